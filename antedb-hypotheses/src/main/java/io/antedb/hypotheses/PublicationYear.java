package io.antedb.hypotheses;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import java.util.Objects;
import java.util.OptionalInt;

/// The publication year of a result, or an explicit unknown year.
///
/// ## Purpose
///
/// Results in the database are dated by the year they were published. Some
/// results have no meaningful date: the trivial bounds that follow from the
/// triangle inequality, conjectures, and results derived only from undated
/// inputs. Those carry [#UNKNOWN].
///
/// ## Cutoff semantics
///
/// When filtering by a cutoff year, an unknown year is always admitted:
///
/// | Year | `isAtOrBefore(1990)` |
/// |------|----------------------|
/// | 1985 | true |
/// | 1990 | true |
/// | 2003 | false |
/// | UNKNOWN | true |
///
/// @see Reference#maxYear(java.util.Collection)
public final class PublicationYear implements Comparable<PublicationYear> {

    /// The unknown year. Sorts before every known year.
    public static final PublicationYear UNKNOWN = new PublicationYear(false, 0);

    private final boolean known;
    private final int year;

    private PublicationYear(boolean known, int year) {
        this.known = known;
        this.year = year;
    }

    /// Creates a known year.
    ///
    /// @param year the calendar year
    /// @return the publication year
    public static PublicationYear of(int year) {
        return new PublicationYear(true, year);
    }

    /// Returns whether this year is known.
    public boolean isKnown() {
        return known;
    }

    /// Returns the calendar year.
    ///
    /// @return the year
    /// @throws IllegalStateException if the year is unknown
    public int value() {
        if (!known) {
            throw new IllegalStateException("publication year is unknown");
        }
        return year;
    }

    /// Returns the calendar year if known.
    public OptionalInt asOptional() {
        return known ? OptionalInt.of(year) : OptionalInt.empty();
    }

    /// Returns whether a result of this year is available at the given cutoff.
    /// Unknown years are always available.
    ///
    /// @param cutoff the last admitted year
    /// @return true if unknown or not later than the cutoff
    public boolean isAtOrBefore(int cutoff) {
        return !known || year <= cutoff;
    }

    /// Returns the later of two years, where any known year beats [#UNKNOWN].
    public static PublicationYear later(PublicationYear a, PublicationYear b) {
        Objects.requireNonNull(a, "a cannot be null");
        Objects.requireNonNull(b, "b cannot be null");
        return a.compareTo(b) >= 0 ? a : b;
    }

    @Override
    public int compareTo(PublicationYear other) {
        if (known != other.known) {
            return known ? 1 : -1;
        }
        return Integer.compare(year, other.year);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PublicationYear)) return false;
        PublicationYear that = (PublicationYear) o;
        return known == that.known && year == that.year;
    }

    @Override
    public int hashCode() {
        return known ? Integer.hashCode(year) : -1;
    }

    @Override
    public String toString() {
        return known ? Integer.toString(year) : "Unknown date";
    }
}
