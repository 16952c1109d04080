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

import java.util.Collection;
import java.util.Objects;

/**
 * Bibliographic provenance of a {@link Hypothesis}.
 *
 * <p>A reference is either a citation of the literature (an author and a
 * publication year) or one of the synthetic categories:
 * <ul>
 *   <li>{@link Kind#TRIVIAL} - follows from first principles, undated</li>
 *   <li>{@link Kind#CONJECTURED} - an open conjecture, undated</li>
 *   <li>{@link Kind#DERIVED} - derived by this database from other results,
 *       dated by the latest of its inputs</li>
 * </ul>
 *
 * @see PublicationYear
 */
public final class Reference {

    /** The category of a reference. */
    public enum Kind {
        LITERATURE,
        TRIVIAL,
        CONJECTURED,
        DERIVED
    }

    private static final Reference TRIVIAL = new Reference(Kind.TRIVIAL, "Trivial", PublicationYear.UNKNOWN);
    private static final Reference CONJECTURED = new Reference(Kind.CONJECTURED, "Conjecture", PublicationYear.UNKNOWN);

    private final Kind kind;
    private final String author;
    private final PublicationYear year;

    private Reference(Kind kind, String author, PublicationYear year) {
        this.kind = kind;
        this.author = author;
        this.year = year;
    }

    /**
     * Creates a literature citation.
     *
     * @param author the author(s), as displayed
     * @param year the publication year
     * @return the reference
     */
    public static Reference literature(String author, int year) {
        Objects.requireNonNull(author, "author cannot be null");
        if (author.isBlank()) {
            throw new IllegalArgumentException("author cannot be blank");
        }
        return new Reference(Kind.LITERATURE, author, PublicationYear.of(year));
    }

    public static Reference trivial() {
        return TRIVIAL;
    }

    public static Reference conjectured() {
        return CONJECTURED;
    }

    /**
     * Creates the reference of a derived result.
     *
     * @param year the latest year among the inputs of the derivation
     * @return the reference
     */
    public static Reference derived(PublicationYear year) {
        Objects.requireNonNull(year, "year cannot be null");
        return new Reference(Kind.DERIVED, "Derived", year);
    }

    /**
     * Returns the latest known year of the given references, or
     * {@link PublicationYear#UNKNOWN} if none of them is dated.
     *
     * @param references the references to combine
     * @return the latest year
     */
    public static PublicationYear maxYear(Collection<Reference> references) {
        Objects.requireNonNull(references, "references cannot be null");
        PublicationYear latest = PublicationYear.UNKNOWN;
        for (Reference reference : references) {
            latest = PublicationYear.later(latest, reference.year());
        }
        return latest;
    }

    public Kind kind() {
        return kind;
    }

    public String author() {
        return author;
    }

    public PublicationYear year() {
        return year;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Reference)) return false;
        Reference that = (Reference) o;
        return kind == that.kind && author.equals(that.author) && year.equals(that.year);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, author, year);
    }

    @Override
    public String toString() {
        return "[" + author + ", " + year + "]";
    }
}
