package io.antedb.hypotheses.bound;

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

import io.antedb.hypotheses.Fractions;
import org.apache.commons.math3.fraction.BigFraction;

import java.util.Objects;

/// An interval of the real line with exact endpoints.
///
/// @param x0 left endpoint
/// @param x1 right endpoint, not less than `x0`
/// @param includeLeft whether `x0` belongs to the interval
/// @param includeRight whether `x1` belongs to the interval
public record Interval(BigFraction x0, BigFraction x1, boolean includeLeft, boolean includeRight) {

    public Interval {
        Objects.requireNonNull(x0, "x0 cannot be null");
        Objects.requireNonNull(x1, "x1 cannot be null");
        if (x0.compareTo(x1) > 0) {
            throw new IllegalArgumentException("empty interval: " + Fractions.format(x0)
                + " > " + Fractions.format(x1));
        }
    }

    /// Creates the closed interval `[x0, x1]`.
    public static Interval closed(BigFraction x0, BigFraction x1) {
        return new Interval(x0, x1, true, true);
    }

    /// Creates the open interval `(x0, x1)`.
    public static Interval open(BigFraction x0, BigFraction x1) {
        return new Interval(x0, x1, false, false);
    }

    public boolean contains(BigFraction x) {
        int left = x.compareTo(x0);
        int right = x.compareTo(x1);
        return (left > 0 || (left == 0 && includeLeft))
            && (right < 0 || (right == 0 && includeRight));
    }

    @Override
    public String toString() {
        return (includeLeft ? "[" : "(") + Fractions.format(x0) + ", " + Fractions.format(x1)
            + (includeRight ? "]" : ")");
    }
}
