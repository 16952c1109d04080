package io.antedb.exppairs;

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
import io.antedb.hypotheses.geometry.RationalPoint;
import org.apache.commons.math3.fraction.BigFraction;

import java.util.Objects;

/// An exponent pair `(k, l)` with exact rational coordinates.
///
/// We use the definition of exponent pair that allows epsilon losses in the
/// bound, as in Graham and Kolesnik, *Van der Corput's Method of Exponential
/// Sums* (1991).
///
/// Equality is exact-value equality on `(k, l)`; this record is the key by
/// which exponent-pair hypotheses are deduplicated.
///
/// @param k first exponent
/// @param l second exponent
public record ExpPair(BigFraction k, BigFraction l) {

    public ExpPair {
        Objects.requireNonNull(k, "k cannot be null");
        Objects.requireNonNull(l, "l cannot be null");
    }

    public static ExpPair of(BigFraction k, BigFraction l) {
        return new ExpPair(k, l);
    }

    /// Convenience factory for `(kNum/kDen, lNum/lDen)`.
    public static ExpPair of(long kNum, long kDen, long lNum, long lDen) {
        return new ExpPair(Fractions.of(kNum, kDen), Fractions.of(lNum, lDen));
    }

    /// Returns this pair as a point of the `(k, l)` plane.
    public RationalPoint toPoint() {
        return new RationalPoint(k, l);
    }

    @Override
    public String toString() {
        return "(" + Fractions.format(k) + ", " + Fractions.format(l) + ")";
    }
}
