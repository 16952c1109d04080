package io.antedb.hypotheses.geometry;

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
import org.apache.commons.math3.geometry.euclidean.twod.Vector2D;

import java.util.Objects;

/// An exact point in the plane.
///
/// @param x the abscissa
/// @param y the ordinate
public record RationalPoint(BigFraction x, BigFraction y) {

    public RationalPoint {
        Objects.requireNonNull(x, "x cannot be null");
        Objects.requireNonNull(y, "y cannot be null");
    }

    /// Returns the nearest floating-point vector, for approximate geometry.
    public Vector2D toVector2D() {
        return new Vector2D(x.doubleValue(), y.doubleValue());
    }

    @Override
    public String toString() {
        return "(" + Fractions.format(x) + ", " + Fractions.format(y) + ")";
    }
}
