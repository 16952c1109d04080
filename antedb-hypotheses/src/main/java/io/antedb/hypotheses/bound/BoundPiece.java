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

/// One piece of a piecewise bound: a function together with the interval on
/// which the bound holds.
///
/// Evaluation outside the domain is only allowed with `extendDomain`, in
/// which case the function formula is extrapolated. This is how the value at
/// an open endpoint is obtained.
///
/// @param domain where the bound holds
/// @param function the bounding function
public record BoundPiece(Interval domain, BoundFunction function) {

    public BoundPiece {
        Objects.requireNonNull(domain, "domain cannot be null");
        Objects.requireNonNull(function, "function cannot be null");
    }

    /// Evaluates the bound.
    ///
    /// @param x the argument
    /// @param extendDomain whether to extrapolate outside the domain
    /// @param precision precision for inexact functions
    /// @return the bound at `x`
    /// @throws IllegalArgumentException if `x` is outside the domain and
    ///         `extendDomain` is false
    public BigFraction at(BigFraction x, boolean extendDomain, NumericPrecision precision) {
        Objects.requireNonNull(x, "x cannot be null");
        if (!extendDomain && !domain.contains(x)) {
            throw new IllegalArgumentException("x = " + Fractions.format(x) + " is outside " + domain);
        }
        return function.at(x, precision);
    }

    @Override
    public String toString() {
        return function + " on " + domain;
    }
}
