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

import org.apache.commons.math3.fraction.BigFraction;

/// A real function evaluated at exact points.
///
/// Implementations that can be evaluated exactly ignore the precision; the
/// others evaluate in decimal arithmetic at the given precision and return
/// the exact value of the rounded decimal.
@FunctionalInterface
public interface BoundFunction {

    /// Evaluates the function.
    ///
    /// @param x the argument
    /// @param precision precision for inexact evaluation
    /// @return the value, as an exact fraction
    BigFraction at(BigFraction x, NumericPrecision precision);
}
