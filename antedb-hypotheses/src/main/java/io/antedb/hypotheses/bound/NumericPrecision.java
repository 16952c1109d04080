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

import java.math.MathContext;
import java.math.RoundingMode;

/// Decimal precision for evaluating bound functions that are not rational.
///
/// A precision is fixed once, before any bound is evaluated, and passed down
/// read-only so that every evaluation in a run uses the same digits and
/// results stay comparable across runs.
///
/// @param digits the number of significant decimal digits, positive
public record NumericPrecision(int digits) {

    /// The precision used when none is configured.
    public static final NumericPrecision DEFAULT = new NumericPrecision(1000);

    public NumericPrecision {
        if (digits <= 0) {
            throw new IllegalArgumentException("digits must be positive, got " + digits);
        }
    }

    /// Returns the math context for this precision, rounding half-even.
    public MathContext mathContext() {
        return new MathContext(digits, RoundingMode.HALF_EVEN);
    }
}
