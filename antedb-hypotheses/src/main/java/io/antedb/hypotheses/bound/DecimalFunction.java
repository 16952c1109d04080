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

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.Objects;
import java.util.function.BiFunction;

/// A function computed in decimal arithmetic, such as one involving roots.
///
/// The argument is converted to a decimal at the configured precision, the
/// computation runs under the same [MathContext], and the rounded decimal
/// result is converted back to a fraction exactly. Two evaluations under the
/// same [NumericPrecision] therefore always agree.
///
/// ```java
/// // sqrt(x) / 2
/// BoundFunction f = new DecimalFunction("sqrt(x)/2",
///     (x, mc) -> x.sqrt(mc).divide(BigDecimal.valueOf(2), mc));
/// ```
public final class DecimalFunction implements BoundFunction {

    private final String label;
    private final BiFunction<BigDecimal, MathContext, BigDecimal> body;

    /// @param label display label of the function
    /// @param body the computation; receives the argument and the math context
    public DecimalFunction(String label, BiFunction<BigDecimal, MathContext, BigDecimal> body) {
        this.label = Objects.requireNonNull(label, "label cannot be null");
        this.body = Objects.requireNonNull(body, "body cannot be null");
    }

    @Override
    public BigFraction at(BigFraction x, NumericPrecision precision) {
        Objects.requireNonNull(precision, "precision cannot be null");
        MathContext mc = precision.mathContext();
        BigDecimal argument = new BigDecimal(x.getNumerator()).divide(new BigDecimal(x.getDenominator()), mc);
        BigDecimal value = body.apply(argument, mc);
        if (value == null) {
            throw new ArithmeticException(label + " is undefined at x = " + Fractions.format(x));
        }
        return Fractions.exact(value.round(mc));
    }

    @Override
    public String toString() {
        return label;
    }
}
