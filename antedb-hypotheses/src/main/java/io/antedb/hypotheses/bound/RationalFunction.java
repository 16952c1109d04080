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

import java.util.Arrays;
import java.util.Objects;

/**
 * A quotient of two polynomials with rational coefficients, evaluated exactly.
 *
 * <p>Coefficients are given lowest degree first, so {@code [c, m]} is the
 * polynomial {@code c + m x}.
 */
public final class RationalFunction implements BoundFunction {

    private static final BigFraction[] ONE = {BigFraction.ONE};

    private final BigFraction[] numerator;
    private final BigFraction[] denominator;

    public RationalFunction(BigFraction[] numerator, BigFraction[] denominator) {
        Objects.requireNonNull(numerator, "numerator cannot be null");
        Objects.requireNonNull(denominator, "denominator cannot be null");
        if (numerator.length == 0 || denominator.length == 0) {
            throw new IllegalArgumentException("polynomials need at least one coefficient");
        }
        this.numerator = numerator.clone();
        this.denominator = denominator.clone();
    }

    /** The polynomial with the given coefficients, lowest degree first. */
    public static RationalFunction polynomial(BigFraction... coefficients) {
        return new RationalFunction(coefficients, ONE);
    }

    /** The line {@code m x + c}. */
    public static RationalFunction linear(BigFraction m, BigFraction c) {
        return polynomial(c, m);
    }

    public static RationalFunction constant(BigFraction c) {
        return polynomial(c);
    }

    @Override
    public BigFraction at(BigFraction x, NumericPrecision precision) {
        BigFraction den = evaluate(denominator, x);
        if (Fractions.signum(den) == 0) {
            throw new ArithmeticException("pole at x = " + Fractions.format(x));
        }
        return evaluate(numerator, x).divide(den);
    }

    private static BigFraction evaluate(BigFraction[] coefficients, BigFraction x) {
        // Horner
        BigFraction value = BigFraction.ZERO;
        for (int i = coefficients.length - 1; i >= 0; i--) {
            value = value.multiply(x).add(coefficients[i]);
        }
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RationalFunction)) return false;
        RationalFunction that = (RationalFunction) o;
        return Arrays.equals(numerator, that.numerator) && Arrays.equals(denominator, that.denominator);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(numerator) + Arrays.hashCode(denominator);
    }

    @Override
    public String toString() {
        return "(" + format(numerator) + ") / (" + format(denominator) + ")";
    }

    private static String format(BigFraction[] coefficients) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < coefficients.length; i++) {
            if (i > 0) sb.append(" + ");
            sb.append(Fractions.format(coefficients[i]));
            if (i == 1) sb.append(" x");
            if (i > 1) sb.append(" x^").append(i);
        }
        return sb.toString();
    }
}
