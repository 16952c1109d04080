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

import org.apache.commons.math3.fraction.BigFraction;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Objects;

/// Helpers for the exact rationals used throughout the database.
///
/// All keys and comparisons use [BigFraction], which is kept in lowest terms,
/// so `equals` is exact-value equality.
public final class Fractions {

    private Fractions() {
        // Utility class
    }

    /// Creates the fraction `numerator / denominator`.
    public static BigFraction of(long numerator, long denominator) {
        return new BigFraction(BigInteger.valueOf(numerator), BigInteger.valueOf(denominator));
    }

    /// Creates the integer `value` as a fraction.
    public static BigFraction of(long value) {
        return new BigFraction(BigInteger.valueOf(value));
    }

    /// Converts a decimal exactly, without rounding.
    public static BigFraction exact(BigDecimal value) {
        Objects.requireNonNull(value, "value cannot be null");
        BigInteger unscaled = value.unscaledValue();
        int scale = value.scale();
        if (scale >= 0) {
            return new BigFraction(unscaled, BigInteger.TEN.pow(scale));
        }
        return new BigFraction(unscaled.multiply(BigInteger.TEN.pow(-scale)));
    }

    /// Formats as `p/q`, or `p` for integers.
    public static String format(BigFraction value) {
        if (BigInteger.ONE.equals(value.getDenominator())) {
            return value.getNumerator().toString();
        }
        return value.getNumerator() + "/" + value.getDenominator();
    }

    /// Parses `p/q` or `p`, as written by [#format(BigFraction)].
    ///
    /// @throws IllegalArgumentException if the text is not a fraction
    public static BigFraction parse(String text) {
        Objects.requireNonNull(text, "text cannot be null");
        String trimmed = text.trim();
        try {
            int slash = trimmed.indexOf('/');
            if (slash < 0) {
                return new BigFraction(new BigInteger(trimmed));
            }
            BigInteger numerator = new BigInteger(trimmed.substring(0, slash).trim());
            BigInteger denominator = new BigInteger(trimmed.substring(slash + 1).trim());
            if (denominator.signum() == 0) {
                throw new IllegalArgumentException("zero denominator in '" + text + "'");
            }
            return new BigFraction(numerator, denominator);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("not a fraction: '" + text + "'", e);
        }
    }

    public static int signum(BigFraction value) {
        return value.getNumerator().signum();
    }
}
