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
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;

import static io.antedb.hypotheses.Fractions.of;
import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
class BoundPieceTest {

    @Test
    void openDomainRejectsEndpointsUnlessExtended() {
        BoundPiece piece = new BoundPiece(Interval.open(of(0), of(1, 2)),
            RationalFunction.linear(of(1, 3), of(1, 6)));

        assertThrows(IllegalArgumentException.class, () -> piece.at(of(0), false, NumericPrecision.DEFAULT));
        assertEquals(of(1, 6), piece.at(of(0), true, NumericPrecision.DEFAULT));
        assertEquals(of(1, 3), piece.at(of(1, 2), true, NumericPrecision.DEFAULT));
        assertEquals(of(7, 30), piece.at(of(1, 5), false, NumericPrecision.DEFAULT));
    }

    @Test
    void intervalEndpointsFollowFlags() {
        Interval halfOpen = new Interval(of(0), of(1), true, false);
        assertTrue(halfOpen.contains(of(0)));
        assertFalse(halfOpen.contains(of(1)));
        assertThrows(IllegalArgumentException.class, () -> Interval.closed(of(1), of(0)));
        assertEquals("[0, 1)", halfOpen.toString());
    }

    @Test
    void rationalFunctionIsExact() {
        // (1 + x) / (2 - x)
        RationalFunction f = new RationalFunction(new BigFraction[]{of(1), of(1)},
            new BigFraction[]{of(2), of(-1)});
        assertEquals(of(4, 5), f.at(of(1, 3), NumericPrecision.DEFAULT));
        assertThrows(ArithmeticException.class, () -> f.at(of(2), NumericPrecision.DEFAULT));
        assertEquals(RationalFunction.polynomial(of(1, 6), of(1, 3)), RationalFunction.linear(of(1, 3), of(1, 6)));
    }

    @Test
    void decimalFunctionIsExactWhenDecimalIsExact() {
        DecimalFunction sqrt = new DecimalFunction("sqrt(x)", (x, mc) -> x.sqrt(mc));
        assertEquals(of(1, 2), sqrt.at(of(1, 4), new NumericPrecision(50)));
    }

    @Test
    void decimalFunctionIsDeterministicAtPrecision() {
        DecimalFunction sqrt = new DecimalFunction("sqrt(x)", (x, mc) -> x.sqrt(mc));
        NumericPrecision precision = new NumericPrecision(30);

        BigFraction first = sqrt.at(of(2), precision);
        BigFraction second = sqrt.at(of(2), precision);
        assertEquals(first, second);

        BigFraction error = first.multiply(first).subtract(of(2)).abs();
        BigFraction limit = new BigFraction(BigInteger.ONE, BigInteger.TEN.pow(28));
        assertTrue(error.compareTo(limit) < 0, "error " + error.doubleValue());
    }

    @Test
    void decimalFunctionWithUndefinedValueFails() {
        DecimalFunction undefined = new DecimalFunction("undefined", (x, mc) -> null);
        assertThrows(ArithmeticException.class, () -> undefined.at(of(1), NumericPrecision.DEFAULT));
    }

    @Test
    void precisionMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> new NumericPrecision(0));
        assertEquals(1000, NumericPrecision.DEFAULT.mathContext().getPrecision());
    }

    @Test
    void linearBetaBoundCoversClosedInterval() {
        BetaBound bound = BetaBound.linear(of(0), of(1, 2), of(1, 3), of(1, 6));
        assertTrue(bound.bound().domain().includeLeft());
        assertTrue(bound.bound().domain().includeRight());
        assertEquals(Fractions.exact(new BigDecimal("0.25")), bound.bound().at(of(1, 4), false, NumericPrecision.DEFAULT));
    }
}
