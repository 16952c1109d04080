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
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class FractionsTest {

    @Test
    void formatsAndParsesLowestTerms() {
        assertEquals("1/3", Fractions.format(Fractions.of(2, 6)));
        assertEquals("-2", Fractions.format(Fractions.of(-4, 2)));
        assertEquals(Fractions.of(13, 84), Fractions.parse(" 13 / 84 "));
        assertEquals(Fractions.of(7), Fractions.parse("7"));
    }

    @Test
    void rejectsNonFractions() {
        assertThrows(IllegalArgumentException.class, () -> Fractions.parse("0.5"));
        assertThrows(IllegalArgumentException.class, () -> Fractions.parse("1/0"));
    }

    @Test
    void convertsDecimalsExactly() {
        assertEquals(Fractions.of(1, 8), Fractions.exact(new BigDecimal("0.125")));
        assertEquals(Fractions.of(1200), Fractions.exact(new BigDecimal("1.2E+3")));
        assertEquals(BigFraction.ZERO, Fractions.exact(BigDecimal.ZERO));
    }
}
