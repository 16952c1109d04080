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

import io.antedb.hypotheses.Hypothesis;
import io.antedb.hypotheses.HypothesisType;
import io.antedb.hypotheses.Reference;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
class VanDerCorputTest {

    @ParameterizedTest
    @CsvSource({
        "0, 1, 1, 1",
        "1, 2, 1, 2",
        "1, 6, 2, 3",
        "13, 84, 55, 84",
        "1, 14, 11, 14"
    })
    void bIsAnInvolution(long kNum, long kDen, long lNum, long lDen) {
        ExpPair pair = ExpPair.of(kNum, kDen, lNum, lDen);
        assertEquals(pair, VanDerCorput.B.map(VanDerCorput.B.map(pair)));
    }

    @Test
    void aMapsKnownPairs() {
        assertEquals(ExpPair.of(0, 1, 1, 1), VanDerCorput.A.map(ExpPair.of(0, 1, 1, 1)));
        assertEquals(ExpPair.of(1, 6, 2, 3), VanDerCorput.A.map(ExpPair.of(1, 2, 1, 2)));
        assertEquals(ExpPair.of(1, 14, 11, 14), VanDerCorput.A.map(ExpPair.of(1, 6, 2, 3)));
    }

    @Test
    void bFixesTheFirstDerivedPair() {
        assertEquals(ExpPair.of(1, 6, 2, 3), VanDerCorput.B.map(ExpPair.of(1, 6, 2, 3)));
        assertEquals(ExpPair.of(1, 2, 1, 2), VanDerCorput.B.map(ExpPair.of(0, 1, 1, 1)));
    }

    @Test
    void applyingATransformRecordsBothDependencies() {
        Hypothesis derived = VanDerCorput.B.apply(VanDerCorput.B_TRANSFORM, ExponentPairs.TRIVIAL);

        assertEquals(HypothesisType.EXPONENT_PAIR, derived.type());
        assertEquals(ExpPair.of(1, 2, 1, 2), ExponentPairs.pairOf(derived));
        assertEquals("Derived exponent pair (1/2, 1/2)", derived.name());
        assertThat(derived.dependencies()).containsExactly(VanDerCorput.B_TRANSFORM, ExponentPairs.TRIVIAL);
        assertEquals(1920, derived.reference().year().value());
        assertEquals(3, derived.proofComplexity());
        assertThat(derived.proof()).contains(VanDerCorput.B_KEYWORD).contains("(0, 1)");
    }

    @Test
    void applyRequiresTheRegisteringHypothesis() {
        assertThrows(IllegalArgumentException.class,
            () -> VanDerCorput.A.apply(VanDerCorput.B_TRANSFORM, ExponentPairs.TRIVIAL));
        assertThrows(IllegalArgumentException.class,
            () -> VanDerCorput.A.apply(VanDerCorput.A_TRANSFORM, VanDerCorput.B_TRANSFORM));
    }

    @Test
    void payloadAccessorsCheckTheType() {
        assertSame(VanDerCorput.A, ExponentPairs.transformOf(VanDerCorput.A_TRANSFORM));
        assertThrows(IllegalArgumentException.class, () -> ExponentPairs.pairOf(VanDerCorput.A_TRANSFORM));
        assertThrows(IllegalArgumentException.class, () -> ExponentPairs.transformOf(ExponentPairs.TRIVIAL));
    }

    @Test
    void literaturePairsAreNamedAfterTheirAuthor() {
        Hypothesis huxley = ExponentPairs.literature(32, 205, 269, 410,
            Reference.literature("Huxley", 2005));
        assertEquals("Huxley exponent pair", huxley.name());
        assertEquals("See [Huxley, 2005]", huxley.proof());
        assertEquals(1, huxley.proofComplexity());
    }
}
