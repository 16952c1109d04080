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
import io.antedb.hypotheses.Reference;
import org.apache.commons.math3.fraction.BigFraction;

/// The classical van der Corput transforms.
///
/// ```text
///   A(k, l) = ( k / (2k + 2),  1/2 + l / (2k + 2) )
///   B(k, l) = ( l - 1/2,       k + 1/2 )
/// ```
///
/// B is an involution: `B(B(p)) = p` for every pair `p`. The beta-bound
/// duality looks B up by [#B_KEYWORD] to mirror pairs across `α = 1/2`.
public final class VanDerCorput {

    /// Name of the A transform hypothesis.
    public static final String A_KEYWORD = "van der Corput A transform";

    /// Name of the B transform hypothesis.
    public static final String B_KEYWORD = "van der Corput B transform";

    public static final ExpPairTransform A = new ExpPairTransform(A_KEYWORD, VanDerCorput::a);

    public static final ExpPairTransform B = new ExpPairTransform(B_KEYWORD, VanDerCorput::b);

    public static final Hypothesis A_TRANSFORM = ExponentPairs.transform(A, Reference.literature("van der Corput", 1922));

    public static final Hypothesis B_TRANSFORM = ExponentPairs.transform(B, Reference.literature("van der Corput", 1920));

    private VanDerCorput() {
        // Utility class
    }

    static ExpPair a(ExpPair p) {
        BigFraction denominator = p.k().multiply(2).add(2);
        return ExpPair.of(p.k().divide(denominator), BigFraction.ONE_HALF.add(p.l().divide(denominator)));
    }

    static ExpPair b(ExpPair p) {
        return ExpPair.of(p.l().subtract(BigFraction.ONE_HALF), p.k().add(BigFraction.ONE_HALF));
    }
}
