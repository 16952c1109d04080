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

import java.util.Objects;

/// Payload of a [io.antedb.hypotheses.HypothesisType#BETA_BOUND] hypothesis:
/// an upper bound `β(α) ≤ f(α)` holding for `α` in the piece's domain.
///
/// @param bound the bound piece
public record BetaBound(BoundPiece bound) {

    public BetaBound {
        Objects.requireNonNull(bound, "bound cannot be null");
    }

    /// The bound `β(α) ≤ m α + c` on the closed interval `[a0, a1]`.
    public static BetaBound linear(BigFraction a0, BigFraction a1, BigFraction m, BigFraction c) {
        return new BetaBound(new BoundPiece(Interval.closed(a0, a1), RationalFunction.linear(m, c)));
    }

    @Override
    public String toString() {
        return "beta(alpha) <= " + bound;
    }
}
