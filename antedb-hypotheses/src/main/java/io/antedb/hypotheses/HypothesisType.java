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

/// Type tags of the hypotheses held in a [HypothesisSet].
///
/// The payload carried by a [Hypothesis] is determined by its type:
///
/// | Type | Payload |
/// |------|---------|
/// | EXPONENT_PAIR | an exponent pair value |
/// | EXPONENT_PAIR_TRANSFORM | a transform mapping exponent pairs to exponent pairs |
/// | BETA_BOUND | a [io.antedb.hypotheses.bound.BetaBound] piece |
public enum HypothesisType {

    EXPONENT_PAIR("Exponent pair"),
    EXPONENT_PAIR_TRANSFORM("Exponent pair transform"),
    BETA_BOUND("Upper bound on beta");

    private final String displayName;

    HypothesisType(String displayName) {
        this.displayName = displayName;
    }

    /// Returns the human-readable name of this type.
    public String displayName() {
        return displayName;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
