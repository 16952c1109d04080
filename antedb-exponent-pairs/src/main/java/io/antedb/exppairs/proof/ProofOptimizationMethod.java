package io.antedb.exppairs.proof;

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

/// Strategies for choosing among the proofs of an exponent pair.
///
/// | Method | Proof returned |
/// |--------|----------------|
/// | DATE | the historically earliest: only results up to the first sufficient year are used |
/// | COMPLEXITY | the cheapest containing triangle of hull vertices |
/// | NONE | not supported |
public enum ProofOptimizationMethod {

    /// Minimize the year of the latest dependency.
    DATE,

    /// Minimize the total proof complexity of the cited pairs.
    COMPLEXITY,

    /// No optimization. Has no determinate output and is reported as unsupported.
    NONE
}
