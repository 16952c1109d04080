package io.antedb.exppairs.trace;

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

/// Observer interface for monitoring exponent pair searches.
///
/// ## Lifecycle
///
/// ```text
///   findBestProof (by date)
///     └─ for each year ──► onYearConsidered
///          └─ findProof
///               ├─ beta duality ──► onBetaPairsDerived
///               ├─ closure rounds ──► onClosureRound (per round)
///               └─ success ──► onProofFound
/// ```
///
/// ## Thread Safety
///
/// Searches are single-threaded; implementations only need to be thread-safe
/// when shared between concurrent searches. [#NOOP] is inherently safe.
public interface SearchObserver {

    /// No-op observer.
    SearchObserver NOOP = new SearchObserver() {
        @Override
        public void onClosureRound(int round, int pairCount) {
            // No-op
        }

        @Override
        public void onBetaPairsDerived(int pairCount) {
            // No-op
        }

        @Override
        public void onYearConsidered(int year, int hypothesisCount) {
            // No-op
        }

        @Override
        public void onProofFound(Hypothesis proof) {
            // No-op
        }
    };

    /// Called after each closure round.
    ///
    /// @param round the one-based round number
    /// @param pairCount the number of distinct pairs after the round (and pruning)
    void onClosureRound(int round, int pairCount);

    /// Called after the beta-bound duality ran.
    ///
    /// @param pairCount the number of exponent pairs it returned
    void onBetaPairsDerived(int pairCount);

    /// Called when a date-ordered search tries a cutoff year.
    ///
    /// @param year the cutoff year
    /// @param hypothesisCount the number of hypotheses available up to it
    void onYearConsidered(int year, int hypothesisCount);

    /// Called when a proof has been constructed.
    ///
    /// @param proof the derived exponent pair
    void onProofFound(Hypothesis proof);
}
