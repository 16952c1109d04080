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

import io.antedb.hypotheses.Hypothesis;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of a proof search.
 *
 * <p>Insufficient input is not an error: a search that cannot prove the
 * target returns {@link Status#NO_RESULT}, so callers can try another
 * strategy or a larger knowledge base.
 */
public final class ProofResult {

    public enum Status {
        /** A proof was constructed. */
        PROVEN,
        /** The target is not implied by the known results. */
        NO_RESULT,
        /** The requested strategy does not produce proofs. */
        UNSUPPORTED
    }

    private static final ProofResult NO_RESULT = new ProofResult(Status.NO_RESULT, null, "no result");

    private final Status status;
    private final Hypothesis proof;
    private final String detail;

    private ProofResult(Status status, Hypothesis proof, String detail) {
        this.status = status;
        this.proof = proof;
        this.detail = detail;
    }

    public static ProofResult proven(Hypothesis proof) {
        Objects.requireNonNull(proof, "proof cannot be null");
        return new ProofResult(Status.PROVEN, proof, proof.proof());
    }

    public static ProofResult noResult() {
        return NO_RESULT;
    }

    public static ProofResult unsupported(String reason) {
        Objects.requireNonNull(reason, "reason cannot be null");
        return new ProofResult(Status.UNSUPPORTED, null, reason);
    }

    static ProofResult of(Optional<Hypothesis> proof) {
        return proof.map(ProofResult::proven).orElse(NO_RESULT);
    }

    public Status status() {
        return status;
    }

    public boolean isProven() {
        return status == Status.PROVEN;
    }

    /**
     * Returns the derived exponent pair, present only when {@link #isProven()}.
     */
    public Optional<Hypothesis> proof() {
        return Optional.ofNullable(proof);
    }

    /**
     * Returns the proof narrative, or why there is no proof.
     */
    public String detail() {
        return detail;
    }

    @Override
    public String toString() {
        return "ProofResult{" + status + ": " + detail + "}";
    }
}
