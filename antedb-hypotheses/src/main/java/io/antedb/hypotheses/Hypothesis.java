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

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * A citable or provable statement together with its provenance.
 *
 * <h2>Anatomy</h2>
 *
 * <pre>{@code
 * ┌───────────────────────────────────────────────────────┐
 * │                      HYPOTHESIS                       │
 * ├───────────────────────────────────────────────────────┤
 * │ name        "Huxley exponent pair"                    │
 * │ type        EXPONENT_PAIR                             │
 * │ data        (32/205, 269/410)                         │
 * │ proof       "See [Huxley, 2005]"                      │
 * │ reference   [Huxley, 2005]                            │
 * │ dependencies  { }                                     │
 * └───────────────────────────────────────────────────────┘
 * }</pre>
 *
 * <p>Hypotheses are immutable. Equality is identity: two hypotheses holding
 * equal payloads are distinct objects with possibly different provenance, and
 * it is up to the consumer to treat them as duplicates by payload.
 *
 * @see HypothesisSet
 * @see Reference
 */
public final class Hypothesis {

    private final String name;
    private final HypothesisType type;
    private final Object data;
    private final String proof;
    private final Reference reference;
    private final Set<Hypothesis> dependencies;

    private long complexity = -1L;

    /**
     * Creates a hypothesis without dependencies.
     */
    public Hypothesis(String name, HypothesisType type, Object data, String proof, Reference reference) {
        this(name, type, data, proof, reference, Set.of());
    }

    /**
     * Creates a hypothesis.
     *
     * @param name display name
     * @param type type tag, which determines the payload kind
     * @param data the payload
     * @param proof free-text proof narrative
     * @param reference bibliographic provenance
     * @param dependencies the hypotheses this one was derived from
     */
    public Hypothesis(String name, HypothesisType type, Object data, String proof, Reference reference,
                      Collection<Hypothesis> dependencies) {
        this.name = Objects.requireNonNull(name, "name cannot be null");
        this.type = Objects.requireNonNull(type, "type cannot be null");
        this.data = Objects.requireNonNull(data, "data cannot be null");
        this.proof = Objects.requireNonNull(proof, "proof cannot be null");
        this.reference = Objects.requireNonNull(reference, "reference cannot be null");
        Objects.requireNonNull(dependencies, "dependencies cannot be null");
        this.dependencies = Collections.unmodifiableSet(new LinkedHashSet<>(dependencies));
    }

    public String name() {
        return name;
    }

    public HypothesisType type() {
        return type;
    }

    public Object data() {
        return data;
    }

    /**
     * Returns the payload as the expected kind.
     *
     * @param kind the expected payload class
     * @return the payload
     * @throws IllegalArgumentException if the payload is of another kind
     */
    public <T> T data(Class<T> kind) {
        if (!kind.isInstance(data)) {
            throw new IllegalArgumentException("Hypothesis '" + name + "' carries "
                + data.getClass().getSimpleName() + ", not " + kind.getSimpleName());
        }
        return kind.cast(data);
    }

    public String proof() {
        return proof;
    }

    public Reference reference() {
        return reference;
    }

    public Set<Hypothesis> dependencies() {
        return dependencies;
    }

    /**
     * Returns the recursively defined complexity of this hypothesis' proof:
     * 1 for a hypothesis without dependencies, otherwise one more than the
     * sum of the dependencies' complexities.
     *
     * @return the proof complexity, at least 1
     */
    public long proofComplexity() {
        if (complexity < 0) {
            long total = 1;
            for (Hypothesis dependency : dependencies) {
                total += dependency.proofComplexity();
            }
            complexity = total;
        }
        return complexity;
    }

    @Override
    public String toString() {
        return name + " " + reference;
    }
}
