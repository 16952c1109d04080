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

import java.util.List;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * A named transform mapping exponent pairs to exponent pairs, such as the
 * van der Corput A and B processes.
 *
 * <p>The mapping must be pure and deterministic: equal input pairs always map
 * to equal output pairs. It is the payload of an
 * {@link HypothesisType#EXPONENT_PAIR_TRANSFORM} hypothesis, and any such
 * hypothesis in a set takes part in closure computations.
 *
 * @see VanDerCorput
 */
public final class ExpPairTransform {

    private final String name;
    private final UnaryOperator<ExpPair> mapping;

    /**
     * @param name the unique label of this transform
     * @param mapping the pair mapping
     */
    public ExpPairTransform(String name, UnaryOperator<ExpPair> mapping) {
        this.name = Objects.requireNonNull(name, "name cannot be null");
        this.mapping = Objects.requireNonNull(mapping, "mapping cannot be null");
    }

    public String name() {
        return name;
    }

    /**
     * Maps a bare pair.
     */
    public ExpPair map(ExpPair pair) {
        return Objects.requireNonNull(mapping.apply(pair), () -> name + " mapped " + pair + " to null");
    }

    /**
     * Applies this transform to an exponent-pair hypothesis.
     *
     * @param self the hypothesis registering this transform
     * @param pair an exponent-pair hypothesis
     * @return the derived exponent-pair hypothesis, depending on {@code self}
     *         and {@code pair}
     */
    public Hypothesis apply(Hypothesis self, Hypothesis pair) {
        Objects.requireNonNull(self, "self cannot be null");
        if (self.data() != this) {
            throw new IllegalArgumentException("Hypothesis '" + self.name() + "' does not register " + name);
        }
        ExpPair source = ExponentPairs.pairOf(pair);
        ExpPair target = map(source);
        return ExponentPairs.derived(target,
            "Follows from applying " + name + " to the exponent pair " + source,
            List.of(self, pair));
    }

    @Override
    public String toString() {
        return name;
    }
}
