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

import io.antedb.hypotheses.Fractions;
import io.antedb.hypotheses.Hypothesis;
import io.antedb.hypotheses.HypothesisType;
import io.antedb.hypotheses.Reference;
import org.apache.commons.math3.fraction.BigFraction;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Constructors and accessors for exponent-pair hypotheses.
///
/// ## Provenance
///
/// | Constructor | Name | Reference |
/// |-------------|------|-----------|
/// | [#literature] | `<author> exponent pair` | the citation |
/// | [#derived] | `Derived exponent pair (k, l)` | derived, dated by the latest dependency |
/// | [#TRIVIAL] | `Trivial exponent pair (0, 1)` | trivial |
/// | [#CONJECTURE] | `Exponent pair conjecture` | conjectured |
public final class ExponentPairs {

    /// The trivial exponent pair (0, 1), from the triangle inequality.
    public static final Hypothesis TRIVIAL = new Hypothesis("Trivial exponent pair (0, 1)",
        HypothesisType.EXPONENT_PAIR, ExpPair.of(BigFraction.ZERO, BigFraction.ONE),
        "Triangle inequality", Reference.trivial());

    /// The exponent pair conjecture: (0, 0) is an exponent pair.
    public static final Hypothesis CONJECTURE = new Hypothesis("Exponent pair conjecture",
        HypothesisType.EXPONENT_PAIR, ExpPair.of(BigFraction.ZERO, BigFraction.ZERO),
        "Conjecture", Reference.conjectured());

    private ExponentPairs() {
        // Utility class
    }

    /// An exponent pair cited from the literature.
    public static Hypothesis literature(BigFraction k, BigFraction l, Reference reference) {
        Objects.requireNonNull(reference, "reference cannot be null");
        return new Hypothesis(reference.author() + " exponent pair", HypothesisType.EXPONENT_PAIR,
            ExpPair.of(k, l), "See " + reference, reference);
    }

    /// An exponent pair cited from the literature, `(kNum/kDen, lNum/lDen)`.
    public static Hypothesis literature(long kNum, long kDen, long lNum, long lDen, Reference reference) {
        return literature(Fractions.of(kNum, kDen), Fractions.of(lNum, lDen), reference);
    }

    /// An exponent pair derived from other hypotheses. Its reference is dated
    /// by the latest dated dependency.
    ///
    /// @param pair the derived pair
    /// @param proof the proof narrative
    /// @param dependencies what the derivation depends on
    /// @return the derived hypothesis
    public static Hypothesis derived(ExpPair pair, String proof, Collection<Hypothesis> dependencies) {
        Objects.requireNonNull(pair, "pair cannot be null");
        Objects.requireNonNull(dependencies, "dependencies cannot be null");
        List<Reference> references = new ArrayList<>(dependencies.size());
        for (Hypothesis dependency : dependencies) {
            references.add(dependency.reference());
        }
        return new Hypothesis("Derived exponent pair " + pair, HypothesisType.EXPONENT_PAIR, pair, proof,
            Reference.derived(Reference.maxYear(references)), dependencies);
    }

    /// Registers a transform as a hypothesis.
    public static Hypothesis transform(ExpPairTransform transform, Reference reference) {
        Objects.requireNonNull(transform, "transform cannot be null");
        Objects.requireNonNull(reference, "reference cannot be null");
        return new Hypothesis(transform.name(), HypothesisType.EXPONENT_PAIR_TRANSFORM, transform,
            "See " + reference, reference);
    }

    /// Returns the pair carried by an exponent-pair hypothesis.
    ///
    /// @throws IllegalArgumentException if the hypothesis is not an exponent pair
    public static ExpPair pairOf(Hypothesis hypothesis) {
        Objects.requireNonNull(hypothesis, "hypothesis cannot be null");
        if (hypothesis.type() != HypothesisType.EXPONENT_PAIR) {
            throw new IllegalArgumentException("'" + hypothesis.name() + "' is a "
                + hypothesis.type() + ", not an exponent pair");
        }
        return hypothesis.data(ExpPair.class);
    }

    /// Returns the transform carried by a transform hypothesis.
    ///
    /// @throws IllegalArgumentException if the hypothesis is not a transform
    public static ExpPairTransform transformOf(Hypothesis hypothesis) {
        Objects.requireNonNull(hypothesis, "hypothesis cannot be null");
        if (hypothesis.type() != HypothesisType.EXPONENT_PAIR_TRANSFORM) {
            throw new IllegalArgumentException("'" + hypothesis.name() + "' is a "
                + hypothesis.type() + ", not an exponent pair transform");
        }
        return hypothesis.data(ExpPairTransform.class);
    }

    /// Indexes exponent-pair hypotheses by pair; the first of equal pairs wins.
    public static Map<ExpPair, Hypothesis> byPair(Collection<Hypothesis> hypotheses) {
        Map<ExpPair, Hypothesis> index = new LinkedHashMap<>();
        for (Hypothesis hypothesis : hypotheses) {
            index.putIfAbsent(pairOf(hypothesis), hypothesis);
        }
        return index;
    }
}
