package io.antedb.exppairs.derive;

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

import io.antedb.exppairs.ExpPair;
import io.antedb.exppairs.ExpPairTransform;
import io.antedb.exppairs.ExponentPairs;
import io.antedb.exppairs.config.ExpPairSearchConfig;
import io.antedb.exppairs.trace.SearchObserver;
import io.antedb.hypotheses.Hypothesis;
import io.antedb.hypotheses.HypothesisSet;
import io.antedb.hypotheses.HypothesisType;
import io.antedb.hypotheses.geometry.ConvexHulls;
import io.antedb.hypotheses.geometry.RationalPoint;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Expands the exponent pairs of a hypothesis set by repeatedly applying every
 * registered transform.
 *
 * <h2>Algorithm</h2>
 *
 * <pre>{@code
 * pairs := known exponent pairs, keyed by (k, l)
 * repeat searchDepth times:
 *   for each transform T, in set order:
 *     for each key in a snapshot of the current keys:
 *       insert T(pairs[key]) unless its key is present
 *   if prune and |pairs| >= 3:
 *     pairs := hull vertices of pairs
 * }</pre>
 *
 * <p>The snapshot is taken per transform, so a transform sees the pairs that
 * earlier transforms produced in the same round. Iteration follows insertion
 * order throughout, which makes the result reproducible.
 *
 * <h2>Pruning</h2>
 *
 * <p>Pruning assumes that a pair strictly inside the hull can never yield a
 * hull vertex under further transforms. This holds for the van der Corput
 * transforms, which map convex sets of exponent pairs to convex sets, but it
 * is an assumption about the registered family, not a proven invariant: a
 * future transform may break it, in which case pruning must be disabled.
 */
public final class ExpPairClosure {

    private static final Logger logger = LogManager.getLogger(ExpPairClosure.class);

    private final double hullTolerance;
    private final SearchObserver observer;

    public ExpPairClosure() {
        this(ConvexHulls.DEFAULT_TOLERANCE, SearchObserver.NOOP);
    }

    /**
     * @param hullTolerance tolerance of the hull used for pruning
     * @param observer receives a callback per round
     */
    public ExpPairClosure(double hullTolerance, SearchObserver observer) {
        this.hullTolerance = hullTolerance;
        this.observer = Objects.requireNonNull(observer, "observer cannot be null");
    }

    /**
     * Computes the closure with the default depth and pruning.
     */
    public List<Hypothesis> compute(HypothesisSet hypotheses) {
        return compute(hypotheses, ExpPairSearchConfig.DEFAULT_SEARCH_DEPTH, ExpPairSearchConfig.DEFAULT_PRUNE);
    }

    /**
     * Computes the closure.
     *
     * @param hypotheses source of the known pairs and the registered transforms; not modified
     * @param searchDepth number of rounds, not negative
     * @param prune whether to keep only hull vertices after each round
     * @return distinct-keyed exponent-pair hypotheses
     */
    public List<Hypothesis> compute(HypothesisSet hypotheses, int searchDepth, boolean prune) {
        Objects.requireNonNull(hypotheses, "hypotheses cannot be null");
        if (searchDepth < 0) {
            throw new IllegalArgumentException("searchDepth must not be negative, got " + searchDepth);
        }

        Map<ExpPair, Hypothesis> pairs = ExponentPairs.byPair(hypotheses.list(HypothesisType.EXPONENT_PAIR));
        List<Hypothesis> transforms = hypotheses.list(HypothesisType.EXPONENT_PAIR_TRANSFORM);

        for (int round = 1; round <= searchDepth; round++) {
            for (Hypothesis transformHypothesis : transforms) {
                ExpPairTransform transform = ExponentPairs.transformOf(transformHypothesis);
                List<Hypothesis> snapshot = new ArrayList<>(pairs.values());
                for (Hypothesis pair : snapshot) {
                    Hypothesis image = transform.apply(transformHypothesis, pair);
                    pairs.putIfAbsent(ExponentPairs.pairOf(image), image);
                }
            }

            int beforePrune = pairs.size();
            if (prune && pairs.size() >= 3) {
                pairs = hullVertices(pairs);
            }
            logger.debug("Closure round {}/{}: {} pairs, {} after pruning",
                round, searchDepth, beforePrune, pairs.size());
            observer.onClosureRound(round, pairs.size());
        }

        return new ArrayList<>(pairs.values());
    }

    private Map<ExpPair, Hypothesis> hullVertices(Map<ExpPair, Hypothesis> pairs) {
        List<Hypothesis> values = new ArrayList<>(pairs.values());
        List<RationalPoint> points = new ArrayList<>(values.size());
        for (ExpPair pair : pairs.keySet()) {
            points.add(pair.toPoint());
        }
        Map<ExpPair, Hypothesis> pruned = new LinkedHashMap<>();
        for (int index : ConvexHulls.hullIndices(points, hullTolerance)) {
            Hypothesis vertex = values.get(index);
            pruned.put(ExponentPairs.pairOf(vertex), vertex);
        }
        return pruned;
    }
}
