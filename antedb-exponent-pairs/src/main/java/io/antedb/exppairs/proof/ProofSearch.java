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

import io.antedb.exppairs.ExpPair;
import io.antedb.exppairs.ExponentPairs;
import io.antedb.exppairs.config.ExpPairSearchConfig;
import io.antedb.exppairs.derive.BetaBoundDuality;
import io.antedb.exppairs.derive.ExpPairClosure;
import io.antedb.exppairs.derive.ExpPairHull;
import io.antedb.exppairs.trace.SearchObserver;
import io.antedb.hypotheses.Hypothesis;
import io.antedb.hypotheses.HypothesisSet;
import io.antedb.hypotheses.HypothesisType;
import io.antedb.hypotheses.PublicationYear;
import io.antedb.hypotheses.geometry.Polytope;
import io.antedb.hypotheses.geometry.RationalPoint;
import org.apache.commons.math3.fraction.BigFraction;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Decides whether {@code (k, l)} is an exponent pair implied by a set of
 * hypotheses, and constructs the proof.
 *
 * <h2>Decision procedure</h2>
 *
 * <pre>{@code
 *   copy of the hypotheses
 *     + exponent pairs from beta bounds       (BetaBoundDuality)
 *     + closure under registered transforms   (ExpPairClosure)
 *   ──► convex hull of all exponent pairs     (ExpPairHull)
 *   ──► (k, l) in hull?  no ──► no result
 *                        yes ──► cite hull vertices
 * }</pre>
 *
 * <p>Exponent pairs form a convex set, so any point of the hull is an
 * exponent pair. With optimization, only the three hull vertices of the
 * cheapest containing triangle are cited.
 *
 * <h2>Inputs</h2>
 *
 * <p>Searches never modify the caller's set; they work on a shallow copy.
 * Search parameters, including the numeric precision, are fixed when the
 * search is constructed.
 *
 * @see ProofOptimizationMethod
 */
public final class ProofSearch {

    private static final Logger logger = LogManager.getLogger(ProofSearch.class);

    private final ExpPairSearchConfig config;
    private final SearchObserver observer;
    private final BetaBoundDuality duality;
    private final ExpPairClosure closure;
    private final ExpPairHull hull;

    public ProofSearch() {
        this(ExpPairSearchConfig.defaults());
    }

    public ProofSearch(ExpPairSearchConfig config) {
        this(config, SearchObserver.NOOP);
    }

    /**
     * @param config search parameters; validated here
     * @param observer receives progress callbacks
     */
    public ProofSearch(ExpPairSearchConfig config, SearchObserver observer) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.observer = Objects.requireNonNull(observer, "observer cannot be null");
        config.validate();
        this.duality = new BetaBoundDuality(config.numericPrecision(), config.getHullTolerance());
        this.closure = new ExpPairClosure(config.getHullTolerance(), observer);
        this.hull = new ExpPairHull(config.getHullTolerance());
    }

    public ExpPairSearchConfig config() {
        return config;
    }

    public Optional<Hypothesis> findProof(BigFraction k, BigFraction l, HypothesisSet hypotheses, boolean optimize) {
        return findProof(ExpPair.of(k, l), hypotheses, optimize);
    }

    /**
     * Tries to prove that {@code target} is an exponent pair.
     *
     * @param target the pair to prove
     * @param hypotheses the knowledge base; not modified
     * @param optimize whether to cite only a cheapest containing triangle
     *        rather than every hull vertex
     * @return the derived exponent pair, or empty if {@code target} lies
     *         outside the region implied by the hypotheses
     */
    public Optional<Hypothesis> findProof(ExpPair target, HypothesisSet hypotheses, boolean optimize) {
        Objects.requireNonNull(target, "target cannot be null");
        Objects.requireNonNull(hypotheses, "hypotheses cannot be null");

        HypothesisSet working = hypotheses.copy();
        List<Hypothesis> fromBeta = duality.derive(working);
        observer.onBetaPairsDerived(fromBeta.size());
        working.addAll(fromBeta);
        working.addAll(closure.compute(working, config.getSearchDepth(), config.isPrune()));

        if (working.list(HypothesisType.EXPONENT_PAIR).isEmpty()) {
            logger.debug("No exponent pairs known; cannot prove {}", target);
            return Optional.empty();
        }

        List<Hypothesis> vertices = hull.compute(working);
        Polytope region = Polytope.fromVRep(pointsOf(vertices), config.getHullTolerance());
        if (!region.contains(target.toPoint())) {
            logger.info("{} lies outside the hull of {} known exponent pairs", target, vertices.size());
            return Optional.empty();
        }

        List<Hypothesis> cited = optimize ? cheapestTriangle(target, vertices) : vertices;
        String proof = "Follows from convexity and the exponent pairs " + cited.stream()
            .map(h -> ExponentPairs.pairOf(h).toString())
            .collect(Collectors.joining(", "));
        Hypothesis result = ExponentPairs.derived(target, proof, cited);

        logger.info("Proved {} from {} exponent pairs ({})", target, cited.size(), result.reference().year());
        observer.onProofFound(result);
        return Optional.of(result);
    }

    public ProofResult findBestProof(BigFraction k, BigFraction l, HypothesisSet hypotheses,
                                     ProofOptimizationMethod method) {
        return findBestProof(ExpPair.of(k, l), hypotheses, method);
    }

    /**
     * Tries to prove that {@code target} is an exponent pair, choosing among
     * proofs by the given strategy.
     *
     * @param target the pair to prove
     * @param hypotheses the knowledge base; not modified
     * @param method the optimization strategy
     * @return the outcome
     * @throws UnsupportedOperationException for a strategy without an implementation
     */
    public ProofResult findBestProof(ExpPair target, HypothesisSet hypotheses, ProofOptimizationMethod method) {
        Objects.requireNonNull(target, "target cannot be null");
        Objects.requireNonNull(hypotheses, "hypotheses cannot be null");
        Objects.requireNonNull(method, "method cannot be null");

        return switch (method) {
            case DATE -> earliestProof(target, hypotheses);
            case COMPLEXITY -> ProofResult.of(findProof(target, hypotheses, true));
            case NONE -> ProofResult.unsupported("Proof optimization method NONE does not construct proofs");
            default -> throw new UnsupportedOperationException("Unimplemented proof optimization method: " + method);
        };
    }

    private ProofResult earliestProof(ExpPair target, HypothesisSet hypotheses) {
        int[] years = hypotheses.stream()
            .map(h -> h.reference().year())
            .filter(PublicationYear::isKnown)
            .mapToInt(PublicationYear::value)
            .toArray();
        if (years.length == 0) {
            return ProofResult.of(findProof(target, hypotheses, true));
        }
        int fromYear = years[0];
        int toYear = years[0];
        for (int year : years) {
            fromYear = Math.min(fromYear, year);
            toYear = Math.max(toYear, year);
        }

        int available = -1;
        for (int year = fromYear; year <= toYear; year++) {
            final int cutoff = year;
            HypothesisSet upToYear = new HypothesisSet(hypotheses.stream()
                .filter(h -> h.reference().year().isAtOrBefore(cutoff))
                .collect(Collectors.toList()));
            if (upToYear.size() == available) {
                continue;
            }
            available = upToYear.size();
            observer.onYearConsidered(year, available);
            logger.debug("Trying {} with {} hypotheses up to {}", target, available, year);

            Optional<Hypothesis> proof = findProof(target, upToYear, true);
            if (proof.isPresent()) {
                return ProofResult.proven(proof.get());
            }
        }
        return ProofResult.noResult();
    }

    private List<Hypothesis> cheapestTriangle(ExpPair target, List<Hypothesis> vertices) {
        int n = vertices.size();
        if (n < 3) {
            return vertices;
        }
        RationalPoint point = target.toPoint();
        List<Hypothesis> best = null;
        long lowest = Long.MAX_VALUE;
        for (int i = 0; i < n; i++) {
            for (int j = i + 1; j < n; j++) {
                for (int k = j + 1; k < n; k++) {
                    List<Hypothesis> triangle = List.of(vertices.get(i), vertices.get(j), vertices.get(k));
                    if (!Polytope.fromVRep(pointsOf(triangle), config.getHullTolerance()).contains(point)) {
                        continue;
                    }
                    long complexity = 0;
                    for (Hypothesis vertex : triangle) {
                        complexity += vertex.proofComplexity();
                    }
                    if (complexity < lowest) {
                        lowest = complexity;
                        best = triangle;
                    }
                }
            }
        }
        if (best == null) {
            // a point inside an exact convex hull lies in some fan triangle of its vertices
            logger.warn("No hull triangle contains {}; citing all {} vertices", target, n);
            return vertices;
        }
        return best;
    }

    private static List<RationalPoint> pointsOf(List<Hypothesis> hypotheses) {
        List<RationalPoint> points = new ArrayList<>(hypotheses.size());
        for (Hypothesis hypothesis : hypotheses) {
            points.add(ExponentPairs.pairOf(hypothesis).toPoint());
        }
        return points;
    }
}
