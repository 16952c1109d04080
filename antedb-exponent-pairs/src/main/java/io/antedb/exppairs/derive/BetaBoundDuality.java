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
import io.antedb.exppairs.VanDerCorput;
import io.antedb.hypotheses.Fractions;
import io.antedb.hypotheses.Hypothesis;
import io.antedb.hypotheses.HypothesisSet;
import io.antedb.hypotheses.HypothesisType;
import io.antedb.hypotheses.bound.BetaBound;
import io.antedb.hypotheses.bound.BoundPiece;
import io.antedb.hypotheses.bound.NumericPrecision;
import io.antedb.hypotheses.geometry.ConvexHulls;
import io.antedb.hypotheses.geometry.RationalPoint;
import org.apache.commons.math3.fraction.BigFraction;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Converts upper bounds on β into exponent pairs.
 *
 * <h2>Duality</h2>
 *
 * <p>An upper bound on β over {@code α ∈ [0, 1/2]} is only as good as its
 * convex hull. Every edge of that hull lies on a tangent line
 * {@code β = m α + c}, and such a line corresponds to the exponent pair
 *
 * <pre>{@code
 *   (k, l) = (c, m + c)
 * }</pre>
 *
 * <h2>Algorithm</h2>
 *
 * <pre>{@code
 * ┌──────────────────────────────────────────────────────────────┐
 * │ 1. min x0 <= 0 and max x1 >= 1/2, otherwise no pairs         │
 * │ 2. points := (0, 0), (1/2, 0), and both endpoints of each    │
 * │    piece, evaluated with domain extension                    │
 * │ 3. hull the points; for each edge (a1, b1) -> (a2, b2)       │
 * │    not lying on β = 0, α = 0 or α = 1/2:                     │
 * │      m = (b2 - b1) / (a2 - a1)                               │
 * │      c = (b1 a2 - a1 b2) / (a2 - a1)                         │
 * │      pair (c, m + c)                                         │
 * │ 4. mirror every pair through the B transform, if registered  │
 * └──────────────────────────────────────────────────────────────┘
 * }</pre>
 *
 * <p>Every derived pair depends on all bound pieces that touch a hull vertex,
 * not on a minimal subset for that pair.
 */
public final class BetaBoundDuality {

    private static final Logger logger = LogManager.getLogger(BetaBoundDuality.class);

    private static final Comparator<Hypothesis> BY_DOMAIN = Comparator
        .comparing((Hypothesis h) -> pieceOf(h).domain().x0())
        .thenComparing(h -> pieceOf(h).domain().x1());

    private final NumericPrecision precision;
    private final double hullTolerance;

    public BetaBoundDuality() {
        this(NumericPrecision.DEFAULT, ConvexHulls.DEFAULT_TOLERANCE);
    }

    /**
     * @param precision precision for evaluating inexact bound pieces
     * @param hullTolerance tolerance of the hull generator
     */
    public BetaBoundDuality(NumericPrecision precision, double hullTolerance) {
        this.precision = Objects.requireNonNull(precision, "precision cannot be null");
        this.hullTolerance = hullTolerance;
    }

    /**
     * Derives exponent pairs from the beta bounds of a set.
     *
     * @param hypotheses the set; not modified
     * @return the known exponent-pair hypotheses followed by the new ones and
     *         their B mirrors, or an empty list if the bounds do not cover
     *         {@code [0, 1/2]}
     */
    public List<Hypothesis> derive(HypothesisSet hypotheses) {
        Objects.requireNonNull(hypotheses, "hypotheses cannot be null");

        List<Hypothesis> bounds = hypotheses.list(HypothesisType.BETA_BOUND);
        if (bounds.isEmpty()) {
            return List.of();
        }
        bounds.sort(BY_DOMAIN);
        // pieces may overlap; the right end is the largest x1
        BigFraction start = pieceOf(bounds.get(0)).domain().x0();
        BigFraction end = start;
        for (Hypothesis bound : bounds) {
            BigFraction x1 = pieceOf(bound).domain().x1();
            if (x1.compareTo(end) > 0) {
                end = x1;
            }
        }
        if (start.compareTo(BigFraction.ZERO) > 0 || end.compareTo(BigFraction.ONE_HALF) < 0) {
            logger.debug("Beta bounds cover [{}, {}], not [0, 1/2]; no exponent pairs derived",
                Fractions.format(start), Fractions.format(end));
            return List.of();
        }

        List<RationalPoint> points = new ArrayList<>();
        points.add(new RationalPoint(BigFraction.ZERO, BigFraction.ZERO));
        points.add(new RationalPoint(BigFraction.ONE_HALF, BigFraction.ZERO));
        List<List<RationalPoint>> endpoints = new ArrayList<>(bounds.size());
        for (Hypothesis bound : bounds) {
            BoundPiece piece = pieceOf(bound);
            BigFraction x0 = piece.domain().x0();
            BigFraction x1 = piece.domain().x1();
            RationalPoint left = new RationalPoint(x0, piece.at(x0, true, precision));
            RationalPoint right = new RationalPoint(x1, piece.at(x1, true, precision));
            points.add(left);
            points.add(right);
            endpoints.add(List.of(left, right));
        }

        List<RationalPoint> hull = new ArrayList<>();
        for (int index : ConvexHulls.hullIndices(points, hullTolerance)) {
            hull.add(points.get(index));
        }

        Set<Hypothesis> dependencies = new LinkedHashSet<>();
        for (int i = 0; i < bounds.size(); i++) {
            for (RationalPoint endpoint : endpoints.get(i)) {
                if (hull.contains(endpoint)) {
                    dependencies.add(bounds.get(i));
                }
            }
        }

        List<Hypothesis> result = new ArrayList<>(hypotheses.list(HypothesisType.EXPONENT_PAIR));
        Map<ExpPair, Hypothesis> known = ExponentPairs.byPair(result);
        Optional<Hypothesis> bTransform = hypotheses.find(VanDerCorput.B_KEYWORD)
            .filter(h -> h.type() == HypothesisType.EXPONENT_PAIR_TRANSFORM);

        int derived = 0;
        int n = hull.size();
        int edges = n < 2 ? 0 : n;
        for (int i = 0; i < edges; i++) {
            RationalPoint p1 = hull.get(i);
            RationalPoint p2 = hull.get((i + 1) % n);
            if (isDegenerate(p1, p2)) {
                continue;
            }

            BigFraction run = p2.x().subtract(p1.x());
            BigFraction m = p2.y().subtract(p1.y()).divide(run);
            BigFraction c = p1.y().multiply(p2.x()).subtract(p1.x().multiply(p2.y())).divide(run);
            ExpPair pair = ExpPair.of(c, m.add(c));

            Hypothesis hypothesis = known.get(pair);
            if (hypothesis == null) {
                hypothesis = ExponentPairs.derived(pair,
                    "Follows from combining " + dependencies.size() + " bounds on beta", dependencies);
                known.put(pair, hypothesis);
                result.add(hypothesis);
                derived++;
            }

            if (bTransform.isPresent()) {
                Hypothesis self = bTransform.get();
                ExpPairTransform b = ExponentPairs.transformOf(self);
                Hypothesis mirror = b.apply(self, hypothesis);
                if (known.putIfAbsent(ExponentPairs.pairOf(mirror), mirror) == null) {
                    result.add(mirror);
                    derived++;
                }
            }
        }

        logger.debug("Derived {} exponent pairs from {} beta bounds ({} hull vertices, {} dependencies)",
            derived, bounds.size(), n, dependencies.size());
        return result;
    }

    private static boolean isDegenerate(RationalPoint p1, RationalPoint p2) {
        boolean onAlphaAxis = Fractions.signum(p1.y()) == 0 && Fractions.signum(p2.y()) == 0;
        boolean onBetaAxis = Fractions.signum(p1.x()) == 0 && Fractions.signum(p2.x()) == 0;
        boolean onHalfLine = BigFraction.ONE_HALF.equals(p1.x()) && BigFraction.ONE_HALF.equals(p2.x());
        // any other vertical edge has no finite slope
        boolean vertical = p1.x().equals(p2.x());
        return onAlphaAxis || onBetaAxis || onHalfLine || vertical;
    }

    private static BoundPiece pieceOf(Hypothesis hypothesis) {
        return hypothesis.data(BetaBound.class).bound();
    }
}
