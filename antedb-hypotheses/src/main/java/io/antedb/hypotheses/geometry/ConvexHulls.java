package io.antedb.hypotheses.geometry;

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
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.geometry.euclidean.twod.Vector2D;
import org.apache.commons.math3.geometry.euclidean.twod.hull.ConvexHull2D;
import org.apache.commons.math3.geometry.euclidean.twod.hull.MonotoneChain;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Planar convex hulls over exact points.
 *
 * <h2>Exactness</h2>
 *
 * <p>Every decision about the hull is made on the exact rationals. The
 * commons-math {@link MonotoneChain} runs first in double precision, keeping
 * collinear points, and only proposes candidates. The candidates are then
 * hulled again with exact cross products, and every input point is checked
 * against that exact hull. Points found outside it join the candidates and
 * the exact pass repeats:
 *
 * <pre>{@code
 *   exact points ──► Vector2D ──► MonotoneChain ──► candidates
 *        │                                              │
 *        │                                   exact monotone chain
 *        │                                              │
 *        └──── outside the exact hull? ◄────────────────┘
 *                 yes: add to candidates, repeat
 * }</pre>
 *
 * <p>Distinct rationals that round to the same double stay distinct, and a
 * vertex is never dropped for lying within the tolerance of a chord.
 *
 * <h2>Result</h2>
 *
 * <p>Vertices are counter-clockwise starting from the lowest of the leftmost
 * points, without collinear boundary points. Degenerate inputs (fewer than
 * three distinct points, or all points on one line) yield their distinct
 * extreme points.
 */
public final class ConvexHulls {

    private static final Logger logger = LogManager.getLogger(ConvexHulls.class);

    /** Default tolerance handed to the floating-point candidate pass. */
    public static final double DEFAULT_TOLERANCE = 1e-10;

    private static final Comparator<RationalPoint> BY_X_THEN_Y = Comparator
        .comparing(RationalPoint::x)
        .thenComparing(RationalPoint::y);

    private ConvexHulls() {
        // Utility class
    }

    /**
     * Computes the hull vertices with the default tolerance.
     *
     * @see #hullIndices(List, double)
     */
    public static List<Integer> hullIndices(List<RationalPoint> points) {
        return hullIndices(points, DEFAULT_TOLERANCE);
    }

    /**
     * Computes the hull vertices of a point list.
     *
     * @param points the exact points
     * @param tolerance tolerance of the floating-point candidate pass; it
     *        never changes the result, only how many exact passes run
     * @return indices into {@code points} of the hull vertices, in hull order;
     *         a point occurring several times is reported at its first index
     */
    public static List<Integer> hullIndices(List<RationalPoint> points, double tolerance) {
        Objects.requireNonNull(points, "points cannot be null");

        Map<RationalPoint, Integer> firstIndex = new LinkedHashMap<>();
        for (int i = 0; i < points.size(); i++) {
            firstIndex.putIfAbsent(Objects.requireNonNull(points.get(i), "points cannot contain null"), i);
        }
        List<RationalPoint> distinct = new ArrayList<>(firstIndex.keySet());

        List<RationalPoint> hull;
        if (distinct.size() <= 2) {
            hull = exactHull(distinct);
        } else {
            List<RationalPoint> candidates = candidates(distinct, tolerance);
            hull = exactHull(candidates);
            List<RationalPoint> missed = outside(hull, distinct);
            while (!missed.isEmpty()) {
                logger.debug("{} points lie outside the floating-point hull of {} points; recomputing exactly",
                    missed.size(), distinct.size());
                candidates.addAll(missed);
                hull = exactHull(candidates);
                missed = outside(hull, distinct);
            }
        }

        List<Integer> result = new ArrayList<>(hull.size());
        for (RationalPoint vertex : hull) {
            result.add(firstIndex.get(vertex));
        }
        return result;
    }

    /**
     * Computes the hull vertices themselves.
     *
     * @param points the exact points
     * @param tolerance tolerance of the floating-point candidate pass
     * @return the hull vertices, in hull order
     */
    public static List<RationalPoint> hull(List<RationalPoint> points, double tolerance) {
        List<RationalPoint> vertices = new ArrayList<>();
        for (int index : hullIndices(points, tolerance)) {
            vertices.add(points.get(index));
        }
        return vertices;
    }

    private static List<RationalPoint> candidates(List<RationalPoint> distinct, double tolerance) {
        Map<Vector2D, List<RationalPoint>> byVector = new LinkedHashMap<>();
        for (RationalPoint point : distinct) {
            byVector.computeIfAbsent(point.toVector2D(), v -> new ArrayList<>()).add(point);
        }

        ConvexHull2D hull;
        try {
            hull = new MonotoneChain(true, tolerance).generate(byVector.keySet());
        } catch (MathIllegalArgumentException | MathIllegalStateException e) {
            logger.debug("Hull generator rejected {} points ({}); using all of them as candidates",
                byVector.size(), e.getMessage());
            return new ArrayList<>(distinct);
        }

        List<RationalPoint> result = new ArrayList<>();
        for (Vector2D vertex : hull.getVertices()) {
            List<RationalPoint> exact = byVector.get(vertex);
            if (exact == null) {
                throw new IllegalStateException("hull vertex " + vertex + " does not match any input point");
            }
            result.addAll(exact);
        }
        return result;
    }

    /** Andrew's monotone chain on exact points, collinear points removed. */
    static List<RationalPoint> exactHull(Collection<RationalPoint> points) {
        List<RationalPoint> sorted = new ArrayList<>(new LinkedHashSet<>(points));
        sorted.sort(BY_X_THEN_Y);
        if (sorted.size() <= 2) {
            return sorted;
        }

        List<RationalPoint> lower = chain(sorted);
        Collections.reverse(sorted);
        List<RationalPoint> upper = chain(sorted);

        List<RationalPoint> hull = new ArrayList<>(lower.subList(0, lower.size() - 1));
        hull.addAll(upper.subList(0, upper.size() - 1));
        return hull;
    }

    private static List<RationalPoint> chain(List<RationalPoint> sorted) {
        List<RationalPoint> chain = new ArrayList<>();
        for (RationalPoint point : sorted) {
            while (chain.size() >= 2 && Fractions.signum(
                Polytope.cross(chain.get(chain.size() - 2), chain.get(chain.size() - 1), point)) <= 0) {
                chain.remove(chain.size() - 1);
            }
            chain.add(point);
        }
        return chain;
    }

    private static List<RationalPoint> outside(List<RationalPoint> hull, List<RationalPoint> points) {
        Polytope region = Polytope.ofHullVertices(hull);
        List<RationalPoint> result = new ArrayList<>();
        for (RationalPoint point : points) {
            if (!region.contains(point)) {
                result.add(point);
            }
        }
        return result;
    }
}
