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
import org.apache.commons.math3.fraction.BigFraction;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/// A convex polygon in the plane with exact vertices.
///
/// ## Construction
///
/// [#fromVRep(List)] takes any vertex list (the V-representation), computes
/// its convex hull through [ConvexHulls] and keeps the hull vertices in hull
/// order. Interior and collinear input points are dropped.
///
/// ## Containment
///
/// [#contains(RationalPoint)] is exact and boundary inclusive. Polygons with
/// fewer than three vertices are a segment, a single point, or empty:
///
/// | Vertices | Region |
/// |----------|--------|
/// | 0 | empty |
/// | 1 | that point |
/// | 2 | the closed segment |
/// | 3+ | the closed polygon |
public final class Polytope {

    /// A directed boundary edge between consecutive vertices.
    public record Edge(RationalPoint from, RationalPoint to) {
    }

    private final List<RationalPoint> vertices;

    private Polytope(List<RationalPoint> vertices) {
        this.vertices = Collections.unmodifiableList(vertices);
    }

    /// Builds the polytope spanned by the given points.
    public static Polytope fromVRep(List<RationalPoint> points) {
        return fromVRep(points, ConvexHulls.DEFAULT_TOLERANCE);
    }

    /// Builds the polytope spanned by the given points.
    ///
    /// @param points the spanning points, in any order
    /// @param tolerance tolerance of the floating-point candidate pass
    /// @return the polytope
    public static Polytope fromVRep(List<RationalPoint> points, double tolerance) {
        Objects.requireNonNull(points, "points cannot be null");
        return new Polytope(new ArrayList<>(ConvexHulls.hull(points, tolerance)));
    }

    /// Wraps vertices that already form a convex hull in counter-clockwise order.
    static Polytope ofHullVertices(List<RationalPoint> vertices) {
        return new Polytope(new ArrayList<>(vertices));
    }

    /// Returns the vertices in hull order.
    public List<RationalPoint> vertices() {
        return vertices;
    }

    /// Returns the boundary edges, cyclically: the last edge closes back to
    /// the first vertex. Empty for fewer than two vertices.
    public List<Edge> edges() {
        int n = vertices.size();
        List<Edge> edges = new ArrayList<>(n);
        if (n < 2) {
            return edges;
        }
        for (int i = 0; i < n; i++) {
            edges.add(new Edge(vertices.get(i), vertices.get((i + 1) % n)));
        }
        return edges;
    }

    public boolean contains(BigFraction x, BigFraction y) {
        return contains(new RationalPoint(x, y));
    }

    /// Tests exact, boundary-inclusive containment.
    ///
    /// @param point the point to test
    /// @return true if the point lies in the closed region
    public boolean contains(RationalPoint point) {
        Objects.requireNonNull(point, "point cannot be null");
        int n = vertices.size();
        if (n == 0) {
            return false;
        }
        if (n == 1) {
            return vertices.get(0).equals(point);
        }
        if (n == 2) {
            return onSegment(vertices.get(0), vertices.get(1), point);
        }

        boolean anyPositive = false;
        boolean anyNegative = false;
        for (int i = 0; i < n; i++) {
            int side = Fractions.signum(cross(vertices.get(i), vertices.get((i + 1) % n), point));
            if (side > 0) anyPositive = true;
            if (side < 0) anyNegative = true;
            if (anyPositive && anyNegative) {
                return false;
            }
        }
        return true;
    }

    static BigFraction cross(RationalPoint a, RationalPoint b, RationalPoint p) {
        BigFraction dx1 = b.x().subtract(a.x());
        BigFraction dy1 = b.y().subtract(a.y());
        BigFraction dx2 = p.x().subtract(a.x());
        BigFraction dy2 = p.y().subtract(a.y());
        return dx1.multiply(dy2).subtract(dy1.multiply(dx2));
    }

    private static boolean onSegment(RationalPoint a, RationalPoint b, RationalPoint p) {
        if (Fractions.signum(cross(a, b, p)) != 0) {
            return false;
        }
        return between(a.x(), b.x(), p.x()) && between(a.y(), b.y(), p.y());
    }

    private static boolean between(BigFraction a, BigFraction b, BigFraction v) {
        BigFraction lo = a.compareTo(b) <= 0 ? a : b;
        BigFraction hi = a.compareTo(b) <= 0 ? b : a;
        return lo.compareTo(v) <= 0 && v.compareTo(hi) <= 0;
    }

    @Override
    public String toString() {
        return "Polytope" + vertices;
    }
}
