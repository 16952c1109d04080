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
import io.antedb.exppairs.ExponentPairs;
import io.antedb.hypotheses.Hypothesis;
import io.antedb.hypotheses.HypothesisSet;
import io.antedb.hypotheses.HypothesisType;
import io.antedb.hypotheses.geometry.ConvexHulls;
import io.antedb.hypotheses.geometry.RationalPoint;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// Convex hull of the exponent pairs in a hypothesis set, cached in the set.
///
/// ## Caching
///
/// The hull is stored in the set's interior cache under [#CACHE_KEY] and
/// reused while the set reports a valid cache. Inserting into the set clears
/// the validity flag, so the next call recomputes:
///
/// ```text
///   compute(set)        ──► computed, stored, cache valid
///   compute(set)        ──► returned from cache
///   set.addAll(...)     ──► cache invalid
///   compute(set)        ──► recomputed
/// ```
///
/// This class only uses the pairs already in the set; it does not expand
/// them by transforms or beta bounds.
public final class ExpPairHull {

    private static final Logger logger = LogManager.getLogger(ExpPairHull.class);

    /// Cache key of the hull in a [HypothesisSet].
    public static final String CACHE_KEY = "convex_hull";

    private record CachedHull(List<Hypothesis> vertices) {
    }

    private final double tolerance;

    public ExpPairHull() {
        this(ConvexHulls.DEFAULT_TOLERANCE);
    }

    public ExpPairHull(double tolerance) {
        this.tolerance = tolerance;
    }

    /// Returns the exponent-pair hypotheses at the vertices of the hull, in
    /// hull order. With fewer than three distinct pairs, all of them are
    /// returned.
    ///
    /// @param hypotheses the set; its cache is updated
    /// @return the vertex hypotheses, unmodifiable
    public List<Hypothesis> compute(HypothesisSet hypotheses) {
        Objects.requireNonNull(hypotheses, "hypotheses cannot be null");

        if (hypotheses.isCacheValid()) {
            Optional<CachedHull> cached = hypotheses.cached(CACHE_KEY, CachedHull.class);
            if (cached.isPresent()) {
                return cached.get().vertices();
            }
        }

        Map<ExpPair, Hypothesis> pairs = ExponentPairs.byPair(hypotheses.list(HypothesisType.EXPONENT_PAIR));
        List<Hypothesis> values = new ArrayList<>(pairs.values());
        List<Hypothesis> vertices;
        if (values.size() < 3) {
            vertices = values;
        } else {
            List<RationalPoint> points = new ArrayList<>(values.size());
            for (ExpPair pair : pairs.keySet()) {
                points.add(pair.toPoint());
            }
            vertices = new ArrayList<>();
            for (int index : ConvexHulls.hullIndices(points, tolerance)) {
                vertices.add(values.get(index));
            }
        }
        logger.debug("Computed hull of {} exponent pairs: {} vertices", values.size(), vertices.size());

        List<Hypothesis> result = Collections.unmodifiableList(vertices);
        hypotheses.putCached(CACHE_KEY, new CachedHull(result));
        hypotheses.markCacheValid();
        return result;
    }
}
