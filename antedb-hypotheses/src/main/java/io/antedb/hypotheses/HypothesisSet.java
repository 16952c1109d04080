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

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

/// A mutable, insertion-ordered collection of [Hypothesis] objects.
///
/// ## Interior cache
///
/// Expensive derived structures (such as the convex hull of the exponent
/// pairs in the set) are stored in an interior cache guarded by a validity
/// flag:
///
/// ```text
///   add / addAll  ──►  cache invalid
///   compute + put + markCacheValid()  ──►  cache valid
/// ```
///
/// Insertion is the only operation that clears the flag. A consumer must
/// treat any cached entry as stale while [#isCacheValid()] is false.
///
/// ## Copies
///
/// [#copy()] is shallow: the new set holds the same hypothesis instances in
/// a new container, with its own cache. Mutating the copy never affects the
/// original. Instances are not thread-safe; concurrent users must each work
/// on their own copy.
public final class HypothesisSet implements Iterable<Hypothesis> {

    private final LinkedHashSet<Hypothesis> hypotheses;
    private final Map<String, Object> cache;
    private boolean cacheValid;

    /// Creates an empty set.
    public HypothesisSet() {
        this.hypotheses = new LinkedHashSet<>();
        this.cache = new HashMap<>();
        this.cacheValid = false;
    }

    /// Creates a set holding the given hypotheses.
    public HypothesisSet(Iterable<Hypothesis> initial) {
        this();
        addAll(initial);
    }

    private HypothesisSet(HypothesisSet source) {
        this.hypotheses = new LinkedHashSet<>(source.hypotheses);
        this.cache = new HashMap<>(source.cache);
        this.cacheValid = source.cacheValid;
    }

    /// Returns a shallow copy of this set with an independent cache.
    public HypothesisSet copy() {
        return new HypothesisSet(this);
    }

    /// Adds a hypothesis, invalidating the cache.
    ///
    /// @param hypothesis the hypothesis to add
    public void add(Hypothesis hypothesis) {
        Objects.requireNonNull(hypothesis, "hypothesis cannot be null");
        hypotheses.add(hypothesis);
        cacheValid = false;
    }

    /// Adds all given hypotheses, invalidating the cache.
    ///
    /// @param toAdd the hypotheses to add
    public void addAll(Iterable<Hypothesis> toAdd) {
        Objects.requireNonNull(toAdd, "hypotheses cannot be null");
        for (Hypothesis hypothesis : toAdd) {
            add(hypothesis);
        }
        cacheValid = false;
    }

    /// Lists the hypotheses of a type, in insertion order.
    ///
    /// @param type the type tag
    /// @return a new list
    public List<Hypothesis> list(HypothesisType type) {
        Objects.requireNonNull(type, "type cannot be null");
        List<Hypothesis> result = new ArrayList<>();
        for (Hypothesis hypothesis : hypotheses) {
            if (hypothesis.type() == type) {
                result.add(hypothesis);
            }
        }
        return result;
    }

    /// Finds the first hypothesis whose name contains the keyword, ignoring case.
    ///
    /// @param keyword the keyword
    /// @return the first match, if any
    public Optional<Hypothesis> find(String keyword) {
        Objects.requireNonNull(keyword, "keyword cannot be null");
        String needle = keyword.toLowerCase(Locale.ROOT);
        for (Hypothesis hypothesis : hypotheses) {
            if (hypothesis.name().toLowerCase(Locale.ROOT).contains(needle)) {
                return Optional.of(hypothesis);
            }
        }
        return Optional.empty();
    }

    public boolean contains(Hypothesis hypothesis) {
        return hypotheses.contains(hypothesis);
    }

    public int size() {
        return hypotheses.size();
    }

    public boolean isEmpty() {
        return hypotheses.isEmpty();
    }

    public Stream<Hypothesis> stream() {
        return hypotheses.stream();
    }

    /// Returns an unmodifiable view of the members.
    public Set<Hypothesis> asSet() {
        return Collections.unmodifiableSet(hypotheses);
    }

    @Override
    public Iterator<Hypothesis> iterator() {
        return asSet().iterator();
    }

    /// Returns whether the cache reflects the current members.
    public boolean isCacheValid() {
        return cacheValid;
    }

    /// Marks the cache as reflecting the current members.
    public void markCacheValid() {
        cacheValid = true;
    }

    /// Returns a cached entry regardless of the validity flag.
    ///
    /// @param key the entry key
    /// @param kind the expected value class
    /// @return the entry, if present
    public <T> Optional<T> cached(String key, Class<T> kind) {
        Object value = cache.get(key);
        if (value == null) {
            return Optional.empty();
        }
        if (!kind.isInstance(value)) {
            throw new IllegalArgumentException("cache entry '" + key + "' is a "
                + value.getClass().getSimpleName() + ", not " + kind.getSimpleName());
        }
        return Optional.of(kind.cast(value));
    }

    /// Stores a cache entry. Does not change the validity flag.
    public void putCached(String key, Object value) {
        Objects.requireNonNull(key, "key cannot be null");
        Objects.requireNonNull(value, "value cannot be null");
        cache.put(key, value);
    }

    @Override
    public String toString() {
        return "HypothesisSet[" + hypotheses.size() + " hypotheses]";
    }
}
