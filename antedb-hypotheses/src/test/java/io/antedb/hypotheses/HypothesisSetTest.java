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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
class HypothesisSetTest {

    private static Hypothesis pair(String name, int year) {
        return new Hypothesis(name, HypothesisType.EXPONENT_PAIR, name, "See " + name,
            Reference.literature(name, year));
    }

    private static Hypothesis transform(String name) {
        return new Hypothesis(name, HypothesisType.EXPONENT_PAIR_TRANSFORM, name, "Classical", Reference.trivial());
    }

    @Test
    void listsByTypeInInsertionOrder() {
        Hypothesis p1 = pair("first", 1990);
        Hypothesis t = transform("van der Corput B transform");
        Hypothesis p2 = pair("second", 2000);
        HypothesisSet set = new HypothesisSet(List.of(p1, t, p2));

        assertEquals(List.of(p1, p2), set.list(HypothesisType.EXPONENT_PAIR));
        assertEquals(List.of(t), set.list(HypothesisType.EXPONENT_PAIR_TRANSFORM));
        assertTrue(set.list(HypothesisType.BETA_BOUND).isEmpty());
        assertEquals(3, set.size());
    }

    @Test
    void findsByKeywordIgnoringCase() {
        Hypothesis b = transform("van der Corput B transform");
        HypothesisSet set = new HypothesisSet(List.of(pair("Huxley", 2005), b));

        assertSame(b, set.find("Van der Corput B").orElseThrow());
        assertTrue(set.find("Bombieri").isEmpty());
    }

    @Test
    void addingTheSameInstanceTwiceKeepsOne() {
        Hypothesis p = pair("Huxley", 2005);
        HypothesisSet set = new HypothesisSet();
        set.add(p);
        set.addAll(List.of(p, p));
        assertEquals(1, set.size());
    }

    @Test
    void insertionInvalidatesCache() {
        HypothesisSet set = new HypothesisSet(List.of(pair("a", 1990)));
        assertFalse(set.isCacheValid());

        set.putCached("hull", "computed");
        set.markCacheValid();
        assertTrue(set.isCacheValid());
        assertEquals("computed", set.cached("hull", String.class).orElseThrow());

        set.add(pair("b", 1991));
        assertFalse(set.isCacheValid());

        set.markCacheValid();
        set.addAll(List.of());
        assertFalse(set.isCacheValid(), "bulk insertion invalidates even when empty");
    }

    @Test
    void cachedEntryOfWrongKindIsRejected() {
        HypothesisSet set = new HypothesisSet();
        set.putCached("hull", 42);
        assertThrows(IllegalArgumentException.class, () -> set.cached("hull", String.class));
        assertTrue(set.cached("missing", String.class).isEmpty());
    }

    @Test
    void copyIsShallowAndIndependent() {
        Hypothesis p = pair("a", 1990);
        HypothesisSet original = new HypothesisSet(List.of(p));
        original.putCached("hull", "original");
        original.markCacheValid();

        HypothesisSet copy = original.copy();
        assertTrue(copy.contains(p));
        assertTrue(copy.isCacheValid());

        copy.add(pair("b", 1991));
        copy.putCached("hull", "copy");

        assertEquals(1, original.size());
        assertTrue(original.isCacheValid());
        assertEquals("original", original.cached("hull", String.class).orElseThrow());
        assertEquals(2, copy.size());
        assertFalse(copy.isCacheValid());
    }

    @Test
    void proofComplexityIsRecursive() {
        Hypothesis a = pair("a", 1990);
        Hypothesis b = pair("b", 1995);
        Hypothesis c = new Hypothesis("c", HypothesisType.EXPONENT_PAIR, "c", "from a and b",
            Reference.derived(PublicationYear.of(1995)), Set.of(a, b));
        Hypothesis d = new Hypothesis("d", HypothesisType.EXPONENT_PAIR, "d", "from c and a",
            Reference.derived(PublicationYear.of(1995)), List.of(c, a));

        assertEquals(1, a.proofComplexity());
        assertEquals(3, c.proofComplexity());
        assertEquals(5, d.proofComplexity());
        assertThat(d.dependencies()).containsExactly(c, a);
    }

    @Test
    void payloadKindIsChecked() {
        Hypothesis p = pair("a", 1990);
        assertEquals("a", p.data(String.class));
        assertThrows(IllegalArgumentException.class, () -> p.data(Integer.class));
    }
}
