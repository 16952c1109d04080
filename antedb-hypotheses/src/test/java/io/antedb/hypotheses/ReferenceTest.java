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

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
class ReferenceTest {

    @Test
    void maxYearIgnoresUndatedReferences() {
        PublicationYear year = Reference.maxYear(List.of(
            Reference.trivial(),
            Reference.literature("Huxley", 2005),
            Reference.literature("Bourgain", 2017),
            Reference.conjectured()));
        assertEquals(PublicationYear.of(2017), year);
    }

    @Test
    void maxYearOfUndatedReferencesIsUnknown() {
        assertEquals(PublicationYear.UNKNOWN, Reference.maxYear(List.of(Reference.trivial(), Reference.conjectured())));
        assertEquals(PublicationYear.UNKNOWN, Reference.maxYear(List.of()));
    }

    @Test
    void unknownYearIsAlwaysAvailable() {
        assertTrue(PublicationYear.UNKNOWN.isAtOrBefore(1900));
        assertTrue(PublicationYear.of(1985).isAtOrBefore(1985));
        assertFalse(PublicationYear.of(2003).isAtOrBefore(1990));
    }

    @Test
    void unknownYearHasNoValue() {
        assertFalse(PublicationYear.UNKNOWN.isKnown());
        assertTrue(PublicationYear.UNKNOWN.asOptional().isEmpty());
        assertThrows(IllegalStateException.class, PublicationYear.UNKNOWN::value);
        assertEquals("Unknown date", PublicationYear.UNKNOWN.toString());
    }

    @Test
    void derivedReferenceCarriesYear() {
        Reference derived = Reference.derived(PublicationYear.of(1991));
        assertEquals(Reference.Kind.DERIVED, derived.kind());
        assertEquals(1991, derived.year().value());
    }

    @Test
    void literatureRequiresAuthor() {
        assertThrows(IllegalArgumentException.class, () -> Reference.literature(" ", 1990));
        assertThrows(NullPointerException.class, () -> Reference.literature(null, 1990));
        assertEquals("[Huxley, 2005]", Reference.literature("Huxley", 2005).toString());
    }
}
