package io.antedb.exppairs.config;

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

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
class ExpPairSearchConfigTest {

    @TempDir
    Path tempDir;

    @Test
    void bundledDefaultsMatchBuiltInDefaults() throws IOException {
        ExpPairSearchConfig loaded = ExpPairSearchConfig.loadDefaults();
        ExpPairSearchConfig builtIn = ExpPairSearchConfig.defaults();

        assertEquals(builtIn.getSearchDepth(), loaded.getSearchDepth());
        assertEquals(builtIn.isPrune(), loaded.isPrune());
        assertEquals(builtIn.getPrecisionDigits(), loaded.getPrecisionDigits());
        assertEquals(builtIn.getHullTolerance(), loaded.getHullTolerance());
    }

    @Test
    void missingKeysFallBackToDefaults() throws Exception {
        Path fixture = Path.of(getClass().getResource("/configs/shallow-search.json").toURI());
        ExpPairSearchConfig config = ExpPairSearchConfig.load(fixture);

        assertEquals(2, config.getSearchDepth());
        assertFalse(config.isPrune());
        assertEquals(64, config.getPrecisionDigits());
        assertEquals(64, config.numericPrecision().digits());
        assertEquals(1e-10, config.getHullTolerance());
    }

    @Test
    void emptyDocumentMeansDefaults() throws IOException {
        Path empty = tempDir.resolve("empty.json");
        Files.writeString(empty, "");

        ExpPairSearchConfig config = ExpPairSearchConfig.load(empty);
        assertEquals(ExpPairSearchConfig.DEFAULT_SEARCH_DEPTH, config.getSearchDepth());
        assertTrue(config.isPrune());
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "{\"search_depth\": -1}",
        "{\"precision_digits\": 0}",
        "{\"hull_tolerance\": 0.0}",
        "{\"search_depth\": \"deep\"}",
        "{\"search_depth\": 3"
    })
    void invalidDocumentsAreRejected(String json) {
        IOException e = assertThrows(IOException.class,
            () -> ExpPairSearchConfig.fromJson(new StringReader(json), "inline"));
        assertTrue(e.getMessage().contains("inline"), e.getMessage());
    }

    @Test
    void writesSnakeCaseKeys() throws IOException {
        ExpPairSearchConfig config = new ExpPairSearchConfig(3, false, 200, 1e-9);
        JsonObject json = JsonParser.parseString(config.toJson()).getAsJsonObject();

        assertEquals(3, json.get("search_depth").getAsInt());
        assertFalse(json.get("prune").getAsBoolean());
        assertEquals(200, json.get("precision_digits").getAsInt());

        Path file = tempDir.resolve("search.json");
        Files.writeString(file, config.toJson());
        assertEquals(1e-9, ExpPairSearchConfig.load(file).getHullTolerance());
    }

    @Test
    void constructorValidates() {
        assertThrows(IllegalArgumentException.class, () -> new ExpPairSearchConfig(-2, true, 10, 1e-10));
    }

    @Test
    void missingFileIsAnIoError() {
        assertThrows(IOException.class, () -> ExpPairSearchConfig.load(tempDir.resolve("absent.json")));
    }
}
