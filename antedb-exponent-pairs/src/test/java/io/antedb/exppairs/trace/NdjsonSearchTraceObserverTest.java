package io.antedb.exppairs.trace;

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
import io.antedb.exppairs.ExpPair;
import io.antedb.exppairs.ExponentPairs;
import io.antedb.exppairs.VanDerCorput;
import io.antedb.exppairs.config.ExpPairSearchConfig;
import io.antedb.exppairs.proof.ProofSearch;
import io.antedb.hypotheses.HypothesisSet;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
class NdjsonSearchTraceObserverTest {

    @TempDir
    Path tempDir;

    private static List<JsonObject> parse(String ndjson) {
        List<JsonObject> events = new ArrayList<>();
        for (String line : ndjson.split("\n")) {
            if (!line.isBlank()) {
                events.add(JsonParser.parseString(line).getAsJsonObject());
            }
        }
        return events;
    }

    @Test
    void proofSearchEmitsOneLinePerEvent() {
        StringWriter out = new StringWriter();
        NdjsonSearchTraceObserver observer = new NdjsonSearchTraceObserver(out);
        ExpPairSearchConfig config = new ExpPairSearchConfig(3, true, 100, 1e-10);
        HypothesisSet set = new HypothesisSet(List.of(ExponentPairs.TRIVIAL,
            VanDerCorput.A_TRANSFORM, VanDerCorput.B_TRANSFORM));

        new ProofSearch(config, observer).findProof(ExpPair.of(1, 6, 2, 3), set, true).orElseThrow();

        List<JsonObject> events = parse(out.toString());
        assertThat(events).extracting(e -> e.get("event").getAsString())
            .containsExactly("beta_pairs_derived", "closure_round", "closure_round", "closure_round", "proof_found");
        assertEquals(0, events.get(0).get("pairs").getAsInt());
        assertEquals(3, events.get(3).get("round").getAsInt());

        JsonObject proof = events.get(4);
        assertEquals("1/6", proof.getAsJsonObject("pair").get("k").getAsString());
        assertEquals("2/3", proof.getAsJsonObject("pair").get("l").getAsString());
        assertTrue(proof.has("timestamp"));
        assertFalse(proof.getAsJsonArray("dependencies").isEmpty());
    }

    @Test
    void writesToFile() throws IOException {
        Path trace = tempDir.resolve("trace.ndjson");
        try (NdjsonSearchTraceObserver observer = new NdjsonSearchTraceObserver(trace)) {
            observer.onYearConsidered(1922, 3);
            observer.onClosureRound(1, 2);
        }

        List<JsonObject> events = parse(Files.readString(trace));
        assertEquals(2, events.size());
        assertEquals("year_considered", events.get(0).get("event").getAsString());
        assertEquals(1922, events.get(0).get("year").getAsInt());
        assertEquals(3, events.get(0).get("hypotheses").getAsInt());
    }

    @Test
    void closingLeavesCallerWriterOpen() throws IOException {
        AtomicBoolean closed = new AtomicBoolean();
        StringWriter out = new StringWriter() {
            @Override
            public void close() throws IOException {
                closed.set(true);
                super.close();
            }
        };

        NdjsonSearchTraceObserver observer = new NdjsonSearchTraceObserver(out);
        observer.onBetaPairsDerived(2);
        observer.close();

        assertFalse(closed.get());
        List<JsonObject> events = parse(out.toString());
        assertEquals(1, events.size());
        assertEquals(2, events.get(0).get("pairs").getAsInt());
    }
}
