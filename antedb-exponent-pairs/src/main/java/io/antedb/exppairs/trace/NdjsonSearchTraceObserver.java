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

import io.antedb.exppairs.ExponentPairs;
import io.antedb.hypotheses.Hypothesis;
import io.antedb.hypotheses.json.AntedbGsonConfig;

import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// SearchObserver that writes NDJSON (newline-delimited JSON) trace files.
///
/// ## Output Format
///
/// ```json
/// {"event":"closure_round","round":1,"pairs":7,"timestamp":1234567890}
/// {"event":"year_considered","year":1989,"hypotheses":12,"timestamp":1234567891}
/// {"event":"proof_found","pair":{"k":"1/6","l":"2/3"},"year":"1989","dependencies":["..."],"timestamp":1234567892}
/// ```
///
/// ## Thread Safety
///
/// Writes are synchronized.
public final class NdjsonSearchTraceObserver implements SearchObserver, Closeable {

    private final BufferedWriter writer;
    private final boolean ownsWriter;
    private final Object writeLock = new Object();

    /// Creates an observer writing to a file, replacing any previous content.
    ///
    /// @param outputPath path to write trace output
    /// @throws IOException if the file cannot be opened for writing
    public NdjsonSearchTraceObserver(Path outputPath) throws IOException {
        this.writer = Files.newBufferedWriter(outputPath, StandardCharsets.UTF_8,
            StandardOpenOption.CREATE,
            StandardOpenOption.TRUNCATE_EXISTING,
            StandardOpenOption.WRITE);
        this.ownsWriter = true;
    }

    /// Creates an observer writing to a Writer. The caller keeps ownership:
    /// [#close()] flushes the writer but leaves it open.
    public NdjsonSearchTraceObserver(Writer writer) {
        this.writer = (writer instanceof BufferedWriter bw) ? bw : new BufferedWriter(writer);
        this.ownsWriter = false;
    }

    @Override
    public void onClosureRound(int round, int pairCount) {
        Map<String, Object> event = event("closure_round");
        event.put("round", round);
        event.put("pairs", pairCount);
        writeEvent(event);
    }

    @Override
    public void onBetaPairsDerived(int pairCount) {
        Map<String, Object> event = event("beta_pairs_derived");
        event.put("pairs", pairCount);
        writeEvent(event);
    }

    @Override
    public void onYearConsidered(int year, int hypothesisCount) {
        Map<String, Object> event = event("year_considered");
        event.put("year", year);
        event.put("hypotheses", hypothesisCount);
        writeEvent(event);
    }

    @Override
    public void onProofFound(Hypothesis proof) {
        Map<String, Object> event = event("proof_found");
        event.put("pair", ExponentPairs.pairOf(proof));
        event.put("year", proof.reference().year().toString());
        List<String> dependencies = new ArrayList<>();
        for (Hypothesis dependency : proof.dependencies()) {
            dependencies.add(dependency.name());
        }
        event.put("dependencies", dependencies);
        writeEvent(event);
    }

    private static Map<String, Object> event(String name) {
        Map<String, Object> event = new LinkedHashMap<>();
        event.put("event", name);
        return event;
    }

    private void writeEvent(Map<String, Object> event) {
        event.put("timestamp", System.currentTimeMillis());
        synchronized (writeLock) {
            try {
                writer.write(AntedbGsonConfig.compactGson().toJson(event));
                writer.newLine();
                writer.flush();
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to write trace event", e);
            }
        }
    }

    /// Closes the trace file, or only flushes a caller-owned writer.
    @Override
    public void close() throws IOException {
        synchronized (writeLock) {
            if (ownsWriter) {
                writer.close();
            } else {
                writer.flush();
            }
        }
    }
}
