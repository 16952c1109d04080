package io.antedb.hypotheses.json;

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

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import org.apache.commons.math3.fraction.BigFraction;

/// Centralized Gson configuration for antedb.
///
/// ## Configuration
///
/// | Feature | Setting | Purpose |
/// |---------|---------|---------|
/// | Pretty printing | Enabled ([#gson()]) / disabled ([#compactGson()]) | Readable files / NDJSON lines |
/// | HTML escaping | Disabled | Keep `<=` and `/` readable |
/// | BigFraction adapter | Registered | Exact `"p/q"` rationals |
///
/// ## Thread Safety
///
/// [Gson] instances are thread-safe and shared.
///
/// @see BigFractionTypeAdapter
public final class AntedbGsonConfig {

    private static final Gson INSTANCE = builder().create();
    private static final Gson COMPACT = compactBuilder().create();

    private AntedbGsonConfig() {
        // Utility class
    }

    /// Returns the shared pretty-printing Gson instance.
    public static Gson gson() {
        return INSTANCE;
    }

    /// Returns the shared compact Gson instance, one record per line.
    public static Gson compactGson() {
        return COMPACT;
    }

    /// Creates a new GsonBuilder with antedb defaults, for further customization.
    public static GsonBuilder builder() {
        return compactBuilder().setPrettyPrinting();
    }

    private static GsonBuilder compactBuilder() {
        return new GsonBuilder()
            .disableHtmlEscaping()
            .registerTypeAdapter(BigFraction.class, new BigFractionTypeAdapter().nullSafe());
    }
}
