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

import com.google.gson.JsonParseException;
import com.google.gson.annotations.SerializedName;
import io.antedb.hypotheses.bound.NumericPrecision;
import io.antedb.hypotheses.geometry.ConvexHulls;
import io.antedb.hypotheses.json.AntedbGsonConfig;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * JSON-serializable configuration of exponent pair searches.
 *
 * <h2>JSON Schema</h2>
 *
 * <pre>{@code
 * {
 *   "search_depth": 5,          // rounds of transform application
 *   "prune": true,              // keep only hull vertices after each round
 *   "precision_digits": 1000,   // decimal digits for inexact bound evaluation
 *   "hull_tolerance": 1e-10     // tolerance of the floating-point hull generator
 * }
 * }</pre>
 *
 * <p>Every field is optional; missing fields take the defaults shown above.
 * The precision is fixed for the lifetime of a search: it is read once when
 * the search is built and handed down read-only.
 *
 * @see io.antedb.exppairs.proof.ProofSearch
 */
public class ExpPairSearchConfig {

    /** Classpath resource holding the shipped defaults. */
    public static final String DEFAULTS_RESOURCE = "/antedb-exppairs-defaults.json";

    public static final int DEFAULT_SEARCH_DEPTH = 5;
    public static final boolean DEFAULT_PRUNE = true;

    @SerializedName("search_depth")
    private Integer searchDepth;

    @SerializedName("prune")
    private Boolean prune;

    @SerializedName("precision_digits")
    private Integer precisionDigits;

    @SerializedName("hull_tolerance")
    private Double hullTolerance;

    public ExpPairSearchConfig() {
    }

    /**
     * Creates a fully specified configuration.
     */
    public ExpPairSearchConfig(int searchDepth, boolean prune, int precisionDigits, double hullTolerance) {
        this.searchDepth = searchDepth;
        this.prune = prune;
        this.precisionDigits = precisionDigits;
        this.hullTolerance = hullTolerance;
        validate();
    }

    /**
     * Returns a configuration with all defaults.
     */
    public static ExpPairSearchConfig defaults() {
        return new ExpPairSearchConfig(DEFAULT_SEARCH_DEPTH, DEFAULT_PRUNE,
            NumericPrecision.DEFAULT.digits(), ConvexHulls.DEFAULT_TOLERANCE);
    }

    /**
     * Loads the defaults shipped on the classpath.
     *
     * @return the configuration
     * @throws IOException if the resource is missing or malformed
     */
    public static ExpPairSearchConfig loadDefaults() throws IOException {
        try (InputStream in = ExpPairSearchConfig.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in == null) {
                throw new IOException("Missing classpath resource " + DEFAULTS_RESOURCE);
            }
            return fromJson(new InputStreamReader(in, StandardCharsets.UTF_8), DEFAULTS_RESOURCE);
        }
    }

    /**
     * Loads a configuration from a JSON file.
     *
     * @param path the file
     * @return the validated configuration
     * @throws IOException if the file cannot be read or is malformed
     */
    public static ExpPairSearchConfig load(Path path) throws IOException {
        Objects.requireNonNull(path, "path cannot be null");
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return fromJson(reader, path.toString());
        }
    }

    /**
     * Reads a configuration from JSON.
     *
     * @param reader the JSON source
     * @param source a name for the source, used in error messages
     * @return the validated configuration
     * @throws IOException if the JSON is malformed or holds invalid values
     */
    public static ExpPairSearchConfig fromJson(Reader reader, String source) throws IOException {
        Objects.requireNonNull(reader, "reader cannot be null");
        ExpPairSearchConfig config;
        try {
            config = AntedbGsonConfig.gson().fromJson(reader, ExpPairSearchConfig.class);
        } catch (JsonParseException e) {
            throw new IOException("Malformed search configuration in " + source + ": " + e.getMessage(), e);
        }
        if (config == null) {
            config = new ExpPairSearchConfig();
        }
        try {
            config.validate();
        } catch (IllegalArgumentException e) {
            throw new IOException("Invalid search configuration in " + source + ": " + e.getMessage(), e);
        }
        return config;
    }

    /**
     * Serializes this configuration as pretty-printed JSON.
     */
    public String toJson() {
        return AntedbGsonConfig.gson().toJson(this);
    }

    /**
     * Checks the configured values.
     *
     * @throws IllegalArgumentException if a value is out of range
     */
    public void validate() {
        if (searchDepth != null && searchDepth < 0) {
            throw new IllegalArgumentException("search_depth must not be negative, got " + searchDepth);
        }
        if (precisionDigits != null && precisionDigits <= 0) {
            throw new IllegalArgumentException("precision_digits must be positive, got " + precisionDigits);
        }
        if (hullTolerance != null && !(hullTolerance > 0.0)) {
            throw new IllegalArgumentException("hull_tolerance must be positive, got " + hullTolerance);
        }
    }

    public int getSearchDepth() {
        return searchDepth != null ? searchDepth : DEFAULT_SEARCH_DEPTH;
    }

    public void setSearchDepth(Integer searchDepth) {
        this.searchDepth = searchDepth;
    }

    public boolean isPrune() {
        return prune != null ? prune : DEFAULT_PRUNE;
    }

    public void setPrune(Boolean prune) {
        this.prune = prune;
    }

    public int getPrecisionDigits() {
        return precisionDigits != null ? precisionDigits : NumericPrecision.DEFAULT.digits();
    }

    public void setPrecisionDigits(Integer precisionDigits) {
        this.precisionDigits = precisionDigits;
    }

    public double getHullTolerance() {
        return hullTolerance != null ? hullTolerance : ConvexHulls.DEFAULT_TOLERANCE;
    }

    public void setHullTolerance(Double hullTolerance) {
        this.hullTolerance = hullTolerance;
    }

    /**
     * Returns the numeric precision for bound evaluation.
     */
    public NumericPrecision numericPrecision() {
        return new NumericPrecision(getPrecisionDigits());
    }

    @Override
    public String toString() {
        return "ExpPairSearchConfig{searchDepth=" + getSearchDepth() + ", prune=" + isPrune()
            + ", precisionDigits=" + getPrecisionDigits() + ", hullTolerance=" + getHullTolerance() + "}";
    }
}
