package io.mobilitytools.analytics.config;

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
import com.google.gson.annotations.SerializedName;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * JSON-serializable settings for {@link io.mobilitytools.analytics.TripAnalytics}.
 *
 * <h2>JSON Schema</h2>
 *
 * <p>Every field is optional; absent fields take the defaults shown.
 * <pre>{@code
 * {
 *   "hash_buckets": 100,
 *   "cache_capacity": 64,
 *   "moving_average_window": 3,
 *   "zscore_threshold": 3.0,
 *   "default_percentile": 95.0,
 *   "top_k": 10
 * }
 * }</pre>
 *
 * <p>Values are checked by {@link #validate()}, which every loading method calls
 * before returning.
 */
public class AnalyticsConfig {

    private static final Logger logger = LogManager.getLogger(AnalyticsConfig.class);
    private static final Gson GSON = AnalyticsGson.gson();

    public static final int DEFAULT_HASH_BUCKETS = 100;
    public static final int DEFAULT_CACHE_CAPACITY = 64;
    public static final int DEFAULT_MOVING_AVERAGE_WINDOW = 3;
    public static final double DEFAULT_ZSCORE_THRESHOLD = 3.0;
    public static final double DEFAULT_PERCENTILE = 95.0;
    public static final int DEFAULT_TOP_K = 10;

    /** Bucket count of the vendor and location lookup tables */
    @SerializedName("hash_buckets")
    private Integer hashBuckets;

    /** Number of memoized query results */
    @SerializedName("cache_capacity")
    private Integer cacheCapacity;

    @SerializedName("moving_average_window")
    private Integer movingAverageWindow;

    /** Minimum |z| for a fare to count as anomalous */
    @SerializedName("zscore_threshold")
    private Double zscoreThreshold;

    @SerializedName("default_percentile")
    private Double defaultPercentile;

    @SerializedName("top_k")
    private Integer topK;

    public AnalyticsConfig() {
    }

    /** A configuration with every field at its default. */
    public static AnalyticsConfig defaults() {
        return new AnalyticsConfig();
    }

    /** An independent copy carrying the same explicitly set values. */
    public AnalyticsConfig copy() {
        AnalyticsConfig copy = new AnalyticsConfig();
        copy.hashBuckets = hashBuckets;
        copy.cacheCapacity = cacheCapacity;
        copy.movingAverageWindow = movingAverageWindow;
        copy.zscoreThreshold = zscoreThreshold;
        copy.defaultPercentile = defaultPercentile;
        copy.topK = topK;
        return copy;
    }

    public int getHashBuckets() {
        return hashBuckets != null ? hashBuckets : DEFAULT_HASH_BUCKETS;
    }

    public void setHashBuckets(Integer hashBuckets) {
        this.hashBuckets = hashBuckets;
    }

    public int getCacheCapacity() {
        return cacheCapacity != null ? cacheCapacity : DEFAULT_CACHE_CAPACITY;
    }

    public void setCacheCapacity(Integer cacheCapacity) {
        this.cacheCapacity = cacheCapacity;
    }

    public int getMovingAverageWindow() {
        return movingAverageWindow != null ? movingAverageWindow : DEFAULT_MOVING_AVERAGE_WINDOW;
    }

    public void setMovingAverageWindow(Integer movingAverageWindow) {
        this.movingAverageWindow = movingAverageWindow;
    }

    public double getZscoreThreshold() {
        return zscoreThreshold != null ? zscoreThreshold : DEFAULT_ZSCORE_THRESHOLD;
    }

    public void setZscoreThreshold(Double zscoreThreshold) {
        this.zscoreThreshold = zscoreThreshold;
    }

    public double getDefaultPercentile() {
        return defaultPercentile != null ? defaultPercentile : DEFAULT_PERCENTILE;
    }

    public void setDefaultPercentile(Double defaultPercentile) {
        this.defaultPercentile = defaultPercentile;
    }

    public int getTopK() {
        return topK != null ? topK : DEFAULT_TOP_K;
    }

    public void setTopK(Integer topK) {
        this.topK = topK;
    }

    /**
     * Checks every effective value.
     *
     * @return this configuration
     * @throws IllegalArgumentException naming the first invalid setting
     */
    public AnalyticsConfig validate() {
        requirePositive("hash_buckets", getHashBuckets());
        requirePositive("cache_capacity", getCacheCapacity());
        requirePositive("moving_average_window", getMovingAverageWindow());
        requirePositive("top_k", getTopK());
        double threshold = getZscoreThreshold();
        if (Double.isNaN(threshold) || threshold < 0) {
            throw new IllegalArgumentException("zscore_threshold must be non-negative, got: " + threshold);
        }
        double percentile = getDefaultPercentile();
        if (Double.isNaN(percentile) || percentile < 0 || percentile > 100) {
            throw new IllegalArgumentException("default_percentile must be in [0, 100], got: " + percentile);
        }
        return this;
    }

    private static void requirePositive(String name, int value) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be positive, got: " + value);
        }
    }

    /**
     * Parses and validates a configuration from JSON.
     *
     * @throws com.google.gson.JsonParseException if the JSON is malformed
     */
    public static AnalyticsConfig fromJson(String json) {
        AnalyticsConfig config = GSON.fromJson(json, AnalyticsConfig.class);
        return (config != null ? config : defaults()).validate();
    }

    /**
     * Parses and validates a configuration from a reader.
     */
    public static AnalyticsConfig fromJson(Reader reader) {
        AnalyticsConfig config = GSON.fromJson(reader, AnalyticsConfig.class);
        return (config != null ? config : defaults()).validate();
    }

    public String toJson() {
        return GSON.toJson(this);
    }

    public void toJson(Writer writer) {
        GSON.toJson(this, writer);
    }

    /**
     * Loads a configuration file.
     *
     * @param path the JSON file
     * @return the validated configuration
     * @throws IOException if the file cannot be read
     */
    public static AnalyticsConfig loadFromFile(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path)) {
            AnalyticsConfig config = fromJson(reader);
            logger.info("Loaded analytics configuration from {}", path);
            return config;
        }
    }

    /**
     * Writes this configuration as JSON.
     *
     * @throws IOException if the file cannot be written
     */
    public void saveToFile(Path path) throws IOException {
        try (Writer writer = Files.newBufferedWriter(path)) {
            toJson(writer);
        }
    }

    @Override
    public String toString() {
        return toJson();
    }
}
