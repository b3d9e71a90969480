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

import com.google.gson.JsonParseException;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

@Tag("unit")
public class AnalyticsConfigTest {

    @Test
    void defaultsApplyWhenNothingIsSet() {
        AnalyticsConfig config = AnalyticsConfig.defaults();
        assertThat(config.getHashBuckets()).isEqualTo(100);
        assertThat(config.getCacheCapacity()).isEqualTo(64);
        assertThat(config.getMovingAverageWindow()).isEqualTo(3);
        assertThat(config.getZscoreThreshold()).isEqualTo(3.0);
        assertThat(config.getDefaultPercentile()).isEqualTo(95.0);
        assertThat(config.getTopK()).isEqualTo(10);
    }

    @Test
    void partialJsonKeepsRemainingDefaults() {
        AnalyticsConfig config = AnalyticsConfig.fromJson("{\"top_k\": 3, \"zscore_threshold\": 2.5, \"unknown\": true}");
        assertThat(config.getTopK()).isEqualTo(3);
        assertThat(config.getZscoreThreshold()).isEqualTo(2.5);
        assertThat(config.getHashBuckets()).isEqualTo(AnalyticsConfig.DEFAULT_HASH_BUCKETS);
    }

    @Test
    void emptyDocumentIsAllDefaults() {
        assertThat(AnalyticsConfig.fromJson("").getCacheCapacity()).isEqualTo(64);
        assertThat(AnalyticsConfig.fromJson("{}").getMovingAverageWindow()).isEqualTo(3);
    }

    @Test
    void copyIsIndependent() {
        AnalyticsConfig original = AnalyticsConfig.fromJson("{\"top_k\": 4}");
        AnalyticsConfig copy = original.copy();
        copy.setTopK(9);
        assertThat(original.getTopK()).isEqualTo(4);
        assertThat(copy.getTopK()).isEqualTo(9);
        assertThat(copy.getCacheCapacity()).isEqualTo(AnalyticsConfig.DEFAULT_CACHE_CAPACITY);
    }

    @Test
    void invalidValuesAreRejected() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
            () -> AnalyticsConfig.fromJson("{\"hash_buckets\": 0}"));
        assertThat(e).hasMessageContaining("hash_buckets");
        assertThrows(IllegalArgumentException.class, () -> AnalyticsConfig.fromJson("{\"default_percentile\": 120}"));
        assertThrows(IllegalArgumentException.class, () -> AnalyticsConfig.fromJson("{\"zscore_threshold\": -1}"));
        assertThrows(IllegalArgumentException.class, () -> AnalyticsConfig.fromJson("{\"moving_average_window\": -2}"));
    }

    @Test
    void malformedJsonFailsToParse() {
        assertThrows(JsonParseException.class, () -> AnalyticsConfig.fromJson("{\"top_k\": [1, 2]}"));
    }

    @Test
    void savedFileLoadsBack(@TempDir Path tempDir) throws IOException {
        AnalyticsConfig config = AnalyticsConfig.defaults();
        config.setCacheCapacity(8);
        config.setDefaultPercentile(50.0);
        Path file = tempDir.resolve("analytics.json");
        config.saveToFile(file);

        assertThat(Files.readString(file)).contains("\"cache_capacity\": 8");
        AnalyticsConfig loaded = AnalyticsConfig.loadFromFile(file);
        assertThat(loaded.getCacheCapacity()).isEqualTo(8);
        assertThat(loaded.getDefaultPercentile()).isEqualTo(50.0);
        assertThat(loaded.getTopK()).isEqualTo(10);
    }

    @Test
    void missingFileIsAnIOException(@TempDir Path tempDir) {
        assertThrows(IOException.class, () -> AnalyticsConfig.loadFromFile(tempDir.resolve("absent.json")));
    }
}
