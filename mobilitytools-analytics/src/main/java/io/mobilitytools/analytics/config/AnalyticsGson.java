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
import com.google.gson.GsonBuilder;

import java.time.LocalDateTime;

/// Centralized Gson configuration for analytics results and configuration files.
///
/// ## Usage
///
/// ```java
/// Map<Integer, Double> times = analytics.fastestTravelTimes(10);
/// String json = AnalyticsGson.gson().toJson(times);
/// // {"10": 0.0, "11": 455.0, "12": Infinity}
/// ```
///
/// ## Configuration
///
/// | Feature | Setting | Purpose |
/// |---------|---------|---------|
/// | Pretty printing | Enabled (except [#compactGson()]) | Readable reports |
/// | HTML escaping | Disabled | Vendor names pass through unchanged |
/// | Special floating-point values | Allowed | Unreachable distances are `Infinity` |
/// | `LocalDateTime` adapter | Registered | Trip timestamps as ISO-8601 |
///
/// The returned instances are thread-safe and shared.
public final class AnalyticsGson {

    private static final Gson INSTANCE = builder().setPrettyPrinting().create();
    private static final Gson COMPACT = builder().create();

    private AnalyticsGson() {
        // Utility class
    }

    /// Shared pretty-printing instance.
    public static Gson gson() {
        return INSTANCE;
    }

    /// Shared single-line instance, for NDJSON style output.
    public static Gson compactGson() {
        return COMPACT;
    }

    /// A fresh builder with the analytics defaults, for further customization.
    public static GsonBuilder builder() {
        return new GsonBuilder()
            .disableHtmlEscaping()
            .serializeSpecialFloatingPointValues()
            .registerTypeAdapter(LocalDateTime.class, new LocalDateTimeAdapter());
    }
}
