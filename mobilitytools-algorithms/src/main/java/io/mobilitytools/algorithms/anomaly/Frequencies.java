package io.mobilitytools.algorithms.anomaly;

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

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// Occurrence counting.
public final class Frequencies {

    private Frequencies() {
        // Utility class
    }

    /// Counts how often each distinct item occurs. Keys keep first-occurrence order.
    public static <T> Map<T, Integer> frequencyMap(Iterable<? extends T> items) {
        Objects.requireNonNull(items, "items cannot be null");
        Map<T, Integer> counts = new LinkedHashMap<>();
        for (T item : items) {
            Integer seen = counts.get(item);
            counts.put(item, seen == null ? 1 : seen + 1);
        }
        return counts;
    }
}
