package io.mobilitytools.algorithms.heap;

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

import io.mobilitytools.algorithms.sort.MergeSort;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/// Bounded top-k selection over a [MinHeap].
///
/// # Algorithm
///
/// ```text
///   heap <- min-heap holding at most k entries
///   for each item:
///     if |heap| < k:               push(item)
///     else if item > heap.min:     pop(); push(item)
///   drain heap (ascending), reverse  ->  descending result
/// ```
///
/// Memory is O(k) regardless of input length and time is O(n log k). Only a
/// strictly greater value displaces the current minimum, so among equal values the
/// earliest seen are retained.
///
/// When `k >= n` every item is returned, ordered by a stable descending
/// [MergeSort], so ties keep their input order.
public final class TopK {

    private TopK() {
        // Utility class
    }

    /// @param items candidates as (value, payload)
    /// @param k number of items to keep
    /// @return up to `k` items, highest value first; empty when `k <= 0`
    public static <T> List<Scored<T>> findTopK(List<Scored<T>> items, int k) {
        Objects.requireNonNull(items, "items cannot be null");
        if (k <= 0) {
            return new ArrayList<>();
        }
        if (k >= items.size()) {
            return MergeSort.mergeSort(items, Comparator.comparingDouble((Scored<T> s) -> s.value()).reversed());
        }

        MinHeap<Double, Scored<T>> heap = new MinHeap<>();
        for (Scored<T> item : items) {
            if (heap.size() < k) {
                heap.push(item.value(), item);
            } else if (item.value() > heap.peek().orElseThrow().priority()) {
                heap.pop();
                heap.push(item.value(), item);
            }
        }

        List<Scored<T>> result = new ArrayList<>(heap.size());
        while (!heap.isEmpty()) {
            result.add(heap.pop().payload());
        }
        Collections.reverse(result);
        return result;
    }
}
