package io.mobilitytools.algorithms.sort;

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

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Stable top-down merge sort.
 *
 * <p>The input is copied into an array, halves are sorted recursively, and each merge
 * takes from the left run whenever its element compares {@code <=} the right run's
 * head. That tie rule is what keeps equal keys in their original relative order.
 * Recursion depth is {@code ceil(log2 n)}; one scratch array of size n is shared by
 * every merge.
 *
 * <p>The input list is never modified; a new list is returned.
 */
public final class MergeSort {

    private MergeSort() {
        // Utility class
    }

    /**
     * Sorts ascending by an extracted key.
     *
     * @param items the items to sort
     * @param key extracts the comparison key from each item
     * @return a new list sorted ascending by key
     */
    public static <T, K extends Comparable<? super K>> List<T> mergeSort(
        List<? extends T> items, Function<? super T, ? extends K> key) {
        Objects.requireNonNull(key, "key cannot be null");
        return mergeSort(items, (a, b) -> key.apply(a).compareTo(key.apply(b)));
    }

    /**
     * Sorts by a comparator. A reversed comparator gives a stable descending order.
     *
     * @param items the items to sort
     * @param comparator the ordering
     * @return a new list in comparator order
     */
    @SuppressWarnings("unchecked")
    public static <T> List<T> mergeSort(List<? extends T> items, Comparator<? super T> comparator) {
        Objects.requireNonNull(items, "items cannot be null");
        Objects.requireNonNull(comparator, "comparator cannot be null");
        Object[] work = items.toArray();
        if (work.length > 1) {
            sort(work, new Object[work.length], 0, work.length, (Comparator<Object>) comparator);
        }
        List<T> sorted = new ArrayList<>(work.length);
        for (Object o : work) {
            sorted.add((T) o);
        }
        return sorted;
    }

    /// Sorts `work[from, to)`.
    private static void sort(Object[] work, Object[] scratch, int from, int to, Comparator<Object> cmp) {
        if (to - from <= 1) {
            return;
        }
        int mid = (from + to) >>> 1;
        sort(work, scratch, from, mid, cmp);
        sort(work, scratch, mid, to, cmp);
        merge(work, scratch, from, mid, to, cmp);
    }

    private static void merge(Object[] work, Object[] scratch, int from, int mid, int to, Comparator<Object> cmp) {
        System.arraycopy(work, from, scratch, from, to - from);
        int i = from;
        int j = mid;
        int out = from;
        while (i < mid && j < to) {
            if (cmp.compare(scratch[i], scratch[j]) <= 0) {
                work[out++] = scratch[i++];
            } else {
                work[out++] = scratch[j++];
            }
        }
        while (i < mid) {
            work[out++] = scratch[i++];
        }
        while (j < to) {
            work[out++] = scratch[j++];
        }
    }
}
