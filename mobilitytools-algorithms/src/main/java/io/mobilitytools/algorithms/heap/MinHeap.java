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

import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;

/**
 * Array-backed binary min-heap of (priority, payload) entries.
 *
 * <p>Index {@code i} has children {@code 2i+1} and {@code 2i+2}; every parent's
 * priority is {@code <=} both children's. {@link #push} appends and sifts up;
 * {@link #pop} swaps the root with the last slot, removes it, and sifts the new root
 * down. There is no decrease-key: callers that need one push a fresh entry and skip
 * stale ones on the way out.
 *
 * <p>Not synchronized.
 *
 * @param <P> orderable priority type
 * @param <T> payload type
 */
public class MinHeap<P extends Comparable<? super P>, T> {

    private final List<HeapEntry<P, T>> heap = new ArrayList<>();

    public void push(P priority, T payload) {
        Objects.requireNonNull(priority, "priority cannot be null");
        heap.add(new HeapEntry<>(priority, payload));
        siftUp(heap.size() - 1);
    }

    /**
     * Removes and returns the entry with the smallest priority.
     *
     * @throws NoSuchElementException if the heap is empty
     */
    public HeapEntry<P, T> pop() {
        if (heap.isEmpty()) {
            throw new NoSuchElementException("heap is empty");
        }
        int last = heap.size() - 1;
        swap(0, last);
        HeapEntry<P, T> min = heap.remove(last);
        if (!heap.isEmpty()) {
            siftDown(0);
        }
        return min;
    }

    /// The smallest entry without removing it.
    public Optional<HeapEntry<P, T>> peek() {
        return heap.isEmpty() ? Optional.empty() : Optional.of(heap.get(0));
    }

    public int size() {
        return heap.size();
    }

    public boolean isEmpty() {
        return heap.isEmpty();
    }

    private void siftUp(int pos) {
        while (pos > 0) {
            int parent = (pos - 1) >>> 1;
            if (less(pos, parent)) {
                swap(pos, parent);
                pos = parent;
            } else {
                break;
            }
        }
    }

    private void siftDown(int pos) {
        int size = heap.size();
        while (true) {
            int left = (pos << 1) + 1;
            int right = left + 1;
            int smallest = pos;

            if (left < size && less(left, smallest)) {
                smallest = left;
            }
            if (right < size && less(right, smallest)) {
                smallest = right;
            }
            if (smallest == pos) {
                return;
            }
            swap(pos, smallest);
            pos = smallest;
        }
    }

    private boolean less(int i, int j) {
        return heap.get(i).priority().compareTo(heap.get(j).priority()) < 0;
    }

    private void swap(int i, int j) {
        HeapEntry<P, T> tmp = heap.get(i);
        heap.set(i, heap.get(j));
        heap.set(j, tmp);
    }
}
