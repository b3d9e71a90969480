package io.mobilitytools.algorithms.window;

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

/**
 * Fixed-capacity window over a numeric stream with a running sum.
 *
 * <p>Values are held in a ring buffer. Each {@link #add(double)} adjusts the sum by
 * the value entering and, once the window is full, the value leaving, so the
 * moving average costs O(1) per update. {@link #min()} and {@link #max()} scan the
 * live window on demand.
 *
 * <p>Not synchronized.
 */
public class SlidingWindow {

    private final double[] ring;
    private int head;
    private int count;
    private double sum;

    /**
     * @param capacity the number of most recent values retained
     * @throws IllegalArgumentException if {@code capacity <= 0}
     */
    public SlidingWindow(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("window size must be positive, got: " + capacity);
        }
        this.ring = new double[capacity];
    }

    /**
     * Appends a value, evicting the oldest one when the window is already full.
     *
     * @return the average of the live window after the update
     */
    public double add(double value) {
        if (count < ring.length) {
            ring[(head + count) % ring.length] = value;
            count++;
        } else {
            sum -= ring[head];
            ring[head] = value;
            head = (head + 1) % ring.length;
        }
        sum += value;
        return average();
    }

    /// Average of the live window; 0.0 when nothing has been added.
    public double average() {
        return count == 0 ? 0.0 : sum / count;
    }

    /// Smallest live value; 0.0 when nothing has been added.
    public double min() {
        if (count == 0) {
            return 0.0;
        }
        double min = ring[head];
        for (int i = 1; i < count; i++) {
            min = Math.min(min, ring[(head + i) % ring.length]);
        }
        return min;
    }

    /// Largest live value; 0.0 when nothing has been added.
    public double max() {
        if (count == 0) {
            return 0.0;
        }
        double max = ring[head];
        for (int i = 1; i < count; i++) {
            max = Math.max(max, ring[(head + i) % ring.length]);
        }
        return max;
    }

    public double sum() {
        return sum;
    }

    public int size() {
        return count;
    }

    public int capacity() {
        return ring.length;
    }

    public boolean isFull() {
        return count == ring.length;
    }
}
