package io.mobilitytools.algorithms.stats;

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
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Order statistics computed by selection rather than by sorting.
 *
 * <h2>Purpose</h2>
 *
 * <p>Answers rank queries (k-th smallest, percentile, median, quartiles) over a
 * snapshot of numeric values in expected linear time. Every public method works on
 * a private copy of the caller's array, so the input is never reordered.
 *
 * <h2>Selection</h2>
 *
 * <p>{@link #selectKth(double[], int)} is a quickselect with a fixed middle-index
 * pivot and a three-way partition:
 *
 * <pre>{@code
 *   pivot = work[(left + right) / 2]
 *   [left, lt)      values <  pivot
 *   [lt, gt]        values == pivot
 *   (gt, right]     values >  pivot
 *   stop if lt <= k <= gt, else descend into the side that holds k
 * }</pre>
 *
 * <p>The descent is a loop over a shrinking {@code [left, right]} range instead of
 * recursion, so stack depth stays constant. A pass removes the whole band of values
 * equal to the pivot, so columns with few distinct values select in linear time.
 * The pivot choice is deterministic; adversarial inputs can still force O(n²)
 * comparisons.
 *
 * <h2>Thread Safety</h2>
 *
 * <p>Stateless. Safe to call from any number of threads on independent inputs.
 */
public final class OrderStatistics {

    private OrderStatistics() {
        // Utility class
    }

    /**
     * Returns the value that would occupy position {@code k} if {@code values}
     * were sorted ascending.
     *
     * @param values the input values, left unmodified
     * @param k zero-based rank
     * @return the k-th smallest value
     * @throws IllegalArgumentException if {@code values} is empty or {@code k} is out of range
     */
    public static double selectKth(double[] values, int k) {
        Objects.requireNonNull(values, "values cannot be null");
        return selectInPlace(Arrays.copyOf(values, values.length), k);
    }

    /**
     * Returns the value at percentile {@code p}, using the rank
     * {@code round((p / 100) * (n - 1))}.
     *
     * @param values the input values, left unmodified
     * @param p percentile in [0, 100]
     * @return the percentile value, or 0.0 when {@code values} is empty
     * @throws IllegalArgumentException if {@code p} is outside [0, 100]
     */
    public static double percentile(double[] values, double p) {
        Objects.requireNonNull(values, "values cannot be null");
        if (Double.isNaN(p) || p < 0.0 || p > 100.0) {
            throw new IllegalArgumentException("percentile must be in [0, 100], got: " + p);
        }
        if (values.length == 0) {
            return 0.0;
        }
        int k = (int) Math.round((p / 100.0) * (values.length - 1));
        return selectInPlace(Arrays.copyOf(values, values.length), k);
    }

    /**
     * Returns the median. For an even count this is the mean of the two middle
     * order statistics, each selected independently.
     *
     * @param values the input values, left unmodified
     * @return the median, or 0.0 when {@code values} is empty
     */
    public static double median(double[] values) {
        Objects.requireNonNull(values, "values cannot be null");
        int n = values.length;
        if (n == 0) {
            return 0.0;
        }
        if (n % 2 == 1) {
            return selectInPlace(Arrays.copyOf(values, n), n / 2);
        }
        double lower = selectInPlace(Arrays.copyOf(values, n), n / 2 - 1);
        double upper = selectInPlace(Arrays.copyOf(values, n), n / 2);
        return (lower + upper) / 2.0;
    }

    /**
     * Flags values outside the Tukey fences {@code [Q1 - 1.5·IQR, Q3 + 1.5·IQR]},
     * with Q1 taken at rank {@code n/4} and Q3 at rank {@code 3n/4}.
     *
     * @param values the input values, left unmodified
     * @return outliers in input order; empty when fewer than 4 values are given
     */
    public static List<IndexedValue> detectOutliersIQR(double[] values) {
        Objects.requireNonNull(values, "values cannot be null");
        int n = values.length;
        List<IndexedValue> outliers = new ArrayList<>();
        if (n < 4) {
            return outliers;
        }

        double q1 = selectInPlace(Arrays.copyOf(values, n), n / 4);
        double q3 = selectInPlace(Arrays.copyOf(values, n), 3 * n / 4);
        double iqr = q3 - q1;
        double lowerFence = q1 - 1.5 * iqr;
        double upperFence = q3 + 1.5 * iqr;

        for (int i = 0; i < n; i++) {
            if (values[i] < lowerFence || values[i] > upperFence) {
                outliers.add(new IndexedValue(i, values[i]));
            }
        }
        return outliers;
    }

    /// Arithmetic mean by explicit accumulation; 0.0 for an empty array.
    public static double mean(double[] values) {
        Objects.requireNonNull(values, "values cannot be null");
        if (values.length == 0) {
            return 0.0;
        }
        double total = 0.0;
        for (double v : values) {
            total += v;
        }
        return total / values.length;
    }

    /// Population standard deviation around a known mean; 0.0 for an empty array.
    public static double populationStdDev(double[] values, double mean) {
        Objects.requireNonNull(values, "values cannot be null");
        if (values.length == 0) {
            return 0.0;
        }
        double total = 0.0;
        for (double v : values) {
            double diff = v - mean;
            total += diff * diff;
        }
        return Math.sqrt(total / values.length);
    }

    /// Quickselect over `work`, which is reordered.
    static double selectInPlace(double[] work, int k) {
        if (work.length == 0) {
            throw new IllegalArgumentException("values cannot be empty");
        }
        if (k < 0 || k >= work.length) {
            throw new IllegalArgumentException("k must be in [0, " + (work.length - 1) + "], got: " + k);
        }

        int left = 0;
        int right = work.length - 1;
        while (left < right) {
            double pivot = work[(left + right) >>> 1];
            int lt = left;
            int gt = right;
            int i = left;
            while (i <= gt) {
                if (work[i] < pivot) {
                    swap(work, lt++, i++);
                } else if (work[i] > pivot) {
                    swap(work, i, gt--);
                } else {
                    i++;
                }
            }
            if (k < lt) {
                right = lt - 1;
            } else if (k > gt) {
                left = gt + 1;
            } else {
                return work[k];
            }
        }
        return work[left];
    }

    private static void swap(double[] work, int i, int j) {
        double tmp = work[i];
        work[i] = work[j];
        work[j] = tmp;
    }
}
