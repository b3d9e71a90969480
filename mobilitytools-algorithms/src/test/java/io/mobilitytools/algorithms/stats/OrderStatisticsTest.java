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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;

@Tag("unit")
public class OrderStatisticsTest {

    @Test
    void selectKthMatchesSortedRankOnRandomInputs() {
        Random random = new Random(12345);
        for (int trial = 0; trial < 200; trial++) {
            int n = 1 + random.nextInt(60);
            double[] values = new double[n];
            for (int i = 0; i < n; i++) {
                // small range forces plenty of duplicates
                values[i] = random.nextInt(20) - 5;
            }
            double[] sorted = values.clone();
            Arrays.sort(sorted);
            for (int k = 0; k < n; k++) {
                assertThat(OrderStatistics.selectKth(values, k)).isEqualTo(sorted[k]);
            }
        }
    }

    @Test
    void selectKthLeavesInputUntouched() {
        double[] values = {9, 1, 8, 2, 7, 3};
        double[] before = values.clone();
        OrderStatistics.selectKth(values, 2);
        assertThat(values).containsExactly(before);
    }

    @Test
    void selectKthHandlesSortedAndReversedRuns() {
        int n = 20_000;
        double[] ascending = new double[n];
        double[] descending = new double[n];
        for (int i = 0; i < n; i++) {
            ascending[i] = i;
            descending[i] = n - i;
        }
        assertThat(OrderStatistics.selectKth(ascending, 0)).isEqualTo(0.0);
        assertThat(OrderStatistics.selectKth(descending, n - 1)).isEqualTo((double) n);
    }

    @Test
    void selectionStaysLinearOnAllEqualValues() {
        double[] values = new double[500_000];
        Arrays.fill(values, 1.0);
        assertTimeoutPreemptively(Duration.ofSeconds(10), () -> {
            assertThat(OrderStatistics.median(values)).isEqualTo(1.0);
            assertThat(OrderStatistics.selectKth(values, 123_456)).isEqualTo(1.0);
            assertThat(OrderStatistics.percentile(values, 95)).isEqualTo(1.0);
        });
    }

    @Test
    void selectionStaysLinearOnFewDistinctValues() {
        // passenger-count shaped column: seven distinct values
        Random random = new Random(42);
        double[] values = new double[500_000];
        for (int i = 0; i < values.length; i++) {
            values[i] = random.nextInt(7);
        }
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        int n = values.length;
        assertTimeoutPreemptively(Duration.ofSeconds(10), () -> {
            assertThat(OrderStatistics.median(values)).isEqualTo((sorted[n / 2 - 1] + sorted[n / 2]) / 2.0);
            for (int k : new int[]{0, n / 4, n / 2, 3 * n / 4, n - 1}) {
                assertThat(OrderStatistics.selectKth(values, k)).isEqualTo(sorted[k]);
            }
        });
    }

    @Test
    void selectKthRejectsEmptyInput() {
        assertThrows(IllegalArgumentException.class, () -> OrderStatistics.selectKth(new double[0], 0));
    }

    @Test
    void selectKthRejectsRankOutOfRange() {
        double[] values = {1, 2, 3};
        assertThrows(IllegalArgumentException.class, () -> OrderStatistics.selectKth(values, -1));
        assertThrows(IllegalArgumentException.class, () -> OrderStatistics.selectKth(values, 3));
    }

    @Test
    void percentileOfTenEvenlySpacedValues() {
        double[] values = {10, 20, 30, 40, 50, 60, 70, 80, 90, 100};
        double p95 = OrderStatistics.percentile(values, 95);
        assertThat(p95).isBetween(90.0, 100.0);
        assertThat(p95).isEqualTo(100.0);
        assertThat(OrderStatistics.percentile(values, 0)).isEqualTo(10.0);
        assertThat(OrderStatistics.percentile(values, 100)).isEqualTo(100.0);
        assertThat(OrderStatistics.percentile(values, 50)).isEqualTo(60.0);
    }

    @Test
    void percentileRejectsOutOfRangeP() {
        double[] values = {1, 2, 3};
        assertThrows(IllegalArgumentException.class, () -> OrderStatistics.percentile(values, -0.1));
        assertThrows(IllegalArgumentException.class, () -> OrderStatistics.percentile(values, 100.5));
        assertThrows(IllegalArgumentException.class, () -> OrderStatistics.percentile(values, Double.NaN));
    }

    @Test
    void percentileAndMedianOfEmptyInputAreZero() {
        assertThat(OrderStatistics.percentile(new double[0], 50)).isEqualTo(0.0);
        assertThat(OrderStatistics.median(new double[0])).isEqualTo(0.0);
    }

    @Test
    void medianOfOddAndEvenCounts() {
        assertThat(OrderStatistics.median(new double[]{5, 1, 3})).isEqualTo(3.0);
        assertThat(OrderStatistics.median(new double[]{4, 1, 3, 2})).isEqualTo(2.5);
        assertThat(OrderStatistics.median(new double[]{7})).isEqualTo(7.0);
    }

    @Test
    void iqrFlagsTheInjectedExtremes() {
        double[] values = {10, 12, 14, 16, 18, 20, 22, 24, 26, 28, 100, 150};
        List<IndexedValue> outliers = OrderStatistics.detectOutliersIQR(values);
        assertThat(outliers).containsExactly(new IndexedValue(10, 100.0), new IndexedValue(11, 150.0));
    }

    @Test
    void iqrFlagsLowOutliersToo() {
        double[] values = {-500, 10, 11, 12, 13, 14, 15, 16};
        assertThat(OrderStatistics.detectOutliersIQR(values)).containsExactly(new IndexedValue(0, -500.0));
    }

    @Test
    void iqrNeedsAtLeastFourValues() {
        assertThat(OrderStatistics.detectOutliersIQR(new double[]{1, 2, 1000})).isEmpty();
        assertThat(OrderStatistics.detectOutliersIQR(new double[0])).isEmpty();
    }

    @Test
    void meanAndPopulationStdDev() {
        double[] values = {2, 4, 4, 4, 5, 5, 7, 9};
        double mean = OrderStatistics.mean(values);
        assertThat(mean).isEqualTo(5.0);
        assertThat(OrderStatistics.populationStdDev(values, mean)).isCloseTo(2.0, within(1e-12));
        assertThat(OrderStatistics.mean(new double[0])).isEqualTo(0.0);
    }
}
