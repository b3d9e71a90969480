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

import io.mobilitytools.algorithms.sort.MergeSort;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Z-score anomaly detection over a numeric series.
 *
 * <p>The mean and the population standard deviation are accumulated in two explicit
 * passes. A value is anomalous when {@code |x - mean| / sigma >= threshold}.
 *
 * <p>A series with zero spread (including a single value) has no anomalies and
 * yields an empty list, as does an empty series.
 */
public final class ZScoreDetector {

    public static final double DEFAULT_THRESHOLD = 3.0;

    private ZScoreDetector() {
        // Utility class
    }

    /**
     * @param values the series, left unmodified
     * @param threshold minimum |z| to report
     * @return anomalies ordered by descending |z|, ties in input order
     */
    public static List<Anomaly> detectAnomaliesZScore(double[] values, double threshold) {
        Objects.requireNonNull(values, "values cannot be null");
        List<Anomaly> anomalies = new ArrayList<>();
        int n = values.length;
        if (n == 0) {
            return anomalies;
        }

        double total = 0.0;
        for (double v : values) {
            total += v;
        }
        double mean = total / n;

        double squares = 0.0;
        for (double v : values) {
            double diff = v - mean;
            squares += diff * diff;
        }
        double sigma = Math.sqrt(squares / n);
        if (sigma == 0.0) {
            return anomalies;
        }

        for (int i = 0; i < n; i++) {
            double z = Math.abs((values[i] - mean) / sigma);
            if (z >= threshold) {
                anomalies.add(new Anomaly(i, values[i], z));
            }
        }
        return MergeSort.mergeSort(anomalies, Comparator.comparingDouble(Anomaly::zScore).reversed());
    }

    public static List<Anomaly> detectAnomaliesZScore(double[] values) {
        return detectAnomaliesZScore(values, DEFAULT_THRESHOLD);
    }
}
