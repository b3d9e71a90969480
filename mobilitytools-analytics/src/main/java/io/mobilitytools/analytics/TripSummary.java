package io.mobilitytools.analytics;

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

/// Headline numbers for a dataset.
///
/// @param totalTrips number of valid trips
/// @param meanDurationSeconds mean trip duration
/// @param meanSpeedMph mean trip speed
/// @param meanFarePerMile mean fare per mile
/// @param medianDurationSeconds median trip duration
/// @param p95DurationSeconds 95th percentile trip duration
public record TripSummary(
    int totalTrips,
    double meanDurationSeconds,
    double meanSpeedMph,
    double meanFarePerMile,
    double medianDurationSeconds,
    double p95DurationSeconds
) {
}
