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

/// A value flagged by [ZScoreDetector].
///
/// @param index position of the value in the input
/// @param value the flagged value
/// @param zScore absolute standardized distance from the mean
public record Anomaly(int index, double value, double zScore) {
}
