package io.mobilitytools.analytics.model;

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

/// A pickup or dropoff point.
///
/// @param locationId location identifier
/// @param latitude degrees in [-90, 90]
/// @param longitude degrees in [-180, 180]
public record Location(int locationId, double latitude, double longitude) {

    /// @throws IllegalArgumentException if either coordinate is out of range
    public void validate() {
        if (!(longitude >= -180 && longitude <= 180)) {
            throw new IllegalArgumentException("Longitude must be between -180 and 180, got: " + longitude);
        }
        if (!(latitude >= -90 && latitude <= 90)) {
            throw new IllegalArgumentException("Latitude must be between -90 and 90, got: " + latitude);
        }
    }
}
