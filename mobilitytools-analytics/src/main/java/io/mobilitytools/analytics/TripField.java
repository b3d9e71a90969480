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

import io.mobilitytools.analytics.model.TripRecord;

import java.util.List;
import java.util.function.ToDoubleFunction;

/// Numeric trip attributes that rank and percentile queries can target.
///
/// Each constant carries the snake_case name used by request parameters, so
/// `field=trip_duration` resolves through [#fromName(String)].
public enum TripField {

    TRIP_DURATION("trip_duration", TripRecord::durationSeconds),
    TRIP_DISTANCE("trip_distance", TripRecord::tripDistance),
    FARE_AMOUNT("fare_amount", TripRecord::fareAmount),
    PASSENGER_COUNT("passenger_count", TripRecord::passengerCount),
    SPEED_MPH("speed_mph", TripRecord::speedMph),
    FARE_PER_MILE("fare_per_mile", TripRecord::farePerMile);

    private final String fieldName;
    private final ToDoubleFunction<TripRecord> extractor;

    TripField(String fieldName, ToDoubleFunction<TripRecord> extractor) {
        this.fieldName = fieldName;
        this.extractor = extractor;
    }

    public String fieldName() {
        return fieldName;
    }

    public double valueOf(TripRecord trip) {
        return extractor.applyAsDouble(trip);
    }

    /// Extracts this field from every trip, in trip order.
    public double[] extract(List<TripRecord> trips) {
        double[] values = new double[trips.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = extractor.applyAsDouble(trips.get(i));
        }
        return values;
    }

    /// @throws IllegalArgumentException for an unknown field name
    public static TripField fromName(String name) {
        for (TripField field : values()) {
            if (field.fieldName.equals(name)) {
                return field;
            }
        }
        throw new IllegalArgumentException("Unknown trip field: " + name);
    }
}
