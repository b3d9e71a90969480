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

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Objects;

/**
 * One taxi trip as handed over by the storage layer.
 *
 * <p>{@code tripDuration} is the recorded duration in seconds and may be null, in
 * which case {@link #durationSeconds()} derives it from the two timestamps.
 *
 * @param tripId unique trip identifier
 * @param vendorId the operating vendor
 * @param pickupLocationId pickup location identifier
 * @param dropoffLocationId dropoff location identifier
 * @param pickupDateTime pickup timestamp
 * @param dropoffDateTime dropoff timestamp
 * @param passengerCount number of passengers
 * @param tripDistance distance in miles
 * @param fareAmount fare charged
 * @param storeAndFwdFlag {@code "Y"} or {@code "N"}
 * @param tripDuration recorded duration in seconds, or null
 */
public record TripRecord(
    long tripId,
    int vendorId,
    int pickupLocationId,
    int dropoffLocationId,
    LocalDateTime pickupDateTime,
    LocalDateTime dropoffDateTime,
    int passengerCount,
    double tripDistance,
    double fareAmount,
    String storeAndFwdFlag,
    Integer tripDuration
) {

    public TripRecord {
        Objects.requireNonNull(pickupDateTime, "pickupDateTime cannot be null");
        Objects.requireNonNull(dropoffDateTime, "dropoffDateTime cannot be null");
        Objects.requireNonNull(storeAndFwdFlag, "storeAndFwdFlag cannot be null");
    }

    /**
     * Checks the record's business constraints.
     *
     * @throws IllegalArgumentException naming the first violated constraint
     */
    public void validate() {
        if (passengerCount < 0) {
            throw new IllegalArgumentException("Passenger count cannot be negative, got: " + passengerCount);
        }
        if (tripDuration != null && tripDuration <= 0) {
            throw new IllegalArgumentException("Trip duration must be positive, got: " + tripDuration);
        }
        if (!pickupDateTime.isBefore(dropoffDateTime)) {
            throw new IllegalArgumentException("Pickup datetime must be before dropoff datetime for trip " + tripId);
        }
        if (!storeAndFwdFlag.equals("Y") && !storeAndFwdFlag.equals("N")) {
            throw new IllegalArgumentException("Store and forward flag must be 'Y' or 'N', got: " + storeAndFwdFlag);
        }
    }

    /** Recorded duration, or the whole seconds between pickup and dropoff. */
    public long durationSeconds() {
        if (tripDuration != null) {
            return tripDuration;
        }
        return Duration.between(pickupDateTime, dropoffDateTime).getSeconds();
    }

    /** Average speed in miles per hour; 0 for a zero-length duration. */
    public double speedMph() {
        long seconds = durationSeconds();
        return seconds > 0 ? tripDistance / (seconds / 3600.0) : 0.0;
    }

    /** Fare per mile; 0 for a zero distance. */
    public double farePerMile() {
        return tripDistance > 0 ? fareAmount / tripDistance : 0.0;
    }

    public int pickupHour() {
        return pickupDateTime.getHour();
    }
}
