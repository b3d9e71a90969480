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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Immutable snapshot of trips, vendors and locations for one analytics session.
 *
 * <p>The {@link Builder} validates as it goes. Invalid trips are skipped with a
 * warning and counted in {@link #rejectedCount()}; an invalid location is a caller
 * error and fails the build.
 *
 * <pre>{@code
 * TripDataset dataset = TripDataset.builder()
 *     .addVendor(new Vendor(1, "Creative Mobile Technologies"))
 *     .addLocation(new Location(10, 40.7679, -73.9821))
 *     .addTrips(tripsFromStorage)
 *     .build();
 * }</pre>
 */
public final class TripDataset {

    private final List<TripRecord> trips;
    private final List<Vendor> vendors;
    private final List<Location> locations;
    private final int rejectedCount;

    private TripDataset(Builder builder) {
        this.trips = Collections.unmodifiableList(new ArrayList<>(builder.trips));
        this.vendors = Collections.unmodifiableList(new ArrayList<>(builder.vendors));
        this.locations = Collections.unmodifiableList(new ArrayList<>(builder.locations));
        this.rejectedCount = builder.rejectedCount;
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<TripRecord> trips() {
        return trips;
    }

    public List<Vendor> vendors() {
        return vendors;
    }

    public List<Location> locations() {
        return locations;
    }

    /** Trips dropped by the builder because they failed validation. */
    public int rejectedCount() {
        return rejectedCount;
    }

    public static final class Builder {

        private static final Logger logger = LogManager.getLogger(TripDataset.class);

        private final List<TripRecord> trips = new ArrayList<>();
        private final List<Vendor> vendors = new ArrayList<>();
        private final List<Location> locations = new ArrayList<>();
        private int rejectedCount;

        private Builder() {
        }

        public Builder addVendor(Vendor vendor) {
            vendors.add(Objects.requireNonNull(vendor, "vendor cannot be null"));
            return this;
        }

        public Builder addLocation(Location location) {
            Objects.requireNonNull(location, "location cannot be null");
            location.validate();
            locations.add(location);
            return this;
        }

        public Builder addTrip(TripRecord trip) {
            Objects.requireNonNull(trip, "trip cannot be null");
            try {
                trip.validate();
                trips.add(trip);
            } catch (IllegalArgumentException e) {
                rejectedCount++;
                logger.warn("Skipping trip {}: {}", trip.tripId(), e.getMessage());
            }
            return this;
        }

        public Builder addTrips(Iterable<TripRecord> records) {
            for (TripRecord trip : records) {
                addTrip(trip);
            }
            return this;
        }

        public TripDataset build() {
            if (rejectedCount > 0) {
                logger.info("Built dataset with {} trips, {} rejected", trips.size(), rejectedCount);
            }
            return new TripDataset(this);
        }
    }
}
