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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

@Tag("unit")
public class TripDatasetTest {

    private static final LocalDateTime T0 = LocalDateTime.of(2016, 1, 1, 9, 0);

    @Test
    void invalidTripsAreCountedNotKept() {
        TripRecord good = new TripRecord(1, 1, 1, 2, T0, T0.plusMinutes(5), 1, 1.0, 6.0, "N", 300);
        TripRecord backwards = new TripRecord(2, 1, 1, 2, T0, T0.minusMinutes(5), 1, 1.0, 6.0, "N", null);
        TripRecord badFlag = new TripRecord(3, 1, 1, 2, T0, T0.plusMinutes(5), 1, 1.0, 6.0, "?", 300);

        TripDataset dataset = TripDataset.builder().addTrips(List.of(good, backwards, badFlag)).build();
        assertThat(dataset.trips()).containsExactly(good);
        assertThat(dataset.rejectedCount()).isEqualTo(2);
    }

    @Test
    void invalidLocationIsRejectedImmediately() {
        TripDataset.Builder builder = TripDataset.builder();
        assertThrows(IllegalArgumentException.class, () -> builder.addLocation(new Location(1, 95.0, 0.0)));
    }

    @Test
    void listsAreUnmodifiable() {
        TripDataset dataset = TripDataset.builder().addVendor(new Vendor(1, "Creative Mobile Technologies")).build();
        assertThrows(UnsupportedOperationException.class, () -> dataset.vendors().add(new Vendor(2, "VeriFone Inc")));
    }
}
