package io.mobilitytools.algorithms.window;

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

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

@Tag("unit")
public class SlidingWindowTest {

    @Test
    void movingAverageEvictsOldestValue() {
        SlidingWindow window = new SlidingWindow(3);
        assertEquals(10.0, window.add(10), 1e-9);
        assertEquals(15.0, window.add(20), 1e-9);
        assertEquals(20.0, window.add(30), 1e-9);
        assertEquals(30.0, window.add(40), 1e-9);
        assertEquals(40.0, window.add(50), 1e-9);
        assertThat(window.size()).isEqualTo(3);
        assertThat(window.isFull()).isTrue();
        assertEquals(120.0, window.sum(), 1e-9);
    }

    @Test
    void minAndMaxCoverOnlyLiveValues() {
        SlidingWindow window = new SlidingWindow(2);
        window.add(1);
        window.add(9);
        window.add(5);
        assertThat(window.min()).isEqualTo(5.0);
        assertThat(window.max()).isEqualTo(9.0);
        window.add(7);
        assertThat(window.min()).isEqualTo(5.0);
        assertThat(window.max()).isEqualTo(7.0);
    }

    @Test
    void emptyWindowReportsZero() {
        SlidingWindow window = new SlidingWindow(4);
        assertThat(window.average()).isEqualTo(0.0);
        assertThat(window.min()).isEqualTo(0.0);
        assertThat(window.max()).isEqualTo(0.0);
        assertThat(window.capacity()).isEqualTo(4);
    }

    @Test
    void nonPositiveSizeIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new SlidingWindow(0));
        assertThrows(IllegalArgumentException.class, () -> new SlidingWindow(-2));
    }
}
