package io.mobilitytools.algorithms.cache;

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
import static org.junit.jupiter.api.Assertions.assertThrows;

@Tag("unit")
public class LruCacheTest {

    @Test
    void getPromotesAndPutEvictsLeastRecentlyUsed() {
        LruCache<Integer, String> cache = new LruCache<>(2);
        cache.put(1, "a");
        cache.put(2, "b");
        assertThat(cache.get(1)).contains("a");

        cache.put(3, "c");

        assertThat(cache.get(2)).isEmpty();
        assertThat(cache.get(1)).contains("a");
        assertThat(cache.get(3)).contains("c");
        assertThat(cache.size()).isEqualTo(2);
    }

    @Test
    void updatingAKeyRefreshesItsRecency() {
        LruCache<String, Integer> cache = new LruCache<>(2);
        cache.put("x", 1);
        cache.put("y", 2);
        cache.put("x", 10);
        cache.put("z", 3);

        assertThat(cache.containsKey("y")).isFalse();
        assertThat(cache.get("x")).contains(10);
        assertThat(cache.keysByRecency()).containsExactly("z", "x");
    }

    @Test
    void containsKeyDoesNotTouchRecency() {
        LruCache<Integer, String> cache = new LruCache<>(2);
        cache.put(1, "a");
        cache.put(2, "b");
        assertThat(cache.containsKey(1)).isTrue();
        cache.put(3, "c");
        assertThat(cache.containsKey(1)).isFalse();
    }

    @Test
    void removeUnlinksTheEntry() {
        LruCache<Integer, String> cache = new LruCache<>(3);
        cache.put(1, "a");
        cache.put(2, "b");
        assertThat(cache.remove(1)).isTrue();
        assertThat(cache.remove(1)).isFalse();
        assertThat(cache.keysByRecency()).containsExactly(2);
    }

    @Test
    void neverExceedsCapacity() {
        LruCache<Integer, Integer> cache = new LruCache<>(5);
        for (int i = 0; i < 100; i++) {
            cache.put(i, i);
            assertThat(cache.size()).isLessThanOrEqualTo(cache.capacity());
        }
        assertThat(cache.keysByRecency()).containsExactly(95, 96, 97, 98, 99);
    }

    @Test
    void nonPositiveCapacityIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new LruCache<String, String>(0));
        assertThrows(IllegalArgumentException.class, () -> new LruCache<String, String>(-1));
    }
}
