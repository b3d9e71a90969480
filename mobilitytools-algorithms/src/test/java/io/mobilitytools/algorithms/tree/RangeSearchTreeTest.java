package io.mobilitytools.algorithms.tree;

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

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
public class RangeSearchTreeTest {

    private static RangeSearchTree<Double, String> durations() {
        RangeSearchTree<Double, String> tree = new RangeSearchTree<>();
        double[] keys = {15, 8, 22, 4, 12, 18, 30, 10, 14};
        for (double key : keys) {
            tree.insert(key, "trip-" + (int) key);
        }
        return tree;
    }

    @Test
    void rangeIsInclusiveAndAscending() {
        List<KeyValue<Double, String>> hits = durations().rangeQuery(10.0, 20.0);
        assertThat(hits).extracting(KeyValue::key).containsExactly(10.0, 12.0, 14.0, 15.0, 18.0);
        assertThat(hits).extracting(KeyValue::value).contains("trip-10", "trip-18");
    }

    @Test
    void emptyAndInvertedRanges() {
        RangeSearchTree<Double, String> tree = durations();
        assertThat(tree.rangeQuery(31.0, 40.0)).isEmpty();
        assertThat(tree.rangeQuery(20.0, 10.0)).isEmpty();
        assertThat(new RangeSearchTree<Double, String>().rangeQuery(0.0, 100.0)).isEmpty();
    }

    @Test
    void duplicateKeysAreAllReportedInInsertionOrder() {
        RangeSearchTree<Integer, String> tree = new RangeSearchTree<>();
        tree.insert(5, "a");
        tree.insert(3, "b");
        tree.insert(5, "c");
        tree.insert(7, "d");
        tree.insert(5, "e");

        assertThat(tree.rangeQuery(5, 5)).extracting(KeyValue::value).containsExactly("a", "c", "e");
        assertThat(tree.rangeQuery(3, 5)).extracting(KeyValue::value).containsExactly("b", "a", "c", "e");
        assertThat(tree.get(5)).contains("a");
        assertThat(tree.get(6)).isEmpty();
    }

    @Test
    void matchesLinearScanOnRandomKeys() {
        Random random = new Random(7);
        RangeSearchTree<Integer, Integer> tree = new RangeSearchTree<>();
        List<Integer> keys = new ArrayList<>();
        for (int i = 0; i < 500; i++) {
            int key = random.nextInt(200);
            keys.add(key);
            tree.insert(key, i);
        }
        for (int trial = 0; trial < 50; trial++) {
            int a = random.nextInt(220) - 10;
            int b = a + random.nextInt(60);
            long expected = keys.stream().filter(k -> k >= a && k <= b).count();
            List<KeyValue<Integer, Integer>> hits = tree.rangeQuery(a, b);
            assertThat(hits).hasSize((int) expected);
            assertThat(hits).allSatisfy(kv -> assertThat(kv.key()).isBetween(a, b));
        }
    }

    @Test
    void sortedInsertionDegeneratesWithoutOverflowingTheStack() {
        RangeSearchTree<Integer, Integer> tree = new RangeSearchTree<>();
        int n = 20_000;
        for (int i = 0; i < n; i++) {
            tree.insert(i, i);
        }
        assertThat(tree.size()).isEqualTo(n);
        assertThat(tree.height()).isEqualTo(n);
        assertThat(tree.rangeQuery(n - 3, n + 10)).extracting(KeyValue::key).containsExactly(n - 3, n - 2, n - 1);
    }
}
