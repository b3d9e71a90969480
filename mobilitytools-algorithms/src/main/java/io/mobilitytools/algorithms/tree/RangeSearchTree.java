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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/// Unbalanced binary search tree for inclusive range queries.
///
/// # Shape
///
/// Keys are placed by strict comparison; a key equal to a node's key goes to the
/// right. For every node:
///
/// ```text
///   keys(left subtree) < node.key <= keys(right subtree)
/// ```
///
/// There is no rebalancing. Sorted insertion order degenerates the tree into a
/// list of depth n, so insert and query walk the tree with loops and an explicit
/// stack rather than with recursion.
///
/// # Range Query
///
/// [#rangeQuery] is an in-order walk that only enters a left child when
/// `node.key > min` and only enters a right child when `node.key <= max`. Those two
/// prunes keep the cost at O(h + k) for a tree of height h and k results, and
/// results come back in ascending key order, with equal keys in insertion order.
///
/// # Thread Safety
///
/// Not synchronized. A tree is meant to be built from a snapshot and queried by a
/// single caller.
///
/// @param <K> orderable key type
/// @param <V> value type
public class RangeSearchTree<K extends Comparable<? super K>, V> {

    private Node<K, V> root;
    private int size;

    /// Inserts a key/value pair. Duplicate keys are kept as separate entries.
    public void insert(K key, V value) {
        Objects.requireNonNull(key, "key cannot be null");
        Node<K, V> created = new Node<>(key, value);
        size++;
        if (root == null) {
            root = created;
            return;
        }

        Node<K, V> node = root;
        while (true) {
            if (key.compareTo(node.key) < 0) {
                if (node.left == null) {
                    node.left = created;
                    return;
                }
                node = node.left;
            } else {
                if (node.right == null) {
                    node.right = created;
                    return;
                }
                node = node.right;
            }
        }
    }

    /// Returns every pair with `min <= key <= max`, ascending by key.
    ///
    /// An inverted range (`min > max`) matches nothing.
    public List<KeyValue<K, V>> rangeQuery(K min, K max) {
        Objects.requireNonNull(min, "min cannot be null");
        Objects.requireNonNull(max, "max cannot be null");
        List<KeyValue<K, V>> results = new ArrayList<>();
        Deque<Node<K, V>> stack = new ArrayDeque<>();

        Node<K, V> node = root;
        while (node != null || !stack.isEmpty()) {
            while (node != null) {
                stack.push(node);
                node = node.key.compareTo(min) > 0 ? node.left : null;
            }
            node = stack.pop();
            if (node.key.compareTo(min) >= 0 && node.key.compareTo(max) <= 0) {
                results.add(new KeyValue<>(node.key, node.value));
            }
            node = node.key.compareTo(max) <= 0 ? node.right : null;
        }
        return results;
    }

    /// Returns the value of the earliest inserted entry whose key equals `key`.
    public Optional<V> get(K key) {
        Objects.requireNonNull(key, "key cannot be null");
        Node<K, V> node = root;
        while (node != null) {
            int cmp = key.compareTo(node.key);
            if (cmp == 0) {
                return Optional.ofNullable(node.value);
            }
            node = cmp < 0 ? node.left : node.right;
        }
        return Optional.empty();
    }

    public int size() {
        return size;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    /// Number of nodes on the longest root-to-leaf path; 0 for an empty tree.
    public int height() {
        if (root == null) {
            return 0;
        }
        int height = 0;
        Deque<Node<K, V>> level = new ArrayDeque<>();
        level.add(root);
        while (!level.isEmpty()) {
            height++;
            for (int i = level.size(); i > 0; i--) {
                Node<K, V> node = level.poll();
                if (node.left != null) level.add(node.left);
                if (node.right != null) level.add(node.right);
            }
        }
        return height;
    }

    private static final class Node<K, V> {
        private final K key;
        private final V value;
        private Node<K, V> left;
        private Node<K, V> right;

        private Node(K key, V value) {
            this.key = key;
            this.value = value;
        }
    }
}
