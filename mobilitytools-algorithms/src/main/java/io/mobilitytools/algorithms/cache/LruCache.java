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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// Capacity-bounded cache with least-recently-used eviction.
///
/// # Structure
///
/// A [HashMap] from key to node gives O(1) lookup; the nodes form a doubly linked
/// recency list between two sentinels:
///
/// ```text
///   head <-> [LRU] <-> ... <-> [MRU] <-> tail
/// ```
///
/// `get` and `put` unlink the touched node and relink it before `tail`. When a
/// `put` of a new key pushes the size past capacity, the node after `head` is
/// evicted. Every operation is O(1).
///
/// # Thread Safety
///
/// Not synchronized; even `get` mutates the recency order.
///
/// @param <K> key type; relies on `equals`/`hashCode`
/// @param <V> value type
public class LruCache<K, V> {

    private static final Logger logger = LogManager.getLogger(LruCache.class);

    private final int capacity;
    private final Map<K, Node<K, V>> index;
    private final Node<K, V> head = new Node<>(null, null);
    private final Node<K, V> tail = new Node<>(null, null);

    /// @throws IllegalArgumentException if `capacity <= 0`
    public LruCache(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive, got: " + capacity);
        }
        this.capacity = capacity;
        this.index = new HashMap<>();
        head.next = tail;
        tail.prev = head;
    }

    /// Returns the cached value and marks `key` most recently used.
    public Optional<V> get(K key) {
        Objects.requireNonNull(key, "key cannot be null");
        Node<K, V> node = index.get(key);
        if (node == null) {
            return Optional.empty();
        }
        unlink(node);
        linkLast(node);
        return Optional.of(node.value);
    }

    /// Stores `value` under `key` as the most recently used entry, evicting the
    /// least recently used entry if capacity is exceeded.
    public void put(K key, V value) {
        Objects.requireNonNull(key, "key cannot be null");
        Objects.requireNonNull(value, "value cannot be null");
        Node<K, V> node = index.get(key);
        if (node != null) {
            node.value = value;
            unlink(node);
            linkLast(node);
            return;
        }

        node = new Node<>(key, value);
        index.put(key, node);
        linkLast(node);
        if (index.size() > capacity) {
            Node<K, V> eldest = head.next;
            unlink(eldest);
            index.remove(eldest.key);
            logger.trace("Evicted least recently used key {}", eldest.key);
        }
    }

    /// Removes `key` if present. Returns true if an entry was removed.
    public boolean remove(K key) {
        Objects.requireNonNull(key, "key cannot be null");
        Node<K, V> node = index.remove(key);
        if (node == null) {
            return false;
        }
        unlink(node);
        return true;
    }

    /// Membership test that leaves recency untouched.
    public boolean containsKey(K key) {
        return index.containsKey(key);
    }

    /// Keys from least to most recently used.
    public List<K> keysByRecency() {
        List<K> keys = new ArrayList<>(index.size());
        for (Node<K, V> node = head.next; node != tail; node = node.next) {
            keys.add(node.key);
        }
        return keys;
    }

    public int size() {
        return index.size();
    }

    public int capacity() {
        return capacity;
    }

    private void unlink(Node<K, V> node) {
        node.prev.next = node.next;
        node.next.prev = node.prev;
        node.prev = null;
        node.next = null;
    }

    private void linkLast(Node<K, V> node) {
        node.prev = tail.prev;
        node.next = tail;
        tail.prev.next = node;
        tail.prev = node;
    }

    private static final class Node<K, V> {
        private final K key;
        private V value;
        private Node<K, V> prev;
        private Node<K, V> next;

        private Node(K key, V value) {
            this.key = key;
            this.value = value;
        }
    }
}
