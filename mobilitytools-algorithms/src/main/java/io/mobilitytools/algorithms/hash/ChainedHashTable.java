package io.mobilitytools.algorithms.hash;

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

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/// Hash map with separate chaining and a fixed number of buckets.
///
/// # Bucket Selection
///
/// | Key type | Bucket |
/// |----------|--------|
/// | [CharSequence] | `Σ charAt(i) · 31^i  mod buckets` |
/// | [Number] | `truncate(key) mod buckets` (floor modulus, never negative) |
/// | anything else | `key.hashCode() mod buckets` |
///
/// The polynomial hash is evaluated with every term reduced modulo the bucket
/// count, which yields the same bucket as the exact sum without overflow.
/// Keys inside a bucket are compared with [Object#equals], so the key type's
/// `equals`/`hashCode` contract is what makes it usable here.
///
/// # Capacity
///
/// The bucket count is fixed at construction and never grows.
/// [#loadFactor()] reports `size / buckets` for diagnostics only.
///
/// # Thread Safety
///
/// Not synchronized. Callers that share an instance must lock around it.
///
/// @param <K> key type, non-null
/// @param <V> value type, non-null
public class ChainedHashTable<K, V> {

    public static final int DEFAULT_BUCKETS = 100;

    private final List<List<Entry<K, V>>> buckets;
    private int size;

    public ChainedHashTable() {
        this(DEFAULT_BUCKETS);
    }

    /// @param bucketCount number of chains, fixed for the table's lifetime
    /// @throws IllegalArgumentException if `bucketCount <= 0`
    public ChainedHashTable(int bucketCount) {
        if (bucketCount <= 0) {
            throw new IllegalArgumentException("bucket count must be positive, got: " + bucketCount);
        }
        this.buckets = new ArrayList<>(bucketCount);
        for (int i = 0; i < bucketCount; i++) {
            buckets.add(new ArrayList<>());
        }
    }

    /// Associates `value` with `key`, replacing the value of an existing entry in place.
    public void insert(K key, V value) {
        Objects.requireNonNull(key, "key cannot be null");
        Objects.requireNonNull(value, "value cannot be null");
        List<Entry<K, V>> bucket = buckets.get(hash(key));
        for (Entry<K, V> entry : bucket) {
            if (entry.key.equals(key)) {
                entry.value = value;
                return;
            }
        }
        bucket.add(new Entry<>(key, value));
        size++;
    }

    public Optional<V> get(K key) {
        Objects.requireNonNull(key, "key cannot be null");
        for (Entry<K, V> entry : buckets.get(hash(key))) {
            if (entry.key.equals(key)) {
                return Optional.of(entry.value);
            }
        }
        return Optional.empty();
    }

    /// @return true if an entry was removed
    public boolean delete(K key) {
        Objects.requireNonNull(key, "key cannot be null");
        List<Entry<K, V>> bucket = buckets.get(hash(key));
        for (int i = 0; i < bucket.size(); i++) {
            if (bucket.get(i).key.equals(key)) {
                bucket.remove(i);
                size--;
                return true;
            }
        }
        return false;
    }

    public boolean containsKey(K key) {
        return get(key).isPresent();
    }

    /// Bucket index for `key`.
    public int hash(K key) {
        Objects.requireNonNull(key, "key cannot be null");
        int bucketCount = buckets.size();
        if (key instanceof CharSequence text) {
            long hash = 0;
            long power = 1;
            for (int i = 0; i < text.length(); i++) {
                hash = (hash + text.charAt(i) * power) % bucketCount;
                power = (power * 31) % bucketCount;
            }
            return (int) hash;
        }
        if (key instanceof Number number) {
            long truncated = (key instanceof Double || key instanceof Float)
                ? (long) number.doubleValue()
                : number.longValue();
            return (int) Math.floorMod(truncated, (long) bucketCount);
        }
        return Math.floorMod(key.hashCode(), bucketCount);
    }

    /// Snapshot of all keys, in bucket order then chain order.
    public List<K> keys() {
        List<K> keys = new ArrayList<>(size);
        for (List<Entry<K, V>> bucket : buckets) {
            for (Entry<K, V> entry : bucket) {
                keys.add(entry.key);
            }
        }
        return keys;
    }

    public int size() {
        return size;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    public int bucketCount() {
        return buckets.size();
    }

    public double loadFactor() {
        return (double) size / buckets.size();
    }

    private static final class Entry<K, V> {
        private final K key;
        private V value;

        private Entry(K key, V value) {
            this.key = key;
            this.value = value;
        }
    }
}
