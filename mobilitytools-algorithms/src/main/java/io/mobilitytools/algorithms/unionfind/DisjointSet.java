package io.mobilitytools.algorithms.unionfind;

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

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Union-find over arbitrary elements, with path compression and union by rank.
 *
 * <p>Each tracked element has a parent pointer and a rank. Roots are their own
 * parent. {@link #find} compresses every node on the path straight to the root;
 * {@link #union} hangs the lower-rank root under the higher-rank one and bumps rank
 * only on a tie. Rank bounds tree height by log2 n, which bounds the recursion in
 * {@code find}.
 *
 * <p>An element that was never added is treated as its own singleton set:
 * {@code find} returns it without tracking it, and {@code union} tracks it first.
 *
 * <p>Not synchronized.
 *
 * @param <E> element type; relies on {@code equals}/{@code hashCode}
 */
public class DisjointSet<E> {

    private final Map<E, E> parent = new HashMap<>();
    private final Map<E, Integer> rank = new HashMap<>();
    private int setCount;

    /** Starts a singleton set for {@code x}. No-op if {@code x} is already tracked. */
    public void makeSet(E x) {
        Objects.requireNonNull(x, "element cannot be null");
        if (!parent.containsKey(x)) {
            parent.put(x, x);
            rank.put(x, 0);
            setCount++;
        }
    }

    /** Returns the root of the set containing {@code x}. */
    public E find(E x) {
        Objects.requireNonNull(x, "element cannot be null");
        E p = parent.get(x);
        if (p == null) {
            return x;
        }
        if (p.equals(x)) {
            return x;
        }
        E root = find(p);
        parent.put(x, root);
        return root;
    }

    /**
     * Merges the sets containing {@code x} and {@code y}.
     *
     * @return true if two distinct sets were merged
     */
    public boolean union(E x, E y) {
        makeSet(x);
        makeSet(y);
        E rootX = find(x);
        E rootY = find(y);
        if (rootX.equals(rootY)) {
            return false;
        }

        int rankX = rank.get(rootX);
        int rankY = rank.get(rootY);
        if (rankX < rankY) {
            parent.put(rootX, rootY);
        } else if (rankX > rankY) {
            parent.put(rootY, rootX);
        } else {
            parent.put(rootY, rootX);
            rank.put(rootX, rankX + 1);
        }
        setCount--;
        return true;
    }

    public boolean connected(E x, E y) {
        return find(x).equals(find(y));
    }

    public boolean contains(E x) {
        return parent.containsKey(x);
    }

    /** Number of tracked elements. */
    public int size() {
        return parent.size();
    }

    /** Number of disjoint sets among tracked elements. */
    public int setCount() {
        return setCount;
    }

    /** Rank of a tracked root, for diagnostics. */
    int rankOf(E x) {
        return rank.getOrDefault(x, 0);
    }
}
