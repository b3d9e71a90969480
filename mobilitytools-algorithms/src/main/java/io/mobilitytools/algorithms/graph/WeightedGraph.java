package io.mobilitytools.algorithms.graph;

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

import io.mobilitytools.algorithms.heap.HeapEntry;
import io.mobilitytools.algorithms.heap.MinHeap;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/// Weighted directed graph as an adjacency list, with Dijkstra shortest paths.
///
/// # Structure
///
/// ```text
///   node -> [(neighbor, weight), ...]
/// ```
///
/// [#addEdge] registers both endpoints, so sink nodes appear in [#nodes()] and in
/// every distance map. Parallel edges are kept.
///
/// # Shortest Paths
///
/// [#dijkstra] runs with a [MinHeap] keyed by tentative distance. The heap has no
/// decrease-key, so an improved distance is pushed as a new entry and older entries
/// for the same node are skipped when popped:
///
/// ```text
///   dist[*] = +inf; dist[source] = 0; push(0, source)
///   while heap not empty:
///     (d, u) = pop()
///     if d > dist[u]: continue          // superseded entry
///     for (v, w) in adj[u]:
///       if d + w < dist[v]: dist[v] = d + w; push(d + w, v)
/// ```
///
/// Edge weights must be non-negative. This is a precondition of the algorithm and is
/// not checked; a negative weight produces wrong distances without an error.
///
/// # Thread Safety
///
/// Not synchronized. Once fully built, concurrent [#dijkstra] calls are safe because
/// they only read the adjacency lists.
///
/// @param <N> node type; relies on `equals`/`hashCode`
public class WeightedGraph<N> {

    private static final Logger logger = LogManager.getLogger(WeightedGraph.class);

    /// An outgoing edge.
    ///
    /// @param target the neighbor the edge leads to
    /// @param weight the non-negative traversal cost
    public record Edge<N>(N target, double weight) {
    }

    private final Map<N, List<Edge<N>>> adjacency = new LinkedHashMap<>();
    private int edgeCount;

    /// Adds `node` with no edges if it is not already present.
    public void addNode(N node) {
        Objects.requireNonNull(node, "node cannot be null");
        adjacency.computeIfAbsent(node, n -> new ArrayList<>());
    }

    /// Appends the directed edge `u -> v` and makes sure `v` is a node.
    public void addEdge(N u, N v, double weight) {
        Objects.requireNonNull(u, "u cannot be null");
        Objects.requireNonNull(v, "v cannot be null");
        adjacency.computeIfAbsent(u, n -> new ArrayList<>()).add(new Edge<>(v, weight));
        adjacency.computeIfAbsent(v, n -> new ArrayList<>());
        edgeCount++;
    }

    /// Shortest distance from `source` to every node.
    ///
    /// @return node to distance, in node insertion order; unreachable nodes map to
    ///     [Double#POSITIVE_INFINITY]. A source that is not in the graph maps to 0.
    public Map<N, Double> dijkstra(N source) {
        Objects.requireNonNull(source, "source cannot be null");
        Map<N, Double> dist = new LinkedHashMap<>();
        for (N node : adjacency.keySet()) {
            dist.put(node, Double.POSITIVE_INFINITY);
        }
        dist.put(source, 0.0);

        MinHeap<Double, N> heap = new MinHeap<>();
        heap.push(0.0, source);
        int settled = 0;
        int stale = 0;

        while (!heap.isEmpty()) {
            HeapEntry<Double, N> entry = heap.pop();
            double d = entry.priority();
            N u = entry.payload();
            if (d > dist.get(u)) {
                stale++;
                continue;
            }
            settled++;
            for (Edge<N> edge : adjacency.getOrDefault(u, Collections.emptyList())) {
                double candidate = d + edge.weight();
                if (candidate < dist.get(edge.target())) {
                    dist.put(edge.target(), candidate);
                    heap.push(candidate, edge.target());
                }
            }
        }
        logger.debug("Dijkstra from {}: {} nodes settled, {} stale heap entries skipped", source, settled, stale);
        return dist;
    }

    /// Outgoing edges of `node`, empty for an unknown node.
    public List<Edge<N>> neighbors(N node) {
        return Collections.unmodifiableList(adjacency.getOrDefault(node, Collections.emptyList()));
    }

    public Set<N> nodes() {
        return Collections.unmodifiableSet(adjacency.keySet());
    }

    public int nodeCount() {
        return adjacency.size();
    }

    public int edgeCount() {
        return edgeCount;
    }
}
