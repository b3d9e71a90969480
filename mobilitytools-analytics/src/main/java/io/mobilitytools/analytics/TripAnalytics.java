package io.mobilitytools.analytics;

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

import io.mobilitytools.algorithms.anomaly.Anomaly;
import io.mobilitytools.algorithms.anomaly.Frequencies;
import io.mobilitytools.algorithms.anomaly.ZScoreDetector;
import io.mobilitytools.algorithms.cache.LruCache;
import io.mobilitytools.algorithms.graph.WeightedGraph;
import io.mobilitytools.algorithms.hash.ChainedHashTable;
import io.mobilitytools.algorithms.heap.Scored;
import io.mobilitytools.algorithms.heap.TopK;
import io.mobilitytools.algorithms.sort.MergeSort;
import io.mobilitytools.algorithms.stats.IndexedValue;
import io.mobilitytools.algorithms.stats.OrderStatistics;
import io.mobilitytools.algorithms.text.RabinKarp;
import io.mobilitytools.algorithms.tree.KeyValue;
import io.mobilitytools.algorithms.tree.RangeSearchTree;
import io.mobilitytools.algorithms.unionfind.DisjointSet;
import io.mobilitytools.algorithms.window.SlidingWindow;
import io.mobilitytools.analytics.config.AnalyticsConfig;
import io.mobilitytools.analytics.model.Location;
import io.mobilitytools.analytics.model.TripDataset;
import io.mobilitytools.analytics.model.TripRecord;
import io.mobilitytools.analytics.model.Vendor;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// Dashboard queries over an in-memory [TripDataset].
///
/// # Query Map
///
/// | Query | Core routine |
/// |-------|--------------|
/// | [#percentile], [#median], [#summary] | `OrderStatistics` selection |
/// | [#vendorPerformance], [#busiestPickupLocations] | `Frequencies` + `TopK` |
/// | [#speedAnomalies] | `OrderStatistics.detectOutliersIQR` |
/// | [#fareAnomalies] | `ZScoreDetector` |
/// | [#tripsWithDurationBetween] | `RangeSearchTree` built per query |
/// | [#hourlyMovingAverage] | `SlidingWindow` |
/// | [#findVendors] | `RabinKarp` |
/// | [#vendor], [#location] | `ChainedHashTable` |
/// | [#fastestTravelTimes] | `WeightedGraph` Dijkstra |
/// | [#connectedZones] | `DisjointSet` |
///
/// Percentile results are memoized in an `LruCache` of `cache_capacity` entries, and
/// the summary in a single-entry one. The travel-time
/// graph and the zone partition are built on first use and kept, since the dataset
/// never changes.
///
/// # Thread Safety
///
/// Not synchronized: the memo caches and the lazily built structures mutate on
/// reads. Use one instance per caller, or lock around it.
public class TripAnalytics {

    private static final Logger logger = LogManager.getLogger(TripAnalytics.class);
    private static final int HOURS_PER_DAY = 24;
    private static final String SUMMARY_KEY = "summary";

    private final TripDataset dataset;
    private final AnalyticsConfig config;
    private final ChainedHashTable<Integer, Vendor> vendorsById;
    private final ChainedHashTable<Integer, Location> locationsById;
    private final LruCache<String, Double> percentiles;
    private final LruCache<String, TripSummary> summaries;

    private WeightedGraph<Integer> travelTimes;
    private DisjointSet<Integer> zones;

    public TripAnalytics(TripDataset dataset, AnalyticsConfig config) {
        this.dataset = Objects.requireNonNull(dataset, "dataset cannot be null");
        this.config = Objects.requireNonNull(config, "config cannot be null").copy().validate();
        this.vendorsById = new ChainedHashTable<>(this.config.getHashBuckets());
        this.locationsById = new ChainedHashTable<>(this.config.getHashBuckets());
        this.percentiles = new LruCache<>(this.config.getCacheCapacity());
        this.summaries = new LruCache<>(1);

        for (Vendor vendor : dataset.vendors()) {
            vendorsById.insert(vendor.vendorId(), vendor);
        }
        for (Location location : dataset.locations()) {
            locationsById.insert(location.locationId(), location);
        }
        logger.debug("Indexed {} vendors and {} locations, load factors {} / {}",
            vendorsById.size(), locationsById.size(), vendorsById.loadFactor(), locationsById.loadFactor());
    }

    public TripAnalytics(TripDataset dataset) {
        this(dataset, AnalyticsConfig.defaults());
    }

    /// Value of `field` at percentile `p`; 0.0 for an empty dataset.
    ///
    /// @throws IllegalArgumentException if `p` is outside [0, 100]
    public double percentile(TripField field, double p) {
        Objects.requireNonNull(field, "field cannot be null");
        if (Double.isNaN(p) || p < 0.0 || p > 100.0) {
            throw new IllegalArgumentException("percentile must be in [0, 100], got: " + p);
        }
        String key = "percentile:" + field.fieldName() + ":" + p;
        Optional<Double> cached = percentiles.get(key);
        if (cached.isPresent()) {
            return cached.get();
        }
        double value = OrderStatistics.percentile(field.extract(dataset.trips()), p);
        percentiles.put(key, value);
        return value;
    }

    /// Value of `field` at the configured default percentile.
    public double percentile(TripField field) {
        return percentile(field, config.getDefaultPercentile());
    }

    public double median(TripField field) {
        Objects.requireNonNull(field, "field cannot be null");
        return OrderStatistics.median(field.extract(dataset.trips()));
    }

    public TripSummary summary() {
        Optional<TripSummary> cached = summaries.get(SUMMARY_KEY);
        if (cached.isPresent()) {
            return cached.get();
        }
        List<TripRecord> trips = dataset.trips();
        double[] durations = TripField.TRIP_DURATION.extract(trips);
        TripSummary summary = new TripSummary(
            trips.size(),
            OrderStatistics.mean(durations),
            OrderStatistics.mean(TripField.SPEED_MPH.extract(trips)),
            OrderStatistics.mean(TripField.FARE_PER_MILE.extract(trips)),
            OrderStatistics.median(durations),
            OrderStatistics.percentile(durations, 95));
        summaries.put(SUMMARY_KEY, summary);
        return summary;
    }

    /// Vendors ranked by trip count, at most `top_k`, busiest first.
    ///
    /// Vendors missing from the dataset's vendor list are reported as `Vendor <id>`.
    public List<Scored<String>> vendorPerformance() {
        List<Integer> vendorIds = new ArrayList<>(dataset.trips().size());
        for (TripRecord trip : dataset.trips()) {
            vendorIds.add(trip.vendorId());
        }
        List<Scored<String>> counts = new ArrayList<>();
        for (Map.Entry<Integer, Integer> entry : Frequencies.frequencyMap(vendorIds).entrySet()) {
            String name = vendor(entry.getKey()).map(Vendor::vendorName).orElse("Vendor " + entry.getKey());
            counts.add(new Scored<>(entry.getValue(), name));
        }
        return TopK.findTopK(counts, config.getTopK());
    }

    /// The `k` pickup locations with the most trips, busiest first.
    public List<Scored<Integer>> busiestPickupLocations(int k) {
        List<Integer> pickups = new ArrayList<>(dataset.trips().size());
        for (TripRecord trip : dataset.trips()) {
            pickups.add(trip.pickupLocationId());
        }
        List<Scored<Integer>> counts = new ArrayList<>();
        for (Map.Entry<Integer, Integer> entry : Frequencies.frequencyMap(pickups).entrySet()) {
            counts.add(new Scored<>(entry.getValue(), entry.getKey()));
        }
        return TopK.findTopK(counts, k);
    }

    /// Trips whose speed falls outside the interquartile fences, in trip order.
    public List<TripOutlier> speedAnomalies() {
        List<TripRecord> trips = dataset.trips();
        List<TripOutlier> outliers = new ArrayList<>();
        for (IndexedValue flagged : OrderStatistics.detectOutliersIQR(TripField.SPEED_MPH.extract(trips))) {
            outliers.add(new TripOutlier(trips.get(flagged.index()).tripId(), flagged.value()));
        }
        return outliers;
    }

    /// Trips whose fare reaches the configured z-score threshold, most extreme first.
    public List<TripAnomaly> fareAnomalies() {
        List<TripRecord> trips = dataset.trips();
        double[] fares = TripField.FARE_AMOUNT.extract(trips);
        List<TripAnomaly> anomalies = new ArrayList<>();
        for (Anomaly anomaly : ZScoreDetector.detectAnomaliesZScore(fares, config.getZscoreThreshold())) {
            anomalies.add(new TripAnomaly(trips.get(anomaly.index()).tripId(), anomaly.value(), anomaly.zScore()));
        }
        return anomalies;
    }

    /// Trips lasting between `minSeconds` and `maxSeconds` inclusive, shortest first.
    public List<TripRecord> tripsWithDurationBetween(long minSeconds, long maxSeconds) {
        RangeSearchTree<Long, TripRecord> tree = new RangeSearchTree<>();
        for (TripRecord trip : dataset.trips()) {
            tree.insert(trip.durationSeconds(), trip);
        }
        List<TripRecord> matches = new ArrayList<>();
        for (KeyValue<Long, TripRecord> hit : tree.rangeQuery(minSeconds, maxSeconds)) {
            matches.add(hit.value());
        }
        return matches;
    }

    /// Trip counts per pickup hour, index 0 through 23.
    public int[] hourlyDensity() {
        int[] density = new int[HOURS_PER_DAY];
        for (TripRecord trip : dataset.trips()) {
            density[trip.pickupHour()]++;
        }
        return density;
    }

    /// [#hourlyDensity()] smoothed by a trailing window of `moving_average_window` hours.
    public double[] hourlyMovingAverage() {
        SlidingWindow window = new SlidingWindow(config.getMovingAverageWindow());
        int[] density = hourlyDensity();
        double[] smoothed = new double[density.length];
        for (int hour = 0; hour < density.length; hour++) {
            smoothed[hour] = window.add(density[hour]);
        }
        return smoothed;
    }

    /// Vendors whose name contains `fragment`, case-sensitively, in dataset order.
    /// An empty fragment matches every vendor.
    public List<Vendor> findVendors(String fragment) {
        Objects.requireNonNull(fragment, "fragment cannot be null");
        if (fragment.isEmpty()) {
            return new ArrayList<>(dataset.vendors());
        }
        List<Vendor> matches = new ArrayList<>();
        for (Vendor vendor : dataset.vendors()) {
            if (!RabinKarp.search(vendor.vendorName(), fragment).isEmpty()) {
                matches.add(vendor);
            }
        }
        return matches;
    }

    public Optional<Vendor> vendor(int vendorId) {
        return vendorsById.get(vendorId);
    }

    public Optional<Location> location(int locationId) {
        return locationsById.get(locationId);
    }

    /// Shortest travel time in seconds from `fromLocation` to every known location.
    ///
    /// Each edge u → v weighs the mean duration of the trips from u to v. Unreachable
    /// locations map to `Infinity`.
    public Map<Integer, Double> fastestTravelTimes(int fromLocation) {
        return travelTimeGraph().dijkstra(fromLocation);
    }

    /// Groups of locations linked by at least one trip in either direction.
    ///
    /// Each group is ascending and groups are ordered by their smallest location id.
    public List<List<Integer>> connectedZones() {
        DisjointSet<Integer> partition = zonePartition();
        Map<Integer, List<Integer>> groups = new LinkedHashMap<>();
        for (Integer locationId : knownLocationIds()) {
            groups.computeIfAbsent(partition.find(locationId), root -> new ArrayList<>()).add(locationId);
        }
        List<List<Integer>> sortedGroups = new ArrayList<>(groups.size());
        for (List<Integer> group : groups.values()) {
            sortedGroups.add(MergeSort.mergeSort(group, id -> id));
        }
        return MergeSort.mergeSort(sortedGroups, group -> group.get(0));
    }

    /// Number of memoized query results currently held.
    public int cacheSize() {
        return percentiles.size() + summaries.size();
    }

    /// A copy of the settings in effect; changing it does not affect this instance.
    public AnalyticsConfig config() {
        return config.copy();
    }

    private WeightedGraph<Integer> travelTimeGraph() {
        if (travelTimes != null) {
            return travelTimes;
        }
        // [u, v] -> {total seconds, trip count}
        Map<List<Integer>, double[]> legs = new LinkedHashMap<>();
        for (TripRecord trip : dataset.trips()) {
            if (trip.pickupLocationId() == trip.dropoffLocationId()) {
                continue;
            }
            double[] leg = legs.computeIfAbsent(
                List.of(trip.pickupLocationId(), trip.dropoffLocationId()), k -> new double[2]);
            leg[0] += trip.durationSeconds();
            leg[1]++;
        }

        WeightedGraph<Integer> graph = new WeightedGraph<>();
        for (Integer locationId : knownLocationIds()) {
            graph.addNode(locationId);
        }
        for (Map.Entry<List<Integer>, double[]> leg : legs.entrySet()) {
            double[] totals = leg.getValue();
            graph.addEdge(leg.getKey().get(0), leg.getKey().get(1), totals[0] / totals[1]);
        }
        logger.debug("Built travel-time graph with {} locations and {} legs", graph.nodeCount(), graph.edgeCount());
        travelTimes = graph;
        return graph;
    }

    private DisjointSet<Integer> zonePartition() {
        if (zones != null) {
            return zones;
        }
        DisjointSet<Integer> partition = new DisjointSet<>();
        for (Integer locationId : knownLocationIds()) {
            partition.makeSet(locationId);
        }
        for (TripRecord trip : dataset.trips()) {
            partition.union(trip.pickupLocationId(), trip.dropoffLocationId());
        }
        logger.debug("Partitioned {} locations into {} zones", partition.size(), partition.setCount());
        zones = partition;
        return partition;
    }

    /// Declared locations first, then any location ids that only appear on trips.
    private List<Integer> knownLocationIds() {
        Map<Integer, Boolean> seen = new LinkedHashMap<>();
        for (Location location : dataset.locations()) {
            seen.put(location.locationId(), Boolean.TRUE);
        }
        for (TripRecord trip : dataset.trips()) {
            seen.putIfAbsent(trip.pickupLocationId(), Boolean.TRUE);
            seen.putIfAbsent(trip.dropoffLocationId(), Boolean.TRUE);
        }
        return new ArrayList<>(seen.keySet());
    }
}
