package org.mides.routeplanner.service;

import org.mides.routeplanner.model.Cluster;
import org.mides.routeplanner.model.ClusteringResult;
import org.mides.routeplanner.model.Order;
import org.mides.routeplanner.util.Utils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Groups orders by proximity: transitive neighbourhoods within the radius,
 * oversized groups bisected, undersized groups merged into the nearest
 * group with room. Every routable order lands in exactly one cluster.
 */
@Service
public class GeoClusterer implements IGeoClusterer {

    private static final Logger logger = LoggerFactory.getLogger(GeoClusterer.class);

    private static final Comparator<Cluster> BY_SMALLEST_ID = Comparator.comparing(Cluster::smallestOrderId);

    @Override
    public ClusteringResult cluster(List<Order> orders, double maxRadiusKm, int minSize, int maxSize) {
        if (maxSize < 1 || minSize < 1) {
            throw new IllegalArgumentException("Cluster sizes must be positive");
        }

        var routable = new ArrayList<Order>();
        var unscheduled = new ArrayList<String>();
        for (Order order : orders) {
            if (order.isRoutable()) {
                routable.add(order);
            } else {
                unscheduled.add(order.getId());
            }
        }
        routable.sort(Comparator.comparing(Order::getId));
        unscheduled.sort(Comparator.naturalOrder());

        if (!unscheduled.isEmpty()) {
            logger.warn("{} orders without coordinates left unscheduled: {}", unscheduled.size(), unscheduled);
        }

        var clusters = new ArrayList<Cluster>();
        for (Cluster group : densityGroups(routable, maxRadiusKm)) {
            clusters.addAll(split(group, maxSize));
        }
        var result = mergeSmall(clusters, minSize, maxSize);
        result.sort(BY_SMALLEST_ID);

        logger.info("Clustered {} orders into {} clusters ({} small, {} unscheduled)",
            routable.size(), result.size(),
            result.stream().filter(Cluster::isSmallRoute).count(),
            unscheduled.size());

        return new ClusteringResult(result, unscheduled);
    }

    /* Connected components of the "within maxRadiusKm" graph, seeded in id order. */
    private List<Cluster> densityGroups(List<Order> sorted, double maxRadiusKm) {
        int n = sorted.size();
        var visited = new boolean[n];
        var groups = new ArrayList<Cluster>();

        for (int seed = 0; seed < n; seed++) {
            if (visited[seed]) {
                continue;
            }
            var members = new ArrayList<Order>();
            var queue = new ArrayDeque<Integer>();
            queue.add(seed);
            visited[seed] = true;

            while (!queue.isEmpty()) {
                int current = queue.poll();
                members.add(sorted.get(current));
                for (int j = 0; j < n; j++) {
                    if (!visited[j] && distanceKm(sorted.get(current), sorted.get(j)) <= maxRadiusKm) {
                        visited[j] = true;
                        queue.add(j);
                    }
                }
            }
            groups.add(new Cluster(members));
        }
        return groups;
    }

    /* Recursive bisection along the widest geographic axis until every part fits. */
    private List<Cluster> split(Cluster cluster, int maxSize) {
        if (cluster.size() <= maxSize) {
            return List.of(cluster);
        }

        var members = new ArrayList<>(cluster.getOrders());
        double meanLatitude = cluster.centroid().getLatitude();
        double latitudeSpan = span(members, true, 1.0);
        double longitudeSpan = span(members, false, Math.cos(Math.toRadians(meanLatitude)));
        boolean byLatitude = latitudeSpan >= longitudeSpan;

        members.sort(Comparator
            .comparingDouble((Order o) -> byLatitude ? o.getCoordinates().getLatitude() : o.getCoordinates().getLongitude())
            .thenComparing(Order::getId));

        int half = (members.size() + 1) / 2;
        var parts = new ArrayList<Cluster>();
        parts.addAll(split(new Cluster(members.subList(0, half)), maxSize));
        parts.addAll(split(new Cluster(members.subList(half, members.size())), maxSize));

        logger.debug("Split cluster of {} orders into {} parts", cluster.size(), parts.size());
        return parts;
    }

    private static double span(List<Order> members, boolean latitude, double scale) {
        double min = Double.MAX_VALUE;
        double max = -Double.MAX_VALUE;
        for (Order order : members) {
            double value = latitude ? order.getCoordinates().getLatitude() : order.getCoordinates().getLongitude();
            min = Math.min(min, value);
            max = Math.max(max, value);
        }
        return (max - min) * scale;
    }

    private List<Cluster> mergeSmall(List<Cluster> clusters, int minSize, int maxSize) {
        var working = new ArrayList<>(clusters);
        var unmergeable = new ArrayList<Cluster>();

        while (true) {
            var candidate = working.stream()
                .filter(c -> c.size() < minSize && !unmergeable.contains(c))
                .min(Comparator.comparingInt(Cluster::size).thenComparing(BY_SMALLEST_ID));
            if (candidate.isEmpty()) {
                break;
            }
            var small = candidate.get();
            var centroid = small.centroid();

            var target = working.stream()
                .filter(other -> other != small && other.size() + small.size() <= maxSize)
                .min(Comparator
                    .comparingDouble((Cluster other) -> Utils.haversineKm(centroid, other.centroid()))
                    .thenComparing(BY_SMALLEST_ID));

            if (target.isEmpty()) {
                unmergeable.add(small);
                continue;
            }

            working.remove(small);
            working.remove(target.get());
            unmergeable.remove(target.get());
            working.add(target.get().mergedWith(small));
        }

        for (Cluster cluster : working) {
            cluster.setSmallRoute(cluster.size() < minSize);
            if (cluster.isSmallRoute()) {
                logger.warn("Cluster {} kept as small route with {} orders (minimum {})",
                    cluster.getOrderIds(), cluster.size(), minSize);
            }
        }
        return working;
    }

    private static double distanceKm(Order a, Order b) {
        return Utils.haversineKm(a.getCoordinates(), b.getCoordinates());
    }
}
