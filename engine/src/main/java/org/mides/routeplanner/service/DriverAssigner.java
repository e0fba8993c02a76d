package org.mides.routeplanner.service;

import org.mides.routeplanner.model.AssignmentResult;
import org.mides.routeplanner.model.AssignmentStrategy;
import org.mides.routeplanner.model.Cluster;
import org.mides.routeplanner.model.Driver;
import org.mides.routeplanner.model.DriverAssignment;
import org.mides.routeplanner.model.DriverStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Binds clusters to drivers. A driver takes at most one cluster per call
 * and offline drivers are never candidates; clusters left without a driver
 * are returned unassigned instead of stacking work on a busy driver.
 * <p>
 * Not thread-safe by contract: one planning batch runs one assignment.
 */
@Service
public class DriverAssigner implements IDriverAssigner {

    private static final Logger logger = LoggerFactory.getLogger(DriverAssigner.class);

    @Override
    public AssignmentResult assign(List<Cluster> clusters, List<Driver> availableDrivers, AssignmentStrategy strategy) {
        var online = availableDrivers.stream()
            .filter(driver -> driver.getStatus() != DriverStatus.OFFLINE)
            .toList();

        /* One entry per driver id, the first one listed wins */
        var byId = new TreeMap<String, Driver>();
        online.forEach(driver -> byId.putIfAbsent(driver.getId(), driver));
        if (byId.size() < online.size()) {
            logger.warn("{} duplicate driver entries ignored", online.size() - byId.size());
        }
        var candidates = new ArrayList<>(byId.values());

        if (candidates.isEmpty() && !clusters.isEmpty()) {
            logger.warn("No drivers available for {} clusters", clusters.size());
        }

        var result = (strategy == AssignmentStrategy.SEQUENTIAL)
            ? assignSequential(clusters, candidates)
            : assignBalanced(clusters, candidates);

        logger.info("Assigned {} of {} clusters using {} strategy, {} left unassigned",
            result.getAssignments().size(), clusters.size(),
            strategy == null ? AssignmentStrategy.BALANCED : strategy,
            result.getUnassignedClusters().size());
        return result;
    }

    /*
     * Greedy load balancing: largest cluster first, to the driver with the
     * lowest running load. Predictable, not globally optimal.
     */
    private AssignmentResult assignBalanced(List<Cluster> clusters, List<Driver> candidates) {
        var orderedClusters = new ArrayList<>(clusters);
        orderedClusters.sort(Comparator
            .comparingInt(Cluster::size).reversed()
            .thenComparing(Cluster::smallestOrderId));

        Map<String, Integer> runningLoad = new HashMap<>();
        candidates.forEach(driver -> runningLoad.put(driver.getId(), Math.max(0, driver.getCurrentLoad())));

        var free = new ArrayList<>(candidates);
        var assignments = new ArrayList<DriverAssignment>();
        var unassigned = new ArrayList<Cluster>();

        for (Cluster cluster : orderedClusters) {
            var driver = free.stream()
                .min(Comparator
                    .comparingInt((Driver d) -> runningLoad.get(d.getId()))
                    .thenComparing(Driver::getId));

            if (driver.isEmpty()) {
                unassigned.add(cluster);
                continue;
            }

            free.remove(driver.get());
            runningLoad.merge(driver.get().getId(), cluster.size(), Integer::sum);
            assignments.add(new DriverAssignment(cluster, driver.get(), assignments.size()));
        }

        return new AssignmentResult(assignments, unassigned);
    }

    /* Clusters in their natural order, drivers in id order. */
    private AssignmentResult assignSequential(List<Cluster> clusters, List<Driver> candidates) {
        var assignments = new ArrayList<DriverAssignment>();
        var unassigned = new ArrayList<Cluster>();

        for (int i = 0; i < clusters.size(); i++) {
            if (i < candidates.size()) {
                assignments.add(new DriverAssignment(clusters.get(i), candidates.get(i), assignments.size()));
            } else {
                unassigned.add(clusters.get(i));
            }
        }
        return new AssignmentResult(assignments, unassigned);
    }
}
