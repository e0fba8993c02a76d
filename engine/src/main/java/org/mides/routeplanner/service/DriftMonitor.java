package org.mides.routeplanner.service;

import org.mides.routeplanner.model.Coordinate;
import org.mides.routeplanner.model.InsertionCandidate;
import org.mides.routeplanner.model.Order;
import org.mides.routeplanner.model.Route;
import org.mides.routeplanner.model.Waypoint;
import org.mides.routeplanner.model.WaypointType;
import org.mides.routeplanner.util.Utils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Proposes where a new order could join an active route. Read only: the
 * routes it is given are never changed.
 */
@Service
public class DriftMonitor implements IDriftMonitor {

    private static final Logger logger = LoggerFactory.getLogger(DriftMonitor.class);

    private static final Comparator<InsertionCandidate> BY_DETOUR = Comparator
        .comparingDouble(InsertionCandidate::getAddedDistanceKm)
        .thenComparing(InsertionCandidate::getRouteId)
        .thenComparingInt(InsertionCandidate::getInsertionIndex);

    private final IDistanceProvider distanceProvider;
    private final ActiveRouteRegistry routeRegistry;

    @Autowired
    public DriftMonitor(IDistanceProvider distanceProvider, ActiveRouteRegistry routeRegistry) {
        this.distanceProvider = distanceProvider;
        this.routeRegistry = routeRegistry;
    }

    @Override
    public List<InsertionCandidate> findInsertionCandidates(Order newOrder, double maxDetourKm) {
        return findInsertionCandidates(newOrder, routeRegistry.snapshot(), maxDetourKm);
    }

    @Override
    public List<InsertionCandidate> findInsertionCandidates(Order newOrder, List<Route> activeRoutes, double maxDetourKm) {
        if (!newOrder.isRoutable()) {
            logger.warn("Order {} has no coordinates, no insertion proposed", newOrder.getId());
            return List.of();
        }

        var candidates = new ArrayList<InsertionCandidate>();
        for (Route route : activeRoutes) {
            if (route.getStatus() == null || !route.getStatus().isActive() || route.getWaypoints().size() < 2) {
                continue;
            }
            candidates.addAll(candidatesForRoute(newOrder, route, maxDetourKm));
        }
        candidates.sort(BY_DETOUR);

        logger.info("Order {}: {} insertion candidates within {} km across {} routes",
            newOrder.getId(), candidates.size(), maxDetourKm, activeRoutes.size());
        return candidates;
    }

    private List<InsertionCandidate> candidatesForRoute(Order newOrder, Route route, double maxDetourKm) {
        var waypoints = route.getWaypoints();
        var points = new ArrayList<Coordinate>();
        waypoints.stream().map(Waypoint::getCoordinates).forEach(points::add);
        points.add(newOrder.getCoordinates());

        /* One matrix per route, the new order is its last point */
        var matrix = distanceProvider.matrix(points);
        int newNode = points.size() - 1;

        var candidates = new ArrayList<InsertionCandidate>();
        for (int i = 0; i + 1 < waypoints.size(); i++) {
            /* A parking stop stays glued to the delivery it serves */
            if (waypoints.get(i).getType() == WaypointType.PARKING) {
                continue;
            }
            double added = matrix.distanceKm(i, newNode)
                + matrix.distanceKm(newNode, i + 1)
                - matrix.distanceKm(i, i + 1);

            if (added <= maxDetourKm) {
                candidates.add(new InsertionCandidate(route.getId(), route.getVersion(), i + 1, Utils.round(added, 3)));
            }
        }
        return candidates;
    }
}
