package org.mides.routeplanner.service;

import org.mides.routeplanner.exception.RouteMutationException;
import org.mides.routeplanner.model.InsertionDecision;
import org.mides.routeplanner.model.Order;
import org.mides.routeplanner.model.OrderStatus;
import org.mides.routeplanner.model.Route;
import org.mides.routeplanner.model.Waypoint;
import org.mides.routeplanner.model.WaypointType;
import org.mides.routeplanner.util.Utils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Carries out the driver's answer to an insertion proposal: the order is
 * either spliced into the route or returned to the unscheduled pool.
 */
@Service
public class InsertionService implements IInsertionService {

    private static final Logger logger = LoggerFactory.getLogger(InsertionService.class);

    private final ActiveRouteRegistry routeRegistry;
    private final UnscheduledOrderPool orderPool;
    private final IDistanceProvider distanceProvider;

    @Autowired
    public InsertionService(
        ActiveRouteRegistry routeRegistry,
        UnscheduledOrderPool orderPool,
        IDistanceProvider distanceProvider
    ) {
        this.routeRegistry = routeRegistry;
        this.orderPool = orderPool;
        this.distanceProvider = distanceProvider;
    }

    @Override
    public Optional<Route> apply(InsertionDecision decision) {
        var order = decision.getOrder();

        if (!decision.isAccepted()) {
            orderPool.add(order);
            logger.info("Insertion of order {} into route {} declined, order returned to the pool",
                order.getId(), decision.getRouteId());
            return Optional.empty();
        }

        var updated = routeRegistry.mutateAddingOrder(
            decision.getRouteId(),
            decision.getRouteVersion(),
            order.getId(),
            route -> insert(route, order, decision.getInsertionIndex())
        );

        order.setStatus(OrderStatus.ASSIGNED);
        order.setRouteId(updated.getId());
        order.setRouteSequence(decision.getInsertionIndex());
        orderPool.remove(order.getId());

        logger.info("Order {} inserted into route {} at sequence {}",
            order.getId(), updated.getId(), decision.getInsertionIndex());
        return Optional.of(updated);
    }

    private Route insert(Route route, Order order, int insertionIndex) {
        var waypoints = route.getWaypoints();

        if (!order.isRoutable()) {
            throw new RouteMutationException(
                String.format("Order %s has no coordinates and cannot join route %s", order.getId(), route.getId()));
        }
        if (route.getDeliveryOrderIds().contains(order.getId())) {
            throw new RouteMutationException(
                String.format("Order %s is already on route %s", order.getId(), route.getId()));
        }
        if (insertionIndex < 1 || insertionIndex > waypoints.size() - 1) {
            throw new RouteMutationException(String.format(
                "Insertion index %d is outside 1..%d for route %s",
                insertionIndex, waypoints.size() - 1, route.getId()));
        }
        if (waypoints.get(insertionIndex - 1).getType() == WaypointType.PARKING) {
            throw new RouteMutationException(String.format(
                "Insertion index %d would separate parking %s from its delivery on route %s",
                insertionIndex, waypoints.get(insertionIndex - 1).getReferenceId(), route.getId()));
        }

        waypoints.add(insertionIndex, Waypoint.delivery(order, insertionIndex));
        for (int i = 0; i < waypoints.size(); i++) {
            waypoints.get(i).setSequence(i);
        }

        var matrix = distanceProvider.matrix(waypoints.stream().map(Waypoint::getCoordinates).toList());
        double distanceKm = 0;
        double durationMinutes = 0;
        for (int i = 0; i + 1 < waypoints.size(); i++) {
            distanceKm += matrix.distanceKm(i, i + 1);
            durationMinutes += matrix.durationMinutes(i, i + 1);
        }
        route.setTotalDistanceKm(Utils.round(distanceKm, 3));
        route.setTotalDurationMinutes(Utils.round(durationMinutes, 2));
        route.setProvenance(matrix.getProvenance());

        return route;
    }
}
