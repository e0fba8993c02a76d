package org.mides.routeplanner.service;

import org.mides.routeplanner.exception.PlanningException;
import org.mides.routeplanner.exception.RouteMutationException;
import org.mides.routeplanner.exception.RouteNotFoundException;
import org.mides.routeplanner.model.Route;
import org.mides.routeplanner.model.RouteStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.UnaryOperator;

/**
 * Routes committed by planning. Stored routes are never modified in place:
 * a mutation works on a copy and swaps it in under the route's lock, so
 * readers always see a whole route. Everything handed out is a copy.
 * <p>
 * A route that reaches {@link RouteStatus#COMPLETED} is evicted together
 * with its lock.
 */
@Component
public class ActiveRouteRegistry {

    private static final Logger logger = LoggerFactory.getLogger(ActiveRouteRegistry.class);

    private final ConcurrentHashMap<String, Route> routes = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final Object commitLock = new Object();

    /* Copies of every route still planned or in transit, by id */
    public List<Route> snapshot() {
        return routes.values().stream()
            .filter(route -> route.getStatus().isActive())
            .sorted(Comparator.comparing(Route::getId))
            .map(Route::copy)
            .toList();
    }

    public Optional<Route> find(String routeId) {
        return Optional.ofNullable(routes.get(routeId)).map(Route::copy);
    }

    public Route get(String routeId) {
        return find(routeId).orElseThrow(() -> new RouteNotFoundException(routeId));
    }

    public boolean contains(String routeId) {
        return routes.containsKey(routeId);
    }

    /**
     * Publishes every route of a batch or none of them.
     *
     * @throws PlanningException if a route id is already taken
     */
    public void commitPlan(List<Route> plannedRoutes) {
        synchronized (commitLock) {
            for (Route route : plannedRoutes) {
                if (routes.containsKey(route.getId())) {
                    throw new PlanningException(String.format("Route id %s is already registered", route.getId()));
                }
            }
            plannedRoutes.forEach(route -> routes.put(route.getId(), route.copy()));
        }
        logger.info("Committed {} routes", plannedRoutes.size());
    }

    /**
     * Like {@link #mutate} for a change that adds {@code orderId} to the
     * route. Membership is checked against every active route and the change
     * is applied before any other order placement can run, so an order is
     * never on two routes.
     *
     * @throws RouteMutationException if an active route already holds the order
     */
    public Route mutateAddingOrder(String routeId, long expectedVersion, String orderId, UnaryOperator<Route> mutation) {
        synchronized (commitLock) {
            routes.values().stream()
                .filter(route -> route.getStatus().isActive())
                .filter(route -> route.getDeliveryOrderIds().contains(orderId))
                .findFirst()
                .ifPresent(holder -> {
                    throw new RouteMutationException(
                        String.format("Order %s is already on route %s", orderId, holder.getId()));
                });
            return mutate(routeId, expectedVersion, mutation);
        }
    }

    /**
     * Moves the route to {@code status}. Completing a route removes it.
     *
     * @throws RouteMutationException if the route is stale or the move goes backwards
     */
    public Route updateStatus(String routeId, long expectedVersion, RouteStatus status) {
        return mutate(routeId, expectedVersion, route -> {
            if (!route.getStatus().canMoveTo(status)) {
                throw new RouteMutationException(String.format(
                    "Route %s cannot move from %s to %s", routeId, route.getStatus(), status));
            }
            route.setStatus(status);
            return route;
        });
    }

    /**
     * Applies {@code mutation} to a copy of the route and stores the result
     * with the next version. One mutation per route at a time.
     *
     * @param expectedVersion version the caller based its change on
     * @throws RouteNotFoundException if the route is unknown
     * @throws RouteMutationException if the route changed since {@code expectedVersion}
     */
    public Route mutate(String routeId, long expectedVersion, UnaryOperator<Route> mutation) {
        var lock = locks.computeIfAbsent(routeId, id -> new ReentrantLock());
        lock.lock();
        try {
            var current = routes.get(routeId);
            if (current == null) {
                throw new RouteNotFoundException(routeId);
            }
            if (current.getVersion() != expectedVersion) {
                throw new RouteMutationException(String.format(
                    "Route %s is at version %d, change was based on version %d",
                    routeId, current.getVersion(), expectedVersion));
            }

            var updated = mutation.apply(current.copy());
            updated.setId(routeId);
            updated.setVersion(current.getVersion() + 1);
            if (updated.getStatus().isActive()) {
                routes.put(routeId, updated);
            } else {
                routes.remove(routeId);
                locks.remove(routeId);
                logger.info("Route {} completed and released", routeId);
            }

            logger.info("Route {} updated to version {}", routeId, updated.getVersion());
            return updated.copy();
        } finally {
            lock.unlock();
        }
    }
}
