package org.mides.routeplanner.service;

import org.mides.routeplanner.config.PlanningConfiguration;
import org.mides.routeplanner.exception.PlanningCancelledException;
import org.mides.routeplanner.exception.PlanningException;
import org.mides.routeplanner.model.Driver;
import org.mides.routeplanner.model.DriverAssignment;
import org.mides.routeplanner.model.DriverStatus;
import org.mides.routeplanner.model.Order;
import org.mides.routeplanner.model.OrderStatus;
import org.mides.routeplanner.model.ParkingLocation;
import org.mides.routeplanner.model.PlanRequest;
import org.mides.routeplanner.model.PlanResult;
import org.mides.routeplanner.model.PlanSummary;
import org.mides.routeplanner.model.Route;
import org.mides.routeplanner.model.RouteStatus;
import org.mides.routeplanner.model.SequencingResult;
import org.mides.routeplanner.model.Waypoint;
import org.mides.routeplanner.model.WaypointType;
import org.mides.routeplanner.service.sequencing.IStopSequencer;
import org.mides.routeplanner.util.Utils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * One "plan routes" batch: cluster, assign, sequence each route in parallel,
 * then commit every route at once. A batch that fails or is cancelled leaves
 * the route registry untouched and puts pooled orders back.
 */
@Service
public class RoutePlanningService implements IRoutePlanningService {

    private static final Logger logger = LoggerFactory.getLogger(RoutePlanningService.class);

    private final IGeoClusterer geoClusterer;
    private final IDriverAssigner driverAssigner;
    private final IStopSequencer stopSequencer;
    private final ActiveRouteRegistry routeRegistry;
    private final UnscheduledOrderPool orderPool;
    private final PlanningConfiguration planningConfiguration;
    private final ExecutorService executorService;

    private final Map<String, PlanningBatch> runningBatches = new ConcurrentHashMap<>();

    @Autowired
    public RoutePlanningService(
        IGeoClusterer geoClusterer,
        IDriverAssigner driverAssigner,
        IStopSequencer stopSequencer,
        ActiveRouteRegistry routeRegistry,
        UnscheduledOrderPool orderPool,
        PlanningConfiguration planningConfiguration,
        ExecutorService executorService
    ) {
        this.geoClusterer = geoClusterer;
        this.driverAssigner = driverAssigner;
        this.stopSequencer = stopSequencer;
        this.routeRegistry = routeRegistry;
        this.orderPool = orderPool;
        this.planningConfiguration = planningConfiguration;
        this.executorService = executorService;
    }

    @Override
    public PlanResult plan(PlanRequest request) {
        var batchId = request.getBatchId() != null ? request.getBatchId() : UUID.randomUUID().toString();
        var batch = new PlanningBatch(batchId);
        if (runningBatches.putIfAbsent(batchId, batch) != null) {
            throw new PlanningException(String.format("Planning batch %s is already running", batchId));
        }

        var pooledOrders = orderPool.drain();
        try {
            return runBatch(batch, request, pooledOrders);
        } catch (PlanningException ex) {
            orderPool.addAll(pooledOrders);
            logger.error("Planning batch {} aborted: {}", batchId, ex.getMessage());
            throw ex;
        } catch (RuntimeException ex) {
            orderPool.addAll(pooledOrders);
            logger.error("Planning batch {} failed", batchId, ex);
            throw new PlanningException(String.format("Planning batch %s failed: %s", batchId, ex.getMessage()), ex);
        } finally {
            runningBatches.remove(batchId);
        }
    }

    @Override
    public boolean cancel(String batchId) {
        var batch = runningBatches.get(batchId);
        if (batch == null) {
            return false;
        }
        synchronized (batch) {
            if (batch.committed) {
                return false;
            }
            batch.cancelled = true;
            batch.sequencing.forEach(future -> future.cancel(true));
        }
        logger.info("Planning batch {} cancelled", batchId);
        return true;
    }

    @Override
    public boolean isRunning(String batchId) {
        return runningBatches.containsKey(batchId);
    }

    private PlanResult runBatch(PlanningBatch batch, PlanRequest request, List<Order> pooledOrders) {
        var warnings = new ArrayList<String>();

        /* Request orders win over pooled copies with the same id */
        var ordersById = new LinkedHashMap<String, Order>();
        pooledOrders.forEach(order -> ordersById.put(order.getId(), order));
        request.getOrders().forEach(order -> ordersById.put(order.getId(), order));

        var pending = ordersById.values().stream()
            .filter(order -> order.getStatus() == null || order.getStatus() == OrderStatus.PENDING)
            .toList();

        logger.info("Planning batch {}: {} pending orders ({} from the pool), {} drivers",
            batch.id, pending.size(), pooledOrders.size(), request.getDrivers().size());

        var clustering = geoClusterer.cluster(
            pending,
            valueOr(request.getMaxRadiusKm(), planningConfiguration.getMaxClusterRadiusKm()),
            valueOr(request.getMinClusterSize(), planningConfiguration.getMinClusterSize()),
            valueOr(request.getMaxClusterSize(), planningConfiguration.getMaxClusterSize())
        );
        checkCancelled(batch);

        var strategy = request.getStrategy() != null
            ? request.getStrategy()
            : planningConfiguration.getAssignmentStrategy();
        var assignment = driverAssigner.assign(clustering.getClusters(), request.getDrivers(), strategy);
        checkCancelled(batch);

        if (!assignment.getUnassignedClusters().isEmpty()) {
            warnings.add(String.format("%d clusters left without a driver", assignment.getUnassignedClusters().size()));
        }

        var sequenced = sequenceAll(batch, request, assignment.getAssignments());
        checkCancelled(batch);

        var startTime = request.getRouteStartTime() != null
            ? request.getRouteStartTime()
            : LocalDateTime.now().truncatedTo(ChronoUnit.MINUTES);

        var routes = new ArrayList<Route>();
        for (int i = 0; i < assignment.getAssignments().size(); i++) {
            var route = buildRoute(assignment.getAssignments().get(i), sequenced.get(i), startTime);
            sequenced.get(i).getCostSummary().getWarnings()
                .forEach(warning -> warnings.add(route.getId() + ": " + warning));
            routes.add(route);
        }

        var unscheduledIds = new ArrayList<String>(clustering.getUnscheduledOrderIds());
        unscheduledIds.addAll(assignment.getUnassignedOrderIds());
        unscheduledIds.sort(String::compareTo);

        synchronized (batch) {
            if (batch.cancelled) {
                throw new PlanningCancelledException(batch.id);
            }
            routeRegistry.commitPlan(routes);
            batch.committed = true;
        }

        applyAssignments(assignment.getAssignments(), routes);
        unscheduledIds.stream()
            .map(ordersById::get)
            .forEach(orderPool::add);

        var result = new PlanResult();
        result.setBatchId(batch.id);
        result.setRoutes(routes);
        result.setUnscheduledOrderIds(unscheduledIds);
        result.setSummary(summarize(routes, unscheduledIds, warnings));

        logger.info("Planning batch {} committed: {} routes, {} orders scheduled, {} unscheduled",
            batch.id, routes.size(), result.getSummary().getOrdersScheduled(), unscheduledIds.size());
        return result;
    }

    /*
     * Routes are independent once assigned; each one is sequenced on the pool.
     * Cancelling the batch cancels the pending futures so the wait ends at once.
     */
    private List<SequencingResult> sequenceAll(
        PlanningBatch batch,
        PlanRequest request,
        List<DriverAssignment> assignments
    ) {
        var parking = request.getParkingLocations() != null ? request.getParkingLocations() : List.<ParkingLocation>of();
        var futures = assignments.stream()
            .map(assignment -> CompletableFuture.supplyAsync(
                () -> stopSequencer.sequence(request.getDepot(), parking, assignment.getCluster().getOrders()),
                executorService))
            .toList();

        synchronized (batch) {
            batch.sequencing = futures;
            if (batch.cancelled) {
                futures.forEach(future -> future.cancel(true));
            }
        }

        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        } catch (CancellationException ex) {
            throw new PlanningCancelledException(batch.id);
        } catch (CompletionException ex) {
            checkCancelled(batch);
            var cause = ex.getCause() != null ? ex.getCause() : ex;
            throw new PlanningException("Sequencing failed: " + cause.getMessage(), cause);
        }
        return futures.stream().map(CompletableFuture::join).toList();
    }

    private Route buildRoute(DriverAssignment assignment, SequencingResult sequencing, LocalDateTime startTime) {
        var driver = assignment.getDriver();
        var summary = sequencing.getCostSummary();

        var route = new Route();
        route.setId(newRouteId());
        route.setName(Utils.routeName(driver.getName(), assignment.getRouteIndex()));
        route.setColor(Utils.routeColor(assignment.getRouteIndex()));
        route.setDriverId(driver.getId());
        route.setStatus(RouteStatus.PLANNED);
        route.setWaypoints(new ArrayList<>(sequencing.getWaypoints()));
        route.setTotalDistanceKm(summary.getTotalDistanceKm());
        route.setTotalDurationMinutes(summary.getTotalDurationMinutes());
        route.setProvenance(summary.getProvenance());
        route.setOptimizationMethod(summary.getOptimizationMethod());
        route.setImprovementPercent(summary.getImprovementPercent());
        route.setSmallRoute(assignment.getCluster().isSmallRoute());
        route.setStartTime(startTime);
        route.setVersion(0);
        return route;
    }

    private static void applyAssignments(List<DriverAssignment> assignments, List<Route> routes) {
        for (int i = 0; i < assignments.size(); i++) {
            var cluster = assignments.get(i).getCluster();
            var route = routes.get(i);

            Map<String, Integer> sequenceByOrderId = new HashMap<>();
            for (Waypoint waypoint : route.getWaypoints()) {
                if (waypoint.getType() == WaypointType.DELIVERY) {
                    sequenceByOrderId.put(waypoint.getReferenceId(), waypoint.getSequence());
                }
            }
            for (Order order : cluster.getOrders()) {
                order.setStatus(OrderStatus.ASSIGNED);
                order.setRouteId(route.getId());
                order.setRouteSequence(sequenceByOrderId.get(order.getId()));
            }

            Driver driver = assignments.get(i).getDriver();
            driver.setStatus(DriverStatus.ON_ROUTE);
            driver.setCurrentLoad(driver.getCurrentLoad() + cluster.size());
        }
    }

    private static PlanSummary summarize(List<Route> routes, List<String> unscheduledIds, List<String> warnings) {
        return PlanSummary.builder()
            .routesCreated(routes.size())
            .ordersScheduled(routes.stream().mapToInt(route -> route.getDeliveryOrderIds().size()).sum())
            .ordersUnscheduled(unscheduledIds.size())
            .totalDistanceKm(Utils.round(routes.stream().mapToDouble(Route::getTotalDistanceKm).sum(), 3))
            .totalTimeMinutes(Utils.round(routes.stream().mapToDouble(Route::getTotalDurationMinutes).sum(), 2))
            .driversUsed((int) routes.stream().map(Route::getDriverId).distinct().count())
            .smallRoutes((int) routes.stream().filter(Route::isSmallRoute).count())
            .usedRoadNetwork(!routes.isEmpty() && routes.stream().allMatch(Route::usedRoadNetwork))
            .warnings(warnings)
            .build();
    }

    private void checkCancelled(PlanningBatch batch) {
        if (batch.cancelled) {
            throw new PlanningCancelledException(batch.id);
        }
    }

    private String newRouteId() {
        String id;
        do {
            id = "R-" + UUID.randomUUID().toString().replace("-", "").substring(0, 8).toUpperCase();
        } while (routeRegistry.contains(id));
        return id;
    }

    private static double valueOr(Double value, double fallback) {
        return value != null ? value : fallback;
    }

    private static int valueOr(Integer value, int fallback) {
        return value != null ? value : fallback;
    }

    private static final class PlanningBatch {
        private final String id;
        private volatile boolean cancelled;
        private boolean committed;
        private List<? extends Future<?>> sequencing = List.of();

        private PlanningBatch(String id) {
            this.id = id;
        }
    }
}
