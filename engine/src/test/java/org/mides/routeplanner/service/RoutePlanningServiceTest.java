package org.mides.routeplanner.service;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mides.routeplanner.config.OSRMConfiguration;
import org.mides.routeplanner.config.PlanningConfiguration;
import org.mides.routeplanner.exception.PlanningCancelledException;
import org.mides.routeplanner.exception.PlanningException;
import org.mides.routeplanner.model.AssignmentStrategy;
import org.mides.routeplanner.model.CostSummary;
import org.mides.routeplanner.model.Coordinate;
import org.mides.routeplanner.model.Depot;
import org.mides.routeplanner.model.DistanceProvenance;
import org.mides.routeplanner.model.Driver;
import org.mides.routeplanner.model.DriverStatus;
import org.mides.routeplanner.model.OptimizationMethod;
import org.mides.routeplanner.model.Order;
import org.mides.routeplanner.model.OrderStatus;
import org.mides.routeplanner.model.PlanRequest;
import org.mides.routeplanner.model.PlanResult;
import org.mides.routeplanner.model.Route;
import org.mides.routeplanner.model.SequencingResult;
import org.mides.routeplanner.model.Waypoint;
import org.mides.routeplanner.model.WaypointType;
import org.mides.routeplanner.service.sequencing.GreedyFallbackSequencing;
import org.mides.routeplanner.service.sequencing.IStopSequencer;
import org.mides.routeplanner.service.sequencing.ParkingPlanner;
import org.mides.routeplanner.service.sequencing.SolverBackedSequencing;
import org.mides.routeplanner.service.sequencing.StopSequencer;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class RoutePlanningServiceTest {

    private final Depot depot = new Depot("DEPOT", new Coordinate(-34.9050, -56.1700), "Depot");

    private PlanningConfiguration planningConfig;
    private ActiveRouteRegistry registry;
    private UnscheduledOrderPool pool;
    private ExecutorService executorService;
    private ExecutorService solverExecutor;
    private StopSequencer stopSequencer;

    @BeforeEach
    void setUp() {
        var osrmConfig = new OSRMConfiguration();
        osrmConfig.setEnabled(false);
        planningConfig = new PlanningConfiguration();
        planningConfig.setMinClusterSize(3);
        planningConfig.setMaxClusterSize(5);

        var distanceProvider = new DistanceProvider(mock(IOSRMService.class), osrmConfig, planningConfig);
        solverExecutor = Executors.newSingleThreadExecutor();
        stopSequencer = new StopSequencer(
            distanceProvider,
            new SolverBackedSequencing(mock(IORToolsService.class), planningConfig, solverExecutor),
            new GreedyFallbackSequencing(),
            new ParkingPlanner(planningConfig),
            planningConfig
        );
        registry = new ActiveRouteRegistry();
        pool = new UnscheduledOrderPool();
        executorService = Executors.newFixedThreadPool(2);
    }

    @AfterEach
    void tearDown() {
        executorService.shutdownNow();
        solverExecutor.shutdownNow();
    }

    private RoutePlanningService service(IStopSequencer sequencer) {
        return new RoutePlanningService(
            new GeoClusterer(),
            new DriverAssigner(),
            sequencer,
            registry,
            pool,
            planningConfig,
            executorService
        );
    }

    private static List<Order> closeOrders(int count) {
        var orders = new ArrayList<Order>();
        for (int i = 1; i <= count; i++) {
            orders.add(new Order("O" + i, new Coordinate(-34.9000 + i * 0.001, -56.1600)));
        }
        return orders;
    }

    private PlanRequest request(String batchId, List<Order> orders, List<Driver> drivers) {
        var request = new PlanRequest();
        request.setBatchId(batchId);
        request.setDepot(depot);
        request.setOrders(new ArrayList<>(orders));
        request.setDrivers(new ArrayList<>(drivers));
        request.setRouteStartTime(LocalDateTime.of(2024, 5, 2, 8, 0));
        return request;
    }

    @Test
    void plan_shouldClusterAssignSequenceAndCommit() {
        // Arrange
        var orders = new ArrayList<>(closeOrders(7));
        orders.add(new Order("X1", null));
        var d1 = new Driver("D1", DriverStatus.AVAILABLE, 0);
        d1.setName("Michael Schneider");
        var d2 = new Driver("D2", DriverStatus.AVAILABLE, 0);

        // Act
        PlanResult result = service(stopSequencer).plan(request("B1", orders, List.of(d1, d2)));

        // Assert
        assertEquals("B1", result.getBatchId());
        assertEquals(2, result.getRoutes().size());
        assertEquals(List.of("X1"), result.getUnscheduledOrderIds());

        var summary = result.getSummary();
        assertEquals(2, summary.getRoutesCreated());
        assertEquals(7, summary.getOrdersScheduled());
        assertEquals(1, summary.getOrdersUnscheduled());
        assertEquals(2, summary.getDriversUsed());
        assertFalse(summary.isUsedRoadNetwork());
        assertTrue(summary.getTotalDistanceKm() > 0);

        for (Route route : result.getRoutes()) {
            assertTrue(route.getId().matches("R-[0-9A-F]{8}"));
            var first = route.getWaypoints().get(0);
            assertEquals(WaypointType.DEPOT, first.getType());
            assertEquals(0, first.getSequence());
            assertEquals(OptimizationMethod.NEAREST_NEIGHBOR_FALLBACK, route.getOptimizationMethod());
            assertEquals(DistanceProvenance.FALLBACK_GEOMETRIC, route.getProvenance());
            assertEquals(LocalDateTime.of(2024, 5, 2, 8, 0), route.getStartTime());
        }
        assertEquals("MS", result.getRoutes().get(0).getName());
        assertEquals(2, registry.snapshot().size());

        assertTrue(orders.subList(0, 7).stream().allMatch(o -> o.getStatus() == OrderStatus.ASSIGNED));
        assertTrue(orders.subList(0, 7).stream().allMatch(o -> o.getRouteId() != null && o.getRouteSequence() != null));
        assertEquals(DriverStatus.ON_ROUTE, d1.getStatus());
        assertEquals(4, d1.getCurrentLoad());
        assertEquals(3, d2.getCurrentLoad());
    }

    @Test
    void plan_moreClustersThanDrivers_shouldPoolExcessOrders() {
        var driver = new Driver("D1", DriverStatus.AVAILABLE, 0);

        var result = service(stopSequencer).plan(request("B1", closeOrders(7), List.of(driver)));

        assertEquals(1, result.getRoutes().size());
        assertEquals(List.of("O5", "O6", "O7"), result.getUnscheduledOrderIds());
        assertEquals(List.of("O5", "O6", "O7"), pool.snapshot().stream().map(Order::getId).toList());
        assertTrue(result.getSummary().getWarnings().contains("1 clusters left without a driver"));
    }

    @Test
    void plan_nextPass_shouldDrainPool() {
        var planningService = service(stopSequencer);
        planningService.plan(request("B1", closeOrders(7), List.of(new Driver("D1", DriverStatus.AVAILABLE, 0))));

        var result = planningService.plan(request("B2", List.of(), List.of(new Driver("D2", DriverStatus.AVAILABLE, 0))));

        assertEquals(1, result.getRoutes().size());
        assertEquals(List.of("O5", "O6", "O7"), result.getRoutes().get(0).getDeliveryOrderIds().stream().sorted().toList());
        assertEquals(0, pool.size());
        assertEquals(2, registry.snapshot().size());
    }

    @Test
    void plan_sequencingFailure_shouldCommitNothingAndRestorePool() {
        var pooled = new Order("P1", new Coordinate(-34.9000, -56.1600));
        pool.add(pooled);
        var failing = mock(IStopSequencer.class);
        when(failing.sequence(any(), anyList(), anyList())).thenThrow(new IllegalStateException("boom"));

        var planningService = service(failing);
        assertThrows(PlanningException.class, () -> planningService.plan(
            request("B1", closeOrders(3), List.of(new Driver("D1", DriverStatus.AVAILABLE, 0)))));

        assertTrue(registry.snapshot().isEmpty());
        assertEquals(List.of("P1"), pool.snapshot().stream().map(Order::getId).toList());
        assertFalse(planningService.isRunning("B1"));
    }

    @Test
    void plan_cancelledBeforeCommit_shouldCommitNothing() throws Exception {
        // Arrange: sequencing blocks until the batch has been cancelled
        var started = new CountDownLatch(1);
        var release = new CountDownLatch(1);
        var blocking = mock(IStopSequencer.class);
        when(blocking.sequence(any(), anyList(), anyList())).thenAnswer(invocation -> {
            started.countDown();
            release.await(5, TimeUnit.SECONDS);
            var summary = CostSummary.builder()
                .optimizationMethod(OptimizationMethod.NONE)
                .provenance(DistanceProvenance.FALLBACK_GEOMETRIC)
                .build();
            return new SequencingResult(List.of(Waypoint.depot(depot)), summary);
        });
        var planningService = service(blocking);

        // Act
        var future = CompletableFuture.supplyAsync(() -> planningService.plan(
            request("B1", closeOrders(3), List.of(new Driver("D1", DriverStatus.AVAILABLE, 0)))));
        assertTrue(started.await(5, TimeUnit.SECONDS));
        assertTrue(planningService.cancel("B1"));
        release.countDown();

        // Assert
        var ex = assertThrows(ExecutionException.class, () -> future.get(5, TimeUnit.SECONDS));
        assertInstanceOf(PlanningCancelledException.class, ex.getCause());
        assertTrue(registry.snapshot().isEmpty());
    }

    @Test
    void plan_cancelledWhileSequencing_shouldAbortWithoutWaitingForSequencer() throws Exception {
        // Arrange: sequencing would hold the batch for half a minute
        var started = new CountDownLatch(1);
        var release = new CountDownLatch(1);
        var stuck = mock(IStopSequencer.class);
        when(stuck.sequence(any(), anyList(), anyList())).thenAnswer(invocation -> {
            started.countDown();
            release.await(30, TimeUnit.SECONDS);
            return null;
        });
        var planningService = service(stuck);

        try {
            // Act
            var future = CompletableFuture.supplyAsync(() -> planningService.plan(
                request("B1", closeOrders(3), List.of(new Driver("D1", DriverStatus.AVAILABLE, 0)))));
            assertTrue(started.await(5, TimeUnit.SECONDS));
            assertTrue(planningService.cancel("B1"));

            // Assert
            var ex = assertThrows(ExecutionException.class, () -> future.get(2, TimeUnit.SECONDS));
            assertInstanceOf(PlanningCancelledException.class, ex.getCause());
            assertTrue(registry.snapshot().isEmpty());
            assertFalse(planningService.isRunning("B1"));
        } finally {
            release.countDown();
        }
    }

    @Test
    void cancel_unknownBatch_shouldReturnFalse() {
        assertFalse(service(stopSequencer).cancel("missing"));
    }

    @Test
    void plan_sequentialStrategy_shouldBeHonoured() {
        var request = request("B1", closeOrders(7), List.of(
            new Driver("D2", DriverStatus.AVAILABLE, 0),
            new Driver("D1", DriverStatus.AVAILABLE, 9)));
        request.setStrategy(AssignmentStrategy.SEQUENTIAL);

        var result = service(stopSequencer).plan(request);

        // Sequential ignores load: the first cluster goes to D1
        assertEquals("D1", result.getRoutes().get(0).getDriverId());
        assertTrue(result.getRoutes().get(0).getDeliveryOrderIds().contains("O1"));
    }
}
