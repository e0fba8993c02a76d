package org.mides.routeplanner.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mides.routeplanner.exception.PlanningException;
import org.mides.routeplanner.exception.RouteMutationException;
import org.mides.routeplanner.exception.RouteNotFoundException;
import org.mides.routeplanner.model.Coordinate;
import org.mides.routeplanner.model.Depot;
import org.mides.routeplanner.model.Route;
import org.mides.routeplanner.model.RouteStatus;
import org.mides.routeplanner.model.Waypoint;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ActiveRouteRegistryTest {

    private ActiveRouteRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new ActiveRouteRegistry();
    }

    private static Route route(String id) {
        var route = new Route();
        route.setId(id);
        route.setDriverId("D-" + id);
        route.setWaypoints(new ArrayList<>(List.of(
            Waypoint.depot(new Depot("DEPOT", new Coordinate(0.0, 0.0), null)))));
        return route;
    }

    @Test
    void snapshot_shouldReturnCopies() {
        registry.commitPlan(List.of(route("R-B"), route("R-A")));

        var snapshot = registry.snapshot();
        snapshot.get(0).getWaypoints().clear();

        assertEquals(List.of("R-A", "R-B"), snapshot.stream().map(Route::getId).toList());
        assertEquals(1, registry.get("R-A").getWaypoints().size());
    }

    @Test
    void snapshot_shouldSkipCompletedRoutes() {
        var done = route("R-DONE");
        done.setStatus(RouteStatus.COMPLETED);
        registry.commitPlan(List.of(done, route("R-LIVE")));

        assertEquals(List.of("R-LIVE"), registry.snapshot().stream().map(Route::getId).toList());
        assertTrue(registry.find("R-DONE").isPresent());
    }

    @Test
    void commitPlan_duplicateId_shouldCommitNothing() {
        registry.commitPlan(List.of(route("R-1")));

        assertThrows(PlanningException.class, () -> registry.commitPlan(List.of(route("R-2"), route("R-1"))));

        assertFalse(registry.contains("R-2"));
    }

    @Test
    void mutate_shouldBumpVersion() {
        registry.commitPlan(List.of(route("R-1")));

        var updated = registry.mutate("R-1", 0, route -> {
            route.setStatus(RouteStatus.IN_TRANSIT);
            return route;
        });

        assertEquals(1, updated.getVersion());
        assertEquals(RouteStatus.IN_TRANSIT, registry.get("R-1").getStatus());
    }

    @Test
    void mutate_staleVersion_shouldBeRejected() {
        registry.commitPlan(List.of(route("R-1")));
        registry.mutate("R-1", 0, route -> route);

        assertThrows(RouteMutationException.class, () -> registry.mutate("R-1", 0, route -> route));
        assertEquals(1, registry.get("R-1").getVersion());
    }

    @Test
    void mutate_unknownRoute_shouldThrowNotFound() {
        assertThrows(RouteNotFoundException.class, () -> registry.mutate("R-X", 0, route -> route));
        assertThrows(RouteNotFoundException.class, () -> registry.get("R-X"));
    }

    @Test
    void mutate_concurrentChangesOnSameVersion_onlyOneWins() throws InterruptedException {
        registry.commitPlan(List.of(route("R-1")));
        int threads = 8;
        var executor = Executors.newFixedThreadPool(threads);
        var ready = new CountDownLatch(1);
        var done = new CountDownLatch(threads);
        var successes = new AtomicInteger();
        var conflicts = new AtomicInteger();

        for (int i = 0; i < threads; i++) {
            executor.submit(() -> {
                try {
                    ready.await();
                    registry.mutate("R-1", 0, route -> route);
                    successes.incrementAndGet();
                } catch (RouteMutationException e) {
                    conflicts.incrementAndGet();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    done.countDown();
                }
            });
        }
        ready.countDown();
        assertTrue(done.await(5, TimeUnit.SECONDS));
        executor.shutdownNow();

        assertEquals(1, successes.get());
        assertEquals(threads - 1, conflicts.get());
        assertEquals(1, registry.get("R-1").getVersion());
    }

    @Test
    void updateStatus_forward_shouldBumpVersion() {
        registry.commitPlan(List.of(route("R-1")));

        var updated = registry.updateStatus("R-1", 0, RouteStatus.IN_TRANSIT);

        assertEquals(RouteStatus.IN_TRANSIT, updated.getStatus());
        assertEquals(1, updated.getVersion());
        assertEquals(RouteStatus.IN_TRANSIT, registry.get("R-1").getStatus());
    }

    @Test
    void updateStatus_backwards_shouldBeRejected() {
        registry.commitPlan(List.of(route("R-1")));
        registry.updateStatus("R-1", 0, RouteStatus.IN_TRANSIT);

        assertThrows(RouteMutationException.class, () -> registry.updateStatus("R-1", 1, RouteStatus.PLANNED));
        assertThrows(RouteMutationException.class, () -> registry.updateStatus("R-1", 1, RouteStatus.IN_TRANSIT));
        assertEquals(1, registry.get("R-1").getVersion());
    }

    @Test
    void updateStatus_completed_shouldEvictRoute() {
        // Arrange
        registry.commitPlan(List.of(route("R-1"), route("R-2")));

        // Act
        var completed = registry.updateStatus("R-1", 0, RouteStatus.COMPLETED);

        // Assert
        assertEquals(RouteStatus.COMPLETED, completed.getStatus());
        assertFalse(registry.contains("R-1"));
        assertThrows(RouteNotFoundException.class, () -> registry.get("R-1"));
        assertThrows(RouteNotFoundException.class, () -> registry.updateStatus("R-1", 1, RouteStatus.COMPLETED));
        assertEquals(List.of("R-2"), registry.snapshot().stream().map(Route::getId).toList());
    }

    @Test
    void updateStatus_staleVersion_shouldBeRejected() {
        registry.commitPlan(List.of(route("R-1")));
        registry.mutate("R-1", 0, route -> route);

        assertThrows(RouteMutationException.class, () -> registry.updateStatus("R-1", 0, RouteStatus.IN_TRANSIT));
    }
}
