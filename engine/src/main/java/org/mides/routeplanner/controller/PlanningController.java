package org.mides.routeplanner.controller;

import jakarta.validation.Valid;
import org.mides.routeplanner.config.PlanningConfiguration;
import org.mides.routeplanner.model.DriftRequest;
import org.mides.routeplanner.model.InsertionCandidate;
import org.mides.routeplanner.model.InsertionDecision;
import org.mides.routeplanner.model.Itinerary;
import org.mides.routeplanner.model.Order;
import org.mides.routeplanner.model.PlanRequest;
import org.mides.routeplanner.model.PlanResult;
import org.mides.routeplanner.model.Route;
import org.mides.routeplanner.model.RouteStatusUpdate;
import org.mides.routeplanner.service.ActiveRouteRegistry;
import org.mides.routeplanner.service.IDriftMonitor;
import org.mides.routeplanner.service.IInsertionService;
import org.mides.routeplanner.service.IRoutePlanningService;
import org.mides.routeplanner.service.IRouteSynthesizer;
import org.mides.routeplanner.service.UnscheduledOrderPool;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@Validated
@RestController
@CrossOrigin(origins = "*")
@RequestMapping("planning/v1")
public class PlanningController {

    private final IRoutePlanningService planningService;
    private final IRouteSynthesizer routeSynthesizer;
    private final IDriftMonitor driftMonitor;
    private final IInsertionService insertionService;
    private final ActiveRouteRegistry routeRegistry;
    private final UnscheduledOrderPool orderPool;
    private final PlanningConfiguration planningConfiguration;

    @Autowired
    public PlanningController(
        IRoutePlanningService planningService,
        IRouteSynthesizer routeSynthesizer,
        IDriftMonitor driftMonitor,
        IInsertionService insertionService,
        ActiveRouteRegistry routeRegistry,
        UnscheduledOrderPool orderPool,
        PlanningConfiguration planningConfiguration)
    {
        this.planningService = planningService;
        this.routeSynthesizer = routeSynthesizer;
        this.driftMonitor = driftMonitor;
        this.insertionService = insertionService;
        this.routeRegistry = routeRegistry;
        this.orderPool = orderPool;
        this.planningConfiguration = planningConfiguration;
    }

    @PostMapping("/plans")
    public ResponseEntity<PlanResult> plan(@RequestBody @Valid PlanRequest request) {
        return ResponseEntity.ok(planningService.plan(request));
    }

    @DeleteMapping("/plans/{batchId}")
    public ResponseEntity<Void> cancel(@PathVariable String batchId) {
        if (!planningService.cancel(batchId)) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.accepted().build();
    }

    @GetMapping("/routes")
    public ResponseEntity<List<Route>> routes() {
        return ResponseEntity.ok(routeRegistry.snapshot());
    }

    @GetMapping("/routes/{routeId}/itinerary")
    public ResponseEntity<Itinerary> itinerary(@PathVariable String routeId) {
        return ResponseEntity.ok(routeSynthesizer.synthesize(routeRegistry.get(routeId)));
    }

    @PutMapping("/routes/{routeId}/status")
    public ResponseEntity<Route> updateStatus(
        @PathVariable String routeId,
        @RequestBody @Valid RouteStatusUpdate update)
    {
        return ResponseEntity.ok(routeRegistry.updateStatus(routeId, update.getRouteVersion(), update.getStatus()));
    }

    @PostMapping("/drift/candidates")
    public ResponseEntity<List<InsertionCandidate>> driftCandidates(@RequestBody @Valid DriftRequest request) {
        double maxDetourKm = request.getMaxDetourKm() != null
            ? request.getMaxDetourKm()
            : planningConfiguration.getMaxDetourKm();
        return ResponseEntity.ok(driftMonitor.findInsertionCandidates(request.getOrder(), maxDetourKm));
    }

    @PostMapping("/drift/decisions")
    public ResponseEntity<Route> driftDecision(@RequestBody @Valid InsertionDecision decision) {
        return insertionService.apply(decision)
            .map(ResponseEntity::ok)
            .orElseGet(() -> ResponseEntity.noContent().build());
    }

    @GetMapping("/orders/unscheduled")
    public ResponseEntity<List<Order>> unscheduledOrders() {
        return ResponseEntity.ok(orderPool.snapshot());
    }
}
