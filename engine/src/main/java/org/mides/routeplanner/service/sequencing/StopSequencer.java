package org.mides.routeplanner.service.sequencing;

import org.mides.routeplanner.config.PlanningConfiguration;
import org.mides.routeplanner.model.CostSummary;
import org.mides.routeplanner.model.Depot;
import org.mides.routeplanner.model.DistanceMatrixResult;
import org.mides.routeplanner.model.DistanceProvenance;
import org.mides.routeplanner.model.OptimizationMethod;
import org.mides.routeplanner.model.Order;
import org.mides.routeplanner.model.ParkingLocation;
import org.mides.routeplanner.model.SequencingProblem;
import org.mides.routeplanner.model.SequencingResult;
import org.mides.routeplanner.model.Waypoint;
import org.mides.routeplanner.model.WaypointType;
import org.mides.routeplanner.service.IDistanceProvider;
import org.mides.routeplanner.util.Utils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Service
public class StopSequencer implements IStopSequencer {

    private static final Logger logger = LoggerFactory.getLogger(StopSequencer.class);

    private final IDistanceProvider distanceProvider;
    private final SequencingStrategy solverBacked;
    private final SequencingStrategy greedyFallback;
    private final ParkingPlanner parkingPlanner;
    private final PlanningConfiguration planningConfiguration;

    @Autowired
    public StopSequencer(
        IDistanceProvider distanceProvider,
        SolverBackedSequencing solverBacked,
        GreedyFallbackSequencing greedyFallback,
        ParkingPlanner parkingPlanner,
        PlanningConfiguration planningConfiguration
    ) {
        this.distanceProvider = distanceProvider;
        this.solverBacked = solverBacked;
        this.greedyFallback = greedyFallback;
        this.parkingPlanner = parkingPlanner;
        this.planningConfiguration = planningConfiguration;
    }

    @Override
    public SequencingResult sequence(Depot depot, List<ParkingLocation> parkingCandidates, List<Order> deliveries) {
        for (Order order : deliveries) {
            if (!order.isRoutable()) {
                throw new IllegalArgumentException(
                    String.format("Order %s has no coordinates and cannot be sequenced", order.getId())
                );
            }
        }

        var warnings = new ArrayList<String>();
        var problem = new SequencingProblem(depot, deliveries);
        problem.setPriorityPenaltyMeters(planningConfiguration.getPriorityPenaltyMeters());
        problem.setMatrix(distanceProvider.matrix(problem.getAllCoordinates()));

        var method = OptimizationMethod.NONE;
        List<Integer> visitOrder = problem.getInputOrder();

        if (deliveries.size() > 1) {
            var solved = solverBacked.isAvailable()
                ? solverBacked.sequence(problem)
                : Optional.<List<Integer>>empty();

            if (solved.isPresent()) {
                method = solverBacked.method();
                visitOrder = solved.get();
            } else {
                var warning = solverBacked.isAvailable()
                    ? "Solver returned no solution in time, used nearest neighbor fallback"
                    : "Solver unavailable, used nearest neighbor fallback";
                warnings.add(warning);
                method = greedyFallback.method();
                visitOrder = greedyFallback.sequence(problem).orElse(problem.getInputOrder());
            }
        }

        var inputOrder = problem.getInputOrder();
        double naiveKm = problem.pathDistanceKm(inputOrder);
        double sequencedKm = problem.pathDistanceKm(visitOrder);

        /* Never hand back something longer than the order we were given */
        if (naiveKm < sequencedKm
            && (method != OptimizationMethod.OR_TOOLS || problem.respectsPrecedences(inputOrder))) {
            logger.debug("Input order is shorter ({} km < {} km), keeping it", naiveKm, sequencedKm);
            visitOrder = inputOrder;
            sequencedKm = naiveKm;
        }

        var orderedDeliveries = visitOrder.stream().map(problem::deliveryAt).toList();
        var waypoints = parkingPlanner.buildWaypoints(depot, orderedDeliveries, parkingCandidates, warnings);

        var summary = summarize(problem, waypoints, naiveKm, sequencedKm, method, warnings);

        logger.info("Sequenced {} deliveries with {}: {} km, {} min, {}% better than input order",
            deliveries.size(), method, summary.getTotalDistanceKm(), summary.getTotalDurationMinutes(),
            summary.getImprovementPercent());

        return new SequencingResult(waypoints, summary);
    }

    private CostSummary summarize(
        SequencingProblem problem,
        List<Waypoint> waypoints,
        double naiveKm,
        double sequencedKm,
        OptimizationMethod method,
        List<String> warnings
    ) {
        DistanceMatrixResult matrix = problem.getMatrix();
        var provenance = matrix.getProvenance();

        var nodeByOrderId = new HashMap<String, Integer>();
        for (int node = 1; node < problem.getNumberOfNodes(); node++) {
            nodeByOrderId.put(problem.deliveryAt(node).getId(), node);
        }

        double totalKm = 0;
        double totalMinutes = 0;
        for (int i = 0; i + 1 < waypoints.size(); i++) {
            var from = waypoints.get(i);
            var to = waypoints.get(i + 1);
            int fromNode = matrixNode(from, nodeByOrderId);
            int toNode = matrixNode(to, nodeByOrderId);

            if (fromNode >= 0 && toNode >= 0) {
                totalKm += matrix.distanceKm(fromNode, toNode);
                totalMinutes += matrix.durationMinutes(fromNode, toNode);
            } else {
                /* Legs touching a parking stop are not part of the matrix */
                var leg = distanceProvider.pairwiseDistance(from.getCoordinates(), to.getCoordinates());
                totalKm += leg.getDistanceKm();
                totalMinutes += leg.getDurationMinutes();
                provenance = provenance.combine(leg.getProvenance());
            }
        }

        double improvement = naiveKm > 0 ? (naiveKm - sequencedKm) / naiveKm * 100 : 0;

        return CostSummary.builder()
            .totalDistanceKm(Utils.round(totalKm, 3))
            .totalDurationMinutes(Utils.round(totalMinutes, 2))
            .naiveDistanceKm(Utils.round(naiveKm, 3))
            .sequencedDistanceKm(Utils.round(sequencedKm, 3))
            .improvementPercent(Utils.round(improvement, 2))
            .optimizationMethod(method)
            .provenance(provenance == null ? DistanceProvenance.FALLBACK_GEOMETRIC : provenance)
            .warnings(warnings)
            .build();
    }

    private static int matrixNode(Waypoint waypoint, Map<String, Integer> nodeByOrderId) {
        if (waypoint.getType() == WaypointType.DEPOT) {
            return SequencingProblem.DEPOT_NODE;
        }
        if (waypoint.getType() == WaypointType.DELIVERY) {
            return nodeByOrderId.getOrDefault(waypoint.getReferenceId(), -1);
        }
        return -1;
    }
}
