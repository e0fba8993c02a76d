package org.mides.routeplanner.service;

import com.google.ortools.constraintsolver.Assignment;
import com.google.ortools.constraintsolver.FirstSolutionStrategy;
import com.google.ortools.constraintsolver.LocalSearchMetaheuristic;
import com.google.ortools.constraintsolver.RoutingDimension;
import com.google.ortools.constraintsolver.RoutingIndexManager;
import com.google.ortools.constraintsolver.RoutingModel;
import com.google.ortools.constraintsolver.Solver;
import com.google.ortools.constraintsolver.main;
import org.mides.routeplanner.config.BootstrapConfiguration;
import org.mides.routeplanner.model.SequencingProblem;
import org.mides.routeplanner.util.Constants;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Single vehicle open path over the route's deliveries: starts at the depot,
 * the leg back to the depot costs nothing.
 */
@Service
public class ORToolsService implements IORToolsService {

    private static final Logger logger = LoggerFactory.getLogger(ORToolsService.class);

    private static final String POSITION_DIMENSION = "position";

    private final BootstrapConfiguration bootstrap;

    @Autowired
    public ORToolsService(BootstrapConfiguration bootstrap) {
        this.bootstrap = bootstrap;
    }

    @Override
    public boolean isAvailable() {
        return bootstrap.isSolverAvailable();
    }

    @Override
    public Optional<List<Integer>> solve(SequencingProblem problem, Duration timeLimit) {
        if (problem.getDeliveries().isEmpty()) {
            return Optional.of(List.of());
        }

        long[][] distanceMatrix = problem.getDistanceCostMatrix();
        long[] priorityRanks = problem.getPriorityRanks();
        int nodes = problem.getNumberOfNodes();

        var manager = new RoutingIndexManager(nodes, 1, SequencingProblem.DEPOT_NODE);
        var routing = new RoutingModel(manager);
        Solver solver = routing.solver();

        /* Add distance cost, open path */
        var distanceCallbackIndex = routing.registerTransitCallback((fromIndex, toIndex) -> {
            var fromNode = manager.indexToNode(fromIndex);
            var toNode = manager.indexToNode(toIndex);
            if (toNode == SequencingProblem.DEPOT_NODE) {
                return 0;
            }
            return distanceMatrix[fromNode][toNode];
        });
        routing.setArcCostEvaluatorOfAllVehicles(distanceCallbackIndex);

        /* Add position dimension: cumul is the visit rank of each node */
        var positionCallbackIndex = routing.registerUnaryTransitCallback((long fromIndex) -> 1L);
        routing.addDimension(
            positionCallbackIndex,
            0,
            nodes + 1,
            true,
            POSITION_DIMENSION
        );
        RoutingDimension positionDimension = routing.getMutableDimension(POSITION_DIMENSION);

        /* Soft priority: every position beyond the first costs rank * penalty */
        long penaltyPerRank = problem.getPriorityPenaltyMeters() * Constants.DISTANCE_MULTIPLIER;
        if (penaltyPerRank > 0) {
            for (int node = 1; node < nodes; node++) {
                if (priorityRanks[node] > 0) {
                    positionDimension.setCumulVarSoftUpperBound(
                        manager.nodeToIndex(node),
                        1,
                        priorityRanks[node] * penaltyPerRank
                    );
                }
            }
        }

        /* Hard precedence from disjoint time windows */
        var precedences = problem.getPrecedencePairs();
        for (int[] pair : precedences) {
            var before = positionDimension.cumulVar(manager.nodeToIndex(pair[0]));
            var after = positionDimension.cumulVar(manager.nodeToIndex(pair[1]));
            solver.addConstraint(solver.makeLessOrEqual(solver.makeSum(before, 1), after));
        }

        logger.info("Solving open path: {} deliveries, {} precedence pairs, time limit {}",
            nodes - 1, precedences.size(), timeLimit);

        var searchParams = main.defaultRoutingSearchParameters()
            .toBuilder()
            .setFirstSolutionStrategy(FirstSolutionStrategy.Value.PATH_CHEAPEST_ARC)
            .setLocalSearchMetaheuristic(LocalSearchMetaheuristic.Value.GUIDED_LOCAL_SEARCH)
            .setTimeLimit(com.google.protobuf.Duration.newBuilder()
                .setSeconds(timeLimit.getSeconds())
                .setNanos(timeLimit.getNano())
                .build())
            .build();

        Assignment assignment = routing.solveWithParameters(searchParams);

        if (assignment == null) {
            logger.warn("No solution found within {}", timeLimit);
            return Optional.empty();
        }

        return Optional.of(extractVisitOrder(routing, manager, assignment));
    }

    private static List<Integer> extractVisitOrder(
        RoutingModel routing,
        RoutingIndexManager manager,
        Assignment assignment
    ) {
        var visitOrder = new ArrayList<Integer>();
        long index = routing.start(0);
        while (!routing.isEnd(index)) {
            int node = manager.indexToNode(index);
            if (node != SequencingProblem.DEPOT_NODE) {
                visitOrder.add(node);
            }
            index = assignment.value(routing.nextVar(index));
        }
        return visitOrder;
    }
}
