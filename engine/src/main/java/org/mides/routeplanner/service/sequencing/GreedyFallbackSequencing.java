package org.mides.routeplanner.service.sequencing;

import org.mides.routeplanner.model.Order;
import org.mides.routeplanner.model.OptimizationMethod;
import org.mides.routeplanner.model.SequencingProblem;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Nearest neighbor from the depot. Equal distances go to the higher priority,
 * then to the lower order id. Time windows are not enforced.
 */
@Component
public class GreedyFallbackSequencing implements SequencingStrategy {

    @Override
    public OptimizationMethod method() {
        return OptimizationMethod.NEAREST_NEIGHBOR_FALLBACK;
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public Optional<List<Integer>> sequence(SequencingProblem problem) {
        var matrix = problem.getMatrix();
        int nodes = problem.getNumberOfNodes();
        var visited = new boolean[nodes];
        var visitOrder = new ArrayList<Integer>();

        int current = SequencingProblem.DEPOT_NODE;
        visited[current] = true;

        for (int step = 1; step < nodes; step++) {
            int best = -1;
            for (int candidate = 1; candidate < nodes; candidate++) {
                if (visited[candidate]) {
                    continue;
                }
                if (best < 0 || isCloser(problem, matrix.distanceKm(current, candidate),
                    matrix.distanceKm(current, best), candidate, best)) {
                    best = candidate;
                }
            }
            visited[best] = true;
            visitOrder.add(best);
            current = best;
        }

        return Optional.of(visitOrder);
    }

    private static boolean isCloser(
        SequencingProblem problem,
        double candidateKm,
        double bestKm,
        int candidate,
        int best
    ) {
        if (candidateKm != bestKm) {
            return candidateKm < bestKm;
        }

        Order candidateOrder = problem.deliveryAt(candidate);
        Order bestOrder = problem.deliveryAt(best);
        int candidateRank = candidateOrder.effectivePriority().rank();
        int bestRank = bestOrder.effectivePriority().rank();
        if (candidateRank != bestRank) {
            return candidateRank > bestRank;
        }
        return candidateOrder.getId().compareTo(bestOrder.getId()) < 0;
    }
}
