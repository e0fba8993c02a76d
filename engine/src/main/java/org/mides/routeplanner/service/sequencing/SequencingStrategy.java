package org.mides.routeplanner.service.sequencing;

import org.mides.routeplanner.model.OptimizationMethod;
import org.mides.routeplanner.model.SequencingProblem;

import java.util.List;
import java.util.Optional;

/**
 * One way of ordering a route's deliveries. The result lists node indices of
 * {@link SequencingProblem} in visiting order, depot excluded. An empty result
 * means the strategy could not produce an order and the caller should try
 * another one.
 */
public interface SequencingStrategy {
    OptimizationMethod method();

    boolean isAvailable();

    Optional<List<Integer>> sequence(SequencingProblem problem);
}
