package org.mides.routeplanner.service.sequencing;

import org.mides.routeplanner.config.PlanningConfiguration;
import org.mides.routeplanner.model.OptimizationMethod;
import org.mides.routeplanner.model.SequencingProblem;
import org.mides.routeplanner.service.IORToolsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs the OR-Tools solver on its own thread and waits at most the solver
 * time limit plus a grace period of wall-clock time.
 */
@Component
public class SolverBackedSequencing implements SequencingStrategy {

    private static final Logger logger = LoggerFactory.getLogger(SolverBackedSequencing.class);

    private final IORToolsService orToolsService;
    private final PlanningConfiguration planningConfiguration;
    private final ExecutorService solverExecutorService;

    @Autowired
    public SolverBackedSequencing(
        IORToolsService orToolsService,
        PlanningConfiguration planningConfiguration,
        @Qualifier("solverExecutorService") ExecutorService solverExecutorService
    ) {
        this.orToolsService = orToolsService;
        this.planningConfiguration = planningConfiguration;
        this.solverExecutorService = solverExecutorService;
    }

    @Override
    public OptimizationMethod method() {
        return OptimizationMethod.OR_TOOLS;
    }

    @Override
    public boolean isAvailable() {
        return planningConfiguration.isSolverEnabled() && orToolsService.isAvailable();
    }

    @Override
    public Optional<List<Integer>> sequence(SequencingProblem problem) {
        var timeLimit = planningConfiguration.getSolverTimeLimit();
        var deadline = timeLimit.plus(planningConfiguration.getSolverGracePeriod());
        var future = solverExecutorService.submit(() -> orToolsService.solve(problem, timeLimit));

        try {
            return future.get(deadline.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            logger.warn("Solver did not return within {}, abandoning it", deadline);
            return Optional.empty();
        } catch (ExecutionException e) {
            logger.warn("Solver failed: {}", e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
            return Optional.empty();
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            logger.warn("Interrupted while waiting for the solver");
            return Optional.empty();
        }
    }
}
