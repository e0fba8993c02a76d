package org.mides.routeplanner.service;

import org.mides.routeplanner.model.SequencingProblem;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

public interface IORToolsService {
    boolean isAvailable();

    /* Visiting order as node indices (depot excluded), empty when no solution was found in time */
    Optional<List<Integer>> solve(SequencingProblem problem, Duration timeLimit);
}
