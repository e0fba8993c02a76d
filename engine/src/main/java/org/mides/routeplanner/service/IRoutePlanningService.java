package org.mides.routeplanner.service;

import org.mides.routeplanner.model.PlanRequest;
import org.mides.routeplanner.model.PlanResult;

public interface IRoutePlanningService {
    PlanResult plan(PlanRequest request);

    /* False when no batch with that id is running or it already committed */
    boolean cancel(String batchId);

    boolean isRunning(String batchId);
}
