package org.mides.routeplanner.exception;

public class PlanningCancelledException extends PlanningException {
    public PlanningCancelledException(String batchId) {
        super(String.format("Planning batch %s was cancelled", batchId));
    }
}
