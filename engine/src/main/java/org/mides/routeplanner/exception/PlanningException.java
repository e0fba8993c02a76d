package org.mides.routeplanner.exception;

/**
 * Unrecoverable failure of a planning batch. Nothing of the batch has been
 * committed when this is thrown.
 */
public class PlanningException extends RuntimeException {
    public PlanningException(String message) {
        super(message);
    }

    public PlanningException(String message, Throwable cause) {
        super(message, cause);
    }
}
