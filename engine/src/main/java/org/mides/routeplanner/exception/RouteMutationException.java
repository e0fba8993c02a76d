package org.mides.routeplanner.exception;

public class RouteMutationException extends RuntimeException {
    public RouteMutationException(String message) {
        super(message);
    }
}
