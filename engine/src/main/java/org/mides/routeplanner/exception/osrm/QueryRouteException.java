package org.mides.routeplanner.exception.osrm;

public class QueryRouteException extends RuntimeException {
    public QueryRouteException(String message) {
        super(message);
    }

    public QueryRouteException(String message, Throwable cause) {
        super(message, cause);
    }
}
