package org.mides.routeplanner.exception.osrm;

public class QueryMatrixException extends RuntimeException {
    public QueryMatrixException(String message) {
        super(message);
    }

    public QueryMatrixException(String message, Throwable cause) {
        super(message, cause);
    }
}
