package org.mides.routeplanner.exception;

public class RouteNotFoundException extends RuntimeException {
    public RouteNotFoundException(String routeId) {
        super(String.format("Route %s not found", routeId));
    }
}
