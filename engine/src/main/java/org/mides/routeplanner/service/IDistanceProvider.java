package org.mides.routeplanner.service;

import org.mides.routeplanner.model.Coordinate;
import org.mides.routeplanner.model.DistanceMatrixResult;
import org.mides.routeplanner.model.RouteGeometry;
import org.mides.routeplanner.model.TravelCost;

import java.util.List;

/**
 * Travel costs between points. Implementations never fail because the
 * road network is unreachable; they answer with a geometric estimate and
 * say so through the result's provenance.
 */
public interface IDistanceProvider {
    TravelCost pairwiseDistance(Coordinate from, Coordinate to);
    DistanceMatrixResult matrix(List<Coordinate> points);
    RouteGeometry routeGeometry(List<Coordinate> orderedPoints);
}
