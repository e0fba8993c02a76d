package org.mides.routeplanner.service;

import org.mides.routeplanner.model.Coordinate;
import org.mides.routeplanner.model.osrm.OSRMMatrixResult;
import org.mides.routeplanner.model.osrm.OSRMRouteResult;

import java.util.List;

public interface IOSRMService {
    OSRMRouteResult queryRoute(List<Coordinate> coordinates);
    OSRMMatrixResult queryMatrix(List<Coordinate> coordinates);
    OSRMMatrixResult queryTable(List<Coordinate> sources, List<Coordinate> destinations);
    OSRMMatrixResult queryMatrixInBatches(List<Coordinate> coordinates, int batchSize);
}
