package org.mides.routeplanner.service;

import org.mides.routeplanner.config.OSRMConfiguration;
import org.mides.routeplanner.config.PlanningConfiguration;
import org.mides.routeplanner.exception.osrm.QueryMatrixException;
import org.mides.routeplanner.exception.osrm.QueryRouteException;
import org.mides.routeplanner.model.Coordinate;
import org.mides.routeplanner.model.DistanceMatrixResult;
import org.mides.routeplanner.model.DistanceProvenance;
import org.mides.routeplanner.model.RouteGeometry;
import org.mides.routeplanner.model.TravelCost;
import org.mides.routeplanner.model.osrm.OSRMRoute;
import org.mides.routeplanner.util.ArrayUtils;
import org.mides.routeplanner.util.Utils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class DistanceProvider implements IDistanceProvider {

    private static final Logger logger = LoggerFactory.getLogger(DistanceProvider.class);

    private final IOSRMService osrmService;
    private final OSRMConfiguration osrmConfig;
    private final PlanningConfiguration planningConfig;

    @Autowired
    public DistanceProvider(
        IOSRMService osrmService,
        OSRMConfiguration osrmConfig,
        PlanningConfiguration planningConfig)
    {
        this.osrmService = osrmService;
        this.osrmConfig = osrmConfig;
        this.planningConfig = planningConfig;
    }

    @Override
    public TravelCost pairwiseDistance(Coordinate from, Coordinate to) {
        if (osrmConfig.isEnabled()) {
            try {
                var route = osrmService.queryRoute(List.of(from, to)).getRoutes().get(0);
                return new TravelCost(route.distanceKm(), route.durationMinutes(), DistanceProvenance.ROAD_NETWORK);
            } catch (QueryRouteException ex) {
                logger.warn("Road network route {} -> {} unavailable, using geometric estimate: {}",
                    from, to, ex.getMessage());
            }
        }
        return geometricCost(from, to);
    }

    @Override
    public DistanceMatrixResult matrix(List<Coordinate> points) {
        if (points.size() < 2) {
            return geometricMatrix(points);
        }

        if (osrmConfig.isEnabled()) {
            try {
                return osrmConfig.isTableEnabled()
                    ? roadNetworkMatrix(points)
                    : pairwiseRoadNetworkMatrix(points);
            } catch (QueryMatrixException | QueryRouteException ex) {
                logger.warn("Road network matrix for {} points unavailable, using geometric estimate: {}",
                    points.size(), ex.getMessage());
            }
        }
        return geometricMatrix(points);
    }

    @Override
    public RouteGeometry routeGeometry(List<Coordinate> orderedPoints) {
        if (orderedPoints.size() < 2) {
            return new RouteGeometry(null, 0, 0, DistanceProvenance.FALLBACK_GEOMETRIC);
        }

        if (osrmConfig.isEnabled()) {
            try {
                OSRMRoute route = osrmService.queryRoute(orderedPoints).getRoutes().get(0);
                return new RouteGeometry(
                    decodeOrNull(route),
                    route.distanceKm(),
                    route.durationMinutes(),
                    DistanceProvenance.ROAD_NETWORK
                );
            } catch (QueryRouteException ex) {
                logger.warn("Road network geometry for {} points unavailable: {}", orderedPoints.size(), ex.getMessage());
            }
        }

        double distanceKm = 0;
        for (int i = 0; i + 1 < orderedPoints.size(); i++) {
            distanceKm += Utils.haversineKm(orderedPoints.get(i), orderedPoints.get(i + 1));
        }
        return new RouteGeometry(null, distanceKm, estimateMinutes(distanceKm), DistanceProvenance.FALLBACK_GEOMETRIC);
    }

    private DistanceMatrixResult roadNetworkMatrix(List<Coordinate> points) {
        var result = osrmService.queryMatrixInBatches(points, osrmConfig.getMatrixBatchSize());
        if (!result.isComplete(points.size(), points.size())) {
            throw new QueryMatrixException("OSRM table does not cover every point pair");
        }
        return new DistanceMatrixResult(
            ArrayUtils.convertTo2DDoubleArray(result.getDistances(), 1000.0),
            ArrayUtils.convertTo2DDoubleArray(result.getDurations(), 60.0),
            DistanceProvenance.ROAD_NETWORK
        );
    }

    /* For servers without a table service: one route query per ordered pair. */
    private DistanceMatrixResult pairwiseRoadNetworkMatrix(List<Coordinate> points) {
        int size = points.size();
        var distances = ArrayUtils.square(size);
        var durations = ArrayUtils.square(size);
        for (int i = 0; i < size; i++) {
            for (int j = 0; j < size; j++) {
                if (i == j) {
                    continue;
                }
                var route = osrmService.queryRoute(List.of(points.get(i), points.get(j))).getRoutes().get(0);
                distances[i][j] = route.distanceKm();
                durations[i][j] = route.durationMinutes();
            }
        }
        return new DistanceMatrixResult(distances, durations, DistanceProvenance.ROAD_NETWORK);
    }

    private DistanceMatrixResult geometricMatrix(List<Coordinate> points) {
        int size = points.size();
        var distances = ArrayUtils.square(size);
        var durations = ArrayUtils.square(size);
        for (int i = 0; i < size; i++) {
            for (int j = 0; j < size; j++) {
                if (i == j) {
                    continue;
                }
                distances[i][j] = Utils.haversineKm(points.get(i), points.get(j));
                durations[i][j] = estimateMinutes(distances[i][j]);
            }
        }
        return new DistanceMatrixResult(distances, durations, DistanceProvenance.FALLBACK_GEOMETRIC);
    }

    private TravelCost geometricCost(Coordinate from, Coordinate to) {
        double distanceKm = Utils.haversineKm(from, to);
        return new TravelCost(distanceKm, estimateMinutes(distanceKm), DistanceProvenance.FALLBACK_GEOMETRIC);
    }

    private double estimateMinutes(double distanceKm) {
        return Utils.estimateTravelMinutes(
            distanceKm,
            planningConfig.getAverageSpeedKmh(),
            planningConfig.getTrafficBufferMultiplier()
        );
    }

    private static List<List<Double>> decodeOrNull(OSRMRoute route) {
        if (route.getGeometry() == null || route.getGeometry().isEmpty()) {
            return null;
        }
        return route.decodeGeometry();
    }
}
