package org.mides.routeplanner.service;

import org.mides.routeplanner.model.DistanceProvenance;
import org.mides.routeplanner.model.Itinerary;
import org.mides.routeplanner.model.ItinerarySegment;
import org.mides.routeplanner.model.ItineraryStop;
import org.mides.routeplanner.model.Waypoint;
import org.mides.routeplanner.util.Utils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Derives the itinerary of a route from its waypoint list. Nothing is cached:
 * calling it again reflects the current state of the road network.
 */
@Service
public class RouteSynthesizer implements IRouteSynthesizer {

    private static final Logger logger = LoggerFactory.getLogger(RouteSynthesizer.class);

    private final IDistanceProvider distanceProvider;

    @Autowired
    public RouteSynthesizer(IDistanceProvider distanceProvider) {
        this.distanceProvider = distanceProvider;
    }

    @Override
    public Itinerary synthesize(String routeId, List<Waypoint> sequencedWaypoints, LocalDateTime startTime) {
        var itinerary = new Itinerary();
        itinerary.setRouteId(routeId);
        itinerary.setStartTime(startTime);

        var stops = new ArrayList<ItineraryStop>();
        var segments = new ArrayList<ItinerarySegment>();
        var provenance = DistanceProvenance.ROAD_NETWORK;

        double cumulativeKm = 0;
        double cumulativeMinutes = 0;

        for (int i = 0; i < sequencedWaypoints.size(); i++) {
            var waypoint = sequencedWaypoints.get(i);

            if (i > 0) {
                var previous = sequencedWaypoints.get(i - 1);
                var segment = buildSegment(previous, waypoint);
                segments.add(segment);
                provenance = provenance.combine(segment.getProvenance());
                cumulativeKm += segment.getDistanceKm();
                cumulativeMinutes += segment.getDurationMinutes();
            }

            stops.add(new ItineraryStop(
                waypoint,
                Utils.round(cumulativeKm, 3),
                Utils.round(cumulativeMinutes, 2),
                estimateArrival(startTime, cumulativeMinutes)
            ));
        }

        itinerary.setStops(stops);
        itinerary.setSegments(segments);
        itinerary.setTotalDistanceKm(Utils.round(cumulativeKm, 3));
        itinerary.setTotalDurationMinutes(Utils.round(cumulativeMinutes, 2));
        itinerary.setProvenance(provenance);

        logger.debug("Itinerary for route {}: {} stops, {} km, {}", routeId, stops.size(),
            itinerary.getTotalDistanceKm(), provenance);
        return itinerary;
    }

    private ItinerarySegment buildSegment(Waypoint from, Waypoint to) {
        var geometry = distanceProvider.routeGeometry(List.of(from.getCoordinates(), to.getCoordinates()));

        /* No road polyline: the straight segment between the two waypoints */
        List<List<Double>> path = geometry.hasPath()
            ? geometry.getPath()
            : List.of(from.getCoordinates().toLonLat(), to.getCoordinates().toLonLat());

        return new ItinerarySegment(
            from.getSequence(),
            to.getSequence(),
            Utils.round(geometry.getDistanceKm(), 3),
            Utils.round(geometry.getDurationMinutes(), 2),
            path,
            geometry.getProvenance()
        );
    }

    private static LocalDateTime estimateArrival(LocalDateTime startTime, double cumulativeMinutes) {
        if (startTime == null) {
            return null;
        }
        return startTime.plusSeconds(Math.round(cumulativeMinutes * 60));
    }
}
