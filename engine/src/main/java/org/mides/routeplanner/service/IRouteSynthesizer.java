package org.mides.routeplanner.service;

import org.mides.routeplanner.model.Itinerary;
import org.mides.routeplanner.model.Route;
import org.mides.routeplanner.model.Waypoint;

import java.time.LocalDateTime;
import java.util.List;

public interface IRouteSynthesizer {
    Itinerary synthesize(String routeId, List<Waypoint> sequencedWaypoints, LocalDateTime startTime);

    default Itinerary synthesize(Route route) {
        return synthesize(route.getId(), route.getWaypoints(), route.getStartTime());
    }
}
