package org.mides.routeplanner.service.sequencing;

import org.mides.routeplanner.config.PlanningConfiguration;
import org.mides.routeplanner.model.Depot;
import org.mides.routeplanner.model.Order;
import org.mides.routeplanner.model.ParkingLocation;
import org.mides.routeplanner.model.Waypoint;
import org.mides.routeplanner.util.Utils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Turns an ordered list of deliveries into waypoints, placing a parking stop
 * before every delivery flagged {@code parking_required}.
 */
@Component
public class ParkingPlanner {

    private static final Logger logger = LoggerFactory.getLogger(ParkingPlanner.class);

    private final PlanningConfiguration planningConfiguration;

    @Autowired
    public ParkingPlanner(PlanningConfiguration planningConfiguration) {
        this.planningConfiguration = planningConfiguration;
    }

    public List<Waypoint> buildWaypoints(
        Depot depot,
        List<Order> orderedDeliveries,
        List<ParkingLocation> parkingCandidates,
        List<String> warnings
    ) {
        var waypoints = new ArrayList<Waypoint>();
        waypoints.add(Waypoint.depot(depot));

        String currentParkingId = null;
        for (Order order : orderedDeliveries) {
            if (order.isParkingRequired()) {
                var parking = nearestParking(order, parkingCandidates);
                if (parking.isEmpty()) {
                    var warning = String.format("No parking location within %.2f km of order %s",
                        planningConfiguration.getParkingSearchRadiusKm(), order.getId());
                    logger.warn(warning);
                    warnings.add(warning);
                    currentParkingId = null;
                } else if (!parking.get().getId().equals(currentParkingId)) {
                    waypoints.add(Waypoint.parking(parking.get(), waypoints.size()));
                    currentParkingId = parking.get().getId();
                }
            } else {
                currentParkingId = null;
            }
            waypoints.add(Waypoint.delivery(order, waypoints.size()));
        }

        return waypoints;
    }

    public Optional<ParkingLocation> nearestParking(Order order, List<ParkingLocation> parkingCandidates) {
        if (parkingCandidates == null || parkingCandidates.isEmpty()) {
            return Optional.empty();
        }

        double radiusKm = planningConfiguration.getParkingSearchRadiusKm();
        return parkingCandidates.stream()
            .filter(p -> p.getCoordinates() != null)
            .filter(p -> Utils.haversineKm(order.getCoordinates(), p.getCoordinates()) <= radiusKm)
            .min(Comparator
                .comparingDouble((ParkingLocation p) -> Utils.haversineKm(order.getCoordinates(), p.getCoordinates()))
                .thenComparing(ParkingLocation::getId));
    }
}
