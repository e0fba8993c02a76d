package org.mides.routeplanner.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One stop of a route. The {@code type} tags which entity
 * {@code referenceId} points at: a depot, a parking location or an order.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Waypoint {

    @JsonProperty("type")
    private WaypointType type;

    @JsonProperty("sequence")
    private int sequence;

    @JsonProperty("coordinates")
    private Coordinate coordinates;

    @JsonProperty("reference_id")
    private String referenceId;

    public static Waypoint depot(Depot depot) {
        return new Waypoint(WaypointType.DEPOT, 0, depot.getCoordinates(), depot.getId());
    }

    public static Waypoint parking(ParkingLocation parking, int sequence) {
        return new Waypoint(WaypointType.PARKING, sequence, parking.getCoordinates(), parking.getId());
    }

    public static Waypoint delivery(Order order, int sequence) {
        if (!order.isRoutable()) {
            throw new IllegalArgumentException(
                String.format("Order %s has no coordinates and cannot be a delivery waypoint", order.getId())
            );
        }
        return new Waypoint(WaypointType.DELIVERY, sequence, order.getCoordinates(), order.getId());
    }

    public Waypoint copy() {
        var coordinatesCopy = coordinates == null
            ? null
            : new Coordinate(coordinates.getLatitude(), coordinates.getLongitude());
        return new Waypoint(type, sequence, coordinatesCopy, referenceId);
    }
}
