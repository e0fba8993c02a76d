package org.mides.routeplanner.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;

/**
 * Road polyline through an ordered list of points. {@code path} is null
 * when the road network could not be queried; distance and duration are
 * then the geometric estimate along the straight legs.
 */
@Data
@AllArgsConstructor
public class RouteGeometry {

    @JsonProperty("path")
    private List<List<Double>> path;

    @JsonProperty("distance_km")
    private double distanceKm;

    @JsonProperty("duration_minutes")
    private double durationMinutes;

    @JsonProperty("provenance")
    private DistanceProvenance provenance;

    public boolean hasPath() {
        return path != null && !path.isEmpty();
    }
}
