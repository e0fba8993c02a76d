package org.mides.routeplanner.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class TravelCost {

    @JsonProperty("distance_km")
    private double distanceKm;

    @JsonProperty("duration_minutes")
    private double durationMinutes;

    @JsonProperty("provenance")
    private DistanceProvenance provenance;
}
