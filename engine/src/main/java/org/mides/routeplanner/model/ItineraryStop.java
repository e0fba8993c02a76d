package org.mides.routeplanner.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ItineraryStop {

    @JsonProperty("waypoint")
    private Waypoint waypoint;

    @JsonProperty("cumulative_distance_km")
    private double cumulativeDistanceKm;

    @JsonProperty("cumulative_duration_minutes")
    private double cumulativeDurationMinutes;

    @JsonProperty("estimated_arrival")
    private LocalDateTime estimatedArrival;
}
