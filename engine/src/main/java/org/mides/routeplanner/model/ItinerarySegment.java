package org.mides.routeplanner.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/* Leg from waypoint {@code fromSequence} to waypoint {@code fromSequence + 1}. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ItinerarySegment {

    @JsonProperty("from_sequence")
    private int fromSequence;

    @JsonProperty("to_sequence")
    private int toSequence;

    @JsonProperty("distance_km")
    private double distanceKm;

    @JsonProperty("duration_minutes")
    private double durationMinutes;

    @JsonProperty("geometry")
    private List<List<Double>> geometry = new ArrayList<>();

    @JsonProperty("provenance")
    private DistanceProvenance provenance;
}
