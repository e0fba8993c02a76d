package org.mides.routeplanner.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class InsertionCandidate {

    @JsonProperty("route_id")
    private String routeId;

    /* Version of the route snapshot the candidate was computed on */
    @JsonProperty("route_version")
    private long routeVersion;

    /* Sequence the new delivery takes, between waypoints index - 1 and index */
    @JsonProperty("insertion_index")
    private int insertionIndex;

    @JsonProperty("added_distance_km")
    private double addedDistanceKm;
}
