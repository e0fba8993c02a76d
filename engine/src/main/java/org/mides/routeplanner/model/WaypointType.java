package org.mides.routeplanner.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum WaypointType {
    @JsonProperty("depot") DEPOT,
    @JsonProperty("parking") PARKING,
    @JsonProperty("delivery") DELIVERY
}
