package org.mides.routeplanner.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum DriverStatus {
    @JsonProperty("available") AVAILABLE,
    @JsonProperty("on_route") ON_ROUTE,
    @JsonProperty("offline") OFFLINE
}
