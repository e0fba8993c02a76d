package org.mides.routeplanner.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum OrderStatus {
    @JsonProperty("pending") PENDING,
    @JsonProperty("assigned") ASSIGNED,
    @JsonProperty("in_transit") IN_TRANSIT,
    @JsonProperty("completed") COMPLETED,
    @JsonProperty("failed") FAILED
}
