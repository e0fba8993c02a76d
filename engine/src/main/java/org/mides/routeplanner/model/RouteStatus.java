package org.mides.routeplanner.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum RouteStatus {
    @JsonProperty("planned") PLANNED,
    @JsonProperty("in_transit") IN_TRANSIT,
    @JsonProperty("completed") COMPLETED;

    public boolean isActive() {
        return this != COMPLETED;
    }

    /* Routes only move forward: planned, in transit, completed */
    public boolean canMoveTo(RouteStatus next) {
        return next != null && next.ordinal() > ordinal();
    }
}
