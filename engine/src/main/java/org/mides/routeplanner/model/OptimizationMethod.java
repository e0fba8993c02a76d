package org.mides.routeplanner.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum OptimizationMethod {
    @JsonProperty("or_tools") OR_TOOLS,
    @JsonProperty("nearest_neighbor_fallback") NEAREST_NEIGHBOR_FALLBACK,
    @JsonProperty("none") NONE
}
