package org.mides.routeplanner.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum DistanceProvenance {
    @JsonProperty("road_network") ROAD_NETWORK,
    @JsonProperty("fallback_geometric") FALLBACK_GEOMETRIC;

    /* Combining results is only as accurate as the weakest part. */
    public DistanceProvenance combine(DistanceProvenance other) {
        return this == ROAD_NETWORK && other == ROAD_NETWORK ? ROAD_NETWORK : FALLBACK_GEOMETRIC;
    }
}
