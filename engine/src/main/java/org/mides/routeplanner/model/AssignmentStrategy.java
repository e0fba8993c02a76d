package org.mides.routeplanner.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum AssignmentStrategy {
    @JsonProperty("balanced") BALANCED,
    @JsonProperty("sequential") SEQUENTIAL
}
