package org.mides.routeplanner.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import lombok.NoArgsConstructor;

/* Driver or dispatcher answer to a drift suggestion. */
@Data
@NoArgsConstructor
public class InsertionDecision {

    @Valid
    @NotNull
    @JsonProperty("order")
    private Order order;

    @NotNull
    @JsonProperty("route_id")
    private String routeId;

    @JsonProperty("insertion_index")
    private int insertionIndex;

    @JsonProperty("route_version")
    private long routeVersion;

    @JsonProperty("accepted")
    private boolean accepted;
}
