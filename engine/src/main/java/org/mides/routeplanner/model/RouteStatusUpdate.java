package org.mides.routeplanner.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import lombok.NoArgsConstructor;

/* Driver progress report for a dispatched route. */
@Data
@NoArgsConstructor
public class RouteStatusUpdate {

    @NotNull
    @JsonProperty("status")
    private RouteStatus status;

    @JsonProperty("route_version")
    private long routeVersion;
}
