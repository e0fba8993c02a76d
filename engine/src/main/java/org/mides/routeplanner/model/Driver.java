package org.mides.routeplanner.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Driver {

    @NotNull
    @JsonProperty("id")
    private String id;

    @JsonProperty("name")
    private String name;

    @JsonProperty("status")
    private DriverStatus status = DriverStatus.AVAILABLE;

    /* Orders on the driver's active route, 0 when idle */
    @JsonProperty("current_load")
    private int currentLoad;

    @JsonProperty("last_known_position")
    private Coordinate lastKnownPosition;

    public Driver(String id, DriverStatus status, int currentLoad) {
        this.id = id;
        this.status = status;
        this.currentLoad = currentLoad;
    }
}
