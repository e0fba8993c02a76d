package org.mides.routeplanner.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * One "plan routes" invocation. Optional tuning values fall back to the
 * {@code planning.*} configuration when absent.
 */
@Data
@NoArgsConstructor
public class PlanRequest {

    /* Client chosen id, lets the caller abort the batch while it runs */
    @JsonProperty("batch_id")
    private String batchId;

    @Valid
    @NotNull
    @JsonProperty("depot")
    private Depot depot;

    @Valid
    @JsonProperty("parking_locations")
    private List<ParkingLocation> parkingLocations = new ArrayList<>();

    @Valid
    @NotNull
    @JsonProperty("orders")
    private List<Order> orders = new ArrayList<>();

    @Valid
    @NotNull
    @JsonProperty("drivers")
    private List<Driver> drivers = new ArrayList<>();

    @JsonProperty("route_start_time")
    private LocalDateTime routeStartTime;

    @JsonProperty("strategy")
    private AssignmentStrategy strategy;

    @Positive
    @JsonProperty("max_radius_km")
    private Double maxRadiusKm;

    @Positive
    @JsonProperty("min_cluster_size")
    private Integer minClusterSize;

    @Positive
    @JsonProperty("max_cluster_size")
    private Integer maxClusterSize;
}
