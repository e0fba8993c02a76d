package org.mides.routeplanner.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PlanSummary {

    @JsonProperty("routes_created")
    private int routesCreated;

    @JsonProperty("orders_scheduled")
    private int ordersScheduled;

    @JsonProperty("orders_unscheduled")
    private int ordersUnscheduled;

    @JsonProperty("total_distance_km")
    private double totalDistanceKm;

    @JsonProperty("total_time_minutes")
    private double totalTimeMinutes;

    @JsonProperty("drivers_used")
    private int driversUsed;

    @JsonProperty("small_routes")
    private int smallRoutes;

    @JsonProperty("used_road_network")
    private boolean usedRoadNetwork;

    @Builder.Default
    @JsonProperty("warnings")
    private List<String> warnings = new ArrayList<>();
}
