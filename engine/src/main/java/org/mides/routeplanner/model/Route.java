package org.mides.routeplanner.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Route {

    @JsonProperty("id")
    private String id;

    @JsonProperty("name")
    private String name;

    @JsonProperty("color")
    private String color;

    @JsonProperty("driver_id")
    private String driverId;

    @JsonProperty("status")
    private RouteStatus status = RouteStatus.PLANNED;

    @JsonProperty("waypoints")
    private List<Waypoint> waypoints = new ArrayList<>();

    @JsonProperty("total_distance_km")
    private double totalDistanceKm;

    @JsonProperty("total_duration_minutes")
    private double totalDurationMinutes;

    @JsonProperty("provenance")
    private DistanceProvenance provenance = DistanceProvenance.FALLBACK_GEOMETRIC;

    @JsonProperty("optimization_method")
    private OptimizationMethod optimizationMethod = OptimizationMethod.NONE;

    @JsonProperty("improvement_percent")
    private double improvementPercent;

    @JsonProperty("small_route")
    private boolean smallRoute;

    @JsonProperty("start_time")
    private LocalDateTime startTime;

    /* Bumped on every structural change of the waypoint list */
    @JsonProperty("version")
    private long version;

    @JsonIgnore
    public boolean usedRoadNetwork() {
        return provenance == DistanceProvenance.ROAD_NETWORK;
    }

    @JsonIgnore
    public List<String> getDeliveryOrderIds() {
        return waypoints.stream()
            .filter(w -> w.getType() == WaypointType.DELIVERY)
            .map(Waypoint::getReferenceId)
            .toList();
    }

    public Route copy() {
        var copy = new Route();
        copy.setId(id);
        copy.setName(name);
        copy.setColor(color);
        copy.setDriverId(driverId);
        copy.setStatus(status);
        copy.setWaypoints(new ArrayList<>(waypoints.stream().map(Waypoint::copy).toList()));
        copy.setTotalDistanceKm(totalDistanceKm);
        copy.setTotalDurationMinutes(totalDurationMinutes);
        copy.setProvenance(provenance);
        copy.setOptimizationMethod(optimizationMethod);
        copy.setImprovementPercent(improvementPercent);
        copy.setSmallRoute(smallRoute);
        copy.setStartTime(startTime);
        copy.setVersion(version);
        return copy;
    }
}
