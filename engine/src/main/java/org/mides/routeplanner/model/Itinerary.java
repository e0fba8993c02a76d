package org.mides.routeplanner.model;

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
public class Itinerary {

    @JsonProperty("route_id")
    private String routeId;

    @JsonProperty("start_time")
    private LocalDateTime startTime;

    @JsonProperty("stops")
    private List<ItineraryStop> stops = new ArrayList<>();

    @JsonProperty("segments")
    private List<ItinerarySegment> segments = new ArrayList<>();

    @JsonProperty("total_distance_km")
    private double totalDistanceKm;

    @JsonProperty("total_duration_minutes")
    private double totalDurationMinutes;

    @JsonProperty("provenance")
    private DistanceProvenance provenance = DistanceProvenance.ROAD_NETWORK;
}
