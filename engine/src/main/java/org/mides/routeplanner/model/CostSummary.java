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
public class CostSummary {

    @JsonProperty("total_distance_km")
    private double totalDistanceKm;

    @JsonProperty("total_duration_minutes")
    private double totalDurationMinutes;

    @JsonProperty("naive_distance_km")
    private double naiveDistanceKm;

    @JsonProperty("sequenced_distance_km")
    private double sequencedDistanceKm;

    @JsonProperty("improvement_percent")
    private double improvementPercent;

    @JsonProperty("optimization_method")
    private OptimizationMethod optimizationMethod;

    @JsonProperty("provenance")
    private DistanceProvenance provenance;

    @Builder.Default
    @JsonProperty("warnings")
    private List<String> warnings = new ArrayList<>();
}
