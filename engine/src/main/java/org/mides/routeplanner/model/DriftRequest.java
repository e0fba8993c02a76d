package org.mides.routeplanner.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
public class DriftRequest {

    @Valid
    @NotNull
    @JsonProperty("order")
    private Order order;

    @Positive
    @JsonProperty("max_detour_km")
    private Double maxDetourKm;
}
