package org.mides.routeplanner.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class Depot {

    @NotNull
    @JsonProperty("id")
    private String id;

    @Valid
    @NotNull
    @JsonProperty("coordinates")
    private Coordinate coordinates;

    @JsonProperty("address")
    private String address;
}
