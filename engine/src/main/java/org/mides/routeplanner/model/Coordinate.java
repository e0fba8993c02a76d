package org.mides.routeplanner.model;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Locale;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class Coordinate {
    @NotNull
    private Double latitude;

    @NotNull
    private Double longitude;

    /* GeoJSON order, as returned by the decoded OSRM geometry */
    public List<Double> toLonLat() {
        return List.of(longitude, latitude);
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "%.8f,%.8f", longitude, latitude);
    }
}
