package org.mides.routeplanner.model.osrm;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
public class OSRMRoute {
    /* meters */
    private Double distance;

    /* seconds */
    private Double duration;

    private Double weight;
    private String geometry;

    @JsonProperty("weight_name")
    private String weightName;

    public double distanceKm() {
        return distance == null ? 0 : distance / 1000.0;
    }

    public double durationMinutes() {
        return duration == null ? 0 : duration / 60.0;
    }

    /**
     * Decodes the encoded polyline (precision 5) into {@code [lon, lat]} pairs.
     */
    public List<List<Double>> decodeGeometry() {
        if (geometry == null || geometry.isEmpty()) {
            throw new IllegalArgumentException("geometry");
        }

        char[] polylineChars = geometry.toCharArray();
        int index = 0;

        int currentLat = 0;
        int currentLng = 0;

        List<List<Double>> result = new ArrayList<>();

        while (index < polylineChars.length) {
            int[] lat = nextValue(polylineChars, index);
            if (lat == null) {
                break;
            }
            int[] lng = nextValue(polylineChars, lat[1]);
            if (lng == null) {
                break;
            }
            index = lng[1];

            currentLat += lat[0];
            currentLng += lng[0];

            result.add(List.of((double) currentLng / 1E5, (double) currentLat / 1E5));
        }

        return result;
    }

    /* Returns {value, nextIndex}, or null on a truncated chunk. */
    private static int[] nextValue(char[] chars, int index) {
        int sum = 0;
        int shifter = 0;
        int nextFiveBits;
        do {
            if (index >= chars.length) {
                return null;
            }
            nextFiveBits = chars[index++] - 63;
            sum |= (nextFiveBits & 31) << shifter;
            shifter += 5;
        } while (nextFiveBits >= 32);

        int value = (sum & 1) == 1 ? ~(sum >> 1) : (sum >> 1);
        return new int[]{value, index};
    }
}
