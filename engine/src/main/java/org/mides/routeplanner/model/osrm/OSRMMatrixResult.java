package org.mides.routeplanner.model.osrm;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Data;

import java.util.List;
import java.util.Objects;

@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
public class OSRMMatrixResult {
    private String code;
    private String message;
    private List<List<Double>> distances;
    private List<List<Double>> durations;

    /* OSRM answers null for unreachable pairs */
    public boolean isComplete(int rows, int cols) {
        return hasShape(distances, rows, cols) && hasShape(durations, rows, cols);
    }

    private static boolean hasShape(List<List<Double>> matrix, int rows, int cols) {
        if (matrix == null || matrix.size() != rows) {
            return false;
        }
        return matrix.stream().allMatch(row -> row != null
            && row.size() == cols
            && row.stream().allMatch(Objects::nonNull));
    }
}
