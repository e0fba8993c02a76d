package org.mides.routeplanner.util;

import java.util.List;

public class ArrayUtils {

    public static double[][] convertTo2DDoubleArray(List<List<Double>> list, double divisor) {
        if (list == null || list.isEmpty()) {
            throw new IllegalArgumentException("Input list cannot be null or empty");
        }

        int rows = list.size();
        int cols = list.get(0).size();
        double[][] result = new double[rows][cols];

        for (int i = 0; i < rows; i++) {
            if (list.get(i).size() != cols) {
                throw new IllegalArgumentException("All inner lists must have the same number of elements");
            }
            for (int j = 0; j < cols; j++) {
                result[i][j] = list.get(i).get(j) / divisor;
            }
        }

        return result;
    }

    public static double[][] square(int size) {
        return new double[size][size];
    }
}
