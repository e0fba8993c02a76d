package org.mides.routeplanner.model;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * N x N travel costs between the points of a matrix query, in the order
 * the points were given. {@code provenance} covers the whole matrix: a
 * matrix is never partly road network and partly geometric.
 */
@Getter
@AllArgsConstructor
public class DistanceMatrixResult {

    private final double[][] distancesKm;
    private final double[][] durationsMinutes;
    private final DistanceProvenance provenance;

    public int size() {
        return distancesKm.length;
    }

    public double distanceKm(int from, int to) {
        return distancesKm[from][to];
    }

    public double durationMinutes(int from, int to) {
        return durationsMinutes[from][to];
    }

    public boolean usedRoadNetwork() {
        return provenance == DistanceProvenance.ROAD_NETWORK;
    }
}
