package org.mides.routeplanner.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.mides.routeplanner.util.Constants;

import java.util.ArrayList;
import java.util.List;

/**
 * Input of one route's sequencing. Node 0 is the depot; node {@code i}
 * for {@code i >= 1} is {@code deliveries.get(i - 1)}.
 */
@Data
@NoArgsConstructor
public class SequencingProblem {

    public static final int DEPOT_NODE = 0;

    private Depot depot;

    private List<Order> deliveries = new ArrayList<>();

    private DistanceMatrixResult matrix;

    /* Objective weight, in meters, per priority rank and route position */
    private long priorityPenaltyMeters;

    public SequencingProblem(Depot depot, List<Order> deliveries) {
        this.depot = depot;
        this.deliveries = new ArrayList<>(deliveries);
    }

    public int getNumberOfNodes() {
        return deliveries.size() + 1;
    }

    public Order deliveryAt(int node) {
        return deliveries.get(node - 1);
    }

    public List<Coordinate> getAllCoordinates() {
        var coordinates = new ArrayList<Coordinate>();
        coordinates.add(depot.getCoordinates());
        deliveries.forEach(order -> coordinates.add(order.getCoordinates()));
        return coordinates;
    }

    public long[][] getDistanceCostMatrix() {
        int nodes = getNumberOfNodes();
        var costs = new long[nodes][nodes];
        for (int i = 0; i < nodes; i++) {
            for (int j = 0; j < nodes; j++) {
                costs[i][j] = Math.round(matrix.distanceKm(i, j) * 1000 * Constants.DISTANCE_MULTIPLIER);
            }
        }
        return costs;
    }

    public long[] getPriorityRanks() {
        var ranks = new long[getNumberOfNodes()];

        /* The depot is never penalised */
        ranks[DEPOT_NODE] = 0;
        for (int node = 1; node < getNumberOfNodes(); node++) {
            ranks[node] = deliveryAt(node).effectivePriority().rank();
        }
        return ranks;
    }

    /**
     * Hard ordering pairs {@code {before, after}} as node indices: a delivery
     * whose window closes strictly before another opens must be visited first.
     */
    public List<int[]> getPrecedencePairs() {
        var pairs = new ArrayList<int[]>();
        for (int i = 1; i < getNumberOfNodes(); i++) {
            var window = deliveryAt(i).effectiveTimeWindow();
            for (int j = 1; j < getNumberOfNodes(); j++) {
                if (i != j && window.strictlyPrecedes(deliveryAt(j).effectiveTimeWindow())) {
                    pairs.add(new int[]{i, j});
                }
            }
        }
        return pairs;
    }

    /* Whether a visiting order (node indices, depot excluded) honours every precedence pair. */
    public boolean respectsPrecedences(List<Integer> visitOrder) {
        var position = new int[getNumberOfNodes()];
        for (int i = 0; i < visitOrder.size(); i++) {
            position[visitOrder.get(i)] = i;
        }
        return getPrecedencePairs().stream().allMatch(pair -> position[pair[0]] < position[pair[1]]);
    }

    /* Open path cost: depot to the first delivery, then along the visit order, no return leg. */
    public double pathDistanceKm(List<Integer> visitOrder) {
        double total = 0;
        int current = DEPOT_NODE;
        for (int node : visitOrder) {
            total += matrix.distanceKm(current, node);
            current = node;
        }
        return total;
    }

    public List<Integer> getInputOrder() {
        var order = new ArrayList<Integer>();
        for (int node = 1; node < getNumberOfNodes(); node++) {
            order.add(node);
        }
        return order;
    }
}
