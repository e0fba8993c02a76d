package org.mides.routeplanner.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Transient group of routable orders that seeds one route. Orders are
 * kept sorted by id so every derived value is reproducible.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Cluster {

    private List<Order> orders = new ArrayList<>();

    /* Set when the group stayed below the minimum size after merging */
    private boolean smallRoute;

    public Cluster(List<Order> orders) {
        this.orders = new ArrayList<>(orders);
        this.orders.sort(Comparator.comparing(Order::getId));
    }

    public int size() {
        return orders.size();
    }

    public List<String> getOrderIds() {
        return orders.stream().map(Order::getId).toList();
    }

    public String smallestOrderId() {
        return orders.isEmpty() ? "" : orders.get(0).getId();
    }

    public Coordinate centroid() {
        double latitude = 0;
        double longitude = 0;
        for (Order order : orders) {
            latitude += order.getCoordinates().getLatitude();
            longitude += order.getCoordinates().getLongitude();
        }
        return new Coordinate(latitude / orders.size(), longitude / orders.size());
    }

    public Cluster mergedWith(Cluster other) {
        var merged = new ArrayList<>(orders);
        merged.addAll(other.getOrders());
        return new Cluster(merged);
    }
}
