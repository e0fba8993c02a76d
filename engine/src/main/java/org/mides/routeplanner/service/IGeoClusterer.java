package org.mides.routeplanner.service;

import org.mides.routeplanner.model.ClusteringResult;
import org.mides.routeplanner.model.Order;

import java.util.List;

public interface IGeoClusterer {
    ClusteringResult cluster(List<Order> orders, double maxRadiusKm, int minSize, int maxSize);
}
