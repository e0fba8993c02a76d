package org.mides.routeplanner.model;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;

@Data
@AllArgsConstructor
public class AssignmentResult {

    private List<DriverAssignment> assignments;

    private List<Cluster> unassignedClusters;

    public List<String> getUnassignedOrderIds() {
        return unassignedClusters.stream()
            .flatMap(cluster -> cluster.getOrderIds().stream())
            .toList();
    }
}
