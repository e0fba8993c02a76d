package org.mides.routeplanner.model;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;

@Data
@AllArgsConstructor
public class ClusteringResult {

    private List<Cluster> clusters;

    /* Orders that could not enter clustering, e.g. missing coordinates */
    private List<String> unscheduledOrderIds;
}
