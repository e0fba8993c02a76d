package org.mides.routeplanner.model;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class DriverAssignment {
    private Cluster cluster;
    private Driver driver;
    private int routeIndex;
}
