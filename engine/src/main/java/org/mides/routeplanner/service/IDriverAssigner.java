package org.mides.routeplanner.service;

import org.mides.routeplanner.model.AssignmentResult;
import org.mides.routeplanner.model.AssignmentStrategy;
import org.mides.routeplanner.model.Cluster;
import org.mides.routeplanner.model.Driver;

import java.util.List;

public interface IDriverAssigner {
    AssignmentResult assign(List<Cluster> clusters, List<Driver> availableDrivers, AssignmentStrategy strategy);
}
