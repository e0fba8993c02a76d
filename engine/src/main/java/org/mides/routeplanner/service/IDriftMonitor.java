package org.mides.routeplanner.service;

import org.mides.routeplanner.model.InsertionCandidate;
import org.mides.routeplanner.model.Order;
import org.mides.routeplanner.model.Route;

import java.util.List;

public interface IDriftMonitor {
    List<InsertionCandidate> findInsertionCandidates(Order newOrder, List<Route> activeRoutes, double maxDetourKm);

    /* Against the routes currently in the registry */
    List<InsertionCandidate> findInsertionCandidates(Order newOrder, double maxDetourKm);
}
