package org.mides.routeplanner.service;

import org.mides.routeplanner.model.InsertionDecision;
import org.mides.routeplanner.model.Route;

import java.util.Optional;

public interface IInsertionService {
    /* The updated route when accepted, empty when the order went back to the pool */
    Optional<Route> apply(InsertionDecision decision);
}
