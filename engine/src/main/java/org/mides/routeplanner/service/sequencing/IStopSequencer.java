package org.mides.routeplanner.service.sequencing;

import org.mides.routeplanner.model.Depot;
import org.mides.routeplanner.model.Order;
import org.mides.routeplanner.model.ParkingLocation;
import org.mides.routeplanner.model.SequencingResult;

import java.util.List;

public interface IStopSequencer {
    SequencingResult sequence(Depot depot, List<ParkingLocation> parkingCandidates, List<Order> deliveries);
}
