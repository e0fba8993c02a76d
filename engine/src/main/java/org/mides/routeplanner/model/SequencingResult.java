package org.mides.routeplanner.model;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;

@Data
@AllArgsConstructor
public class SequencingResult {
    private List<Waypoint> waypoints;
    private CostSummary costSummary;
}
