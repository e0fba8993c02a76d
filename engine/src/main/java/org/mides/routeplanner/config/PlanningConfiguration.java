package org.mides.routeplanner.config;

import lombok.Data;
import org.mides.routeplanner.model.AssignmentStrategy;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Data
@Component
@ConfigurationProperties(prefix = "planning")
public class PlanningConfiguration {

    /* Geometric fallback */
    private double averageSpeedKmh = 50;
    private double trafficBufferMultiplier = 1.3;

    /* Clustering */
    private double maxClusterRadiusKm = 10.0;
    private int minClusterSize = 3;
    private int maxClusterSize = 40;

    private AssignmentStrategy assignmentStrategy = AssignmentStrategy.BALANCED;

    /* Sequencing */
    private boolean solverEnabled = true;
    private Duration solverTimeLimit = Duration.ofSeconds(5);
    private Duration solverGracePeriod = Duration.ofSeconds(2);
    private long priorityPenaltyMeters = 500;
    private double parkingSearchRadiusKm = 0.6;

    /* Drift */
    private double maxDetourKm = 3.0;
}
