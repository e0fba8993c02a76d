package org.mides.routeplanner.service;

import org.junit.jupiter.api.Test;
import org.mides.routeplanner.config.OSRMConfiguration;
import org.mides.routeplanner.config.PlanningConfiguration;
import org.mides.routeplanner.model.Coordinate;
import org.mides.routeplanner.model.Depot;
import org.mides.routeplanner.model.DistanceProvenance;
import org.mides.routeplanner.model.Order;
import org.mides.routeplanner.model.RouteGeometry;
import org.mides.routeplanner.model.Waypoint;
import org.mides.routeplanner.util.Utils;

import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class RouteSynthesizerTest {

    private final LocalDateTime start = LocalDateTime.of(2024, 5, 2, 8, 0);

    private static List<Waypoint> waypoints() {
        return List.of(
            Waypoint.depot(new Depot("DEPOT", new Coordinate(0.0, 0.0), null)),
            Waypoint.delivery(new Order("O1", new Coordinate(0.0, 0.01)), 1),
            Waypoint.delivery(new Order("O2", new Coordinate(0.0, 0.02)), 2)
        );
    }

    @Test
    void synthesize_geometricMode_shouldUseStraightSegments() {
        // Arrange
        var osrmConfig = new OSRMConfiguration();
        osrmConfig.setEnabled(false);
        var distanceProvider = new DistanceProvider(mock(IOSRMService.class), osrmConfig, new PlanningConfiguration());
        var synthesizer = new RouteSynthesizer(distanceProvider);

        // Act
        var itinerary = synthesizer.synthesize("R-00000001", waypoints(), start);

        // Assert
        assertEquals(3, itinerary.getStops().size());
        assertEquals(2, itinerary.getSegments().size());
        for (int i = 0; i < itinerary.getSegments().size(); i++) {
            var segment = itinerary.getSegments().get(i);
            assertEquals(i, segment.getFromSequence());
            assertEquals(i + 1, segment.getToSequence());
            assertEquals(2, segment.getGeometry().size());
        }
        assertEquals(List.of(0.01, 0.0), itinerary.getSegments().get(0).getGeometry().get(1));

        double legKm = Utils.haversineKm(new Coordinate(0.0, 0.0), new Coordinate(0.0, 0.01));
        double legMinutes = Utils.estimateTravelMinutes(legKm, 50, 1.3);
        var firstStop = itinerary.getStops().get(1);
        assertEquals(Utils.round(legKm, 3), firstStop.getCumulativeDistanceKm());
        assertEquals(start.plusSeconds(Math.round(legMinutes * 60)), firstStop.getEstimatedArrival());
        assertEquals(start, itinerary.getStops().get(0).getEstimatedArrival());
        assertEquals(0.0, itinerary.getStops().get(0).getCumulativeDistanceKm());
        assertEquals(DistanceProvenance.FALLBACK_GEOMETRIC, itinerary.getProvenance());
    }

    @Test
    void synthesize_roadNetwork_shouldUsePolylineAndKeepProvenance() {
        var distanceProvider = mock(IDistanceProvider.class);
        var path = List.of(List.of(0.0, 0.0), List.of(0.005, 0.001), List.of(0.01, 0.0));
        when(distanceProvider.routeGeometry(anyList()))
            .thenReturn(new RouteGeometry(path, 1.5, 3.0, DistanceProvenance.ROAD_NETWORK));
        var synthesizer = new RouteSynthesizer(distanceProvider);

        var itinerary = synthesizer.synthesize("R-00000002", waypoints(), start);

        assertEquals(path, itinerary.getSegments().get(0).getGeometry());
        assertEquals(3.0, itinerary.getTotalDistanceKm());
        assertEquals(6.0, itinerary.getTotalDurationMinutes());
        assertEquals(start.plusMinutes(6), itinerary.getStops().get(2).getEstimatedArrival());
        assertEquals(DistanceProvenance.ROAD_NETWORK, itinerary.getProvenance());
    }

    @Test
    void synthesize_depotOnly_shouldHaveNoSegments() {
        var synthesizer = new RouteSynthesizer(mock(IDistanceProvider.class));

        var itinerary = synthesizer.synthesize("R-00000003", waypoints().subList(0, 1), null);

        assertEquals(1, itinerary.getStops().size());
        assertTrue(itinerary.getSegments().isEmpty());
        assertNull(itinerary.getStops().get(0).getEstimatedArrival());
    }
}
