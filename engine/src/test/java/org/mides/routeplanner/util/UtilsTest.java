package org.mides.routeplanner.util;

import org.junit.jupiter.api.Test;
import org.mides.routeplanner.model.Coordinate;

import static org.junit.jupiter.api.Assertions.*;

class UtilsTest {

    @Test
    void haversineKm_oneDegreeAlongEquator_shouldBeAbout111Km() {
        double distance = Utils.haversineKm(new Coordinate(0.0, 0.0), new Coordinate(0.0, 1.0));

        assertEquals(111.195, distance, 0.001);
    }

    @Test
    void haversineKm_samePoint_shouldBeZero() {
        var point = new Coordinate(-34.9011, -56.1645);

        assertEquals(0.0, Utils.haversineKm(point, point));
    }

    @Test
    void estimateTravelMinutes_shouldApplySpeedAndBuffer() {
        // 50 km at 50 km/h is one hour, plus 30%
        assertEquals(78.0, Utils.estimateTravelMinutes(50, 50, 1.3), 1e-9);
        assertEquals(0.0, Utils.estimateTravelMinutes(0, 50, 1.3));
    }

    @Test
    void routeName_shouldUseInitialsOrFallBackToIndex() {
        assertEquals("MS", Utils.routeName("Michael Schneider", 0));
        assertEquals("AN", Utils.routeName("anna", 0));
        assertEquals("R3", Utils.routeName(null, 2));
        assertEquals("R1", Utils.routeName("  ", 0));
    }

    @Test
    void routeColor_shouldCycleThroughPalette() {
        assertEquals(Constants.ROUTE_COLORS[0], Utils.routeColor(0));
        assertEquals(Constants.ROUTE_COLORS[0], Utils.routeColor(Constants.ROUTE_COLORS.length));
    }

    @Test
    void round_shouldKeepRequestedDecimals() {
        assertEquals(12.35, Utils.round(12.3456, 2));
        assertEquals(0.1, Utils.round(0.1 + 0.2 - 0.2, 3));
    }
}
