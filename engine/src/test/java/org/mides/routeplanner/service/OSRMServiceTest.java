package org.mides.routeplanner.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mides.routeplanner.config.OSRMConfiguration;
import org.mides.routeplanner.exception.osrm.QueryMatrixException;
import org.mides.routeplanner.exception.osrm.QueryRouteException;
import org.mides.routeplanner.model.Coordinate;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.ExpectedCount;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.util.List;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.startsWith;
import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class OSRMServiceTest {

    private MockRestServiceServer server;
    private OSRMService osrmService;

    private final List<Coordinate> coordinates = List.of(
        new Coordinate(-34.9011, -56.1645),
        new Coordinate(-34.8941, -56.1528),
        new Coordinate(-34.9058, -56.1913)
    );

    @BeforeEach
    void setUp() {
        var config = new OSRMConfiguration();
        config.setBaseUrl("http://osrm.test");

        var builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        osrmService = new OSRMService(builder.build(), config);
    }

    @Test
    void queryRoute_okResponse_shouldReturnRouteWithGeometry() {
        server.expect(requestTo(startsWith("http://osrm.test/route/v1/driving/-56.16450000,-34.90110000;")))
            .andRespond(withSuccess("""
                {"code":"Ok","routes":[{"distance":1500.0,"duration":120.0,
                  "geometry":"_p~iF~ps|U_ulLnnqC_mqNvxq`@","weight_name":"routability"}]}
                """, MediaType.APPLICATION_JSON));

        var result = osrmService.queryRoute(coordinates.subList(0, 2));

        server.verify();
        var route = result.getRoutes().get(0);
        assertEquals(1.5, route.distanceKm());
        assertEquals(2.0, route.durationMinutes());
        assertEquals(List.of(
            List.of(-120.2, 38.5),
            List.of(-120.95, 40.7),
            List.of(-126.453, 43.252)
        ), route.decodeGeometry());
    }

    @Test
    void queryRoute_errorCode_shouldThrowQueryRouteException() {
        server.expect(requestTo(startsWith("http://osrm.test/route/v1/driving/")))
            .andRespond(withSuccess("{\"code\":\"NoRoute\",\"routes\":[]}", MediaType.APPLICATION_JSON));

        var ex = assertThrows(QueryRouteException.class, () -> osrmService.queryRoute(coordinates));
        assertTrue(ex.getMessage().contains("NoRoute"));
    }

    @Test
    void queryRoute_serverError_shouldThrowQueryRouteException() {
        server.expect(requestTo(startsWith("http://osrm.test/route/v1/driving/")))
            .andRespond(withServerError());

        assertThrows(QueryRouteException.class, () -> osrmService.queryRoute(coordinates));
    }

    @Test
    void queryMatrix_unreachablePair_shouldThrowQueryMatrixException() {
        server.expect(requestTo(startsWith("http://osrm.test/table/v1/driving/")))
            .andRespond(withSuccess("""
                {"code":"Ok",
                 "distances":[[0.0,null],[10.0,0.0]],
                 "durations":[[0.0,5.0],[5.0,0.0]]}
                """, MediaType.APPLICATION_JSON));

        assertThrows(QueryMatrixException.class, () -> osrmService.queryMatrix(coordinates.subList(0, 2)));
    }

    @Test
    void queryMatrixInBatches_fitsInOneBatch_shouldIssueSingleTableQuery() {
        server.expect(ExpectedCount.once(), requestTo(containsString("annotations=distance,duration")))
            .andRespond(withSuccess("""
                {"code":"Ok",
                 "distances":[[0.0,10.0,20.0],[10.0,0.0,30.0],[20.0,30.0,0.0]],
                 "durations":[[0.0,1.0,2.0],[1.0,0.0,3.0],[2.0,3.0,0.0]]}
                """, MediaType.APPLICATION_JSON));

        var result = osrmService.queryMatrixInBatches(coordinates, 100);

        server.verify();
        assertEquals(30.0, result.getDistances().get(1).get(2));
    }

    @Test
    void queryMatrixInBatches_largerThanBatch_shouldStitchBlocks() {
        // Batch size 2 gives one source and one destination per query: 3 x 3 queries
        server.expect(ExpectedCount.times(9), requestTo(containsString("&sources=0&destinations=1")))
            .andRespond(withSuccess(
                "{\"code\":\"Ok\",\"distances\":[[100.0]],\"durations\":[[10.0]]}",
                MediaType.APPLICATION_JSON));

        var result = osrmService.queryMatrixInBatches(coordinates, 2);

        server.verify();
        assertEquals("Ok", result.getCode());
        assertTrue(result.isComplete(3, 3));
        assertEquals(100.0, result.getDistances().get(2).get(0));
        assertEquals(10.0, result.getDurations().get(0).get(2));
    }
}
