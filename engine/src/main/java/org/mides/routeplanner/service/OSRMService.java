package org.mides.routeplanner.service;

import org.mides.routeplanner.config.OSRMConfiguration;
import org.mides.routeplanner.exception.osrm.QueryMatrixException;
import org.mides.routeplanner.exception.osrm.QueryRouteException;
import org.mides.routeplanner.model.Coordinate;
import org.mides.routeplanner.model.osrm.OSRMMatrixResult;
import org.mides.routeplanner.model.osrm.OSRMRouteResult;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

@Service
public class OSRMService implements IOSRMService {

    private final RestClient restClient;
    private final OSRMConfiguration osrmConfig;

    @Autowired
    public OSRMService(RestClient restClient, OSRMConfiguration osrmConfig) {
        this.restClient = restClient;
        this.osrmConfig = osrmConfig;
    }

    private String parseCoordinates(List<Coordinate> coordinates) {
        return coordinates
            .stream()
            .map(Coordinate::toString)
            .collect(Collectors.joining(";"));
    }

    private static String indices(int from, int to) {
        return IntStream.range(from, to)
            .mapToObj(Integer::toString)
            .collect(Collectors.joining(";"));
    }

    private String generateRouteRequestUri(List<Coordinate> coordinates) {
        return String.format("%s/%s/%s?%s",
            osrmConfig.getBaseUrl(),
            osrmConfig.getRouteEndpoint(),
            parseCoordinates(coordinates),
            osrmConfig.getRouteParams());
    }

    private String generateMatrixRequestUri(List<Coordinate> coordinates) {
        return String.format("%s/%s/%s?%s",
            osrmConfig.getBaseUrl(),
            osrmConfig.getMatrixEndpoint(),
            parseCoordinates(coordinates),
            osrmConfig.getMatrixParams());
    }

    private String generateTableRequestUri(List<Coordinate> sources, List<Coordinate> destinations) {
        var all = new ArrayList<>(sources);
        all.addAll(destinations);
        return String.format("%s&sources=%s&destinations=%s",
            generateMatrixRequestUri(all),
            indices(0, sources.size()),
            indices(sources.size(), all.size()));
    }

    @Override
    public OSRMRouteResult queryRoute(List<Coordinate> coordinates) {
        try {
            var result = restClient.get()
                .uri(generateRouteRequestUri(coordinates))
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .body(OSRMRouteResult.class);

            if (result == null) {
                throw new QueryRouteException("OSRM route returned null");
            }

            if (!Objects.equals(result.getCode(), "Ok")) {
                throw new QueryRouteException(
                    String.format("OSRM route returned error response %s", result.getCode()));
            }

            if (result.getRoutes() == null || result.getRoutes().isEmpty()) {
                throw new QueryRouteException("OSRM route returned no routes");
            }

            return result;
        }
        catch (QueryRouteException ex) {
            throw ex;
        }
        catch (RuntimeException ex) {
            throw new QueryRouteException(ex.getLocalizedMessage(), ex);
        }
    }

    @Override
    public OSRMMatrixResult queryMatrix(List<Coordinate> coordinates) {
        return fetchMatrix(generateMatrixRequestUri(coordinates), coordinates.size(), coordinates.size());
    }

    @Override
    public OSRMMatrixResult queryTable(List<Coordinate> sources, List<Coordinate> destinations) {
        return fetchMatrix(generateTableRequestUri(sources, destinations), sources.size(), destinations.size());
    }

    private OSRMMatrixResult fetchMatrix(String uri, int rows, int cols) {
        try {
            var result = restClient.get()
                .uri(uri)
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .body(OSRMMatrixResult.class);

            if (result == null) {
                throw new QueryMatrixException("OSRM table returned null");
            }

            if (!Objects.equals(result.getCode(), "Ok")) {
                throw new QueryMatrixException(
                    String.format("OSRM table returned error response %s", result.getCode()));
            }

            if (!result.isComplete(rows, cols)) {
                throw new QueryMatrixException("OSRM table is incomplete, some points are unreachable");
            }

            return result;
        }
        catch (QueryMatrixException ex) {
            throw ex;
        }
        catch (RuntimeException ex) {
            throw new QueryMatrixException(ex.getLocalizedMessage(), ex);
        }
    }

    /**
     * Fetches the full matrix with one table query when the points fit in a
     * batch, otherwise block by block (sources x destinations) and stitches
     * the blocks together.
     */
    @Override
    public OSRMMatrixResult queryMatrixInBatches(List<Coordinate> coordinates, int batchSize) {
        if (batchSize <= 0 || coordinates.size() <= batchSize) {
            return queryMatrix(coordinates);
        }

        int size = coordinates.size();
        List<List<Double>> fullDistanceMatrix = emptyMatrix(size);
        List<List<Double>> fullDurationMatrix = emptyMatrix(size);

        /* Each query carries at most batchSize points: half sources, half destinations */
        int block = Math.max(1, batchSize / 2);

        for (int sourceStart = 0; sourceStart < size; sourceStart += block) {
            int sourceEnd = Math.min(sourceStart + block, size);
            var sources = coordinates.subList(sourceStart, sourceEnd);

            for (int destStart = 0; destStart < size; destStart += block) {
                int destEnd = Math.min(destStart + block, size);
                var destinations = coordinates.subList(destStart, destEnd);

                var result = queryTable(sources, destinations);

                for (int i = 0; i < sources.size(); i++) {
                    for (int j = 0; j < destinations.size(); j++) {
                        fullDistanceMatrix.get(sourceStart + i).set(destStart + j, result.getDistances().get(i).get(j));
                        fullDurationMatrix.get(sourceStart + i).set(destStart + j, result.getDurations().get(i).get(j));
                    }
                }
            }
        }

        OSRMMatrixResult finalResult = new OSRMMatrixResult();
        finalResult.setCode("Ok");
        finalResult.setDistances(fullDistanceMatrix);
        finalResult.setDurations(fullDurationMatrix);
        return finalResult;
    }

    private static List<List<Double>> emptyMatrix(int size) {
        List<List<Double>> matrix = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            List<Double> row = new ArrayList<>(size);
            for (int j = 0; j < size; j++) {
                row.add(0.0);
            }
            matrix.add(row);
        }
        return matrix;
    }
}
