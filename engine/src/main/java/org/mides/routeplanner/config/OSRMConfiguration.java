package org.mides.routeplanner.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Data
@Component
@ConfigurationProperties(prefix = "osrm")
public class OSRMConfiguration {
    /* false skips the road network entirely, every answer is geometric */
    private boolean enabled = true;
    private String baseUrl = "http://localhost:5000";
    private String matrixEndpoint = "table/v1/driving";
    private String matrixParams = "annotations=distance,duration";
    private String routeEndpoint = "route/v1/driving";
    private String routeParams = "overview=full&geometries=polyline";
    /* false when the server offers no table service; matrices are then assembled pair by pair */
    private boolean tableEnabled = true;
    private int matrixBatchSize = 100;
    private Duration connectTimeout = Duration.ofSeconds(2);
    private Duration readTimeout = Duration.ofSeconds(10);
}
