package org.mides.routeplanner.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class SpringConfiguration {

    @Bean
    public RestClient restClient(OSRMConfiguration osrmConfig) {
        var requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout((int) osrmConfig.getConnectTimeout().toMillis());
        requestFactory.setReadTimeout((int) osrmConfig.getReadTimeout().toMillis());
        return RestClient.builder()
            .requestFactory(requestFactory)
            .build();
    }

    /* Runs per-route sequencing of a planning batch */
    @Primary
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService executorService() {
        return Executors.newFixedThreadPool(10);
    }

    /* Solver calls get their own pool so a stuck native call never starves route sequencing */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService solverExecutorService() {
        return Executors.newCachedThreadPool();
    }
}
