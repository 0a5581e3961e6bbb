package com.olap.bench.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.olap.bench.domain.DimensionEncoder;
import com.olap.bench.repository.BitmapEngineClient;
import com.olap.bench.repository.http.HttpBitmapEngineClient;

import lombok.extern.slf4j.Slf4j;

/**
 * Wires the engine client and the process-wide dimension tables.
 *
 * The {@link DimensionEncoder} is built once here and injected into every
 * component that needs ids, instead of being read from global state.
 */
@Slf4j
@Configuration
public class EngineConfig {

    @Bean
    public DimensionEncoder dimensionEncoder() {
        return DimensionEncoder.standard();
    }

    /**
     * HTTP client for the engine.
     *
     * The read timeout has to cover a monolithic batch (concurrency 1, batch
     * size = iteration count), which can keep the engine busy for minutes.
     */
    @Bean
    public RestClient engineRestClient(RestClient.Builder builder, BenchProperties properties) {
        BenchProperties.Engine engine = properties.getEngine();

        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout((int) engine.getConnectTimeout().toMillis());
        requestFactory.setReadTimeout((int) engine.getReadTimeout().toMillis());

        String baseUrl = engine.getAddress().startsWith("http")
            ? engine.getAddress()
            : "http://" + engine.getAddress();

        log.info("Configuring engine client: baseUrl={}, index={}, maxAttempts={}",
            baseUrl, engine.getIndex(), engine.getMaxAttempts());

        return builder
            .baseUrl(baseUrl)
            .requestFactory(requestFactory)
            .build();
    }

    @Bean
    public BitmapEngineClient bitmapEngineClient(
            RestClient engineRestClient,
            BenchProperties properties,
            ObjectMapper objectMapper) {
        return new HttpBitmapEngineClient(engineRestClient, properties.getEngine().getIndex(), objectMapper);
    }
}
