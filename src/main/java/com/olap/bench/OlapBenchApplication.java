package com.olap.bench;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.retry.annotation.EnableRetry;

/**
 * Star Schema Benchmark driver for a bitmap-index aggregation engine.
 *
 * Expands each SSB query flight into its full parameter space, dispatches the
 * resulting point aggregates to the engine with configurable concurrency and
 * batching, and reports throughput and (grouped, ordered) results over REST.
 *
 * @author OLAP Bench Team
 * @version 1.0.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@EnableRetry
public class OlapBenchApplication {

    public static void main(String[] args) {
        SpringApplication.run(OlapBenchApplication.class, args);
    }
}
