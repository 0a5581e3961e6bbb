package com.olap.bench.config;

import java.time.Duration;
import java.util.List;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import com.olap.bench.domain.FailurePolicy;

import lombok.Data;

/**
 * Settings bound from the {@code bench.*} keys of application.yml.
 *
 * Every value can be overridden through the environment, e.g.
 * {@code BENCH_ENGINE_ADDRESS=engine:10101}.
 */
@Data
@Validated
@ConfigurationProperties("bench")
public class BenchProperties {

    /** Version reported by {@code /api/version}. */
    private String version = "v0.0.0";

    @Valid
    private Engine engine = new Engine();

    @Valid
    private Dispatch dispatch = new Dispatch();

    @Valid
    private Grouped grouped = new Grouped();

    @Valid
    private Results results = new Results();

    @Valid
    private Sweep sweep = new Sweep();

    @Data
    public static class Engine {

        /** host:port of the engine's HTTP API. */
        @NotBlank
        private String address = "localhost:10101";

        /** Index holding the star-schema frames. */
        @NotBlank
        private String index = "ssb1";

        @NotNull
        private Duration connectTimeout = Duration.ofSeconds(5);

        @NotNull
        private Duration readTimeout = Duration.ofMinutes(5);

        /** Attempts per engine call when the engine is unreachable. */
        @Min(1)
        private int maxAttempts = 3;

        @Min(0)
        private long retryDelayMs = 100;
    }

    @Data
    public static class Dispatch {

        /** Capacity of the payload queue between producer and workers. */
        @Min(1)
        private int workQueueCapacity = 64;

        /**
         * Capacity of the results queue; 0 means unbounded (no backpressure
         * on workers, memory grows with a slow reader).
         */
        @Min(0)
        private int resultQueueCapacity = 0;

        @NotNull
        private FailurePolicy failurePolicy = FailurePolicy.DROP_PAYLOAD;
    }

    @Data
    public static class Grouped {

        @Min(1)
        private int defaultConcurrency = 32;
    }

    @Data
    public static class Results {

        /** Write one result log per run. */
        private boolean enabled = true;

        @NotBlank
        private String directory = "results";
    }

    @Data
    public static class Sweep {

        @NotEmpty
        private List<@Min(1) Integer> concurrencyLevels = List.of(1, 2, 4, 8, 16, 32);

        @NotEmpty
        private List<@Min(1) Integer> batchSizes = List.of(1, 2, 4, 8, 16);
    }
}
