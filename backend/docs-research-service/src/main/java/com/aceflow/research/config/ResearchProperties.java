package com.aceflow.research.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Recognized options of the research pipeline (prefix {@code research}).
 *
 * Defaults:
 * - fetch: 8 workers, 2 per host, 10s timeout, 3 retries with 500ms * 2^n backoff and jitter
 * - cache: 24h TTL
 * - resolver: 2 supplemental passes
 * - validation: 0.85 completeness threshold, 0.6 floor for critical categories
 * - run: 5 minute overall timeout
 */
@Configuration
@ConfigurationProperties(prefix = "research")
@Validated
@Data
public class ResearchProperties {

    @Valid
    private Fetch fetch = new Fetch();

    @Valid
    private Cache cache = new Cache();

    @Valid
    private Resolver resolver = new Resolver();

    @Valid
    private Validation validation = new Validation();

    @Valid
    private Run run = new Run();

    @Valid
    private Output output = new Output();

    @Data
    public static class Fetch {
        /** Bounded worker pool size */
        @Min(1)
        private int concurrency = 8;

        /** Concurrent requests allowed against a single host */
        @Min(1)
        private int perHostLimit = 2;

        /** Timeout of a single HTTP attempt */
        @NotNull
        private Duration timeout = Duration.ofSeconds(10);

        @NotNull
        private Duration connectTimeout = Duration.ofSeconds(5);

        /** Retries after the first attempt for transient failures */
        @Min(0)
        private int maxRetries = 3;

        @NotNull
        private Duration backoffBase = Duration.ofMillis(500);

        @DecimalMin("1.0")
        private double backoffFactor = 2.0;

        /** Fraction of the computed delay added or removed at random */
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double backoffJitter = 0.25;

        @Min(1024)
        private int maxBodyBytes = 8 * 1024 * 1024;

        @NotBlank
        private String userAgent = "ACE-Flow-Research/1.0";
    }

    @Data
    public static class Cache {
        private boolean enabled = true;

        @NotNull
        private Duration ttl = Duration.ofHours(24);

        @NotNull
        private Path directory = Path.of(System.getProperty("user.home"), ".aceflow", "research-cache");

        /** Size of the in-memory layer in front of the file store */
        @Min(1)
        private int maxEntries = 2000;
    }

    @Data
    public static class Resolver {
        /** Upper bound on supplemental resolve-fetch-extract cycles */
        @Min(0)
        private int supplementalPassLimit = 2;

        /** Links discovered in fetched pages that one supplemental pass may add */
        @Min(0)
        private int maxDiscoveredLinksPerPass = 4;
    }

    @Data
    public static class Validation {
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double completenessThreshold = 0.85;

        /** Minimum score of every critical category */
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double criticalFloor = 0.6;
    }

    @Data
    public static class Run {
        @NotNull
        private Duration timeout = Duration.ofMinutes(5);

        /** How long shutdown waits for a cancelled run to write its bundle */
        @NotNull
        private Duration shutdownGrace = Duration.ofSeconds(30);
    }

    @Data
    public static class Output {
        @NotNull
        private Path directory = Path.of("research-output");
    }
}
