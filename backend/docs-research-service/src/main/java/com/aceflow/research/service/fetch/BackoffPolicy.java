package com.aceflow.research.service.fetch;

import com.aceflow.research.config.ResearchProperties;

import java.time.Duration;
import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Exponential backoff with jitter: base * factor^retry, moved by up to ±jitter of itself.
 */
public class BackoffPolicy {

    private final Duration base;
    private final double factor;
    private final double jitter;
    private final DoubleSupplier random;

    public BackoffPolicy(Duration base, double factor, double jitter, DoubleSupplier random) {
        this.base = base;
        this.factor = factor;
        this.jitter = jitter;
        this.random = random;
    }

    public static BackoffPolicy from(ResearchProperties.Fetch fetch) {
        return new BackoffPolicy(fetch.getBackoffBase(), fetch.getBackoffFactor(), fetch.getBackoffJitter(),
                () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * Seeded variant for tests.
     */
    public static BackoffPolicy seeded(Duration base, double factor, double jitter, long seed) {
        Random rnd = new Random(seed);
        return new BackoffPolicy(base, factor, jitter, rnd::nextDouble);
    }

    /**
     * @param retry zero-based retry index (0 = delay before the first retry)
     */
    public Duration delayFor(long retry) {
        double exponential = base.toMillis() * Math.pow(factor, retry);
        double spread = exponential * jitter * (random.getAsDouble() * 2 - 1);
        long millis = Math.max(0, Math.round(exponential + spread));
        return Duration.ofMillis(millis);
    }

    public Duration maxDelayFor(long retry) {
        return Duration.ofMillis(Math.round(base.toMillis() * Math.pow(factor, retry) * (1 + jitter)));
    }
}
