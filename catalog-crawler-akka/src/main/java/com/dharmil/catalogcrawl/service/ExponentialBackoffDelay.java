package com.dharmil.catalogcrawl.service;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * {@code base * multiplier^(attempt-1)}, stretched by up to {@code jitter} (a fraction of the
 * computed delay) and capped at {@code max}.
 */
public final class ExponentialBackoffDelay implements RetryDelayStrategy {

    private final long baseMillis;
    private final long maxMillis;
    private final double multiplier;
    private final double jitter;
    private final DoubleSupplier random;

    public ExponentialBackoffDelay(Duration base, Duration max, double multiplier, double jitter) {
        this(base, max, multiplier, jitter, () -> ThreadLocalRandom.current().nextDouble());
    }

    public ExponentialBackoffDelay(Duration base, Duration max, double multiplier, double jitter,
                                   DoubleSupplier random) {
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1 but was " + multiplier);
        }
        if (jitter < 0.0 || jitter > 1.0) {
            throw new IllegalArgumentException("jitter must be within [0, 1] but was " + jitter);
        }
        this.baseMillis = base.toMillis();
        this.maxMillis = max.toMillis();
        this.multiplier = multiplier;
        this.jitter = jitter;
        this.random = random;
    }

    @Override
    public Duration delay(int attempt) {
        int exponent = Math.max(0, attempt - 1);
        double raw = baseMillis * Math.pow(multiplier, exponent);
        double jittered = raw + raw * jitter * random.getAsDouble();
        long millis = (long) Math.min(jittered, (double) maxMillis);
        return Duration.ofMillis(Math.max(0, millis));
    }

    @Override
    public String toString() {
        return "ExponentialBackoffDelay[base=" + baseMillis + "ms, max=" + maxMillis + "ms, multiplier="
                + multiplier + ", jitter=" + jitter + "]";
    }
}
