package com.dharmil.catalogcrawl.service;

import java.time.Duration;
import java.util.Objects;

/**
 * Same delay for every attempt.
 */
public final class FixedRetryDelay implements RetryDelayStrategy {

    private final Duration delay;

    public FixedRetryDelay(Duration delay) {
        this.delay = Objects.requireNonNull(delay, "delay");
        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay must not be negative");
        }
    }

    @Override
    public Duration delay(int attempt) {
        return delay;
    }

    @Override
    public String toString() {
        return "FixedRetryDelay[" + delay + "]";
    }
}
