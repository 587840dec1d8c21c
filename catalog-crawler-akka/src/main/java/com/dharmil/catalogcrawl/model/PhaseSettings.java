package com.dharmil.catalogcrawl.model;

import com.dharmil.catalogcrawl.service.RetryDelayStrategy;

import java.time.Duration;

/**
 * Knobs that drive one phase coordinator, derived from {@link SessionConfig}.
 */
public record PhaseSettings(PhaseKind phase,
                            int concurrency,
                            int batchSize,
                            int maxRetries,
                            int parseErrorMaxRetries,
                            int failureThreshold,
                            Duration taskTimeout,
                            double downshiftThreshold,
                            double downshiftFactor,
                            int downshiftMinSample,
                            RetryDelayStrategy retryDelay) {

    public PhaseSettings {
        if (concurrency < 1) {
            throw new IllegalArgumentException("concurrency must be >= 1 but was " + concurrency);
        }
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be >= 1 but was " + batchSize);
        }
    }
}
