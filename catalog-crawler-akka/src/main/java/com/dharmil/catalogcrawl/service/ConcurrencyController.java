package com.dharmil.catalogcrawl.service;

import com.dharmil.catalogcrawl.model.ConcurrencyState;
import com.dharmil.catalogcrawl.model.DownshiftMeta;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Locale;
import java.util.Optional;

/**
 * Watches a phase's failure rate and halves (by {@code factor}) the worker budget the first time
 * it exceeds {@code threshold}. The limit never goes back up within a phase.
 */
public class ConcurrencyController {

    private static final Logger log = LoggerFactory.getLogger(ConcurrencyController.class);

    private final double threshold;
    private final double factor;
    private final int minSample;
    private final Clock clock;

    private int currentLimit;
    private DownshiftMeta downshiftMeta;

    public ConcurrencyController(int initialLimit, double threshold, double factor, int minSample, Clock clock) {
        if (initialLimit < 1) {
            throw new IllegalArgumentException("initialLimit must be >= 1 but was " + initialLimit);
        }
        if (factor <= 0.0 || factor >= 1.0) {
            throw new IllegalArgumentException("factor must be within (0, 1) but was " + factor);
        }
        this.currentLimit = initialLimit;
        this.threshold = threshold;
        this.factor = factor;
        this.minSample = Math.max(1, minSample);
        this.clock = clock;
    }

    /**
     * Feeds the phase's cumulative counters.
     *
     * @return the downshift that just happened, if any
     */
    public Optional<DownshiftMeta> observe(long succeeded, long failed) {
        long processed = succeeded + failed;
        if (downshiftMeta != null || processed < minSample) {
            return Optional.empty();
        }
        double rate = (double) failed / processed;
        if (rate <= threshold) {
            return Optional.empty();
        }
        int oldLimit = currentLimit;
        int newLimit = Math.max(1, (int) Math.floor(oldLimit * factor));
        String trigger = String.format(Locale.ROOT, "fail_rate>%.2f", rate);
        currentLimit = newLimit;
        downshiftMeta = new DownshiftMeta(clock.instant(), oldLimit, newLimit, trigger);
        log.warn("Concurrency downshift {} -> {} ({} failed of {} processed, {})",
                oldLimit, newLimit, failed, processed, trigger);
        return Optional.of(downshiftMeta);
    }

    public int currentLimit() {
        return currentLimit;
    }

    public boolean downshifted() {
        return downshiftMeta != null;
    }

    public ConcurrencyState state() {
        return new ConcurrencyState(currentLimit, downshiftMeta != null, downshiftMeta);
    }
}
