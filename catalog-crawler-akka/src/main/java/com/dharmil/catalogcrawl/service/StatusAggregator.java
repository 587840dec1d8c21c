package com.dharmil.catalogcrawl.service;

import com.dharmil.catalogcrawl.model.ErrorStatusView;
import com.dharmil.catalogcrawl.model.MetricsView;
import com.dharmil.catalogcrawl.model.PhaseKind;
import com.dharmil.catalogcrawl.model.PhaseSnapshot;
import com.dharmil.catalogcrawl.model.PhaseStatusView;
import com.dharmil.catalogcrawl.model.SessionStatus;
import com.dharmil.catalogcrawl.model.SessionStatusView;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Pure projection of session state into {@link SessionStatusView}. Reads immutable snapshots only.
 */
public class StatusAggregator {

    public static final int CONTRACT_VERSION = 1;

    /**
     * Everything a status view is computed from.
     *
     * @param processedOffset pages completed by earlier sessions of a resumed plan
     * @param resumeToken     latest token JSON, or {@code null}
     * @param remainingPages  pages listed in that token, or {@code null}
     */
    public record StatusSource(String sessionId,
                               SessionStatus status,
                               Instant startedAt,
                               Instant completedAt,
                               PhaseSnapshot pages,
                               PhaseSnapshot details,
                               long processedOffset,
                               String resumeToken,
                               List<Integer> remainingPages,
                               int etaMinSample) {
    }

    private final Clock clock;

    public StatusAggregator(Clock clock) {
        this.clock = clock;
    }

    public SessionStatusView aggregate(StatusSource source) {
        Instant now = clock.instant();
        Instant end = source.completedAt() != null ? source.completedAt() : now;
        long elapsedMs = Math.max(0, Duration.between(source.startedAt(), end).toMillis());

        PhaseSnapshot pages = source.pages();
        PhaseSnapshot details = source.details();

        return new SessionStatusView(
                source.sessionId(),
                source.status(),
                CONTRACT_VERSION,
                source.startedAt(),
                source.completedAt(),
                phaseView(pages, source.processedOffset()),
                phaseView(details, 0),
                errors(pages, details),
                metrics(source, elapsedMs, now),
                source.resumeToken(),
                source.remainingPages() == null ? null : List.copyOf(source.remainingPages()));
    }

    private static PhaseStatusView phaseView(PhaseSnapshot snapshot, long offset) {
        long processed = offset + snapshot.processed();
        long total = offset + snapshot.total();
        double percent = total == 0 ? 0.0 : round(processed * 100.0 / total);
        List<String> sample = sampleIds(snapshot.failedSample());
        boolean pagePhase = snapshot.phase() == PhaseKind.LIST_COLLECTION;
        return new PhaseStatusView(
                processed,
                total,
                percent,
                snapshot.failed(),
                round(snapshot.failedRate()),
                snapshot.retrying(),
                snapshot.failureThreshold(),
                pagePhase ? toPageNumbers(sample) : null,
                pagePhase ? null : sample,
                snapshot.concurrency().currentLimit(),
                snapshot.concurrency().downshifted(),
                snapshot.concurrency().downshiftMeta());
    }

    private static ErrorStatusView errors(PhaseSnapshot pages, PhaseSnapshot details) {
        long count = pages.errorCount() + details.errorCount();
        long attempts = pages.attempts() + details.attempts();
        String last = pages.lastError();
        if (details.lastErrorAt() != null
                && (pages.lastErrorAt() == null || details.lastErrorAt().isAfter(pages.lastErrorAt()))) {
            last = details.lastError();
        }
        double rate = attempts == 0 ? 0.0 : round((double) count / attempts);
        return new ErrorStatusView(last, count, rate);
    }

    private static MetricsView metrics(StatusSource source, long elapsedMs, Instant now) {
        long pagesProcessed = source.pages().processed();
        double throughput = elapsedMs == 0 ? 0.0 : round(pagesProcessed / (elapsedMs / 60_000.0));
        long eta = source.status().isTerminal() ? 0 : eta(activePhase(source), source.etaMinSample(), now);
        return new MetricsView(elapsedMs, throughput, eta);
    }

    private static PhaseSnapshot activePhase(StatusSource source) {
        PhaseSnapshot details = source.details();
        return details.startedAt() != null ? details : source.pages();
    }

    /**
     * Remaining items divided by the phase's observed rate, once enough items were processed.
     */
    static long eta(PhaseSnapshot phase, int minSample, Instant now) {
        int processed = phase.processed();
        if (phase.isFinished() || phase.startedAt() == null || processed < Math.max(1, minSample)) {
            return 0;
        }
        long phaseMs = Duration.between(phase.startedAt(), now).toMillis();
        if (phaseMs <= 0) {
            return 0;
        }
        double msPerItem = (double) phaseMs / processed;
        return Math.round(msPerItem * (phase.total() - processed));
    }

    private static List<String> sampleIds(List<String> taskKeys) {
        List<String> ids = new ArrayList<>(taskKeys.size());
        for (String key : taskKeys) {
            int separator = key.indexOf(':');
            ids.add(separator < 0 ? key : key.substring(separator + 1));
        }
        return ids;
    }

    private static List<Integer> toPageNumbers(List<String> ids) {
        List<Integer> pages = new ArrayList<>(ids.size());
        for (String id : ids) {
            pages.add(Integer.valueOf(id));
        }
        return pages;
    }

    private static double round(double value) {
        return Math.round(value * 10_000.0) / 10_000.0;
    }
}
