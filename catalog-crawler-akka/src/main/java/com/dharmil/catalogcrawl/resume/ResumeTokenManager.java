package com.dharmil.catalogcrawl.resume;

import com.dharmil.catalogcrawl.model.CrawlTask;
import com.dharmil.catalogcrawl.model.DetailTask;
import com.dharmil.catalogcrawl.model.PageTask;
import com.dharmil.catalogcrawl.model.PhaseSnapshot;
import com.dharmil.catalogcrawl.model.RestorePlan;
import com.dharmil.catalogcrawl.model.ResumeToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Builds resume tokens from session progress and turns tokens back into restore plans.
 */
public class ResumeTokenManager {

    private static final Logger log = LoggerFactory.getLogger(ResumeTokenManager.class);

    /**
     * Session progress a token is cut from.
     *
     * @param processedOffset  pages already completed by earlier sessions of the same plan
     * @param details          detail phase snapshot, {@code null} while the detail phase has not started
     * @param pendingDetailIds discovered products that have not entered the detail phase yet
     */
    public record TokenSource(String planHash,
                              int batchSize,
                              long processedOffset,
                              long totalPages,
                              PhaseSnapshot pages,
                              PhaseSnapshot details,
                              List<String> pendingDetailIds) {
    }

    private final ResumeTokenCodec codec;
    private final PlanHashVerifier verifier;
    private final Clock clock;

    public ResumeTokenManager(ResumeTokenCodec codec, PlanHashVerifier verifier, Clock clock) {
        this.codec = codec;
        this.verifier = verifier;
        this.clock = clock;
    }

    // --- Emit ---

    /**
     * Captures every page and detail not yet successfully completed.
     *
     * @return empty when no page remains, since such a token could not be loaded
     */
    public Optional<ResumeToken> emit(TokenSource source) {
        PhaseSnapshot pages = source.pages();
        Set<Integer> remaining = new TreeSet<>();
        remaining.addAll(pageNumbers(pages.unfinishedTasks()));
        remaining.addAll(pageNumbers(pages.failedTasks()));
        if (remaining.isEmpty()) {
            log.debug("No pages remain for plan {}; no resume token emitted", source.planHash());
            return Optional.empty();
        }

        Map<Integer, Integer> retriesPerPage = new TreeMap<>();
        pages.retryCounts().forEach((task, retries) -> {
            if (task instanceof PageTask page && remaining.contains(page.pageNumber())) {
                retriesPerPage.put(page.pageNumber(), retries);
            }
        });

        Set<String> remainingDetails = new LinkedHashSet<>();
        Map<String, Integer> detailRetryCounts = new LinkedHashMap<>();
        long detailRetriesTotal = 0;
        Map<Integer, Integer> detailHistogram = new LinkedHashMap<>();
        PhaseSnapshot details = source.details();
        if (details != null) {
            remainingDetails.addAll(detailIds(details.unfinishedTasks()));
            remainingDetails.addAll(detailIds(details.failedTasks()));
            details.retryCounts().forEach((task, retries) -> {
                if (task instanceof DetailTask detail && remainingDetails.contains(detail.id())) {
                    detailRetryCounts.put(detail.id(), retries);
                }
            });
            detailRetriesTotal = details.totalRetries();
            detailHistogram.putAll(details.retryHistogram());
        }
        if (source.pendingDetailIds() != null) {
            remainingDetails.addAll(source.pendingDetailIds());
        }

        ResumeToken token = new ResumeToken(
                ResumeToken.CURRENT_VERSION,
                source.planHash(),
                new ArrayList<>(remaining),
                new ArrayList<>(remainingDetails),
                detailRetryCounts,
                detailRetriesTotal,
                clock.instant(),
                source.processedOffset() + pages.succeeded(),
                source.totalPages(),
                source.batchSize(),
                pages.concurrency().currentLimit(),
                pageNumbers(pages.retryingTasks()),
                pageNumbers(pages.failedTasks()),
                retriesPerPage,
                detailHistogram);
        log.debug("Emitted resume token for plan {}: {} pages, {} details remaining",
                source.planHash(), token.remainingPages().size(), remainingDetails.size());
        return Optional.of(token);
    }

    public String encode(ResumeToken token) {
        return codec.encode(token);
    }

    // --- Load ---

    public RestorePlan load(String json) {
        return load(codec.decode(json));
    }

    /**
     * Validates a token and converts it into a plan. Missing detail fields load as empty collections.
     *
     * @throws InvalidResumeTokenException if no page remains or the version is unknown
     */
    public RestorePlan load(ResumeToken token) {
        if (token.remainingPages().isEmpty()) {
            throw new InvalidResumeTokenException("Resume token has no remaining pages");
        }
        int version = token.effectiveVersion();
        if (version < 1 || version > ResumeToken.CURRENT_VERSION) {
            throw new InvalidResumeTokenException("Unsupported resume token version " + version);
        }
        verifier.verify(token);

        List<Integer> pages = new ArrayList<>(new LinkedHashSet<>(token.remainingPages()));
        Map<Integer, Integer> retriesPerPage = new TreeMap<>();
        token.retriesPerPage().forEach((page, retries) -> {
            if (retries > 0 && pages.contains(page)) {
                retriesPerPage.put(page, retries);
            }
        });
        List<String> detailIds = token.remainingDetailIds() == null
                ? List.of()
                : new ArrayList<>(new LinkedHashSet<>(token.remainingDetailIds()));
        Map<String, Integer> detailRetries = token.detailRetryCounts() == null
                ? Map.of()
                : token.detailRetryCounts();

        RestorePlan plan = new RestorePlan(version, token.planHash(), pages, detailIds, retriesPerPage,
                detailRetries, token.processedPages(), Math.max(token.totalPages(), token.processedPages() + pages.size()),
                Math.max(1, token.batchSize()), Math.max(1, token.concurrencyLimit()));
        log.info("Loaded v{} resume token for plan {}: {} pages and {} details remaining",
                version, plan.planHash(), pages.size(), detailIds.size());
        return plan;
    }

    private static List<Integer> pageNumbers(Collection<CrawlTask> tasks) {
        List<Integer> numbers = new ArrayList<>();
        for (CrawlTask task : tasks) {
            if (task instanceof PageTask page) {
                numbers.add(page.pageNumber());
            }
        }
        return numbers;
    }

    private static List<String> detailIds(Collection<CrawlTask> tasks) {
        List<String> ids = new ArrayList<>();
        for (CrawlTask task : tasks) {
            if (task instanceof DetailTask detail) {
                ids.add(detail.id());
            }
        }
        return ids;
    }
}
