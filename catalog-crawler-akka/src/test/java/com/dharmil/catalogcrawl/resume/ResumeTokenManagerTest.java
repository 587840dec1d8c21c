package com.dharmil.catalogcrawl.resume;

import com.dharmil.catalogcrawl.model.ConcurrencyState;
import com.dharmil.catalogcrawl.model.CrawlTask;
import com.dharmil.catalogcrawl.model.DetailTask;
import com.dharmil.catalogcrawl.model.PageTask;
import com.dharmil.catalogcrawl.model.PhaseKind;
import com.dharmil.catalogcrawl.model.PhaseSnapshot;
import com.dharmil.catalogcrawl.model.RestorePlan;
import com.dharmil.catalogcrawl.model.ResumeToken;
import com.dharmil.catalogcrawl.support.TestRuntimes;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ResumeTokenManagerTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private final ResumeTokenManager manager = TestRuntimes.tokenManager(Clock.fixed(NOW, ZoneOffset.UTC));

    /**
     * Pages 1 and 3 completed, 2 permanently failed after 3 retries, 4 waiting for its third
     * retry, 5 never dispatched.
     */
    private static PhaseSnapshot pagesInProgress() {
        Map<CrawlTask, Integer> retries = new LinkedHashMap<>();
        retries.put(new PageTask(2), 3);
        retries.put(new PageTask(4), 2);
        return snapshot(PhaseKind.LIST_COLLECTION, 5, 2, 1,
                List.of(new PageTask(4), new PageTask(5)),
                List.of(new PageTask(2)),
                List.of(new PageTask(4)),
                retries, Map.of(2, 1, 3, 1), 5);
    }

    static PhaseSnapshot snapshot(PhaseKind phase, int total, int succeeded, int failed,
                                  List<CrawlTask> unfinished, List<CrawlTask> failedTasks,
                                  List<CrawlTask> retrying, Map<CrawlTask, Integer> retryCounts,
                                  Map<Integer, Integer> histogram, long totalRetries) {
        return new PhaseSnapshot(phase, total, succeeded, failed, retrying.size(), 0,
                unfinished.size() - retrying.size(), 50, List.of(), new ConcurrencyState(3, false, null),
                0, 0, null, null, NOW, null, unfinished, failedTasks, retrying, retryCounts, histogram,
                totalRetries, 0);
    }

    private static ResumeTokenManager.TokenSource source(PhaseSnapshot pages, PhaseSnapshot details,
                                                         List<String> pending) {
        return new ResumeTokenManager.TokenSource("plan-1", 10, 0, 5, pages, details, pending);
    }

    @Test
    void emitCapturesUnfinishedAndFailedWork() {
        ResumeToken token = manager.emit(source(pagesInProgress(), null, List.of("p1-0", "p3-2"))).orElseThrow();

        assertEquals(ResumeToken.CURRENT_VERSION, token.version());
        assertEquals("plan-1", token.planHash());
        assertEquals(List.of(2, 4, 5), token.remainingPages());
        assertEquals(List.of(2), token.failedPages());
        assertEquals(List.of(4), token.retryingPages());
        assertEquals(Map.of(2, 3, 4, 2), token.retriesPerPage());
        assertEquals(List.of("p1-0", "p3-2"), token.remainingDetailIds());
        assertEquals(2, token.processedPages());
        assertEquals(5, token.totalPages());
        assertEquals(10, token.batchSize());
        assertEquals(3, token.concurrencyLimit());
        assertEquals(NOW, token.generatedAt());
    }

    @Test
    void loadOfEmitEqualsUnfinishedWork() {
        Map<CrawlTask, Integer> detailRetries = Map.of(new DetailTask("p1-1", "https://shop.test/products/p1-1"), 1);
        PhaseSnapshot details = snapshot(PhaseKind.DETAIL_COLLECTION, 3, 1, 1,
                List.of(new DetailTask("p1-1", "https://shop.test/products/p1-1")),
                List.of(new DetailTask("p1-2", "https://shop.test/products/p1-2")),
                List.of(new DetailTask("p1-1", "https://shop.test/products/p1-1")),
                detailRetries, Map.of(1, 1), 1);
        ResumeToken token = manager.emit(source(pagesInProgress(), details, List.of())).orElseThrow();

        RestorePlan plan = manager.load(manager.encode(token));

        assertEquals(List.of(2, 4, 5), plan.remainingPages());
        assertEquals(Map.of(2, 3, 4, 2), plan.retriesPerPage());
        assertEquals(List.of("p1-1", "p1-2"), plan.remainingDetailIds());
        assertEquals(Map.of("p1-1", 1), plan.detailRetryCounts());
        assertEquals("plan-1", plan.planHash());
        assertEquals(2, plan.processedPages());
        assertEquals(10, plan.batchSize());
        assertEquals(3, plan.concurrencyLimit());
    }

    @Test
    void loadingTheSameTokenTwiceYieldsTheSamePlan() {
        String json = manager.encode(manager.emit(source(pagesInProgress(), null, List.of("a"))).orElseThrow());
        assertEquals(manager.load(json), manager.load(json));
    }

    @Test
    void nothingIsEmittedWhenNoPageRemains() {
        PhaseSnapshot done = snapshot(PhaseKind.LIST_COLLECTION, 2, 2, 0, List.of(), List.of(), List.of(),
                Map.of(), Map.of(), 0);
        Optional<ResumeToken> token = manager.emit(source(done, null, List.of("left-over")));
        assertTrue(token.isEmpty());
    }

    @Test
    void tokenWithoutRemainingPagesIsRejected() {
        String json = """
                {"version":2,"plan_hash":"h","remaining_pages":[],"processed_pages":5,"total_pages":5,
                 "batch_size":10,"concurrency_limit":4,"retrying_pages":[],"failed_pages":[],
                 "retries_per_page":[]}
                """;
        assertThrows(InvalidResumeTokenException.class, () -> manager.load(json));
    }

    @Test
    void missingDetailFieldsLoadAsEmptyCollections() {
        RestorePlan plan = manager.load("""
                {"plan_hash":"h","remaining_pages":[7,7,8],"processed_pages":6,"total_pages":2,
                 "batch_size":0,"concurrency_limit":0,"retrying_pages":[],"failed_pages":[],
                 "retries_per_page":[[7,2],[9,4],[8,0]]}
                """);

        assertEquals(1, plan.version());
        assertEquals(List.of(7, 8), plan.remainingPages());
        assertTrue(plan.remainingDetailIds().isEmpty());
        assertTrue(plan.detailRetryCounts().isEmpty());
        assertEquals(Map.of(7, 2), plan.retriesPerPage());
        assertEquals(8, plan.totalPages());
        assertEquals(1, plan.batchSize());
        assertEquals(1, plan.concurrencyLimit());
    }

    @Test
    void unknownVersionIsRejected() {
        assertThrows(InvalidResumeTokenException.class, () -> manager.load("""
                {"version":3,"plan_hash":"h","remaining_pages":[1]}
                """));
    }

    @Test
    void verifierCanRejectAToken() {
        ResumeTokenManager strict = new ResumeTokenManager(new ResumeTokenCodec(TestRuntimes.mapper()),
                token -> {
                    throw new InvalidResumeTokenException("plan " + token.planHash() + " unknown");
                },
                Clock.systemUTC());
        assertThrows(InvalidResumeTokenException.class,
                () -> strict.load("{\"plan_hash\":\"h\",\"remaining_pages\":[1]}"));
    }
}
