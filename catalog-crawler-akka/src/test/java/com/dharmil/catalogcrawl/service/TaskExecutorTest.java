package com.dharmil.catalogcrawl.service;

import com.dharmil.catalogcrawl.model.CrawlErrorKind;
import com.dharmil.catalogcrawl.model.CrawlTask;
import com.dharmil.catalogcrawl.model.DetailTask;
import com.dharmil.catalogcrawl.model.PageTask;
import com.dharmil.catalogcrawl.model.ProductRef;
import com.dharmil.catalogcrawl.model.TaskOutcome;
import com.dharmil.catalogcrawl.model.TaskState;
import com.dharmil.catalogcrawl.support.ScriptedCatalog;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TaskExecutorTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private final ExecutorService pool = Executors.newCachedThreadPool();
    private final ScriptedCatalog catalog = new ScriptedCatalog();
    private final TaskExecutor executor = new TaskExecutor(catalog, catalog, catalog);

    @AfterEach
    void shutdownPool() {
        catalog.release();
        pool.shutdownNow();
    }

    private TaskOutcome run(CrawlTask task, Duration timeout) throws Exception {
        return executor.execute(task, timeout, pool).toCompletableFuture().get(10, TimeUnit.SECONDS);
    }

    @Test
    void listPageSucceedsWithDiscoveredProducts() throws Exception {
        catalog.listProducts(3, "a", "b");

        TaskOutcome outcome = run(new PageTask(3), TIMEOUT);

        assertTrue(outcome.isSuccess());
        assertEquals(TaskState.SUCCEEDED, outcome.resultState());
        assertEquals(List.of(new ProductRef("a", "https://shop.test/products/a"),
                new ProductRef("b", "https://shop.test/products/b")), outcome.discovered());
        assertNull(outcome.errorKind());
    }

    @Test
    void classifiedFailureKeepsItsKind() throws Exception {
        catalog.failPage(4, CrawlErrorKind.RATE_LIMITED);

        TaskOutcome outcome = run(new PageTask(4), TIMEOUT);

        assertEquals(TaskOutcome.Status.FAILED, outcome.status());
        assertEquals(CrawlErrorKind.RATE_LIMITED, outcome.errorKind());
        assertTrue(outcome.error().contains("page 4"));
    }

    @Test
    void slowTaskTimesOut() throws Exception {
        catalog.hold();

        TaskOutcome outcome = run(new PageTask(1), Duration.ofMillis(50));

        assertEquals(TaskOutcome.Status.TIMED_OUT, outcome.status());
        assertEquals(TaskState.TIMED_OUT, outcome.resultState());
        assertEquals(CrawlErrorKind.NETWORK_TIMEOUT, outcome.errorKind());
    }

    @Test
    void detailTaskPersistsProduct() throws Exception {
        TaskOutcome outcome = run(new DetailTask("sku-1", "https://shop.test/products/sku-1"), TIMEOUT);

        assertTrue(outcome.isSuccess());
        assertTrue(outcome.discovered().isEmpty());
        assertEquals(List.of("sku-1"), catalog.persistedIds());
    }

    @Test
    void failedDetailIsNotPersisted() throws Exception {
        catalog.failDetail("sku-2", CrawlErrorKind.PERMANENT);

        TaskOutcome outcome = run(new DetailTask("sku-2", "https://shop.test/products/sku-2"), TIMEOUT);

        assertEquals(CrawlErrorKind.PERMANENT, outcome.errorKind());
        assertTrue(catalog.persistedIds().isEmpty());
    }
}
