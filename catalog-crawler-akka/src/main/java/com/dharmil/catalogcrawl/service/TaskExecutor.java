package com.dharmil.catalogcrawl.service;

import com.dharmil.catalogcrawl.collaborator.CatalogParser;
import com.dharmil.catalogcrawl.collaborator.PageFetcher;
import com.dharmil.catalogcrawl.collaborator.ProductPersister;
import com.dharmil.catalogcrawl.model.CrawlErrorKind;
import com.dharmil.catalogcrawl.model.CrawlTask;
import com.dharmil.catalogcrawl.model.CrawlTaskException;
import com.dharmil.catalogcrawl.model.DetailTask;
import com.dharmil.catalogcrawl.model.PageTask;
import com.dharmil.catalogcrawl.model.ProductDetail;
import com.dharmil.catalogcrawl.model.ProductRef;
import com.dharmil.catalogcrawl.model.TaskOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs one list page or product detail as a future on the given executor and always completes
 * normally with a {@link TaskOutcome}; failures and timeouts are folded into the outcome.
 * The underlying work is not cancelled when the timeout fires.
 */
public class TaskExecutor {

    private static final Logger log = LoggerFactory.getLogger(TaskExecutor.class);

    private final PageFetcher fetcher;
    private final CatalogParser parser;
    private final ProductPersister persister;

    public TaskExecutor(PageFetcher fetcher, CatalogParser parser, ProductPersister persister) {
        this.fetcher = fetcher;
        this.parser = parser;
        this.persister = persister;
    }

    public CompletionStage<TaskOutcome> execute(CrawlTask task, Duration timeout, Executor executor) {
        final long startNanos = System.nanoTime();
        return CompletableFuture
                .supplyAsync(() -> runTask(task), executor)
                .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                .handle((discovered, error) -> {
                    long durationMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
                    if (error == null) {
                        return TaskOutcome.succeeded(task, discovered, durationMs);
                    }
                    Throwable cause = CrawlErrorKind.unwrap(error);
                    if (cause instanceof TimeoutException) {
                        log.debug("Task {} timed out after {} ms", task.key(), durationMs);
                        return TaskOutcome.timedOut(task, "timed out after " + timeout.toMillis() + " ms", durationMs);
                    }
                    CrawlErrorKind kind = CrawlErrorKind.fromThrowable(cause);
                    if (!(cause instanceof CrawlTaskException)) {
                        log.warn("Task {} failed with unexpected {}", task.key(), cause.getClass().getName(), cause);
                    }
                    return TaskOutcome.failed(task, kind, describe(cause), durationMs);
                });
    }

    private List<ProductRef> runTask(CrawlTask task) {
        try {
            if (task instanceof PageTask page) {
                String body = fetcher.fetchListPage(page.pageNumber());
                List<ProductRef> refs = parser.parseListPage(page.pageNumber(), body);
                log.debug("Page {} listed {} products", page.pageNumber(), refs.size());
                return refs;
            }
            if (task instanceof DetailTask detail) {
                ProductRef ref = new ProductRef(detail.id(), detail.url());
                String body = fetcher.fetchDetail(detail.url());
                ProductDetail record = parser.parseDetail(ref, body);
                persister.persist(record);
                return List.of();
            }
            throw new IllegalArgumentException("Unsupported task type " + task.getClass().getName());
        } catch (CrawlTaskException e) {
            throw new CompletionException(e);
        }
    }

    private static String describe(Throwable cause) {
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
