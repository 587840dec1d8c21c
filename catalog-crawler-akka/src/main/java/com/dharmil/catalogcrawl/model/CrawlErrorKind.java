package com.dharmil.catalogcrawl.model;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Failure taxonomy for crawl tasks.
 */
public enum CrawlErrorKind {
    NETWORK_TIMEOUT,
    RATE_LIMITED,
    PARSE_ERROR,
    SERVER_ERROR,
    PERMANENT,
    INTERNAL_ERROR;

    public static CrawlErrorKind fromHttpStatus(int status) {
        if (status == 429) {
            return RATE_LIMITED;
        }
        if (status == 408) {
            return NETWORK_TIMEOUT;
        }
        if (status == 404 || status == 410) {
            return PERMANENT;
        }
        if (status >= 400 && status < 600) {
            return SERVER_ERROR;
        }
        return PERMANENT;
    }

    /**
     * Maps an arbitrary failure raised while running a task onto the taxonomy.
     * Unknown exceptions count as server errors so they stay within the retry budget.
     */
    public static CrawlErrorKind fromThrowable(Throwable error) {
        Throwable cause = unwrap(error);
        if (cause instanceof CrawlTaskException crawlError) {
            return crawlError.kind();
        }
        if (cause instanceof TimeoutException
                || cause instanceof SocketTimeoutException
                || cause instanceof HttpTimeoutException) {
            return NETWORK_TIMEOUT;
        }
        if (cause instanceof IOException) {
            return SERVER_ERROR;
        }
        if (cause instanceof IllegalArgumentException) {
            return PERMANENT;
        }
        return SERVER_ERROR;
    }

    public static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
