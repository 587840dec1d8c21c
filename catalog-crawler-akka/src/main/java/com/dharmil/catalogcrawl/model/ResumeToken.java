package com.dharmil.catalogcrawl.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Versioned snapshot of a session's incomplete work.
 * <p>
 * Detail fields and {@code version} are {@code null} when absent from the serialized form; a token
 * without a version is treated as v1 unless it carries detail fields.
 */
public record ResumeToken(Integer version,
                          String planHash,
                          List<Integer> remainingPages,
                          List<String> remainingDetailIds,
                          Map<String, Integer> detailRetryCounts,
                          Long detailRetriesTotal,
                          Instant generatedAt,
                          long processedPages,
                          long totalPages,
                          int batchSize,
                          int concurrencyLimit,
                          List<Integer> retryingPages,
                          List<Integer> failedPages,
                          Map<Integer, Integer> retriesPerPage,
                          Map<Integer, Integer> detailRetryHistogram) {

    public static final int CURRENT_VERSION = 2;

    public ResumeToken {
        remainingPages = remainingPages == null ? List.of() : List.copyOf(remainingPages);
        remainingDetailIds = remainingDetailIds == null ? null : List.copyOf(remainingDetailIds);
        detailRetryCounts = orderedCopy(detailRetryCounts);
        retryingPages = retryingPages == null ? List.of() : List.copyOf(retryingPages);
        failedPages = failedPages == null ? List.of() : List.copyOf(failedPages);
        retriesPerPage = retriesPerPage == null ? Map.of() : orderedCopy(retriesPerPage);
        detailRetryHistogram = orderedCopy(detailRetryHistogram);
    }

    public int effectiveVersion() {
        if (version != null) {
            return version;
        }
        return hasDetailFields() ? CURRENT_VERSION : 1;
    }

    public boolean hasDetailFields() {
        return remainingDetailIds != null || detailRetryCounts != null
                || detailRetriesTotal != null || detailRetryHistogram != null;
    }

    private static <K> Map<K, Integer> orderedCopy(Map<K, Integer> source) {
        return source == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }
}
