package com.dharmil.catalogcrawl.model;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Unfinished work recovered from a resume token, ready to seed a new session.
 */
public record RestorePlan(int version,
                          String planHash,
                          List<Integer> remainingPages,
                          List<String> remainingDetailIds,
                          Map<Integer, Integer> retriesPerPage,
                          Map<String, Integer> detailRetryCounts,
                          long processedPages,
                          long totalPages,
                          int batchSize,
                          int concurrencyLimit) implements Serializable {

    public RestorePlan {
        remainingPages = List.copyOf(remainingPages);
        remainingDetailIds = remainingDetailIds == null ? List.of() : List.copyOf(remainingDetailIds);
        retriesPerPage = retriesPerPage == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(retriesPerPage));
        detailRetryCounts = detailRetryCounts == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(detailRetryCounts));
    }
}
