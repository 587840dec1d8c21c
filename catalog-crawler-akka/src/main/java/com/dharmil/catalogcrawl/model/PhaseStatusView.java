package com.dharmil.catalogcrawl.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

/**
 * Per-phase block of {@link SessionStatusView}. Page phases fill {@code failedPagesSample},
 * detail phases fill {@code failedIdsSample}.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PhaseStatusView(long processed,
                              long total,
                              double percent,
                              long failed,
                              double failedRate,
                              long retrying,
                              int failureThreshold,
                              List<Integer> failedPagesSample,
                              List<String> failedIdsSample,
                              int concurrencyLimit,
                              boolean downshifted,
                              DownshiftMeta downshiftMeta) {
}
