package com.dharmil.catalogcrawl.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;
import java.util.List;

/**
 * Status of one session as exposed to external consumers.
 *
 * @param resumeToken    latest emitted token in its JSON interchange form, if any
 * @param remainingPages pages still outstanding according to that token
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SessionStatusView(String sessionId,
                                SessionStatus status,
                                int contractVersion,
                                Instant startedAt,
                                Instant completedAt,
                                PhaseStatusView pages,
                                PhaseStatusView details,
                                ErrorStatusView errors,
                                MetricsView metrics,
                                String resumeToken,
                                List<Integer> remainingPages) {
}
