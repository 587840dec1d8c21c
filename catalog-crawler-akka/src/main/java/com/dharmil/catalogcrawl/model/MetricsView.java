package com.dharmil.catalogcrawl.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record MetricsView(long elapsedMs, double throughputPagesPerMin, long etaMs) {
}
