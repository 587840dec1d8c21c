package com.dharmil.catalogcrawl.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Record of the one-time concurrency reduction applied to a phase.
 */
public record DownshiftMeta(Instant timestamp,
                            @JsonProperty("old_limit") int oldLimit,
                            @JsonProperty("new_limit") int newLimit,
                            String trigger) {
}
