package com.dharmil.catalogcrawl.model;

/**
 * Read-only view of a phase's worker budget.
 *
 * @param downshiftMeta {@code null} until a downshift happened
 */
public record ConcurrencyState(int currentLimit, boolean downshifted, DownshiftMeta downshiftMeta) {
}
