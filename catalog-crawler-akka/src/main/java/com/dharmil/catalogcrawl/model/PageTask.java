package com.dharmil.catalogcrawl.model;

/**
 * Fetches one listing page and extracts the product references on it.
 *
 * @param pageNumber catalog page number as understood by the fetcher
 */
public record PageTask(int pageNumber) implements CrawlTask {

    public static String keyFor(int pageNumber) {
        return PhaseKind.LIST_COLLECTION.taskPrefix() + ":" + pageNumber;
    }

    @Override
    public String key() {
        return keyFor(pageNumber);
    }

    @Override
    public PhaseKind phase() {
        return PhaseKind.LIST_COLLECTION;
    }
}
