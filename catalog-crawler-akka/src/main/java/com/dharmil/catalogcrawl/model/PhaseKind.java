package com.dharmil.catalogcrawl.model;

/**
 * The two stages of a catalog crawl. List collection discovers product references from the
 * paginated listing; detail collection fetches every discovered product.
 */
public enum PhaseKind {
    LIST_COLLECTION("page"),
    DETAIL_COLLECTION("detail");

    private final String taskPrefix;

    PhaseKind(String taskPrefix) {
        this.taskPrefix = taskPrefix;
    }

    public String taskPrefix() {
        return taskPrefix;
    }
}
