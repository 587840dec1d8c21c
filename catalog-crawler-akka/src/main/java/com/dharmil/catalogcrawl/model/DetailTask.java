package com.dharmil.catalogcrawl.model;

/**
 * Fetches, parses and persists the detail record of one product.
 *
 * @param id  product identifier, stable across sessions and used in resume tokens
 * @param url absolute URL of the product detail page
 */
public record DetailTask(String id, String url) implements CrawlTask {

    public static String keyFor(String id) {
        return PhaseKind.DETAIL_COLLECTION.taskPrefix() + ":" + id;
    }

    public static DetailTask of(ProductRef ref) {
        return new DetailTask(ref.id(), ref.url());
    }

    @Override
    public String key() {
        return keyFor(id);
    }

    @Override
    public PhaseKind phase() {
        return PhaseKind.DETAIL_COLLECTION;
    }
}
