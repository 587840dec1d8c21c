package com.dharmil.catalogcrawl.model;

import java.util.Map;

/**
 * Parsed product detail handed to the persister. Attribute names are whatever the parser extracts.
 */
public record ProductDetail(String id, String url, Map<String, String> attributes) {

    public ProductDetail {
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }
}
