package com.dharmil.catalogcrawl.model;

import java.io.Serializable;

/**
 * A product reference discovered on a listing page.
 */
public record ProductRef(String id, String url) implements Serializable {
}
