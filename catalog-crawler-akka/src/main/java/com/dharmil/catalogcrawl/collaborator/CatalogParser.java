package com.dharmil.catalogcrawl.collaborator;

import com.dharmil.catalogcrawl.model.CrawlTaskException;
import com.dharmil.catalogcrawl.model.ProductDetail;
import com.dharmil.catalogcrawl.model.ProductRef;

import java.util.List;

/**
 * Turns raw bodies into product references and detail records. Malformed input should be
 * reported as {@code PARSE_ERROR}.
 */
public interface CatalogParser {

    List<ProductRef> parseListPage(int pageNumber, String body) throws CrawlTaskException;

    ProductDetail parseDetail(ProductRef ref, String body) throws CrawlTaskException;
}
