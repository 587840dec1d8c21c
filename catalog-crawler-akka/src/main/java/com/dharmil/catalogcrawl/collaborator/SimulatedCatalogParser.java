package com.dharmil.catalogcrawl.collaborator;

import com.dharmil.catalogcrawl.model.CrawlErrorKind;
import com.dharmil.catalogcrawl.model.CrawlTaskException;
import com.dharmil.catalogcrawl.model.ProductDetail;
import com.dharmil.catalogcrawl.model.ProductRef;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parses the line formats served by {@link SimulatedCatalog}: {@code id|url} per product on list
 * pages and {@code key=value} attributes on detail pages. Stateless.
 */
public class SimulatedCatalogParser implements CatalogParser {

    @Override
    public List<ProductRef> parseListPage(int pageNumber, String body) throws CrawlTaskException {
        List<ProductRef> refs = new ArrayList<>();
        for (String line : body.split("\n")) {
            if (line.isBlank()) {
                continue;
            }
            int separator = line.indexOf('|');
            if (separator <= 0 || separator == line.length() - 1) {
                throw new CrawlTaskException(CrawlErrorKind.PARSE_ERROR,
                        "Malformed product line on page " + pageNumber + ": " + line);
            }
            refs.add(new ProductRef(line.substring(0, separator), line.substring(separator + 1)));
        }
        return refs;
    }

    @Override
    public ProductDetail parseDetail(ProductRef ref, String body) throws CrawlTaskException {
        Map<String, String> attributes = new LinkedHashMap<>();
        for (String line : body.split("\n")) {
            if (line.isBlank()) {
                continue;
            }
            int separator = line.indexOf('=');
            if (separator <= 0) {
                throw new CrawlTaskException(CrawlErrorKind.PARSE_ERROR,
                        "Malformed detail attribute for " + ref.id() + ": " + line);
            }
            attributes.put(line.substring(0, separator), line.substring(separator + 1));
        }
        if (!ref.id().equals(attributes.get("id"))) {
            throw new CrawlTaskException(CrawlErrorKind.PARSE_ERROR, "Detail body does not describe " + ref.id());
        }
        return new ProductDetail(ref.id(), ref.url(), attributes);
    }
}
