package com.dharmil.catalogcrawl.collaborator;

import com.dharmil.catalogcrawl.model.CrawlErrorKind;
import com.dharmil.catalogcrawl.model.CrawlTaskException;
import com.dharmil.catalogcrawl.model.ProductDetail;
import com.dharmil.catalogcrawl.model.ProductRef;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class SimulatedCatalogTest {

    private final SimulatedCatalogParser parser = new SimulatedCatalogParser();

    private static SimulatedCatalog catalog(double timeoutRate, double parseErrorRate) {
        return new SimulatedCatalog(new SimulatedCatalog.Settings("https://sim.test", 12, 0,
                timeoutRate, 0.0, 0.0, parseErrorRate, 7L));
    }

    @Test
    void healthyPageListsConfiguredProducts() throws Exception {
        SimulatedCatalog catalog = catalog(0.0, 0.0);

        List<ProductRef> refs = parser.parseListPage(5, catalog.fetchListPage(5));

        assertEquals(12, refs.size());
        assertEquals(new ProductRef("p5-0", "https://sim.test/products/p5-0"), refs.get(0));
        assertEquals("p5-11", refs.get(11).id());
    }

    @Test
    void detailRoundTripsThroughParser() throws Exception {
        SimulatedCatalog catalog = catalog(0.0, 0.0);
        ProductRef ref = new ProductRef("p1-2", "https://sim.test/products/p1-2");

        ProductDetail detail = parser.parseDetail(ref, catalog.fetchDetail(ref.url()));

        assertEquals("p1-2", detail.id());
        assertEquals("Product p1-2", detail.attributes().get("name"));
    }

    @Test
    void pagesBelowOneArePermanentlyMissing() {
        CrawlTaskException error = assertThrows(CrawlTaskException.class, () -> catalog(0.0, 0.0).fetchListPage(0));
        assertEquals(CrawlErrorKind.PERMANENT, error.kind());
    }

    @Test
    void garbledBodiesFailToParse() throws Exception {
        SimulatedCatalog catalog = catalog(0.0, 1.0);
        String body = catalog.fetchListPage(2);

        CrawlTaskException error = assertThrows(CrawlTaskException.class, () -> parser.parseListPage(2, body));
        assertEquals(CrawlErrorKind.PARSE_ERROR, error.kind());
    }

    @Test
    void injectedTimeoutsAreClassified() {
        CrawlTaskException error = assertThrows(CrawlTaskException.class, () -> catalog(1.0, 0.0).fetchListPage(1));
        assertEquals(CrawlErrorKind.NETWORK_TIMEOUT, error.kind());
    }

    @Test
    void detailForAnotherProductIsAParseError() {
        SimulatedCatalog catalog = catalog(0.0, 0.0);
        ProductRef ref = new ProductRef("p1-1", "https://sim.test/products/p1-1");

        CrawlTaskException error = assertThrows(CrawlTaskException.class,
                () -> parser.parseDetail(ref, "id=p9-9\nname=Other"));
        assertEquals(CrawlErrorKind.PARSE_ERROR, error.kind());
    }
}
