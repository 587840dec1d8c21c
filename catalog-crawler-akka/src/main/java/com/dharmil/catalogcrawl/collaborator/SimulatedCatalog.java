package com.dharmil.catalogcrawl.collaborator;

import com.dharmil.catalogcrawl.model.CrawlErrorKind;
import com.dharmil.catalogcrawl.model.CrawlTaskException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Random;

/**
 * In-process stand-in for a real catalog site. Serves synthetic list pages ({@code id|url} lines)
 * and detail bodies ({@code key=value} lines), read back by {@link SimulatedCatalogParser}, and
 * injects failures of every kind at the configured rates so the retry and downshift paths can be
 * exercised without a network.
 */
public class SimulatedCatalog implements PageFetcher {

    private static final Logger log = LoggerFactory.getLogger(SimulatedCatalog.class);

    private static final String GARBLED_BODY = "<!-- truncated";

    /**
     * @param productsPerPage products listed on every list page
     * @param latencyMillis   simulated fetch latency
     * @param timeoutRate     probability of a {@code NETWORK_TIMEOUT}
     * @param rateLimitRate   probability of an HTTP 429
     * @param serverErrorRate probability of an HTTP 503
     * @param parseErrorRate  probability of a garbled body
     * @param seed            random seed, fixed for reproducible runs
     */
    public record Settings(String baseUrl,
                           int productsPerPage,
                           long latencyMillis,
                           double timeoutRate,
                           double rateLimitRate,
                           double serverErrorRate,
                           double parseErrorRate,
                           long seed) {
    }

    private final Settings settings;
    private final Random random;

    public SimulatedCatalog(Settings settings) {
        this.settings = settings;
        this.random = new Random(settings.seed());
        log.info("Simulated catalog ready: {}", settings);
    }

    // --- PageFetcher ---

    @Override
    public String fetchListPage(int pageNumber) throws CrawlTaskException {
        String url = settings.baseUrl() + "/products?page=" + pageNumber;
        if (pageNumber < 1) {
            throw CrawlTaskException.httpStatus(404, url);
        }
        boolean garbled = simulateRequest(url);
        if (garbled) {
            return GARBLED_BODY;
        }
        StringBuilder body = new StringBuilder();
        for (int i = 0; i < settings.productsPerPage(); i++) {
            String id = "p" + pageNumber + "-" + i;
            body.append(id).append('|').append(settings.baseUrl()).append("/products/").append(id).append('\n');
        }
        return body.toString();
    }

    @Override
    public String fetchDetail(String url) throws CrawlTaskException {
        boolean garbled = simulateRequest(url);
        if (garbled) {
            return GARBLED_BODY;
        }
        String id = url.substring(url.lastIndexOf('/') + 1);
        return "id=" + id + "\nname=Product " + id + "\nprice=" + (Math.abs(id.hashCode()) % 10_000) / 100.0 + "\n";
    }

    /**
     * Sleeps for the configured latency and throws the injected failure, if any.
     *
     * @return true when the response body should be garbled
     */
    private boolean simulateRequest(String url) throws CrawlTaskException {
        if (settings.latencyMillis() > 0) {
            try {
                Thread.sleep(settings.latencyMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new CrawlTaskException(CrawlErrorKind.NETWORK_TIMEOUT, "Interrupted while fetching " + url, e);
            }
        }
        double roll = random.nextDouble();
        double bound = settings.timeoutRate();
        if (roll < bound) {
            throw new CrawlTaskException(CrawlErrorKind.NETWORK_TIMEOUT, "Simulated timeout for " + url);
        }
        bound += settings.rateLimitRate();
        if (roll < bound) {
            throw CrawlTaskException.httpStatus(429, url);
        }
        bound += settings.serverErrorRate();
        if (roll < bound) {
            throw CrawlTaskException.httpStatus(503, url);
        }
        bound += settings.parseErrorRate();
        return roll < bound;
    }
}
