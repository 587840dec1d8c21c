package com.dharmil.catalogcrawl.collaborator;

import com.dharmil.catalogcrawl.model.ProductDetail;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Default persister used when no storage backend is configured: logs each record and counts them.
 */
public class LoggingProductPersister implements ProductPersister {

    private static final Logger log = LoggerFactory.getLogger(LoggingProductPersister.class);

    private final AtomicLong persisted = new AtomicLong();

    @Override
    public void persist(ProductDetail detail) {
        long count = persisted.incrementAndGet();
        log.debug("Persisted product {} ({} attributes) from {}", detail.id(), detail.attributes().size(), detail.url());
        if (count % 100 == 0) {
            log.info("Progress: {} product details persisted.", count);
        }
    }

    public long persistedCount() {
        return persisted.get();
    }
}
