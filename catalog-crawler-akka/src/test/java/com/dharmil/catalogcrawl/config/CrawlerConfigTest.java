package com.dharmil.catalogcrawl.config;

import com.dharmil.catalogcrawl.collaborator.CatalogParser;
import com.dharmil.catalogcrawl.collaborator.LoggingProductPersister;
import com.dharmil.catalogcrawl.collaborator.PageFetcher;
import com.dharmil.catalogcrawl.collaborator.ProductPersister;
import com.dharmil.catalogcrawl.collaborator.SimulatedCatalog;
import com.dharmil.catalogcrawl.collaborator.SimulatedCatalogParser;
import com.dharmil.catalogcrawl.resume.ResumeTokenStore;
import com.dharmil.catalogcrawl.service.TaskExecutor;
import com.dharmil.catalogcrawl.support.InMemoryResumeTokenStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;

class CrawlerConfigTest {

    /** Serves fixed bodies; stands in for an application's own transport. */
    static class FixedPageFetcher implements PageFetcher {
        @Override
        public String fetchListPage(int pageNumber) {
            return "fixed-" + pageNumber + "|https://shop.test/products/fixed-" + pageNumber + "\n";
        }

        @Override
        public String fetchDetail(String url) {
            return "id=" + url.substring(url.lastIndexOf('/') + 1) + "\n";
        }
    }

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withPropertyValues("crawler.events.log-bridge=false")
            .withBean(ObjectMapper.class, ObjectMapper::new)
            .withBean(ResumeTokenStore.class, InMemoryResumeTokenStore::new)
            .withUserConfiguration(CrawlerConfig.class);

    @Test
    void registersSimulatedCollaboratorsWhenNoneAreSupplied() {
        runner.run(context -> {
            assertNull(context.getStartupFailure());
            assertInstanceOf(SimulatedCatalog.class, context.getBean(PageFetcher.class));
            assertInstanceOf(SimulatedCatalogParser.class, context.getBean(CatalogParser.class));
            assertInstanceOf(LoggingProductPersister.class, context.getBean(ProductPersister.class));
        });
    }

    @Test
    void suppliedFetcherStillGetsTheSimulatedParser() {
        FixedPageFetcher fetcher = new FixedPageFetcher();
        runner.withBean(PageFetcher.class, () -> fetcher).run(context -> {
            assertNull(context.getStartupFailure());
            assertSame(fetcher, context.getBean(PageFetcher.class));
            assertEquals(0, context.getBeansOfType(SimulatedCatalog.class).size());
            assertInstanceOf(SimulatedCatalogParser.class, context.getBean(CatalogParser.class));
            assertEquals(1, context.getBeansOfType(TaskExecutor.class).size());
        });
    }

    @Test
    void suppliedParserStillGetsTheSimulatedFetcher() {
        CatalogParser parser = new SimulatedCatalogParser();
        runner.withBean(CatalogParser.class, () -> parser).run(context -> {
            assertNull(context.getStartupFailure());
            assertSame(parser, context.getBean(CatalogParser.class));
            assertInstanceOf(SimulatedCatalog.class, context.getBean(PageFetcher.class));
        });
    }
}
