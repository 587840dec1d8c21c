package com.dharmil.catalogcrawl;

import com.dharmil.catalogcrawl.collaborator.CatalogParser;
import com.dharmil.catalogcrawl.collaborator.PageFetcher;
import com.dharmil.catalogcrawl.collaborator.SimulatedCatalog;
import com.dharmil.catalogcrawl.collaborator.SimulatedCatalogParser;
import com.dharmil.catalogcrawl.events.CrawlEventLogBridge;
import com.dharmil.catalogcrawl.model.SessionStatus;
import com.dharmil.catalogcrawl.model.SessionStatusView;
import com.dharmil.catalogcrawl.resume.JdbcResumeTokenStore;
import com.dharmil.catalogcrawl.resume.ResumeTokenStore;
import com.dharmil.catalogcrawl.service.CrawlEngine;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.ActiveProfiles;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest
@ActiveProfiles("test")
class CatalogCrawlApplicationTest {

    @Autowired
    private CrawlEngine engine;

    @Autowired
    private PageFetcher pageFetcher;

    @Autowired
    private ResumeTokenStore tokenStore;

    @Autowired
    private ApplicationContext context;

    @Test
    void wiresSimulatedCatalogAndJdbcStore() {
        assertInstanceOf(SimulatedCatalog.class, pageFetcher);
        assertInstanceOf(SimulatedCatalogParser.class, context.getBean(CatalogParser.class));
        assertInstanceOf(JdbcResumeTokenStore.class, tokenStore);
        assertTrue(context.getBeansOfType(CrawlEventLogBridge.class).isEmpty());
    }

    @Test
    void crawlsSimulatedCatalogEndToEnd() throws Exception {
        String sessionId = engine.startPages(1, 3).toCompletableFuture().get(10, TimeUnit.SECONDS);

        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(20);
        SessionStatusView view = engine.getStatus(sessionId).toCompletableFuture().get(5, TimeUnit.SECONDS);
        while (!view.status().isTerminal() && System.nanoTime() < deadline) {
            Thread.sleep(50);
            view = engine.getStatus(sessionId).toCompletableFuture().get(5, TimeUnit.SECONDS);
        }

        assertEquals(SessionStatus.COMPLETED, view.status());
        assertEquals(3, view.pages().processed());
        assertEquals(9, view.details().processed());
        assertEquals(0, view.details().failed());
    }
}
