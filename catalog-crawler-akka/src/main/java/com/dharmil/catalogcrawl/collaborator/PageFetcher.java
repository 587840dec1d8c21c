package com.dharmil.catalogcrawl.collaborator;

import com.dharmil.catalogcrawl.model.CrawlTaskException;

/**
 * Transport to the catalog. Implementations are called from the blocking-I/O dispatcher and may block.
 */
public interface PageFetcher {

    String fetchListPage(int pageNumber) throws CrawlTaskException;

    String fetchDetail(String url) throws CrawlTaskException;
}
