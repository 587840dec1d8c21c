package com.dharmil.catalogcrawl.model;

import java.io.Serializable;

/**
 * A single bounded unit of crawl work. The key identifies the task across retries and in resume tokens.
 */
public interface CrawlTask extends Serializable {

    String key();

    PhaseKind phase();
}
