package com.dharmil.catalogcrawl.akka.messages;

import java.io.Serializable;

/**
 * Marker interface for every message exchanged between the crawl actors.
 */
public interface CrawlMessage extends Serializable {
    long serialVersionUID = 1L;
}
