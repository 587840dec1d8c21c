package com.dharmil.catalogcrawl.resume;

import java.util.Optional;

/**
 * Keeps emitted tokens so an interrupted crawl can be restarted from its latest one.
 */
public interface ResumeTokenStore {

    void save(String sessionId, String planHash, String tokenJson, boolean checkpoint);

    Optional<String> findLatest(String sessionId);

    Optional<String> findLatestByPlanHash(String planHash);
}
