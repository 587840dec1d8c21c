package com.dharmil.catalogcrawl.config;

import com.dharmil.catalogcrawl.model.SessionConfig;
import com.dharmil.catalogcrawl.service.ExponentialBackoffDelay;
import com.dharmil.catalogcrawl.service.FixedRetryDelay;
import com.dharmil.catalogcrawl.service.RetryDelayStrategy;

import java.util.List;

/**
 * Turns {@link CrawlerProperties} into {@link SessionConfig} builders.
 */
public class SessionConfigFactory {

    private final CrawlerProperties properties;

    public SessionConfigFactory(CrawlerProperties properties) {
        this.properties = properties;
    }

    /** Builder pre-filled with the configured defaults and no pages. */
    public SessionConfig.Builder defaults() {
        return SessionConfig.builder()
                .batchSize(properties.getBatchSize())
                .listConcurrency(properties.getList().getConcurrency())
                .detailConcurrency(properties.getDetail().getConcurrency())
                .pageMaxRetries(properties.getList().getMaxRetries())
                .detailMaxRetries(properties.getDetail().getMaxRetries())
                .parseErrorMaxRetries(properties.getParseErrorMaxRetries())
                .pageFailureThreshold(properties.getList().getFailureThreshold())
                .detailFailureThreshold(properties.getDetail().getFailureThreshold())
                .taskTimeout(properties.getTaskTimeout())
                .downshiftThreshold(properties.getDownshift().getThreshold())
                .downshiftFactor(properties.getDownshift().getFactor())
                .downshiftMinSample(properties.getDownshift().getMinSample())
                .shutdownTimeout(properties.getSession().getShutdownTimeout())
                .removalGrace(properties.getSession().getRemovalGrace())
                .etaMinSample(properties.getStatus().getEtaMinSample())
                .checkpointOnBatch(properties.getResume().isCheckpointOnBatch())
                .retryDelay(retryDelay())
                .detailUrlTemplate(properties.getCatalog().getDetailUrlTemplate());
    }

    public SessionConfig forPages(List<Integer> pages) {
        return defaults().pages(pages).build();
    }

    public SessionConfig forPageRange(int firstPage, int lastPage) {
        return forPages(SessionConfig.pageRange(firstPage, lastPage));
    }

    public RetryDelayStrategy retryDelay() {
        CrawlerProperties.Retry retry = properties.getRetry();
        if (retry.getStrategy() == CrawlerProperties.RetryStrategy.FIXED) {
            return new FixedRetryDelay(retry.getBaseDelay());
        }
        return new ExponentialBackoffDelay(retry.getBaseDelay(), retry.getMaxDelay(),
                retry.getMultiplier(), retry.getJitter());
    }
}
