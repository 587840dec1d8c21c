package com.dharmil.catalogcrawl.model;

import com.dharmil.catalogcrawl.service.FixedRetryDelay;
import com.dharmil.catalogcrawl.service.RetryDelayStrategy;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Everything one crawl session needs. Built from {@code CrawlerProperties} with per-request
 * overrides; see {@code SessionConfigFactory}.
 *
 * @param sessionId          requested id, or {@code null} to let the registry assign one
 * @param pages              list pages to crawl, in dispatch order
 * @param detailUrlTemplate  template used to rebuild detail URLs for restored ids; {@code {id}} is substituted
 */
public record SessionConfig(String sessionId,
                            List<Integer> pages,
                            int batchSize,
                            int listConcurrency,
                            int detailConcurrency,
                            int pageMaxRetries,
                            int detailMaxRetries,
                            int parseErrorMaxRetries,
                            int pageFailureThreshold,
                            int detailFailureThreshold,
                            Duration taskTimeout,
                            double downshiftThreshold,
                            double downshiftFactor,
                            int downshiftMinSample,
                            Duration shutdownTimeout,
                            Duration removalGrace,
                            int etaMinSample,
                            boolean checkpointOnBatch,
                            RetryDelayStrategy retryDelay,
                            String detailUrlTemplate) {

    public SessionConfig {
        pages = List.copyOf(Objects.requireNonNull(pages, "pages"));
        Objects.requireNonNull(taskTimeout, "taskTimeout");
        Objects.requireNonNull(shutdownTimeout, "shutdownTimeout");
        Objects.requireNonNull(removalGrace, "removalGrace");
        Objects.requireNonNull(retryDelay, "retryDelay");
    }

    public static List<Integer> pageRange(int firstPage, int lastPage) {
        return IntStream.rangeClosed(firstPage, lastPage).boxed().collect(Collectors.toList());
    }

    public PhaseSettings listPhase() {
        return new PhaseSettings(PhaseKind.LIST_COLLECTION, listConcurrency, batchSize, pageMaxRetries,
                parseErrorMaxRetries, pageFailureThreshold, taskTimeout, downshiftThreshold, downshiftFactor,
                downshiftMinSample, retryDelay);
    }

    public PhaseSettings detailPhase() {
        return new PhaseSettings(PhaseKind.DETAIL_COLLECTION, detailConcurrency, batchSize, detailMaxRetries,
                parseErrorMaxRetries, detailFailureThreshold, taskTimeout, downshiftThreshold, downshiftFactor,
                downshiftMinSample, retryDelay);
    }

    public String detailUrlFor(String id) {
        if (id.startsWith("http://") || id.startsWith("https://")) {
            return id;
        }
        return detailUrlTemplate.replace("{id}", id);
    }

    public SessionConfig withSessionId(String id) {
        return toBuilder().sessionId(id).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .sessionId(sessionId).pages(pages).batchSize(batchSize)
                .listConcurrency(listConcurrency).detailConcurrency(detailConcurrency)
                .pageMaxRetries(pageMaxRetries).detailMaxRetries(detailMaxRetries)
                .parseErrorMaxRetries(parseErrorMaxRetries)
                .pageFailureThreshold(pageFailureThreshold).detailFailureThreshold(detailFailureThreshold)
                .taskTimeout(taskTimeout)
                .downshiftThreshold(downshiftThreshold).downshiftFactor(downshiftFactor)
                .downshiftMinSample(downshiftMinSample)
                .shutdownTimeout(shutdownTimeout).removalGrace(removalGrace)
                .etaMinSample(etaMinSample).checkpointOnBatch(checkpointOnBatch)
                .retryDelay(retryDelay).detailUrlTemplate(detailUrlTemplate);
    }

    /**
     * Builder pre-filled with the same defaults as {@code CrawlerProperties}.
     */
    public static final class Builder {
        private String sessionId;
        private List<Integer> pages = List.of();
        private int batchSize = 10;
        private int listConcurrency = 4;
        private int detailConcurrency = 8;
        private int pageMaxRetries = 3;
        private int detailMaxRetries = 2;
        private int parseErrorMaxRetries = 1;
        private int pageFailureThreshold = 50;
        private int detailFailureThreshold = 25;
        private Duration taskTimeout = Duration.ofSeconds(30);
        private double downshiftThreshold = 0.30;
        private double downshiftFactor = 0.5;
        private int downshiftMinSample = 10;
        private Duration shutdownTimeout = Duration.ofSeconds(10);
        private Duration removalGrace = Duration.ofSeconds(30);
        private int etaMinSample = 3;
        private boolean checkpointOnBatch = true;
        private RetryDelayStrategy retryDelay = new FixedRetryDelay(Duration.ofSeconds(1));
        private String detailUrlTemplate = "https://catalog.example.com/products/{id}";

        private Builder() {
        }

        public Builder sessionId(String sessionId) { this.sessionId = sessionId; return this; }
        public Builder pages(List<Integer> pages) { this.pages = pages; return this; }
        public Builder batchSize(int batchSize) { this.batchSize = batchSize; return this; }
        public Builder listConcurrency(int listConcurrency) { this.listConcurrency = listConcurrency; return this; }
        public Builder detailConcurrency(int detailConcurrency) { this.detailConcurrency = detailConcurrency; return this; }
        public Builder pageMaxRetries(int pageMaxRetries) { this.pageMaxRetries = pageMaxRetries; return this; }
        public Builder detailMaxRetries(int detailMaxRetries) { this.detailMaxRetries = detailMaxRetries; return this; }
        public Builder parseErrorMaxRetries(int parseErrorMaxRetries) { this.parseErrorMaxRetries = parseErrorMaxRetries; return this; }
        public Builder pageFailureThreshold(int pageFailureThreshold) { this.pageFailureThreshold = pageFailureThreshold; return this; }
        public Builder detailFailureThreshold(int detailFailureThreshold) { this.detailFailureThreshold = detailFailureThreshold; return this; }
        public Builder taskTimeout(Duration taskTimeout) { this.taskTimeout = taskTimeout; return this; }
        public Builder downshiftThreshold(double downshiftThreshold) { this.downshiftThreshold = downshiftThreshold; return this; }
        public Builder downshiftFactor(double downshiftFactor) { this.downshiftFactor = downshiftFactor; return this; }
        public Builder downshiftMinSample(int downshiftMinSample) { this.downshiftMinSample = downshiftMinSample; return this; }
        public Builder shutdownTimeout(Duration shutdownTimeout) { this.shutdownTimeout = shutdownTimeout; return this; }
        public Builder removalGrace(Duration removalGrace) { this.removalGrace = removalGrace; return this; }
        public Builder etaMinSample(int etaMinSample) { this.etaMinSample = etaMinSample; return this; }
        public Builder checkpointOnBatch(boolean checkpointOnBatch) { this.checkpointOnBatch = checkpointOnBatch; return this; }
        public Builder retryDelay(RetryDelayStrategy retryDelay) { this.retryDelay = retryDelay; return this; }
        public Builder detailUrlTemplate(String detailUrlTemplate) { this.detailUrlTemplate = detailUrlTemplate; return this; }

        public SessionConfig build() {
            return new SessionConfig(sessionId, pages, batchSize, listConcurrency, detailConcurrency,
                    pageMaxRetries, detailMaxRetries, parseErrorMaxRetries, pageFailureThreshold,
                    detailFailureThreshold, taskTimeout, downshiftThreshold, downshiftFactor, downshiftMinSample,
                    shutdownTimeout, removalGrace, etaMinSample, checkpointOnBatch, retryDelay, detailUrlTemplate);
        }
    }
}
