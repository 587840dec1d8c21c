package com.dharmil.catalogcrawl.config;

import com.dharmil.catalogcrawl.events.EventWireFormat;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Crawler defaults bound from {@code crawler.*}. Setters clamp values into their valid range;
 * per-session overrides travel in {@code SessionConfig}.
 */
@ConfigurationProperties(prefix = "crawler")
public class CrawlerProperties {

    public enum RetryStrategy { FIXED, EXPONENTIAL }

    private int batchSize = 10;
    private Duration taskTimeout = Duration.ofSeconds(30);
    private int parseErrorMaxRetries = 1;
    private Duration askTimeout = Duration.ofSeconds(5);
    private String dispatcher = "crawler.blocking-io-dispatcher";
    private Phase list = new Phase(4, 3, 50);
    private Phase detail = new Phase(8, 2, 25);
    private Retry retry = new Retry();
    private Downshift downshift = new Downshift();
    private Session session = new Session();
    private Status status = new Status();
    private Resume resume = new Resume();
    private Events events = new Events();
    private Catalog catalog = new Catalog();
    private Simulation simulation = new Simulation();
    private Autostart autostart = new Autostart();

    public int getBatchSize() {
        return batchSize;
    }

    public void setBatchSize(int batchSize) {
        this.batchSize = Math.max(1, batchSize);
    }

    public Duration getTaskTimeout() {
        return taskTimeout;
    }

    public void setTaskTimeout(Duration taskTimeout) {
        this.taskTimeout = atLeast(taskTimeout, Duration.ofMillis(1));
    }

    public int getParseErrorMaxRetries() {
        return parseErrorMaxRetries;
    }

    public void setParseErrorMaxRetries(int parseErrorMaxRetries) {
        this.parseErrorMaxRetries = Math.max(0, parseErrorMaxRetries);
    }

    public Duration getAskTimeout() {
        return askTimeout;
    }

    public void setAskTimeout(Duration askTimeout) {
        this.askTimeout = atLeast(askTimeout, Duration.ofMillis(100));
    }

    public String getDispatcher() {
        return dispatcher;
    }

    public void setDispatcher(String dispatcher) {
        this.dispatcher = dispatcher == null || dispatcher.isBlank() ? "crawler.blocking-io-dispatcher" : dispatcher.trim();
    }

    public Phase getList() {
        return list;
    }

    public void setList(Phase list) {
        this.list = list;
    }

    public Phase getDetail() {
        return detail;
    }

    public void setDetail(Phase detail) {
        this.detail = detail;
    }

    public Retry getRetry() {
        return retry;
    }

    public void setRetry(Retry retry) {
        this.retry = retry;
    }

    public Downshift getDownshift() {
        return downshift;
    }

    public void setDownshift(Downshift downshift) {
        this.downshift = downshift;
    }

    public Session getSession() {
        return session;
    }

    public void setSession(Session session) {
        this.session = session;
    }

    public Status getStatus() {
        return status;
    }

    public void setStatus(Status status) {
        this.status = status;
    }

    public Resume getResume() {
        return resume;
    }

    public void setResume(Resume resume) {
        this.resume = resume;
    }

    public Events getEvents() {
        return events;
    }

    public void setEvents(Events events) {
        this.events = events;
    }

    public Catalog getCatalog() {
        return catalog;
    }

    public void setCatalog(Catalog catalog) {
        this.catalog = catalog;
    }

    public Simulation getSimulation() {
        return simulation;
    }

    public void setSimulation(Simulation simulation) {
        this.simulation = simulation;
    }

    public Autostart getAutostart() {
        return autostart;
    }

    public void setAutostart(Autostart autostart) {
        this.autostart = autostart;
    }

    private static Duration atLeast(Duration value, Duration minimum) {
        if (value == null || value.compareTo(minimum) < 0) {
            return minimum;
        }
        return value;
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }

    /** Worker budget and failure limits of one phase. */
    public static class Phase {
        private int concurrency;
        private int maxRetries;
        private int failureThreshold;

        public Phase() {
            this(1, 0, 1);
        }

        Phase(int concurrency, int maxRetries, int failureThreshold) {
            this.concurrency = concurrency;
            this.maxRetries = maxRetries;
            this.failureThreshold = failureThreshold;
        }

        public int getConcurrency() {
            return concurrency;
        }

        public void setConcurrency(int concurrency) {
            this.concurrency = Math.max(1, concurrency);
        }

        public int getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = Math.max(0, maxRetries);
        }

        public int getFailureThreshold() {
            return failureThreshold;
        }

        public void setFailureThreshold(int failureThreshold) {
            this.failureThreshold = Math.max(1, failureThreshold);
        }
    }

    public static class Retry {
        private RetryStrategy strategy = RetryStrategy.EXPONENTIAL;
        private Duration baseDelay = Duration.ofMillis(1000);
        private Duration maxDelay = Duration.ofMillis(30000);
        private double multiplier = 2.0;
        private double jitter = 0.1;

        public RetryStrategy getStrategy() {
            return strategy;
        }

        public void setStrategy(RetryStrategy strategy) {
            this.strategy = strategy == null ? RetryStrategy.EXPONENTIAL : strategy;
        }

        public Duration getBaseDelay() {
            return baseDelay;
        }

        public void setBaseDelay(Duration baseDelay) {
            this.baseDelay = atLeast(baseDelay, Duration.ZERO);
        }

        public Duration getMaxDelay() {
            return maxDelay;
        }

        public void setMaxDelay(Duration maxDelay) {
            this.maxDelay = atLeast(maxDelay, Duration.ZERO);
        }

        public double getMultiplier() {
            return multiplier;
        }

        public void setMultiplier(double multiplier) {
            this.multiplier = Math.max(1.0, multiplier);
        }

        public double getJitter() {
            return jitter;
        }

        public void setJitter(double jitter) {
            this.jitter = clamp(jitter, 0.0, 1.0);
        }
    }

    public static class Downshift {
        private double threshold = 0.30;
        private double factor = 0.5;
        private int minSample = 10;

        public double getThreshold() {
            return threshold;
        }

        public void setThreshold(double threshold) {
            this.threshold = clamp(threshold, 0.0, 1.0);
        }

        public double getFactor() {
            return factor;
        }

        public void setFactor(double factor) {
            this.factor = clamp(factor, 0.05, 0.95);
        }

        public int getMinSample() {
            return minSample;
        }

        public void setMinSample(int minSample) {
            this.minSample = Math.max(1, minSample);
        }
    }

    public static class Session {
        private Duration shutdownTimeout = Duration.ofSeconds(10);
        private Duration removalGrace = Duration.ofSeconds(30);

        public Duration getShutdownTimeout() {
            return shutdownTimeout;
        }

        public void setShutdownTimeout(Duration shutdownTimeout) {
            this.shutdownTimeout = atLeast(shutdownTimeout, Duration.ZERO);
        }

        public Duration getRemovalGrace() {
            return removalGrace;
        }

        public void setRemovalGrace(Duration removalGrace) {
            this.removalGrace = atLeast(removalGrace, Duration.ZERO);
        }
    }

    public static class Status {
        private int etaMinSample = 3;

        public int getEtaMinSample() {
            return etaMinSample;
        }

        public void setEtaMinSample(int etaMinSample) {
            this.etaMinSample = Math.max(1, etaMinSample);
        }
    }

    public static class Resume {
        private boolean checkpointOnBatch = true;

        public boolean isCheckpointOnBatch() {
            return checkpointOnBatch;
        }

        public void setCheckpointOnBatch(boolean checkpointOnBatch) {
            this.checkpointOnBatch = checkpointOnBatch;
        }
    }

    public static class Events {
        private int bufferSize = 1024;
        private EventWireFormat.Mode mode = EventWireFormat.Mode.GENERALIZED;
        private boolean logBridge = true;

        public int getBufferSize() {
            return bufferSize;
        }

        public void setBufferSize(int bufferSize) {
            this.bufferSize = Math.max(1, bufferSize);
        }

        public EventWireFormat.Mode getMode() {
            return mode;
        }

        public void setMode(EventWireFormat.Mode mode) {
            this.mode = mode == null ? EventWireFormat.Mode.GENERALIZED : mode;
        }

        public boolean isLogBridge() {
            return logBridge;
        }

        public void setLogBridge(boolean logBridge) {
            this.logBridge = logBridge;
        }
    }

    public static class Catalog {
        private String detailUrlTemplate = "https://catalog.example.com/products/{id}";

        public String getDetailUrlTemplate() {
            return detailUrlTemplate;
        }

        public void setDetailUrlTemplate(String detailUrlTemplate) {
            if (detailUrlTemplate != null && !detailUrlTemplate.isBlank()) {
                this.detailUrlTemplate = detailUrlTemplate.trim();
            }
        }
    }

    /** Knobs of the built-in simulated catalog. */
    public static class Simulation {
        private String baseUrl = "https://catalog.example.com";
        private int productsPerPage = 12;
        private Duration latency = Duration.ofMillis(50);
        private double timeoutRate = 0.02;
        private double rateLimitRate = 0.02;
        private double serverErrorRate = 0.03;
        private double parseErrorRate = 0.01;
        private long seed = 42L;

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            if (baseUrl != null && !baseUrl.isBlank()) {
                this.baseUrl = baseUrl.trim();
            }
        }

        public int getProductsPerPage() {
            return productsPerPage;
        }

        public void setProductsPerPage(int productsPerPage) {
            this.productsPerPage = Math.max(0, productsPerPage);
        }

        public Duration getLatency() {
            return latency;
        }

        public void setLatency(Duration latency) {
            this.latency = atLeast(latency, Duration.ZERO);
        }

        public double getTimeoutRate() {
            return timeoutRate;
        }

        public void setTimeoutRate(double timeoutRate) {
            this.timeoutRate = clamp(timeoutRate, 0.0, 1.0);
        }

        public double getRateLimitRate() {
            return rateLimitRate;
        }

        public void setRateLimitRate(double rateLimitRate) {
            this.rateLimitRate = clamp(rateLimitRate, 0.0, 1.0);
        }

        public double getServerErrorRate() {
            return serverErrorRate;
        }

        public void setServerErrorRate(double serverErrorRate) {
            this.serverErrorRate = clamp(serverErrorRate, 0.0, 1.0);
        }

        public double getParseErrorRate() {
            return parseErrorRate;
        }

        public void setParseErrorRate(double parseErrorRate) {
            this.parseErrorRate = clamp(parseErrorRate, 0.0, 1.0);
        }

        public long getSeed() {
            return seed;
        }

        public void setSeed(long seed) {
            this.seed = seed;
        }
    }

    /** Crawl launched by the startup runner. */
    public static class Autostart {
        private boolean enabled = false;
        private String sessionId;
        private int firstPage = 1;
        private int lastPage = 10;
        private String resumeTokenFile;
        private Duration statusInterval = Duration.ofSeconds(5);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getSessionId() {
            return sessionId;
        }

        public void setSessionId(String sessionId) {
            this.sessionId = sessionId == null || sessionId.isBlank() ? null : sessionId.trim();
        }

        public int getFirstPage() {
            return firstPage;
        }

        public void setFirstPage(int firstPage) {
            this.firstPage = Math.max(1, firstPage);
        }

        public int getLastPage() {
            return lastPage;
        }

        public void setLastPage(int lastPage) {
            this.lastPage = Math.max(1, lastPage);
        }

        public String getResumeTokenFile() {
            return resumeTokenFile;
        }

        public void setResumeTokenFile(String resumeTokenFile) {
            this.resumeTokenFile = resumeTokenFile == null || resumeTokenFile.isBlank() ? null : resumeTokenFile.trim();
        }

        public Duration getStatusInterval() {
            return statusInterval;
        }

        public void setStatusInterval(Duration statusInterval) {
            this.statusInterval = atLeast(statusInterval, Duration.ofMillis(100));
        }
    }
}
