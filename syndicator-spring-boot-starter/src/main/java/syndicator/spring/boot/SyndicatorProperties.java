package syndicator.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Configuration properties for the syndication pipeline.
 *
 * @see SyndicatorAutoConfiguration
 */
@ConfigurationProperties(prefix = "syndicator")
public class SyndicatorProperties {

    /**
     * Whether the pipeline is wired at all.
     */
    private boolean enabled = true;

    private final Dispatcher dispatcher = new Dispatcher();
    private final Retry retry = new Retry();
    private final Poller poller = new Poller();
    private final Purge purge = new Purge();
    private final Metrics metrics = new Metrics();

    /**
     * Per-target settings keyed by target name. A {@code Publisher} bean is only used when
     * a target entry with its name exists.
     */
    private final Map<String, Target> targets = new LinkedHashMap<>();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public Dispatcher getDispatcher() {
        return dispatcher;
    }

    public Retry getRetry() {
        return retry;
    }

    public Poller getPoller() {
        return poller;
    }

    public Purge getPurge() {
        return purge;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public Map<String, Target> getTargets() {
        return targets;
    }

    public enum Counter {
        CODE_POINTS,
        GRAPHEMES,
        WEIGHTED
    }

    public static class Dispatcher {
        private int maxAttempts = 5;
        private long fetchIntervalMs = 1000;
        private int batchSize = 50;
        private long drainTimeoutMs = 5000;
        private long rateLimitFloorMs = 30000;

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public long getFetchIntervalMs() {
            return fetchIntervalMs;
        }

        public void setFetchIntervalMs(long fetchIntervalMs) {
            this.fetchIntervalMs = fetchIntervalMs;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public long getDrainTimeoutMs() {
            return drainTimeoutMs;
        }

        public void setDrainTimeoutMs(long drainTimeoutMs) {
            this.drainTimeoutMs = drainTimeoutMs;
        }

        public long getRateLimitFloorMs() {
            return rateLimitFloorMs;
        }

        public void setRateLimitFloorMs(long rateLimitFloorMs) {
            this.rateLimitFloorMs = rateLimitFloorMs;
        }
    }

    public static class Retry {
        private long baseDelayMs = 10000;
        private long maxDelayMs = 3600000;
        private boolean jitter;

        public long getBaseDelayMs() {
            return baseDelayMs;
        }

        public void setBaseDelayMs(long baseDelayMs) {
            this.baseDelayMs = baseDelayMs;
        }

        public long getMaxDelayMs() {
            return maxDelayMs;
        }

        public void setMaxDelayMs(long maxDelayMs) {
            this.maxDelayMs = maxDelayMs;
        }

        public boolean isJitter() {
            return jitter;
        }

        public void setJitter(boolean jitter) {
            this.jitter = jitter;
        }
    }

    public static class Poller {
        private boolean enabled = true;
        private long intervalMs = 15000;
        private int feedLimit = 50;
        private long reconcileIntervalMs = 60000;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public long getIntervalMs() {
            return intervalMs;
        }

        public void setIntervalMs(long intervalMs) {
            this.intervalMs = intervalMs;
        }

        public int getFeedLimit() {
            return feedLimit;
        }

        public void setFeedLimit(int feedLimit) {
            this.feedLimit = feedLimit;
        }

        public long getReconcileIntervalMs() {
            return reconcileIntervalMs;
        }

        public void setReconcileIntervalMs(long reconcileIntervalMs) {
            this.reconcileIntervalMs = reconcileIntervalMs;
        }
    }

    public static class Purge {
        private boolean enabled;
        private Duration retention = Duration.ofDays(7);
        private int batchSize = 500;
        private long intervalSeconds = 3600;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getRetention() {
            return retention;
        }

        public void setRetention(Duration retention) {
            this.retention = retention;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public long getIntervalSeconds() {
            return intervalSeconds;
        }

        public void setIntervalSeconds(long intervalSeconds) {
            this.intervalSeconds = intervalSeconds;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "syndicator";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }

    public static class Target {
        private int maxLength = 300;
        private Counter counter = Counter.GRAPHEMES;
        private int reserveForCounter = 6;
        private int concurrency = 4;

        /**
         * Minimum spacing between publisher calls; derived from the daily limit when unset.
         */
        private Long minIntervalMs;

        /**
         * Posts allowed per UTC day; {@code 0} disables the budget.
         */
        private int dailyLimit;

        private String remoteLinkFormat;

        public int getMaxLength() {
            return maxLength;
        }

        public void setMaxLength(int maxLength) {
            this.maxLength = maxLength;
        }

        public Counter getCounter() {
            return counter;
        }

        public void setCounter(Counter counter) {
            this.counter = counter;
        }

        public int getReserveForCounter() {
            return reserveForCounter;
        }

        public void setReserveForCounter(int reserveForCounter) {
            this.reserveForCounter = reserveForCounter;
        }

        public int getConcurrency() {
            return concurrency;
        }

        public void setConcurrency(int concurrency) {
            this.concurrency = concurrency;
        }

        public Long getMinIntervalMs() {
            return minIntervalMs;
        }

        public void setMinIntervalMs(Long minIntervalMs) {
            this.minIntervalMs = minIntervalMs;
        }

        public int getDailyLimit() {
            return dailyLimit;
        }

        public void setDailyLimit(int dailyLimit) {
            this.dailyLimit = dailyLimit;
        }

        public String getRemoteLinkFormat() {
            return remoteLinkFormat;
        }

        public void setRemoteLinkFormat(String remoteLinkFormat) {
            this.remoteLinkFormat = remoteLinkFormat;
        }
    }
}
