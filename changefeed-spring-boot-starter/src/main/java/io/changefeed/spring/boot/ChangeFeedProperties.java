package io.changefeed.spring.boot;

import io.changefeed.AggregatorConfig;
import io.changefeed.model.PriorityTier;
import io.changefeed.model.TierSettings;
import io.changefeed.resilience.OperationKind;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Configuration properties for changefeed.
 *
 * @see ChangeFeedAutoConfiguration
 */
@ConfigurationProperties(prefix = "changefeed")
public class ChangeFeedProperties {

    private final Pool pool = new Pool();

    /**
     * Per-tier overrides, keyed by tier name ({@code critical}, {@code high}, {@code medium}, {@code low}).
     * Unset fields keep the tier's defaults.
     */
    private Map<PriorityTier, Tier> tiers = new LinkedHashMap<>();

    private final CircuitBreaker circuitBreaker = new CircuitBreaker();
    private final Retry retry = new Retry();

    /**
     * Per-attempt timeout overrides, keyed by operation kind ({@code get}, {@code batch}, {@code health-check}, ...).
     */
    private Map<OperationKind, Duration> timeouts = new LinkedHashMap<>();

    private final Dedupe dedupe = new Dedupe();
    private final Metrics metrics = new Metrics();
    private final Redis redis = new Redis();

    public Pool getPool() {
        return pool;
    }

    public Map<PriorityTier, Tier> getTiers() {
        return tiers;
    }

    public void setTiers(Map<PriorityTier, Tier> tiers) {
        this.tiers = tiers;
    }

    public CircuitBreaker getCircuitBreaker() {
        return circuitBreaker;
    }

    public Retry getRetry() {
        return retry;
    }

    public Map<OperationKind, Duration> getTimeouts() {
        return timeouts;
    }

    public void setTimeouts(Map<OperationKind, Duration> timeouts) {
        this.timeouts = timeouts;
    }

    public Dedupe getDedupe() {
        return dedupe;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public Redis getRedis() {
        return redis;
    }

    /**
     * Converts these properties to the core configuration.
     *
     * @return a new {@link AggregatorConfig}
     */
    public AggregatorConfig toAggregatorConfig() {
        AggregatorConfig config = new AggregatorConfig()
                .setMaxConnections(pool.getMaxConnections())
                .setIdleTimeoutMs(pool.getIdleTimeout().toMillis())
                .setPoolSweepIntervalMs(pool.getSweepInterval().toMillis())
                .setMaxConnectionErrors(pool.getMaxConnectionErrors())
                .setFailureThreshold(circuitBreaker.getFailureThreshold())
                .setSuccessThreshold(circuitBreaker.getSuccessThreshold())
                .setOpenTimeoutMs(circuitBreaker.getOpenTimeout().toMillis())
                .setMonitorWindowMs(circuitBreaker.getMonitorWindow().toMillis())
                .setRetryMaxAttempts(retry.getMaxAttempts())
                .setRetryBaseDelayMs(retry.getBaseDelayMs())
                .setRetryMaxDelayMs(retry.getMaxDelayMs())
                .setRetryMultiplier(retry.getMultiplier())
                .setRetryJitter(retry.getJitter())
                .setPendingTimeoutMs(dedupe.getPendingTimeout().toMillis())
                .setDedupeTtlMs(dedupe.getTtl().toMillis())
                .setDedupeSweepIntervalMs(dedupe.getSweepInterval().toMillis())
                .setReadThroughTtlMs(dedupe.getReadThroughTtl().toMillis());
        for (Map.Entry<PriorityTier, Tier> entry : tiers.entrySet()) {
            config.setTierSettings(entry.getKey(), entry.getValue().merge(entry.getKey().defaults()));
        }
        for (Map.Entry<OperationKind, Duration> entry : timeouts.entrySet()) {
            config.setOperationTimeoutMs(entry.getKey(), entry.getValue().toMillis());
        }
        return config;
    }

    public static class Pool {
        private int maxConnections = 10;
        private Duration idleTimeout = Duration.ofMinutes(5);
        private Duration sweepInterval = Duration.ofSeconds(30);
        private int maxConnectionErrors = 5;

        public int getMaxConnections() {
            return maxConnections;
        }

        public void setMaxConnections(int maxConnections) {
            this.maxConnections = maxConnections;
        }

        public Duration getIdleTimeout() {
            return idleTimeout;
        }

        public void setIdleTimeout(Duration idleTimeout) {
            this.idleTimeout = idleTimeout;
        }

        public Duration getSweepInterval() {
            return sweepInterval;
        }

        public void setSweepInterval(Duration sweepInterval) {
            this.sweepInterval = sweepInterval;
        }

        public int getMaxConnectionErrors() {
            return maxConnectionErrors;
        }

        public void setMaxConnectionErrors(int maxConnectionErrors) {
            this.maxConnectionErrors = maxConnectionErrors;
        }
    }

    public static class Tier {
        private Long debounceMs;
        private Integer maxBatchSize;
        private Integer maxConnections;

        public Long getDebounceMs() {
            return debounceMs;
        }

        public void setDebounceMs(Long debounceMs) {
            this.debounceMs = debounceMs;
        }

        public Integer getMaxBatchSize() {
            return maxBatchSize;
        }

        public void setMaxBatchSize(Integer maxBatchSize) {
            this.maxBatchSize = maxBatchSize;
        }

        public Integer getMaxConnections() {
            return maxConnections;
        }

        public void setMaxConnections(Integer maxConnections) {
            this.maxConnections = maxConnections;
        }

        TierSettings merge(TierSettings defaults) {
            return new TierSettings(
                    debounceMs != null ? debounceMs : defaults.debounceMs(),
                    maxBatchSize != null ? maxBatchSize : defaults.maxBatchSize(),
                    maxConnections != null ? maxConnections : defaults.maxConnections());
        }
    }

    public static class CircuitBreaker {
        private int failureThreshold = 5;
        private int successThreshold = 3;
        private Duration openTimeout = Duration.ofMinutes(1);
        private Duration monitorWindow = Duration.ofMinutes(5);

        public int getFailureThreshold() {
            return failureThreshold;
        }

        public void setFailureThreshold(int failureThreshold) {
            this.failureThreshold = failureThreshold;
        }

        public int getSuccessThreshold() {
            return successThreshold;
        }

        public void setSuccessThreshold(int successThreshold) {
            this.successThreshold = successThreshold;
        }

        public Duration getOpenTimeout() {
            return openTimeout;
        }

        public void setOpenTimeout(Duration openTimeout) {
            this.openTimeout = openTimeout;
        }

        public Duration getMonitorWindow() {
            return monitorWindow;
        }

        public void setMonitorWindow(Duration monitorWindow) {
            this.monitorWindow = monitorWindow;
        }
    }

    public static class Retry {
        private int maxAttempts = 3;
        private long baseDelayMs = 500;
        private long maxDelayMs = 2000;
        private double multiplier = 2.0;
        private double jitter = 0.25;

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

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

        public double getMultiplier() {
            return multiplier;
        }

        public void setMultiplier(double multiplier) {
            this.multiplier = multiplier;
        }

        public double getJitter() {
            return jitter;
        }

        public void setJitter(double jitter) {
            this.jitter = jitter;
        }
    }

    public static class Dedupe {
        private Duration pendingTimeout = Duration.ofSeconds(30);
        private Duration ttl = Duration.ofSeconds(5);
        private Duration sweepInterval = Duration.ofMinutes(1);
        private Duration readThroughTtl = Duration.ofMinutes(5);

        public Duration getPendingTimeout() {
            return pendingTimeout;
        }

        public void setPendingTimeout(Duration pendingTimeout) {
            this.pendingTimeout = pendingTimeout;
        }

        public Duration getTtl() {
            return ttl;
        }

        public void setTtl(Duration ttl) {
            this.ttl = ttl;
        }

        public Duration getSweepInterval() {
            return sweepInterval;
        }

        public void setSweepInterval(Duration sweepInterval) {
            this.sweepInterval = sweepInterval;
        }

        public Duration getReadThroughTtl() {
            return readThroughTtl;
        }

        public void setReadThroughTtl(Duration readThroughTtl) {
            this.readThroughTtl = readThroughTtl;
        }
    }

    public static class Metrics {
        /**
         * Whether to register a Micrometer exporter when Micrometer is on the classpath.
         */
        private boolean enabled = true;

        /**
         * Prefix for all meter names.
         */
        private String namePrefix = "changefeed";

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

    public static class Redis {
        /**
         * Redis URI, for example {@code redis://localhost:6379/0}. No remote cache is configured when unset.
         */
        private String uri;

        public String getUri() {
            return uri;
        }

        public void setUri(String uri) {
            this.uri = uri;
        }
    }
}
