package io.changefeed;

import io.changefeed.model.PriorityTier;
import io.changefeed.model.TierSettings;
import io.changefeed.resilience.OperationKind;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Tuning knobs for {@link ChangeAggregator}. Every setting has a working default;
 * values are validated when the aggregator is built.
 */
public final class AggregatorConfig {
  // connection pool
  private int maxConnections = 10;
  private long idleTimeoutMs = 300_000L;
  private long poolSweepIntervalMs = 30_000L;
  private int maxConnectionErrors = 5;
  private final Map<PriorityTier, TierSettings> tierSettings = new EnumMap<>(PriorityTier.class);

  // circuit breaker
  private int failureThreshold = 5;
  private int successThreshold = 3;
  private long openTimeoutMs = 60_000L;
  private long monitorWindowMs = 300_000L;

  // retry
  private int retryMaxAttempts = 3;
  private long retryBaseDelayMs = 500L;
  private long retryMaxDelayMs = 2_000L;
  private double retryMultiplier = 2.0;
  private double retryJitter = 0.25;
  private final Map<OperationKind, Long> operationTimeouts = new EnumMap<>(OperationKind.class);

  // deduplication and read-through
  private long pendingTimeoutMs = 30_000L;
  private long dedupeTtlMs = 5_000L;
  private long dedupeSweepIntervalMs = 60_000L;
  private long readThroughTtlMs = 300_000L;

  public int getMaxConnections() {
    return maxConnections;
  }

  public AggregatorConfig setMaxConnections(int maxConnections) {
    this.maxConnections = maxConnections;
    return this;
  }

  public long getIdleTimeoutMs() {
    return idleTimeoutMs;
  }

  public AggregatorConfig setIdleTimeoutMs(long idleTimeoutMs) {
    this.idleTimeoutMs = idleTimeoutMs;
    return this;
  }

  public long getPoolSweepIntervalMs() {
    return poolSweepIntervalMs;
  }

  public AggregatorConfig setPoolSweepIntervalMs(long poolSweepIntervalMs) {
    this.poolSweepIntervalMs = poolSweepIntervalMs;
    return this;
  }

  public int getMaxConnectionErrors() {
    return maxConnectionErrors;
  }

  public AggregatorConfig setMaxConnectionErrors(int maxConnectionErrors) {
    this.maxConnectionErrors = maxConnectionErrors;
    return this;
  }

  /**
   * Returns the effective settings of {@code tier}: the override if set, else the tier default.
   */
  public TierSettings getTierSettings(PriorityTier tier) {
    TierSettings override = tierSettings.get(tier);
    return override != null ? override : tier.defaults();
  }

  public Map<PriorityTier, TierSettings> getTierOverrides() {
    return Collections.unmodifiableMap(tierSettings);
  }

  public AggregatorConfig setTierSettings(PriorityTier tier, TierSettings settings) {
    tierSettings.put(Objects.requireNonNull(tier, "tier"), Objects.requireNonNull(settings, "settings"));
    return this;
  }

  public int getFailureThreshold() {
    return failureThreshold;
  }

  public AggregatorConfig setFailureThreshold(int failureThreshold) {
    this.failureThreshold = failureThreshold;
    return this;
  }

  public int getSuccessThreshold() {
    return successThreshold;
  }

  public AggregatorConfig setSuccessThreshold(int successThreshold) {
    this.successThreshold = successThreshold;
    return this;
  }

  public long getOpenTimeoutMs() {
    return openTimeoutMs;
  }

  public AggregatorConfig setOpenTimeoutMs(long openTimeoutMs) {
    this.openTimeoutMs = openTimeoutMs;
    return this;
  }

  public long getMonitorWindowMs() {
    return monitorWindowMs;
  }

  public AggregatorConfig setMonitorWindowMs(long monitorWindowMs) {
    this.monitorWindowMs = monitorWindowMs;
    return this;
  }

  public int getRetryMaxAttempts() {
    return retryMaxAttempts;
  }

  public AggregatorConfig setRetryMaxAttempts(int retryMaxAttempts) {
    this.retryMaxAttempts = retryMaxAttempts;
    return this;
  }

  public long getRetryBaseDelayMs() {
    return retryBaseDelayMs;
  }

  public AggregatorConfig setRetryBaseDelayMs(long retryBaseDelayMs) {
    this.retryBaseDelayMs = retryBaseDelayMs;
    return this;
  }

  public long getRetryMaxDelayMs() {
    return retryMaxDelayMs;
  }

  public AggregatorConfig setRetryMaxDelayMs(long retryMaxDelayMs) {
    this.retryMaxDelayMs = retryMaxDelayMs;
    return this;
  }

  public double getRetryMultiplier() {
    return retryMultiplier;
  }

  public AggregatorConfig setRetryMultiplier(double retryMultiplier) {
    this.retryMultiplier = retryMultiplier;
    return this;
  }

  public double getRetryJitter() {
    return retryJitter;
  }

  public AggregatorConfig setRetryJitter(double retryJitter) {
    this.retryJitter = retryJitter;
    return this;
  }

  /**
   * Returns the effective per-attempt timeout of {@code kind}.
   */
  public long getOperationTimeoutMs(OperationKind kind) {
    Long override = operationTimeouts.get(kind);
    return override != null ? override : kind.defaultTimeoutMs();
  }

  public AggregatorConfig setOperationTimeoutMs(OperationKind kind, long timeoutMs) {
    operationTimeouts.put(Objects.requireNonNull(kind, "kind"), timeoutMs);
    return this;
  }

  public long getPendingTimeoutMs() {
    return pendingTimeoutMs;
  }

  public AggregatorConfig setPendingTimeoutMs(long pendingTimeoutMs) {
    this.pendingTimeoutMs = pendingTimeoutMs;
    return this;
  }

  public long getDedupeTtlMs() {
    return dedupeTtlMs;
  }

  public AggregatorConfig setDedupeTtlMs(long dedupeTtlMs) {
    this.dedupeTtlMs = dedupeTtlMs;
    return this;
  }

  public long getDedupeSweepIntervalMs() {
    return dedupeSweepIntervalMs;
  }

  public AggregatorConfig setDedupeSweepIntervalMs(long dedupeSweepIntervalMs) {
    this.dedupeSweepIntervalMs = dedupeSweepIntervalMs;
    return this;
  }

  public long getReadThroughTtlMs() {
    return readThroughTtlMs;
  }

  public AggregatorConfig setReadThroughTtlMs(long readThroughTtlMs) {
    this.readThroughTtlMs = readThroughTtlMs;
    return this;
  }
}
