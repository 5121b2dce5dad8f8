package io.changefeed.resilience;

/**
 * Category of remote operation; selects the default attempt timeout.
 */
public enum OperationKind {
  GET(4_000),
  SET(4_000),
  DEL(4_000),
  BATCH(10_000),
  CRITICAL(6_000),
  HEALTH_CHECK(5_000);

  private final long defaultTimeoutMs;

  OperationKind(long defaultTimeoutMs) {
    this.defaultTimeoutMs = defaultTimeoutMs;
  }

  public long defaultTimeoutMs() {
    return defaultTimeoutMs;
  }
}
