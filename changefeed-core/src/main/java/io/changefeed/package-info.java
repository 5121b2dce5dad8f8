/**
 * Root API of changefeed: turns a noisy per-row change feed into batched,
 * priority-paced callbacks and guards remote cache reads with deduplication, retries
 * and a circuit breaker.
 *
 * <h2>Core Design</h2>
 * <p>{@link io.changefeed.ChangeAggregator#subscribe subscribe} goes through the
 * {@linkplain io.changefeed.pool.ConnectionPool connection pool}, which shares one
 * backend subscription per {@code (table, filter)} and caps the number of live ones.
 * Changes are validated into {@link io.changefeed.model.ChangeEvent}s and queued per
 * channel by the {@linkplain io.changefeed.batch.BatchingEngine batching engine}, which
 * flushes after the tier's quiet period or as soon as the batch is full.
 *
 * <p>{@link io.changefeed.ChangeAggregator#readThroughCache readThroughCache} collapses
 * concurrent reads in the {@linkplain io.changefeed.dedupe.RequestDeduplicator
 * deduplicator} and reaches the remote cache only through the
 * {@linkplain io.changefeed.resilience.RetryExecutor retry executor}, which consults a
 * single shared {@linkplain io.changefeed.resilience.CircuitBreaker circuit breaker}.
 *
 * <p>All timing runs on one {@link io.changefeed.spi.TimerService} event loop.
 *
 * <h2>Module Layout</h2>
 * <ul>
 *   <li><b>changefeed-core</b>: this API, components and SPIs (zero external deps)</li>
 *   <li><b>changefeed-micrometer</b>: Micrometer metrics exporter</li>
 *   <li><b>changefeed-redis</b>: Lettuce remote cache client</li>
 *   <li><b>changefeed-spring-boot-starter</b>: auto-configuration</li>
 * </ul>
 *
 * @see io.changefeed.ChangeAggregator
 * @see io.changefeed.ChangeListener
 * @see io.changefeed.model.SubscriptionSpec
 */
package io.changefeed;
