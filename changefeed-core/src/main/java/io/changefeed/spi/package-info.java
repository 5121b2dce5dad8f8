/**
 * Service Provider Interfaces (SPI) for plugging changefeed into a backend.
 *
 * <p>Integrators implement {@link io.changefeed.spi.ChangeFeed} for the backend's
 * realtime channel and {@link io.changefeed.spi.RemoteCacheClient} for the remote
 * cache; {@link io.changefeed.spi.TimerService},
 * {@link io.changefeed.spi.MetricsExporter} and {@link io.changefeed.spi.ErrorHandler}
 * have defaults.
 *
 * @see io.changefeed.spi.ChangeFeed
 * @see io.changefeed.spi.RemoteCacheClient
 * @see io.changefeed.spi.TimerService
 * @see io.changefeed.spi.MetricsExporter
 */
package io.changefeed.spi;
