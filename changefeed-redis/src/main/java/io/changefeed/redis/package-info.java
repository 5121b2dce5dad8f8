/**
 * Redis-backed {@link io.changefeed.spi.RemoteCacheClient} built on the Lettuce async API.
 *
 * @see io.changefeed.redis.LettuceRemoteCacheClient
 */
package io.changefeed.redis;
