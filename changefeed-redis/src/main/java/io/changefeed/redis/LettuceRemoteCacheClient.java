package io.changefeed.redis;

import io.changefeed.spi.RemoteCacheClient;
import io.lettuce.core.RedisClient;
import io.lettuce.core.SetArgs;
import io.lettuce.core.api.StatefulRedisConnection;
import io.lettuce.core.api.async.RedisAsyncCommands;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletionStage;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link RemoteCacheClient} over a single Lettuce connection.
 *
 * <p>Lettuce multiplexes commands over one connection, so one instance can be shared by
 * the whole application. Calls are not retried here; wrap the client in a
 * {@link io.changefeed.ChangeAggregator} (or a
 * {@link io.changefeed.cache.ResilientCacheClient}) for timeouts, retries and the
 * circuit breaker.
 *
 * <p>Instances created through {@link #create(String)} or {@link #create(RedisClient)}
 * own their connection and close it in {@link #close()}; instances wrapping a supplied
 * connection leave it open.
 */
public final class LettuceRemoteCacheClient implements RemoteCacheClient, AutoCloseable {
  private static final Logger logger = Logger.getLogger(LettuceRemoteCacheClient.class.getName());
  private static final String OK = "OK";

  private final StatefulRedisConnection<String, String> connection;
  private final RedisAsyncCommands<String, String> commands;
  private final RedisClient ownedClient;
  private final boolean ownsConnection;

  /**
   * Wraps an existing connection. The caller keeps ownership of it.
   *
   * @param connection an open string-codec connection
   */
  public LettuceRemoteCacheClient(StatefulRedisConnection<String, String> connection) {
    this(connection, null, false);
  }

  private LettuceRemoteCacheClient(StatefulRedisConnection<String, String> connection,
      RedisClient ownedClient, boolean ownsConnection) {
    this.connection = Objects.requireNonNull(connection, "connection");
    this.commands = connection.async();
    this.ownedClient = ownedClient;
    this.ownsConnection = ownsConnection;
  }

  /**
   * Opens a connection on {@code client}. The client stays owned by the caller.
   *
   * @param client a configured Redis client
   * @return a client that closes its connection on {@link #close()}
   */
  public static LettuceRemoteCacheClient create(RedisClient client) {
    Objects.requireNonNull(client, "client");
    return new LettuceRemoteCacheClient(client.connect(), null, true);
  }

  /**
   * Creates a Redis client for {@code uri} and opens a connection.
   *
   * @param uri Redis URI, for example {@code redis://localhost:6379/0}
   * @return a client that closes its connection and shuts down the Redis client on {@link #close()}
   */
  public static LettuceRemoteCacheClient create(String uri) {
    Objects.requireNonNull(uri, "uri");
    RedisClient client = RedisClient.create(uri);
    try {
      return new LettuceRemoteCacheClient(client.connect(), client, true);
    } catch (RuntimeException e) {
      client.shutdown();
      throw e;
    }
  }

  @Override
  public CompletionStage<String> get(String key) {
    return commands.get(key);
  }

  @Override
  public CompletionStage<Boolean> set(String key, String value, Duration ttl) {
    long ttlMs = ttl.toMillis();
    if (ttlMs <= 0) {
      throw new IllegalArgumentException("ttl must be >= 1ms, got: " + ttl);
    }
    return commands.set(key, value, SetArgs.Builder.px(ttlMs)).thenApply(OK::equals);
  }

  @Override
  public CompletionStage<Long> del(String... keys) {
    return commands.del(keys);
  }

  @Override
  public CompletionStage<String> ping() {
    return commands.ping();
  }

  public boolean isOpen() {
    return connection.isOpen();
  }

  @Override
  public void close() {
    if (ownsConnection) {
      try {
        connection.close();
      } catch (RuntimeException e) {
        logger.log(Level.WARNING, "Failed to close Redis connection", e);
      }
    }
    if (ownedClient != null) {
      ownedClient.shutdown();
    }
  }
}
