/*
 * Copyright (c) 2024 Moataz Abdelnasser
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */

package com.github.mizosoft.rampart.redis;

import static com.github.mizosoft.rampart.internal.Validate.requireArgument;
import static com.github.mizosoft.rampart.internal.Validate.requireState;
import static java.util.Objects.requireNonNull;

import com.github.mizosoft.rampart.CacheBackend;
import io.lettuce.core.RedisClient;
import io.lettuce.core.RedisException;
import io.lettuce.core.RedisURI;
import io.lettuce.core.SetArgs;
import io.lettuce.core.api.StatefulRedisConnection;
import io.lettuce.core.api.sync.RedisCommands;
import io.lettuce.core.codec.ByteArrayCodec;
import io.lettuce.core.codec.RedisCodec;
import io.lettuce.core.codec.StringCodec;
import java.io.IOException;
import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A {@link CacheBackend} that stores entries in a Redis Standalone instance. Entry expiry is
 * delegated to Redis through the {@code PX} option of {@code SET}. Keys are namespaced under a
 * configurable prefix so that multiple clients can share an instance.
 */
public final class RedisCacheBackend implements CacheBackend, AutoCloseable {
  private static final Logger logger = System.getLogger(RedisCacheBackend.class.getName());

  /** The prefix keys are namespaced under if none is specified. */
  public static final String DEFAULT_KEY_PREFIX = "rampart:cache:";

  static final RedisCodec<String, byte[]> CODEC =
      RedisCodec.of(StringCodec.UTF8, ByteArrayCodec.INSTANCE);

  private final StatefulRedisConnection<String, byte[]> connection;
  private final @Nullable RedisClient clientToClose;
  private final String keyPrefix;
  private final AtomicBoolean closed = new AtomicBoolean();

  private RedisCacheBackend(
      StatefulRedisConnection<String, byte[]> connection,
      @Nullable RedisClient clientToClose,
      String keyPrefix) {
    this.connection = requireNonNull(connection);
    this.clientToClose = clientToClose;
    this.keyPrefix = requireNonNull(keyPrefix);
  }

  /** Returns the prefix keys are namespaced under. */
  public String keyPrefix() {
    return keyPrefix;
  }

  @Override
  public Optional<byte[]> get(String key) throws IOException {
    requireNonNull(key);
    try {
      return Optional.ofNullable(commands().get(toRedisKey(key)));
    } catch (RedisException e) {
      throw new IOException(e);
    }
  }

  @Override
  public void set(String key, byte[] value, Duration ttl) throws IOException {
    requireNonNull(key);
    requireNonNull(value);
    requireArgument(
        !ttl.isNegative() && !ttl.isZero(), "Expected a positive ttl, got: %s", ttl);
    try {
      // PX can't take a zero, so sub-millisecond ttls are rounded up.
      commands().set(toRedisKey(key), value, SetArgs.Builder.px(Math.max(1, ttl.toMillis())));
    } catch (RedisException e) {
      throw new IOException(e);
    }
  }

  @Override
  public void delete(String key) throws IOException {
    requireNonNull(key);
    try {
      commands().del(toRedisKey(key));
    } catch (RedisException e) {
      throw new IOException(e);
    }
  }

  /**
   * Closes the underlying connection, and the {@code RedisClient} if this backend created it.
   * Subsequent operations throw {@code IllegalStateException}.
   */
  @Override
  public void close() {
    if (closed.compareAndSet(false, true)) {
      try {
        connection.close();
      } finally {
        if (clientToClose != null) {
          clientToClose.shutdown();
        }
      }
      logger.log(Level.DEBUG, "Closed Redis cache backend with key prefix {0}", keyPrefix);
    }
  }

  private RedisCommands<String, byte[]> commands() {
    requireState(!closed.get(), "closed");
    return connection.sync();
  }

  private String toRedisKey(String key) {
    return keyPrefix + key;
  }

  /**
   * Connects to the Redis Standalone instance at the given URI. The returned backend owns the
   * created {@code RedisClient} and shuts it down when closed.
   *
   * @throws IOException if the connection couldn't be established
   */
  public static RedisCacheBackend connect(RedisURI redisUri) throws IOException {
    return connect(redisUri, DEFAULT_KEY_PREFIX);
  }

  /**
   * Same as {@link #connect(RedisURI)} but namespaces keys under the given prefix.
   *
   * @throws IOException if the connection couldn't be established
   */
  public static RedisCacheBackend connect(RedisURI redisUri, String keyPrefix)
      throws IOException {
    requireNonNull(redisUri);
    requireNonNull(keyPrefix);
    var client = RedisClient.create();
    try {
      return new RedisCacheBackend(client.connect(CODEC, redisUri), client, keyPrefix);
    } catch (RedisException e) {
      client.shutdown();
      throw new IOException("couldn't connect to " + redisUri, e);
    }
  }

  /**
   * Opens a new connection to the given URI using an existing {@code RedisClient}. Closing the
   * returned backend closes the connection but not the client.
   *
   * @throws IOException if the connection couldn't be established
   */
  public static RedisCacheBackend connect(RedisClient client, RedisURI redisUri, String keyPrefix)
      throws IOException {
    requireNonNull(client);
    requireNonNull(redisUri);
    requireNonNull(keyPrefix);
    try {
      return new RedisCacheBackend(client.connect(CODEC, redisUri), null, keyPrefix);
    } catch (RedisException e) {
      throw new IOException("couldn't connect to " + redisUri, e);
    }
  }
}
