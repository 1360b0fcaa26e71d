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

package com.github.mizosoft.rampart.internal.cache;

import static com.github.mizosoft.rampart.internal.Utils.requirePositiveDuration;
import static com.github.mizosoft.rampart.internal.Validate.requireArgument;
import static java.util.Objects.requireNonNull;

import com.github.mizosoft.rampart.CacheBackend;
import com.google.errorprone.annotations.concurrent.GuardedBy;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * {@link CacheBackend} that keeps entries in memory. An expired entry is evicted when it's read,
 * and writes sweep all expired entries at most once every {@link #SWEEP_INTERVAL}. If a maximum
 * number of entries is set, writes beyond it evict the least recently used entries.
 */
public final class MemoryCacheBackend implements CacheBackend {
  static final Duration SWEEP_INTERVAL = Duration.ofSeconds(30);

  private final Clock clock;
  private final int maxEntries;

  @GuardedBy("entries")
  private final Map<String, Entry> entries = new LinkedHashMap<>(16, 0.75f, true);

  @GuardedBy("entries")
  private Instant nextSweep;

  public MemoryCacheBackend(Clock clock) {
    this(clock, Integer.MAX_VALUE);
  }

  public MemoryCacheBackend(Clock clock, int maxEntries) {
    requireArgument(maxEntries > 0, "non-positive maxEntries: %d", maxEntries);
    this.clock = requireNonNull(clock);
    this.maxEntries = maxEntries;
    this.nextSweep = clock.instant().plus(SWEEP_INTERVAL);
  }

  @Override
  public Optional<byte[]> get(String key) {
    requireNonNull(key);
    var now = clock.instant();
    synchronized (entries) {
      var entry = entries.get(key);
      if (entry == null) {
        return Optional.empty();
      }
      if (entry.isExpired(now)) {
        entries.remove(key);
        return Optional.empty();
      }
      return Optional.of(entry.value.clone());
    }
  }

  @Override
  public void set(String key, byte[] value, Duration ttl) {
    requireNonNull(key);
    requireNonNull(value);
    requirePositiveDuration(ttl);
    var now = clock.instant();
    var entry = new Entry(value.clone(), now.plus(ttl));
    synchronized (entries) {
      if (!now.isBefore(nextSweep)) {
        evictExpired(now);
      }
      entries.put(key, entry);
      if (entries.size() > maxEntries) {
        var iterator = entries.values().iterator();
        while (entries.size() > maxEntries && iterator.hasNext()) {
          iterator.next();
          iterator.remove();
        }
      }
    }
  }

  @Override
  public void delete(String key) {
    requireNonNull(key);
    synchronized (entries) {
      entries.remove(key);
    }
  }

  /** Returns the number of entries, including expired ones that haven't been evicted yet. */
  public int size() {
    synchronized (entries) {
      return entries.size();
    }
  }

  /** Evicts all expired entries. */
  public void evictExpired() {
    var now = clock.instant();
    synchronized (entries) {
      evictExpired(now);
    }
  }

  @GuardedBy("entries")
  private void evictExpired(Instant now) {
    entries.values().removeIf(entry -> entry.isExpired(now));
    nextSweep = now.plus(SWEEP_INTERVAL);
  }

  private static final class Entry {
    final byte[] value;
    final Instant expiresAt;

    Entry(byte[] value, Instant expiresAt) {
      this.value = value;
      this.expiresAt = expiresAt;
    }

    boolean isExpired(Instant now) {
      return !now.isBefore(expiresAt);
    }
  }
}
