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

package com.github.mizosoft.rampart;

import com.github.mizosoft.rampart.internal.cache.MemoryCacheBackend;
import com.github.mizosoft.rampart.internal.Utils;
import java.io.IOException;
import java.time.Duration;
import java.util.Optional;

/**
 * A key-value store with per-entry expiry, used by {@link CachingInterceptor}. Implementations must
 * tolerate concurrent access.
 */
public interface CacheBackend {

  /** Returns the value associated with the given key, if present and not expired. */
  Optional<byte[]> get(String key) throws IOException;

  /** Associates the given value with the given key, expiring after {@code ttl}. */
  void set(String key, byte[] value, Duration ttl) throws IOException;

  /** Removes the value associated with the given key, if any. */
  void delete(String key) throws IOException;

  /**
   * Returns a {@code CacheBackend} that keeps its entries in memory. Expired entries are swept
   * periodically as new entries are written.
   */
  static CacheBackend inMemory() {
    return new MemoryCacheBackend(Utils.systemMillisUtc());
  }

  /**
   * Returns a {@code CacheBackend} that keeps at most {@code maxEntries} entries in memory,
   * evicting the least recently used ones beyond that.
   */
  static CacheBackend inMemory(int maxEntries) {
    return new MemoryCacheBackend(Utils.systemMillisUtc(), maxEntries);
  }
}
