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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatIllegalArgumentException;

import com.github.mizosoft.rampart.testing.MockClock;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MemoryCacheBackendTest {
  private MockClock clock;
  private MemoryCacheBackend backend;

  @BeforeEach
  void setUp() {
    clock = new MockClock();
    backend = new MemoryCacheBackend(clock);
  }

  @Test
  void setAndGet() {
    backend.set("a", new byte[] {1, 2}, Duration.ofSeconds(1));
    assertThat(backend.get("a"))
        .hasValueSatisfying(value -> assertThat(value).containsExactly(1, 2));
    assertThat(backend.get("b")).isEmpty();
  }

  @Test
  void entryExpiresAtTtl() {
    backend.set("a", new byte[] {1}, Duration.ofSeconds(3));
    clock.advance(Duration.ofMillis(2999));
    assertThat(backend.get("a")).isPresent();
    clock.advance(Duration.ofMillis(1));
    assertThat(backend.get("a")).isEmpty();
    assertThat(backend.size()).isZero();
  }

  @Test
  void setReplacesEntryAndTtl() {
    backend.set("a", new byte[] {1}, Duration.ofSeconds(1));
    backend.set("a", new byte[] {2}, Duration.ofSeconds(5));
    clock.advanceSeconds(2);
    assertThat(backend.get("a")).hasValueSatisfying(value -> assertThat(value).containsExactly(2));
  }

  @Test
  void delete() {
    backend.set("a", new byte[] {1}, Duration.ofSeconds(1));
    backend.delete("a");
    backend.delete("b"); // No-op.
    assertThat(backend.get("a")).isEmpty();
  }

  @Test
  void valuesAreCopied() {
    var value = new byte[] {1};
    backend.set("a", value, Duration.ofSeconds(1));
    value[0] = 9;
    backend.get("a").orElseThrow()[0] = 8;
    assertThat(backend.get("a")).hasValueSatisfying(v -> assertThat(v).containsExactly(1));
  }

  @Test
  void evictExpired() {
    backend.set("short", new byte[0], Duration.ofSeconds(1));
    backend.set("long", new byte[0], Duration.ofSeconds(10));
    clock.advanceSeconds(5);
    backend.evictExpired();
    assertThat(backend.size()).isOne();
    assertThat(backend.get("long")).isPresent();
  }

  @Test
  void writesSweepExpiredEntries() {
    for (int i = 0; i < 10_000; i++) {
      backend.set("e" + i, new byte[] {1}, Duration.ofSeconds(1));
    }
    clock.advanceSeconds(60);
    backend.set("fresh", new byte[] {1}, Duration.ofSeconds(1));
    assertThat(backend.size()).isOne();
    assertThat(backend.get("fresh")).isPresent();
  }

  @Test
  void writesWithinSweepIntervalDontSweep() {
    backend.set("a", new byte[0], Duration.ofSeconds(1));
    clock.advance(MemoryCacheBackend.SWEEP_INTERVAL.minusSeconds(1));
    backend.set("b", new byte[0], Duration.ofMinutes(1));
    assertThat(backend.size()).isEqualTo(2);

    clock.advanceSeconds(1);
    backend.set("c", new byte[0], Duration.ofMinutes(1));
    assertThat(backend.size()).isEqualTo(2);
    assertThat(backend.get("a")).isEmpty();
  }

  @Test
  void leastRecentlyUsedEntriesAreEvictedBeyondMaxEntries() {
    var bounded = new MemoryCacheBackend(clock, 2);
    bounded.set("a", new byte[] {1}, Duration.ofMinutes(1));
    bounded.set("b", new byte[] {2}, Duration.ofMinutes(1));
    assertThat(bounded.get("a")).isPresent(); // "b" becomes least recently used.
    bounded.set("c", new byte[] {3}, Duration.ofMinutes(1));
    assertThat(bounded.size()).isEqualTo(2);
    assertThat(bounded.get("b")).isEmpty();
    assertThat(bounded.get("a")).isPresent();
    assertThat(bounded.get("c")).isPresent();
  }

  @Test
  void nonPositiveMaxEntries() {
    assertThatIllegalArgumentException().isThrownBy(() -> new MemoryCacheBackend(clock, 0));
  }

  @Test
  void nonPositiveTtl() {
    assertThatIllegalArgumentException()
        .isThrownBy(() -> backend.set("a", new byte[0], Duration.ZERO));
  }
}
