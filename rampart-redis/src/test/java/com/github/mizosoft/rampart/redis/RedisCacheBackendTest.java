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

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatIllegalArgumentException;
import static org.assertj.core.api.Assertions.assertThatIllegalStateException;
import static org.awaitility.Awaitility.await;

import com.github.mizosoft.rampart.CachingInterceptor;
import com.github.mizosoft.rampart.EndpointPolicy;
import com.github.mizosoft.rampart.Rampart;
import com.github.mizosoft.rampart.testing.StubHttpClient;
import io.lettuce.core.RedisURI;
import java.time.Duration;
import java.util.UUID;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledIfEnvironmentVariable;

@EnabledIfEnvironmentVariable(named = "RAMPART_REDIS_URI", matches = ".+")
class RedisCacheBackendTest {
  private RedisCacheBackend backend;

  @BeforeEach
  void setUp() throws Exception {
    backend =
        RedisCacheBackend.connect(
            RedisURI.create(System.getenv("RAMPART_REDIS_URI")),
            "rampart:test:" + UUID.randomUUID() + ":");
  }

  @AfterEach
  void tearDown() {
    if (backend != null) {
      backend.close();
    }
  }

  @Test
  void setThenGet() throws Exception {
    backend.set("e1", "Pikachu".getBytes(UTF_8), Duration.ofMinutes(1));
    assertThat(backend.get("e1")).hasValueSatisfying(
        value -> assertThat(value).asString(UTF_8).isEqualTo("Pikachu"));
  }

  @Test
  void absentKey() throws Exception {
    assertThat(backend.get("e1")).isEmpty();
  }

  @Test
  void setOverwrites() throws Exception {
    backend.set("e1", "Pikachu".getBytes(UTF_8), Duration.ofMinutes(1));
    backend.set("e1", "Raichu".getBytes(UTF_8), Duration.ofMinutes(1));
    assertThat(backend.get("e1")).hasValueSatisfying(
        value -> assertThat(value).asString(UTF_8).isEqualTo("Raichu"));
  }

  @Test
  void delete() throws Exception {
    backend.set("e1", "Pikachu".getBytes(UTF_8), Duration.ofMinutes(1));
    backend.delete("e1");
    assertThat(backend.get("e1")).isEmpty();

    // Deleting an absent key is a no-op.
    backend.delete("e1");
  }

  @Test
  void entryExpires() throws Exception {
    backend.set("e1", new byte[] {1, 2, 3}, Duration.ofMillis(200));
    await().atMost(Duration.ofSeconds(5)).until(() -> backend.get("e1").isEmpty());
  }

  @Test
  void keysAreNamespacedUnderPrefix() throws Exception {
    backend.set("e1", new byte[] {1}, Duration.ofMinutes(1));
    try (var other =
        RedisCacheBackend.connect(
            RedisURI.create(System.getenv("RAMPART_REDIS_URI")),
            "rampart:test:" + UUID.randomUUID() + ":")) {
      assertThat(other.get("e1")).isEmpty();
    }
  }

  @Test
  void nonPositiveTtl() {
    assertThatIllegalArgumentException()
        .isThrownBy(() -> backend.set("e1", new byte[0], Duration.ZERO));
    assertThatIllegalArgumentException()
        .isThrownBy(() -> backend.set("e1", new byte[0], Duration.ofSeconds(-1)));
  }

  @Test
  void closedBackendRejectsOperations() {
    backend.close();
    backend.close(); // Closing twice is harmless.
    assertThatIllegalStateException().isThrownBy(() -> backend.get("e1"));
    assertThatIllegalStateException()
        .isThrownBy(() -> backend.set("e1", new byte[0], Duration.ofMinutes(1)));
    assertThatIllegalStateException().isThrownBy(() -> backend.delete("e1"));
  }

  @Test
  void servesCachedResponsesThroughClient() throws Exception {
    var stub = new StubHttpClient();
    stub.respondWith(200, "Pikachu");
    var client =
        Rampart.newBuilder(stub)
            .baseUri("https://example.com")
            .defaultPolicy(EndpointPolicy.newBuilder().cacheEnabled(true).build())
            .interceptor(CachingInterceptor.newBuilder(backend).build())
            .build();

    assertThat(client.get("/pokemon/25").body()).asString(UTF_8).isEqualTo("Pikachu");
    assertThat(client.get("/pokemon/25").body()).asString(UTF_8).isEqualTo("Pikachu");
    assertThat(stub.sendCount()).isOne();
    assertThat(backend.get("GET:https://example.com/pokemon/25")).isPresent();
  }
}
