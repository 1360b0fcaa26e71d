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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatIllegalArgumentException;

import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.Test;

class EndpointPolicyTest {
  @Test
  void defaults() {
    var policy = EndpointPolicy.empty();
    assertThat(policy.timeout()).isEqualTo(Duration.ofSeconds(10));
    assertThat(policy.maxRetries()).isEqualTo(2);
    assertThat(policy.backoffStrategy().backoff(0)).isEqualTo(Duration.ofMillis(200));
    assertThat(policy.backoffStrategy().backoff(5)).isEqualTo(Duration.ofMillis(200));
    assertThat(policy.headers()).isEmpty();
    assertThat(policy.requiresAuth()).isFalse();
    assertThat(policy.rateLimiter()).isEmpty();
    assertThat(policy.circuitBreaker()).isSameAs(CircuitBreaker.alwaysClosed());
    assertThat(policy.authTokenProvider()).isEmpty();
    assertThat(policy.cacheEnabled()).isFalse();
    assertThat(policy.cacheTtl()).isEmpty();
    assertThat(policy.fallback()).isEmpty();
    assertThat(policy.maxResponseSize()).isEmpty();
    assertThat(policy.tags()).isEmpty();
  }

  @Test
  void setFieldsOverrideDefaults() {
    var defaults =
        EndpointPolicy.newBuilder()
            .timeout(Duration.ofSeconds(30))
            .maxRetries(3)
            .requireAuth(true)
            .cacheEnabled(true)
            .maxResponseSize(1024)
            .build();
    var merged =
        EndpointPolicy.newBuilder()
            .maxRetries(0)
            .cacheEnabled(false)
            .build()
            .mergeOver(defaults);
    assertThat(merged.timeout()).isEqualTo(Duration.ofSeconds(30));
    assertThat(merged.maxRetries()).isZero();
    assertThat(merged.requiresAuth()).isTrue();
    assertThat(merged.cacheEnabled()).isFalse();
    assertThat(merged.maxResponseSize()).hasValue(1024);
  }

  @Test
  void unsetFieldsInBothPoliciesFallToBuiltInDefaults() {
    var merged = EndpointPolicy.empty().mergeOver(EndpointPolicy.empty());
    assertThat(merged.timeout()).isEqualTo(Duration.ofSeconds(10));
    assertThat(merged.maxRetries()).isEqualTo(2);
  }

  @Test
  void headersAndTagsAreMerged() {
    var defaults =
        EndpointPolicy.newBuilder()
            .header("Accept", "application/json")
            .header("X-Client", "rampart")
            .tag("team", "payments")
            .tag("tier", "1")
            .build();
    var merged =
        EndpointPolicy.newBuilder()
            .header("accept", "text/plain")
            .tag("tier", "2")
            .build()
            .mergeOver(defaults);
    assertThat(merged.headers()).hasSize(2).containsEntry("X-Client", "rampart");
    assertThat(merged.headers().get("ACCEPT")).isEqualTo("text/plain");
    assertThat(merged.tags())
        .containsExactlyInAnyOrderEntriesOf(Map.of("team", "payments", "tier", "2"));
  }

  @Test
  void headersAreCaseInsensitive() {
    var policy = EndpointPolicy.newBuilder().headers(Map.of("Content-Type", "text/plain")).build();
    assertThat(policy.headers()).containsKey("content-type");
  }

  @Test
  void invalidValues() {
    var builder = EndpointPolicy.newBuilder();
    assertThatIllegalArgumentException().isThrownBy(() -> builder.timeout(Duration.ZERO));
    assertThatIllegalArgumentException().isThrownBy(() -> builder.maxRetries(-1));
    assertThatIllegalArgumentException().isThrownBy(() -> builder.cacheTtl(Duration.ofSeconds(-1)));
    assertThatIllegalArgumentException().isThrownBy(() -> builder.maxResponseSize(-1));
  }
}
