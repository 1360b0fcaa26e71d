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

import java.io.IOException;
import java.net.ConnectException;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class RetryPredicateTest {
  private final RetryPredicate predicate = RetryPredicate.onFailureOrServerError();

  @ParameterizedTest
  @ValueSource(ints = {500, 502, 503, 504, 599})
  void retriesServerErrors(int statusCode) {
    assertThat(predicate.shouldRetry(response(statusCode), null)).isTrue();
  }

  @ParameterizedTest
  @ValueSource(ints = {200, 204, 301, 400, 404, 429, 499})
  void doesNotRetryOtherStatuses(int statusCode) {
    assertThat(predicate.shouldRetry(response(statusCode), null)).isFalse();
  }

  @Test
  void retriesTransportFailures() {
    assertThat(predicate.shouldRetry(null, new ConnectException())).isTrue();
    assertThat(predicate.shouldRetry(null, new HttpTimeoutException("timed out"))).isTrue();
    assertThat(predicate.shouldRetry(null, new HttpConnectTimeoutException("timed out")))
        .isTrue();
    assertThat(predicate.shouldRetry(null, new IOException())).isTrue();
  }

  @Test
  void doesNotRetryRejectionsOrOversizedResponses() {
    assertThat(predicate.shouldRetry(null, new CircuitBreakerOpenException("open"))).isFalse();
    assertThat(predicate.shouldRetry(null, new RateLimitExceededException("limited"))).isFalse();
    assertThat(predicate.shouldRetry(null, new ResponseTooLargeException(1))).isFalse();
  }

  @Test
  void doesNotRetryProgrammingErrors() {
    assertThat(predicate.shouldRetry(null, new IllegalStateException())).isFalse();
  }

  private static HttpResponse<?> response(int statusCode) {
    return ResponseBuilder.create()
        .statusCode(statusCode)
        .request(MutableRequest.GET("https://example.com"))
        .build();
  }
}
