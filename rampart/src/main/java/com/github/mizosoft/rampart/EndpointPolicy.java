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

import static com.github.mizosoft.rampart.internal.Utils.requirePositiveDuration;
import static com.github.mizosoft.rampart.internal.Validate.requireArgument;
import static java.util.Objects.requireNonNull;

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.time.Duration;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.TreeMap;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The settings governing a call: timeout, retries, headers, authentication, rate limiting, circuit
 * breaking, caching, fallback and response size limit. A policy is immutable, and all attempts of
 * a call share the same policy.
 *
 * <p>Every field is optional. Fields not set on a policy take the value of the policy it's {@link
 * #mergeOver(EndpointPolicy) merged over}, and fields not set on either read as the following
 * defaults:
 *
 * <ul>
 *   <li>{@link #timeout()}: 10 seconds
 *   <li>{@link #maxRetries()}: 2
 *   <li>{@link #retryPredicate()}: {@link RetryPredicate#onFailureOrServerError()}
 *   <li>{@link #backoffStrategy()}: {@link BackoffStrategy#fixed(Duration) fixed(200ms)}
 *   <li>{@link #headers()}: none
 *   <li>{@link #circuitBreaker()}: {@link CircuitBreaker#alwaysClosed()}
 * </ul>
 */
public final class EndpointPolicy {
  static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);
  static final int DEFAULT_MAX_RETRIES = 2;
  static final Duration DEFAULT_BACKOFF = Duration.ofMillis(200);

  private static final EndpointPolicy EMPTY = newBuilder().build();

  private final @Nullable Duration timeout;
  private final @Nullable Integer maxRetries;
  private final @Nullable RetryPredicate retryPredicate;
  private final @Nullable BackoffStrategy backoffStrategy;
  private final Map<String, String> headers;
  private final @Nullable Boolean requireAuth;
  private final @Nullable RateLimiter rateLimiter;
  private final @Nullable CircuitBreaker circuitBreaker;
  private final @Nullable AuthTokenProvider authTokenProvider;
  private final @Nullable Boolean cacheEnabled;
  private final @Nullable Duration cacheTtl;
  private final @Nullable Fallback fallback;
  private final @Nullable Long maxResponseSize;
  private final Map<String, String> tags;

  private EndpointPolicy(Builder builder) {
    this.timeout = builder.timeout;
    this.maxRetries = builder.maxRetries;
    this.retryPredicate = builder.retryPredicate;
    this.backoffStrategy = builder.backoffStrategy;
    var headers = new TreeMap<String, String>(String.CASE_INSENSITIVE_ORDER);
    headers.putAll(builder.headers);
    this.headers = Collections.unmodifiableMap(headers);
    this.requireAuth = builder.requireAuth;
    this.rateLimiter = builder.rateLimiter;
    this.circuitBreaker = builder.circuitBreaker;
    this.authTokenProvider = builder.authTokenProvider;
    this.cacheEnabled = builder.cacheEnabled;
    this.cacheTtl = builder.cacheTtl;
    this.fallback = builder.fallback;
    this.maxResponseSize = builder.maxResponseSize;
    this.tags = Collections.unmodifiableMap(new TreeMap<>(builder.tags));
  }

  /** Returns the time a call is allowed to take, including all its attempts and backoffs. */
  public Duration timeout() {
    return timeout != null ? timeout : DEFAULT_TIMEOUT;
  }

  /** Returns the maximum number of attempts made after the first one. */
  public int maxRetries() {
    return maxRetries != null ? maxRetries : DEFAULT_MAX_RETRIES;
  }

  public RetryPredicate retryPredicate() {
    return retryPredicate != null ? retryPredicate : RetryPredicate.onFailureOrServerError();
  }

  public BackoffStrategy backoffStrategy() {
    return backoffStrategy != null ? backoffStrategy : BackoffStrategy.fixed(DEFAULT_BACKOFF);
  }

  /** Returns the headers added to each request, unless the request already has them. */
  public Map<String, String> headers() {
    return headers;
  }

  /** Returns whether the caller's credential is propagated to the endpoint. */
  public boolean requiresAuth() {
    return requireAuth != null && requireAuth;
  }

  public Optional<RateLimiter> rateLimiter() {
    return Optional.ofNullable(rateLimiter);
  }

  public CircuitBreaker circuitBreaker() {
    return circuitBreaker != null ? circuitBreaker : CircuitBreaker.alwaysClosed();
  }

  public Optional<AuthTokenProvider> authTokenProvider() {
    return Optional.ofNullable(authTokenProvider);
  }

  public boolean cacheEnabled() {
    return cacheEnabled != null && cacheEnabled;
  }

  /** Returns the time-to-live of cached responses, if overridden for this policy. */
  public Optional<Duration> cacheTtl() {
    return Optional.ofNullable(cacheTtl);
  }

  public Optional<Fallback> fallback() {
    return Optional.ofNullable(fallback);
  }

  public OptionalLong maxResponseSize() {
    return maxResponseSize != null ? OptionalLong.of(maxResponseSize) : OptionalLong.empty();
  }

  /** Returns arbitrary tags describing the endpoint, used for labeling telemetry. */
  public Map<String, String> tags() {
    return tags;
  }

  /**
   * Returns a policy that has this policy's fields where set, and the given policy's fields
   * otherwise. Headers and tags are merged, with this policy's entries taking precedence.
   */
  public EndpointPolicy mergeOver(EndpointPolicy defaults) {
    requireNonNull(defaults);
    var builder = new Builder();
    builder.timeout = timeout != null ? timeout : defaults.timeout;
    builder.maxRetries = maxRetries != null ? maxRetries : defaults.maxRetries;
    builder.retryPredicate = retryPredicate != null ? retryPredicate : defaults.retryPredicate;
    builder.backoffStrategy = backoffStrategy != null ? backoffStrategy : defaults.backoffStrategy;
    builder.headers.putAll(defaults.headers);
    builder.headers.putAll(headers);
    builder.requireAuth = requireAuth != null ? requireAuth : defaults.requireAuth;
    builder.rateLimiter = rateLimiter != null ? rateLimiter : defaults.rateLimiter;
    builder.circuitBreaker = circuitBreaker != null ? circuitBreaker : defaults.circuitBreaker;
    builder.authTokenProvider =
        authTokenProvider != null ? authTokenProvider : defaults.authTokenProvider;
    builder.cacheEnabled = cacheEnabled != null ? cacheEnabled : defaults.cacheEnabled;
    builder.cacheTtl = cacheTtl != null ? cacheTtl : defaults.cacheTtl;
    builder.fallback = fallback != null ? fallback : defaults.fallback;
    builder.maxResponseSize = maxResponseSize != null ? maxResponseSize : defaults.maxResponseSize;
    builder.tags.putAll(defaults.tags);
    builder.tags.putAll(tags);
    return builder.build();
  }

  @Override
  public String toString() {
    return "EndpointPolicy[timeout="
        + timeout()
        + ", maxRetries="
        + maxRetries()
        + ", headers="
        + headers.keySet()
        + ", requiresAuth="
        + requiresAuth()
        + ", cacheEnabled="
        + cacheEnabled()
        + ", tags="
        + tags
        + "]";
  }

  /** Returns a policy with no fields set. */
  public static EndpointPolicy empty() {
    return EMPTY;
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  /** A builder of {@code EndpointPolicy} instances. */
  public static final class Builder {
    private @Nullable Duration timeout;
    private @Nullable Integer maxRetries;
    private @Nullable RetryPredicate retryPredicate;
    private @Nullable BackoffStrategy backoffStrategy;
    private final Map<String, String> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
    private @Nullable Boolean requireAuth;
    private @Nullable RateLimiter rateLimiter;
    private @Nullable CircuitBreaker circuitBreaker;
    private @Nullable AuthTokenProvider authTokenProvider;
    private @Nullable Boolean cacheEnabled;
    private @Nullable Duration cacheTtl;
    private @Nullable Fallback fallback;
    private @Nullable Long maxResponseSize;
    private final Map<String, String> tags = new TreeMap<>();

    Builder() {}

    @CanIgnoreReturnValue
    public Builder timeout(Duration timeout) {
      this.timeout = requirePositiveDuration(timeout);
      return this;
    }

    /** Sets the maximum number of retries. {@code 0} disables retrying. */
    @CanIgnoreReturnValue
    public Builder maxRetries(int maxRetries) {
      requireArgument(maxRetries >= 0, "negative maxRetries: %d", maxRetries);
      this.maxRetries = maxRetries;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder retryOn(RetryPredicate retryPredicate) {
      this.retryPredicate = requireNonNull(retryPredicate);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder backoff(BackoffStrategy backoffStrategy) {
      this.backoffStrategy = requireNonNull(backoffStrategy);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder header(String name, String value) {
      headers.put(requireNonNull(name), requireNonNull(value));
      return this;
    }

    @CanIgnoreReturnValue
    public Builder headers(Map<String, String> headers) {
      headers.forEach(this::header);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder requireAuth(boolean requireAuth) {
      this.requireAuth = requireAuth;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder rateLimiter(RateLimiter rateLimiter) {
      this.rateLimiter = requireNonNull(rateLimiter);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder circuitBreaker(CircuitBreaker circuitBreaker) {
      this.circuitBreaker = requireNonNull(circuitBreaker);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder authTokenProvider(AuthTokenProvider authTokenProvider) {
      this.authTokenProvider = requireNonNull(authTokenProvider);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder cacheEnabled(boolean cacheEnabled) {
      this.cacheEnabled = cacheEnabled;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder cacheTtl(Duration cacheTtl) {
      this.cacheTtl = requirePositiveDuration(cacheTtl);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder fallback(Fallback fallback) {
      this.fallback = requireNonNull(fallback);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder maxResponseSize(long maxResponseSize) {
      requireArgument(maxResponseSize >= 0, "negative maxResponseSize: %d", maxResponseSize);
      this.maxResponseSize = maxResponseSize;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder tag(String key, String value) {
      tags.put(requireNonNull(key), requireNonNull(value));
      return this;
    }

    public EndpointPolicy build() {
      return new EndpointPolicy(this);
    }
  }
}
