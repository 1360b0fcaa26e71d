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

import com.github.mizosoft.rampart.internal.cache.CacheEntry;
import com.github.mizosoft.rampart.internal.extensions.HeadersBuilder;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * An interceptor that caches responses of endpoints whose policy {@link
 * EndpointPolicy#cacheEnabled() enables caching}. Only requests with an allowed method are looked
 * up, and only responses with an allowed status code are stored, each for the policy's {@link
 * EndpointPolicy#cacheTtl() TTL} or this interceptor's default TTL. A cache hit is served without
 * forwarding the request.
 *
 * <p>A request can opt out of caching by having a skip header (by default {@code X-Skip-Cache})
 * with the value {@code true}. The skip header is never forwarded.
 *
 * <p>Failures of the cache backend don't fail calls. A lookup that fails is treated as a miss, and
 * a store that fails is ignored.
 */
public final class CachingInterceptor implements Rampart.Interceptor {
  private static final Logger logger = System.getLogger(CachingInterceptor.class.getName());

  public static final String DEFAULT_SKIP_HEADER_NAME = "X-Skip-Cache";

  private static final String REQUEST_ID_HEADER_NAME = RequestIdInterceptor.DEFAULT_HEADER_NAME;

  private final CacheBackend backend;
  private final Duration defaultTtl;
  private final Set<String> methods;
  private final Set<Integer> statusCodes;
  private final Function<HttpRequest, String> keyFunction;
  private final String skipHeaderName;

  private CachingInterceptor(Builder builder) {
    this.backend = builder.backend;
    this.defaultTtl = builder.defaultTtl;
    this.methods = Set.copyOf(builder.methods);
    this.statusCodes = Set.copyOf(builder.statusCodes);
    this.keyFunction = builder.keyFunction;
    this.skipHeaderName = builder.skipHeaderName;
  }

  @Override
  public HttpResponse<InputStream> intercept(HttpRequest request, Rampart.Chain chain)
      throws IOException, InterruptedException {
    boolean skip = false;
    var skipHeaderValue = request.headers().firstValue(skipHeaderName);
    if (skipHeaderValue.isPresent()) {
      skip = skipHeaderValue.get().trim().equalsIgnoreCase("true");
      request = MutableRequest.copyOf(request).removeHeader(skipHeaderName);
    }

    var policy = chain.context().policy();
    if (skip || !policy.cacheEnabled() || !methods.contains(request.method())) {
      return chain.forward(request);
    }

    var key = keyFunction.apply(request);
    var cachedEntry = lookup(key);
    if (cachedEntry.isPresent()) {
      logger.log(Level.DEBUG, () -> "Cache hit for " + key);
      return toResponse(cachedEntry.get(), request);
    }

    var response = chain.forward(request);
    if (!statusCodes.contains(response.statusCode())) {
      return response;
    }

    byte[] body;
    try (var stream = response.body()) {
      body = stream.readAllBytes();
    }
    var headers = new HeadersBuilder();
    headers.addAll(response.headers());
    headers.remove(REQUEST_ID_HEADER_NAME);
    store(
        key,
        new CacheEntry(response.statusCode(), response.version(), headers.build(), body),
        policy.cacheTtl().orElse(defaultTtl));
    return ResponseBuilder.newBuilder(response)
        .<InputStream>body(new ByteArrayInputStream(body))
        .build();
  }

  private Optional<CacheEntry> lookup(String key) {
    try {
      var encoded = backend.get(key);
      return encoded.isPresent() ? Optional.of(CacheEntry.decode(encoded.get())) : Optional.empty();
    } catch (IOException | RuntimeException e) {
      logger.log(Level.WARNING, () -> "Couldn't read cache entry for " + key, e);
      return Optional.empty();
    }
  }

  private void store(String key, CacheEntry entry, Duration ttl) {
    try {
      backend.set(key, entry.encode(), ttl);
    } catch (IOException | RuntimeException e) {
      logger.log(Level.WARNING, () -> "Couldn't write cache entry for " + key, e);
    }
  }

  private static HttpResponse<InputStream> toResponse(CacheEntry entry, HttpRequest request) {
    return ResponseBuilder.create()
        .statusCode(entry.statusCode())
        .version(entry.version())
        .headers(entry.headers())
        .request(request)
        .<InputStream>body(new ByteArrayInputStream(entry.body()))
        .build();
  }

  /** Returns the default cache key of a request, which is its method and URI. */
  public static String defaultKey(HttpRequest request) {
    return request.method() + ":" + request.uri();
  }

  public static Builder newBuilder(CacheBackend backend) {
    return new Builder(backend);
  }

  /** A builder of {@code CachingInterceptor} instances. */
  public static final class Builder {
    private static final Duration DEFAULT_TTL = Duration.ofMinutes(5);

    private final CacheBackend backend;
    private Duration defaultTtl = DEFAULT_TTL;
    private Set<String> methods = Set.of("GET");
    private Set<Integer> statusCodes = Set.of(200);
    private Function<HttpRequest, String> keyFunction = CachingInterceptor::defaultKey;
    private String skipHeaderName = DEFAULT_SKIP_HEADER_NAME;

    Builder(CacheBackend backend) {
      this.backend = requireNonNull(backend);
    }

    /** Sets the TTL of responses whose policy doesn't specify one. The default is 5 minutes. */
    @CanIgnoreReturnValue
    public Builder defaultTtl(Duration defaultTtl) {
      this.defaultTtl = requirePositiveDuration(defaultTtl);
      return this;
    }

    /** Sets the request methods whose responses are cached. The default is {@code GET} only. */
    @CanIgnoreReturnValue
    public Builder methods(String... methods) {
      requireArgument(methods.length > 0, "no methods");
      var set = new LinkedHashSet<String>();
      for (var method : methods) {
        set.add(method.toUpperCase(Locale.ROOT));
      }
      this.methods = set;
      return this;
    }

    /** Sets the status codes of cached responses. The default is {@code 200} only. */
    @CanIgnoreReturnValue
    public Builder statusCodes(Integer... statusCodes) {
      requireArgument(statusCodes.length > 0, "no status codes");
      this.statusCodes = new LinkedHashSet<>(Arrays.asList(statusCodes));
      return this;
    }

    @CanIgnoreReturnValue
    public Builder keyFunction(Function<HttpRequest, String> keyFunction) {
      this.keyFunction = requireNonNull(keyFunction);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder skipHeaderName(String skipHeaderName) {
      this.skipHeaderName = requireNonNull(skipHeaderName);
      return this;
    }

    public CachingInterceptor build() {
      return new CachingInterceptor(this);
    }
  }
}
