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

import com.github.mizosoft.rampart.internal.extensions.HeadersBuilder;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.net.URI;
import java.net.http.HttpClient.Version;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import org.checkerframework.checker.nullness.qual.MonotonicNonNull;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A mutable {@link HttpRequest} that also implements {@link HttpRequest.Builder} for setting its
 * fields. Interceptors use it to derive a modified copy of the request they're given:
 *
 * <pre>{@code
 * public HttpResponse<InputStream> intercept(HttpRequest request, Chain chain)
 *     throws IOException, InterruptedException {
 *   return chain.forward(MutableRequest.copyOf(request).setHeader("Accept", "application/json"));
 * }
 * }</pre>
 *
 * <p>Querying a field before it's been set returns its default value.
 */
public final class MutableRequest extends HttpRequest implements HttpRequest.Builder {
  private static final URI EMPTY_URI = URI.create("");

  private final HeadersBuilder headersBuilder = new HeadersBuilder();
  private String method;
  private URI uri;
  private @Nullable BodyPublisher bodyPublisher;
  private @MonotonicNonNull Duration timeout;
  private @MonotonicNonNull Version version;
  private boolean expectContinue;

  private MutableRequest() {
    method = "GET";
    uri = EMPTY_URI;
  }

  private MutableRequest(MutableRequest other) {
    method = other.method;
    uri = other.uri;
    bodyPublisher = other.bodyPublisher;
    expectContinue = other.expectContinue;
    headersBuilder.addAll(other.headers());
    if (other.timeout != null) {
      timeout = other.timeout;
    }
    if (other.version != null) {
      version = other.version;
    }
  }

  @Override
  public Optional<BodyPublisher> bodyPublisher() {
    return Optional.ofNullable(bodyPublisher);
  }

  @Override
  public String method() {
    return method;
  }

  @Override
  public Optional<Duration> timeout() {
    return Optional.ofNullable(timeout);
  }

  @Override
  public boolean expectContinue() {
    return expectContinue;
  }

  @Override
  public URI uri() {
    return uri;
  }

  @Override
  public Optional<Version> version() {
    return Optional.ofNullable(version);
  }

  @Override
  public HttpHeaders headers() {
    return headersBuilder.build();
  }

  /** Returns the last value of the given header, if present. */
  public Optional<String> headerValue(String name) {
    return headersBuilder.lastValue(name);
  }

  @CanIgnoreReturnValue
  public MutableRequest uri(String uri) {
    return uri(URI.create(uri));
  }

  @Override
  @CanIgnoreReturnValue
  public MutableRequest uri(URI uri) {
    this.uri = requireNonNull(uri);
    return this;
  }

  @Override
  @CanIgnoreReturnValue
  public MutableRequest expectContinue(boolean enable) {
    this.expectContinue = enable;
    return this;
  }

  @Override
  @CanIgnoreReturnValue
  public MutableRequest version(Version version) {
    this.version = requireNonNull(version);
    return this;
  }

  @Override
  @CanIgnoreReturnValue
  public MutableRequest header(String name, String value) {
    headersBuilder.add(name, value);
    return this;
  }

  @Override
  @CanIgnoreReturnValue
  public MutableRequest headers(String... headers) {
    requireArgument(
        headers.length > 0 && headers.length % 2 == 0,
        "Expected a even-numbered, positive array length: %d",
        headers.length);
    for (int i = 0; i < headers.length; i += 2) {
      headersBuilder.add(headers[i], headers[i + 1]);
    }
    return this;
  }

  @CanIgnoreReturnValue
  public MutableRequest headers(HttpHeaders headers) {
    headersBuilder.addAll(headers);
    return this;
  }

  @Override
  @CanIgnoreReturnValue
  public MutableRequest setHeader(String name, String value) {
    headersBuilder.set(name, value);
    return this;
  }

  @CanIgnoreReturnValue
  public MutableRequest setHeader(String name, List<String> values) {
    headersBuilder.set(name, values);
    return this;
  }

  @CanIgnoreReturnValue
  public MutableRequest setHeaderIfAbsent(String name, String value) {
    headersBuilder.setIfAbsent(name, value);
    return this;
  }

  @CanIgnoreReturnValue
  public MutableRequest removeHeader(String name) {
    headersBuilder.remove(name);
    return this;
  }

  @Override
  @CanIgnoreReturnValue
  public MutableRequest timeout(Duration timeout) {
    this.timeout = requirePositiveDuration(timeout);
    return this;
  }

  @Override
  @CanIgnoreReturnValue
  public MutableRequest GET() {
    return setMethod("GET", null);
  }

  @CanIgnoreReturnValue
  public MutableRequest HEAD() {
    return setMethod("HEAD", null);
  }

  @Override
  @CanIgnoreReturnValue
  public MutableRequest POST(BodyPublisher bodyPublisher) {
    return setMethod("POST", requireNonNull(bodyPublisher));
  }

  @Override
  @CanIgnoreReturnValue
  public MutableRequest PUT(BodyPublisher bodyPublisher) {
    return setMethod("PUT", requireNonNull(bodyPublisher));
  }

  @CanIgnoreReturnValue
  public MutableRequest PATCH(BodyPublisher bodyPublisher) {
    return setMethod("PATCH", requireNonNull(bodyPublisher));
  }

  @Override
  @CanIgnoreReturnValue
  public MutableRequest DELETE() {
    return setMethod("DELETE", null);
  }

  @Override
  @CanIgnoreReturnValue
  public MutableRequest method(String method, BodyPublisher bodyPublisher) {
    requireArgument(!method.isBlank(), "Illegal method name: '%s'", method);
    return setMethod(method, requireNonNull(bodyPublisher));
  }

  @CanIgnoreReturnValue
  private MutableRequest setMethod(String method, @Nullable BodyPublisher bodyPublisher) {
    this.method = requireNonNull(method);
    this.bodyPublisher = bodyPublisher;
    return this;
  }

  @Override
  public HttpRequest build() {
    return copy();
  }

  @Override
  public MutableRequest copy() {
    return new MutableRequest(this);
  }

  @Override
  public String toString() {
    return uri + " " + method;
  }

  /** Returns a new {@code MutableRequest} that is a copy of the given request. */
  public static MutableRequest copyOf(HttpRequest other) {
    if (other instanceof MutableRequest) {
      return ((MutableRequest) other).copy();
    }
    var copy =
        new MutableRequest()
            .uri(other.uri())
            .headers(other.headers())
            .expectContinue(other.expectContinue())
            .setMethod(other.method(), other.bodyPublisher().orElse(null));
    other.timeout().ifPresent(copy::timeout);
    other.version().ifPresent(copy::version);
    return copy;
  }

  public static MutableRequest create() {
    return new MutableRequest();
  }

  public static MutableRequest GET(String uri) {
    return new MutableRequest().uri(uri); // default is GET
  }

  public static MutableRequest GET(URI uri) {
    return new MutableRequest().uri(uri);
  }

  public static MutableRequest POST(String uri, BodyPublisher bodyPublisher) {
    return new MutableRequest().uri(uri).POST(bodyPublisher);
  }
}
