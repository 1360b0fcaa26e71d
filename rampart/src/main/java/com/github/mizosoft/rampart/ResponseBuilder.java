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

import static com.github.mizosoft.rampart.internal.Validate.requireArgument;
import static com.github.mizosoft.rampart.internal.Validate.requireState;
import static java.util.Objects.requireNonNull;

import com.github.mizosoft.rampart.internal.extensions.HeadersBuilder;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.net.URI;
import java.net.http.HttpClient.Version;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Optional;
import javax.net.ssl.SSLSession;
import org.checkerframework.checker.nullness.qual.MonotonicNonNull;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A builder of {@link HttpResponse} instances. Used for synthesizing responses, as fallbacks and
 * cache hits do, or for replacing the body of an existing response.
 */
public final class ResponseBuilder<T> {
  private static final int UNSET_STATUS_CODE = -1;

  private final HeadersBuilder headersBuilder = new HeadersBuilder();
  private int statusCode = UNSET_STATUS_CODE;
  private @MonotonicNonNull URI uri;
  private Version version = Version.HTTP_1_1;
  private @MonotonicNonNull HttpRequest request;
  private @Nullable Object body;
  private @Nullable SSLSession sslSession;

  private ResponseBuilder() {}

  @CanIgnoreReturnValue
  public ResponseBuilder<T> statusCode(int statusCode) {
    requireArgument(statusCode >= 0, "negative status code");
    this.statusCode = statusCode;
    return this;
  }

  @CanIgnoreReturnValue
  public ResponseBuilder<T> uri(URI uri) {
    this.uri = requireNonNull(uri);
    return this;
  }

  @CanIgnoreReturnValue
  public ResponseBuilder<T> version(Version version) {
    this.version = requireNonNull(version);
    return this;
  }

  @CanIgnoreReturnValue
  public ResponseBuilder<T> header(String name, String value) {
    headersBuilder.add(name, value);
    return this;
  }

  @CanIgnoreReturnValue
  public ResponseBuilder<T> setHeader(String name, String value) {
    headersBuilder.set(name, value);
    return this;
  }

  @CanIgnoreReturnValue
  public ResponseBuilder<T> headers(HttpHeaders headers) {
    headersBuilder.addAll(headers);
    return this;
  }

  @CanIgnoreReturnValue
  public ResponseBuilder<T> removeHeader(String name) {
    headersBuilder.remove(name);
    return this;
  }

  /** Sets the request. The response's URI defaults to the request's URI if not set. */
  @CanIgnoreReturnValue
  public ResponseBuilder<T> request(HttpRequest request) {
    this.request = requireNonNull(request);
    return this;
  }

  @CanIgnoreReturnValue
  @SuppressWarnings("unchecked")
  public <U> ResponseBuilder<U> body(@Nullable U body) {
    this.body = body;
    return (ResponseBuilder<U>) this;
  }

  @CanIgnoreReturnValue
  public ResponseBuilder<T> sslSession(@Nullable SSLSession sslSession) {
    this.sslSession = sslSession;
    return this;
  }

  @SuppressWarnings("unchecked")
  public HttpResponse<T> build() {
    requireState(statusCode != UNSET_STATUS_CODE, "statusCode is required");
    requireState(request != null, "request is required");
    var request = this.request;
    return new HttpResponseImpl<>(
        statusCode,
        uri != null ? uri : request.uri(),
        version,
        headersBuilder.build(),
        request,
        (T) body,
        sslSession);
  }

  /** Returns a new {@code ResponseBuilder} with no fields set except the HTTP version. */
  public static <T> ResponseBuilder<T> create() {
    return new ResponseBuilder<>();
  }

  /** Returns a new {@code ResponseBuilder} initialized with the given response's fields. */
  public static <T> ResponseBuilder<T> newBuilder(HttpResponse<T> response) {
    var builder =
        new ResponseBuilder<T>()
            .statusCode(response.statusCode())
            .uri(response.uri())
            .version(response.version())
            .headers(response.headers())
            .request(response.request())
            .body(response.body());
    response.sslSession().ifPresent(builder::sslSession);
    return builder;
  }

  private static final class HttpResponseImpl<T> implements HttpResponse<T> {
    private final int statusCode;
    private final URI uri;
    private final Version version;
    private final HttpHeaders headers;
    private final HttpRequest request;
    private final T body;
    private final @Nullable SSLSession sslSession;

    HttpResponseImpl(
        int statusCode,
        URI uri,
        Version version,
        HttpHeaders headers,
        HttpRequest request,
        T body,
        @Nullable SSLSession sslSession) {
      this.statusCode = statusCode;
      this.uri = uri;
      this.version = version;
      this.headers = headers;
      this.request = request;
      this.body = body;
      this.sslSession = sslSession;
    }

    @Override
    public int statusCode() {
      return statusCode;
    }

    @Override
    public HttpRequest request() {
      return request;
    }

    @Override
    public Optional<HttpResponse<T>> previousResponse() {
      return Optional.empty();
    }

    @Override
    public HttpHeaders headers() {
      return headers;
    }

    @Override
    public T body() {
      return body;
    }

    @Override
    public Optional<SSLSession> sslSession() {
      return Optional.ofNullable(sslSession);
    }

    @Override
    public URI uri() {
      return uri;
    }

    @Override
    public Version version() {
      return version;
    }

    @Override
    public String toString() {
      return '(' + request.method() + " " + uri + ") " + statusCode;
    }
  }
}
