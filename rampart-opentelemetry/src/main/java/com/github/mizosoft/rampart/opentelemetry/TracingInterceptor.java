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

package com.github.mizosoft.rampart.opentelemetry;

import static java.util.Objects.requireNonNull;

import com.github.mizosoft.rampart.HttpStatus;
import com.github.mizosoft.rampart.MutableRequest;
import com.github.mizosoft.rampart.Rampart;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Context;
import io.opentelemetry.context.propagation.TextMapPropagator;
import io.opentelemetry.context.propagation.TextMapSetter;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.function.Function;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * An interceptor that wraps each attempt in a client {@link Span} and propagates the span's context
 * to the server through the request's headers. Spans are marked as errored if the attempt fails
 * with an exception or receives a response with an error status code.
 */
public final class TracingInterceptor implements Rampart.Interceptor {
  public static final String INSTRUMENTATION_NAME = "com.github.mizosoft.rampart";

  private static final TextMapSetter<MutableRequest> HEADER_SETTER =
      (request, name, value) -> {
        if (request != null) {
          request.setHeader(name, value);
        }
      };

  private final Tracer tracer;
  private final TextMapPropagator propagator;
  private final Function<HttpRequest, String> spanNameFormatter;

  private TracingInterceptor(Builder builder) {
    var openTelemetry =
        builder.openTelemetry != null ? builder.openTelemetry : GlobalOpenTelemetry.get();
    this.tracer = openTelemetry.getTracer(INSTRUMENTATION_NAME);
    this.propagator = openTelemetry.getPropagators().getTextMapPropagator();
    this.spanNameFormatter = builder.spanNameFormatter;
  }

  @Override
  public HttpResponse<InputStream> intercept(HttpRequest request, Rampart.Chain chain)
      throws IOException, InterruptedException {
    var uri = request.uri();
    var span =
        tracer
            .spanBuilder(spanNameFormatter.apply(request))
            .setSpanKind(SpanKind.CLIENT)
            .setParent(Context.current())
            .setAttribute("http.method", request.method())
            .setAttribute("http.url", uri.toString())
            .setAttribute("http.target", uri.getRawPath() != null ? uri.getRawPath() : "")
            .setAttribute("http.scheme", uri.getScheme())
            .setAttribute("http.host", hostOf(uri))
            .startSpan();
    try (var scope = span.makeCurrent()) {
      long requestContentLength =
          request.bodyPublisher().map(HttpRequest.BodyPublisher::contentLength).orElse(0L);
      if (requestContentLength > 0) {
        span.setAttribute("http.request_content_length", requestContentLength);
      }

      var tracedRequest = MutableRequest.copyOf(request);
      propagator.inject(Context.current(), tracedRequest, HEADER_SETTER);

      HttpResponse<InputStream> response;
      try {
        response = chain.forward(tracedRequest);
      } catch (IOException | RuntimeException e) {
        span.recordException(e);
        span.setStatus(StatusCode.ERROR, String.valueOf(e.getMessage()));
        throw e;
      }

      int statusCode = response.statusCode();
      span.setAttribute("http.status_code", statusCode);
      long responseContentLength = response.headers().firstValueAsLong("Content-Length").orElse(0);
      if (responseContentLength > 0) {
        span.setAttribute("http.response_content_length", responseContentLength);
      }
      if (HttpStatus.isError(statusCode)) {
        span.setStatus(StatusCode.ERROR, "HTTP status " + statusCode);
      }
      return response;
    } finally {
      span.end();
    }
  }

  private static String hostOf(URI uri) {
    var host = uri.getHost() != null ? uri.getHost() : "";
    return uri.getPort() != -1 ? host + ":" + uri.getPort() : host;
  }

  public static TracingInterceptor create() {
    return newBuilder().build();
  }

  public static TracingInterceptor create(OpenTelemetry openTelemetry) {
    return newBuilder().openTelemetry(openTelemetry).build();
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  public static final class Builder {
    private @Nullable OpenTelemetry openTelemetry;
    private Function<HttpRequest, String> spanNameFormatter =
        request -> "HTTP " + request.method();

    Builder() {}

    /** Sets the {@code OpenTelemetry} instance to use. {@link GlobalOpenTelemetry} by default. */
    @CanIgnoreReturnValue
    public Builder openTelemetry(OpenTelemetry openTelemetry) {
      this.openTelemetry = requireNonNull(openTelemetry);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder spanNameFormatter(Function<HttpRequest, String> spanNameFormatter) {
      this.spanNameFormatter = requireNonNull(spanNameFormatter);
      return this;
    }

    public TracingInterceptor build() {
      return new TracingInterceptor(this);
    }
  }
}
