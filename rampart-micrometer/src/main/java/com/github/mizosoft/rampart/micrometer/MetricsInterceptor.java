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

package com.github.mizosoft.rampart.micrometer;

import static com.github.mizosoft.rampart.internal.Validate.requireArgument;
import static java.util.Objects.requireNonNull;

import com.github.mizosoft.rampart.Rampart;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.MonotonicNonNull;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * An interceptor that records the duration and outcome of each attempt into a {@link
 * MeterRegistry}. Three meters are recorded, all named under a prefix made of a namespace and an
 * optional subsystem:
 *
 * <ul>
 *   <li>{@code <prefix>.request.duration}: a timer of attempts that received a response, tagged
 *       with {@code method}, {@code host}, {@code path} and {@code status}.
 *   <li>{@code <prefix>.requests}: a counter with the same tags.
 *   <li>{@code <prefix>.request.errors}: a counter of attempts that failed without a response,
 *       tagged with {@code method}, {@code host}, {@code path} and {@code error}.
 * </ul>
 *
 * <p>Tags set on the call's {@link com.github.mizosoft.rampart.EndpointPolicy} are added to each
 * meter. Meters are looked up in the registry on each use, so any number of interceptors sharing a
 * registry and a prefix record into the same meters.
 */
public final class MetricsInterceptor implements Rampart.Interceptor {
  public static final String DEFAULT_NAMESPACE = "http_client";

  private final MeterRegistry registry;
  private final String durationName;
  private final String requestsName;
  private final String errorsName;

  private MetricsInterceptor(Builder builder) {
    this.registry = requireNonNull(builder.registry, "registry");
    var prefix =
        builder.subsystem != null ? builder.namespace + "." + builder.subsystem : builder.namespace;
    this.durationName = prefix + ".request.duration";
    this.requestsName = prefix + ".requests";
    this.errorsName = prefix + ".request.errors";
  }

  @Override
  public HttpResponse<InputStream> intercept(HttpRequest request, Rampart.Chain chain)
      throws IOException, InterruptedException {
    var context = chain.context();
    var tags =
        policyTags(context.policy().tags())
            .and("method", request.method(), "host", hostOf(request.uri()), "path", context.path());

    var sample = Timer.start(registry);
    HttpResponse<InputStream> response;
    try {
      response = chain.forward(request);
    } catch (IOException | RuntimeException e) {
      Counter.builder(errorsName)
          .description("Number of HTTP requests that failed without a response")
          .tags(tags.and("error", e.getClass().getSimpleName()))
          .register(registry)
          .increment();
      throw e;
    }

    var responseTags = tags.and("status", Integer.toString(response.statusCode()));
    sample.stop(
        Timer.builder(durationName)
            .description("Time spent on HTTP requests")
            .tags(responseTags)
            .register(registry));
    Counter.builder(requestsName)
        .description("Number of HTTP requests")
        .tags(responseTags)
        .register(registry)
        .increment();
    return response;
  }

  private static Tags policyTags(Map<String, String> policyTags) {
    var tags = Tags.empty();
    for (var entry : policyTags.entrySet()) {
      tags = tags.and(entry.getKey(), entry.getValue());
    }
    return tags;
  }

  private static String hostOf(URI uri) {
    var host = uri.getHost() != null ? uri.getHost() : "";
    return uri.getPort() != -1 ? host + ":" + uri.getPort() : host;
  }

  public static Builder newBuilder(MeterRegistry registry) {
    return new Builder().registry(registry);
  }

  public static final class Builder {
    private @MonotonicNonNull MeterRegistry registry;
    private String namespace = DEFAULT_NAMESPACE;
    private @Nullable String subsystem;

    Builder() {}

    @CanIgnoreReturnValue
    public Builder registry(MeterRegistry registry) {
      this.registry = requireNonNull(registry);
      return this;
    }

    /** Sets the namespace meter names start with. Defaults to {@value #DEFAULT_NAMESPACE}. */
    @CanIgnoreReturnValue
    public Builder namespace(String namespace) {
      requireArgument(!namespace.isBlank(), "blank namespace");
      this.namespace = namespace;
      return this;
    }

    /** Sets the subsystem meter names have after the namespace. None by default. */
    @CanIgnoreReturnValue
    public Builder subsystem(String subsystem) {
      requireArgument(!subsystem.isBlank(), "blank subsystem");
      this.subsystem = subsystem;
      return this;
    }

    public MetricsInterceptor build() {
      return new MetricsInterceptor(this);
    }
  }
}
