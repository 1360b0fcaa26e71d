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

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.github.mizosoft.rampart.EndpointPolicy;
import com.github.mizosoft.rampart.HttpCallException;
import com.github.mizosoft.rampart.Rampart;
import com.github.mizosoft.rampart.testing.StubHttpClient;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.propagation.W3CTraceContextPropagator;
import io.opentelemetry.context.propagation.ContextPropagators;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.testing.exporter.InMemorySpanExporter;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.export.SimpleSpanProcessor;
import java.net.ConnectException;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TracingInterceptorTest {
  private InMemorySpanExporter exporter;
  private OpenTelemetrySdk openTelemetry;
  private StubHttpClient backend;

  @BeforeEach
  void setUp() {
    exporter = InMemorySpanExporter.create();
    openTelemetry =
        OpenTelemetrySdk.builder()
            .setTracerProvider(
                SdkTracerProvider.builder()
                    .addSpanProcessor(SimpleSpanProcessor.create(exporter))
                    .build())
            .setPropagators(ContextPropagators.create(W3CTraceContextPropagator.getInstance()))
            .build();
    backend = new StubHttpClient();
  }

  @AfterEach
  void tearDown() {
    openTelemetry.getSdkTracerProvider().close();
  }

  private Rampart client(TracingInterceptor interceptor) {
    return Rampart.newBuilder(backend)
        .baseUri("https://example.com:8443")
        .defaultPolicy(EndpointPolicy.newBuilder().maxRetries(0).build())
        .interceptor(interceptor)
        .build();
  }

  @Test
  void spanPerCall() throws Exception {
    backend.respondWith(200, Map.of("Content-Length", "7"), "Pikachu");
    client(TracingInterceptor.create(openTelemetry))
        .post("/pokemon?lang=en", "Pichu".getBytes(UTF_8));

    assertThat(exporter.getFinishedSpanItems()).hasSize(1);
    var span = exporter.getFinishedSpanItems().get(0);
    assertThat(span.getName()).isEqualTo("HTTP POST");
    assertThat(span.getKind()).isEqualTo(SpanKind.CLIENT);
    assertThat(span.getStatus().getStatusCode()).isEqualTo(StatusCode.UNSET);

    var attributes = span.getAttributes();
    assertThat(attributes.get(AttributeKey.stringKey("http.method"))).isEqualTo("POST");
    assertThat(attributes.get(AttributeKey.stringKey("http.url")))
        .isEqualTo("https://example.com:8443/pokemon?lang=en");
    assertThat(attributes.get(AttributeKey.stringKey("http.target"))).isEqualTo("/pokemon");
    assertThat(attributes.get(AttributeKey.stringKey("http.scheme"))).isEqualTo("https");
    assertThat(attributes.get(AttributeKey.stringKey("http.host")))
        .isEqualTo("example.com:8443");
    assertThat(attributes.get(AttributeKey.longKey("http.request_content_length")))
        .isEqualTo(5L);
    assertThat(attributes.get(AttributeKey.longKey("http.status_code"))).isEqualTo(200L);
    assertThat(attributes.get(AttributeKey.longKey("http.response_content_length")))
        .isEqualTo(7L);
  }

  @Test
  void traceContextIsInjected() throws Exception {
    backend.respondWith(200, "");
    client(TracingInterceptor.create(openTelemetry)).get("/");

    var span = exporter.getFinishedSpanItems().get(0);
    assertThat(backend.lastRequest().headers().firstValue("traceparent"))
        .hasValue("00-" + span.getTraceId() + "-" + span.getSpanId() + "-01");
  }

  @Test
  void errorStatus() {
    backend.respondWith(503, "");
    var client = client(TracingInterceptor.create(openTelemetry));
    assertThatThrownBy(() -> client.get("/")).isInstanceOf(HttpCallException.class);

    var span = exporter.getFinishedSpanItems().get(0);
    assertThat(span.getStatus().getStatusCode()).isEqualTo(StatusCode.ERROR);
    assertThat(span.getAttributes().get(AttributeKey.longKey("http.status_code")))
        .isEqualTo(503L);
    assertThat(span.getAttributes().get(AttributeKey.longKey("http.request_content_length")))
        .isNull();
  }

  @Test
  void exception() {
    backend.failWith(new ConnectException("refused"));
    var client = client(TracingInterceptor.create(openTelemetry));
    assertThatThrownBy(() -> client.get("/")).isInstanceOf(HttpCallException.class);

    var span = exporter.getFinishedSpanItems().get(0);
    assertThat(span.getStatus().getStatusCode()).isEqualTo(StatusCode.ERROR);
    assertThat(span.getStatus().getDescription()).isEqualTo("refused");
    assertThat(span.getEvents()).anyMatch(event -> event.getName().equals("exception"));
    assertThat(span.getAttributes().get(AttributeKey.longKey("http.status_code"))).isNull();
  }

  @Test
  void customSpanName() throws Exception {
    backend.respondWith(200, "");
    client(
            TracingInterceptor.newBuilder()
                .openTelemetry(openTelemetry)
                .spanNameFormatter(request -> request.method() + " " + request.uri().getPath())
                .build())
        .get("/users");
    assertThat(exporter.getFinishedSpanItems().get(0).getName()).isEqualTo("GET /users");
  }
}
