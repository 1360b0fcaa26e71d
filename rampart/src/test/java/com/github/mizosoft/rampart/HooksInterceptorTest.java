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
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.github.mizosoft.rampart.testing.MockClock;
import com.github.mizosoft.rampart.testing.MockDelayer;
import com.github.mizosoft.rampart.testing.StubHttpClient;
import java.net.ConnectException;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class HooksInterceptorTest {
  private StubHttpClient backend;
  private MockClock clock;
  private List<String> events;

  @BeforeEach
  void setUp() {
    backend = new StubHttpClient();
    clock = new MockClock();
    events = new CopyOnWriteArrayList<>();
  }

  private Rampart client(Rampart.Interceptor... interceptors) {
    var builder =
        Rampart.newBuilder(backend)
            .baseUri("https://example.com")
            .clock(clock)
            .delayer(new MockDelayer(clock));
    for (var interceptor : interceptors) {
      builder.interceptor(interceptor);
    }
    return builder.build();
  }

  private HooksInterceptor recordingInterceptor() {
    return new HooksInterceptor(
        new HooksInterceptor.Listener() {
          @Override
          public void onPreRequest(HttpRequest request) {
            events.add("pre " + request.method() + " " + request.uri().getPath());
          }

          @Override
          public void onPostRequest(HttpRequest request, HttpResponse<?> response) {
            events.add("post " + response.statusCode());
          }

          @Override
          public void onError(HttpRequest request, Throwable exception) {
            events.add("error " + exception.getClass().getSimpleName());
          }
        });
  }

  @Test
  void listenerSeesEachAttempt() throws Exception {
    backend.respondWith(503, "").respondWith(200, "");
    client(recordingInterceptor()).get("/pokemon");
    assertThat(events)
        .containsExactly("pre GET /pokemon", "post 503", "pre GET /pokemon", "post 200");
  }

  @Test
  void listenerSeesTransportFailures() throws Exception {
    backend.failWith(new ConnectException("refused")).respondWith(200, "");
    client(recordingInterceptor()).get("/");
    assertThat(events)
        .containsExactly("pre GET /", "error ConnectException", "pre GET /", "post 200");
  }

  @Test
  void listenerSeesRequestAsModifiedByOuterInterceptors() throws Exception {
    backend.respondWith(200, "");
    var seenIds = new CopyOnWriteArrayList<String>();
    client(
            new RequestIdInterceptor(),
            new HooksInterceptor(
                new HooksInterceptor.Listener() {
                  @Override
                  public void onPreRequest(HttpRequest request) {
                    seenIds.add(request.headers().firstValue("X-Request-ID").orElse(""));
                  }
                }))
        .get("/");
    assertThat(seenIds).hasSize(1).doesNotContain("");
  }

  @Test
  void failingListenerDoesNotFailAttempt() throws Exception {
    backend.respondWith(200, "Pikachu");
    var response =
        client(
                new HooksInterceptor(
                    new HooksInterceptor.Listener() {
                      @Override
                      public void onPreRequest(HttpRequest request) {
                        throw new IllegalStateException("pre");
                      }

                      @Override
                      public void onPostRequest(HttpRequest request, HttpResponse<?> response) {
                        throw new IllegalStateException("post");
                      }
                    }))
            .get("/");
    assertThat(response.statusCode()).isEqualTo(200);
  }

  @Test
  void failingErrorListenerKeepsOriginalFailure() {
    backend.failWith(new ConnectException("refused"));
    var client =
        client(
            new HooksInterceptor(
                new HooksInterceptor.Listener() {
                  @Override
                  public void onError(HttpRequest request, Throwable exception) {
                    throw new IllegalStateException("error");
                  }
                }));
    assertThatThrownBy(() -> client.get("/"))
        .isInstanceOf(HttpCallException.class)
        .hasCauseInstanceOf(ConnectException.class);
  }
}
