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

package com.github.mizosoft.rampart.testing;

import static java.nio.charset.StandardCharsets.UTF_8;

import com.github.mizosoft.rampart.ResponseBuilder;
import java.io.IOException;
import java.io.InputStream;
import java.net.Authenticator;
import java.net.CookieHandler;
import java.net.ProxySelector;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpResponse.BodyHandler;
import java.net.http.HttpResponse.PushPromiseHandler;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLParameters;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * An {@code HttpClient} that records the requests it's given and responds with queued {@link
 * Responder responders}. The last queued responder keeps responding once the others are used up.
 * Response bodies are {@link TrackedInputStream TrackedInputStreams}, so tests can check they're
 * closed. Only {@code InputStream} body handlers are supported, as that's what a {@code Rampart}
 * client uses.
 */
public final class StubHttpClient extends HttpClient {
  private final List<HttpRequest> requests = new CopyOnWriteArrayList<>();
  private final List<TrackedInputStream> bodies = new CopyOnWriteArrayList<>();
  private final List<Integer> openBodiesAtEachSend = new CopyOnWriteArrayList<>();
  private final Deque<Responder> responders = new ArrayDeque<>();

  public StubHttpClient() {}

  /** Queues the given responders. */
  public StubHttpClient respondWith(Responder... responders) {
    synchronized (this.responders) {
      this.responders.addAll(List.of(responders));
    }
    return this;
  }

  /** Queues a responder that responds with the given status and UTF-8 body. */
  public StubHttpClient respondWith(int statusCode, String body) {
    return respondWith(request -> response(request, statusCode, body));
  }

  /** Queues a responder that responds with the given status, headers and UTF-8 body. */
  public StubHttpClient respondWith(int statusCode, Map<String, String> headers, String body) {
    return respondWith(request -> response(request, statusCode, headers, body));
  }

  /** Queues a responder that fails with the given exception. */
  public StubHttpClient failWith(IOException exception) {
    return respondWith(
        request -> {
          throw exception;
        });
  }

  public int sendCount() {
    return requests.size();
  }

  public List<HttpRequest> requests() {
    return List.copyOf(requests);
  }

  public HttpRequest lastRequest() {
    return requests.get(requests.size() - 1);
  }

  /** Returns the bodies of all responses given so far. */
  public List<TrackedInputStream> bodies() {
    return List.copyOf(bodies);
  }

  /** Returns, for each send, the number of response bodies that were still open at that point. */
  public List<Integer> openBodiesAtEachSend() {
    return List.copyOf(openBodiesAtEachSend);
  }

  @Override
  @SuppressWarnings("unchecked")
  public <T> HttpResponse<T> send(HttpRequest request, BodyHandler<T> responseBodyHandler)
      throws IOException {
    openBodiesAtEachSend.add((int) bodies.stream().filter(body -> !body.isClosed()).count());
    requests.add(request);
    Responder responder;
    synchronized (responders) {
      if (responders.isEmpty()) {
        throw new IllegalStateException("no responders for " + request);
      }
      responder = responders.size() > 1 ? responders.poll() : responders.peek();
    }
    var response = responder.respond(request);
    if (response.body() instanceof TrackedInputStream) {
      bodies.add((TrackedInputStream) response.body());
    }
    return (HttpResponse<T>) response;
  }

  @Override
  public <T> CompletableFuture<HttpResponse<T>> sendAsync(
      HttpRequest request, BodyHandler<T> responseBodyHandler) {
    try {
      return CompletableFuture.completedFuture(send(request, responseBodyHandler));
    } catch (IOException e) {
      return CompletableFuture.failedFuture(e);
    }
  }

  @Override
  public <T> CompletableFuture<HttpResponse<T>> sendAsync(
      HttpRequest request,
      BodyHandler<T> responseBodyHandler,
      @Nullable PushPromiseHandler<T> pushPromiseHandler) {
    return sendAsync(request, responseBodyHandler);
  }

  @Override
  public Optional<CookieHandler> cookieHandler() {
    return Optional.empty();
  }

  @Override
  public Optional<Duration> connectTimeout() {
    return Optional.empty();
  }

  @Override
  public Redirect followRedirects() {
    return Redirect.NEVER;
  }

  @Override
  public Optional<ProxySelector> proxy() {
    return Optional.empty();
  }

  @Override
  public SSLContext sslContext() {
    throw new UnsupportedOperationException();
  }

  @Override
  public SSLParameters sslParameters() {
    throw new UnsupportedOperationException();
  }

  @Override
  public Optional<Authenticator> authenticator() {
    return Optional.empty();
  }

  @Override
  public Version version() {
    return Version.HTTP_1_1;
  }

  @Override
  public Optional<Executor> executor() {
    return Optional.empty();
  }

  public static HttpResponse<InputStream> response(
      HttpRequest request, int statusCode, String body) {
    return response(request, statusCode, Map.of(), body);
  }

  public static HttpResponse<InputStream> response(
      HttpRequest request, int statusCode, Map<String, String> headers, String body) {
    var builder = ResponseBuilder.create().statusCode(statusCode).request(request);
    headers.forEach(builder::header);
    return builder.<InputStream>body(new TrackedInputStream(body.getBytes(UTF_8))).build();
  }

  /** Produces the response to a request. */
  @FunctionalInterface
  public interface Responder {
    HttpResponse<InputStream> respond(HttpRequest request) throws IOException;
  }
}
