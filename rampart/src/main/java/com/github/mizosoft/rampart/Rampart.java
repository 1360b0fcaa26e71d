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
import static java.util.Objects.requireNonNull;

import com.github.mizosoft.rampart.internal.ErrorClassifier;
import com.github.mizosoft.rampart.internal.HooksDispatcher;
import com.github.mizosoft.rampart.internal.PolicyResolver;
import com.github.mizosoft.rampart.internal.ResponseMaterializer;
import com.github.mizosoft.rampart.internal.Retrier;
import com.github.mizosoft.rampart.internal.Utils;
import com.github.mizosoft.rampart.internal.concurrent.Delayer;
import com.github.mizosoft.rampart.internal.extensions.DeadlineBodySubscriber;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.io.IOException;
import java.io.InputStream;
import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.invoke.MethodType;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublisher;
import java.net.http.HttpRequest.BodyPublishers;
import java.net.http.HttpResponse;
import java.net.http.HttpResponse.BodyHandlers;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * An HTTP client that makes calls governed by per-endpoint {@link EndpointPolicy policies}, and
 * that routes each attempt through an ordered chain of {@link Interceptor interceptors} before
 * sending it over a {@link HttpClient}.
 *
 * <p>A call proceeds as follows. The call's policy is resolved from the client's {@link
 * EndpointPolicies}, merged over the client's default policy. The policy's headers and auth token
 * are applied to the request. The request is then attempted, and possibly retried as decided by
 * the policy, with each attempt passing through the interceptors in registration order (the first
 * registered interceptor is the outermost). The final response's body is read into memory, and the
 * call fails with an {@link HttpCallException} if no response was received or its status code is
 * 400 or above, unless the policy's {@link Fallback} replaces the failure. {@link Hooks} are
 * notified around the whole call.
 *
 * <p>All attempts of a call run on the caller's thread, and are bounded by the call's deadline,
 * which is the earlier of the {@link CallerContext caller's deadline} and the end of the policy's
 * timeout. Interrupting the calling thread aborts the call.
 *
 * <p>A {@code Rampart} instance is immutable and safe for concurrent use.
 */
public final class Rampart implements AutoCloseable {
  private static final Logger logger = System.getLogger(Rampart.class.getName());

  private static final @Nullable MethodHandle SHUTDOWN; // Since Java 21.

  static {
    MethodHandle shutdown;
    try {
      shutdown =
          MethodHandles.lookup()
              .findVirtual(HttpClient.class, "shutdown", MethodType.methodType(void.class));
    } catch (NoSuchMethodException e) {
      shutdown = null;
    } catch (IllegalAccessException e) {
      throw new IllegalStateException(e);
    }
    SHUTDOWN = shutdown;
  }

  /** The default policy of clients that don't specify one. */
  private static final EndpointPolicy DEFAULT_POLICY =
      EndpointPolicy.newBuilder().timeout(Duration.ofSeconds(30)).maxRetries(3).build();

  private final HttpClient backend;
  private final @Nullable URI baseUri;
  private final PolicyResolver policyResolver;
  private final List<Interceptor> interceptors;
  private final HooksDispatcher hooksDispatcher;
  private final Retrier retrier;
  private final Clock clock;

  private Rampart(Builder builder) {
    backend = builder.backend != null ? builder.backend : HttpClient.newHttpClient();
    baseUri = builder.baseUri;
    policyResolver = new PolicyResolver(builder.defaultPolicy, builder.endpointPolicies);
    interceptors = Collections.unmodifiableList(new ArrayList<>(builder.interceptors));
    hooksDispatcher = new HooksDispatcher(builder.hooks);
    clock = builder.clock;
    retrier = new Retrier(builder.clock, builder.delayer);
  }

  /** Returns the {@code HttpClient} calls are sent over. */
  public HttpClient underlyingClient() {
    return backend;
  }

  public Optional<URI> baseUri() {
    return Optional.ofNullable(baseUri);
  }

  public EndpointPolicy defaultPolicy() {
    return policyResolver.defaultPolicy();
  }

  /** Returns this client's interceptors, outermost first. */
  public List<Interceptor> interceptors() {
    return interceptors;
  }

  public HttpResponse<byte[]> get(String path) throws HttpCallException {
    return get(path, Map.of());
  }

  public HttpResponse<byte[]> get(String path, Map<String, String> headers)
      throws HttpCallException {
    return get(path, headers, CallerContext.empty());
  }

  public HttpResponse<byte[]> get(
      String path, Map<String, String> headers, CallerContext callerContext)
      throws HttpCallException {
    return call("GET", path, BodyPublishers.noBody(), headers, callerContext);
  }

  public HttpResponse<byte[]> head(String path) throws HttpCallException {
    return head(path, Map.of());
  }

  public HttpResponse<byte[]> head(String path, Map<String, String> headers)
      throws HttpCallException {
    return head(path, headers, CallerContext.empty());
  }

  public HttpResponse<byte[]> head(
      String path, Map<String, String> headers, CallerContext callerContext)
      throws HttpCallException {
    return call("HEAD", path, BodyPublishers.noBody(), headers, callerContext);
  }

  public HttpResponse<byte[]> delete(String path) throws HttpCallException {
    return delete(path, Map.of());
  }

  public HttpResponse<byte[]> delete(String path, Map<String, String> headers)
      throws HttpCallException {
    return delete(path, headers, CallerContext.empty());
  }

  public HttpResponse<byte[]> delete(
      String path, Map<String, String> headers, CallerContext callerContext)
      throws HttpCallException {
    return call("DELETE", path, BodyPublishers.noBody(), headers, callerContext);
  }

  public HttpResponse<byte[]> post(String path, byte[] body) throws HttpCallException {
    return post(path, body, Map.of());
  }

  public HttpResponse<byte[]> post(String path, byte[] body, Map<String, String> headers)
      throws HttpCallException {
    return post(path, body, headers, CallerContext.empty());
  }

  public HttpResponse<byte[]> post(
      String path, byte[] body, Map<String, String> headers, CallerContext callerContext)
      throws HttpCallException {
    return call("POST", path, BodyPublishers.ofByteArray(body), headers, callerContext);
  }

  public HttpResponse<byte[]> put(String path, byte[] body) throws HttpCallException {
    return put(path, body, Map.of());
  }

  public HttpResponse<byte[]> put(String path, byte[] body, Map<String, String> headers)
      throws HttpCallException {
    return put(path, body, headers, CallerContext.empty());
  }

  public HttpResponse<byte[]> put(
      String path, byte[] body, Map<String, String> headers, CallerContext callerContext)
      throws HttpCallException {
    return call("PUT", path, BodyPublishers.ofByteArray(body), headers, callerContext);
  }

  public HttpResponse<byte[]> patch(String path, byte[] body) throws HttpCallException {
    return patch(path, body, Map.of());
  }

  public HttpResponse<byte[]> patch(String path, byte[] body, Map<String, String> headers)
      throws HttpCallException {
    return patch(path, body, headers, CallerContext.empty());
  }

  public HttpResponse<byte[]> patch(
      String path, byte[] body, Map<String, String> headers, CallerContext callerContext)
      throws HttpCallException {
    return call("PATCH", path, BodyPublishers.ofByteArray(body), headers, callerContext);
  }

  /** Sends the given request. A relative URI is resolved against the client's base URI. */
  public HttpResponse<byte[]> send(HttpRequest request) throws HttpCallException {
    return send(request, CallerContext.empty());
  }

  /** Sends the given request on behalf of the given caller. */
  public HttpResponse<byte[]> send(HttpRequest request, CallerContext callerContext)
      throws HttpCallException {
    requireNonNull(request);
    requireNonNull(callerContext);
    var resolvedRequest = MutableRequest.copyOf(request).uri(resolveUri(request.uri()));
    var requestInfo = RequestInfo.of(resolvedRequest.method(), Utils.pathOf(resolvedRequest.uri()));
    hooksDispatcher.preRequest(requestInfo);
    HttpResponse<byte[]> response;
    try {
      response = execute(resolvedRequest, requestInfo, callerContext);
    } catch (HttpCallException e) {
      e.response().ifPresent(r -> hooksDispatcher.postRequest(requestInfo, r.statusCode()));
      hooksDispatcher.error(requestInfo, e);
      throw e;
    }
    hooksDispatcher.postRequest(requestInfo, response.statusCode());
    return response;
  }

  private HttpResponse<byte[]> call(
      String method,
      String path,
      BodyPublisher bodyPublisher,
      Map<String, String> headers,
      CallerContext callerContext)
      throws HttpCallException {
    var request = MutableRequest.create().uri(resolveUri(path)).method(method, bodyPublisher);
    headers.forEach(request::setHeader);
    return send(request, callerContext);
  }

  private HttpResponse<byte[]> execute(
      MutableRequest request, RequestInfo requestInfo, CallerContext callerContext)
      throws HttpCallException {
    var policy = policyResolver.resolve(requestInfo.method(), requestInfo.path());
    var context = CallContext.start(requestInfo, policy, callerContext, clock);
    applyPolicy(request, context);

    var outcome =
        retrier.run(
            request,
            policy,
            context.deadline(),
            attemptRequest ->
                new InterceptorChain(backend, interceptors, context).forward(attemptRequest));

    HttpResponse<byte[]> response = null;
    Throwable exception = outcome.exception();
    int unreadStatusCode = 0;
    var networkResponse = outcome.response();
    if (networkResponse != null) {
      try {
        response = ResponseMaterializer.materialize(networkResponse);
      } catch (IOException e) {
        exception = e;
        unreadStatusCode = networkResponse.statusCode();
      }
    }

    var failure =
        ErrorClassifier.classify(
            request, response, exception, unreadStatusCode, outcome.attempts());
    if (failure.isEmpty()) {
      return requireNonNull(response);
    }

    var fallback = policy.fallback();
    if (fallback.isEmpty()) {
      throw failure.get();
    }
    return applyFallback(fallback.get(), request, failure.get());
  }

  private void applyPolicy(MutableRequest request, CallContext context) {
    var policy = context.policy();
    policy.headers().forEach(request::setHeaderIfAbsent);

    var authTokenProvider = policy.authTokenProvider();
    if (authTokenProvider.isPresent()) {
      try {
        authTokenProvider
            .get()
            .token(context.requestInfo())
            .ifPresent(token -> request.setHeader("Authorization", "Bearer " + token));
      } catch (IOException | RuntimeException e) {
        logger.log(
            Level.WARNING,
            () -> "Couldn't get auth token for " + context.requestInfo() + ", proceeding without",
            e);
      }
    }
  }

  private static HttpResponse<byte[]> applyFallback(
      Fallback fallback, HttpRequest request, HttpCallException failure) throws HttpCallException {
    HttpResponse<byte[]> fallbackResponse;
    try {
      fallbackResponse = fallback.apply(request, failure);
    } catch (IOException | RuntimeException e) {
      throw ErrorClassifier.normalize(e, failure);
    }
    if (fallbackResponse == null) {
      throw failure;
    }
    return fallbackResponse;
  }

  private URI resolveUri(String path) {
    requireNonNull(path);
    var uri = URI.create(path);
    if (uri.isAbsolute() || baseUri == null) {
      requireArgument(uri.isAbsolute(), "Relative URI without a base URI: %s", path);
      return uri;
    }
    var base = baseUri.toString();
    if (base.endsWith("/")) {
      base = base.substring(0, base.length() - 1);
    }
    return URI.create(path.startsWith("/") ? base + path : base + "/" + path);
  }

  private URI resolveUri(URI uri) {
    return uri.isAbsolute() ? uri : resolveUri(uri.toString());
  }

  /**
   * Releases the resources held by the underlying {@code HttpClient}, including idle connections.
   * This has no effect if the running JDK doesn't support shutting down an {@code HttpClient}
   * (prior to Java 21), in which case resources are released when the client is garbage collected.
   */
  public void shutdown() {
    if (SHUTDOWN == null) {
      logger.log(Level.DEBUG, "HttpClient::shutdown isn't supported by the running JDK");
      return;
    }
    try {
      SHUTDOWN.invokeExact(backend);
    } catch (RuntimeException | Error e) {
      throw e;
    } catch (Throwable e) {
      throw new IllegalStateException(e);
    }
  }

  /** Equivalent to {@link #shutdown()}. */
  @Override
  public void close() {
    shutdown();
  }

  @Override
  public String toString() {
    return "Rampart[baseUri="
        + baseUri
        + ", defaultPolicy="
        + policyResolver.defaultPolicy()
        + ", interceptors="
        + interceptors
        + "]";
  }

  /** Returns a new {@code Rampart.Builder} that creates its own {@code HttpClient}. */
  public static Builder newBuilder() {
    return new Builder(null);
  }

  /** Returns a new {@code Rampart.Builder} that sends calls over the given {@code HttpClient}. */
  public static Builder newBuilder(HttpClient backend) {
    return new Builder(requireNonNull(backend));
  }

  /** Returns a new {@code Rampart} with default settings. */
  public static Rampart create() {
    return newBuilder().build();
  }

  /**
   * An object that intercepts the attempts of calls made through a {@code Rampart} client.
   * Interceptors see a response whose body is an unread stream. An interceptor that reads the body
   * must return a response with a fresh stream over what it read.
   *
   * <p>Interceptors are shared by all calls made through a client, and must be safe for concurrent
   * use.
   */
  @FunctionalInterface
  public interface Interceptor {

    /**
     * Intercepts the given request and returns the resulting response, usually by forwarding to
     * the given chain.
     */
    HttpResponse<InputStream> intercept(HttpRequest request, Chain chain)
        throws IOException, InterruptedException;

    /** Returns an interceptor that forwards the request after applying the given operator. */
    static Interceptor create(Function<HttpRequest, HttpRequest> operator) {
      requireNonNull(operator);
      return (request, chain) -> chain.forward(operator.apply(request));
    }
  }

  /**
   * An object that gives interceptors the ability to relay requests to inner interceptors, till
   * eventually being sent over the client's {@code HttpClient}.
   */
  public interface Chain {

    /** Returns the context of the call the intercepted attempt belongs to. */
    CallContext context();

    /** Forwards the request to the next interceptor, or to the client if there are none. */
    HttpResponse<InputStream> forward(HttpRequest request)
        throws IOException, InterruptedException;
  }

  /** A builder of {@code Rampart} instances. */
  public static final class Builder {
    private final @Nullable HttpClient backend;
    private final List<Interceptor> interceptors = new ArrayList<>();
    private @Nullable URI baseUri;
    private EndpointPolicy defaultPolicy = DEFAULT_POLICY;
    private EndpointPolicies endpointPolicies = EndpointPolicies.none();
    private Hooks hooks = Hooks.none();
    private Clock clock = Utils.systemMillisUtc();
    private Delayer delayer = Delayer.systemDelayer();

    Builder(@Nullable HttpClient backend) {
      this.backend = backend;
    }

    /** Sets the URI against which request paths are resolved. */
    @CanIgnoreReturnValue
    public Builder baseUri(String baseUri) {
      return baseUri(URI.create(baseUri));
    }

    @CanIgnoreReturnValue
    public Builder baseUri(URI baseUri) {
      requireArgument(baseUri.isAbsolute(), "base URI must be absolute: %s", baseUri);
      this.baseUri = baseUri;
      return this;
    }

    /**
     * Sets the policy applied to calls whose endpoint has no specific policy, and over which
     * endpoint-specific policies are merged. Unless set, calls have a 30 second timeout and are
     * retried up to 3 times.
     */
    @CanIgnoreReturnValue
    public Builder defaultPolicy(EndpointPolicy defaultPolicy) {
      this.defaultPolicy = requireNonNull(defaultPolicy);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder endpointPolicies(EndpointPolicies endpointPolicies) {
      this.endpointPolicies = requireNonNull(endpointPolicies);
      return this;
    }

    /**
     * Adds an interceptor. Interceptors are invoked in the order they're added, so the first added
     * interceptor sees the request first and the response last.
     */
    @CanIgnoreReturnValue
    public Builder interceptor(Interceptor interceptor) {
      interceptors.add(requireNonNull(interceptor));
      return this;
    }

    @CanIgnoreReturnValue
    public Builder hooks(Hooks hooks) {
      this.hooks = requireNonNull(hooks);
      return this;
    }

    @CanIgnoreReturnValue
    Builder clock(Clock clock) {
      this.clock = requireNonNull(clock);
      return this;
    }

    @CanIgnoreReturnValue
    Builder delayer(Delayer delayer) {
      this.delayer = requireNonNull(delayer);
      return this;
    }

    public Rampart build() {
      return new Rampart(this);
    }
  }

  private static final class InterceptorChain implements Chain {
    private final HttpClient backend;
    private final List<Interceptor> interceptors;
    private final CallContext context;
    private final int currentInterceptorIndex;

    InterceptorChain(HttpClient backend, List<Interceptor> interceptors, CallContext context) {
      this(backend, interceptors, context, 0);
    }

    private InterceptorChain(
        HttpClient backend,
        List<Interceptor> interceptors,
        CallContext context,
        int currentInterceptorIndex) {
      this.backend = requireNonNull(backend);
      this.interceptors = requireNonNull(interceptors);
      this.context = requireNonNull(context);
      this.currentInterceptorIndex = currentInterceptorIndex;
    }

    @Override
    public CallContext context() {
      return context;
    }

    @Override
    public HttpResponse<InputStream> forward(HttpRequest request)
        throws IOException, InterruptedException {
      requireNonNull(request);
      if (currentInterceptorIndex >= interceptors.size()) {
        // The request's timeout stops counting once headers arrive, so the body is bounded too.
        return backend.send(
            request,
            DeadlineBodySubscriber.withDeadline(BodyHandlers.ofInputStream(), context::remaining));
      }
      return interceptors
          .get(currentInterceptorIndex)
          .intercept(
              request,
              new InterceptorChain(backend, interceptors, context, currentInterceptorIndex + 1));
    }
  }
}
