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

import static java.util.Objects.requireNonNull;

import java.io.IOException;
import java.io.InputStream;
import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;

/**
 * An interceptor that notifies a {@link Listener} around each attempt that passes through it.
 * Unlike {@link Hooks}, which see a call once as a whole, a listener sees every attempt,
 * including ones that are later retried, along with the request as modified by preceding
 * interceptors. Exceptions thrown by the listener are logged and otherwise ignored.
 */
public final class HooksInterceptor implements Rampart.Interceptor {
  private static final Logger logger = System.getLogger(HooksInterceptor.class.getName());

  private final Listener listener;

  public HooksInterceptor(Listener listener) {
    this.listener = requireNonNull(listener);
  }

  @Override
  public HttpResponse<InputStream> intercept(HttpRequest request, Rampart.Chain chain)
      throws IOException, InterruptedException {
    try {
      listener.onPreRequest(request);
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Exception thrown by listener's onPreRequest", e);
    }

    HttpResponse<InputStream> response;
    try {
      response = chain.forward(request);
    } catch (IOException | InterruptedException | RuntimeException e) {
      try {
        listener.onError(request, e);
      } catch (RuntimeException listenerException) {
        logger.log(Level.WARNING, "Exception thrown by listener's onError", listenerException);
      }
      throw e;
    }

    try {
      listener.onPostRequest(request, response);
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Exception thrown by listener's onPostRequest", e);
    }
    return response;
  }

  @Override
  public String toString() {
    return "HooksInterceptor[" + listener + "]";
  }

  /** Callbacks invoked around each attempt. */
  public interface Listener {

    /** Called before the attempt is forwarded. */
    default void onPreRequest(HttpRequest request) {}

    /**
     * Called when the attempt completes with a response. The response's body is still to be read
     * downstream and mustn't be consumed here.
     */
    default void onPostRequest(HttpRequest request, HttpResponse<?> response) {}

    /** Called when the attempt fails with an exception. */
    default void onError(HttpRequest request, Throwable exception) {}
  }
}
