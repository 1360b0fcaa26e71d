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

import java.io.IOException;
import java.io.InputStream;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * An interceptor that identifies the calling application with a static token, sent as the {@code
 * X-Auth-App-Token} header. The interceptor does nothing if there's no token.
 */
public final class AppTokenInterceptor implements Rampart.Interceptor {
  public static final String HEADER_NAME = "X-Auth-App-Token";
  public static final String ENVIRONMENT_VARIABLE = "X_AUTH_APP_TOKEN";

  private final @Nullable String token;

  public AppTokenInterceptor(@Nullable String token) {
    this.token = token != null && !token.isBlank() ? token : null;
  }

  @Override
  public HttpResponse<InputStream> intercept(HttpRequest request, Rampart.Chain chain)
      throws IOException, InterruptedException {
    var token = this.token;
    return chain.forward(
        token != null ? MutableRequest.copyOf(request).setHeader(HEADER_NAME, token) : request);
  }

  /** Returns whether this interceptor has a token to send. */
  public boolean hasToken() {
    return token != null;
  }

  /** Returns an interceptor that reads its token from {@code X_AUTH_APP_TOKEN}. */
  public static AppTokenInterceptor fromEnvironment() {
    return new AppTokenInterceptor(System.getenv(ENVIRONMENT_VARIABLE));
  }
}
