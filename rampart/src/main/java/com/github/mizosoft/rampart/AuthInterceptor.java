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
import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;

/**
 * An interceptor that propagates the caller's {@link CallerContext#authorization() credential} as
 * the {@code Authorization} header of calls to endpoints whose policy {@link
 * EndpointPolicy#requiresAuth() requires authentication}. Calls proceed without the header if the
 * caller has no credential, leaving enforcement to the server.
 */
public final class AuthInterceptor implements Rampart.Interceptor {
  private static final Logger logger = System.getLogger(AuthInterceptor.class.getName());

  public static final String HEADER_NAME = "Authorization";

  public AuthInterceptor() {}

  @Override
  public HttpResponse<InputStream> intercept(HttpRequest request, Rampart.Chain chain)
      throws IOException, InterruptedException {
    var context = chain.context();
    if (!context.policy().requiresAuth()) {
      return chain.forward(request);
    }

    var credential = context.caller().authorization().filter(value -> !value.isBlank());
    if (credential.isEmpty()) {
      logger.log(
          Level.DEBUG,
          () -> "No credential to propagate to " + context.requestInfo() + ", proceeding without");
      return chain.forward(request);
    }
    return chain.forward(MutableRequest.copyOf(request).setHeader(HEADER_NAME, credential.get()));
  }
}
