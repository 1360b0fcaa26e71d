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
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.function.Function;

/**
 * An interceptor that tags requests with an identifier, unless they already have one. By default,
 * the identifier is the call's {@link CallContext#callId() id}, so all attempts of a call carry the
 * same identifier.
 */
public final class RequestIdInterceptor implements Rampart.Interceptor {
  public static final String DEFAULT_HEADER_NAME = "X-Request-ID";

  private final String headerName;
  private final Function<CallContext, String> idGenerator;

  public RequestIdInterceptor() {
    this(DEFAULT_HEADER_NAME, CallContext::callId);
  }

  public RequestIdInterceptor(String headerName, Function<CallContext, String> idGenerator) {
    this.headerName = requireNonNull(headerName);
    this.idGenerator = requireNonNull(idGenerator);
  }

  @Override
  public HttpResponse<InputStream> intercept(HttpRequest request, Rampart.Chain chain)
      throws IOException, InterruptedException {
    if (request.headers().firstValue(headerName).isPresent()) {
      return chain.forward(request);
    }
    return chain.forward(
        MutableRequest.copyOf(request).setHeader(headerName, idGenerator.apply(chain.context())));
  }

  @Override
  public String toString() {
    return "RequestIdInterceptor[" + headerName + "]";
  }
}
