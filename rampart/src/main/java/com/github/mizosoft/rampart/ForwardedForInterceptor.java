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
import java.util.ArrayList;
import java.util.List;

/**
 * An interceptor that appends the caller's {@link CallerContext#remoteAddress() remote address}
 * to the {@code X-Forwarded-For} header. The address is stripped from its port, and isn't appended
 * if the header already lists it.
 */
public final class ForwardedForInterceptor implements Rampart.Interceptor {
  public static final String HEADER_NAME = "X-Forwarded-For";

  public ForwardedForInterceptor() {}

  @Override
  public HttpResponse<InputStream> intercept(HttpRequest request, Rampart.Chain chain)
      throws IOException, InterruptedException {
    var address =
        chain
            .context()
            .caller()
            .remoteAddress()
            .map(ForwardedForInterceptor::stripPort)
            .filter(host -> !host.isEmpty());
    if (address.isEmpty()) {
      return chain.forward(request);
    }

    var forwardedFor = forwardedFor(request);
    if (forwardedFor.contains(address.get())) {
      return chain.forward(request);
    }
    forwardedFor.add(address.get());
    return chain.forward(
        MutableRequest.copyOf(request).setHeader(HEADER_NAME, String.join(", ", forwardedFor)));
  }

  /** Strips the port from an address of the form {@code host:port} or {@code [ipv6]:port}. */
  static String stripPort(String address) {
    var trimmed = address.trim();
    if (trimmed.startsWith("[")) {
      int closingBracket = trimmed.indexOf(']');
      return closingBracket > 0 ? trimmed.substring(1, closingBracket) : trimmed;
    }
    int colon = trimmed.indexOf(':');
    if (colon >= 0 && colon == trimmed.lastIndexOf(':')) {
      return trimmed.substring(0, colon);
    }
    return trimmed; // Either no port or an unbracketed IPv6 address.
  }

  /** Returns the addresses listed in the given request's {@code X-Forwarded-For} header. */
  static List<String> forwardedFor(HttpRequest request) {
    var addresses = new ArrayList<String>();
    request
        .headers()
        .allValues(HEADER_NAME)
        .forEach(
            value -> {
              for (var element : value.split(",")) {
                if (!element.isBlank()) {
                  addresses.add(element.trim());
                }
              }
            });
    return addresses;
  }
}
