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

import com.github.mizosoft.rampart.internal.io.LimitedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;

/**
 * An interceptor that bounds the size of response bodies. The limit is the policy's {@link
 * EndpointPolicy#maxResponseSize()} if set, or this interceptor's default limit otherwise. Reading
 * a body past its limit fails with {@link ResponseTooLargeException}.
 */
public final class MaxResponseSizeInterceptor implements Rampart.Interceptor {
  private static final long UNLIMITED = -1;

  private final long defaultMaxSize;

  /** Creates an interceptor that only limits responses of endpoints whose policy sets a limit. */
  public MaxResponseSizeInterceptor() {
    this.defaultMaxSize = UNLIMITED;
  }

  /** Creates an interceptor with the given default limit in bytes. */
  public MaxResponseSizeInterceptor(long defaultMaxSize) {
    requireArgument(defaultMaxSize >= 0, "negative defaultMaxSize: %d", defaultMaxSize);
    this.defaultMaxSize = defaultMaxSize;
  }

  @Override
  public HttpResponse<InputStream> intercept(HttpRequest request, Rampart.Chain chain)
      throws IOException, InterruptedException {
    long maxSize = chain.context().policy().maxResponseSize().orElse(defaultMaxSize);
    var response = chain.forward(request);
    if (maxSize == UNLIMITED || response.body() == null) {
      return response;
    }
    return ResponseBuilder.newBuilder(response)
        .<InputStream>body(new LimitedInputStream(response.body(), maxSize))
        .build();
  }
}
