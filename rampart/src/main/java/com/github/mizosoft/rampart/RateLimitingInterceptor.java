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

/**
 * An interceptor that acquires a permit from the policy's {@link RateLimiter} before forwarding.
 * The limiter isn't waited on beyond the call's deadline, and a call that can't get a permit in
 * time fails with {@link RateLimitExceededException} without reaching the transport.
 */
public final class RateLimitingInterceptor implements Rampart.Interceptor {
  public RateLimitingInterceptor() {}

  @Override
  public HttpResponse<InputStream> intercept(HttpRequest request, Rampart.Chain chain)
      throws IOException, InterruptedException {
    var context = chain.context();
    var rateLimiter = context.policy().rateLimiter();
    if (rateLimiter.isPresent()) {
      var remaining = context.remaining();
      if (remaining.isNegative() || remaining.isZero()) {
        throw new RateLimitExceededException(
            "deadline reached before acquiring a permit for " + context.requestInfo());
      }
      rateLimiter.get().acquire(remaining);
    }
    return chain.forward(request);
  }
}
