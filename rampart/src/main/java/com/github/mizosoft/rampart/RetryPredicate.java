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
import java.net.http.HttpResponse;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Decides whether an attempt's outcome warrants another attempt. Exactly one of {@code response}
 * and {@code exception} is non-null.
 */
@FunctionalInterface
public interface RetryPredicate {
  boolean shouldRetry(@Nullable HttpResponse<?> response, @Nullable Throwable exception);

  /**
   * Returns a predicate that retries on transport failures (any {@code IOException}) and on server
   * error responses. Calls rejected before reaching the transport (an open breaker or a rate limit
   * that couldn't be satisfied in time) and responses exceeding their size limit aren't retried.
   */
  static RetryPredicate onFailureOrServerError() {
    return (response, exception) ->
        exception != null
            ? exception instanceof IOException
                && !(exception instanceof CallRejectedException)
                && !(exception instanceof ResponseTooLargeException)
            : response != null && HttpStatus.isServerError(response);
  }
}
