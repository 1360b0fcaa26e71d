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

package com.github.mizosoft.rampart.internal;

import com.github.mizosoft.rampart.HttpCallException;
import com.github.mizosoft.rampart.HttpStatus;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Optional;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Decides whether a call failed, and describes the failure as an {@link HttpCallException}. */
public final class ErrorClassifier {
  private ErrorClassifier() {}

  /**
   * Classifies the outcome of a call. A call fails if it completed with an exception or with a
   * response having an error status code.
   *
   * @param statusCode the status code of the response that was received but couldn't be read, or
   *     {@code 0} if none
   */
  public static Optional<HttpCallException> classify(
      HttpRequest request,
      @Nullable HttpResponse<byte[]> response,
      @Nullable Throwable exception,
      int statusCode,
      int attempts) {
    if (exception != null) {
      return Optional.of(
          exception instanceof HttpCallException
              ? (HttpCallException) exception
              : HttpCallException.forFailure(
                  exception, statusCode, attempts, request.method(), request.uri()));
    }
    if (response != null && HttpStatus.isError(response.statusCode())) {
      return Optional.of(HttpCallException.forResponse(response, attempts));
    }
    return Optional.empty();
  }

  /** Converts an exception thrown in place of the given failure to an {@code HttpCallException}. */
  public static HttpCallException normalize(Throwable exception, HttpCallException failure) {
    return exception instanceof HttpCallException
        ? (HttpCallException) exception
        : HttpCallException.forFailure(
            exception, failure.attempts(), failure.method(), failure.uri());
  }
}
