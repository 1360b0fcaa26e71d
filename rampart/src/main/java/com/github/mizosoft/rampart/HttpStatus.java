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

import java.net.http.HttpResponse;

/** Static functions for checking response status codes. */
public class HttpStatus {
  private HttpStatus() {}

  /** Returns {@code true} if {@code statusCode} is a 2xx success status code. */
  public static boolean isSuccessful(int statusCode) {
    return statusCode >= 200 && statusCode <= 299;
  }

  /** Returns {@code true} if {@code statusCode} is a 4xx client error status code. */
  public static boolean isClientError(int statusCode) {
    return statusCode >= 400 && statusCode <= 499;
  }

  /** Returns {@code true} if {@code statusCode} is a server error status code (500 or above). */
  public static boolean isServerError(int statusCode) {
    return statusCode >= 500;
  }

  /** Returns {@code true} if {@code response.statusCode()} is a server error status code. */
  public static boolean isServerError(HttpResponse<?> response) {
    return isServerError(response.statusCode());
  }

  /**
   * Returns {@code true} if {@code statusCode} denotes a failed call, which is either a client or a
   * server error.
   */
  public static boolean isError(int statusCode) {
    return statusCode >= 400;
  }
}
