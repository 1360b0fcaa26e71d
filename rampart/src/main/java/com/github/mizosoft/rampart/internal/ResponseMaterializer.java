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

import com.github.mizosoft.rampart.ResponseBuilder;
import java.io.IOException;
import java.io.InputStream;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;

/** Reads a call's final response body into memory. */
public final class ResponseMaterializer {
  private ResponseMaterializer() {}

  /**
   * Reads the response's body fully and returns a copy of the response with the read bytes as its
   * body. The response's stream is closed whether reading succeeds or not.
   */
  public static HttpResponse<byte[]> materialize(HttpResponse<InputStream> response)
      throws IOException {
    byte[] body;
    var stream = response.body();
    if (stream == null) {
      body = new byte[0];
    } else {
      try (stream) {
        body = stream.readAllBytes();
      } catch (IOException e) {
        throw unwrapTimeout(e);
      }
    }
    return ResponseBuilder.newBuilder(response).body(body).build();
  }

  /**
   * The JDK's body stream wraps the error it's failed with, so a body that times out is rethrown as
   * an {@code HttpTimeoutException}.
   */
  private static IOException unwrapTimeout(IOException exception) {
    for (Throwable cause = exception.getCause(); cause != null; cause = cause.getCause()) {
      if (cause instanceof HttpTimeoutException) {
        var timeoutException = new HttpTimeoutException(cause.getMessage());
        timeoutException.initCause(exception);
        return timeoutException;
      }
    }
    return exception;
  }
}
