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

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpResponse;
import java.util.Optional;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Signals a failed call. A call fails if no response could be received, or if the final response
 * has a status code of 400 or above. The exception carries enough context to log or branch on:
 * the status code ({@code 0} if no response was received), the number of attempts made, the
 * request's method and URI, and the final response's body.
 */
public final class HttpCallException extends IOException {
  private static final long serialVersionUID = 1L;

  private static final int MAX_BODY_PREVIEW_LENGTH = 512;

  private final int statusCode;
  private final int attempts;
  private final String method;
  private final URI uri;
  private final byte[] body;
  private final transient @Nullable HttpResponse<byte[]> response;

  private HttpCallException(
      int statusCode,
      @Nullable Throwable cause,
      int attempts,
      String method,
      URI uri,
      byte[] body,
      @Nullable HttpResponse<byte[]> response) {
    super(formatMessage(statusCode, cause, method, uri, body), cause);
    this.statusCode = statusCode;
    this.attempts = attempts;
    this.method = requireNonNull(method);
    this.uri = requireNonNull(uri);
    this.body = body.clone();
    this.response = response;
  }

  /** Returns the final response's status code, or {@code 0} if no response was received. */
  public int statusCode() {
    return statusCode;
  }

  /** Returns the number of attempts made. */
  public int attempts() {
    return attempts;
  }

  public String method() {
    return method;
  }

  public URI uri() {
    return uri;
  }

  /** Returns the final response's body, or an empty array if no response was received. */
  public byte[] body() {
    return body.clone();
  }

  /** Returns the final response, if one was received. */
  public Optional<HttpResponse<byte[]>> response() {
    return Optional.ofNullable(response);
  }

  /** Creates an exception for a call that failed with a response. */
  public static HttpCallException forResponse(HttpResponse<byte[]> response, int attempts) {
    var request = response.request();
    var body = response.body() != null ? response.body() : new byte[0];
    return new HttpCallException(
        response.statusCode(), null, attempts, request.method(), request.uri(), body, response);
  }

  /** Creates an exception for a call that failed without receiving a usable response. */
  public static HttpCallException forFailure(
      Throwable cause, int attempts, String method, URI uri) {
    return forFailure(cause, 0, attempts, method, uri);
  }

  /**
   * Creates an exception for a call that failed with the given cause, where {@code statusCode} is
   * the status of the response, if any, whose processing caused the failure.
   */
  public static HttpCallException forFailure(
      Throwable cause, int statusCode, int attempts, String method, URI uri) {
    requireNonNull(cause);
    return new HttpCallException(statusCode, cause, attempts, method, uri, new byte[0], null);
  }

  private static String formatMessage(
      int statusCode, @Nullable Throwable cause, String method, URI uri, byte[] body) {
    var message =
        new StringBuilder("[HTTP] ")
            .append(method)
            .append(' ')
            .append(uri)
            .append(": status=")
            .append(statusCode)
            .append(", err=")
            .append(cause != null ? cause : "none");
    if (body.length > 0) {
      var bodyString = new String(body, UTF_8);
      message
          .append(", body=")
          .append(
              bodyString.length() > MAX_BODY_PREVIEW_LENGTH
                  ? bodyString.substring(0, MAX_BODY_PREVIEW_LENGTH) + "..."
                  : bodyString);
    }
    return message.toString();
  }
}
