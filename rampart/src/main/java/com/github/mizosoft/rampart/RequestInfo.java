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

/** The method and path of a call, as seen by hooks and auth token providers. */
public final class RequestInfo {
  private final String method;
  private final String path;

  private RequestInfo(String method, String path) {
    this.method = requireNonNull(method);
    this.path = requireNonNull(path);
  }

  public String method() {
    return method;
  }

  /** Returns the request's path, excluding the query. */
  public String path() {
    return path;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof RequestInfo)) {
      return false;
    }
    var other = (RequestInfo) obj;
    return method.equals(other.method) && path.equals(other.path);
  }

  @Override
  public int hashCode() {
    return 31 * method.hashCode() + path.hashCode();
  }

  @Override
  public String toString() {
    return method + " " + path;
  }

  public static RequestInfo of(String method, String path) {
    return new RequestInfo(method, path);
  }
}
