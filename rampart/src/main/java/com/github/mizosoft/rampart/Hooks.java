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

/**
 * Callbacks invoked around each call made through a {@link Rampart} client. Exceptions thrown by
 * hooks are logged and otherwise ignored.
 */
public interface Hooks {

  /** Called before the call's first attempt. */
  default void onPreRequest(RequestInfo requestInfo) {}

  /** Called when the call completes with a response, whether successful or not. */
  default void onPostRequest(RequestInfo requestInfo, int statusCode) {}

  /** Called when the call fails. */
  default void onError(RequestInfo requestInfo, HttpCallException exception) {}

  /** Returns a {@code Hooks} that does nothing. */
  static Hooks none() {
    return NoopHooks.INSTANCE;
  }

  enum NoopHooks implements Hooks {
    INSTANCE
  }
}
