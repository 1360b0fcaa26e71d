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

import static java.util.Objects.requireNonNull;

import com.github.mizosoft.rampart.Hooks;
import com.github.mizosoft.rampart.HttpCallException;
import com.github.mizosoft.rampart.RequestInfo;
import java.lang.System.Logger;
import java.lang.System.Logger.Level;

/** Invokes {@link Hooks} such that a failing hook never fails the call. */
public final class HooksDispatcher {
  private static final Logger logger = System.getLogger(HooksDispatcher.class.getName());

  private final Hooks hooks;

  public HooksDispatcher(Hooks hooks) {
    this.hooks = requireNonNull(hooks);
  }

  public void preRequest(RequestInfo requestInfo) {
    try {
      hooks.onPreRequest(requestInfo);
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Exception thrown by pre-request hook", e);
    }
  }

  public void postRequest(RequestInfo requestInfo, int statusCode) {
    try {
      hooks.onPostRequest(requestInfo, statusCode);
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Exception thrown by post-request hook", e);
    }
  }

  public void error(RequestInfo requestInfo, HttpCallException exception) {
    try {
      hooks.onError(requestInfo, exception);
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Exception thrown by error hook", e);
    }
  }
}
