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
import java.util.function.Predicate;

/**
 * A gate that decides whether a call is made based on the outcomes of previous calls. Instances
 * are shared by all calls of the endpoints they're configured for, and must be safe for concurrent
 * use.
 */
public interface CircuitBreaker {

  /**
   * Runs the given operation if the breaker permits it, and records its outcome. An operation that
   * throws is recorded as a failure. An operation that completes normally is recorded as a failure
   * if its result matches {@code failurePredicate}, and as a success otherwise.
   *
   * @throws CircuitBreakerOpenException if the breaker doesn't permit the call
   */
  <T> T execute(Operation<T> operation, Predicate<? super T> failurePredicate)
      throws IOException, InterruptedException;

  /** Returns a {@code CircuitBreaker} that permits all calls. */
  static CircuitBreaker alwaysClosed() {
    return AlwaysClosedCircuitBreaker.INSTANCE;
  }

  /** An operation executed by a {@code CircuitBreaker}. */
  @FunctionalInterface
  interface Operation<T> {
    T run() throws IOException, InterruptedException;
  }

  enum AlwaysClosedCircuitBreaker implements CircuitBreaker {
    INSTANCE;

    @Override
    public <T> T execute(Operation<T> operation, Predicate<? super T> failurePredicate)
        throws IOException, InterruptedException {
      return operation.run();
    }

    @Override
    public String toString() {
      return "CircuitBreaker[always closed]";
    }
  }
}
