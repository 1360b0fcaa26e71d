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

package com.github.mizosoft.rampart.resilience4j;

import static java.util.Objects.requireNonNull;

import com.github.mizosoft.rampart.CircuitBreaker;
import com.github.mizosoft.rampart.CircuitBreakerOpenException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import java.io.IOException;
import java.util.function.Predicate;

/**
 * A {@link CircuitBreaker} that delegates to a Resilience4j {@link
 * io.github.resilience4j.circuitbreaker.CircuitBreaker}. Calls rejected by an open breaker fail
 * with {@link CircuitBreakerOpenException}. Results matching the failure predicate and exceptions
 * are both recorded as errors.
 *
 * <pre>{@code
 * var breaker = CircuitBreakerRegistry.ofDefaults().circuitBreaker("payments");
 * var policy = EndpointPolicy.newBuilder()
 *     .circuitBreaker(Resilience4jCircuitBreaker.of(breaker))
 *     .build();
 * }</pre>
 */
public final class Resilience4jCircuitBreaker implements CircuitBreaker {
  private final io.github.resilience4j.circuitbreaker.CircuitBreaker delegate;

  private Resilience4jCircuitBreaker(
      io.github.resilience4j.circuitbreaker.CircuitBreaker delegate) {
    this.delegate = requireNonNull(delegate);
  }

  public io.github.resilience4j.circuitbreaker.CircuitBreaker delegate() {
    return delegate;
  }

  @Override
  public <T> T execute(Operation<T> operation, Predicate<? super T> failurePredicate)
      throws IOException, InterruptedException {
    try {
      delegate.acquirePermission();
    } catch (CallNotPermittedException e) {
      throw new CircuitBreakerOpenException(
          "circuit breaker '" + delegate.getName() + "' is " + delegate.getState(), e);
    }

    long start = delegate.getCurrentTimestamp();
    T result;
    try {
      result = operation.run();
    } catch (InterruptedException e) {
      delegate.releasePermission();
      throw e;
    } catch (IOException | RuntimeException e) {
      delegate.onError(elapsedSince(start), delegate.getTimestampUnit(), e);
      throw e;
    }

    if (failurePredicate.test(result)) {
      delegate.onError(
          elapsedSince(start), delegate.getTimestampUnit(), new FailedResultException(result));
    } else {
      delegate.onSuccess(elapsedSince(start), delegate.getTimestampUnit());
    }
    return result;
  }

  private long elapsedSince(long start) {
    return delegate.getCurrentTimestamp() - start;
  }

  @Override
  public String toString() {
    return "Resilience4jCircuitBreaker[" + delegate.getName() + "]";
  }

  public static Resilience4jCircuitBreaker of(
      io.github.resilience4j.circuitbreaker.CircuitBreaker delegate) {
    return new Resilience4jCircuitBreaker(delegate);
  }

  /** Recorded in place of a result that completed normally but is considered a failure. */
  static final class FailedResultException extends Exception {
    private static final long serialVersionUID = 1L;

    FailedResultException(Object result) {
      super("failed result: " + result, null, false, false);
    }
  }
}
