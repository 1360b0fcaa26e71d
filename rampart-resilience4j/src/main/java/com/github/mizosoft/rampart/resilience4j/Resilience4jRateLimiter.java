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

import com.github.mizosoft.rampart.RateLimitExceededException;
import com.github.mizosoft.rampart.RateLimiter;
import java.io.IOException;
import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A {@link RateLimiter} that delegates to a Resilience4j {@link
 * io.github.resilience4j.ratelimiter.RateLimiter}. A permit is reserved up front, then the caller
 * waits for it to become active. A reservation that can't be made within the limiter's configured
 * timeout, or that would become active after the call's deadline, fails with {@link
 * RateLimitExceededException}.
 */
public final class Resilience4jRateLimiter implements RateLimiter {
  private static final Logger logger = System.getLogger(Resilience4jRateLimiter.class.getName());

  private final io.github.resilience4j.ratelimiter.RateLimiter delegate;

  private Resilience4jRateLimiter(io.github.resilience4j.ratelimiter.RateLimiter delegate) {
    this.delegate = requireNonNull(delegate);
  }

  public io.github.resilience4j.ratelimiter.RateLimiter delegate() {
    return delegate;
  }

  @Override
  public void acquire(@Nullable Duration maxWait) throws IOException, InterruptedException {
    long waitNanos = delegate.reservePermission();
    if (waitNanos < 0) {
      throw new RateLimitExceededException(
          "rate limiter '" + delegate.getName() + "' has no permits available");
    }
    if (maxWait != null && waitNanos > maxWait.toNanos()) {
      // The reserved permit is forfeited.
      logger.log(
          Level.DEBUG,
          () ->
              "Permit from '"
                  + delegate.getName()
                  + "' is available after "
                  + Duration.ofNanos(waitNanos)
                  + ", which exceeds "
                  + maxWait);
      throw new RateLimitExceededException(
          "rate limiter '" + delegate.getName() + "' can't permit the call before its deadline");
    }
    if (waitNanos > 0) {
      TimeUnit.NANOSECONDS.sleep(waitNanos);
    }
  }

  @Override
  public String toString() {
    return "Resilience4jRateLimiter[" + delegate.getName() + "]";
  }

  public static Resilience4jRateLimiter of(
      io.github.resilience4j.ratelimiter.RateLimiter delegate) {
    return new Resilience4jRateLimiter(delegate);
  }
}
