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

import static com.github.mizosoft.rampart.internal.Utils.requirePositiveDuration;
import static com.github.mizosoft.rampart.internal.Validate.requireArgument;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/** A strategy for backing off (delaying) before a retry. */
@FunctionalInterface
public interface BackoffStrategy {

  /**
   * Returns the {@link Duration} to wait for before the next attempt, where {@code retryCount} is
   * the number of attempts made so far minus one (i.e. {@code 0} before the first retry).
   */
  Duration backoff(int retryCount);

  /**
   * Returns a {@code BackoffStrategy} that applies <a
   * href="https://aws.amazon.com/blogs/architecture/exponential-backoff-and-jitter/">full
   * jitter</a> to this {@code BackoffStrategy}. Calling this method is equivalent to {@link
   * #withJitter(double) withJitter(1.0)}.
   */
  default BackoffStrategy withJitter() {
    return withJitter(1.0);
  }

  /**
   * Returns a {@code BackoffStrategy} that applies jitter to this {@code BackoffStrategy}, where
   * the degree of "fullness" is specified by the given factor.
   */
  default BackoffStrategy withJitter(double factor) {
    requireArgument(
        Double.compare(factor, 0.0) >= 0 && Double.compare(factor, 1.0) <= 0,
        "Expected %f to be between 0.0 and 1.0",
        factor);
    return retryCount -> {
      long delayMillis = backoff(retryCount).toMillis();
      long jitterRangeMillis = Math.round(delayMillis * factor);
      return Duration.ofMillis(
          Math.max(
              0,
              delayMillis
                  - jitterRangeMillis
                  + Math.round(jitterRangeMillis * ThreadLocalRandom.current().nextDouble())));
    };
  }

  /** Returns a {@code BackoffStrategy} that applies no delays. */
  static BackoffStrategy none() {
    return __ -> Duration.ZERO;
  }

  /** Returns a {@code BackoffStrategy} that applies a fixed delay every retry. */
  static BackoffStrategy fixed(Duration delay) {
    requirePositiveDuration(delay);
    return __ -> delay;
  }

  /**
   * Returns a {@code BackoffStrategy} that applies a linearly increasing delay every retry, where
   * {@code base} specifies the first delay, and {@code cap} specifies the maximum delay.
   */
  static BackoffStrategy linear(Duration base, Duration cap) {
    requirePositiveDuration(base);
    requirePositiveDuration(cap);
    return retryCount ->
        retryCount < Integer.MAX_VALUE // Avoid overflow.
            ? min(cap, base.multipliedBy(retryCount + 1L))
            : cap;
  }

  /**
   * Returns a {@code BackoffStrategy} that applies an exponentially (base 2) increasing delay
   * every retry, where {@code base} specifies the first delay, and {@code cap} specifies the
   * maximum delay.
   */
  static BackoffStrategy exponential(Duration base, Duration cap) {
    requirePositiveDuration(base);
    requirePositiveDuration(cap);
    requireArgument(
        base.compareTo(cap) <= 0,
        "Base delay (%s) must be less than or equal to cap delay (%s)",
        base,
        cap);
    return retryCount ->
        retryCount < Long.SIZE - 2 // Avoid overflow.
            ? min(cap, base.multipliedBy(1L << retryCount))
            : cap;
  }

  private static Duration min(Duration left, Duration right) {
    return left.compareTo(right) <= 0 ? left : right;
  }
}
