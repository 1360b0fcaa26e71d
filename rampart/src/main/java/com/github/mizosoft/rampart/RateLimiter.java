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
import java.time.Duration;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Limits the rate at which calls are made. Instances are shared by all calls of the endpoints
 * they're configured for, and must be safe for concurrent use.
 */
@FunctionalInterface
public interface RateLimiter {

  /**
   * Blocks until a permit is granted. If {@code maxWait} is not {@code null}, the limiter must not
   * wait beyond it.
   *
   * @throws RateLimitExceededException if a permit can't be granted within {@code maxWait}
   * @throws InterruptedException if the current thread is interrupted while waiting
   */
  void acquire(@Nullable Duration maxWait) throws IOException, InterruptedException;
}
