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

import static com.github.mizosoft.rampart.internal.Utils.closeBodyQuietly;
import static com.github.mizosoft.rampart.internal.Utils.toInterruptedIOException;
import static java.util.Objects.requireNonNull;

import com.github.mizosoft.rampart.EndpointPolicy;
import com.github.mizosoft.rampart.MutableRequest;
import com.github.mizosoft.rampart.internal.concurrent.Delayer;
import java.io.IOException;
import java.io.InputStream;
import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Drives the attempts of a call. The first attempt is always made. After each attempt, the policy's
 * retry predicate decides whether to make another, up to the policy's maximum number of retries.
 * The body of a response that's retried is closed before backing off. No attempt is started if the
 * call's deadline would pass during backoff, in which case the last outcome is kept.
 */
public final class Retrier {
  private static final Logger logger = System.getLogger(Retrier.class.getName());

  private static final Duration MIN_ATTEMPT_TIMEOUT = Duration.ofMillis(1);

  private final Clock clock;
  private final Delayer delayer;

  public Retrier(Clock clock, Delayer delayer) {
    this.clock = requireNonNull(clock);
    this.delayer = requireNonNull(delayer);
  }

  public Outcome run(
      HttpRequest request, EndpointPolicy policy, Instant deadline, Attempt attempt) {
    int retryCount = 0;
    while (true) {
      HttpResponse<InputStream> response = null;
      Exception exception = null;
      try {
        response = attempt.send(withTimeout(request, deadline));
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        return new Outcome(null, toInterruptedIOException(e), retryCount + 1);
      } catch (IOException | RuntimeException e) {
        exception = e;
      }

      int attempts = retryCount + 1;
      boolean retry;
      Duration delay;
      try {
        retry =
            retryCount < policy.maxRetries()
                && policy.retryPredicate().shouldRetry(response, exception);
        delay = retry ? policy.backoffStrategy().backoff(retryCount) : Duration.ZERO;
      } catch (RuntimeException e) {
        logger.log(Level.WARNING, () -> "Couldn't decide whether to retry " + request, e);
        if (response != null) {
          closeBodyQuietly(response, logger);
        }
        if (exception != null) {
          e.addSuppressed(exception);
        }
        return new Outcome(null, e, attempts);
      }
      if (!retry) {
        return new Outcome(response, exception, attempts);
      }

      if (Duration.between(clock.instant(), deadline).compareTo(delay) <= 0) {
        logger.log(
            Level.DEBUG,
            () -> "Not retrying " + request + " as its deadline would be reached while waiting");
        return new Outcome(response, exception, attempts);
      }

      if (response != null) {
        closeBodyQuietly(response, logger);
      }

      logger.log(
          Level.DEBUG,
          () -> "Retrying " + request + " after " + delay + " (attempt " + (attempts + 1) + ")");
      try {
        delayer.delay(delay);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        return new Outcome(null, toInterruptedIOException(e), attempts);
      }
      retryCount++;
    }
  }

  /** Bounds the request's timeout by the time remaining until the deadline. */
  private HttpRequest withTimeout(HttpRequest request, Instant deadline) {
    var remaining = Duration.between(clock.instant(), deadline);
    if (remaining.compareTo(MIN_ATTEMPT_TIMEOUT) < 0) {
      remaining = MIN_ATTEMPT_TIMEOUT;
    }
    if (request.timeout().isPresent() && request.timeout().get().compareTo(remaining) <= 0) {
      return request;
    }
    return MutableRequest.copyOf(request).timeout(remaining);
  }

  /** Sends one attempt of a call. */
  @FunctionalInterface
  public interface Attempt {
    HttpResponse<InputStream> send(HttpRequest request) throws IOException, InterruptedException;
  }

  /** The final response or exception of a call along with the number of attempts made. */
  public static final class Outcome {
    private final @Nullable HttpResponse<InputStream> response;
    private final @Nullable Exception exception;
    private final int attempts;

    Outcome(
        @Nullable HttpResponse<InputStream> response,
        @Nullable Exception exception,
        int attempts) {
      this.response = response;
      this.exception = exception;
      this.attempts = attempts;
    }

    public @Nullable HttpResponse<InputStream> response() {
      return response;
    }

    public @Nullable Exception exception() {
      return exception;
    }

    public int attempts() {
      return attempts;
    }
  }
}
