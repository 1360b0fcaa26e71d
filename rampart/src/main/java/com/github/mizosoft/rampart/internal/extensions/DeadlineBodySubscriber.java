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

package com.github.mizosoft.rampart.internal.extensions;

import static java.util.Objects.requireNonNull;
import static java.util.concurrent.TimeUnit.NANOSECONDS;

import com.google.errorprone.annotations.concurrent.GuardedBy;
import java.net.http.HttpResponse.BodyHandler;
import java.net.http.HttpResponse.BodySubscriber;
import java.net.http.HttpTimeoutException;
import java.nio.ByteBuffer;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Flow.Subscription;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.function.Supplier;
import org.checkerframework.checker.nullness.qual.MonotonicNonNull;

/**
 * A {@code BodySubscriber} that fails its downstream with an {@link HttpTimeoutException} if the
 * body isn't completely received within a given duration, counted from when the subscriber is
 * created. Upstream is cancelled on timeout. This bounds reading the body of responses whose
 * headers arrive in time, which the request's own timeout doesn't cover.
 */
public final class DeadlineBodySubscriber<T> implements BodySubscriber<T> {
  private final BodySubscriber<T> downstream;
  private final Duration timeout;
  private final ScheduledFuture<?> timeoutFuture;

  @GuardedBy("this")
  private @MonotonicNonNull Subscription upstream;

  @GuardedBy("this")
  private boolean done;

  @GuardedBy("this")
  private boolean timedOut;

  DeadlineBodySubscriber(
      BodySubscriber<T> downstream, Duration timeout, ScheduledExecutorService scheduler) {
    this.downstream = requireNonNull(downstream);
    this.timeout = requireNonNull(timeout);
    this.timeoutFuture =
        scheduler.schedule(this::onTimeout, Math.max(0, timeout.toNanos()), NANOSECONDS);
  }

  @Override
  public CompletionStage<T> getBody() {
    return downstream.getBody();
  }

  @Override
  public void onSubscribe(Subscription subscription) {
    requireNonNull(subscription);
    synchronized (this) {
      if (upstream == null && !timedOut) {
        upstream = subscription;
        downstream.onSubscribe(new CancellationTrackingSubscription(subscription));
        return;
      }
    }
    subscription.cancel();
  }

  @Override
  public synchronized void onNext(List<ByteBuffer> item) {
    requireNonNull(item);
    if (!done) {
      downstream.onNext(item);
    }
  }

  @Override
  public void onError(Throwable throwable) {
    requireNonNull(throwable);
    if (markDone()) {
      synchronized (this) {
        downstream.onError(throwable);
      }
    }
  }

  @Override
  public void onComplete() {
    if (markDone()) {
      synchronized (this) {
        downstream.onComplete();
      }
    }
  }

  private void onTimeout() {
    Subscription subscription;
    synchronized (this) {
      if (done) {
        return;
      }
      done = true;
      timedOut = true;
      subscription = upstream;
    }
    if (subscription != null) {
      subscription.cancel();
    }

    var timeoutException =
        new HttpTimeoutException(
            "response body not received within " + timeout.toMillis() + " ms");
    synchronized (this) {
      if (subscription == null) {
        // The JDK expects onSubscribe before any other signal.
        downstream.onSubscribe(NoopSubscription.INSTANCE);
      }
      downstream.onError(timeoutException);
    }
  }

  private boolean markDone() {
    synchronized (this) {
      if (done) {
        return false;
      }
      done = true;
    }
    timeoutFuture.cancel(false);
    return true;
  }

  /**
   * Returns a {@code BodyHandler} whose subscribers fail if the body isn't received within the
   * duration the given supplier returns when the handler is applied.
   */
  public static <T> BodyHandler<T> withDeadline(
      BodyHandler<T> delegate, Supplier<Duration> remaining) {
    requireNonNull(delegate);
    requireNonNull(remaining);
    return responseInfo ->
        new DeadlineBodySubscriber<>(
            delegate.apply(responseInfo), remaining.get(), SchedulerHolder.SCHEDULER);
  }

  private final class CancellationTrackingSubscription implements Subscription {
    private final Subscription delegate;

    CancellationTrackingSubscription(Subscription delegate) {
      this.delegate = delegate;
    }

    @Override
    public void request(long n) {
      delegate.request(n);
    }

    @Override
    public void cancel() {
      synchronized (DeadlineBodySubscriber.this) {
        done = true;
      }
      timeoutFuture.cancel(false);
      delegate.cancel();
    }
  }

  private enum NoopSubscription implements Subscription {
    INSTANCE;

    @Override
    public void request(long n) {}

    @Override
    public void cancel() {}
  }

  private static final class SchedulerHolder {
    static final ScheduledExecutorService SCHEDULER = createScheduler();

    private static ScheduledExecutorService createScheduler() {
      var scheduler =
          new ScheduledThreadPoolExecutor(
              1,
              runnable -> {
                var thread = new Thread(runnable, "rampart-deadline-scheduler");
                thread.setDaemon(true);
                return thread;
              });
      scheduler.setRemoveOnCancelPolicy(true);
      return scheduler;
    }
  }
}
