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

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.net.http.HttpResponse.BodySubscribers;
import java.net.http.HttpTimeoutException;
import java.nio.ByteBuffer;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Flow.Subscription;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

@Timeout(5)
class DeadlineBodySubscriberTest {
  private ScheduledThreadPoolExecutor scheduler;

  @BeforeEach
  void setUp() {
    scheduler = new ScheduledThreadPoolExecutor(1);
    scheduler.setRemoveOnCancelPolicy(true);
  }

  @AfterEach
  void tearDown() {
    scheduler.shutdownNow();
  }

  @Test
  void bodyReceivedBeforeDeadline() throws Exception {
    var subscriber =
        new DeadlineBodySubscriber<>(
            BodySubscribers.ofByteArray(), Duration.ofMinutes(1), scheduler);
    var subscription = new RecordingSubscription();
    subscriber.onSubscribe(subscription);
    subscriber.onNext(List.of(ByteBuffer.wrap("Pikachu".getBytes(UTF_8))));
    subscriber.onComplete();
    assertThat(subscriber.getBody().toCompletableFuture().get())
        .asString(UTF_8)
        .isEqualTo("Pikachu");
    assertThat(subscription.cancelled).isFalse();
    assertThat(scheduler.getQueue()).isEmpty();
  }

  @Test
  void bodyNotReceivedBeforeDeadline() {
    var subscriber =
        new DeadlineBodySubscriber<>(
            BodySubscribers.ofByteArray(), Duration.ofMillis(50), scheduler);
    var subscription = new RecordingSubscription();
    subscriber.onSubscribe(subscription);
    subscriber.onNext(List.of(ByteBuffer.wrap(new byte[] {1})));

    assertThat(subscriber.getBody())
        .failsWithin(Duration.ofSeconds(4))
        .withThrowableOfType(ExecutionException.class)
        .withCauseInstanceOf(HttpTimeoutException.class);
    assertThat(subscription.cancelled).isTrue();

    // Late signals are dropped.
    subscriber.onNext(List.of(ByteBuffer.wrap(new byte[] {2})));
    subscriber.onComplete();
  }

  @Test
  void deadlinePassedBeforeSubscribing() {
    var subscriber =
        new DeadlineBodySubscriber<>(BodySubscribers.ofByteArray(), Duration.ZERO, scheduler);
    assertThat(subscriber.getBody())
        .failsWithin(Duration.ofSeconds(4))
        .withThrowableOfType(ExecutionException.class)
        .withCauseInstanceOf(HttpTimeoutException.class);

    var subscription = new RecordingSubscription();
    subscriber.onSubscribe(subscription);
    assertThat(subscription.cancelled).isTrue();
  }

  @Test
  void blockedStreamReadFailsOnDeadline() throws Exception {
    var subscriber =
        new DeadlineBodySubscriber<>(
            BodySubscribers.ofInputStream(), Duration.ofMillis(100), scheduler);
    subscriber.onSubscribe(new RecordingSubscription());
    var stream = subscriber.getBody().toCompletableFuture().get();
    assertThatThrownBy(stream::readAllBytes)
        .isInstanceOf(IOException.class)
        .hasRootCauseInstanceOf(HttpTimeoutException.class);
  }

  @Test
  void closingStreamCancelsDeadline() throws Exception {
    var subscriber =
        new DeadlineBodySubscriber<>(
            BodySubscribers.ofInputStream(), Duration.ofMinutes(1), scheduler);
    var subscription = new RecordingSubscription();
    subscriber.onSubscribe(subscription);
    subscriber.getBody().toCompletableFuture().get().close();
    assertThat(subscription.cancelled).isTrue();
    assertThat(scheduler.getQueue()).isEmpty();
  }

  private static final class RecordingSubscription implements Subscription {
    volatile boolean cancelled;

    @Override
    public void request(long n) {}

    @Override
    public void cancel() {
      cancelled = true;
    }
  }
}
