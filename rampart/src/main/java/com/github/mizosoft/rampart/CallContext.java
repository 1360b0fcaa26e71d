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

import static java.util.Objects.requireNonNull;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * The state of one logical call, shared by all its attempts and visible to interceptors through
 * {@link Rampart.Chain#context()}. This includes the call's resolved policy and its deadline, which
 * is the earlier of the caller's deadline and the end of the policy's timeout.
 */
public final class CallContext {
  private final String callId;
  private final RequestInfo requestInfo;
  private final EndpointPolicy policy;
  private final CallerContext caller;
  private final Instant deadline;
  private final Clock clock;

  CallContext(
      String callId,
      RequestInfo requestInfo,
      EndpointPolicy policy,
      CallerContext caller,
      Instant deadline,
      Clock clock) {
    this.callId = requireNonNull(callId);
    this.requestInfo = requireNonNull(requestInfo);
    this.policy = requireNonNull(policy);
    this.caller = requireNonNull(caller);
    this.deadline = requireNonNull(deadline);
    this.clock = requireNonNull(clock);
  }

  /** Returns an identifier that is unique to this call and shared by all its attempts. */
  public String callId() {
    return callId;
  }

  public RequestInfo requestInfo() {
    return requestInfo;
  }

  public String method() {
    return requestInfo.method();
  }

  public String path() {
    return requestInfo.path();
  }

  public EndpointPolicy policy() {
    return policy;
  }

  public CallerContext caller() {
    return caller;
  }

  public Instant deadline() {
    return deadline;
  }

  /** Returns the time left until the deadline, which is negative if the deadline has passed. */
  public Duration remaining() {
    return Duration.between(clock.instant(), deadline);
  }

  public boolean isExpired() {
    return !clock.instant().isBefore(deadline);
  }

  @Override
  public String toString() {
    return "CallContext[" + callId + ", " + requestInfo + ", deadline=" + deadline + "]";
  }

  /**
   * Creates a context for a call starting now, whose deadline is the earlier of the caller's
   * deadline and the end of the policy's timeout.
   */
  static CallContext start(
      RequestInfo requestInfo, EndpointPolicy policy, CallerContext caller, Clock clock) {
    var policyDeadline = clock.instant().plus(policy.timeout());
    var deadline =
        caller
            .deadline()
            .filter(callerDeadline -> callerDeadline.isBefore(policyDeadline))
            .orElse(policyDeadline);
    return new CallContext(
        UUID.randomUUID().toString(), requestInfo, policy, caller, deadline, clock);
  }
}
