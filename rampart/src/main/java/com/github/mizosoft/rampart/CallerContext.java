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

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.time.Instant;
import java.util.Optional;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Information about the party on whose behalf a call is made, typically extracted from an inbound
 * request by the caller's own middleware. This includes a deadline that bounds the call along with
 * its policy's timeout, the inbound authorization credential propagated when the endpoint requires
 * authentication, and the remote address propagated in {@code X-Forwarded-For}.
 */
public final class CallerContext {
  private static final CallerContext EMPTY = newBuilder().build();

  private final @Nullable Instant deadline;
  private final @Nullable String authorization;
  private final @Nullable String remoteAddress;

  private CallerContext(Builder builder) {
    this.deadline = builder.deadline;
    this.authorization = builder.authorization;
    this.remoteAddress = builder.remoteAddress;
  }

  public Optional<Instant> deadline() {
    return Optional.ofNullable(deadline);
  }

  /** Returns the value of the inbound {@code Authorization} header. */
  public Optional<String> authorization() {
    return Optional.ofNullable(authorization);
  }

  /** Returns the address of the inbound request's peer, possibly with a port. */
  public Optional<String> remoteAddress() {
    return Optional.ofNullable(remoteAddress);
  }

  @Override
  public String toString() {
    return "CallerContext[deadline="
        + deadline
        + ", hasAuthorization="
        + (authorization != null)
        + ", remoteAddress="
        + remoteAddress
        + "]";
  }

  public static CallerContext empty() {
    return EMPTY;
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  /** A builder of {@code CallerContext} instances. */
  public static final class Builder {
    private @Nullable Instant deadline;
    private @Nullable String authorization;
    private @Nullable String remoteAddress;

    Builder() {}

    @CanIgnoreReturnValue
    public Builder deadline(Instant deadline) {
      this.deadline = requireNonNull(deadline);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder authorization(String authorization) {
      this.authorization = requireNonNull(authorization);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder remoteAddress(String remoteAddress) {
      this.remoteAddress = requireNonNull(remoteAddress);
      return this;
    }

    public CallerContext build() {
      return new CallerContext(this);
    }
  }
}
