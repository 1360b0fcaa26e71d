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

import java.util.Optional;

/**
 * Selects the policy of a specific endpoint. A {@link Rampart} client consults its {@code
 * EndpointPolicies} on each call, merging the returned policy over the client's default policy.
 * For instance:
 *
 * <pre>{@code
 * EndpointPolicies policies = (method, path) -> {
 *   if (path.startsWith("/payments/")) {
 *     return Optional.of(EndpointPolicy.newBuilder()
 *         .timeout(Duration.ofSeconds(5))
 *         .maxRetries(0)
 *         .requireAuth(true)
 *         .build());
 *   }
 *   return Optional.empty();
 * };
 * }</pre>
 */
@FunctionalInterface
public interface EndpointPolicies {

  /**
   * Returns the policy for the endpoint with the given method and path, or an empty optional if
   * the default policy applies. The path never contains the query.
   */
  Optional<EndpointPolicy> policyFor(String method, String path);

  /** Returns an {@code EndpointPolicies} that always defers to the default policy. */
  static EndpointPolicies none() {
    return (method, path) -> Optional.empty();
  }
}
