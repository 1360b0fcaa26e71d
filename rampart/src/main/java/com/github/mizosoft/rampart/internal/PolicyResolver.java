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

import static java.util.Objects.requireNonNull;

import com.github.mizosoft.rampart.EndpointPolicies;
import com.github.mizosoft.rampart.EndpointPolicy;
import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.util.Optional;

/** Resolves the effective policy of a call by merging its endpoint's policy over the defaults. */
public final class PolicyResolver {
  private static final Logger logger = System.getLogger(PolicyResolver.class.getName());

  private final EndpointPolicy defaultPolicy;
  private final EndpointPolicies endpointPolicies;

  public PolicyResolver(EndpointPolicy defaultPolicy, EndpointPolicies endpointPolicies) {
    this.defaultPolicy = requireNonNull(defaultPolicy);
    this.endpointPolicies = requireNonNull(endpointPolicies);
  }

  public EndpointPolicy defaultPolicy() {
    return defaultPolicy;
  }

  /** Returns the policy of the endpoint with the given method and path, never failing. */
  public EndpointPolicy resolve(String method, String path) {
    Optional<EndpointPolicy> endpointPolicy;
    try {
      endpointPolicy = endpointPolicies.policyFor(method, path);
    } catch (RuntimeException e) {
      logger.log(
          Level.WARNING,
          () -> "Exception while selecting policy for " + method + " " + path + ", using defaults",
          e);
      endpointPolicy = Optional.empty();
    }

    if (endpointPolicy == null || endpointPolicy.isEmpty()) {
      logger.log(Level.DEBUG, () -> "Applying default policy to " + method + " " + path);
      return defaultPolicy;
    }
    return endpointPolicy.get().mergeOver(defaultPolicy);
  }
}
