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

import static org.assertj.core.api.Assertions.assertThat;

import com.github.mizosoft.rampart.testing.StubHttpClient;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class AuthInterceptorTest {
  private static final CallerContext AUTHORIZED_CALLER =
      CallerContext.newBuilder().authorization("Bearer caller-token").build();

  private StubHttpClient backend;

  @BeforeEach
  void setUp() {
    backend = new StubHttpClient().respondWith(200, "");
  }

  private Rampart client(boolean requireAuth) {
    return Rampart.newBuilder(backend)
        .baseUri("https://example.com")
        .defaultPolicy(EndpointPolicy.newBuilder().requireAuth(requireAuth).build())
        .interceptor(new AuthInterceptor())
        .build();
  }

  @Test
  void propagatesCallerCredential() throws Exception {
    client(true).get("/", Map.of(), AUTHORIZED_CALLER);
    assertThat(backend.lastRequest().headers().firstValue("Authorization"))
        .hasValue("Bearer caller-token");
  }

  @Test
  void callerCredentialReplacesExistingHeader() throws Exception {
    client(true).get("/", Map.of("Authorization", "Basic old"), AUTHORIZED_CALLER);
    assertThat(backend.lastRequest().headers().allValues("Authorization"))
        .containsExactly("Bearer caller-token");
  }

  @Test
  void notPropagatedWhenPolicyDoesNotRequireAuth() throws Exception {
    client(false).get("/", Map.of(), AUTHORIZED_CALLER);
    assertThat(backend.lastRequest().headers().firstValue("Authorization")).isEmpty();
  }

  @Test
  void proceedsWithoutCredential() throws Exception {
    var response = client(true).get("/");
    assertThat(response.statusCode()).isEqualTo(200);
    assertThat(backend.lastRequest().headers().firstValue("Authorization")).isEmpty();
  }

  @Test
  void endpointPolicyCanRequireAuth() throws Exception {
    var client =
        Rampart.newBuilder(backend)
            .baseUri("https://example.com")
            .endpointPolicies(
                (method, path) ->
                    path.startsWith("/admin")
                        ? Optional.of(EndpointPolicy.newBuilder().requireAuth(true).build())
                        : Optional.empty())
            .interceptor(new AuthInterceptor())
            .build();
    client.get("/public", Map.of(), AUTHORIZED_CALLER);
    assertThat(backend.lastRequest().headers().firstValue("Authorization")).isEmpty();
    client.get("/admin/users", Map.of(), AUTHORIZED_CALLER);
    assertThat(backend.lastRequest().headers().firstValue("Authorization"))
        .hasValue("Bearer caller-token");
  }
}
