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

import java.net.http.HttpHeaders;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/** Case-insensitive accumulator of header fields. */
public final class HeadersBuilder {
  private final Map<String, List<String>> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);

  public HeadersBuilder() {}

  public void add(String name, String value) {
    headers
        .computeIfAbsent(requireNonNull(name), __ -> new ArrayList<>())
        .add(requireNonNull(value));
  }

  public void addAll(HttpHeaders headers) {
    headers
        .map()
        .forEach(
            (name, values) ->
                this.headers.computeIfAbsent(name, __ -> new ArrayList<>()).addAll(values));
  }

  public void set(String name, String value) {
    set(name, List.of(value));
  }

  public void set(String name, List<String> values) {
    var myValues = headers.computeIfAbsent(requireNonNull(name), __ -> new ArrayList<>());
    myValues.clear();
    values.forEach(value -> myValues.add(requireNonNull(value)));
  }

  public void setIfAbsent(String name, String value) {
    headers.computeIfAbsent(
        requireNonNull(name), __ -> new ArrayList<>(List.of(requireNonNull(value))));
  }

  public boolean remove(String name) {
    return headers.remove(requireNonNull(name)) != null;
  }

  public void clear() {
    headers.clear();
  }

  public Optional<String> lastValue(String name) {
    var values = headers.get(name);
    return values != null && !values.isEmpty()
        ? Optional.of(values.get(values.size() - 1))
        : Optional.empty();
  }

  public HttpHeaders build() {
    return HttpHeaders.of(headers, (n, v) -> true);
  }
}
