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

package com.github.mizosoft.rampart.internal.cache;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;

import com.github.mizosoft.rampart.internal.extensions.HeadersBuilder;
import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.net.http.HttpClient.Version;
import java.net.http.HttpHeaders;
import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.util.Collection;

/**
 * A snapshot of a response's status line, headers and body, as stored in a cache backend. Entries
 * are encoded in a compact binary format where integers are written as varints and strings as
 * length-prefixed UTF-8 bytes.
 */
public final class CacheEntry {
  private static final int ENCODING_VERSION = 1;

  private static final int VARINT_SHIFT = 7;
  private static final int VARINT_MASK = 0x7F;
  private static final int VARINT_HAS_MORE_MASK = 0xFF & ~VARINT_MASK;
  private static final long INT_MASK = 0xFFFFFFFFL;

  private final int statusCode;
  private final Version version;
  private final HttpHeaders headers;
  private final byte[] body;

  public CacheEntry(int statusCode, Version version, HttpHeaders headers, byte[] body) {
    this.statusCode = statusCode;
    this.version = requireNonNull(version);
    this.headers = requireNonNull(headers);
    this.body = requireNonNull(body);
  }

  public int statusCode() {
    return statusCode;
  }

  public Version version() {
    return version;
  }

  public HttpHeaders headers() {
    return headers;
  }

  public byte[] body() {
    return body;
  }

  public byte[] encode() {
    var writer = new EntryWriter();
    writer.writeInt(ENCODING_VERSION);
    writer.writeInt(statusCode);
    writer.writeUtf8(version.name());
    writer.writeHeaders(headers);
    writer.writeByteArray(body);
    return writer.toByteArray();
  }

  public static CacheEntry decode(byte[] encoded) throws IOException {
    var reader = new EntryReader(ByteBuffer.wrap(encoded));
    int encodingVersion = reader.readInt();
    if (encodingVersion != ENCODING_VERSION) {
      throw new IOException(
          "unexpected cache entry version: expected "
              + ENCODING_VERSION
              + ", found "
              + encodingVersion);
    }
    int statusCode = reader.readInt();
    Version version;
    try {
      version = Version.valueOf(reader.readUtf8String());
    } catch (IllegalArgumentException e) {
      throw new IOException("unrecognized HTTP version", e);
    }
    var headers = reader.readHeaders();
    var body = reader.readByteArray();
    if (reader.hasRemaining()) {
      throw new IOException("trailing bytes after cache entry");
    }
    return new CacheEntry(statusCode, version, headers, body);
  }

  private static final class EntryReader {
    private final ByteBuffer buffer;

    EntryReader(ByteBuffer buffer) {
      this.buffer = buffer;
    }

    int readInt() throws IOException {
      long value = 0L;
      for (int shift = 0; shift < Integer.SIZE; shift += VARINT_SHIFT) {
        long currentByte = requireByte() & 0xFF;
        value |= (currentByte & VARINT_MASK) << shift;
        if ((currentByte & VARINT_HAS_MORE_MASK) == 0) {
          return (int) value;
        }
      }
      throw new IOException("wrong varint format");
    }

    byte[] readByteArray() throws IOException {
      int length = readInt();
      if (length < 0 || length > buffer.remaining()) {
        throw endOfInput();
      }
      var array = new byte[length];
      buffer.get(array);
      return array;
    }

    String readUtf8String() throws IOException {
      return new String(readByteArray(), UTF_8);
    }

    HttpHeaders readHeaders() throws IOException {
      var builder = new HeadersBuilder();
      for (int i = 0, count = readInt(); i < count; i++) {
        var header = readUtf8String();
        int separatorIndex = header.indexOf(':');
        if (separatorIndex <= 0) {
          throw new IOException("malformed header");
        }
        builder.add(header.substring(0, separatorIndex), header.substring(separatorIndex + 1));
      }
      return builder.build();
    }

    boolean hasRemaining() {
      return buffer.hasRemaining();
    }

    private byte requireByte() throws EOFException {
      try {
        return buffer.get();
      } catch (BufferUnderflowException e) {
        throw endOfInput();
      }
    }

    private EOFException endOfInput() {
      return new EOFException(
          "unexpected end of input; " + buffer.position() + " bytes read");
    }
  }

  private static final class EntryWriter {
    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();

    EntryWriter() {}

    void writeInt(int value) {
      long unsigned = value & INT_MASK;
      while ((unsigned & ~VARINT_MASK) != 0) { // Value requires more than one varint byte?
        buffer.write(((int) unsigned & VARINT_MASK) | VARINT_HAS_MORE_MASK);
        unsigned >>>= VARINT_SHIFT;
      }
      buffer.write((int) unsigned); // Last varint byte
    }

    void writeByteArray(byte[] array) {
      writeInt(array.length);
      buffer.write(array, 0, array.length);
    }

    void writeUtf8(String value) {
      writeByteArray(value.getBytes(UTF_8));
    }

    void writeHeaders(HttpHeaders headers) {
      var headersMap = headers.map();
      int deepHeaderCount = headersMap.values().stream().mapToInt(Collection::size).sum();
      writeInt(deepHeaderCount);
      headersMap.forEach((name, values) -> values.forEach(value -> writeUtf8(name + ':' + value)));
    }

    byte[] toByteArray() {
      return buffer.toByteArray();
    }
  }
}
