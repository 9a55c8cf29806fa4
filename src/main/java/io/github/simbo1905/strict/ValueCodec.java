// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//

package io.github.simbo1905.strict;

import java.nio.ByteBuffer;
import java.util.Objects;

/// The codec a member's value type supplies: the recursive base case every plan bottoms out in.
/// Implementations set the buffer's byte order they need; strict encoding is little-endian.
public interface ValueCodec<T> {

  /// Write `value` at the sink's position
  /// @return the number of bytes written
  int encode(ByteBuffer sink, T value);

  /// Read one value at the source's position, consuming exactly the bytes it was encoded as
  T decode(ByteBuffer source);

  @FunctionalInterface
  interface Writer<T> {
    int write(ByteBuffer sink, T value);
  }

  @FunctionalInterface
  interface Reader<T> {
    T read(ByteBuffer source);
  }

  static <T> ValueCodec<T> of(Writer<T> writer, Reader<T> reader) {
    Objects.requireNonNull(writer, "writer must not be null");
    Objects.requireNonNull(reader, "reader must not be null");
    return new ValueCodec<>() {
      @Override
      public int encode(ByteBuffer sink, T value) {
        return writer.write(sink, value);
      }

      @Override
      public T decode(ByteBuffer source) {
        return reader.read(source);
      }
    };
  }
}
