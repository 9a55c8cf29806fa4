// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//

package io.github.simbo1905.strict;

import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Arrays;
import java.util.Optional;

/// The four fixed-width unsigned integer kinds a discriminant may be written as.
/// Values are held in a `long` and treated as unsigned; `U64` uses the full 64 bits.
public enum DiscriminantRepr {
  U8("u8", Byte.BYTES),
  U16("u16", Short.BYTES),
  U32("u32", Integer.BYTES),
  U64("u64", Long.BYTES);

  private final String ident;
  private final int width;

  DiscriminantRepr(String ident, int width) {
    this.ident = ident;
    this.width = width;
  }

  /// The identifier used for this kind in the `repr` attribute
  public String ident() {
    return ident;
  }

  /// Number of bytes on the wire
  public int width() {
    return width;
  }

  public BigInteger maxValue() {
    return BigInteger.ONE.shiftLeft(width * Byte.SIZE).subtract(BigInteger.ONE);
  }

  public boolean fits(BigInteger value) {
    return value.signum() >= 0 && value.compareTo(maxValue()) <= 0;
  }

  static Optional<DiscriminantRepr> fromIdent(String ident) {
    return Arrays.stream(values()).filter(r -> r.ident.equals(ident)).findFirst();
  }

  /// Write the low `width` bytes of `value` little-endian
  int write(ByteBuffer sink, long value) {
    sink.order(ByteOrder.LITTLE_ENDIAN);
    switch (this) {
      case U8 -> sink.put((byte) value);
      case U16 -> sink.putShort((short) value);
      case U32 -> sink.putInt((int) value);
      case U64 -> sink.putLong(value);
    }
    return width;
  }

  /// Read `width` bytes little-endian, zero extended
  long read(ByteBuffer source) {
    source.order(ByteOrder.LITTLE_ENDIAN);
    return switch (this) {
      case U8 -> Byte.toUnsignedLong(source.get());
      case U16 -> Short.toUnsignedLong(source.getShort());
      case U32 -> Integer.toUnsignedLong(source.getInt());
      case U64 -> source.getLong();
    };
  }

  @Override
  public String toString() {
    return ident;
  }
}
