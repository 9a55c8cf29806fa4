// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//

package io.github.simbo1905.strict;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// The value codecs of one codec namespace, keyed by the Java type they encode. Immutable.
public final class CodecRegistry {

  /// Strings and byte arrays carry a u16 length prefix
  public static final int MAX_LENGTH = 0xFFFF;

  private final Map<Class<?>, ValueCodec<?>> codecs;

  private CodecRegistry(Map<Class<?>, ValueCodec<?>> codecs) {
    this.codecs = Map.copyOf(codecs);
  }

  public static CodecRegistry empty() {
    return new CodecRegistry(Map.of());
  }

  /// Little-endian fixed-width primitives and boxes, a one byte boolean, and u16 length-prefixed
  /// UTF-8 strings and byte arrays. Strings are encoded and decoded strictly: malformed input is an error,
  /// never replaced.
  public static CodecRegistry standard() {
    return Standard.REGISTRY;
  }

  public <T> CodecRegistry with(Class<T> type, ValueCodec<? super T> codec) {
    Objects.requireNonNull(type, "type must not be null");
    Objects.requireNonNull(codec, "codec must not be null");
    final var copy = new HashMap<>(codecs);
    copy.put(type, codec);
    return new CodecRegistry(copy);
  }

  public Optional<ValueCodec<Object>> codecFor(Class<?> type) {
    @SuppressWarnings("unchecked") final var codec = (ValueCodec<Object>) codecs.get(type);
    return Optional.ofNullable(codec);
  }

  @Override
  public String toString() {
    return "CodecRegistry" + codecs.keySet().stream().map(Class::getSimpleName).sorted().toList();
  }

  private static final class Standard {
    static final CodecRegistry REGISTRY = build();

    private static CodecRegistry build() {
      final var map = new HashMap<Class<?>, ValueCodec<?>>();
      final ValueCodec<Boolean> bool = ValueCodec.of(
          (sink, v) -> {
            sink.put((byte) (v ? 1 : 0));
            return Byte.BYTES;
          },
          source -> {
            final byte b = source.get();
            return switch (b) {
              case 0 -> false;
              case 1 -> true;
              default -> throw new IllegalStateException("Invalid boolean byte 0x" + Integer.toHexString(b & 0xFF));
            };
          });
      final ValueCodec<Byte> u8 = ValueCodec.of(
          (sink, v) -> {
            sink.put(v);
            return Byte.BYTES;
          },
          ByteBuffer::get);
      final ValueCodec<Short> u16 = ValueCodec.of(
          (sink, v) -> {
            le(sink).putShort(v);
            return Short.BYTES;
          },
          source -> le(source).getShort());
      final ValueCodec<Character> chars = ValueCodec.of(
          (sink, v) -> {
            le(sink).putChar(v);
            return Character.BYTES;
          },
          source -> le(source).getChar());
      final ValueCodec<Integer> u32 = ValueCodec.of(
          (sink, v) -> {
            le(sink).putInt(v);
            return Integer.BYTES;
          },
          source -> le(source).getInt());
      final ValueCodec<Long> u64 = ValueCodec.of(
          (sink, v) -> {
            le(sink).putLong(v);
            return Long.BYTES;
          },
          source -> le(source).getLong());
      final ValueCodec<Float> f32 = ValueCodec.of(
          (sink, v) -> {
            le(sink).putFloat(v);
            return Float.BYTES;
          },
          source -> le(source).getFloat());
      final ValueCodec<Double> f64 = ValueCodec.of(
          (sink, v) -> {
            le(sink).putDouble(v);
            return Double.BYTES;
          },
          source -> le(source).getDouble());
      final ValueCodec<byte[]> bytes = ValueCodec.of(
          CodecRegistry::writeBytes,
          source -> {
            final int length = Short.toUnsignedInt(le(source).getShort());
            final byte[] data = new byte[length];
            source.get(data);
            return data;
          });
      final ValueCodec<String> string = ValueCodec.of(
          (sink, v) -> writeBytes(sink, encodeUtf8(v)),
          source -> decodeUtf8(bytes.decode(source)));

      map.put(boolean.class, bool);
      map.put(Boolean.class, bool);
      map.put(byte.class, u8);
      map.put(Byte.class, u8);
      map.put(short.class, u16);
      map.put(Short.class, u16);
      map.put(char.class, chars);
      map.put(Character.class, chars);
      map.put(int.class, u32);
      map.put(Integer.class, u32);
      map.put(long.class, u64);
      map.put(Long.class, u64);
      map.put(float.class, f32);
      map.put(Float.class, f32);
      map.put(double.class, f64);
      map.put(Double.class, f64);
      map.put(byte[].class, bytes);
      map.put(String.class, string);
      return new CodecRegistry(map);
    }
  }

  private static ByteBuffer le(ByteBuffer buffer) {
    return buffer.order(ByteOrder.LITTLE_ENDIAN);
  }

  /// @throws IllegalArgumentException if the string holds an unpaired surrogate
  private static byte[] encodeUtf8(String value) {
    try {
      final ByteBuffer encoded = StandardCharsets.UTF_8.newEncoder()
          .onMalformedInput(CodingErrorAction.REPORT)
          .onUnmappableCharacter(CodingErrorAction.REPORT)
          .encode(CharBuffer.wrap(value));
      final byte[] data = new byte[encoded.remaining()];
      encoded.get(data);
      return data;
    } catch (CharacterCodingException e) {
      throw new IllegalArgumentException("String of length " + value.length() + " has no UTF-8 encoding: " + e, e);
    }
  }

  /// @throws IllegalStateException if the bytes are not well-formed UTF-8
  private static String decodeUtf8(byte[] data) {
    try {
      return StandardCharsets.UTF_8.newDecoder()
          .onMalformedInput(CodingErrorAction.REPORT)
          .onUnmappableCharacter(CodingErrorAction.REPORT)
          .decode(ByteBuffer.wrap(data))
          .toString();
    } catch (CharacterCodingException e) {
      throw new IllegalStateException("Invalid UTF-8 in string of " + data.length + " bytes: " + e, e);
    }
  }

  private static int writeBytes(ByteBuffer sink, byte[] data) {
    if (data.length > MAX_LENGTH) {
      throw new IllegalArgumentException("Length " + data.length + " exceeds the u16 length prefix maximum " + MAX_LENGTH);
    }
    le(sink).putShort((short) data.length);
    sink.put(data);
    return Short.BYTES + data.length;
  }
}
