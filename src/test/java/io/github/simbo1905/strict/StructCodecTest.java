// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//

package io.github.simbo1905.strict;

import io.github.simbo1905.LoggingControl;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class StructCodecTest {

  public record Point(int x, int y) {
  }

  public record Account(String name, long balance, int cache) {
  }

  public record Empty() {
  }

  public record Line(Point from, Point to) {
  }

  public record Tiny(int a) {
  }

  public record Session(UUID id) {
  }

  public record Flags(boolean on, byte level) {
  }

  public record Name(String value) {
  }

  @BeforeAll
  static void setupLogging() {
    LoggingControl.setupCleanLogging();
  }

  static <T> byte[] encode(ValueCodec<T> codec, T value) {
    final var buffer = ByteBuffer.allocate(1024);
    final int written = codec.encode(buffer, value);
    assertThat(written).isEqualTo(buffer.position());
    return Arrays.copyOf(buffer.array(), written);
  }

  static byte[] bytes(int... values) {
    final byte[] result = new byte[values.length];
    for (int i = 0; i < values.length; i++) {
      result[i] = (byte) values[i];
    }
    return result;
  }

  @Test
  void fieldsAreConcatenatedLittleEndianInDeclarationOrder() {
    final var codec = StrictCodec.forClass(Point.class);
    final byte[] wire = encode(codec, new Point(1, 0x0203));
    assertThat(wire).containsExactly(bytes(1, 0, 0, 0, 3, 2, 0, 0));
    assertThat(codec.decode(ByteBuffer.wrap(wire))).isEqualTo(new Point(1, 0x0203));
  }

  @Test
  void skippedFieldIsAbsentFromTheWireAndDefaultedOnDecode() {
    final var codec = StrictCodec.forClass(Account.class, Map.of("cache", Attributes.flag("skip")));
    final byte[] wire = encode(codec, new Account("ab", 5L, 99));
    assertThat(wire).containsExactly(bytes(2, 0, 'a', 'b', 5, 0, 0, 0, 0, 0, 0, 0));
    assertThat(codec.decode(ByteBuffer.wrap(wire))).isEqualTo(new Account("ab", 5L, 0));
  }

  @Test
  void skippedFieldConsumesNothing() {
    final var codec = StrictCodec.forClass(Account.class, Map.of("cache", Attributes.flag("skip")));
    final byte[] wire = encode(codec, new Account("", 1L, 7));
    final var source = ByteBuffer.allocate(wire.length + 4).put(wire).put(bytes(9, 9, 9, 9)).flip();
    assertThat(codec.decode(source)).isEqualTo(new Account("", 1L, 0));
    assertThat(source.remaining()).isEqualTo(4);
  }

  @Test
  void zeroFieldStructEncodesToNothing() {
    final var codec = StrictCodec.forClass(Empty.class);
    final var buffer = ByteBuffer.allocate(8);
    assertThat(codec.encode(buffer, new Empty())).isZero();
    assertThat(buffer.position()).isZero();
    assertThat(codec.decode(ByteBuffer.allocate(0))).isEqualTo(new Empty());
  }

  @Test
  void booleanIsOneByte() {
    final var codec = StrictCodec.forClass(Flags.class);
    assertThat(encode(codec, new Flags(true, (byte) -1))).containsExactly(bytes(1, 0xFF));
    assertThatThrownBy(() -> codec.decode(ByteBuffer.wrap(bytes(2, 0))))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("boolean");
  }

  @Test
  void truncatedInputFailsWithoutConstructing() {
    final var codec = StrictCodec.forClass(Point.class);
    assertThatThrownBy(() -> codec.decode(ByteBuffer.wrap(bytes(1, 0, 0, 0, 2))))
        .isInstanceOf(BufferUnderflowException.class);
  }

  @Test
  void encodingIsDeterministic() {
    final var codec = StrictCodec.forClass(Account.class);
    final var value = new Account("déjà vu", -42L, 7);
    assertThat(encode(codec, value)).containsExactly(encode(codec, value));
  }

  @Test
  void nestedStructBindsThroughTheRegistry() {
    final var registry = CodecRegistry.standard().with(Point.class, StrictCodec.forClass(Point.class));
    final var namespaces = CodecNamespaces.standard().with("strict_encoding", registry);
    final var codec = StrictCodec.forType(TypeScanner.scan(Line.class), Line.class, namespaces, DefaultValues.standard());
    final var line = new Line(new Point(1, 2), new Point(3, 4));
    final byte[] wire = encode(codec, line);
    assertThat(wire).hasSize(16);
    assertThat(codec.decode(ByteBuffer.wrap(wire))).isEqualTo(line);
  }

  @Test
  void missingMemberCodecFailsAtBind() {
    assertThatThrownBy(() -> StrictCodec.forClass(Session.class))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("java.util.UUID")
        .hasMessageContaining("Session.id");
  }

  @Test
  void crateSelectsTheNamespace() {
    final ValueCodec<Integer> oneByte = ValueCodec.of(
        (sink, v) -> {
          sink.put(v.byteValue());
          return 1;
        },
        source -> (int) source.get());
    final var namespaces = CodecNamespaces.standard()
        .with("my::codecs", CodecRegistry.empty().with(int.class, oneByte));
    final var spec = TypeScanner.scan(Tiny.class, Map.of("", Attributes.of("crate", AttrValue.path("my::codecs"))));
    final var codec = StrictCodec.forType(spec, Tiny.class, namespaces, DefaultValues.standard());
    assertThat(encode(codec, new Tiny(7))).containsExactly(bytes(7));
    assertThat(codec.decode(ByteBuffer.wrap(bytes(7)))).isEqualTo(new Tiny(7));
  }

  @Test
  void unknownNamespaceFailsAtBind() {
    final var spec = TypeScanner.scan(Tiny.class, Map.of("", Attributes.of("crate", AttrValue.path("my::codecs"))));
    assertThatThrownBy(() -> StrictCodec.forType(spec, Tiny.class))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("my::codecs");
  }

  @Test
  void planMustMatchTheRecordShape() {
    final var spec = TypeSpec.struct("Point", Attributes.EMPTY, List.of(FieldSpec.named("x", 0, int.class)));
    assertThatThrownBy(() -> StrictCodec.forType(spec, Point.class))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("components");
    final var renamed = TypeSpec.struct("Point", Attributes.EMPTY, List.of(
        FieldSpec.named("x", 0, int.class), FieldSpec.named("z", 1, int.class)));
    assertThatThrownBy(() -> StrictCodec.forType(renamed, Point.class))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("z");
  }

  @Test
  void positionalPlanBindsByPosition() {
    final var spec = TypeSpec.struct("Point", Attributes.EMPTY, List.of(
        FieldSpec.positional(0, int.class), FieldSpec.positional(1, int.class, Attributes.flag("skip"))));
    final var codec = StrictCodec.forType(spec, Point.class);
    assertThat(encode(codec, new Point(5, 6))).containsExactly(bytes(5, 0, 0, 0));
    assertThat(codec.decode(ByteBuffer.wrap(bytes(5, 0, 0, 0)))).isEqualTo(new Point(5, 0));
  }

  @Test
  void oversizedStringIsRejected() {
    final var codec = StrictCodec.forClass(Account.class);
    final var name = "x".repeat(CodecRegistry.MAX_LENGTH + 1);
    assertThatThrownBy(() -> codec.encode(ByteBuffer.allocate(CodecRegistry.MAX_LENGTH * 2), new Account(name, 0, 0)))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void malformedUtf8IsRejectedOnDecode() {
    final var codec = StrictCodec.forClass(Name.class);
    assertThatThrownBy(() -> codec.decode(ByteBuffer.wrap(bytes(2, 0, 0xC3, 0x28))))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("UTF-8");
  }

  @Test
  void unpairedSurrogateIsRejectedOnEncode() {
    final var codec = StrictCodec.forClass(Name.class);
    final var sink = ByteBuffer.allocate(16);
    assertThatThrownBy(() -> codec.encode(sink, new Name("a\uD800b")))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("UTF-8");
    assertThat(sink.position()).isZero();
  }

  @Test
  void supplementaryCharacterIsFourBytes() {
    final var codec = StrictCodec.forClass(Name.class);
    final var name = new Name("\uD83D\uDE00");
    final byte[] wire = encode(codec, name);
    assertThat(wire).containsExactly(bytes(4, 0, 0xF0, 0x9F, 0x98, 0x80));
    assertThat(codec.decode(ByteBuffer.wrap(wire))).isEqualTo(name);
  }
}
