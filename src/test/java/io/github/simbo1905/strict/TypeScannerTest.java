// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//

package io.github.simbo1905.strict;

import io.github.simbo1905.LoggingControl;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class TypeScannerTest {

  public record Point(int x, int y) {
  }

  public sealed interface Command permits Move, Stop {
  }

  public record Move(Point to, double speed) implements Command {
  }

  public record Stop() implements Command {
  }

  public enum Level {LOW, HIGH}

  public static final class NotCodable {
  }

  @BeforeAll
  static void setupLogging() {
    LoggingControl.setupCleanLogging();
  }

  @Test
  void recordBecomesAStruct() {
    final var spec = TypeScanner.scan(Point.class, Map.of("y", Attributes.flag("skip")));
    assertThat(spec.kind()).isEqualTo(TypeSpec.Kind.STRUCT);
    assertThat(spec.name()).isEqualTo("Point");
    assertThat(spec.fields()).extracting(FieldSpec::name).containsExactly("x", "y");
    assertThat(spec.fields()).extracting(FieldSpec::valueType).containsExactly(int.class, int.class);
    assertThat(spec.fields().get(1).localAttributes().contains("skip")).isTrue();
  }

  @Test
  void sealedInterfaceBecomesAnEnumOfRecordVariants() {
    final var spec = TypeScanner.scan(Command.class, Map.of(
        "", Attributes.of("repr", AttrValue.ident("u16")),
        "Stop", Attributes.of("value", AttrValue.integer(9)),
        "Move.speed", Attributes.flag("skip")));
    assertThat(spec.kind()).isEqualTo(TypeSpec.Kind.ENUM);
    assertThat(spec.globalAttributes().get("repr")).contains(AttrValue.ident("u16"));
    assertThat(spec.variants()).extracting(VariantSpec::name).containsExactly("Move", "Stop");
    assertThat(spec.variants()).extracting(VariantSpec::declarationIndex).containsExactly(0, 1);
    final var move = spec.variants().get(0);
    assertThat(move.fields()).extracting(FieldSpec::name).containsExactly("to", "speed");
    assertThat(move.fields().get(1).localAttributes().contains("skip")).isTrue();
    assertThat(spec.variants().get(1).localAttributes().get("value")).contains(AttrValue.integer(9));
  }

  @Test
  void javaEnumBecomesUnitVariantsWithNativeOrdinals() {
    final var spec = TypeScanner.scan(Level.class);
    assertThat(spec.variants()).extracting(VariantSpec::name).containsExactly("LOW", "HIGH");
    assertThat(spec.variants()).extracting(VariantSpec::nativeOrdinal).containsExactly(0L, 1L);
    assertThat(spec.variants()).allSatisfy(v -> assertThat(v.fields()).isEmpty());
  }

  @Test
  void misspeltPathIsRejected() {
    assertThatThrownBy(() -> TypeScanner.scan(Point.class, Map.of("z", Attributes.flag("skip"))))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("[z]");
    assertThatThrownBy(() -> TypeScanner.scan(Command.class, Map.of("Move.distance", Attributes.flag("skip"))))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("Move.distance");
  }

  @Test
  void plainClassIsRejected() {
    assertThatThrownBy(() -> TypeScanner.scan(NotCodable.class))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
