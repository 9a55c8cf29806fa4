// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//

package io.github.simbo1905.strict;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/// One field of a struct or of an enum variant
/// @param name the field name, or null for a positional field
/// @param declarationIndex zero-based position in the declaring type; fixes the encode order
/// @param valueType the Java type the member value codec and default value are looked up by
/// @param localAttributes attributes declared on the field itself
public record FieldSpec(
    @Nullable String name,
    int declarationIndex,
    @NotNull Class<?> valueType,
    @NotNull Attributes localAttributes
) {
  public FieldSpec {
    if (declarationIndex < 0) {
      throw new IllegalArgumentException("declarationIndex must not be negative: " + declarationIndex);
    }
    Objects.requireNonNull(valueType, "valueType must not be null");
    Objects.requireNonNull(localAttributes, "localAttributes must not be null");
  }

  public static FieldSpec named(String name, int declarationIndex, Class<?> valueType) {
    return new FieldSpec(Objects.requireNonNull(name), declarationIndex, valueType, Attributes.EMPTY);
  }

  public static FieldSpec named(String name, int declarationIndex, Class<?> valueType, Attributes attributes) {
    return new FieldSpec(Objects.requireNonNull(name), declarationIndex, valueType, attributes);
  }

  public static FieldSpec positional(int declarationIndex, Class<?> valueType) {
    return new FieldSpec(null, declarationIndex, valueType, Attributes.EMPTY);
  }

  public static FieldSpec positional(int declarationIndex, Class<?> valueType, Attributes attributes) {
    return new FieldSpec(null, declarationIndex, valueType, attributes);
  }

  /// The name, or the position for positional fields
  public String displayName() {
    return name != null ? name : Integer.toString(declarationIndex);
  }
}
