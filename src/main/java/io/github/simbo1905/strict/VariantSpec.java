// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//

package io.github.simbo1905.strict;

import java.util.List;
import java.util.Objects;

/// One variant of an enumeration. Its fields are laid out like a struct's.
/// @param nativeOrdinal the variant's intrinsic ordinal, used by `by_value`
public record VariantSpec(
    String name,
    int declarationIndex,
    long nativeOrdinal,
    List<FieldSpec> fields,
    Attributes localAttributes
) {
  public VariantSpec {
    Objects.requireNonNull(name, "name must not be null");
    if (declarationIndex < 0) {
      throw new IllegalArgumentException("declarationIndex must not be negative: " + declarationIndex);
    }
    fields = TypeSpec.inDeclarationOrder(fields, FieldSpec::declarationIndex, name);
    Objects.requireNonNull(localAttributes, "localAttributes must not be null");
  }

  /// A variant whose native ordinal is its declaration index
  public VariantSpec(String name, int declarationIndex, List<FieldSpec> fields, Attributes localAttributes) {
    this(name, declarationIndex, declarationIndex, fields, localAttributes);
  }

  public static VariantSpec unit(String name, int declarationIndex) {
    return new VariantSpec(name, declarationIndex, List.of(), Attributes.EMPTY);
  }

  public static VariantSpec unit(String name, int declarationIndex, Attributes attributes) {
    return new VariantSpec(name, declarationIndex, List.of(), attributes);
  }
}
