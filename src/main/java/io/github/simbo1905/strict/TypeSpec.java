// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//

package io.github.simbo1905.strict;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.function.ToIntFunction;
import java.util.stream.IntStream;

/// A structured type definition with its configuration attached.
/// Members are held in declaration order whatever order they were supplied in.
public record TypeSpec(
    String name,
    Kind kind,
    Attributes globalAttributes,
    List<FieldSpec> fields,
    List<VariantSpec> variants
) {
  public enum Kind {
    STRUCT,
    ENUM
  }

  public TypeSpec {
    Objects.requireNonNull(name, "name must not be null");
    Objects.requireNonNull(kind, "kind must not be null");
    Objects.requireNonNull(globalAttributes, "globalAttributes must not be null");
    fields = inDeclarationOrder(fields, FieldSpec::declarationIndex, name);
    variants = inDeclarationOrder(variants, VariantSpec::declarationIndex, name);
    if (kind == Kind.STRUCT && !variants.isEmpty()) {
      throw new IllegalArgumentException("Struct " + name + " must not declare variants");
    }
    if (kind == Kind.ENUM && !fields.isEmpty()) {
      throw new IllegalArgumentException("Enum " + name + " must declare its fields inside variants");
    }
  }

  public static TypeSpec struct(String name, Attributes globalAttributes, List<FieldSpec> fields) {
    return new TypeSpec(name, Kind.STRUCT, globalAttributes, fields, List.of());
  }

  public static TypeSpec enumeration(String name, Attributes globalAttributes, List<VariantSpec> variants) {
    return new TypeSpec(name, Kind.ENUM, globalAttributes, List.of(), variants);
  }

  /// Sort members by their declaration index and require the indexes to be exactly `0..n-1`
  static <M> List<M> inDeclarationOrder(List<M> members, ToIntFunction<M> index, String owner) {
    Objects.requireNonNull(members, "members of " + owner + " must not be null");
    final var sorted = new ArrayList<>(members);
    sorted.sort(Comparator.comparingInt(index));
    IntStream.range(0, sorted.size()).forEach(i -> {
      final int declared = index.applyAsInt(sorted.get(i));
      if (declared != i) {
        throw new IllegalArgumentException("Members of " + owner + " must have declaration indexes 0.." +
            (sorted.size() - 1) + " without gaps or duplicates but found " + declared + " at position " + i);
      }
    });
    return List.copyOf(sorted);
  }
}
