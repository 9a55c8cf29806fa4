// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//

package io.github.simbo1905.strict;

import org.jetbrains.annotations.NotNull;

import java.nio.ByteBuffer;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/// Enum plan bound to a Java enum. Every variant is a unit variant matched to the constant of the same name.
final class NativeEnumSerde<E extends Enum<E>> implements StrictCodec<E> {
  final EnumCodecPlan plan;
  final Class<E> enumType;
  /// indexed by ordinal; null for skipped constants
  final Long[] discriminants;
  final Map<Long, E> byDiscriminant;

  NativeEnumSerde(@NotNull EnumCodecPlan plan, @NotNull Class<E> enumType) {
    assert enumType.isEnum() : "User type must be an enum: " + enumType;
    this.plan = Objects.requireNonNull(plan);
    this.enumType = enumType;

    final E[] constants = enumType.getEnumConstants();
    this.discriminants = new Long[constants.length];
    final var decoded = new HashMap<Long, E>();
    for (VariantPlan variant : plan.variants()) {
      if (!variant.fields().isEmpty()) {
        throw new IllegalArgumentException("Variant " + plan.typeName() + "::" + variant.name() +
            " has fields so cannot bind to the constant of Java enum " + enumType.getName());
      }
      final E constant = constantNamed(variant.name());
      discriminants[constant.ordinal()] = variant.discriminant();
      decoded.putIfAbsent(variant.discriminant(), constant);
    }
    plan.skippedVariants().forEach(v -> constantNamed(v.name()));
    for (E constant : constants) {
      if (discriminants[constant.ordinal()] == null && !plan.isSkipped(constant.name())) {
        throw new IllegalArgumentException("Constant " + constant + " of " + enumType.getName() +
            " is not a variant of " + plan.typeName());
      }
    }
    this.byDiscriminant = Map.copyOf(decoded);

    LOGGER.fine(() -> "NativeEnumSerde " + enumType.getName() + " construction complete for " + plan.toTreeString());
  }

  private E constantNamed(String name) {
    try {
      return Enum.valueOf(enumType, name);
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Variant " + plan.typeName() + "::" + name + " has no constant in " +
          enumType.getName(), e);
    }
  }

  @Override
  public int encode(ByteBuffer sink, E value) {
    Objects.requireNonNull(sink);
    Objects.requireNonNull(value);
    if (!enumType.isAssignableFrom(value.getDeclaringClass())) {
      throw new IllegalArgumentException("Expected " + enumType + " but got " + value.getDeclaringClass());
    }
    final Long discriminant = discriminants[value.ordinal()];
    if (discriminant == null) {
      throw new IllegalArgumentException("Variant " + value + " of " + plan.typeName() + " is skipped and cannot be encoded");
    }
    LOGGER.finer(() -> "NativeEnumSerde " + plan.typeName() + " writing " + value + " as " +
        Long.toUnsignedString(discriminant) + " @" + sink.position());
    return plan.repr().write(sink, discriminant);
  }

  @Override
  public E decode(ByteBuffer source) {
    Objects.requireNonNull(source);
    final long discriminant = plan.repr().read(source);
    final E constant = byDiscriminant.get(discriminant);
    if (constant == null) {
      throw new UnknownVariantException(plan.typeName(), discriminant);
    }
    return constant;
  }

  @Override
  public EnumCodecPlan plan() {
    return plan;
  }

  @Override
  public Class<E> javaType() {
    return enumType;
  }

  @Override
  public String toString() {
    return "NativeEnumSerde{enumType=" + enumType.getName() + ", repr=" + plan.repr() + ", variants=" +
        plan.variants() + "}";
  }
}
