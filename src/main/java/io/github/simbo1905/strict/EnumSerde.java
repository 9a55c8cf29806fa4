// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//

package io.github.simbo1905.strict;

import java.nio.ByteBuffer;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/// Enum plan bound to a sealed interface whose permitted subclasses are records, one per variant,
/// matched by simple name
final class EnumSerde<T> implements StrictCodec<T> {

  /// A dispatchable variant and the record its payload binds to
  record Variant(VariantPlan plan, RecordBinding binding) {
  }

  final EnumCodecPlan plan;
  final Class<T> userType;
  final Map<Class<?>, Variant> byClass;
  /// first declared variant wins when discriminants collide
  final Map<Long, Variant> byDiscriminant;
  final Set<Class<?>> skippedClasses;

  EnumSerde(EnumCodecPlan plan, Class<T> userType, CodecRegistry registry) {
    this.plan = Objects.requireNonNull(plan);
    this.userType = Objects.requireNonNull(userType);
    if (!userType.isSealed()) {
      throw new IllegalArgumentException("Enum " + plan.typeName() + " must bind to a sealed type: " + userType);
    }
    final Map<String, Class<?>> permitted = Arrays.stream(userType.getPermittedSubclasses())
        .collect(Collectors.toMap(Class::getSimpleName, c -> c));

    final var classes = new HashMap<Class<?>, Variant>();
    final var discriminants = new HashMap<Long, Variant>();
    for (VariantPlan variantPlan : plan.variants()) {
      final String owner = plan.typeName() + "::" + variantPlan.name();
      final Class<?> variantType = permitted.get(variantPlan.name());
      if (variantType == null) {
        throw new IllegalArgumentException("Variant " + owner + " has no permitted subclass of " +
            userType.getName() + " named " + variantPlan.name() + "; found " + permitted.keySet());
      }
      final var variant = new Variant(variantPlan, new RecordBinding(owner, variantType, variantPlan.fields(), registry));
      classes.put(variantType, variant);
      discriminants.putIfAbsent(variantPlan.discriminant(), variant);
    }

    final var skipped = new HashSet<Class<?>>();
    for (VariantSpec variant : plan.skippedVariants()) {
      final Class<?> variantType = permitted.get(variant.name());
      if (variantType == null) {
        throw new IllegalArgumentException("Skipped variant " + plan.typeName() + "::" + variant.name() +
            " has no permitted subclass of " + userType.getName() + " named " + variant.name() + "; found " +
            permitted.keySet());
      }
      skipped.add(variantType);
    }

    permitted.values().stream()
        .filter(c -> !classes.containsKey(c) && !skipped.contains(c))
        .findAny()
        .ifPresent(c -> {
          throw new IllegalArgumentException("Permitted subclass " + c.getName() + " of " + userType.getName() +
              " is not a variant of " + plan.typeName());
        });

    this.byClass = Map.copyOf(classes);
    this.byDiscriminant = Map.copyOf(discriminants);
    this.skippedClasses = Set.copyOf(skipped);
    LOGGER.fine(() -> "EnumSerde " + userType.getName() + " construction complete for " + plan.toTreeString());
  }

  @Override
  public int encode(ByteBuffer sink, T value) {
    Objects.requireNonNull(sink);
    Objects.requireNonNull(value);
    final var variant = byClass.get(value.getClass());
    if (variant == null) {
      if (skippedClasses.contains(value.getClass())) {
        throw new IllegalArgumentException("Variant " + value.getClass().getSimpleName() + " of " + plan.typeName() +
            " is skipped and cannot be encoded");
      }
      throw new IllegalArgumentException("Expected a variant of " + userType + " but got " + value.getClass());
    }
    final int start = sink.position();
    int length = plan.repr().write(sink, variant.plan().discriminant());
    length += variant.binding().encodeFields(sink, value);
    final int total = length;
    LOGGER.fine(() -> "EnumSerde " + plan.typeName() + " wrote " + variant.plan() + " in " + total + " bytes @" + start);
    return length;
  }

  @Override
  public T decode(ByteBuffer source) {
    Objects.requireNonNull(source);
    final int start = source.position();
    final long discriminant = plan.repr().read(source);
    final var variant = byDiscriminant.get(discriminant);
    if (variant == null) {
      LOGGER.fine(() -> "EnumSerde " + plan.typeName() + " read unknown discriminant " +
          Long.toUnsignedString(discriminant) + " @" + start);
      throw new UnknownVariantException(plan.typeName(), discriminant);
    }
    @SuppressWarnings("unchecked") final T result = (T) variant.binding().decodeFields(source);
    LOGGER.fine(() -> "EnumSerde " + plan.typeName() + " read " + variant.plan() + " @" + start + " to @" +
        source.position());
    return result;
  }

  @Override
  public EnumCodecPlan plan() {
    return plan;
  }

  @Override
  public Class<T> javaType() {
    return userType;
  }

  @Override
  public String toString() {
    return "EnumSerde{userType=" + userType.getName() + ", repr=" + plan.repr() + ", variants=" + plan.variants() + "}";
  }
}
