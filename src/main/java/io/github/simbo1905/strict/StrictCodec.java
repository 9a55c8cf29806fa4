// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//

package io.github.simbo1905.strict;

import java.nio.ByteBuffer;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/// A [CodecPlan] bound to a Java type: executes the strict encoding of records, sealed interfaces of records
/// and enums. A bound codec is itself a [ValueCodec] so it can be registered for use as a member of another type.
public sealed interface StrictCodec<T> extends ValueCodec<T> permits StructSerde, EnumSerde, NativeEnumSerde {

  Logger LOGGER = Logger.getLogger(StrictCodec.class.getName());

  /// Encode a value at the sink's position
  /// @return the number of bytes written
  @Override
  int encode(ByteBuffer sink, T value);

  /// Decode a value at the source's position. Fails fast on the first field or discriminant error.
  /// @throws UnknownVariantException if an enum discriminant matches no variant
  @Override
  T decode(ByteBuffer source);

  CodecPlan plan();

  Class<T> javaType();

  /// Derive and bind a plan for a record, sealed interface or enum, attaching attributes by member path.
  /// See [TypeScanner#scan] for the path syntax.
  static <T> StrictCodec<T> forClass(Class<T> type, Map<String, Attributes> attributes) {
    return forType(TypeScanner.scan(type, attributes), type);
  }

  static <T> StrictCodec<T> forClass(Class<T> type) {
    return forClass(type, Map.of());
  }

  /// Derive a plan with the standard default values and bind it with the standard namespaces
  static <T> StrictCodec<T> forType(TypeSpec spec, Class<T> type) {
    return forType(spec, type, CodecNamespaces.standard(), DefaultValues.standard());
  }

  static <T> StrictCodec<T> forType(TypeSpec spec, Class<T> type, CodecNamespaces namespaces, DefaultValues defaults) {
    Objects.requireNonNull(spec, "spec must not be null");
    final CodecPlan plan = spec.kind() == TypeSpec.Kind.STRUCT
        ? StructCodecDeriver.derive(spec, defaults)
        : EnumCodecDeriver.derive(spec, defaults);
    return forPlan(plan, type, namespaces);
  }

  /// Bind a derived plan to a Java type
  /// @throws IllegalArgumentException if the type's shape does not match the plan or a member has no value codec
  /// in the plan's namespace
  @SuppressWarnings({"unchecked", "rawtypes"})
  static <T> StrictCodec<T> forPlan(CodecPlan plan, Class<T> type, CodecNamespaces namespaces) {
    Objects.requireNonNull(plan, "plan must not be null");
    Objects.requireNonNull(type, "type must not be null");
    Objects.requireNonNull(namespaces, "namespaces must not be null");
    final var registry = namespaces.registryFor(plan.policy());
    final StrictCodec<T> codec;
    if (plan instanceof StructCodecPlan struct) {
      codec = new StructSerde<>(struct, type, registry);
    } else if (plan instanceof EnumCodecPlan enumeration && type.isEnum()) {
      codec = new NativeEnumSerde(enumeration, type);
    } else if (plan instanceof EnumCodecPlan enumeration && type.isSealed()) {
      codec = new EnumSerde<>(enumeration, type, registry);
    } else {
      throw new IllegalArgumentException("Cannot bind " + plan.typeName() + " to " + type.getName() +
          ": an enum plan needs a Java enum or a sealed interface of records");
    }
    LOGGER.info(() -> "Bound " + plan.typeName() + " to " + type.getName() + " as " + codec);
    return codec;
  }
}
