// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//

package io.github.simbo1905.strict;

import java.nio.ByteBuffer;
import java.util.Objects;

/// Struct plan bound to a record. A zero-field record writes nothing and reads nothing.
final class StructSerde<T> implements StrictCodec<T> {
  final StructCodecPlan plan;
  final Class<T> userType;
  final RecordBinding binding;

  StructSerde(StructCodecPlan plan, Class<T> userType, CodecRegistry registry) {
    this.plan = Objects.requireNonNull(plan);
    this.userType = Objects.requireNonNull(userType);
    this.binding = new RecordBinding(plan.typeName(), userType, plan.fields(), registry);
    LOGGER.fine(() -> "StructSerde " + userType.getName() + " construction complete for " + plan.toTreeString());
  }

  @Override
  public int encode(ByteBuffer sink, T record) {
    Objects.requireNonNull(sink);
    Objects.requireNonNull(record);
    if (!userType.isAssignableFrom(record.getClass())) {
      throw new IllegalArgumentException("Expected " + userType + " but got " + record.getClass());
    }
    final int start = sink.position();
    final int length = binding.encodeFields(sink, record);
    LOGGER.fine(() -> "StructSerde " + plan.typeName() + " wrote " + length + " bytes @" + start);
    return length;
  }

  @Override
  public T decode(ByteBuffer source) {
    Objects.requireNonNull(source);
    final int start = source.position();
    @SuppressWarnings("unchecked") final T result = (T) binding.decodeFields(source);
    LOGGER.fine(() -> "StructSerde " + plan.typeName() + " read @" + start + " to @" + source.position());
    return result;
  }

  @Override
  public StructCodecPlan plan() {
    return plan;
  }

  @Override
  public Class<T> javaType() {
    return userType;
  }

  @Override
  public String toString() {
    return "StructSerde{userType=" + userType.getName() + ", fields=" + plan.fields() + "}";
  }
}
