// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//

package io.github.simbo1905.strict;

import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.reflect.Constructor;
import java.lang.reflect.RecordComponent;
import java.nio.ByteBuffer;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import static io.github.simbo1905.strict.StrictCodec.LOGGER;

/// A list of field plans attached to the components of a record class through method handles.
/// Used for struct bodies and for enum variant payloads.
final class RecordBinding {
  private static final Map<Class<?>, Class<?>> BOXES = Map.of(
      boolean.class, Boolean.class, byte.class, Byte.class, short.class, Short.class, char.class, Character.class,
      int.class, Integer.class, long.class, Long.class, float.class, Float.class, double.class, Double.class);

  final String owner;
  final Class<?> recordType;
  final FieldPlan[] fields;
  final MethodHandle recordConstructor;
  final MethodHandle[] componentAccessors;
  /// null where the field is skipped
  final ValueCodec<Object>[] codecs;

  @SuppressWarnings("unchecked")
  RecordBinding(String owner, Class<?> recordType, List<FieldPlan> fields, CodecRegistry registry) {
    this.owner = Objects.requireNonNull(owner);
    this.recordType = Objects.requireNonNull(recordType);
    this.fields = fields.toArray(FieldPlan[]::new);
    if (!recordType.isRecord()) {
      throw new IllegalArgumentException(owner + " must bind to a record but " + recordType.getName() + " is not one");
    }
    final RecordComponent[] components = recordType.getRecordComponents();
    if (components.length != this.fields.length) {
      throw new IllegalArgumentException(owner + " declares " + this.fields.length + " fields but record " +
          recordType.getName() + " has " + components.length + " components");
    }

    this.codecs = (ValueCodec<Object>[]) new ValueCodec[this.fields.length];
    for (int i = 0; i < components.length; i++) {
      final FieldSpec field = this.fields[i].field();
      final RecordComponent component = components[i];
      if (field.name() != null && !field.name().equals(component.getName())) {
        throw new IllegalArgumentException(owner + " field " + i + " is named " + field.name() +
            " but record component " + i + " of " + recordType.getName() + " is " + component.getName());
      }
      if (!box(component.getType()).isAssignableFrom(box(field.valueType()))) {
        throw new IllegalArgumentException(owner + "." + field.displayName() + " has value type " +
            field.valueType().getName() + " which does not fit component type " + component.getType().getName());
      }
      if (this.fields[i] instanceof FieldPlan.Coded coded) {
        codecs[i] = registry.codecFor(field.valueType()).orElseThrow(() -> new IllegalArgumentException(
            "No value codec for " + field.valueType().getName() + " needed by " + owner + "." + field.displayName() +
                " in namespace " + coded.policy().namespacePath() + " " + registry));
      }
    }

    try {
      final Class<?>[] parameterTypes = Arrays.stream(components)
          .map(RecordComponent::getType)
          .toArray(Class<?>[]::new);
      final Constructor<?> constructor = recordType.getDeclaredConstructor(parameterTypes);
      this.recordConstructor = MethodHandles.lookup().unreflectConstructor(constructor);
    } catch (ReflectiveOperationException e) {
      throw new IllegalArgumentException("Failed to create constructor handle for " + recordType, e);
    }

    componentAccessors = Arrays.stream(components)
        .map(component -> {
          try {
            return MethodHandles.lookup().unreflect(component.getAccessor());
          } catch (IllegalAccessException e) {
            throw new IllegalArgumentException("Failed to create accessor for " + component.getName(), e);
          }
        })
        .toArray(MethodHandle[]::new);
  }

  /// Write every coded field in declaration order
  /// @return the sum of the byte counts the field codecs report
  int encodeFields(ByteBuffer sink, Object record) {
    int length = 0;
    for (int i = 0; i < fields.length; i++) {
      if (codecs[i] == null) {
        continue;
      }
      final Object component;
      try {
        component = componentAccessors[i].invoke(record);
      } catch (Throwable e) {
        throw new IllegalStateException("Failed to read " + owner + "." + fields[i].field().displayName(), e);
      }
      final int start = sink.position();
      length += codecs[i].encode(sink, component);
      final int index = i;
      LOGGER.finer(() -> "Wrote " + owner + "." + fields[index].field().displayName() + " @" + start + " to @" +
          sink.position());
    }
    return length;
  }

  /// Read every coded field in declaration order, default the skipped ones, then construct the record.
  /// Field codec failures propagate unwrapped and nothing is constructed.
  Object decodeFields(ByteBuffer source) {
    final Object[] components = new Object[fields.length];
    for (int i = 0; i < fields.length; i++) {
      if (fields[i] instanceof FieldPlan.Skipped skipped) {
        components[i] = skipped.defaultValue().get();
      } else {
        final int start = source.position();
        components[i] = codecs[i].decode(source);
        final int index = i;
        LOGGER.finer(() -> "Read " + owner + "." + fields[index].field().displayName() + " @" + start + " to @" +
            source.position());
      }
    }
    try {
      return recordConstructor.invokeWithArguments(components);
    } catch (RuntimeException e) {
      throw e;
    } catch (Throwable e) {
      throw new IllegalStateException("Failed to construct " + recordType.getName(), e);
    }
  }

  private static Class<?> box(Class<?> type) {
    return BOXES.getOrDefault(type, type);
  }
}
