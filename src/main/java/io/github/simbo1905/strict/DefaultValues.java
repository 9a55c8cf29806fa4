// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//

package io.github.simbo1905.strict;

import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.reflect.RecordComponent;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

import static io.github.simbo1905.strict.StrictCodec.LOGGER;

/// The default-value capability a type must have to sit in a skip-marked position.
/// Looked up while deriving a plan so a missing default is a configuration error, not a decode failure.
@FunctionalInterface
public interface DefaultValues {

  Optional<Supplier<?>> defaultFor(Class<?> type);

  /// Primitives and their boxes default to zero (`false` for booleans), `String` to empty, `byte[]` to an empty
  /// array, and records to an instance built from their components' defaults when every component has one and
  /// the record's constructor accepts them. The record default is built once on lookup to prove that.
  static DefaultValues standard() {
    return Standard.INSTANCE;
  }

  /// A new lookup that answers `supplier` for `type` and delegates everything else to this one
  default <T> DefaultValues with(Class<T> type, Supplier<? extends T> supplier) {
    Objects.requireNonNull(type, "type must not be null");
    Objects.requireNonNull(supplier, "supplier must not be null");
    final DefaultValues fallback = this;
    return t -> t.equals(type) ? Optional.<Supplier<?>>of(supplier) : fallback.defaultFor(t);
  }

  final class Standard implements DefaultValues {
    static final Standard INSTANCE = new Standard();

    static final Map<Class<?>, Object> ZEROS = Map.ofEntries(
        Map.entry(boolean.class, false), Map.entry(Boolean.class, false),
        Map.entry(byte.class, (byte) 0), Map.entry(Byte.class, (byte) 0),
        Map.entry(short.class, (short) 0), Map.entry(Short.class, (short) 0),
        Map.entry(char.class, '\u0000'), Map.entry(Character.class, '\u0000'),
        Map.entry(int.class, 0), Map.entry(Integer.class, 0),
        Map.entry(long.class, 0L), Map.entry(Long.class, 0L),
        Map.entry(float.class, 0.0f), Map.entry(Float.class, 0.0f),
        Map.entry(double.class, 0.0), Map.entry(Double.class, 0.0),
        Map.entry(String.class, "")
    );

    private Standard() {
    }

    @Override
    public Optional<Supplier<?>> defaultFor(Class<?> type) {
      return defaultFor(type, new HashMap<>());
    }

    private Optional<Supplier<?>> defaultFor(Class<?> type, Map<Class<?>, Boolean> visiting) {
      final Object zero = ZEROS.get(type);
      if (zero != null) {
        return Optional.<Supplier<?>>of(() -> zero);
      }
      if (type == byte[].class) {
        return Optional.<Supplier<?>>of(() -> new byte[0]);
      }
      // a record that contains itself has no finite default
      if (type.isRecord() && visiting.putIfAbsent(type, Boolean.TRUE) == null) {
        try {
          return recordDefault(type, visiting);
        } finally {
          visiting.remove(type);
        }
      }
      return Optional.empty();
    }

    private Optional<Supplier<?>> recordDefault(Class<?> type, Map<Class<?>, Boolean> visiting) {
      final RecordComponent[] components = type.getRecordComponents();
      final Supplier<?>[] suppliers = new Supplier<?>[components.length];
      for (int i = 0; i < components.length; i++) {
        final var component = defaultFor(components[i].getType(), visiting);
        if (component.isEmpty()) {
          LOGGER.finer(() -> "No default for record " + type.getName() + " as a component has none");
          return Optional.empty();
        }
        suppliers[i] = component.get();
      }
      final MethodHandle constructor;
      try {
        final Class<?>[] parameterTypes = Arrays.stream(components)
            .map(RecordComponent::getType)
            .toArray(Class<?>[]::new);
        constructor = MethodHandles.lookup().unreflectConstructor(type.getDeclaredConstructor(parameterTypes));
      } catch (ReflectiveOperationException e) {
        LOGGER.finer(() -> "No default for record " + type.getName() + ": " + e.getMessage());
        return Optional.empty();
      }
      final Supplier<?> supplier = () -> {
        final Object[] args = Arrays.stream(suppliers).map(Supplier::get).toArray();
        try {
          return constructor.invokeWithArguments(args);
        } catch (Throwable e) {
          throw new IllegalStateException("Failed to construct default " + type.getName(), e);
        }
      };
      // a compact constructor may reject the zero values
      try {
        supplier.get();
      } catch (IllegalStateException e) {
        LOGGER.finer(() -> "No default for record " + type.getName() + ": " + e.getCause());
        return Optional.empty();
      }
      return Optional.<Supplier<?>>of(supplier);
    }
  }
}
