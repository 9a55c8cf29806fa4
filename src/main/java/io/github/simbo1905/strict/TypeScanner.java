// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//

package io.github.simbo1905.strict;

import java.lang.reflect.RecordComponent;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

import static io.github.simbo1905.strict.StrictCodec.LOGGER;

/// Builds a [TypeSpec] from a Java type, taking declaration order from the class file
/// and attributes from a map keyed by member path.
///
/// Paths:
/// - `""` the type itself
/// - `"field"` a component of a record
/// - `"Variant"` a permitted record subclass of a sealed interface, or an enum constant
/// - `"Variant.field"` a component of that subclass
///
/// A path that names no member is rejected so that misspelt configuration is never silently ignored.
public final class TypeScanner {

  private TypeScanner() {
  }

  public static TypeSpec scan(Class<?> type) {
    return scan(type, Map.of());
  }

  public static TypeSpec scan(Class<?> type, Map<String, Attributes> attributes) {
    Objects.requireNonNull(type, "type must not be null");
    Objects.requireNonNull(attributes, "attributes must not be null");
    final var used = new HashSet<String>();
    final TypeSpec spec;
    if (type.isRecord()) {
      spec = TypeSpec.struct(type.getSimpleName(), lookup(attributes, "", used), fieldsOf(type, "", attributes, used));
    } else if (type.isEnum()) {
      final var variants = new ArrayList<VariantSpec>();
      for (Object constant : type.getEnumConstants()) {
        final var e = (Enum<?>) constant;
        variants.add(new VariantSpec(e.name(), e.ordinal(), e.ordinal(), List.of(), lookup(attributes, e.name(), used)));
      }
      spec = TypeSpec.enumeration(type.getSimpleName(), lookup(attributes, "", used), variants);
    } else if (type.isSealed()) {
      final Class<?>[] permitted = type.getPermittedSubclasses();
      final var variants = new ArrayList<VariantSpec>();
      for (int i = 0; i < permitted.length; i++) {
        final Class<?> variant = permitted[i];
        if (!variant.isRecord()) {
          throw new IllegalArgumentException("Permitted subclass " + variant.getName() + " of " + type.getName() +
              " must be a record");
        }
        final String name = variant.getSimpleName();
        variants.add(new VariantSpec(name, i, i, fieldsOf(variant, name + ".", attributes, used),
            lookup(attributes, name, used)));
      }
      spec = TypeSpec.enumeration(type.getSimpleName(), lookup(attributes, "", used), variants);
    } else {
      throw new IllegalArgumentException("Class must be a record, enum, or sealed interface: " + type);
    }

    final Set<String> unused = new TreeSet<>(attributes.keySet());
    unused.removeAll(used);
    if (!unused.isEmpty()) {
      throw new IllegalArgumentException("Attributes given for paths that name no member of " + type.getName() +
          ": " + unused);
    }
    LOGGER.finer(() -> "Scanned " + type.getName() + " into " + spec);
    return spec;
  }

  private static List<FieldSpec> fieldsOf(Class<?> record, String prefix, Map<String, Attributes> attributes,
                                          Set<String> used) {
    final RecordComponent[] components = record.getRecordComponents();
    final var fields = new ArrayList<FieldSpec>(components.length);
    for (int i = 0; i < components.length; i++) {
      final var component = components[i];
      fields.add(FieldSpec.named(component.getName(), i, component.getType(),
          lookup(attributes, prefix + component.getName(), used)));
    }
    return fields;
  }

  private static Attributes lookup(Map<String, Attributes> attributes, String path, Set<String> used) {
    used.add(path);
    return attributes.getOrDefault(path, Attributes.EMPTY);
  }
}
