// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//

package io.github.simbo1905.strict;

import org.jetbrains.annotations.NotNull;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/// The already-parsed value of one configuration attribute.
/// A key written without a value is a [Flag].
public sealed interface AttrValue permits AttrValue.Flag, AttrValue.Ident, AttrValue.Path, AttrValue.Int {

  /// The class of a value, used by requirement tables
  enum ValueClass {
    FLAG,
    IDENT,
    PATH,
    INT
  }

  ValueClass valueClass();

  /// True if this value may stand where `required` is expected. An identifier is a one segment path.
  default boolean conformsTo(ValueClass required) {
    return valueClass() == required || (required == ValueClass.PATH && valueClass() == ValueClass.IDENT);
  }

  AttrValue FLAG = new Flag();

  static AttrValue ident(String name) {
    return new Ident(name);
  }

  /// Parse a `::` separated path such as `my::codecs`
  static AttrValue path(String path) {
    Objects.requireNonNull(path, "path must not be null");
    final var segments = Arrays.asList(path.split("::"));
    return segments.size() == 1 ? new Ident(segments.get(0)) : new Path(segments);
  }

  static AttrValue integer(long value) {
    return new Int(BigInteger.valueOf(value));
  }

  static AttrValue integer(BigInteger value) {
    return new Int(value);
  }

  record Flag() implements AttrValue {
    @Override
    public ValueClass valueClass() {
      return ValueClass.FLAG;
    }

    @Override
    public String toString() {
      return "<flag>";
    }
  }

  record Ident(@NotNull String name) implements AttrValue {
    public Ident {
      Objects.requireNonNull(name, "name must not be null");
      if (name.isBlank() || name.contains("::")) {
        throw new IllegalArgumentException("Not an identifier: '" + name + "'");
      }
    }

    @Override
    public ValueClass valueClass() {
      return ValueClass.IDENT;
    }

    @Override
    public String toString() {
      return name;
    }
  }

  record Path(@NotNull List<String> segments) implements AttrValue {
    public Path {
      segments = List.copyOf(segments);
      if (segments.isEmpty() || segments.stream().anyMatch(String::isBlank)) {
        throw new IllegalArgumentException("Not an identifier path: " + segments);
      }
    }

    @Override
    public ValueClass valueClass() {
      return ValueClass.PATH;
    }

    @Override
    public String toString() {
      return String.join("::", segments);
    }
  }

  record Int(@NotNull BigInteger value) implements AttrValue {
    public Int {
      Objects.requireNonNull(value, "value must not be null");
    }

    @Override
    public ValueClass valueClass() {
      return ValueClass.INT;
    }

    @Override
    public String toString() {
      return value.toString();
    }
  }
}
