// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//

package io.github.simbo1905.strict;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/// Immutable set of attribute requests declared at one scope, in declaration order
public record Attributes(Map<String, AttrValue> args) {

  public static final Attributes EMPTY = new Attributes(Map.of());

  public Attributes {
    Objects.requireNonNull(args, "args must not be null");
    args.forEach((k, v) -> {
      Objects.requireNonNull(k, "attribute key must not be null");
      Objects.requireNonNull(v, "attribute value must not be null for key " + k);
    });
    args = Collections.unmodifiableMap(new LinkedHashMap<>(args));
  }

  /// Start from a single flag such as `skip`
  public static Attributes flag(String key) {
    return EMPTY.with(key, AttrValue.FLAG);
  }

  public static Attributes of(String key, AttrValue value) {
    return EMPTY.with(key, value);
  }

  public static Attributes of(String k1, AttrValue v1, String k2, AttrValue v2) {
    return EMPTY.with(k1, v1).with(k2, v2);
  }

  public Attributes with(String key, AttrValue value) {
    final var copy = new LinkedHashMap<>(args);
    copy.put(key, value);
    return new Attributes(copy);
  }

  public Attributes withFlag(String key) {
    return with(key, AttrValue.FLAG);
  }

  public boolean contains(String key) {
    return args.containsKey(key);
  }

  public Optional<AttrValue> get(String key) {
    return Optional.ofNullable(args.get(key));
  }

  @Override
  public String toString() {
    return args.entrySet().stream()
        .map(e -> e.getValue() instanceof AttrValue.Flag ? e.getKey() : e.getKey() + " = " + e.getValue())
        .collect(Collectors.joining(", ", "(", ")"));
  }
}
