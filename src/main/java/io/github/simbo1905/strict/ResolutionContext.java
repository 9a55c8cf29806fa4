// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//

package io.github.simbo1905.strict;

import java.util.LinkedHashMap;
import java.util.Map;

import static io.github.simbo1905.strict.AttributeRequirement.FLAG;
import static io.github.simbo1905.strict.AttributeRequirement.PROHIBITED;
import static io.github.simbo1905.strict.ConfigStore.BY_ORDER;
import static io.github.simbo1905.strict.ConfigStore.BY_VALUE;
import static io.github.simbo1905.strict.ConfigStore.CRATE;
import static io.github.simbo1905.strict.ConfigStore.REPR;
import static io.github.simbo1905.strict.ConfigStore.SKIP;
import static io.github.simbo1905.strict.ConfigStore.VALUE;

/// Where an attribute set is being resolved. Each context carries the requirement table for every recognized key.
public enum ResolutionContext {
  STRUCT_GLOBAL(Scope.GLOBAL),
  STRUCT_FIELD(Scope.LOCAL),
  ENUM_GLOBAL(Scope.GLOBAL),
  ENUM_VARIANT(Scope.LOCAL),
  VARIANT_FIELD(Scope.LOCAL);

  /// The codec namespace used when `crate` is not given
  public static final AttrValue DEFAULT_NAMESPACE = AttrValue.ident("strict_encoding");
  /// The discriminant width used when `repr` is not given
  public static final AttrValue DEFAULT_REPR = AttrValue.ident("u8");

  private final Scope scope;

  ResolutionContext(Scope scope) {
    this.scope = scope;
  }

  public Scope scope() {
    return scope;
  }

  /// The requirement for every recognized key in this context, in a stable order
  Map<String, AttributeRequirement> requirements() {
    final var map = new LinkedHashMap<String, AttributeRequirement>();
    for (String key : ConfigStore.RECOGNIZED_KEYS) {
      map.put(key, PROHIBITED);
    }
    switch (this) {
      case STRUCT_GLOBAL -> map.put(CRATE, AttributeRequirement.withDefault(DEFAULT_NAMESPACE, AttrValue.ValueClass.PATH));
      case STRUCT_FIELD, VARIANT_FIELD -> map.put(SKIP, FLAG);
      case ENUM_GLOBAL -> {
        map.put(CRATE, AttributeRequirement.withDefault(DEFAULT_NAMESPACE, AttrValue.ValueClass.PATH));
        map.put(REPR, AttributeRequirement.withDefault(DEFAULT_REPR, AttrValue.ValueClass.IDENT));
        map.put(BY_ORDER, FLAG);
        map.put(BY_VALUE, FLAG);
      }
      case ENUM_VARIANT -> {
        map.put(SKIP, FLAG);
        map.put(BY_ORDER, FLAG);
        map.put(BY_VALUE, FLAG);
        map.put(VALUE, AttributeRequirement.optional(AttrValue.ValueClass.INT));
      }
    }
    return map;
  }
}
