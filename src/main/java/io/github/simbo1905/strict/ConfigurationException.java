// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//

package io.github.simbo1905.strict;

import org.jetbrains.annotations.Nullable;

/// Raised while resolving configuration or deriving a plan. Never raised while processing live data.
public class ConfigurationException extends IllegalArgumentException {

  public enum Kind {
    UNRECOGNIZED_KEY,
    WRONG_VALUE_CLASS,
    PROHIBITED_KEY_PRESENT,
    MUTUALLY_EXCLUSIVE_KEYS,
    INVALID_REPR_KIND,
    DISCRIMINANT_OUT_OF_RANGE,
    DUPLICATE_DISCRIMINANT,
    MISSING_DEFAULT
  }

  private final Kind kind;
  private final @Nullable String key;
  private final String owner;
  private final @Nullable Scope scope;

  ConfigurationException(Kind kind, @Nullable String key, String owner, @Nullable Scope scope, String message) {
    super(kind + " at " + owner + (scope == null ? "" : " (" + scope + " scope)") + ": " + message);
    this.kind = kind;
    this.key = key;
    this.owner = owner;
    this.scope = scope;
  }

  public Kind kind() {
    return kind;
  }

  /// The offending attribute key, if the error concerns one
  public @Nullable String key() {
    return key;
  }

  /// The type, variant or field the attributes were declared on, e.g. `Shape::Circle`
  public String owner() {
    return owner;
  }

  public @Nullable Scope scope() {
    return scope;
  }
}
