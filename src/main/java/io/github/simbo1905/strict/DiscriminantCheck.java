// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//

package io.github.simbo1905.strict;

import java.util.Arrays;

/// How enum derivation treats two dispatchable variants that are assigned the same discriminant.
/// Set via system property `strict.encoding.DiscriminantCheck`. The default is STRICT.
///
/// **STRICT** (the default) fails derivation with [ConfigurationException.Kind#DUPLICATE_DISCRIMINANT].
///
/// **FIRST_MATCH** (the opt-in) logs a warning and accepts the plan. Decode then always selects the first
/// declared variant with that discriminant, so the later variants can be encoded but never decoded.
public enum DiscriminantCheck {
  STRICT,
  FIRST_MATCH;

  public static final String PROPERTY = "strict.encoding.DiscriminantCheck";

  public static DiscriminantCheck current() {
    final String mode = System.getProperty(PROPERTY, STRICT.name()).trim().toUpperCase();
    try {
      return DiscriminantCheck.valueOf(mode);
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Invalid discriminant check mode: " + mode + ". Must be one of: " +
          Arrays.toString(DiscriminantCheck.values()), e);
    }
  }
}
