// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//

package io.github.simbo1905.strict;

/// The level at which configuration is declared
public enum Scope {
  /// Type-level attributes
  GLOBAL,
  /// Field or variant level attributes
  LOCAL
}
