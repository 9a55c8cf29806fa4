// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//

package io.github.simbo1905.strict;

/// How a variant's discriminant is chosen
public sealed interface DiscriminantMode permits
    DiscriminantMode.ByDeclarationOrder, DiscriminantMode.ExplicitValue, DiscriminantMode.ByNativeOrdinal {

  DiscriminantMode BY_DECLARATION_ORDER = new ByDeclarationOrder();
  DiscriminantMode BY_NATIVE_ORDINAL = new ByNativeOrdinal();

  /// Zero-based index of the variant among all declared variants
  record ByDeclarationOrder() implements DiscriminantMode {
  }

  /// An explicit `value` attribute. Unsigned; may use all 64 bits.
  record ExplicitValue(long value) implements DiscriminantMode {
    @Override
    public String toString() {
      return "ExplicitValue[value=" + Long.toUnsignedString(value) + "]";
    }
  }

  /// The variant's intrinsic ordinal
  record ByNativeOrdinal() implements DiscriminantMode {
  }
}
