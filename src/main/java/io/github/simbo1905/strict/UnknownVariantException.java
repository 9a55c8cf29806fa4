// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//

package io.github.simbo1905.strict;

/// A decoded discriminant matches no dispatchable variant. Nothing was constructed.
public class UnknownVariantException extends IllegalStateException {
  private final String typeName;
  private final long rawValue;

  public UnknownVariantException(String typeName, long rawValue) {
    super("Unknown variant of " + typeName + ": discriminant " + Long.toUnsignedString(rawValue));
    this.typeName = typeName;
    this.rawValue = rawValue;
  }

  public String typeName() {
    return typeName;
  }

  /// The discriminant as read, unsigned
  public long rawValue() {
    return rawValue;
  }
}
