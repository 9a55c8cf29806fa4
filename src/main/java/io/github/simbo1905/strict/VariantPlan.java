// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//

package io.github.simbo1905.strict;

import java.util.List;
import java.util.Objects;

/// A dispatchable variant: its assigned discriminant and its payload laid out like a struct
/// @param discriminant unsigned, already checked to fit the enum's repr
public record VariantPlan(VariantSpec variant, EncodingPolicy policy, long discriminant, List<FieldPlan> fields) {
  public VariantPlan {
    Objects.requireNonNull(variant, "variant must not be null");
    Objects.requireNonNull(policy, "policy must not be null");
    fields = List.copyOf(fields);
  }

  public String name() {
    return variant.name();
  }

  @Override
  public String toString() {
    return "VariantPlan[" + variant.name() + " = " + Long.toUnsignedString(discriminant) + "]";
  }
}
