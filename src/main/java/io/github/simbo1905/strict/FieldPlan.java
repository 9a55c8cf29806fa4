// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//

package io.github.simbo1905.strict;

import java.util.Objects;
import java.util.function.Supplier;

/// What happens to one field on encode and decode
public sealed interface FieldPlan permits FieldPlan.Coded, FieldPlan.Skipped {

  FieldSpec field();

  EncodingPolicy policy();

  /// Written by its own value codec on encode, read back by it on decode
  record Coded(FieldSpec field, EncodingPolicy policy) implements FieldPlan {
    public Coded {
      Objects.requireNonNull(field, "field must not be null");
      Objects.requireNonNull(policy, "policy must not be null");
    }

    @Override
    public String toString() {
      return "Coded[" + field.displayName() + ": " + field.valueType().getSimpleName() + "]";
    }
  }

  /// Absent from the wire. Decode populates it from `defaultValue` and consumes nothing.
  record Skipped(FieldSpec field, EncodingPolicy policy, Supplier<?> defaultValue) implements FieldPlan {
    public Skipped {
      Objects.requireNonNull(field, "field must not be null");
      Objects.requireNonNull(policy, "policy must not be null");
      Objects.requireNonNull(defaultValue, "defaultValue must not be null");
    }

    @Override
    public String toString() {
      return "Skipped[" + field.displayName() + ": " + field.valueType().getSimpleName() + "]";
    }
  }
}
