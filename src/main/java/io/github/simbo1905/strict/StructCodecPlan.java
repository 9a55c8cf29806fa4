// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//

package io.github.simbo1905.strict;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/// Encode: each coded field in declaration order, concatenated. Decode: the same order, skipped fields defaulted.
public record StructCodecPlan(String typeName, EncodingPolicy policy, List<FieldPlan> fields) implements CodecPlan {
  public StructCodecPlan {
    Objects.requireNonNull(typeName, "typeName must not be null");
    Objects.requireNonNull(policy, "policy must not be null");
    fields = List.copyOf(fields);
  }

  /// The fields that appear on the wire
  public List<FieldPlan.Coded> codedFields() {
    return fields.stream()
        .filter(FieldPlan.Coded.class::isInstance)
        .map(FieldPlan.Coded.class::cast)
        .toList();
  }

  @Override
  public String toTreeString() {
    return "struct " + typeName + " [" + policy.namespacePath() + "]" + fieldsTree(fields, "  ");
  }

  static String fieldsTree(List<FieldPlan> fields, String indent) {
    return fields.stream().map(f -> "\n" + indent + f).collect(Collectors.joining());
  }
}
