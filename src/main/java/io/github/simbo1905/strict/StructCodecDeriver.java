// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//

package io.github.simbo1905.strict;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import static io.github.simbo1905.strict.ConfigStore.SKIP;
import static io.github.simbo1905.strict.ConfigurationException.Kind.MISSING_DEFAULT;
import static io.github.simbo1905.strict.StrictCodec.LOGGER;

/// Derives the encode/decode procedure of a struct from its resolved per-field policies
public final class StructCodecDeriver {

  private StructCodecDeriver() {
  }

  public static StructCodecPlan derive(TypeSpec type) {
    return derive(type, DefaultValues.standard());
  }

  public static StructCodecPlan derive(TypeSpec type, DefaultValues defaults) {
    Objects.requireNonNull(type, "type must not be null");
    Objects.requireNonNull(defaults, "defaults must not be null");
    if (type.kind() != TypeSpec.Kind.STRUCT) {
      throw new IllegalArgumentException("Not a struct: " + type.name() + " is " + type.kind());
    }
    final var policy = PolicyResolver.resolveGlobal(type);
    final var fields = deriveFields(type.fields(), policy, type.globalAttributes(),
        ResolutionContext.STRUCT_FIELD, type.name(), defaults);
    final var plan = new StructCodecPlan(type.name(), policy, fields);
    LOGGER.fine(() -> "Derived " + plan.toTreeString());
    return plan;
  }

  /// Resolve each field against its enclosing scope and decide whether it is coded or skipped.
  /// Shared by struct bodies and enum variant payloads.
  static List<FieldPlan> deriveFields(List<FieldSpec> fields,
                                      EncodingPolicy parent,
                                      Attributes outer,
                                      ResolutionContext context,
                                      String owner,
                                      DefaultValues defaults) {
    final var plans = new ArrayList<FieldPlan>(fields.size());
    for (FieldSpec field : fields) {
      final String fieldOwner = owner + "." + field.displayName();
      final var policy = PolicyResolver.resolveMember(parent, outer, field.localAttributes(), context, fieldOwner);
      if (policy.skip()) {
        final var defaultValue = defaults.defaultFor(field.valueType()).orElseThrow(() ->
            new ConfigurationException(MISSING_DEFAULT, SKIP, fieldOwner, context.scope(),
                "skipped field of type " + field.valueType().getName() + " has no default value"));
        plans.add(new FieldPlan.Skipped(field, policy, defaultValue));
      } else {
        plans.add(new FieldPlan.Coded(field, policy));
      }
    }
    return plans;
  }
}
