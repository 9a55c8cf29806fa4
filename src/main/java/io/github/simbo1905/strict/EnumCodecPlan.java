// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//

package io.github.simbo1905.strict;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/// Encode: the variant's discriminant as a fixed-width integer, then its payload.
/// Decode: read the discriminant, dispatch to the first variant carrying it.
/// @param variants the dispatchable variants in declaration order
/// @param skippedVariants variants that can never be produced or consumed
public record EnumCodecPlan(
    String typeName,
    EncodingPolicy policy,
    List<VariantPlan> variants,
    List<VariantSpec> skippedVariants
) implements CodecPlan {
  public EnumCodecPlan {
    Objects.requireNonNull(typeName, "typeName must not be null");
    Objects.requireNonNull(policy, "policy must not be null");
    variants = List.copyOf(variants);
    skippedVariants = List.copyOf(skippedVariants);
  }

  public DiscriminantRepr repr() {
    return policy.discriminantRepr();
  }

  /// The first variant in declaration order whose discriminant is `discriminant`
  public Optional<VariantPlan> variantFor(long discriminant) {
    return variants.stream().filter(v -> v.discriminant() == discriminant).findFirst();
  }

  public Optional<VariantPlan> variantNamed(String name) {
    return variants.stream().filter(v -> v.name().equals(name)).findFirst();
  }

  public boolean isSkipped(String variantName) {
    return skippedVariants.stream().anyMatch(v -> v.name().equals(variantName));
  }

  @Override
  public String toTreeString() {
    return "enum " + typeName + " as " + repr() + " [" + policy.namespacePath() + "]" +
        variants.stream()
            .map(v -> "\n  " + v + StructCodecPlan.fieldsTree(v.fields(), "    "))
            .collect(Collectors.joining()) +
        skippedVariants.stream().map(v -> "\n  skipped " + v.name()).collect(Collectors.joining());
  }
}
