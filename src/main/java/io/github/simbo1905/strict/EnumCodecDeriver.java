// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//

package io.github.simbo1905.strict;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Objects;

import static io.github.simbo1905.strict.ConfigStore.VARIANT_ONLY;
import static io.github.simbo1905.strict.ConfigurationException.Kind.DISCRIMINANT_OUT_OF_RANGE;
import static io.github.simbo1905.strict.ConfigurationException.Kind.DUPLICATE_DISCRIMINANT;
import static io.github.simbo1905.strict.StrictCodec.LOGGER;

/// Derives discriminant assignment and the encode/decode dispatch of an enumeration
public final class EnumCodecDeriver {

  private EnumCodecDeriver() {
  }

  public static EnumCodecPlan derive(TypeSpec type) {
    return derive(type, DefaultValues.standard(), DiscriminantCheck.current());
  }

  public static EnumCodecPlan derive(TypeSpec type, DefaultValues defaults) {
    return derive(type, defaults, DiscriminantCheck.current());
  }

  public static EnumCodecPlan derive(TypeSpec type, DefaultValues defaults, DiscriminantCheck check) {
    Objects.requireNonNull(type, "type must not be null");
    Objects.requireNonNull(defaults, "defaults must not be null");
    Objects.requireNonNull(check, "check must not be null");
    if (type.kind() != TypeSpec.Kind.ENUM) {
      throw new IllegalArgumentException("Not an enum: " + type.name() + " is " + type.kind());
    }
    final var policy = PolicyResolver.resolveGlobal(type);

    final var variants = new ArrayList<VariantPlan>();
    final var skipped = new ArrayList<VariantSpec>();
    for (VariantSpec variant : type.variants()) {
      final String owner = type.name() + "::" + variant.name();
      final var variantPolicy = PolicyResolver.resolveMember(policy, type.globalAttributes(),
          variant.localAttributes(), ResolutionContext.ENUM_VARIANT, owner);
      if (variantPolicy.skip()) {
        LOGGER.fine(() -> "Variant " + owner + " is skipped and excluded from dispatch");
        skipped.add(variant);
        continue;
      }
      final long discriminant = assign(variant, variantPolicy, owner);
      // fields inherit from the variant, not from the enum
      final var fieldOuter = ConfigStore.strip(variant.localAttributes(), VARIANT_ONLY);
      final var fields = StructCodecDeriver.deriveFields(variant.fields(), policy, fieldOuter,
          ResolutionContext.VARIANT_FIELD, owner, defaults);
      variants.add(new VariantPlan(variant, variantPolicy, discriminant, fields));
    }

    checkUnique(type.name(), variants, check);
    final var plan = new EnumCodecPlan(type.name(), policy, variants, skipped);
    LOGGER.fine(() -> "Derived " + plan.toTreeString());
    return plan;
  }

  /// An explicit value wins, then declaration order, then the native ordinal
  static long assign(VariantSpec variant, EncodingPolicy policy, String owner) {
    final var mode = policy.discriminantMode();
    final BigInteger candidate;
    if (mode instanceof DiscriminantMode.ExplicitValue explicit) {
      return explicit.value();
    } else if (mode instanceof DiscriminantMode.ByDeclarationOrder) {
      candidate = BigInteger.valueOf(variant.declarationIndex());
    } else {
      candidate = BigInteger.valueOf(variant.nativeOrdinal());
    }
    if (!policy.discriminantRepr().fits(candidate)) {
      throw new ConfigurationException(DISCRIMINANT_OUT_OF_RANGE, null, owner, Scope.LOCAL,
          mode + " assigns " + candidate + " which does not fit in " + policy.discriminantRepr());
    }
    return candidate.longValue();
  }

  private static void checkUnique(String typeName, List<VariantPlan> variants, DiscriminantCheck check) {
    final var seen = new HashMap<Long, VariantPlan>();
    for (VariantPlan variant : variants) {
      final var first = seen.putIfAbsent(variant.discriminant(), variant);
      if (first == null) {
        continue;
      }
      final String message = "variants " + first.name() + " and " + variant.name() + " share discriminant " +
          Long.toUnsignedString(variant.discriminant());
      if (check == DiscriminantCheck.STRICT) {
        throw new ConfigurationException(DUPLICATE_DISCRIMINANT, null, typeName + "::" + variant.name(),
            Scope.LOCAL, message);
      }
      LOGGER.warning(() -> "Enum " + typeName + ": " + message + "; decode will always select " + first.name());
    }
  }
}
