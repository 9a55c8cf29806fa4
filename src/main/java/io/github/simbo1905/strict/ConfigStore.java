// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//

package io.github.simbo1905.strict;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static io.github.simbo1905.strict.ConfigurationException.Kind.MUTUALLY_EXCLUSIVE_KEYS;
import static io.github.simbo1905.strict.ConfigurationException.Kind.PROHIBITED_KEY_PRESENT;
import static io.github.simbo1905.strict.ConfigurationException.Kind.UNRECOGNIZED_KEY;
import static io.github.simbo1905.strict.ConfigurationException.Kind.WRONG_VALUE_CLASS;
import static io.github.simbo1905.strict.StrictCodec.LOGGER;

/// Validation and layering of attribute sets. All operations are pure and return new [Attributes].
final class ConfigStore {
  static final String CRATE = "crate";
  static final String REPR = "repr";
  static final String SKIP = "skip";
  static final String BY_ORDER = "by_order";
  static final String BY_VALUE = "by_value";
  static final String VALUE = "value";

  static final List<String> RECOGNIZED_KEYS = List.of(CRATE, REPR, SKIP, BY_ORDER, BY_VALUE, VALUE);

  /// Keys consumed at type-global scope. They never flow into a narrower scope.
  static final Set<String> TYPE_GLOBAL_ONLY = Set.of(CRATE, REPR);

  /// Keys consumed at variant scope. They never flow into the variant's fields.
  static final Set<String> VARIANT_ONLY = Set.of(VALUE, BY_ORDER, BY_VALUE);

  private ConfigStore() {
  }

  /// Validate an attribute set against the requirement table of a context.
  /// @param owner the type, variant or field the attributes belong to, used in error messages
  /// @throws ConfigurationException on the first unrecognized, prohibited or wrongly classed key, or on a
  /// mutually exclusive pair
  static void check(Attributes attributes, ResolutionContext context, String owner) {
    final var requirements = context.requirements();
    for (Map.Entry<String, AttrValue> entry : attributes.args().entrySet()) {
      final String key = entry.getKey();
      final AttrValue value = entry.getValue();
      final AttributeRequirement requirement = requirements.get(key);
      if (requirement == null) {
        throw new ConfigurationException(UNRECOGNIZED_KEY, key, owner, context.scope(),
            "unrecognized attribute `" + key + "`; expected one of " + RECOGNIZED_KEYS);
      }
      if (requirement instanceof AttributeRequirement.Prohibited) {
        throw new ConfigurationException(PROHIBITED_KEY_PRESENT, key, owner, context.scope(),
            "attribute `" + key + "` is not allowed in " + context);
      } else if (requirement instanceof AttributeRequirement.Flag) {
        if (!(value instanceof AttrValue.Flag)) {
          throw new ConfigurationException(WRONG_VALUE_CLASS, key, owner, context.scope(),
              "attribute `" + key + "` takes no value but was given `" + value + "`");
        }
      } else if (requirement instanceof AttributeRequirement.Optional optional) {
        requireClass(key, value, optional.valueClass(), owner, context);
      } else if (requirement instanceof AttributeRequirement.RequiredWithDefault required) {
        requireClass(key, value, required.valueClass(), owner, context);
      }
    }
    checkExclusive(attributes, owner, context);
  }

  private static void requireClass(String key, AttrValue value, AttrValue.ValueClass expected,
                                   String owner, ResolutionContext context) {
    if (!value.conformsTo(expected)) {
      throw new ConfigurationException(WRONG_VALUE_CLASS, key, owner, context.scope(),
          "attribute `" + key + "` requires a " + expected + " value but was given " + value.valueClass() +
              " `" + value + "`");
    }
  }

  /// `by_order` and `by_value` can't be present together
  static void checkExclusive(Attributes attributes, String owner, ResolutionContext context) {
    if (attributes.contains(BY_ORDER) && attributes.contains(BY_VALUE)) {
      throw new ConfigurationException(MUTUALLY_EXCLUSIVE_KEYS, BY_VALUE, owner, context.scope(),
          "`" + BY_VALUE + "` and `" + BY_ORDER + "` attributes can't be present together");
    }
  }

  /// Layer `outer` under `inner`. Inner keys shadow same-named outer keys.
  static Attributes merge(Attributes outer, Attributes inner) {
    final var merged = new LinkedHashMap<>(outer.args());
    merged.putAll(inner.args());
    final var result = new Attributes(merged);
    LOGGER.finer(() -> "Merged " + outer + " with " + inner + " into " + result);
    return result;
  }

  static Attributes strip(Attributes attributes, Set<String> keys) {
    final var copy = new LinkedHashMap<>(attributes.args());
    copy.keySet().removeAll(keys);
    return new Attributes(copy);
  }

  /// Fill every absent key that the context requires with its default
  static Attributes withDefaults(Attributes attributes, ResolutionContext context) {
    final var copy = new LinkedHashMap<>(attributes.args());
    context.requirements().forEach((key, requirement) -> {
      if (requirement instanceof AttributeRequirement.RequiredWithDefault required) {
        copy.putIfAbsent(key, required.defaultValue());
      }
    });
    return new Attributes(copy);
  }
}
