// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//

package io.github.simbo1905.strict;

import java.util.Objects;

/// What a requirement table demands of one recognized attribute key
sealed interface AttributeRequirement permits
    AttributeRequirement.RequiredWithDefault, AttributeRequirement.Optional,
    AttributeRequirement.Flag, AttributeRequirement.Prohibited {

  AttributeRequirement FLAG = new Flag();
  AttributeRequirement PROHIBITED = new Prohibited();

  static AttributeRequirement withDefault(AttrValue value, AttrValue.ValueClass valueClass) {
    return new RequiredWithDefault(value, valueClass);
  }

  static AttributeRequirement optional(AttrValue.ValueClass valueClass) {
    return new Optional(valueClass);
  }

  /// Always present after defaults are applied
  record RequiredWithDefault(AttrValue defaultValue, AttrValue.ValueClass valueClass) implements AttributeRequirement {
    public RequiredWithDefault {
      Objects.requireNonNull(defaultValue, "defaultValue must not be null");
      Objects.requireNonNull(valueClass, "valueClass must not be null");
      assert defaultValue.conformsTo(valueClass) : "default " + defaultValue + " is not a " + valueClass;
    }
  }

  record Optional(AttrValue.ValueClass valueClass) implements AttributeRequirement {
    public Optional {
      Objects.requireNonNull(valueClass, "valueClass must not be null");
    }
  }

  /// Present or absent, never with a value
  record Flag() implements AttributeRequirement {
  }

  record Prohibited() implements AttributeRequirement {
  }
}
