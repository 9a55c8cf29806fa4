// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//

package io.github.simbo1905.strict;

import java.math.BigInteger;
import java.util.List;

import static io.github.simbo1905.strict.ConfigStore.BY_VALUE;
import static io.github.simbo1905.strict.ConfigStore.CRATE;
import static io.github.simbo1905.strict.ConfigStore.REPR;
import static io.github.simbo1905.strict.ConfigStore.SKIP;
import static io.github.simbo1905.strict.ConfigStore.TYPE_GLOBAL_ONLY;
import static io.github.simbo1905.strict.ConfigStore.VALUE;
import static io.github.simbo1905.strict.ConfigurationException.Kind.DISCRIMINANT_OUT_OF_RANGE;
import static io.github.simbo1905.strict.ConfigurationException.Kind.INVALID_REPR_KIND;
import static io.github.simbo1905.strict.StrictCodec.LOGGER;

/// Turns layered attribute sets into immutable [EncodingPolicy] values.
/// Any error aborts resolution; a partial policy is never returned.
public final class PolicyResolver {

  private PolicyResolver() {
  }

  /// Resolve the type-global policy of a struct or enum
  public static EncodingPolicy resolveGlobal(TypeSpec type) {
    final var context = type.kind() == TypeSpec.Kind.STRUCT
        ? ResolutionContext.STRUCT_GLOBAL
        : ResolutionContext.ENUM_GLOBAL;
    final var attributes = type.globalAttributes();
    ConfigStore.check(attributes, context, type.name());
    final var complete = ConfigStore.withDefaults(attributes, context);

    final List<String> namespace = namespaceOf(complete.get(CRATE).orElse(ResolutionContext.DEFAULT_NAMESPACE));
    final DiscriminantRepr repr = reprOf(complete, type.name(), context);
    final var policy = new EncodingPolicy(namespace, false, repr, modeOf(complete));
    LOGGER.fine(() -> "Resolved " + context + " policy for " + type.name() + " from " + attributes + ": " + policy);
    return policy;
  }

  /// Resolve the policy of a field or variant.
  /// @param parent the resolved type-global policy; its namespace and repr are inherited
  /// @param outer the attributes of the enclosing scope
  /// @param local the attributes declared on the member
  /// @param context the member's context
  /// @param owner names the member in error messages
  public static EncodingPolicy resolveMember(EncodingPolicy parent,
                                             Attributes outer,
                                             Attributes local,
                                             ResolutionContext context,
                                             String owner) {
    assert context.scope() == Scope.LOCAL : "Member resolution needs a local context: " + context;
    // the member's own attributes must be valid before inheritance can mask anything
    ConfigStore.check(local, context, owner);

    final var merged = ConfigStore.strip(ConfigStore.merge(outer, local), TYPE_GLOBAL_ONLY);
    ConfigStore.check(merged, context, owner);

    final DiscriminantMode mode;
    final var value = merged.get(VALUE);
    if (value.isPresent()) {
      final BigInteger literal = ((AttrValue.Int) value.get()).value();
      if (!parent.discriminantRepr().fits(literal)) {
        throw new ConfigurationException(DISCRIMINANT_OUT_OF_RANGE, VALUE, owner, context.scope(),
            "value " + literal + " does not fit in " + parent.discriminantRepr());
      }
      mode = new DiscriminantMode.ExplicitValue(literal.longValue());
    } else {
      mode = modeOf(merged);
    }

    final var policy = new EncodingPolicy(parent.codecNamespace(), merged.contains(SKIP), parent.discriminantRepr(), mode);
    LOGGER.finer(() -> "Resolved " + context + " policy for " + owner + " from " + local + " under " + outer + ": " + policy);
    return policy;
  }

  private static DiscriminantMode modeOf(Attributes attributes) {
    return attributes.contains(BY_VALUE) ? DiscriminantMode.BY_NATIVE_ORDINAL : DiscriminantMode.BY_DECLARATION_ORDER;
  }

  private static List<String> namespaceOf(AttrValue value) {
    if (value instanceof AttrValue.Path path) {
      return path.segments();
    }
    return List.of(((AttrValue.Ident) value).name());
  }

  private static DiscriminantRepr reprOf(Attributes attributes, String owner, ResolutionContext context) {
    final var repr = attributes.get(REPR).orElse(ResolutionContext.DEFAULT_REPR);
    final String ident = ((AttrValue.Ident) repr).name();
    return DiscriminantRepr.fromIdent(ident).orElseThrow(() ->
        new ConfigurationException(INVALID_REPR_KIND, REPR, owner, context.scope(),
            "`repr` requires one of u8, u16, u32, u64 but was given `" + ident + "`"));
  }
}
