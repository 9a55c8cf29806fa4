// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//

package io.github.simbo1905.strict;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;

/// Maps a codec namespace path, as named by the `crate` attribute, to the registry its members bind to.
/// The selection is made once when a plan is bound; a bound codec keeps no reference to the namespace.
public final class CodecNamespaces {

  private final Map<String, CodecRegistry> registries;

  private CodecNamespaces(Map<String, CodecRegistry> registries) {
    this.registries = Map.copyOf(registries);
  }

  /// Only the default `strict_encoding` namespace with the standard registry
  public static CodecNamespaces standard() {
    return new CodecNamespaces(Map.of(ResolutionContext.DEFAULT_NAMESPACE.toString(), CodecRegistry.standard()));
  }

  /// @param path a `::` separated namespace path such as `my::codecs`
  public CodecNamespaces with(String path, CodecRegistry registry) {
    Objects.requireNonNull(path, "path must not be null");
    Objects.requireNonNull(registry, "registry must not be null");
    final var copy = new HashMap<>(registries);
    copy.put(path, registry);
    return new CodecNamespaces(copy);
  }

  /// The registry of the namespace a policy selects
  /// @throws IllegalArgumentException if no registry is known under that path
  public CodecRegistry registryFor(EncodingPolicy policy) {
    final var path = policy.namespacePath();
    final var registry = registries.get(path);
    if (registry == null) {
      throw new IllegalArgumentException("No codec namespace registered as `" + path + "`; known namespaces are " +
          new TreeSet<>(registries.keySet()));
    }
    return registry;
  }
}
