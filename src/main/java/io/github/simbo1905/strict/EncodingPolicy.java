// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//

package io.github.simbo1905.strict;

import java.util.List;
import java.util.Objects;

/// The resolved, conflict-free encoding decisions for one scope
/// @param codecNamespace the path of the value-codec namespace members bind to
/// @param skip whether the member is absent from the wire
/// @param discriminantRepr the width of enum discriminants
/// @param discriminantMode how a variant's discriminant is chosen
public record EncodingPolicy(
    List<String> codecNamespace,
    boolean skip,
    DiscriminantRepr discriminantRepr,
    DiscriminantMode discriminantMode
) {
  public EncodingPolicy {
    codecNamespace = List.copyOf(codecNamespace);
    if (codecNamespace.isEmpty()) {
      throw new IllegalArgumentException("codecNamespace must not be empty");
    }
    Objects.requireNonNull(discriminantRepr, "discriminantRepr must not be null");
    Objects.requireNonNull(discriminantMode, "discriminantMode must not be null");
  }

  /// The namespace as written in configuration, e.g. `strict_encoding` or `my::codecs`
  public String namespacePath() {
    return String.join("::", codecNamespace);
  }
}
