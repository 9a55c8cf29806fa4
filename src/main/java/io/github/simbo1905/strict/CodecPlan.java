// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//

package io.github.simbo1905.strict;

/// The abstract, language-neutral description of a type's encode/decode procedure.
/// Consumed by [StrictCodec#forPlan] or by an external code emitter.
public sealed interface CodecPlan permits StructCodecPlan, EnumCodecPlan {

  String typeName();

  /// The resolved type-global policy
  EncodingPolicy policy();

  /// Indented, human-readable rendering for logs and diagnostics
  String toTreeString();
}
