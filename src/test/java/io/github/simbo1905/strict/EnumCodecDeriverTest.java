// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//

package io.github.simbo1905.strict;

import io.github.simbo1905.LoggingControl;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static io.github.simbo1905.strict.ConfigurationException.Kind.DISCRIMINANT_OUT_OF_RANGE;
import static io.github.simbo1905.strict.ConfigurationException.Kind.DUPLICATE_DISCRIMINANT;
import static io.github.simbo1905.strict.ConfigurationException.Kind.MISSING_DEFAULT;
import static io.github.simbo1905.strict.ConfigurationException.Kind.PROHIBITED_KEY_PRESENT;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class EnumCodecDeriverTest {

  @BeforeAll
  static void setupLogging() {
    LoggingControl.setupCleanLogging();
  }

  static TypeSpec colours(Attributes global, Attributes green) {
    return TypeSpec.enumeration("Colour", global, List.of(
        VariantSpec.unit("Red", 0),
        VariantSpec.unit("Green", 1, green),
        VariantSpec.unit("Blue", 2)));
  }

  static List<Long> discriminants(EnumCodecPlan plan) {
    return plan.variants().stream().map(VariantPlan::discriminant).toList();
  }

  @Test
  void declarationOrderByDefault() {
    final var plan = EnumCodecDeriver.derive(colours(Attributes.EMPTY, Attributes.EMPTY));
    assertThat(discriminants(plan)).containsExactly(0L, 1L, 2L);
    assertThat(plan.repr()).isEqualTo(DiscriminantRepr.U8);
  }

  @Test
  void explicitValueWins() {
    final var plan = EnumCodecDeriver.derive(colours(Attributes.EMPTY, Attributes.of("value", AttrValue.integer(200))));
    assertThat(discriminants(plan)).containsExactly(0L, 200L, 2L);
    assertThat(plan.variantFor(200)).map(VariantPlan::name).contains("Green");
  }

  @Test
  void byValueUsesNativeOrdinals() {
    final var spec = TypeSpec.enumeration("Status", Attributes.flag("by_value"), List.of(
        new VariantSpec("Ok", 0, 200, List.of(), Attributes.EMPTY),
        new VariantSpec("NotFound", 1, 404, List.of(), Attributes.EMPTY)));
    assertThatThrownBy(() -> EnumCodecDeriver.derive(spec))
        .isInstanceOfSatisfying(ConfigurationException.class, e -> {
          assertThat(e.kind()).isEqualTo(DISCRIMINANT_OUT_OF_RANGE);
          assertThat(e.owner()).isEqualTo("Status::NotFound");
        });

    final var wide = TypeSpec.enumeration("Status",
        Attributes.flag("by_value").with("repr", AttrValue.ident("u16")), spec.variants());
    assertThat(discriminants(EnumCodecDeriver.derive(wide))).containsExactly(200L, 404L);
  }

  @Test
  void variantByOrderOverridesNothingWhenAlone() {
    final var plan = EnumCodecDeriver.derive(colours(Attributes.EMPTY, Attributes.flag("by_order")));
    assertThat(discriminants(plan)).containsExactly(0L, 1L, 2L);
  }

  @Test
  void skippedVariantIsExcludedAndKeepsItsIndex() {
    final var plan = EnumCodecDeriver.derive(colours(Attributes.EMPTY, Attributes.flag("skip")));
    assertThat(plan.variants()).extracting(VariantPlan::name).containsExactly("Red", "Blue");
    assertThat(discriminants(plan)).containsExactly(0L, 2L);
    assertThat(plan.isSkipped("Green")).isTrue();
    assertThat(plan.variantFor(1)).isEmpty();
  }

  @Test
  void duplicatesFailUnderStrict() {
    final var spec = colours(Attributes.EMPTY, Attributes.of("value", AttrValue.integer(2)));
    assertThatThrownBy(() -> EnumCodecDeriver.derive(spec, DefaultValues.standard(), DiscriminantCheck.STRICT))
        .isInstanceOfSatisfying(ConfigurationException.class, e -> {
          assertThat(e.kind()).isEqualTo(DUPLICATE_DISCRIMINANT);
          assertThat(e.owner()).isEqualTo("Colour::Blue");
          assertThat(e).hasMessageContaining("Green").hasMessageContaining("Blue");
        });
  }

  @Test
  void duplicatesResolveToTheFirstDeclaredUnderFirstMatch() {
    final var spec = colours(Attributes.EMPTY, Attributes.of("value", AttrValue.integer(2)));
    final var plan = EnumCodecDeriver.derive(spec, DefaultValues.standard(), DiscriminantCheck.FIRST_MATCH);
    assertThat(discriminants(plan)).containsExactly(0L, 2L, 2L);
    assertThat(plan.variantFor(2)).map(VariantPlan::name).contains("Green");
  }

  @Test
  void declarationOrderMustFitTheRepr() {
    final var variants = new ArrayList<VariantSpec>();
    for (int i = 0; i < 257; i++) {
      variants.add(VariantSpec.unit("V" + i, i));
    }
    assertThatThrownBy(() -> EnumCodecDeriver.derive(TypeSpec.enumeration("Big", Attributes.EMPTY, variants)))
        .isInstanceOfSatisfying(ConfigurationException.class, e -> {
          assertThat(e.kind()).isEqualTo(DISCRIMINANT_OUT_OF_RANGE);
          assertThat(e.owner()).isEqualTo("Big::V256");
        });
    final var plan = EnumCodecDeriver.derive(
        TypeSpec.enumeration("Big", Attributes.of("repr", AttrValue.ident("u16")), variants));
    assertThat(plan.variants()).hasSize(257);
  }

  @Test
  void variantFieldsInheritFromTheVariantOnly() {
    final var spec = TypeSpec.enumeration("Event", Attributes.flag("by_value"), List.of(
        new VariantSpec("Login", 0, List.of(
            FieldSpec.named("user", 0, String.class),
            FieldSpec.named("attempts", 1, int.class, Attributes.flag("skip"))),
            Attributes.of("value", AttrValue.integer(7)))));
    final var plan = EnumCodecDeriver.derive(spec);
    final var login = plan.variantNamed("Login").orElseThrow();
    assertThat(login.discriminant()).isEqualTo(7L);
    assertThat(login.fields().get(0)).isInstanceOf(FieldPlan.Coded.class);
    assertThat(login.fields().get(1)).isInstanceOf(FieldPlan.Skipped.class);
  }

  @Test
  void discriminantKeysOnVariantFieldsAreProhibited() {
    final var spec = TypeSpec.enumeration("Event", Attributes.EMPTY, List.of(
        new VariantSpec("Login", 0, List.of(
            FieldSpec.named("user", 0, String.class, Attributes.flag("by_order"))), Attributes.EMPTY)));
    assertThatThrownBy(() -> EnumCodecDeriver.derive(spec))
        .isInstanceOfSatisfying(ConfigurationException.class, e -> {
          assertThat(e.kind()).isEqualTo(PROHIBITED_KEY_PRESENT);
          assertThat(e.owner()).isEqualTo("Event::Login.user");
        });
  }

  @Test
  void skippedVariantFieldNeedsADefault() {
    final var spec = TypeSpec.enumeration("Event", Attributes.EMPTY, List.of(
        new VariantSpec("Login", 0, List.of(
            FieldSpec.positional(0, UUID.class, Attributes.flag("skip"))), Attributes.EMPTY)));
    assertThatThrownBy(() -> EnumCodecDeriver.derive(spec))
        .isInstanceOfSatisfying(ConfigurationException.class, e -> {
          assertThat(e.kind()).isEqualTo(MISSING_DEFAULT);
          assertThat(e.owner()).isEqualTo("Event::Login.0");
        });
  }

  @Test
  void treeStringShowsDispatch() {
    final var plan = EnumCodecDeriver.derive(colours(Attributes.EMPTY, Attributes.flag("skip")));
    assertThat(plan.toTreeString())
        .startsWith("enum Colour as u8 [strict_encoding]")
        .contains("skipped Green");
  }
}
