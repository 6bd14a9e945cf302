/*
 * Copyright 2025 The Lemmata Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.lemmata.library;

import org.lemmata.build.PackageSpec;
import org.lemmata.syntax.Expr;
import org.lemmata.syntax.Notation;
import org.lemmata.syntax.Notation.Assoc;
import org.lemmata.syntax.Skeleton;

/**
 * A Hilbert-style propositional calculus over implication and negation, with the three classical
 * axiom schemes, modus ponens, and a library of derived lemmas: syllogism and its variants,
 * contraposition, double negation, case analysis, and the laws of disjunction. The classical
 * theorems (contraposition, excluded middle, Peirce's law, and both halves of De Morgan's law for
 * a negated disjunction) are declared last.
 *
 * <p>Formulas may be written in ASCII ({@code ph -> -. ps}) or with the usual symbols ({@code φ → ¬
 * ψ}). Disjunction is a definition: {@code ph \/ ps} stands for {@code -. ph -> ps}.
 */
public final class Hilbert {

  public static final String PACKAGE_NAME = "hilbert";

  public static final Skeleton SKELETON =
      Skeleton.builder()
          .typecode("wff")
          .typecode("|-")
          .assertionTypecode("|-")
          .variable("ph", "wff", "φ")
          .variable("ps", "wff", "ψ")
          .variable("ch", "wff", "χ")
          .variable("th", "wff", "θ")
          .connective("->", 2, Notation.infix(10, Assoc.RIGHT), "→")
          .connective("-.", 1, Notation.prefix(30), "¬")
          .connective("/\\", 2, Notation.infix(20, Assoc.LEFT), "∧")
          .definition(
              "\\/",
              2,
              Notation.infix(20, Assoc.LEFT),
              args -> Expr.apply("->", Expr.apply("-.", args.get(0)), args.get(1)),
              "∨",
              "Or")
          .defaultCombinator("mp")
          .build();

  private Hilbert() {}

  public static PackageSpec spec() {
    PackageSpec.Builder b = PackageSpec.builder(PACKAGE_NAME, SKELETON);

    b.axiom("A1", "ph -> ( ps -> ph )");
    b.axiom("A2", "( ph -> ( ps -> ch ) ) -> ( ( ph -> ps ) -> ( ph -> ch ) )");
    b.axiom("A3", "( -. ph -> -. ps ) -> ( ps -> ph )");

    // Syntax rules describe how wffs are formed; mp is the only inference rule.
    b.rule("wi", "ph -> ps").typecode("wff");
    b.rule("wn", "-. ph").typecode("wff");
    b.rule("wa", "ph /\\ ps").typecode("wff");
    b.rule("mp", "ps").hypotheses("ph", "ph -> ps");

    b.labelAlias("ax-1", "A1");
    b.labelAlias("ax-2", "A2");
    b.labelAlias("ax-3", "A3");
    b.labelAlias("ax-mp", "mp");

    b.lemma("a1i")
        .hypotheses("ph")
        .conclusion("ps -> ph")
        .hyp(0)
        .ref("A1", "ph := ph", "ps := ps")
        .compose(0, 1);
    b.lemma("a2i")
        .hypotheses("ph -> ( ps -> ch )")
        .conclusion("( ph -> ps ) -> ( ph -> ch )")
        .hyp(0)
        .ref("ax-2", "ph := ph", "ps := ps", "ch := ch")
        .compose(0, 1);
    b.lemma("mpd")
        .hypotheses("ph -> ps", "ph -> ( ps -> ch )")
        .conclusion("ph -> ch")
        .hyp(1)
        .ref("A2", "ph := ph", "ps := ps", "ch := ch")
        .compose(0, 1)
        .hyp(0)
        .compose(1, 0);
    b.lemma("syl")
        .hypotheses("ph -> ps", "ps -> ch")
        .conclusion("ph -> ch")
        .hyp(1)
        .ref("a1i", "ph := ps -> ch", "ps := ph")
        .hyp(0)
        .ref("mpd", "ph := ph", "ps := ps", "ch := ch");
    b.lemma("id")
        .conclusion("ph -> ph")
        .ref("A1", "ph := ph", "ps := ph")
        .ref("A1", "ph := ph", "ps := ph -> ph")
        .ref("mpd", "ph := ph", "ps := ph -> ph", "ch := ph");
    b.lemma("a1d")
        .hypotheses("ph -> ps")
        .conclusion("ph -> ( ch -> ps )")
        .hyp(0)
        .ref("A1", "ph := ps", "ps := ch")
        .ref("syl", "ph := ph", "ps := ps", "ch := ch -> ps");
    b.lemma("con4i")
        .hypotheses("¬ φ → ¬ ψ")
        .conclusion("ψ → φ")
        .hyp(0)
        .ref("ax-3", "φ := φ", "ψ := ψ")
        .compose(0, 1, "ax-mp");
    b.lemma("ori").hypotheses("ph \\/ ps").conclusion("-. ph -> ps").hyp(0);

    b.lemma("imim2i")
        .hypotheses("ph -> ps")
        .conclusion("( ch -> ph ) -> ( ch -> ps )")
        .hyp(0)
        .ref("a1i", "ph := ph -> ps", "ps := ch")
        .ref("a2i", "ph := ch", "ps := ph", "ch := ps");
    b.lemma("idd")
        .conclusion("ph -> ( ps -> ps )")
        .ref("id", "ph := ps")
        .ref("a1i", "ph := ps -> ps", "ps := ph");
    // Commuting and chaining antecedents.
    b.lemma("com12")
        .hypotheses("ph -> ( ps -> ch )")
        .conclusion("ps -> ( ph -> ch )")
        .ref("A1", "ph := ps", "ps := ph")
        .hyp(0)
        .ref("a2i", "ph := ph", "ps := ps", "ch := ch")
        .ref("syl", "ph := ps", "ps := ph -> ps", "ch := ph -> ch");
    b.lemma("pm2.27")
        .conclusion("ph -> ( ( ph -> ps ) -> ps )")
        .ref("id", "ph := ph -> ps")
        .ref("com12", "ph := ph -> ps", "ps := ph", "ch := ps");
    b.lemma("imim1i")
        .hypotheses("ph -> ps")
        .conclusion("( ps -> ch ) -> ( ph -> ch )")
        .hyp(0)
        .ref("pm2.27", "ph := ps", "ps := ch")
        .ref("syl", "ph := ph", "ps := ps", "ch := ( ps -> ch ) -> ch")
        .ref("com12", "ph := ph", "ps := ps -> ch", "ch := ch");
    b.lemma("imim2")
        .conclusion("( ph -> ps ) -> ( ( ch -> ph ) -> ( ch -> ps ) )")
        .ref("A1", "ph := ph -> ps", "ps := ch")
        .ref("A2", "ph := ch", "ps := ph", "ch := ps")
        .ref(
            "syl",
            "ph := ph -> ps",
            "ps := ch -> ( ph -> ps )",
            "ch := ( ch -> ph ) -> ( ch -> ps )");
    b.lemma("imim1")
        .conclusion("( ph -> ps ) -> ( ( ps -> ch ) -> ( ph -> ch ) )")
        .ref("imim2", "ph := ps", "ps := ch", "ch := ph")
        .ref("com12", "ph := ps -> ch", "ps := ph -> ps", "ch := ph -> ch");
    b.lemma("syl5")
        .hypotheses("ph -> ps", "ch -> ( ps -> th )")
        .conclusion("ch -> ( ph -> th )")
        .hyp(0)
        .ref("imim1i", "ph := ph", "ps := ps", "ch := th")
        .hyp(1)
        .ref("syl", "ph := ch", "ps := ps -> th", "ch := ph -> th");
    b.lemma("syl6")
        .hypotheses("ph -> ( ps -> ch )", "ch -> th")
        .conclusion("ph -> ( ps -> th )")
        .hyp(0)
        .hyp(1)
        .ref("imim2i", "ph := ch", "ps := th", "ch := ps")
        .ref("syl", "ph := ph", "ps := ps -> ch", "ch := ps -> th");
    b.lemma("sylcom")
        .hypotheses("ph -> ( ps -> ch )", "ps -> ( ch -> th )")
        .conclusion("ph -> ( ps -> th )")
        .hyp(0)
        .hyp(1)
        .ref("a2i", "ph := ps", "ps := ch", "ch := th")
        .ref("syl", "ph := ph", "ps := ps -> ch", "ch := ps -> th");
    b.lemma("syld")
        .hypotheses("ph -> ( ps -> ch )", "ph -> ( ch -> th )")
        .conclusion("ph -> ( ps -> th )")
        .hyp(1)
        .ref("imim2", "ph := ch", "ps := th", "ch := ps")
        .ref("syl", "ph := ph", "ps := ch -> th", "ch := ( ps -> ch ) -> ( ps -> th )")
        .hyp(0)
        .ref("mpd", "ph := ph", "ps := ps -> ch", "ch := ps -> th");
    b.lemma("pm2.43i")
        .hypotheses("ph -> ( ph -> ps )")
        .conclusion("ph -> ps")
        .hyp(0)
        .ref("id", "ph := ph")
        .ref("mpd", "ph := ph", "ps := ph", "ch := ps");
    // Negation and contraposition.
    b.lemma("con4d")
        .hypotheses("ph -> ( -. ps -> -. ch )")
        .conclusion("ph -> ( ch -> ps )")
        .hyp(0)
        .ref("ax-3", "ph := ps", "ps := ch")
        .ref("syl", "ph := ph", "ps := -. ps -> -. ch", "ch := ch -> ps");
    b.lemma("pm2.21")
        .conclusion("-. ph -> ( ph -> ps )")
        .ref("ax-1", "ph := -. ph", "ps := -. ps")
        .ref("con4d", "ph := -. ph", "ps := ps", "ch := ph");
    b.lemma("pm2.21d")
        .hypotheses("ph -> -. ps")
        .conclusion("ph -> ( ps -> ch )")
        .hyp(0)
        .ref("pm2.21", "ph := ps", "ps := ch")
        .ref("syl", "ph := ph", "ps := -. ps", "ch := ps -> ch");
    b.lemma("pm2.24")
        .conclusion("ph -> ( -. ph -> ps )")
        .ref("pm2.21", "ph := ph", "ps := ps")
        .ref("com12", "ph := -. ph", "ps := ph", "ch := ps");
    b.lemma("pm2.18")
        .conclusion("( -. ph -> ph ) -> ph")
        .ref("pm2.21", "ph := ph", "ps := -. ( -. ph -> ph )")
        .ref("a2i", "ph := -. ph", "ps := ph", "ch := -. ( -. ph -> ph )")
        .ref("ax-3", "ph := ph", "ps := -. ph -> ph")
        .ref(
            "syl",
            "ph := -. ph -> ph",
            "ps := -. ph -> -. ( -. ph -> ph )",
            "ch := ( -. ph -> ph ) -> ph")
        .ref("pm2.43i", "ph := -. ph -> ph", "ps := ph");
    b.lemma("pm2.18d")
        .hypotheses("ph -> ( -. ps -> ps )")
        .conclusion("ph -> ps")
        .hyp(0)
        .ref("pm2.18", "ph := ps")
        .ref("syl", "ph := ph", "ps := -. ps -> ps", "ch := ps");
    b.lemma("notnotr")
        .conclusion("-. -. ph -> ph")
        .ref("pm2.21", "ph := -. ph", "ps := ph")
        .ref("pm2.18d", "ph := -. -. ph", "ps := ph");
    b.lemma("notnot")
        .conclusion("ph -> -. -. ph")
        .ref("notnotr", "ph := -. ph")
        .ref("con4i", "ph := -. -. ph", "ps := ph");
    b.lemma("con1d")
        .hypotheses("ph -> ( -. ps -> ch )")
        .conclusion("ph -> ( -. ch -> ps )")
        .hyp(0)
        .ref("notnot", "ph := ch")
        .ref("syl6", "ph := ph", "ps := -. ps", "ch := ch", "th := -. -. ch")
        .ref("con4d", "ph := ph", "ps := ps", "ch := -. ch");
    b.lemma("con1i")
        .hypotheses("-. ph -> ps")
        .conclusion("-. ps -> ph")
        .hyp(0)
        .ref("notnot", "ph := ps")
        .ref("syl", "ph := -. ph", "ps := ps", "ch := -. -. ps")
        .ref("con4i", "ph := ph", "ps := -. ps");
    b.lemma("con2d")
        .hypotheses("ph -> ( ps -> -. ch )")
        .conclusion("ph -> ( ch -> -. ps )")
        .ref("notnotr", "ph := ps")
        .hyp(0)
        .ref("syl5", "ph := -. -. ps", "ps := ps", "ch := ph", "th := -. ch")
        .ref("con4d", "ph := ph", "ps := -. ps", "ch := ch");
    b.lemma("con2i")
        .hypotheses("ph -> -. ps")
        .conclusion("ps -> -. ph")
        .ref("notnotr", "ph := ph")
        .hyp(0)
        .ref("syl", "ph := -. -. ph", "ps := ph", "ch := -. ps")
        .ref("con4i", "ph := -. ph", "ps := ps");
    b.lemma("con3d")
        .hypotheses("ph -> ( ps -> ch )")
        .conclusion("ph -> ( -. ch -> -. ps )")
        .ref("notnotr", "ph := ps")
        .hyp(0)
        .ref("syl5", "ph := -. -. ps", "ps := ps", "ch := ph", "th := ch")
        .ref("con1d", "ph := ph", "ps := -. ps", "ch := ch");
    b.lemma("con3i")
        .hypotheses("ph -> ps")
        .conclusion("-. ps -> -. ph")
        .ref("notnotr", "ph := ph")
        .hyp(0)
        .ref("syl", "ph := -. -. ph", "ps := ph", "ch := ps")
        .ref("notnot", "ph := ps")
        .ref("syl", "ph := -. -. ph", "ps := ps", "ch := -. -. ps")
        .ref("con4i", "ph := -. ph", "ps := -. ps");
    b.lemma("con1")
        .conclusion("( -. ph -> ps ) -> ( -. ps -> ph )")
        .ref("id", "ph := -. ph -> ps")
        .ref("con1d", "ph := -. ph -> ps", "ps := ph", "ch := ps");
    b.lemma("con2")
        .conclusion("( ph -> -. ps ) -> ( ps -> -. ph )")
        .ref("id", "ph := ph -> -. ps")
        .ref("con2d", "ph := ph -> -. ps", "ps := ph", "ch := ps");
    b.lemma("con4")
        .conclusion("( -. ph -> -. ps ) -> ( ps -> ph )")
        .ref("A3", "ph := ph", "ps := ps");
    b.lemma("mto")
        .hypotheses("ph -> ps", "-. ps")
        .conclusion("-. ph")
        .hyp(1)
        .hyp(0)
        .ref("con3i", "ph := ph", "ps := ps")
        .compose(0, 1);
    // Case analysis on a formula and its negation.
    b.lemma("pm2.61d")
        .hypotheses("ph -> ( ps -> ch )", "ph -> ( -. ps -> ch )")
        .conclusion("ph -> ch")
        .hyp(1)
        .ref("con1d", "ph := ph", "ps := ps", "ch := ch")
        .hyp(0)
        .ref("syld", "ph := ph", "ps := -. ch", "ch := ps", "th := ch")
        .ref("pm2.18d", "ph := ph", "ps := ch");
    b.lemma("pm2.61i")
        .hypotheses("ph -> ps", "-. ph -> ps")
        .conclusion("ps")
        .hyp(1)
        .ref("con1i", "ph := ph", "ps := ps")
        .hyp(0)
        .ref("syl", "ph := -. ps", "ps := ph", "ch := ps")
        .ref("pm2.18", "ph := ps")
        .compose(0, 1);
    b.lemma("pm2.61")
        .conclusion("( ph -> ps ) -> ( ( -. ph -> ps ) -> ps )")
        .ref("id", "ph := ph -> ps")
        .ref("A1", "ph := ps", "ps := -. ph -> ps")
        .ref("syl6", "ph := ph -> ps", "ps := ph", "ch := ps", "th := ( -. ph -> ps ) -> ps")
        .ref("pm2.27", "ph := -. ph", "ps := ps")
        .ref("a1i", "ph := -. ph -> ( ( -. ph -> ps ) -> ps )", "ps := ph -> ps")
        .ref("pm2.61d", "ph := ph -> ps", "ps := ph", "ch := ( -. ph -> ps ) -> ps");
    b.lemma("simplim")
        .conclusion("-. ( ph -> ps ) -> ph")
        .ref("pm2.21", "ph := ph", "ps := ps")
        .ref("con1i", "ph := ph", "ps := ph -> ps");
    b.lemma("jarli")
        .hypotheses("( ph -> ps ) -> ch")
        .conclusion("-. ph -> ch")
        .ref("pm2.21", "ph := ph", "ps := ps")
        .hyp(0)
        .ref("syl", "ph := -. ph", "ps := ph -> ps", "ch := ch");
    b.lemma("ja")
        .hypotheses("-. ph -> ch", "ps -> ch")
        .conclusion("( ph -> ps ) -> ch")
        .hyp(1)
        .ref("imim2i", "ph := ps", "ps := ch", "ch := ph")
        .hyp(0)
        .ref("a1i", "ph := -. ph -> ch", "ps := ph -> ps")
        .ref("pm2.61d", "ph := ph -> ps", "ps := ph", "ch := ch");
    // Disjunction.
    b.lemma("orc")
        .conclusion("ph -> ( ph \\/ ps )")
        .ref("pm2.24", "ph := ph", "ps := ps");
    b.lemma("olc")
        .conclusion("ph -> ( ps ∨ ph )")
        .ref("A1", "ph := ph", "ps := -. ps");

    b.theorem("con3")
        .conclusion("( ph -> ps ) -> ( -. ps -> -. ph )")
        .ref("id", "ph := ph -> ps")
        .ref("con3d", "ph := ph -> ps", "ps := ph", "ch := ps");
    b.theorem("exmid")
        .conclusion("φ ∨ ¬ φ")
        .ref("id", "ph := -. ph");
    b.theorem("peirce")
        .conclusion("( ( ph -> ps ) -> ph ) -> ph")
        .ref("id", "ph := ph")
        .ref("a1i", "ph := ph -> ph", "ps := ( ph -> ps ) -> ph")
        .ref("pm2.21", "ph := ph", "ps := ps")
        .ref("imim1", "ph := -. ph", "ps := ph -> ps", "ch := ph")
        .compose(1, 2)
        .ref("pm2.61d", "ph := ( ph -> ps ) -> ph", "ps := ph", "ch := ph");
    b.theorem("pm2.45")
        .conclusion("-. ( ph \\/ ps ) -> -. ph")
        .ref("simplim", "ph := -. ph", "ps := ps");
    b.theorem("pm2.46")
        .conclusion("-. ( ph \\/ ps ) -> -. ps")
        .ref("A1", "ph := ps", "ps := -. ph")
        .ref("con3i", "ph := ps", "ps := -. ph -> ps");

    return b.exportAll().build();
  }
}
