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

import static com.google.common.truth.Truth.assertThat;

import org.junit.BeforeClass;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.lemmata.build.LogicPackage;
import org.lemmata.build.PackageBuilder;
import org.lemmata.proof.Assertion;

@RunWith(JUnit4.class)
public class LibraryTest {

  private static LogicPackage hilbert;
  private static LogicPackage predicate;

  @BeforeClass
  public static void buildLibrary() {
    PackageBuilder builder = new PackageBuilder();
    hilbert = builder.build(Hilbert.spec());
    predicate = builder.build(Predicate.spec(hilbert.dependencyView()));
  }

  private static String conclusion(LogicPackage pkg, String label) {
    return pkg.assertion(label).conclusion.toString();
  }

  @Test
  public void hilbertLemmas() {
    assertThat(conclusion(hilbert, "a1i")).isEqualTo("-> ps ph");
    assertThat(conclusion(hilbert, "mpd")).isEqualTo("-> ph ch");
    assertThat(conclusion(hilbert, "syl")).isEqualTo("-> ph ch");
    assertThat(conclusion(hilbert, "id")).isEqualTo("-> ph ph");
    assertThat(conclusion(hilbert, "a1d")).isEqualTo("-> ph -> ch ps");
    assertThat(conclusion(hilbert, "con4i")).isEqualTo("-> ps ph");
    assertThat(conclusion(hilbert, "imim2i")).isEqualTo("-> -> ch ph -> ch ps");
    assertThat(conclusion(hilbert, "com12")).isEqualTo("-> ps -> ph ch");
    assertThat(conclusion(hilbert, "syl6")).isEqualTo("-> ph -> ps th");
    assertThat(conclusion(hilbert, "mto")).isEqualTo("-. ph");
    assertThat(conclusion(hilbert, "pm2.61")).isEqualTo("-> -> ph ps -> -> -. ph ps ps");
    assertThat(conclusion(hilbert, "ja")).isEqualTo("-> -> ph ps ch");
    for (Assertion a : hilbert.assertions.values()) {
      if (a.kind == Assertion.Kind.LEMMA || a.kind == Assertion.Kind.THEOREM) {
        assertThat(a.provenance).isEqualTo(Assertion.Provenance.PROVED);
        assertThat(a.proof.conclusion()).isEqualTo(a.conclusion);
      }
    }
  }

  @Test
  public void classicalLaws() {
    assertThat(conclusion(hilbert, "notnot")).isEqualTo("-> ph -. -. ph");
    assertThat(conclusion(hilbert, "notnotr")).isEqualTo("-> -. -. ph ph");
    assertThat(conclusion(hilbert, "con3")).isEqualTo("-> -> ph ps -> -. ps -. ph");
    assertThat(conclusion(hilbert, "exmid")).isEqualTo("-> -. ph -. ph");
    assertThat(conclusion(hilbert, "peirce")).isEqualTo("-> -> -> ph ps ph ph");
    assertThat(conclusion(hilbert, "pm2.45")).isEqualTo("-> -. -> -. ph ps -. ph");
    assertThat(conclusion(hilbert, "pm2.46")).isEqualTo("-> -. -> -. ph ps -. ps");
    assertThat(conclusion(hilbert, "orc")).isEqualTo("-> ph -> -. ph ps");
    assertThat(conclusion(hilbert, "olc")).isEqualTo("-> ph -> -. ps ph");
    for (String label : new String[] {"con3", "exmid", "peirce", "pm2.45", "pm2.46"}) {
      assertThat(hilbert.assertion(label).kind).isEqualTo(Assertion.Kind.THEOREM);
      assertThat(hilbert.exported).containsKey(label);
    }
  }

  @Test
  public void proofReferences() {
    assertThat(hilbert.assertion("peirce").proof.references())
        .containsExactly("id", "a1i", "pm2.21", "imim1", "mp", "pm2.61d")
        .inOrder();
    assertThat(hilbert.assertion("notnot").proof.references())
        .containsExactly("notnotr", "con4i")
        .inOrder();
  }

  @Test
  public void definitionsExpandToCoreConnectives() {
    // ph \/ ps abbreviates -. ph -> ps.
    assertThat(hilbert.assertion("ori").essentials().get(0).subject.toString())
        .isEqualTo("-> -. ph ps");
    assertThat(conclusion(hilbert, "ori")).isEqualTo("-> -. ph ps");
  }

  @Test
  public void syntaxRulesAreWffs() {
    assertThat(hilbert.assertion("wi").typecode.spelling()).isEqualTo("wff");
    assertThat(hilbert.assertion("mp").typecode.spelling()).isEqualTo("|-");
    assertThat(hilbert.assertion("A1").typecode.spelling()).isEqualTo("|-");
  }

  @Test
  public void nameMappingRecordsAliases() {
    assertThat(hilbert.nameMapping).containsEntry("→", "->");
    assertThat(hilbert.nameMapping).containsEntry("¬", "-.");
    assertThat(hilbert.nameMapping).containsEntry("φ", "ph");
    assertThat(hilbert.nameMapping).containsEntry("->", "->");
    assertThat(hilbert.nameMapping).containsEntry("\\/", "\\/");
    assertThat(hilbert.nameMapping).containsEntry("∨", "\\/");
  }

  @Test
  public void predicateAxioms() {
    assertThat(conclusion(predicate, "AX7")).isEqualTo("-> = x y -> = x z = y z");
    assertThat(conclusion(predicate, "AX13")).isEqualTo("-> -. = x y -> = y z A. x = y z");
    assertThat(predicate.assertion("AX5").floating().stream().map(h -> h.label))
        .containsExactly("ph", "x")
        .inOrder();
    assertThat(predicate.assertion("AX5").floating().get(1).typecode.spelling())
        .isEqualTo("setvar");
  }

  @Test
  public void predicateBuildsOnHilbert() {
    assertThat(conclusion(predicate, "a5i")).isEqualTo("A. x ph");
    assertThat(conclusion(predicate, "ax5a1d")).isEqualTo("-> ph -> ps A. x ph");
    assertThat(predicate.assertion("ax5a1d").proof.references())
        .containsExactly("AX5", "a1d")
        .inOrder();
    assertThat(predicate.imports).containsExactly("hilbert");
    assertThat(predicate.labelOrigins).containsEntry("a1d", "hilbert");
    assertThat(predicate.labelOrigins).containsEntry("a5i", "predicate");
    assertThat(predicate.assertion("A1")).isNull();
    assertThat(predicate.exported).doesNotContainKey("A1");
  }
}
