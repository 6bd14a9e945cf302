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
package org.lemmata.emit;

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableList;
import org.junit.BeforeClass;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.lemmata.build.LogicPackage;
import org.lemmata.build.PackageBuilder;
import org.lemmata.build.PackageSpec;
import org.lemmata.library.Hilbert;
import org.lemmata.testing.MiniLogic;

@RunWith(JUnit4.class)
public class IrEmitterTest {

  private static IrArtifact hilbert;

  @BeforeClass
  public static void buildHilbert() {
    hilbert = new PackageBuilder().build(Hilbert.spec()).toIr();
  }

  @Test
  public void statementKinds() {
    IrStatement a1 = hilbert.statement("A1");
    assertThat(a1.kind).isEqualTo(IrStatement.Kind.AXIOM);
    assertThat(a1.axiom).isTrue();
    assertThat(a1.proof).isNull();
    assertThat(hilbert.statement("wi").kind).isEqualTo(IrStatement.Kind.DEFINITION);
    assertThat(hilbert.statement("mp").kind).isEqualTo(IrStatement.Kind.DEFINITION);
    assertThat(hilbert.statement("syl").kind).isEqualTo(IrStatement.Kind.THEOREM);
    assertThat(hilbert.statement("syl").axiom).isNull();
    assertThat(hilbert.statement("imim2i").kind).isEqualTo(IrStatement.Kind.THEOREM);
  }

  @Test
  public void hypotheses() {
    ImmutableList<IrStatement.Hypothesis> hyps = hilbert.statement("mp").hypotheses;
    assertThat(hyps.stream().map(h -> h.label))
        .containsExactly("ph", "ps", "mp.1", "mp.2")
        .inOrder();
    assertThat(hyps.get(0).kind).isEqualTo("floating");
    assertThat(hyps.get(0).typecode).isEqualTo("wff");
    assertThat(hyps.get(3).kind).isEqualTo("essential");
    assertThat(hyps.get(3).typecode).isEqualTo("|-");
    assertThat(hyps.get(3).subject).containsExactly("->", "ph", "ps").inOrder();
  }

  @Test
  public void proofEntriesUseCanonicalLabels() {
    ImmutableList<IrStatement.ProofEntry> proof = hilbert.statement("a2i").proof;
    assertThat(proof.stream().map(e -> e.ref)).containsExactly("a2i.1", "A2", "mp").inOrder();
    assertThat(proof.get(0).substitution).isEmpty();
    assertThat(proof.get(1).substitution.keySet()).containsExactly("ph", "ps", "ch").inOrder();

    ImmutableList<IrStatement.ProofEntry> con4i = hilbert.statement("con4i").proof;
    assertThat(con4i.stream().map(e -> e.ref)).containsExactly("con4i.1", "A3", "mp").inOrder();
    assertThat(hilbert.statement("con4i").conclusion).containsExactly("->", "ps", "ph").inOrder();
  }

  @Test
  public void jsonHasOnlyCanonicalSpellings() {
    String json = ArtifactSink.render(hilbert, false);
    assertThat(json).startsWith("{\"package\":\"hilbert\",\"imports\":[],\"statements\":[");
    assertThat(json).contains("{\"label\":\"A1\",\"kind\":\"axiom\",");
    assertThat(json).contains("\"axiom\":true");
    for (String alias : ImmutableList.of("→", "¬", "φ", "ψ", "∨", "ax-2", "ax-mp")) {
      assertThat(json).doesNotContain(alias);
    }
  }

  @Test
  public void stubsAreOmitted() {
    PackageSpec.Builder b = MiniLogic.base("stubs");
    b.lemma("s1").conclusion("p Imp p");
    LogicPackage pkg = new PackageBuilder().build(b.build());
    IrArtifact ir = pkg.toIr();
    assertThat(ir.statements.stream().map(s -> s.label)).containsExactly("A1", "mp").inOrder();
    assertThat(ir.statement("s1")).isNull();
  }
}
