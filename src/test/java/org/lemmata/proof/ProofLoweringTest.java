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
package org.lemmata.proof;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;
import static org.lemmata.proof.ProofStep.compose;
import static org.lemmata.proof.ProofStep.hyp;
import static org.lemmata.proof.ProofStep.ref;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.lemmata.symbol.NameMapping;
import org.lemmata.symbol.NameResolver;
import org.lemmata.symbol.ResolutionPolicy;
import org.lemmata.symbol.SymbolInterner;
import org.lemmata.syntax.CompilationError;
import org.lemmata.syntax.Expr;
import org.lemmata.syntax.ExprCompiler;
import org.lemmata.syntax.FormulaReader;
import org.lemmata.syntax.TokenSeq;
import org.lemmata.testing.MiniLogic;

@RunWith(JUnit4.class)
public class ProofLoweringTest {

  private final SymbolInterner labels = new SymbolInterner();
  private final SymbolInterner symbols = new SymbolInterner();
  private final ExprCompiler compiler =
      new ExprCompiler(
          MiniLogic.SKELETON,
          new NameResolver(
              MiniLogic.SKELETON.lexicon(),
              symbols,
              new NameMapping(),
              ResolutionPolicy.STRICT));
  private final FormulaReader reader = new FormulaReader(MiniLogic.SKELETON);
  private final HypothesisSynthesizer synthesizer =
      new HypothesisSynthesizer(MiniLogic.SKELETON, symbols);
  private final Map<String, Assertion> assertions = new HashMap<>();
  private final ProofLowering lowering = new ProofLowering(compiler, assertions::get);

  @Before
  public void declareAxioms() {
    declare("A1", Assertion.Kind.AXIOM, "|-", "p Imp ( q Imp p )");
    declare("mp", Assertion.Kind.RULE, "|-", "q", "p", "p Imp q");
    declare("wi", Assertion.Kind.RULE, "wff", "p Imp q");
    declare("notmp", Assertion.Kind.RULE, "|-", "q", "p", "Not p");
  }

  private TokenSeq wff(String text) {
    return compiler.compile(reader.read(text));
  }

  private ImmutableList<TokenSeq> wffs(String... texts) {
    return Arrays.stream(texts).map(this::wff).collect(ImmutableList.toImmutableList());
  }

  private Assertion declare(
      String label, Assertion.Kind kind, String typecode, String conclusion, String... hyps) {
    return add(label, kind, typecode, conclusion, Assertion.Provenance.AXIOM, hyps);
  }

  private Assertion add(
      String label,
      Assertion.Kind kind,
      String typecode,
      String conclusion,
      Assertion.Provenance provenance,
      String... hyps) {
    TokenSeq concl = wff(conclusion);
    Assertion result =
        new Assertion(
            labels.intern(label),
            kind,
            symbols.intern(typecode),
            synthesizer.synthesize(label, wffs(hyps), concl),
            concl,
            provenance,
            null);
    assertions.put(label, result);
    return result;
  }

  /** Parses bindings of the form "{@code var := formula}". */
  private ImmutableMap<String, Expr> bind(String... bindings) {
    ImmutableMap.Builder<String, Expr> result = ImmutableMap.builder();
    for (String binding : bindings) {
      int sep = binding.indexOf(":=");
      result.put(binding.substring(0, sep).trim(), reader.read(binding.substring(sep + 2)));
    }
    return result.buildOrThrow();
  }

  private LoweredProof lower(
      String label, ImmutableList<String> hyps, String conclusion, ProofStep... steps) {
    TokenSeq concl = wff(conclusion);
    ImmutableList<Hypothesis> hypotheses =
        synthesizer.synthesize(label, wffs(hyps.toArray(new String[0])), concl);
    return lowering.lower(label, hypotheses, concl, Arrays.asList(steps));
  }

  private LoweringError lowerFails(
      String label, ImmutableList<String> hyps, String conclusion, ProofStep... steps) {
    return assertThrows(LoweringError.class, () -> lower(label, hyps, conclusion, steps));
  }

  @Test
  public void hypothesisThenAxiomThenModusPonens() {
    LoweredProof proof =
        lower(
            "L1",
            ImmutableList.of("p"),
            "q Imp p",
            hyp(0),
            ref("A1", bind("p := p", "q := q")),
            compose(0, 1));
    assertThat(proof.conclusion().toString()).isEqualTo("Imp q p");
    assertThat(proof.entries).hasSize(3);

    Justification first = proof.entries.get(0);
    assertThat(first.kind).isEqualTo(Justification.Kind.HYPOTHESIS);
    assertThat(first.label).isEqualTo("L1.1");
    assertThat(first.result.toString()).isEqualTo("p");

    Justification second = proof.entries.get(1);
    assertThat(second.label).isEqualTo("A1");
    assertThat(second.result.toString()).isEqualTo("Imp p Imp q p");

    Justification last = proof.entries.get(2);
    assertThat(last.kind).isEqualTo(Justification.Kind.ASSERTION);
    assertThat(last.label).isEqualTo("mp");
    assertThat(last.substitution.values().stream().map(TokenSeq::toString))
        .containsExactly("p", "Imp q p")
        .inOrder();
    assertThat(last.result).isEqualTo(proof.conclusion());
    assertThat(proof.references()).containsExactly("A1", "mp");
  }

  @Test
  public void refDischargesEssentialHypotheses() {
    LoweredProof proof =
        lower(
            "L2",
            ImmutableList.of("p", "p Imp q"),
            "q",
            hyp(1),
            hyp(0),
            ref("mp", bind("p := p", "q := q")));
    assertThat(proof.entries.get(2).result.toString()).isEqualTo("q");

    LoweringError e =
        lowerFails(
            "L2",
            ImmutableList.of("p", "p Imp q"),
            "q",
            hyp(0),
            hyp(1),
            hyp(0),
            ref("mp", bind("p := p", "q := q")));
    // Only the nearest copy of "p" is discharged.
    assertThat(e.kind).isEqualTo(LoweringError.Kind.CONCLUSION_MISMATCH);
    assertThat(e.stepIndex).isEqualTo(4);
    assertThat(e.detail).isEqualTo("2 entries left on the stack");
  }

  @Test
  public void missingEssentialHypothesis() {
    LoweringError e =
        lowerFails("L3", ImmutableList.of("p"), "q", hyp(0), ref("mp", bind("p := q", "q := q")));
    assertThat(e.kind).isEqualTo(LoweringError.Kind.UNRESOLVED_REFERENCE);
    assertThat(e.stepIndex).isEqualTo(1);
    assertThat(e.reference).isEqualTo("mp.1");
    assertThat(e.expected.toString()).isEqualTo("q");
  }

  @Test
  public void unknownReference() {
    LoweringError e =
        lowerFails(
            "L4",
            ImmutableList.of(),
            "p Imp ( p Imp p )",
            ref("A1", bind("p := p", "q := p")),
            ref("ax-missing", ImmutableMap.of()));
    assertThat(e.kind).isEqualTo(LoweringError.Kind.UNRESOLVED_REFERENCE);
    assertThat(e.label).isEqualTo("L4");
    assertThat(e.stepIndex).isEqualTo(1);
    assertThat(e.reference).isEqualTo("ax-missing");
    assertThat(e)
        .hasMessageThat()
        .isEqualTo(
            "UNRESOLVED_REFERENCE in L4 at step 1: No proved assertion 'ax-missing'");
  }

  @Test
  public void stubsAndSyntaxRulesCannotBeReferenced() {
    add("S1", Assertion.Kind.LEMMA, "|-", "p Imp p", Assertion.Provenance.STUB);
    LoweringError e =
        lowerFails("L5", ImmutableList.of(), "p Imp p", ref("S1", bind("p := p")));
    assertThat(e.kind).isEqualTo(LoweringError.Kind.UNRESOLVED_REFERENCE);
    assertThat(e.reference).isEqualTo("S1");

    e = lowerFails("L5", ImmutableList.of(), "p Imp q", ref("wi", bind("p := p", "q := q")));
    assertThat(e.kind).isEqualTo(LoweringError.Kind.UNRESOLVED_REFERENCE);
    assertThat(e.detail).isEqualTo("'wi' is a wff rule");
  }

  @Test
  public void hypothesisIndexOutOfRange() {
    LoweringError e = lowerFails("L6", ImmutableList.of("p"), "p", hyp(1));
    assertThat(e.kind).isEqualTo(LoweringError.Kind.INDEX_OUT_OF_RANGE);
    assertThat(e.stepIndex).isEqualTo(0);

    e = lowerFails("L6", ImmutableList.of("p"), "p", hyp(-1));
    assertThat(e.kind).isEqualTo(LoweringError.Kind.INDEX_OUT_OF_RANGE);
  }

  @Test
  public void composeUnderflow() {
    LoweringError e = lowerFails("L7", ImmutableList.of("p"), "p", hyp(0), compose(0, 1));
    assertThat(e.kind).isEqualTo(LoweringError.Kind.STACK_UNDERFLOW);
    assertThat(e.stepIndex).isEqualTo(1);

    e = lowerFails("L7", ImmutableList.of("p"), "p", hyp(0), hyp(0), compose(0, 0));
    assertThat(e.kind).isEqualTo(LoweringError.Kind.STACK_UNDERFLOW);
  }

  @Test
  public void composeMismatch() {
    LoweringError e =
        lowerFails(
            "L8",
            ImmutableList.of("q"),
            "q Imp p",
            hyp(0),
            ref("A1", bind("p := p", "q := q")),
            compose(0, 1));
    assertThat(e.kind).isEqualTo(LoweringError.Kind.CONCLUSION_MISMATCH);
    assertThat(e.stepIndex).isEqualTo(2);
    assertThat(e.expected.toString()).isEqualTo("p");
    assertThat(e.actual.toString()).isEqualTo("q");

    e = lowerFails("L8", ImmutableList.of("p", "Not p"), "p", hyp(0), hyp(1), compose(0, 1));
    assertThat(e.kind).isEqualTo(LoweringError.Kind.CONCLUSION_MISMATCH);
    assertThat(e.actual.toString()).isEqualTo("Not p");
  }

  @Test
  public void composeRequiresModusPonensShape() {
    LoweringError e =
        lowerFails(
            "L9", ImmutableList.of("p", "p Imp q"), "q", hyp(0), hyp(1), compose(0, 1, "A1"));
    assertThat(e.kind).isEqualTo(LoweringError.Kind.UNIFICATION_FAILURE);

    e =
        lowerFails(
            "L9", ImmutableList.of("p", "Not p"), "q", hyp(0), hyp(1), compose(0, 1, "notmp"));
    assertThat(e.kind).isEqualTo(LoweringError.Kind.UNIFICATION_FAILURE);
  }

  @Test
  public void substitutionMustCoverExactlyTheVariables() {
    LoweringError e =
        lowerFails("L10", ImmutableList.of(), "p Imp ( q Imp p )", ref("A1", bind("p := p")));
    assertThat(e.kind).isEqualTo(LoweringError.Kind.UNIFICATION_FAILURE);
    assertThat(e.reference).isEqualTo("A1");
    assertThat(e.detail).isEqualTo("No binding for 'q' in reference to A1");

    e =
        lowerFails(
            "L10",
            ImmutableList.of(),
            "p Imp ( q Imp p )",
            ref("A1", bind("p := p", "q := q", "r := q")));
    assertThat(e.kind).isEqualTo(LoweringError.Kind.UNIFICATION_FAILURE);
    assertThat(e.detail).isEqualTo("'r' is not a variable of A1");
  }

  @Test
  public void substitutionMustBeWellTyped() {
    LoweringError e =
        lowerFails(
            "L11",
            ImmutableList.of(),
            "x Imp ( q Imp x )",
            ref("A1", bind("p := x", "q := q")));
    assertThat(e.kind).isEqualTo(LoweringError.Kind.UNIFICATION_FAILURE);

    e =
        lowerFails(
            "L11",
            ImmutableList.of(),
            "p Imp ( q Imp p )",
            ref("A1", ImmutableMap.of("p", Expr.apply("Imp", Expr.var("p")), "q", Expr.var("q"))));
    assertThat(e.kind).isEqualTo(LoweringError.Kind.UNIFICATION_FAILURE);
    assertThat(e).hasCauseThat().isInstanceOf(CompilationError.class);
  }

  @Test
  public void conclusionMismatch() {
    LoweringError e =
        lowerFails(
            "L12",
            ImmutableList.of(),
            "q Imp ( p Imp q )",
            ref("A1", bind("p := p", "q := q")));
    assertThat(e.kind).isEqualTo(LoweringError.Kind.CONCLUSION_MISMATCH);
    assertThat(e.stepIndex).isEqualTo(1);
    assertThat(e.expected.toString()).isEqualTo("Imp q Imp p q");
    assertThat(e.actual.toString()).isEqualTo("Imp p Imp q p");

    e = lowerFails("L12", ImmutableList.of("p"), "p");
    assertThat(e.kind).isEqualTo(LoweringError.Kind.CONCLUSION_MISMATCH);
    assertThat(e.stepIndex).isEqualTo(0);
    assertThat(e.actual).isNull();
  }
}
