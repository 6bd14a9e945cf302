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
package org.lemmata.syntax;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;
import static org.lemmata.syntax.Expr.apply;
import static org.lemmata.syntax.Expr.var;

import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.lemmata.symbol.NameMapping;
import org.lemmata.symbol.NameResolver;
import org.lemmata.symbol.ResolutionError;
import org.lemmata.symbol.ResolutionPolicy;
import org.lemmata.symbol.SymbolInterner;
import org.lemmata.testing.MiniLogic;

@RunWith(JUnit4.class)
public class ExprCompilerTest {

  /** MiniLogic plus a definition of {@code Or}. */
  private static final Skeleton SKELETON =
      Skeleton.builder()
          .include(MiniLogic.SKELETON)
          .definition(
              "Or",
              2,
              Notation.infix(20, Notation.Assoc.LEFT),
              args -> apply("Imp", apply("Not", args.get(0)), args.get(1)))
          .build();

  private final SymbolInterner interner = new SymbolInterner();
  private final NameMapping mapping = new NameMapping();
  private final ExprCompiler compiler = newCompiler(interner, mapping);

  private static ExprCompiler newCompiler(SymbolInterner interner, NameMapping mapping) {
    return new ExprCompiler(
        SKELETON,
        new NameResolver(SKELETON.lexicon(), interner, mapping, ResolutionPolicy.STRICT));
  }

  @Test
  public void emitsPolishNotation() {
    TokenSeq seq = compiler.compile(apply("Imp", var("p"), apply("Imp", var("q"), var("p"))));
    assertThat(seq.toString()).isEqualTo("Imp p Imp q p");
  }

  @Test
  public void compilationIsDeterministic() {
    Expr expr = new FormulaReader(SKELETON).read("~ p Imp ( q Or r )");
    TokenSeq first = compiler.compile(expr);
    TokenSeq second = newCompiler(new SymbolInterner(), new NameMapping()).compile(expr);
    assertThat(second).isEqualTo(first);
    assertThat(compiler.compile(expr)).isEqualTo(first);
    assertThat(first.toString()).isEqualTo("Imp Not p Imp Not q r");
  }

  @Test
  public void aliasesAreRecorded() {
    TokenSeq seq = compiler.compile(apply("~", var("p")));
    assertThat(seq.toString()).isEqualTo("Not p");
    assertThat(mapping.asMap()).containsExactly("~", "Not", "p", "p").inOrder();
  }

  @Test
  public void definitionsExpand() {
    TokenSeq seq = compiler.compile(apply("Or", var("p"), apply("Or", var("q"), var("r"))));
    assertThat(seq.toString()).isEqualTo("Imp Not p Imp Not q r");
    assertThat(mapping.asMap()).containsEntry("Or", "Or");
  }

  @Test
  public void definitionAliasesAreRecorded() {
    Skeleton skeleton =
        Skeleton.builder()
            .include(SKELETON)
            .definition(
                "Unless",
                2,
                null,
                args -> apply("Imp", apply("Not", args.get(1)), args.get(0)),
                "Lest")
            .build();
    ExprCompiler withAlias =
        new ExprCompiler(
            skeleton,
            new NameResolver(skeleton.lexicon(), interner, mapping, ResolutionPolicy.STRICT));
    TokenSeq seq = withAlias.compile(apply("Lest", var("p"), var("q")));
    assertThat(seq.toString()).isEqualTo("Imp Not q p");
    assertThat(mapping.asMap()).containsEntry("Lest", "Unless");
    assertThat(mapping.asMap()).doesNotContainKey("Unless");
  }

  @Test
  public void definitionNamesAreNotVariables() {
    CompilationError e =
        assertThrows(CompilationError.class, () -> compiler.compile(var("Or")));
    assertThat(e.kind).isEqualTo(CompilationError.Kind.UNBOUND_VARIABLE);
    assertThat(e.detail).isEqualTo("'Or' is not a variable");
  }

  @Test
  public void definitionsCheckTheirOperandCount() {
    Definition or = SKELETON.definition("Or");
    IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class, () -> or.expand(ImmutableList.of(var("p"))));
    assertThat(e).hasMessageThat().isEqualTo("Or expects 2 operands, got 1");
  }

  @Test
  public void unregisteredAliasFailsResolution() {
    ResolutionError e =
        assertThrows(
            ResolutionError.class, () -> compiler.compile(apply("→", var("p"), var("q"))));
    assertThat(e.rawSpelling).isEqualTo("→");
  }

  @Test
  public void arityMismatch() {
    CompilationError e =
        assertThrows(CompilationError.class, () -> compiler.compile(apply("Imp", var("p"))));
    assertThat(e.kind).isEqualTo(CompilationError.Kind.ARITY_MISMATCH);
    assertThat(e.subject).isEqualTo("Imp");
    assertThat(e).hasMessageThat().isEqualTo("ARITY_MISMATCH: 'Imp' expects 2 operands, got 1");

    e = assertThrows(CompilationError.class, () -> compiler.compile(apply("Or", var("p"))));
    assertThat(e.kind).isEqualTo(CompilationError.Kind.ARITY_MISMATCH);
    assertThat(e.subject).isEqualTo("Or");
  }

  @Test
  public void unboundVariables() {
    CompilationError e =
        assertThrows(CompilationError.class, () -> compiler.compile(var("s")));
    assertThat(e.kind).isEqualTo(CompilationError.Kind.UNBOUND_VARIABLE);
    assertThat(e).hasCauseThat().isInstanceOf(ResolutionError.class);

    e = assertThrows(CompilationError.class, () -> compiler.compile(var("Imp")));
    assertThat(e.kind).isEqualTo(CompilationError.Kind.UNBOUND_VARIABLE);
    assertThat(e.detail).isEqualTo("'Imp' is not a variable");

    e = assertThrows(CompilationError.class, () -> compiler.compile(var("wff")));
    assertThat(e.kind).isEqualTo(CompilationError.Kind.UNBOUND_VARIABLE);
  }

  @Test
  public void unknownConnective() {
    CompilationError e =
        assertThrows(CompilationError.class, () -> compiler.compile(apply("p", var("q"))));
    assertThat(e.kind).isEqualTo(CompilationError.Kind.UNKNOWN_CONNECTIVE);
    assertThat(e.subject).isEqualTo("p");
  }
}
