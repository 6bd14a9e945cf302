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
package org.lemmata.build;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import org.jspecify.annotations.Nullable;
import org.lemmata.proof.Assertion;
import org.lemmata.proof.ProofStep;
import org.lemmata.symbol.Lexicon;
import org.lemmata.syntax.Expr;
import org.lemmata.syntax.FormulaReader;
import org.lemmata.syntax.Skeleton;

/**
 * One entry of a {@link PackageSpec}: an axiom, rule skeleton, lemma, or theorem, with its
 * essential hypotheses, conclusion, and (for lemmas and theorems) proof script.
 *
 * <p>Formula text is not read until the declaration is built, so that a formula that fails to
 * parse is reported against its own declaration rather than the whole package.
 */
public final class Declaration {
  public final String label;
  public final Assertion.Kind kind;

  /** The statement's typecode, or null for the skeleton's assertion typecode. */
  public final @Nullable String typecode;

  private final ImmutableList<Function<FormulaReader, Expr>> essentials;
  private final Function<FormulaReader, Expr> conclusion;

  /** Null for axioms, rule skeletons, and stubs. */
  private final @Nullable ImmutableList<Function<FormulaReader, ProofStep>> proof;

  private Declaration(
      String label,
      Assertion.Kind kind,
      @Nullable String typecode,
      ImmutableList<Function<FormulaReader, Expr>> essentials,
      Function<FormulaReader, Expr> conclusion,
      @Nullable ImmutableList<Function<FormulaReader, ProofStep>> proof) {
    this.label = label;
    this.kind = kind;
    this.typecode = typecode;
    this.essentials = essentials;
    this.conclusion = conclusion;
    this.proof = proof;
  }

  /** True for a lemma or theorem that was declared without a proof. */
  public boolean isStub() {
    return proof == null && needsProof(kind);
  }

  private static boolean needsProof(Assertion.Kind kind) {
    return kind == Assertion.Kind.LEMMA || kind == Assertion.Kind.THEOREM;
  }

  /**
   * Reads any formula text of this declaration with {@code reader}.
   *
   * @throws org.lemmata.syntax.ParseError if some formula text is malformed
   */
  public Statement read(FormulaReader reader) {
    return new Statement(
        essentials.stream().map(e -> e.apply(reader)).collect(ImmutableList.toImmutableList()),
        conclusion.apply(reader),
        (proof == null)
            ? null
            : proof.stream().map(s -> s.apply(reader)).collect(ImmutableList.toImmutableList()));
  }

  @Override
  public String toString() {
    return label + " (" + kind + ")";
  }

  /** The formulas and proof script of a Declaration, once read. */
  public static final class Statement {
    public final ImmutableList<Expr> essentials;
    public final Expr conclusion;

    /** Null for axioms, rule skeletons, and stubs. */
    public final @Nullable ImmutableList<ProofStep> proof;

    Statement(
        ImmutableList<Expr> essentials, Expr conclusion, @Nullable ImmutableList<ProofStep> proof) {
      this.essentials = essentials;
      this.conclusion = conclusion;
      this.proof = proof;
    }
  }

  /**
   * Accumulates the parts of a Declaration. Formulas may be given either as Exprs or as formula
   * text; text is read when the package is built, using the skeleton of the package and its
   * imports.
   */
  public static final class Builder {
    private final String label;
    private final Assertion.Kind kind;
    private @Nullable String typecode;
    private final List<Function<FormulaReader, Expr>> essentials = new ArrayList<>();
    private @Nullable Function<FormulaReader, Expr> conclusion;
    private @Nullable List<Function<FormulaReader, ProofStep>> steps;

    Builder(String label, Assertion.Kind kind) {
      checkArgument(Lexicon.isCanonicalForm(label), "'%s' is not a valid label", label);
      this.label = label;
      this.kind = kind;
    }

    /**
     * Sets the typecode of the statement, e.g. {@code wff} for a rule skeleton that describes how a
     * formula is formed rather than what is provable.
     */
    @CanIgnoreReturnValue
    public Builder typecode(String typecode) {
      this.typecode = typecode;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder hypotheses(String... texts) {
      for (String text : texts) {
        essentials.add(reader -> reader.read(text));
      }
      return this;
    }

    @CanIgnoreReturnValue
    public Builder hypotheses(Expr... exprs) {
      for (Expr expr : exprs) {
        essentials.add(reader -> expr);
      }
      return this;
    }

    @CanIgnoreReturnValue
    public Builder conclusion(String text) {
      conclusion = reader -> reader.read(text);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder conclusion(Expr expr) {
      conclusion = reader -> expr;
      return this;
    }

    /** Replaces the proof script; an empty list is a (failing) proof, not a stub. */
    @CanIgnoreReturnValue
    public Builder proof(List<ProofStep> proof) {
      steps = new ArrayList<>();
      proof.forEach(this::step);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder step(ProofStep step) {
      return addStep(reader -> step);
    }

    @CanIgnoreReturnValue
    public Builder hyp(int index) {
      return step(ProofStep.hyp(index));
    }

    /**
     * Appends a Ref step. Each binding has the form "{@code var := formula}", e.g. "{@code ph := ps
     * -> ch}".
     */
    @CanIgnoreReturnValue
    public Builder ref(String target, String... bindings) {
      Map<String, String> parsed = new LinkedHashMap<>();
      for (String binding : bindings) {
        int sep = binding.indexOf(":=");
        checkArgument(sep > 0, "Expected 'var := formula', got '%s'", binding);
        String prev = parsed.put(binding.substring(0, sep).trim(), binding.substring(sep + 2));
        checkArgument(prev == null, "Duplicate binding '%s'", binding);
      }
      return addStep(
          reader -> {
            Map<String, Expr> substitution = new LinkedHashMap<>();
            parsed.forEach((v, text) -> substitution.put(v, reader.read(text)));
            return ProofStep.ref(target, substitution);
          });
    }

    @CanIgnoreReturnValue
    public Builder compose(int antecedentPos, int implicationPos) {
      return step(ProofStep.compose(antecedentPos, implicationPos));
    }

    @CanIgnoreReturnValue
    public Builder compose(int antecedentPos, int implicationPos, String combinator) {
      return step(ProofStep.compose(antecedentPos, implicationPos, combinator));
    }

    private Builder addStep(Function<FormulaReader, ProofStep> step) {
      checkState(needsProof(kind), "%s %s cannot have a proof", kind, label);
      if (steps == null) {
        steps = new ArrayList<>();
      }
      steps.add(step);
      return this;
    }

    String label() {
      return label;
    }

    Declaration build(Skeleton skeleton) {
      checkState(conclusion != null, "%s has no conclusion", label);
      checkState(
          typecode == null || skeleton.typecodes().contains(typecode),
          "%s has undeclared typecode '%s'",
          label,
          typecode);
      return new Declaration(
          label,
          kind,
          typecode,
          ImmutableList.copyOf(essentials),
          conclusion,
          (steps == null) ? null : ImmutableList.copyOf(steps));
    }
  }
}
