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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.FormatMethod;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.lemmata.symbol.CanonicalId;
import org.lemmata.symbol.ResolutionError;
import org.lemmata.syntax.CompilationError;
import org.lemmata.syntax.Expr;
import org.lemmata.syntax.ExprCompiler;
import org.lemmata.syntax.Skeleton;
import org.lemmata.syntax.TokenSeq;

/**
 * Runs proof scripts, turning a list of {@link ProofStep}s into a {@link LoweredProof}.
 *
 * <p>Each run maintains a stack of statements. A run succeeds if, after the last step, the stack
 * holds exactly one statement and it equals the declared conclusion; any failure throws a {@link
 * LoweringError} that identifies the failing step.
 */
public final class ProofLowering {
  private final ExprCompiler compiler;
  private final Skeleton skeleton;
  private final AssertionLookup lookup;

  public ProofLowering(ExprCompiler compiler, AssertionLookup lookup) {
    this.compiler = compiler;
    this.skeleton = compiler.skeleton();
    this.lookup = lookup;
  }

  /**
   * Lowers the proof of the assertion {@code label}.
   *
   * @param hypotheses the assertion's hypotheses; {@link ProofStep.Hyp} indexes its essentials
   * @param conclusion the statement that the steps must prove
   */
  public LoweredProof lower(
      String label, List<Hypothesis> hypotheses, TokenSeq conclusion, List<ProofStep> steps) {
    ImmutableList<Hypothesis> essentials =
        hypotheses.stream().filter(h -> !h.isFloating()).collect(ImmutableList.toImmutableList());
    Run run = new Run(label, essentials);
    for (int i = 0; i < steps.size(); i++) {
      run.stepIndex = i;
      steps.get(i).accept(run);
    }
    run.stepIndex = steps.size();
    return run.finish(conclusion);
  }

  /** The state of a single call to {@link #lower}. */
  private class Run implements ProofStep.Visitor<Void> {
    final String label;
    final ImmutableList<Hypothesis> essentials;
    final List<TokenSeq> stack = new ArrayList<>();
    final ImmutableList.Builder<Justification> journal = ImmutableList.builder();
    int stepIndex;

    Run(String label, ImmutableList<Hypothesis> essentials) {
      this.label = label;
      this.essentials = essentials;
    }

    @Override
    public Void visitHyp(ProofStep.Hyp step) {
      if (step.index < 0 || step.index >= essentials.size()) {
        throw error(
            LoweringError.Kind.INDEX_OUT_OF_RANGE,
            String.format(
                "No hypothesis %s (%s has %s)", step.index, label, essentials.size()));
      }
      Hypothesis hyp = essentials.get(step.index);
      push(Justification.hypothesis(hyp.label, hyp.subject));
      return null;
    }

    @Override
    public Void visitRef(ProofStep.Ref step) {
      Assertion target = find(step.label);
      ImmutableMap<CanonicalId, TokenSeq> substitution = substitution(target, step.substitution);
      for (Hypothesis hyp : target.essentials()) {
        TokenSeq instance = instantiate(hyp.subject, substitution);
        // Discharge the nearest matching entry.
        int pos = stack.lastIndexOf(instance);
        if (pos < 0) {
          throw error(
              LoweringError.Kind.UNRESOLVED_REFERENCE,
              String.format("Hypothesis %s is not on the stack", hyp.label),
              hyp.label,
              instance,
              null,
              null);
        }
        stack.remove(pos);
      }
      TokenSeq result = instantiate(target.conclusion, substitution);
      push(Justification.assertion(target.labelSpelling(), substitution, result));
      return null;
    }

    @Override
    public Void visitCompose(ProofStep.Compose step) {
      String ruleLabel =
          (step.combinator != null) ? step.combinator : skeleton.defaultCombinator();
      if (ruleLabel == null) {
        throw error(LoweringError.Kind.UNRESOLVED_REFERENCE, "No default combinator");
      }
      Combinator rule = Combinator.of(find(ruleLabel));
      if (rule == null) {
        throw error(
            LoweringError.Kind.UNIFICATION_FAILURE,
            String.format("%s is not a modus ponens rule", ruleLabel));
      }
      int size = stack.size();
      int a = step.antecedentPos;
      int i = step.implicationPos;
      if (a < 0 || a >= size || i < 0 || i >= size || a == i) {
        throw error(
            LoweringError.Kind.STACK_UNDERFLOW,
            String.format("Cannot compose positions %s and %s of %s entries", a, i, size));
      }
      TokenSeq antecedent = stack.get(a);
      TokenSeq implication = stack.get(i);
      if (implication.isEmpty() || !implication.head().equals(rule.connective)) {
        throw error(
            LoweringError.Kind.CONCLUSION_MISMATCH,
            String.format("'%s' is not an implication", implication),
            null,
            null,
            implication,
            null);
      }
      ImmutableList<TokenSeq> parts = implication.operands(skeleton::arity);
      if (!parts.get(0).equals(antecedent)) {
        throw error(
            LoweringError.Kind.CONCLUSION_MISMATCH,
            "Antecedent does not match",
            null,
            parts.get(0),
            antecedent,
            null);
      }
      stack.remove(Math.max(a, i));
      stack.remove(Math.min(a, i));
      TokenSeq consequent = parts.get(1);
      push(
          Justification.assertion(
              rule.label,
              ImmutableMap.of(rule.antecedent, antecedent, rule.consequent, consequent),
              consequent));
      return null;
    }

    LoweredProof finish(TokenSeq conclusion) {
      if (stack.size() != 1 || !stack.get(0).equals(conclusion)) {
        TokenSeq top = stack.isEmpty() ? null : stack.get(stack.size() - 1);
        String detail =
            (stack.size() == 1)
                ? "Proved statement is not the conclusion"
                : String.format("%s entries left on the stack", stack.size());
        throw error(LoweringError.Kind.CONCLUSION_MISMATCH, detail, null, conclusion, top, null);
      }
      return new LoweredProof(journal.build(), conclusion);
    }

    private void push(Justification justification) {
      stack.add(justification.result);
      journal.add(justification);
    }

    /** Returns the visible, provable, non-stub assertion with the given label. */
    private Assertion find(String ref) {
      Assertion result = lookup.find(ref);
      String detail = null;
      if (result == null || result.isStub()) {
        detail = String.format("No proved assertion '%s'", ref);
      } else if (!result.typecode.spelling().equals(skeleton.assertionTypecode())) {
        detail = String.format("'%s' is a %s rule", ref, result.typecode.spelling());
      }
      if (detail != null) {
        throw error(LoweringError.Kind.UNRESOLVED_REFERENCE, detail, ref, null, null, null);
      }
      return result;
    }

    /**
     * Compiles the bindings of a Ref step, checking that they bind each of {@code target}'s
     * variables (and nothing else) to a formula of the right type.
     */
    private ImmutableMap<CanonicalId, TokenSeq> substitution(
        Assertion target, Map<String, Expr> bindings) {
      Map<CanonicalId, Hypothesis> floating = new LinkedHashMap<>();
      target.floating().forEach(h -> floating.put(h.variable(), h));
      Map<CanonicalId, TokenSeq> bound = new HashMap<>();
      for (Map.Entry<String, Expr> binding : bindings.entrySet()) {
        CanonicalId variable;
        TokenSeq value;
        try {
          variable = compiler.resolver().resolveId(binding.getKey());
          value = compiler.compile(binding.getValue());
        } catch (ResolutionError | CompilationError e) {
          throw error(
              LoweringError.Kind.UNIFICATION_FAILURE,
              String.format("Invalid binding for '%s': %s", binding.getKey(), e.getMessage()),
              target.labelSpelling(),
              null,
              null,
              e);
        }
        Hypothesis hyp = floating.get(variable);
        if (hyp == null) {
          throw unificationFailure(
              target, "'%s' is not a variable of %s", binding.getKey(), target.labelSpelling());
        }
        String valueType = typecodeOf(value);
        if (!hyp.typecode.spelling().equals(valueType)) {
          throw unificationFailure(
              target,
              "Cannot substitute '%s' (%s) for %s variable '%s'",
              value,
              valueType,
              hyp.typecode.spelling(),
              binding.getKey());
        }
        if (bound.put(variable, value) != null) {
          throw unificationFailure(target, "'%s' is bound twice", variable.spelling());
        }
      }
      ImmutableMap.Builder<CanonicalId, TokenSeq> result = ImmutableMap.builder();
      for (CanonicalId variable : floating.keySet()) {
        TokenSeq value = bound.get(variable);
        if (value == null) {
          throw unificationFailure(
              target,
              "No binding for '%s' in reference to %s",
              variable.spelling(),
              target.labelSpelling());
        }
        result.put(variable, value);
      }
      return result.buildOrThrow();
    }

    private @Nullable String typecodeOf(TokenSeq value) {
      return (value.size() == 1)
          ? skeleton.variableTypecode(value.head().spelling())
          : skeleton.formulaTypecode();
    }

    @FormatMethod
    private LoweringError unificationFailure(Assertion target, String format, Object... args) {
      return error(
          LoweringError.Kind.UNIFICATION_FAILURE,
          String.format(format, args),
          target.labelSpelling(),
          null,
          null,
          null);
    }

    private LoweringError error(LoweringError.Kind kind, String detail) {
      return error(kind, detail, null, null, null, null);
    }

    private LoweringError error(
        LoweringError.Kind kind,
        String detail,
        @Nullable String reference,
        @Nullable TokenSeq expected,
        @Nullable TokenSeq actual,
        @Nullable Throwable cause) {
      return new LoweringError(
          kind, label, stepIndex, detail, reference, expected, actual, cause);
    }
  }

  private static TokenSeq instantiate(TokenSeq seq, Map<CanonicalId, TokenSeq> substitution) {
    TokenSeq.Builder result = new TokenSeq.Builder();
    for (CanonicalId token : seq.tokens()) {
      TokenSeq value = substitution.get(token);
      if (value == null) {
        result.add(token);
      } else {
        result.addAll(value);
      }
    }
    return result.build();
  }

  /**
   * The shape of a modus-ponens rule: essential hypotheses {@code A} and {@code C A B} (for some
   * binary connective {@code C}), and conclusion {@code B}.
   */
  private static class Combinator {
    final String label;
    final CanonicalId connective;
    final CanonicalId antecedent;
    final CanonicalId consequent;

    Combinator(
        String label, CanonicalId connective, CanonicalId antecedent, CanonicalId consequent) {
      this.label = label;
      this.connective = connective;
      this.antecedent = antecedent;
      this.consequent = consequent;
    }

    /** Returns the Combinator for {@code rule}, or null if it doesn't have the required shape. */
    static @Nullable Combinator of(Assertion rule) {
      ImmutableList<Hypothesis> essentials = rule.essentials();
      if (essentials.size() != 2
          || essentials.get(0).subject.size() != 1
          || essentials.get(1).subject.size() != 3
          || rule.conclusion.size() != 1) {
        return null;
      }
      CanonicalId a = essentials.get(0).subject.head();
      CanonicalId b = rule.conclusion.head();
      TokenSeq implication = essentials.get(1).subject;
      if (a.equals(b) || !implication.get(1).equals(a) || !implication.get(2).equals(b)) {
        return null;
      }
      return new Combinator(rule.labelSpelling(), implication.head(), a, b);
    }
  }
}
