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
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.lemmata.symbol.CanonicalId;
import org.lemmata.symbol.SymbolInterner;
import org.lemmata.syntax.CompilationError;
import org.lemmata.syntax.Skeleton;
import org.lemmata.syntax.TokenSeq;

/**
 * Derives the complete hypothesis list of an assertion from its essential hypotheses and
 * conclusion: one floating hypothesis for each variable that occurs in them (scanning the
 * essentials in declaration order, then the conclusion, and taking variables in order of first
 * occurrence), followed by the essentials themselves.
 */
public final class HypothesisSynthesizer {
  private final Skeleton skeleton;
  private final SymbolInterner symbols;

  public HypothesisSynthesizer(Skeleton skeleton, SymbolInterner symbols) {
    this.skeleton = skeleton;
    this.symbols = symbols;
  }

  public ImmutableList<Hypothesis> synthesize(
      String label, List<TokenSeq> essentials, TokenSeq conclusion) {
    Set<TokenSeq> seen = new HashSet<>();
    for (TokenSeq essential : essentials) {
      if (!seen.add(essential)) {
        throw new CompilationError(
            CompilationError.Kind.DUPLICATE_HYPOTHESIS,
            essential.toString(),
            String.format("Hypothesis '%s' of %s is declared twice", essential, label));
      }
    }
    Set<CanonicalId> variables = new LinkedHashSet<>();
    essentials.forEach(e -> addVariables(e, variables));
    addVariables(conclusion, variables);

    ImmutableList.Builder<Hypothesis> result = ImmutableList.builder();
    for (CanonicalId v : variables) {
      String typecode = skeleton.variableTypecode(v.spelling());
      if (typecode == null) {
        throw new CompilationError(
            CompilationError.Kind.UNBOUND_VARIABLE,
            v.spelling(),
            String.format("Variable '%s' of %s has no declared typecode", v.spelling(), label));
      }
      result.add(
          new Hypothesis(
              Hypothesis.Kind.FLOATING, v.spelling(), symbols.intern(typecode), TokenSeq.of(v)));
    }
    CanonicalId assertionTypecode = symbols.intern(skeleton.assertionTypecode());
    for (int i = 0; i < essentials.size(); i++) {
      result.add(
          new Hypothesis(
              Hypothesis.Kind.ESSENTIAL,
              label + "." + (i + 1),
              assertionTypecode,
              essentials.get(i)));
    }
    return result.build();
  }

  private void addVariables(TokenSeq seq, Set<CanonicalId> variables) {
    for (CanonicalId token : seq.tokens()) {
      if (skeleton.connective(token.spelling()) == null) {
        variables.add(token);
      }
    }
  }
}
