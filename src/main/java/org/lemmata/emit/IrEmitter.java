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

import com.google.common.base.Ascii;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.lemmata.proof.Assertion;
import org.lemmata.proof.Hypothesis;
import org.lemmata.proof.Justification;
import org.lemmata.proof.LoweredProof;

/**
 * Converts built assertions to IR. Axioms become {@code axiom} statements, rule skeletons become
 * {@code definition} statements, and lemmas and theorems become {@code theorem} statements; stubs
 * are omitted.
 */
public final class IrEmitter {

  private IrEmitter() {}

  public static IrArtifact emit(
      String packageName, List<String> imports, Iterable<Assertion> assertions) {
    ImmutableList.Builder<IrStatement> statements = ImmutableList.builder();
    for (Assertion assertion : assertions) {
      IrStatement statement = statement(assertion);
      if (statement != null) {
        statements.add(statement);
      }
    }
    return new IrArtifact(packageName, ImmutableList.copyOf(imports), statements.build());
  }

  /** Returns the IR for {@code assertion}, or null if it is a stub. */
  static @Nullable IrStatement statement(Assertion assertion) {
    if (assertion.isStub()) {
      return null;
    }
    ImmutableList<IrStatement.Hypothesis> hypotheses =
        assertion.hypotheses.stream()
            .map(IrEmitter::hypothesis)
            .collect(ImmutableList.toImmutableList());
    LoweredProof proof = assertion.proof;
    ImmutableList<IrStatement.ProofEntry> entries =
        (proof == null)
            ? null
            : proof.entries.stream()
                .map(IrEmitter::proofEntry)
                .collect(ImmutableList.toImmutableList());
    return new IrStatement(
        assertion.labelSpelling(),
        kind(assertion.kind),
        hypotheses,
        assertion.conclusion.spellings(),
        entries);
  }

  private static IrStatement.Kind kind(Assertion.Kind kind) {
    return switch (kind) {
      case AXIOM -> IrStatement.Kind.AXIOM;
      case RULE -> IrStatement.Kind.DEFINITION;
      case LEMMA, THEOREM -> IrStatement.Kind.THEOREM;
    };
  }

  private static IrStatement.Hypothesis hypothesis(Hypothesis h) {
    return new IrStatement.Hypothesis(
        Ascii.toLowerCase(h.kind.name()), h.label, h.typecode.spelling(), h.subject.spellings());
  }

  private static IrStatement.ProofEntry proofEntry(Justification j) {
    ImmutableMap.Builder<String, ImmutableList<String>> substitution = ImmutableMap.builder();
    j.substitution.forEach((v, seq) -> substitution.put(v.spelling(), seq.spellings()));
    return new IrStatement.ProofEntry(
        j.label, substitution.buildOrThrow(), j.result.spellings());
  }
}
