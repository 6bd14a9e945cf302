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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import org.jspecify.annotations.Nullable;
import org.lemmata.symbol.CanonicalId;
import org.lemmata.symbol.SymbolInterner;
import org.lemmata.syntax.TokenSeq;

/**
 * A labelled statement of a logic package: an axiom, a rule skeleton, or a lemma or theorem with
 * its hypotheses and (usually) a lowered proof.
 *
 * <p>Assertions are immutable. Their tokens belong to the build context that created them; an
 * Assertion read from another package is first copied with {@link #reintern}.
 */
public final class Assertion {

  /** The build phase that produced an assertion. */
  public enum Kind {
    AXIOM,
    RULE,
    LEMMA,
    THEOREM
  }

  /** Why an assertion is believed. */
  public enum Provenance {
    /** Accepted without proof (axioms and rule skeletons). */
    AXIOM,
    /** Carries a {@link LoweredProof}. */
    PROVED,
    /** Declared without a proof; may not be exported or referenced. */
    STUB,
    /** Read from an upstream package; its proof stays there. */
    IMPORTED
  }

  public final CanonicalId label;
  public final Kind kind;
  public final CanonicalId typecode;

  /** The floating hypotheses followed by the essential hypotheses. */
  public final ImmutableList<Hypothesis> hypotheses;

  public final TokenSeq conclusion;
  public final Provenance provenance;

  /** Non-null if and only if {@link #provenance} is {@link Provenance#PROVED}. */
  public final @Nullable LoweredProof proof;

  public Assertion(
      CanonicalId label,
      Kind kind,
      CanonicalId typecode,
      ImmutableList<Hypothesis> hypotheses,
      TokenSeq conclusion,
      Provenance provenance,
      @Nullable LoweredProof proof) {
    checkArgument(
        (provenance == Provenance.PROVED) == (proof != null),
        "Proof must be present exactly when provenance is PROVED");
    this.label = label;
    this.kind = kind;
    this.typecode = typecode;
    this.hypotheses = hypotheses;
    this.conclusion = conclusion;
    this.provenance = provenance;
    this.proof = proof;
  }

  public String labelSpelling() {
    return label.spelling();
  }

  public boolean isStub() {
    return provenance == Provenance.STUB;
  }

  public ImmutableList<Hypothesis> floating() {
    return hypotheses.stream()
        .filter(Hypothesis::isFloating)
        .collect(ImmutableList.toImmutableList());
  }

  public ImmutableList<Hypothesis> essentials() {
    return hypotheses.stream()
        .filter(h -> !h.isFloating())
        .collect(ImmutableList.toImmutableList());
  }

  /**
   * Returns a copy of this assertion for use in another build context, with its label interned in
   * {@code labels} and its tokens in {@code symbols}. The copy does not carry the proof.
   */
  public Assertion reintern(SymbolInterner labels, SymbolInterner symbols) {
    return new Assertion(
        labels.reintern(label),
        kind,
        symbols.reintern(typecode),
        hypotheses.stream()
            .map(h -> h.reintern(symbols))
            .collect(ImmutableList.toImmutableList()),
        conclusion.reintern(symbols),
        Provenance.IMPORTED,
        null);
  }

  @Override
  public String toString() {
    return String.format(
        "%s (%s) %s |- %s %s",
        label.spelling(), kind, essentials(), typecode.spelling(), conclusion);
  }
}
