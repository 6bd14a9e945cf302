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

import com.google.common.collect.ImmutableMap;
import org.lemmata.symbol.CanonicalId;
import org.lemmata.syntax.TokenSeq;

/** One entry of a {@link LoweredProof}: how a single statement on the proof stack was obtained. */
public final class Justification {

  public enum Kind {
    /** The statement is one of the essential hypotheses of the assertion being proved. */
    HYPOTHESIS,
    /** The statement is an instance of a previously established assertion. */
    ASSERTION
  }

  public final Kind kind;

  /** The hypothesis label, or the canonical label of the instantiated assertion. */
  public final String label;

  /** The variable substitution applied to the assertion; empty for hypotheses. */
  public final ImmutableMap<CanonicalId, TokenSeq> substitution;

  /** The statement that was pushed. */
  public final TokenSeq result;

  private Justification(
      Kind kind, String label, ImmutableMap<CanonicalId, TokenSeq> substitution, TokenSeq result) {
    this.kind = kind;
    this.label = label;
    this.substitution = substitution;
    this.result = result;
  }

  static Justification hypothesis(String label, TokenSeq result) {
    return new Justification(Kind.HYPOTHESIS, label, ImmutableMap.of(), result);
  }

  static Justification assertion(
      String label, ImmutableMap<CanonicalId, TokenSeq> substitution, TokenSeq result) {
    return new Justification(Kind.ASSERTION, label, substitution, result);
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof Justification other
        && kind == other.kind
        && label.equals(other.label)
        && substitution.equals(other.substitution)
        && result.equals(other.result);
  }

  @Override
  public int hashCode() {
    return (label.hashCode() * 31 + substitution.hashCode()) * 31 + result.hashCode();
  }

  @Override
  public String toString() {
    return (kind == Kind.HYPOTHESIS)
        ? label + ": " + result
        : label + " " + substitution + ": " + result;
  }
}
