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

import org.lemmata.symbol.CanonicalId;
import org.lemmata.symbol.SymbolInterner;
import org.lemmata.syntax.TokenSeq;

/**
 * A hypothesis of an {@link Assertion}. Floating hypotheses declare the type of a single variable
 * (e.g. {@code wff ph}); essential hypotheses are premises that must be discharged when the
 * assertion is used.
 */
public final class Hypothesis {

  public enum Kind {
    FLOATING,
    ESSENTIAL
  }

  public final Kind kind;

  /**
   * For a floating hypothesis, the spelling of its variable; for an essential hypothesis, its
   * assertion's label followed by ".1", ".2", etc.
   */
  public final String label;

  public final CanonicalId typecode;

  /** For a floating hypothesis, a single variable token; otherwise the premise. */
  public final TokenSeq subject;

  public Hypothesis(Kind kind, String label, CanonicalId typecode, TokenSeq subject) {
    this.kind = kind;
    this.label = label;
    this.typecode = typecode;
    this.subject = subject;
  }

  public boolean isFloating() {
    return kind == Kind.FLOATING;
  }

  /** Returns the variable typed by this floating hypothesis. */
  public CanonicalId variable() {
    assert isFloating();
    return subject.head();
  }

  /** Returns an equivalent Hypothesis whose symbols have been interned in {@code symbols}. */
  Hypothesis reintern(SymbolInterner symbols) {
    return new Hypothesis(kind, label, symbols.reintern(typecode), subject.reintern(symbols));
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof Hypothesis other
        && kind == other.kind
        && label.equals(other.label)
        && typecode.equals(other.typecode)
        && subject.equals(other.subject);
  }

  @Override
  public int hashCode() {
    return label.hashCode() * 31 + subject.hashCode();
  }

  @Override
  public String toString() {
    return String.format(
        "%s $%s %s %s", label, isFloating() ? "f" : "e", typecode.spelling(), subject);
  }
}
