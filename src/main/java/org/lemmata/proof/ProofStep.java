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
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.lemmata.syntax.Expr;

/**
 * One instruction of a structured proof script. A script is run by {@link ProofLowering} against a
 * stack of proved statements:
 *
 * <ul>
 *   <li>{@link Hyp} pushes one of the essential hypotheses of the statement being proved;
 *   <li>{@link Ref} instantiates another assertion, discharging its essential hypotheses from the
 *       stack and pushing its conclusion; and
 *   <li>{@link Compose} applies a modus-ponens-shaped rule to two stack entries.
 * </ul>
 */
public abstract class ProofStep {

  // Only the nested subclasses.
  private ProofStep() {}

  public abstract <T> T accept(Visitor<T> visitor);

  /** Handles each kind of ProofStep. */
  public interface Visitor<T> {
    T visitHyp(Hyp step);

    T visitRef(Ref step);

    T visitCompose(Compose step);
  }

  public static Hyp hyp(int index) {
    return new Hyp(index);
  }

  /**
   * Returns a Ref step; {@code substitution} maps the authoring spelling of each of the referenced
   * assertion's variables to the formula that replaces it.
   */
  public static Ref ref(String label, Map<String, Expr> substitution) {
    return new Ref(label, ImmutableMap.copyOf(substitution));
  }

  /** Returns a Compose step that uses the skeleton's default combinator. */
  public static Compose compose(int antecedentPos, int implicationPos) {
    return new Compose(antecedentPos, implicationPos, null);
  }

  public static Compose compose(int antecedentPos, int implicationPos, String combinator) {
    return new Compose(antecedentPos, implicationPos, combinator);
  }

  /** Pushes the essential hypothesis with the given (zero-based) index. */
  public static final class Hyp extends ProofStep {
    public final int index;

    private Hyp(int index) {
      this.index = index;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitHyp(this);
    }

    @Override
    public String toString() {
      return "Hyp(" + index + ")";
    }
  }

  /** Instantiates the assertion with the given label. */
  public static final class Ref extends ProofStep {
    public final String label;
    public final ImmutableMap<String, Expr> substitution;

    private Ref(String label, ImmutableMap<String, Expr> substitution) {
      this.label = label;
      this.substitution = substitution;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitRef(this);
    }

    @Override
    public String toString() {
      return "Ref(" + label + ", " + substitution + ")";
    }
  }

  /**
   * Combines the stack entry at {@code antecedentPos} with the implication at {@code
   * implicationPos}; positions count from the bottom of the stack.
   */
  public static final class Compose extends ProofStep {
    public final int antecedentPos;
    public final int implicationPos;

    /** The label of the rule to apply, or null for the skeleton's default combinator. */
    public final @Nullable String combinator;

    private Compose(int antecedentPos, int implicationPos, @Nullable String combinator) {
      this.antecedentPos = antecedentPos;
      this.implicationPos = implicationPos;
      this.combinator = combinator;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitCompose(this);
    }

    @Override
    public String toString() {
      String suffix = (combinator == null) ? "" : ", " + combinator;
      return "Compose(" + antecedentPos + ", " + implicationPos + suffix + ")";
    }
  }
}
