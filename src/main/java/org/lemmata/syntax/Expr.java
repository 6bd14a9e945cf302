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

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * An authoring-level formula tree. Names are raw authoring spellings (e.g. "{@code φ}" or "{@code
 * →}"); they are only resolved to canonical symbols when the Expr is compiled.
 *
 * <p>There are exactly two kinds of Expr, {@link Variable} and {@link Application}; code that needs
 * to distinguish them should use a {@link Visitor}.
 */
public abstract class Expr {

  // Only the nested subclasses.
  private Expr() {}

  /** Calls the method of {@code visitor} corresponding to this Expr's kind. */
  public abstract <T> T accept(Visitor<T> visitor);

  /** Handles each kind of Expr. */
  public interface Visitor<T> {
    T visitVariable(Variable variable);

    T visitApplication(Application application);
  }

  /** Returns a Variable with the given authoring spelling. */
  public static Variable var(String name) {
    return new Variable(name);
  }

  /** Returns an Application of the connective with the given authoring spelling. */
  public static Application apply(String connective, Expr... operands) {
    return new Application(connective, ImmutableList.copyOf(operands));
  }

  /** Returns an Application of the connective with the given authoring spelling. */
  public static Application apply(String connective, List<Expr> operands) {
    return new Application(connective, ImmutableList.copyOf(operands));
  }

  /** A reference to a formal variable. */
  public static final class Variable extends Expr {
    public final String name;

    private Variable(String name) {
      this.name = name;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitVariable(this);
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Variable other && name.equals(other.name);
    }

    @Override
    public int hashCode() {
      return name.hashCode();
    }

    @Override
    public String toString() {
      return name;
    }
  }

  /** A connective (or definition) applied to an ordered list of operands. */
  public static final class Application extends Expr {
    public final String connective;
    public final ImmutableList<Expr> operands;

    private Application(String connective, ImmutableList<Expr> operands) {
      this.connective = connective;
      this.operands = operands;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitApplication(this);
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Application other
          && connective.equals(other.connective)
          && operands.equals(other.operands);
    }

    @Override
    public int hashCode() {
      return connective.hashCode() * 31 + operands.hashCode();
    }

    @Override
    public String toString() {
      return operands.stream()
          .map(Expr::toString)
          .collect(Collectors.joining(", ", connective + "(", ")"));
    }
  }
}
