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

import static com.google.common.base.Preconditions.checkArgument;

/**
 * How a connective or definition is written in formula text (see {@link FormulaReader}).
 *
 * <p>An operator with a higher binding power binds more tightly. The last operand of a prefix
 * operator extends over any infix operators whose binding power is at least the prefix operator's;
 * for example with "{@code -.}" at 30, "{@code =}" at 30, and "{@code ->}" at 10, "{@code -. x = y
 * -> ph}" reads as "{@code (-. (x = y)) -> ph}".
 */
public final class Notation {

  public enum Fixity {
    /** The operator precedes all of its operands, e.g. "{@code -. ph}" or "{@code A. x ph}". */
    PREFIX,
    /** A binary operator written between its operands, e.g. "{@code ph -> ps}". */
    INFIX
  }

  public enum Assoc {
    LEFT,
    RIGHT,
    /** Chains such as "{@code x = y = z}" are rejected. */
    NONE
  }

  public final Fixity fixity;
  public final int bindingPower;
  public final Assoc assoc;

  private Notation(Fixity fixity, int bindingPower, Assoc assoc) {
    checkArgument(bindingPower > 0, "bindingPower must be positive");
    this.fixity = fixity;
    this.bindingPower = bindingPower;
    this.assoc = assoc;
  }

  public static Notation prefix(int bindingPower) {
    return new Notation(Fixity.PREFIX, bindingPower, Assoc.RIGHT);
  }

  public static Notation infix(int bindingPower, Assoc assoc) {
    return new Notation(Fixity.INFIX, bindingPower, assoc);
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof Notation other
        && fixity == other.fixity
        && bindingPower == other.bindingPower
        && assoc == other.assoc;
  }

  @Override
  public int hashCode() {
    return (fixity.ordinal() * 31 + bindingPower) * 31 + assoc.ordinal();
  }

  @Override
  public String toString() {
    return fixity == Fixity.PREFIX
        ? "prefix(" + bindingPower + ")"
        : "infix(" + bindingPower + ", " + assoc + ")";
  }
}
