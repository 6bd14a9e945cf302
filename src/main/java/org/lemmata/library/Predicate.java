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
package org.lemmata.library;

import org.lemmata.build.DependencyView;
import org.lemmata.build.PackageSpec;
import org.lemmata.syntax.Notation;
import org.lemmata.syntax.Notation.Assoc;
import org.lemmata.syntax.Skeleton;

/**
 * Predicate calculus with equality and membership, built on {@link Hilbert}. Set variables ({@code
 * x}, {@code y}, ...) are bound by the quantifiers {@code A.} and {@code E.}; {@code A. x ph} binds
 * as tightly as negation, so {@code A. x ph -> ps} means {@code ( A. x ph ) -> ps}.
 */
public final class Predicate {

  public static final String PACKAGE_NAME = "predicate";

  public static final Skeleton SKELETON =
      Skeleton.builder()
          .include(Hilbert.SKELETON)
          .typecode("setvar")
          .variable("x", "setvar")
          .variable("y", "setvar")
          .variable("z", "setvar")
          .variable("w", "setvar")
          .connective("A.", 2, Notation.prefix(30), "∀")
          .connective("E.", 2, Notation.prefix(30), "∃")
          .connective("=", 2, Notation.infix(30, Assoc.NONE))
          .connective("e.", 2, Notation.infix(30, Assoc.NONE), "∈")
          .build();

  private Predicate() {}

  /** Returns the spec of the predicate package, which imports {@code hilbert}. */
  public static PackageSpec spec(DependencyView hilbert) {
    PackageSpec.Builder b = PackageSpec.builder(PACKAGE_NAME, SKELETON).imports(hilbert);

    b.axiom("AX5", "ph -> A. x ph");
    b.axiom("AX6", "-. A. x -. x = y");
    b.axiom("AX7", "x = y -> ( x = z -> y = z )");
    b.axiom("AX8", "x = y -> ( x e. z -> y e. z )");
    b.axiom("AX9", "x = y -> ( z e. x -> z e. y )");
    b.axiom("AX10", "-. A. x ph -> A. x -. A. x ph");
    b.axiom("AX11", "A. x A. y ph -> A. y A. x ph");
    b.axiom("AX12", "x = y -> ( A. y ph -> A. x ( x = y -> ph ) )");
    b.axiom("AX13", "-. x = y -> ( y = z -> A. x y = z )");
    for (int i = 5; i <= 13; i++) {
      b.labelAlias("ax-" + i, "AX" + i);
    }

    b.rule("wal", "A. x ph").typecode("wff");
    b.rule("wex", "E. x ph").typecode("wff");
    b.rule("weq", "x = y").typecode("wff");
    b.rule("wel", "x e. y").typecode("wff");

    b.lemma("a5i")
        .hypotheses("ph")
        .conclusion("A. x ph")
        .hyp(0)
        .ref("ax-5", "ph := ph", "x := x")
        .compose(0, 1);
    b.theorem("ax5a1d")
        .conclusion("ph -> ( ps -> A. x ph )")
        .ref("AX5", "ph := ph", "x := x")
        .ref("a1d", "ph := ph", "ps := A. x ph", "ch := ps");

    return b.exportAll().build();
  }
}
