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
package org.lemmata.testing;

import org.lemmata.build.PackageSpec;
import org.lemmata.syntax.Notation;
import org.lemmata.syntax.Notation.Assoc;
import org.lemmata.syntax.Skeleton;

/**
 * A minimal logic for tests: wff variables {@code p q r}, a set variable {@code x}, a binary {@code
 * Imp}, and a unary {@code Not} (also spelled {@code ~}). Provable statements have typecode
 * {@code |-}.
 */
public final class MiniLogic {

  public static final Skeleton SKELETON =
      Skeleton.builder()
          .typecode("wff")
          .typecode("set")
          .typecode("|-")
          .assertionTypecode("|-")
          .variable("p", "wff")
          .variable("q", "wff")
          .variable("r", "wff")
          .variable("x", "set")
          .connective("Imp", 2, Notation.infix(10, Assoc.RIGHT))
          .connective("Not", 1, Notation.prefix(30), "~")
          .defaultCombinator("mp")
          .build();

  private MiniLogic() {}

  /** Returns a spec builder that already declares the axiom {@code A1} and the rule {@code mp}. */
  public static PackageSpec.Builder base(String name) {
    PackageSpec.Builder b = PackageSpec.builder(name, SKELETON);
    b.axiom("A1", "p Imp ( q Imp p )");
    b.rule("mp", "q").hypotheses("p", "p Imp q");
    return b.export("A1", "mp");
  }
}
