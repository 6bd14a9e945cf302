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
package org.lemmata;

import com.google.common.collect.ImmutableList;
import org.lemmata.emit.IrArtifact;

/**
 * The Ir class is just a namespace for the types that connect a built package to an external proof
 * verifier.
 */
public class Ir {

  // Just a namespace for the contained types.
  private Ir() {}

  /**
   * A Verifier independently checks the proofs in an IR artifact. Implementations are supplied by
   * the caller; nothing in this library assumes that a verifier accepts what the builder accepted.
   */
  public interface Verifier {
    Verdict verify(IrArtifact artifact);
  }

  /** A point at which the verifier's view of a proof diverges from the builder's. */
  public static final class Divergence {
    public final String label;

    /** The index of the proof entry at which checking failed, or -1 if not step-specific. */
    public final int stepIndex;

    public final String description;

    public Divergence(String label, int stepIndex, String description) {
      this.label = label;
      this.stepIndex = stepIndex;
      this.description = description;
    }

    @Override
    public String toString() {
      return String.format("%s[%s]: %s", label, stepIndex, description);
    }
  }

  /** The result of verifying an artifact; empty if every proof was accepted. */
  public static final class Verdict {
    public static final Verdict OK = new Verdict(ImmutableList.of());

    public final ImmutableList<Divergence> divergences;

    public Verdict(ImmutableList<Divergence> divergences) {
      this.divergences = divergences;
    }

    public boolean ok() {
      return divergences.isEmpty();
    }

    @Override
    public String toString() {
      return ok() ? "OK" : divergences.toString();
    }
  }
}
