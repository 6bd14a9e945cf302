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

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.annotation.JsonValue;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.jspecify.annotations.Nullable;

/**
 * One statement of an {@link IrArtifact}. All tokens are canonical spellings; each formula is a
 * list of tokens in prefix order.
 */
@JsonPropertyOrder({"label", "kind", "hypotheses", "conclusion", "proof", "axiom"})
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class IrStatement {

  public enum Kind {
    AXIOM("axiom"),
    DEFINITION("definition"),
    THEOREM("theorem");

    private final String spelling;

    Kind(String spelling) {
      this.spelling = spelling;
    }

    @JsonValue
    @Override
    public String toString() {
      return spelling;
    }
  }

  /** A floating or essential hypothesis. */
  @JsonPropertyOrder({"kind", "label", "typecode", "subject"})
  public static final class Hypothesis {
    @JsonProperty public final String kind;
    @JsonProperty public final String label;
    @JsonProperty public final String typecode;
    @JsonProperty public final ImmutableList<String> subject;

    public Hypothesis(
        String kind, String label, String typecode, ImmutableList<String> subject) {
      this.kind = kind;
      this.label = label;
      this.typecode = typecode;
      this.subject = subject;
    }
  }

  /**
   * One proof entry: either a hypothesis label, or an assertion label together with the
   * substitution that instantiates it; {@code result} is the statement the entry establishes.
   */
  @JsonPropertyOrder({"ref", "substitution", "result"})
  public static final class ProofEntry {
    @JsonProperty public final String ref;

    @JsonProperty
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public final ImmutableMap<String, ImmutableList<String>> substitution;

    @JsonProperty public final ImmutableList<String> result;

    public ProofEntry(
        String ref,
        ImmutableMap<String, ImmutableList<String>> substitution,
        ImmutableList<String> result) {
      this.ref = ref;
      this.substitution = substitution;
      this.result = result;
    }
  }

  @JsonProperty public final String label;
  @JsonProperty public final Kind kind;
  @JsonProperty public final ImmutableList<Hypothesis> hypotheses;
  @JsonProperty public final ImmutableList<String> conclusion;

  /** The lowered proof; null for axioms and definitions. */
  @JsonProperty public final @Nullable ImmutableList<ProofEntry> proof;

  /** True for statements accepted without proof; null otherwise. */
  @JsonProperty public final @Nullable Boolean axiom;

  public IrStatement(
      String label,
      Kind kind,
      ImmutableList<Hypothesis> hypotheses,
      ImmutableList<String> conclusion,
      @Nullable ImmutableList<ProofEntry> proof) {
    this.label = label;
    this.kind = kind;
    this.hypotheses = hypotheses;
    this.conclusion = conclusion;
    this.proof = proof;
    this.axiom = (proof == null) ? Boolean.TRUE : null;
  }

  @Override
  public String toString() {
    return label + " (" + kind + ")";
  }
}
