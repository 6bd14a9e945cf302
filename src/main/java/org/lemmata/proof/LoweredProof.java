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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import org.lemmata.syntax.TokenSeq;

/**
 * A proof in the form the verifier consumes: the sequence of justifications recorded while running
 * a proof script, ending with the proved statement.
 */
public final class LoweredProof {
  public final ImmutableList<Justification> entries;
  private final TokenSeq conclusion;

  LoweredProof(ImmutableList<Justification> entries, TokenSeq conclusion) {
    this.entries = entries;
    this.conclusion = conclusion;
  }

  /** The statement established by this proof; equal to its assertion's conclusion. */
  public TokenSeq conclusion() {
    return conclusion;
  }

  /** Returns the labels of the assertions this proof instantiates, in order of first use. */
  public ImmutableSet<String> references() {
    return entries.stream()
        .filter(j -> j.kind == Justification.Kind.ASSERTION)
        .map(j -> j.label)
        .collect(ImmutableSet.toImmutableSet());
  }

  @Override
  public String toString() {
    return entries.toString();
  }
}
