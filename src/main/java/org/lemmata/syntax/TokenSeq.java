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

import static com.google.common.base.Preconditions.checkElementIndex;

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.function.ToIntFunction;
import java.util.stream.Collectors;
import org.lemmata.symbol.CanonicalId;
import org.lemmata.symbol.SymbolInterner;

/**
 * A formula in canonical prefix notation: each connective token is followed by the token sequences
 * of its operands, in declared order. TokenSeqs are immutable and compare by content, so two
 * formulas that compile identically are equal.
 *
 * <p>TokenSeq is the only formula representation that crosses package boundaries or is persisted.
 */
public final class TokenSeq {

  public static final TokenSeq EMPTY = new TokenSeq(ImmutableList.of());

  private final ImmutableList<CanonicalId> tokens;

  private TokenSeq(ImmutableList<CanonicalId> tokens) {
    this.tokens = tokens;
  }

  public static TokenSeq of(CanonicalId... tokens) {
    return new TokenSeq(ImmutableList.copyOf(tokens));
  }

  public static TokenSeq of(Iterable<CanonicalId> tokens) {
    return new TokenSeq(ImmutableList.copyOf(tokens));
  }

  public int size() {
    return tokens.size();
  }

  public boolean isEmpty() {
    return tokens.isEmpty();
  }

  public CanonicalId get(int i) {
    return tokens.get(i);
  }

  public CanonicalId head() {
    checkElementIndex(0, tokens.size());
    return tokens.get(0);
  }

  public ImmutableList<CanonicalId> tokens() {
    return tokens;
  }

  /** Returns the tokens from {@code start} (inclusive) to {@code end} (exclusive). */
  public TokenSeq slice(int start, int end) {
    return new TokenSeq(tokens.subList(start, end));
  }

  /**
   * Returns the index just past the end of the term that starts at {@code start}, where {@code
   * arity} gives the number of operands each token takes (zero for variables).
   */
  public int termEnd(int start, ToIntFunction<CanonicalId> arity) {
    int pending = 1;
    int i = start;
    while (pending > 0) {
      checkElementIndex(i, tokens.size(), "truncated term");
      pending += arity.applyAsInt(tokens.get(i)) - 1;
      i++;
    }
    return i;
  }

  /**
   * Splits this TokenSeq (which must be a single well-formed term) into the TokenSeqs of the
   * operands of its head token.
   */
  public ImmutableList<TokenSeq> operands(ToIntFunction<CanonicalId> arity) {
    int n = arity.applyAsInt(head());
    ImmutableList.Builder<TokenSeq> result = ImmutableList.builderWithExpectedSize(n);
    int pos = 1;
    for (int i = 0; i < n; i++) {
      int end = termEnd(pos, arity);
      result.add(slice(pos, end));
      pos = end;
    }
    assert pos == tokens.size();
    return result.build();
  }

  /** Returns the canonical spellings of this TokenSeq's tokens. */
  public ImmutableList<String> spellings() {
    return tokens.stream().map(CanonicalId::spelling).collect(ImmutableList.toImmutableList());
  }

  /** Returns an equivalent TokenSeq whose tokens have been interned in {@code interner}. */
  public TokenSeq reintern(SymbolInterner interner) {
    return new TokenSeq(
        tokens.stream().map(interner::reintern).collect(ImmutableList.toImmutableList()));
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof TokenSeq other && tokens.equals(other.tokens);
  }

  @Override
  public int hashCode() {
    return tokens.hashCode();
  }

  /** Returns the canonical spellings separated by spaces. */
  @Override
  public String toString() {
    return tokens.stream().map(CanonicalId::spelling).collect(Collectors.joining(" "));
  }

  /** Accumulates tokens for a new TokenSeq. */
  public static final class Builder {
    private final ImmutableList.Builder<CanonicalId> tokens = ImmutableList.builder();

    @CanIgnoreReturnValue
    public Builder add(CanonicalId token) {
      tokens.add(token);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder addAll(TokenSeq seq) {
      tokens.addAll(seq.tokens);
      return this;
    }

    public TokenSeq build() {
      return new TokenSeq(tokens.build());
    }
  }
}
