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

package org.lemmata.symbol;

/**
 * A CanonicalId identifies one canonical symbol (a variable, connective, typecode, or label) within
 * a build context. CanonicalIds are only created by a {@link SymbolInterner}, which assigns indices
 * densely in order of first occurrence.
 *
 * <p>Two CanonicalIds are equal if they have the same index and spelling; since each interner
 * returns the same instance for repeated requests, ids from a single context can also be compared
 * with {@code ==}. Ids from different build contexts must not be mixed; cross-context data is
 * carried by spelling (see {@link SymbolInterner#reintern}).
 */
public final class CanonicalId {
  final int index;
  final String spelling;

  CanonicalId(int index, String spelling) {
    this.index = index;
    this.spelling = spelling;
  }

  /** The position of this id in its interner; ids are assigned 0, 1, 2, ... */
  public int index() {
    return index;
  }

  /** The canonical spelling of this symbol. */
  public String spelling() {
    return spelling;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    return obj instanceof CanonicalId other
        && index == other.index
        && spelling.equals(other.spelling);
  }

  @Override
  public int hashCode() {
    return index * 31 + spelling.hashCode();
  }

  @Override
  public String toString() {
    return spelling + "#" + index;
  }
}
