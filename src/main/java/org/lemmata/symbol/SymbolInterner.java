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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Assigns CanonicalIds to canonical spellings.
 *
 * <p>There is one SymbolInterner per build context (never a process-wide table), so independent
 * builds don't interfere with each other. There is no removal operation; symbols live as long as
 * the interner.
 *
 * <p>SymbolInterners are not thread-safe. A build context is only ever used from one thread.
 */
public final class SymbolInterner {

  private final Map<String, CanonicalId> bySpelling = new HashMap<>();

  /** All ids assigned so far, indexed by {@link CanonicalId#index}. */
  private final List<CanonicalId> byIndex = new ArrayList<>();

  /**
   * Returns the CanonicalId for {@code canonicalSpelling}, assigning the next index if this is the
   * first time it has been seen. Repeated calls with the same spelling return the same instance.
   */
  public CanonicalId intern(String canonicalSpelling) {
    CanonicalId result = bySpelling.get(canonicalSpelling);
    if (result == null) {
      checkArgument(
          Lexicon.isCanonicalForm(canonicalSpelling),
          "'%s' is not in canonical form",
          canonicalSpelling);
      result = new CanonicalId(byIndex.size(), canonicalSpelling);
      byIndex.add(result);
      bySpelling.put(canonicalSpelling, result);
    }
    return result;
  }

  /** Returns the CanonicalId previously assigned to {@code spelling}, or null if there is none. */
  public @Nullable CanonicalId lookup(String spelling) {
    return bySpelling.get(spelling);
  }

  /**
   * Returns the CanonicalId in this interner with the same spelling as {@code id}, which may have
   * come from a different build context.
   */
  public CanonicalId reintern(CanonicalId id) {
    return intern(id.spelling);
  }

  /** Returns the CanonicalId with the given index. */
  public CanonicalId get(int index) {
    return byIndex.get(index);
  }

  /** Returns the number of ids assigned so far. */
  public int size() {
    return byIndex.size();
  }

  /** Returns all ids assigned so far, in index order. */
  public ImmutableList<CanonicalId> ids() {
    return ImmutableList.copyOf(byIndex);
  }

  @Override
  public String toString() {
    return byIndex.toString();
  }
}
