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

import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Records every authoring spelling resolved during a build, together with the canonical spelling
 * and CanonicalId it resolved to. Each raw spelling appears exactly once, in order of first use.
 *
 * <p>The mapping is retained as an artifact so that the canonical IR can be traced back to (and
 * regenerated from) the author's notation.
 */
public final class NameMapping {

  /** What a single raw spelling resolved to. */
  public static final class Entry {
    public final String rawSpelling;
    public final String canonicalSpelling;
    public final CanonicalId id;

    Entry(String rawSpelling, CanonicalId id) {
      this.rawSpelling = rawSpelling;
      this.canonicalSpelling = id.spelling();
      this.id = id;
    }

    @Override
    public String toString() {
      return rawSpelling + "=" + canonicalSpelling;
    }
  }

  private final Map<String, Entry> entries = new LinkedHashMap<>();

  /**
   * Records that {@code rawSpelling} resolved to {@code id}. Recording the same resolution again is
   * a no-op; recording a different resolution for a spelling that has already been recorded is an
   * internal error.
   */
  void record(String rawSpelling, CanonicalId id) {
    Entry prev = entries.get(rawSpelling);
    if (prev == null) {
      entries.put(rawSpelling, new Entry(rawSpelling, id));
    } else {
      checkState(prev.id.equals(id), "'%s' resolved to both %s and %s", rawSpelling, prev.id, id);
    }
  }

  /** Returns the entry for {@code rawSpelling}, or null if it has not been resolved. */
  public @Nullable Entry get(String rawSpelling) {
    return entries.get(rawSpelling);
  }

  public int size() {
    return entries.size();
  }

  /** Returns a map from each raw spelling to its canonical spelling, in order of first use. */
  public ImmutableMap<String, String> asMap() {
    ImmutableMap.Builder<String, String> builder = ImmutableMap.builder();
    entries.values().forEach(e -> builder.put(e.rawSpelling, e.canonicalSpelling));
    return builder.buildOrThrow();
  }

  @Override
  public String toString() {
    return entries.values().toString();
  }
}
