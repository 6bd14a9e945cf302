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

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * A Lexicon is the fixed policy for which spellings a {@link NameResolver} accepts: a set of
 * canonical spellings, plus a table of aliases (alternate notations such as "{@code →}" for
 * "{@code ->}") each mapping to one of the canonical spellings.
 *
 * <p>Lexicons are immutable; use {@link Builder} to create one.
 */
public final class Lexicon {

  private final ImmutableSet<String> canonical;
  private final ImmutableMap<String, String> aliases;

  private Lexicon(ImmutableSet<String> canonical, ImmutableMap<String, String> aliases) {
    this.canonical = canonical;
    this.aliases = aliases;
  }

  /**
   * Returns true if {@code spelling} is in canonical form: non-empty, and consisting only of
   * printable, non-space ASCII characters. Only canonical-form spellings may be interned or appear
   * in emitted artifacts.
   */
  public static boolean isCanonicalForm(String spelling) {
    if (spelling.isEmpty()) {
      return false;
    }
    for (int i = 0; i < spelling.length(); i++) {
      char c = spelling.charAt(i);
      if (c <= ' ' || c > '~') {
        return false;
      }
    }
    return true;
  }

  /** Returns true if {@code spelling} is one of this lexicon's canonical spellings. */
  public boolean isCanonical(String spelling) {
    return canonical.contains(spelling);
  }

  /** If {@code spelling} is a registered alias, returns its canonical spelling; otherwise null. */
  public @Nullable String aliasTarget(String spelling) {
    return aliases.get(spelling);
  }

  public ImmutableSet<String> canonicalSpellings() {
    return canonical;
  }

  public ImmutableMap<String, String> aliases() {
    return aliases;
  }

  @Override
  public String toString() {
    return String.format("Lexicon%s aliases=%s", canonical, aliases);
  }

  /** Collects canonical spellings and aliases for a new Lexicon. */
  public static final class Builder {
    private final Set<String> canonical = new LinkedHashSet<>();
    private final Map<String, String> aliases = new LinkedHashMap<>();

    /** Adds a canonical spelling; adding the same spelling twice is harmless. */
    @CanIgnoreReturnValue
    public Builder canonical(String spelling) {
      checkArgument(isCanonicalForm(spelling), "'%s' is not in canonical form", spelling);
      checkArgument(!aliases.containsKey(spelling), "'%s' is already an alias", spelling);
      canonical.add(spelling);
      return this;
    }

    /**
     * Registers {@code alias} as an alternate spelling of {@code canonicalSpelling}, which must
     * already have been added.
     */
    @CanIgnoreReturnValue
    public Builder alias(String alias, String canonicalSpelling) {
      checkArgument(
          canonical.contains(canonicalSpelling), "Unknown canonical '%s'", canonicalSpelling);
      checkArgument(!canonical.contains(alias), "'%s' is already canonical", alias);
      String prev = aliases.putIfAbsent(alias, canonicalSpelling);
      checkArgument(
          prev == null || prev.equals(canonicalSpelling),
          "'%s' is already an alias of '%s'",
          alias,
          prev);
      return this;
    }

    /** Adds all canonical spellings and aliases of {@code other}. */
    @CanIgnoreReturnValue
    public Builder addAll(Lexicon other) {
      other.canonical.forEach(this::canonical);
      other.aliases.forEach(this::alias);
      return this;
    }

    public Lexicon build() {
      return new Lexicon(ImmutableSet.copyOf(canonical), ImmutableMap.copyOf(aliases));
    }
  }
}
