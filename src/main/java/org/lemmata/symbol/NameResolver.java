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

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.HashSet;
import java.util.Set;

/**
 * Maps authoring spellings to canonical spellings, interning the result and recording each
 * resolution in a {@link NameMapping}.
 *
 * <p>A spelling resolves if it is
 *
 * <ul>
 *   <li>a registered alias in the lexicon (resolves to the alias target);
 *   <li>one of the lexicon's canonical spellings (resolves to itself); or
 *   <li>under {@link ResolutionPolicy#PERMISSIVE} only, any other spelling that is already in
 *       canonical form (resolves to itself, and is treated as canonical from then on).
 * </ul>
 *
 * Anything else throws a {@link ResolutionError}; resolution never invents a canonical symbol from
 * a spelling that isn't already in canonical form.
 */
public final class NameResolver {
  private final Lexicon lexicon;
  private final SymbolInterner interner;
  private final NameMapping mapping;
  private final ResolutionPolicy policy;

  /** Canonical-form spellings accepted under the permissive policy. */
  private final Set<String> registered = new HashSet<>();

  public NameResolver(
      Lexicon lexicon, SymbolInterner interner, NameMapping mapping, ResolutionPolicy policy) {
    this.lexicon = lexicon;
    this.interner = interner;
    this.mapping = mapping;
    this.policy = policy;
  }

  /** Returns the canonical spelling for {@code rawSpelling}. */
  @CanIgnoreReturnValue
  public String resolve(String rawSpelling) {
    return resolveId(rawSpelling).spelling();
  }

  /** Returns the CanonicalId for {@code rawSpelling}. */
  public CanonicalId resolveId(String rawSpelling) {
    NameMapping.Entry prev = mapping.get(rawSpelling);
    if (prev != null) {
      return prev.id;
    }
    CanonicalId id = interner.intern(canonicalSpelling(rawSpelling));
    mapping.record(rawSpelling, id);
    return id;
  }

  private String canonicalSpelling(String rawSpelling) {
    String target = lexicon.aliasTarget(rawSpelling);
    if (target != null) {
      return target;
    } else if (lexicon.isCanonical(rawSpelling) || registered.contains(rawSpelling)) {
      return rawSpelling;
    } else if (policy == ResolutionPolicy.PERMISSIVE && Lexicon.isCanonicalForm(rawSpelling)) {
      registered.add(rawSpelling);
      return rawSpelling;
    }
    throw new ResolutionError(rawSpelling);
  }

  public ResolutionPolicy policy() {
    return policy;
  }

  public Lexicon lexicon() {
    return lexicon;
  }
}
