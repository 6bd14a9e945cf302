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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import junitparams.JUnitParamsRunner;
import junitparams.Parameters;
import org.junit.Test;
import org.junit.runner.RunWith;

@RunWith(JUnitParamsRunner.class)
public class NameResolverTest {

  private static final Lexicon LEXICON =
      new Lexicon.Builder().canonical("->").canonical("ph").alias("φ", "ph").build();

  private final SymbolInterner interner = new SymbolInterner();
  private final NameMapping mapping = new NameMapping();

  private NameResolver resolver(ResolutionPolicy policy) {
    return new NameResolver(LEXICON, interner, mapping, policy);
  }

  @Test
  @Parameters({"STRICT", "PERMISSIVE"})
  public void resolvesAliasesAndCanonicalSpellings(ResolutionPolicy policy) {
    NameResolver resolver = resolver(policy);
    assertThat(resolver.resolve("φ")).isEqualTo("ph");
    assertThat(resolver.resolve("ph")).isEqualTo("ph");
    assertThat(resolver.resolve("->")).isEqualTo("->");
    assertThat(resolver.resolveId("φ")).isSameInstanceAs(resolver.resolveId("ph"));
    assertThat(mapping.asMap()).containsExactly("φ", "ph", "ph", "ph", "->", "->").inOrder();
  }

  @Test
  @Parameters({"STRICT", "PERMISSIVE"})
  public void unregisteredAliasFails(ResolutionPolicy policy) {
    // "→" is not in canonical form, so no policy can accept it.
    ResolutionError e =
        assertThrows(ResolutionError.class, () -> resolver(policy).resolve("→"));
    assertThat(e.rawSpelling).isEqualTo("→");
    assertThat(e).hasMessageThat().contains("'→'");
    assertThat(mapping.size()).isEqualTo(0);
    assertThat(interner.size()).isEqualTo(0);
  }

  @Test
  public void strictPolicyRejectsUnknownCanonicalForms() {
    NameResolver resolver = resolver(ResolutionPolicy.STRICT);
    ResolutionError e = assertThrows(ResolutionError.class, () -> resolver.resolve("ch"));
    assertThat(e.rawSpelling).isEqualTo("ch");
  }

  @Test
  public void permissivePolicyRegistersUnknownCanonicalForms() {
    NameResolver resolver = resolver(ResolutionPolicy.PERMISSIVE);
    CanonicalId ch = resolver.resolveId("ch");
    assertThat(ch.spelling()).isEqualTo("ch");
    assertThat(resolver.resolveId("ch")).isSameInstanceAs(ch);
    assertThat(mapping.asMap()).containsExactly("ch", "ch");
  }

  @Test
  public void eachRawSpellingIsRecordedOnce() {
    NameResolver resolver = resolver(ResolutionPolicy.STRICT);
    for (int i = 0; i < 3; i++) {
      resolver.resolve("φ");
      resolver.resolve("->");
    }
    assertThat(mapping.size()).isEqualTo(2);
    assertThat(mapping.get("φ").canonicalSpelling).isEqualTo("ph");
    assertThat(interner.size()).isEqualTo(2);
  }

  @Test
  public void lexiconRejectsConflictingAliases() {
    Lexicon.Builder builder = new Lexicon.Builder().canonical("a").canonical("b").alias("x", "a");
    assertThrows(IllegalArgumentException.class, () -> builder.alias("x", "b"));
    assertThrows(IllegalArgumentException.class, () -> builder.alias("y", "c"));
    assertThrows(IllegalArgumentException.class, () -> builder.alias("a", "b"));
  }
}
