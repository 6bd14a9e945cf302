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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import org.jspecify.annotations.Nullable;
import org.lemmata.symbol.CanonicalId;
import org.lemmata.symbol.Lexicon;

/**
 * A language skeleton declares the symbols of a formal system:
 *
 * <ul>
 *   <li>typecodes (e.g. {@code wff}); the first declared typecode is that of compound formulas,
 *       and one (by default the same) is that of provable statements;
 *   <li>variables, each with a typecode;
 *   <li>connectives, each with a fixed arity and an optional text {@link Notation};
 *   <li>{@link Definition}s, which expand to core connectives; and
 *   <li>aliases, alternate authoring spellings for variables, connectives, and definitions.
 * </ul>
 *
 * <p>Skeletons are immutable, and may be combined with {@link Builder#include}.
 */
public final class Skeleton {

  /** A connective declaration. */
  public static final class Connective {
    public final String spelling;
    public final int arity;
    public final @Nullable Notation notation;

    Connective(String spelling, int arity, @Nullable Notation notation) {
      this.spelling = spelling;
      this.arity = arity;
      this.notation = notation;
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Connective other
          && spelling.equals(other.spelling)
          && arity == other.arity
          && Objects.equals(notation, other.notation);
    }

    @Override
    public int hashCode() {
      return spelling.hashCode() * 31 + arity;
    }

    @Override
    public String toString() {
      return spelling + "/" + arity;
    }
  }

  private final ImmutableSet<String> typecodes;
  private final String assertionTypecode;
  private final ImmutableMap<String, String> variables;
  private final ImmutableMap<String, Connective> connectives;
  private final ImmutableMap<String, Definition> definitions;
  private final @Nullable String defaultCombinator;
  private final Lexicon lexicon;

  private Skeleton(Builder builder) {
    checkState(!builder.typecodes.isEmpty(), "A skeleton needs at least one typecode");
    this.typecodes = ImmutableSet.copyOf(builder.typecodes);
    this.assertionTypecode =
        (builder.assertionTypecode != null)
            ? builder.assertionTypecode
            : typecodes.iterator().next();
    this.variables = ImmutableMap.copyOf(builder.variables);
    this.connectives = ImmutableMap.copyOf(builder.connectives);
    this.definitions = ImmutableMap.copyOf(builder.definitions);
    this.defaultCombinator = builder.defaultCombinator;
    Lexicon.Builder lexiconBuilder = new Lexicon.Builder();
    typecodes.forEach(lexiconBuilder::canonical);
    variables.keySet().forEach(lexiconBuilder::canonical);
    connectives.keySet().forEach(lexiconBuilder::canonical);
    definitions.keySet().forEach(lexiconBuilder::canonical);
    builder.aliases.forEach(lexiconBuilder::alias);
    this.lexicon = lexiconBuilder.build();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * The canonical spellings and aliases of this skeleton's typecodes, variables, connectives, and
   * definitions.
   */
  public Lexicon lexicon() {
    return lexicon;
  }

  /** Returns the variables declared by this skeleton, in declaration order. */
  public ImmutableList<String> variables() {
    return variables.keySet().asList();
  }

  public ImmutableSet<String> typecodes() {
    return typecodes;
  }

  /** The typecode of provable statements (axioms, inference rules, and lemmas). */
  public String assertionTypecode() {
    return assertionTypecode;
  }

  /** The typecode of a formula built by applying a connective; the first declared typecode. */
  public String formulaTypecode() {
    return typecodes.iterator().next();
  }

  /** Returns the typecode of the given canonical variable, or null if it is not declared. */
  public @Nullable String variableTypecode(String canonicalSpelling) {
    return variables.get(canonicalSpelling);
  }

  /** Returns the connective with the given canonical spelling, or null if there is none. */
  public @Nullable Connective connective(String canonicalSpelling) {
    return connectives.get(canonicalSpelling);
  }

  /** Returns the number of operands taken by {@code token}; zero for anything but a connective. */
  public int arity(CanonicalId token) {
    Connective c = connectives.get(token.spelling());
    return (c == null) ? 0 : c.arity;
  }

  /** Returns the definition with the given name or alias, or null if there is none. */
  public @Nullable Definition definition(String rawSpelling) {
    String name = lexicon.aliasTarget(rawSpelling);
    return definitions.get((name != null) ? name : rawSpelling);
  }

  /**
   * Returns true if {@code rawSpelling} is a declared spelling or alias of a typecode, variable,
   * connective, or definition.
   */
  boolean declares(String rawSpelling) {
    return lexicon.isCanonical(rawSpelling) || lexicon.aliasTarget(rawSpelling) != null;
  }

  /**
   * Returns the text notation of the connective or definition with the given authoring spelling, or
   * null if the spelling doesn't name one (or it has no notation).
   */
  public @Nullable Notation notation(String rawSpelling) {
    String canonical = lexicon.aliasTarget(rawSpelling);
    Connective c = connectives.get((canonical != null) ? canonical : rawSpelling);
    if (c != null) {
      return c.notation;
    }
    Definition d = definition(rawSpelling);
    return (d == null) ? null : d.notation;
  }

  /**
   * Returns the number of operands taken by the connective or definition with the given authoring
   * spelling, or zero if it names neither.
   */
  int operandCount(String rawSpelling) {
    String canonical = lexicon.aliasTarget(rawSpelling);
    Connective c = connectives.get((canonical != null) ? canonical : rawSpelling);
    if (c != null) {
      return c.arity;
    }
    Definition d = definition(rawSpelling);
    return (d == null) ? 0 : d.arity;
  }

  /**
   * The label of the rule used by proof composition steps that don't name one, or null if there is
   * no default.
   */
  public @Nullable String defaultCombinator() {
    return defaultCombinator;
  }

  @Override
  public String toString() {
    return String.format(
        "Skeleton(typecodes=%s, variables=%s, connectives=%s, definitions=%s)",
        typecodes, variables, connectives.values(), definitions.values());
  }

  /** Accumulates declarations for a new Skeleton. */
  public static final class Builder {
    private final Set<String> typecodes = new LinkedHashSet<>();
    private @Nullable String assertionTypecode;
    private final Map<String, String> variables = new LinkedHashMap<>();
    private final Map<String, Connective> connectives = new LinkedHashMap<>();
    private final Map<String, Definition> definitions = new LinkedHashMap<>();
    private final Map<String, String> aliases = new LinkedHashMap<>();
    private @Nullable String defaultCombinator;

    private Builder() {}

    @CanIgnoreReturnValue
    public Builder typecode(String typecode) {
      checkArgument(Lexicon.isCanonicalForm(typecode), "'%s' is not in canonical form", typecode);
      typecodes.add(typecode);
      return this;
    }

    /** Sets the typecode of provable statements; defaults to the first declared typecode. */
    @CanIgnoreReturnValue
    public Builder assertionTypecode(String typecode) {
      checkArgument(typecodes.contains(typecode), "Undeclared typecode '%s'", typecode);
      assertionTypecode = typecode;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder variable(String spelling, String typecode, String... aliases) {
      checkArgument(typecodes.contains(typecode), "Undeclared typecode '%s'", typecode);
      checkArgument(!connectives.containsKey(spelling), "'%s' is a connective", spelling);
      String prev = variables.putIfAbsent(spelling, typecode);
      checkArgument(
          prev == null || prev.equals(typecode), "'%s' already has typecode %s", spelling, prev);
      addAliases(spelling, aliases);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder connective(
        String spelling, int arity, @Nullable Notation notation, String... aliases) {
      checkArgument(arity > 0, "Connectives must take at least one operand");
      checkArgument(
          notation == null || notation.fixity == Notation.Fixity.PREFIX || arity == 2,
          "Infix connectives must be binary");
      checkArgument(!variables.containsKey(spelling), "'%s' is a variable", spelling);
      Connective c = new Connective(spelling, arity, notation);
      Connective prev = connectives.putIfAbsent(spelling, c);
      checkArgument(prev == null || prev.equals(c), "Conflicting declarations of '%s'", spelling);
      addAliases(spelling, aliases);
      return this;
    }

    /**
     * Declares a definition with the given name; {@code body} is called with exactly {@code arity}
     * operands and returns the Expr they stand for.
     */
    @CanIgnoreReturnValue
    public Builder definition(
        String name,
        int arity,
        @Nullable Notation notation,
        Function<List<Expr>, Expr> body,
        String... aliases) {
      checkArgument(!definitions.containsKey(name), "Duplicate definition '%s'", name);
      checkArgument(
          !variables.containsKey(name) && !connectives.containsKey(name),
          "'%s' is already declared",
          name);
      definitions.put(name, new Definition(name, arity, notation, body::apply));
      addAliases(name, aliases);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder defaultCombinator(String label) {
      defaultCombinator = label;
      return this;
    }

    /**
     * Adds all of the declarations of {@code other}. Declarations that appear in both must agree;
     * the assertion typecode and default combinator are only taken from {@code other} if they have
     * not been set.
     */
    @CanIgnoreReturnValue
    public Builder include(Skeleton other) {
      other.typecodes.forEach(this::typecode);
      other.variables.forEach((v, t) -> variable(v, t));
      other.connectives.values().forEach(c -> connective(c.spelling, c.arity, c.notation));
      other.lexicon.aliases().forEach(this::alias);
      other.definitions.forEach(
          (name, d) -> {
            Definition prev = definitions.putIfAbsent(name, d);
            checkArgument(prev == null || prev == d, "Conflicting definitions of '%s'", name);
          });
      if (assertionTypecode == null) {
        assertionTypecode = other.assertionTypecode;
      }
      if (defaultCombinator == null) {
        defaultCombinator = other.defaultCombinator;
      }
      return this;
    }

    private void addAliases(String spelling, String[] newAliases) {
      for (String alias : newAliases) {
        alias(alias, spelling);
      }
    }

    private void alias(String alias, String spelling) {
      String prev = aliases.putIfAbsent(alias, spelling);
      checkArgument(
          prev == null || prev.equals(spelling), "'%s' is already an alias of '%s'", alias, prev);
    }

    public Skeleton build() {
      return new Skeleton(this);
    }
  }
}
