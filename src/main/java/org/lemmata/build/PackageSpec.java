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
package org.lemmata.build;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.jspecify.annotations.Nullable;
import org.lemmata.proof.Assertion;
import org.lemmata.syntax.Expr;
import org.lemmata.syntax.Skeleton;

/**
 * Everything needed to build a logic package: its name, its skeleton and imports, its declarations
 * in order, its label aliases, and the labels it exports.
 *
 * <p>A PackageSpec is immutable and may be built any number of times, in any number of threads.
 */
public final class PackageSpec {

  /** An imported package, and which of its exported labels are visible. */
  public static final class Import {
    public final DependencyView view;

    /** The imported labels, or null if all exported labels are imported. */
    public final @Nullable ImmutableSet<String> labels;

    Import(DependencyView view, @Nullable ImmutableSet<String> labels) {
      this.view = view;
      this.labels = labels;
    }
  }

  public final String name;

  /** The package's own skeleton merged with those of its imports. */
  public final Skeleton skeleton;

  public final ImmutableList<Import> imports;
  public final ImmutableList<Declaration> declarations;

  /** Alternate labels that proof scripts may use, e.g. {@code ax-mp} for {@code mp}. */
  public final ImmutableMap<String, String> labelAliases;

  public final ImmutableSet<String> exports;

  private PackageSpec(
      String name,
      Skeleton skeleton,
      ImmutableList<Import> imports,
      ImmutableList<Declaration> declarations,
      ImmutableMap<String, String> labelAliases,
      ImmutableSet<String> exports) {
    this.name = name;
    this.skeleton = skeleton;
    this.imports = imports;
    this.declarations = declarations;
    this.labelAliases = labelAliases;
    this.exports = exports;
  }

  public static Builder builder(String name, Skeleton skeleton) {
    return new Builder(name, skeleton);
  }

  /** Returns the first declaration with the given label, or null if there is none. */
  public @Nullable Declaration declaration(String label) {
    return declarations.stream().filter(d -> d.label.equals(label)).findFirst().orElse(null);
  }

  @Override
  public String toString() {
    return String.format("PackageSpec(%s, %s declarations)", name, declarations.size());
  }

  /** Accumulates the parts of a new PackageSpec. */
  public static final class Builder {
    private final String name;
    private final Skeleton skeleton;
    private final List<Import> imports = new ArrayList<>();
    private final List<Declaration.Builder> declarations = new ArrayList<>();
    private final Map<String, String> labelAliases = new LinkedHashMap<>();
    private final Set<String> exports = new LinkedHashSet<>();
    private boolean exportAll;

    private Builder(String name, Skeleton skeleton) {
      this.name = name;
      this.skeleton = skeleton;
    }

    /** Imports every exported assertion of {@code view}. */
    @CanIgnoreReturnValue
    public Builder imports(DependencyView view) {
      imports.add(new Import(view, null));
      return this;
    }

    /** Imports only the given exported assertions of {@code view}. */
    @CanIgnoreReturnValue
    public Builder imports(DependencyView view, String... labels) {
      imports.add(new Import(view, ImmutableSet.copyOf(labels)));
      return this;
    }

    @CanIgnoreReturnValue
    public Builder labelAlias(String alias, String label) {
      String prev = labelAliases.putIfAbsent(alias, label);
      checkArgument(prev == null, "'%s' is already an alias of '%s'", alias, prev);
      return this;
    }

    /** Declares an axiom with the given conclusion (as formula text). */
    @CanIgnoreReturnValue
    public Declaration.Builder axiom(String label, String conclusion) {
      return declare(label, Assertion.Kind.AXIOM).conclusion(conclusion);
    }

    @CanIgnoreReturnValue
    public Declaration.Builder axiom(String label, Expr conclusion) {
      return declare(label, Assertion.Kind.AXIOM).conclusion(conclusion);
    }

    /** Declares a rule skeleton; add its premises with {@link Declaration.Builder#hypotheses}. */
    @CanIgnoreReturnValue
    public Declaration.Builder rule(String label, String conclusion) {
      return declare(label, Assertion.Kind.RULE).conclusion(conclusion);
    }

    @CanIgnoreReturnValue
    public Declaration.Builder rule(String label, Expr conclusion) {
      return declare(label, Assertion.Kind.RULE).conclusion(conclusion);
    }

    /** Declares a lemma; a lemma with no proof steps is a stub. */
    public Declaration.Builder lemma(String label) {
      return declare(label, Assertion.Kind.LEMMA);
    }

    public Declaration.Builder theorem(String label) {
      return declare(label, Assertion.Kind.THEOREM);
    }

    @CanIgnoreReturnValue
    public Builder export(String... labels) {
      exports.addAll(Arrays.asList(labels));
      return this;
    }

    /** Exports every declaration of this package. */
    @CanIgnoreReturnValue
    public Builder exportAll() {
      exportAll = true;
      return this;
    }

    private Declaration.Builder declare(String label, Assertion.Kind kind) {
      Declaration.Builder result = new Declaration.Builder(label, kind);
      declarations.add(result);
      return result;
    }

    /** Returns the completed PackageSpec; formula text is left to be read by each build. */
    public PackageSpec build() {
      Skeleton.Builder merged = Skeleton.builder().include(skeleton);
      imports.forEach(i -> merged.include(i.view.skeleton));
      Skeleton fullSkeleton = merged.build();
      ImmutableList<Declaration> built =
          declarations.stream()
              .map(d -> d.build(fullSkeleton))
              .collect(ImmutableList.toImmutableList());
      if (exportAll) {
        declarations.forEach(d -> exports.add(d.label()));
      }
      return new PackageSpec(
          name,
          fullSkeleton,
          ImmutableList.copyOf(imports),
          built,
          ImmutableMap.copyOf(labelAliases),
          ImmutableSet.copyOf(exports));
    }
  }
}
