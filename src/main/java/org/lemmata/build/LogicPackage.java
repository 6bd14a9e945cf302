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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.jspecify.annotations.Nullable;
import org.lemmata.emit.IrArtifact;
import org.lemmata.emit.IrEmitter;
import org.lemmata.proof.Assertion;
import org.lemmata.syntax.Skeleton;

/** The immutable result of building a {@link PackageSpec}. */
public final class LogicPackage {
  public final String name;
  public final Skeleton skeleton;

  /** The names of the imported packages. */
  public final ImmutableList<String> imports;

  /** The assertions defined by this package, in the order they were built. */
  public final ImmutableMap<String, Assertion> assertions;

  public final ImmutableMap<String, Assertion> exported;

  /** The package that defines each visible label, including those of transitive imports. */
  public final ImmutableMap<String, String> labelOrigins;

  /** Each raw spelling used by the build, mapped to its canonical spelling. */
  public final ImmutableMap<String, String> nameMapping;

  LogicPackage(
      String name,
      Skeleton skeleton,
      ImmutableList<String> imports,
      ImmutableMap<String, Assertion> assertions,
      ImmutableMap<String, Assertion> exported,
      ImmutableMap<String, String> labelOrigins,
      ImmutableMap<String, String> nameMapping) {
    this.name = name;
    this.skeleton = skeleton;
    this.imports = imports;
    this.assertions = assertions;
    this.exported = exported;
    this.labelOrigins = labelOrigins;
    this.nameMapping = nameMapping;
  }

  /** Returns the assertion with the given label, or null if this package doesn't define it. */
  public @Nullable Assertion assertion(String label) {
    return assertions.get(label);
  }

  /** Returns the view of this package that is visible to packages that import it. */
  public DependencyView dependencyView() {
    return new DependencyView(name, skeleton, exported, labelOrigins);
  }

  public IrArtifact toIr() {
    return IrEmitter.emit(name, imports, assertions.values());
  }

  @Override
  public String toString() {
    return String.format("LogicPackage(%s, %s assertions)", name, assertions.size());
  }
}
