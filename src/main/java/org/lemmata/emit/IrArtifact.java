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
package org.lemmata.emit;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.google.common.collect.ImmutableList;
import org.jspecify.annotations.Nullable;

/**
 * The canonical IR of one logic package, in the order its statements were built. This is the
 * artifact handed to the external verifier.
 */
@JsonPropertyOrder({"package", "imports", "statements"})
public final class IrArtifact {
  @JsonProperty("package")
  public final String packageName;

  /** The names of the packages whose exported statements this package refers to. */
  @JsonProperty public final ImmutableList<String> imports;

  @JsonProperty public final ImmutableList<IrStatement> statements;

  public IrArtifact(
      String packageName, ImmutableList<String> imports, ImmutableList<IrStatement> statements) {
    this.packageName = packageName;
    this.imports = imports;
    this.statements = statements;
  }

  /** Returns the statement with the given label, or null if there is none. */
  public @Nullable IrStatement statement(String label) {
    return statements.stream().filter(s -> s.label.equals(label)).findFirst().orElse(null);
  }

  @Override
  public String toString() {
    return "IrArtifact(" + packageName + ", " + statements + ")";
  }
}
