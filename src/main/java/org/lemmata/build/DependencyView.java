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

import com.google.common.collect.ImmutableMap;
import org.jspecify.annotations.Nullable;
import org.lemmata.proof.Assertion;
import org.lemmata.syntax.Skeleton;

/**
 * What a downstream package may see of a built package: its exported assertions, the skeleton
 * needed to interpret their tokens, and the origin of every label it defines or imports (used to
 * keep labels unique across the dependency graph). Unexported assertions are not reachable.
 */
public final class DependencyView {
  public final String packageName;
  public final Skeleton skeleton;
  public final ImmutableMap<String, Assertion> exported;
  public final ImmutableMap<String, String> labelOrigins;

  DependencyView(
      String packageName,
      Skeleton skeleton,
      ImmutableMap<String, Assertion> exported,
      ImmutableMap<String, String> labelOrigins) {
    this.packageName = packageName;
    this.skeleton = skeleton;
    this.exported = exported;
    this.labelOrigins = labelOrigins;
  }

  /** Returns the exported assertion with the given label, or null if there is none. */
  public @Nullable Assertion find(String label) {
    return exported.get(label);
  }

  @Override
  public String toString() {
    return "DependencyView(" + packageName + ", " + exported.keySet() + ")";
  }
}
