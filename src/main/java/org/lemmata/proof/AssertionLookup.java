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
package org.lemmata.proof;

import org.jspecify.annotations.Nullable;

/**
 * Finds the assertions that a proof may refer to: those already built by the current package, and
 * those exported by its imports.
 */
@FunctionalInterface
public interface AssertionLookup {
  /**
   * Returns the assertion with the given label (or label alias), or null if no such assertion is
   * visible.
   */
  @Nullable Assertion find(String label);
}
