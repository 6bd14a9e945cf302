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

/**
 * Determines how a {@link NameResolver} handles a spelling that is neither a registered alias nor
 * one of its lexicon's canonical spellings.
 */
public enum ResolutionPolicy {
  /** Such spellings always fail with a {@link ResolutionError}. */
  STRICT,

  /**
   * Such spellings are accepted (and become canonical for the rest of the build) if they are
   * already in canonical form; other spellings fail with a {@link ResolutionError}.
   */
  PERMISSIVE
}
