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

/** Thrown when an authoring spelling cannot be mapped to a canonical spelling. */
public class ResolutionError extends RuntimeException {
  public final String rawSpelling;

  public ResolutionError(String rawSpelling) {
    super(rawSpelling);
    this.rawSpelling = rawSpelling;
  }

  @Override
  public String getMessage() {
    return String.format("Unregistered spelling '%s'", rawSpelling);
  }
}
