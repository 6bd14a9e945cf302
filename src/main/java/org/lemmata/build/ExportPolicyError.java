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

/**
 * Thrown when a build would violate the package's label space or export surface. These errors are
 * fatal: the build stops as soon as one is detected.
 */
public class ExportPolicyError extends RuntimeException {

  public enum Kind {
    /** A label is defined by two different packages, or twice by the same package. */
    DUPLICATE_LABEL,
    /** An assertion without a proof is in the export list. */
    STUB_EXPORTED,
    /** The export list names a label that the package does not define. */
    UNKNOWN_EXPORT,
    /** An explicitly imported label is not exported by the imported package. */
    UNRESOLVED_IMPORT
  }

  public final Kind kind;
  public final String packageName;
  public final String label;
  public final String detail;

  public ExportPolicyError(Kind kind, String packageName, String label, String detail) {
    super(detail);
    this.kind = kind;
    this.packageName = packageName;
    this.label = label;
    this.detail = detail;
  }

  @Override
  public String getMessage() {
    return String.format("%s in %s: %s", kind, packageName, detail);
  }
}
