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
import org.lemmata.syntax.TokenSeq;

/**
 * Thrown when a proof script cannot be lowered. Every LoweringError identifies the assertion being
 * proved and the zero-based index of the failing step; failures detected after the last step
 * report the number of steps.
 */
public class LoweringError extends RuntimeException {

  public enum Kind {
    /** A Compose step named a stack position that doesn't hold an entry. */
    STACK_UNDERFLOW,
    /** A Hyp step named an essential hypothesis that doesn't exist. */
    INDEX_OUT_OF_RANGE,
    /**
     * A Ref step named an assertion that is not visible, or one of its essential hypotheses is not
     * on the stack.
     */
    UNRESOLVED_REFERENCE,
    /** A substitution was incomplete, ill-typed, or could not be compiled. */
    UNIFICATION_FAILURE,
    /** A statement on the stack did not have the required form. */
    CONCLUSION_MISMATCH
  }

  public final Kind kind;
  public final String label;
  public final int stepIndex;
  public final String detail;

  /** The label or hypothesis that could not be resolved, if any. */
  public final @Nullable String reference;

  public final @Nullable TokenSeq expected;
  public final @Nullable TokenSeq actual;

  LoweringError(
      Kind kind,
      String label,
      int stepIndex,
      String detail,
      @Nullable String reference,
      @Nullable TokenSeq expected,
      @Nullable TokenSeq actual,
      @Nullable Throwable cause) {
    super(detail, cause);
    this.kind = kind;
    this.label = label;
    this.stepIndex = stepIndex;
    this.detail = detail;
    this.reference = reference;
    this.expected = expected;
    this.actual = actual;
  }

  @Override
  public String getMessage() {
    String result = String.format("%s in %s at step %s: %s", kind, label, stepIndex, detail);
    if (expected != null && actual != null) {
      result += String.format(" (expected '%s', got '%s')", expected, actual);
    } else if (expected != null) {
      result += String.format(" (expected '%s')", expected);
    } else if (actual != null) {
      result += String.format(" (got '%s')", actual);
    }
    return result;
  }
}
