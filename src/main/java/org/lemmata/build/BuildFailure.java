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
import java.util.stream.Collectors;
import org.jspecify.annotations.Nullable;
import org.lemmata.proof.Assertion;
import org.lemmata.proof.LoweringError;

/**
 * Thrown at the end of a build in which one or more declarations failed to compile or lower. Each
 * failure is independent; the declarations that succeeded are discarded along with the failed ones.
 */
public class BuildFailure extends RuntimeException {

  /** Why a single declaration could not be built. */
  public static final class LemmaFailure {
    public final String label;
    public final Assertion.Kind kind;

    /** The index of the failing proof step, or -1 if the statement itself could not be compiled. */
    public final int stepIndex;

    public final RuntimeException cause;

    LemmaFailure(String label, Assertion.Kind kind, int stepIndex, RuntimeException cause) {
      this.label = label;
      this.kind = kind;
      this.stepIndex = stepIndex;
      this.cause = cause;
    }

    /** Returns the cause if this is a proof lowering failure, or null otherwise. */
    public @Nullable LoweringError loweringError() {
      return (cause instanceof LoweringError loweringError) ? loweringError : null;
    }

    @Override
    public String toString() {
      return (stepIndex < 0)
          ? label + ": " + cause.getMessage()
          : label + "[" + stepIndex + "]: " + cause.getMessage();
    }
  }

  public final String packageName;
  public final ImmutableList<LemmaFailure> failures;

  BuildFailure(String packageName, ImmutableList<LemmaFailure> failures) {
    super(packageName);
    this.packageName = packageName;
    this.failures = failures;
  }

  /** Returns the failure for the given label, or null if it did not fail. */
  public @Nullable LemmaFailure failure(String label) {
    return failures.stream().filter(f -> f.label.equals(label)).findFirst().orElse(null);
  }

  @Override
  public String getMessage() {
    return failures.stream()
        .map(LemmaFailure::toString)
        .collect(
            Collectors.joining(
                "\n  ",
                String.format("%s failure(s) building %s:\n  ", failures.size(), packageName),
                ""));
  }
}
