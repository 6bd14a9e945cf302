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
package org.lemmata.syntax;

/**
 * Thrown when a well-typed formula cannot be produced from an authoring-level {@link Expr}, or when
 * the hypotheses of a declaration are malformed.
 */
public class CompilationError extends RuntimeException {

  public enum Kind {
    /** A connective or definition was applied to the wrong number of operands. */
    ARITY_MISMATCH,
    /** A variable did not resolve, or resolved to something other than a variable. */
    UNBOUND_VARIABLE,
    /** An Application named a symbol that the skeleton does not declare as a connective. */
    UNKNOWN_CONNECTIVE,
    /** The same essential hypothesis was declared twice. */
    DUPLICATE_HYPOTHESIS
  }

  public final Kind kind;

  /** The authoring spelling or formula that the error refers to. */
  public final String subject;

  public final String detail;

  public CompilationError(Kind kind, String subject, String detail) {
    super(detail);
    this.kind = kind;
    this.subject = subject;
    this.detail = detail;
  }

  public CompilationError(Kind kind, String subject, String detail, Throwable cause) {
    super(detail, cause);
    this.kind = kind;
    this.subject = subject;
    this.detail = detail;
  }

  static CompilationError arityMismatch(String connective, int expected, int actual) {
    return new CompilationError(
        Kind.ARITY_MISMATCH,
        connective,
        String.format("'%s' expects %s operands, got %s", connective, expected, actual));
  }

  @Override
  public String getMessage() {
    return String.format("%s: %s", kind, detail);
  }
}
