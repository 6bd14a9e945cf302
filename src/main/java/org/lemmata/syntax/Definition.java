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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import java.util.function.Function;
import org.jspecify.annotations.Nullable;

/**
 * A definitional macro: a name for a pattern over the core connectives, e.g. {@code Or(a, b) :=
 * -. a -> b}. Definitions are expanded by the {@link ExprCompiler} before lowering, so they never
 * appear in a TokenSeq and add no axioms or rules.
 */
public final class Definition {
  public final String name;
  public final int arity;
  public final @Nullable Notation notation;
  private final Function<ImmutableList<Expr>, Expr> body;

  Definition(
      String name,
      int arity,
      @Nullable Notation notation,
      Function<ImmutableList<Expr>, Expr> body) {
    this.name = name;
    this.arity = arity;
    this.notation = notation;
    this.body = body;
  }

  /** Returns the Expr this definition stands for; {@code args} must have arity elements. */
  Expr expand(ImmutableList<Expr> args) {
    checkArgument(
        args.size() == arity, "%s expects %s operands, got %s", name, arity, args.size());
    return body.apply(args);
  }

  @Override
  public String toString() {
    return name + "/" + arity;
  }
}
