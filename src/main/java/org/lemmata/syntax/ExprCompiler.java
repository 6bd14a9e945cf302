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

import org.lemmata.symbol.CanonicalId;
import org.lemmata.symbol.NameResolver;
import org.lemmata.symbol.ResolutionError;

/**
 * Compiles authoring-level {@link Expr}s to canonical {@link TokenSeq}s.
 *
 * <p>Compilation is a prefix traversal: each Application emits its connective's CanonicalId
 * followed by the tokens of its operands, and each Variable emits its own CanonicalId. Definitions
 * are expanded in place. Their spellings are resolved like any other, so each one used is recorded
 * in the name mapping, but they never appear in a TokenSeq. The result depends only on the Expr and
 * the skeleton, so compiling the same Expr twice in one build context returns equal TokenSeqs.
 *
 * <p>A connective spelling that fails to resolve throws the {@link ResolutionError} unchanged; a
 * variable that fails to resolve is reported as {@link CompilationError.Kind#UNBOUND_VARIABLE}.
 */
public final class ExprCompiler {
  private final Skeleton skeleton;
  private final NameResolver resolver;

  public ExprCompiler(Skeleton skeleton, NameResolver resolver) {
    this.skeleton = skeleton;
    this.resolver = resolver;
  }

  public Skeleton skeleton() {
    return skeleton;
  }

  public NameResolver resolver() {
    return resolver;
  }

  public TokenSeq compile(Expr expr) {
    Emitter emitter = new Emitter();
    expr.accept(emitter);
    return emitter.out.build();
  }

  /** Appends the tokens of each visited Expr to {@link #out}. */
  private class Emitter implements Expr.Visitor<Void> {
    final TokenSeq.Builder out = new TokenSeq.Builder();

    @Override
    public Void visitVariable(Expr.Variable variable) {
      CanonicalId id;
      try {
        id = resolver.resolveId(variable.name);
      } catch (ResolutionError e) {
        throw new CompilationError(
            CompilationError.Kind.UNBOUND_VARIABLE,
            variable.name,
            String.format("Unbound variable '%s'", variable.name),
            e);
      }
      String spelling = id.spelling();
      // Typecodes, connectives, and definitions are canonical but are not variables.
      if (skeleton.variableTypecode(spelling) == null
          && skeleton.lexicon().isCanonical(spelling)) {
        throw new CompilationError(
            CompilationError.Kind.UNBOUND_VARIABLE,
            variable.name,
            String.format("'%s' is not a variable", variable.name));
      }
      out.add(id);
      return null;
    }

    @Override
    public Void visitApplication(Expr.Application application) {
      int numOperands = application.operands.size();
      CanonicalId id = resolver.resolveId(application.connective);
      Definition definition = skeleton.definition(id.spelling());
      if (definition != null) {
        if (numOperands != definition.arity) {
          throw CompilationError.arityMismatch(
              application.connective, definition.arity, numOperands);
        }
        return definition.expand(application.operands).accept(this);
      }
      Skeleton.Connective connective = skeleton.connective(id.spelling());
      if (connective == null) {
        throw new CompilationError(
            CompilationError.Kind.UNKNOWN_CONNECTIVE,
            application.connective,
            String.format("'%s' is not a connective", application.connective));
      } else if (numOperands != connective.arity) {
        throw CompilationError.arityMismatch(
            application.connective, connective.arity, numOperands);
      }
      out.add(id);
      for (Expr operand : application.operands) {
        operand.accept(this);
      }
      return null;
    }
  }
}
