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

import org.lemmata.proof.HypothesisSynthesizer;
import org.lemmata.symbol.NameMapping;
import org.lemmata.symbol.NameResolver;
import org.lemmata.symbol.SymbolInterner;
import org.lemmata.syntax.ExprCompiler;
import org.lemmata.syntax.Skeleton;

/**
 * The mutable state of a single package build: its interners, name mapping, and the compiler that
 * uses them.
 *
 * <p>A BuildContext is used by one thread and for one build. Nothing in it is shared with other
 * contexts, so independent builds may run concurrently.
 */
public final class BuildContext {
  public final BuildOptions options;

  /** The package's skeleton, merged with the skeletons of its imports. */
  public final Skeleton skeleton;

  /** Interns variables, connectives, and typecodes. */
  public final SymbolInterner symbols = new SymbolInterner();

  /** Interns assertion labels. */
  public final SymbolInterner labels = new SymbolInterner();

  public final NameMapping nameMapping = new NameMapping();
  public final NameResolver resolver;
  public final ExprCompiler compiler;
  public final HypothesisSynthesizer synthesizer;

  public BuildContext(Skeleton skeleton, BuildOptions options) {
    this.options = options;
    this.skeleton = skeleton;
    this.resolver =
        new NameResolver(skeleton.lexicon(), symbols, nameMapping, options.resolutionPolicy);
    this.compiler = new ExprCompiler(skeleton, resolver);
    this.synthesizer = new HypothesisSynthesizer(skeleton, symbols);
  }
}
