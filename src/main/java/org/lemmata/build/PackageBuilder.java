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
import com.google.common.collect.ImmutableMap;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jspecify.annotations.Nullable;
import org.lemmata.Ir;
import org.lemmata.emit.ArtifactSink;
import org.lemmata.emit.IrArtifact;
import org.lemmata.proof.Assertion;
import org.lemmata.proof.Hypothesis;
import org.lemmata.proof.LoweredProof;
import org.lemmata.proof.LoweringError;
import org.lemmata.proof.ProofLowering;
import org.lemmata.symbol.ResolutionError;
import org.lemmata.syntax.CompilationError;
import org.lemmata.syntax.FormulaReader;
import org.lemmata.syntax.ParseError;
import org.lemmata.syntax.TokenSeq;

/**
 * Builds {@link LogicPackage}s from {@link PackageSpec}s.
 *
 * <p>A build first checks the export list, then processes the imports, and then the declarations
 * in four fixed phases (axioms, rule skeletons, lemmas, theorems), keeping declaration order within
 * each phase. A declaration may only refer to assertions built before it.
 *
 * <p>Label collisions and export violations throw an {@link ExportPolicyError} as soon as they are
 * detected. Any other failure in a single declaration, from reading its text to lowering its
 * proof, does not stop the build; all such failures are reported together in a {@link
 * BuildFailure} once every phase has run.
 */
public final class PackageBuilder {
  private static final Logger log = LogManager.getLogger(PackageBuilder.class);

  private static final ImmutableList<Assertion.Kind> PHASES =
      ImmutableList.of(
          Assertion.Kind.AXIOM, Assertion.Kind.RULE, Assertion.Kind.LEMMA, Assertion.Kind.THEOREM);

  private final BuildOptions options;

  public PackageBuilder(BuildOptions options) {
    this.options = options;
  }

  public PackageBuilder() {
    this(BuildOptions.DEFAULT);
  }

  /** Returns a fresh context for building {@code spec}. */
  public BuildContext newContext(PackageSpec spec) {
    return new BuildContext(spec.skeleton, options);
  }

  public LogicPackage build(PackageSpec spec) {
    return build(spec, newContext(spec));
  }

  /** Builds {@code spec} using the given context, which must not have been used before. */
  public LogicPackage build(PackageSpec spec, BuildContext ctx) {
    return new Run(spec, ctx).run();
  }

  /** Emits the IR of {@code pkg} and returns the verifier's verdict on it. */
  public Ir.Verdict verify(LogicPackage pkg, Ir.Verifier verifier) {
    IrArtifact ir = pkg.toIr();
    Ir.Verdict verdict = verifier.verify(ir);
    if (verdict.ok()) {
      log.info("{}: verifier accepted {} statements", pkg.name, ir.statements.size());
    } else {
      verdict.divergences.forEach(d -> log.warn("{}: verifier rejected {}", pkg.name, d));
    }
    return verdict;
  }

  /** Returns a sink that writes artifacts to {@code outputDir} as configured by this builder. */
  public ArtifactSink newSink(Path outputDir) {
    return new ArtifactSink(outputDir, options.indentArtifacts);
  }

  /** Writes the IR and name mapping of {@code pkg} to {@code sink}. */
  public void write(LogicPackage pkg, ArtifactSink sink) throws IOException {
    sink.writeIr(pkg.toIr());
    sink.writeNameMapping(pkg.name, pkg.nameMapping);
  }

  /** The state of a single call to {@link #build}. */
  private static class Run {
    final PackageSpec spec;
    final BuildContext ctx;
    final LabelSpace labelSpace;
    final ProofLowering lowering;
    final FormulaReader reader;
    final Map<String, Assertion> imported = new LinkedHashMap<>();
    final Map<String, Assertion> own = new LinkedHashMap<>();
    final List<BuildFailure.LemmaFailure> failures = new ArrayList<>();

    Run(PackageSpec spec, BuildContext ctx) {
      this.spec = spec;
      this.ctx = ctx;
      this.labelSpace = new LabelSpace(spec.name);
      this.lowering = new ProofLowering(ctx.compiler, this::find);
      this.reader = new FormulaReader(spec.skeleton);
    }

    LogicPackage run() {
      log.debug(
          "Building {} ({} declarations, {})",
          spec.name,
          spec.declarations.size(),
          ctx.options);
      checkExports();
      spec.imports.forEach(this::addImport);
      for (Assertion.Kind phase : PHASES) {
        log.debug("{}: {} phase", spec.name, phase);
        for (Declaration declaration : spec.declarations) {
          if (declaration.kind == phase) {
            process(declaration);
          }
        }
      }
      if (!failures.isEmpty()) {
        failures.forEach(f -> log.warn("{}: {}", spec.name, f));
        throw new BuildFailure(spec.name, ImmutableList.copyOf(failures));
      }
      ImmutableMap.Builder<String, Assertion> exported = ImmutableMap.builder();
      spec.exports.forEach(label -> exported.put(label, own.get(label)));
      LogicPackage result =
          new LogicPackage(
              spec.name,
              spec.skeleton,
              spec.imports.stream()
                  .map(i -> i.view.packageName)
                  .distinct()
                  .collect(ImmutableList.toImmutableList()),
              ImmutableMap.copyOf(own),
              exported.buildOrThrow(),
              labelSpace.origins(),
              ctx.nameMapping.asMap());
      log.info(
          "Built {}: {} assertions, {} exported",
          spec.name,
          result.assertions.size(),
          result.exported.size());
      return result;
    }

    /** Checks that every exported label is defined by this package and has a proof. */
    void checkExports() {
      for (String label : spec.exports) {
        Declaration declaration = spec.declaration(label);
        if (declaration == null) {
          throw new ExportPolicyError(
              ExportPolicyError.Kind.UNKNOWN_EXPORT,
              spec.name,
              label,
              String.format("'%s' is exported but not defined", label));
        } else if (declaration.isStub()) {
          throw new ExportPolicyError(
              ExportPolicyError.Kind.STUB_EXPORTED,
              spec.name,
              label,
              String.format("'%s' is exported but has no proof", label));
        }
      }
    }

    void addImport(PackageSpec.Import imp) {
      DependencyView view = imp.view;
      view.labelOrigins.forEach(labelSpace::claimImported);
      Collection<String> labels = (imp.labels == null) ? view.exported.keySet() : imp.labels;
      for (String label : labels) {
        Assertion assertion = view.find(label);
        if (assertion == null) {
          throw new ExportPolicyError(
              ExportPolicyError.Kind.UNRESOLVED_IMPORT,
              spec.name,
              label,
              String.format("'%s' is not exported by %s", label, view.packageName));
        }
        imported.put(label, assertion.reintern(ctx.labels, ctx.symbols));
      }
      log.debug("{}: imported {} assertions from {}", spec.name, labels.size(), view.packageName);
    }

    void process(Declaration declaration) {
      labelSpace.claimOwn(declaration.label);
      try {
        own.put(declaration.label, assemble(declaration));
        log.debug("{}: built {} {}", spec.name, declaration.kind, declaration.label);
      } catch (LoweringError e) {
        failures.add(
            new BuildFailure.LemmaFailure(declaration.label, declaration.kind, e.stepIndex, e));
      } catch (ParseError | CompilationError | ResolutionError e) {
        failures.add(new BuildFailure.LemmaFailure(declaration.label, declaration.kind, -1, e));
      }
    }

    Assertion assemble(Declaration declaration) {
      Declaration.Statement statement = declaration.read(reader);
      ImmutableList<TokenSeq> essentials =
          statement.essentials.stream()
              .map(ctx.compiler::compile)
              .collect(ImmutableList.toImmutableList());
      TokenSeq conclusion = ctx.compiler.compile(statement.conclusion);
      ImmutableList<Hypothesis> hypotheses =
          ctx.synthesizer.synthesize(declaration.label, essentials, conclusion);
      Assertion.Provenance provenance;
      LoweredProof proof = null;
      if (declaration.kind == Assertion.Kind.AXIOM || declaration.kind == Assertion.Kind.RULE) {
        provenance = Assertion.Provenance.AXIOM;
      } else if (statement.proof == null) {
        provenance = Assertion.Provenance.STUB;
      } else {
        proof = lowering.lower(declaration.label, hypotheses, conclusion, statement.proof);
        provenance = Assertion.Provenance.PROVED;
      }
      return new Assertion(
          ctx.labels.intern(declaration.label),
          declaration.kind,
          ctx.symbols.intern(
              (declaration.typecode != null)
                  ? declaration.typecode
                  : ctx.skeleton.assertionTypecode()),
          hypotheses,
          conclusion,
          provenance,
          proof);
    }

    /**
     * Finds an assertion built earlier in this package or imported into it, by label or by one of
     * the package's label aliases.
     */
    @Nullable Assertion find(String label) {
      Assertion result = findExact(label);
      if (result == null) {
        String target = spec.labelAliases.get(label);
        if (target != null) {
          result = findExact(target);
        }
      }
      return result;
    }

    private @Nullable Assertion findExact(String label) {
      Assertion result = own.get(label);
      return (result != null) ? result : imported.get(label);
    }
  }
}
