/*
 * Copyright 2025 The Selexpr Authors
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

package org.selexpr.compiler;

import java.util.List;
import org.selexpr.CompileOptions;
import org.selexpr.eval.EvalContext;
import org.selexpr.eval.Evaluator;
import org.selexpr.tree.CompileAnalysis.Dispatch;
import org.selexpr.tree.CompileFlag;
import org.selexpr.tree.Node;
import org.selexpr.tree.NodeKind;
import org.selexpr.util.IndexSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compiles a chain of selection trees in place into the form evaluated once per frame.
 *
 * <p>The phases, in order:
 *
 * <ol>
 *   <li>default position types are chosen for calls without one;
 *   <li>parameter expressions are extracted into subexpressions, and unused ones removed;
 *   <li>each tree is normalized and its evaluation tags, pooling and compile flags are set;
 *   <li>the chain is evaluated once under a {@link StaticAnalyzer}, which folds static parts and
 *       computes bounds; common subexpressions are then analyzed again for their final group;
 *   <li>ROOT groups, position calculators and storage are set up and the compile-time state is
 *       discarded.
 * </ol>
 *
 * A {@link SelectionError} thrown by any phase leaves the chain in an unusable state.
 */
public final class SelectionCompiler {
  private static final Logger LOG = LoggerFactory.getLogger(SelectionCompiler.class);

  private final EvalContext ctx;
  private final CompileOptions options;

  public SelectionCompiler(EvalContext ctx, CompileOptions options) {
    this.ctx = ctx;
    this.options = options;
  }

  /** Compiles {@code roots}, which is modified in place, and reserves the memory pool. */
  public void compile(List<Node> roots) {
    prepare(roots);
    analyze(roots);
    finish(roots);
  }

  /** Extracts subexpressions, normalizes each tree and attaches the initial compile flags. */
  void prepare(List<Node> roots) {
    new PositionDefaults(
            options.selectionPositionType(),
            options.referencePositionType(),
            options.evaluateVelocities(),
            options.evaluateForces())
        .apply(roots);
    SubexpressionExtractor.pruneUnused(roots);
    new SubexpressionExtractor().extract(roots);
    SubexpressionExtractor.pruneUnused(roots);
    LOG.debug("Extracted subexpressions: {} roots", roots.size());

    for (Node root : roots) {
      TreeNormalizer.normalize(root);
      FlagPropagator.initEvalTags(root);
      FlagPropagator.setupMemoryPooling(root);
      FlagPropagator.initAnalysis(root);
      FlagPropagator.initStaticEval(root);
    }
    for (Node root : roots) {
      FlagPropagator.initSubexprFlags(root);
      FlagPropagator.initEvalOutput(root);
    }
    for (Node root : roots) {
      FlagPropagator.initMinMax(root);
    }
    FlagPropagator.initEvalGroups(roots, ctx.universe());
    dump("Initialized compiler data", roots);
  }

  /** Sets up evaluation and storage, discards the compile-time state and reserves the pool. */
  void finish(List<Node> roots) {
    IndexSet universe = ctx.universe();
    StoragePlanner planner = new StoragePlanner(universe);
    for (Node root : roots) {
      Finalizer.initRoot(root, universe);
      Finalizer.postprocessSubexprs(root);
      Finalizer.initPositionCalculators(
          root, ctx.topology(), universe, options.referencePositionType());
    }
    long poolSize = planner.plan(roots);
    for (Node root : roots) {
      Finalizer.freeAnalysis(root);
    }
    ctx.pool().reserveArena(poolSize);
    dump("Compiled", roots);
    LOG.debug("Compiled {} roots; memory pool of {} bytes", roots.size(), poolSize);
  }

  /**
   * Evaluates the chain under a {@link StaticAnalyzer}, folding static parts and computing the
   * bounds of dynamic ones.
   */
  void analyze(List<Node> roots) {
    ctx.setAnalyzer(new StaticAnalyzer());
    try {
      analyzePasses(roots);
    } finally {
      ctx.setAnalyzer(null);
    }
    dump("Analyzed", roots);
  }

  private void analyzePasses(List<Node> roots) {
    // First pass: common subexpressions are treated as dynamic, since the groups they will be
    // evaluated with are only known once all their referrers have been analyzed
    for (Node root : roots) {
      Node child = root.child(0);
      if (isCommon(child)) {
        FlagPropagator.markSubexprDynamic(child, true);
      }
      FlagPropagator.setDispatch(root, Dispatch.ANALYZE);
      Evaluator.evaluate(ctx, root, null);
    }
    SubexpressionExtractor.pruneUnused(roots);
    LOG.debug("First analysis pass complete: {} roots", roots.size());

    // Second pass: evaluate each common subexpression for its maximal group
    for (Node root : roots) {
      FlagPropagator.clearEvaluated(root);
    }
    for (Node root : roots) {
      Node child = root.child(0);
      if (!isCommon(child)) {
        continue;
      }
      FlagPropagator.markSubexprDynamic(child, false);
      child.setEvalGroup(IndexSet.EMPTY);
      FlagPropagator.setDispatch(root, Dispatch.ANALYZE);
      // The subexpression's own bounds stay those computed from its referrers
      child.analysis().clear(CompileFlag.DO_MINMAX);
      Evaluator.evaluate(ctx, child, FlagPropagator.maxOf(child, ctx.universe()));
      child.analysis().set(CompileFlag.DO_MINMAX);
    }
    SubexpressionExtractor.pruneUnused(roots);
  }

  private static boolean isCommon(Node node) {
    return node.kind() == NodeKind.SUBEXPR
        && node.analysis().has(CompileFlag.COMMON_SUBEXPR);
  }

  private void dump(String phase, List<Node> roots) {
    if (options.debug() && LOG.isDebugEnabled()) {
      LOG.debug("{}:\n{}", phase, TreePrinter.print(roots));
    }
  }
}
