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

import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.selexpr.eval.Analyzer;
import org.selexpr.eval.EvalContext;
import org.selexpr.eval.Evaluator;
import org.selexpr.method.MethodCall;
import org.selexpr.tree.BoolOp;
import org.selexpr.tree.CompileAnalysis;
import org.selexpr.tree.CompileAnalysis.Dispatch;
import org.selexpr.tree.CompileFlag;
import org.selexpr.tree.EvalTag;
import org.selexpr.tree.Node;
import org.selexpr.tree.NodeKind;
import org.selexpr.tree.ValueShape;
import org.selexpr.tree.ValueType;
import org.selexpr.util.IndexSet;

/**
 * Receives the evaluation of every node while the chain is being compiled. Static nodes are
 * evaluated and replaced by constants; dynamic nodes get the minimal and maximal groups that
 * their value will be between in any frame.
 *
 * <p>The analyzer drives the regular {@link Evaluator} routines, so a node is analyzed exactly when
 * (and with the group that) it would be evaluated at runtime.
 */
final class StaticAnalyzer implements Analyzer {

  @Override
  public void analyze(EvalContext ctx, Node node, @Nullable IndexSet g) {
    CompileAnalysis analysis = node.analysis();
    boolean doMinMax = analysis.has(CompileFlag.DO_MINMAX);
    if (doMinMax && node.kind() != NodeKind.SUBEXPR) {
      analysis.resetBounds();
    }
    switch (node.kind()) {
      case CONSTANT -> {
        if (node.evalTag() != null) {
          Evaluator.evaluateReal(ctx, node, g);
        }
      }
      case METHOD, MODIFIER -> analyzeCall(ctx, node, g, doMinMax);
      case BOOLEAN -> {
        if (!node.isDynamic()) {
          evaluateStatic(ctx, node, g);
        } else {
          evaluateStaticPart(ctx, node, g);
          Node first = node.child(0);
          boolean narrowed = node.boolOp() == BoolOp.AND && first.kind() == NodeKind.CONSTANT;
          Evaluator.evaluateReal(ctx, node, narrowed ? first.value().group() : g);
          if (doMinMax) {
            updateBooleanBounds(ctx, node, g);
          }
        }
      }
      case ARITHMETIC -> {
        if (!node.isDynamic()) {
          evaluateStatic(ctx, node, g);
        } else {
          // Dynamic operands have no values yet; only analyze them
          for (Node child : node.children()) {
            if (Evaluator.hasEvaluator(ctx, child)) {
              Evaluator.evaluate(ctx, child, g);
            }
          }
          sizeUnevaluatedValue(ctx, node, g);
        }
        recordMaxGroup(ctx, node, g);
      }
      case ROOT -> Evaluator.evaluateReal(ctx, node, g);
      case SUBEXPR -> analyzeSubexpr(ctx, node, g, doMinMax);
      case SUBEXPR_REF -> analyzeSubexprRef(ctx, node, g, doMinMax);
      case GROUP_REF -> throw StructuralError.unresolvedReference(node.groupName());
    }
    if (node.kind() == NodeKind.CONSTANT || !node.isDynamic() || node.type() != ValueType.GROUP) {
      return;
    }
    // A node whose bounds coincide has the same value in every frame
    if (doMinMax
        && g != null
        && (node.kind() == NodeKind.METHOD
            || node.kind() == NodeKind.MODIFIER
            || node.kind() == NodeKind.BOOLEAN)
        && !analysis.has(CompileFlag.COMMON_SUBEXPR)) {
      IndexSet min = FlagPropagator.minOf(node);
      if (min.equals(FlagPropagator.maxOf(node, ctx.universe()))) {
        node.value().setGroup(min);
        makeStatic(node);
        node.setDynamic(false);
        return;
      }
    }
    if (node.kind() != NodeKind.SUBEXPR
        && !(node.kind() == NodeKind.BOOLEAN && node.boolOp() == BoolOp.NOT)) {
      node.value()
          .setGroup(
              analysis.has(CompileFlag.EVAL_MAX)
                  ? FlagPropagator.maxOf(node, ctx.universe())
                  : FlagPropagator.minOf(node));
    }
  }

  private static void analyzeCall(
      EvalContext ctx, Node node, @Nullable IndexSet g, boolean doMinMax) {
    Evaluator.evaluateMethodParams(ctx, node, g);
    MethodCall call = node.call();
    boolean perAtomParams = node.children().stream().anyMatch(FlagPropagator::isPerAtomParam);
    if (!call.isInitialized() || perAtomParams) {
      call.init(ctx.topology());
    }
    if (!node.isDynamic()) {
      evaluateStatic(ctx, node, g);
      recordMaxGroup(ctx, node, g);
    } else {
      // Modifiers and position calls are evaluated to get their output from the maximal input
      if (node.kind() == NodeKind.MODIFIER || node.type() == ValueType.POSITION) {
        Evaluator.evaluateReal(ctx, node, g);
      } else {
        sizeUnevaluatedValue(ctx, node, g);
      }
      if (doMinMax) {
        node.analysis().setMaxGroup(ctx.groupOrUniverse(g));
      }
    }
  }

  /**
   * Gives a dynamic numeric or string node that is not evaluated during analysis one (zero)
   * element per atom of its group, so that subexpressions and references that copy or merge its
   * value see the same number of elements as at runtime.
   */
  private static void sizeUnevaluatedValue(EvalContext ctx, Node node, @Nullable IndexSet g) {
    if (node.type().isNumeric() || node.type() == ValueType.STRING) {
      node.value().setCount(
          (node.shape() == ValueShape.PER_ATOM) ? ctx.groupOrUniverse(g).size() : 1);
    }
  }

  private static void evaluateStatic(EvalContext ctx, Node node, @Nullable IndexSet g) {
    Evaluator.evaluateReal(ctx, node, g);
    if (node.analysis().has(CompileFlag.STATIC)) {
      makeStatic(node);
    }
  }

  /** Sets the maximal group of a node that has not been folded and owns its bounds. */
  private static void recordMaxGroup(EvalContext ctx, Node node, @Nullable IndexSet g) {
    CompileAnalysis analysis = node.analysis();
    if (node.kind() != NodeKind.CONSTANT
        && analysis.has(CompileFlag.DO_MINMAX)
        && !analysis.boundsAliased()) {
      analysis.setMaxGroup(ctx.groupOrUniverse(g));
    }
  }

  /**
   * Evaluates the leading static operands of a dynamic boolean and replaces them with a single
   * constant.
   */
  private static void evaluateStaticPart(EvalContext ctx, Node node, @Nullable IndexSet g) {
    List<Node> children = node.children();
    int n = 0;
    while (n < children.size() && !children.get(n).isDynamic()) {
      n++;
    }
    if (n == 0) {
      return;
    }
    Node first;
    if (n > 1) {
      List<Node> run = new ArrayList<>(children.subList(0, n));
      List<Node> rest = new ArrayList<>(children.subList(n, children.size()));
      children.subList(n, children.size()).clear();
      Evaluator.evaluateReal(ctx, node, g);
      children.clear();
      for (Node child : run) {
        release(child);
      }
      first = Node.constantGroup(node.value().group());
      CompileAnalysis analysis = new CompileAnalysis(first);
      analysis.set(CompileFlag.STATIC);
      if (node.analysis().has(CompileFlag.STATIC_EVAL)) {
        analysis.set(CompileFlag.STATIC_EVAL);
      }
      analysis.aliasBoundsToValue();
      first.setAnalysis(analysis);
      children.add(first);
      children.addAll(rest);
    } else {
      first = children.get(0);
      if (Evaluator.hasEvaluator(ctx, first)) {
        Evaluator.evaluate(ctx, first, g);
      }
    }
    if (first.kind() != NodeKind.CONSTANT) {
      return;
    }
    first.analysis().setDispatch(Dispatch.NONE);
    // An OR evaluated with a fixed group doesn't need the constant intersected again
    if (node.boolOp() == BoolOp.NOT
        || (node.boolOp() == BoolOp.OR && node.analysis().has(CompileFlag.STATIC_EVAL))) {
      first.setEvalTag(null);
    } else {
      first.setEvalTag(EvalTag.STATIC);
      first.setEvalGroup(first.value().group());
    }
  }

  private static void updateBooleanBounds(EvalContext ctx, Node node, @Nullable IndexSet g) {
    IndexSet universe = ctx.universe();
    IndexSet group = ctx.groupOrUniverse(g);
    List<Node> children = node.children();
    Node first = children.get(0);
    IndexSet min;
    IndexSet max;
    switch (node.boolOp()) {
      case NOT -> {
        min = group.difference(FlagPropagator.maxOf(first, universe));
        max = group.difference(FlagPropagator.minOf(first));
      }
      case AND -> {
        min = FlagPropagator.minOf(first);
        max = FlagPropagator.maxOf(first, universe);
        for (int i = 1; i < children.size() && !max.isEmpty(); i++) {
          min = min.intersection(FlagPropagator.minOf(children.get(i)));
          max = max.intersection(FlagPropagator.maxOf(children.get(i), universe));
        }
        // Later operands may limit the static part further
        if (isStaticGroup(first) && first.value().group().size() > max.size()) {
          setStaticGroup(first, max);
        }
      }
      case OR -> {
        min = FlagPropagator.minOf(first);
        max = FlagPropagator.maxOf(first, universe);
        // Bounds of simple subexpression references are not limited to the group an operand is
        // evaluated for, so the operands' minima can overlap and mergeDisjoint would not apply
        for (int i = 1; i < children.size() && min.size() < group.size(); i++) {
          min = min.union(FlagPropagator.minOf(children.get(i)));
          max = max.union(FlagPropagator.maxOf(children.get(i), universe));
        }
        if (isStaticGroup(first) && first.value().group().size() < min.size()) {
          setStaticGroup(first, min);
        }
      }
      default -> throw UnsupportedOperationError.format("%s cannot be analyzed", node.boolOp());
    }
    node.analysis().setBounds(min, max);
  }

  private static boolean isStaticGroup(Node node) {
    return node.kind() == NodeKind.CONSTANT
        && node.type() == ValueType.GROUP
        && node.analysis() != null
        && node.analysis().has(CompileFlag.STATIC);
  }

  private static void setStaticGroup(Node constant, IndexSet group) {
    constant.value().setGroup(group);
    if (constant.evalTag() == EvalTag.STATIC) {
      constant.setEvalGroup(group);
    }
  }

  private static void analyzeSubexpr(
      EvalContext ctx, Node node, @Nullable IndexSet g, boolean doMinMax) {
    CompileAnalysis analysis = node.analysis();
    Node body = node.child(0);
    if (analysis.has(CompileFlag.SIMPLE_SUBEXPR) || analysis.has(CompileFlag.FULL_EVAL)) {
      Evaluator.evaluateReal(ctx, node, g);
      node.setValue(body.value());
    } else if (node.evalGroup().isEmpty()) {
      Evaluator.evaluateReal(ctx, node, g);
      if (doMinMax) {
        analysis.setBounds(FlagPropagator.minOf(body), FlagPropagator.maxOf(body, ctx.universe()));
      }
    } else {
      IndexSet missing = ctx.groupOrUniverse(g).difference(node.evalGroup());
      Evaluator.evaluateReal(ctx, node, g);
      if (!missing.isEmpty() && doMinMax) {
        analysis.setBounds(
            FlagPropagator.minOf(node).union(FlagPropagator.minOf(body)),
            FlagPropagator.maxOf(node, ctx.universe())
                .union(FlagPropagator.maxOf(body, ctx.universe())));
      }
    }
  }

  private static void analyzeSubexprRef(
      EvalContext ctx, Node node, @Nullable IndexSet g, boolean doMinMax) {
    CompileAnalysis analysis = node.analysis();
    Node target = node.target();
    Evaluator.evaluateReal(ctx, node, g);
    boolean simple = analysis.has(CompileFlag.SIMPLE_SUBEXPR);
    if (simple) {
      node.setValue(target.child(0).value());
    }
    if (!node.isDynamic()) {
      if (analysis.has(CompileFlag.STATIC)) {
        makeStatic(node);
      }
    } else if (doMinMax) {
      IndexSet min = FlagPropagator.minOf(target);
      IndexSet max = FlagPropagator.maxOf(target, ctx.universe());
      if (simple || g == null) {
        analysis.setBounds(min, max);
      } else {
        analysis.setBounds(min.intersection(g), max.intersection(g));
      }
    }
  }

  /**
   * Replaces {@code node} with a constant holding its current value, releasing its children and
   * any subexpression only it referred to.
   */
  static void makeStatic(Node node) {
    release(node);
    node.convertToConstant();
    node.analysis().setDispatch(Dispatch.NONE);
  }

  /**
   * Releases the references in the subtree of {@code node}. A subexpression whose only referrer
   * is released loses its body, and is pruned with its ROOT afterwards.
   */
  static void release(Node node) {
    if (node.kind() == NodeKind.SUBEXPR_REF) {
      Node target = node.target();
      if (target.kind() == NodeKind.SUBEXPR) {
        if (target.refCount() == 2 && !target.children().isEmpty()) {
          release(target.child(0));
          target.children().clear();
          target.setName(null);
        }
        target.decrementRefCount();
      }
      return;
    }
    for (Node child : node.children()) {
      release(child);
    }
  }
}
