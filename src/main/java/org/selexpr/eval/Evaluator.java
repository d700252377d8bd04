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

package org.selexpr.eval;

import java.util.List;
import org.jspecify.annotations.Nullable;
import org.selexpr.compiler.UnsupportedOperationError;
import org.selexpr.method.MethodCall;
import org.selexpr.method.Parameter;
import org.selexpr.position.PositionCalculator;
import org.selexpr.tree.CompileAnalysis;
import org.selexpr.tree.EvalTag;
import org.selexpr.tree.Node;
import org.selexpr.tree.NodeKind;
import org.selexpr.tree.Value;
import org.selexpr.tree.ValueShape;
import org.selexpr.util.IndexSet;

/**
 * Static-only class with the evaluation routines for each {@link EvalTag}.
 *
 * <p>Evaluating a node for a group {@code g} stores the node's value for the atoms of {@code g}
 * in {@link Node#value}; a null group means that the value does not depend on the group (for
 * group-valued nodes, the universe). While a node has a {@link CompileAnalysis} attached and the
 * context has an {@link Analyzer}, the analysis's dispatch decides whether the real routine runs.
 */
public final class Evaluator {

  // Statics only
  private Evaluator() {}

  /** Evaluates {@code node} for {@code g}, honoring any compile-time dispatch override. */
  public static void evaluate(EvalContext ctx, Node node, @Nullable IndexSet g) {
    CompileAnalysis analysis = node.analysis();
    Analyzer analyzer = ctx.analyzer();
    if (analysis != null && analyzer != null) {
      switch (analysis.dispatch()) {
        case NONE:
          return;
        case ANALYZE:
          analyzer.analyze(ctx, node, g);
          return;
        case REAL:
          break;
      }
    }
    evaluateReal(ctx, node, g);
  }

  /** Returns true if evaluating {@code node} would do anything. */
  public static boolean hasEvaluator(EvalContext ctx, Node node) {
    CompileAnalysis analysis = node.analysis();
    if (analysis != null && ctx.analyzer() != null) {
      switch (analysis.dispatch()) {
        case NONE:
          return false;
        case ANALYZE:
          return true;
        case REAL:
          break;
      }
    }
    return node.evalTag() != null;
  }

  /** Runs the evaluation routine selected by the node's tag, ignoring any dispatch override. */
  public static void evaluateReal(EvalContext ctx, Node node, @Nullable IndexSet g) {
    EvalTag tag = node.evalTag();
    if (tag == null) {
      return;
    }
    switch (tag) {
      case STATIC ->
          node.value()
              .setGroup((g == null) ? node.evalGroup() : node.evalGroup().intersection(g));
      case ROOT -> evaluateRoot(ctx, node);
      case SUBEXPR_SIMPLE -> evaluateIfPossible(ctx, node.child(0), g);
      case SUBEXPR -> evaluateSubexpr(ctx, node, g);
      case SUBEXPR_STATIC_EVAL -> evaluateStaticEvalSubexpr(ctx, node, g);
      case SUBEXPR_REF_SIMPLE -> {
        if (g != null) {
          evaluateIfPossible(ctx, node.target(), g);
        }
      }
      case SUBEXPR_REF -> evaluateSubexprRef(ctx, node, g);
      case METHOD -> evaluateMethod(ctx, node, g);
      case MODIFIER -> evaluateModifier(ctx, node, g);
      case ARITHMETIC -> evaluateArithmetic(ctx, node, g);
      case NOT -> evaluateNot(ctx, node, g);
      case AND -> evaluateAnd(ctx, node, g);
      case OR -> evaluateOr(ctx, node, g);
    }
  }

  private static void evaluateIfPossible(EvalContext ctx, Node node, @Nullable IndexSet g) {
    if (hasEvaluator(ctx, node)) {
      evaluate(ctx, node, g);
    }
  }

  private static void evaluateRoot(EvalContext ctx, Node root) {
    Node child = root.child(0);
    if (!hasEvaluator(ctx, child)) {
      return;
    }
    if (root.evalWithoutGroup()) {
      evaluate(ctx, child, null);
    } else if (!root.evalGroup().isEmpty()) {
      evaluate(ctx, child, root.evalGroup());
    }
  }

  /**
   * Evaluates a subexpression with several referrers: only the atoms of {@code g} that have not
   * yet been evaluated in this frame are passed to the body, and the results are merged with the
   * values already computed.
   */
  private static void evaluateSubexpr(EvalContext ctx, Node node, @Nullable IndexSet g) {
    Node body = node.child(0);
    IndexSet group = ctx.groupOrUniverse(g);
    Value own = node.value();
    if (node.evalGroup().isEmpty()) {
      Value reserved = reserve(ctx, body, group.size());
      evaluateIfPossible(ctx, body, group);
      own.copyFrom(body.value());
      release(ctx, reserved);
      node.setEvalGroup(group);
      return;
    }
    IndexSet evaluated = node.evalGroup();
    IndexSet missing = group.difference(evaluated);
    if (missing.isEmpty()) {
      return;
    }
    // The missing group is held in a temporary buffer while the body is evaluated
    Value scratch = Value.ofGroup(missing);
    ctx.pool().reserve(scratch, missing.size());
    Value reserved = reserve(ctx, body, missing.size());
    evaluateIfPossible(ctx, body, missing);
    Value delta = body.value();
    switch (node.type()) {
      case GROUP -> own.setGroup(own.group().union(delta.group()));
      case POSITION ->
          throw UnsupportedOperationError.format(
              "Subexpression '%s' with position values cannot be evaluated for varying groups",
              node.name());
      case INTEGER, REAL, STRING -> {
        if (node.shape() == ValueShape.PER_ATOM) {
          mergeValues(own, evaluated, delta, missing);
        } else {
          own.copyFrom(delta);
        }
      }
      case NONE -> {}
    }
    release(ctx, reserved);
    ctx.pool().release(scratch);
    node.setEvalGroup(evaluated.mergeDisjoint(missing));
  }

  /**
   * Merges per-atom values {@code delta} for the atoms {@code missing} into {@code own}, which has
   * values for the (disjoint) atoms {@code evaluated}; the merged values are ordered by atom.
   */
  private static void mergeValues(Value own, IndexSet evaluated, Value delta, IndexSet missing) {
    int i = evaluated.size() - 1;
    int j = missing.size() - 1;
    int k = i + j + 1;
    own.setCount(k + 1);
    // Fill from the end, so that own's elements are moved before they are overwritten
    while (j >= 0) {
      if (i >= 0 && evaluated.get(i) > missing.get(j)) {
        own.copyElement(k, own, i--);
      } else {
        own.copyElement(k, delta, j--);
      }
      k--;
    }
  }

  private static void evaluateStaticEvalSubexpr(EvalContext ctx, Node node, @Nullable IndexSet g) {
    if (node.evaluatedThisFrame()) {
      return;
    }
    evaluateIfPossible(ctx, node.child(0), g);
    node.setEvalGroup(ctx.groupOrUniverse(g));
    node.setEvaluatedThisFrame(true);
  }

  private static void evaluateSubexprRef(EvalContext ctx, Node node, @Nullable IndexSet g) {
    Node target = node.target();
    if (g != null) {
      evaluateIfPossible(ctx, target, g);
    }
    Value source = target.value();
    Value out = node.value();
    switch (node.type()) {
      case GROUP -> out.setGroup((g == null) ? source.group() : source.group().intersection(g));
      case POSITION -> out.setPositions(source.positions());
      case INTEGER, REAL, STRING -> {
        IndexSet evaluated = target.evalGroup();
        if (g == null || node.shape() != ValueShape.PER_ATOM || evaluated.isEmpty()) {
          out.copyFrom(source);
        } else {
          // Pick out the values for g from those computed for the target's group
          out.setCount(g.size());
          int j = 0;
          for (int i = 0; i < g.size(); i++) {
            while (evaluated.get(j) < g.get(i)) {
              j++;
            }
            out.copyElement(i, source, j);
          }
        }
      }
      case NONE -> {}
    }
  }

  /**
   * Evaluates the parameters of a method call: per-atom parameters for {@code g}, the others once
   * per frame.
   */
  public static void evaluateMethodParams(EvalContext ctx, Node node, @Nullable IndexSet g) {
    for (Node child : node.children()) {
      if (!hasEvaluator(ctx, child) || child.evaluatedThisFrame()) {
        continue;
      }
      Parameter param = child.param();
      if (param != null && param.isPerAtom()) {
        evaluate(ctx, child, g);
      } else {
        child.setEvaluatedThisFrame(true);
        evaluate(ctx, child, null);
      }
    }
  }

  private static void evaluateMethod(EvalContext ctx, Node node, @Nullable IndexSet g) {
    evaluateMethodParams(ctx, node, g);
    MethodCall call = node.call();
    if (!call.isInitialized()) {
      call.init(ctx.topology());
    }
    if (node.needsInitFrame()) {
      node.setInitFrame(false);
      call.method().initFrame(ctx, call);
    }
    PositionCalculator calculator = node.positionCalculator();
    if (calculator != null) {
      IndexSet group = (g == null) ? calculator.maxGroup() : g;
      call.method()
          .updatePositions(ctx, call, calculator.compute(ctx.frame(), group), g, node.value());
    } else {
      call.method().update(ctx, call, g, node.value());
    }
  }

  private static void evaluateModifier(EvalContext ctx, Node node, @Nullable IndexSet g) {
    evaluateMethodParams(ctx, node, g);
    MethodCall call = node.call();
    if (!call.isInitialized()) {
      call.init(ctx.topology());
    }
    call.method().update(ctx, call, g, node.value());
  }

  private static void evaluateArithmetic(EvalContext ctx, Node node, @Nullable IndexSet g) {
    List<Node> children = node.children();
    Node left = children.get(0);
    Node right = (children.size() > 1) ? children.get(1) : null;
    int n = (node.shape() == ValueShape.SINGLE) ? 1 : ctx.groupOrUniverse(g).size();
    Value leftReserved = reserve(ctx, left, n);
    Value rightReserved = (right == null) ? null : reserve(ctx, right, n);
    evaluateIfPossible(ctx, left, g);
    if (right != null) {
      evaluateIfPossible(ctx, right, g);
    }
    Value out = node.value();
    out.setCount(n);
    boolean leftSingle = left.shape() == ValueShape.SINGLE;
    boolean rightSingle = right == null || right.shape() == ValueShape.SINGLE;
    for (int i = 0; i < n; i++) {
      double l = left.value().realAt(leftSingle ? 0 : i);
      double r = (right == null) ? 0 : right.value().realAt(rightSingle ? 0 : i);
      out.setReal(i, node.arithOp().apply(l, r));
    }
    release(ctx, rightReserved);
    release(ctx, leftReserved);
  }

  private static void evaluateNot(EvalContext ctx, Node node, @Nullable IndexSet g) {
    IndexSet group = ctx.groupOrUniverse(g);
    Node child = node.child(0);
    Value reserved = reserve(ctx, child, group.size());
    evaluateIfPossible(ctx, child, group);
    node.value().setGroup(group.difference(child.value().group()));
    release(ctx, reserved);
  }

  private static void evaluateAnd(EvalContext ctx, Node node, @Nullable IndexSet g) {
    List<Node> children = node.children();
    // A leading constant without an evaluator has already been applied to g
    int first = hasEvaluator(ctx, children.get(0)) ? 0 : 1;
    IndexSet result = ctx.groupOrUniverse(g);
    for (int k = first; k < children.size() && (k == first || !result.isEmpty()); k++) {
      Node child = children.get(k);
      Value reserved = reserve(ctx, child, result.size());
      evaluateIfPossible(ctx, child, result);
      IndexSet value = child.value().group();
      result = (k == first) ? value : result.intersection(value);
      release(ctx, reserved);
    }
    node.value().setGroup(result);
  }

  private static void evaluateOr(EvalContext ctx, Node node, @Nullable IndexSet g) {
    List<Node> children = node.children();
    IndexSet group = ctx.groupOrUniverse(g);
    Node first = children.get(0);
    IndexSet[] parts;
    if (hasEvaluator(ctx, first)) {
      Value reserved = reserve(ctx, first, group.size());
      evaluate(ctx, first, group);
      parts = group.partition(first.value().group());
      release(ctx, reserved);
    } else {
      parts = group.partition(first.value().group());
    }
    IndexSet result = parts[0];
    IndexSet rest = parts[1];
    for (int k = 1; k < children.size() && !rest.isEmpty(); k++) {
      Node child = children.get(k);
      Value reserved = reserve(ctx, child, rest.size());
      evaluateIfPossible(ctx, child, rest);
      parts = rest.partition(child.value().group());
      release(ctx, reserved);
      result = result.mergeDisjoint(parts[0]);
      rest = parts[1];
    }
    node.value().setGroup(result);
  }

  /**
   * Reserves pool storage for the value of {@code node} if it is pooled, and returns the reserved
   * value (or null). The node may be folded to a constant before the reservation is released, so
   * the release must not depend on the node's flags.
   */
  private static @Nullable Value reserve(EvalContext ctx, Node node, int count) {
    if (!node.isPooled()) {
      return null;
    }
    Value value = node.value();
    ctx.pool().reserve(value, count);
    return value;
  }

  private static void release(EvalContext ctx, @Nullable Value reserved) {
    if (reserved != null) {
      ctx.pool().release(reserved);
    }
  }

  /**
   * Prepares the tree under {@code root} for a new frame: clears per-frame evaluation marks and the
   * accumulated groups of subexpressions, and schedules per-frame method hooks.
   */
  public static void beginFrame(Node root) {
    root.setEvaluatedThisFrame(false);
    switch (root.kind()) {
      case SUBEXPR -> root.setEvalGroup(IndexSet.EMPTY);
      case METHOD -> root.setInitFrame(root.call().method().hasInitFrame());
      case SUBEXPR_REF -> {
        return;
      }
      default -> {}
    }
    for (Node child : root.children()) {
      beginFrame(child);
    }
  }
}
