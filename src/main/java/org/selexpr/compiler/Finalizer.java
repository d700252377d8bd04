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

import org.selexpr.method.MethodCall;
import org.selexpr.position.PositionCalculator;
import org.selexpr.position.PositionType;
import org.selexpr.position.Topology;
import org.selexpr.tree.CompileAnalysis;
import org.selexpr.tree.CompileFlag;
import org.selexpr.tree.EvalTag;
import org.selexpr.tree.Node;
import org.selexpr.tree.NodeKind;
import org.selexpr.tree.ValueShape;
import org.selexpr.tree.ValueType;
import org.selexpr.util.IndexSet;

/** Static-only class with the passes that prepare an analyzed chain for per-frame evaluation. */
final class Finalizer {

  // Statics only
  private Finalizer() {}

  /** Sets the group a ROOT evaluates its child with. */
  static void initRoot(Node root, IndexSet universe) {
    Node child = root.child(0);
    CompileAnalysis analysis = child.analysis();
    if (child.kind() == NodeKind.SUBEXPR
        && (!analysis.has(CompileFlag.STATIC_EVAL)
            || (analysis.has(CompileFlag.SIMPLE_SUBEXPR)
                && !analysis.has(CompileFlag.FULL_EVAL)))) {
      // Evaluated only through its references
      root.setEvalTag(null);
      root.setEvalGroup(IndexSet.EMPTY);
    } else if (child.shape() == ValueShape.VARIABLE
        || (child.shape() == ValueShape.SINGLE && child.type() != ValueType.GROUP)) {
      root.setEvalWithoutGroup(true);
    } else {
      IndexSet max = FlagPropagator.maxOf(child, universe);
      root.setEvalGroup((max.size() == universe.size()) ? universe : max);
    }
  }

  /**
   * Switches common subexpressions that are always evaluated with the same group to
   * once-per-frame evaluation.
   */
  static void postprocessSubexprs(Node node) {
    if (node.kind() == NodeKind.SUBEXPR_REF) {
      return;
    }
    for (Node child : node.children()) {
      postprocessSubexprs(child);
    }
    CompileAnalysis analysis = node.analysis();
    if (node.kind() == NodeKind.SUBEXPR
        && node.refCount() > 2
        && analysis.has(CompileFlag.STATIC_EVAL)
        && !analysis.has(CompileFlag.FULL_EVAL)) {
      Node body = node.child(0);
      node.setEvalTag(EvalTag.SUBEXPR_STATIC_EVAL);
      node.setEvalGroup(IndexSet.EMPTY);
      body.setPooled(false);
      node.setValue(body.value());
    }
  }

  /** Gives each method that works on positions a calculator for its maximal group. */
  static void initPositionCalculators(
      Node node, Topology topology, IndexSet universe, PositionType referenceType) {
    if (node.kind() == NodeKind.SUBEXPR_REF) {
      return;
    }
    for (Node child : node.children()) {
      initPositionCalculators(child, topology, universe, referenceType);
    }
    if (node.kind() != NodeKind.METHOD || !node.call().method().requiresPositions()) {
      return;
    }
    MethodCall call = node.call();
    PositionType type = (call.positionType() != null) ? call.positionType() : referenceType;
    PositionCalculator calculator = new PositionCalculator(type, topology);
    calculator.setDynamic(!node.analysis().has(CompileFlag.STATIC_EVAL));
    calculator.setMaxGroup(FlagPropagator.maxOf(node, universe));
    calculator.setEvaluateVelocities(call.evaluateVelocities());
    calculator.setEvaluateForces(call.evaluateForces());
    node.setPositionCalculator(calculator);
  }

  /** Discards the compile-time state of every node below {@code node}. */
  static void freeAnalysis(Node node) {
    node.setAnalysis(null);
    if (node.kind() == NodeKind.SUBEXPR_REF) {
      return;
    }
    for (Node child : node.children()) {
      freeAnalysis(child);
    }
  }
}
