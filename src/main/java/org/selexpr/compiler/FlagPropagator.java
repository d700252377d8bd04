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
import org.jspecify.annotations.Nullable;
import org.selexpr.method.Parameter;
import org.selexpr.tree.BoolOp;
import org.selexpr.tree.CompileAnalysis;
import org.selexpr.tree.CompileFlag;
import org.selexpr.tree.EvalTag;
import org.selexpr.tree.Node;
import org.selexpr.tree.NodeKind;
import org.selexpr.tree.ValueShape;
import org.selexpr.tree.ValueType;
import org.selexpr.util.IndexSet;

/**
 * Static-only class with the passes that assign evaluation tags, pooling, compile flags, output
 * sharing and bounds to each node before static analysis.
 *
 * <p>Unless noted otherwise each pass walks the tree below a ROOT without following SUBEXPR_REF
 * targets; those are reached from their own ROOTs, which precede every reference in the chain.
 */
final class FlagPropagator {

  // Statics only
  private FlagPropagator() {}

  /** Assigns each node's {@link EvalTag}. */
  static void initEvalTags(Node node) {
    switch (node.kind()) {
      case CONSTANT -> {
        if (node.type() == ValueType.GROUP) {
          node.setEvalTag(EvalTag.STATIC);
          node.setEvalGroup(node.value().group());
        }
      }
      case METHOD -> {
        node.setEvalTag(EvalTag.METHOD);
        if (!node.isDynamic() && node.call().method().hasInitFrame()) {
          node.setInitFrame(true);
        }
      }
      case MODIFIER -> node.setEvalTag(EvalTag.MODIFIER);
      case ARITHMETIC -> node.setEvalTag(EvalTag.ARITHMETIC);
      case BOOLEAN ->
          node.setEvalTag(
              switch (node.boolOp()) {
                case NOT -> EvalTag.NOT;
                case AND -> EvalTag.AND;
                case OR -> EvalTag.OR;
                case XOR ->
                    throw UnsupportedOperationError.format("XOR expressions are not supported");
              });
      case ROOT -> node.setEvalTag(EvalTag.ROOT);
      case SUBEXPR ->
          node.setEvalTag((node.refCount() == 2) ? EvalTag.SUBEXPR_SIMPLE : EvalTag.SUBEXPR);
      case SUBEXPR_REF -> {
        Node target = node.target();
        node.setName(target.name());
        node.setEvalTag(
            (target.refCount() == 2) ? EvalTag.SUBEXPR_REF_SIMPLE : EvalTag.SUBEXPR_REF);
        return;
      }
      case GROUP_REF -> throw StructuralError.unresolvedReference(node.groupName());
    }
    for (Node child : node.children()) {
      initEvalTags(child);
    }
  }

  /** Marks the nodes whose values are reserved from the memory pool by their parent. */
  static void setupMemoryPooling(Node node) {
    if (node.kind() == NodeKind.SUBEXPR_REF) {
      return;
    }
    for (Node child : node.children()) {
      boolean pooled =
          switch (node.kind()) {
            case BOOLEAN -> child.isDynamic() && child.kind() != NodeKind.CONSTANT;
            case ARITHMETIC ->
                child.kind() != NodeKind.CONSTANT && child.shape() != ValueShape.SINGLE;
            case SUBEXPR -> node.refCount() > 2;
            default -> false;
          };
      if (pooled) {
        child.setPooled(true);
        // A simple reference shares its value with the body it refers to
        if (child.kind() == NodeKind.SUBEXPR_REF && child.target().refCount() == 2) {
          child.target().child(0).setPooled(true);
        }
      }
      setupMemoryPooling(child);
    }
  }

  /** Attaches a {@link CompileAnalysis} to each node and sets the initial flags. */
  static void initAnalysis(Node node) {
    CompileAnalysis analysis = new CompileAnalysis(node);
    node.setAnalysis(analysis);
    analysis.set(CompileFlag.STATIC_EVAL);
    if (!node.isDynamic()) {
      analysis.set(CompileFlag.STATIC);
    }
    if (node.kind() == NodeKind.SUBEXPR) {
      analysis.set(CompileFlag.EVAL_MAX);
    }
    // Subexpressions whose values are needed independent of any group are evaluated in full
    if (node.kind() == NodeKind.METHOD || node.kind() == NodeKind.MODIFIER) {
      for (Node child : node.children()) {
        if (!isPerAtomParam(child) && child.target() != null) {
          child.target().analysis().set(CompileFlag.FULL_EVAL);
        }
      }
    } else if (node.kind() == NodeKind.ROOT
        && node.child(0).kind() == NodeKind.SUBEXPR_REF) {
      node.child(0).target().analysis().set(CompileFlag.FULL_EVAL);
    }
    if (node.kind() == NodeKind.SUBEXPR_REF) {
      return;
    }
    for (Node child : node.children()) {
      initAnalysis(child);
    }
    switch (node.kind()) {
      case BOOLEAN -> {
        for (Node child : node.children()) {
          if (node.boolOp() == BoolOp.AND) {
            child.analysis().set(CompileFlag.EVAL_MAX);
          } else if (child.kind() == NodeKind.BOOLEAN && child.boolOp() == BoolOp.NOT) {
            child.child(0).analysis().set(CompileFlag.EVAL_MAX);
          }
        }
      }
      case METHOD, MODIFIER, SUBEXPR -> {
        for (Node child : node.children()) {
          child.analysis().set(CompileFlag.EVAL_MAX);
        }
      }
      default -> {}
    }
  }

  /**
   * Clears STATIC_EVAL on every node that may be evaluated with different groups in different
   * frames.
   */
  static void initStaticEval(Node node) {
    CompileAnalysis analysis = node.analysis();
    if (node.kind() == NodeKind.SUBEXPR_REF
        && node.target().analysis().has(CompileFlag.FULL_EVAL)) {
      return;
    }
    if (!analysis.has(CompileFlag.STATIC_EVAL)) {
      boolean isCall = node.kind() == NodeKind.METHOD || node.kind() == NodeKind.MODIFIER;
      for (Node child : analysisChildren(node)) {
        if ((!isCall || isPerAtomParam(child))
            && child.analysis().has(CompileFlag.STATIC_EVAL)) {
          clearStaticEval(child);
          initStaticEval(child);
        }
      }
    } else {
      if (node.kind() == NodeKind.BOOLEAN) {
        // Operands after the first dynamic one are evaluated for what remains of the group
        boolean seenDynamic = false;
        for (Node child : node.children()) {
          if (seenDynamic) {
            clearStaticEval(child);
          }
          seenDynamic |= child.isDynamic();
        }
      }
      for (Node child : analysisChildren(node)) {
        initStaticEval(child);
      }
    }
  }

  private static void clearStaticEval(Node node) {
    CompileAnalysis analysis = node.analysis();
    analysis.clear(CompileFlag.STATIC_EVAL);
    if (!canFold(node)) {
      analysis.clear(CompileFlag.STATIC);
    }
  }

  /**
   * Returns true if the node could be replaced by its value once evaluated. Per-atom values are
   * only valid for the group they were computed for, so they can't be folded unless that group
   * is fixed.
   */
  private static boolean canFold(Node node) {
    return !node.isDynamic()
        && (node.analysis().has(CompileFlag.STATIC_EVAL)
            || node.type() == ValueType.GROUP
            || node.shape() != ValueShape.PER_ATOM);
  }

  /** Classifies subexpressions (and the nodes inside them) as simple or common. */
  static void initSubexprFlags(Node node) {
    CompileAnalysis analysis = node.analysis();
    if (node.kind() == NodeKind.SUBEXPR) {
      if (node.refCount() == 2) {
        analysis.set(CompileFlag.SIMPLE_SUBEXPR);
      } else if (!analysis.has(CompileFlag.FULL_EVAL)) {
        analysis.set(CompileFlag.COMMON_SUBEXPR);
      }
    } else if (node.kind() == NodeKind.SUBEXPR_REF && node.target().refCount() == 2) {
      analysis.set(CompileFlag.SIMPLE_SUBEXPR);
    }
    // References are only followed to propagate the common flag
    if (node.kind() == NodeKind.SUBEXPR_REF
        && !(analysis.has(CompileFlag.COMMON_SUBEXPR) && node.target().refCount() > 2)) {
      return;
    }
    boolean common = analysis.has(CompileFlag.COMMON_SUBEXPR);
    for (Node child : analysisChildren(node)) {
      if (!child.analysis().has(CompileFlag.COMMON_SUBEXPR)) {
        if (common && (node.kind() != NodeKind.METHOD || isPerAtomParam(child))) {
          child.analysis().set(CompileFlag.COMMON_SUBEXPR);
        }
        initSubexprFlags(child);
      }
    }
  }

  /**
   * Makes subexpressions that don't need their own storage share the value of their body, and
   * switches subexpressions evaluated in full to once-per-frame evaluation.
   */
  static void initEvalOutput(Node node) {
    if (node.kind() != NodeKind.SUBEXPR_REF) {
      for (Node child : node.children()) {
        initEvalOutput(child);
      }
    }
    if (node.kind() == NodeKind.SUBEXPR) {
      Node body = node.child(0);
      if (node.refCount() == 2) {
        node.setValue(body.value());
      } else if (node.analysis().has(CompileFlag.FULL_EVAL)) {
        node.setEvalTag(EvalTag.SUBEXPR_STATIC_EVAL);
        body.setPooled(false);
        node.setValue(body.value());
      }
    } else if (node.kind() == NodeKind.SUBEXPR_REF && node.target().refCount() == 2) {
      Node target = node.target();
      Node body = target.child(0);
      node.setValue(body.value());
      target.setValue(body.value());
    }
  }

  /** Decides where each node's min/max groups come from. */
  static void initMinMax(Node node) {
    if (node.kind() != NodeKind.SUBEXPR_REF) {
      for (Node child : node.children()) {
        initMinMax(child);
      }
    }
    if (node.kind() == NodeKind.ROOT || node.type() == ValueType.NONE) {
      return;
    }
    CompileAnalysis analysis = node.analysis();
    if (node.type() == ValueType.GROUP && analysis.has(CompileFlag.STATIC)) {
      analysis.aliasBoundsToValue();
    } else if (node.kind() == NodeKind.SUBEXPR
        && (analysis.has(CompileFlag.SIMPLE_SUBEXPR) || analysis.has(CompileFlag.FULL_EVAL))) {
      analysis.aliasBoundsToChild();
    } else {
      analysis.allocateBounds();
    }
  }

  /**
   * Sets the evaluation group of each ROOT: the universe, except for subexpressions that are only
   * evaluated when referenced.
   */
  static void initEvalGroups(List<Node> roots, IndexSet universe) {
    for (Node root : roots) {
      Node child = root.child(0);
      if (child.kind() != NodeKind.SUBEXPR || child.analysis().has(CompileFlag.FULL_EVAL)) {
        root.setEvalGroup(universe);
      } else {
        root.setEvalGroup(IndexSet.EMPTY);
      }
    }
  }

  /**
   * Marks a common subexpression and everything evaluated with it as dynamic (so that nothing is
   * folded while its final group is unknown), or restores the static flags.
   */
  static void markSubexprDynamic(Node node, boolean dynamic) {
    CompileAnalysis analysis = node.analysis();
    if (!dynamic && canFold(node)) {
      analysis.set(CompileFlag.STATIC);
    } else {
      analysis.clear(CompileFlag.STATIC);
    }
    for (Node child : analysisChildren(node)) {
      if (node.kind() != NodeKind.METHOD
          || child.kind() != NodeKind.SUBEXPR_REF
          || isPerAtomParam(child)) {
        markSubexprDynamic(child, dynamic);
      }
    }
  }

  /** Sets the analysis dispatch of every node below {@code node}. */
  static void setDispatch(Node node, CompileAnalysis.Dispatch dispatch) {
    CompileAnalysis analysis = node.analysis();
    if (analysis != null) {
      analysis.setDispatch(dispatch);
    }
    if (node.kind() != NodeKind.SUBEXPR_REF) {
      for (Node child : node.children()) {
        setDispatch(child, dispatch);
      }
    }
  }

  /** Clears the marks left by evaluations with a null group. */
  static void clearEvaluated(Node node) {
    node.setEvaluatedThisFrame(false);
    if (node.kind() != NodeKind.SUBEXPR_REF) {
      for (Node child : node.children()) {
        clearEvaluated(child);
      }
    }
  }

  /** The nodes the analysis passes visit below {@code node}: a reference's target, or children. */
  static List<Node> analysisChildren(Node node) {
    if (node.kind() == NodeKind.SUBEXPR_REF) {
      return List.of(node.target());
    }
    return node.children();
  }

  /** True if {@code node} supplies a method parameter with one value per atom. */
  static boolean isPerAtomParam(Node node) {
    Parameter param = node.param();
    return param != null && param.isPerAtom();
  }

  /** Returns the node's minimal group; nodes without bounds count as empty. */
  static IndexSet minOf(Node node) {
    CompileAnalysis analysis = node.analysis();
    @Nullable IndexSet min = (analysis == null) ? null : analysis.minGroup();
    return (min == null) ? IndexSet.EMPTY : min;
  }

  /** Returns the node's maximal group; nodes without bounds count as {@code universe}. */
  static IndexSet maxOf(Node node, IndexSet universe) {
    CompileAnalysis analysis = node.analysis();
    @Nullable IndexSet max = (analysis == null) ? null : analysis.maxGroup();
    return (max == null) ? universe : max;
  }
}
