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

package org.selexpr.tree;

import com.google.common.base.Preconditions;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.selexpr.method.MethodCall;
import org.selexpr.method.Parameter;
import org.selexpr.position.PositionCalculator;
import org.selexpr.util.IndexSet;

/**
 * A node in a selection tree.
 *
 * <p>All node kinds share this one class because the compiler rewrites nodes in place: a method
 * call whose value turns out not to vary between frames becomes a CONSTANT without its parent
 * noticing, and a SUBEXPR_REF may become a CONSTANT once its value has been computed.
 *
 * <p>Ownership is strictly tree-shaped: a node owns its {@link #children}. The one exception is
 * {@link #target} on a SUBEXPR_REF, which points (without owning) at a SUBEXPR owned by some
 * ROOT; the SUBEXPR's {@link #refCount} counts its ROOT plus each reference. Before
 * subexpression extraction a SUBEXPR_REF's target may be an arbitrary expression node that the
 * reference does own; extraction moves such expressions under a new ROOT.
 */
public final class Node {
  private NodeKind kind;
  private @Nullable String name;
  private ValueType type;
  private final ValueShape shape;

  /** True if this node's value may be different in different frames. */
  private boolean dynamic;

  private final List<Node> children = new ArrayList<>();
  private Value value;

  private @Nullable BoolOp boolOp;
  private @Nullable ArithOp arithOp;
  private @Nullable MethodCall call;

  /** For SUBEXPR_REF nodes, the referenced node. */
  private @Nullable Node target;

  /** For SUBEXPR_REF nodes that supply a method parameter, the parameter. */
  private @Nullable Parameter param;

  /** For SUBEXPR nodes, the number of ROOTs and SUBEXPR_REFs pointing at this node. */
  private int refCount;

  /** For GROUP_REF nodes, the name that could not be resolved. */
  private @Nullable String groupName;

  private @Nullable EvalTag evalTag;

  /**
   * For ROOT nodes, the group the child is evaluated with; for SUBEXPR nodes, the atoms for which
   * the value has been computed in the current frame; for group-valued CONSTANT nodes, the
   * constant.
   */
  private IndexSet evalGroup = IndexSet.EMPTY;

  /** For ROOT nodes, true if the child is evaluated without a group. */
  private boolean evalWithoutGroup;

  private boolean pooled;
  private boolean initFrame;
  private boolean evaluatedThisFrame;
  private @Nullable CompileAnalysis analysis;
  private @Nullable PositionCalculator positionCalculator;
  private @Nullable Storage storage;

  Node(NodeKind kind, ValueType type, ValueShape shape) {
    this.kind = kind;
    this.type = type;
    this.shape = shape;
    this.value = Value.of(type);
  }

  /** Creates a ROOT node with the given child. */
  public static Node root(@Nullable String name, Node child) {
    Node root = new Node(NodeKind.ROOT, ValueType.NONE, ValueShape.SINGLE);
    root.name = name;
    root.children.add(child);
    return root;
  }

  /**
   * Creates a SUBEXPR node wrapping {@code body}; {@code refCount} is the number of existing
   * pointers (ROOT or references) to it.
   */
  public static Node subexpr(@Nullable String name, Node body, int refCount) {
    Node subexpr = new Node(NodeKind.SUBEXPR, body.type, body.shape);
    subexpr.name = name;
    subexpr.dynamic = body.dynamic;
    subexpr.refCount = refCount;
    subexpr.children.add(body);
    return subexpr;
  }

  /** Creates a group-valued CONSTANT. */
  public static Node constantGroup(IndexSet group) {
    Node constant = new Node(NodeKind.CONSTANT, ValueType.GROUP, ValueShape.SINGLE);
    constant.value = Value.ofGroup(group);
    return constant;
  }

  public NodeKind kind() {
    return kind;
  }

  public @Nullable String name() {
    return name;
  }

  public void setName(@Nullable String name) {
    this.name = name;
  }

  public ValueType type() {
    return type;
  }

  public ValueShape shape() {
    return shape;
  }

  public boolean isDynamic() {
    return dynamic;
  }

  public void setDynamic(boolean dynamic) {
    this.dynamic = dynamic;
  }

  /** Returns this node's children; the list is modified directly by compiler passes. */
  public List<Node> children() {
    return children;
  }

  public Node child(int i) {
    return children.get(i);
  }

  public Value value() {
    return value;
  }

  /** Makes this node's value {@code value}, which may be shared with other nodes. */
  public void setValue(Value value) {
    Preconditions.checkArgument(value.type() == type, "Expected %s, got %s", type, value.type());
    this.value = value;
  }

  public @Nullable BoolOp boolOp() {
    return boolOp;
  }

  public @Nullable ArithOp arithOp() {
    return arithOp;
  }

  public @Nullable MethodCall call() {
    return call;
  }

  public @Nullable Node target() {
    return target;
  }

  public void setTarget(@Nullable Node target) {
    this.target = target;
  }

  public @Nullable Parameter param() {
    return param;
  }

  public void setParam(@Nullable Parameter param) {
    this.param = param;
  }

  public int refCount() {
    return refCount;
  }

  @CanIgnoreReturnValue
  public int incrementRefCount() {
    Preconditions.checkState(kind == NodeKind.SUBEXPR);
    return ++refCount;
  }

  @CanIgnoreReturnValue
  public int decrementRefCount() {
    Preconditions.checkState(kind == NodeKind.SUBEXPR && refCount > 0);
    return --refCount;
  }

  public @Nullable String groupName() {
    return groupName;
  }

  public @Nullable EvalTag evalTag() {
    return evalTag;
  }

  public void setEvalTag(@Nullable EvalTag evalTag) {
    this.evalTag = evalTag;
  }

  public IndexSet evalGroup() {
    return evalGroup;
  }

  public void setEvalGroup(IndexSet evalGroup) {
    this.evalGroup = evalGroup;
  }

  public boolean evalWithoutGroup() {
    return evalWithoutGroup;
  }

  public void setEvalWithoutGroup(boolean evalWithoutGroup) {
    this.evalWithoutGroup = evalWithoutGroup;
  }

  /** True if this node's value is reserved from the memory pool by its parent. */
  public boolean isPooled() {
    return pooled;
  }

  public void setPooled(boolean pooled) {
    this.pooled = pooled;
  }

  /** For METHOD nodes, true if the method's per-frame hook must run before the next update. */
  public boolean needsInitFrame() {
    return initFrame;
  }

  public void setInitFrame(boolean initFrame) {
    this.initFrame = initFrame;
  }

  /** True if this node has already been evaluated (without a group) in the current frame. */
  public boolean evaluatedThisFrame() {
    return evaluatedThisFrame;
  }

  public void setEvaluatedThisFrame(boolean evaluatedThisFrame) {
    this.evaluatedThisFrame = evaluatedThisFrame;
  }

  public @Nullable CompileAnalysis analysis() {
    return analysis;
  }

  public void setAnalysis(@Nullable CompileAnalysis analysis) {
    this.analysis = analysis;
  }

  public @Nullable PositionCalculator positionCalculator() {
    return positionCalculator;
  }

  public void setPositionCalculator(@Nullable PositionCalculator positionCalculator) {
    this.positionCalculator = positionCalculator;
  }

  public @Nullable Storage storage() {
    return storage;
  }

  public void setStorage(@Nullable Storage storage) {
    this.storage = storage;
  }

  /**
   * Turns this node into a CONSTANT holding its current value. The caller is responsible for
   * releasing the children first.
   */
  public void convertToConstant() {
    kind = NodeKind.CONSTANT;
    name = null;
    children.clear();
    call = null;
    target = null;
    boolOp = null;
    arithOp = null;
    pooled = false;
    positionCalculator = null;
    if (type == ValueType.GROUP) {
      evalTag = EvalTag.STATIC;
      evalGroup = value.group();
    } else {
      evalTag = null;
      evalGroup = IndexSet.EMPTY;
    }
  }

  /** Converts an INTEGER constant to a REAL constant with the same values. */
  public void convertIntegerConstantToReal() {
    Preconditions.checkState(kind == NodeKind.CONSTANT && type == ValueType.INTEGER);
    double[] reals = new double[value.count()];
    for (int i = 0; i < reals.length; i++) {
      reals[i] = value.intAt(i);
    }
    type = ValueType.REAL;
    value = Value.ofReals(reals);
  }

  /** Returns a short description of this node, e.g. "BOOLEAN AND" or "SUBEXPR \"SubExpr 1\"". */
  public String describe() {
    StringBuilder sb = new StringBuilder(kind.name());
    switch (kind) {
      case BOOLEAN -> sb.append(' ').append(boolOp);
      case ARITHMETIC -> sb.append(' ').append(arithOp.symbol);
      case METHOD, MODIFIER -> sb.append(' ').append(call.method().name());
      case CONSTANT -> sb.append(' ').append(value);
      case GROUP_REF -> sb.append(" '").append(groupName).append('\'');
      default -> {}
    }
    if (name != null) {
      sb.append(" \"").append(name).append('"');
    }
    return sb.toString();
  }

  @Override
  public String toString() {
    return describe();
  }

  // Package-private setters used by Nodes while building trees.

  void setBoolOp(BoolOp boolOp) {
    this.boolOp = boolOp;
  }

  void setArithOp(ArithOp arithOp) {
    this.arithOp = arithOp;
  }

  void setCall(MethodCall call) {
    this.call = call;
  }

  void setGroupName(String groupName) {
    this.groupName = groupName;
  }

  void setRefCount(int refCount) {
    this.refCount = refCount;
  }
}
