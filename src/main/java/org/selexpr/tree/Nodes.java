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
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.selexpr.compiler.InputInconsistencyError;
import org.selexpr.compiler.StructuralError;
import org.selexpr.method.CompareMethod;
import org.selexpr.method.MatchMethod;
import org.selexpr.method.MethodCall;
import org.selexpr.method.ParamSpec;
import org.selexpr.method.Parameter;
import org.selexpr.method.PlusModifier;
import org.selexpr.method.PositionsMethod;
import org.selexpr.method.SelectionMethod;
import org.selexpr.method.WithinMethod;
import org.selexpr.position.PositionType;
import org.selexpr.util.IndexSet;

/**
 * Static-only class for building uncompiled selection trees.
 *
 * <p>Each factory resolves the node's type and shape, checks its operands, and computes its
 * {@code dynamic} flag from its operands. A SUBEXPR passed as an operand (i.e. a variable created
 * with {@link #variable}) is replaced by a reference to it.
 */
public final class Nodes {

  // Statics only
  private Nodes() {}

  /** Returns a constant group. */
  public static Node group(IndexSet group) {
    return Node.constantGroup(group);
  }

  /** Returns an integer constant; more than one value gives a list (e.g. for {@link #match}). */
  public static Node integers(int... values) {
    return constant(ValueType.INTEGER, values.length, Value.ofInts(values));
  }

  public static Node reals(double... values) {
    return constant(ValueType.REAL, values.length, Value.ofReals(values));
  }

  public static Node strings(String... values) {
    return constant(ValueType.STRING, values.length, Value.ofStrings(values));
  }

  private static Node constant(ValueType type, int count, Value value) {
    Preconditions.checkArgument(count > 0, "Empty constant");
    Node node =
        new Node(NodeKind.CONSTANT, type, (count == 1) ? ValueShape.SINGLE : ValueShape.VARIABLE);
    node.setValue(value);
    return node;
  }

  public static Node and(Node... operands) {
    return bool(BoolOp.AND, operands);
  }

  public static Node or(Node... operands) {
    return bool(BoolOp.OR, operands);
  }

  public static Node not(Node operand) {
    return bool(BoolOp.NOT, operand);
  }

  /** Returns an exclusive-or; such trees can be built but not compiled. */
  public static Node xor(Node left, Node right) {
    return bool(BoolOp.XOR, left, right);
  }

  private static Node bool(BoolOp op, Node... operands) {
    Preconditions.checkArgument(
        (op == BoolOp.NOT) ? operands.length == 1 : operands.length >= 2,
        "Wrong number of operands for %s",
        op);
    Node node = new Node(NodeKind.BOOLEAN, ValueType.GROUP, ValueShape.SINGLE);
    node.setBoolOp(op);
    for (Node operand : operands) {
      operand = operand(operand);
      if (operand.type() != ValueType.GROUP) {
        throw StructuralError.wrongType("Operand of " + op, ValueType.GROUP, operand.type());
      }
      node.children().add(operand);
      node.setDynamic(node.isDynamic() || operand.isDynamic());
    }
    return node;
  }

  /**
   * Returns a binary arithmetic expression. Operand types are checked by the compiler, but the
   * operands must not be lists.
   */
  public static Node arith(ArithOp op, Node left, Node right) {
    Preconditions.checkArgument(op.arity() == 2, "%s is not a binary operator", op);
    return arithmetic(op, operand(left), operand(right));
  }

  public static Node negate(Node operand) {
    return arithmetic(ArithOp.NEGATE, operand(operand));
  }

  private static Node arithmetic(ArithOp op, Node... operands) {
    ValueShape shape = ValueShape.SINGLE;
    boolean dynamic = false;
    for (Node operand : operands) {
      if (operand.shape() == ValueShape.VARIABLE) {
        throw InputInconsistencyError.format(
            "Operand of '%s' must have a single value or one value per atom", op.symbol);
      } else if (operand.shape() == ValueShape.PER_ATOM) {
        shape = ValueShape.PER_ATOM;
      }
      dynamic |= operand.isDynamic();
    }
    Node node = new Node(NodeKind.ARITHMETIC, ValueType.REAL, shape);
    node.setArithOp(op);
    node.setDynamic(dynamic);
    node.children().addAll(List.of(operands));
    return node;
  }

  /**
   * Returns a call of {@code method}. Constant arguments are stored in the call directly; every
   * other argument becomes a SUBEXPR_REF child that supplies the parameter.
   */
  public static Node call(SelectionMethod method, Node... args) {
    ImmutableList<ParamSpec> specs = method.params();
    if (args.length != specs.size()) {
      throw StructuralError.format(
          "%s takes %s arguments, got %s", method.name(), specs.size(), args.length);
    }
    List<ValueType> argTypes = new ArrayList<>();
    for (int i = 0; i < args.length; i++) {
      ValueType type = args[i].type();
      if (!specs.get(i).accepts(type)) {
        throw StructuralError.format(
            "Argument '%s' of %s cannot be %s", specs.get(i).name(), method.name(), type);
      }
      argTypes.add(type);
    }
    method.checkArguments(argTypes);
    Node node =
        new Node(
            method.isModifier() ? NodeKind.MODIFIER : NodeKind.METHOD,
            method.type(),
            method.shape());
    boolean dynamic = method.isDynamic();
    ImmutableList.Builder<Parameter> params = ImmutableList.builder();
    for (int i = 0; i < args.length; i++) {
      Node arg = operand(args[i]);
      ParamSpec spec = specs.get(i);
      if (arg.kind() == NodeKind.CONSTANT) {
        params.add(Parameter.constant(spec, arg.value()));
        continue;
      }
      Node child = (arg.kind() == NodeKind.SUBEXPR_REF) ? arg : wrap(arg);
      Parameter param = Parameter.fromNode(spec, child);
      child.setParam(param);
      params.add(param);
      node.children().add(child);
      dynamic |= child.isDynamic();
    }
    node.setCall(new MethodCall(method, params.build()));
    node.setDynamic(dynamic);
    return node;
  }

  /** Returns a reference that owns {@code expression} until it is extracted by the compiler. */
  private static Node wrap(Node expression) {
    Node ref = new Node(NodeKind.SUBEXPR_REF, expression.type(), expression.shape());
    ref.setTarget(expression);
    ref.setDynamic(expression.isDynamic());
    return ref;
  }

  public static Node compare(CompareMethod.Op op, Node left, Node right) {
    return call(CompareMethod.of(op), left, right);
  }

  public static Node match(Node value, String... accepted) {
    return call(MatchMethod.INSTANCE, value, strings(accepted));
  }

  public static Node match(Node value, int... accepted) {
    return call(MatchMethod.INSTANCE, value, integers(accepted));
  }

  public static Node within(double cutoff, Node positions) {
    return call(WithinMethod.INSTANCE, reals(cutoff), positions);
  }

  /**
   * Returns the positions of {@code group}; if {@code type} is null the compiler supplies the
   * configured default.
   */
  public static Node positions(@Nullable PositionType type, Node group) {
    Node node = call(PositionsMethod.INSTANCE, group);
    node.call().setPositionType(type);
    return node;
  }

  public static Node plus(Node first, Node second) {
    return call(PlusModifier.INSTANCE, first, second);
  }

  /** Returns a user variable: a named SUBEXPR whose only pointer so far is its ROOT. */
  public static Node variable(String name, Node body) {
    return Node.subexpr(name, body, 1);
  }

  /**
   * Returns a reference to a variable. A variable whose value is a constant is substituted
   * directly.
   */
  public static Node ref(Node subexpr) {
    Preconditions.checkArgument(subexpr.kind() == NodeKind.SUBEXPR, "Not a variable: %s", subexpr);
    Node body = subexpr.child(0);
    if (body.kind() == NodeKind.CONSTANT) {
      Node copy = new Node(NodeKind.CONSTANT, body.type(), body.shape());
      copy.value().copyFrom(body.value());
      return copy;
    }
    subexpr.incrementRefCount();
    Node ref = new Node(NodeKind.SUBEXPR_REF, subexpr.type(), subexpr.shape());
    ref.setName(subexpr.name());
    ref.setTarget(subexpr);
    ref.setDynamic(subexpr.isDynamic());
    return ref;
  }

  /** Returns a reference to a group name that could not be resolved. */
  public static Node groupRef(String name) {
    Node node = new Node(NodeKind.GROUP_REF, ValueType.GROUP, ValueShape.SINGLE);
    node.setGroupName(name);
    return node;
  }

  private static Node operand(Node node) {
    return (node.kind() == NodeKind.SUBEXPR) ? ref(node) : node;
  }
}
