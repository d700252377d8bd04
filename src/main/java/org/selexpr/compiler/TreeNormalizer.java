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
import org.selexpr.tree.BoolOp;
import org.selexpr.tree.Node;
import org.selexpr.tree.NodeKind;
import org.selexpr.tree.ValueType;

/** Static-only class with the rewrites applied to each tree before flags are assigned. */
final class TreeNormalizer {

  // Statics only
  private TreeNormalizer() {}

  /** Applies all the rewrites to the tree below {@code root}. */
  static void normalize(Node root) {
    optimizeBooleans(root);
    reorderStaticFirst(root);
    coerceArithmetic(root);
  }

  /**
   * Removes double negations and merges nested ANDs (or ORs) into their parent. References are
   * not followed.
   */
  static void optimizeBooleans(Node node) {
    List<Node> children = node.children();
    for (int i = 0; i < children.size(); i++) {
      Node child = children.get(i);
      optimizeBooleans(child);
      if (isNot(child) && isNot(child.child(0))) {
        children.set(i, child.child(0).child(0));
      }
    }
    if (node.kind() != NodeKind.BOOLEAN || node.boolOp() == BoolOp.NOT) {
      return;
    }
    for (int i = 0; i < children.size(); i++) {
      Node child = children.get(i);
      if (child.kind() == NodeKind.BOOLEAN && child.boolOp() == node.boolOp()) {
        children.remove(i);
        children.addAll(i, child.children());
        i += child.children().size() - 1;
      }
    }
  }

  private static boolean isNot(Node node) {
    return node.kind() == NodeKind.BOOLEAN && node.boolOp() == BoolOp.NOT;
  }

  /**
   * Moves the static operands of every dynamic AND and OR in front of the dynamic ones, keeping
   * the relative order within each.
   */
  static void reorderStaticFirst(Node node) {
    List<Node> children = node.children();
    for (Node child : children) {
      reorderStaticFirst(child);
    }
    if (node.kind() != NodeKind.BOOLEAN || node.boolOp() == BoolOp.NOT || !node.isDynamic()) {
      return;
    }
    int cursor = 0;
    for (int i = 0; i < children.size(); i++) {
      if (!children.get(i).isDynamic()) {
        if (i != cursor) {
          children.add(cursor, children.remove(i));
        }
        cursor++;
      }
    }
  }

  /** Converts integer constants used in arithmetic to reals. */
  static void coerceArithmetic(Node node) {
    for (Node child : node.children()) {
      coerceArithmetic(child);
    }
    if (node.kind() != NodeKind.ARITHMETIC) {
      return;
    }
    for (Node child : node.children()) {
      if (child.type() == ValueType.INTEGER) {
        if (child.kind() != NodeKind.CONSTANT) {
          throw InputInconsistencyError.format(
              "Integer operand of '%s' must be a constant: %s",
              node.arithOp().symbol,
              child.describe());
        }
        child.convertIntegerConstantToReal();
      } else if (child.type() != ValueType.REAL) {
        throw StructuralError.format(
            "Internal error: operand of '%s' has type %s", node.arithOp().symbol, child.type());
      }
    }
  }
}
