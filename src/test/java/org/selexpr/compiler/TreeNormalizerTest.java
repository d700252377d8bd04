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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.selexpr.TestSystems.BelowMethod;
import org.selexpr.method.AtomKeyword;
import org.selexpr.tree.ArithOp;
import org.selexpr.tree.BoolOp;
import org.selexpr.tree.Node;
import org.selexpr.tree.NodeKind;
import org.selexpr.tree.Nodes;
import org.selexpr.tree.ValueType;
import org.selexpr.util.IndexSet;

@RunWith(JUnit4.class)
public class TreeNormalizerTest {

  private static Node dynamic(int limit) {
    return Nodes.call(new BelowMethod(limit));
  }

  @Test
  public void nestedAndsAreMerged() {
    Node a = dynamic(10);
    Node b = dynamic(20);
    Node c = dynamic(30);
    Node root = Node.root("s", Nodes.and(a, Nodes.and(b, c)));
    TreeNormalizer.normalize(root);
    Node and = root.child(0);
    assertThat(and.boolOp()).isEqualTo(BoolOp.AND);
    assertThat(and.children()).containsExactly(a, b, c).inOrder();
  }

  @Test
  public void orInsideAndIsKept() {
    Node a = dynamic(10);
    Node or = Nodes.or(dynamic(20), dynamic(30));
    Node root = Node.root("s", Nodes.and(a, or));
    TreeNormalizer.normalize(root);
    assertThat(root.child(0).children()).containsExactly(a, or).inOrder();
  }

  @Test
  public void doubleNegationIsRemoved() {
    Node x = dynamic(10);
    Node root = Node.root("s", Nodes.not(Nodes.not(x)));
    TreeNormalizer.normalize(root);
    assertThat(root.child(0)).isSameInstanceAs(x);
  }

  @Test
  public void tripleNegationLeavesOne() {
    Node x = dynamic(10);
    Node root = Node.root("s", Nodes.not(Nodes.not(Nodes.not(x))));
    TreeNormalizer.normalize(root);
    Node not = root.child(0);
    assertThat(not.boolOp()).isEqualTo(BoolOp.NOT);
    assertThat(not.child(0)).isSameInstanceAs(x);
  }

  @Test
  public void staticOperandsMoveFirst() {
    Node d1 = dynamic(10);
    Node s1 = Nodes.group(IndexSet.of(1));
    Node d2 = dynamic(20);
    Node s2 = Nodes.group(IndexSet.of(2));
    Node root = Node.root("s", Nodes.or(d1, s1, d2, s2));
    TreeNormalizer.normalize(root);
    assertThat(root.child(0).children()).containsExactly(s1, s2, d1, d2).inOrder();
  }

  @Test
  public void staticBooleansAreNotReordered() {
    Node s1 = Nodes.group(IndexSet.of(1));
    Node s2 = Nodes.group(IndexSet.of(2));
    Node root = Node.root("s", Nodes.and(s2, s1));
    TreeNormalizer.normalize(root);
    assertThat(root.child(0).children()).containsExactly(s2, s1).inOrder();
  }

  @Test
  public void integerConstantsInArithmeticBecomeReal() {
    Node two = Nodes.integers(2);
    Node root = Node.root(null, Nodes.arith(ArithOp.PLUS, Nodes.call(AtomKeyword.MASS), two));
    TreeNormalizer.normalize(root);
    assertThat(two.type()).isEqualTo(ValueType.REAL);
    assertThat(two.kind()).isEqualTo(NodeKind.CONSTANT);
    assertThat(two.value().realAt(0)).isEqualTo(2.0);
  }

  @Test
  public void integerExpressionsInArithmeticAreRejected() {
    Node root =
        Node.root(null, Nodes.arith(ArithOp.PLUS, Nodes.call(AtomKeyword.INDEX), Nodes.reals(1)));
    assertThrows(InputInconsistencyError.class, () -> TreeNormalizer.normalize(root));
  }
}
