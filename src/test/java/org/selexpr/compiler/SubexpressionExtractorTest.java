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

import java.util.ArrayList;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.selexpr.method.AtomKeyword;
import org.selexpr.method.CompareMethod.Op;
import org.selexpr.tree.Node;
import org.selexpr.tree.NodeKind;
import org.selexpr.tree.Nodes;
import org.selexpr.util.IndexSet;

@RunWith(JUnit4.class)
public class SubexpressionExtractorTest {

  private static List<String> names(List<Node> roots) {
    List<String> result = new ArrayList<>();
    for (Node root : roots) {
      Node child = root.child(0);
      result.add((child.kind() == NodeKind.SUBEXPR) ? child.name() : root.name());
    }
    return result;
  }

  @Test
  public void methodArgumentsGetTheirOwnRoots() {
    Node compare = Nodes.compare(Op.LT, Nodes.call(AtomKeyword.INDEX), Nodes.integers(50));
    List<Node> roots = new ArrayList<>(List.of(Node.root("s", compare)));
    new SubexpressionExtractor().extract(roots);

    assertThat(names(roots)).containsExactly("SubExpr 1", "s").inOrder();
    Node subexpr = roots.get(0).child(0);
    assertThat(subexpr.refCount()).isEqualTo(2);
    assertThat(subexpr.child(0).call().method()).isSameInstanceAs(AtomKeyword.INDEX);
    Node ref = compare.child(0);
    assertThat(ref.target()).isSameInstanceAs(subexpr);
    assertThat(ref.name()).isEqualTo("SubExpr 1");
  }

  @Test
  public void innerSubexpressionsPrecedeTheirUsers() {
    Node compare = Nodes.compare(Op.LT, Nodes.call(AtomKeyword.INDEX), Nodes.integers(5));
    Node within = Nodes.within(1.0, Nodes.positions(null, compare));
    List<Node> roots = new ArrayList<>(List.of(Node.root("s", within)));
    new SubexpressionExtractor().extract(roots);

    assertThat(names(roots)).containsExactly("SubExpr 1", "SubExpr 2", "SubExpr 3", "s").inOrder();
    assertThat(roots.get(0).child(0).child(0).call().method()).isSameInstanceAs(AtomKeyword.INDEX);
    assertThat(roots.get(1).child(0).child(0)).isSameInstanceAs(compare);
  }

  @Test
  public void variablesAreNotExtractedAgain() {
    Node v = Nodes.variable("v", Nodes.call(AtomKeyword.INDEX));
    Node s = Node.root("s", Nodes.compare(Op.LT, v, Nodes.integers(5)));
    List<Node> roots = new ArrayList<>(List.of(Node.root(null, v), s));
    new SubexpressionExtractor().extract(roots);

    assertThat(roots).hasSize(2);
    assertThat(v.refCount()).isEqualTo(2);
    assertThat(s.child(0).child(0).target()).isSameInstanceAs(v);
  }

  @Test
  public void unusedVariablesArePrunedTransitively() {
    Node w = Nodes.variable("w", Nodes.call(AtomKeyword.INDEX));
    Node u = Nodes.variable("u", Nodes.compare(Op.LT, w, Nodes.integers(5)));
    Node used = Nodes.variable("used", Nodes.call(AtomKeyword.MASS));
    Node s = Node.root("s", Nodes.compare(Op.GT, used, Nodes.reals(12.5)));
    List<Node> roots =
        new ArrayList<>(List.of(Node.root(null, w), Node.root(null, u), Node.root(null, used), s));

    SubexpressionExtractor.pruneUnused(roots);

    assertThat(names(roots)).containsExactly("used", "s").inOrder();
    assertThat(w.refCount()).isEqualTo(1);
  }

  @Test
  public void constantVariablesAreInlined() {
    Node v = Nodes.variable("v", Nodes.group(IndexSet.of(1, 2)));
    Node ref = Nodes.ref(v);
    assertThat(ref.kind()).isEqualTo(NodeKind.CONSTANT);
    assertThat(ref.value().group()).isEqualTo(IndexSet.of(1, 2));
    assertThat(v.refCount()).isEqualTo(1);
  }
}
