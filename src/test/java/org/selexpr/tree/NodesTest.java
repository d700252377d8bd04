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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.selexpr.compiler.InputInconsistencyError;
import org.selexpr.compiler.StructuralError;
import org.selexpr.method.AtomKeyword;
import org.selexpr.method.CompareMethod.Op;
import org.selexpr.method.CoordinateKeyword;
import org.selexpr.method.Parameter;
import org.selexpr.util.IndexSet;

@RunWith(JUnit4.class)
public class NodesTest {

  @Test
  public void constantShapes() {
    assertThat(Nodes.reals(1.5).shape()).isEqualTo(ValueShape.SINGLE);
    assertThat(Nodes.integers(1, 2, 3).shape()).isEqualTo(ValueShape.VARIABLE);
    assertThat(Nodes.group(IndexSet.of(1, 2)).shape()).isEqualTo(ValueShape.SINGLE);
    assertThrows(IllegalArgumentException.class, () -> Nodes.strings());
  }

  @Test
  public void booleanOperandsMustBeGroups() {
    StructuralError e =
        assertThrows(
            StructuralError.class,
            () -> Nodes.and(Nodes.group(IndexSet.of(1)), Nodes.call(AtomKeyword.MASS)));
    assertThat(e).hasMessageThat().contains("expected GROUP");
  }

  @Test
  public void booleanDynamicIfAnyOperandIs() {
    Node x = Nodes.call(CoordinateKeyword.X);
    assertThat(x.isDynamic()).isTrue();
    Node slab = Nodes.compare(Op.LT, x, Nodes.reals(1));
    assertThat(Nodes.and(Nodes.group(IndexSet.of(1)), slab).isDynamic()).isTrue();
    assertThat(Nodes.not(Nodes.group(IndexSet.of(1))).isDynamic()).isFalse();
  }

  @Test
  public void arithmeticShape() {
    Node perAtom = Nodes.arith(ArithOp.PLUS, Nodes.call(AtomKeyword.MASS), Nodes.reals(1));
    assertThat(perAtom.shape()).isEqualTo(ValueShape.PER_ATOM);
    assertThat(perAtom.type()).isEqualTo(ValueType.REAL);
    assertThat(Nodes.negate(Nodes.reals(2)).shape()).isEqualTo(ValueShape.SINGLE);
    assertThrows(
        InputInconsistencyError.class,
        () -> Nodes.arith(ArithOp.PLUS, Nodes.reals(1, 2), Nodes.reals(3)));
    assertThrows(
        IllegalArgumentException.class,
        () -> Nodes.arith(ArithOp.NEGATE, Nodes.reals(1), Nodes.reals(3)));
  }

  @Test
  public void callArgumentsBecomeParameters() {
    Node mass = Nodes.call(AtomKeyword.MASS);
    Node compare = Nodes.compare(Op.GT, mass, Nodes.reals(13.0));
    assertThat(compare.kind()).isEqualTo(NodeKind.METHOD);
    assertThat(compare.children()).hasSize(1);
    Node ref = compare.child(0);
    assertThat(ref.kind()).isEqualTo(NodeKind.SUBEXPR_REF);
    assertThat(ref.target()).isSameInstanceAs(mass);

    Parameter left = compare.call().param(0);
    Parameter right = compare.call().param(1);
    assertThat(left.source()).isSameInstanceAs(ref);
    assertThat(left.isPerAtom()).isTrue();
    assertThat(right.source()).isNull();
    assertThat(right.numberAt(5)).isEqualTo(13.0);
  }

  @Test
  public void variableReferencesCountUses() {
    Node v = Nodes.variable("v", Nodes.call(CoordinateKeyword.Z));
    assertThat(v.refCount()).isEqualTo(1);
    Node ref = Nodes.ref(v);
    assertThat(ref.name()).isEqualTo("v");
    assertThat(ref.isDynamic()).isTrue();
    Nodes.compare(Op.LT, v, Nodes.reals(0));
    assertThat(v.refCount()).isEqualTo(3);
  }

  @Test
  public void groupReference() {
    Node ref = Nodes.groupRef("protein");
    assertThat(ref.kind()).isEqualTo(NodeKind.GROUP_REF);
    assertThat(ref.groupName()).isEqualTo("protein");
  }
}
