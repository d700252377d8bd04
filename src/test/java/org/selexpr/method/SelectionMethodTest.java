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

package org.selexpr.method;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import junitparams.JUnitParamsRunner;
import junitparams.Parameters;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.selexpr.CompileOptions;
import org.selexpr.Selection;
import org.selexpr.SelectionCollection;
import org.selexpr.TestSystems;
import org.selexpr.compiler.StructuralError;
import org.selexpr.method.CompareMethod.Op;
import org.selexpr.tree.ArithOp;
import org.selexpr.tree.Node;
import org.selexpr.tree.Nodes;
import org.selexpr.util.IndexSet;

@RunWith(JUnitParamsRunner.class)
public class SelectionMethodTest {

  private static IndexSet evaluate(Node expression) {
    SelectionCollection sc =
        new SelectionCollection(TestSystems.chain(40), CompileOptions.defaults());
    Selection selection = sc.addSelection("s", expression);
    sc.compile();
    sc.evaluate(TestSystems.line(0, 40, 1.0));
    return selection.result().group();
  }

  private static Object[] wildcards() {
    return new Object[] {
      new Object[] {"C*", "CA", true},
      new Object[] {"C*", "C", true},
      new Object[] {"C*", "NC", false},
      new Object[] {"?A", "CA", true},
      new Object[] {"?A", "CAB", false},
      new Object[] {"C.A", "CXA", false},
      new Object[] {"C.A", "C.A", true},
      new Object[] {"*", "", true},
    };
  }

  @Test
  @Parameters(method = "wildcards")
  public void wildcardPatterns(String wildcard, String name, boolean matches) {
    assertThat(MatchMethod.toPattern(wildcard).matcher(name).matches()).isEqualTo(matches);
  }

  @Test
  public void matchNames() {
    IndexSet result = evaluate(Nodes.match(Nodes.call(AtomKeyword.NAME), "C*"));
    assertThat(result).isEqualTo(IndexSet.forRange(0, 39).filter(i -> i % 4 == 1 || i % 4 == 2));
  }

  @Test
  public void matchIntegers() {
    IndexSet result = evaluate(Nodes.match(Nodes.call(AtomKeyword.RESINDEX), 0, 2));
    assertThat(result).isEqualTo(IndexSet.of(0, 1, 2, 3, 8, 9, 10, 11));
  }

  private static Object[] comparisons() {
    return new Object[] {
      new Object[] {Op.LT, IndexSet.forRange(0, 19)},
      new Object[] {Op.LE, IndexSet.forRange(0, 39)},
      new Object[] {Op.GT, IndexSet.EMPTY},
      new Object[] {Op.GE, IndexSet.forRange(20, 39)},
      new Object[] {Op.EQ, IndexSet.forRange(20, 39)},
      new Object[] {Op.NE, IndexSet.forRange(0, 19)},
    };
  }

  /** Compares molecule indices (0 or 1) with 1. */
  @Test
  @Parameters(method = "comparisons")
  public void compare(Op op, IndexSet expected) {
    assertThat(evaluate(Nodes.compare(op, Nodes.call(AtomKeyword.MOLINDEX), Nodes.integers(1))))
        .isEqualTo(expected);
  }

  @Test
  public void compareRealsWithArithmetic() {
    Node doubled = Nodes.arith(ArithOp.MULTIPLY, Nodes.call(AtomKeyword.CHARGE), Nodes.reals(2.0));
    IndexSet result = evaluate(Nodes.compare(Op.GT, doubled, Nodes.reals(1.0)));
    // Only C atoms have charge 0.6
    assertThat(result).isEqualTo(IndexSet.forRange(0, 39).filter(i -> i % 4 == 2));
  }

  @Test
  public void negatedCharges() {
    Node negated = Nodes.negate(Nodes.call(AtomKeyword.CHARGE));
    IndexSet result = evaluate(Nodes.compare(Op.GT, negated, Nodes.reals(0.45)));
    // O atoms have charge -0.5
    assertThat(result).isEqualTo(IndexSet.forRange(0, 39).filter(i -> i % 4 == 3));
  }

  @Test
  public void withinUsesCutoff() {
    Node of = Nodes.positions(null, Nodes.group(IndexSet.of(10)));
    assertThat(evaluate(Nodes.within(1.5, of))).isEqualTo(IndexSet.of(9, 10, 11));
    assertThat(evaluate(Nodes.within(0, Nodes.positions(null, Nodes.group(IndexSet.of(10))))))
        .isEqualTo(IndexSet.of(10));
  }

  @Test
  public void matchTypesMustAgree() {
    assertThrows(StructuralError.class, () -> Nodes.match(Nodes.call(AtomKeyword.NAME), 1, 2));
  }

  @Test
  public void argumentCountIsChecked() {
    assertThrows(StructuralError.class, () -> Nodes.call(WithinMethod.INSTANCE, Nodes.reals(1)));
  }

  @Test
  public void argumentTypesAreChecked() {
    assertThrows(
        StructuralError.class,
        () -> Nodes.call(WithinMethod.INSTANCE, Nodes.reals(1), Nodes.group(IndexSet.of(1))));
  }
}
