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

package org.selexpr;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import java.util.Random;
import java.util.function.IntPredicate;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.selexpr.TestSystems.BelowMethod;
import org.selexpr.TestSystems.ParityMethod;
import org.selexpr.compiler.InputInconsistencyError;
import org.selexpr.compiler.UnsupportedOperationError;
import org.selexpr.method.AtomKeyword;
import org.selexpr.method.CompareMethod.Op;
import org.selexpr.method.CoordinateKeyword;
import org.selexpr.position.Frame;
import org.selexpr.position.PositionType;
import org.selexpr.position.Positions;
import org.selexpr.position.Topology;
import org.selexpr.tree.ArithOp;
import org.selexpr.tree.Node;
import org.selexpr.tree.NodeKind;
import org.selexpr.tree.Nodes;
import org.selexpr.util.IndexSet;

@RunWith(JUnit4.class)
public class SelectionCollectionTest {

  private static final int ATOMS = 100;

  private final Topology topology = TestSystems.chain(ATOMS);

  private SelectionCollection newCollection() {
    return new SelectionCollection(topology, CompileOptions.defaults());
  }

  private static Node index() {
    return Nodes.call(AtomKeyword.INDEX);
  }

  private static Node name(String... accepted) {
    return Nodes.match(Nodes.call(AtomKeyword.NAME), accepted);
  }

  private static Node within(double cutoff, PositionType type, IndexSet of) {
    return Nodes.within(cutoff, Nodes.positions(type, Nodes.group(of)));
  }

  @Test
  public void staticSelection() {
    SelectionCollection sc = newCollection();
    Selection s1 =
        sc.addSelection(
            "s1",
            Nodes.and(
                Nodes.compare(Op.LT, index(), Nodes.integers(50)),
                Nodes.compare(Op.GE, index(), Nodes.integers(10))));
    sc.compile();
    assertThat(s1.isDynamic()).isFalse();
    assertThat(s1.maxGroup()).isEqualTo(IndexSet.forRange(10, 49));

    sc.evaluate(TestSystems.line(0, ATOMS, 1.0));
    SelectionResult result = s1.result();
    assertThat(result.group()).isEqualTo(IndexSet.forRange(10, 49));
    assertThat(result.positionCount()).isEqualTo(40);
    assertThat(result.positions().x(0, 0)).isEqualTo(10.0);
    // Atom 10 is the C of its residue
    assertThat(result.masses()[0]).isEqualTo(12.0);
  }

  @Test
  public void dynamicSelectionFollowsTheFrame() {
    SelectionCollection sc = newCollection();
    Selection s2 = sc.addSelection("s2", within(2.0, PositionType.ATOM, IndexSet.of(0)));
    sc.compile();
    assertThat(s2.isDynamic()).isTrue();
    assertThat(s2.maxGroup()).isEqualTo(IndexSet.forRange(0, 99));

    sc.evaluate(TestSystems.line(0, ATOMS, 1.0));
    assertThat(s2.result().group()).isEqualTo(IndexSet.of(0, 1, 2));
    assertThat(s2.result().masses()).hasLength(3);

    sc.evaluate(TestSystems.line(1, ATOMS, 0.5));
    assertThat(s2.result().group()).isEqualTo(IndexSet.forRange(0, 4));
    assertThat(s2.result().positionCount()).isEqualTo(5);
  }

  @Test
  public void dynamicMaskKeepsAllPositions() {
    SelectionCollection sc =
        new SelectionCollection(
            topology, CompileOptions.defaults().toBuilder().dynamicMask(true).build());
    Selection s = sc.addSelection("s", within(2.0, PositionType.ATOM, IndexSet.of(0)));
    sc.compile();
    sc.evaluate(TestSystems.line(0, ATOMS, 1.0));
    assertThat(s.result().group()).isEqualTo(IndexSet.of(0, 1, 2));
    assertThat(s.result().positionCount()).isEqualTo(ATOMS);
    assertThat(s.result().masses()).isEqualTo(s.originalMasses());
  }

  @Test
  public void positionSelection() {
    SelectionCollection sc = newCollection();
    Selection centers =
        sc.addSelection(
            "centers", Nodes.positions(PositionType.RES_COG, Nodes.group(IndexSet.forRange(0, 7))));
    sc.compile();
    assertThat(centers.originalMasses()).isEqualTo(new double[] {54.0, 54.0});

    sc.evaluate(TestSystems.line(0, ATOMS, 1.0));
    Positions positions = centers.result().positions();
    assertThat(positions.count()).isEqualTo(2);
    assertThat(positions.x(0, 0)).isWithin(1e-9).of(1.5);
    assertThat(positions.x(1, 0)).isWithin(1e-9).of(5.5);
    assertThat(centers.result().group()).isEqualTo(IndexSet.forRange(0, 7));
  }

  @Test
  public void plusConcatenatesPositions() {
    SelectionCollection sc = newCollection();
    Selection both =
        sc.addSelection(
            "both",
            Nodes.plus(
                Nodes.positions(PositionType.ATOM, Nodes.group(IndexSet.of(0))),
                Nodes.positions(PositionType.ATOM, Nodes.group(IndexSet.of(5)))));
    sc.compile();
    sc.evaluate(TestSystems.line(0, ATOMS, 2.0));
    Positions positions = both.result().positions();
    assertThat(positions.count()).isEqualTo(2);
    assertThat(positions.x(0, 0)).isEqualTo(0.0);
    assertThat(positions.x(1, 0)).isEqualTo(10.0);
    assertThat(both.result().group()).isEqualTo(IndexSet.of(0, 5));
  }

  @Test
  public void unusedVariablesAreRemovedFromTheChain() {
    SelectionCollection sc = newCollection();
    Node unused = sc.addVariable("unused", Nodes.compare(Op.LT, index(), Nodes.integers(5)));
    Node near = sc.addVariable("near", within(2.0, PositionType.ATOM, IndexSet.of(0)));
    sc.addSelection("s", Nodes.and(Nodes.group(IndexSet.forRange(0, 9)), near));
    sc.compile();

    assertThat(sc.chain().stream().map(root -> root.child(0)).toList()).doesNotContain(unused);
    assertThat(sc.chain().stream().map(root -> root.child(0)).toList()).contains(near);
  }

  @Test
  public void commonSubexpressionIsEvaluatedOncePerGroup() {
    ParityMethod parity = new ParityMethod();
    SelectionCollection sc = newCollection();
    Node v = sc.addVariable("v", Nodes.call(parity));
    Selection low = sc.addSelection("low", Nodes.and(Nodes.call(new BelowMethod(50)), v));
    Selection high =
        sc.addSelection("high", Nodes.and(Nodes.not(Nodes.call(new BelowMethod(50))), v));
    sc.compile();
    assertThat(v.kind()).isEqualTo(NodeKind.SUBEXPR);

    parity.requested.clear();
    sc.evaluate(TestSystems.line(0, ATOMS, 1.0));
    assertThat(parity.requested)
        .containsExactly(IndexSet.forRange(0, 49), IndexSet.forRange(50, 99))
        .inOrder();
    assertThat(low.result().group()).isEqualTo(IndexSet.forRange(0, 49).filter(i -> i % 2 == 0));
    assertThat(high.result().group())
        .isEqualTo(IndexSet.forRange(50, 99).filter(i -> i % 2 == 0));

    parity.requested.clear();
    sc.evaluate(TestSystems.line(1, ATOMS, 1.0));
    assertThat(parity.requested).hasSize(2);
    assertThat(low.result().group()).isEqualTo(IndexSet.forRange(0, 49).filter(i -> i % 2 == 1));
  }

  @Test
  public void sharedVariableWithFixedGroupsIsEvaluatedOnce() {
    ParityMethod parity = new ParityMethod();
    SelectionCollection sc = newCollection();
    Node v = sc.addVariable("v", Nodes.call(parity));
    Selection low = sc.addSelection("low", Nodes.and(Nodes.group(IndexSet.forRange(0, 9)), v));
    Selection high = sc.addSelection("high", Nodes.and(Nodes.group(IndexSet.forRange(90, 99)), v));
    sc.compile();

    parity.requested.clear();
    sc.evaluate(TestSystems.line(0, ATOMS, 1.0));
    assertThat(parity.requested).hasSize(1);
    assertThat(low.result().group()).isEqualTo(IndexSet.of(0, 2, 4, 6, 8));
    assertThat(high.result().group()).isEqualTo(IndexSet.of(90, 92, 94, 96, 98));
  }

  @Test
  public void sharedCoordinateVariable() {
    SelectionCollection sc = newCollection();
    Node x = sc.addVariable("x", Nodes.call(CoordinateKeyword.X));
    Selection low = sc.addSelection("low", Nodes.compare(Op.LT, x, Nodes.reals(3.0)));
    Selection high = sc.addSelection("high", Nodes.compare(Op.GT, x, Nodes.reals(5.0)));
    sc.compile();

    sc.evaluate(TestSystems.line(0, ATOMS, 0.5));
    assertThat(low.result().group()).isEqualTo(IndexSet.forRange(0, 5));
    assertThat(high.result().group()).isEqualTo(IndexSet.forRange(11, 99));
  }

  @Test
  public void sharedCoordinateVariableEvaluatedForVaryingGroups() {
    SelectionCollection sc = newCollection();
    Node x = sc.addVariable("x", Nodes.call(CoordinateKeyword.X));
    Selection low =
        sc.addSelection(
            "low",
            Nodes.and(Nodes.call(new BelowMethod(50)), Nodes.compare(Op.LT, x, Nodes.reals(3.0))));
    Selection high =
        sc.addSelection(
            "high",
            Nodes.and(
                Nodes.not(Nodes.call(new BelowMethod(50))),
                Nodes.compare(Op.GT, x, Nodes.reals(30.0))));
    sc.compile();

    sc.evaluate(TestSystems.line(0, ATOMS, 0.5));
    assertThat(low.result().group()).isEqualTo(IndexSet.forRange(0, 5));
    assertThat(high.result().group()).isEqualTo(IndexSet.forRange(61, 99));
  }

  @Test
  public void foldedOperandsReleaseTheirStorage() {
    SelectionCollection sc = newCollection();
    Selection positive =
        sc.addSelection(
            "positive",
            Nodes.compare(
                Op.GT,
                Nodes.arith(
                    ArithOp.MULTIPLY,
                    Nodes.call(AtomKeyword.MASS),
                    Nodes.call(AtomKeyword.CHARGE)),
                Nodes.reals(0.0)));
    Selection slab =
        sc.addSelection(
            "slab",
            Nodes.and(
                Nodes.compare(Op.LT, Nodes.call(CoordinateKeyword.X), Nodes.reals(5.0)),
                Nodes.or(
                    Nodes.compare(Op.GE, index(), Nodes.integers(0)),
                    within(2.0, PositionType.ATOM, IndexSet.of(0)))));
    Selection all =
        sc.addSelection(
            "all",
            Nodes.not(
                Nodes.and(
                    Nodes.group(IndexSet.EMPTY), within(2.0, PositionType.ATOM, IndexSet.of(0)))));
    sc.compile();

    sc.evaluate(TestSystems.line(0, ATOMS, 1.0));
    assertThat(positive.isDynamic()).isFalse();
    assertThat(positive.result().group()).isEqualTo(select(i -> i % 4 == 1 || i % 4 == 2));
    assertThat(slab.result().group()).isEqualTo(IndexSet.forRange(0, 4));
    assertThat(all.result().group()).isEqualTo(IndexSet.forRange(0, 99));
  }

  @Test
  public void resultArraysAreCopies() {
    SelectionCollection sc = newCollection();
    Selection s = sc.addSelection("s", Nodes.group(IndexSet.forRange(0, 3)));
    sc.compile();
    sc.evaluate(TestSystems.line(0, ATOMS, 1.0));
    s.result().masses()[0] = -1;
    s.result().charges()[0] = -1;

    sc.evaluate(TestSystems.line(1, ATOMS, 1.0));
    assertThat(s.originalMasses()[0]).isEqualTo(14.0);
    assertThat(s.result().masses()[0]).isEqualTo(14.0);
    assertThat(s.result().charges()[0]).isEqualTo(-0.4);
  }

  /** Compares compiled results with a direct evaluation of the same expressions. */
  @Test
  public void compiledSelectionsMatchDirectEvaluation() {
    SelectionCollection sc = newCollection();
    IndexSet firstResidue = IndexSet.forRange(0, 3);
    Node nearStart = sc.addVariable("nearStart", within(2.0, PositionType.RES_COG, firstResidue));
    Selection nearCa = sc.addSelection("nearCa", Nodes.and(name("CA"), nearStart));
    Selection nearO = sc.addSelection("nearO", Nodes.and(name("O*"), nearStart));
    Selection heavyOrNear =
        sc.addSelection(
            "heavyOrNear",
            Nodes.or(
                Nodes.compare(Op.GT, Nodes.call(AtomKeyword.MASS), Nodes.reals(13.0)),
                within(2.5, PositionType.RES_COM, IndexSet.forRange(40, 47))));
    Selection slab =
        sc.addSelection(
            "slab",
            Nodes.and(
                Nodes.compare(Op.GT, Nodes.call(CoordinateKeyword.X), Nodes.reals(2.0)),
                Nodes.compare(Op.LT, Nodes.call(CoordinateKeyword.X), Nodes.reals(6.0))));
    Selection sum =
        sc.addSelection(
            "sum",
            Nodes.compare(
                Op.LT,
                Nodes.arith(
                    ArithOp.PLUS, Nodes.call(CoordinateKeyword.X), Nodes.call(CoordinateKeyword.Y)),
                Nodes.integers(8)));
    Selection farFromEnd =
        sc.addSelection("farFromEnd", Nodes.not(within(3.0, PositionType.ATOM, IndexSet.of(99))));
    Node shifted =
        sc.addVariable(
            "shifted",
            Nodes.arith(
                ArithOp.PLUS, Nodes.call(CoordinateKeyword.X), Nodes.call(AtomKeyword.MASS)));
    Selection lowShifted =
        sc.addSelection(
            "lowShifted",
            Nodes.and(
                Nodes.call(new BelowMethod(50)), Nodes.compare(Op.LT, shifted, Nodes.reals(17.0))));
    Selection highShifted =
        sc.addSelection(
            "highShifted",
            Nodes.and(
                Nodes.not(Nodes.call(new BelowMethod(50))),
                Nodes.compare(Op.GT, shifted, Nodes.reals(20.0))));
    Selection shiftedBelow =
        sc.addSelection("shiftedBelow", Nodes.compare(Op.LT, shifted, Nodes.reals(19.0)));
    sc.compile();

    Random random = new Random(2025);
    for (int step = 0; step < 20; step++) {
      Frame frame = TestSystems.random(step, ATOMS, 10.0, random);
      sc.evaluate(frame);

      IndexSet near = near(frame, 2.0, center(frame, firstResidue, false));
      assertThat(nearCa.result().group()).isEqualTo(select(i -> i % 4 == 1 && near.contains(i)));
      assertThat(nearO.result().group()).isEqualTo(select(i -> i % 4 == 3 && near.contains(i)));

      IndexSet nearMiddle =
          near(
              frame,
              2.5,
              center(frame, IndexSet.forRange(40, 43), true),
              center(frame, IndexSet.forRange(44, 47), true));
      assertThat(heavyOrNear.result().group())
          .isEqualTo(select(i -> i % 4 == 0 || i % 4 == 3 || nearMiddle.contains(i)));

      assertThat(slab.result().group())
          .isEqualTo(select(i -> frame.x(i, 0) > 2.0 && frame.x(i, 0) < 6.0));
      assertThat(sum.result().group())
          .isEqualTo(select(i -> frame.x(i, 0) + frame.x(i, 1) < 8.0));

      IndexSet nearEnd = near(frame, 3.0, center(frame, IndexSet.of(99), false));
      assertThat(farFromEnd.result().group()).isEqualTo(select(i -> !nearEnd.contains(i)));

      IntPredicate lowSum = i -> frame.x(i, 0) + topology.mass(i) < 17.0;
      IntPredicate highSum = i -> frame.x(i, 0) + topology.mass(i) > 20.0;
      assertThat(lowShifted.result().group()).isEqualTo(select(i -> i < 50 && lowSum.test(i)));
      assertThat(highShifted.result().group())
          .isEqualTo(select(i -> i >= 50 && highSum.test(i)));
      assertThat(shiftedBelow.result().group())
          .isEqualTo(select(i -> frame.x(i, 0) + topology.mass(i) < 19.0));
    }
  }

  @Test
  public void failedCompilationLeavesCollectionUnusable() {
    SelectionCollection sc = newCollection();
    sc.addSelection(
        "s",
        Nodes.xor(within(2.0, PositionType.ATOM, IndexSet.of(0)), Nodes.group(IndexSet.of(1))));
    assertThrows(UnsupportedOperationError.class, sc::compile);
    assertThrows(IllegalStateException.class, sc::compile);
    assertThrows(
        IllegalStateException.class, () -> sc.evaluate(TestSystems.line(0, ATOMS, 1.0)));
  }

  @Test
  public void frameMustMatchTopology() {
    SelectionCollection sc = newCollection();
    sc.addSelection("s", within(2.0, PositionType.ATOM, IndexSet.of(0)));
    sc.compile();
    assertThrows(
        InputInconsistencyError.class, () -> sc.evaluate(TestSystems.line(0, ATOMS - 1, 1.0)));
  }

  @Test
  public void selectionsMustBeGroupsOrPositions() {
    SelectionCollection sc = newCollection();
    assertThrows(
        org.selexpr.compiler.StructuralError.class,
        () -> sc.addSelection("masses", Nodes.call(AtomKeyword.MASS)));
  }

  @Test
  public void universeLimitsSelections() {
    SelectionCollection sc =
        new SelectionCollection(topology, IndexSet.forRange(0, 19), CompileOptions.defaults());
    Selection s = sc.addSelection("s", within(100.0, PositionType.ATOM, IndexSet.of(0)));
    sc.compile();
    sc.evaluate(TestSystems.line(0, ATOMS, 1.0));
    assertThat(s.result().group()).isEqualTo(IndexSet.forRange(0, 19));
  }

  @Test
  public void dumpTreeAfterCompilation() {
    SelectionCollection sc = newCollection();
    sc.addSelection("s", within(2.0, PositionType.ATOM, IndexSet.of(0)));
    sc.compile();
    String dump = sc.dumpTree();
    assertThat(dump).contains("ROOT");
    assertThat(dump).contains("storage=");
  }

  private static IndexSet select(IntPredicate include) {
    return IndexSet.forRange(0, ATOMS - 1).filter(include);
  }

  /** Returns the atoms within {@code cutoff} of any of {@code points}. */
  private static IndexSet near(Frame frame, double cutoff, double[]... points) {
    return select(
        i -> {
          for (double[] p : points) {
            double dx = frame.x(i, 0) - p[0];
            double dy = frame.x(i, 1) - p[1];
            double dz = frame.x(i, 2) - p[2];
            if (dx * dx + dy * dy + dz * dz <= cutoff * cutoff) {
              return true;
            }
          }
          return false;
        });
  }

  private double[] center(Frame frame, IndexSet atoms, boolean massWeighted) {
    double[] weights = new double[atoms.size()];
    double total = 0;
    for (int j = 0; j < weights.length; j++) {
      weights[j] = massWeighted ? topology.mass(atoms.get(j)) : 1;
      total += weights[j];
    }
    for (int j = 0; j < weights.length; j++) {
      weights[j] /= total;
    }
    double[] result = new double[3];
    for (int d = 0; d < 3; d++) {
      for (int j = 0; j < weights.length; j++) {
        result[d] += weights[j] * frame.x(atoms.get(j), d);
      }
    }
    return result;
  }
}
