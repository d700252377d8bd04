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

import com.google.common.base.Preconditions;
import org.jspecify.annotations.Nullable;
import org.selexpr.eval.EvalContext;
import org.selexpr.position.PositionCalculator;
import org.selexpr.position.Positions;
import org.selexpr.position.Topology;
import org.selexpr.tree.Node;
import org.selexpr.tree.Value;
import org.selexpr.tree.ValueType;
import org.selexpr.util.IndexSet;

/**
 * A named selection in a {@link SelectionCollection}. Its {@link #result} is updated each time the
 * collection is evaluated.
 */
public final class Selection {
  private final String name;
  private final Node root;
  private boolean dynamic;
  private IndexSet maxGroup = IndexSet.EMPTY;
  private boolean dynamicMask;

  /** For group-valued selections, computes the selection's positions from its atoms. */
  private @Nullable PositionCalculator calculator;

  private double[] originalMasses = new double[0];
  private double[] originalCharges = new double[0];
  private @Nullable SelectionResult result;

  Selection(String name, Node root) {
    this.name = name;
    this.root = root;
  }

  public String name() {
    return name;
  }

  /** True if the selected atoms or their positions may change between frames. */
  public boolean isDynamic() {
    return dynamic;
  }

  /** Returns a group that contains the selected atoms in every frame. */
  public IndexSet maxGroup() {
    return maxGroup;
  }

  /** Returns the masses of the positions of {@link #maxGroup}, computed when compiled. */
  public double[] originalMasses() {
    return originalMasses.clone();
  }

  public double[] originalCharges() {
    return originalCharges.clone();
  }

  /** Returns the value of this selection in the last evaluated frame. */
  public SelectionResult result() {
    Preconditions.checkState(result != null, "Selection '%s' has not been evaluated", name);
    return result;
  }

  /** Called once the collection has been compiled. */
  void initialize(EvalContext ctx, CompileOptions options) {
    Node child = root.child(0);
    dynamic = child.isDynamic();
    dynamicMask = options.dynamicMask();
    Topology topology = ctx.topology();
    Positions positions;
    if (child.type() == ValueType.GROUP) {
      maxGroup = root.evalGroup();
      calculator = new PositionCalculator(options.selectionPositionType(), topology);
      calculator.setDynamic(dynamic);
      calculator.setMaxGroup(maxGroup);
      calculator.setEvaluateVelocities(options.evaluateVelocities());
      calculator.setEvaluateForces(options.evaluateForces());
      positions = calculator.compute(null, maxGroup);
    } else {
      positions = child.value().positions();
      maxGroup = positions.group();
    }
    originalMasses = sum(topology, positions, true);
    originalCharges = sum(topology, positions, false);
  }

  /** Reads the selection's value after its ROOT has been evaluated. */
  void update(EvalContext ctx) {
    Value value = root.child(0).value();
    Topology topology = ctx.topology();
    if (calculator != null) {
      IndexSet group = value.group();
      boolean masked = dynamic && dynamicMask;
      Positions positions = calculator.compute(ctx.frame(), masked ? maxGroup : group);
      if (!dynamic || masked) {
        result =
            new SelectionResult(
                group, positions, originalMasses.clone(), originalCharges.clone());
      } else {
        result =
            new SelectionResult(
                group, positions, sum(topology, positions, true), sum(topology, positions, false));
      }
    } else {
      Positions positions = value.positions();
      result =
          new SelectionResult(
              positions.group(),
              positions,
              sum(topology, positions, true),
              sum(topology, positions, false));
    }
  }

  /** Returns the total mass (or charge) of the atoms of each position. */
  private static double[] sum(Topology topology, Positions positions, boolean mass) {
    double[] result = new double[positions.count()];
    for (int i = 0; i < result.length; i++) {
      IndexSet atoms = positions.atomsOf(i);
      for (int j = 0; j < atoms.size(); j++) {
        int atom = atoms.get(j);
        result[i] += mass ? topology.mass(atom) : topology.charge(atom);
      }
    }
    return result;
  }

  @Override
  public String toString() {
    return name;
  }
}
