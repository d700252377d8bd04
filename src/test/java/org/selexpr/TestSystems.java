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

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import org.jspecify.annotations.Nullable;
import org.selexpr.eval.EvalContext;
import org.selexpr.method.MethodCall;
import org.selexpr.method.SelectionMethod;
import org.selexpr.position.Frame;
import org.selexpr.position.Topology;
import org.selexpr.tree.Value;
import org.selexpr.tree.ValueShape;
import org.selexpr.tree.ValueType;
import org.selexpr.util.IndexSet;

/** Topologies, frames and selection methods shared by the tests. */
public final class TestSystems {

  private static final String[] NAMES = {"N", "CA", "C", "O"};
  private static final double[] MASSES = {14.0, 12.0, 12.0, 16.0};
  private static final double[] CHARGES = {-0.4, 0.1, 0.6, -0.5};

  // Statics only
  private TestSystems() {}

  /**
   * Returns a topology of {@code atoms} atoms in residues of four (named N, CA, C and O) and
   * molecules of five residues.
   */
  public static Topology chain(int atoms) {
    Topology.Builder builder = Topology.builder();
    for (int i = 0; i < atoms; i++) {
      int k = i % 4;
      builder.addAtom(NAMES[k], i / 4, i / 20, MASSES[k], CHARGES[k]);
    }
    return builder.build();
  }

  /** Returns a frame with atom {@code i} at {@code (i * spacing, 0, 0)}. */
  public static Frame line(long step, int atoms, double spacing) {
    double[] x = new double[3 * atoms];
    for (int i = 0; i < atoms; i++) {
      x[3 * i] = i * spacing;
    }
    return new Frame(step, x);
  }

  /** Returns a frame with atoms uniformly distributed in a cube of side {@code box}. */
  public static Frame random(long step, int atoms, double box, Random random) {
    double[] x = new double[3 * atoms];
    for (int i = 0; i < x.length; i++) {
      x[i] = box * random.nextDouble();
    }
    return new Frame(step, x);
  }

  /**
   * A dynamic method that selects the atoms whose index has the same parity as the frame step, and
   * records the group it was asked to evaluate each time.
   */
  public static final class ParityMethod extends SelectionMethod {
    public final List<IndexSet> requested = new ArrayList<>();

    public ParityMethod() {
      super("parity", ValueType.GROUP, ValueShape.SINGLE);
    }

    @Override
    public boolean isDynamic() {
      return true;
    }

    @Override
    public void update(EvalContext ctx, MethodCall call, @Nullable IndexSet g, Value out) {
      IndexSet group = ctx.groupOrUniverse(g);
      requested.add(group);
      Frame frame = ctx.frame();
      long step = (frame == null) ? 0 : frame.step();
      out.setGroup(group.filter(i -> (i + step) % 2 == 0));
    }
  }

  /** A method declared dynamic that selects the atoms below a fixed index. */
  public static final class BelowMethod extends SelectionMethod {
    private final int limit;

    public BelowMethod(int limit) {
      super("below " + limit, ValueType.GROUP, ValueShape.SINGLE);
      this.limit = limit;
    }

    @Override
    public boolean isDynamic() {
      return true;
    }

    @Override
    public void update(EvalContext ctx, MethodCall call, @Nullable IndexSet g, Value out) {
      out.setGroup(ctx.groupOrUniverse(g).filter(i -> i < limit));
    }
  }
}
