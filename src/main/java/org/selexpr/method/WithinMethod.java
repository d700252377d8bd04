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

import org.jspecify.annotations.Nullable;
import org.selexpr.eval.EvalContext;
import org.selexpr.position.Positions;
import org.selexpr.tree.Value;
import org.selexpr.tree.ValueShape;
import org.selexpr.tree.ValueType;
import org.selexpr.util.IndexSet;

/**
 * Selects the atoms whose position is within a cutoff distance of any of a set of reference
 * positions. With a position type other than ATOM, all atoms of a position are selected together.
 */
public final class WithinMethod extends SelectionMethod {
  public static final WithinMethod INSTANCE = new WithinMethod();

  private WithinMethod() {
    super(
        "within",
        ValueType.GROUP,
        ValueShape.SINGLE,
        ParamSpec.perFrame("cutoff", ValueType.REAL, ValueType.INTEGER),
        ParamSpec.perFrame("of", ValueType.POSITION));
  }

  @Override
  public boolean isDynamic() {
    return true;
  }

  @Override
  public boolean requiresPositions() {
    return true;
  }

  @Override
  public void update(EvalContext ctx, MethodCall call, @Nullable IndexSet g, Value out) {
    updatePositions(ctx, call, atomPositions(ctx, g), g, out);
  }

  @Override
  public void updatePositions(
      EvalContext ctx, MethodCall call, Positions positions, @Nullable IndexSet g, Value out) {
    double cutoff = call.param(0).numberAt(0);
    double cutoff2 = cutoff * cutoff;
    Positions reference = call.param(1).value().positions();
    IndexSet.Builder result = new IndexSet.Builder();
    for (int i = 0; i < positions.count(); i++) {
      for (int j = 0; j < reference.count(); j++) {
        double d2 =
            positions.distanceSquared(i, reference.x(j, 0), reference.x(j, 1), reference.x(j, 2));
        if (d2 <= cutoff2) {
          result.addAll(positions.atomsOf(i));
          break;
        }
      }
    }
    IndexSet selected = result.build();
    out.setGroup((g == null) ? selected : selected.intersection(g));
  }
}
