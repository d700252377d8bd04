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
 * The x, y and z keywords. Each atom gets the coordinate of the position it contributes to, so
 * with a residue-based position type all atoms of a residue get the coordinate of its center.
 */
public final class CoordinateKeyword extends SelectionMethod {
  public static final CoordinateKeyword X = new CoordinateKeyword("x", 0);
  public static final CoordinateKeyword Y = new CoordinateKeyword("y", 1);
  public static final CoordinateKeyword Z = new CoordinateKeyword("z", 2);

  private final int dimension;

  private CoordinateKeyword(String name, int dimension) {
    super(name, ValueType.REAL, ValueShape.PER_ATOM);
    this.dimension = dimension;
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
    IndexSet group = ctx.groupOrUniverse(g);
    out.setCount(group.size());
    for (int i = 0; i < positions.count(); i++) {
      double coordinate = positions.x(i, dimension);
      IndexSet atoms = positions.atomsOf(i);
      for (int j = 0; j < atoms.size(); j++) {
        int k = group.indexOf(atoms.get(j));
        if (k >= 0) {
          out.setReal(k, coordinate);
        }
      }
    }
  }
}
