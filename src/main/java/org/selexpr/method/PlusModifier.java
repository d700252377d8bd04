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

/** Concatenates two sets of positions. */
public final class PlusModifier extends SelectionMethod {
  public static final PlusModifier INSTANCE = new PlusModifier();

  private PlusModifier() {
    super(
        "plus",
        ValueType.POSITION,
        ValueShape.VARIABLE,
        ParamSpec.perFrame("first", ValueType.POSITION),
        ParamSpec.perFrame("second", ValueType.POSITION));
  }

  @Override
  public boolean isModifier() {
    return true;
  }

  @Override
  public void update(EvalContext ctx, MethodCall call, @Nullable IndexSet g, Value out) {
    Positions first = call.param(0).value().positions();
    Positions second = call.param(1).value().positions();
    out.setPositions(Positions.concat(first, second));
  }
}
