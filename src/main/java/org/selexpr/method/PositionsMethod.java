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
import org.selexpr.position.PositionCalculator;
import org.selexpr.position.PositionType;
import org.selexpr.position.Topology;
import org.selexpr.tree.Value;
import org.selexpr.tree.ValueShape;
import org.selexpr.tree.ValueType;
import org.selexpr.util.IndexSet;

/**
 * Computes the positions of a group, e.g. {@code res_com of resindex 3}. The position type is the
 * call's, or the configured default if none was given explicitly.
 */
public final class PositionsMethod extends SelectionMethod {
  public static final PositionsMethod INSTANCE = new PositionsMethod();

  private PositionsMethod() {
    super(
        "positions",
        ValueType.POSITION,
        ValueShape.VARIABLE,
        ParamSpec.perFrame("of", ValueType.GROUP));
  }

  @Override
  public boolean isDynamic() {
    return true;
  }

  @Override
  public boolean usesPositionType() {
    return true;
  }

  @Override
  public void init(Topology topology, MethodCall call) {
    PositionType type = call.positionType();
    PositionCalculator calculator =
        new PositionCalculator((type == null) ? PositionType.ATOM : type, topology);
    calculator.setDynamic(call.param(0).isDynamic());
    calculator.setEvaluateVelocities(call.evaluateVelocities());
    calculator.setEvaluateForces(call.evaluateForces());
    call.setState(calculator);
  }

  @Override
  public void update(EvalContext ctx, MethodCall call, @Nullable IndexSet g, Value out) {
    PositionCalculator calculator = call.state(PositionCalculator.class);
    IndexSet group = call.param(0).value().group();
    out.setPositions(calculator.compute(ctx.frame(), group));
  }
}
