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

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.selexpr.eval.EvalContext;
import org.selexpr.position.PositionCalculator;
import org.selexpr.position.PositionType;
import org.selexpr.position.Positions;
import org.selexpr.position.Topology;
import org.selexpr.tree.Value;
import org.selexpr.tree.ValueShape;
import org.selexpr.tree.ValueType;
import org.selexpr.util.IndexSet;

/**
 * A keyword or function that can be used in selections. Methods are stateless; any state needed
 * by a particular call is kept in its {@link MethodCall}.
 *
 * <p>Group-valued methods must return a subset of the group they are evaluated for, and whether
 * an atom is selected may depend only on that atom (so that evaluating for a subset of a group
 * gives the corresponding subset of the result).
 */
public abstract class SelectionMethod {
  private final String name;
  private final ValueType type;
  private final ValueShape shape;
  private final ImmutableList<ParamSpec> params;

  protected SelectionMethod(String name, ValueType type, ValueShape shape, ParamSpec... params) {
    this.name = name;
    this.type = type;
    this.shape = shape;
    this.params = ImmutableList.copyOf(params);
  }

  public String name() {
    return name;
  }

  public ValueType type() {
    return type;
  }

  public ValueShape shape() {
    return shape;
  }

  public ImmutableList<ParamSpec> params() {
    return params;
  }

  /** True if the result may change between frames even when no parameter does. */
  public boolean isDynamic() {
    return false;
  }

  /**
   * True if the method is evaluated from positions (see {@link #updatePositions}) when the
   * compiler has set up a position calculator for it.
   */
  public boolean requiresPositions() {
    return false;
  }

  /** True if the method post-processes position values rather than selecting atoms. */
  public boolean isModifier() {
    return false;
  }

  /** True if the method's output depends on the call's {@link MethodCall#positionType}. */
  public boolean usesPositionType() {
    return false;
  }

  /** True if {@link #initFrame} must be called before the first evaluation in each frame. */
  public boolean hasInitFrame() {
    return false;
  }

  /**
   * Checks the types of the supplied arguments beyond what the {@link ParamSpec}s express; throws
   * a {@link org.selexpr.compiler.SelectionError} if they are unacceptable.
   */
  public void checkArguments(List<ValueType> argTypes) {}

  /**
   * Prepares the call's state from its parameter values. Called after the parameters have been
   * evaluated, and again whenever per-atom parameters may have changed.
   */
  public void init(Topology topology, MethodCall call) {}

  /** Called once per frame before the first evaluation, if {@link #hasInitFrame} is true. */
  public void initFrame(EvalContext ctx, MethodCall call) {}

  /**
   * Evaluates the method for the atoms of {@code g} (or for the universe, if {@code g} is null)
   * and stores the result in {@code out}.
   */
  public abstract void update(EvalContext ctx, MethodCall call, @Nullable IndexSet g, Value out);

  /**
   * Evaluates the method from precomputed {@code positions} of the evaluation group. Only called
   * for methods that {@link #requiresPositions}.
   */
  public void updatePositions(
      EvalContext ctx, MethodCall call, Positions positions, @Nullable IndexSet g, Value out) {
    throw new IllegalStateException(name + " does not evaluate positions");
  }

  /** Returns one position per atom of {@code g}, for position methods without a calculator. */
  protected static Positions atomPositions(EvalContext ctx, @Nullable IndexSet g) {
    PositionCalculator calculator = new PositionCalculator(PositionType.ATOM, ctx.topology());
    return calculator.compute(ctx.frame(), ctx.groupOrUniverse(g));
  }

  @Override
  public String toString() {
    return name;
  }
}
