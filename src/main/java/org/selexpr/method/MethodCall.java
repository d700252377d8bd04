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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import org.jspecify.annotations.Nullable;
import org.selexpr.position.PositionType;
import org.selexpr.position.Topology;

/** A call of a {@link SelectionMethod} with its parameters and per-call state. */
public final class MethodCall {
  private final SelectionMethod method;
  private final ImmutableList<Parameter> params;
  private @Nullable Object state;
  private boolean initialized;
  private @Nullable PositionType positionType;
  private boolean evaluateVelocities;
  private boolean evaluateForces;

  public MethodCall(SelectionMethod method, ImmutableList<Parameter> params) {
    Preconditions.checkArgument(params.size() == method.params().size());
    this.method = method;
    this.params = params;
  }

  public SelectionMethod method() {
    return method;
  }

  public ImmutableList<Parameter> params() {
    return params;
  }

  public Parameter param(int i) {
    return params.get(i);
  }

  /** (Re)initializes the method's state for this call from the current parameter values. */
  public void init(Topology topology) {
    method.init(topology, this);
    initialized = true;
  }

  public boolean isInitialized() {
    return initialized;
  }

  /** Returns the state saved by the method's {@code init}, which must be of type {@code cls}. */
  public <T> T state(Class<T> cls) {
    Preconditions.checkState(state != null, "%s has not been initialized", method.name());
    return cls.cast(state);
  }

  public void setState(@Nullable Object state) {
    this.state = state;
  }

  /** Returns the position type for methods that compute positions, if one has been chosen. */
  public @Nullable PositionType positionType() {
    return positionType;
  }

  public void setPositionType(@Nullable PositionType positionType) {
    this.positionType = positionType;
  }

  public boolean evaluateVelocities() {
    return evaluateVelocities;
  }

  public boolean evaluateForces() {
    return evaluateForces;
  }

  public void setEvaluate(boolean velocities, boolean forces) {
    this.evaluateVelocities = velocities;
    this.evaluateForces = forces;
  }

  @Override
  public String toString() {
    return method.name() + params;
  }
}
