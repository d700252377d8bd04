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
import org.jspecify.annotations.Nullable;
import org.selexpr.tree.Node;
import org.selexpr.tree.Value;
import org.selexpr.tree.ValueShape;

/**
 * The value supplied for one parameter of a method call: either a constant, or the current value
 * of a SUBEXPR_REF child of the call.
 */
public final class Parameter {
  private final ParamSpec spec;
  private final @Nullable Value constant;
  private final @Nullable Node source;

  private Parameter(ParamSpec spec, @Nullable Value constant, @Nullable Node source) {
    this.spec = spec;
    this.constant = constant;
    this.source = source;
  }

  /** Returns a parameter with a fixed value. */
  public static Parameter constant(ParamSpec spec, Value value) {
    Preconditions.checkArgument(spec.accepts(value.type()));
    return new Parameter(spec, value, null);
  }

  /** Returns a parameter whose value is the value of {@code source} each time it is read. */
  public static Parameter fromNode(ParamSpec spec, Node source) {
    Preconditions.checkArgument(spec.accepts(source.type()));
    return new Parameter(spec, null, source);
  }

  public ParamSpec spec() {
    return spec;
  }

  /** Returns the node supplying this parameter, or null for a constant parameter. */
  public @Nullable Node source() {
    return source;
  }

  /** True if the supplied value is frame-dependent. */
  public boolean isDynamic() {
    return source != null && source.isDynamic();
  }

  /** True if the supplied value has one element per atom of the evaluation group. */
  public boolean isPerAtom() {
    return spec.perAtom() && source != null && source.shape() == ValueShape.PER_ATOM;
  }

  public Value value() {
    return (source != null) ? source.value() : constant;
  }

  /**
   * Returns element {@code i} of a numeric value; a value with a single element is used for
   * every atom.
   */
  public double numberAt(int i) {
    Value value = value();
    return value.numberAt(value.count() == 1 ? 0 : i);
  }

  @Override
  public String toString() {
    return spec.name() + "=" + ((source != null) ? source.describe() : String.valueOf(constant));
  }
}
