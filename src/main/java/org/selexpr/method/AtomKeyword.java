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
import org.selexpr.position.Topology;
import org.selexpr.tree.Value;
import org.selexpr.tree.ValueShape;
import org.selexpr.tree.ValueType;
import org.selexpr.util.IndexSet;

/** Keywords that return a topology property of each atom; these never change between frames. */
public final class AtomKeyword extends SelectionMethod {

  /** Stores the property of {@code atom} as element {@code i} of {@code out}. */
  private interface Property {
    void store(Topology topology, int atom, Value out, int i);
  }

  public static final AtomKeyword INDEX =
      new AtomKeyword("index", ValueType.INTEGER, (t, atom, out, i) -> out.setInt(i, atom));

  public static final AtomKeyword RESINDEX =
      new AtomKeyword(
          "resindex", ValueType.INTEGER, (t, atom, out, i) -> out.setInt(i, t.residueIndex(atom)));

  public static final AtomKeyword MOLINDEX =
      new AtomKeyword(
          "molindex", ValueType.INTEGER, (t, atom, out, i) -> out.setInt(i, t.moleculeIndex(atom)));

  public static final AtomKeyword NAME =
      new AtomKeyword(
          "name", ValueType.STRING, (t, atom, out, i) -> out.setString(i, t.name(atom)));

  public static final AtomKeyword MASS =
      new AtomKeyword("mass", ValueType.REAL, (t, atom, out, i) -> out.setReal(i, t.mass(atom)));

  public static final AtomKeyword CHARGE =
      new AtomKeyword(
          "charge", ValueType.REAL, (t, atom, out, i) -> out.setReal(i, t.charge(atom)));

  private final Property property;

  private AtomKeyword(String name, ValueType type, Property property) {
    super(name, type, ValueShape.PER_ATOM);
    this.property = property;
  }

  @Override
  public void update(EvalContext ctx, MethodCall call, @Nullable IndexSet g, Value out) {
    IndexSet group = ctx.groupOrUniverse(g);
    out.setCount(group.size());
    for (int i = 0; i < group.size(); i++) {
      property.store(ctx.topology(), group.get(i), out, i);
    }
  }
}
