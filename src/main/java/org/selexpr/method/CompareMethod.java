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

import com.google.common.collect.Maps;
import java.util.EnumMap;
import org.jspecify.annotations.Nullable;
import org.selexpr.eval.EvalContext;
import org.selexpr.tree.Value;
import org.selexpr.tree.ValueShape;
import org.selexpr.tree.ValueType;
import org.selexpr.util.IndexSet;

/** Selects the atoms for which a numeric comparison holds, e.g. {@code mass > 12}. */
public final class CompareMethod extends SelectionMethod {

  /** The comparison operators. */
  public enum Op {
    LT("<") {
      @Override
      boolean test(double left, double right) {
        return left < right;
      }
    },
    LE("<=") {
      @Override
      boolean test(double left, double right) {
        return left <= right;
      }
    },
    GT(">") {
      @Override
      boolean test(double left, double right) {
        return left > right;
      }
    },
    GE(">=") {
      @Override
      boolean test(double left, double right) {
        return left >= right;
      }
    },
    EQ("==") {
      @Override
      boolean test(double left, double right) {
        return left == right;
      }
    },
    NE("!=") {
      @Override
      boolean test(double left, double right) {
        return left != right;
      }
    };

    public final String symbol;

    Op(String symbol) {
      this.symbol = symbol;
    }

    abstract boolean test(double left, double right);
  }

  private static final EnumMap<Op, CompareMethod> METHODS = Maps.newEnumMap(Op.class);

  static {
    for (Op op : Op.values()) {
      METHODS.put(op, new CompareMethod(op));
    }
  }

  private final Op op;

  private CompareMethod(Op op) {
    super(
        "cmp " + op.symbol,
        ValueType.GROUP,
        ValueShape.SINGLE,
        ParamSpec.perAtom("left", ValueType.INTEGER, ValueType.REAL),
        ParamSpec.perAtom("right", ValueType.INTEGER, ValueType.REAL));
    this.op = op;
  }

  public static CompareMethod of(Op op) {
    return METHODS.get(op);
  }

  public Op op() {
    return op;
  }

  @Override
  public void update(EvalContext ctx, MethodCall call, @Nullable IndexSet g, Value out) {
    IndexSet group = ctx.groupOrUniverse(g);
    Parameter left = call.param(0);
    Parameter right = call.param(1);
    IndexSet.Builder result = new IndexSet.Builder();
    for (int i = 0; i < group.size(); i++) {
      if (op.test(left.numberAt(i), right.numberAt(i))) {
        result.add(group.get(i));
      }
    }
    out.setGroup(result.build());
  }
}
