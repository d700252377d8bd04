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
import com.google.common.collect.ImmutableSet;
import java.util.List;
import java.util.regex.Pattern;
import org.jspecify.annotations.Nullable;
import org.selexpr.compiler.StructuralError;
import org.selexpr.eval.EvalContext;
import org.selexpr.position.Topology;
import org.selexpr.tree.Value;
import org.selexpr.tree.ValueShape;
import org.selexpr.tree.ValueType;
import org.selexpr.util.IndexSet;

/**
 * Selects the atoms whose value is one of a list of accepted values, e.g. {@code name CA CB} or
 * {@code resindex 1 5 7}. Accepted strings may contain the wildcards {@code *} and {@code ?}.
 */
public final class MatchMethod extends SelectionMethod {
  public static final MatchMethod INSTANCE = new MatchMethod();

  /** The accepted values, in the form used for matching. */
  private record Accepted(ImmutableSet<Integer> ints, ImmutableList<Pattern> patterns) {}

  private MatchMethod() {
    super(
        "match",
        ValueType.GROUP,
        ValueShape.SINGLE,
        ParamSpec.perAtom("value", ValueType.STRING, ValueType.INTEGER),
        ParamSpec.perFrame("accepted", ValueType.STRING, ValueType.INTEGER));
  }

  @Override
  public void checkArguments(List<ValueType> argTypes) {
    if (argTypes.get(0) != argTypes.get(1)) {
      throw StructuralError.wrongType("Accepted values of match", argTypes.get(0), argTypes.get(1));
    }
  }

  @Override
  public void init(Topology topology, MethodCall call) {
    Value accepted = call.param(1).value();
    if (accepted.type() == ValueType.INTEGER) {
      ImmutableSet.Builder<Integer> ints = ImmutableSet.builder();
      for (int i = 0; i < accepted.count(); i++) {
        ints.add(accepted.intAt(i));
      }
      call.setState(new Accepted(ints.build(), ImmutableList.of()));
    } else {
      ImmutableList.Builder<Pattern> patterns = ImmutableList.builder();
      for (int i = 0; i < accepted.count(); i++) {
        patterns.add(toPattern(accepted.stringAt(i)));
      }
      call.setState(new Accepted(ImmutableSet.of(), patterns.build()));
    }
  }

  /** Converts a string with {@code *} and {@code ?} wildcards to a regular expression. */
  static Pattern toPattern(String wildcard) {
    StringBuilder regex = new StringBuilder();
    int start = 0;
    for (int i = 0; i < wildcard.length(); i++) {
      char c = wildcard.charAt(i);
      if (c == '*' || c == '?') {
        if (i > start) {
          regex.append(Pattern.quote(wildcard.substring(start, i)));
        }
        regex.append(c == '*' ? ".*" : ".");
        start = i + 1;
      }
    }
    if (start < wildcard.length()) {
      regex.append(Pattern.quote(wildcard.substring(start)));
    }
    return Pattern.compile(regex.toString());
  }

  @Override
  public void update(EvalContext ctx, MethodCall call, @Nullable IndexSet g, Value out) {
    IndexSet group = ctx.groupOrUniverse(g);
    Accepted accepted = call.state(Accepted.class);
    Value values = call.param(0).value();
    boolean single = values.count() == 1;
    IndexSet.Builder result = new IndexSet.Builder();
    for (int i = 0; i < group.size(); i++) {
      int j = single ? 0 : i;
      boolean match;
      if (values.type() == ValueType.INTEGER) {
        match = accepted.ints().contains(values.intAt(j));
      } else {
        String s = values.stringAt(j);
        match = accepted.patterns().stream().anyMatch(p -> p.matcher(s).matches());
      }
      if (match) {
        result.add(group.get(i));
      }
    }
    out.setGroup(result.build());
  }
}
