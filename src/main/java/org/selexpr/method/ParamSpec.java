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

import com.google.common.collect.ImmutableSet;
import org.selexpr.tree.ValueType;

/**
 * Describes one parameter of a {@link SelectionMethod}.
 *
 * @param name the parameter's name, used in error messages
 * @param types the value types the parameter accepts
 * @param perAtom if true, the parameter may supply one value per atom of the evaluation group and
 *     is evaluated together with the method; otherwise it is evaluated once per frame, without a
 *     group
 */
public record ParamSpec(String name, ImmutableSet<ValueType> types, boolean perAtom) {

  /** Returns a spec for a parameter that may have one value per atom. */
  public static ParamSpec perAtom(String name, ValueType... types) {
    return new ParamSpec(name, ImmutableSet.copyOf(types), true);
  }

  /** Returns a spec for a parameter that is evaluated once per frame. */
  public static ParamSpec perFrame(String name, ValueType... types) {
    return new ParamSpec(name, ImmutableSet.copyOf(types), false);
  }

  public boolean accepts(ValueType type) {
    return types.contains(type);
  }
}
