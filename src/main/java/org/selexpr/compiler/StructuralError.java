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

package org.selexpr.compiler;

import com.google.errorprone.annotations.FormatMethod;
import org.selexpr.tree.ValueType;

/**
 * Thrown when a selection tree is not well formed: an unresolved group reference, a value of the
 * wrong type, or an internal inconsistency.
 */
public class StructuralError extends SelectionError {

  public StructuralError(String msg) {
    super(msg);
  }

  @FormatMethod
  public static StructuralError format(String fmt, Object... fmtArgs) {
    return new StructuralError(String.format(fmt, fmtArgs));
  }

  /** Returns a new "Unresolved group reference" StructuralError. */
  public static StructuralError unresolvedReference(String name) {
    return format("Unresolved group reference '%s'", name);
  }

  /** Returns a new "Expected %s, got %s" StructuralError. */
  public static StructuralError wrongType(String what, ValueType expected, ValueType actual) {
    return format("%s: expected %s, got %s", what, expected, actual);
  }
}
