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

/**
 * Thrown when the inputs are individually valid but cannot be combined, e.g. a non-constant
 * integer operand in arithmetic or coordinates that don't match the topology.
 */
public class InputInconsistencyError extends SelectionError {

  public InputInconsistencyError(String msg) {
    super(msg);
  }

  @FormatMethod
  public static InputInconsistencyError format(String fmt, Object... fmtArgs) {
    return new InputInconsistencyError(String.format(fmt, fmtArgs));
  }
}
