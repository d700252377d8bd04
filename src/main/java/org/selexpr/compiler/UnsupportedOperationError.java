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

/** Thrown for constructs that can be represented but not evaluated, such as XOR. */
public class UnsupportedOperationError extends SelectionError {

  public UnsupportedOperationError(String msg) {
    super(msg);
  }

  @FormatMethod
  public static UnsupportedOperationError format(String fmt, Object... fmtArgs) {
    return new UnsupportedOperationError(String.format(fmt, fmtArgs));
  }
}
