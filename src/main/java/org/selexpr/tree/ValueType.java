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

package org.selexpr.tree;

import org.selexpr.util.SizeOf;

/** The type of the values produced by a node. */
public enum ValueType {
  GROUP(SizeOf.INT),
  POSITION(SizeOf.POSITION),
  INTEGER(SizeOf.INT),
  REAL(SizeOf.DOUBLE),
  STRING(SizeOf.PTR),
  NONE(0);

  /** The number of bytes used to store one value of this type. */
  public final int elementSize;

  ValueType(int elementSize) {
    this.elementSize = elementSize;
  }

  public boolean isNumeric() {
    return this == INTEGER || this == REAL;
  }
}
