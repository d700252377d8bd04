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

package org.selexpr.util;

/**
 * Static-only class with the per-element byte sizes used when planning storage for selection
 * values.
 */
public class SizeOf {

  // Statics only
  private SizeOf() {}

  /** The number of bytes required for a pointer. */
  public static final int PTR = 4;

  /** The number of bytes required for an int. */
  public static final int INT = 4;

  /** The number of bytes required for a double. */
  public static final int DOUBLE = 8;

  /** The number of bytes required for one 3-dimensional position. */
  public static final int POSITION = 3 * DOUBLE;

  /** Returns the number of bytes needed for {@code count} elements of {@code elementSize} bytes. */
  public static long elements(int count, int elementSize) {
    return (long) count * elementSize;
  }
}
