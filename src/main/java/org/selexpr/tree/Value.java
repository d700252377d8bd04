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

import com.google.common.base.Preconditions;
import java.nio.ByteBuffer;
import java.util.Arrays;
import org.jspecify.annotations.Nullable;
import org.selexpr.position.Positions;
import org.selexpr.util.IndexSet;
import org.selexpr.util.SizeOf;

/**
 * The mutable result of evaluating a node.
 *
 * <p>Nodes whose storage is aliased share a single Value instance, so writes through one are seen
 * by all. Numeric values may be temporarily bound to a slice of the memory pool's arena; while
 * bound, elements are read and written in the arena rather than in the Value's own arrays.
 */
public final class Value {
  private static final int[] NO_INTS = new int[0];
  private static final double[] NO_REALS = new double[0];
  private static final String[] NO_STRINGS = new String[0];

  private final ValueType type;

  /** The number of numeric or string elements; unused for groups and positions. */
  private int count;

  private IndexSet group = IndexSet.EMPTY;
  private int[] ints = NO_INTS;
  private double[] reals = NO_REALS;
  private String[] strings = NO_STRINGS;
  private @Nullable Positions positions;

  /** Non-null while this value is bound to a slice of a pool arena. */
  private @Nullable ByteBuffer arena;

  private int arenaOffset;
  private int arenaCapacity;

  private Value(ValueType type) {
    this.type = type;
  }

  /** Returns a new, empty Value of the given type. */
  public static Value of(ValueType type) {
    return new Value(type);
  }

  public static Value ofGroup(IndexSet group) {
    Value result = new Value(ValueType.GROUP);
    result.group = group;
    return result;
  }

  public static Value ofInts(int... values) {
    Value result = new Value(ValueType.INTEGER);
    result.ints = values.clone();
    result.count = values.length;
    return result;
  }

  public static Value ofReals(double... values) {
    Value result = new Value(ValueType.REAL);
    result.reals = values.clone();
    result.count = values.length;
    return result;
  }

  public static Value ofStrings(String... values) {
    Value result = new Value(ValueType.STRING);
    result.strings = values.clone();
    result.count = values.length;
    return result;
  }

  public ValueType type() {
    return type;
  }

  /** Returns the number of elements in this value. */
  public int size() {
    return switch (type) {
      case GROUP -> group.size();
      case POSITION -> (positions == null) ? 0 : positions.count();
      case NONE -> 0;
      default -> count;
    };
  }

  public int count() {
    return count;
  }

  public void setCount(int count) {
    Preconditions.checkArgument(count >= 0);
    ensureCapacity(count);
    this.count = count;
  }

  public IndexSet group() {
    Preconditions.checkState(type == ValueType.GROUP, "Not a group value: %s", type);
    return group;
  }

  public void setGroup(IndexSet group) {
    Preconditions.checkState(type == ValueType.GROUP, "Not a group value: %s", type);
    this.group = group;
  }

  /** Returns the positions, or {@link Positions#EMPTY} if none have been computed. */
  public Positions positions() {
    Preconditions.checkState(type == ValueType.POSITION, "Not a position value: %s", type);
    return (positions == null) ? Positions.EMPTY : positions;
  }

  public void setPositions(Positions positions) {
    Preconditions.checkState(type == ValueType.POSITION, "Not a position value: %s", type);
    this.positions = positions;
  }

  public int intAt(int i) {
    if (arena != null) {
      return arena.getInt(arenaOffset + i * SizeOf.INT);
    }
    return ints[i];
  }

  public void setInt(int i, int v) {
    if (arena != null) {
      Preconditions.checkElementIndex(i, arenaCapacity);
      arena.putInt(arenaOffset + i * SizeOf.INT, v);
    } else {
      if (i >= ints.length) {
        ints = Arrays.copyOf(ints, Math.max(i + 1, 2 * ints.length));
      }
      ints[i] = v;
    }
  }

  public double realAt(int i) {
    if (arena != null) {
      return arena.getDouble(arenaOffset + i * SizeOf.DOUBLE);
    }
    return reals[i];
  }

  public void setReal(int i, double v) {
    if (arena != null) {
      Preconditions.checkElementIndex(i, arenaCapacity);
      arena.putDouble(arenaOffset + i * SizeOf.DOUBLE, v);
    } else {
      if (i >= reals.length) {
        reals = Arrays.copyOf(reals, Math.max(i + 1, 2 * reals.length));
      }
      reals[i] = v;
    }
  }

  public String stringAt(int i) {
    return strings[i];
  }

  public void setString(int i, String v) {
    if (i >= strings.length) {
      strings = Arrays.copyOf(strings, Math.max(i + 1, 2 * strings.length));
    }
    strings[i] = v;
  }

  /** Returns element {@code i} of a numeric value as a double. */
  public double numberAt(int i) {
    return (type == ValueType.INTEGER) ? intAt(i) : realAt(i);
  }

  /** Copies element {@code j} of {@code from} (which must have the same type) to element i. */
  public void copyElement(int i, Value from, int j) {
    switch (type) {
      case INTEGER -> setInt(i, from.intAt(j));
      case REAL -> setReal(i, from.realAt(j));
      case STRING -> setString(i, from.stringAt(j));
      default -> throw new IllegalStateException("Cannot copy elements of " + type);
    }
  }

  /** Makes this value equal to {@code other}, which must have the same type. */
  public void copyFrom(Value other) {
    Preconditions.checkArgument(other.type == type);
    if (other == this) {
      return;
    }
    switch (type) {
      case GROUP -> group = other.group;
      case POSITION -> positions = other.positions;
      case NONE -> {}
      default -> {
        setCount(other.count);
        for (int i = 0; i < other.count; i++) {
          copyElement(i, other, i);
        }
      }
    }
  }

  /**
   * Ensures that the value's own storage can hold {@code n} numeric or string elements. Has no
   * effect while bound to an arena.
   */
  public void ensureCapacity(int n) {
    if (arena != null) {
      Preconditions.checkArgument(n <= arenaCapacity, "Pool slice overflow");
      return;
    }
    switch (type) {
      case INTEGER -> {
        if (ints.length < n) {
          ints = Arrays.copyOf(ints, n);
        }
      }
      case REAL -> {
        if (reals.length < n) {
          reals = Arrays.copyOf(reals, n);
        }
      }
      case STRING -> {
        if (strings.length < n) {
          strings = Arrays.copyOf(strings, n);
        }
      }
      default -> {}
    }
  }

  /** Returns the number of elements that can be stored without reallocating. */
  public int capacity() {
    if (arena != null) {
      return arenaCapacity;
    }
    return switch (type) {
      case INTEGER -> ints.length;
      case REAL -> reals.length;
      case STRING -> strings.length;
      default -> 0;
    };
  }

  /** Binds numeric storage to {@code capacity} elements of {@code arena} at byte {@code offset}. */
  public void bindArena(ByteBuffer arena, int offset, int capacity) {
    Preconditions.checkState(type.isNumeric() && this.arena == null);
    this.arena = arena;
    this.arenaOffset = offset;
    this.arenaCapacity = capacity;
    this.count = 0;
  }

  /** Returns true if this value is currently stored in a pool arena. */
  public boolean isArenaBound() {
    return arena != null;
  }

  /** Returns the byte offset of this value's arena slice. */
  public int arenaOffset() {
    return arenaOffset;
  }

  /** Releases the arena slice; the value's contents are no longer valid. */
  public void unbindArena() {
    arena = null;
    arenaOffset = 0;
    arenaCapacity = 0;
    count = 0;
  }

  @Override
  public String toString() {
    return switch (type) {
      case GROUP -> group.toString();
      case POSITION -> positions().toString();
      case NONE -> "none";
      default -> {
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < Math.min(count, 8); i++) {
          if (i > 0) {
            sb.append(", ");
          }
          sb.append(type == ValueType.STRING ? stringAt(i) : String.valueOf(numberAt(i)));
        }
        yield sb.append(count > 8 ? ", ...]" : "]").toString();
      }
    };
  }
}
