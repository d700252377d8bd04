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

import com.google.common.base.Preconditions;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.Arrays;
import java.util.function.IntPredicate;
import java.util.stream.IntStream;

/**
 * An IndexSet is an immutable, sorted, duplicate-free sequence of non-negative particle indices.
 *
 * <p>Unlike a bitmap, the cost of an IndexSet is proportional to the number of elements rather
 * than to the largest one, and the elements can be addressed by position; selections routinely
 * need "the i-th selected atom" as well as membership tests.
 */
public final class IndexSet implements IntPredicate {

  /** An IndexSet containing no indices. */
  public static final IndexSet EMPTY = new IndexSet(new int[0]);

  /** The elements, strictly increasing. Never modified after construction. */
  private final int[] indices;

  private IndexSet(int[] indices) {
    this.indices = indices;
  }

  /** Returns an IndexSet containing the given indices, which need not be sorted or distinct. */
  public static IndexSet of(int... elements) {
    if (elements.length == 0) {
      return EMPTY;
    }
    int[] copy = elements.clone();
    Arrays.sort(copy);
    Preconditions.checkArgument(copy[0] >= 0, "Negative index %s", copy[0]);
    int n = 1;
    for (int i = 1; i < copy.length; i++) {
      if (copy[i] != copy[n - 1]) {
        copy[n++] = copy[i];
      }
    }
    return new IndexSet(n == copy.length ? copy : Arrays.copyOf(copy, n));
  }

  /**
   * Returns an IndexSet containing all integers greater than or equal to min and less than or
   * equal to max.
   */
  public static IndexSet forRange(int min, int max) {
    Preconditions.checkArgument(min >= 0);
    if (min > max) {
      return EMPTY;
    }
    return new IndexSet(IntStream.rangeClosed(min, max).toArray());
  }

  /** Returns an IndexSet with the first {@code size} elements of a strictly increasing array. */
  static IndexSet fromSorted(int[] sorted, int size) {
    if (size == 0) {
      return EMPTY;
    }
    return new IndexSet(size == sorted.length ? sorted : Arrays.copyOf(sorted, size));
  }

  /** Returns the number of elements. */
  public int size() {
    return indices.length;
  }

  /** Returns true if this IndexSet contains no indices. */
  public boolean isEmpty() {
    return indices.length == 0;
  }

  /** Returns the element at the given position. */
  public int get(int i) {
    return indices[i];
  }

  /** Returns true if this IndexSet contains {@code index}. */
  @Override
  public boolean test(int index) {
    return indexOf(index) >= 0;
  }

  /** Equivalent to {@link #test}. */
  public boolean contains(int index) {
    return test(index);
  }

  /** Returns the position of {@code index} in this set, or a negative value if it is absent. */
  public int indexOf(int index) {
    return Arrays.binarySearch(indices, index);
  }

  /** Returns true if every element of this IndexSet is also an element of {@code other}. */
  public boolean isSubsetOf(IndexSet other) {
    if (indices.length > other.indices.length) {
      return false;
    }
    int j = 0;
    for (int index : indices) {
      while (j < other.indices.length && other.indices[j] < index) {
        j++;
      }
      if (j == other.indices.length || other.indices[j] != index) {
        return false;
      }
    }
    return true;
  }

  /** Returns a copy of the elements. */
  public int[] toArray() {
    return indices.clone();
  }

  public IntStream stream() {
    return Arrays.stream(indices);
  }

  /** Returns the elements of this IndexSet for which {@code include} returns true. */
  public IndexSet filter(IntPredicate include) {
    int[] result = new int[indices.length];
    int n = 0;
    for (int index : indices) {
      if (include.test(index)) {
        result[n++] = index;
      }
    }
    return n == indices.length ? this : fromSorted(result, n);
  }

  /** Returns the union of this and {@code other}. */
  public IndexSet union(IndexSet other) {
    return Op.UNION.apply(this, other);
  }

  /** Returns the intersection of this and {@code other}. */
  public IndexSet intersection(IndexSet other) {
    return Op.INTERSECTION.apply(this, other);
  }

  /** Returns the elements of this that are not in {@code other}. */
  public IndexSet difference(IndexSet other) {
    return Op.DIFFERENCE.apply(this, other);
  }

  /**
   * Returns the union of this and {@code other}, which must be disjoint from this. Cheaper than
   * {@link #union} since no duplicate detection is needed.
   */
  public IndexSet mergeDisjoint(IndexSet other) {
    if (other.isEmpty()) {
      return this;
    } else if (isEmpty()) {
      return other;
    }
    int[] result = new int[indices.length + other.indices.length];
    int i = 0;
    int j = 0;
    int k = 0;
    while (i < indices.length && j < other.indices.length) {
      Preconditions.checkArgument(indices[i] != other.indices[j], "Overlapping merge");
      result[k++] = (indices[i] < other.indices[j]) ? indices[i++] : other.indices[j++];
    }
    while (i < indices.length) {
      result[k++] = indices[i++];
    }
    while (j < other.indices.length) {
      result[k++] = other.indices[j++];
    }
    return new IndexSet(result);
  }

  /**
   * Splits this IndexSet by membership in {@code selector}; the first element of the result is
   * the intersection and the second is the difference.
   */
  public IndexSet[] partition(IndexSet selector) {
    return new IndexSet[] {intersection(selector), difference(selector)};
  }

  /** The binary operations on IndexSets. */
  public enum Op {
    UNION {
      @Override
      boolean keepLeftOnly() {
        return true;
      }

      @Override
      boolean keepRightOnly() {
        return true;
      }

      @Override
      boolean keepBoth() {
        return true;
      }
    },
    INTERSECTION {
      @Override
      boolean keepLeftOnly() {
        return false;
      }

      @Override
      boolean keepRightOnly() {
        return false;
      }

      @Override
      boolean keepBoth() {
        return true;
      }
    },
    DIFFERENCE {
      @Override
      boolean keepLeftOnly() {
        return true;
      }

      @Override
      boolean keepRightOnly() {
        return false;
      }

      @Override
      boolean keepBoth() {
        return false;
      }
    };

    abstract boolean keepLeftOnly();

    abstract boolean keepRightOnly();

    abstract boolean keepBoth();

    /** Applies this operation; returns one of the arguments when the result is equal to it. */
    public IndexSet apply(IndexSet left, IndexSet right) {
      int[] x = left.indices;
      int[] y = right.indices;
      int[] result = new int[keepRightOnly() ? x.length + y.length : x.length];
      int i = 0;
      int j = 0;
      int k = 0;
      while (i < x.length && j < y.length) {
        if (x[i] < y[j]) {
          if (keepLeftOnly()) {
            result[k++] = x[i];
          }
          i++;
        } else if (x[i] > y[j]) {
          if (keepRightOnly()) {
            result[k++] = y[j];
          }
          j++;
        } else {
          if (keepBoth()) {
            result[k++] = x[i];
          }
          i++;
          j++;
        }
      }
      if (keepLeftOnly()) {
        while (i < x.length) {
          result[k++] = x[i++];
        }
      }
      if (keepRightOnly()) {
        while (j < y.length) {
          result[k++] = y[j++];
        }
      }
      if (k == x.length && (keepLeftOnly() || keepBoth()) && isPrefixOf(result, x)) {
        return left;
      } else if (k == y.length && keepRightOnly() && isPrefixOf(result, y)) {
        return right;
      }
      return fromSorted(result, k);
    }

    private static boolean isPrefixOf(int[] result, int[] x) {
      return Arrays.equals(result, 0, x.length, x, 0, x.length);
    }
  }

  /**
   * A Builder accumulates indices (in any order) and returns an IndexSet. A Builder can be reused
   * after calling {@link #build}.
   */
  public static class Builder {
    private int[] elements = new int[8];
    private int size;
    private boolean sorted = true;

    @CanIgnoreReturnValue
    public Builder add(int index) {
      Preconditions.checkArgument(index >= 0);
      if (size == elements.length) {
        elements = Arrays.copyOf(elements, size * 2);
      }
      if (size > 0 && elements[size - 1] >= index) {
        sorted = false;
      }
      elements[size++] = index;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder addAll(IndexSet set) {
      for (int index : set.indices) {
        add(index);
      }
      return this;
    }

    public int size() {
      return size;
    }

    public IndexSet build() {
      int[] copy = Arrays.copyOf(elements, size);
      IndexSet result = sorted ? fromSorted(copy, size) : of(copy);
      size = 0;
      sorted = true;
      return result;
    }
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof IndexSet set && Arrays.equals(indices, set.indices);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(indices);
  }

  @Override
  public String toString() {
    if (indices.length == 0) {
      return "{}";
    }
    // Render runs compactly, e.g. "{0..9, 12}"
    StringBuilder sb = new StringBuilder("{");
    int i = 0;
    while (i < indices.length) {
      int j = i;
      while (j + 1 < indices.length && indices[j + 1] == indices[j] + 1) {
        j++;
      }
      if (i > 0) {
        sb.append(", ");
      }
      sb.append(indices[i]);
      if (j > i) {
        sb.append("..").append(indices[j]);
      }
      i = j + 1;
    }
    return sb.append('}').toString();
  }
}
