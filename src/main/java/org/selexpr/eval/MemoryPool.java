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

package org.selexpr.eval;

import com.google.common.base.Preconditions;
import java.nio.ByteBuffer;
import java.util.ArrayDeque;
import org.jspecify.annotations.Nullable;
import org.selexpr.tree.Value;
import org.selexpr.tree.ValueType;
import org.selexpr.util.SizeOf;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Provides temporary storage for values that are only needed while their parent is being
 * evaluated. Reservations must be released in the reverse of the order they were made.
 *
 * <p>Until {@link #reserveArena} is called every reservation is satisfied from the heap and only
 * the peak usage is recorded. Once an arena has been reserved, numeric values are stored in slices
 * of it; group values are immutable and are only counted.
 */
public final class MemoryPool {
  private static final Logger LOG = LoggerFactory.getLogger(MemoryPool.class);

  /** Arena slices start at multiples of this many bytes. */
  private static final int ALIGNMENT = SizeOf.DOUBLE;

  private record Reservation(Value value, long bytes, int arenaStart, boolean inArena) {}

  private final ArrayDeque<Reservation> reservations = new ArrayDeque<>();
  private @Nullable ByteBuffer arena;
  private int arenaUsed;
  private long current;
  private long peak;
  private boolean overflowReported;

  /**
   * Reserves storage for {@code count} elements of {@code value}, which will be written by the
   * next evaluation of its node.
   */
  public void reserve(Value value, int count) {
    ValueType type = value.type();
    long bytes = SizeOf.elements(count, type.elementSize);
    int start = arenaUsed;
    boolean inArena = false;
    if (arena != null && type.isNumeric() && !value.isArenaBound()) {
      long end = align(arenaUsed + bytes);
      if (end <= arena.capacity()) {
        value.bindArena(arena, arenaUsed, count);
        arenaUsed = (int) end;
        inArena = true;
      } else {
        reportOverflow(bytes);
        value.ensureCapacity(count);
      }
    } else if (type.isNumeric() || type == ValueType.STRING) {
      value.ensureCapacity(count);
    }
    reservations.push(new Reservation(value, bytes, start, inArena));
    current += bytes;
    peak = Math.max(peak, current);
  }

  /** Releases the most recent reservation, which must have been made for {@code value}. */
  public void release(Value value) {
    Reservation top = reservations.peek();
    Preconditions.checkState(
        top != null && top.value() == value, "Memory pool released out of order");
    reservations.pop();
    current -= top.bytes();
    if (top.inArena()) {
      value.unbindArena();
      arenaUsed = top.arenaStart();
    }
  }

  /**
   * Allocates the arena; {@code bytes} should be the largest amount that will be reserved at any
   * one time.
   */
  public void reserveArena(long bytes) {
    Preconditions.checkState(reservations.isEmpty(), "Pool is in use");
    Preconditions.checkArgument(
        bytes >= 0 && bytes <= Integer.MAX_VALUE, "Bad pool size %s", bytes);
    arena = (bytes == 0) ? null : ByteBuffer.allocate((int) bytes);
    arenaUsed = 0;
    peak = 0;
    LOG.debug("Reserved {} bytes for the memory pool", bytes);
  }

  /** Returns the size of the arena, or zero if none has been reserved. */
  public int arenaSize() {
    return (arena == null) ? 0 : arena.capacity();
  }

  /** Returns the number of bytes currently reserved. */
  public long currentBytes() {
    return current;
  }

  /** Returns the largest number of bytes that have been reserved at one time. */
  public long peakBytes() {
    return peak;
  }

  private void reportOverflow(long bytes) {
    if (!overflowReported) {
      overflowReported = true;
      LOG.warn(
          "Memory pool of {} bytes cannot hold a further {} bytes; allocating from the heap",
          arenaSize(),
          bytes);
    } else {
      LOG.debug("Memory pool overflow of {} bytes", bytes);
    }
  }

  private static long align(long n) {
    return (n + ALIGNMENT - 1) / ALIGNMENT * ALIGNMENT;
  }
}
