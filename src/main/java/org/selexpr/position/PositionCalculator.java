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

package org.selexpr.position;

import com.google.common.base.Preconditions;
import com.google.common.primitives.Ints;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.selexpr.util.IndexSet;

/**
 * Computes positions of a given {@link PositionType} for groups of atoms.
 *
 * <p>A calculator that is not dynamic is always asked for the same group, so the grouping of atoms
 * into blocks is computed once and reused.
 */
public final class PositionCalculator {
  private final PositionType type;
  private final Topology topology;
  private boolean dynamic;
  private IndexSet maxGroup = IndexSet.EMPTY;
  private boolean evaluateVelocities;
  private boolean evaluateForces;

  /** Cached result of {@link #blocks} for a non-dynamic calculator. */
  private @Nullable IndexSet cachedGroup;

  private int @Nullable [][] cachedBlocks;

  public PositionCalculator(PositionType type, Topology topology) {
    this.type = type;
    this.topology = topology;
  }

  public PositionType type() {
    return type;
  }

  public boolean isDynamic() {
    return dynamic;
  }

  /** If true, the calculator may be asked for different groups in different frames. */
  public void setDynamic(boolean dynamic) {
    this.dynamic = dynamic;
  }

  /** Returns the largest group the calculator will be asked for. */
  public IndexSet maxGroup() {
    return maxGroup;
  }

  public void setMaxGroup(IndexSet maxGroup) {
    this.maxGroup = maxGroup;
  }

  public void setEvaluateVelocities(boolean evaluateVelocities) {
    this.evaluateVelocities = evaluateVelocities;
  }

  public void setEvaluateForces(boolean evaluateForces) {
    this.evaluateForces = evaluateForces;
  }

  /**
   * Splits {@code group} into blocks, one per position; blocks are ordered by their first atom.
   */
  public int[][] blocks(IndexSet group) {
    if (!dynamic && cachedBlocks != null && group.equals(cachedGroup)) {
      return cachedBlocks;
    }
    Map<Integer, List<Integer>> byKey = new LinkedHashMap<>();
    group
        .stream()
        .forEach(
            atom ->
                byKey
                    .computeIfAbsent(type.blockKey(topology, atom), k -> new ArrayList<>())
                    .add(atom));
    int[][] result = byKey.values().stream().map(Ints::toArray).toArray(int[][]::new);
    if (!dynamic) {
      cachedGroup = group;
      cachedBlocks = result;
    }
    return result;
  }

  /**
   * Computes the positions for {@code group} in {@code frame}. If {@code frame} is null (as during
   * compilation) all coordinates are zero, but the grouping of atoms into positions is correct.
   */
  public Positions compute(@Nullable Frame frame, IndexSet group) {
    Preconditions.checkArgument(
        group.isEmpty() || group.get(group.size() - 1) < topology.atomCount(),
        "Group %s is not in the topology",
        group);
    int[][] blocks = blocks(group);
    int n = blocks.length;
    double[] x = new double[3 * n];
    boolean withV = evaluateVelocities && frame != null && frame.hasVelocities();
    boolean withF = evaluateForces && frame != null && frame.hasForces();
    double[] v = withV ? new double[3 * n] : null;
    double[] f = withF ? new double[3 * n] : null;
    int[] blockStart = new int[n + 1];
    int[] atoms = new int[group.size()];
    int k = 0;
    for (int i = 0; i < n; i++) {
      int[] block = blocks[i];
      blockStart[i] = k;
      System.arraycopy(block, 0, atoms, k, block.length);
      k += block.length;
      if (frame == null) {
        continue;
      }
      double[] weights = weights(block);
      for (int d = 0; d < 3; d++) {
        double sx = 0;
        double sv = 0;
        double sf = 0;
        for (int j = 0; j < block.length; j++) {
          sx += weights[j] * frame.x(block[j], d);
          if (withV) {
            sv += weights[j] * frame.v(block[j], d);
          }
          if (withF) {
            // Forces on a block are summed rather than averaged
            sf += frame.f(block[j], d);
          }
        }
        x[3 * i + d] = sx;
        if (v != null) {
          v[3 * i + d] = sv;
        }
        if (f != null) {
          f[3 * i + d] = sf;
        }
      }
    }
    blockStart[n] = k;
    return new Positions(x, v, f, blockStart, atoms);
  }

  /** Returns normalized weights for the atoms of a block. */
  private double[] weights(int[] block) {
    double[] weights = new double[block.length];
    double total = 0;
    if (type.massWeighted) {
      for (int j = 0; j < block.length; j++) {
        weights[j] = topology.mass(block[j]);
        total += weights[j];
      }
    }
    if (total <= 0) {
      // Geometric center, also used when a block has no mass
      Arrays.fill(weights, 1);
      total = block.length;
    }
    for (int j = 0; j < block.length; j++) {
      weights[j] /= total;
    }
    return weights;
  }

  @Override
  public String toString() {
    return "PositionCalculator(" + type + (dynamic ? ", dynamic" : "") + ")";
  }
}
