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
import java.util.Arrays;
import org.jspecify.annotations.Nullable;
import org.selexpr.util.IndexSet;

/**
 * An immutable list of positions, each computed from a block of atoms. Coordinates (and
 * velocities and forces, if present) are stored as {x0, y0, z0, x1, ...}.
 */
public final class Positions {

  /** Positions with no elements. */
  public static final Positions EMPTY =
      new Positions(new double[0], null, null, new int[] {0}, new int[0]);

  private final double[] x;
  private final double @Nullable [] v;
  private final double @Nullable [] f;

  /**
   * The atoms of position {@code i} are {@code atoms[blockStart[i]]} to {@code
   * atoms[blockStart[i+1]-1]}.
   */
  private final int[] blockStart;

  private final int[] atoms;

  Positions(
      double[] x, double @Nullable [] v, double @Nullable [] f, int[] blockStart, int[] atoms) {
    Preconditions.checkArgument(x.length == 3 * (blockStart.length - 1));
    this.x = x;
    this.v = v;
    this.f = f;
    this.blockStart = blockStart;
    this.atoms = atoms;
  }

  /** Returns the number of positions. */
  public int count() {
    return blockStart.length - 1;
  }

  /** Returns coordinate {@code d} of position {@code i}. */
  public double x(int i, int d) {
    return x[3 * i + d];
  }

  public boolean hasVelocities() {
    return v != null;
  }

  public double v(int i, int d) {
    Preconditions.checkState(v != null, "Velocities were not computed");
    return v[3 * i + d];
  }

  public boolean hasForces() {
    return f != null;
  }

  public double f(int i, int d) {
    Preconditions.checkState(f != null, "Forces were not computed");
    return f[3 * i + d];
  }

  /** Returns the atoms that position {@code i} was computed from. */
  public IndexSet atomsOf(int i) {
    return IndexSet.of(Arrays.copyOfRange(atoms, blockStart[i], blockStart[i + 1]));
  }

  /** Returns all atoms that contribute to some position. */
  public IndexSet group() {
    return IndexSet.of(atoms);
  }

  /** Returns the squared distance between position {@code i} and the given point. */
  public double distanceSquared(int i, double px, double py, double pz) {
    double dx = x[3 * i] - px;
    double dy = x[3 * i + 1] - py;
    double dz = x[3 * i + 2] - pz;
    return dx * dx + dy * dy + dz * dz;
  }

  /** Returns the positions of {@code first} followed by those of {@code second}. */
  public static Positions concat(Positions first, Positions second) {
    if (second.count() == 0) {
      return first;
    } else if (first.count() == 0) {
      return second;
    }
    double[] x = concat(first.x, second.x);
    double[] v = (first.v != null && second.v != null) ? concat(first.v, second.v) : null;
    double[] f = (first.f != null && second.f != null) ? concat(first.f, second.f) : null;
    int n = first.count();
    int[] blockStart = Arrays.copyOf(first.blockStart, n + second.count() + 1);
    for (int i = 1; i <= second.count(); i++) {
      blockStart[n + i] = first.atoms.length + second.blockStart[i];
    }
    int[] atoms = Arrays.copyOf(first.atoms, first.atoms.length + second.atoms.length);
    System.arraycopy(second.atoms, 0, atoms, first.atoms.length, second.atoms.length);
    return new Positions(x, v, f, blockStart, atoms);
  }

  private static double[] concat(double[] a, double[] b) {
    double[] result = Arrays.copyOf(a, a.length + b.length);
    System.arraycopy(b, 0, result, a.length, b.length);
    return result;
  }

  @Override
  public String toString() {
    return "Positions(" + count() + ")";
  }
}
