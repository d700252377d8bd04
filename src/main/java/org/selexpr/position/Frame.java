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
import org.jspecify.annotations.Nullable;

/**
 * The frame-dependent state of the system: coordinates, and optionally velocities and forces,
 * stored as {x0, y0, z0, x1, y1, z1, ...}.
 */
public final class Frame {
  private final long step;
  private final double[] x;
  private final double @Nullable [] v;
  private final double @Nullable [] f;

  public Frame(long step, double[] x) {
    this(step, x, null, null);
  }

  public Frame(long step, double[] x, double @Nullable [] v, double @Nullable [] f) {
    Preconditions.checkArgument(x.length % 3 == 0, "Coordinates must come in triples");
    Preconditions.checkArgument(v == null || v.length == x.length);
    Preconditions.checkArgument(f == null || f.length == x.length);
    this.step = step;
    this.x = x;
    this.v = v;
    this.f = f;
  }

  public long step() {
    return step;
  }

  public int atomCount() {
    return x.length / 3;
  }

  /** Returns coordinate {@code d} (0, 1 or 2) of {@code atom}. */
  public double x(int atom, int d) {
    return x[3 * atom + d];
  }

  public boolean hasVelocities() {
    return v != null;
  }

  public double v(int atom, int d) {
    Preconditions.checkState(v != null, "Frame has no velocities");
    return v[3 * atom + d];
  }

  public boolean hasForces() {
    return f != null;
  }

  public double f(int atom, int d) {
    Preconditions.checkState(f != null, "Frame has no forces");
    return f[3 * atom + d];
  }
}
