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
import com.google.common.collect.ImmutableList;
import com.google.common.primitives.Doubles;
import com.google.common.primitives.Ints;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.List;
import org.selexpr.util.IndexSet;

/** The per-atom properties that do not change between frames. */
public final class Topology {
  private final double[] masses;
  private final double[] charges;
  private final int[] residues;
  private final int[] molecules;
  private final ImmutableList<String> names;

  private Topology(Builder builder) {
    this.masses = Doubles.toArray(builder.masses);
    this.charges = Doubles.toArray(builder.charges);
    this.residues = Ints.toArray(builder.residues);
    this.molecules = Ints.toArray(builder.molecules);
    this.names = ImmutableList.copyOf(builder.names);
  }

  public static Builder builder() {
    return new Builder();
  }

  public int atomCount() {
    return masses.length;
  }

  /** Returns an IndexSet containing every atom. */
  public IndexSet allAtoms() {
    return IndexSet.forRange(0, atomCount() - 1);
  }

  public double mass(int atom) {
    return masses[atom];
  }

  public double charge(int atom) {
    return charges[atom];
  }

  public int residueIndex(int atom) {
    return residues[atom];
  }

  public int moleculeIndex(int atom) {
    return molecules[atom];
  }

  public String name(int atom) {
    return names.get(atom);
  }

  /** Adds atoms to a new Topology, in index order. */
  public static class Builder {
    private final List<Double> masses = new ArrayList<>();
    private final List<Double> charges = new ArrayList<>();
    private final List<Integer> residues = new ArrayList<>();
    private final List<Integer> molecules = new ArrayList<>();
    private final List<String> names = new ArrayList<>();

    private Builder() {}

    /** Adds the next atom. */
    @CanIgnoreReturnValue
    public Builder addAtom(String name, int residue, int molecule, double mass, double charge) {
      Preconditions.checkArgument(residue >= 0 && molecule >= 0);
      Preconditions.checkArgument(mass >= 0, "Negative mass %s", mass);
      names.add(name);
      residues.add(residue);
      molecules.add(molecule);
      masses.add(mass);
      charges.add(charge);
      return this;
    }

    public Topology build() {
      return new Topology(this);
    }
  }
}
