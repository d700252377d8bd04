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

import com.google.common.base.Ascii;
import java.util.Arrays;
import java.util.stream.Collectors;

/** How atoms are combined into positions. */
public enum PositionType {
  /** One position per atom. */
  ATOM(Block.ATOM, false),
  RES_COM(Block.RESIDUE, true),
  RES_COG(Block.RESIDUE, false),
  MOL_COM(Block.MOLECULE, true),
  MOL_COG(Block.MOLECULE, false),
  /** A single position for the whole group, at its center of mass. */
  WHOLE_COM(Block.WHOLE, true),
  WHOLE_COG(Block.WHOLE, false);

  private enum Block {
    ATOM,
    RESIDUE,
    MOLECULE,
    WHOLE
  }

  private final Block block;

  /** True if positions are mass-weighted (centers of mass rather than of geometry). */
  public final boolean massWeighted;

  PositionType(Block block, boolean massWeighted) {
    this.block = block;
    this.massWeighted = massWeighted;
  }

  /** Returns a key that is equal for two atoms if and only if they belong to the same block. */
  int blockKey(Topology topology, int atom) {
    return switch (block) {
      case ATOM -> atom;
      case RESIDUE -> topology.residueIndex(atom);
      case MOLECULE -> topology.moleculeIndex(atom);
      case WHOLE -> 0;
    };
  }

  /** Parses a position type given in the form used by configuration files, e.g. "res_com". */
  public static PositionType parse(String s) {
    try {
      return valueOf(Ascii.toUpperCase(s.trim()));
    } catch (IllegalArgumentException e) {
      String choices =
          Arrays.stream(values())
              .map(t -> Ascii.toLowerCase(t.name()))
              .collect(Collectors.joining(", "));
      throw new IllegalArgumentException(
          String.format("Unknown position type '%s' (expected one of %s)", s, choices), e);
    }
  }

  @Override
  public String toString() {
    return Ascii.toLowerCase(name());
  }
}
