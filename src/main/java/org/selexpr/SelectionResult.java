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

package org.selexpr;

import org.selexpr.position.Positions;
import org.selexpr.util.IndexSet;

/**
 * The value of a selection in one frame.
 *
 * @param group the selected atoms
 * @param positions the selection's positions, with velocities and forces if requested
 * @param masses the total mass of the atoms making up each position
 * @param charges the total charge of the atoms making up each position
 */
public record SelectionResult(
    IndexSet group, Positions positions, double[] masses, double[] charges) {

  public int positionCount() {
    return positions.count();
  }
}
