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

package org.selexpr.compiler;

import java.util.List;
import org.selexpr.method.MethodCall;
import org.selexpr.position.PositionType;
import org.selexpr.tree.Node;
import org.selexpr.tree.NodeKind;

/**
 * Chooses the position type of calls that were given none: positions that make up a selection
 * use the selection type, and positions used as input to other methods use the reference type.
 */
final class PositionDefaults {
  private final PositionType selectionType;
  private final PositionType referenceType;
  private final boolean evaluateVelocities;
  private final boolean evaluateForces;

  PositionDefaults(
      PositionType selectionType,
      PositionType referenceType,
      boolean evaluateVelocities,
      boolean evaluateForces) {
    this.selectionType = selectionType;
    this.referenceType = referenceType;
    this.evaluateVelocities = evaluateVelocities;
    this.evaluateForces = evaluateForces;
  }

  /**
   * Applies the defaults below each ROOT. Before extraction the ROOTs of variables are the ones
   * whose child is a SUBEXPR; every other ROOT is a selection.
   */
  void apply(List<Node> roots) {
    for (Node root : roots) {
      apply(root, root.child(0).kind() != NodeKind.SUBEXPR);
    }
  }

  private void apply(Node node, boolean selection) {
    MethodCall call = node.call();
    if (node.kind() == NodeKind.METHOD
        && call.method().usesPositionType()
        && call.positionType() == null) {
      call.setPositionType(selection ? selectionType : referenceType);
      if (selection) {
        call.setEvaluate(evaluateVelocities, evaluateForces);
      }
    }
    // Only the direct value of a selection is part of it
    boolean passOn =
        selection
            && switch (node.kind()) {
              case ROOT, MODIFIER, SUBEXPR, SUBEXPR_REF -> true;
              default -> false;
            };
    if (node.kind() == NodeKind.SUBEXPR_REF) {
      apply(node.target(), passOn);
    } else {
      for (Node child : node.children()) {
        apply(child, passOn);
      }
    }
  }
}
