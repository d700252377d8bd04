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

import java.util.ArrayList;
import java.util.List;
import org.selexpr.tree.Node;
import org.selexpr.tree.NodeKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Moves every expression that supplies a method parameter into its own named SUBEXPR under a new
 * ROOT, and removes ROOTs whose subexpression is no longer referenced.
 *
 * <p>New ROOTs are inserted immediately before the ROOT that uses them, so each SUBEXPR precedes
 * every reference to it in the chain.
 */
final class SubexpressionExtractor {
  private static final Logger LOG = LoggerFactory.getLogger(SubexpressionExtractor.class);

  /** Numbers the extracted subexpressions; one extractor is used for each compilation. */
  private int counter;

  /** Extracts subexpressions from every ROOT of {@code roots}, which is modified in place. */
  void extract(List<Node> roots) {
    for (int i = 0; i < roots.size(); i++) {
      List<Node> extracted = new ArrayList<>();
      extractFrom(roots.get(i), extracted);
      roots.addAll(i, extracted);
      i += extracted.size();
    }
  }

  private void extractFrom(Node node, List<Node> extracted) {
    for (Node child : node.children()) {
      extractFrom(child, extracted);
    }
    if (node.kind() != NodeKind.SUBEXPR_REF) {
      return;
    }
    Node target = node.target();
    if (target.kind() == NodeKind.SUBEXPR && target.name() != null) {
      // A variable, which already has its own ROOT
      return;
    }
    extractFrom(target, extracted);
    Node subexpr = (target.kind() == NodeKind.SUBEXPR) ? target : Node.subexpr(null, target, 1);
    subexpr.setName("SubExpr " + ++counter);
    subexpr.incrementRefCount();
    node.setTarget(subexpr);
    node.setName(subexpr.name());
    extracted.add(Node.root(null, subexpr));
    LOG.debug("Extracted {}", subexpr.name());
  }

  /**
   * Removes the ROOTs of subexpressions that are referenced only by their ROOT. The chain is
   * processed last to first, so subexpressions that were only used by removed ones are removed
   * too.
   */
  static void pruneUnused(List<Node> roots) {
    for (int i = roots.size() - 1; i >= 0; i--) {
      Node child = roots.get(i).child(0);
      if (child.kind() == NodeKind.SUBEXPR && child.refCount() == 1) {
        LOG.debug("Removing unused subexpression {}", child.name());
        release(child);
        roots.remove(i);
      }
    }
  }

  /** Drops the references in the subtree of {@code node}, including subtrees that refs own. */
  private static void release(Node node) {
    if (node.kind() == NodeKind.SUBEXPR_REF) {
      Node target = node.target();
      if (target.kind() == NodeKind.SUBEXPR && target.name() != null) {
        target.decrementRefCount();
      } else {
        release(target);
      }
      return;
    }
    for (Node child : node.children()) {
      release(child);
    }
  }
}
