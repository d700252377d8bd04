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

import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import org.selexpr.tree.CompileFlag;
import org.selexpr.tree.EvalTag;
import org.selexpr.tree.Node;
import org.selexpr.tree.NodeKind;
import org.selexpr.tree.Storage;
import org.selexpr.tree.ValueShape;
import org.selexpr.tree.ValueType;
import org.selexpr.util.IndexSet;
import org.selexpr.util.SizeOf;

/**
 * Decides how each node's value is stored once compilation is complete, and how large the memory
 * pool must be. Must run while the nodes' bounds are still attached.
 */
final class StoragePlanner {
  private final IndexSet universe;

  /** The peak pool usage while evaluating each subexpression, computed once. */
  private final Map<Node, Long> subexprPeaks = new IdentityHashMap<>();

  StoragePlanner(IndexSet universe) {
    this.universe = universe;
  }

  /** Sets the {@link Storage} of every node and returns the number of bytes the pool needs. */
  long plan(List<Node> roots) {
    for (Node root : roots) {
      classify(root);
    }
    long poolSize = 0;
    for (Node root : roots) {
      poolSize = Math.max(poolSize, peak(root));
    }
    return poolSize;
  }

  private void classify(Node node) {
    Storage storage;
    if (node.kind() == NodeKind.CONSTANT) {
      storage = Storage.dedicated(SizeOf.elements(node.value().size(), node.type().elementSize));
    } else if (node.isPooled()) {
      storage = Storage.pooled(bytes(node));
    } else if (node.kind() == NodeKind.SUBEXPR
        && !node.children().isEmpty()
        && node.value() == node.child(0).value()) {
      storage = Storage.aliased(node.child(0));
    } else if (node.kind() == NodeKind.SUBEXPR_REF
        && !node.target().children().isEmpty()
        && node.value() == node.target().child(0).value()) {
      storage = Storage.aliased(node.target().child(0));
    } else {
      storage = Storage.dedicated(bytes(node));
    }
    node.setStorage(storage);
    if (node.kind() != NodeKind.SUBEXPR_REF) {
      for (Node child : node.children()) {
        classify(child);
      }
    }
  }

  private long bytes(Node node) {
    return SizeOf.elements(capacity(node), node.type().elementSize);
  }

  /** Returns the number of elements the node's value may need. */
  private int capacity(Node node) {
    if (node.type() == ValueType.GROUP || node.shape() == ValueShape.PER_ATOM) {
      return FlagPropagator.maxOf(node, universe).size();
    } else if (node.shape() == ValueShape.SINGLE) {
      return 1;
    }
    List<Node> children = FlagPropagator.analysisChildren(node);
    return children.isEmpty() ? node.value().size() : capacity(children.get(0));
  }

  private long pooledBytes(Node node) {
    return node.isPooled() ? node.storage().bytes() : 0;
  }

  /** Returns the most pool bytes reserved at any one time while evaluating {@code node}. */
  private long peak(Node node) {
    switch (node.kind()) {
      case SUBEXPR_REF -> {
        Node target = node.target();
        return (target.kind() == NodeKind.SUBEXPR) ? peak(target) : 0;
      }
      case SUBEXPR -> {
        Long known = subexprPeaks.get(node);
        if (known != null) {
          return known;
        }
        long result = 0;
        if (!node.children().isEmpty()) {
          Node body = node.child(0);
          result = pooledBytes(body) + peak(body);
          if (node.evalTag() == EvalTag.SUBEXPR
              && node.analysis().has(CompileFlag.COMMON_SUBEXPR)) {
            // The group still to be evaluated is kept while the body is evaluated
            result += SizeOf.elements(FlagPropagator.maxOf(node, universe).size(), SizeOf.INT);
          }
        }
        subexprPeaks.put(node, result);
        return result;
      }
      case ARITHMETIC -> {
        // All operands are reserved before any is evaluated
        long reserved = 0;
        long inner = 0;
        for (Node child : node.children()) {
          reserved += pooledBytes(child);
          inner = Math.max(inner, peak(child));
        }
        return reserved + inner;
      }
      default -> {
        long result = 0;
        for (Node child : node.children()) {
          result = Math.max(result, pooledBytes(child) + peak(child));
        }
        return result;
      }
    }
  }
}
