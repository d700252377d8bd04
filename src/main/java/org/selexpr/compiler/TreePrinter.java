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
import org.jspecify.annotations.Nullable;
import org.selexpr.tree.CompileAnalysis;
import org.selexpr.tree.Node;
import org.selexpr.tree.NodeKind;
import org.selexpr.util.IndexSet;

/**
 * Renders a chain of selection trees, one node per line, for debugging. While compile-time state
 * is attached each line also shows the node's flags and bounds, e.g.
 *
 * <pre>
 * BOOLEAN AND dyn eval=AND cdata: flg=DSM gmin=(0 atoms) gmax=(100 atoms)
 * </pre>
 */
public final class TreePrinter {

  // Statics only
  private TreePrinter() {}

  public static String print(List<Node> roots) {
    StringBuilder sb = new StringBuilder();
    for (Node root : roots) {
      print(sb, root, 0);
    }
    return sb.toString();
  }

  private static void print(StringBuilder sb, Node node, int depth) {
    sb.append("  ".repeat(depth)).append(node.describe());
    if (node.isDynamic()) {
      sb.append(" dyn");
    }
    if (node.kind() == NodeKind.SUBEXPR) {
      sb.append(" refc=").append(node.refCount());
    }
    if (node.evalTag() != null) {
      sb.append(" eval=").append(node.evalTag());
    }
    if (node.isPooled()) {
      sb.append(" pool");
    }
    CompileAnalysis analysis = node.analysis();
    if (analysis != null) {
      sb.append(" cdata: flg=").append(analysis.flagCodes());
      if (analysis.hasBounds()) {
        sb.append(" gmin=").append(size(analysis.minGroup()));
        sb.append(" gmax=").append(size(analysis.maxGroup()));
      }
    } else if (node.storage() != null) {
      sb.append(" storage=").append(node.storage());
    }
    sb.append('\n');
    if (node.kind() != NodeKind.SUBEXPR_REF) {
      for (Node child : node.children()) {
        print(sb, child, depth + 1);
      }
    }
  }

  private static String size(@Nullable IndexSet group) {
    return (group == null) ? "(none)" : "(" + group.size() + " atoms)";
  }
}
