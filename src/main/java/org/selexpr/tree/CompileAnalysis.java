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

package org.selexpr.tree;

import com.google.common.base.Preconditions;
import java.util.EnumSet;
import org.jspecify.annotations.Nullable;
import org.selexpr.util.IndexSet;

/**
 * The state the compiler attaches to each node while it is being compiled: flags, the evaluation
 * dispatch override, and the node's minimal and maximal groups.
 *
 * <p>The minimal group ({@code gmin}) is a subset of the node's value in every frame; the maximal
 * group ({@code gmax}) is a superset. Some nodes don't keep their own bounds: a static group node
 * uses its own value for both, and a subexpression with a single referrer (or one evaluated for its
 * whole maximal group) uses its body's bounds.
 */
public final class CompileAnalysis {

  /** How calls to evaluate the node are handled while this analysis is attached. */
  public enum Dispatch {
    /** Run the node's real evaluation routine (as selected by its {@link EvalTag}). */
    REAL,
    /** Pass the call to the compiler's analyzer. */
    ANALYZE,
    /** Skip the node; its value is already final for the rest of compilation. */
    NONE
  }

  private enum BoundsSource {
    NONE,
    OWN,
    VALUE,
    CHILD
  }

  private final Node node;
  private final EnumSet<CompileFlag> flags = EnumSet.noneOf(CompileFlag.class);
  private Dispatch dispatch = Dispatch.REAL;
  private BoundsSource boundsSource = BoundsSource.NONE;
  private IndexSet minGroup = IndexSet.EMPTY;
  private IndexSet maxGroup = IndexSet.EMPTY;

  public CompileAnalysis(Node node) {
    this.node = node;
  }

  public boolean has(CompileFlag flag) {
    return flags.contains(flag);
  }

  public void set(CompileFlag flag) {
    flags.add(flag);
  }

  public void clear(CompileFlag flag) {
    flags.remove(flag);
  }

  /** Returns a copy of the current flags. */
  public EnumSet<CompileFlag> flags() {
    return EnumSet.copyOf(flags);
  }

  public Dispatch dispatch() {
    return dispatch;
  }

  public void setDispatch(Dispatch dispatch) {
    this.dispatch = dispatch;
  }

  /** Gives this node its own bounds, which are updated whenever it is analyzed. */
  public void allocateBounds() {
    boundsSource = BoundsSource.OWN;
    flags.add(CompileFlag.MINMAX_ALLOC);
    flags.add(CompileFlag.DO_MINMAX);
  }

  /** Makes both bounds of this (static, group-valued) node equal to its current value. */
  public void aliasBoundsToValue() {
    Preconditions.checkState(node.type() == ValueType.GROUP);
    boundsSource = BoundsSource.VALUE;
  }

  /** Makes this node's bounds the bounds of its only child. */
  public void aliasBoundsToChild() {
    boundsSource = BoundsSource.CHILD;
  }

  /** Returns true if this node has bounds, either its own or shared. */
  public boolean hasBounds() {
    return boundsSource != BoundsSource.NONE;
  }

  /** Returns true if {@link #minGroup} and {@link #maxGroup} are shared with another node. */
  public boolean boundsAliased() {
    return boundsSource == BoundsSource.VALUE || boundsSource == BoundsSource.CHILD;
  }

  public @Nullable IndexSet minGroup() {
    return switch (boundsSource) {
      case NONE -> null;
      case OWN -> minGroup;
      case VALUE -> node.value().group();
      case CHILD -> childAnalysis() == null ? null : childAnalysis().minGroup();
    };
  }

  public @Nullable IndexSet maxGroup() {
    return switch (boundsSource) {
      case NONE -> null;
      case OWN -> maxGroup;
      case VALUE -> node.value().group();
      case CHILD -> childAnalysis() == null ? null : childAnalysis().maxGroup();
    };
  }

  private @Nullable CompileAnalysis childAnalysis() {
    return node.children().isEmpty() ? null : node.child(0).analysis();
  }

  /** Sets this node's own bounds. */
  public void setBounds(IndexSet min, IndexSet max) {
    Preconditions.checkState(boundsSource == BoundsSource.OWN, "Bounds are not owned");
    this.minGroup = min;
    this.maxGroup = max;
  }

  /** Sets this node's own maximal group, leaving the minimal group unchanged. */
  public void setMaxGroup(IndexSet max) {
    Preconditions.checkState(boundsSource == BoundsSource.OWN, "Bounds are not owned");
    this.maxGroup = max;
  }

  /** Empties this node's own bounds before re-analysis. */
  public void resetBounds() {
    if (boundsSource == BoundsSource.OWN) {
      minGroup = IndexSet.EMPTY;
      maxGroup = IndexSet.EMPTY;
    }
  }

  /** Returns the flags in the compact form used by tree dumps, e.g. "DSMA". */
  public String flagCodes() {
    StringBuilder sb = new StringBuilder();
    if (has(CompileFlag.FULL_EVAL)) {
      sb.append(CompileFlag.FULL_EVAL.code);
    }
    if (!has(CompileFlag.STATIC)) {
      sb.append('D');
    }
    for (CompileFlag flag : flags) {
      if (flag != CompileFlag.FULL_EVAL) {
        sb.append(flag.code);
      }
    }
    return sb.isEmpty() ? "0" : sb.toString();
  }
}
