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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import org.selexpr.compiler.InputInconsistencyError;
import org.selexpr.compiler.SelectionCompiler;
import org.selexpr.compiler.StructuralError;
import org.selexpr.compiler.TreePrinter;
import org.selexpr.eval.EvalContext;
import org.selexpr.eval.Evaluator;
import org.selexpr.eval.MemoryPool;
import org.selexpr.position.Frame;
import org.selexpr.position.Topology;
import org.selexpr.tree.Node;
import org.selexpr.tree.NodeKind;
import org.selexpr.tree.Nodes;
import org.selexpr.tree.ValueType;
import org.selexpr.util.IndexSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A set of selections (and the variables they use) over one topology, compiled together so that
 * shared work is done once per frame.
 *
 * <p>Usage: build expressions with {@link Nodes}, register them with {@link #addVariable} and
 * {@link #addSelection}, call {@link #compile} once, and then {@link #evaluate} for each frame.
 * If compilation fails the collection can no longer be used.
 */
public final class SelectionCollection {
  private static final Logger LOG = LoggerFactory.getLogger(SelectionCollection.class);

  private enum State {
    BUILDING,
    COMPILED,
    FAILED
  }

  private final Topology topology;
  private final CompileOptions options;
  private final EvalContext ctx;

  /** The chain of ROOT nodes, in evaluation order. */
  private final List<Node> roots = new ArrayList<>();

  private final List<Selection> selections = new ArrayList<>();
  private State state = State.BUILDING;

  /** Creates a collection whose universe is every atom of {@code topology}. */
  public SelectionCollection(Topology topology, CompileOptions options) {
    this(topology, topology.allAtoms(), options);
  }

  public SelectionCollection(Topology topology, IndexSet universe, CompileOptions options) {
    Preconditions.checkArgument(
        universe.isEmpty() || universe.get(universe.size() - 1) < topology.atomCount(),
        "Universe is not within the topology");
    this.topology = topology;
    this.options = options;
    this.ctx = new EvalContext(topology, universe, new MemoryPool());
  }

  /**
   * Defines a variable; the returned node can be passed to {@link Nodes} factories (or {@link
   * Nodes#ref}) to use its value. Variables that no selection uses are dropped when compiling.
   */
  public Node addVariable(String name, Node value) {
    checkBuilding();
    Node variable = Nodes.variable(name, value);
    roots.add(Node.root(null, variable));
    return variable;
  }

  /** Adds a selection with the given group- or position-valued expression. */
  public Selection addSelection(String name, Node expression) {
    checkBuilding();
    if (expression.kind() == NodeKind.SUBEXPR) {
      expression = Nodes.ref(expression);
    }
    if (expression.type() != ValueType.GROUP && expression.type() != ValueType.POSITION) {
      throw StructuralError.format(
          "Selection '%s' must be a group or positions, not %s", name, expression.type());
    }
    Node root = Node.root(name, expression);
    roots.add(root);
    Selection selection = new Selection(name, root);
    selections.add(selection);
    return selection;
  }

  /** Compiles all selections; must be called once, before the first {@link #evaluate}. */
  public void compile() {
    checkBuilding();
    try {
      new SelectionCompiler(ctx, options).compile(roots);
      for (Selection selection : selections) {
        selection.initialize(ctx, options);
      }
      state = State.COMPILED;
    } catch (RuntimeException e) {
      state = State.FAILED;
      LOG.debug("Compilation failed", e);
      throw e;
    }
  }

  /** Evaluates every selection for {@code frame}. */
  public void evaluate(Frame frame) {
    Preconditions.checkState(state == State.COMPILED, "Collection is %s", state);
    if (frame.atomCount() != topology.atomCount()) {
      throw InputInconsistencyError.format(
          "Frame has %s atoms, topology has %s", frame.atomCount(), topology.atomCount());
    }
    ctx.setFrame(frame);
    for (Node root : roots) {
      Evaluator.beginFrame(root);
    }
    for (Node root : roots) {
      Evaluator.evaluate(ctx, root, null);
    }
    for (Selection selection : selections) {
      selection.update(ctx);
    }
  }

  public ImmutableList<Selection> selections() {
    return ImmutableList.copyOf(selections);
  }

  /** Returns the chain of ROOT nodes; after compilation, the compiled form. */
  public ImmutableList<Node> chain() {
    return ImmutableList.copyOf(roots);
  }

  /** The size of the memory pool reserved when compiling. */
  public int poolSize() {
    return ctx.pool().arenaSize();
  }

  public Topology topology() {
    return topology;
  }

  public IndexSet universe() {
    return ctx.universe();
  }

  /** Renders the chain for debugging. */
  public String dumpTree() {
    return TreePrinter.print(roots);
  }

  private void checkBuilding() {
    Preconditions.checkState(state == State.BUILDING, "Collection is %s", state);
  }
}
