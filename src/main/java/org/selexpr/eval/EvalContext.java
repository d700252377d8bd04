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

package org.selexpr.eval;

import org.jspecify.annotations.Nullable;
import org.selexpr.position.Frame;
import org.selexpr.position.Topology;
import org.selexpr.util.IndexSet;

/**
 * The state shared by all evaluations in a collection: the topology, the universe, the memory pool
 * and the current frame.
 */
public final class EvalContext {
  private final Topology topology;
  private final IndexSet universe;
  private final MemoryPool pool;
  private @Nullable Frame frame;
  private @Nullable Analyzer analyzer;

  public EvalContext(Topology topology, IndexSet universe, MemoryPool pool) {
    this.topology = topology;
    this.universe = universe;
    this.pool = pool;
  }

  public Topology topology() {
    return topology;
  }

  /** The group of all atoms that selections may contain. */
  public IndexSet universe() {
    return universe;
  }

  public MemoryPool pool() {
    return pool;
  }

  /** Returns the current frame, or null if there is none (e.g. during compilation). */
  public @Nullable Frame frame() {
    return frame;
  }

  public void setFrame(@Nullable Frame frame) {
    this.frame = frame;
  }

  /** Returns the analyzer that receives redirected evaluations, or null outside compilation. */
  public @Nullable Analyzer analyzer() {
    return analyzer;
  }

  public void setAnalyzer(@Nullable Analyzer analyzer) {
    this.analyzer = analyzer;
  }

  /** Returns {@code g}, or the universe if {@code g} is null. */
  public IndexSet groupOrUniverse(@Nullable IndexSet g) {
    return (g == null) ? universe : g;
  }
}
