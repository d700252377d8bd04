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

/** Per-node flags computed by the compiler and discarded when compilation completes. */
public enum CompileFlag {
  /** The subexpression must be evaluated for its whole maximal group, independent of referrers. */
  FULL_EVAL("F"),
  /** The node's value cannot change between frames; it will be folded to a constant. */
  STATIC(""),
  /** The node is always evaluated with the same group. */
  STATIC_EVAL("S"),
  /** Downstream analysis should use the node's maximal rather than minimal group as its value. */
  EVAL_MAX("M"),
  /** The node has its own min/max groups, rather than sharing another node's. */
  MINMAX_ALLOC("A"),
  /** The node's min/max groups are updated when it is analyzed. */
  DO_MINMAX(""),
  /** A subexpression (or reference to one) with exactly one referrer. */
  SIMPLE_SUBEXPR("Ss"),
  /** A subexpression (or a node inside one) with several referrers and no fixed group. */
  COMMON_SUBEXPR("Sc");

  /** The code used for this flag in tree dumps; empty if the flag is not shown directly. */
  final String code;

  CompileFlag(String code) {
    this.code = code;
  }
}
