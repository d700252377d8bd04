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

/** The kinds of node that can appear in a selection tree. */
public enum NodeKind {
  /** Top-level node of a selection or of an extracted subexpression; has exactly one child. */
  ROOT,
  /** A named, shared subtree; its single child is the body. */
  SUBEXPR,
  /** A reference to a SUBEXPR (or, before extraction, to an unwrapped parameter expression). */
  SUBEXPR_REF,
  CONSTANT,
  BOOLEAN,
  ARITHMETIC,
  /** A call to a selection method; children are its parameter references. */
  METHOD,
  /** A call to a modifier method, which post-processes positions. */
  MODIFIER,
  /** A reference to a named group that the front end failed to resolve. */
  GROUP_REF
}
