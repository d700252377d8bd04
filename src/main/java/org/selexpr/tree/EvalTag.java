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

/**
 * Identifies the evaluation routine used for a node. Tags are assigned by the compiler; a node
 * with no tag is never evaluated (its value is fixed).
 */
public enum EvalTag {
  /** Intersects a stored constant group with the requested group. */
  STATIC,
  METHOD,
  MODIFIER,
  ARITHMETIC,
  NOT,
  AND,
  OR,
  ROOT,
  /** A subexpression with a single reference; evaluates its body in place. */
  SUBEXPR_SIMPLE,
  /** A subexpression with several references; evaluates only the atoms not yet evaluated. */
  SUBEXPR,
  /** A subexpression whose evaluation group is fixed; evaluated once per frame. */
  SUBEXPR_STATIC_EVAL,
  SUBEXPR_REF_SIMPLE,
  SUBEXPR_REF
}
