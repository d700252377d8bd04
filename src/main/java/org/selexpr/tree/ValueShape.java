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

/** How many values a node produces for an evaluation group. */
public enum ValueShape {
  /** Exactly one value, independent of the group. */
  SINGLE,
  /** One value per atom of the evaluation group. */
  PER_ATOM,
  /** A count that is only known after evaluation (e.g. the number of positions). */
  VARIABLE
}
