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
import org.selexpr.tree.Node;
import org.selexpr.util.IndexSet;

/**
 * Receives evaluation requests for nodes whose dispatch has been redirected during compilation.
 */
@FunctionalInterface
public interface Analyzer {
  void analyze(EvalContext ctx, Node node, @Nullable IndexSet g);
}
