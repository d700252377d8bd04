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

import org.jspecify.annotations.Nullable;

/**
 * The storage planned for a node's value after compilation.
 *
 * @param kind how the storage is provided
 * @param bytes the number of bytes the node is expected to need; zero for aliased storage
 * @param source for ALIASED storage, the node whose value is shared
 */
public record Storage(Kind kind, long bytes, @Nullable Node source) {

  /** The ways a node's value may be stored. */
  public enum Kind {
    /** The node owns its value. */
    DEDICATED,
    /** The node shares another node's value. */
    ALIASED,
    /** The value is reserved from the memory pool for the duration of the parent's evaluation. */
    POOLED
  }

  public static Storage dedicated(long bytes) {
    return new Storage(Kind.DEDICATED, bytes, null);
  }

  public static Storage aliased(Node source) {
    return new Storage(Kind.ALIASED, 0, source);
  }

  public static Storage pooled(long bytes) {
    return new Storage(Kind.POOLED, bytes, null);
  }

  @Override
  public String toString() {
    return switch (kind) {
      case DEDICATED -> "dedicated(" + bytes + ")";
      case POOLED -> "pooled(" + bytes + ")";
      case ALIASED -> "aliased";
    };
  }
}
