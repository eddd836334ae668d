/*
 * Copyright 2025 The Retrospect Authors
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

package org.mirpromote.mir;

import com.google.common.base.Preconditions;
import java.util.Objects;

/**
 * Identifies a single definition site in a body: either the statement at {@link #statementIndex}
 * of {@link #block}, or (if {@code statementIndex} equals the number of statements in that block)
 * the block's terminator.
 */
public final class Location {
  public final BasicBlock block;
  public final int statementIndex;

  public Location(BasicBlock block, int statementIndex) {
    Preconditions.checkArgument(statementIndex >= 0);
    this.block = block;
    this.statementIndex = statementIndex;
  }

  /** Returns true if this location addresses the terminator of its block in {@code mir}. */
  public boolean isTerminator(Mir mir) {
    return statementIndex >= mir.block(block).statements.size();
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof Location other
        && block.equals(other.block)
        && statementIndex == other.statementIndex;
  }

  @Override
  public int hashCode() {
    return Objects.hash(block, statementIndex);
  }

  @Override
  public String toString() {
    return block + "[" + statementIndex + "]";
  }
}
