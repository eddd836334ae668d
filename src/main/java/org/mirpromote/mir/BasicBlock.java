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

/**
 * Identifies a basic block by its index in the owning {@link Mir}. Block indices are assigned
 * sequentially as blocks are added and never change, so a BasicBlock remains valid while statements
 * and terminators within the body are rewritten.
 */
public final class BasicBlock implements Comparable<BasicBlock> {
  /** Execution of every body starts at its first block. */
  public static final BasicBlock START_BLOCK = new BasicBlock(0);

  public final int index;

  private BasicBlock(int index) {
    this.index = index;
  }

  public static BasicBlock of(int index) {
    Preconditions.checkArgument(index >= 0);
    return (index == 0) ? START_BLOCK : new BasicBlock(index);
  }

  @Override
  public int compareTo(BasicBlock other) {
    return Integer.compare(index, other.index);
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof BasicBlock other && index == other.index;
  }

  @Override
  public int hashCode() {
    return index;
  }

  @Override
  public String toString() {
    return "bb" + index;
  }
}
