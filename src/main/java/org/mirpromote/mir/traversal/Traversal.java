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

package org.mirpromote.mir.traversal;

import com.google.common.collect.ImmutableList;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import org.mirpromote.mir.BasicBlock;
import org.mirpromote.mir.Mir;

/**
 * A static-only class that orders the blocks of a {@link Mir} reachable from {@link
 * BasicBlock#START_BLOCK}. Blocks that cannot be reached are omitted from every ordering.
 *
 * <p>Successors are explored in the order returned by {@link
 * org.mirpromote.mir.TerminatorKind#successors}, so the orderings are deterministic.
 */
public class Traversal {
  // Statics only
  private Traversal() {}

  /** Returns the reachable blocks in depth-first preorder: each block before its successors. */
  public static ImmutableList<BasicBlock> preorder(Mir mir) {
    ImmutableList.Builder<BasicBlock> result = ImmutableList.builder();
    boolean[] visited = new boolean[mir.numBlocks()];
    Deque<BasicBlock> worklist = new ArrayDeque<>();
    worklist.push(BasicBlock.START_BLOCK);
    while (!worklist.isEmpty()) {
      BasicBlock bb = worklist.pop();
      if (visited[bb.index]) {
        continue;
      }
      visited[bb.index] = true;
      result.add(bb);
      // Push in reverse so that the first successor is the next one popped.
      ImmutableList<BasicBlock> successors = mir.block(bb).terminator().kind().successors();
      for (BasicBlock succ : successors.reverse()) {
        if (!visited[succ.index]) {
          worklist.push(succ);
        }
      }
    }
    return result.build();
  }

  /**
   * Returns the reachable blocks in depth-first postorder: each block after all of its successors
   * that were first reached through it.
   */
  public static ImmutableList<BasicBlock> postorder(Mir mir) {
    ImmutableList.Builder<BasicBlock> result = ImmutableList.builder();
    boolean[] visited = new boolean[mir.numBlocks()];
    // Each entry is a block whose successors are still being explored, and an iterator over the
    // ones that haven't been looked at yet.
    Deque<Frame> stack = new ArrayDeque<>();
    visited[BasicBlock.START_BLOCK.index] = true;
    stack.push(new Frame(mir, BasicBlock.START_BLOCK));
    while (!stack.isEmpty()) {
      Frame top = stack.peek();
      if (top.successors.hasNext()) {
        BasicBlock succ = top.successors.next();
        if (!visited[succ.index]) {
          visited[succ.index] = true;
          stack.push(new Frame(mir, succ));
        }
      } else {
        stack.pop();
        result.add(top.block);
      }
    }
    return result.build();
  }

  /**
   * Returns the reachable blocks in reverse postorder. Ignoring back edges, each block comes after
   * all of its predecessors, so a block's dominators are always visited before it.
   */
  public static ImmutableList<BasicBlock> reversePostorder(Mir mir) {
    return postorder(mir).reverse();
  }

  private static class Frame {
    final BasicBlock block;
    final Iterator<BasicBlock> successors;

    Frame(Mir mir, BasicBlock block) {
      this.block = block;
      this.successors = mir.block(block).terminator().kind().successors().iterator();
    }
  }
}
