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

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableList;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.mirpromote.mir.BasicBlock;
import org.mirpromote.mir.Mir;
import org.mirpromote.mir.Operand;
import org.mirpromote.mir.Span;
import org.mirpromote.mir.TerminatorKind;
import org.mirpromote.mir.Ty;

@RunWith(JUnit4.class)
public class TraversalTest {
  private Mir mir;
  private Operand cond;

  @Before
  public void setup() {
    mir = new Mir(Span.DUMMY, Ty.UNIT);
    cond = Operand.consume(mir.newArg("c", Ty.BOOL));
  }

  private static BasicBlock bb(int index) {
    return BasicBlock.of(index);
  }

  private void block(TerminatorKind terminator) {
    mir.newBlock(Span.DUMMY, terminator);
  }

  @Test
  public void diamondWithUnreachableBlock() {
    block(new TerminatorKind.If(cond, bb(1), bb(2)));
    block(new TerminatorKind.Goto(bb(3)));
    block(new TerminatorKind.Goto(bb(3)));
    block(TerminatorKind.RETURN);
    // Not reachable from the start block
    block(new TerminatorKind.Goto(bb(3)));

    assertThat(Traversal.preorder(mir)).containsExactly(bb(0), bb(1), bb(3), bb(2)).inOrder();
    assertThat(Traversal.postorder(mir)).containsExactly(bb(3), bb(1), bb(2), bb(0)).inOrder();
    assertThat(Traversal.reversePostorder(mir))
        .containsExactly(bb(0), bb(2), bb(1), bb(3))
        .inOrder();
  }

  @Test
  public void loop() {
    block(new TerminatorKind.Goto(bb(1)));
    block(new TerminatorKind.If(cond, bb(2), bb(3)));
    block(new TerminatorKind.Goto(bb(1)));
    block(TerminatorKind.RETURN);

    assertThat(Traversal.postorder(mir)).containsExactly(bb(2), bb(3), bb(1), bb(0)).inOrder();
    // The loop header comes before both the body and the exit.
    assertThat(Traversal.reversePostorder(mir))
        .containsExactly(bb(0), bb(1), bb(3), bb(2))
        .inOrder();
  }

  @Test
  public void selfLoop() {
    block(new TerminatorKind.Goto(bb(0)));

    assertThat(Traversal.preorder(mir)).containsExactly(bb(0));
    assertThat(Traversal.reversePostorder(mir)).containsExactly(bb(0));
  }

  @Test
  public void callWithCleanup() {
    Operand f = Operand.value(Ty.fnDef("f"), "f");
    block(
        new TerminatorKind.Call(
            f,
            ImmutableList.of(),
            new TerminatorKind.Destination(mir.newTemp(Ty.I32), bb(1)),
            bb(2)));
    block(TerminatorKind.RETURN);
    block(TerminatorKind.RESUME);

    assertThat(Traversal.reversePostorder(mir))
        .containsExactly(bb(0), bb(2), bb(1))
        .inOrder();
  }
}
