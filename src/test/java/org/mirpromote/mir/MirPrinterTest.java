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

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class MirPrinterTest {

  @Test
  public void bodyWithCleanupBlock() {
    Mir mir = new Mir(Span.DUMMY, Ty.ref(Ty.I32));
    Lvalue.Arg a0 = mir.newArg("n", Ty.I32);
    mir.newArg("m", Ty.BOOL);
    Lvalue.Var v0 = mir.newVar("x", Ty.I32);
    Lvalue.Temp t0 = mir.newTemp(Ty.I32);
    Operand f = Operand.constant(Ty.fnDef("g"), new Literal.Item("g"));
    BasicBlock bb0 =
        mir.newBlock(
            new Span(4, 10),
            new TerminatorKind.Call(
                f,
                ImmutableList.of(Operand.consume(t0)),
                new TerminatorKind.Destination(v0, BasicBlock.of(1)),
                BasicBlock.of(2)));
    mir.block(bb0)
        .statements
        .add(
            new Statement(
                new Span(0, 3),
                t0,
                Rvalue.binary(Rvalue.BinOp.ADD, Operand.consume(a0), Operand.value(Ty.I32, 1))));
    BasicBlock bb1 = mir.newBlock(new Span(11, 12), TerminatorKind.RETURN);
    mir.block(bb1)
        .statements
        .add(new Statement(new Span(11, 12), Lvalue.RETURN_POINTER, Rvalue.ref(v0)));
    BasicBlock bb2 = mir.newBlock(new Span(13, 14), TerminatorKind.RESUME);
    mir.block(bb2).isCleanup = true;

    assertThat(mir.toString())
        .isEqualTo(
            """
            fn(arg0: i32, arg1: bool) -> &i32 {
                let var0: i32; // x
                let tmp0: i32;

                bb0: {
                    tmp0 = Add(arg0, const 1);
                    var0 = const g(tmp0) -> [return: bb1, unwind: bb2];
                }

                bb1: {
                    return = &var0;
                    return;
                }

                bb2: { // cleanup
                    resume;
                }
            }
            """);
    assertThat(MirPrinter.print(mir, PrintOptions.WITH_SPANS))
        .contains(
            """
                bb0: {
                    tmp0 = Add(arg0, const 1); // 0..3
                    var0 = const g(tmp0) -> [return: bb1, unwind: bb2]; // 4..10
                }
            """);
  }

  @Test
  public void nestedPromotedBodies() {
    Mir mir = new Mir(Span.DUMMY, null);
    mir.newBlock(Span.DUMMY, TerminatorKind.UNREACHABLE);
    Mir promoted = new Mir(Span.DUMMY, Ty.ref(Ty.I32));
    promoted.newBlock(Span.DUMMY, TerminatorKind.RETURN);
    Mir nested = new Mir(Span.DUMMY, Ty.BOOL);
    nested.newBlock(Span.DUMMY, TerminatorKind.RETURN);
    promoted.promoted.add(nested);
    mir.promoted.add(promoted);

    assertThat(mir.toString())
        .isEqualTo(
            """
            fn() -> ! {
                bb0: {
                    unreachable;
                }
            }

            promoted0() -> &i32 {
                bb0: {
                    return;
                }
            }

            promoted0.promoted0() -> bool {
                bb0: {
                    return;
                }
            }
            """);
    PrintOptions withoutPromoted =
        new PrintOptions() {
          @Override
          public boolean showPromoted() {
            return false;
          }
        };
    assertThat(MirPrinter.print(mir, withoutPromoted)).doesNotContain("promoted0");
  }
}
