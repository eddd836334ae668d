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

package org.mirpromote.mir.visit;

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.mirpromote.mir.BasicBlock;
import org.mirpromote.mir.Literal;
import org.mirpromote.mir.Lvalue;
import org.mirpromote.mir.Mir;
import org.mirpromote.mir.Operand;
import org.mirpromote.mir.Rvalue;
import org.mirpromote.mir.Rvalue.BinOp;
import org.mirpromote.mir.Rvalue.BorrowKind;
import org.mirpromote.mir.Span;
import org.mirpromote.mir.Statement;
import org.mirpromote.mir.TerminatorKind;
import org.mirpromote.mir.Ty;

@RunWith(JUnit4.class)
public class VisitorTest {
  private Mir mir;

  /**
   * Builds
   *
   * <pre>{@code
   * bb0: {
   *     tmp0 = Len(var0);
   *     tmp1 = Add(tmp0, (*arg0));
   *     tmp2 = &mut var1;
   *     tmp3 = const f(tmp1, var0[tmp2]) -> [return: bb1, unwind: bb2];
   * }
   * bb1: { drop(tmp3) -> bb2; }
   * bb2: { switchInt(var1) -> [0: bb3, otherwise: bb3]; }
   * bb3: { return; }
   * }</pre>
   */
  @Before
  public void setup() {
    mir = new Mir(Span.DUMMY, Ty.UNIT);
    Lvalue.Arg a0 = mir.newArg("p", Ty.ref(Ty.I32));
    Lvalue.Var v0 = mir.newVar("xs", Ty.array(Ty.I32, 4));
    Lvalue.Var v1 = mir.newVar("n", Ty.USIZE);
    Lvalue.Temp t0 = mir.newTemp(Ty.USIZE);
    Lvalue.Temp t1 = mir.newTemp(Ty.I32);
    Lvalue.Temp t2 = mir.newTemp(Ty.refMut(Ty.USIZE));
    Lvalue.Temp t3 = mir.newTemp(Ty.I32);
    BasicBlock bb0 =
        mir.newBlock(
            Span.DUMMY,
            new TerminatorKind.Call(
                Operand.constant(Ty.fnDef("f"), new Literal.Item("f")),
                ImmutableList.of(
                    Operand.consume(t1), Operand.consume(v0.index(Operand.consume(t2)))),
                new TerminatorKind.Destination(t3, BasicBlock.of(1)),
                BasicBlock.of(2)));
    mir.block(bb0)
        .statements
        .addAll(
            List.of(
                Statement.assign(t0, new Rvalue.Len(v0)),
                Statement.assign(
                    t1, Rvalue.binary(BinOp.ADD, Operand.consume(t0), Operand.consume(a0.deref()))),
                Statement.assign(t2, Rvalue.ref(BorrowKind.MUT, v1))));
    mir.newBlock(Span.DUMMY, new TerminatorKind.Drop(t3, BasicBlock.of(2), null));
    mir.newBlock(
        Span.DUMMY,
        new TerminatorKind.SwitchInt(
            v1,
            Ty.USIZE,
            ImmutableList.of(0),
            ImmutableList.of(BasicBlock.of(3), BasicBlock.of(3))));
    mir.newBlock(Span.DUMMY, TerminatorKind.RETURN);
  }

  /** Records each Lvalue visited with its context, and each constant. */
  private static class Recorder extends Visitor {
    final List<String> visited = new ArrayList<>();

    @Override
    public void visitLvalue(Lvalue lvalue, LvalueContext context) {
      visited.add(lvalue + ":" + context);
      super.visitLvalue(lvalue, context);
    }

    @Override
    public void visitConstant(Operand.Constant constant) {
      visited.add(constant.toString());
    }
  }

  @Test
  public void contexts() {
    Recorder recorder = new Recorder();
    recorder.visitMir(mir);
    assertThat(recorder.visited)
        .containsExactly(
            // bb0
            "tmp0:STORE",
            "var0:INSPECT",
            "tmp1:STORE",
            "tmp0:CONSUME",
            "(*arg0):CONSUME",
            "arg0:PROJECTION",
            "tmp2:STORE",
            "var1:BORROW",
            "const f",
            "tmp1:CONSUME",
            "var0[tmp2]:CONSUME",
            "var0:PROJECTION",
            "tmp2:CONSUME",
            "tmp3:CALL",
            // bb1
            "tmp3:DROP",
            // bb2
            "var1:INSPECT")
        .inOrder();
  }

  @Test
  public void contextClassification() {
    assertThat(LvalueContext.STORE.isDefinition()).isTrue();
    assertThat(LvalueContext.CALL.isDefinition()).isTrue();
    assertThat(LvalueContext.BORROW.isDefinition()).isFalse();
    assertThat(LvalueContext.BORROW.isDirectUse()).isTrue();
    assertThat(LvalueContext.CONSUME.isDirectUse()).isTrue();
    assertThat(LvalueContext.INSPECT.isDirectUse()).isTrue();
    assertThat(LvalueContext.DROP.isDirectUse()).isFalse();
    assertThat(LvalueContext.PROJECTION.isDirectUse()).isFalse();
    assertThat(LvalueContext.STORE.isDirectUse()).isFalse();
  }

  /** Renumbers every temp, including those nested in projections and call destinations. */
  private static class TempShifter extends MutVisitor {
    @Override
    public Lvalue visitLvalue(Lvalue lvalue, LvalueContext context) {
      if (lvalue instanceof Lvalue.Temp temp) {
        return Lvalue.temp(temp.index + 10);
      }
      return super.visitLvalue(lvalue, context);
    }
  }

  @Test
  public void mutVisitorRewritesInPlace() {
    new TempShifter().visitMir(mir);

    List<String> bb0 = new ArrayList<>();
    for (Statement statement : mir.block(BasicBlock.of(0)).statements) {
      bb0.add(statement.toString());
    }
    assertThat(bb0)
        .containsExactly("tmp10 = Len(var0)", "tmp11 = Add(tmp10, (*arg0))", "tmp12 = &mut var1")
        .inOrder();
    assertThat(mir.block(BasicBlock.of(0)).terminator().toString())
        .isEqualTo("tmp13 = const f(tmp11, var0[tmp12]) -> [return: bb1, unwind: bb2]");
    assertThat(mir.block(BasicBlock.of(1)).terminator().toString())
        .isEqualTo("drop(tmp13) -> bb2");
    // Nothing to rewrite here, so the terminator is unchanged.
    TerminatorKind.SwitchInt switchInt =
        (TerminatorKind.SwitchInt) mir.block(BasicBlock.of(2)).terminator().kind();
    assertThat(switchInt.discr).isEqualTo(Lvalue.var(1));
  }

  @Test
  public void mutVisitorDefaultIsIdentity() {
    String before = mir.toString();
    new MutVisitor() {}.visitMir(mir);
    assertThat(mir.toString()).isEqualTo(before);
  }
}
