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

import org.mirpromote.mir.BasicBlock;
import org.mirpromote.mir.BasicBlockData;
import org.mirpromote.mir.Lvalue;
import org.mirpromote.mir.Mir;
import org.mirpromote.mir.Operand;
import org.mirpromote.mir.Rvalue;
import org.mirpromote.mir.Statement;
import org.mirpromote.mir.Terminator;
import org.mirpromote.mir.TerminatorKind;

/**
 * A read-only walk over a {@link Mir}. Each {@code visitX} method visits the children of its
 * argument; subclasses override the methods for the nodes they care about and call the superclass
 * method to continue the walk.
 *
 * <p>Lvalues are visited with the {@link LvalueContext} describing how they are used: an
 * assignment destination is a {@link LvalueContext#STORE}, the base of a projection is a {@link
 * LvalueContext#PROJECTION}, and so on. An assignment's destination is visited before its rvalue;
 * a call's function and arguments are visited before its destination.
 */
public abstract class Visitor {

  /** Visits every block of {@code mir} in index order. */
  public void visitMir(Mir mir) {
    for (int i = 0; i < mir.numBlocks(); i++) {
      BasicBlock bb = BasicBlock.of(i);
      visitBasicBlockData(bb, mir.block(bb));
    }
  }

  public void visitBasicBlockData(BasicBlock bb, BasicBlockData data) {
    for (Statement statement : data.statements) {
      visitStatement(bb, statement);
    }
    visitTerminator(bb, data.terminator());
  }

  public void visitStatement(BasicBlock bb, Statement statement) {
    visitLvalue(statement.lhs(), LvalueContext.STORE);
    visitRvalue(statement.rhs());
  }

  public void visitTerminator(BasicBlock bb, Terminator terminator) {
    visitTerminatorKind(bb, terminator.kind());
  }

  public void visitTerminatorKind(BasicBlock bb, TerminatorKind kind) {
    if (kind instanceof TerminatorKind.If ifKind) {
      visitOperand(ifKind.cond);
    } else if (kind instanceof TerminatorKind.SwitchInt switchInt) {
      visitLvalue(switchInt.discr, LvalueContext.INSPECT);
    } else if (kind instanceof TerminatorKind.Drop drop) {
      visitLvalue(drop.location, LvalueContext.DROP);
    } else if (kind instanceof TerminatorKind.Call call) {
      visitOperand(call.func);
      for (Operand arg : call.args) {
        visitOperand(arg);
      }
      if (call.destination != null) {
        visitLvalue(call.destination.lvalue, LvalueContext.CALL);
      }
    }
    // Goto, resume, return and unreachable have nothing to visit.
  }

  public void visitRvalue(Rvalue rvalue) {
    if (rvalue instanceof Rvalue.Use use) {
      visitOperand(use.operand);
    } else if (rvalue instanceof Rvalue.Repeat repeat) {
      visitOperand(repeat.operand);
    } else if (rvalue instanceof Rvalue.Ref ref) {
      visitLvalue(ref.lvalue, LvalueContext.BORROW);
    } else if (rvalue instanceof Rvalue.Len len) {
      visitLvalue(len.lvalue, LvalueContext.INSPECT);
    } else if (rvalue instanceof Rvalue.Cast cast) {
      visitOperand(cast.operand);
    } else if (rvalue instanceof Rvalue.BinaryOp binary) {
      visitOperand(binary.left);
      visitOperand(binary.right);
    } else if (rvalue instanceof Rvalue.UnaryOp unary) {
      visitOperand(unary.operand);
    } else if (rvalue instanceof Rvalue.Aggregate aggregate) {
      for (Operand operand : aggregate.operands) {
        visitOperand(operand);
      }
    } else {
      assert rvalue instanceof Rvalue.Box;
    }
  }

  public void visitOperand(Operand operand) {
    if (operand instanceof Operand.Consume consume) {
      visitLvalue(consume.lvalue, LvalueContext.CONSUME);
    } else {
      visitConstant((Operand.Constant) operand);
    }
  }

  public void visitLvalue(Lvalue lvalue, LvalueContext context) {
    if (lvalue instanceof Lvalue.Projection projection) {
      visitLvalue(projection.base, LvalueContext.PROJECTION);
      if (projection.elem instanceof Lvalue.ProjectionElem.Index index) {
        visitOperand(index.index);
      }
    }
  }

  public void visitConstant(Operand.Constant constant) {}
}
