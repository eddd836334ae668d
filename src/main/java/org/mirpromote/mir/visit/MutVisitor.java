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

import com.google.common.collect.ImmutableList;
import java.util.List;
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
 * A walk over a {@link Mir} that may rewrite what it visits. Since Lvalues, Operands, Rvalues and
 * TerminatorKinds are immutable, each {@code visitX} method for those returns its (possibly new)
 * replacement; the default implementations rebuild the node from the results of visiting its
 * children, and return non-composite nodes unchanged. Statements and Terminators are updated in
 * place.
 *
 * <p>Children are visited in the same order as {@link Visitor} visits them.
 */
public abstract class MutVisitor {

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
    statement.setLhs(visitLvalue(statement.lhs(), LvalueContext.STORE));
    statement.setRhs(visitRvalue(statement.rhs()));
  }

  public void visitTerminator(BasicBlock bb, Terminator terminator) {
    terminator.setKind(visitTerminatorKind(bb, terminator.kind()));
  }

  public TerminatorKind visitTerminatorKind(BasicBlock bb, TerminatorKind kind) {
    if (kind instanceof TerminatorKind.If ifKind) {
      return ifKind.withCond(visitOperand(ifKind.cond));
    } else if (kind instanceof TerminatorKind.SwitchInt switchInt) {
      return switchInt.withDiscr(visitLvalue(switchInt.discr, LvalueContext.INSPECT));
    } else if (kind instanceof TerminatorKind.Drop drop) {
      return drop.withLocation(visitLvalue(drop.location, LvalueContext.DROP));
    } else if (kind instanceof TerminatorKind.Call call) {
      Operand func = visitOperand(call.func);
      List<Operand> args = visitOperands(call.args);
      TerminatorKind.Destination destination = call.destination;
      if (destination != null) {
        destination =
            new TerminatorKind.Destination(
                visitLvalue(destination.lvalue, LvalueContext.CALL), destination.target);
      }
      return new TerminatorKind.Call(func, args, destination, call.cleanup);
    }
    return kind;
  }

  public Rvalue visitRvalue(Rvalue rvalue) {
    if (rvalue instanceof Rvalue.Use use) {
      return Rvalue.use(visitOperand(use.operand));
    } else if (rvalue instanceof Rvalue.Repeat repeat) {
      return new Rvalue.Repeat(visitOperand(repeat.operand), repeat.count);
    } else if (rvalue instanceof Rvalue.Ref ref) {
      return Rvalue.ref(ref.kind, visitLvalue(ref.lvalue, LvalueContext.BORROW));
    } else if (rvalue instanceof Rvalue.Len len) {
      return new Rvalue.Len(visitLvalue(len.lvalue, LvalueContext.INSPECT));
    } else if (rvalue instanceof Rvalue.Cast cast) {
      return new Rvalue.Cast(cast.kind, visitOperand(cast.operand), cast.ty);
    } else if (rvalue instanceof Rvalue.BinaryOp binary) {
      Operand left = visitOperand(binary.left);
      Operand right = visitOperand(binary.right);
      return Rvalue.binary(binary.op, left, right);
    } else if (rvalue instanceof Rvalue.UnaryOp unary) {
      return Rvalue.unary(unary.op, visitOperand(unary.operand));
    } else if (rvalue instanceof Rvalue.Aggregate aggregate) {
      return Rvalue.aggregate(aggregate.kind, visitOperands(aggregate.operands));
    }
    assert rvalue instanceof Rvalue.Box;
    return rvalue;
  }

  public Operand visitOperand(Operand operand) {
    if (operand instanceof Operand.Consume consume) {
      return Operand.consume(visitLvalue(consume.lvalue, LvalueContext.CONSUME));
    }
    return visitConstant((Operand.Constant) operand);
  }

  public Lvalue visitLvalue(Lvalue lvalue, LvalueContext context) {
    if (lvalue instanceof Lvalue.Projection projection) {
      Lvalue base = visitLvalue(projection.base, LvalueContext.PROJECTION);
      if (projection.elem instanceof Lvalue.ProjectionElem.Index index) {
        return base.index(visitOperand(index.index));
      }
      return projection.withBase(base);
    }
    return lvalue;
  }

  public Operand visitConstant(Operand.Constant constant) {
    return constant;
  }

  /** Visits each of the given operands in order and returns the results. */
  private ImmutableList<Operand> visitOperands(List<Operand> operands) {
    ImmutableList.Builder<Operand> builder = ImmutableList.builderWithExpectedSize(operands.size());
    for (Operand operand : operands) {
      builder.add(visitOperand(operand));
    }
    return builder.build();
  }
}
