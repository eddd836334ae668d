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

package org.mirpromote.transform;

import java.util.List;
import org.mirpromote.mir.BasicBlock;
import org.mirpromote.mir.BasicBlockData;
import org.mirpromote.mir.CompilerBug;
import org.mirpromote.mir.Literal;
import org.mirpromote.mir.Location;
import org.mirpromote.mir.Lvalue;
import org.mirpromote.mir.Mir;
import org.mirpromote.mir.Operand;
import org.mirpromote.mir.Rvalue;
import org.mirpromote.mir.Span;
import org.mirpromote.mir.Statement;
import org.mirpromote.mir.Terminator;
import org.mirpromote.mir.TerminatorKind;
import org.mirpromote.mir.visit.LvalueContext;
import org.mirpromote.mir.visit.MutVisitor;

/**
 * Builds one promoted body by pulling the tree of temps rooted at a {@link Candidate} out of the
 * source body.
 *
 * <p>Each temp reached is either moved (if its only use is within the tree) or duplicated (if it
 * has other uses, which still need the original definition). Everything below a duplicated temp is
 * duplicated as well, since it may be shared with those other uses.
 *
 * <p>The recursion through {@link #promoteTemp} terminates because the temps form a tree: each temp
 * has a single definition, and that definition cannot read the temp it defines. This pass relies
 * on, but does not check, that property of its input.
 */
final class Promoter extends MutVisitor {
  private final Mir source;
  private final Mir promoted;
  private final List<TempState> temps;

  /** If true, all nested temps are also kept in the source body, not moved to the promoted body. */
  private boolean keepOriginal;

  /**
   * Creates a Promoter that will build {@code promoted}, which must be a new body with no blocks.
   * The Promoter adds its start block.
   */
  Promoter(Mir source, Mir promoted, List<TempState> temps) {
    assert promoted.numBlocks() == 0;
    this.source = source;
    this.promoted = promoted;
    this.temps = temps;
    BasicBlock start = newBlock();
    assert start.equals(BasicBlock.START_BLOCK);
  }

  /** Appends a block to the promoted body that just returns. */
  private BasicBlock newBlock() {
    return promoted.newBlock(promoted.span, TerminatorKind.RETURN);
  }

  /** Appends an assignment to the last block of the promoted body. */
  private void assign(Lvalue dest, Rvalue rvalue, Span span) {
    promoted.block(promoted.lastBlock()).statements.add(new Statement(span, dest, rvalue));
  }

  /**
   * Copies the definition of the given source temp into the promoted body, recursing through the
   * temps it reads, and returns the index of the corresponding temp in the promoted body.
   */
  int promoteTemp(int index) {
    boolean oldKeepOriginal = keepOriginal;
    if (!(temps.get(index) instanceof TempState.Defined defined) || defined.uses == 0) {
      throw CompilerBug.spanBug(
          promoted.span, "tmp%s not promotable: %s", index, temps.get(index));
    }
    if (defined.uses > 1) {
      keepOriginal = true;
    }
    if (!keepOriginal) {
      temps.set(index, TempState.PROMOTED_OUT);
    }

    Location location = defined.location;
    BasicBlockData data = source.block(location.block);
    boolean isAssign = !location.isTerminator(source);

    // First, take the Rvalue or Call out of the source body, or duplicate it, depending on
    // keepOriginal.
    Rvalue rvalue = null;
    TerminatorKind.Call call = null;
    Span span;
    if (isAssign) {
      Statement statement = data.statements.get(location.statementIndex);
      rvalue = keepOriginal ? statement.rhs() : statement.replaceRhs(Rvalue.UNIT);
      span = statement.span;
    } else {
      Terminator terminator = data.terminator();
      if (!(terminator.kind() instanceof TerminatorKind.Call original)
          || original.destination == null) {
        throw CompilerBug.spanBug(terminator.span, "%s not promotable", terminator.kind());
      }
      if (!keepOriginal) {
        terminator.setKind(new TerminatorKind.Goto(original.destination.target));
      }
      // A promoted body can't unwind, and we'll put a new destination in later.
      call = original.withCleanup(null).withDestination(null);
      span = terminator.span;
    }

    // Then, recurse for components in the Rvalue or Call.
    if (isAssign) {
      rvalue = visitRvalue(rvalue);
    } else {
      call = (TerminatorKind.Call) visitTerminatorKind(location.block, call);
    }

    Lvalue.Temp newTemp = promoted.newTemp(source.tempDecls.get(index).ty);

    // Inject the Rvalue or Call into the promoted body.
    if (isAssign) {
      assign(newTemp, rvalue, span);
    } else {
      Terminator last = promoted.block(promoted.lastBlock()).terminator();
      BasicBlock newTarget = newBlock();
      last.span = span;
      last.setKind(call.withDestination(new TerminatorKind.Destination(newTemp, newTarget)));
    }

    // Restore the old duplication state.
    keepOriginal = oldKeepOriginal;
    return newTemp.index;
  }

  /**
   * Replaces the candidate's root expression in the source body with a reference to the promoted
   * body, makes that expression the promoted body's result, and adds the promoted body to the
   * source.
   */
  void promoteCandidate(Candidate candidate) {
    Span span = promoted.span;
    Operand newOperand =
        Operand.constant(span, promoted.returnTy(), Literal.promoted(source.promoted.size()));
    Rvalue rvalue;
    if (candidate instanceof Candidate.Ref ref) {
      rvalue = refStatement(source, ref.location).replaceRhs(Rvalue.use(newOperand));
    } else {
      BasicBlock block = ((Candidate.ShuffleIndices) candidate).block;
      Terminator terminator = source.block(block).terminator();
      TerminatorKind.Call call = shuffleCall(terminator);
      rvalue = Rvalue.use(call.args.get(Candidate.ShuffleIndices.ARG_INDEX));
      terminator.setKind(call.withArg(Candidate.ShuffleIndices.ARG_INDEX, newOperand));
    }
    rvalue = visitRvalue(rvalue);
    assign(Lvalue.RETURN_POINTER, rvalue, span);
    source.promoted.add(promoted);
  }

  /** Returns the assignment at a Ref candidate's location, or throws if there isn't one. */
  static Statement refStatement(Mir mir, Location location) {
    BasicBlockData data = mir.block(location.block);
    if (location.isTerminator(mir)) {
      throw CompilerBug.spanBug(
          data.terminator().span, "expected an assignment at %s to promote", location);
    }
    return data.statements.get(location.statementIndex);
  }

  /** Returns the shuffle call at a ShuffleIndices candidate, or throws if there isn't one. */
  static TerminatorKind.Call shuffleCall(Terminator terminator) {
    if (terminator.kind() instanceof TerminatorKind.Call call
        && call.args.size() > Candidate.ShuffleIndices.ARG_INDEX) {
      return call;
    }
    throw CompilerBug.spanBug(terminator.span, "expected simd_shuffleN call to promote");
  }

  /** Replaces all temps with their promoted counterparts. */
  @Override
  public Lvalue visitLvalue(Lvalue lvalue, LvalueContext context) {
    if (lvalue instanceof Lvalue.Temp temp) {
      return Lvalue.temp(promoteTemp(temp.index));
    }
    return super.visitLvalue(lvalue, context);
  }
}
