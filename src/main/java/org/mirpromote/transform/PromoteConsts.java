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
import org.mirpromote.mir.Lvalue;
import org.mirpromote.mir.Mir;
import org.mirpromote.mir.MirPrinter;
import org.mirpromote.mir.PrintOptions;
import org.mirpromote.mir.Span;
import org.mirpromote.mir.Statement;
import org.mirpromote.mir.Terminator;
import org.mirpromote.mir.TerminatorKind;
import org.mirpromote.mir.Ty;
import org.mirpromote.mir.traversal.Traversal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A pass that promotes borrows of constant rvalues.
 *
 * <p>The rvalues considered constant are trees of temps, each with exactly one initialization, and
 * holding a constant value with no interior mutability. They are placed into a new body in {@link
 * Mir#promoted} and the borrow rvalue is replaced with a {@link
 * org.mirpromote.mir.Literal.Promoted} using the index into {@code promoted} of that body.
 *
 * <p>This pass assumes that every use is dominated by an initialization, and may otherwise silence
 * errors if move analysis runs after promotion on a broken body.
 */
public class PromoteConsts {
  private static final Logger logger = LoggerFactory.getLogger(PromoteConsts.class);

  /** If true, the body is logged (at debug level) before and after promotion. */
  public boolean verbose;

  /**
   * Runs the whole pass on {@code mir}: collects temp states, promotes the given candidates, and
   * removes what was promoted out. Returns the final temp states.
   */
  public List<TempState> run(Mir mir, List<Candidate> candidates) {
    List<TempState> temps = TempCollector.collectTemps(mir, Traversal.reversePostorder(mir));
    promoteCandidates(mir, temps, candidates);
    return temps;
  }

  /**
   * Promotes each of the candidates into a new body appended to {@code mir.promoted}, then
   * eliminates assignments to, and drops of, the temps that were promoted out. {@code temps} must
   * have been computed by {@link TempCollector#collectTemps} and is updated to record which temps
   * were promoted out.
   */
  public void promoteCandidates(Mir mir, List<TempState> temps, List<Candidate> candidates) {
    if (verbose && logger.isDebugEnabled()) {
      logger.debug("before promotion:\n{}", MirPrinter.print(mir, PrintOptions.DEFAULT));
    }
    // Visit candidates in reverse, in case they're nested.
    for (int i = candidates.size() - 1; i >= 0; i--) {
      Candidate candidate = candidates.get(i);
      Span span;
      Ty ty;
      if (candidate instanceof Candidate.Ref ref) {
        Statement statement = Promoter.refStatement(mir, ref.location);
        if (statement.lhs() instanceof Lvalue.Temp temp
            && temps.get(temp.index) == TempState.PROMOTED_OUT) {
          logger.debug("skipping {}: already promoted", candidate);
          continue;
        }
        span = statement.span;
        ty = mir.lvalueTy(statement.lhs());
      } else {
        BasicBlock block = ((Candidate.ShuffleIndices) candidate).block;
        Terminator terminator = mir.block(block).terminator();
        TerminatorKind.Call call = Promoter.shuffleCall(terminator);
        span = terminator.span;
        ty = mir.operandTy(call.args.get(Candidate.ShuffleIndices.ARG_INDEX));
      }
      logger.debug("promoting {} as promoted{}: {}", candidate, mir.promoted.size(), ty);
      Promoter promoter = new Promoter(mir, new Mir(span, ty), temps);
      promoter.promoteCandidate(candidate);
    }
    removePromotedOut(mir, temps);
    if (verbose && logger.isDebugEnabled()) {
      logger.debug("after promotion:\n{}", MirPrinter.print(mir, PrintOptions.DEFAULT));
    }
  }

  /** Eliminates assignments to, and drops of, promoted temps. */
  private static void removePromotedOut(Mir mir, List<TempState> temps) {
    for (BasicBlockData block : mir.blocks()) {
      block.statements.removeIf(
          statement ->
              statement.lhs() instanceof Lvalue.Temp temp && isPromotedOut(temps, temp.index));
      Terminator terminator = block.terminator();
      if (terminator.kind() instanceof TerminatorKind.Drop drop
          && drop.location instanceof Lvalue.Temp temp
          && isPromotedOut(temps, temp.index)) {
        terminator.setKind(new TerminatorKind.Goto(drop.target));
      }
    }
  }

  private static boolean isPromotedOut(List<TempState> temps, int index) {
    return temps.get(index) == TempState.PROMOTED_OUT;
  }
}
