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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.mirpromote.mir.BasicBlock;
import org.mirpromote.mir.BasicBlockData;
import org.mirpromote.mir.Location;
import org.mirpromote.mir.Lvalue;
import org.mirpromote.mir.Mir;
import org.mirpromote.mir.Statement;
import org.mirpromote.mir.visit.LvalueContext;
import org.mirpromote.mir.visit.Visitor;

/**
 * Computes a {@link TempState} for each temp of a body by visiting its blocks in reverse
 * postorder.
 *
 * <p>This assumes that every use of a temp is dominated by its definition, which reverse postorder
 * then visits first. That is not checked; a use that is not dominated by the definition is
 * misclassified rather than reported.
 */
public final class TempCollector extends Visitor {
  private final List<TempState> temps;

  /**
   * The location of the statement or terminator currently being visited. While visiting the
   * terminator statementIndex is the number of statements, which is how a Location identifies it.
   */
  private BasicBlock block = BasicBlock.START_BLOCK;

  private int statementIndex;

  private TempCollector(int numTemps) {
    temps = new ArrayList<>(Collections.nCopies(numTemps, TempState.UNDEFINED));
  }

  /**
   * Returns a mutable list with the state of each temp in {@code mir}, indexed by temp number.
   * {@code rpo} must be the reverse postorder of {@code mir}'s blocks.
   */
  public static List<TempState> collectTemps(Mir mir, List<BasicBlock> rpo) {
    TempCollector collector = new TempCollector(mir.tempDecls.size());
    for (BasicBlock bb : rpo) {
      collector.visitBasicBlockData(bb, mir.block(bb));
    }
    return collector.temps;
  }

  @Override
  public void visitBasicBlockData(BasicBlock bb, BasicBlockData data) {
    block = bb;
    statementIndex = 0;
    super.visitBasicBlockData(bb, data);
  }

  @Override
  public void visitStatement(BasicBlock bb, Statement statement) {
    assert block.equals(bb);
    super.visitStatement(bb, statement);
    statementIndex++;
  }

  @Override
  public void visitLvalue(Lvalue lvalue, LvalueContext context) {
    super.visitLvalue(lvalue, context);
    if (!(lvalue instanceof Lvalue.Temp temp)) {
      return;
    }
    // Ignore drops: if the temp gets promoted it's constant, and dropping it is a no-op.
    if (context == LvalueContext.DROP) {
      return;
    }
    TempState state = temps.get(temp.index);
    if (state == TempState.UNDEFINED) {
      if (context.isDefinition()) {
        temps.set(temp.index, TempState.defined(new Location(block, statementIndex), 0));
        return;
      }
    } else if (state instanceof TempState.Defined defined) {
      if (context.isDirectUse()) {
        temps.set(temp.index, defined.withAnotherUse());
        return;
      }
    }
    temps.set(temp.index, TempState.UNPROMOTABLE);
  }
}
