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
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * The mid-level IR of a single function or constant body: a control-flow graph of basic blocks,
 * the declarations of the local slots those blocks refer to, and the bodies that have been
 * promoted out of it.
 *
 * <p>Blocks, variables, temporaries and arguments are all referred to by index into the lists
 * owned here. Indices are assigned in order of creation and never change, and nothing is ever
 * removed from these lists, so an index obtained at any point remains valid for the lifetime of
 * the body.
 */
public class Mir {
  private final List<BasicBlockData> basicBlocks = new ArrayList<>();

  public final List<LocalDecl> varDecls = new ArrayList<>();
  public final List<LocalDecl> argDecls = new ArrayList<>();
  public final List<LocalDecl> tempDecls = new ArrayList<>();

  /**
   * Bodies extracted from this one by constant promotion; a {@link Literal.Promoted} in this body
   * refers to an element of this list.
   */
  public final List<Mir> promoted = new ArrayList<>();

  /** The type of the value this body returns, or null if it never returns. */
  private final @Nullable Ty returnTy;

  public final Span span;

  public Mir(Span span, @Nullable Ty returnTy) {
    this.span = span;
    this.returnTy = returnTy;
  }

  public @Nullable Ty returnTy() {
    return returnTy;
  }

  /** Returns true if this body never returns. */
  public boolean isDiverging() {
    return returnTy == null;
  }

  public int numBlocks() {
    return basicBlocks.size();
  }

  /** Returns an unmodifiable view of this body's blocks, in index order. */
  public List<BasicBlockData> blocks() {
    return Collections.unmodifiableList(basicBlocks);
  }

  public BasicBlockData block(BasicBlock bb) {
    return basicBlocks.get(bb.index);
  }

  /** Appends a block and returns its id. */
  @CanIgnoreReturnValue
  public BasicBlock addBlock(BasicBlockData data) {
    basicBlocks.add(data);
    return BasicBlock.of(basicBlocks.size() - 1);
  }

  /** Appends an empty block ending with the given terminator and returns its id. */
  @CanIgnoreReturnValue
  public BasicBlock newBlock(Span span, TerminatorKind kind) {
    return addBlock(new BasicBlockData(new Terminator(span, kind)));
  }

  /** Returns the id of the most recently added block. */
  public BasicBlock lastBlock() {
    Preconditions.checkState(!basicBlocks.isEmpty());
    return BasicBlock.of(basicBlocks.size() - 1);
  }

  public Lvalue.Temp newTemp(Ty ty) {
    tempDecls.add(new LocalDecl(ty, null));
    return Lvalue.temp(tempDecls.size() - 1);
  }

  public Lvalue.Var newVar(String name, Ty ty) {
    varDecls.add(new LocalDecl(ty, name));
    return Lvalue.var(varDecls.size() - 1);
  }

  public Lvalue.Arg newArg(String name, Ty ty) {
    argDecls.add(new LocalDecl(ty, name));
    return Lvalue.arg(argDecls.size() - 1);
  }

  /** Returns the static type of the given Lvalue in this body. */
  public Ty lvalueTy(Lvalue lvalue) {
    if (lvalue instanceof Lvalue.Var var) {
      return varDecls.get(var.index).ty;
    } else if (lvalue instanceof Lvalue.Temp temp) {
      return tempDecls.get(temp.index).ty;
    } else if (lvalue instanceof Lvalue.Arg arg) {
      return argDecls.get(arg.index).ty;
    } else if (lvalue instanceof Lvalue.Static item) {
      return item.ty;
    } else if (lvalue == Lvalue.RETURN_POINTER) {
      if (returnTy == null) {
        throw CompilerBug.spanBug(span, "return slot of a diverging body has no type");
      }
      return returnTy;
    }
    Lvalue.Projection projection = (Lvalue.Projection) lvalue;
    Ty baseTy = lvalueTy(projection.base);
    if (projection.elem instanceof Lvalue.ProjectionElem.Field field) {
      return field.ty;
    } else if (projection.elem instanceof Lvalue.ProjectionElem.Index) {
      return baseTy.element();
    } else {
      return baseTy.pointee();
    }
  }

  /** Returns the static type of the given Operand in this body. */
  public Ty operandTy(Operand operand) {
    if (operand instanceof Operand.Consume consume) {
      return lvalueTy(consume.lvalue);
    }
    return ((Operand.Constant) operand).ty;
  }

  @Override
  public String toString() {
    return MirPrinter.print(this, PrintOptions.DEFAULT);
  }
}
