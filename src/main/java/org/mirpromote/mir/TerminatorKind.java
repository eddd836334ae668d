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
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import org.jspecify.annotations.Nullable;

/**
 * What a {@link Terminator} does. TerminatorKinds are immutable; to change a terminator, replace
 * its kind.
 *
 * <p>The kinds form a closed set: {@link Goto}, {@link If}, {@link SwitchInt}, {@link #RESUME},
 * {@link #RETURN}, {@link #UNREACHABLE}, {@link Drop}, and {@link Call}.
 */
public abstract class TerminatorKind {
  /** Continues unwinding; only valid in cleanup blocks. */
  public static final TerminatorKind RESUME = new NoSuccessor("resume");

  /** Returns from the body; the result has been stored in {@link Lvalue#RETURN_POINTER}. */
  public static final TerminatorKind RETURN = new NoSuccessor("return");

  /** Marks a point that execution can never reach. */
  public static final TerminatorKind UNREACHABLE = new NoSuccessor("unreachable");

  // Only the nested subclasses can extend TerminatorKind.
  private TerminatorKind() {}

  /** Returns the blocks that execution may continue to, in a fixed order. */
  public abstract ImmutableList<BasicBlock> successors();

  /**
   * Formats {@code head} followed by its outgoing edges, e.g. {@code "drop(tmp0) -> [return: bb1,
   * unwind: bb2]"}. A single {@code return} edge is printed without its label.
   */
  static String withEdges(String head, List<String> labels, List<BasicBlock> targets) {
    if (targets.isEmpty()) {
      return head;
    } else if (targets.size() == 1 && labels.get(0).equals("return")) {
      return head + " -> " + targets.get(0);
    }
    List<String> edges = new ArrayList<>();
    for (int i = 0; i < targets.size(); i++) {
      edges.add(labels.get(i) + ": " + targets.get(i));
    }
    return head + " -> [" + String.join(", ", edges) + "]";
  }

  /** The terminators with no successors. */
  private static final class NoSuccessor extends TerminatorKind {
    private final String name;

    NoSuccessor(String name) {
      this.name = name;
    }

    @Override
    public ImmutableList<BasicBlock> successors() {
      return ImmutableList.of();
    }

    @Override
    public String toString() {
      return name;
    }
  }

  /** An unconditional jump. */
  public static final class Goto extends TerminatorKind {
    public final BasicBlock target;

    public Goto(BasicBlock target) {
      this.target = target;
    }

    @Override
    public ImmutableList<BasicBlock> successors() {
      return ImmutableList.of(target);
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Goto other && target.equals(other.target);
    }

    @Override
    public int hashCode() {
      return target.hashCode();
    }

    @Override
    public String toString() {
      return "goto -> " + target;
    }
  }

  /** A two-way branch on a boolean operand. */
  public static final class If extends TerminatorKind {
    public final Operand cond;
    public final BasicBlock ifTrue;
    public final BasicBlock ifFalse;

    public If(Operand cond, BasicBlock ifTrue, BasicBlock ifFalse) {
      this.cond = cond;
      this.ifTrue = ifTrue;
      this.ifFalse = ifFalse;
    }

    public If withCond(Operand newCond) {
      return new If(newCond, ifTrue, ifFalse);
    }

    @Override
    public ImmutableList<BasicBlock> successors() {
      return ImmutableList.of(ifTrue, ifFalse);
    }

    @Override
    public String toString() {
      return withEdges("if(" + cond + ")", ImmutableList.of("true", "false"), successors());
    }
  }

  /**
   * A multi-way branch on an integer discriminant: {@code targets.get(i)} is taken when the
   * discriminant equals {@code values.get(i)}, and the final target otherwise.
   */
  public static final class SwitchInt extends TerminatorKind {
    public final Lvalue discr;
    public final Ty switchTy;
    public final ImmutableList<Object> values;
    public final ImmutableList<BasicBlock> targets;

    public SwitchInt(Lvalue discr, Ty switchTy, List<?> values, List<BasicBlock> targets) {
      Preconditions.checkArgument(targets.size() == values.size() + 1);
      this.discr = discr;
      this.switchTy = switchTy;
      this.values = ImmutableList.copyOf(values);
      this.targets = ImmutableList.copyOf(targets);
    }

    public SwitchInt withDiscr(Lvalue newDiscr) {
      return new SwitchInt(newDiscr, switchTy, values, targets);
    }

    @Override
    public ImmutableList<BasicBlock> successors() {
      return targets;
    }

    @Override
    public String toString() {
      List<String> labels = new ArrayList<>();
      values.forEach(v -> labels.add(String.valueOf(v)));
      labels.add("otherwise");
      return withEdges("switchInt(" + discr + ")", labels, targets);
    }
  }

  /** Runs the destructor of {@link #location}, then continues to {@link #target}. */
  public static final class Drop extends TerminatorKind {
    public final Lvalue location;
    public final BasicBlock target;

    /** Where to go if the destructor unwinds. */
    public final @Nullable BasicBlock unwind;

    public Drop(Lvalue location, BasicBlock target, @Nullable BasicBlock unwind) {
      this.location = location;
      this.target = target;
      this.unwind = unwind;
    }

    public Drop withLocation(Lvalue newLocation) {
      return new Drop(newLocation, target, unwind);
    }

    @Override
    public ImmutableList<BasicBlock> successors() {
      return (unwind == null) ? ImmutableList.of(target) : ImmutableList.of(target, unwind);
    }

    @Override
    public String toString() {
      return withEdges(
          "drop(" + location + ")", ImmutableList.of("return", "unwind"), successors());
    }
  }

  /**
   * Calls {@link #func} with {@link #args}. If {@link #destination} is non-null the result is
   * stored in its Lvalue and execution continues at its target; if it is null the call diverges. If
   * {@link #cleanup} is non-null it is the block to unwind to.
   */
  public static final class Call extends TerminatorKind {
    public final Operand func;
    public final ImmutableList<Operand> args;
    public final @Nullable Destination destination;
    public final @Nullable BasicBlock cleanup;

    public Call(
        Operand func,
        List<Operand> args,
        @Nullable Destination destination,
        @Nullable BasicBlock cleanup) {
      this.func = func;
      this.args = ImmutableList.copyOf(args);
      this.destination = destination;
      this.cleanup = cleanup;
    }

    public Call withDestination(@Nullable Destination newDestination) {
      return new Call(func, args, newDestination, cleanup);
    }

    public Call withCleanup(@Nullable BasicBlock newCleanup) {
      return new Call(func, args, destination, newCleanup);
    }

    public Call withOperands(Operand newFunc, List<Operand> newArgs) {
      return new Call(newFunc, newArgs, destination, cleanup);
    }

    /** Returns a copy of this Call with the argument at {@code index} replaced. */
    public Call withArg(int index, Operand arg) {
      Preconditions.checkElementIndex(index, args.size());
      List<Operand> newArgs = new ArrayList<>(args);
      newArgs.set(index, arg);
      return withOperands(func, newArgs);
    }

    @Override
    public ImmutableList<BasicBlock> successors() {
      ImmutableList.Builder<BasicBlock> builder = ImmutableList.builder();
      if (destination != null) {
        builder.add(destination.target);
      }
      if (cleanup != null) {
        builder.add(cleanup);
      }
      return builder.build();
    }

    @Override
    public String toString() {
      String head =
          args.stream().map(Operand::toString).collect(Collectors.joining(", ", func + "(", ")"));
      List<String> labels = new ArrayList<>();
      if (destination != null) {
        head = destination.lvalue + " = " + head;
        labels.add("return");
      }
      if (cleanup != null) {
        labels.add("unwind");
      }
      return withEdges(head, labels, successors());
    }
  }

  /** Where a {@link Call} stores its result, and where execution continues afterwards. */
  public static final class Destination {
    public final Lvalue lvalue;
    public final BasicBlock target;

    public Destination(Lvalue lvalue, BasicBlock target) {
      this.lvalue = lvalue;
      this.target = target;
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Destination other
          && lvalue.equals(other.lvalue)
          && target.equals(other.target);
    }

    @Override
    public int hashCode() {
      return Objects.hash(lvalue, target);
    }

    @Override
    public String toString() {
      return "(" + lvalue + ", " + target + ")";
    }
  }
}
