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
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import org.jspecify.annotations.Nullable;

/**
 * An Rvalue is the right-hand side of an assignment: an expression computed from {@link Operand}s
 * and {@link Lvalue}s without any control flow. Rvalues are immutable.
 */
public abstract class Rvalue {
  /** The empty tuple {@code ()}. */
  public static final Rvalue UNIT = new Aggregate(AggregateKind.TUPLE, ImmutableList.of());

  // Only the nested subclasses can extend Rvalue.
  private Rvalue() {}

  public static Use use(Operand operand) {
    return new Use(operand);
  }

  public static Ref ref(BorrowKind kind, Lvalue lvalue) {
    return new Ref(kind, lvalue);
  }

  /** Shorthand for a shared borrow. */
  public static Ref ref(Lvalue lvalue) {
    return new Ref(BorrowKind.SHARED, lvalue);
  }

  public static BinaryOp binary(BinOp op, Operand left, Operand right) {
    return new BinaryOp(op, left, right);
  }

  public static UnaryOp unary(UnOp op, Operand operand) {
    return new UnaryOp(op, operand);
  }

  public static Aggregate aggregate(AggregateKind kind, List<Operand> operands) {
    return new Aggregate(kind, ImmutableList.copyOf(operands));
  }

  /** The kinds of borrow that may appear in a {@link Ref}. */
  public enum BorrowKind {
    SHARED("&"),
    UNIQUE("&uniq "),
    MUT("&mut ");

    final String prefix;

    BorrowKind(String prefix) {
      this.prefix = prefix;
    }
  }

  public enum BinOp {
    ADD("Add"),
    SUB("Sub"),
    MUL("Mul"),
    DIV("Div"),
    REM("Rem"),
    BIT_XOR("BitXor"),
    BIT_AND("BitAnd"),
    BIT_OR("BitOr"),
    SHL("Shl"),
    SHR("Shr"),
    EQ("Eq"),
    LT("Lt"),
    LE("Le"),
    NE("Ne"),
    GE("Ge"),
    GT("Gt");

    final String name;

    BinOp(String name) {
      this.name = name;
    }
  }

  public enum UnOp {
    NOT("Not"),
    NEG("Neg");

    final String name;

    UnOp(String name) {
      this.name = name;
    }
  }

  public enum CastKind {
    MISC,
    REIFY_FN_POINTER,
    UNSAFE_FN_POINTER,
    UNSIZE
  }

  /** What an {@link Aggregate} builds. */
  public static final class AggregateKind {
    public static final AggregateKind VEC = new AggregateKind(null);
    public static final AggregateKind TUPLE = new AggregateKind(null);

    /** The name of the struct or enum variant, or null for arrays and tuples. */
    public final @Nullable String adtName;

    private AggregateKind(@Nullable String adtName) {
      this.adtName = adtName;
    }

    public static AggregateKind adt(String name) {
      return new AggregateKind(Preconditions.checkNotNull(name));
    }

    @Override
    public boolean equals(Object obj) {
      if (this == obj) {
        return true;
      }
      return adtName != null && obj instanceof AggregateKind other && adtName.equals(other.adtName);
    }

    @Override
    public int hashCode() {
      return (adtName == null) ? System.identityHashCode(this) : adtName.hashCode();
    }

    @Override
    public String toString() {
      return (this == VEC) ? "Vec" : (this == TUPLE) ? "Tuple" : adtName;
    }
  }

  /** Just the value of an operand. */
  public static final class Use extends Rvalue {
    public final Operand operand;

    Use(Operand operand) {
      this.operand = operand;
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Use other && operand.equals(other.operand);
    }

    @Override
    public int hashCode() {
      return operand.hashCode();
    }

    @Override
    public String toString() {
      return operand.toString();
    }
  }

  /** {@code [operand; count]}. */
  public static final class Repeat extends Rvalue {
    public final Operand operand;
    public final long count;

    public Repeat(Operand operand, long count) {
      Preconditions.checkArgument(count >= 0);
      this.operand = operand;
      this.count = count;
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Repeat other && count == other.count && operand.equals(other.operand);
    }

    @Override
    public int hashCode() {
      return Objects.hash(operand, count);
    }

    @Override
    public String toString() {
      return "[" + operand + "; " + count + "]";
    }
  }

  /** A borrow of an Lvalue. */
  public static final class Ref extends Rvalue {
    public final BorrowKind kind;
    public final Lvalue lvalue;

    Ref(BorrowKind kind, Lvalue lvalue) {
      this.kind = kind;
      this.lvalue = lvalue;
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Ref other && kind == other.kind && lvalue.equals(other.lvalue);
    }

    @Override
    public int hashCode() {
      return Objects.hash(kind, lvalue);
    }

    @Override
    public String toString() {
      return kind.prefix + lvalue;
    }
  }

  /** The length of an array or slice. */
  public static final class Len extends Rvalue {
    public final Lvalue lvalue;

    public Len(Lvalue lvalue) {
      this.lvalue = lvalue;
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Len other && lvalue.equals(other.lvalue);
    }

    @Override
    public int hashCode() {
      return Objects.hash("len", lvalue);
    }

    @Override
    public String toString() {
      return "Len(" + lvalue + ")";
    }
  }

  public static final class Cast extends Rvalue {
    public final CastKind kind;
    public final Operand operand;
    public final Ty ty;

    public Cast(CastKind kind, Operand operand, Ty ty) {
      this.kind = kind;
      this.operand = operand;
      this.ty = ty;
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Cast other
          && kind == other.kind
          && operand.equals(other.operand)
          && ty.equals(other.ty);
    }

    @Override
    public int hashCode() {
      return Objects.hash(kind, operand, ty);
    }

    @Override
    public String toString() {
      return operand + " as " + ty;
    }
  }

  public static final class BinaryOp extends Rvalue {
    public final BinOp op;
    public final Operand left;
    public final Operand right;

    BinaryOp(BinOp op, Operand left, Operand right) {
      this.op = op;
      this.left = left;
      this.right = right;
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof BinaryOp other
          && op == other.op
          && left.equals(other.left)
          && right.equals(other.right);
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, left, right);
    }

    @Override
    public String toString() {
      return op.name + "(" + left + ", " + right + ")";
    }
  }

  public static final class UnaryOp extends Rvalue {
    public final UnOp op;
    public final Operand operand;

    UnaryOp(UnOp op, Operand operand) {
      this.op = op;
      this.operand = operand;
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof UnaryOp other && op == other.op && operand.equals(other.operand);
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, operand);
    }

    @Override
    public String toString() {
      return op.name + "(" + operand + ")";
    }
  }

  /** Allocates an uninitialized box of the given type. */
  public static final class Box extends Rvalue {
    public final Ty ty;

    public Box(Ty ty) {
      this.ty = ty;
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Box other && ty.equals(other.ty);
    }

    @Override
    public int hashCode() {
      return Objects.hash("box", ty);
    }

    @Override
    public String toString() {
      return "box " + ty;
    }
  }

  /** Builds an array, tuple, or struct from its elements. */
  public static final class Aggregate extends Rvalue {
    public final AggregateKind kind;
    public final ImmutableList<Operand> operands;

    Aggregate(AggregateKind kind, ImmutableList<Operand> operands) {
      this.kind = kind;
      this.operands = operands;
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Aggregate other
          && kind.equals(other.kind)
          && operands.equals(other.operands);
    }

    @Override
    public int hashCode() {
      return Objects.hash(kind, operands);
    }

    @Override
    public String toString() {
      String elements = operands.stream().map(Operand::toString).collect(Collectors.joining(", "));
      if (kind == AggregateKind.VEC) {
        return "[" + elements + "]";
      } else if (kind == AggregateKind.TUPLE) {
        return (operands.size() == 1) ? "(" + elements + ",)" : "(" + elements + ")";
      } else {
        return kind.adtName + "(" + elements + ")";
      }
    }
  }
}
