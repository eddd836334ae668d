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

import java.util.Objects;

/**
 * An Operand is an input to an {@link Rvalue} or a call: either a read of an {@link Lvalue} or a
 * {@link Constant}. Operands are immutable.
 */
public abstract class Operand {
  // Only the nested subclasses can extend Operand.
  private Operand() {}

  public static Consume consume(Lvalue lvalue) {
    return new Consume(lvalue);
  }

  public static Constant constant(Ty ty, Literal literal) {
    return new Constant(Span.DUMMY, ty, literal);
  }

  public static Constant constant(Span span, Ty ty, Literal literal) {
    return new Constant(span, ty, literal);
  }

  /** Shorthand for a constant holding the given value. */
  public static Constant value(Ty ty, Object value) {
    return constant(ty, new Literal.Value(value));
  }

  /** Reads (copies or moves) the value in an Lvalue. */
  public static final class Consume extends Operand {
    public final Lvalue lvalue;

    Consume(Lvalue lvalue) {
      this.lvalue = lvalue;
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Consume other && lvalue.equals(other.lvalue);
    }

    @Override
    public int hashCode() {
      return lvalue.hashCode();
    }

    @Override
    public String toString() {
      return lvalue.toString();
    }
  }

  /** A constant of a known type. The span is not significant for equality. */
  public static final class Constant extends Operand {
    public final Span span;
    public final Ty ty;
    public final Literal literal;

    Constant(Span span, Ty ty, Literal literal) {
      this.span = span;
      this.ty = ty;
      this.literal = literal;
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Constant other && ty.equals(other.ty) && literal.equals(other.literal);
    }

    @Override
    public int hashCode() {
      return Objects.hash(ty, literal);
    }

    @Override
    public String toString() {
      return "const " + literal;
    }
  }
}
