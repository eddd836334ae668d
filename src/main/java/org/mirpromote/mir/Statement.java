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

import com.google.errorprone.annotations.CanIgnoreReturnValue;

/**
 * A statement that stores the value of an {@link Rvalue} into an {@link Lvalue}.
 *
 * <p>The Lvalue and Rvalue themselves are immutable, but a Statement's parts can be replaced; this
 * is how passes rewrite a body in place while all {@link Location}s in it remain valid.
 */
public class Statement {
  public final Span span;
  private Lvalue lhs;
  private Rvalue rhs;

  public Statement(Span span, Lvalue lhs, Rvalue rhs) {
    this.span = span;
    this.lhs = lhs;
    this.rhs = rhs;
  }

  /** Creates a Statement with no meaningful source position. */
  public static Statement assign(Lvalue lhs, Rvalue rhs) {
    return new Statement(Span.DUMMY, lhs, rhs);
  }

  public Lvalue lhs() {
    return lhs;
  }

  public Rvalue rhs() {
    return rhs;
  }

  public void setLhs(Lvalue lhs) {
    this.lhs = lhs;
  }

  public void setRhs(Rvalue rhs) {
    this.rhs = rhs;
  }

  /** Sets the rhs to {@code newRhs} and returns the previous rhs. */
  @CanIgnoreReturnValue
  public Rvalue replaceRhs(Rvalue newRhs) {
    Rvalue result = rhs;
    rhs = newRhs;
    return result;
  }

  @Override
  public String toString() {
    return lhs + " = " + rhs;
  }
}
