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

/** How an {@link org.mirpromote.mir.Lvalue} is being used at the point a visitor reaches it. */
public enum LvalueContext {
  /** The destination of an assignment statement. */
  STORE,

  /** The destination of a call terminator. */
  CALL,

  /** The location dropped by a drop terminator. */
  DROP,

  /** Read without being moved or copied out, e.g. by {@code Len} or a {@code switchInt}. */
  INSPECT,

  /** Borrowed by a {@code Ref} rvalue (of any borrow kind). */
  BORROW,

  /** Read by an operand. */
  CONSUME,

  /** The base of a projection (deref, field, or index). */
  PROJECTION;

  /** Returns true for the contexts that write the Lvalue. */
  public boolean isDefinition() {
    return this == STORE || this == CALL;
  }

  /** Returns true for the contexts that read the Lvalue directly. */
  public boolean isDirectUse() {
    return this == BORROW || this == CONSUME || this == INSPECT;
  }
}
