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

/** Ends a {@link BasicBlockData}. Its {@link TerminatorKind} may be replaced. */
public class Terminator {
  public Span span;
  private TerminatorKind kind;

  public Terminator(Span span, TerminatorKind kind) {
    this.span = span;
    this.kind = kind;
  }

  public TerminatorKind kind() {
    return kind;
  }

  public void setKind(TerminatorKind kind) {
    this.kind = kind;
  }

  @Override
  public String toString() {
    return kind.toString();
  }
}
