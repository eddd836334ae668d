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

/**
 * A range of source positions, used to attribute statements, terminators and constants back to the
 * program text they were built from.
 */
public final class Span {
  /** The span used for compiler-synthesized code that has no meaningful source position. */
  public static final Span DUMMY = new Span(0, 0);

  public final int lo;
  public final int hi;

  public Span(int lo, int hi) {
    Preconditions.checkArgument(lo >= 0 && hi >= lo, "bad span %s..%s", lo, hi);
    this.lo = lo;
    this.hi = hi;
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof Span other && lo == other.lo && hi == other.hi;
  }

  @Override
  public int hashCode() {
    return lo * 31 + hi;
  }

  @Override
  public String toString() {
    return lo + ".." + hi;
  }
}
