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
import java.util.ArrayList;
import java.util.List;

/** A basic block: a sequence of statements followed by a single terminator. */
public class BasicBlockData {
  /** The statements, in execution order; passes may add, remove or rewrite them. */
  public final List<Statement> statements = new ArrayList<>();

  private final Terminator terminator;

  /** True if this block is only reached while unwinding. */
  public boolean isCleanup;

  public BasicBlockData(Terminator terminator) {
    this.terminator = Preconditions.checkNotNull(terminator);
  }

  public Terminator terminator() {
    return terminator;
  }
}
