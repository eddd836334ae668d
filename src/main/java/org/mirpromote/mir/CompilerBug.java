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

import com.google.errorprone.annotations.FormatMethod;
import org.jspecify.annotations.Nullable;

/**
 * Thrown when a pass finds the IR in a state that its producer guaranteed could not occur. These
 * are defects in the compiler, not in the program being compiled; they are never recovered from.
 *
 * <p>Callers throw the result of {@link #spanBug} or {@link #bug}, e.g.
 *
 * <pre>{@code
 * throw CompilerBug.spanBug(terminator.span, "%s not promotable", terminator.kind());
 * }</pre>
 */
public class CompilerBug extends RuntimeException {
  public final String msg;

  /** The source range being processed when the defect was detected, if known. */
  public final @Nullable Span span;

  public CompilerBug(String msg, @Nullable Span span) {
    super(msg);
    this.msg = msg;
    this.span = span;
  }

  @FormatMethod
  public static CompilerBug spanBug(Span span, String fmt, Object... args) {
    return new CompilerBug(String.format(fmt, args), span);
  }

  @FormatMethod
  public static CompilerBug bug(String fmt, Object... args) {
    return new CompilerBug(String.format(fmt, args), null);
  }

  @Override
  public String getMessage() {
    if (span == null) {
      return "internal compiler error: " + msg;
    }
    return String.format("internal compiler error: %s (at %s)", msg, span);
  }
}
