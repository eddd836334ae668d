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

import java.util.List;

/**
 * A static-only class that renders a {@link Mir} as a listing, e.g.
 *
 * <pre>{@code
 * fn(arg0: i32) -> &i32 {
 *     let tmp0: i32;
 *
 *     bb0: {
 *         tmp0 = Add(arg0, const 1);
 *         return;
 *     }
 * }
 * }</pre>
 */
public class MirPrinter {
  // Statics only
  private MirPrinter() {}

  private static final String BLOCK_INDENT = "    ";
  private static final String STATEMENT_INDENT = "        ";

  public static String print(Mir mir, PrintOptions options) {
    StringBuilder sb = new StringBuilder();
    printBody(sb, "fn", "promoted", mir, options);
    return sb.toString();
  }

  /**
   * Appends the listing of {@code mir} with the given heading, followed by the listings of its
   * promoted bodies (headed {@code promotedPrefix + index}).
   */
  private static void printBody(
      StringBuilder sb, String name, String promotedPrefix, Mir mir, PrintOptions options) {
    sb.append(name).append('(');
    for (int i = 0; i < mir.argDecls.size(); i++) {
      if (i != 0) {
        sb.append(", ");
      }
      sb.append(Lvalue.arg(i)).append(": ").append(mir.argDecls.get(i).ty);
    }
    Ty returnTy = mir.returnTy();
    sb.append(") -> ").append(returnTy == null ? "!" : returnTy).append(" {\n");
    printDecls(sb, "var", mir.varDecls);
    printDecls(sb, "tmp", mir.tempDecls);
    if (!mir.varDecls.isEmpty() || !mir.tempDecls.isEmpty()) {
      sb.append('\n');
    }
    List<BasicBlockData> blocks = mir.blocks();
    for (int i = 0; i < blocks.size(); i++) {
      BasicBlockData data = blocks.get(i);
      if (i != 0) {
        sb.append('\n');
      }
      sb.append(BLOCK_INDENT).append(BasicBlock.of(i)).append(": {");
      if (data.isCleanup) {
        sb.append(" // cleanup");
      }
      sb.append('\n');
      for (Statement statement : data.statements) {
        printLine(sb, statement.toString(), statement.span, options);
      }
      printLine(sb, data.terminator().toString(), data.terminator().span, options);
      sb.append(BLOCK_INDENT).append("}\n");
    }
    sb.append("}\n");
    if (options.showPromoted()) {
      for (int i = 0; i < mir.promoted.size(); i++) {
        sb.append('\n');
        String promotedName = promotedPrefix + i;
        printBody(sb, promotedName, promotedName + ".promoted", mir.promoted.get(i), options);
      }
    }
  }

  private static void printDecls(StringBuilder sb, String prefix, List<LocalDecl> decls) {
    for (int i = 0; i < decls.size(); i++) {
      LocalDecl decl = decls.get(i);
      sb.append(BLOCK_INDENT).append("let ").append(prefix).append(i).append(": ").append(decl.ty);
      sb.append(';');
      if (decl.name != null) {
        sb.append(" // ").append(decl.name);
      }
      sb.append('\n');
    }
  }

  private static void printLine(StringBuilder sb, String line, Span span, PrintOptions options) {
    sb.append(STATEMENT_INDENT).append(line).append(';');
    if (options.showSpans()) {
      sb.append(" // ").append(span);
    }
    sb.append('\n');
  }
}
