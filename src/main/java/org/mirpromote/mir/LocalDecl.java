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

import org.jspecify.annotations.Nullable;

/**
 * The declaration of a local slot: its type and, for user variables and arguments, the source
 * name (temporaries have none).
 */
public final class LocalDecl {
  public final Ty ty;
  public final @Nullable String name;

  public LocalDecl(Ty ty, @Nullable String name) {
    this.ty = ty;
    this.name = name;
  }

  @Override
  public String toString() {
    return (name == null) ? ty.toString() : name + ": " + ty;
  }
}
