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

/** Options that control how {@link MirPrinter} renders a body. */
public interface PrintOptions {
  /** The options used by {@link Mir#toString}. */
  PrintOptions DEFAULT = new PrintOptions() {};

  /** Like {@link #DEFAULT}, but with spans. */
  PrintOptions WITH_SPANS =
      new PrintOptions() {
        @Override
        public boolean showSpans() {
          return true;
        }
      };

  /** If true, each statement and terminator is followed by a comment giving its span. */
  default boolean showSpans() {
    return false;
  }

  /** If true, the body's promoted bodies are printed after it. */
  default boolean showPromoted() {
    return true;
  }
}
