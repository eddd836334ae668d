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

package org.mirpromote.transform;

import java.util.Objects;
import org.mirpromote.mir.BasicBlock;
import org.mirpromote.mir.Location;

/**
 * A root candidate for promotion, which will become the returned value of a promoted body unless it
 * is part of a larger candidate. Candidates are found by constant qualification; each one is
 * already known to root a constant expression.
 */
public abstract class Candidate {
  // Only the nested subclasses can extend Candidate.
  private Candidate() {}

  public static Ref ref(Location location) {
    return new Ref(location);
  }

  public static ShuffleIndices shuffleIndices(BasicBlock block) {
    return new ShuffleIndices(block);
  }

  /** The rvalue of the assignment at {@link #location}, a borrow of a constant temp. */
  public static final class Ref extends Candidate {
    public final Location location;

    Ref(Location location) {
      this.location = location;
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Ref other && location.equals(other.location);
    }

    @Override
    public int hashCode() {
      return Objects.hash("ref", location);
    }

    @Override
    public String toString() {
      return "Ref(" + location + ")";
    }
  }

  /**
   * The array of indices passed as the third argument of the {@code simd_shuffleN} intrinsic call
   * that terminates {@link #block}.
   */
  public static final class ShuffleIndices extends Candidate {
    /** The index of the call argument holding the indices. */
    public static final int ARG_INDEX = 2;

    public final BasicBlock block;

    ShuffleIndices(BasicBlock block) {
      this.block = block;
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof ShuffleIndices other && block.equals(other.block);
    }

    @Override
    public int hashCode() {
      return Objects.hash("shuffle", block);
    }

    @Override
    public String toString() {
      return "ShuffleIndices(" + block + ")";
    }
  }
}
