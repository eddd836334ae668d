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

import com.google.common.base.Preconditions;
import java.util.Objects;
import org.mirpromote.mir.Location;

/**
 * The state of a temporary during collection and promotion. A closed set of four variants:
 *
 * <ul>
 *   <li>{@link #UNDEFINED}: no references to this temp have been seen.
 *   <li>{@link Defined}: one direct assignment (or call destination) and some number of direct
 *       uses. A borrow of this temp is promotable if the assigned value is qualified as constant
 *       and there is at least one use.
 *   <li>{@link #UNPROMOTABLE}: any other combination of assignments and uses.
 *   <li>{@link #PROMOTED_OUT}: this temp was part of an rvalue that was moved into a promoted body;
 *       its remaining assignments and drops in the source body are dead.
 * </ul>
 *
 * <p>Transitions only go forward: {@code UNDEFINED → Defined → (UNPROMOTABLE | PROMOTED_OUT)}, or
 * directly {@code UNDEFINED → UNPROMOTABLE}.
 */
public abstract class TempState {
  public static final TempState UNDEFINED = new Simple("Undefined");
  public static final TempState UNPROMOTABLE = new Simple("Unpromotable");
  public static final TempState PROMOTED_OUT = new Simple("PromotedOut");

  // Only the nested subclasses can extend TempState.
  private TempState() {}

  public static Defined defined(Location location, int uses) {
    return new Defined(location, uses);
  }

  /** Returns true if this temp could be moved or copied into a promoted body. */
  public boolean isPromotable() {
    return false;
  }

  /** The variants with no data. */
  private static final class Simple extends TempState {
    private final String name;

    Simple(String name) {
      this.name = name;
    }

    @Override
    public String toString() {
      return name;
    }
  }

  /** A temp with a single definition at {@link #location}, read {@link #uses} times. */
  public static final class Defined extends TempState {
    public final Location location;
    public final int uses;

    Defined(Location location, int uses) {
      Preconditions.checkArgument(uses >= 0);
      this.location = location;
      this.uses = uses;
    }

    /** Returns the state after one more direct use. */
    Defined withAnotherUse() {
      return new Defined(location, uses + 1);
    }

    @Override
    public boolean isPromotable() {
      return uses > 0;
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Defined other && location.equals(other.location) && uses == other.uses;
    }

    @Override
    public int hashCode() {
      return Objects.hash(location, uses);
    }

    @Override
    public String toString() {
      return String.format("Defined { location: %s, uses: %s }", location, uses);
    }
  }
}
