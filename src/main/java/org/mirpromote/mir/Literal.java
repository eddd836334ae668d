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
import java.util.Objects;

/** The value of a {@link Operand.Constant}. */
public abstract class Literal {
  // Only the nested subclasses can extend Literal.
  private Literal() {}

  /** A reference to the body at {@code index} in the owning body's {@link Mir#promoted} list. */
  public static Promoted promoted(int index) {
    return new Promoted(index);
  }

  /** A compile-time value such as an integer or boolean. */
  public static final class Value extends Literal {
    public final Object value;

    public Value(Object value) {
      this.value = Preconditions.checkNotNull(value);
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Value other && value.equals(other.value);
    }

    @Override
    public int hashCode() {
      return value.hashCode();
    }

    @Override
    public String toString() {
      return String.valueOf(value);
    }
  }

  /** A named item, e.g. a function or a constant defined elsewhere. */
  public static final class Item extends Literal {
    public final String name;

    public Item(String name) {
      this.name = name;
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Item other && name.equals(other.name);
    }

    @Override
    public int hashCode() {
      return Objects.hash("item", name);
    }

    @Override
    public String toString() {
      return name;
    }
  }

  /**
   * The value computed by a promoted body. Only meaningful relative to the body whose {@link
   * Mir#promoted} list it indexes.
   */
  public static final class Promoted extends Literal {
    public final int index;

    Promoted(int index) {
      Preconditions.checkArgument(index >= 0);
      this.index = index;
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Promoted other && index == other.index;
    }

    @Override
    public int hashCode() {
      return Objects.hash("promoted", index);
    }

    @Override
    public String toString() {
      return "promoted" + index;
    }
  }
}
