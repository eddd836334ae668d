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
import com.google.common.collect.ImmutableList;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * The static type of a slot or value. Types are immutable and compared structurally, so two
 * separately constructed {@code &i32} types are equal.
 *
 * <p>There are five kinds of type:
 *
 * <ul>
 *   <li>{@link Named}: a scalar or nominal type, identified only by its name ({@code i32}, {@code
 *       bool}, {@code Foo}).
 *   <li>{@link Ref}: a shared or mutable reference to another type.
 *   <li>{@link Array}: a fixed-length array.
 *   <li>{@link Tuple}: a tuple; the empty tuple is {@link #UNIT}.
 *   <li>{@link FnDef}: the zero-sized type of a named function item, used for the callee of a
 *       call.
 * </ul>
 */
public abstract class Ty {
  public static final Ty BOOL = named("bool");
  public static final Ty I32 = named("i32");
  public static final Ty U32 = named("u32");
  public static final Ty USIZE = named("usize");
  public static final Ty UNIT = new Tuple(ImmutableList.of());

  // Only the nested subclasses can extend Ty.
  private Ty() {}

  public static Ty named(String name) {
    return new Named(name);
  }

  public static Ty ref(Ty pointee) {
    return new Ref(pointee, false);
  }

  public static Ty refMut(Ty pointee) {
    return new Ref(pointee, true);
  }

  public static Ty array(Ty element, long length) {
    return new Array(element, length);
  }

  public static Ty tuple(Ty... elements) {
    return (elements.length == 0) ? UNIT : new Tuple(ImmutableList.copyOf(elements));
  }

  public static Ty fnDef(String name) {
    return new FnDef(name);
  }

  /** Returns the type obtained by dereferencing a value of this type. */
  public Ty pointee() {
    throw CompilerBug.bug("type %s cannot be dereferenced", this);
  }

  /** Returns the type obtained by indexing into a value of this type. */
  public Ty element() {
    throw CompilerBug.bug("type %s cannot be indexed", this);
  }

  /** A scalar or nominal type. */
  public static final class Named extends Ty {
    public final String name;

    Named(String name) {
      Preconditions.checkArgument(!name.isEmpty());
      this.name = name;
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Named other && name.equals(other.name);
    }

    @Override
    public int hashCode() {
      return name.hashCode();
    }

    @Override
    public String toString() {
      return name;
    }
  }

  /** A reference type. */
  public static final class Ref extends Ty {
    public final Ty pointee;
    public final boolean mutable;

    Ref(Ty pointee, boolean mutable) {
      this.pointee = pointee;
      this.mutable = mutable;
    }

    @Override
    public Ty pointee() {
      return pointee;
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Ref other && mutable == other.mutable && pointee.equals(other.pointee);
    }

    @Override
    public int hashCode() {
      return Objects.hash(pointee, mutable);
    }

    @Override
    public String toString() {
      return (mutable ? "&mut " : "&") + pointee;
    }
  }

  /** A fixed-length array type. */
  public static final class Array extends Ty {
    public final Ty element;
    public final long length;

    Array(Ty element, long length) {
      Preconditions.checkArgument(length >= 0);
      this.element = element;
      this.length = length;
    }

    @Override
    public Ty element() {
      return element;
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Array other && length == other.length && element.equals(other.element);
    }

    @Override
    public int hashCode() {
      return Objects.hash(element, length);
    }

    @Override
    public String toString() {
      return "[" + element + "; " + length + "]";
    }
  }

  /** A tuple type. */
  public static final class Tuple extends Ty {
    public final ImmutableList<Ty> elements;

    Tuple(ImmutableList<Ty> elements) {
      this.elements = elements;
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Tuple other && elements.equals(other.elements);
    }

    @Override
    public int hashCode() {
      return elements.hashCode();
    }

    @Override
    public String toString() {
      if (elements.size() == 1) {
        return "(" + elements.get(0) + ",)";
      }
      return elements.stream().map(Ty::toString).collect(Collectors.joining(", ", "(", ")"));
    }
  }

  /** The type of a named function item. */
  public static final class FnDef extends Ty {
    public final String name;

    FnDef(String name) {
      this.name = name;
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof FnDef other && name.equals(other.name);
    }

    @Override
    public int hashCode() {
      return name.hashCode() + 1;
    }

    @Override
    public String toString() {
      return "fn() {" + name + "}";
    }
  }
}
