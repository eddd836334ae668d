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

/**
 * An Lvalue names a storage location: a local slot (user variable, compiler temporary, or
 * argument), a static, the return slot, or a projection (deref, field, or index) of another
 * Lvalue.
 *
 * <p>Lvalues are immutable; passes that rename slots (e.g. when moving code into a promoted body)
 * build new Lvalues rather than modifying existing ones.
 */
public abstract class Lvalue {
  /** The slot that holds the body's result when it returns. */
  public static final Lvalue RETURN_POINTER = new ReturnPointer();

  // Only the nested subclasses can extend Lvalue.
  private Lvalue() {}

  public static Var var(int index) {
    return new Var(index);
  }

  public static Temp temp(int index) {
    return new Temp(index);
  }

  public static Arg arg(int index) {
    return new Arg(index);
  }

  public static Static staticItem(String name, Ty ty) {
    return new Static(name, ty);
  }

  /** Returns {@code *this}. */
  public Projection deref() {
    return new Projection(this, ProjectionElem.DEREF);
  }

  /** Returns {@code this.index}, where the field has type {@code ty}. */
  public Projection field(int index, Ty ty) {
    return new Projection(this, new ProjectionElem.Field(index, ty));
  }

  /** Returns {@code this[index]}. */
  public Projection index(Operand index) {
    return new Projection(this, new ProjectionElem.Index(index));
  }

  /** Superclass of the three kinds of local slot, which are identified by an index. */
  public abstract static class Local extends Lvalue {
    public final int index;

    Local(int index) {
      Preconditions.checkArgument(index >= 0);
      this.index = index;
    }

    abstract String prefix();

    @Override
    public boolean equals(Object obj) {
      return obj != null && obj.getClass() == getClass() && ((Local) obj).index == index;
    }

    @Override
    public int hashCode() {
      return Objects.hash(getClass(), index);
    }

    @Override
    public String toString() {
      return prefix() + index;
    }
  }

  /** A user-declared variable. */
  public static final class Var extends Local {
    Var(int index) {
      super(index);
    }

    @Override
    String prefix() {
      return "var";
    }
  }

  /** A compiler-introduced temporary. */
  public static final class Temp extends Local {
    Temp(int index) {
      super(index);
    }

    @Override
    String prefix() {
      return "tmp";
    }
  }

  /** A function argument. */
  public static final class Arg extends Local {
    Arg(int index) {
      super(index);
    }

    @Override
    String prefix() {
      return "arg";
    }
  }

  /** A named static item. */
  public static final class Static extends Lvalue {
    public final String name;
    public final Ty ty;

    Static(String name, Ty ty) {
      this.name = name;
      this.ty = ty;
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Static other && name.equals(other.name) && ty.equals(other.ty);
    }

    @Override
    public int hashCode() {
      return Objects.hash(name, ty);
    }

    @Override
    public String toString() {
      return name;
    }
  }

  /** The return slot; there is only one instance, {@link #RETURN_POINTER}. */
  public static final class ReturnPointer extends Lvalue {
    private ReturnPointer() {}

    @Override
    public String toString() {
      return "return";
    }
  }

  /** A location derived from {@link #base}. */
  public static final class Projection extends Lvalue {
    public final Lvalue base;
    public final ProjectionElem elem;

    Projection(Lvalue base, ProjectionElem elem) {
      this.base = base;
      this.elem = elem;
    }

    /** Returns a projection with the same elem applied to a different base. */
    public Projection withBase(Lvalue newBase) {
      return (newBase == base) ? this : new Projection(newBase, elem);
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Projection other && base.equals(other.base) && elem.equals(other.elem);
    }

    @Override
    public int hashCode() {
      return Objects.hash(base, elem);
    }

    @Override
    public String toString() {
      if (elem instanceof ProjectionElem.Field field) {
        return base + "." + field.index;
      } else if (elem instanceof ProjectionElem.Index idx) {
        return base + "[" + idx.index + "]";
      } else {
        return "(*" + base + ")";
      }
    }
  }

  /** The step taken by a {@link Projection}. */
  public abstract static class ProjectionElem {
    public static final ProjectionElem DEREF = new Deref();

    private ProjectionElem() {}

    /** Dereference of a reference or box; there is only one instance, {@link #DEREF}. */
    public static final class Deref extends ProjectionElem {
      private Deref() {}

      @Override
      public String toString() {
        return "Deref";
      }
    }

    /** Selects a field of a tuple or struct. */
    public static final class Field extends ProjectionElem {
      public final int index;
      public final Ty ty;

      Field(int index, Ty ty) {
        this.index = index;
        this.ty = ty;
      }

      @Override
      public boolean equals(Object obj) {
        return obj instanceof Field other && index == other.index && ty.equals(other.ty);
      }

      @Override
      public int hashCode() {
        return Objects.hash(index, ty);
      }

      @Override
      public String toString() {
        return "Field(" + index + ": " + ty + ")";
      }
    }

    /** Selects an element of an array; the index is computed at run time. */
    public static final class Index extends ProjectionElem {
      public final Operand index;

      public Index(Operand index) {
        this.index = index;
      }

      @Override
      public boolean equals(Object obj) {
        return obj instanceof Index other && index.equals(other.index);
      }

      @Override
      public int hashCode() {
        return index.hashCode();
      }

      @Override
      public String toString() {
        return "Index(" + index + ")";
      }
    }
  }
}
