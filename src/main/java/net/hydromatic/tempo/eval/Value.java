/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.tempo.eval;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import net.hydromatic.tempo.constraint.Constraint;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Runtime value.
 *
 * <p>Values are immutable. Numbers, strings, booleans and null compare by
 * value; objects and arrays compare by reference; closures compare by
 * handle; types compare by constraint.
 *
 * @see Values */
public abstract class Value {
  public final Kind kind;

  Value(Kind kind) {
    this.kind = requireNonNull(kind);
  }

  @Override public String toString() {
    return Values.append(new StringBuilder(), this).toString();
  }

  /** Kind of value. */
  public enum Kind {
    NUMBER, STRING, BOOL, NULL, OBJECT, ARRAY, CLOSURE, TYPE, BUILTIN
  }

  /** Number value. */
  public static class Num extends Value {
    public final double value;

    Num(double value) {
      super(Kind.NUMBER);
      this.value = value;
    }

    @Override public int hashCode() {
      return Double.hashCode(value);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Num
          && Double.compare(value, ((Num) o).value) == 0;
    }
  }

  /** String value. */
  public static class Str extends Value {
    public final String value;

    Str(String value) {
      super(Kind.STRING);
      this.value = requireNonNull(value);
    }

    @Override public int hashCode() {
      return value.hashCode();
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Str
          && value.equals(((Str) o).value);
    }
  }

  /** Boolean value. There are two instances,
   * {@link Values#TRUE} and {@link Values#FALSE}. */
  public static class Bool extends Value {
    public final boolean value;

    Bool(boolean value) {
      super(Kind.BOOL);
      this.value = value;
    }
  }

  /** The null value. There is one instance, {@link Values#NULL}. */
  public static class Null extends Value {
    Null() {
      super(Kind.NULL);
    }
  }

  /** Object value; a map from field names to values, in order. */
  public static class Obj extends Value {
    public final ImmutableMap<String, Value> fields;

    Obj(ImmutableMap<String, Value> fields) {
      super(Kind.OBJECT);
      this.fields = requireNonNull(fields);
    }
  }

  /** Array value. */
  public static class Arr extends Value {
    public final ImmutableList<Value> elements;

    Arr(ImmutableList<Value> elements) {
      super(Kind.ARRAY);
      this.elements = requireNonNull(elements);
    }
  }

  /** Closure value.
   *
   * <p>The body and the captured environment live in the session's closure
   * arena, at index {@link #handle}. */
  public static class Closure extends Value {
    public final int handle;
    public final @Nullable String name;

    Closure(int handle, @Nullable String name) {
      super(Kind.CLOSURE);
      this.handle = handle;
      this.name = name;
    }

    @Override public int hashCode() {
      return handle;
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Closure
          && handle == ((Closure) o).handle;
    }
  }

  /** Type value; a constraint reified as a value, so that it can be passed
   * to {@code assert} and {@code trust}. */
  public static class TypeValue extends Value {
    public final Constraint constraint;

    TypeValue(Constraint constraint) {
      super(Kind.TYPE);
      this.constraint = requireNonNull(constraint);
    }

    @Override public int hashCode() {
      return constraint.hashCode();
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof TypeValue
          && constraint.equals(((TypeValue) o).constraint);
    }
  }

  /** Reference to a built-in function. */
  public static class Builtin extends Value {
    public final String name;

    Builtin(String name) {
      super(Kind.BUILTIN);
      this.name = requireNonNull(name);
    }

    @Override public int hashCode() {
      return name.hashCode();
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Builtin
          && name.equals(((Builtin) o).name);
    }
  }
}

// End Value.java
