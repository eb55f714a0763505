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
import java.util.List;
import net.hydromatic.tempo.ast.Ast;
import net.hydromatic.tempo.constraint.Constraint;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Staged value.
 *
 * <p>A staged value is either {@link Now}, a value known at compile time,
 * or {@link Later}, a value that will only be known at run time and is
 * represented by residual code. {@link LaterArray} is an array whose
 * elements are a mixture of both. Every staged value has a constraint. */
public abstract class SValue {
  public final Constraint constraint;

  SValue(Constraint constraint) {
    this.constraint = requireNonNull(constraint);
  }

  /** Creates a value known at compile time. */
  public static Now now(Value value, Constraint constraint) {
    return new Now(value, constraint, null);
  }

  /** Creates a value known at compile time, with an expression by which
   * residual code can refer to it. */
  public static Now now(Value value, Constraint constraint,
      Ast.@Nullable Exp residual) {
    return new Now(value, constraint, residual);
  }

  /** Creates a value known at run time. */
  public static Later later(Constraint constraint, Ast.Exp residual) {
    return new Later(constraint, residual);
  }

  /** Creates an array of staged values. */
  public static LaterArray laterArray(List<? extends SValue> elements,
      Constraint constraint) {
    return new LaterArray(ImmutableList.copyOf(elements), constraint);
  }

  /** Returns whether this value is known at compile time. */
  public boolean isNow() {
    return false;
  }

  /** Value known at compile time. */
  public static class Now extends SValue {
    public final Value value;
    /** Expression that refers to this value in residual code, or null. A
     * compound value bound to a variable remembers the variable, so that
     * residual code does not copy it. */
    public final Ast.@Nullable Exp residual;

    Now(Value value, Constraint constraint, Ast.@Nullable Exp residual) {
      super(constraint);
      this.value = requireNonNull(value);
      this.residual = residual;
    }

    @Override public boolean isNow() {
      return true;
    }

    @Override public String toString() {
      return "Now(" + value + ", " + constraint + ")";
    }
  }

  /** Value known only at run time. */
  public static class Later extends SValue {
    public final Ast.Exp residual;

    Later(Constraint constraint, Ast.Exp residual) {
      super(constraint);
      this.residual = requireNonNull(residual);
    }

    @Override public String toString() {
      return "Later(" + residual + ", " + constraint + ")";
    }
  }

  /** Array whose elements are staged values, some of which are not known
   * until run time.
   *
   * <p>It is how a function receives its arguments: indexing it with a
   * constant gives the staged argument itself. */
  public static class LaterArray extends SValue {
    public final ImmutableList<SValue> elements;

    LaterArray(ImmutableList<SValue> elements, Constraint constraint) {
      super(constraint);
      this.elements = requireNonNull(elements);
    }

    @Override public String toString() {
      return "LaterArray(" + elements + ", " + constraint + ")";
    }
  }
}

// End SValue.java
