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
package net.hydromatic.tempo.compile;

import static net.hydromatic.tempo.constraint.Constraints.ANY;
import static net.hydromatic.tempo.constraint.Constraints.IS_ARRAY;
import static net.hydromatic.tempo.constraint.Constraints.IS_BOOL;
import static net.hydromatic.tempo.constraint.Constraints.IS_FUNCTION;
import static net.hydromatic.tempo.constraint.Constraints.IS_NULL;
import static net.hydromatic.tempo.constraint.Constraints.IS_STRING;
import static net.hydromatic.tempo.constraint.Constraints.arrayOf;
import static net.hydromatic.tempo.constraint.Constraints.extractElements;
import static net.hydromatic.tempo.constraint.Constraints.isType;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.function.Function;
import net.hydromatic.tempo.constraint.Constraint;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Built-in functions.
 *
 * <p>Each is bound in the initial environment. A <em>pure</em> built-in is
 * computed from its arguments' values, by an
 * {@link net.hydromatic.tempo.eval.Applicable} in
 * {@link net.hydromatic.tempo.eval.Codes#BUILT_IN_VALUES}, when all of them
 * are known at compile time. A <em>staged</em> built-in sees its arguments
 * as staged values, and can invoke closures; its implementation is in
 * {@link net.hydromatic.tempo.eval.Codes#STAGED_BUILT_INS}.
 *
 * <p>A built-in that is also a <em>method</em> can be called as
 * {@code receiver.name(args)}; the receiver is its first argument. */
public enum BuiltIn {
  /** Function "typeOf", of type "any &rarr; Type". Reifies the constraint
   * of its argument. */
  TYPE_OF("typeOf", false, true, args -> isType(ANY), "value", ANY),

  /** Function "print", of type "any &rarr; null". Prints at compile time
   * if its argument is known, otherwise at run time. */
  PRINT("print", false, true, args -> IS_NULL, "value", ANY),

  /** Method "startsWith", of type "(string, string) &rarr; boolean". */
  STARTS_WITH("startsWith", true, false, args -> IS_BOOL,
      "str", IS_STRING, "prefix", IS_STRING),

  /** Method "endsWith", of type "(string, string) &rarr; boolean". */
  ENDS_WITH("endsWith", true, false, args -> IS_BOOL,
      "str", IS_STRING, "suffix", IS_STRING),

  /** Method "contains", of type "(string, string) &rarr; boolean". */
  CONTAINS("contains", true, false, args -> IS_BOOL,
      "str", IS_STRING, "substr", IS_STRING),

  /** Method "map", of type "(array, function) &rarr; array". */
  MAP("map", true, true, args -> arrayOf(ANY),
      "arr", IS_ARRAY, "fn", IS_FUNCTION),

  /** Method "filter", of type "(array, function) &rarr; array". The
   * result has the same element type as the argument. */
  FILTER("filter", true, true, BuiltIn::sameElements,
      "arr", IS_ARRAY, "fn", IS_FUNCTION);

  /** Name of the function in the initial environment. */
  public final String camelName;
  /** Whether this function can be called as a method of its first
   * argument. */
  public final boolean isMethod;
  /** Whether this function sees staged values, rather than values. */
  public final boolean staged;
  /** Whether the function accepts more arguments than it has
   * parameters. */
  public final boolean variadic;
  public final ImmutableList<Param> params;
  private final Function<List<Constraint>, Constraint> resultType;

  /** Built-in functions, keyed by {@link #camelName}. */
  public static final ImmutableMap<String, BuiltIn> BY_NAME;

  static {
    final ImmutableMap.Builder<String, BuiltIn> b = ImmutableMap.builder();
    for (BuiltIn builtIn : values()) {
      b.put(builtIn.camelName, builtIn);
    }
    BY_NAME = b.build();
  }

  BuiltIn(String camelName, boolean isMethod, boolean staged,
      Function<List<Constraint>, Constraint> resultType,
      Object... paramNamesAndConstraints) {
    this.camelName = camelName;
    this.isMethod = isMethod;
    this.staged = staged;
    this.variadic = false;
    this.resultType = resultType;
    final ImmutableList.Builder<Param> params = ImmutableList.builder();
    for (int i = 0; i < paramNamesAndConstraints.length; i += 2) {
      params.add(
          new Param((String) paramNamesAndConstraints[i],
              (Constraint) paramNamesAndConstraints[i + 1]));
    }
    this.params = params.build();
  }

  /** Looks up a built-in by name; returns null if not found. */
  public static @Nullable BuiltIn lookup(String name) {
    return BY_NAME.get(name);
  }

  /** Computes the constraint of the result from the constraints of the
   * arguments. */
  public Constraint resultType(List<Constraint> argConstraints) {
    return resultType.apply(argConstraints);
  }

  private static Constraint sameElements(List<Constraint> args) {
    final @Nullable Constraint elements =
        args.isEmpty() ? null : extractElements(args.get(0));
    return arrayOf(elements == null ? ANY : elements);
  }

  /** Parameter of a built-in function. */
  public static class Param {
    public final String name;
    public final Constraint constraint;

    Param(String name, Constraint constraint) {
      this.name = name;
      this.constraint = constraint;
    }

    @Override public String toString() {
      return name + ": " + constraint;
    }
  }
}

// End BuiltIn.java
