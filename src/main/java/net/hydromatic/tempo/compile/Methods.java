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
import static net.hydromatic.tempo.constraint.Constraints.IS_NULL;
import static net.hydromatic.tempo.constraint.Constraints.IS_NUMBER;
import static net.hydromatic.tempo.constraint.Constraints.IS_STRING;
import static net.hydromatic.tempo.constraint.Constraints.arrayOf;
import static net.hydromatic.tempo.constraint.Constraints.extractElements;
import static net.hydromatic.tempo.constraint.Constraints.or;
import static net.hydromatic.tempo.constraint.Constraints.simplify;
import static net.hydromatic.tempo.eval.Codes.list;
import static net.hydromatic.tempo.eval.Codes.num;
import static net.hydromatic.tempo.eval.Codes.str;
import static net.hydromatic.tempo.util.Static.numberToString;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.function.BiFunction;
import net.hydromatic.tempo.constraint.Constraint;
import net.hydromatic.tempo.constraint.Implication;
import net.hydromatic.tempo.eval.Applicable;
import net.hydromatic.tempo.eval.Codes;
import net.hydromatic.tempo.eval.Value;
import net.hydromatic.tempo.eval.Values;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Methods of strings, arrays and numbers.
 *
 * <p>Each method has a receiver type, parameter constraints, a rule that
 * computes the result constraint, and an implementation. The
 * implementation's first argument is the receiver. */
public abstract class Methods {
  private Methods() {}

  /** Optional number, as taken by the second argument of {@code slice}. */
  private static final Constraint OPT_NUMBER = or(IS_NUMBER, IS_NULL);

  /** Methods of strings. */
  public static final ImmutableMap<String, MethodDef> STRING =
      ImmutableMap.<String, MethodDef>builder()
          .put("startsWith",
              def(IS_STRING, IS_BOOL, a ->
                  Values.bool(str(a.get(0)).startsWith(str(a.get(1)))),
                  IS_STRING))
          .put("endsWith",
              def(IS_STRING, IS_BOOL, a ->
                  Values.bool(str(a.get(0)).endsWith(str(a.get(1)))),
                  IS_STRING))
          .put("includes",
              def(IS_STRING, IS_BOOL, a ->
                  Values.bool(str(a.get(0)).contains(str(a.get(1)))),
                  IS_STRING))
          .put("toUpperCase",
              def(IS_STRING, IS_STRING, a ->
                  Values.string(str(a.get(0)).toUpperCase(Locale.ROOT))))
          .put("toLowerCase",
              def(IS_STRING, IS_STRING, a ->
                  Values.string(str(a.get(0)).toLowerCase(Locale.ROOT))))
          .put("trim",
              def(IS_STRING, IS_STRING, a ->
                  Values.string(str(a.get(0)).strip())))
          .put("trimStart",
              def(IS_STRING, IS_STRING, a ->
                  Values.string(str(a.get(0)).stripLeading())))
          .put("trimEnd",
              def(IS_STRING, IS_STRING, a ->
                  Values.string(str(a.get(0)).stripTrailing())))
          .put("slice",
              def(IS_STRING, IS_STRING, a ->
                  Values.string(
                      Codes.slice(str(a.get(0)), num(a.get(1)), a.get(2))),
                  IS_NUMBER, OPT_NUMBER))
          .put("substring",
              def(IS_STRING, IS_STRING, a ->
                  Values.string(
                      Codes.substring(str(a.get(0)), num(a.get(1)),
                          a.get(2))),
                  IS_NUMBER, OPT_NUMBER))
          .put("charAt",
              def(IS_STRING, IS_STRING, a ->
                  Values.string(Codes.charAt(str(a.get(0)), num(a.get(1)))),
                  IS_NUMBER))
          .put("charCodeAt",
              def(IS_STRING, IS_NUMBER, a ->
                  Values.number(
                      Codes.charCodeAt(str(a.get(0)), num(a.get(1)))),
                  IS_NUMBER))
          .put("indexOf",
              def(IS_STRING, IS_NUMBER, a ->
                  Values.number(str(a.get(0)).indexOf(str(a.get(1)))),
                  IS_STRING))
          .put("lastIndexOf",
              def(IS_STRING, IS_NUMBER, a ->
                  Values.number(str(a.get(0)).lastIndexOf(str(a.get(1)))),
                  IS_STRING))
          .put("split",
              def(IS_STRING, arrayOf(IS_STRING), a ->
                  Values.array(
                      Codes.split(str(a.get(0)), str(a.get(1))).stream()
                          .map(Values::string)
                          .collect(ImmutableList.toImmutableList())),
                  IS_STRING))
          .put("replace",
              def(IS_STRING, IS_STRING, a ->
                  Values.string(
                      Codes.replaceFirst(str(a.get(0)), str(a.get(1)),
                          str(a.get(2)))),
                  IS_STRING, IS_STRING))
          .put("replaceAll",
              def(IS_STRING, IS_STRING, a ->
                  Values.string(
                      Codes.replaceAll(str(a.get(0)), str(a.get(1)),
                          str(a.get(2)))),
                  IS_STRING, IS_STRING))
          .put("padStart",
              def(IS_STRING, IS_STRING, a ->
                  Values.string(
                      Codes.pad(str(a.get(0)), num(a.get(1)), str(a.get(2)),
                          true)),
                  IS_NUMBER, IS_STRING))
          .put("padEnd",
              def(IS_STRING, IS_STRING, a ->
                  Values.string(
                      Codes.pad(str(a.get(0)), num(a.get(1)), str(a.get(2)),
                          false)),
                  IS_NUMBER, IS_STRING))
          .put("repeat",
              def(IS_STRING, IS_STRING, a ->
                  Values.string(Codes.repeat(str(a.get(0)), num(a.get(1)))),
                  IS_NUMBER))
          .put("concat",
              def(IS_STRING, IS_STRING, a ->
                  Values.string(str(a.get(0)) + str(a.get(1))),
                  IS_STRING))
          .build();

  /** Methods of arrays. */
  public static final ImmutableMap<String, MethodDef> ARRAY =
      ImmutableMap.<String, MethodDef>builder()
          .put("includes",
              def(IS_ARRAY, IS_BOOL, a ->
                  Values.bool(Codes.indexOf(list(a.get(0)), a.get(1)) >= 0),
                  ANY))
          .put("indexOf",
              def(IS_ARRAY, IS_NUMBER, a ->
                  Values.number(Codes.indexOf(list(a.get(0)), a.get(1))),
                  ANY))
          .put("join",
              def(IS_ARRAY, IS_STRING, a ->
                  Values.string(Codes.join(list(a.get(0)), str(a.get(1)))),
                  IS_STRING))
          .put("slice",
              new MethodDef(IS_ARRAY, ImmutableList.of(IS_NUMBER, OPT_NUMBER),
                  (receiver, args) -> sameElements(receiver), a ->
                  Values.array(
                      Codes.slice(list(a.get(0)), num(a.get(1)), a.get(2)))))
          .put("reverse",
              new MethodDef(IS_ARRAY, ImmutableList.of(),
                  (receiver, args) -> sameElements(receiver), a ->
                  Values.array(Lists.reverse(list(a.get(0))))))
          .put("concat",
              new MethodDef(IS_ARRAY, ImmutableList.of(IS_ARRAY),
                  Methods::concatType, a ->
                  Values.array(
                      ImmutableList.<Value>builder()
                          .addAll(list(a.get(0)))
                          .addAll(list(a.get(1)))
                          .build())))
          .build();

  /** Methods of numbers. */
  public static final ImmutableMap<String, MethodDef> NUMBER =
      ImmutableMap.<String, MethodDef>builder()
          .put("toString",
              def(IS_NUMBER, IS_STRING, a ->
                  Values.string(numberToString(num(a.get(0))))))
          .put("toFixed",
              def(IS_NUMBER, IS_STRING, a ->
                  Values.string(Codes.toFixed(num(a.get(0)), num(a.get(1)))),
                  IS_NUMBER))
          .put("toPrecision",
              def(IS_NUMBER, IS_STRING, a ->
                  Values.string(
                      Codes.toPrecision(num(a.get(0)), num(a.get(1)))),
                  IS_NUMBER))
          .build();

  /** Returns an array type with the same element type as an array type,
   * but any length. */
  private static Constraint sameElements(Constraint c) {
    final @Nullable Constraint elements = extractElements(c);
    return arrayOf(elements == null ? ANY : elements);
  }

  private static Constraint concatType(Constraint receiver,
      List<Constraint> args) {
    final @Nullable Constraint e0 = extractElements(receiver);
    final @Nullable Constraint e1 = extractElements(args.get(0));
    return arrayOf(e0 == null || e1 == null ? ANY : simplify(or(e0, e1)));
  }

  private static MethodDef def(Constraint receiverType, Constraint result,
      Applicable impl, Constraint... params) {
    return new MethodDef(receiverType, ImmutableList.copyOf(params),
        (receiver, args) -> result, impl);
  }

  /** Looks up a method of a value whose constraint is {@code c}; returns
   * null if there is no such method.
   *
   * <p>If {@code c} is not known to be a string, array or number, searches
   * all three tables in that order. */
  public static @Nullable MethodDef lookup(Constraint c, String name) {
    for (ImmutableMap<String, MethodDef> table : tables(c)) {
      final MethodDef def = table.get(name);
      if (def != null) {
        return def;
      }
    }
    return null;
  }

  /** Returns the names of the methods that a value whose constraint is
   * {@code c} may have, sorted by table then by name. */
  public static Set<String> methodNames(Constraint c) {
    final Set<String> names = new LinkedHashSet<>();
    for (ImmutableMap<String, MethodDef> table : tables(c)) {
      final List<String> tableNames = new ArrayList<>(table.keySet());
      tableNames.sort(null);
      names.addAll(tableNames);
    }
    return names;
  }

  private static List<ImmutableMap<String, MethodDef>> tables(Constraint c) {
    if (Implication.implies(c, IS_STRING)) {
      return ImmutableList.of(STRING);
    }
    if (Implication.implies(c, IS_ARRAY)) {
      return ImmutableList.of(ARRAY);
    }
    if (Implication.implies(c, IS_NUMBER)) {
      return ImmutableList.of(NUMBER);
    }
    return ImmutableList.of(STRING, ARRAY, NUMBER);
  }

  /** Definition of a method. */
  public static class MethodDef {
    /** Constraint that the receiver must satisfy. */
    public final Constraint receiverType;
    /** Constraints of the arguments, not including the receiver. */
    public final ImmutableList<Constraint> params;
    private final BiFunction<Constraint, List<Constraint>, Constraint>
        result;
    /** Implementation; its first argument is the receiver. */
    public final Applicable impl;

    MethodDef(Constraint receiverType, ImmutableList<Constraint> params,
        BiFunction<Constraint, List<Constraint>, Constraint> result,
        Applicable impl) {
      this.receiverType = receiverType;
      this.params = params;
      this.result = result;
      this.impl = impl;
    }

    /** Computes the constraint of the result. */
    public Constraint result(Constraint receiver, List<Constraint> args) {
      return result.apply(receiver, args);
    }
  }
}

// End Methods.java
