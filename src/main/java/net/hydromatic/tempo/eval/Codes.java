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

import static com.google.common.base.Preconditions.checkArgument;
import static net.hydromatic.tempo.ast.AstBuilder.ast;
import static net.hydromatic.tempo.constraint.Constraints.ANY;
import static net.hydromatic.tempo.constraint.Constraints.IS_NULL;
import static net.hydromatic.tempo.constraint.Constraints.arrayOf;
import static net.hydromatic.tempo.constraint.Constraints.isType;
import static net.hydromatic.tempo.util.Static.numberToString;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.tempo.ast.Ast;
import net.hydromatic.tempo.compile.BuiltIn;
import net.hydromatic.tempo.compile.StageException;
import net.hydromatic.tempo.compile.StagedApplicable;
import net.hydromatic.tempo.compile.StagedContext;
import net.hydromatic.tempo.constraint.Constraint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Implementations of built-in functions and methods.
 *
 * <p>String and number operations follow JavaScript semantics, because
 * residual code runs as JavaScript, and a value computed at compile time
 * must equal the value that the same code would compute at run time. */
public abstract class Codes {
  private static final Logger LOG = LoggerFactory.getLogger(Codes.class);

  private Codes() {}

  /** Returns the string in a string value. */
  public static String str(Value value) {
    return ((Value.Str) value).value;
  }

  /** Returns the number in a number value. */
  public static double num(Value value) {
    return ((Value.Num) value).value;
  }

  /** Returns the elements of an array value. */
  public static List<Value> list(Value value) {
    return ((Value.Arr) value).elements;
  }

  /** Converts a number to an integer the way JavaScript converts the
   * arguments of string methods: truncates, and NaN becomes 0. */
  static int toInteger(double d) {
    if (Double.isNaN(d)) {
      return 0;
    }
    if (d >= Integer.MAX_VALUE) {
      return Integer.MAX_VALUE;
    }
    if (d <= Integer.MIN_VALUE) {
      return Integer.MIN_VALUE;
    }
    return (int) d;
  }

  /** Converts a relative index, as taken by {@code slice}, to an absolute
   * index in {@code [0, length]}. A negative index counts from the end. */
  static int relativeIndex(double d, int length) {
    final int i = toInteger(d);
    if (i < 0) {
      return Math.max(length + i, 0);
    }
    return Math.min(i, length);
  }

  /** Implements {@code String.prototype.slice}. */
  public static String slice(String s, double start, Value end) {
    final int from = relativeIndex(start, s.length());
    final int to = end.kind == Value.Kind.NULL
        ? s.length()
        : relativeIndex(num(end), s.length());
    return from < to ? s.substring(from, to) : "";
  }

  /** Implements {@code String.prototype.substring}. Negative indexes become
   * 0, and the indexes are swapped if the start is after the end. */
  public static String substring(String s, double start, Value end) {
    int from = Math.min(Math.max(toInteger(start), 0), s.length());
    int to = end.kind == Value.Kind.NULL
        ? s.length()
        : Math.min(Math.max(toInteger(num(end)), 0), s.length());
    if (from > to) {
      final int t = from;
      from = to;
      to = t;
    }
    return s.substring(from, to);
  }

  /** Implements {@code String.prototype.charAt}. */
  public static String charAt(String s, double index) {
    final int i = toInteger(index);
    return i >= 0 && i < s.length() ? s.substring(i, i + 1) : "";
  }

  /** Implements {@code String.prototype.charCodeAt}. */
  public static double charCodeAt(String s, double index) {
    final int i = toInteger(index);
    return i >= 0 && i < s.length() ? s.charAt(i) : Double.NaN;
  }

  /** Implements {@code String.prototype.split} with a string separator.
   * Unlike {@link String#split(String)}, the separator is not a regular
   * expression, and trailing empty strings are kept. */
  public static List<String> split(String s, String separator) {
    final List<String> list = new ArrayList<>();
    if (separator.isEmpty()) {
      for (int i = 0; i < s.length(); i++) {
        list.add(s.substring(i, i + 1));
      }
      return list;
    }
    int start = 0;
    for (;;) {
      final int i = s.indexOf(separator, start);
      if (i < 0) {
        list.add(s.substring(start));
        return list;
      }
      list.add(s.substring(start, i));
      start = i + separator.length();
    }
  }

  /** Implements {@code String.prototype.replace} with a string pattern;
   * replaces the first occurrence. */
  public static String replaceFirst(String s, String search,
      String replacement) {
    final int i = s.indexOf(search);
    if (i < 0) {
      return s;
    }
    return s.substring(0, i) + replacement
        + s.substring(i + search.length());
  }

  /** Implements {@code String.prototype.replaceAll} with a string
   * pattern. */
  public static String replaceAll(String s, String search,
      String replacement) {
    return String.join(replacement, split(s, search));
  }

  /** Implements {@code String.prototype.padStart} and
   * {@code padEnd}. */
  public static String pad(String s, double targetLength, String padding,
      boolean atStart) {
    final int length = toInteger(targetLength);
    if (length <= s.length() || padding.isEmpty()) {
      return s;
    }
    final StringBuilder fill = new StringBuilder();
    while (fill.length() < length - s.length()) {
      fill.append(padding);
    }
    fill.setLength(length - s.length());
    return atStart ? fill + s : s + fill;
  }

  /** Implements {@code String.prototype.repeat}. */
  public static String repeat(String s, double count) {
    if (count < 0 || Double.isInfinite(count)) {
      throw new StageException("Invalid count value: "
          + numberToString(count));
    }
    return s.repeat(toInteger(count));
  }

  /** Implements {@code Number.prototype.toFixed}. */
  public static String toFixed(double d, double digits) {
    final int scale = toInteger(digits);
    if (scale < 0 || scale > 100) {
      throw new StageException("toFixed() digits argument must be between "
          + "0 and 100");
    }
    if (Double.isNaN(d) || Double.isInfinite(d) || Math.abs(d) >= 1e21) {
      return numberToString(d);
    }
    // JavaScript rounds the exact binary value of the magnitude, as
    // BigDecimal(double) does, and keeps the sign even if the result is 0
    final String s =
        new BigDecimal(Math.abs(d)).setScale(scale, RoundingMode.HALF_UP)
            .toPlainString();
    return d < 0 ? "-" + s : s;
  }

  /** Implements {@code Number.prototype.toPrecision}. */
  public static String toPrecision(double d, double precision) {
    if (Double.isNaN(d) || Double.isInfinite(d)) {
      return numberToString(d);
    }
    final int p = toInteger(precision);
    if (p < 1 || p > 100) {
      throw new StageException("toPrecision() argument must be between "
          + "1 and 100");
    }
    if (d == 0) {
      return p == 1 ? "0" : "0." + "0".repeat(p - 1);
    }
    final BigDecimal bd =
        new BigDecimal(d).round(new MathContext(p, RoundingMode.HALF_UP));
    final int e = bd.precision() - bd.scale() - 1;
    if (e < -6 || e >= p) {
      final String digits =
          bd.unscaledValue().abs().toString()
              + "0".repeat(Math.max(0, p - bd.precision()));
      final StringBuilder b = new StringBuilder();
      if (d < 0) {
        b.append('-');
      }
      b.append(digits.charAt(0));
      if (p > 1) {
        b.append('.').append(digits, 1, p);
      }
      return b.append('e').append(e >= 0 ? "+" : "-").append(Math.abs(e))
          .toString();
    }
    return bd.setScale(p - 1 - e, RoundingMode.HALF_UP).toPlainString();
  }

  /** Implements {@code Array.prototype.slice}. */
  public static List<Value> slice(List<Value> list, double start,
      Value end) {
    final int from = relativeIndex(start, list.size());
    final int to = end.kind == Value.Kind.NULL
        ? list.size()
        : relativeIndex(num(end), list.size());
    return from < to ? list.subList(from, to) : ImmutableList.of();
  }

  /** Implements {@code Array.prototype.indexOf}. */
  public static int indexOf(List<Value> list, Value value) {
    for (int i = 0; i < list.size(); i++) {
      if (Values.valueEquals(list.get(i), value)) {
        return i;
      }
    }
    return -1;
  }

  /** Implements {@code Array.prototype.join}. */
  public static String join(List<Value> list, String separator) {
    final StringBuilder b = new StringBuilder();
    for (int i = 0; i < list.size(); i++) {
      if (i > 0) {
        b.append(separator);
      }
      final Value value = list.get(i);
      switch (value.kind) {
        case STRING:
          b.append(str(value));
          break;
        case NUMBER:
        case BOOL:
          Values.append(b, value);
          break;
        case NULL:
          // JavaScript joins null as the empty string
          break;
        default:
          b.append("[object]");
      }
    }
    return b.toString();
  }

  /** Implementations of pure built-in functions. */
  public static final ImmutableMap<BuiltIn, Applicable> BUILT_IN_VALUES =
      ImmutableMap.<BuiltIn, Applicable>builder()
          .put(BuiltIn.STARTS_WITH, args ->
              Values.bool(str(args.get(0)).startsWith(str(args.get(1)))))
          .put(BuiltIn.ENDS_WITH, args ->
              Values.bool(str(args.get(0)).endsWith(str(args.get(1)))))
          .put(BuiltIn.CONTAINS, args ->
              Values.bool(str(args.get(0)).contains(str(args.get(1)))))
          .build();

  /** Implementations of staged built-in functions. */
  public static final ImmutableMap<BuiltIn, StagedApplicable>
      STAGED_BUILT_INS =
      ImmutableMap.<BuiltIn, StagedApplicable>builder()
          .put(BuiltIn.TYPE_OF, Codes::typeOf)
          .put(BuiltIn.PRINT, Codes::print)
          .put(BuiltIn.MAP, Codes::map)
          .put(BuiltIn.FILTER, Codes::filter)
          .build();

  static {
    for (BuiltIn builtIn : BuiltIn.values()) {
      checkArgument(builtIn.staged
              ? STAGED_BUILT_INS.containsKey(builtIn)
              : BUILT_IN_VALUES.containsKey(builtIn),
          "no implementation for %s", builtIn);
    }
  }

  private static SValue typeOf(List<SValue> args, List<Ast.Exp> argExps,
      StagedContext cx) {
    final Constraint c = args.get(0).constraint;
    return SValue.now(Values.type(c), isType(c));
  }

  private static SValue print(List<SValue> args, List<Ast.Exp> argExps,
      StagedContext cx) {
    final SValue arg = args.get(0);
    final Session session = cx.session();
    if (arg.isNow() && Prop.COMPTIME_PRINT.booleanValue(session.map)) {
      final String line = ((SValue.Now) arg).value.toString();
      LOG.debug("print {}", line);
      session.out.add(line);
      return SValue.now(Values.NULL, IS_NULL);
    }
    return SValue.later(IS_NULL,
        ast.apply(ast.id(BuiltIn.PRINT.camelName), cx.residual(arg)));
  }

  private static SValue map(List<SValue> args, List<Ast.Exp> argExps,
      StagedContext cx) {
    final SValue arr = args.get(0);
    final SValue fn = args.get(1);
    if (arr.isNow() && fn.isNow()) {
      final List<Value> results = new ArrayList<>();
      for (Value e : list(((SValue.Now) arr).value)) {
        results.add(invokeNow(cx, fn, e, "map"));
      }
      return SValue.now(Values.array(results), arrayOf(ANY));
    }
    return SValue.later(arrayOf(ANY),
        ast.methodCall(cx.residual(arr), BuiltIn.MAP.camelName,
            cx.residual(fn)));
  }

  private static SValue filter(List<SValue> args, List<Ast.Exp> argExps,
      StagedContext cx) {
    final SValue arr = args.get(0);
    final SValue fn = args.get(1);
    if (arr.isNow() && fn.isNow()) {
      final List<Value> results = new ArrayList<>();
      for (Value e : list(((SValue.Now) arr).value)) {
        final Value keep = invokeNow(cx, fn, e, "filter");
        if (keep == Values.TRUE) {
          results.add(e);
        }
      }
      final Value result = Values.array(results);
      return SValue.now(result, Values.constraintOf(result));
    }
    return SValue.later(
        BuiltIn.FILTER.resultType(ImmutableList.of(arr.constraint)),
        ast.methodCall(cx.residual(arr), BuiltIn.FILTER.camelName,
            cx.residual(fn)));
  }

  /** Invokes a callback on an element, requiring a result that is known
   * at compile time. */
  private static Value invokeNow(StagedContext cx, SValue fn, Value e,
      String name) {
    final SValue result =
        cx.invoke(fn,
            ImmutableList.of(SValue.now(e, Values.constraintOf(e))));
    if (!result.isNow()) {
      throw new StageException(name
          + " callback returned Later value on Now input");
    }
    return ((SValue.Now) result).value;
  }
}

// End Codes.java
