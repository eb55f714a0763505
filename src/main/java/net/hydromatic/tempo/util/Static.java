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
package net.hydromatic.tempo.util;

import com.google.common.collect.ImmutableList;
import java.math.BigDecimal;
import java.util.Collection;
import java.util.function.Function;
import java.util.function.Predicate;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Utilities. */
public class Static {
  private Static() {}

  /** Returns whether a predicate is true for all elements of a list. */
  public static <E> boolean allMatch(
      Iterable<? extends E> list, Predicate<? super E> predicate) {
    for (E e : list) {
      if (!predicate.test(e)) {
        return false;
      }
    }
    return true;
  }

  /** Returns whether a predicate is true for any element of a list. */
  public static <E> boolean anyMatch(
      Iterable<? extends E> list, Predicate<? super E> predicate) {
    for (E e : list) {
      if (predicate.test(e)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Eagerly converts a Collection to an ImmutableList, applying a mapping
   * function to each element.
   */
  public static <E, T> ImmutableList<T> transformEager(
      Collection<? extends E> elements, Function<? super E, T> mapper) {
    if (elements.isEmpty()) {
      return ImmutableList.of();
    }
    final ImmutableList.Builder<T> b =
        ImmutableList.builderWithExpectedSize(elements.size());
    elements.forEach(e -> b.add(mapper.apply(e)));
    return b.build();
  }

  /**
   * Converts a number to a string the way JavaScript's {@code String(n)} does.
   *
   * <p>For example, 6.0 becomes "6", 1.5 becomes "1.5", and 1e21 becomes
   * "1e+21".
   */
  public static String numberToString(double d) {
    if (Double.isNaN(d)) {
      return "NaN";
    }
    if (Double.isInfinite(d)) {
      return d > 0 ? "Infinity" : "-Infinity";
    }
    if (d == 0) {
      return "0"; // also for -0
    }
    final double abs = Math.abs(d);
    if (d == Math.rint(d) && abs < 1e21) {
      return abs < 1e15
          ? Long.toString((long) d)
          : BigDecimal.valueOf(d).toBigInteger().toString();
    }
    if (abs >= 1e-6 && abs < 1e21) {
      return BigDecimal.valueOf(d).stripTrailingZeros().toPlainString();
    }
    // Java prints "1.0E-7"; JavaScript prints "1e-7".
    final String s = Double.toString(d);
    final int e = s.indexOf('E');
    String mantissa = s.substring(0, e);
    if (mantissa.endsWith(".0")) {
      mantissa = mantissa.substring(0, mantissa.length() - 2);
    }
    final String exponent = s.substring(e + 1);
    return mantissa + "e" + (exponent.startsWith("-") ? "" : "+") + exponent;
  }

  /** Returns whether a double holds an integer value. */
  public static boolean isInteger(double d) {
    return !Double.isInfinite(d) && d == Math.rint(d);
  }

  /** Appends a string literal, quoted and escaped as JSON. */
  public static StringBuilder appendQuoted(StringBuilder buf, String s) {
    buf.append('"');
    for (int i = 0; i < s.length(); i++) {
      final char c = s.charAt(i);
      switch (c) {
        case '"':
          buf.append("\\\"");
          break;
        case '\\':
          buf.append("\\\\");
          break;
        case '\n':
          buf.append("\\n");
          break;
        case '\r':
          buf.append("\\r");
          break;
        case '\t':
          buf.append("\\t");
          break;
        default:
          if (c < 0x20) {
            buf.append(String.format("\\u%04x", (int) c));
          } else {
            buf.append(c);
          }
      }
    }
    return buf.append('"');
  }

  /**
   * Appends a literal value (a {@link Double}, {@link String}, {@link Boolean}
   * or null) as JSON.
   */
  public static StringBuilder appendLiteral(
      StringBuilder buf, @Nullable Object value) {
    if (value == null) {
      return buf.append("null");
    }
    if (value instanceof String) {
      return appendQuoted(buf, (String) value);
    }
    if (value instanceof Double) {
      final double d = (Double) value;
      // JSON has no NaN or Infinity
      return buf.append(Double.isNaN(d) || Double.isInfinite(d)
          ? "null" : numberToString(d));
    }
    return buf.append(value);
  }

  /** Returns whether a value is a valid literal: a {@link Double},
   * {@link String}, {@link Boolean} or null. */
  public static boolean isLiteral(@Nullable Object value) {
    return value == null
        || value instanceof Double
        || value instanceof String
        || value instanceof Boolean;
  }
}

// End Static.java
