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

import static net.hydromatic.tempo.util.Static.allMatch;
import static net.hydromatic.tempo.util.Static.anyMatch;
import static net.hydromatic.tempo.util.Static.appendLiteral;
import static net.hydromatic.tempo.util.Static.isInteger;
import static net.hydromatic.tempo.util.Static.numberToString;
import static net.hydromatic.tempo.util.Static.transformEager;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.core.Is.is;

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.junit.jupiter.api.Test;

/** Tests for {@link Static}. */
public class StaticTest {
  /** Numbers print the way JavaScript's {@code String(n)} prints them. */
  @Test void testNumberToString() {
    assertThat(numberToString(6d), is("6"));
    assertThat(numberToString(-0d), is("0"));
    assertThat(numberToString(1.5d), is("1.5"));
    assertThat(numberToString(-2.25d), is("-2.25"));
    assertThat(numberToString(0.1d + 0.2d), is("0.30000000000000004"));
    assertThat(numberToString(1e20d), is("100000000000000000000"));
    assertThat(numberToString(1e21d), is("1e+21"));
    assertThat(numberToString(1.5e-7d), is("1.5e-7"));
    assertThat(numberToString(0.000001d), is("0.000001"));
    assertThat(numberToString(Double.NaN), is("NaN"));
    assertThat(numberToString(Double.NEGATIVE_INFINITY), is("-Infinity"));
  }

  @Test void testIsInteger() {
    assertThat(isInteger(3d), is(true));
    assertThat(isInteger(-0d), is(true));
    assertThat(isInteger(3.5d), is(false));
    assertThat(isInteger(Double.POSITIVE_INFINITY), is(false));
    assertThat(isInteger(Double.NaN), is(false));
  }

  @Test void testAppendLiteral() {
    assertThat(literal("a\"b\n"), is("\"a\\\"b\\n\""));
    assertThat(literal("\u0001"), is("\"\\u0001\""));
    assertThat(literal(2d), is("2"));
    assertThat(literal(true), is("true"));
    assertThat(literal(null), is("null"));
    assertThat(Static.isLiteral(1), is(false));
    assertThat(Static.isLiteral(1d), is(true));
  }

  private static String literal(Object o) {
    return appendLiteral(new StringBuilder(), o).toString();
  }

  @Test void testMatch() {
    final List<Integer> list = ImmutableList.of(1, 2, 3);
    assertThat(allMatch(list, i -> i > 0), is(true));
    assertThat(allMatch(list, i -> i > 1), is(false));
    assertThat(anyMatch(list, i -> i > 2), is(true));
    assertThat(anyMatch(ImmutableList.<Integer>of(), i -> true), is(false));
    assertThat(transformEager(list, i -> i * 10), contains(10, 20, 30));
  }
}

// End StaticTest.java
