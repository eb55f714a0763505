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
package net.hydromatic.tempo.constraint;

import static net.hydromatic.tempo.constraint.Constraints.ANY;
import static net.hydromatic.tempo.constraint.Constraints.IS_ARRAY;
import static net.hydromatic.tempo.constraint.Constraints.IS_FUNCTION;
import static net.hydromatic.tempo.constraint.Constraints.IS_NULL;
import static net.hydromatic.tempo.constraint.Constraints.IS_NUMBER;
import static net.hydromatic.tempo.constraint.Constraints.IS_OBJECT;
import static net.hydromatic.tempo.constraint.Constraints.IS_STRING;
import static net.hydromatic.tempo.constraint.Constraints.NEVER;
import static net.hydromatic.tempo.constraint.Constraints.and;
import static net.hydromatic.tempo.constraint.Constraints.arrayOf;
import static net.hydromatic.tempo.constraint.Constraints.equalTo;
import static net.hydromatic.tempo.constraint.Constraints.fnType;
import static net.hydromatic.tempo.constraint.Constraints.gt;
import static net.hydromatic.tempo.constraint.Constraints.gte;
import static net.hydromatic.tempo.constraint.Constraints.hasField;
import static net.hydromatic.tempo.constraint.Constraints.literal;
import static net.hydromatic.tempo.constraint.Constraints.lt;
import static net.hydromatic.tempo.constraint.Constraints.lte;
import static net.hydromatic.tempo.constraint.Constraints.not;
import static net.hydromatic.tempo.constraint.Constraints.object;
import static net.hydromatic.tempo.constraint.Constraints.or;
import static net.hydromatic.tempo.constraint.Constraints.rec;
import static net.hydromatic.tempo.constraint.Constraints.recVar;
import static net.hydromatic.tempo.constraint.Implication.implies;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.core.Is.is;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.junit.jupiter.api.Test;

/** Tests for {@link Implication}. */
public class ImplicationTest {
  @Test void testTrivial() {
    assertThat(implies(NEVER, IS_STRING), is(true));
    assertThat(implies(NEVER, NEVER), is(true));
    assertThat(implies(IS_STRING, ANY), is(true));
    assertThat(implies(ANY, ANY), is(true));
    assertThat(implies(ANY, IS_NUMBER), is(false));
    assertThat(implies(IS_NUMBER, NEVER), is(false));
    assertThat(implies(IS_NUMBER, IS_NUMBER), is(true));
    assertThat(implies(IS_NUMBER, IS_STRING), is(false));
    // A contradiction is never, so implies anything
    assertThat(implies(and(IS_NUMBER, IS_STRING), IS_NULL), is(true));
  }

  @Test void testHierarchy() {
    assertThat(implies(IS_ARRAY, IS_OBJECT), is(true));
    assertThat(implies(IS_FUNCTION, IS_OBJECT), is(true));
    assertThat(implies(IS_OBJECT, IS_ARRAY), is(false));
    final Constraint fn = fnType(ImmutableList.of(IS_NUMBER), IS_NUMBER);
    assertThat(implies(fn, IS_FUNCTION), is(true));
    assertThat(implies(fn, IS_OBJECT), is(true));
    assertThat(implies(arrayOf(IS_NUMBER), IS_OBJECT), is(true));
  }

  @Test void testLiteral() {
    assertThat(implies(literal(5d), IS_NUMBER), is(true));
    assertThat(implies(literal(5d), IS_STRING), is(false));
    assertThat(implies(equalTo("a"), IS_STRING), is(true));
    assertThat(implies(equalTo(null), IS_NULL), is(true));
    assertThat(implies(IS_NULL, equalTo(null)), is(true));
    assertThat(implies(IS_NULL, equalTo(0)), is(false));
    assertThat(implies(literal(5d), gt(3)), is(true));
    assertThat(implies(literal(5d), gt(5)), is(false));
    assertThat(implies(literal(5d), gte(5)), is(true));
    assertThat(implies(literal(5d), lt(6)), is(true));
    assertThat(implies(literal(5d), and(IS_NUMBER, gt(0))), is(true));
    assertThat(implies(literal(-1d), and(IS_NUMBER, gt(0))), is(false));
    assertThat(implies(literal(5d), literal(5d)), is(true));
    assertThat(implies(literal(5d), literal(6d)), is(false));
  }

  @Test void testBounds() {
    assertThat(implies(gt(5), gt(3)), is(true));
    assertThat(implies(gt(3), gt(5)), is(false));
    assertThat(implies(gt(5), gte(5)), is(true));
    assertThat(implies(gte(5), gt(5)), is(false));
    assertThat(implies(gte(10), gt(5)), is(true));
    assertThat(implies(lt(3), lt(5)), is(true));
    assertThat(implies(lt(5), lte(5)), is(true));
    assertThat(implies(lte(5), lt(10)), is(true));
    assertThat(implies(lte(5), lt(5)), is(false));
    assertThat(implies(gt(0), lt(10)), is(false));
    assertThat(implies(and(gte(5), lte(5)), equalTo(5d)), is(true));
    assertThat(implies(and(gte(5), lte(6)), equalTo(5d)), is(false));
  }

  @Test void testJunction() {
    final Constraint numberOrString = or(IS_NUMBER, IS_STRING);
    assertThat(implies(numberOrString, IS_NUMBER), is(false));
    assertThat(implies(IS_NUMBER, numberOrString), is(true));
    assertThat(implies(or(literal(1d), literal(2d)), IS_NUMBER), is(true));
    assertThat(implies(and(IS_NUMBER, gt(0)), IS_NUMBER), is(true));
    assertThat(implies(IS_NUMBER, and(IS_NUMBER, gt(0))), is(false));
    assertThat(implies(and(IS_NUMBER, gt(5)), and(gt(0), IS_NUMBER)),
        is(true));
  }

  @Test void testStructure() {
    final Constraint point =
        object(ImmutableMap.of("x", literal(1d), "y", IS_NUMBER));
    assertThat(implies(point, and(IS_OBJECT, hasField("x", IS_NUMBER))),
        is(true));
    assertThat(implies(point, hasField("y", IS_NUMBER)), is(true));
    assertThat(implies(point, hasField("z", ANY)), is(false));
    assertThat(implies(point, hasField("y", IS_STRING)), is(false));
    assertThat(implies(arrayOf(literal(1d)), arrayOf(IS_NUMBER)), is(true));
    assertThat(implies(arrayOf(IS_NUMBER), arrayOf(literal(1d))), is(false));
    assertThat(implies(not(IS_NUMBER), not(literal(3d))), is(true));
  }

  @Test void testFunction() {
    final Constraint numberToNumber =
        fnType(ImmutableList.of(IS_NUMBER), IS_NUMBER);
    final Constraint anyToPositive =
        fnType(ImmutableList.of(ANY), and(IS_NUMBER, gt(0)));
    assertThat(implies(anyToPositive, numberToNumber), is(true));
    assertThat(implies(numberToNumber, anyToPositive), is(false));
  }

  @Test void testRecursive() {
    final Constraint list = list("L", IS_NUMBER);
    assertThat(implies(IS_NULL, list), is(true));
    assertThat(implies(list, list), is(true));
    assertThat(implies(IS_NUMBER, list), is(false));

    // Alpha-equivalent
    assertThat(implies(list, list("M", IS_NUMBER)), is(true));

    // A list of numbers is a list of anything, but not the converse
    final Constraint anyList = list("L", ANY);
    assertThat(implies(list, anyList), is(true));
    assertThat(implies(anyList, list), is(false));

    // A one-element list, unrolled by hand
    final Constraint one =
        and(IS_OBJECT, hasField("head", literal(1d)),
            hasField("tail", IS_NULL));
    assertThat(implies(one, list), is(true));
    assertThat(implies(list, IS_NULL), is(false));
    assertThat(implies(list, or(IS_NULL, IS_OBJECT)), is(true));
  }

  private static Constraint list(String name, Constraint element) {
    return rec(name,
        or(IS_NULL,
            and(IS_OBJECT, hasField("head", element),
                hasField("tail", recVar(name)))));
  }
}

// End ImplicationTest.java
