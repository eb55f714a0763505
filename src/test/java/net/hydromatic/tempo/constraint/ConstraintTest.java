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
import static net.hydromatic.tempo.constraint.Constraints.IS_BOOL;
import static net.hydromatic.tempo.constraint.Constraints.IS_FUNCTION;
import static net.hydromatic.tempo.constraint.Constraints.IS_NULL;
import static net.hydromatic.tempo.constraint.Constraints.IS_NUMBER;
import static net.hydromatic.tempo.constraint.Constraints.IS_OBJECT;
import static net.hydromatic.tempo.constraint.Constraints.IS_STRING;
import static net.hydromatic.tempo.constraint.Constraints.NEVER;
import static net.hydromatic.tempo.constraint.Constraints.and;
import static net.hydromatic.tempo.constraint.Constraints.arrayOf;
import static net.hydromatic.tempo.constraint.Constraints.cvar;
import static net.hydromatic.tempo.constraint.Constraints.elementAt;
import static net.hydromatic.tempo.constraint.Constraints.equalTo;
import static net.hydromatic.tempo.constraint.Constraints.extractAllFieldNames;
import static net.hydromatic.tempo.constraint.Constraints.extractElementAt;
import static net.hydromatic.tempo.constraint.Constraints.extractFieldConstraint;
import static net.hydromatic.tempo.constraint.Constraints.fnType;
import static net.hydromatic.tempo.constraint.Constraints.genericFnType;
import static net.hydromatic.tempo.constraint.Constraints.gt;
import static net.hydromatic.tempo.constraint.Constraints.gte;
import static net.hydromatic.tempo.constraint.Constraints.hasField;
import static net.hydromatic.tempo.constraint.Constraints.indexSig;
import static net.hydromatic.tempo.constraint.Constraints.isType;
import static net.hydromatic.tempo.constraint.Constraints.literal;
import static net.hydromatic.tempo.constraint.Constraints.lt;
import static net.hydromatic.tempo.constraint.Constraints.lte;
import static net.hydromatic.tempo.constraint.Constraints.narrow;
import static net.hydromatic.tempo.constraint.Constraints.narrowOr;
import static net.hydromatic.tempo.constraint.Constraints.not;
import static net.hydromatic.tempo.constraint.Constraints.object;
import static net.hydromatic.tempo.constraint.Constraints.or;
import static net.hydromatic.tempo.constraint.Constraints.rec;
import static net.hydromatic.tempo.constraint.Constraints.recVar;
import static net.hydromatic.tempo.constraint.Constraints.simplify;
import static net.hydromatic.tempo.constraint.Constraints.tuple;
import static net.hydromatic.tempo.constraint.Constraints.typeParam;
import static net.hydromatic.tempo.constraint.Constraints.unify;
import static net.hydromatic.tempo.constraint.Constraints.widen;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.Matchers.notNullValue;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.core.Is.is;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import org.junit.jupiter.api.Test;

/** Tests for {@link Constraint} and {@link Constraints}. */
public class ConstraintTest {
  /** A linked list of numbers. */
  static final Constraint LIST =
      rec("L",
          or(IS_NULL,
              and(IS_OBJECT, hasField("head", IS_NUMBER),
                  hasField("tail", recVar("L")))));

  @Test void testToString() {
    assertThat(IS_NUMBER, hasToString("number"));
    assertThat(IS_BOOL, hasToString("boolean"));
    assertThat(ANY, hasToString("any"));
    assertThat(equalTo("a\"b"), hasToString("\"a\\\"b\""));
    assertThat(gt(1.5), hasToString("> 1.5"));
    assertThat(lte(0), hasToString("<= 0"));
    assertThat(literal(5d), hasToString("5"));
    assertThat(literal(true), hasToString("true"));
    assertThat(and(IS_NUMBER, gt(0)), hasToString("number & > 0"));
    assertThat(or(IS_STRING, IS_NULL), hasToString("string | null"));
    assertThat(not(IS_NULL), hasToString("not(null)"));
    assertThat(arrayOf(IS_NUMBER), hasToString("array & number[]"));
    assertThat(tuple(ImmutableList.of(IS_NUMBER, IS_STRING)),
        hasToString("array & [0]: number & [1]: string & length(2)"));
    assertThat(indexSig(IS_STRING), hasToString("[string]: string"));
    assertThat(cvar(3), hasToString("?3"));
    assertThat(isType(IS_NUMBER), hasToString("Type<number>"));
    assertThat(fnType(ImmutableList.of(IS_NUMBER), IS_STRING),
        hasToString("(number) => string"));
    final Constraint.TypeParam t = typeParam("T", ANY, 0);
    assertThat(genericFnType(ImmutableList.of(t), ImmutableList.of(t), t),
        hasToString("<T>(T) => T"));
    assertThat(LIST,
        hasToString("μL. null | { head: number, tail: L }"));
  }

  @Test void testObjectToString() {
    final Constraint c =
        object(ImmutableMap.of("a", literal(1d), "b", IS_NUMBER));
    assertThat(c, hasToString("{ a: 1, b: number }"));
    assertThat(object(ImmutableMap.of()), hasToString("{ }"));

    // An object without an index signature is open
    final Constraint open = and(IS_OBJECT, hasField("x", IS_STRING));
    assertThat(open, hasToString("{ x: string }"));

    // Other conjuncts prevent the short form
    final Constraint c2 = and(IS_OBJECT, hasField("x", IS_STRING), gt(1));
    assertThat(c2, hasToString("object & { x: string } & > 1"));
  }

  @Test void testJunction() {
    assertThat(and(), is(ANY));
    assertThat(or(), is(NEVER));
    assertThat(and(IS_NUMBER), is(IS_NUMBER));
    final Constraint c = and(and(IS_NUMBER, gt(0)), lt(10));
    assertThat(c.op, is(Op.AND));
    assertThat(((Constraint.Junction) c).constraints.size(), is(3));
    assertThat(and(IS_NUMBER, gt(0)), is(and(IS_NUMBER, gt(0))));
    assertThat(and(IS_NUMBER, gt(0)).equals(and(gt(0), IS_NUMBER)),
        is(false));
  }

  @Test void testSimplifyContradiction() {
    assertThat(simplify(and(IS_NUMBER, IS_STRING)), is(NEVER));
    assertThat(simplify(and(IS_ARRAY, IS_FUNCTION)), is(NEVER));
    assertThat(simplify(and(IS_OBJECT, IS_NULL)), is(NEVER));
    assertThat(simplify(and(IS_NUMBER, equalTo("x"))), is(NEVER));
    assertThat(simplify(and(equalTo("x"), IS_NUMBER)), is(NEVER));
    assertThat(simplify(and(equalTo(5d), equalTo(6d))), is(NEVER));
    assertThat(simplify(and(gt(5), lt(3))), is(NEVER));
    assertThat(simplify(and(gt(5), lte(5))), is(NEVER));
    assertThat(simplify(and(gte(5), lt(5))), is(NEVER));
    assertThat(simplify(and(equalTo(5d), gt(5))), is(NEVER));
    assertThat(simplify(and(equalTo(5d), lte(4))), is(NEVER));
    assertThat(
        simplify(
            and(hasField("x", equalTo(1d)), hasField("x", equalTo(2d)))),
        is(NEVER));
    assertThat(
        simplify(
            and(hasField("x", IS_NUMBER), hasField("x", IS_STRING))),
        is(NEVER));
    assertThat(simplify(and(IS_NUMBER, NEVER)), is(NEVER));
  }

  @Test void testSimplifyConsistent() {
    assertThat(simplify(and(IS_OBJECT, IS_ARRAY)),
        is(and(IS_OBJECT, IS_ARRAY)));
    assertThat(simplify(and(IS_OBJECT, IS_FUNCTION)),
        is(and(IS_OBJECT, IS_FUNCTION)));
    assertThat(simplify(and(gte(5), lte(5))), is(and(gte(5), lte(5))));
    assertThat(simplify(and(ANY, IS_NUMBER)), is(IS_NUMBER));
    assertThat(simplify(and(IS_NUMBER, IS_NUMBER, gt(0))),
        is(and(IS_NUMBER, gt(0))));
    assertThat(simplify(or(IS_NUMBER, ANY)), is(ANY));
    assertThat(simplify(or(NEVER, IS_STRING)), is(IS_STRING));
    assertThat(simplify(or(IS_STRING, IS_STRING)), is(IS_STRING));
    assertThat(simplify(not(not(IS_NUMBER))), is(IS_NUMBER));
    assertThat(simplify(not(NEVER)), is(ANY));
    assertThat(simplify(not(ANY)), is(NEVER));
    assertThat(simplify(hasField("a", and(IS_STRING, IS_NUMBER))),
        is(hasField("a", NEVER)));
  }

  /** Simplification is idempotent. */
  @Test void testSimplifyIdempotent() {
    final List<Constraint> list =
        ImmutableList.of(IS_NUMBER,
            and(IS_NUMBER, IS_NUMBER, gt(0)),
            and(and(IS_NUMBER, ANY), and(gt(0), lt(10))),
            or(or(IS_NULL, NEVER), and(IS_STRING, equalTo("a"))),
            and(IS_OBJECT, hasField("a", and(ANY, IS_NUMBER)),
                indexSig(NEVER)),
            not(not(not(IS_NULL))),
            and(hasField("x", or(IS_NUMBER, IS_NUMBER)), ANY),
            LIST,
            tuple(ImmutableList.of(literal(1d), literal("a"))),
            and(IS_NUMBER, equalTo("x")),
            or(and(IS_STRING, IS_NUMBER), ANY));
    for (Constraint c : list) {
      final Constraint s = simplify(c);
      assertThat(c.toString(), simplify(s), is(s));
    }
  }

  @Test void testUnifyAndNarrow() {
    assertThat(unify(IS_NUMBER, equalTo(10d)),
        is(and(IS_NUMBER, equalTo(10d))));
    assertThat(unify(IS_NUMBER, IS_STRING), is(NEVER));

    final Constraint nullable = or(IS_STRING, IS_NULL);
    assertThat(narrowOr(nullable, not(IS_NULL)), is(IS_STRING));
    assertThat(narrowOr(nullable, IS_NULL), is(IS_NULL));
    assertThat(narrow(IS_NULL, not(IS_NULL)), is(NEVER));
    assertThat(narrow(IS_NUMBER, not(IS_NULL)), is(IS_NUMBER));
    assertThat(narrow(IS_NUMBER, gt(0)), is(and(IS_NUMBER, gt(0))));
  }

  @Test void testWiden() {
    assertThat(widen(literal(5d)), is(IS_NUMBER));
    assertThat(widen(and(IS_NUMBER, gt(0), lt(10))), is(IS_NUMBER));
    assertThat(widen(object(ImmutableMap.of("a", literal("x")))),
        hasToString("{ a: string }"));
  }

  @Test void testExtractField() {
    final Constraint c =
        object(ImmutableMap.of("a", literal(1d), "b", IS_NUMBER));
    assertThat(extractFieldConstraint(c, "a"), is(literal(1d)));
    assertThat(extractFieldConstraint(c, "z"), nullValue());
    assertThat(extractFieldConstraint(and(IS_OBJECT, hasField("z", ANY)), "z"),
        is(ANY));
    assertThat(extractAllFieldNames(c), contains("a", "b"));

    final Constraint union =
        or(and(IS_OBJECT, hasField("kind", equalTo("a"))),
            and(IS_OBJECT, hasField("kind", equalTo("b")),
                hasField("size", IS_NUMBER)));
    assertThat(extractFieldConstraint(union, "kind"),
        hasToString("\"a\" | \"b\""));
    assertThat(extractFieldConstraint(union, "size"), is(IS_NUMBER));
    assertThat(extractAllFieldNames(union), contains("kind", "size"));
  }

  @Test void testExtractFieldRecursive() {
    assertThat(extractFieldConstraint(LIST, "head"), is(IS_NUMBER));
    // The tail of a list is a list
    final Constraint tail = extractFieldConstraint(LIST, "tail");
    assertThat(tail, notNullValue());
    assertThat(tail, is(LIST));
    assertThat(extractAllFieldNames(LIST), contains("head", "tail"));
  }

  @Test void testExtractElement() {
    final Constraint t = tuple(ImmutableList.of(IS_NUMBER, IS_STRING));
    assertThat(extractElementAt(t, 1), is(IS_STRING));
    assertThat(extractElementAt(t, 2), is(ANY));
    assertThat(extractElementAt(arrayOf(IS_NUMBER), 5), is(IS_NUMBER));
    assertThat(extractElementAt(IS_ARRAY, 0), is(ANY));
    assertThat(Constraints.extractLength(t), is(2));
    assertThat(Constraints.extractElements(arrayOf(IS_BOOL)), is(IS_BOOL));
    assertThat(Constraints.extractIndexSig(IS_OBJECT), nullValue());
  }

  @Test void testCopy() {
    final Constraint c = and(IS_NUMBER, gt(0));
    assertThat(c.copy(c2 -> c2), is(c));
    final Constraint c2 =
        elementAt(0, cvar(1)).copy(x -> x.op == Op.VAR ? IS_FUNCTION : x);
    assertThat(c2, is(elementAt(0, IS_FUNCTION)));
  }
}

// End ConstraintTest.java
