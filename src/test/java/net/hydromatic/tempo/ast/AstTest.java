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
package net.hydromatic.tempo.ast;

import static net.hydromatic.tempo.ast.AstBuilder.ast;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.junit.jupiter.api.Test;

/** Tests for {@link Ast} and {@link AstBuilder}. */
public class AstTest {
  private static final Ast.Id X = ast.id("x");

  @Test void testLiteral() {
    assertThat(ast.literal(1), hasToString("1"));
    assertThat(ast.literal(1.5), hasToString("1.5"));
    assertThat(ast.literal("a\"b"), hasToString("\"a\\\"b\""));
    assertThat(ast.literal(false), hasToString("false"));
    assertThat(ast.nullLiteral(), hasToString("null"));
    // Integers are stored as doubles
    assertThat(ast.literal(1).value, is(1d));
    assertThrows(IllegalArgumentException.class, () ->
        ast.literal(new Object()));
  }

  @Test void testOperators() {
    assertThat(ast.plus(X, ast.times(X, ast.literal(2))),
        hasToString("(x + (x * 2))"));
    assertThat(ast.binary("!=", X, ast.nullLiteral()),
        hasToString("(x != null)"));
    assertThat(ast.binary(">=", X, ast.literal(0)).op, is(Op.GE));
    assertThat(ast.not(ast.andAlso(X, ast.id("y"))),
        hasToString("!(x && y)"));
    assertThat(ast.negate(X), hasToString("-x"));
    assertThrows(NullPointerException.class, () ->
        ast.binary("===", X, X));
  }

  @Test void testControl() {
    assertThat(
        ast.ifThenElse(ast.lessThan(X, ast.literal(0)), ast.negate(X), X),
        hasToString("if (x < 0) then -x else x"));
    assertThat(ast.let("x", ast.literal(1), ast.plus(X, X)),
        hasToString("let x = 1 in (x + x)"));
    assertThat(ast.block(X, ast.literal(1)), hasToString("{ x; 1 }"));
    assertThat(ast.comptime(X), hasToString("comptime(x)"));
    assertThat(ast.runtime(X, "r"), hasToString("runtime(r: x)"));
    assertThat(ast.runtime(X, null), hasToString("runtime(x)"));
  }

  @Test void testPatterns() {
    final Ast.Pat pat =
        ast.recordPat(
            ImmutableMap.of("a", ast.idPat("a"),
                "b", ast.arrayPat(ast.idPat("c"), ast.idPat("d"))));
    assertThat(pat, hasToString("{ a, b: [c, d] }"));
    assertThat(pat.vars(), contains("a", "c", "d"));
    assertThat(ast.letPattern(pat, X, ast.id("c")),
        hasToString("let { a, b: [c, d] } = x in c"));
  }

  @Test void testFn() {
    final Ast.Fn fn =
        ast.fn(ImmutableList.of("a", "b"), ast.plus(ast.id("a"), ast.id("b")));
    assertThat(fn, hasToString("fn(a, b) => (a + b)"));
    assertThat(fn.isDesugared(), is(true));
    assertThat(fn.body, hasToString("let [a, b] = args in (a + b)"));
    assertThat(fn.innerBody(), hasToString("(a + b)"));

    final Ast.Fn residual =
        ast.residualRecFn("f", ImmutableList.of("n"), ast.id("n"));
    assertThat(residual, hasToString("fn f(n) => n"));
    assertThat(residual.isDesugared(), is(false));
    assertThat(residual.op, is(Op.REC_FN));
  }

  @Test void testCalls() {
    assertThat(ast.apply(ast.id("f"), X, ast.literal(1)),
        hasToString("f(x, 1)"));
    assertThat(ast.methodCall(X, "trim"), hasToString("x.trim()"));
    assertThat(ast.field(ast.index(X, ast.literal(0)), "a"),
        hasToString("x[0].a"));
    assertThat(ast.record(ImmutableMap.of()), hasToString("{}"));
    assertThat(ast.record(ImmutableMap.of("a", ast.literal(1), "b", X)),
        hasToString("{ a: 1, b: x }"));
    assertThat(ast.array(), hasToString("[]"));
  }

  @Test void testDirectives() {
    assertThat(ast.assertType(X, ast.id("number"), null),
        hasToString("assert(x, number)"));
    assertThat(ast.assertType(X, ast.id("number"), "oops"),
        hasToString("assert(x, number, \"oops\")"));
    assertThat(ast.assertCond(ast.id("ok"), null), hasToString("assert(ok)"));
    assertThat(ast.trust(X, ast.id("string")),
        hasToString("trust(x, string)"));
    assertThat(ast.trust(X, null), hasToString("trust(x)"));
    assertThat(ast.typeOf(X), hasToString("typeOf(x)"));
    assertThat(
        ast.importExp(ImmutableList.of("a", "b"), "./m", ast.id("a")),
        hasToString("import { a, b } from \"./m\" in a"));
  }

  @Test void testEquals() {
    assertThat(ast.id("x"), is(X));
    assertThat(ast.literal(1), is(ast.literal(1d)));
    assertThat(ast.idPat("x"), is(ast.idPat("x")));
  }
}

// End AstTest.java
