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

import static net.hydromatic.tempo.ast.AstBuilder.ast;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.core.Is.is;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import net.hydromatic.tempo.ast.Ast;
import org.junit.jupiter.api.Test;

/** Tests for {@link FreeFinder}. */
public class FreeFinderTest {
  private static final Ast.Id X = ast.id("x");
  private static final Ast.Id Y = ast.id("y");

  @Test void testFreeVars() {
    assertThat(FreeFinder.freeVars(ast.plus(X, ast.plus(Y, X))),
        contains("x", "y"));
    assertThat(FreeFinder.freeVars(ast.literal(1)), empty());
  }

  @Test void testLet() {
    // "x" in the value is free; "x" in the body is bound
    final Ast.Exp e = ast.let("x", ast.plus(X, Y), X);
    assertThat(FreeFinder.freeVars(e), contains("x", "y"));
    assertThat(FreeFinder.freeVars(ast.let("x", Y, X)), contains("y"));
  }

  @Test void testLetPattern() {
    final Ast.Exp e =
        ast.letPattern(
            ast.recordPat(ImmutableMap.of("a", ast.idPat("x"))), Y,
            ast.plus(X, ast.id("z")));
    assertThat(FreeFinder.freeVars(e), contains("y", "z"));
  }

  @Test void testFn() {
    final Ast.Fn fn =
        ast.recFn("f", ImmutableList.of("x"),
            ast.apply(ast.id("f"), ast.plus(X, Y)));
    assertThat(FreeFinder.freeVars(fn), contains("y"));
    assertThat(FreeFinder.usesVar(fn, "f"), is(false));
    assertThat(FreeFinder.usesVar(ast.apply(fn, ast.id("f")), "f"),
        is(true));
  }

  @Test void testImport() {
    final Ast.Exp e =
        ast.importExp(ImmutableList.of("pi"), "m",
            ast.plus(ast.id("pi"), X));
    assertThat(FreeFinder.freeVars(e), contains("x"));
  }
}

// End FreeFinderTest.java
