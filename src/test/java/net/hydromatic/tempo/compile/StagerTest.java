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
import static net.hydromatic.tempo.constraint.Constraints.ANY;
import static net.hydromatic.tempo.constraint.Constraints.IS_BOOL;
import static net.hydromatic.tempo.constraint.Constraints.IS_NULL;
import static net.hydromatic.tempo.constraint.Constraints.IS_NUMBER;
import static net.hydromatic.tempo.constraint.Constraints.IS_OBJECT;
import static net.hydromatic.tempo.constraint.Constraints.IS_STRING;
import static net.hydromatic.tempo.constraint.Constraints.and;
import static net.hydromatic.tempo.constraint.Constraints.hasField;
import static net.hydromatic.tempo.constraint.Constraints.isType;
import static net.hydromatic.tempo.constraint.Constraints.literal;
import static net.hydromatic.tempo.constraint.Constraints.object;
import static net.hydromatic.tempo.constraint.Constraints.or;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import net.hydromatic.tempo.ast.Ast;
import net.hydromatic.tempo.constraint.Constraint;
import net.hydromatic.tempo.constraint.Implication;
import net.hydromatic.tempo.eval.SValue;
import net.hydromatic.tempo.eval.Value;
import net.hydromatic.tempo.eval.Values;
import org.junit.jupiter.api.Test;

/** Tests for {@link Stager}. */
public class StagerTest {
  /** Returns {@code fact(n) = if n == 0 then 1 else n * fact(n - 1)}. */
  static Ast.Fn fact() {
    final Ast.Id n = ast.id("n");
    return ast.recFn("fact", ImmutableList.of("n"),
        ast.ifThenElse(ast.equal(n, ast.literal(0)),
            ast.literal(1),
            ast.times(n,
                ast.apply(ast.id("fact"), ast.minus(n, ast.literal(1))))));
  }

  /** Returns the value of a staged value, which must be known. */
  static Value now(SValue sv) {
    assertThat(sv, instanceOf(SValue.Now.class));
    final Value value = ((SValue.Now) sv).value;
    // A known value always satisfies its constraint
    assertThat(Values.satisfies(value, sv.constraint), is(true));
    return value;
  }

  /** Returns the residual of a staged value, which must not be known. */
  static Ast.Exp later(SValue sv) {
    assertThat(sv, instanceOf(SValue.Later.class));
    return ((SValue.Later) sv).residual;
  }

  static boolean implies(SValue sv, Constraint c) {
    return Implication.implies(sv.constraint, c);
  }

  /** Returns an environment in which "y" is a value not known until run
   * time, with the given constraint. */
  static SEnv envWithY(Constraint c) {
    return Stager.initialEnv().bind("y", SValue.later(c, ast.id("y")));
  }

  static SValue stageWithY(Constraint c, Ast.Exp exp) {
    return Stager.create().stage(exp, envWithY(c));
  }

  @Test void testLiteral() {
    for (Object o : Arrays.asList(1d, -2.5d, "a", "", true, false, null)) {
      final SValue sv = Stager.stage(ast.literal(o));
      assertThat(sv.isNow(), is(true));
      assertThat(sv.constraint,
          is(Values.constraintOf(Values.fromLiteral(o))));
    }
    assertThat(Stager.stage(ast.literal(1)).constraint, is(literal(1d)));
  }

  @Test void testLet() {
    final Ast.Exp e =
        ast.let("x", ast.literal(5), ast.plus(ast.id("x"), ast.literal(1)));
    assertThat(now(Stager.stage(e)), is(Values.number(6)));
  }

  @Test void testRuntime() {
    final Ast.Exp e =
        ast.plus(ast.runtime(ast.literal(5), "x"), ast.literal(3));
    final SValue sv = Stager.stage(e);
    assertThat(later(sv), hasToString("(x + 3)"));
    assertThat(sv.constraint, is(IS_NUMBER));
  }

  @Test void testRuntimeFreshName() {
    final Ast.Exp e =
        ast.plus(ast.runtime(ast.literal(1), null),
            ast.runtime(ast.literal(2), null));
    assertThat(Stager.stageToExpr(e), hasToString("(rt0 + rt1)"));
  }

  /** Two compilations in fresh sessions generate the same names. */
  @Test void testReproducible() {
    final Ast.Exp e =
        ast.let("f", ast.fn(ImmutableList.of("a"), ast.id("a")),
            ast.array(
                ast.apply(ast.id("f"), ast.runtime(ast.literal(1), null)),
                ast.runtime(ast.literal("s"), null)));
    final String s0 = Stager.stageToExpr(e).toString();
    final String s1 = Stager.stageToExpr(e).toString();
    assertThat(s0, is(s1));
    assertThat(s0, is("let f = fn(a) => a in [f(rt0), rt2]"));
  }

  @Test void testIf() {
    final Ast.Exp e =
        ast.ifThenElse(ast.literal(true), ast.literal(42), ast.id("unused"));
    assertThat(now(Stager.stage(e)), is(Values.number(42)));

    final Ast.Exp e2 =
        ast.ifThenElse(ast.runtime(ast.literal(true), "c"),
            ast.literal(1), ast.literal("one"));
    final SValue sv = Stager.stage(e2);
    assertThat(later(sv), hasToString("if c then 1 else \"one\""));
    assertThat(implies(sv, or(IS_NUMBER, IS_STRING)), is(true));
    assertThat(implies(sv, IS_NUMBER), is(false));
  }

  @Test void testIfConditionMustBeBoolean() {
    final TypeException e =
        assertThrows(TypeException.class, () ->
            Stager.stage(
                ast.ifThenElse(ast.literal(1), ast.literal(2),
                    ast.literal(3))));
    assertThat(e.getMessage(),
        is("Type error in if condition: expected boolean, got 1"));
  }

  /** In the "else" branch of {@code if y == null}, "y" is not null. */
  @Test void testRefinement() {
    final Constraint numberOrNull = or(IS_NUMBER, IS_NULL);
    final Ast.Id y = ast.id("y");
    final SValue sv =
        stageWithY(numberOrNull,
            ast.ifThenElse(ast.equal(y, ast.nullLiteral()),
                ast.literal(0),
                ast.plus(y, ast.literal(1))));
    assertThat(later(sv), hasToString("if (y == null) then 0 else (y + 1)"));
    assertThat(implies(sv, IS_NUMBER), is(true));

    // Without the refinement, "y + 1" is a type error
    final TypeException e =
        assertThrows(TypeException.class, () ->
            stageWithY(numberOrNull, ast.plus(y, ast.literal(1))));
    assertThat(e.context, is("left of +"));
  }

  @Test void testLogicalOperators() {
    assertThat(
        now(Stager.stage(ast.andAlso(ast.literal(true), ast.literal(false)))),
        is(Values.FALSE));
    assertThat(
        now(Stager.stage(ast.orElse(ast.literal(false), ast.literal(true)))),
        is(Values.TRUE));

    // Both operands are checked, even when the left decides the result
    final TypeException e =
        assertThrows(TypeException.class, () ->
            Stager.stage(ast.andAlso(ast.literal(false), ast.literal(5))));
    assertThat(e.context, is("right of &&"));
    assertThrows(UnboundException.class, () ->
        Stager.stage(ast.orElse(ast.literal(true), ast.id("unbound"))));

    final Ast.Exp e3 =
        ast.andAlso(ast.runtime(ast.literal(true), "b"), ast.literal(false));
    final SValue sv = Stager.stage(e3);
    assertThat(later(sv), hasToString("(b && false)"));
    assertThat(sv.constraint, is(literal(false)));
  }

  @Test void testOperators() {
    assertThat(now(Stager.stage(ast.negate(ast.literal(3)))),
        is(Values.number(-3)));
    assertThat(now(Stager.stage(ast.not(ast.literal(true)))),
        is(Values.FALSE));
    assertThat(
        now(Stager.stage(ast.plus(ast.literal("a"), ast.literal("b")))),
        is(Values.string("ab")));
    assertThat(
        now(Stager.stage(ast.binary("%", ast.literal(7), ast.literal(4)))),
        is(Values.number(3)));
    assertThat(
        now(Stager.stage(
            ast.equal(ast.literal("x"), ast.literal("x")))),
        is(Values.TRUE));

    final SValue sv =
        Stager.stage(ast.not(ast.runtime(ast.literal(true), "b")));
    assertThat(later(sv), hasToString("!b"));
    assertThat(sv.constraint, is(IS_BOOL));
  }

  @Test void testOperatorTypeError() {
    final TypeException e =
        assertThrows(TypeException.class, () ->
            Stager.stage(ast.plus(ast.literal(1), ast.literal(true))));
    assertThat(e.getMessage(),
        is("Type error in right of +: expected number, got true"));
    assertThat(e.expected, is(IS_NUMBER));

    final TypeException e2 =
        assertThrows(TypeException.class, () ->
            Stager.stage(ast.plus(ast.literal("a"), ast.literal(1))));
    assertThat(e2.getMessage(),
        is("Type error in right of string +: expected string, got 1"));

    // Operands are checked even if their values are not known
    final TypeException e3 =
        assertThrows(TypeException.class, () ->
            Stager.stage(
                ast.times(ast.runtime(ast.literal("s"), "s"),
                    ast.literal(2))));
    assertThat(e3.context, is("left of *"));
  }

  /** If both operands' constraints pin a literal, so does the result. */
  @Test void testPinnedResult() {
    final Ast.Id y = ast.id("y");
    final SValue sv =
        stageWithY(literal(2d), ast.times(y, ast.literal(3)));
    assertThat(later(sv), hasToString("(y * 3)"));
    assertThat(sv.constraint, is(literal(6d)));

    final SValue sv2 =
        stageWithY(literal(2d), ast.binary("/", y, ast.literal(0)));
    assertThat(sv2.constraint, is(IS_NUMBER));
  }

  @Test void testUnbound() {
    final UnboundException e =
        assertThrows(UnboundException.class, () ->
            Stager.stage(ast.id("nope")));
    assertThat(e.getMessage(), is("Unbound variable: nope"));
    assertThat(e.name, is("nope"));
  }

  @Test void testFactNow() {
    final Ast.Exp e =
        ast.let("fact", fact(),
            ast.apply(ast.id("fact"), ast.literal(5)));
    assertThat(now(Stager.stage(e)), is(Values.number(120)));
  }

  /** A recursive function called with an argument that is not known
   * terminates, and leaves a recursive call in residual code. */
  @Test void testFactLater() {
    final Stager stager = Stager.create();
    final List<String> cuts = new ArrayList<>();
    stager.session().tracer =
        Tracers.withOnRecursionCut(Tracers.empty(), cuts::add);
    final Ast.Exp e =
        ast.let("fact", fact(),
            ast.apply(ast.id("fact"), ast.runtime(ast.literal(5), "x")));
    final SValue sv = stager.stage(e, Stager.initialEnv());
    assertThat(later(sv),
        hasToString("let fact = fn fact(n) => "
            + "if (n == 0) then 1 else (n * fact((n - 1))) in fact(x)"));
    assertThat(implies(sv, IS_NUMBER), is(true));
    assertThat(cuts, contains("fact"));
    assertThat(stager.session().isInProgress("fact"), is(false));
  }

  /** The marker that a function is being staged is removed even if
   * staging fails. */
  @Test void testRecursionMarkerRemovedOnError() {
    final Stager stager = Stager.create();
    final Ast.Exp e =
        ast.let("f",
            ast.recFn("f", ImmutableList.of("n"),
                ast.comptime(ast.id("n"))),
            ast.apply(ast.id("f"), ast.runtime(ast.literal(1), "r")));
    assertThrows(ComptimeException.class, () ->
        stager.stage(e, Stager.initialEnv()));
    assertThat(stager.session().isInProgress("f"), is(false));
  }

  @Test void testClosure() {
    final Ast.Fn inc =
        ast.fn(ImmutableList.of("x"), ast.plus(ast.id("x"), ast.literal(1)));
    assertThat(now(Stager.stage(ast.apply(inc, ast.literal(1)))),
        is(Values.number(2)));

    // Called with a value not known until run time, the body is inlined
    final Ast.Exp e = ast.apply(inc, ast.runtime(ast.literal(1), "r"));
    assertThat(Stager.stageToExpr(e),
        hasToString("let [x] = [r] in (x + 1)"));

    // A function bound to a name is called by that name
    final Ast.Exp e2 =
        ast.let("f", inc,
            ast.apply(ast.id("f"), ast.runtime(ast.literal(1), "r")));
    final SValue sv = Stager.stage(e2);
    assertThat(later(sv),
        hasToString("let f = fn(x) => (x + 1) in f(r)"));
    assertThat(sv.constraint, is(IS_NUMBER));
  }

  @Test void testClosureCapturesEnvironment() {
    // let a = 10 in let f = fn(x) => x + a in let a = 20 in f(1)
    final Ast.Exp e =
        ast.let("a", ast.literal(10),
            ast.let("f",
                ast.fn(ImmutableList.of("x"),
                    ast.plus(ast.id("x"), ast.id("a"))),
                ast.let("a", ast.literal(20),
                    ast.apply(ast.id("f"), ast.literal(1)))));
    assertThat(now(Stager.stage(e)), is(Values.number(11)));
  }

  @Test void testCallUnknownFunction() {
    final SValue sv =
        stageWithY(ANY,
            ast.apply(ast.id("y"), ast.runtime(ast.literal(1), "a")));
    assertThat(later(sv), hasToString("y(a)"));
  }

  @Test void testLetDropsUnusedBinding() {
    final Ast.Exp e =
        ast.let("unused", ast.runtime(ast.literal(1), "r"),
            ast.runtime(ast.literal(2), "s"));
    assertThat(Stager.stageToExpr(e), hasToString("s"));

    // A body that is known does not need the binding, even if the
    // binding's value is not known
    final Ast.Exp e2 =
        ast.let("x", ast.runtime(ast.literal(1), "r"),
            ast.typeOf(ast.id("x")));
    assertThat(now(Stager.stage(e2)), is(Values.type(IS_NUMBER)));
  }

  @Test void testLetNamesComplexValue() {
    final Ast.Exp e =
        ast.let("x",
            ast.plus(ast.runtime(ast.literal(1), "r"), ast.literal(1)),
            ast.times(ast.id("x"), ast.id("x")));
    assertThat(Stager.stageToExpr(e),
        hasToString("let x = (r + 1) in (x * x)"));
  }

  @Test void testLetPattern() {
    final Ast.Exp e =
        ast.letPattern(ast.arrayPat(ast.idPat("a"), ast.idPat("b")),
            ast.array(ast.literal(1), ast.literal(2)),
            ast.plus(ast.id("a"), ast.id("b")));
    assertThat(now(Stager.stage(e)), is(Values.number(3)));

    final Constraint c =
        and(IS_OBJECT, hasField("a", IS_NUMBER), hasField("b", IS_STRING));
    final SValue sv =
        stageWithY(c,
            ast.letPattern(
                ast.recordPat(ImmutableMap.of("a", ast.idPat("a"))),
                ast.id("y"),
                ast.plus(ast.id("a"), ast.literal(1))));
    assertThat(later(sv), hasToString("let { a } = y in (a + 1)"));
    assertThat(sv.constraint, is(IS_NUMBER));
  }

  /** Indexing a known array whose elements differ, at an index not known
   * until run time, gives the union of the element types. */
  @Test void testIndexMixedArray() {
    final Ast.Exp e =
        ast.letPattern(ast.arrayPat(ast.idPat("xs")),
            ast.array(ast.array(ast.literal(1), ast.literal("a"))),
            ast.typeOf(
                ast.index(ast.id("xs"), ast.runtime(ast.literal(1), "i"))));
    final Value type = now(Stager.stage(e));
    final Constraint c = ((Value.TypeValue) type).constraint;
    assertThat(Implication.implies(c, or(IS_NUMBER, IS_STRING)), is(true));
    assertThat(Implication.implies(c, IS_NUMBER), is(false));
    assertThat(Implication.implies(c, IS_STRING), is(false));
  }

  @Test void testRecord() {
    final Ast.Exp e =
        ast.record(
            ImmutableMap.of("a", ast.literal(1),
                "b", ast.runtime(ast.literal(2), "y")));
    final SValue sv = Stager.stage(e);
    assertThat(later(sv), hasToString("{ a: 1, b: y }"));
    assertThat(sv.constraint,
        is(object(ImmutableMap.of("a", literal(1d), "b", IS_NUMBER))));

    final SValue sv2 =
        Stager.stage(ast.record(ImmutableMap.of("a", ast.literal(1))));
    assertThat(now(sv2), hasToString("{ a: 1 }"));
  }

  @Test void testField() {
    final Ast.Exp r = ast.record(ImmutableMap.of("a", ast.literal(1)));
    assertThat(now(Stager.stage(ast.field(r, "a"))), is(Values.number(1)));

    final StageException e =
        assertThrows(StageException.class, () ->
            Stager.stage(ast.field(r, "b")));
    assertThat(e.getMessage(), is("Object has no field 'b'"));

    final TypeException e2 =
        assertThrows(TypeException.class, () ->
            Stager.stage(ast.field(ast.literal(1), "a")));
    assertThat(e2.context, is("field access .a"));

    // A closed object has no other fields
    final Ast.Exp r2 =
        ast.record(
            ImmutableMap.of("a", ast.runtime(ast.literal(1), "r")));
    final TypeException e3 =
        assertThrows(TypeException.class, () ->
            Stager.stage(ast.field(r2, "b")));
    assertThat(e3.context, is("field access .b"));

    // An open object may have other fields
    final Constraint open = and(IS_OBJECT, hasField("a", IS_NUMBER));
    final SValue sv = stageWithY(open, ast.field(ast.id("y"), "a"));
    assertThat(later(sv), hasToString("y.a"));
    assertThat(sv.constraint, is(IS_NUMBER));
    final SValue sv2 = stageWithY(open, ast.field(ast.id("y"), "c"));
    assertThat(later(sv2), hasToString("y.c"));
    assertThat(sv2.constraint, is(ANY));
  }

  @Test void testArray() {
    final Ast.Exp a = ast.array(ast.literal(1), ast.literal(2));
    assertThat(now(Stager.stage(a)), hasToString("[1, 2]"));
    assertThat(now(Stager.stage(ast.index(a, ast.literal(1)))),
        is(Values.number(2)));

    final StageException e =
        assertThrows(StageException.class, () ->
            Stager.stage(ast.index(a, ast.literal(2))));
    assertThat(e.getMessage(), is("Array index out of bounds: 2 >= 2"));
    final StageException e2 =
        assertThrows(StageException.class, () ->
            Stager.stage(ast.index(a, ast.literal(1.5))));
    assertThat(e2.getMessage(), is("Invalid array index: 1.5"));
    assertThrows(TypeException.class, () ->
        Stager.stage(ast.index(ast.literal("s"), ast.literal(0))));

    // An array with an element not known until run time
    final Ast.Exp a2 =
        ast.array(ast.literal(1), ast.runtime(ast.literal(2), "r"));
    final SValue sv = Stager.stage(a2);
    assertThat(sv, instanceOf(SValue.LaterArray.class));
    assertThat(Stager.stageToExpr(a2), hasToString("[1, r]"));
    assertThat(now(Stager.stage(ast.index(a2, ast.literal(0)))),
        is(Values.number(1)));
    final SValue sv2 = Stager.stage(ast.index(a2, ast.literal(1)));
    assertThat(later(sv2), hasToString("r"));
    assertThat(sv2.constraint, is(IS_NUMBER));
  }

  @Test void testBlock() {
    final Ast.Exp e =
        ast.block(ast.literal(1), ast.literal("two"));
    assertThat(now(Stager.stage(e)), is(Values.string("two")));
    assertThat(now(Stager.stage(ast.block())), is(Values.NULL));
  }

  @Test void testComptime() {
    final Ast.Exp e =
        ast.comptime(ast.plus(ast.literal(1), ast.literal(2)));
    assertThat(now(Stager.stage(e)), is(Values.number(3)));

    final ComptimeException e2 =
        assertThrows(ComptimeException.class, () ->
            Stager.stage(ast.comptime(ast.runtime(ast.literal(1), "r"))));
    assertThat(e2.getMessage(),
        is("comptime expression evaluated to runtime value: r"));
  }

  @Test void testRun() {
    assertThat(Stager.run(ast.plus(ast.literal(1), ast.literal(2))),
        is(Values.number(3)));
    final StageException e =
        assertThrows(StageException.class, () ->
            Stager.run(ast.runtime(ast.literal(1), "r")));
    assertThat(e.getMessage(),
        is("Expression has runtime dependencies - "
            + "use stage() for partial evaluation"));
  }

  @Test void testAssert() {
    final SValue sv =
        Stager.stage(
            ast.assertType(ast.literal(10), ast.id("number"), null));
    assertThat(now(sv), is(Values.number(10)));
    assertThat(sv.constraint, is(literal(10d)));

    final AssertException e =
        assertThrows(AssertException.class, () ->
            Stager.stage(
                ast.assertType(ast.literal(10), ast.id("string"), null)));
    assertThat(e.getMessage(),
        is("Assertion failed: value 10 does not satisfy string"));
    assertThat(e.value, is(Values.number(10)));
    assertThat(e.constraint, is(IS_STRING));

    final AssertException e2 =
        assertThrows(AssertException.class, () ->
            Stager.stage(
                ast.assertType(ast.literal(10), ast.id("string"),
                    "want a string")));
    assertThat(e2.getMessage(), is("want a string"));

    // A value not known until run time is checked at run time
    final SValue sv2 =
        stageWithY(ANY, ast.assertType(ast.id("y"), ast.id("string"), "s"));
    assertThat(later(sv2), hasToString("assert(y, string, \"s\")"));
    assertThat(sv2.constraint, is(IS_STRING));

    assertThrows(TypeException.class, () ->
        Stager.stage(
            ast.assertType(ast.literal(1), ast.literal(2), null)));
  }

  /** The result of "0 / 0" is NaN, and NaN satisfies its own type. */
  @Test void testAssertNaN() {
    final Ast.Exp e =
        ast.let("x", ast.binary("/", ast.literal(0), ast.literal(0)),
            ast.assertType(ast.id("x"), ast.typeOf(ast.id("x")), null));
    final SValue sv = Stager.stage(e);
    assertThat(Double.isNaN(((Value.Num) now(sv)).value), is(true));
    assertThat(sv.constraint, is(IS_NUMBER));
  }

  @Test void testAssertCond() {
    assertThat(
        now(Stager.stage(
            ast.assertCond(ast.lessThan(ast.literal(1), ast.literal(2)),
                null))),
        is(Values.TRUE));
    final AssertException e =
        assertThrows(AssertException.class, () ->
            Stager.stage(ast.assertCond(ast.literal(false), null)));
    assertThat(e.getMessage(), is("Assertion failed: condition is false"));

    final SValue sv =
        Stager.stage(
            ast.assertCond(ast.runtime(ast.literal(true), "ok"), "bad"));
    assertThat(later(sv), hasToString("assert(ok, \"bad\")"));
    assertThat(sv.constraint, is(IS_BOOL));
  }

  @Test void testTrust() {
    final SValue sv = stageWithY(ANY, ast.trust(ast.id("y"), ast.id("number")));
    assertThat(later(sv), hasToString("y"));
    assertThat(sv.constraint, is(IS_NUMBER));

    final SValue sv2 = stageWithY(ANY, ast.trust(ast.id("y"), null));
    assertThat(sv2.constraint, is(ANY));

    // An array of types is a tuple type
    final SValue sv3 =
        stageWithY(ANY,
            ast.index(
                ast.trust(ast.id("y"),
                    ast.array(ast.id("number"), ast.id("string"))),
                ast.literal(1)));
    assertThat(later(sv3), hasToString("y[1]"));
    assertThat(sv3.constraint, is(IS_STRING));
  }

  @Test void testTypeOf() {
    final SValue sv =
        Stager.stage(ast.typeOf(ast.runtime(ast.literal(5), "x")));
    assertThat(now(sv), hasToString("Type<number>"));
    assertThat(sv.constraint, is(isType(IS_NUMBER)));

    final UnsupportedConstructException e =
        assertThrows(UnsupportedConstructException.class, () ->
            Stager.stageToExpr(ast.typeOf(ast.literal(1))));
    assertThat(e.getMessage(),
        is("Cannot convert type value to expression: Type<1>"));
  }

  @Test void testClosureToResidual() {
    final Stager stager = Stager.create();
    final List<String> staged = new ArrayList<>();
    stager.session().tracer =
        Tracers.withOnClosureStaged(Tracers.empty(), staged::add);
    final Value inc =
        stager.run(
            ast.fn(ImmutableList.of("x"),
                ast.plus(ast.id("x"), ast.literal(1))),
            Stager.initialEnv());
    assertThat(stager.closureToResidual(inc),
        hasToString("fn(x) => (x + 1)"));

    final Value f = stager.run(fact(), Stager.initialEnv());
    assertThat(stager.closureToResidual(f),
        hasToString("fn fact(n) => "
            + "if (n == 0) then 1 else (n * fact((n - 1)))"));
    assertThat(staged, contains("fn", "fact"));

    assertThrows(StageException.class, () ->
        stager.closureToResidual(Values.number(1)));
  }

  @Test void testTracer() {
    final Stager stager = Stager.create();
    final List<SValue> results = new ArrayList<>();
    final List<StageException> exceptions = new ArrayList<>();
    stager.session().tracer =
        Tracers.withOnException(
            Tracers.withOnResult(Tracers.logging(), results::add),
            exceptions::add);
    stager.stage(ast.plus(ast.literal(1), ast.literal(2)),
        Stager.initialEnv());
    // Nested expressions do not fire events
    assertThat(results.size(), is(1));
    assertThat(results.get(0), hasToString("Now(3, 3)"));

    assertThrows(UnboundException.class, () ->
        stager.stage(ast.id("x"), Stager.initialEnv()));
    assertThat(exceptions.size(), is(1));
    assertThat(exceptions.get(0), instanceOf(UnboundException.class));
  }

  @Test void testBackend() {
    final Backend<String> backend = new Backend<String>() {
      @Override public String name() {
        return "test";
      }

      @Override public String generate(SValue sv,
          BackendContext<String> cx) {
        return sv.isNow()
            ? "const " + ((SValue.Now) sv).value
            : "code " + cx.svalueToResidual(sv);
      }
    };
    final BackendContext<String> cx =
        Stager.create().backendContext(backend);
    assertThat(cx.generateExpr(ast.plus(ast.literal(1), ast.literal(2))),
        is("const 3"));
    assertThat(
        cx.generateExpr(
            ast.plus(ast.runtime(ast.literal(1), "a"), ast.literal(2))),
        is("code (a + 2)"));
    assertThat(cx.env().has("print"), is(true));
    assertThat(cx.env().has("number"), is(true));
  }
}

// End StagerTest.java
