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
import static net.hydromatic.tempo.compile.StagerTest.later;
import static net.hydromatic.tempo.compile.StagerTest.now;
import static net.hydromatic.tempo.constraint.Constraints.ANY;
import static net.hydromatic.tempo.constraint.Constraints.IS_BOOL;
import static net.hydromatic.tempo.constraint.Constraints.IS_NULL;
import static net.hydromatic.tempo.constraint.Constraints.IS_NUMBER;
import static net.hydromatic.tempo.constraint.Constraints.IS_STRING;
import static net.hydromatic.tempo.constraint.Constraints.genericFnType;
import static net.hydromatic.tempo.constraint.Constraints.typeParam;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.concurrent.atomic.AtomicInteger;
import net.hydromatic.tempo.ast.Ast;
import net.hydromatic.tempo.constraint.Constraint;
import net.hydromatic.tempo.constraint.Constraints;
import net.hydromatic.tempo.constraint.Implication;
import net.hydromatic.tempo.eval.Prop;
import net.hydromatic.tempo.eval.SValue;
import net.hydromatic.tempo.eval.Session;
import net.hydromatic.tempo.eval.Value;
import net.hydromatic.tempo.eval.Values;
import org.junit.jupiter.api.Test;

/** Tests for {@link BuiltIn}, {@link Methods} and imports. */
public class BuiltInTest {
  private static Ast.Exp str(String s) {
    return ast.literal(s);
  }

  private static Ast.Exp num(double d) {
    return ast.literal(d);
  }

  private static Ast.Exp runtimeString(String name) {
    return ast.runtime(ast.literal("s"), name);
  }

  private static Ast.Fn double_() {
    return ast.fn(ImmutableList.of("x"), ast.times(ast.id("x"), num(2)));
  }

  @Test void testBuiltInFunction() {
    final SValue sv =
        Stager.stage(ast.apply(ast.id("startsWith"), str("hello"), str("he")));
    assertThat(now(sv), is(Values.TRUE));

    final SValue sv2 =
        Stager.stage(
            ast.apply(ast.id("endsWith"), runtimeString("s"), str("o")));
    assertThat(later(sv2), hasToString("endsWith(s, \"o\")"));
    assertThat(sv2.constraint, is(IS_BOOL));
  }

  @Test void testBuiltInAsMethod() {
    assertThat(
        now(Stager.stage(ast.methodCall(str("hello"), "startsWith",
            str("he")))),
        is(Values.TRUE));
    assertThat(
        now(Stager.stage(ast.methodCall(str("hello"), "contains",
            str("ll")))),
        is(Values.TRUE));

    // Residual code calls the built-in function, not the method
    final SValue sv =
        Stager.stage(ast.methodCall(runtimeString("s"), "startsWith",
            str("a")));
    assertThat(later(sv), hasToString("startsWith(s, \"a\")"));
  }

  @Test void testBuiltInArguments() {
    final StageException e =
        assertThrows(StageException.class, () ->
            Stager.stage(ast.apply(ast.id("startsWith"), str("hello"))));
    assertThat(e.getMessage(),
        is("startsWith() requires exactly 2 arguments, got 1"));

    final TypeException e2 =
        assertThrows(TypeException.class, () ->
            Stager.stage(ast.apply(ast.id("startsWith"), num(1), str("a"))));
    assertThat(e2.context, is("argument 1 of startsWith()"));

    final TypeException e3 =
        assertThrows(TypeException.class, () ->
            Stager.stage(ast.methodCall(num(1), "map", double_())));
    assertThat(e3.context, is("receiver of .map()"));
  }

  @Test void testLookup() {
    assertThat(BuiltIn.lookup("typeOf"), is(BuiltIn.TYPE_OF));
    assertThat(BuiltIn.lookup("TYPE_OF") == null, is(true));
    assertThat(BuiltIn.FILTER.isMethod, is(true));
    assertThat(BuiltIn.PRINT.isMethod, is(false));
    assertThat(BuiltIn.MAP.params.get(1), hasToString("fn: function"));
  }

  @Test void testTypeOfFunction() {
    final SValue sv =
        Stager.stage(ast.apply(ast.id("typeOf"), num(1)));
    assertThat(now(sv), hasToString("Type<1>"));
  }

  @Test void testStringMethods() {
    assertThat(
        now(Stager.stage(ast.methodCall(str("hello"), "toUpperCase"))),
        is(Values.string("HELLO")));
    assertThat(
        now(Stager.stage(
            ast.methodCall(str("hello"), "slice", num(1), ast.nullLiteral()))),
        is(Values.string("ello")));
    assertThat(
        now(Stager.stage(
            ast.methodCall(str("hello"), "slice", num(-3), num(-1)))),
        is(Values.string("ll")));
    assertThat(
        now(Stager.stage(ast.methodCall(str("a,b,,c"), "split", str(",")))),
        hasToString("[\"a\", \"b\", \"\", \"c\"]"));
    assertThat(
        now(Stager.stage(
            ast.methodCall(str("5"), "padStart", num(3), str("0")))),
        is(Values.string("005")));

    final SValue sv =
        Stager.stage(ast.methodCall(runtimeString("s"), "toUpperCase"));
    assertThat(later(sv), hasToString("s.toUpperCase()"));
    assertThat(sv.constraint, is(IS_STRING));
  }

  @Test void testNumberMethods() {
    assertThat(
        now(Stager.stage(ast.methodCall(num(2.5), "toFixed", num(0)))),
        is(Values.string("3")));
    assertThat(
        now(Stager.stage(ast.methodCall(num(10), "toString"))),
        is(Values.string("10")));
  }

  @Test void testArrayMethods() {
    final Ast.Exp a = ast.array(num(1), num(2), num(3));
    assertThat(now(Stager.stage(ast.methodCall(a, "reverse"))),
        hasToString("[3, 2, 1]"));
    assertThat(
        now(Stager.stage(
            ast.methodCall(a, "slice", num(1), ast.nullLiteral()))),
        hasToString("[2, 3]"));
    assertThat(
        now(Stager.stage(
            ast.methodCall(a, "concat", ast.array(str("x"))))),
        hasToString("[1, 2, 3, \"x\"]"));
    assertThat(
        now(Stager.stage(ast.methodCall(a, "indexOf", num(3)))),
        is(Values.number(2)));
    assertThat(
        now(Stager.stage(
            ast.methodCall(ast.array(num(1), ast.nullLiteral()), "join",
                str(",")))),
        is(Values.string("1,")));
  }

  @Test void testMethodErrors() {
    final StageException e =
        assertThrows(StageException.class, () ->
            Stager.stage(ast.methodCall(num(1), "foo")));
    assertThat(e.getMessage(), is("No method 'foo' on type 1"));

    final StageException e2 =
        assertThrows(StageException.class, () ->
            Stager.stage(ast.methodCall(str("abc"), "charAt")));
    assertThat(e2.getMessage(),
        is("Method 'charAt' expects 1 arguments, got 0"));

    final TypeException e3 =
        assertThrows(TypeException.class, () ->
            Stager.stage(ast.methodCall(str("abc"), "charAt", str("x"))));
    assertThat(e3.context, is("argument 1 of .charAt()"));
  }

  @Test void testMethodLookup() {
    assertThat(Methods.lookup(IS_STRING, "trim") != null, is(true));
    assertThat(Methods.lookup(IS_NUMBER, "trim") == null, is(true));
    // If the type is not known, all methods are candidates
    assertThat(Methods.lookup(ANY, "toFixed") != null, is(true));
    assertThat(Methods.methodNames(IS_NUMBER),
        contains("toFixed", "toPrecision", "toString"));
  }

  @Test void testMap() {
    final Ast.Exp a = ast.array(num(1), num(2), num(3));
    assertThat(now(Stager.stage(ast.methodCall(a, "map", double_()))),
        hasToString("[2, 4, 6]"));

    final Ast.Exp a2 = ast.array(ast.runtime(num(1), "r"));
    final SValue sv = Stager.stage(ast.methodCall(a2, "map", double_()));
    assertThat(later(sv), hasToString("[r].map(fn(x) => (x * 2))"));

    final StageException e =
        assertThrows(StageException.class, () ->
            Stager.stage(
                ast.methodCall(a, "map",
                    ast.fn(ImmutableList.of("x"),
                        ast.runtime(ast.id("x"), "r")))));
    assertThat(e.getMessage(),
        is("map callback returned Later value on Now input"));
  }

  @Test void testFilter() {
    final Ast.Exp a = ast.array(num(1), num(2), num(3), num(4));
    final Ast.Fn big =
        ast.fn(ImmutableList.of("x"), ast.lessThan(num(2), ast.id("x")));
    final SValue sv = Stager.stage(ast.methodCall(a, "filter", big));
    assertThat(now(sv), hasToString("[3, 4]"));

    final SValue sv2 =
        Stager.stage(
            ast.apply(ast.id("filter"),
                ast.array(ast.runtime(num(1), "r")), big));
    assertThat(later(sv2), hasToString("[r].filter(fn(x) => (2 < x))"));
  }

  @Test void testPrint() {
    final Stager stager = Stager.create();
    final SValue sv =
        stager.stage(ast.block(ast.apply(ast.id("print"), num(42)), num(3)),
            Stager.initialEnv());
    assertThat(now(sv), is(Values.number(3)));
    assertThat(stager.session().out, contains("42"));

    final SValue sv2 =
        stager.stage(ast.apply(ast.id("print"), ast.runtime(num(1), "r")),
            Stager.initialEnv());
    assertThat(later(sv2), hasToString("print(r)"));
    assertThat(sv2.constraint, is(IS_NULL));
  }

  @Test void testPrintAtRunTime() {
    final Stager stager = Stager.create();
    Prop.COMPTIME_PRINT.set(stager.session().map, false);
    final SValue sv =
        stager.stage(ast.apply(ast.id("print"), num(42)),
            Stager.initialEnv());
    assertThat(later(sv), hasToString("print(42)"));
    assertThat(stager.session().out, empty());
  }

  /** Returns a stager that can import module "m", which exports "pi", a
   * number, and "id", the identity function. */
  private static Stager importStager(AtomicInteger loadCount) {
    final Constraint.TypeParam t = typeParam("T", ANY, 0);
    final ModuleLoader loader =
        ModuleLoaders.of("m",
            ImmutableMap.of("pi", IS_NUMBER,
                "id",
                genericFnType(ImmutableList.of(t), ImmutableList.of(t), t)));
    return new Stager(new Session(), (modulePath, names) -> {
      loadCount.incrementAndGet();
      return loader.loadExportsWithSignatures(modulePath, names);
    });
  }

  @Test void testImport() {
    final AtomicInteger loadCount = new AtomicInteger();
    final Stager stager = importStager(loadCount);
    final Ast.Exp e =
        ast.importExp(ImmutableList.of("pi"), "m",
            ast.plus(ast.id("pi"), num(1)));
    final SValue sv = stager.stage(e, Stager.initialEnv());
    assertThat(later(sv), hasToString("import { pi } from \"m\" in (pi + 1)"));
    assertThat(sv.constraint, is(IS_NUMBER));

    // The second import of the same name uses the cache
    stager.stage(e, Stager.initialEnv());
    assertThat(loadCount.get(), is(1));

    // If the body does not use the import, there is no import in the
    // residual code
    final Ast.Exp e2 = ast.importExp(ImmutableList.of("pi"), "m", num(1));
    assertThat(now(stager.stage(e2, Stager.initialEnv())),
        is(Values.number(1)));
  }

  @Test void testImportMissing() {
    final AtomicInteger loadCount = new AtomicInteger();
    final Stager stager = importStager(loadCount);
    final Ast.Exp e = ast.importExp(ImmutableList.of("e"), "m", num(1));
    final StageException e1 =
        assertThrows(StageException.class, () ->
            stager.stage(e, Stager.initialEnv()));
    assertThat(e1.getMessage(), is("Module \"m\" has no export named \"e\""));

    // The loader is not asked again for a name it does not have
    assertThrows(StageException.class, () ->
        stager.stage(e, Stager.initialEnv()));
    assertThat(loadCount.get(), is(1));
  }

  @Test void testImportGeneric() {
    final Stager stager = importStager(new AtomicInteger());
    final SValue sv =
        stager.stage(
            ast.importExp(ImmutableList.of("id"), "m",
                ast.apply(ast.id("id"), num(5))),
            Stager.initialEnv());
    assertThat(later(sv), hasToString("import { id } from \"m\" in id(5)"));
    assertThat(sv.constraint, hasToString("5"));

    // "id" is a closure, and each call instantiates "<T>(T) => T"
    final Ast.Exp e =
        ast.importExp(ImmutableList.of("id"), "m",
            ast.array(ast.apply(ast.id("id"), ast.runtime(num(7), "x")),
                ast.apply(ast.id("id"), ast.literal("a"))));
    final SValue sv2 = stager.stage(e, Stager.initialEnv());
    assertThat(later(sv2),
        hasToString("import { id } from \"m\" in [id(x), id(\"a\")]"));
    assertThat(
        Implication.implies(sv2.constraint,
            Constraints.tuple(ImmutableList.of(IS_NUMBER, IS_STRING))),
        is(true));
    final SValue id =
        stager.stage(ast.importExp(ImmutableList.of("id"), "m", ast.id("id")),
            Stager.initialEnv());
    assertThat(id.isNow(), is(true));
    assertThat(((SValue.Now) id).value, instanceOf(Value.Closure.class));
  }
}

// End BuiltInTest.java
