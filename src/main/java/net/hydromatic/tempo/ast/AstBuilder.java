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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;
import static net.hydromatic.tempo.util.Static.transformEager;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Builds parse tree nodes. */
public enum AstBuilder {
  /**
   * The singleton instance of the AST builder. The short name is convenient
   * for use via 'import static', but checkstyle does not approve.
   */
  // CHECKSTYLE: IGNORE 1
  ast;

  /** Name of the array through which a function receives its arguments. */
  public static final String ARGS = "args";

  /** Creates a literal. The value must be a number, string, boolean or
   * null; numbers are stored as {@link Double}. */
  public Ast.Literal literal(@Nullable Object value) {
    if (value instanceof Number && !(value instanceof Double)) {
      value = ((Number) value).doubleValue();
    }
    checkArgument(value == null
        || value instanceof Double
        || value instanceof String
        || value instanceof Boolean, "not a literal: %s", value);
    return new Ast.Literal(value);
  }

  public Ast.Literal nullLiteral() {
    return new Ast.Literal(null);
  }

  public Ast.Id id(String name) {
    return new Ast.Id(name);
  }

  /** Creates a call to a binary operator. */
  public Ast.InfixCall infixCall(Op op, Ast.Exp a0, Ast.Exp a1) {
    checkArgument(op.isBinary(), "not a binary operator: %s", op);
    return new Ast.InfixCall(op, a0, a1);
  }

  /** Creates a call to a binary operator, given its symbol, such as
   * "+" or "&&". */
  public Ast.InfixCall binary(String symbol, Ast.Exp a0, Ast.Exp a1) {
    final Op op =
        requireNonNull(Op.BY_SYMBOL.get(symbol),
            () -> "unknown operator " + symbol);
    return infixCall(op, a0, a1);
  }

  public Ast.InfixCall plus(Ast.Exp a0, Ast.Exp a1) {
    return infixCall(Op.PLUS, a0, a1);
  }

  public Ast.InfixCall minus(Ast.Exp a0, Ast.Exp a1) {
    return infixCall(Op.MINUS, a0, a1);
  }

  public Ast.InfixCall times(Ast.Exp a0, Ast.Exp a1) {
    return infixCall(Op.TIMES, a0, a1);
  }

  public Ast.InfixCall equal(Ast.Exp a0, Ast.Exp a1) {
    return infixCall(Op.EQ, a0, a1);
  }

  public Ast.InfixCall lessThan(Ast.Exp a0, Ast.Exp a1) {
    return infixCall(Op.LT, a0, a1);
  }

  public Ast.InfixCall andAlso(Ast.Exp a0, Ast.Exp a1) {
    return infixCall(Op.ANDALSO, a0, a1);
  }

  public Ast.InfixCall orElse(Ast.Exp a0, Ast.Exp a1) {
    return infixCall(Op.ORELSE, a0, a1);
  }

  /** Creates a call to a unary operator. */
  public Ast.PrefixCall prefixCall(Op op, Ast.Exp a) {
    checkArgument(op.isUnary(), "not a unary operator: %s", op);
    return new Ast.PrefixCall(op, a);
  }

  public Ast.PrefixCall negate(Ast.Exp a) {
    return prefixCall(Op.NEGATE, a);
  }

  public Ast.PrefixCall not(Ast.Exp a) {
    return prefixCall(Op.NOT, a);
  }

  public Ast.If ifThenElse(Ast.Exp condition, Ast.Exp ifTrue,
      Ast.Exp ifFalse) {
    return new Ast.If(condition, ifTrue, ifFalse);
  }

  public Ast.Let let(String name, Ast.Exp exp, Ast.Exp body) {
    return new Ast.Let(name, exp, body);
  }

  public Ast.LetPattern letPattern(Ast.Pat pat, Ast.Exp exp, Ast.Exp body) {
    return new Ast.LetPattern(pat, exp, body);
  }

  public Ast.IdPat idPat(String name) {
    return new Ast.IdPat(name);
  }

  public Ast.ArrayPat arrayPat(List<? extends Ast.Pat> args) {
    return new Ast.ArrayPat(ImmutableList.copyOf(args));
  }

  public Ast.ArrayPat arrayPat(Ast.Pat... args) {
    return arrayPat(ImmutableList.copyOf(args));
  }

  /** Creates a record pattern. Field order is preserved. */
  public Ast.RecordPat recordPat(Map<String, ? extends Ast.Pat> args) {
    return new Ast.RecordPat(ImmutableMap.copyOf(args));
  }

  /** Creates a function. Its body destructures the "args" array into the
   * parameters. */
  public Ast.Fn fn(List<String> params, Ast.Exp body) {
    return new Ast.Fn(Op.FN, null, ImmutableList.copyOf(params),
        desugar(params, body));
  }

  /** Creates a recursive function; the body can refer to it by name. */
  public Ast.Fn recFn(String name, List<String> params, Ast.Exp body) {
    return new Ast.Fn(Op.REC_FN, name, ImmutableList.copyOf(params),
        desugar(params, body));
  }

  /** Creates a function in residual code. Its parameters are bound
   * directly, not through "args". */
  public Ast.Fn residualFn(List<String> params, Ast.Exp body) {
    return new Ast.Fn(Op.FN, null, ImmutableList.copyOf(params), body);
  }

  /** Creates a recursive function in residual code. */
  public Ast.Fn residualRecFn(String name, List<String> params,
      Ast.Exp body) {
    return new Ast.Fn(Op.REC_FN, name, ImmutableList.copyOf(params), body);
  }

  private Ast.LetPattern desugar(List<String> params, Ast.Exp body) {
    return letPattern(arrayPat(transformEager(params, this::idPat)),
        id(ARGS), body);
  }

  public Ast.Apply apply(Ast.Exp fn, List<? extends Ast.Exp> args) {
    return new Ast.Apply(fn, ImmutableList.copyOf(args));
  }

  public Ast.Apply apply(Ast.Exp fn, Ast.Exp... args) {
    return apply(fn, ImmutableList.copyOf(args));
  }

  public Ast.MethodCall methodCall(Ast.Exp receiver, String method,
      List<? extends Ast.Exp> args) {
    return new Ast.MethodCall(receiver, method, ImmutableList.copyOf(args));
  }

  public Ast.MethodCall methodCall(Ast.Exp receiver, String method,
      Ast.Exp... args) {
    return methodCall(receiver, method, ImmutableList.copyOf(args));
  }

  /** Creates a record. Field order is preserved. */
  public Ast.Record record(Map<String, ? extends Ast.Exp> args) {
    return new Ast.Record(ImmutableMap.copyOf(args));
  }

  public Ast.Field field(Ast.Exp exp, String name) {
    return new Ast.Field(exp, name);
  }

  public Ast.Array array(List<? extends Ast.Exp> args) {
    return new Ast.Array(ImmutableList.copyOf(args));
  }

  public Ast.Array array(Ast.Exp... args) {
    return array(ImmutableList.copyOf(args));
  }

  public Ast.Index index(Ast.Exp exp, Ast.Exp index) {
    return new Ast.Index(exp, index);
  }

  public Ast.Block block(List<? extends Ast.Exp> exps) {
    return new Ast.Block(ImmutableList.copyOf(exps));
  }

  public Ast.Block block(Ast.Exp... exps) {
    return block(ImmutableList.copyOf(exps));
  }

  public Ast.Comptime comptime(Ast.Exp exp) {
    return new Ast.Comptime(exp);
  }

  public Ast.Runtime runtime(Ast.Exp exp, @Nullable String name) {
    return new Ast.Runtime(exp, name);
  }

  public Ast.Assert assertType(Ast.Exp exp, Ast.Exp constraint,
      @Nullable String message) {
    return new Ast.Assert(exp, constraint, message);
  }

  public Ast.AssertCond assertCond(Ast.Exp condition,
      @Nullable String message) {
    return new Ast.AssertCond(condition, message);
  }

  public Ast.Trust trust(Ast.Exp exp, Ast.@Nullable Exp constraint) {
    return new Ast.Trust(exp, constraint);
  }

  public Ast.TypeOf typeOf(Ast.Exp exp) {
    return new Ast.TypeOf(exp);
  }

  public Ast.Import importExp(List<String> names, String modulePath,
      Ast.Exp body) {
    return new Ast.Import(ImmutableList.copyOf(names), modulePath, body);
  }
}

// End AstBuilder.java
