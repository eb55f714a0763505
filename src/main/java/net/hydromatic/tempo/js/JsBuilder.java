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
package net.hydromatic.tempo.js;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.tempo.util.Static;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Builds JavaScript syntax tree nodes. */
public enum JsBuilder {
  /**
   * The singleton instance of the JavaScript builder. The short name is
   * convenient for use via 'import static', but checkstyle does not
   * approve.
   */
  // CHECKSTYLE: IGNORE 1
  js;

  /** Creates a literal. The value must be a number, string, boolean or
   * null; numbers are stored as {@link Double}. */
  public Js.Lit lit(@Nullable Object value) {
    if (value instanceof Number && !(value instanceof Double)) {
      value = ((Number) value).doubleValue();
    }
    checkArgument(Static.isLiteral(value), "not a literal: %s", value);
    return new Js.Lit(value);
  }

  public Js.Var var(String name) {
    return new Js.Var(name);
  }

  public Js.Binop binop(String op, Js.Exp left, Js.Exp right) {
    return new Js.Binop(op, left, right);
  }

  public Js.Unary unary(String op, Js.Exp operand) {
    return new Js.Unary(op, operand);
  }

  public Js.Call call(Js.Exp func, List<? extends Js.Exp> args) {
    return new Js.Call(func, ImmutableList.copyOf(args));
  }

  public Js.Call call(Js.Exp func, Js.Exp... args) {
    return call(func, ImmutableList.copyOf(args));
  }

  public Js.Method method(Js.Exp obj, String method,
      List<? extends Js.Exp> args) {
    return new Js.Method(obj, method, ImmutableList.copyOf(args));
  }

  public Js.Method method(Js.Exp obj, String method, Js.Exp... args) {
    return method(obj, method, ImmutableList.copyOf(args));
  }

  /** Creates an arrow function whose body is an expression. */
  public Js.Arrow arrow(List<String> params, Js.Exp body) {
    return new Js.Arrow(ImmutableList.copyOf(params), body,
        ImmutableList.of());
  }

  /** Creates an arrow function whose body is a block. */
  public Js.Arrow arrowBlock(List<String> params,
      List<? extends Js.Stmt> stmts) {
    return new Js.Arrow(ImmutableList.copyOf(params), null,
        ImmutableList.copyOf(stmts));
  }

  /** Creates a named function whose body is an expression. */
  public Js.NamedFunction namedFunction(String name, List<String> params,
      Js.Exp body) {
    return new Js.NamedFunction(name, ImmutableList.copyOf(params), body,
        ImmutableList.of());
  }

  /** Creates a named function whose body is a block. */
  public Js.NamedFunction namedFunctionBlock(String name,
      List<String> params, List<? extends Js.Stmt> stmts) {
    return new Js.NamedFunction(name, ImmutableList.copyOf(params), null,
        ImmutableList.copyOf(stmts));
  }

  public Js.Ternary ternary(Js.Exp cond, Js.Exp ifTrue, Js.Exp ifFalse) {
    return new Js.Ternary(cond, ifTrue, ifFalse);
  }

  public Js.Member member(Js.Exp obj, String prop) {
    return new Js.Member(obj, prop);
  }

  public Js.Index index(Js.Exp arr, Js.Exp idx) {
    return new Js.Index(arr, idx);
  }

  /** Creates an object literal; the fields keep the map's order. */
  public Js.ObjectExp object(Map<String, ? extends Js.Exp> fields) {
    return new Js.ObjectExp(ImmutableMap.copyOf(fields));
  }

  public Js.ArrayExp array(List<? extends Js.Exp> elements) {
    return new Js.ArrayExp(ImmutableList.copyOf(elements));
  }

  public Js.ArrayExp array(Js.Exp... elements) {
    return array(ImmutableList.copyOf(elements));
  }

  public Js.Iife iife(List<? extends Js.Stmt> body) {
    return new Js.Iife(ImmutableList.copyOf(body));
  }

  public Js.Declare constStmt(String name, Js.Exp value) {
    return new Js.Declare(JsOp.CONST, name, value);
  }

  public Js.Declare letStmt(String name, Js.Exp value) {
    return new Js.Declare(JsOp.LET, name, value);
  }

  public Js.ConstPattern constPattern(Js.Pat pat, Js.Exp value) {
    return new Js.ConstPattern(pat, value);
  }

  public Js.ExpStmt returnStmt(Js.Exp value) {
    return new Js.ExpStmt(JsOp.RETURN, value);
  }

  public Js.ExpStmt throwStmt(Js.Exp value) {
    return new Js.ExpStmt(JsOp.THROW, value);
  }

  public Js.ExpStmt exprStmt(Js.Exp value) {
    return new Js.ExpStmt(JsOp.EXPR, value);
  }

  /** Creates an "if" statement; {@code ifFalse} is null if there is no
   * "else". */
  public Js.If ifStmt(Js.Exp cond, List<? extends Js.Stmt> ifTrue,
      @Nullable List<? extends Js.Stmt> ifFalse) {
    return new Js.If(cond, ImmutableList.copyOf(ifTrue),
        ifFalse == null ? null : ImmutableList.copyOf(ifFalse));
  }

  public Js.ForOf forOf(String item, Js.Exp iter,
      List<? extends Js.Stmt> body) {
    return new Js.ForOf(item, iter, ImmutableList.copyOf(body));
  }

  public Js.Jump continueStmt() {
    return new Js.Jump(JsOp.CONTINUE);
  }

  public Js.Jump breakStmt() {
    return new Js.Jump(JsOp.BREAK);
  }

  public Js.VarPat varPat(String name) {
    return new Js.VarPat(name);
  }

  public Js.ArrayPat arrayPat(List<? extends Js.Pat> elements) {
    return new Js.ArrayPat(ImmutableList.copyOf(elements));
  }

  public Js.ObjectPat objectPat(Map<String, ? extends Js.Pat> fields) {
    return new Js.ObjectPat(ImmutableMap.copyOf(fields));
  }
}

// End JsBuilder.java
