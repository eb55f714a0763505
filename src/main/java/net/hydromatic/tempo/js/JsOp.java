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

/** Sub-types of {@link Js.Node}. */
public enum JsOp {
  // expressions
  LIT("L"),
  VAR("V"),
  BINOP("B"),
  UNARY("U"),
  CALL("C"),
  METHOD("M"),
  ARROW("A"),
  NAMED_FUNCTION("F"),
  TERNARY("T"),
  MEMBER("."),
  INDEX("I"),
  OBJECT("O"),
  ARRAY("[]"),
  IIFE("IIFE"),

  // statements
  CONST("const"),
  LET("let"),
  RETURN("return"),
  IF("if"),
  FOR_OF("for"),
  EXPR("expr"),
  CONST_PATTERN("const P"),
  THROW("throw"),
  CONTINUE("continue"),
  BREAK("break"),

  // patterns
  VAR_PATTERN("VP"),
  ARRAY_PATTERN("AP"),
  OBJECT_PATTERN("OP");

  /** Short tag, used in the signatures computed by
   * {@link net.hydromatic.tempo.cluster.Clusterer#signature}. */
  public final String tag;

  JsOp(String tag) {
    this.tag = tag;
  }

  /** Returns whether this is an expression. */
  public boolean isExp() {
    return ordinal() <= IIFE.ordinal();
  }

  /** Returns whether this is a pattern. */
  public boolean isPattern() {
    return ordinal() >= VAR_PATTERN.ordinal();
  }
}

// End JsOp.java
