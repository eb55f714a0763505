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

import com.google.common.collect.ImmutableMap;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Sub-types of {@link AstNode}. */
public enum Op {
  // atoms
  LITERAL,
  ID,

  // binary operators
  PLUS("+"),
  MINUS("-"),
  TIMES("*"),
  DIVIDE("/"),
  MOD("%"),
  EQ("=="),
  NE("!="),
  LT("<"),
  GT(">"),
  LE("<="),
  GE(">="),
  ANDALSO("&&"),
  ORELSE("||"),

  // unary operators
  NEGATE("-"),
  NOT("!"),

  // control
  IF,
  LET,
  LET_PATTERN,
  BLOCK,

  // functions
  FN,
  REC_FN,
  APPLY,
  METHOD_CALL,

  // value constructors and accessors
  RECORD,
  FIELD,
  ARRAY,
  INDEX,

  // staging annotations
  COMPTIME,
  RUNTIME,
  ASSERT,
  ASSERT_COND,
  TRUST,
  TYPE_OF,
  IMPORT,

  // patterns
  ID_PAT,
  ARRAY_PAT,
  RECORD_PAT;

  /** Operator symbol, e.g. "+"; null if this is not an operator. */
  public final @Nullable String symbol;

  /** Binary operators, indexed by symbol. */
  public static final ImmutableMap<String, Op> BY_SYMBOL;

  static {
    final ImmutableMap.Builder<String, Op> b = ImmutableMap.builder();
    for (Op op : values()) {
      if (op.isBinary()) {
        b.put(op.symbol, op);
      }
    }
    BY_SYMBOL = b.build();
  }

  Op() {
    this(null);
  }

  Op(@Nullable String symbol) {
    this.symbol = symbol;
  }

  /** Returns whether this is a binary operator. */
  public boolean isBinary() {
    return symbol != null && this != NEGATE && this != NOT;
  }

  /** Returns whether this is a unary operator. */
  public boolean isUnary() {
    return this == NEGATE || this == NOT;
  }

  /** Returns whether this is an arithmetic operator. */
  public boolean isArithmetic() {
    switch (this) {
      case PLUS:
      case MINUS:
      case TIMES:
      case DIVIDE:
      case MOD:
        return true;
      default:
        return false;
    }
  }

  /** Returns whether this is a numeric comparison. */
  public boolean isComparison() {
    switch (this) {
      case LT:
      case GT:
      case LE:
      case GE:
        return true;
      default:
        return false;
    }
  }
}

// End Op.java
