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

/** Kind of {@link Constraint}. */
public enum Op {
  ANY("any"),
  NEVER("never"),

  // Classifications; the traditional types.
  IS_NUMBER("number"),
  IS_STRING("string"),
  IS_BOOL("boolean"),
  IS_NULL("null"),
  IS_UNDEFINED("undefined"),
  IS_OBJECT("object"),
  IS_ARRAY("array"),
  IS_FUNCTION("function"),

  EQUALS("equals"),
  GT(">"),
  GTE(">="),
  LT("<"),
  LTE("<="),

  HAS_FIELD("hasField"),
  ELEMENTS("elements"),
  ELEMENT_AT("elementAt"),
  LENGTH("length"),
  INDEX_SIG("indexSig"),

  AND(" & "),
  OR(" | "),
  NOT("not"),

  VAR("var"),
  IS_TYPE("Type"),
  REC("μ"),
  REC_VAR("recVar"),
  TYPE_PARAM("typeParam"),
  FN_TYPE("fnType"),
  GENERIC_FN_TYPE("genericFnType");

  /** Print name. For a classification, the name of the type. */
  public final String str;

  Op(String str) {
    this.str = str;
  }

  /** Returns whether this is a classification, such as {@link #IS_NUMBER}. */
  public boolean isClassification() {
    return ordinal() >= IS_NUMBER.ordinal()
        && ordinal() <= IS_FUNCTION.ordinal();
  }

  /** Returns whether this is a numeric bound, such as {@link #GT}. */
  public boolean isBound() {
    return this == GT || this == GTE || this == LT || this == LTE;
  }

  /**
   * Returns whether two classifications are mutually exclusive.
   *
   * <p>Arrays and functions are objects, so {@link #IS_OBJECT} is compatible
   * with {@link #IS_ARRAY} and {@link #IS_FUNCTION}; every other pair of
   * distinct classifications is disjoint.
   */
  public boolean disjoint(Op other) {
    if (this == other) {
      return false;
    }
    if (this == IS_OBJECT) {
      return other != IS_ARRAY && other != IS_FUNCTION;
    }
    if (other == IS_OBJECT) {
      return this != IS_ARRAY && this != IS_FUNCTION;
    }
    return true;
  }
}

// End Op.java
