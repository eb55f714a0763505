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
package net.hydromatic.tempo.eval;

import static net.hydromatic.tempo.constraint.Constraints.IS_BOOL;
import static net.hydromatic.tempo.constraint.Constraints.IS_FUNCTION;
import static net.hydromatic.tempo.constraint.Constraints.IS_NULL;
import static net.hydromatic.tempo.constraint.Constraints.IS_NUMBER;
import static net.hydromatic.tempo.constraint.Constraints.IS_OBJECT;
import static net.hydromatic.tempo.constraint.Constraints.IS_STRING;
import static net.hydromatic.tempo.constraint.Constraints.and;
import static net.hydromatic.tempo.constraint.Constraints.arrayLiteral;
import static net.hydromatic.tempo.constraint.Constraints.equalTo;
import static net.hydromatic.tempo.constraint.Constraints.hasField;
import static net.hydromatic.tempo.constraint.Constraints.isType;
import static net.hydromatic.tempo.util.Static.appendLiteral;
import static net.hydromatic.tempo.util.Static.appendQuoted;
import static net.hydromatic.tempo.util.Static.numberToString;
import static net.hydromatic.tempo.util.Static.transformEager;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import net.hydromatic.tempo.constraint.Constraint;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Factory methods and utilities for {@link Value}. */
public class Values {
  private Values() {}

  public static final Value NULL = new Value.Null();
  public static final Value TRUE = new Value.Bool(true);
  public static final Value FALSE = new Value.Bool(false);

  public static Value.Num number(double value) {
    return new Value.Num(value);
  }

  public static Value.Str string(String value) {
    return new Value.Str(value);
  }

  public static Value bool(boolean value) {
    return value ? TRUE : FALSE;
  }

  /** Creates an object. Field order is preserved. */
  public static Value.Obj object(Map<String, ? extends Value> fields) {
    return new Value.Obj(ImmutableMap.copyOf(fields));
  }

  public static Value.Arr array(List<? extends Value> elements) {
    return new Value.Arr(ImmutableList.copyOf(elements));
  }

  public static Value.Closure closure(int handle, @Nullable String name) {
    return new Value.Closure(handle, name);
  }

  public static Value.TypeValue type(Constraint constraint) {
    return new Value.TypeValue(constraint);
  }

  public static Value.Builtin builtin(String name) {
    return new Value.Builtin(name);
  }

  /** Converts a literal ({@link Double}, {@link String}, {@link Boolean} or
   * null) to a value. */
  public static Value fromLiteral(@Nullable Object literal) {
    if (literal == null) {
      return NULL;
    }
    if (literal instanceof Number) {
      return number(((Number) literal).doubleValue());
    }
    if (literal instanceof String) {
      return string((String) literal);
    }
    if (literal instanceof Boolean) {
      return bool((Boolean) literal);
    }
    throw new IllegalArgumentException("not a literal: " + literal);
  }

  /** Returns whether a value is a number, string, boolean or null. */
  public static boolean isPrimitive(Value value) {
    switch (value.kind) {
      case NUMBER:
      case STRING:
      case BOOL:
      case NULL:
        return true;
      default:
        return false;
    }
  }

  /** Returns whether a value is an object, array or closure; values that
   * residual code must refer to by name. */
  public static boolean isCompound(Value value) {
    switch (value.kind) {
      case OBJECT:
      case ARRAY:
      case CLOSURE:
        return true;
      default:
        return false;
    }
  }

  /** Converts a primitive value to a literal. */
  public static @Nullable Object toLiteral(Value value) {
    switch (value.kind) {
      case NUMBER:
        return ((Value.Num) value).value;
      case STRING:
        return ((Value.Str) value).value;
      case BOOL:
        return ((Value.Bool) value).value;
      case NULL:
        return null;
      default:
        throw new IllegalArgumentException("not a literal: " + value);
    }
  }

  /** Returns the most specific constraint of a value, its "literal
   * type". */
  public static Constraint constraintOf(Value value) {
    switch (value.kind) {
      case NUMBER:
        final double d = ((Value.Num) value).value;
        if (Double.isNaN(d)) {
          // NaN is not equal to itself, so it has no literal type
          return IS_NUMBER;
        }
        return and(IS_NUMBER, equalTo(d));
      case STRING:
        return and(IS_STRING, equalTo(((Value.Str) value).value));
      case BOOL:
        return and(IS_BOOL, equalTo(((Value.Bool) value).value));
      case NULL:
        return IS_NULL;
      case OBJECT:
        final List<Constraint> fieldConstraints = new ArrayList<>();
        fieldConstraints.add(IS_OBJECT);
        ((Value.Obj) value).fields.forEach((name, v) ->
            fieldConstraints.add(hasField(name, constraintOf(v))));
        return and(fieldConstraints);
      case ARRAY:
        return arrayLiteral(
            transformEager(((Value.Arr) value).elements,
                Values::constraintOf));
      case CLOSURE:
      case BUILTIN:
        return IS_FUNCTION;
      case TYPE:
        return isType(((Value.TypeValue) value).constraint);
      default:
        throw new AssertionError("unknown kind " + value.kind);
    }
  }

  /** Returns whether a value satisfies a constraint.
   *
   * <p>Constraint variables and recursive types are not checked; they are
   * assumed to be satisfied. */
  public static boolean satisfies(Value value, Constraint c) {
    return satisfies(value, c, ImmutableSet.of());
  }

  /** Returns whether a value satisfies a constraint; {@code namedFields}
   * are the fields that sibling {@code hasField} constraints describe, and
   * an index signature does not apply to them. */
  private static boolean satisfies(Value value, Constraint c,
      Set<String> namedFields) {
    switch (c.op) {
      case ANY:
      case VAR:
      case REC:
      case REC_VAR:
        return true;
      case NEVER:
      case IS_UNDEFINED:
        return false;
      case IS_NUMBER:
        return value.kind == Value.Kind.NUMBER;
      case IS_STRING:
        return value.kind == Value.Kind.STRING;
      case IS_BOOL:
        return value.kind == Value.Kind.BOOL;
      case IS_NULL:
        return value.kind == Value.Kind.NULL;
      case IS_OBJECT:
        return value.kind == Value.Kind.OBJECT;
      case IS_ARRAY:
        return value.kind == Value.Kind.ARRAY;
      case IS_FUNCTION:
      case FN_TYPE:
      case GENERIC_FN_TYPE:
        return value.kind == Value.Kind.CLOSURE
            || value.kind == Value.Kind.BUILTIN;
      case EQUALS:
        final Object literal = ((Constraint.Equals) c).value;
        if (value.kind == Value.Kind.NUMBER && literal instanceof Double) {
          return ((Value.Num) value).value == (Double) literal;
        }
        return isPrimitive(value)
            && Objects.equals(toLiteral(value), literal);
      case GT:
      case GTE:
      case LT:
      case LTE:
        return value.kind == Value.Kind.NUMBER
            && ((Constraint.Bound) c).test(((Value.Num) value).value);
      case HAS_FIELD:
        if (value.kind != Value.Kind.OBJECT) {
          return false;
        }
        final Constraint.HasField hasField = (Constraint.HasField) c;
        final Value fieldValue =
            ((Value.Obj) value).fields.get(hasField.name);
        return fieldValue != null
            && satisfies(fieldValue, hasField.constraint);
      case INDEX_SIG:
        if (value.kind != Value.Kind.OBJECT) {
          return false;
        }
        final Constraint indexSig = ((Constraint.Wrapper) c).constraint;
        for (Map.Entry<String, Value> e
            : ((Value.Obj) value).fields.entrySet()) {
          if (!namedFields.contains(e.getKey())
              && !satisfies(e.getValue(), indexSig)) {
            return false;
          }
        }
        return true;
      case ELEMENTS:
        if (value.kind != Value.Kind.ARRAY) {
          return false;
        }
        final Constraint element = ((Constraint.Wrapper) c).constraint;
        for (Value e : ((Value.Arr) value).elements) {
          if (!satisfies(e, element)) {
            return false;
          }
        }
        return true;
      case ELEMENT_AT:
        if (value.kind != Value.Kind.ARRAY) {
          return false;
        }
        final Constraint.ElementAt elementAt = (Constraint.ElementAt) c;
        final List<Value> list = ((Value.Arr) value).elements;
        return elementAt.index < list.size()
            && satisfies(list.get(elementAt.index), elementAt.constraint);
      case LENGTH:
        final Constraint lengthConstraint =
            ((Constraint.Wrapper) c).constraint;
        switch (value.kind) {
          case ARRAY:
            return satisfies(number(((Value.Arr) value).elements.size()),
                lengthConstraint);
          case STRING:
            return satisfies(number(((Value.Str) value).value.length()),
                lengthConstraint);
          default:
            return false;
        }
      case AND:
        final List<Constraint> conjuncts =
            ((Constraint.Junction) c).constraints;
        final ImmutableSet.Builder<String> names = ImmutableSet.builder();
        for (Constraint conjunct : conjuncts) {
          if (conjunct instanceof Constraint.HasField) {
            names.add(((Constraint.HasField) conjunct).name);
          }
        }
        final Set<String> nameSet = names.build();
        for (Constraint conjunct : conjuncts) {
          if (!satisfies(value, conjunct, nameSet)) {
            return false;
          }
        }
        return true;
      case OR:
        for (Constraint disjunct : ((Constraint.Junction) c).constraints) {
          if (satisfies(value, disjunct, namedFields)) {
            return true;
          }
        }
        return false;
      case NOT:
        return !satisfies(value, ((Constraint.Wrapper) c).constraint,
            namedFields);
      case IS_TYPE:
        return value.kind == Value.Kind.TYPE;
      case TYPE_PARAM:
        return satisfies(value, ((Constraint.TypeParam) c).bound,
            namedFields);
      default:
        throw new AssertionError("unknown op " + c.op);
    }
  }

  /** Returns whether two values are equal under the {@code ==} operator.
   *
   * <p>Numbers, strings and booleans compare by value, and null equals
   * only null. Objects and arrays compare by reference, closures by handle,
   * and types by constraint. */
  public static boolean valueEquals(Value v0, Value v1) {
    if (v0.kind != v1.kind) {
      return false;
    }
    switch (v0.kind) {
      case NUMBER:
        return ((Value.Num) v0).value == ((Value.Num) v1).value;
      case NULL:
        return true;
      case OBJECT:
      case ARRAY:
        return v0 == v1;
      default:
        return v0.equals(v1);
    }
  }

  /** Appends a value in display form, for example {@code { a: 1 }}. */
  public static StringBuilder append(StringBuilder buf, Value value) {
    switch (value.kind) {
      case NUMBER:
        return buf.append(numberToString(((Value.Num) value).value));
      case STRING:
        return appendQuoted(buf, ((Value.Str) value).value);
      case BOOL:
      case NULL:
        return appendLiteral(buf, toLiteral(value));
      case OBJECT:
        final Map<String, Value> fields = ((Value.Obj) value).fields;
        if (fields.isEmpty()) {
          return buf.append("{}");
        }
        buf.append("{ ");
        int i = 0;
        for (Map.Entry<String, Value> e : fields.entrySet()) {
          if (i++ > 0) {
            buf.append(", ");
          }
          append(buf.append(e.getKey()).append(": "), e.getValue());
        }
        return buf.append(" }");
      case ARRAY:
        buf.append('[');
        final List<Value> elements = ((Value.Arr) value).elements;
        for (int j = 0; j < elements.size(); j++) {
          if (j > 0) {
            buf.append(", ");
          }
          append(buf, elements.get(j));
        }
        return buf.append(']');
      case CLOSURE:
        final String name = ((Value.Closure) value).name;
        return buf.append(name == null ? "<fn" : "<fn " + name)
            .append("(...)>");
      case TYPE:
        return buf.append("Type<")
            .append(((Value.TypeValue) value).constraint)
            .append('>');
      case BUILTIN:
        return buf.append("<builtin ")
            .append(((Value.Builtin) value).name)
            .append('>');
      default:
        throw new AssertionError("unknown kind " + value.kind);
    }
  }
}

// End Values.java
