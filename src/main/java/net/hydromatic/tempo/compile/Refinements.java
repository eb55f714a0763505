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

import static net.hydromatic.tempo.constraint.Constraints.IS_ARRAY;
import static net.hydromatic.tempo.constraint.Constraints.IS_BOOL;
import static net.hydromatic.tempo.constraint.Constraints.IS_FUNCTION;
import static net.hydromatic.tempo.constraint.Constraints.IS_NULL;
import static net.hydromatic.tempo.constraint.Constraints.IS_NUMBER;
import static net.hydromatic.tempo.constraint.Constraints.IS_OBJECT;
import static net.hydromatic.tempo.constraint.Constraints.IS_STRING;
import static net.hydromatic.tempo.constraint.Constraints.and;
import static net.hydromatic.tempo.constraint.Constraints.equalTo;
import static net.hydromatic.tempo.constraint.Constraints.gt;
import static net.hydromatic.tempo.constraint.Constraints.gte;
import static net.hydromatic.tempo.constraint.Constraints.hasField;
import static net.hydromatic.tempo.constraint.Constraints.lt;
import static net.hydromatic.tempo.constraint.Constraints.lte;
import static net.hydromatic.tempo.constraint.Constraints.not;
import static net.hydromatic.tempo.constraint.Constraints.or;
import static net.hydromatic.tempo.util.Static.transformEager;

import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.Map;
import net.hydromatic.tempo.ast.Ast;
import net.hydromatic.tempo.ast.Op;
import net.hydromatic.tempo.constraint.Constraint;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Extracts refinements from conditions.
 *
 * <p>A refinement is a map from variable names to what we learn about them
 * when a condition is true. For example, from {@code x > 0} we learn that
 * {@code x} satisfies {@code > 0}; if the condition is false, we learn the
 * negation, {@code <= 0}. */
public class Refinements {
  private Refinements() {}

  /** Names of type-guard functions, and the classification that each
   * establishes. */
  static final ImmutableMap<String, Constraint> TYPE_GUARDS =
      ImmutableMap.<String, Constraint>builder()
          .put("isNumber", IS_NUMBER)
          .put("isString", IS_STRING)
          .put("isBool", IS_BOOL)
          .put("isBoolean", IS_BOOL)
          .put("isNull", IS_NULL)
          .put("isObject", IS_OBJECT)
          .put("isArray", IS_ARRAY)
          .put("isFunction", IS_FUNCTION)
          .build();

  /** Returns what we learn if a condition is true. */
  public static Map<String, Constraint> extract(Ast.Exp condition) {
    switch (condition.op) {
      case APPLY:
        return typeGuard((Ast.Apply) condition);
      case NOT:
        return negate(extract(((Ast.PrefixCall) condition).a));
      case EQ:
      case NE:
      case LT:
      case LE:
      case GT:
      case GE:
      case ANDALSO:
      case ORELSE:
        final Ast.InfixCall call = (Ast.InfixCall) condition;
        return binary(call);
      default:
        return ImmutableMap.of();
    }
  }

  /** Recognizes a type guard, such as {@code isNumber(x)}. */
  private static Map<String, Constraint> typeGuard(Ast.Apply apply) {
    if (apply.fn instanceof Ast.Id
        && apply.args.size() == 1
        && apply.args.get(0) instanceof Ast.Id) {
      final Constraint c = TYPE_GUARDS.get(((Ast.Id) apply.fn).name);
      if (c != null) {
        return ImmutableMap.of(((Ast.Id) apply.args.get(0)).name, c);
      }
    }
    return ImmutableMap.of();
  }

  private static Map<String, Constraint> binary(Ast.InfixCall call) {
    switch (call.op) {
      case ANDALSO:
        return merge(extract(call.a0), extract(call.a1));
      case ORELSE:
        // We only learn that one of the conditions holds
        return ImmutableMap.of();
      default:
        break;
    }

    // "x op literal", or "literal op x" with the operator flipped
    Ast.Exp subject = call.a0;
    Ast.Exp other = call.a1;
    boolean flipped = false;
    if (!(other instanceof Ast.Literal)) {
      subject = call.a1;
      other = call.a0;
      flipped = true;
    }
    if (!(other instanceof Ast.Literal)) {
      return ImmutableMap.of();
    }
    final Object literal = ((Ast.Literal) other).value;

    switch (call.op) {
      case LT:
      case LE:
      case GT:
      case GE:
        if (subject instanceof Ast.Id && literal instanceof Double) {
          return ImmutableMap.of(((Ast.Id) subject).name,
              bound(call.op, flipped, (Double) literal));
        }
        return ImmutableMap.of();
      case EQ:
        return equality(subject, equalTo(literal));
      case NE:
        return equality(subject, not(equalTo(literal)));
      default:
        throw new AssertionError("unknown op " + call.op);
    }
  }

  /** Refinement for "x == literal" or "x.f == literal". */
  private static Map<String, Constraint> equality(Ast.Exp subject,
      Constraint constraint) {
    if (subject instanceof Ast.Id) {
      return ImmutableMap.of(((Ast.Id) subject).name, constraint);
    }
    if (subject instanceof Ast.Field
        && ((Ast.Field) subject).exp instanceof Ast.Id) {
      final Ast.Field field = (Ast.Field) subject;
      return ImmutableMap.of(((Ast.Id) field.exp).name,
          hasField(field.name, constraint));
    }
    return ImmutableMap.of();
  }

  private static Constraint bound(Op op, boolean flipped, double d) {
    switch (op) {
      case LT:
        return flipped ? gt(d) : lt(d);
      case LE:
        return flipped ? gte(d) : lte(d);
      case GT:
        return flipped ? lt(d) : gt(d);
      case GE:
        return flipped ? lte(d) : gte(d);
      default:
        throw new AssertionError("unknown op " + op);
    }
  }

  /** Combines two refinements that both hold. */
  public static Map<String, Constraint> merge(Map<String, Constraint> a,
      Map<String, Constraint> b) {
    final Map<String, Constraint> result = new LinkedHashMap<>(a);
    b.forEach((name, c) -> {
      final @Nullable Constraint existing = result.get(name);
      result.put(name, existing == null ? c : and(existing, c));
    });
    return result;
  }

  /** Returns what we learn if the condition that gave a refinement is
   * false. */
  public static Map<String, Constraint> negate(
      Map<String, Constraint> refinement) {
    final Map<String, Constraint> result = new LinkedHashMap<>();
    refinement.forEach((name, c) -> result.put(name, negate(c)));
    return result;
  }

  /** Negates a constraint. Bounds flip, and conjunctions and disjunctions
   * follow De Morgan's laws. */
  public static Constraint negate(Constraint c) {
    switch (c.op) {
      case GT:
        return lte(((Constraint.Bound) c).bound);
      case GTE:
        return lt(((Constraint.Bound) c).bound);
      case LT:
        return gte(((Constraint.Bound) c).bound);
      case LTE:
        return gt(((Constraint.Bound) c).bound);
      case NOT:
        return ((Constraint.Wrapper) c).constraint;
      case AND:
        return or(
            transformEager(((Constraint.Junction) c).constraints,
                Refinements::negate));
      case OR:
        return and(
            transformEager(((Constraint.Junction) c).constraints,
                Refinements::negate));
      default:
        return not(c);
    }
  }
}

// End Refinements.java
