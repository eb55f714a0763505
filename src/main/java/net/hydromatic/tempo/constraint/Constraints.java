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

import static com.google.common.base.Preconditions.checkArgument;
import static net.hydromatic.tempo.util.Static.transformEager;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Factory methods and algorithms for {@link Constraint}. */
public class Constraints {
  private Constraints() {}

  public static final Constraint ANY = new Constraint.Atom(Op.ANY);
  public static final Constraint NEVER = new Constraint.Atom(Op.NEVER);
  public static final Constraint IS_NUMBER = new Constraint.Atom(Op.IS_NUMBER);
  public static final Constraint IS_STRING = new Constraint.Atom(Op.IS_STRING);
  public static final Constraint IS_BOOL = new Constraint.Atom(Op.IS_BOOL);
  public static final Constraint IS_NULL = new Constraint.Atom(Op.IS_NULL);
  public static final Constraint IS_UNDEFINED =
      new Constraint.Atom(Op.IS_UNDEFINED);
  public static final Constraint IS_OBJECT = new Constraint.Atom(Op.IS_OBJECT);
  public static final Constraint IS_ARRAY = new Constraint.Atom(Op.IS_ARRAY);
  public static final Constraint IS_FUNCTION =
      new Constraint.Atom(Op.IS_FUNCTION);

  /** Default limit on the number of nested {@link Op#REC} binders that
   * {@link #extractFieldConstraint} will unroll. */
  public static final int MAX_UNROLL_DEPTH = 64;

  /** Returns the constant for a classification. */
  public static Constraint classification(Op op) {
    switch (op) {
        case IS_NUMBER:
          return IS_NUMBER;
        case IS_STRING:
          return IS_STRING;
        case IS_BOOL:
          return IS_BOOL;
        case IS_NULL:
          return IS_NULL;
        case IS_UNDEFINED:
          return IS_UNDEFINED;
        case IS_OBJECT:
          return IS_OBJECT;
        case IS_ARRAY:
          return IS_ARRAY;
        case IS_FUNCTION:
          return IS_FUNCTION;
        default:
          throw new IllegalArgumentException("not a classification: " + op);
    }
  }

  /** Creates a constraint that a value equals a literal. (Not called
   * {@code equals}, to avoid confusion with {@link Object#equals}.) */
  public static Constraint equalTo(@Nullable Object value) {
    if (value instanceof Integer) {
      value = ((Integer) value).doubleValue();
    }
    return new Constraint.Equals(value);
  }

  public static Constraint gt(double bound) {
    return new Constraint.Bound(Op.GT, bound);
  }

  public static Constraint gte(double bound) {
    return new Constraint.Bound(Op.GTE, bound);
  }

  public static Constraint lt(double bound) {
    return new Constraint.Bound(Op.LT, bound);
  }

  public static Constraint lte(double bound) {
    return new Constraint.Bound(Op.LTE, bound);
  }

  /** Creates a numeric bound. */
  public static Constraint bound(Op op, double bound) {
    return new Constraint.Bound(op, bound);
  }

  public static Constraint hasField(String name, Constraint constraint) {
    return new Constraint.HasField(name, constraint);
  }

  public static Constraint elements(Constraint constraint) {
    return new Constraint.Wrapper(Op.ELEMENTS, constraint);
  }

  public static Constraint elementAt(int index, Constraint constraint) {
    return new Constraint.ElementAt(index, constraint);
  }

  public static Constraint length(Constraint constraint) {
    return new Constraint.Wrapper(Op.LENGTH, constraint);
  }

  /** Creates an index signature; {@code indexSig(never)} means that an
   * object is closed. */
  public static Constraint indexSig(Constraint constraint) {
    return new Constraint.Wrapper(Op.INDEX_SIG, constraint);
  }

  public static Constraint not(Constraint constraint) {
    return new Constraint.Wrapper(Op.NOT, constraint);
  }

  public static Constraint isType(Constraint constraint) {
    return new Constraint.Wrapper(Op.IS_TYPE, constraint);
  }

  public static Constraint.Var cvar(int id) {
    return new Constraint.Var(id);
  }

  public static Constraint.Rec rec(String name, Constraint body) {
    return new Constraint.Rec(name, body);
  }

  public static Constraint recVar(String name) {
    return new Constraint.RecVar(name);
  }

  public static Constraint.TypeParam typeParam(String name, Constraint bound,
      int id) {
    return new Constraint.TypeParam(name, bound, id);
  }

  public static Constraint fnType(List<Constraint> params, Constraint result) {
    return new Constraint.FnType(ImmutableList.copyOf(params), result);
  }

  public static Constraint genericFnType(
      List<Constraint.TypeParam> typeParams, List<Constraint> params,
      Constraint result) {
    return new Constraint.GenericFnType(ImmutableList.copyOf(typeParams),
        ImmutableList.copyOf(params), result);
  }

  /** Creates a conjunction. */
  public static Constraint and(Constraint... constraints) {
    return and(Arrays.asList(constraints));
  }

  /** Creates a conjunction, flattening nested conjunctions. Returns
   * {@link #ANY} if the list is empty, and the sole element if there is just
   * one. */
  public static Constraint and(Iterable<? extends Constraint> constraints) {
    return junction(Op.AND, constraints);
  }

  /** Creates a disjunction. */
  public static Constraint or(Constraint... constraints) {
    return or(Arrays.asList(constraints));
  }

  /** Creates a disjunction, flattening nested disjunctions. Returns
   * {@link #NEVER} if the list is empty, and the sole element if there is
   * just one. */
  public static Constraint or(Iterable<? extends Constraint> constraints) {
    return junction(Op.OR, constraints);
  }

  private static Constraint junction(Op op,
      Iterable<? extends Constraint> constraints) {
    final List<Constraint> list = new ArrayList<>();
    flatten(op, constraints, list);
    switch (list.size()) {
      case 0:
        return op == Op.AND ? ANY : NEVER;
      case 1:
        return list.get(0);
      default:
        return new Constraint.Junction(op, ImmutableList.copyOf(list));
    }
  }

  private static void flatten(Op op, Iterable<? extends Constraint> constraints,
      List<Constraint> list) {
    for (Constraint c : constraints) {
      if (c.op == op) {
        list.addAll(((Constraint.Junction) c).constraints);
      } else {
        list.add(c);
      }
    }
  }

  /** Creates the constraint of a fixed-length array (a tuple). */
  public static Constraint tuple(List<Constraint> constraints) {
    final List<Constraint> list = new ArrayList<>();
    list.add(IS_ARRAY);
    for (int i = 0; i < constraints.size(); i++) {
      list.add(elementAt(i, constraints.get(i)));
    }
    list.add(length(and(IS_NUMBER, equalTo((double) constraints.size()))));
    return and(list);
  }

  /** Creates the constraint of an array whose elements all satisfy a
   * constraint. */
  public static Constraint arrayOf(Constraint constraint) {
    return and(IS_ARRAY, elements(constraint));
  }

  /** Creates the constraint of an array literal: its length, each element
   * at its position, and the union of the distinct element constraints.
   * An empty array has no {@code elements} part. */
  public static Constraint arrayLiteral(List<Constraint> constraints) {
    final List<Constraint> list = new ArrayList<>();
    list.add(IS_ARRAY);
    list.add(length(and(IS_NUMBER, equalTo((double) constraints.size()))));
    final Set<Constraint> unique = new LinkedHashSet<>();
    for (int i = 0; i < constraints.size(); i++) {
      list.add(elementAt(i, constraints.get(i)));
      unique.add(constraints.get(i));
    }
    if (unique.size() == 1) {
      list.add(elements(unique.iterator().next()));
    } else if (unique.size() > 1) {
      list.add(elements(or(ImmutableList.copyOf(unique))));
    }
    return and(list);
  }

  /** Creates the constraint of a closed object with the given fields. */
  public static Constraint object(Map<String, Constraint> fields) {
    final List<Constraint> list = new ArrayList<>();
    list.add(IS_OBJECT);
    fields.forEach((name, c) -> list.add(hasField(name, c)));
    list.add(indexSig(NEVER));
    return and(list);
  }

  /** Returns the constraint for a literal value: for example,
   * {@code and(isNumber, equals(5))}. */
  public static Constraint literal(@Nullable Object value) {
    if (value == null) {
      return IS_NULL;
    }
    if (value instanceof Double) {
      return and(IS_NUMBER, equalTo(value));
    }
    if (value instanceof String) {
      return and(IS_STRING, equalTo(value));
    }
    if (value instanceof Boolean) {
      return and(IS_BOOL, equalTo(value));
    }
    throw new IllegalArgumentException("not a literal: " + value);
  }

  // Simplification

  /**
   * Simplifies a constraint.
   *
   * <p>Flattens nested conjunctions and disjunctions, removes duplicates,
   * and reduces contradictory conjunctions to {@link #NEVER}. The result is
   * idempotent: {@code simplify(simplify(c))} equals {@code simplify(c)}.
   */
  public static Constraint simplify(Constraint c) {
    switch (c.op) {
      case NOT:
        final Constraint inner = simplify(((Constraint.Wrapper) c).constraint);
        switch (inner.op) {
          case NEVER:
            return ANY;
          case ANY:
            return NEVER;
          case NOT:
            return ((Constraint.Wrapper) inner).constraint;
          default:
            return not(inner);
        }

      case AND:
        return simplifyAnd((Constraint.Junction) c);

      case OR:
        return simplifyOr((Constraint.Junction) c);

      default:
        return c.copy(Constraints::simplify);
    }
  }

  private static Constraint simplifyAnd(Constraint.Junction c) {
    final List<Constraint> simplified = new ArrayList<>();
    for (Constraint c2 : c.constraints) {
      simplified.add(simplify(c2));
    }
    final List<Constraint> flat = new ArrayList<>();
    flatten(Op.AND, simplified, flat);
    final List<Constraint> list = new ArrayList<>();
    for (Constraint c2 : flat) {
      if (c2.isNever()) {
        return NEVER;
      }
      if (!c2.isAny() && !list.contains(c2)) {
        list.add(c2);
      }
    }
    if (hasContradiction(list)) {
      return NEVER;
    }
    switch (list.size()) {
      case 0:
        return ANY;
      case 1:
        return list.get(0);
      default:
        return new Constraint.Junction(Op.AND, ImmutableList.copyOf(list));
    }
  }

  private static Constraint simplifyOr(Constraint.Junction c) {
    final List<Constraint> simplified = new ArrayList<>();
    for (Constraint c2 : c.constraints) {
      simplified.add(simplify(c2));
    }
    final List<Constraint> flat = new ArrayList<>();
    flatten(Op.OR, simplified, flat);
    final List<Constraint> list = new ArrayList<>();
    for (Constraint c2 : flat) {
      if (c2.isAny()) {
        return ANY;
      }
      if (!c2.isNever() && !list.contains(c2)) {
        list.add(c2);
      }
    }
    switch (list.size()) {
      case 0:
        return NEVER;
      case 1:
        return list.get(0);
      default:
        return new Constraint.Junction(Op.OR, ImmutableList.copyOf(list));
    }
  }

  /** Returns whether a flat list of conjuncts is contradictory. */
  private static boolean hasContradiction(List<Constraint> constraints) {
    final List<Op> classifications = new ArrayList<>();
    final List<Constraint.Equals> equalses = new ArrayList<>();
    Double gt = null;
    Double gte = null;
    Double lt = null;
    Double lte = null;
    final Map<String, List<Constraint>> fields = new HashMap<>();

    for (Constraint c : constraints) {
      if (c.op.isClassification()) {
        for (Op op : classifications) {
          if (op.disjoint(c.op)) {
            return true;
          }
        }
        for (Constraint.Equals equals : equalses) {
          if (!equals.matches(c.op)) {
            return true;
          }
        }
        classifications.add(c.op);
        continue;
      }
      switch (c.op) {
        case EQUALS:
          final Constraint.Equals equals = (Constraint.Equals) c;
          for (Constraint.Equals e : equalses) {
            if (!Objects.equals(e.value, equals.value)) {
              return true;
            }
          }
          for (Op op : classifications) {
            if (!equals.matches(op)) {
              return true;
            }
          }
          equalses.add(equals);
          break;
        case GT:
          gt = max(gt, ((Constraint.Bound) c).bound);
          break;
        case GTE:
          gte = max(gte, ((Constraint.Bound) c).bound);
          break;
        case LT:
          lt = min(lt, ((Constraint.Bound) c).bound);
          break;
        case LTE:
          lte = min(lte, ((Constraint.Bound) c).bound);
          break;
        case HAS_FIELD:
          final Constraint.HasField hasField = (Constraint.HasField) c;
          fields.computeIfAbsent(hasField.name, k -> new ArrayList<>())
              .add(hasField.constraint);
          break;
        default:
          break;
      }
    }

    if (gt != null && lt != null && gt >= lt
        || gt != null && lte != null && gt >= lte
        || gte != null && lt != null && gte >= lt
        || gte != null && lte != null && gte > lte) {
      return true;
    }

    for (Constraint.Equals equals : equalses) {
      if (equals.value instanceof Double) {
        final double v = (Double) equals.value;
        if (gt != null && v <= gt
            || gte != null && v < gte
            || lt != null && v >= lt
            || lte != null && v > lte) {
          return true;
        }
      }
    }

    for (List<Constraint> fieldConstraints : fields.values()) {
      if (fieldConstraints.size() > 1
          && simplify(and(fieldConstraints)).isNever()) {
        return true;
      }
    }
    return false;
  }

  private static Double max(@Nullable Double d0, double d1) {
    return d0 == null ? d1 : Math.max(d0, d1);
  }

  private static Double min(@Nullable Double d0, double d1) {
    return d0 == null ? d1 : Math.min(d0, d1);
  }

  // Unification and narrowing

  /** Unifies two constraints by taking their conjunction. The result may be
   * {@link #NEVER} if they are contradictory. */
  public static Constraint unify(Constraint a, Constraint b) {
    return simplify(and(a, b));
  }

  /** Narrows a constraint with information learned from control flow. */
  public static Constraint narrow(Constraint base, Constraint refinement) {
    if (refinement.op == Op.NOT) {
      final Constraint negated = ((Constraint.Wrapper) refinement).constraint;
      return Implication.implies(base, negated) ? NEVER : base;
    }
    return unify(base, refinement);
  }

  /** Narrows each branch of a disjunction, removing branches that contradict
   * the refinement. */
  public static Constraint narrowOr(Constraint c, Constraint refinement) {
    if (c.op != Op.OR) {
      return narrow(c, refinement);
    }
    final List<Constraint> surviving = new ArrayList<>();
    for (Constraint branch : ((Constraint.Junction) c).constraints) {
      final Constraint narrowed = narrow(branch, refinement);
      if (!narrowed.isNever()) {
        surviving.add(narrowed);
      }
    }
    switch (surviving.size()) {
      case 0:
        return NEVER;
      case 1:
        return surviving.get(0);
      default:
        return simplify(or(surviving));
    }
  }

  /** Removes literal information, {@code equals} and numeric bounds, so that
   * {@code and(isNumber, equals(5))} becomes {@code isNumber}. */
  public static Constraint widen(Constraint c) {
    switch (c.op) {
      case EQUALS:
      case GT:
      case GTE:
      case LT:
      case LTE:
        return ANY;
      case AND:
        return simplify(
            and(transformEager(((Constraint.Junction) c).constraints,
                Constraints::widen)));
      case OR:
        return simplify(
            or(transformEager(((Constraint.Junction) c).constraints,
                Constraints::widen)));
      case NOT:
        // Widening under negation would narrow
        return c;
      default:
        return c.copy(Constraints::widen);
    }
  }

  /** Replaces references to a recursive binder. Does not descend into a
   * nested binder of the same name. */
  public static Constraint substituteRecVar(Constraint c, String name,
      Constraint replacement) {
    switch (c.op) {
      case REC_VAR:
        return ((Constraint.RecVar) c).name.equals(name) ? replacement : c;
      case REC:
        if (((Constraint.Rec) c).name.equals(name)) {
          return c;
        }
        // fall through
      default:
        return c.copy(c2 -> substituteRecVar(c2, name, replacement));
    }
  }

  // Extraction

  /** Returns the constraint on a field, or null if the constraint says
   * nothing about the field. */
  public static @Nullable Constraint extractFieldConstraint(Constraint c,
      String name) {
    return extractFieldConstraint(c, name, MAX_UNROLL_DEPTH);
  }

  /** Returns the constraint on a field, unrolling at most
   * {@code maxUnrollDepth} recursive types. */
  public static @Nullable Constraint extractFieldConstraint(Constraint c,
      String name, int maxUnrollDepth) {
    switch (c.op) {
      case HAS_FIELD:
        final Constraint.HasField hasField = (Constraint.HasField) c;
        return hasField.name.equals(name) ? hasField.constraint : null;
      case AND:
        for (Constraint c2 : ((Constraint.Junction) c).constraints) {
          final Constraint f = extractFieldConstraint(c2, name, maxUnrollDepth);
          if (f != null) {
            return f;
          }
        }
        return null;
      case OR:
        final List<Constraint> list = new ArrayList<>();
        for (Constraint c2 : ((Constraint.Junction) c).constraints) {
          final Constraint f = extractFieldConstraint(c2, name, maxUnrollDepth);
          if (f != null) {
            list.add(f);
          }
        }
        return list.isEmpty() ? null : or(list);
      case REC:
        if (maxUnrollDepth <= 0) {
          return null;
        }
        return extractFieldConstraint(((Constraint.Rec) c).unroll(), name,
            maxUnrollDepth - 1);
      default:
        return null;
    }
  }

  /** Returns the names of all fields that a constraint mentions, in order of
   * first appearance. For a disjunction, that is the fields that could
   * exist in any branch. */
  public static Set<String> extractAllFieldNames(Constraint c) {
    final Set<String> names = new LinkedHashSet<>();
    collectFieldNames(c, names);
    return names;
  }

  private static void collectFieldNames(Constraint c, Set<String> names) {
    switch (c.op) {
      case HAS_FIELD:
        names.add(((Constraint.HasField) c).name);
        break;
      case AND:
      case OR:
        for (Constraint c2 : ((Constraint.Junction) c).constraints) {
          collectFieldNames(c2, names);
        }
        break;
      case REC:
        collectFieldNames(((Constraint.Rec) c).body, names);
        break;
      default:
        break;
    }
  }

  /** Returns the constraint on the element at a given position of an array;
   * the {@code elementAt} constraint if present, otherwise the
   * {@code elements} constraint, otherwise {@link #ANY}. */
  public static Constraint extractElementAt(Constraint c, int index) {
    checkArgument(index >= 0);
    final Constraint at = findElementAt(c, index);
    if (at != null) {
      return at;
    }
    final Constraint elements = extractElements(c);
    return elements != null ? elements : ANY;
  }

  private static @Nullable Constraint findElementAt(Constraint c, int index) {
    switch (c.op) {
      case ELEMENT_AT:
        final Constraint.ElementAt elementAt = (Constraint.ElementAt) c;
        return elementAt.index == index ? elementAt.constraint : null;
      case AND:
        for (Constraint c2 : ((Constraint.Junction) c).constraints) {
          final Constraint f = findElementAt(c2, index);
          if (f != null) {
            return f;
          }
        }
        return null;
      default:
        return null;
    }
  }

  /** Returns the constraint on all elements of an array, or null. */
  public static @Nullable Constraint extractElements(Constraint c) {
    return findWrapped(c, Op.ELEMENTS);
  }

  /** Returns the index signature of an object, or null. */
  public static @Nullable Constraint extractIndexSig(Constraint c) {
    return findWrapped(c, Op.INDEX_SIG);
  }

  /** Returns the known length of an array, or null. */
  public static @Nullable Integer extractLength(Constraint c) {
    final Constraint length = findWrapped(c, Op.LENGTH);
    if (length == null) {
      return null;
    }
    final Constraint.Equals equals = extractEquals(length);
    return equals != null && equals.value instanceof Double
        ? ((Double) equals.value).intValue()
        : null;
  }

  /** Returns the {@code equals} constraint that pins a value to a literal,
   * or null. */
  public static Constraint.@Nullable Equals extractEquals(Constraint c) {
    switch (c.op) {
      case EQUALS:
        return (Constraint.Equals) c;
      case AND:
        for (Constraint c2 : ((Constraint.Junction) c).constraints) {
          if (c2.op == Op.EQUALS) {
            return (Constraint.Equals) c2;
          }
        }
        return null;
      default:
        return null;
    }
  }

  private static @Nullable Constraint findWrapped(Constraint c, Op op) {
    if (c.op == op) {
      return ((Constraint.Wrapper) c).constraint;
    }
    if (c.op == Op.AND) {
      for (Constraint c2 : ((Constraint.Junction) c).constraints) {
        if (c2.op == op) {
          return ((Constraint.Wrapper) c2).constraint;
        }
      }
    }
    return null;
  }

  /** Returns whether a constraint contains a classification; for example
   * {@code and(isNumber, gt(0))} contains {@link Op#IS_NUMBER}. */
  public static boolean hasClassification(Constraint c, Op classification) {
    if (c.op == classification) {
      return true;
    }
    if (c.op == Op.AND) {
      for (Constraint c2 : ((Constraint.Junction) c).constraints) {
        if (c2.op == classification) {
          return true;
        }
      }
    }
    return false;
  }
}

// End Constraints.java
