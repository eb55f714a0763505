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

import static net.hydromatic.tempo.constraint.Constraints.simplify;

import com.google.common.collect.ImmutableList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Decides whether one constraint implies another; that is, whether every
 * value that satisfies the first also satisfies the second.
 *
 * <p>Implication is the subtyping relation of the constraint system.
 *
 * <p>Recursive types are handled coinductively. Each pair of constraints
 * where either side is a {@link Op#REC} is recorded in an assumption set that
 * lives for the duration of one top-level call to {@link #implies}; if the
 * same pair is reached again, it is assumed to hold. Otherwise the recursive
 * side is unrolled by one level.
 */
public class Implication {
  private final Set<List<Constraint>> assumptions = new HashSet<>();

  private Implication() {}

  /** Returns whether {@code a} implies {@code b}. */
  public static boolean implies(Constraint a, Constraint b) {
    return new Implication().test(a, b);
  }

  private boolean test(Constraint a, Constraint b) {
    final Constraint sa = simplify(a);
    final Constraint sb = simplify(b);

    if (sa.isNever() || sb.isAny()) {
      return true;
    }
    if (sa.isAny() || sb.isNever()) {
      return false;
    }
    if (sa.equals(sb)) {
      return true;
    }

    if (sa.op == Op.REC || sb.op == Op.REC) {
      return testRec(sa, sb);
    }

    if (sb.op == Op.IS_OBJECT) {
      switch (sa.op) {
        case IS_ARRAY:
        case IS_FUNCTION:
        case FN_TYPE:
        case GENERIC_FN_TYPE:
          return true;
        default:
          break;
      }
    }
    if (sb.op == Op.IS_FUNCTION
        && (sa.op == Op.FN_TYPE || sa.op == Op.GENERIC_FN_TYPE)) {
      return true;
    }

    if (sa.op == Op.EQUALS) {
      final Constraint.Equals equals = (Constraint.Equals) sa;
      if (sb.op.isClassification()) {
        return equals.matches(sb.op);
      }
      if (sb.op.isBound()) {
        return equals.value instanceof Double
            && ((Constraint.Bound) sb).test((Double) equals.value);
      }
    }

    if (sa.op == Op.IS_NULL && sb.op == Op.EQUALS) {
      // null is the only value of its type
      return ((Constraint.Equals) sb).value == null;
    }

    if (sa.op.isBound() && sb.op.isBound()) {
      return boundImplies((Constraint.Bound) sa, (Constraint.Bound) sb);
    }

    if (sa.op == Op.AND) {
      final List<Constraint> conjuncts = ((Constraint.Junction) sa).constraints;
      for (Constraint c : conjuncts) {
        if (test(c, sb)) {
          return true;
        }
      }
      if (sb.op == Op.EQUALS && impliesEquals(conjuncts,
          (Constraint.Equals) sb)) {
        return true;
      }
    }

    if (sa.op == Op.OR) {
      for (Constraint c : ((Constraint.Junction) sa).constraints) {
        if (!test(c, sb)) {
          return false;
        }
      }
      return true;
    }

    if (sb.op == Op.OR) {
      for (Constraint c : ((Constraint.Junction) sb).constraints) {
        if (test(sa, c)) {
          return true;
        }
      }
    }

    if (sb.op == Op.AND) {
      // Each conjunct on the right must be implied by the left
      for (Constraint bc : ((Constraint.Junction) sb).constraints) {
        if (!test(sa, bc)) {
          return false;
        }
      }
      return true;
    }

    if (sa.op != sb.op) {
      return false;
    }
    switch (sa.op) {
      case HAS_FIELD:
        final Constraint.HasField hfa = (Constraint.HasField) sa;
        final Constraint.HasField hfb = (Constraint.HasField) sb;
        return hfa.name.equals(hfb.name)
            && test(hfa.constraint, hfb.constraint);
      case ELEMENT_AT:
        final Constraint.ElementAt eaa = (Constraint.ElementAt) sa;
        final Constraint.ElementAt eab = (Constraint.ElementAt) sb;
        return eaa.index == eab.index && test(eaa.constraint, eab.constraint);
      case ELEMENTS:
      case LENGTH:
      case INDEX_SIG:
      case IS_TYPE:
        return test(((Constraint.Wrapper) sa).constraint,
            ((Constraint.Wrapper) sb).constraint);
      case NOT:
        // not(a) implies not(b) if b implies a
        return test(((Constraint.Wrapper) sb).constraint,
            ((Constraint.Wrapper) sa).constraint);
      case FN_TYPE:
        final Constraint.FnType fa = (Constraint.FnType) sa;
        final Constraint.FnType fb = (Constraint.FnType) sb;
        if (fa.params.size() != fb.params.size()) {
          return false;
        }
        for (int i = 0; i < fa.params.size(); i++) {
          // Parameters are contravariant
          if (!test(fb.params.get(i), fa.params.get(i))) {
            return false;
          }
        }
        return test(fa.result, fb.result);
      default:
        // recVar, typeParam, var: only structural equality, handled above
        return false;
    }
  }

  /** Handles a pair where either side is recursive. */
  private boolean testRec(Constraint sa, Constraint sb) {
    final List<Constraint> key = ImmutableList.of(sa, sb);
    if (!assumptions.add(key)) {
      return true;
    }
    final Constraint a2 =
        sa.op == Op.REC ? ((Constraint.Rec) sa).unroll() : sa;
    final Constraint b2 =
        sb.op == Op.REC ? ((Constraint.Rec) sb).unroll() : sb;
    return test(a2, b2);
  }

  private static boolean boundImplies(Constraint.Bound a, Constraint.Bound b) {
    switch (a.op) {
      case GT:
        return (b.op == Op.GT || b.op == Op.GTE) && a.bound >= b.bound;
      case GTE:
        return b.op == Op.GTE && a.bound >= b.bound
            || b.op == Op.GT && a.bound > b.bound;
      case LT:
        return (b.op == Op.LT || b.op == Op.LTE) && a.bound <= b.bound;
      case LTE:
        return b.op == Op.LTE && a.bound <= b.bound
            || b.op == Op.LT && a.bound < b.bound;
      default:
        throw new AssertionError(a.op);
    }
  }

  /** Returns whether a conjunction that contains {@code gte(n)} and
   * {@code lte(n)} implies {@code equals(n)}. */
  private static boolean impliesEquals(List<Constraint> conjuncts,
      Constraint.Equals equals) {
    if (!(equals.value instanceof Double)) {
      return false;
    }
    final double v = (Double) equals.value;
    boolean gte = false;
    boolean lte = false;
    for (Constraint c : conjuncts) {
      if (c.op == Op.GTE && ((Constraint.Bound) c).bound == v) {
        gte = true;
      }
      if (c.op == Op.LTE && ((Constraint.Bound) c).bound == v) {
        lte = true;
      }
    }
    return gte && lte;
  }
}

// End Implication.java
