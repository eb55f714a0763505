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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Solves equations between constraints that contain variables.
 *
 * <p>A substitution maps the id of a {@link Constraint.Var} to the
 * constraint that it stands for. {@link #solve} finds a substitution that
 * makes its first argument match its second; the first argument may have
 * more conjuncts than the second (it is the more specific), but not fewer.
 */
public class Solver {
  private Solver() {}

  /** Applies a substitution to a constraint, replacing bound variables. */
  public static Constraint apply(Constraint c, Map<Integer, Constraint> sub) {
    return apply(c, sub, ImmutableSet.of());
  }

  private static Constraint apply(Constraint c, Map<Integer, Constraint> sub,
      Set<Integer> seen) {
    if (c.op == Op.VAR) {
      final int id = ((Constraint.Var) c).id;
      final Constraint target = sub.get(id);
      if (target == null || seen.contains(id)) {
        // Unbound, or a cycle
        return c;
      }
      final Set<Integer> seen2 =
          ImmutableSet.<Integer>builder().addAll(seen).add(id).build();
      return apply(target, sub, seen2);
    }
    return c.copy(c2 -> apply(c2, sub, seen));
  }

  /** Returns the ids of the variables in a constraint. */
  public static Set<Integer> freeVars(Constraint c) {
    final Set<Integer> vars = new LinkedHashSet<>();
    collectVars(c, vars);
    return vars;
  }

  private static void collectVars(Constraint c, Set<Integer> vars) {
    if (c.op == Op.VAR) {
      vars.add(((Constraint.Var) c).id);
      return;
    }
    c.copy(c2 -> {
      collectVars(c2, vars);
      return c2;
    });
  }

  /** Solves {@code a} against {@code b}, returning a substitution, or null
   * if they are inconsistent. */
  public static @Nullable Map<Integer, Constraint> solve(Constraint a,
      Constraint b) {
    final Map<Integer, Constraint> sub = new HashMap<>();
    return solveInto(a, b, sub) ? sub : null;
  }

  /** Solves {@code a} against {@code b}, adding bindings to {@code sub}.
   * On failure, {@code sub} may contain partial bindings. */
  static boolean solveInto(Constraint a, Constraint b,
      Map<Integer, Constraint> sub) {
    a = apply(a, sub);
    b = apply(b, sub);

    if (a.equals(b)) {
      return true;
    }
    if (a.isAny() || b.isAny()) {
      return true;
    }
    if (a.isNever() || b.isNever()) {
      return false;
    }

    if (a.op == Op.VAR) {
      return bind((Constraint.Var) a, b, sub);
    }
    if (b.op == Op.VAR) {
      return bind((Constraint.Var) b, a, sub);
    }

    if (a.op == b.op) {
      switch (a.op) {
        case IS_NUMBER:
        case IS_STRING:
        case IS_BOOL:
        case IS_NULL:
        case IS_UNDEFINED:
        case IS_OBJECT:
        case IS_ARRAY:
        case IS_FUNCTION:
          return true;

        case EQUALS:
        case GT:
        case GTE:
        case LT:
        case LTE:
        case REC_VAR:
        case GENERIC_FN_TYPE:
          // Not equal, or we would have returned already
          return false;

        case TYPE_PARAM:
          return ((Constraint.TypeParam) a).id == ((Constraint.TypeParam) b).id;

        case HAS_FIELD:
          final Constraint.HasField hfa = (Constraint.HasField) a;
          final Constraint.HasField hfb = (Constraint.HasField) b;
          return hfa.name.equals(hfb.name)
              && solveInto(hfa.constraint, hfb.constraint, sub);

        case ELEMENT_AT:
          final Constraint.ElementAt eaa = (Constraint.ElementAt) a;
          final Constraint.ElementAt eab = (Constraint.ElementAt) b;
          return eaa.index == eab.index
              && solveInto(eaa.constraint, eab.constraint, sub);

        case ELEMENTS:
        case LENGTH:
        case INDEX_SIG:
        case IS_TYPE:
        case NOT:
          return solveInto(((Constraint.Wrapper) a).constraint,
              ((Constraint.Wrapper) b).constraint, sub);

        case REC:
          final Constraint.Rec ra = (Constraint.Rec) a;
          final Constraint.Rec rb = (Constraint.Rec) b;
          return ra.name.equals(rb.name) && solveInto(ra.body, rb.body, sub);

        case FN_TYPE:
          final Constraint.FnType fa = (Constraint.FnType) a;
          final Constraint.FnType fb = (Constraint.FnType) b;
          return solveAll(fa.params, fb.params, sub)
              && solveInto(fa.result, fb.result, sub);

        case AND:
          // Each conjunct of b must match some conjunct of a
          for (Constraint bc : ((Constraint.Junction) b).constraints) {
            if (!solveAny(((Constraint.Junction) a).constraints, bc, sub)) {
              return false;
            }
          }
          return true;

        case OR:
          return solveAll(((Constraint.Junction) a).constraints,
              ((Constraint.Junction) b).constraints, sub);

        default:
          throw new AssertionError(a.op);
      }
    }

    if (a.op == Op.AND) {
      return solveAny(((Constraint.Junction) a).constraints, b, sub);
    }
    return false;
  }

  private static boolean bind(Constraint.Var v, Constraint c,
      Map<Integer, Constraint> sub) {
    if (freeVars(c).contains(v.id)) {
      // Occurs check; the solution would be an infinite type
      return false;
    }
    sub.put(v.id, c);
    return true;
  }

  /** Solves each element of {@code as} against the corresponding element of
   * {@code bs}. */
  private static boolean solveAll(List<Constraint> as, List<Constraint> bs,
      Map<Integer, Constraint> sub) {
    if (as.size() != bs.size()) {
      return false;
    }
    for (int i = 0; i < as.size(); i++) {
      if (!solveInto(as.get(i), bs.get(i), sub)) {
        return false;
      }
    }
    return true;
  }

  /** Finds the first of {@code as} that solves against {@code b}, and commits
   * its bindings. */
  private static boolean solveAny(List<Constraint> as, Constraint b,
      Map<Integer, Constraint> sub) {
    for (Constraint a : as) {
      final Map<Integer, Constraint> tempSub = new HashMap<>(sub);
      if (solveInto(a, b, tempSub)) {
        sub.putAll(tempSub);
        return true;
      }
    }
    return false;
  }

  /** Generalizes a constraint over the variables that are not free in the
   * environment. */
  public static Scheme generalize(Constraint c, Set<Integer> envVars) {
    final Set<Integer> quantified = new LinkedHashSet<>();
    for (Integer id : freeVars(c)) {
      if (!envVars.contains(id)) {
        quantified.add(id);
      }
    }
    return new Scheme(quantified, c);
  }

  /** Instantiates a scheme, replacing each quantified variable with a fresh
   * one. */
  public static Constraint instantiate(Scheme scheme,
      VarGenerator varGenerator) {
    if (scheme.quantified.isEmpty()) {
      return scheme.constraint;
    }
    final Map<Integer, Constraint> sub = new HashMap<>();
    for (int id : scheme.quantified) {
      sub.put(id, varGenerator.get());
    }
    return apply(scheme.constraint, sub);
  }

  /** Constraint with universally quantified variables. Used for
   * let-polymorphism. */
  public static class Scheme {
    public final ImmutableSet<Integer> quantified;
    public final Constraint constraint;

    Scheme(Set<Integer> quantified, Constraint constraint) {
      this.quantified = ImmutableSet.copyOf(quantified);
      this.constraint = requireNonNull(constraint, "constraint");
    }

    @Override
    public String toString() {
      return quantified.isEmpty()
          ? constraint.toString()
          : "forall " + quantified + ". " + constraint;
    }
  }

  /** Returns the variables of an environment's constraints. */
  public static Set<Integer> freeVars(Iterable<Constraint> constraints) {
    final Set<Integer> vars = new HashSet<>();
    for (Constraint c : constraints) {
      collectVars(c, vars);
    }
    return vars;
  }
}

// End Solver.java
