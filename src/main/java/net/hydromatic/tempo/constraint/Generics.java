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
import static net.hydromatic.tempo.util.Static.transformEager;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Instantiation of generic function types.
 *
 * <p>For example, given
 *
 * <blockquote><pre>
 * identity: &lt;T&gt;(T) =&gt; T
 * </pre></blockquote>
 *
 * <p>the call {@code identity(5)} has result {@code and(isNumber, equals(5))}.
 * Each type parameter gets a fresh constraint variable; the variables are
 * solved by matching argument constraints against parameter constraints,
 * and the solution is applied to the result.
 */
public class Generics {
  private Generics() {}

  /** Replaces type parameters with constraints. Type parameters bound by a
   * nested generic function type are not replaced. */
  public static Constraint substituteTypeParams(Constraint c,
      Map<Integer, Constraint> subs) {
    switch (c.op) {
      case TYPE_PARAM:
        final Constraint.TypeParam typeParam = (Constraint.TypeParam) c;
        final Constraint replacement = subs.get(typeParam.id);
        return replacement != null ? replacement : c;

      case GENERIC_FN_TYPE:
        final Constraint.GenericFnType g = (Constraint.GenericFnType) c;
        final Map<Integer, Constraint> subs2 = new HashMap<>(subs);
        g.typeParams.forEach(tp -> subs2.remove(tp.id));
        final List<Constraint.TypeParam> typeParams =
            transformEager(g.typeParams,
                tp -> tp.copy(c2 -> substituteTypeParams(c2, subs2)));
        return Constraints.genericFnType(typeParams,
            transformEager(g.params, p -> substituteTypeParams(p, subs2)),
            substituteTypeParams(g.result, subs2));

      default:
        return c.copy(c2 -> substituteTypeParams(c2, subs));
    }
  }

  /** Instantiates a generic function type for a call with arguments of the
   * given constraints. Returns null if the arguments cannot be matched to
   * the parameters. */
  public static @Nullable Instantiation instantiateGenericCall(
      Constraint.GenericFnType fn, List<Constraint> args,
      VarGenerator varGenerator) {
    final Map<Integer, Constraint> typeParamSubs = new HashMap<>();
    for (Constraint.TypeParam typeParam : fn.typeParams) {
      typeParamSubs.put(typeParam.id, varGenerator.get());
    }
    final ImmutableList<Constraint> params =
        transformEager(fn.params, p -> substituteTypeParams(p, typeParamSubs));

    final Map<Integer, Constraint> substitution = new HashMap<>();
    // Extra arguments go to a rest parameter, which we do not check
    final int n = Math.min(args.size(), params.size());
    for (int i = 0; i < n; i++) {
      final Map<Integer, Constraint> sub = solveArg(args.get(i), params.get(i));
      if (sub == null || !merge(substitution, sub)) {
        return null;
      }
    }

    final Constraint result =
        substituteTypeParams(fn.result, typeParamSubs);
    return new Instantiation(substitution,
        Constraints.simplify(Solver.apply(result, substitution)), params);
  }

  private static @Nullable Map<Integer, Constraint> solveArg(Constraint arg,
      Constraint param) {
    Map<Integer, Constraint> sub = Solver.solve(arg, param);
    if (sub != null) {
      return sub;
    }
    sub = Solver.solve(param, arg);
    if (sub != null) {
      return sub;
    }
    if (param.op == Op.OR) {
      // For example, "T | (() => T)" with argument 0
      for (Constraint branch : ((Constraint.Junction) param).constraints) {
        sub = Solver.solve(arg, branch);
        if (sub != null) {
          return sub;
        }
      }
    }
    return null;
  }

  /** Merges bindings into a substitution. Returns false if a variable is
   * already bound to a different constraint. */
  private static boolean merge(Map<Integer, Constraint> substitution,
      Map<Integer, Constraint> sub) {
    for (Map.Entry<Integer, Constraint> entry : sub.entrySet()) {
      final Constraint previous = substitution.get(entry.getKey());
      if (previous != null && !previous.equals(entry.getValue())) {
        return false;
      }
      substitution.put(entry.getKey(), entry.getValue());
    }
    return true;
  }

  /** Returns the result of calling a function of a given constraint, or
   * null if the constraint is not a function type. */
  public static @Nullable Constraint tryInstantiateCall(Constraint fn,
      List<Constraint> args, VarGenerator varGenerator) {
    switch (fn.op) {
      case GENERIC_FN_TYPE:
        final Instantiation instantiation =
            instantiateGenericCall((Constraint.GenericFnType) fn, args,
                varGenerator);
        return instantiation == null ? null : instantiation.result;
      case FN_TYPE:
        return ((Constraint.FnType) fn).result;
      case AND:
        // For example, "and(isFunction, fnType(...))"
        for (Constraint c : ((Constraint.Junction) fn).constraints) {
          final Constraint result = tryInstantiateCall(c, args, varGenerator);
          if (result != null) {
            return result;
          }
        }
        return null;
      default:
        return null;
    }
  }

  /** Returns the result of calling a function of a given constraint;
   * {@code any} if the constraint is not a function type. */
  public static Constraint inferCallResult(Constraint fn,
      List<Constraint> args, VarGenerator varGenerator) {
    final Constraint result = tryInstantiateCall(fn, args, varGenerator);
    return result != null ? result : Constraints.ANY;
  }

  /** Result of instantiating a generic function type. */
  public static class Instantiation {
    /** Maps constraint variable ids to inferred constraints. */
    public final ImmutableMap<Integer, Constraint> substitution;
    public final Constraint result;
    /** Parameter constraints after substitution of type parameters; useful
     * for error messages. */
    public final ImmutableList<Constraint> params;

    Instantiation(Map<Integer, Constraint> substitution, Constraint result,
        List<Constraint> params) {
      this.substitution = ImmutableMap.copyOf(substitution);
      this.result = requireNonNull(result, "result");
      this.params = ImmutableList.copyOf(params);
    }
  }
}

// End Generics.java
