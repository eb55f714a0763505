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

import static net.hydromatic.tempo.constraint.Constraints.and;

import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.Map;
import net.hydromatic.tempo.constraint.Constraint;
import org.checkerframework.checker.nullness.qual.Nullable;

/** What control flow has taught us about variables.
 *
 * <p>Inside the "then" branch of {@code if x > 0 then ... else ...}, the
 * context maps "x" to {@code > 0}; inside the "else" branch, to
 * {@code <= 0}. The context is immutable; each branch gets its own. */
public class RefinementContext {
  private static final RefinementContext EMPTY =
      new RefinementContext(ImmutableMap.of());

  private final ImmutableMap<String, Constraint> map;

  private RefinementContext(ImmutableMap<String, Constraint> map) {
    this.map = map;
  }

  /** Returns an empty refinement context. */
  public static RefinementContext empty() {
    return EMPTY;
  }

  @Override public String toString() {
    return map.toString();
  }

  /** Returns the refinement of a variable, or null. */
  public @Nullable Constraint get(String name) {
    return map.get(name);
  }

  /** Returns a context that also knows that variable {@code name} satisfies
   * {@code constraint}. If there is an existing refinement, the new
   * refinement is the conjunction of both. */
  public RefinementContext refine(String name, Constraint constraint) {
    final Constraint existing = map.get(name);
    final Map<String, Constraint> newMap = new LinkedHashMap<>(map);
    newMap.put(name,
        existing == null ? constraint : and(existing, constraint));
    return new RefinementContext(ImmutableMap.copyOf(newMap));
  }

  /** Returns a context with each of a set of refinements applied. */
  public RefinementContext refineAll(Map<String, Constraint> refinements) {
    RefinementContext context = this;
    for (Map.Entry<String, Constraint> e : refinements.entrySet()) {
      context = context.refine(e.getKey(), e.getValue());
    }
    return context;
  }
}

// End RefinementContext.java
