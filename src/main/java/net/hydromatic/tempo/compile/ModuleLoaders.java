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

import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.Map;
import net.hydromatic.tempo.constraint.Constraint;

/** Implementations of {@link ModuleLoader}. */
public abstract class ModuleLoaders {
  private ModuleLoaders() {}

  /** Returns a loader that knows no modules. */
  public static ModuleLoader empty() {
    return of(ImmutableMap.of());
  }

  /** Returns a loader whose modules are given by a map from module path to
   * the constraints of its exports.
   *
   * <p>A constraint that is a generic function type, such as
   * {@code <T>(T) => T}, also gives the export a signature. */
  public static ModuleLoader of(
      Map<String, ? extends Map<String, Constraint>> modules) {
    final ImmutableMap<String, Map<String, Constraint>> map =
        ImmutableMap.copyOf(modules);
    return (modulePath, names) -> {
      final Map<String, Constraint> exports =
          map.getOrDefault(modulePath, ImmutableMap.of());
      final Map<String, Constraint> constraints = new LinkedHashMap<>();
      final Map<String, ModuleLoader.Signature> signatures =
          new LinkedHashMap<>();
      for (String name : names) {
        final Constraint c = exports.get(name);
        if (c == null) {
          continue;
        }
        constraints.put(name, c);
        switch (c.op) {
          case GENERIC_FN_TYPE:
            signatures.put(name,
                new ModuleLoader.Signature(
                    ((Constraint.GenericFnType) c).typeParams.size(), c));
            break;
          case FN_TYPE:
            signatures.put(name, new ModuleLoader.Signature(0, c));
            break;
          default:
            break;
        }
      }
      return new ModuleLoader.Exports(constraints, signatures);
    };
  }

  /** Convenience method that creates a loader for a single module. */
  public static ModuleLoader of(String modulePath,
      Map<String, Constraint> exports) {
    return of(ImmutableMap.of(modulePath, exports));
  }
}

// End ModuleLoaders.java
