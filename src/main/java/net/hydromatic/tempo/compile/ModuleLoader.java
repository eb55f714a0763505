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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.tempo.constraint.Constraint;

/** Provides the constraints of the names that a module exports.
 *
 * <p>Tempo does not read declaration files itself; the host supplies a
 * loader. See {@link ModuleLoaders} for simple implementations. */
public interface ModuleLoader {
  /** Loads the given exports of a module. Names that the module does not
   * export are absent from the result. */
  Exports loadExportsWithSignatures(String modulePath, List<String> names);

  /** Exports of a module. */
  class Exports {
    /** Constraint of each export. */
    public final ImmutableMap<String, Constraint> constraints;
    /** Signature of each export that is a function. */
    public final ImmutableMap<String, Signature> signatures;

    public Exports(Map<String, Constraint> constraints,
        Map<String, Signature> signatures) {
      this.constraints = ImmutableMap.copyOf(constraints);
      this.signatures = ImmutableMap.copyOf(signatures);
    }
  }

  /** Signature of an exported function. */
  class Signature {
    /** Number of type parameters; positive if the function is generic. */
    public final int typeParamCount;
    public final Constraint constraint;

    public Signature(int typeParamCount, Constraint constraint) {
      this.typeParamCount = typeParamCount;
      this.constraint = requireNonNull(constraint);
    }

    @Override public String toString() {
      return constraint.toString();
    }
  }
}

// End ModuleLoader.java
