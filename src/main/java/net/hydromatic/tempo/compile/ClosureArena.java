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

import java.util.ArrayList;
import java.util.List;
import net.hydromatic.tempo.ast.Ast;
import net.hydromatic.tempo.eval.Value;
import net.hydromatic.tempo.eval.Values;

/** Storage for the closures created during a session.
 *
 * <p>A closure value holds only a handle, an index into this arena; the
 * arena holds the function and the environment that it captured. The arena
 * lives as long as its {@link net.hydromatic.tempo.eval.Session}. */
public class ClosureArena {
  private final List<Entry> entries = new ArrayList<>();

  /** Registers a function and the environment it captures, and returns a
   * closure value. */
  public Value.Closure register(Ast.Fn fn, SEnv env) {
    final int handle = entries.size();
    entries.add(new Entry(fn, env));
    return Values.closure(handle, fn.name);
  }

  /** Returns the entry for a closure. */
  public Entry get(Value.Closure closure) {
    return entries.get(closure.handle);
  }

  /** Returns the number of closures created so far. */
  public int size() {
    return entries.size();
  }

  /** A function and the environment in which it was created. */
  public static class Entry {
    public final Ast.Fn fn;
    public final SEnv env;

    Entry(Ast.Fn fn, SEnv env) {
      this.fn = requireNonNull(fn);
      this.env = requireNonNull(env);
    }
  }
}

// End ClosureArena.java
