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

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.function.BiConsumer;
import net.hydromatic.tempo.eval.SValue;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Environment for staging; maps names to staged values.
 *
 * <p>Every environment is immutable; when you call {@link #bind}, a new
 * environment is created that inherits from the previous environment. The
 * new environment may obscure bindings in the old environment, but neither
 * the new nor the old will ever change. Closures capture environments, so
 * this matters.
 *
 * <p>To create an empty environment, call {@link SEnvs#empty()}.
 */
public abstract class SEnv {
  /**
   * Visits every binding in this environment.
   *
   * <p>Bindings that are obscured by more recent bindings of the same name
   * are visited, but after the more obscuring bindings.
   */
  abstract void visit(BiConsumer<String, SValue> consumer);

  /** Returns the value bound to {@code name}, or null if not bound. */
  public abstract @Nullable SValue getOpt(String name);

  /** Returns the value bound to {@code name}.
   *
   * @throws UnboundException if not bound */
  public SValue get(String name) {
    final SValue value = getOpt(name);
    if (value == null) {
      throw new UnboundException(name);
    }
    return value;
  }

  /** Returns whether {@code name} is bound. */
  public boolean has(String name) {
    return getOpt(name) != null;
  }

  /**
   * Creates an environment that is the same as this environment, plus one
   * more variable.
   */
  public SEnv bind(String name, SValue value) {
    return new SEnvs.SubSEnv(this, name, value);
  }

  /** Creates an environment that is the same as this, plus the given
   * bindings. */
  public final SEnv bindAll(Map<String, ? extends SValue> bindings) {
    SEnv env = this;
    for (Map.Entry<String, ? extends SValue> e : bindings.entrySet()) {
      env = env.bind(e.getKey(), e.getValue());
    }
    return env;
  }

  /** Calls a consumer for each variable and its value. Does not visit
   * obscured bindings. */
  public void forEachValue(BiConsumer<String, SValue> consumer) {
    final Set<String> names = new HashSet<>();
    visit((name, value) -> {
      if (names.add(name)) {
        consumer.accept(name, value);
      }
    });
  }

  /** Returns a map of the visible bindings, most recent first. */
  public final Map<String, SValue> getValueMap() {
    final Map<String, SValue> valueMap = new LinkedHashMap<>();
    forEachValue(valueMap::put);
    return valueMap;
  }

  /**
   * Converts this environment to a string.
   *
   * <p>This method does not override the {@link #toString()} method; if we
   * did, debuggers would invoke it automatically, burning lots of CPU and
   * memory.
   */
  public String asString() {
    final StringBuilder b = new StringBuilder();
    forEachValue((name, value) ->
        b.append(name).append(": ").append(value).append("\n"));
    return b.toString();
  }
}

// End SEnv.java
