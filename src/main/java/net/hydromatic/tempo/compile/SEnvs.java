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

import java.util.function.BiConsumer;
import net.hydromatic.tempo.eval.SValue;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Helpers for {@link SEnv}. */
public abstract class SEnvs {
  private SEnvs() {}

  /** Returns the empty environment. */
  public static SEnv empty() {
    return EmptySEnv.INSTANCE;
  }

  /**
   * Environment that inherits from a parent environment and adds one
   * binding.
   */
  static class SubSEnv extends SEnv {
    private final SEnv parent;
    private final String name;
    private final SValue value;

    SubSEnv(SEnv parent, String name, SValue value) {
      this.parent = requireNonNull(parent);
      this.name = requireNonNull(name);
      this.value = requireNonNull(value);
    }

    @Override public String toString() {
      return name + ", ...";
    }

    @Override public @Nullable SValue getOpt(String name) {
      if (name.equals(this.name)) {
        return value;
      }
      return parent.getOpt(name);
    }

    @Override public SEnv bind(String name, SValue value) {
      SEnv env;
      if (this.name.equals(name)) {
        // The new binding obscures this environment's binding. Bind the
        // parent environment instead, so that chains stay short.
        env = parent;
        while (env instanceof SubSEnv
            && ((SubSEnv) env).name.equals(name)) {
          env = ((SubSEnv) env).parent;
        }
      } else {
        env = this;
      }
      return new SubSEnv(env, name, value);
    }

    @Override void visit(BiConsumer<String, SValue> consumer) {
      consumer.accept(name, value);
      parent.visit(consumer);
    }
  }

  /** Empty environment. */
  private static class EmptySEnv extends SEnv {
    static final EmptySEnv INSTANCE = new EmptySEnv();

    @Override public String toString() {
      return "[]";
    }

    @Override void visit(BiConsumer<String, SValue> consumer) {}

    @Override public @Nullable SValue getOpt(String name) {
      return null;
    }
  }
}

// End SEnvs.java
