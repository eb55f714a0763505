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

/**
 * Generates fresh constraint variables.
 *
 * <p>Each compilation session owns one, so that two sessions compiling the
 * same program allocate identical ids.
 */
public class VarGenerator {
  private int id = 0;

  /** Generates a constraint variable that is unique in this session. */
  public Constraint.Var get() {
    return Constraints.cvar(id++);
  }

  /** Returns the id that the next call to {@link #get()} will use. */
  public int peek() {
    return id;
  }
}

// End VarGenerator.java
