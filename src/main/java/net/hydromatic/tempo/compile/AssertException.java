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

import net.hydromatic.tempo.constraint.Constraint;
import net.hydromatic.tempo.eval.Value;
import org.checkerframework.checker.nullness.qual.Nullable;

/** An assertion failed at compile time. */
public class AssertException extends StageException {
  /** The value that failed; null if a condition failed. */
  public final @Nullable Value value;
  /** The constraint that the value did not satisfy; null if a condition
   * failed. */
  public final @Nullable Constraint constraint;

  public AssertException(String message, @Nullable Value value,
      @Nullable Constraint constraint) {
    super(message);
    this.value = value;
    this.constraint = constraint;
  }
}

// End AssertException.java
