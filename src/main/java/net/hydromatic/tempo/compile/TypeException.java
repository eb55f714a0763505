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

import net.hydromatic.tempo.constraint.Constraint;

/** A value's constraint does not imply the constraint required by the
 * context in which the value is used. */
public class TypeException extends StageException {
  public final Constraint expected;
  public final Constraint actual;
  public final String context;

  public TypeException(Constraint expected, Constraint actual,
      String context) {
    super("Type error in " + context + ": expected " + expected
        + ", got " + actual);
    this.expected = requireNonNull(expected);
    this.actual = requireNonNull(actual);
    this.context = requireNonNull(context);
  }
}

// End TypeException.java
