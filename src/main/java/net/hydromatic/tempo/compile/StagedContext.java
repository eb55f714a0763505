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

import java.util.List;
import net.hydromatic.tempo.ast.Ast;
import net.hydromatic.tempo.eval.SValue;
import net.hydromatic.tempo.eval.Session;
import net.hydromatic.tempo.eval.Value;

/** What a staged built-in function can see and do while it is being
 * applied.
 *
 * @see StagedApplicable */
public interface StagedContext {
  /** Returns the session. */
  Session session();

  /** Returns the environment of the call. */
  SEnv env();

  /** Returns the refinements in effect at the call. */
  RefinementContext refinementContext();

  /** Applies a function (closure or built-in) to staged arguments. */
  SValue invoke(SValue fn, List<SValue> args);

  /** Converts a value known at compile time to an expression. */
  Ast.Exp valueToExpr(Value value);

  /** Converts a staged value to an expression for residual code. */
  Ast.Exp residual(SValue value);
}

// End StagedContext.java
