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

import net.hydromatic.tempo.ast.Ast;
import net.hydromatic.tempo.eval.SValue;

/** Called on various events during staging. */
public interface Tracer {
  /** Called when staging of a top-level expression starts. */
  void onStage(Ast.Exp exp);

  /** Called with the result of staging a top-level expression. */
  void onResult(SValue result);

  /** Called when a recursive call is left in residual code rather than
   * staged again. */
  void onRecursionCut(String name);

  /** Called when the body of a closure is staged to make residual code. */
  void onClosureStaged(String name);

  /** Called with an exception thrown during staging, before it reaches the
   * caller. */
  void onException(StageException e);
}

// End Tracer.java
