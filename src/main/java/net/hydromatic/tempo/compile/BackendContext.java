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
import net.hydromatic.tempo.eval.Value;

/** What a {@link Backend} can see and do while generating code.
 *
 * <p>Created by {@link Stager#backendContext(Backend)}.
 *
 * @param <T> Type of generated code */
public interface BackendContext<T> {
  /** Stages an expression in this context's environment. */
  SValue stage(Ast.Exp exp);

  /** Stages an expression in a given environment. */
  SValue stage(Ast.Exp exp, SEnv env);

  /** Returns the environment. */
  SEnv env();

  /** Converts a staged value to an expression that computes it. */
  Ast.Exp svalueToResidual(SValue sv);

  /** Converts a closure to a function expression, staging its body with
   * its parameters unknown. */
  Ast.Fn closureToResidual(Value closure);

  /** Generates code for a staged value, by calling back into the
   * backend. */
  T generate(SValue sv);

  /** Stages an expression, then generates code for it. */
  T generateExpr(Ast.Exp exp);
}

// End BackendContext.java
