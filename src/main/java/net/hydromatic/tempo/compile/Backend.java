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

import net.hydromatic.tempo.eval.SValue;

/** Generates target code from staged values.
 *
 * <p>A backend is an interpreter over {@link SValue}s. It can inspect
 * constraints, and can stage further expressions through the
 * {@link BackendContext}, in order to make target-specific decisions.
 *
 * @param <T> Type of generated code */
public interface Backend<T> {
  /** Returns the name of this backend, for example "javascript". */
  String name();

  /** Generates code for a staged value. */
  T generate(SValue sv, BackendContext<T> cx);
}

// End Backend.java
