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

import net.hydromatic.tempo.util.TempoException;

/** An error occurred during staging.
 *
 * <p>Base class of the errors that {@link Stager} throws. Errors are not
 * caught within the stager; each aborts the current call to
 * {@link Stager#stage}. */
public class StageException extends RuntimeException
    implements TempoException {
  public StageException(String message) {
    super(message);
  }

  @Override public StringBuilder describeTo(StringBuilder buf) {
    return buf.append("Staging error: ").append(getMessage());
  }
}

// End StageException.java
