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

import java.util.function.Consumer;
import net.hydromatic.tempo.ast.Ast;
import net.hydromatic.tempo.eval.SValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Utilities for {@link Tracer}. */
public abstract class Tracers {
  private Tracers() {}

  /** Returns a tracer that does nothing. */
  public static Tracer empty() {
    return EmptyTracer.INSTANCE;
  }

  /** Returns a tracer that writes each event to the log, at debug
   * level. */
  public static Tracer logging() {
    return LoggingTracer.INSTANCE;
  }

  /** Returns a tracer that performs the given action on the result of
   * staging, then calls the underlying tracer. */
  public static Tracer withOnResult(Tracer tracer,
      Consumer<SValue> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onResult(SValue result) {
        consumer.accept(result);
        super.onResult(result);
      }
    };
  }

  /** Returns a tracer that performs the given action when a recursive call
   * is cut off, then calls the underlying tracer. */
  public static Tracer withOnRecursionCut(Tracer tracer,
      Consumer<String> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onRecursionCut(String name) {
        consumer.accept(name);
        super.onRecursionCut(name);
      }
    };
  }

  /** Returns a tracer that performs the given action when a closure is
   * converted to residual code, then calls the underlying tracer. */
  public static Tracer withOnClosureStaged(Tracer tracer,
      Consumer<String> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onClosureStaged(String name) {
        consumer.accept(name);
        super.onClosureStaged(name);
      }
    };
  }

  public static Tracer withOnException(Tracer tracer,
      Consumer<StageException> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onException(StageException e) {
        consumer.accept(e);
        super.onException(e);
      }
    };
  }

  /** Tracer that does nothing. */
  private static class EmptyTracer implements Tracer {
    static final Tracer INSTANCE = new EmptyTracer();

    @Override public void onStage(Ast.Exp exp) {
    }

    @Override public void onResult(SValue result) {
    }

    @Override public void onRecursionCut(String name) {
    }

    @Override public void onClosureStaged(String name) {
    }

    @Override public void onException(StageException e) {
    }
  }

  /** Tracer that writes to the log. */
  private static class LoggingTracer implements Tracer {
    static final Tracer INSTANCE = new LoggingTracer();

    private static final Logger LOG =
        LoggerFactory.getLogger(LoggingTracer.class);

    @Override public void onStage(Ast.Exp exp) {
      LOG.debug("stage {}", exp);
    }

    @Override public void onResult(SValue result) {
      LOG.debug("result {}", result);
    }

    @Override public void onRecursionCut(String name) {
      LOG.debug("recursion cut at {}", name);
    }

    @Override public void onClosureStaged(String name) {
      LOG.debug("closure {} staged", name);
    }

    @Override public void onException(StageException e) {
      LOG.debug("staging failed", e);
    }
  }

  /** Tracer that delegates to an underlying tracer. */
  private static class DelegatingTracer implements Tracer {
    final Tracer tracer;

    DelegatingTracer(Tracer tracer) {
      this.tracer = tracer;
    }

    @Override public void onStage(Ast.Exp exp) {
      tracer.onStage(exp);
    }

    @Override public void onResult(SValue result) {
      tracer.onResult(result);
    }

    @Override public void onRecursionCut(String name) {
      tracer.onRecursionCut(name);
    }

    @Override public void onClosureStaged(String name) {
      tracer.onClosureStaged(name);
    }

    @Override public void onException(StageException e) {
      tracer.onException(e);
    }
  }
}

// End Tracers.java
