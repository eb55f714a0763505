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
package net.hydromatic.tempo.eval;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.hydromatic.tempo.cluster.Clusterer;
import net.hydromatic.tempo.compile.ClosureArena;
import net.hydromatic.tempo.compile.ModuleLoader;
import net.hydromatic.tempo.compile.Tracer;
import net.hydromatic.tempo.compile.Tracers;
import net.hydromatic.tempo.constraint.Constraint;
import net.hydromatic.tempo.constraint.VarGenerator;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Session.
 *
 * <p>Holds all of the mutable state of one compilation: counters, caches,
 * the closure arena, and the functions whose bodies are being staged. Two
 * compilations in fresh sessions produce the same names and the same
 * residual code. To reset, create a new session. */
public class Session {
  private static final Logger LOG = LoggerFactory.getLogger(Session.class);

  /** Property values. */
  public final Map<Prop, Object> map;
  /** Lines written by {@code print} at compile time. */
  public final List<String> out = new ArrayList<>();
  /** Generator of constraint variables. */
  public final VarGenerator varGenerator = new VarGenerator();
  /** Closures created during this session. */
  public final ClosureArena closures = new ClosureArena();
  /** Receives staging events. */
  public Tracer tracer = Tracers.empty();

  /** Constraints of module exports, keyed by "path:name". */
  private final Map<String, Constraint> exportCache = new HashMap<>();
  /** Signatures of module exports, keyed by "path:name". */
  private final Map<String, ModuleLoader.Signature> signatureCache =
      new HashMap<>();
  /** Exports that a module does not have, keyed by "path:name". */
  private final Set<String> missingExports = new HashSet<>();
  /** Names of recursive functions whose bodies are being staged. */
  private final Set<String> inProgress = new LinkedHashSet<>();
  private int nameCounter;

  /** Creates a Session with default property values. */
  public Session() {
    this(new LinkedHashMap<>());
  }

  /** Creates a Session.
   *
   * <p>The {@code map} parameter, that becomes the property map, is used as
   * is, not copied.
   *
   * @param map Map that contains property values */
  public Session(Map<Prop, Object> map) {
    this.map = requireNonNull(map);
  }

  /** Returns a name that has not been used before in this session, using
   * the default prefix. */
  public String fresh() {
    return fresh(Prop.FRESH_PREFIX.stringValue(map));
  }

  /** Returns a name that has not been used before in this session, for
   * example "rt0". */
  public String fresh(String prefix) {
    return prefix + nameCounter++;
  }

  /** Returns a clusterer whose parameter names start with the value of
   * property {@link Prop#CLUSTER_PARAM_PREFIX}. */
  public Clusterer clusterer() {
    return new Clusterer(Prop.CLUSTER_PARAM_PREFIX.stringValue(map));
  }

  /** Returns whether the body of the function called {@code name} is being
   * staged. */
  public boolean isInProgress(String name) {
    return inProgress.contains(name);
  }

  /** Marks that we have started staging the body of the function called
   * {@code name}. Returns false if we had already started. */
  public boolean enter(String name) {
    return inProgress.add(name);
  }

  /** Marks that we have finished staging the body of a function. */
  public void exit(String name) {
    inProgress.remove(name);
  }

  /** Returns the constraint of a module's export, loading the module if
   * necessary; null if the module has no such export. */
  public @Nullable Constraint exportConstraint(ModuleLoader loader,
      String modulePath, String name) {
    final String key = modulePath + ":" + name;
    if (!exportCache.containsKey(key) && !missingExports.contains(key)) {
      final ModuleLoader.Exports exports =
          loader.loadExportsWithSignatures(modulePath, ImmutableList.of(name));
      LOG.debug("loaded {} from module {}: {}", name, modulePath,
          exports.constraints.keySet());
      exports.constraints.forEach((n, c) ->
          exportCache.put(modulePath + ":" + n, c));
      exports.signatures.forEach((n, s) ->
          signatureCache.put(modulePath + ":" + n, s));
      if (!exportCache.containsKey(key)) {
        missingExports.add(key);
      }
    }
    return exportCache.get(key);
  }

  /** Returns the signature of a module's export, or null. Call
   * {@link #exportConstraint} first. */
  public ModuleLoader.@Nullable Signature exportSignature(String modulePath,
      String name) {
    return signatureCache.get(modulePath + ":" + name);
  }
}

// End Session.java
