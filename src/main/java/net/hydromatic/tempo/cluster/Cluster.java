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
package net.hydromatic.tempo.cluster;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.tempo.js.Js;
import net.hydromatic.tempo.js.JsPath;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Group of trees that differ only in the values of some literals, and so
 * can share one function that takes those values as parameters.
 *
 * <p>The {@link #holes} are the paths of the literals that vary. Holes
 * whose values are equal in every member share a parameter;
 * {@link #parameterMapping} gives the parameter of each hole.
 *
 * @param <T> Type of member identifier */
public class Cluster<T> {
  public final ImmutableList<Member<T>> members;
  public final String signature;
  public final ImmutableList<JsPath> holes;
  /** For each hole, the ordinal of its parameter. */
  public final ImmutableList<Integer> parameterMapping;
  public final int parameterCount;
  private final String paramPrefix;

  Cluster(ImmutableList<Member<T>> members, String signature,
      ImmutableList<JsPath> holes, ImmutableList<Integer> parameterMapping,
      int parameterCount, String paramPrefix) {
    this.members = requireNonNull(members);
    this.signature = requireNonNull(signature);
    this.holes = requireNonNull(holes);
    this.parameterMapping = requireNonNull(parameterMapping);
    this.parameterCount = parameterCount;
    this.paramPrefix = requireNonNull(paramPrefix);
  }

  @Override public String toString() {
    return "Cluster{members=" + members.size() + ", holes=" + holes
        + ", parameterMapping=" + parameterMapping + "}";
  }

  /** Returns the names of the parameters, for example "_p0", "_p1". */
  public ImmutableList<String> paramNames() {
    final ImmutableList.Builder<String> names = ImmutableList.builder();
    for (int i = 0; i < parameterCount; i++) {
      names.add(paramPrefix + i);
    }
    return names.build();
  }

  /** Returns the shared body: the first member's tree with a reference to
   * a parameter in place of each hole. */
  public Js.Node template() {
    return Clusterer.applyTemplate(members.get(0).tree, holes,
        parameterMapping, paramNames());
  }

  /** Returns the arguments with which a member calls the shared body,
   * one per parameter. */
  public List<@Nullable Object> parameterValues(Member<T> member) {
    return Clusterer.parameterValues(member, this);
  }

  /** Tree to be clustered, and an identifier supplied by the caller.
   *
   * @param <T> Type of identifier */
  public static class Member<T> {
    public final T id;
    public final Js.Node tree;

    public Member(T id, Js.Node tree) {
      this.id = requireNonNull(id);
      this.tree = requireNonNull(tree);
    }

    @Override public String toString() {
      return id + ": " + tree;
    }
  }
}

// End Cluster.java
