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
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import net.hydromatic.tempo.js.Js;
import net.hydromatic.tempo.js.JsBuilder;
import net.hydromatic.tempo.js.JsOp;
import net.hydromatic.tempo.js.JsPath;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Groups trees that are identical except for the values of some
 * literals, so that each group can share one parameterized function.
 *
 * <p>For example, {@code x === null ? 0 : x} and
 * {@code x === null ? "" : x} form one cluster whose template is
 * {@code x === null ? _p0 : x}, called with arguments {@code 0} and
 * {@code ""}. Trees whose structure differs, such as {@code x * 2} and
 * {@code x + x}, never share a cluster.
 *
 * <p>The algorithms use only the generic view of a tree, that is
 * {@link Js.Node#shape()} and {@link Js.Node#children()}. */
public class Clusterer {
  private static final Logger LOG = LoggerFactory.getLogger(Clusterer.class);

  /** Default prefix of parameter names. */
  public static final String DEFAULT_PARAM_PREFIX = "_p";

  private final String paramPrefix;

  public Clusterer(String paramPrefix) {
    this.paramPrefix = requireNonNull(paramPrefix);
  }

  /** Creates a clusterer whose parameters are called "_p0", "_p1",
   * etc. */
  public static Clusterer create() {
    return new Clusterer(DEFAULT_PARAM_PREFIX);
  }

  /** Returns a fingerprint of the structure of a tree. Every literal
   * prints as "L", so trees that differ only in literal values have the
   * same signature. */
  public static String signature(Js.Node node) {
    return appendSignature(new StringBuilder(), node).toString();
  }

  private static StringBuilder appendSignature(StringBuilder buf,
      Js.Node node) {
    buf.append(node.shape());
    final List<Js.Child> children = node.children();
    if (!children.isEmpty()) {
      buf.append('[');
      for (int i = 0; i < children.size(); i++) {
        if (i > 0) {
          buf.append(',');
        }
        appendSignature(buf, children.get(i).node);
      }
      buf.append(']');
    }
    return buf;
  }

  /** Compares two trees.
   *
   * <p>Returns null if their structure differs: a different kind,
   * operator, name, parameter list, set of keys or number of children.
   * Otherwise returns the paths, relative to the root, of the literals
   * whose values differ; an empty list if the trees are identical. */
  public static @Nullable ImmutableList<JsPath> compare(Js.Node a,
      Js.Node b) {
    final ImmutableList.Builder<JsPath> paths = ImmutableList.builder();
    return compare(a, b, JsPath.ROOT, paths) ? paths.build() : null;
  }

  private static boolean compare(Js.Node a, Js.Node b, JsPath path,
      ImmutableList.Builder<JsPath> paths) {
    if (a.op != b.op) {
      return false;
    }
    if (a.op == JsOp.LIT) {
      if (!Objects.equals(((Js.Lit) a).value, ((Js.Lit) b).value)) {
        paths.add(path);
      }
      return true;
    }
    if (!a.shape().equals(b.shape())) {
      return false;
    }
    final List<Js.Child> aChildren = a.children();
    final List<Js.Child> bChildren = b.children();
    if (aChildren.size() != bChildren.size()) {
      return false;
    }
    for (int i = 0; i < aChildren.size(); i++) {
      final Js.Child aChild = aChildren.get(i);
      final Js.Child bChild = bChildren.get(i);
      if (!aChild.path.equals(bChild.path)
          || !compare(aChild.node, bChild.node, path.plus(aChild.path),
              paths)) {
        return false;
      }
    }
    return true;
  }

  /** Partitions trees into clusters.
   *
   * <p>A tree joins the first cluster whose signature matches and whose
   * first member it {@link #compare compares} successfully with;
   * otherwise it starts a new cluster. Clusters, and the members of each,
   * are in the order that the trees are given. */
  public <T> ImmutableList<Cluster<T>> cluster(
      List<Cluster.Member<T>> members) {
    final List<Group<T>> groups = new ArrayList<>();
    for (Cluster.Member<T> member : members) {
      final String signature = signature(member.tree);
      Group<T> group = null;
      for (Group<T> g : groups) {
        if (!g.signature.equals(signature)) {
          continue;
        }
        final List<JsPath> diff = compare(member.tree, g.first().tree);
        if (diff != null) {
          g.holes.addAll(diff);
          group = g;
          break;
        }
      }
      if (group == null) {
        group = new Group<>(signature);
        groups.add(group);
      }
      group.members.add(member);
    }

    final ImmutableList.Builder<Cluster<T>> clusters =
        ImmutableList.builder();
    for (Group<T> group : groups) {
      clusters.add(group.toCluster(paramPrefix));
    }
    final ImmutableList<Cluster<T>> list = clusters.build();
    if (LOG.isDebugEnabled()) {
      LOG.debug("clustered {} trees into {} clusters: {}", members.size(),
          list.size(), list);
    }
    return list;
  }

  /** Returns the value of the literal at each hole of a tree. */
  public static List<@Nullable Object> holeValues(Js.Node tree,
      List<JsPath> holes) {
    final List<@Nullable Object> values = new ArrayList<>();
    for (JsPath hole : holes) {
      values.add(literalAt(tree, hole));
    }
    return values;
  }

  /** Returns the arguments with which a member of a cluster calls the
   * cluster's shared function; one value per parameter. */
  public static <T> List<@Nullable Object> parameterValues(
      Cluster.Member<T> member, Cluster<T> cluster) {
    final List<@Nullable Object> holeValues =
        holeValues(member.tree, cluster.holes);
    final @Nullable Object[] values = new Object[cluster.parameterCount];
    for (int i = 0; i < holeValues.size(); i++) {
      values[cluster.parameterMapping.get(i)] = holeValues.get(i);
    }
    return Arrays.asList(values);
  }

  /** Replaces the literal at each hole with a reference to the hole's
   * parameter. */
  public static Js.Node applyTemplate(Js.Node tree, List<JsPath> holes,
      List<Integer> parameterMapping, List<String> paramNames) {
    final Map<JsPath, String> pathToParam = new HashMap<>();
    for (int i = 0; i < holes.size(); i++) {
      pathToParam.put(holes.get(i),
          paramNames.get(parameterMapping.get(i)));
    }
    return replaceHoles(tree, JsPath.ROOT, pathToParam);
  }

  private static Js.Node replaceHoles(Js.Node node, JsPath path,
      Map<JsPath, String> pathToParam) {
    final String paramName = pathToParam.get(path);
    if (paramName != null && node.op == JsOp.LIT) {
      return JsBuilder.js.var(paramName);
    }
    final List<Js.Child> children = node.children();
    if (children.isEmpty()) {
      return node;
    }
    final List<Js.Node> newChildren = new ArrayList<>();
    boolean changed = false;
    for (Js.Child child : children) {
      final Js.Node newChild =
          replaceHoles(child.node, path.plus(child.path), pathToParam);
      changed |= newChild != child.node;
      newChildren.add(newChild);
    }
    return changed ? node.copy(newChildren) : node;
  }

  private static @Nullable Object literalAt(Js.Node tree, JsPath path) {
    final Js.@Nullable Node node = tree.get(path);
    if (!(node instanceof Js.Lit)) {
      throw new IllegalStateException("Expected literal at path " + path
          + ", got " + (node == null ? null : node.op));
    }
    return ((Js.Lit) node).value;
  }

  /** Cluster under construction. */
  private static class Group<T> {
    final String signature;
    final List<Cluster.Member<T>> members = new ArrayList<>();
    final Set<JsPath> holes = new LinkedHashSet<>();

    Group(String signature) {
      this.signature = signature;
    }

    Cluster.Member<T> first() {
      return members.get(0);
    }

    /** Assigns a parameter to each hole. Holes whose values are equal in
     * every member share a parameter; parameters are numbered in order of
     * their first hole. */
    Cluster<T> toCluster(String paramPrefix) {
      final ImmutableList<JsPath> holeList = ImmutableList.copyOf(holes);
      final Map<List<@Nullable Object>, Integer> parameters =
          new HashMap<>();
      final ImmutableList.Builder<Integer> mapping = ImmutableList.builder();
      final List<List<@Nullable Object>> valuesByMember = new ArrayList<>();
      for (Cluster.Member<T> member : members) {
        valuesByMember.add(holeValues(member.tree, holeList));
      }
      for (int i = 0; i < holeList.size(); i++) {
        final List<@Nullable Object> tuple = new ArrayList<>();
        for (List<@Nullable Object> values : valuesByMember) {
          tuple.add(values.get(i));
        }
        Integer parameter = parameters.get(tuple);
        if (parameter == null) {
          parameter = parameters.size();
          parameters.put(tuple, parameter);
        }
        mapping.add(parameter);
      }
      return new Cluster<>(ImmutableList.copyOf(members), signature,
          holeList, mapping.build(), parameters.size(), paramPrefix);
    }
  }
}

// End Clusterer.java
