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
package net.hydromatic.tempo.js;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import java.util.List;

/** Path from the root of a {@link Js.Node} tree to one of its
 * descendants.
 *
 * <p>Each segment is either a {@link String} (the name of a child, such as
 * "left" or "cond") or an {@link Integer} (an index into a list of
 * children, such as the arguments of a call). For example, the path of
 * {@code 2} in {@code f(1, 2)} is "args.1". */
public class JsPath {
  /** The empty path, which addresses the root. */
  public static final JsPath ROOT = new JsPath(ImmutableList.of());

  public final ImmutableList<Object> segments;

  private JsPath(ImmutableList<Object> segments) {
    this.segments = segments;
  }

  /** Creates a path from a list of segments. */
  public static JsPath of(Object... segments) {
    return of(ImmutableList.copyOf(segments));
  }

  /** Creates a path from a list of segments. */
  public static JsPath of(List<?> segments) {
    for (Object segment : segments) {
      checkArgument(segment instanceof String || segment instanceof Integer,
          "bad segment %s", segment);
    }
    return segments.isEmpty() ? ROOT
        : new JsPath(ImmutableList.copyOf(segments));
  }

  /** Returns a path that is this path followed by another. */
  public JsPath plus(JsPath path) {
    if (path.segments.isEmpty()) {
      return this;
    }
    if (segments.isEmpty()) {
      return path;
    }
    return new JsPath(ImmutableList.builder()
        .addAll(segments).addAll(path.segments).build());
  }

  /** Returns whether this path starts with the given path. */
  public boolean startsWith(JsPath prefix) {
    return segments.size() >= prefix.segments.size()
        && segments.subList(0, prefix.segments.size())
            .equals(prefix.segments);
  }

  /** Returns this path without its first {@code n} segments. */
  public JsPath skip(int n) {
    return of(segments.subList(n, segments.size()));
  }

  public int size() {
    return segments.size();
  }

  @Override public int hashCode() {
    return segments.hashCode();
  }

  @Override public boolean equals(Object o) {
    return o == this
        || o instanceof JsPath
        && segments.equals(((JsPath) o).segments);
  }

  /** Returns the segments separated by ".", for example "args.1"; the
   * root path is "". */
  @Override public String toString() {
    final StringBuilder buf = new StringBuilder();
    for (Object segment : segments) {
      if (buf.length() > 0) {
        buf.append('.');
      }
      buf.append(segment);
    }
    return buf.toString();
  }
}

// End JsPath.java
