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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

/** Tests for {@link Prop}. */
public class PropTest {
  @Test void testLookup() {
    assertThat(Prop.lookup("maxUnrollDepth"), is(Prop.MAX_UNROLL_DEPTH));
    assertThat(Prop.lookup("MAX_UNROLL_DEPTH"), is(Prop.MAX_UNROLL_DEPTH));
    final IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class, () ->
            Prop.lookup("nonExistent"));
    assertThat(e.getMessage(), is("property nonExistent not found"));
  }

  @Test void testSortedByCamelName() {
    assertThat(Prop.BY_CAMEL_NAME.get(0), is(Prop.CLUSTER_PARAM_PREFIX));
    assertThat(Prop.BY_CAMEL_NAME.size(), is(Prop.values().length));
  }

  @Test void testDefaults() {
    final Map<Prop, Object> map = new HashMap<>();
    assertThat(Prop.COMPTIME_PRINT.booleanValue(map), is(true));
    assertThat(Prop.FRESH_PREFIX.stringValue(map), is("_tmp"));
    assertThat(Prop.CLUSTER_PARAM_PREFIX.stringValue(map), is("_p"));
    assertThat(Prop.MAX_UNROLL_DEPTH.intValue(map), is(64));
  }

  @Test void testSet() {
    final Map<Prop, Object> map = new HashMap<>();
    Prop.MAX_UNROLL_DEPTH.set(map, 3);
    assertThat(Prop.MAX_UNROLL_DEPTH.intValue(map), is(3));
    assertThat(Prop.MAX_UNROLL_DEPTH.remove(map), is(3));
    assertThat(Prop.MAX_UNROLL_DEPTH.remove(map), nullValue());
    assertThat(Prop.MAX_UNROLL_DEPTH.intValue(map), is(64));

    final IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class, () ->
            Prop.MAX_UNROLL_DEPTH.set(map, "three"));
    assertThat(e.getMessage(),
        is("value for property maxUnrollDepth must have type Integer"));

    final IllegalArgumentException e2 =
        assertThrows(IllegalArgumentException.class, () ->
            Prop.FRESH_PREFIX.set(map, null));
    assertThat(e2.getMessage(), is("property freshPrefix is required"));

    // Asking for the wrong type is an error
    assertThrows(IllegalArgumentException.class, () ->
        Prop.MAX_UNROLL_DEPTH.stringValue(map));
  }
}

// End PropTest.java
