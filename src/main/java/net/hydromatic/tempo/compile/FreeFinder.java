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

import com.google.common.collect.ImmutableSet;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.function.Consumer;
import net.hydromatic.tempo.ast.Ast;
import net.hydromatic.tempo.ast.AstBuilder;
import net.hydromatic.tempo.ast.Visitor;

/** Finds free variables in an expression.
 *
 * <p>A variable is free if it is not bound by an enclosing {@code let},
 * pattern, function or {@code import} within the expression. */
public class FreeFinder extends Visitor {
  private final ImmutableSet<String> bound;
  private final Consumer<String> consumer;

  private FreeFinder(ImmutableSet<String> bound, Consumer<String> consumer) {
    this.bound = bound;
    this.consumer = consumer;
  }

  /** Returns the free variables of an expression, in order of first
   * occurrence. */
  public static Set<String> freeVars(Ast.Exp exp) {
    final Set<String> names = new LinkedHashSet<>();
    exp.accept(new FreeFinder(ImmutableSet.of(), names::add));
    return names;
  }

  /** Returns whether {@code name} occurs free in an expression. */
  public static boolean usesVar(Ast.Exp exp, String name) {
    return freeVars(exp).contains(name);
  }

  /** Returns a finder in which some more names are bound. */
  private FreeFinder push(Iterable<String> names) {
    return new FreeFinder(
        ImmutableSet.<String>builder().addAll(bound).addAll(names).build(),
        consumer);
  }

  @Override protected void visit(Ast.Id id) {
    if (!bound.contains(id.name)) {
      consumer.accept(id.name);
    }
  }

  @Override protected void visit(Ast.Let let) {
    let.exp.accept(this);
    let.body.accept(push(ImmutableSet.of(let.name)));
  }

  @Override protected void visit(Ast.LetPattern letPattern) {
    letPattern.exp.accept(this);
    letPattern.body.accept(push(letPattern.pat.vars()));
  }

  @Override protected void visit(Ast.Fn fn) {
    final ImmutableSet.Builder<String> names = ImmutableSet.builder();
    if (fn.isDesugared()) {
      names.add(AstBuilder.ARGS);
    }
    names.addAll(fn.params);
    if (fn.name != null) {
      names.add(fn.name);
    }
    fn.body.accept(push(names.build()));
  }

  @Override protected void visit(Ast.Import anImport) {
    anImport.body.accept(push(anImport.names));
  }
}

// End FreeFinder.java
