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
package net.hydromatic.tempo.ast;

/** Visits syntax trees.
 *
 * <p>Each method visits the children of its node; sub-classes override the
 * methods for the nodes they are interested in. */
public class Visitor {

  /** For use as a method reference. */
  protected <E extends AstNode> void accept(E e) {
    e.accept(this);
  }

  // atoms

  protected void visit(Ast.Literal literal) {}

  protected void visit(Ast.Id id) {}

  // operators

  protected void visit(Ast.InfixCall infixCall) {
    infixCall.a0.accept(this);
    infixCall.a1.accept(this);
  }

  protected void visit(Ast.PrefixCall prefixCall) {
    prefixCall.a.accept(this);
  }

  // control

  protected void visit(Ast.If anIf) {
    anIf.condition.accept(this);
    anIf.ifTrue.accept(this);
    anIf.ifFalse.accept(this);
  }

  protected void visit(Ast.Let let) {
    let.exp.accept(this);
    let.body.accept(this);
  }

  protected void visit(Ast.LetPattern letPattern) {
    letPattern.pat.accept(this);
    letPattern.exp.accept(this);
    letPattern.body.accept(this);
  }

  protected void visit(Ast.Block block) {
    block.exps.forEach(this::accept);
  }

  // functions

  protected void visit(Ast.Fn fn) {
    fn.body.accept(this);
  }

  protected void visit(Ast.Apply apply) {
    apply.fn.accept(this);
    apply.args.forEach(this::accept);
  }

  protected void visit(Ast.MethodCall methodCall) {
    methodCall.receiver.accept(this);
    methodCall.args.forEach(this::accept);
  }

  // value constructors and accessors

  protected void visit(Ast.Record record) {
    record.args.values().forEach(this::accept);
  }

  protected void visit(Ast.Field field) {
    field.exp.accept(this);
  }

  protected void visit(Ast.Array array) {
    array.args.forEach(this::accept);
  }

  protected void visit(Ast.Index index) {
    index.exp.accept(this);
    index.index.accept(this);
  }

  // staging annotations

  protected void visit(Ast.Comptime comptime) {
    comptime.exp.accept(this);
  }

  protected void visit(Ast.Runtime runtime) {
    runtime.exp.accept(this);
  }

  protected void visit(Ast.Assert anAssert) {
    anAssert.exp.accept(this);
    anAssert.constraint.accept(this);
  }

  protected void visit(Ast.AssertCond assertCond) {
    assertCond.condition.accept(this);
  }

  protected void visit(Ast.Trust trust) {
    trust.exp.accept(this);
    if (trust.constraint != null) {
      trust.constraint.accept(this);
    }
  }

  protected void visit(Ast.TypeOf typeOf) {
    typeOf.exp.accept(this);
  }

  protected void visit(Ast.Import anImport) {
    anImport.body.accept(this);
  }

  // patterns

  protected void visit(Ast.IdPat idPat) {}

  protected void visit(Ast.ArrayPat arrayPat) {
    arrayPat.args.forEach(this::accept);
  }

  protected void visit(Ast.RecordPat recordPat) {
    recordPat.args.values().forEach(this::accept);
  }
}

// End Visitor.java
