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

import static java.util.Objects.requireNonNull;
import static net.hydromatic.tempo.util.Static.appendLiteral;
import static net.hydromatic.tempo.util.Static.appendQuoted;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Various sub-classes of AST nodes. */
public class Ast {
  private Ast() {}

  /** Appends a list of nodes, separated by a string. */
  static StringBuilder appendAll(StringBuilder buf, String sep,
      List<? extends AstNode> nodes) {
    for (int i = 0; i < nodes.size(); i++) {
      if (i > 0) {
        buf.append(sep);
      }
      nodes.get(i).unparse(buf);
    }
    return buf;
  }

  /** Base class for a pattern.
   *
   * <p>For example, "x" in "let x = 5 in x + 1" is a pattern, as is
   * "[a, b]" in "let [a, b] = args in a + b". */
  public abstract static class Pat extends AstNode {
    Pat(Op op) {
      super(op);
    }

    /** Returns the names of the variables bound by this pattern, in
     * order. */
    public final ImmutableList<String> vars() {
      final ImmutableList.Builder<String> names = ImmutableList.builder();
      addVars(names);
      return names.build();
    }

    abstract void addVars(ImmutableList.Builder<String> names);
  }

  /** Named pattern, the pattern analog of an {@link Id} expression. */
  public static class IdPat extends Pat {
    public final String name;

    IdPat(String name) {
      super(Op.ID_PAT);
      this.name = requireNonNull(name);
    }

    @Override public int hashCode() {
      return name.hashCode();
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof IdPat
          && name.equals(((IdPat) o).name);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override void addVars(ImmutableList.Builder<String> names) {
      names.add(name);
    }

    @Override StringBuilder unparse(StringBuilder buf) {
      return buf.append(name);
    }
  }

  /** Array pattern, for example "[a, b]". */
  public static class ArrayPat extends Pat {
    public final ImmutableList<Pat> args;

    ArrayPat(ImmutableList<Pat> args) {
      super(Op.ARRAY_PAT);
      this.args = requireNonNull(args);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override void addVars(ImmutableList.Builder<String> names) {
      args.forEach(arg -> arg.addVars(names));
    }

    @Override StringBuilder unparse(StringBuilder buf) {
      return appendAll(buf.append('['), ", ", args).append(']');
    }
  }

  /** Record pattern, for example "{ a, b: [c, d] }". */
  public static class RecordPat extends Pat {
    public final ImmutableMap<String, Pat> args;

    RecordPat(ImmutableMap<String, Pat> args) {
      super(Op.RECORD_PAT);
      this.args = requireNonNull(args);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override void addVars(ImmutableList.Builder<String> names) {
      args.values().forEach(arg -> arg.addVars(names));
    }

    @Override StringBuilder unparse(StringBuilder buf) {
      buf.append("{ ");
      int i = 0;
      for (ImmutableMap.Entry<String, Pat> entry : args.entrySet()) {
        if (i++ > 0) {
          buf.append(", ");
        }
        buf.append(entry.getKey());
        final Pat pat = entry.getValue();
        if (!(pat instanceof IdPat)
            || !((IdPat) pat).name.equals(entry.getKey())) {
          pat.unparse(buf.append(": "));
        }
      }
      return buf.append(" }");
    }
  }

  /** Base class of expression ASTs. */
  public abstract static class Exp extends AstNode {
    Exp(Op op) {
      super(op);
    }
  }

  /** Parse tree node of a literal (constant).
   *
   * <p>The value is a {@link Double}, {@link String}, {@link Boolean}, or
   * null. */
  public static class Literal extends Exp {
    public final @Nullable Object value;

    Literal(@Nullable Object value) {
      super(Op.LITERAL);
      this.value = value;
    }

    @Override public int hashCode() {
      return Objects.hashCode(value);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Literal
          && Objects.equals(value, ((Literal) o).value);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override StringBuilder unparse(StringBuilder buf) {
      return appendLiteral(buf, value);
    }
  }

  /** Parse tree node of an identifier. */
  public static class Id extends Exp {
    public final String name;

    Id(String name) {
      super(Op.ID);
      this.name = requireNonNull(name);
    }

    @Override public int hashCode() {
      return name.hashCode();
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Id
          && name.equals(((Id) o).name);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override StringBuilder unparse(StringBuilder buf) {
      return buf.append(name);
    }
  }

  /** Call to an infix operator, for example "x + 1". */
  public static class InfixCall extends Exp {
    public final Exp a0;
    public final Exp a1;

    InfixCall(Op op, Exp a0, Exp a1) {
      super(op);
      this.a0 = requireNonNull(a0);
      this.a1 = requireNonNull(a1);
      assert op.isBinary() : op;
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override StringBuilder unparse(StringBuilder buf) {
      a0.unparse(buf.append('('));
      buf.append(' ').append(op.symbol).append(' ');
      return a1.unparse(buf).append(')');
    }
  }

  /** Call to a prefix operator, for example "-x" or "!b". */
  public static class PrefixCall extends Exp {
    public final Exp a;

    PrefixCall(Op op, Exp a) {
      super(op);
      this.a = requireNonNull(a);
      assert op.isUnary() : op;
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override StringBuilder unparse(StringBuilder buf) {
      return a.unparse(buf.append(op.symbol));
    }
  }

  /** "If ... then ... else" expression. */
  public static class If extends Exp {
    public final Exp condition;
    public final Exp ifTrue;
    public final Exp ifFalse;

    If(Exp condition, Exp ifTrue, Exp ifFalse) {
      super(Op.IF);
      this.condition = requireNonNull(condition);
      this.ifTrue = requireNonNull(ifTrue);
      this.ifFalse = requireNonNull(ifFalse);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override StringBuilder unparse(StringBuilder buf) {
      condition.unparse(buf.append("if "));
      ifTrue.unparse(buf.append(" then "));
      return ifFalse.unparse(buf.append(" else "));
    }
  }

  /** "Let" expression that binds a single name. */
  public static class Let extends Exp {
    public final String name;
    public final Exp exp;
    public final Exp body;

    Let(String name, Exp exp, Exp body) {
      super(Op.LET);
      this.name = requireNonNull(name);
      this.exp = requireNonNull(exp);
      this.body = requireNonNull(body);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override StringBuilder unparse(StringBuilder buf) {
      exp.unparse(buf.append("let ").append(name).append(" = "));
      return body.unparse(buf.append(" in "));
    }
  }

  /** "Let" expression that destructures a value with a pattern. */
  public static class LetPattern extends Exp {
    public final Pat pat;
    public final Exp exp;
    public final Exp body;

    LetPattern(Pat pat, Exp exp, Exp body) {
      super(Op.LET_PATTERN);
      this.pat = requireNonNull(pat);
      this.exp = requireNonNull(exp);
      this.body = requireNonNull(body);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override StringBuilder unparse(StringBuilder buf) {
      pat.unparse(buf.append("let "));
      exp.unparse(buf.append(" = "));
      return body.unparse(buf.append(" in "));
    }
  }

  /** Lambda expression, "fn(a, b) => body", or, if it has a name, a
   * recursive function "fn f(a, b) => body".
   *
   * <p>A function created by {@link AstBuilder#fn} or
   * {@link AstBuilder#recFn} receives its arguments as an array called
   * "args", and its body starts by destructuring that array into the
   * parameters. A function created for residual code binds its parameters
   * directly. */
  public static class Fn extends Exp {
    public final @Nullable String name;
    public final ImmutableList<String> params;
    public final Exp body;

    Fn(Op op, @Nullable String name, ImmutableList<String> params,
        Exp body) {
      super(op);
      this.name = name;
      this.params = requireNonNull(params);
      this.body = requireNonNull(body);
      assert (op == Op.REC_FN) == (name != null) : op;
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    /** Returns whether the body destructures "args" into the
     * parameters. */
    public boolean isDesugared() {
      if (!(body instanceof LetPattern)) {
        return false;
      }
      final LetPattern letPattern = (LetPattern) body;
      return letPattern.exp.equals(new Id(AstBuilder.ARGS))
          && letPattern.pat instanceof ArrayPat
          && letPattern.pat.vars().equals(params);
    }

    /** Returns the body as the user wrote it, without the destructuring
     * of "args". */
    public Exp innerBody() {
      return isDesugared() ? ((LetPattern) body).body : body;
    }

    @Override StringBuilder unparse(StringBuilder buf) {
      buf.append("fn");
      if (name != null) {
        buf.append(' ').append(name);
      }
      buf.append('(').append(String.join(", ", params)).append(") => ");
      return innerBody().unparse(buf);
    }
  }

  /** Application of a function to arguments, "f(a, b)". */
  public static class Apply extends Exp {
    public final Exp fn;
    public final ImmutableList<Exp> args;

    Apply(Exp fn, ImmutableList<Exp> args) {
      super(Op.APPLY);
      this.fn = requireNonNull(fn);
      this.args = requireNonNull(args);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override StringBuilder unparse(StringBuilder buf) {
      fn.unparse(buf);
      return appendAll(buf.append('('), ", ", args).append(')');
    }
  }

  /** Call to a method, "receiver.method(a, b)". */
  public static class MethodCall extends Exp {
    public final Exp receiver;
    public final String method;
    public final ImmutableList<Exp> args;

    MethodCall(Exp receiver, String method, ImmutableList<Exp> args) {
      super(Op.METHOD_CALL);
      this.receiver = requireNonNull(receiver);
      this.method = requireNonNull(method);
      this.args = requireNonNull(args);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override StringBuilder unparse(StringBuilder buf) {
      receiver.unparse(buf).append('.').append(method).append('(');
      return appendAll(buf, ", ", args).append(')');
    }
  }

  /** Record (object) constructor, "{ a: 1, b: y }". Field order is
   * preserved. */
  public static class Record extends Exp {
    public final ImmutableMap<String, Exp> args;

    Record(ImmutableMap<String, Exp> args) {
      super(Op.RECORD);
      this.args = requireNonNull(args);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override StringBuilder unparse(StringBuilder buf) {
      if (args.isEmpty()) {
        return buf.append("{}");
      }
      buf.append("{ ");
      int i = 0;
      for (ImmutableMap.Entry<String, Exp> entry : args.entrySet()) {
        if (i++ > 0) {
          buf.append(", ");
        }
        entry.getValue().unparse(buf.append(entry.getKey()).append(": "));
      }
      return buf.append(" }");
    }
  }

  /** Access to a field of a record, "o.f". */
  public static class Field extends Exp {
    public final Exp exp;
    public final String name;

    Field(Exp exp, String name) {
      super(Op.FIELD);
      this.exp = requireNonNull(exp);
      this.name = requireNonNull(name);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override StringBuilder unparse(StringBuilder buf) {
      return exp.unparse(buf).append('.').append(name);
    }
  }

  /** Array constructor, "[a, b]". */
  public static class Array extends Exp {
    public final ImmutableList<Exp> args;

    Array(ImmutableList<Exp> args) {
      super(Op.ARRAY);
      this.args = requireNonNull(args);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override StringBuilder unparse(StringBuilder buf) {
      return appendAll(buf.append('['), ", ", args).append(']');
    }
  }

  /** Access to an element of an array, "a[i]". */
  public static class Index extends Exp {
    public final Exp exp;
    public final Exp index;

    Index(Exp exp, Exp index) {
      super(Op.INDEX);
      this.exp = requireNonNull(exp);
      this.index = requireNonNull(index);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override StringBuilder unparse(StringBuilder buf) {
      exp.unparse(buf);
      return index.unparse(buf.append('[')).append(']');
    }
  }

  /** Sequence of expressions, "{ a; b }"; its value is the value of the
   * last. */
  public static class Block extends Exp {
    public final ImmutableList<Exp> exps;

    Block(ImmutableList<Exp> exps) {
      super(Op.BLOCK);
      this.exps = requireNonNull(exps);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override StringBuilder unparse(StringBuilder buf) {
      return appendAll(buf.append("{ "), "; ", exps).append(" }");
    }
  }

  /** Expression that must be evaluated at compile time, "comptime(e)". */
  public static class Comptime extends Exp {
    public final Exp exp;

    Comptime(Exp exp) {
      super(Op.COMPTIME);
      this.exp = requireNonNull(exp);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override StringBuilder unparse(StringBuilder buf) {
      return exp.unparse(buf.append("comptime(")).append(')');
    }
  }

  /** Expression whose value is only known at run time,
   * "runtime(name: e)". The expression gives the constraint. */
  public static class Runtime extends Exp {
    public final Exp exp;
    public final @Nullable String name;

    Runtime(Exp exp, @Nullable String name) {
      super(Op.RUNTIME);
      this.exp = requireNonNull(exp);
      this.name = name;
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override StringBuilder unparse(StringBuilder buf) {
      buf.append("runtime(");
      if (name != null) {
        buf.append(name).append(": ");
      }
      return exp.unparse(buf).append(')');
    }
  }

  /** Assertion that a value satisfies a type, "assert(e, T)". */
  public static class Assert extends Exp {
    public final Exp exp;
    public final Exp constraint;
    public final @Nullable String message;

    Assert(Exp exp, Exp constraint, @Nullable String message) {
      super(Op.ASSERT);
      this.exp = requireNonNull(exp);
      this.constraint = requireNonNull(constraint);
      this.message = message;
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override StringBuilder unparse(StringBuilder buf) {
      exp.unparse(buf.append("assert("));
      constraint.unparse(buf.append(", "));
      if (message != null) {
        appendQuoted(buf.append(", "), message);
      }
      return buf.append(')');
    }
  }

  /** Assertion that a condition holds, "assert(c)". */
  public static class AssertCond extends Exp {
    public final Exp condition;
    public final @Nullable String message;

    AssertCond(Exp condition, @Nullable String message) {
      super(Op.ASSERT_COND);
      this.condition = requireNonNull(condition);
      this.message = message;
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override StringBuilder unparse(StringBuilder buf) {
      condition.unparse(buf.append("assert("));
      if (message != null) {
        appendQuoted(buf.append(", "), message);
      }
      return buf.append(')');
    }
  }

  /** Unchecked type refinement, "trust(e, T)". */
  public static class Trust extends Exp {
    public final Exp exp;
    public final @Nullable Exp constraint;

    Trust(Exp exp, @Nullable Exp constraint) {
      super(Op.TRUST);
      this.exp = requireNonNull(exp);
      this.constraint = constraint;
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override StringBuilder unparse(StringBuilder buf) {
      exp.unparse(buf.append("trust("));
      if (constraint != null) {
        constraint.unparse(buf.append(", "));
      }
      return buf.append(')');
    }
  }

  /** Reification of the constraint of an expression, "typeOf(e)". */
  public static class TypeOf extends Exp {
    public final Exp exp;

    TypeOf(Exp exp) {
      super(Op.TYPE_OF);
      this.exp = requireNonNull(exp);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override StringBuilder unparse(StringBuilder buf) {
      return exp.unparse(buf.append("typeOf(")).append(')');
    }
  }

  /** Import of names from a module,
   * "import { a, b } from "m" in body". */
  public static class Import extends Exp {
    public final ImmutableList<String> names;
    public final String modulePath;
    public final Exp body;

    Import(ImmutableList<String> names, String modulePath, Exp body) {
      super(Op.IMPORT);
      this.names = requireNonNull(names);
      this.modulePath = requireNonNull(modulePath);
      this.body = requireNonNull(body);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override StringBuilder unparse(StringBuilder buf) {
      buf.append("import { ").append(String.join(", ", names))
          .append(" } from ");
      appendQuoted(buf, modulePath);
      return body.unparse(buf.append(" in "));
    }
  }
}

// End Ast.java
