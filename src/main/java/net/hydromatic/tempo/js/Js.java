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
import static java.util.Objects.requireNonNull;
import static net.hydromatic.tempo.util.Static.appendQuoted;
import static net.hydromatic.tempo.util.Static.numberToString;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import org.checkerframework.checker.nullness.qual.Nullable;

/** JavaScript syntax trees.
 *
 * <p>Every node has a <em>shape</em> (its kind and those attributes that
 * are not child nodes, such as an operator or a variable name) and a list
 * of {@link Child children}, each addressed by a relative
 * {@link JsPath}. Code that only needs the structure of a tree, such as
 * {@link net.hydromatic.tempo.cluster.Clusterer}, uses this generic view
 * and does not need to know about individual kinds.
 *
 * <p>{@link Node#toString()} prints JavaScript source. */
public class Js {
  private Js() {}

  /** Words that cannot be used as identifiers. */
  static final ImmutableSet<String> RESERVED_WORDS =
      ImmutableSet.of("break", "case", "catch", "continue", "debugger",
          "default", "delete", "do", "else", "finally", "for", "function",
          "if", "in", "instanceof", "new", "return", "switch", "this",
          "throw", "try", "typeof", "var", "void", "while", "with", "class",
          "const", "enum", "export", "extends", "import", "super",
          "implements", "interface", "let", "package", "private",
          "protected", "public", "static", "yield", "await", "null", "true",
          "false");

  private static final Pattern IDENTIFIER =
      Pattern.compile("[a-zA-Z_$][a-zA-Z0-9_$]*");

  /** Binding strength of binary operators; higher binds tighter. */
  static final ImmutableMap<String, Integer> PRECEDENCE =
      ImmutableMap.<String, Integer>builder()
          .put("||", 1)
          .put("&&", 2)
          .put("==", 3).put("!=", 3).put("===", 3).put("!==", 3)
          .put("<", 4).put(">", 4).put("<=", 4).put(">=", 4)
          .put("+", 5).put("-", 5)
          .put("*", 6).put("/", 6).put("%", 6)
          .build();

  /** Converts a name to a valid JavaScript identifier. A reserved word
   * gets a "_" prefix, as does a name with invalid characters, which
   * become "_". */
  static String identifier(String name) {
    if (RESERVED_WORDS.contains(name)) {
      return "_" + name;
    }
    if (IDENTIFIER.matcher(name).matches()) {
      return name;
    }
    return "_" + name.replaceAll("[^a-zA-Z0-9_$]", "_");
  }

  static boolean isValidPropertyName(String name) {
    return IDENTIFIER.matcher(name).matches()
        && !RESERVED_WORDS.contains(name);
  }

  static int precedence(String op) {
    final Integer p = PRECEDENCE.get(op);
    return p == null ? 0 : p;
  }

  static StringBuilder indent(StringBuilder buf, int depth) {
    for (int i = 0; i < depth; i++) {
      buf.append("  ");
    }
    return buf;
  }

  /** Appends a list of statements, one per line, each indented. */
  static StringBuilder appendStmts(StringBuilder buf, int depth,
      List<Stmt> stmts) {
    for (int i = 0; i < stmts.size(); i++) {
      if (i > 0) {
        buf.append('\n');
      }
      stmts.get(i).unparse(buf, depth);
    }
    return buf;
  }

  /** Appends a block "{ ... }" whose statements are indented one level
   * deeper than {@code depth}. */
  static StringBuilder appendBlock(StringBuilder buf, int depth,
      List<Stmt> stmts) {
    appendStmts(buf.append("{\n"), depth + 1, stmts);
    return indent(buf.append('\n'), depth).append('}');
  }

  static StringBuilder appendArgs(StringBuilder buf, int depth,
      List<Exp> args) {
    buf.append('(');
    for (int i = 0; i < args.size(); i++) {
      if (i > 0) {
        buf.append(", ");
      }
      args.get(i).unparse(buf, depth);
    }
    return buf.append(')');
  }

  /** Appends items on one line if they fit, otherwise one per line. */
  static StringBuilder appendWrapped(StringBuilder buf, int depth,
      String open, String close, List<String> items) {
    final String singleLine =
        open + String.join(", ", items) + close;
    if (singleLine.length() <= 60) {
      return buf.append(singleLine);
    }
    buf.append(open.trim()).append('\n');
    for (int i = 0; i < items.size(); i++) {
      if (i > 0) {
        buf.append(",\n");
      }
      indent(buf, depth + 1).append(items.get(i));
    }
    return indent(buf.append('\n'), depth).append(close.trim());
  }

  /** Wraps an expression in parentheses if it is an operator, a
   * conditional or a function, so that it can be followed by ".", "[" or
   * "(". */
  static StringBuilder appendOperand(StringBuilder buf, int depth, Exp e) {
    switch (e.op) {
      case BINOP:
      case UNARY:
      case TERNARY:
      case ARROW:
      case NAMED_FUNCTION:
        return e.unparse(buf.append('('), depth).append(')');
      default:
        return e.unparse(buf, depth);
    }
  }

  static Exp exp(Node node) {
    return (Exp) node;
  }

  static ImmutableList<Exp> exps(List<Node> nodes) {
    final ImmutableList.Builder<Exp> b = ImmutableList.builder();
    nodes.forEach(node -> b.add((Exp) node));
    return b.build();
  }

  static ImmutableList<Stmt> stmts(List<Node> nodes) {
    final ImmutableList.Builder<Stmt> b = ImmutableList.builder();
    nodes.forEach(node -> b.add((Stmt) node));
    return b.build();
  }

  /** Adds one child per element of a list, with paths
   * "{@code name}.0", "{@code name}.1", and so on. */
  static void addAll(ImmutableList.Builder<Child> b, String name,
      List<? extends Node> nodes) {
    for (int i = 0; i < nodes.size(); i++) {
      b.add(new Child(JsPath.of(name, i), nodes.get(i)));
    }
  }

  /** Child of a node, and its path relative to that node. */
  public static class Child {
    public final JsPath path;
    public final Node node;

    Child(JsPath path, Node node) {
      this.path = requireNonNull(path);
      this.node = requireNonNull(node);
    }

    static Child of(String name, Node node) {
      return new Child(JsPath.of(name), node);
    }

    @Override public String toString() {
      return path + "=" + node;
    }
  }

  /** Base class of all JavaScript syntax tree nodes. */
  public abstract static class Node {
    public final JsOp op;

    Node(JsOp op) {
      this.op = requireNonNull(op);
    }

    /** Returns the kind of this node and its attributes that are not
     * children. Two nodes with the same shape have the same kind, and
     * their children, if they have the same number, have the same
     * paths. */
    public String shape() {
      return op.tag;
    }

    /** Returns the children of this node. */
    public ImmutableList<Child> children() {
      return ImmutableList.of();
    }

    /** Returns a node of the same shape with different children, which
     * must be in the same order as {@link #children()}. */
    public Node copy(List<Node> children) {
      checkArgument(children.isEmpty(), "%s has no children", op);
      return this;
    }

    /** Returns the descendant at a given path, or null if there is no
     * such descendant. */
    public @Nullable Node get(JsPath path) {
      if (path.size() == 0) {
        return this;
      }
      for (Child child : children()) {
        if (path.startsWith(child.path)) {
          return child.node.get(path.skip(child.path.size()));
        }
      }
      return null;
    }

    /** Converts this node to JavaScript source. */
    @Override public final String toString() {
      return unparse(new StringBuilder(), 0).toString();
    }

    /** Appends this node as JavaScript source. Nested blocks are indented
     * relative to {@code depth}; a statement starts with its own
     * indentation. */
    abstract StringBuilder unparse(StringBuilder buf, int depth);
  }

  /** Base class of expressions. */
  public abstract static class Exp extends Node {
    Exp(JsOp op) {
      super(op);
      assert op.isExp() : op;
    }
  }

  /** Base class of statements. */
  public abstract static class Stmt extends Node {
    Stmt(JsOp op) {
      super(op);
      assert !op.isExp() && !op.isPattern() : op;
    }
  }

  /** Base class of destructuring patterns. A pattern has no children;
   * its shape is its source text. */
  public abstract static class Pat extends Node {
    Pat(JsOp op) {
      super(op);
      assert op.isPattern() : op;
    }

    @Override public String shape() {
      return op.tag + "(" + this + ")";
    }
  }

  /** Literal: a {@link Double}, {@link String}, {@link Boolean} or
   * null. */
  public static class Lit extends Exp {
    public final @Nullable Object value;

    Lit(@Nullable Object value) {
      super(JsOp.LIT);
      this.value = value;
    }

    @Override StringBuilder unparse(StringBuilder buf, int depth) {
      if (value instanceof String) {
        return appendQuoted(buf, (String) value);
      }
      if (value instanceof Double) {
        final double d = (Double) value;
        if (d == 0 && 1 / d < 0) {
          return buf.append("-0");
        }
        return buf.append(numberToString(d));
      }
      return buf.append(value);
    }
  }

  /** Reference to a variable. */
  public static class Var extends Exp {
    public final String name;

    Var(String name) {
      super(JsOp.VAR);
      this.name = requireNonNull(name);
    }

    @Override public String shape() {
      return op.tag + "(" + name + ")";
    }

    @Override StringBuilder unparse(StringBuilder buf, int depth) {
      return buf.append(identifier(name));
    }
  }

  /** Binary operator, "left op right". */
  public static class Binop extends Exp {
    public final String operator;
    public final Exp left;
    public final Exp right;

    Binop(String operator, Exp left, Exp right) {
      super(JsOp.BINOP);
      this.operator = requireNonNull(operator);
      this.left = requireNonNull(left);
      this.right = requireNonNull(right);
    }

    @Override public String shape() {
      return op.tag + "(" + operator + ")";
    }

    @Override public ImmutableList<Child> children() {
      return ImmutableList.of(Child.of("left", left),
          Child.of("right", right));
    }

    @Override public Binop copy(List<Node> children) {
      return new Binop(operator, exp(children.get(0)),
          exp(children.get(1)));
    }

    @Override StringBuilder unparse(StringBuilder buf, int depth) {
      appendSide(buf, depth, left, false).append(' ').append(operator)
          .append(' ');
      return appendSide(buf, depth, right, true);
    }

    private StringBuilder appendSide(StringBuilder buf, int depth, Exp e,
        boolean isRight) {
      if (e instanceof Binop) {
        final int child = precedence(((Binop) e).operator);
        final int parent = precedence(operator);
        if (child < parent || child == parent && isRight) {
          return e.unparse(buf.append('('), depth).append(')');
        }
      }
      return e.unparse(buf, depth);
    }
  }

  /** Unary operator, "op operand". */
  public static class Unary extends Exp {
    public final String operator;
    public final Exp operand;

    Unary(String operator, Exp operand) {
      super(JsOp.UNARY);
      this.operator = requireNonNull(operator);
      this.operand = requireNonNull(operand);
    }

    @Override public String shape() {
      return op.tag + "(" + operator + ")";
    }

    @Override public ImmutableList<Child> children() {
      return ImmutableList.of(Child.of("operand", operand));
    }

    @Override public Unary copy(List<Node> children) {
      return new Unary(operator, exp(children.get(0)));
    }

    @Override StringBuilder unparse(StringBuilder buf, int depth) {
      buf.append(operator);
      if (operand.op == JsOp.BINOP || operand.op == JsOp.UNARY) {
        return operand.unparse(buf.append('('), depth).append(')');
      }
      return operand.unparse(buf, depth);
    }
  }

  /** Function call, "func(args)". */
  public static class Call extends Exp {
    public final Exp func;
    public final ImmutableList<Exp> args;

    Call(Exp func, ImmutableList<Exp> args) {
      super(JsOp.CALL);
      this.func = requireNonNull(func);
      this.args = requireNonNull(args);
    }

    @Override public ImmutableList<Child> children() {
      final ImmutableList.Builder<Child> b = ImmutableList.builder();
      b.add(Child.of("func", func));
      addAll(b, "args", args);
      return b.build();
    }

    @Override public Call copy(List<Node> children) {
      return new Call(exp(children.get(0)),
          exps(children.subList(1, children.size())));
    }

    @Override StringBuilder unparse(StringBuilder buf, int depth) {
      if (func.op == JsOp.ARROW || func.op == JsOp.NAMED_FUNCTION) {
        func.unparse(buf.append('('), depth).append(')');
      } else {
        func.unparse(buf, depth);
      }
      return appendArgs(buf, depth, args);
    }
  }

  /** Method call, "obj.method(args)". */
  public static class Method extends Exp {
    public final Exp obj;
    public final String method;
    public final ImmutableList<Exp> args;

    Method(Exp obj, String method, ImmutableList<Exp> args) {
      super(JsOp.METHOD);
      this.obj = requireNonNull(obj);
      this.method = requireNonNull(method);
      this.args = requireNonNull(args);
    }

    @Override public String shape() {
      return op.tag + "(" + method + ")";
    }

    @Override public ImmutableList<Child> children() {
      final ImmutableList.Builder<Child> b = ImmutableList.builder();
      b.add(Child.of("obj", obj));
      addAll(b, "args", args);
      return b.build();
    }

    @Override public Method copy(List<Node> children) {
      return new Method(exp(children.get(0)), method,
          exps(children.subList(1, children.size())));
    }

    @Override StringBuilder unparse(StringBuilder buf, int depth) {
      appendOperand(buf, depth, obj).append('.').append(method);
      return appendArgs(buf, depth, args);
    }
  }

  /** Function expression. Its body is either an expression or a list of
   * statements; the children are at "body" or at "body.0", "body.1",
   * and so on. */
  public abstract static class FunctionExp extends Exp {
    public final ImmutableList<String> params;
    /** Body, if it is an expression; null if the body is
     * {@link #stmts}. */
    public final @Nullable Exp body;
    public final ImmutableList<Stmt> stmts;

    FunctionExp(JsOp op, ImmutableList<String> params, @Nullable Exp body,
        ImmutableList<Stmt> stmts) {
      super(op);
      this.params = requireNonNull(params);
      this.body = body;
      this.stmts = requireNonNull(stmts);
      checkArgument(body == null || stmts.isEmpty(),
          "body must be an expression or statements, not both");
    }

    /** Returns the parameters and the kind of body, for example
     * "(x,y){}" for a function with a statement body. */
    String paramShape() {
      return "(" + String.join(",", params) + ")"
          + (body == null ? "{}" : "");
    }

    @Override public ImmutableList<Child> children() {
      if (body != null) {
        return ImmutableList.of(Child.of("body", body));
      }
      final ImmutableList.Builder<Child> b = ImmutableList.builder();
      addAll(b, "body", stmts);
      return b.build();
    }

    StringBuilder appendParams(StringBuilder buf) {
      buf.append('(');
      for (int i = 0; i < params.size(); i++) {
        if (i > 0) {
          buf.append(", ");
        }
        buf.append(identifier(params.get(i)));
      }
      return buf.append(')');
    }
  }

  /** Arrow function, "(params) =&gt; body". */
  public static class Arrow extends FunctionExp {
    Arrow(ImmutableList<String> params, @Nullable Exp body,
        ImmutableList<Stmt> stmts) {
      super(JsOp.ARROW, params, body, stmts);
    }

    @Override public String shape() {
      return op.tag + paramShape();
    }

    @Override public Arrow copy(List<Node> children) {
      return body != null
          ? new Arrow(params, exp(children.get(0)), ImmutableList.of())
          : new Arrow(params, null, stmts(children));
    }

    @Override StringBuilder unparse(StringBuilder buf, int depth) {
      appendParams(buf).append(" => ");
      if (body == null) {
        return appendBlock(buf, depth, stmts);
      }
      if (body.op == JsOp.OBJECT) {
        return body.unparse(buf.append('('), depth).append(')');
      }
      return body.unparse(buf, depth);
    }
  }

  /** Named function expression, "function name(params) { ... }". */
  public static class NamedFunction extends FunctionExp {
    public final String name;

    NamedFunction(String name, ImmutableList<String> params,
        @Nullable Exp body, ImmutableList<Stmt> stmts) {
      super(JsOp.NAMED_FUNCTION, params, body, stmts);
      this.name = requireNonNull(name);
    }

    @Override public String shape() {
      return op.tag + "(" + name + ")" + paramShape();
    }

    @Override public NamedFunction copy(List<Node> children) {
      return body != null
          ? new NamedFunction(name, params, exp(children.get(0)),
              ImmutableList.of())
          : new NamedFunction(name, params, null, stmts(children));
    }

    @Override StringBuilder unparse(StringBuilder buf, int depth) {
      appendParams(buf.append("function ").append(identifier(name)))
          .append(' ');
      if (body == null) {
        return appendBlock(buf, depth, stmts);
      }
      return body.unparse(buf.append("{ return "), depth).append("; }");
    }
  }

  /** Conditional expression, "cond ? ifTrue : ifFalse". */
  public static class Ternary extends Exp {
    public final Exp cond;
    public final Exp ifTrue;
    public final Exp ifFalse;

    Ternary(Exp cond, Exp ifTrue, Exp ifFalse) {
      super(JsOp.TERNARY);
      this.cond = requireNonNull(cond);
      this.ifTrue = requireNonNull(ifTrue);
      this.ifFalse = requireNonNull(ifFalse);
    }

    @Override public ImmutableList<Child> children() {
      return ImmutableList.of(Child.of("cond", cond),
          Child.of("then", ifTrue), Child.of("else", ifFalse));
    }

    @Override public Ternary copy(List<Node> children) {
      return new Ternary(exp(children.get(0)), exp(children.get(1)),
          exp(children.get(2)));
    }

    @Override StringBuilder unparse(StringBuilder buf, int depth) {
      if (cond.op == JsOp.TERNARY
          || cond instanceof Binop
              && precedence(((Binop) cond).operator) <= 1) {
        cond.unparse(buf.append('('), depth).append(')');
      } else {
        cond.unparse(buf, depth);
      }
      ifTrue.unparse(buf.append(" ? "), depth);
      return ifFalse.unparse(buf.append(" : "), depth);
    }
  }

  /** Property access, "obj.prop". */
  public static class Member extends Exp {
    public final Exp obj;
    public final String prop;

    Member(Exp obj, String prop) {
      super(JsOp.MEMBER);
      this.obj = requireNonNull(obj);
      this.prop = requireNonNull(prop);
    }

    @Override public String shape() {
      return op.tag + "(" + prop + ")";
    }

    @Override public ImmutableList<Child> children() {
      return ImmutableList.of(Child.of("obj", obj));
    }

    @Override public Member copy(List<Node> children) {
      return new Member(exp(children.get(0)), prop);
    }

    @Override StringBuilder unparse(StringBuilder buf, int depth) {
      appendOperand(buf, depth, obj);
      if (isValidPropertyName(prop)) {
        return buf.append('.').append(prop);
      }
      return appendQuoted(buf.append('['), prop).append(']');
    }
  }

  /** Element access, "arr[idx]". */
  public static class Index extends Exp {
    public final Exp arr;
    public final Exp idx;

    Index(Exp arr, Exp idx) {
      super(JsOp.INDEX);
      this.arr = requireNonNull(arr);
      this.idx = requireNonNull(idx);
    }

    @Override public ImmutableList<Child> children() {
      return ImmutableList.of(Child.of("arr", arr), Child.of("idx", idx));
    }

    @Override public Index copy(List<Node> children) {
      return new Index(exp(children.get(0)), exp(children.get(1)));
    }

    @Override StringBuilder unparse(StringBuilder buf, int depth) {
      appendOperand(buf, depth, arr);
      return idx.unparse(buf.append('['), depth).append(']');
    }
  }

  /** Object literal, "{ key: value, ... }". The value of the i-th field
   * is at path "fields.i.value". */
  public static class ObjectExp extends Exp {
    public final ImmutableMap<String, Exp> fields;

    ObjectExp(ImmutableMap<String, Exp> fields) {
      super(JsOp.OBJECT);
      this.fields = requireNonNull(fields);
    }

    @Override public String shape() {
      return op.tag + "(" + String.join(",", fields.keySet()) + ")";
    }

    @Override public ImmutableList<Child> children() {
      final ImmutableList.Builder<Child> b = ImmutableList.builder();
      int i = 0;
      for (Exp value : fields.values()) {
        b.add(new Child(JsPath.of("fields", i++, "value"), value));
      }
      return b.build();
    }

    @Override public ObjectExp copy(List<Node> children) {
      final ImmutableMap.Builder<String, Exp> b = ImmutableMap.builder();
      int i = 0;
      for (String key : fields.keySet()) {
        b.put(key, exp(children.get(i++)));
      }
      return new ObjectExp(b.build());
    }

    @Override StringBuilder unparse(StringBuilder buf, int depth) {
      if (fields.isEmpty()) {
        return buf.append("{}");
      }
      final List<String> items = new ArrayList<>();
      for (Map.Entry<String, Exp> field : fields.entrySet()) {
        final String key = field.getKey();
        final Exp value = field.getValue();
        if (value instanceof Var && ((Var) value).name.equals(key)) {
          items.add(identifier(key));
          continue;
        }
        final StringBuilder b = new StringBuilder();
        if (isValidPropertyName(key)) {
          b.append(key);
        } else {
          appendQuoted(b, key);
        }
        items.add(value.unparse(b.append(": "), depth + 1).toString());
      }
      return appendWrapped(buf, depth, "{ ", " }", items);
    }
  }

  /** Array literal, "[elements]". */
  public static class ArrayExp extends Exp {
    public final ImmutableList<Exp> elements;

    ArrayExp(ImmutableList<Exp> elements) {
      super(JsOp.ARRAY);
      this.elements = requireNonNull(elements);
    }

    @Override public ImmutableList<Child> children() {
      final ImmutableList.Builder<Child> b = ImmutableList.builder();
      addAll(b, "elements", elements);
      return b.build();
    }

    @Override public ArrayExp copy(List<Node> children) {
      return new ArrayExp(exps(children));
    }

    @Override StringBuilder unparse(StringBuilder buf, int depth) {
      final List<String> items = new ArrayList<>();
      for (Exp e : elements) {
        items.add(e.unparse(new StringBuilder(), depth + 1).toString());
      }
      return appendWrapped(buf, depth, "[", "]", items);
    }
  }

  /** Immediately-invoked function expression, "(() =&gt; { ... })()". */
  public static class Iife extends Exp {
    public final ImmutableList<Stmt> body;

    Iife(ImmutableList<Stmt> body) {
      super(JsOp.IIFE);
      this.body = requireNonNull(body);
    }

    @Override public ImmutableList<Child> children() {
      final ImmutableList.Builder<Child> b = ImmutableList.builder();
      addAll(b, "body", body);
      return b.build();
    }

    @Override public Iife copy(List<Node> children) {
      return new Iife(stmts(children));
    }

    @Override StringBuilder unparse(StringBuilder buf, int depth) {
      return appendBlock(buf.append("(() => "), depth, body).append(")()");
    }
  }

  /** Declaration, "const name = value;" or "let name = value;". */
  public static class Declare extends Stmt {
    public final String name;
    public final Exp value;

    Declare(JsOp op, String name, Exp value) {
      super(op);
      this.name = requireNonNull(name);
      this.value = requireNonNull(value);
      checkArgument(op == JsOp.CONST || op == JsOp.LET);
    }

    @Override public String shape() {
      return op.tag + "(" + name + ")";
    }

    @Override public ImmutableList<Child> children() {
      return ImmutableList.of(Child.of("value", value));
    }

    @Override public Declare copy(List<Node> children) {
      return new Declare(op, name, exp(children.get(0)));
    }

    @Override StringBuilder unparse(StringBuilder buf, int depth) {
      indent(buf, depth).append(op.tag).append(' ')
          .append(identifier(name)).append(" = ");
      return value.unparse(buf, depth).append(';');
    }
  }

  /** Destructuring declaration, "const [a, b] = value;". */
  public static class ConstPattern extends Stmt {
    public final Pat pat;
    public final Exp value;

    ConstPattern(Pat pat, Exp value) {
      super(JsOp.CONST_PATTERN);
      this.pat = requireNonNull(pat);
      this.value = requireNonNull(value);
    }

    @Override public String shape() {
      return op.tag + "(" + pat + ")";
    }

    @Override public ImmutableList<Child> children() {
      return ImmutableList.of(Child.of("value", value));
    }

    @Override public ConstPattern copy(List<Node> children) {
      return new ConstPattern(pat, exp(children.get(0)));
    }

    @Override StringBuilder unparse(StringBuilder buf, int depth) {
      pat.unparse(indent(buf, depth).append("const "), depth);
      return value.unparse(buf.append(" = "), depth).append(';');
    }
  }

  /** Statement that consists of a single expression: "return value;",
   * "throw value;" or "value;". */
  public static class ExpStmt extends Stmt {
    public final Exp value;

    ExpStmt(JsOp op, Exp value) {
      super(op);
      this.value = requireNonNull(value);
      checkArgument(op == JsOp.RETURN || op == JsOp.THROW
          || op == JsOp.EXPR);
    }

    @Override public ImmutableList<Child> children() {
      return ImmutableList.of(
          Child.of(op == JsOp.EXPR ? "expr" : "value", value));
    }

    @Override public ExpStmt copy(List<Node> children) {
      return new ExpStmt(op, exp(children.get(0)));
    }

    @Override StringBuilder unparse(StringBuilder buf, int depth) {
      indent(buf, depth);
      if (op != JsOp.EXPR) {
        buf.append(op.tag).append(' ');
      }
      return value.unparse(buf, depth).append(';');
    }
  }

  /** "if (cond) { ... } else { ... }" statement. */
  public static class If extends Stmt {
    public final Exp cond;
    public final ImmutableList<Stmt> ifTrue;
    /** Statements of the "else" branch; null if there is no "else". */
    public final @Nullable ImmutableList<Stmt> ifFalse;

    If(Exp cond, ImmutableList<Stmt> ifTrue,
        @Nullable ImmutableList<Stmt> ifFalse) {
      super(JsOp.IF);
      this.cond = requireNonNull(cond);
      this.ifTrue = requireNonNull(ifTrue);
      this.ifFalse = ifFalse;
    }

    @Override public String shape() {
      return op.tag + "(" + ifTrue.size()
          + (ifFalse == null ? "" : "," + ifFalse.size()) + ")";
    }

    @Override public ImmutableList<Child> children() {
      final ImmutableList.Builder<Child> b = ImmutableList.builder();
      b.add(Child.of("cond", cond));
      addAll(b, "then", ifTrue);
      if (ifFalse != null) {
        addAll(b, "else", ifFalse);
      }
      return b.build();
    }

    @Override public If copy(List<Node> children) {
      final int n = 1 + ifTrue.size();
      return new If(exp(children.get(0)), stmts(children.subList(1, n)),
          ifFalse == null ? null
              : stmts(children.subList(n, children.size())));
    }

    @Override StringBuilder unparse(StringBuilder buf, int depth) {
      cond.unparse(indent(buf, depth).append("if ("), depth).append(") ");
      appendBlock(buf, depth, ifTrue);
      if (ifFalse != null && !ifFalse.isEmpty()) {
        appendBlock(buf.append(" else "), depth, ifFalse);
      }
      return buf;
    }
  }

  /** "for (const item of iter) { ... }" statement. */
  public static class ForOf extends Stmt {
    public final String item;
    public final Exp iter;
    public final ImmutableList<Stmt> body;

    ForOf(String item, Exp iter, ImmutableList<Stmt> body) {
      super(JsOp.FOR_OF);
      this.item = requireNonNull(item);
      this.iter = requireNonNull(iter);
      this.body = requireNonNull(body);
    }

    @Override public String shape() {
      return op.tag + "(" + item + ")";
    }

    @Override public ImmutableList<Child> children() {
      final ImmutableList.Builder<Child> b = ImmutableList.builder();
      b.add(Child.of("iter", iter));
      addAll(b, "body", body);
      return b.build();
    }

    @Override public ForOf copy(List<Node> children) {
      return new ForOf(item, exp(children.get(0)),
          stmts(children.subList(1, children.size())));
    }

    @Override StringBuilder unparse(StringBuilder buf, int depth) {
      indent(buf, depth).append("for (const ").append(identifier(item))
          .append(" of ");
      iter.unparse(buf, depth).append(") ");
      return appendBlock(buf, depth, body);
    }
  }

  /** "continue;" or "break;". */
  public static class Jump extends Stmt {
    Jump(JsOp op) {
      super(op);
      checkArgument(op == JsOp.CONTINUE || op == JsOp.BREAK);
    }

    @Override StringBuilder unparse(StringBuilder buf, int depth) {
      return indent(buf, depth).append(op.tag).append(';');
    }
  }

  /** Pattern that binds a name. */
  public static class VarPat extends Pat {
    public final String name;

    VarPat(String name) {
      super(JsOp.VAR_PATTERN);
      this.name = requireNonNull(name);
    }

    @Override StringBuilder unparse(StringBuilder buf, int depth) {
      return buf.append(identifier(name));
    }
  }

  /** Array destructuring pattern, "[a, b]". */
  public static class ArrayPat extends Pat {
    public final ImmutableList<Pat> elements;

    ArrayPat(ImmutableList<Pat> elements) {
      super(JsOp.ARRAY_PATTERN);
      this.elements = requireNonNull(elements);
    }

    @Override StringBuilder unparse(StringBuilder buf, int depth) {
      buf.append('[');
      for (int i = 0; i < elements.size(); i++) {
        if (i > 0) {
          buf.append(", ");
        }
        elements.get(i).unparse(buf, depth);
      }
      return buf.append(']');
    }
  }

  /** Object destructuring pattern, "{ a, b: [c, d] }". */
  public static class ObjectPat extends Pat {
    public final ImmutableMap<String, Pat> fields;

    ObjectPat(ImmutableMap<String, Pat> fields) {
      super(JsOp.OBJECT_PATTERN);
      this.fields = requireNonNull(fields);
    }

    @Override StringBuilder unparse(StringBuilder buf, int depth) {
      buf.append("{ ");
      int i = 0;
      for (Map.Entry<String, Pat> field : fields.entrySet()) {
        if (i++ > 0) {
          buf.append(", ");
        }
        buf.append(identifier(field.getKey()));
        final Pat pat = field.getValue();
        if (!(pat instanceof VarPat)
            || !((VarPat) pat).name.equals(field.getKey())) {
          pat.unparse(buf.append(": "), depth);
        }
      }
      return buf.append(" }");
    }
  }
}

// End Js.java
