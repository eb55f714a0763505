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
package net.hydromatic.tempo.constraint;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;
import static net.hydromatic.tempo.util.Static.appendLiteral;
import static net.hydromatic.tempo.util.Static.numberToString;
import static net.hydromatic.tempo.util.Static.transformEager;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Objects;
import java.util.function.UnaryOperator;
import net.hydromatic.tempo.util.Static;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Constraint, the type language of Tempo.
 *
 * <p>A constraint is a logical predicate that a value must satisfy. It unifies
 * traditional types ({@code isNumber}, {@code isString}) with refinements
 * ({@code x > 0}, {@code x == 5}) and structure ({@code hasField},
 * {@code elementAt}).
 *
 * <p>Constraints are immutable, and equality is structural. To create one,
 * use the factory methods in {@link Constraints}. This class functions as a
 * namespace for the sub-classes, one per family of {@link Op}.
 */
public abstract class Constraint {
  public final Op op;

  Constraint(Op op) {
    this.op = requireNonNull(op, "op");
  }

  @Override
  public String toString() {
    return unparse(new StringBuilder()).toString();
  }

  /** Appends the textual form of this constraint to a buffer. */
  abstract StringBuilder unparse(StringBuilder buf);

  /**
   * Creates a copy of this constraint whose immediate children have been
   * transformed. Returns this constraint if it has no children.
   */
  public abstract Constraint copy(UnaryOperator<Constraint> transform);

  /** Returns whether this is {@code any}. */
  public boolean isAny() {
    return op == Op.ANY;
  }

  /** Returns whether this is {@code never}. */
  public boolean isNever() {
    return op == Op.NEVER;
  }

  /** Constraint with no arguments: {@code any}, {@code never}, and the
   * classifications such as {@code isNumber}. */
  public static class Atom extends Constraint {
    Atom(Op op) {
      super(op);
      checkArgument(op == Op.ANY || op == Op.NEVER || op.isClassification());
    }

    @Override
    public int hashCode() {
      return op.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this || o instanceof Atom && ((Atom) o).op == op;
    }

    @Override
    StringBuilder unparse(StringBuilder buf) {
      return buf.append(op.str);
    }

    @Override
    public Constraint copy(UnaryOperator<Constraint> transform) {
      return this;
    }
  }

  /** Constraint that a value is equal to a literal. */
  public static class Equals extends Constraint {
    /** A {@link Double}, {@link String}, {@link Boolean}, or null. */
    public final @Nullable Object value;

    Equals(@Nullable Object value) {
      super(Op.EQUALS);
      checkArgument(Static.isLiteral(value), "not a literal: %s", value);
      this.value = value;
    }

    @Override
    public int hashCode() {
      return Objects.hashCode(value);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Equals && Objects.equals(((Equals) o).value, value);
    }

    @Override
    StringBuilder unparse(StringBuilder buf) {
      return appendLiteral(buf, value);
    }

    @Override
    public Constraint copy(UnaryOperator<Constraint> transform) {
      return this;
    }

    /** Returns whether the value matches a classification. */
    boolean matches(Op classification) {
      switch (classification) {
        case IS_NUMBER:
          return value instanceof Double;
        case IS_STRING:
          return value instanceof String;
        case IS_BOOL:
          return value instanceof Boolean;
        case IS_NULL:
          return value == null;
        default:
          // Literals are never undefined, objects, arrays or functions.
          return false;
      }
    }
  }

  /** Numeric comparison: {@code gt}, {@code gte}, {@code lt}, {@code lte}. */
  public static class Bound extends Constraint {
    public final double bound;

    Bound(Op op, double bound) {
      super(op);
      checkArgument(op.isBound());
      this.bound = bound;
    }

    @Override
    public int hashCode() {
      return op.hashCode() * 31 + Double.hashCode(bound);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Bound
              && ((Bound) o).op == op
              && Double.compare(((Bound) o).bound, bound) == 0;
    }

    @Override
    StringBuilder unparse(StringBuilder buf) {
      return buf.append(op.str).append(' ').append(numberToString(bound));
    }

    @Override
    public Constraint copy(UnaryOperator<Constraint> transform) {
      return this;
    }

    /** Returns whether a number satisfies this bound. */
    public boolean test(double d) {
      switch (op) {
        case GT:
          return d > bound;
        case GTE:
          return d >= bound;
        case LT:
          return d < bound;
        case LTE:
          return d <= bound;
        default:
          throw new AssertionError(op);
      }
    }
  }

  /** Constraint that an object has a field whose value satisfies a
   * constraint. */
  public static class HasField extends Constraint {
    public final String name;
    public final Constraint constraint;

    HasField(String name, Constraint constraint) {
      super(Op.HAS_FIELD);
      this.name = requireNonNull(name, "name");
      this.constraint = requireNonNull(constraint, "constraint");
    }

    @Override
    public int hashCode() {
      return Objects.hash(name, constraint);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof HasField
              && ((HasField) o).name.equals(name)
              && ((HasField) o).constraint.equals(constraint);
    }

    @Override
    StringBuilder unparse(StringBuilder buf) {
      buf.append("{ ").append(name).append(": ");
      return constraint.unparse(buf).append(" }");
    }

    @Override
    public HasField copy(UnaryOperator<Constraint> transform) {
      final Constraint constraint2 = transform.apply(constraint);
      return constraint2 == constraint
          ? this
          : new HasField(name, constraint2);
    }
  }

  /** Constraint with a single constraint argument: {@code elements},
   * {@code length}, {@code indexSig}, {@code not}, {@code isType}. */
  public static class Wrapper extends Constraint {
    public final Constraint constraint;

    Wrapper(Op op, Constraint constraint) {
      super(op);
      checkArgument(op == Op.ELEMENTS
          || op == Op.LENGTH
          || op == Op.INDEX_SIG
          || op == Op.NOT
          || op == Op.IS_TYPE);
      this.constraint = requireNonNull(constraint, "constraint");
    }

    @Override
    public int hashCode() {
      return op.hashCode() * 31 + constraint.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Wrapper
              && ((Wrapper) o).op == op
              && ((Wrapper) o).constraint.equals(constraint);
    }

    @Override
    StringBuilder unparse(StringBuilder buf) {
      switch (op) {
        case ELEMENTS:
          return constraint.unparse(buf).append("[]");
        case LENGTH:
          return constraint.unparse(buf.append("length(")).append(')');
        case INDEX_SIG:
          return constraint.unparse(buf.append("[string]: "));
        case NOT:
          return constraint.unparse(buf.append("not(")).append(')');
        case IS_TYPE:
          return constraint.unparse(buf.append("Type<")).append('>');
        default:
          throw new AssertionError(op);
      }
    }

    @Override
    public Wrapper copy(UnaryOperator<Constraint> transform) {
      final Constraint constraint2 = transform.apply(constraint);
      return constraint2 == constraint
          ? this
          : new Wrapper(op, constraint2);
    }
  }

  /** Constraint on the element at a particular position of an array. */
  public static class ElementAt extends Constraint {
    public final int index;
    public final Constraint constraint;

    ElementAt(int index, Constraint constraint) {
      super(Op.ELEMENT_AT);
      checkArgument(index >= 0, "negative index %s", index);
      this.index = index;
      this.constraint = requireNonNull(constraint, "constraint");
    }

    @Override
    public int hashCode() {
      return index * 31 + constraint.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof ElementAt
              && ((ElementAt) o).index == index
              && ((ElementAt) o).constraint.equals(constraint);
    }

    @Override
    StringBuilder unparse(StringBuilder buf) {
      buf.append('[').append(index).append("]: ");
      return constraint.unparse(buf);
    }

    @Override
    public ElementAt copy(UnaryOperator<Constraint> transform) {
      final Constraint constraint2 = transform.apply(constraint);
      return constraint2 == constraint
          ? this
          : new ElementAt(index, constraint2);
    }
  }

  /** Conjunction ({@code and}) or disjunction ({@code or}) of
   * constraints. */
  public static class Junction extends Constraint {
    public final ImmutableList<Constraint> constraints;

    Junction(Op op, ImmutableList<Constraint> constraints) {
      super(op);
      checkArgument(op == Op.AND || op == Op.OR);
      checkArgument(constraints.size() >= 2,
          "junction must have at least two arguments");
      this.constraints = requireNonNull(constraints, "constraints");
    }

    @Override
    public int hashCode() {
      return op.hashCode() * 31 + constraints.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Junction
              && ((Junction) o).op == op
              && ((Junction) o).constraints.equals(constraints);
    }

    @Override
    StringBuilder unparse(StringBuilder buf) {
      if (op == Op.AND) {
        if (unparseLiteral(buf) || unparseObject(buf)) {
          return buf;
        }
      }
      for (int i = 0; i < constraints.size(); i++) {
        if (i > 0) {
          buf.append(op.str);
        }
        constraints.get(i).unparse(buf);
      }
      return buf;
    }

    /** Prints a literal type, such as {@code and(isNumber, equals(5))}, as
     * its value. */
    private boolean unparseLiteral(StringBuilder buf) {
      if (constraints.size() != 2) {
        return false;
      }
      Equals equals = null;
      boolean classified = false;
      for (Constraint c : constraints) {
        if (c instanceof Equals) {
          equals = (Equals) c;
        } else if (c.op.isClassification()) {
          classified = true;
        }
      }
      if (equals == null || !classified) {
        return false;
      }
      equals.unparse(buf);
      return true;
    }

    /** Prints an object type as "{ a: number, b: string }". */
    private boolean unparseObject(StringBuilder buf) {
      boolean object = false;
      Wrapper indexSig = null;
      int fieldCount = 0;
      for (Constraint c : constraints) {
        if (c.op == Op.IS_OBJECT) {
          object = true;
        } else if (c.op == Op.HAS_FIELD) {
          ++fieldCount;
        } else if (c.op == Op.INDEX_SIG) {
          indexSig = (Wrapper) c;
        }
      }
      final boolean closed =
          indexSig != null && indexSig.constraint.isNever();
      final int expectedSize = 1 + fieldCount + (indexSig != null ? 1 : 0);
      if (!object || constraints.size() != expectedSize) {
        return false;
      }
      if (fieldCount == 0) {
        if (!closed) {
          return false;
        }
        buf.append("{ }");
        return true;
      }
      buf.append("{ ");
      int i = 0;
      for (Constraint c : constraints) {
        if (c instanceof HasField) {
          final HasField hasField = (HasField) c;
          if (i++ > 0) {
            buf.append(", ");
          }
          hasField.constraint.unparse(buf.append(hasField.name).append(": "));
        }
      }
      if (indexSig != null && !closed) {
        indexSig.unparse(buf.append(", "));
      }
      buf.append(" }");
      return true;
    }

    @Override
    public Constraint copy(UnaryOperator<Constraint> transform) {
      final List<Constraint> list = transformEager(constraints, transform);
      if (list.equals(constraints)) {
        return this;
      }
      return op == Op.AND ? Constraints.and(list) : Constraints.or(list);
    }
  }

  /** Inference variable, used by {@link Solver}. */
  public static class Var extends Constraint {
    public final int id;

    Var(int id) {
      super(Op.VAR);
      this.id = id;
    }

    @Override
    public int hashCode() {
      return id;
    }

    @Override
    public boolean equals(Object o) {
      return o == this || o instanceof Var && ((Var) o).id == id;
    }

    @Override
    StringBuilder unparse(StringBuilder buf) {
      return buf.append('?').append(id);
    }

    @Override
    public Constraint copy(UnaryOperator<Constraint> transform) {
      return this;
    }
  }

  /** Recursive type binder, "μX. body". */
  public static class Rec extends Constraint {
    public final String name;
    public final Constraint body;

    Rec(String name, Constraint body) {
      super(Op.REC);
      this.name = requireNonNull(name, "name");
      this.body = requireNonNull(body, "body");
    }

    @Override
    public int hashCode() {
      return Objects.hash(name, body);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Rec
              && ((Rec) o).name.equals(name)
              && ((Rec) o).body.equals(body);
    }

    @Override
    StringBuilder unparse(StringBuilder buf) {
      return body.unparse(buf.append(op.str).append(name).append(". "));
    }

    @Override
    public Rec copy(UnaryOperator<Constraint> transform) {
      final Constraint body2 = transform.apply(body);
      return body2 == body ? this : new Rec(name, body2);
    }

    /** Returns the body with each reference to this binder replaced by this
     * binder; that is, unrolls the recursive type one level. */
    public Constraint unroll() {
      return Constraints.substituteRecVar(body, name, this);
    }
  }

  /** Reference to an enclosing {@link Rec} binder. */
  public static class RecVar extends Constraint {
    public final String name;

    RecVar(String name) {
      super(Op.REC_VAR);
      this.name = requireNonNull(name, "name");
    }

    @Override
    public int hashCode() {
      return name.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof RecVar && ((RecVar) o).name.equals(name);
    }

    @Override
    StringBuilder unparse(StringBuilder buf) {
      return buf.append(name);
    }

    @Override
    public Constraint copy(UnaryOperator<Constraint> transform) {
      return this;
    }
  }

  /** Type parameter of a generic function type, such as "T" in
   * "&lt;T&gt;(T) =&gt; T". */
  public static class TypeParam extends Constraint {
    public final String name;
    public final Constraint bound;
    public final int id;

    TypeParam(String name, Constraint bound, int id) {
      super(Op.TYPE_PARAM);
      this.name = requireNonNull(name, "name");
      this.bound = requireNonNull(bound, "bound");
      this.id = id;
    }

    @Override
    public int hashCode() {
      return Objects.hash(name, bound, id);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof TypeParam
              && ((TypeParam) o).id == id
              && ((TypeParam) o).name.equals(name)
              && ((TypeParam) o).bound.equals(bound);
    }

    @Override
    StringBuilder unparse(StringBuilder buf) {
      return buf.append(name);
    }

    @Override
    public TypeParam copy(UnaryOperator<Constraint> transform) {
      final Constraint bound2 = transform.apply(bound);
      return bound2 == bound ? this : new TypeParam(name, bound2, id);
    }
  }

  /** Function type, "(p0, p1) =&gt; result". */
  public static class FnType extends Constraint {
    public final ImmutableList<Constraint> params;
    public final Constraint result;

    FnType(ImmutableList<Constraint> params, Constraint result) {
      super(Op.FN_TYPE);
      this.params = requireNonNull(params, "params");
      this.result = requireNonNull(result, "result");
    }

    @Override
    public int hashCode() {
      return Objects.hash(params, result);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof FnType
              && ((FnType) o).params.equals(params)
              && ((FnType) o).result.equals(result);
    }

    @Override
    StringBuilder unparse(StringBuilder buf) {
      return unparseSignature(buf, params, result);
    }

    @Override
    public FnType copy(UnaryOperator<Constraint> transform) {
      final ImmutableList<Constraint> params2 =
          transformEager(params, transform);
      final Constraint result2 = transform.apply(result);
      return params2.equals(params) && result2 == result
          ? this
          : new FnType(params2, result2);
    }
  }

  /** Generic function type, "&lt;T&gt;(T) =&gt; T". */
  public static class GenericFnType extends Constraint {
    public final ImmutableList<TypeParam> typeParams;
    public final ImmutableList<Constraint> params;
    public final Constraint result;

    GenericFnType(ImmutableList<TypeParam> typeParams,
        ImmutableList<Constraint> params, Constraint result) {
      super(Op.GENERIC_FN_TYPE);
      this.typeParams = requireNonNull(typeParams, "typeParams");
      this.params = requireNonNull(params, "params");
      this.result = requireNonNull(result, "result");
    }

    @Override
    public int hashCode() {
      return Objects.hash(typeParams, params, result);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof GenericFnType
              && ((GenericFnType) o).typeParams.equals(typeParams)
              && ((GenericFnType) o).params.equals(params)
              && ((GenericFnType) o).result.equals(result);
    }

    @Override
    StringBuilder unparse(StringBuilder buf) {
      buf.append('<');
      for (int i = 0; i < typeParams.size(); i++) {
        if (i > 0) {
          buf.append(", ");
        }
        buf.append(typeParams.get(i).name);
      }
      buf.append('>');
      return unparseSignature(buf, params, result);
    }

    @Override
    public GenericFnType copy(UnaryOperator<Constraint> transform) {
      final ImmutableList<TypeParam> typeParams2 =
          transformEager(typeParams, tp -> tp.copy(transform));
      final ImmutableList<Constraint> params2 =
          transformEager(params, transform);
      final Constraint result2 = transform.apply(result);
      return typeParams2.equals(typeParams)
          && params2.equals(params)
          && result2 == result
          ? this
          : new GenericFnType(typeParams2, params2, result2);
    }
  }

  private static StringBuilder unparseSignature(StringBuilder buf,
      List<Constraint> params, Constraint result) {
    buf.append('(');
    for (int i = 0; i < params.size(); i++) {
      if (i > 0) {
        buf.append(", ");
      }
      params.get(i).unparse(buf);
    }
    return result.unparse(buf.append(") => "));
  }
}

// End Constraint.java
