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

import static net.hydromatic.tempo.ast.AstBuilder.ast;
import static net.hydromatic.tempo.constraint.Constraints.ANY;
import static net.hydromatic.tempo.constraint.Constraints.IS_ARRAY;
import static net.hydromatic.tempo.constraint.Constraints.IS_BOOL;
import static net.hydromatic.tempo.constraint.Constraints.IS_FUNCTION;
import static net.hydromatic.tempo.constraint.Constraints.IS_NULL;
import static net.hydromatic.tempo.constraint.Constraints.IS_NUMBER;
import static net.hydromatic.tempo.constraint.Constraints.IS_OBJECT;
import static net.hydromatic.tempo.constraint.Constraints.IS_STRING;
import static net.hydromatic.tempo.constraint.Constraints.NEVER;
import static net.hydromatic.tempo.constraint.Constraints.and;
import static net.hydromatic.tempo.constraint.Constraints.arrayOf;
import static net.hydromatic.tempo.constraint.Constraints.equalTo;
import static net.hydromatic.tempo.constraint.Constraints.hasField;
import static net.hydromatic.tempo.constraint.Constraints.indexSig;
import static net.hydromatic.tempo.constraint.Constraints.isType;
import static net.hydromatic.tempo.constraint.Constraints.or;
import static net.hydromatic.tempo.constraint.Constraints.simplify;
import static net.hydromatic.tempo.constraint.Constraints.unify;
import static net.hydromatic.tempo.util.Static.allMatch;
import static net.hydromatic.tempo.util.Static.anyMatch;
import static net.hydromatic.tempo.util.Static.isInteger;
import static net.hydromatic.tempo.util.Static.numberToString;
import static net.hydromatic.tempo.util.Static.transformEager;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.tempo.ast.Ast;
import net.hydromatic.tempo.ast.AstBuilder;
import net.hydromatic.tempo.ast.Op;
import net.hydromatic.tempo.constraint.Constraint;
import net.hydromatic.tempo.constraint.Constraints;
import net.hydromatic.tempo.constraint.Generics;
import net.hydromatic.tempo.constraint.Implication;
import net.hydromatic.tempo.eval.Codes;
import net.hydromatic.tempo.eval.Prop;
import net.hydromatic.tempo.eval.SValue;
import net.hydromatic.tempo.eval.Session;
import net.hydromatic.tempo.eval.Value;
import net.hydromatic.tempo.eval.Values;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Staged evaluator.
 *
 * <p>Evaluates an expression as far as it can at compile time. Each
 * expression becomes a {@link SValue}: "now" if its value is known, "later"
 * if the value is known only at run time, in which case the result carries
 * a residual expression that computes it. Either way, the result carries a
 * {@link Constraint} that describes what we know about the value.
 *
 * <p>A stager belongs to one {@link Session}; the session holds counters,
 * caches and closures, so that two stagers in fresh sessions produce
 * identical output. */
public class Stager {
  private static final Logger LOG = LoggerFactory.getLogger(Stager.class);

  /** Names of the types in the initial environment. */
  private static final ImmutableMap<String, Constraint> TYPE_NAMES =
      ImmutableMap.<String, Constraint>builder()
          .put("number", IS_NUMBER)
          .put("string", IS_STRING)
          .put("boolean", IS_BOOL)
          .put("null", IS_NULL)
          .put("object", IS_OBJECT)
          .put("array", IS_ARRAY)
          .put("function", IS_FUNCTION)
          .build();

  private final Session session;
  private final ModuleLoader loader;

  public Stager(Session session, ModuleLoader loader) {
    this.session = session;
    this.loader = loader;
  }

  /** Creates a stager in a new session that cannot load modules. */
  public static Stager create() {
    return new Stager(new Session(), ModuleLoaders.empty());
  }

  /** Returns this stager's session. */
  public Session session() {
    return session;
  }

  /** Creates the initial environment: the type names and the built-in
   * functions. */
  public static SEnv initialEnv() {
    final Map<String, SValue> map = new LinkedHashMap<>();
    TYPE_NAMES.forEach((name, c) ->
        map.put(name, SValue.now(Values.type(c), isType(c))));
    for (BuiltIn builtIn : BuiltIn.values()) {
      map.put(builtIn.camelName,
          SValue.now(Values.builtin(builtIn.camelName), IS_FUNCTION));
    }
    return SEnvs.empty().bindAll(map);
  }

  /** Stages an expression in a new session and the initial
   * environment. */
  public static SValue stage(Ast.Exp exp) {
    return create().stage(exp, initialEnv());
  }

  /** Evaluates an expression whose value must be known at compile time,
   * in a new session. */
  public static Value run(Ast.Exp exp) {
    return create().run(exp, initialEnv());
  }

  /** Stages an expression in a new session, and returns the expression
   * that computes its value. */
  public static Ast.Exp stageToExpr(Ast.Exp exp) {
    return create().stageToExpr(exp, initialEnv());
  }

  /** Stages an expression in a given environment. */
  public SValue stage(Ast.Exp exp, SEnv env) {
    return stage(exp, env, RefinementContext.empty());
  }

  /** Stages an expression in a given environment and refinement
   * context. */
  public SValue stage(Ast.Exp exp, SEnv env,
      RefinementContext refinementContext) {
    final Tracer tracer = session.tracer;
    tracer.onStage(exp);
    final SValue result;
    try {
      result = stage(new Context(env, refinementContext), exp);
    } catch (StageException e) {
      tracer.onException(e);
      throw e;
    }
    tracer.onResult(result);
    return result;
  }

  /** Evaluates an expression whose value must be known at compile time. */
  public Value run(Ast.Exp exp, SEnv env) {
    final SValue result = stage(exp, env);
    if (!result.isNow()) {
      throw new StageException("Expression has runtime dependencies - "
          + "use stage() for partial evaluation");
    }
    return ((SValue.Now) result).value;
  }

  /** Stages an expression, and returns the expression that computes its
   * value; if the value is known, a literal. */
  public Ast.Exp stageToExpr(Ast.Exp exp, SEnv env) {
    final SValue result = stage(exp, env);
    if (result.isNow()) {
      return valueToExpr(((SValue.Now) result).value);
    }
    return svalueToResidual(result);
  }

  /** Creates a context in which a backend can generate code, and stage
   * further expressions, in the initial environment. */
  public <T> BackendContext<T> backendContext(Backend<T> backend) {
    return backendContext(backend, initialEnv());
  }

  /** Creates a context in which a backend can generate code. */
  public <T> BackendContext<T> backendContext(Backend<T> backend,
      SEnv env) {
    return new BackendContextImpl<>(backend, env);
  }

  private SValue stage(Context cx, Ast.Exp exp) {
    switch (exp.op) {
      case LITERAL:
        final Value value = Values.fromLiteral(((Ast.Literal) exp).value);
        return SValue.now(value, Values.constraintOf(value));

      case ID:
        return stageId(cx, ((Ast.Id) exp).name);

      case PLUS:
      case MINUS:
      case TIMES:
      case DIVIDE:
      case MOD:
      case EQ:
      case NE:
      case LT:
      case GT:
      case LE:
      case GE:
      case ANDALSO:
      case ORELSE:
        return stageInfix(cx, (Ast.InfixCall) exp);

      case NEGATE:
      case NOT:
        return stagePrefix(cx, (Ast.PrefixCall) exp);

      case IF:
        return stageIf(cx, (Ast.If) exp);

      case LET:
        return stageLet(cx, (Ast.Let) exp);

      case LET_PATTERN:
        return stageLetPattern(cx, (Ast.LetPattern) exp);

      case FN:
      case REC_FN:
        // The body is staged at each call site
        final Value.Closure closure =
            session.closures.register((Ast.Fn) exp, cx.env);
        return SValue.now(closure, IS_FUNCTION);

      case APPLY:
        return stageApply(cx, (Ast.Apply) exp);

      case METHOD_CALL:
        return stageMethodCall(cx, (Ast.MethodCall) exp);

      case RECORD:
        return stageRecord(cx, (Ast.Record) exp);

      case FIELD:
        return stageField(cx, (Ast.Field) exp);

      case ARRAY:
        return stageArray(cx, (Ast.Array) exp);

      case INDEX:
        return stageIndex(cx, (Ast.Index) exp);

      case BLOCK:
        SValue last = SValue.now(Values.NULL, IS_NULL);
        for (Ast.Exp e : ((Ast.Block) exp).exps) {
          last = stage(cx, e);
        }
        return last;

      case COMPTIME:
        final SValue comptime = stage(cx, ((Ast.Comptime) exp).exp);
        if (!comptime.isNow()) {
          throw new ComptimeException("comptime expression evaluated to "
              + "runtime value: " + svalueToResidual(comptime));
        }
        return comptime;

      case RUNTIME:
        final Ast.Runtime runtime = (Ast.Runtime) exp;
        final SValue runtimeValue = stage(cx, runtime.exp);
        final String name =
            runtime.name != null ? runtime.name : session.fresh("rt");
        // The value may differ at run time, so forget literal bounds
        return SValue.later(Constraints.widen(runtimeValue.constraint),
            ast.id(name));

      case ASSERT:
        return stageAssert(cx, (Ast.Assert) exp);

      case ASSERT_COND:
        return stageAssertCond(cx, (Ast.AssertCond) exp);

      case TRUST:
        return stageTrust(cx, (Ast.Trust) exp);

      case TYPE_OF:
        final Constraint c = stage(cx, ((Ast.TypeOf) exp).exp).constraint;
        return SValue.now(Values.type(c), isType(c));

      case IMPORT:
        return stageImport(cx, (Ast.Import) exp);

      default:
        throw new AssertionError("unknown op " + exp.op);
    }
  }

  private List<SValue> stageAll(Context cx, List<Ast.Exp> exps) {
    return transformEager(exps, e -> stage(cx, e));
  }

  /** Throws {@link TypeException} unless {@code actual} implies
   * {@code expected}. A value about which nothing is known (constraint
   * {@code any}) is checked at run time, not here. */
  static void requireConstraint(Constraint actual, Constraint expected,
      String context) {
    if (!actual.equals(ANY) && !Implication.implies(actual, expected)) {
      throw new TypeException(expected, actual, context);
    }
  }

  private SValue stageId(Context cx, String name) {
    final SValue sv = cx.env.get(name);
    final @Nullable Constraint refinement = cx.refinementContext.get(name);
    if (refinement != null) {
      final Constraint refined =
          Constraints.narrowOr(sv.constraint, refinement);
      if (sv instanceof SValue.Now) {
        final SValue.Now now = (SValue.Now) sv;
        final Ast.@Nullable Exp residual = now.residual != null
            ? now.residual
            : Values.isCompound(now.value) ? ast.id(name) : null;
        return SValue.now(now.value, refined, residual);
      } else if (sv instanceof SValue.LaterArray) {
        return SValue.laterArray(((SValue.LaterArray) sv).elements, refined);
      } else {
        return SValue.later(refined, ((SValue.Later) sv).residual);
      }
    }
    if (sv instanceof SValue.Now) {
      final SValue.Now now = (SValue.Now) sv;
      if (now.residual == null && Values.isCompound(now.value)) {
        return SValue.now(now.value, now.constraint, ast.id(name));
      }
    }
    return sv;
  }

  private SValue stageInfix(Context cx, Ast.InfixCall call) {
    final SValue left = stage(cx, call.a0);
    final SValue right = stage(cx, call.a1);
    final boolean string = call.op == Op.PLUS
        && (Implication.implies(left.constraint, IS_STRING)
            || Implication.implies(right.constraint, IS_STRING));
    final Constraint paramType;
    if (string) {
      paramType = IS_STRING;
    } else {
      switch (call.op) {
        case EQ:
        case NE:
          paramType = ANY;
          break;
        case ANDALSO:
        case ORELSE:
          paramType = IS_BOOL;
          break;
        default:
          paramType = IS_NUMBER;
      }
    }
    final String prefix = string ? "string " : "";
    requireConstraint(left.constraint, paramType,
        "left of " + prefix + call.op.symbol);
    requireConstraint(right.constraint, paramType,
        "right of " + prefix + call.op.symbol);

    if (left.isNow() && right.isNow()) {
      final Value result =
          compute(call.op, ((SValue.Now) left).value,
              ((SValue.Now) right).value);
      return SValue.now(result, Values.constraintOf(result));
    }
    return SValue.later(
        resultType(call.op, string, left.constraint, right.constraint),
        ast.infixCall(call.op, svalueToResidual(left),
            svalueToResidual(right)));
  }

  /** Computes the value of a binary operator, following JavaScript
   * semantics. */
  static Value compute(Op op, Value v0, Value v1) {
    switch (op) {
      case PLUS:
        if (v0.kind == Value.Kind.STRING) {
          return Values.string(Codes.str(v0) + Codes.str(v1));
        }
        return Values.number(Codes.num(v0) + Codes.num(v1));
      case MINUS:
        return Values.number(Codes.num(v0) - Codes.num(v1));
      case TIMES:
        return Values.number(Codes.num(v0) * Codes.num(v1));
      case DIVIDE:
        return Values.number(Codes.num(v0) / Codes.num(v1));
      case MOD:
        return Values.number(Codes.num(v0) % Codes.num(v1));
      case EQ:
        return Values.bool(Values.valueEquals(v0, v1));
      case NE:
        return Values.bool(!Values.valueEquals(v0, v1));
      case LT:
        return Values.bool(Codes.num(v0) < Codes.num(v1));
      case GT:
        return Values.bool(Codes.num(v0) > Codes.num(v1));
      case LE:
        return Values.bool(Codes.num(v0) <= Codes.num(v1));
      case GE:
        return Values.bool(Codes.num(v0) >= Codes.num(v1));
      case ANDALSO:
        return Values.bool(bool(v0) && bool(v1));
      case ORELSE:
        return Values.bool(bool(v0) || bool(v1));
      default:
        throw new AssertionError("unknown op " + op);
    }
  }

  private static boolean bool(Value value) {
    return ((Value.Bool) value).value;
  }

  /** Computes the constraint of a binary operator whose value is not
   * known. If both operands' constraints pin a literal, so does the
   * result. */
  private static Constraint resultType(Op op, boolean string, Constraint c0,
      Constraint c1) {
    final Constraint.Equals e0 = Constraints.extractEquals(c0);
    final Constraint.Equals e1 = Constraints.extractEquals(c1);
    final boolean zeroDivisor = (op == Op.DIVIDE || op == Op.MOD)
        && e1 != null && e1.value instanceof Double
        && (Double) e1.value == 0d;
    if (e0 != null && e1 != null && !zeroDivisor) {
      return Values.constraintOf(
          compute(op, Values.fromLiteral(e0.value),
              Values.fromLiteral(e1.value)));
    }
    switch (op) {
      case ANDALSO:
      case ORELSE:
        final Boolean shortCircuit = op == Op.ORELSE;
        if (e0 != null && shortCircuit.equals(e0.value)
            || e1 != null && shortCircuit.equals(e1.value)) {
          return and(IS_BOOL, equalTo(shortCircuit));
        }
        return IS_BOOL;
      default:
        return string ? IS_STRING
            : op.isArithmetic() ? IS_NUMBER
            : IS_BOOL;
    }
  }

  private SValue stagePrefix(Context cx, Ast.PrefixCall call) {
    final SValue operand = stage(cx, call.a);
    final Constraint paramType = call.op == Op.NOT ? IS_BOOL : IS_NUMBER;
    requireConstraint(operand.constraint, paramType,
        "operand of " + call.op.symbol);
    if (operand.isNow()) {
      final Value result = negate(call.op, ((SValue.Now) operand).value);
      return SValue.now(result, Values.constraintOf(result));
    }
    final Constraint.Equals e = Constraints.extractEquals(operand.constraint);
    final Constraint result = e != null
        ? Values.constraintOf(negate(call.op, Values.fromLiteral(e.value)))
        : paramType;
    return SValue.later(result,
        ast.prefixCall(call.op, svalueToResidual(operand)));
  }

  private static Value negate(Op op, Value value) {
    switch (op) {
      case NEGATE:
        return Values.number(-Codes.num(value));
      case NOT:
        return Values.bool(!bool(value));
      default:
        throw new AssertionError("unknown op " + op);
    }
  }

  private SValue stageIf(Context cx, Ast.If if_) {
    final SValue condition = stage(cx, if_.condition);
    requireConstraint(condition.constraint, IS_BOOL, "if condition");
    final Map<String, Constraint> refinements =
        Refinements.extract(if_.condition);
    final Context trueCx = cx.refine(refinements);
    final Context falseCx = cx.refine(Refinements.negate(refinements));
    if (condition.isNow()) {
      final Value value = ((SValue.Now) condition).value;
      if (value.kind != Value.Kind.BOOL) {
        throw new StageException("if condition must be boolean");
      }
      return bool(value)
          ? stage(trueCx, if_.ifTrue)
          : stage(falseCx, if_.ifFalse);
    }
    final SValue ifTrue = stage(trueCx, if_.ifTrue);
    final SValue ifFalse = stage(falseCx, if_.ifFalse);
    return SValue.later(simplify(or(ifTrue.constraint, ifFalse.constraint)),
        ast.ifThenElse(svalueToResidual(condition),
            svalueToResidual(ifTrue), svalueToResidual(ifFalse)));
  }

  private static boolean isSimple(Ast.Exp exp) {
    return exp.op == Op.ID || exp.op == Op.LITERAL;
  }

  private SValue stageLet(Context cx, Ast.Let let) {
    final SValue value = stage(cx, let.exp);
    // Refer to a complex residual by name, so that it is evaluated once
    final SValue bound =
        value instanceof SValue.Later
            && !isSimple(((SValue.Later) value).residual)
            ? SValue.later(value.constraint, ast.id(let.name))
            : value;
    final SValue body = stage(cx.bind(let.name, bound), let.body);
    if (body.isNow()) {
      return body;
    }
    final boolean used;
    if (!value.isNow()
        || Values.isCompound(((SValue.Now) value).value)) {
      used = FreeFinder.usesVar(let.body, let.name);
    } else {
      used = FreeFinder.usesVar(svalueToResidual(body), let.name);
    }
    if (!used) {
      return body;
    }
    final Ast.Exp valueResidual = value.isNow()
        ? valueToExpr(((SValue.Now) value).value)
        : svalueToResidual(value);
    return SValue.later(body.constraint,
        ast.let(let.name, valueResidual, svalueToResidual(body)));
  }

  private SValue stageLetPattern(Context cx, Ast.LetPattern letPattern) {
    final SValue value = stage(cx, letPattern.exp);
    final Map<String, SValue> bindings = new LinkedHashMap<>();
    final Ast.Exp tmp = ast.id(session.fresh());
    destructure(letPattern.pat, value, tmp, bindings);
    final SValue body = stage(cx.bindAll(bindings), letPattern.body);
    if (body.isNow() || value.isNow()) {
      return body;
    }
    if (!anyMatch(letPattern.pat.vars(),
        name -> FreeFinder.usesVar(letPattern.body, name))) {
      return body;
    }
    return SValue.later(body.constraint,
        ast.letPattern(letPattern.pat, svalueToResidual(value),
            svalueToResidual(body)));
  }

  /** Binds the variables of a pattern to parts of a staged value. A
   * variable bound to a value that is not known refers to itself, because
   * the residual code will destructure the value too. */
  private void destructure(Ast.Pat pat, SValue value, Ast.Exp path,
      Map<String, SValue> bindings) {
    switch (pat.op) {
      case ID_PAT:
        final String name = ((Ast.IdPat) pat).name;
        bindings.put(name,
            value.isNow() ? value : SValue.later(value.constraint,
                ast.id(name)));
        return;

      case ARRAY_PAT:
        final List<Ast.Pat> args = ((Ast.ArrayPat) pat).args;
        for (int i = 0; i < args.size(); i++) {
          final Ast.Exp elementPath = ast.index(path, ast.literal(i));
          final SValue element;
          if (value instanceof SValue.Now) {
            final Value v = ((SValue.Now) value).value;
            element = v instanceof Value.Arr
                && i < ((Value.Arr) v).elements.size()
                ? nowOf(((Value.Arr) v).elements.get(i))
                : SValue.later(ANY, elementPath);
          } else if (value instanceof SValue.LaterArray) {
            final List<SValue> elements =
                ((SValue.LaterArray) value).elements;
            element = i < elements.size()
                ? elements.get(i)
                : SValue.later(ANY, elementPath);
          } else {
            element =
                SValue.later(Constraints.extractElementAt(value.constraint, i),
                    elementPath);
          }
          destructure(args.get(i), element, elementPath, bindings);
        }
        return;

      case RECORD_PAT:
        final Map<String, Ast.Pat> fields = ((Ast.RecordPat) pat).args;
        fields.forEach((fieldName, fieldPat) -> {
          final Ast.Exp fieldPath = ast.field(path, fieldName);
          @Nullable SValue field = null;
          if (value instanceof SValue.Now) {
            final Value v = ((SValue.Now) value).value;
            if (v instanceof Value.Obj) {
              final Value f = ((Value.Obj) v).fields.get(fieldName);
              if (f != null) {
                field = nowOf(f);
              }
            }
          } else {
            final Constraint c =
                Constraints.extractFieldConstraint(value.constraint,
                    fieldName);
            if (c != null) {
              field = SValue.later(c, fieldPath);
            }
          }
          destructure(fieldPat,
              field != null ? field : SValue.later(ANY, fieldPath),
              fieldPath, bindings);
        });
        return;

      default:
        throw new AssertionError("unknown op " + pat.op);
    }
  }

  private static SValue nowOf(Value value) {
    return SValue.now(value, Values.constraintOf(value));
  }

  private SValue stageApply(Context cx, Ast.Apply apply) {
    final SValue fn = stage(cx, apply.fn);
    if (fn instanceof SValue.Now
        && ((SValue.Now) fn).value instanceof Value.Builtin) {
      final String name = ((Value.Builtin) ((SValue.Now) fn).value).name;
      final BuiltIn builtIn = BuiltIn.lookup(name);
      if (builtIn == null) {
        throw new StageException("Unknown builtin: " + name);
      }
      return applyBuiltIn(cx, builtIn, stageAll(cx, apply.args),
          apply.args);
    }
    requireConstraint(fn.constraint, IS_FUNCTION, "function call");
    final List<SValue> args = stageAll(cx, apply.args);
    return invoke(cx, fn, args);
  }

  /** Applies a function to staged arguments. */
  private SValue invoke(Context cx, SValue fn, List<SValue> args) {
    if (!(fn instanceof SValue.Now)) {
      // The function is not known; all we know is its type
      final Constraint result =
          Generics.inferCallResult(fn.constraint, constraints(args),
              session.varGenerator);
      return SValue.later(result,
          ast.apply(svalueToResidual(fn), residuals(args)));
    }
    final SValue.Now now = (SValue.Now) fn;
    if (now.value instanceof Value.Builtin) {
      final String name = ((Value.Builtin) now.value).name;
      final BuiltIn builtIn = BuiltIn.lookup(name);
      if (builtIn == null) {
        throw new StageException("Unknown builtin: " + name);
      }
      return applyBuiltIn(cx, builtIn, args, residuals(args));
    }
    if (!(now.value instanceof Value.Closure)) {
      throw new StageException("Cannot call non-function");
    }
    return applyClosure(now, (Value.Closure) now.value, args);
  }

  private SValue applyClosure(SValue.Now fn, Value.Closure closure,
      List<SValue> args) {
    final boolean anyLater = anyMatch(args, a -> !a.isNow());
    final String name = closure.name;
    if (name != null && anyLater) {
      if (!session.enter(name)) {
        // Already staging this function's body; leave the call in the
        // residual code
        LOG.debug("recursive call to {} left in residual code", name);
        session.tracer.onRecursionCut(name);
        return SValue.later(ANY, ast.apply(ast.id(name), residuals(args)));
      }
      try {
        final SValue result = stageBody(closure, args);
        return wrapCall(result,
            ast.apply(svalueToResidual(fn), residuals(args)));
      } finally {
        session.exit(name);
      }
    }
    final SValue result = stageBody(closure, args);
    if (anyLater && fn.residual != null) {
      // Call the function rather than inlining its body
      return wrapCall(result, ast.apply(fn.residual, residuals(args)));
    }
    return result;
  }

  private static SValue wrapCall(SValue result, Ast.Exp call) {
    if (result instanceof SValue.Now) {
      return SValue.now(((SValue.Now) result).value, result.constraint,
          call);
    }
    return SValue.later(result.constraint, call);
  }

  /** Stages the body of a closure, with its arguments bound. */
  private SValue stageBody(Value.Closure closure, List<SValue> args) {
    final ClosureArena.Entry entry = session.closures.get(closure);
    final Ast.Fn fn = entry.fn;
    final Map<String, SValue> bindings = new LinkedHashMap<>();
    if (closure.name != null) {
      bindings.put(closure.name, SValue.now(closure, IS_FUNCTION));
    }
    if (fn.isDesugared()) {
      bindings.put(AstBuilder.ARGS, createArraySValue(args));
    } else {
      for (int i = 0; i < fn.params.size(); i++) {
        bindings.put(fn.params.get(i),
            i < args.size() ? args.get(i) : SValue.now(Values.NULL, IS_NULL));
      }
    }
    return stage(new Context(entry.env.bindAll(bindings),
        RefinementContext.empty()), fn.body);
  }

  private SValue applyBuiltIn(Context cx, BuiltIn builtIn,
      List<SValue> args, List<Ast.Exp> argExps) {
    final String name = builtIn.camelName;
    final int paramCount = builtIn.params.size();
    if (builtIn.variadic) {
      if (args.size() < paramCount) {
        throw new StageException(name + "() requires at least "
            + paramCount + " arguments, got " + args.size());
      }
    } else if (args.size() != paramCount) {
      throw new StageException(name + "() requires exactly "
          + paramCount + " arguments, got " + args.size());
    }
    for (int i = 0; i < paramCount; i++) {
      requireConstraint(args.get(i).constraint,
          builtIn.params.get(i).constraint,
          "argument " + (i + 1) + " of " + name + "()");
    }
    if (builtIn.staged) {
      final StagedApplicable applicable =
          Codes.STAGED_BUILT_INS.get(builtIn);
      return applicable.apply(args, argExps, cx);
    }
    final Constraint resultType = builtIn.resultType(constraints(args));
    if (allMatch(args, SValue::isNow)) {
      final Value result =
          Codes.BUILT_IN_VALUES.get(builtIn).apply(values(args));
      return SValue.now(result,
          simplify(and(resultType, Values.constraintOf(result))));
    }
    return SValue.later(resultType,
        ast.apply(ast.id(name), residuals(args)));
  }

  private SValue stageMethodCall(Context cx, Ast.MethodCall call) {
    final SValue receiver = stage(cx, call.receiver);
    final String name = call.method;
    final BuiltIn builtIn = BuiltIn.lookup(name);
    if (builtIn != null && builtIn.isMethod) {
      requireConstraint(receiver.constraint,
          builtIn.params.get(0).constraint, "receiver of ." + name + "()");
      final List<SValue> args =
          ImmutableList.<SValue>builder().add(receiver)
              .addAll(stageAll(cx, call.args)).build();
      final List<Ast.Exp> argExps =
          ImmutableList.<Ast.Exp>builder().add(call.receiver)
              .addAll(call.args).build();
      return applyBuiltIn(cx, builtIn, args, argExps);
    }

    final Methods.MethodDef def = Methods.lookup(receiver.constraint, name);
    if (def == null) {
      throw new StageException("No method '" + name + "' on type "
          + receiver.constraint);
    }
    final List<SValue> args = stageAll(cx, call.args);
    if (args.size() != def.params.size()) {
      throw new StageException("Method '" + name + "' expects "
          + def.params.size() + " arguments, got " + args.size());
    }
    for (int i = 0; i < args.size(); i++) {
      requireConstraint(args.get(i).constraint, def.params.get(i),
          "argument " + (i + 1) + " of ." + name + "()");
    }
    final Constraint result =
        def.result(receiver.constraint, constraints(args));
    if (!receiver.isNow() || anyMatch(args, a -> !a.isNow())) {
      return SValue.later(result,
          ast.methodCall(svalueToResidual(receiver), name,
              residuals(args)));
    }
    final Value value =
        def.impl.apply(
            ImmutableList.<Value>builder()
                .add(((SValue.Now) receiver).value)
                .addAll(values(args))
                .build());
    return SValue.now(value,
        simplify(and(result, Values.constraintOf(value))));
  }

  private SValue stageRecord(Context cx, Ast.Record record) {
    final Map<String, SValue> fields = new LinkedHashMap<>();
    record.args.forEach((name, e) -> fields.put(name, stage(cx, e)));
    final List<Constraint> constraints = new ArrayList<>();
    constraints.add(IS_OBJECT);
    fields.forEach((name, sv) ->
        constraints.add(hasField(name, sv.constraint)));
    constraints.add(indexSig(NEVER));
    final Constraint c = and(constraints);
    final Map<String, Ast.Exp> residuals = new LinkedHashMap<>();
    fields.forEach((name, sv) -> residuals.put(name, svalueToResidual(sv)));
    if (allMatch(fields.values(), SValue::isNow)) {
      final Map<String, Value> values = new LinkedHashMap<>();
      fields.forEach((name, sv) -> values.put(name, ((SValue.Now) sv).value));
      final boolean anyResidual =
          anyMatch(fields.values(), sv -> ((SValue.Now) sv).residual != null);
      return SValue.now(Values.object(values), c,
          anyResidual ? ast.record(residuals) : null);
    }
    return SValue.later(c, ast.record(residuals));
  }

  private SValue stageField(Context cx, Ast.Field field) {
    final SValue record = stage(cx, field.exp);
    final String name = field.name;
    requireConstraint(record.constraint, IS_OBJECT,
        "field access ." + name);
    if (record instanceof SValue.Now) {
      final Value value = ((SValue.Now) record).value;
      if (!(value instanceof Value.Obj)) {
        throw new StageException("Cannot access field '" + name
            + "' on non-object");
      }
      final Value fieldValue = ((Value.Obj) value).fields.get(name);
      if (fieldValue == null) {
        throw new StageException("Object has no field '" + name + "'");
      }
      final Constraint c =
          Constraints.extractFieldConstraint(record.constraint, name);
      return SValue.now(fieldValue,
          c != null ? c : Values.constraintOf(fieldValue));
    }
    final Constraint c = fieldConstraint(record.constraint, name);
    return SValue.later(c, ast.field(svalueToResidual(record), name));
  }

  /** Returns the constraint on a field of an object whose value is not
   * known. */
  private Constraint fieldConstraint(Constraint c, String name) {
    final int maxUnrollDepth = Prop.MAX_UNROLL_DEPTH.intValue(session.map);
    final Constraint f =
        Constraints.extractFieldConstraint(c, name, maxUnrollDepth);
    if (f != null) {
      return f;
    }
    final Constraint index = Constraints.extractIndexSig(c);
    if (index == null) {
      // Nothing is known about the object's fields
      return ANY;
    }
    if (index.isNever()) {
      throw new TypeException(hasField(name, ANY), c,
          "field access ." + name);
    }
    return index;
  }

  private SValue stageArray(Context cx, Ast.Array array) {
    final List<SValue> elements = stageAll(cx, array.args);
    final Constraint c = arrayConstraint(elements);
    if (allMatch(elements, SValue::isNow)) {
      final boolean anyResidual =
          anyMatch(elements, sv -> ((SValue.Now) sv).residual != null);
      return SValue.now(Values.array(values(elements)), c,
          anyResidual ? ast.array(residuals(elements)) : null);
    }
    return SValue.laterArray(elements, c);
  }

  /** Creates the staged value of an array, such as the arguments of a
   * call. */
  static SValue createArraySValue(List<SValue> elements) {
    final Constraint c = arrayConstraint(elements);
    if (allMatch(elements, SValue::isNow)) {
      return SValue.now(Values.array(values(elements)), c);
    }
    return SValue.laterArray(elements, c);
  }

  private static Constraint arrayConstraint(List<SValue> elements) {
    return Constraints.arrayLiteral(
        transformEager(elements, sv -> sv.constraint));
  }

  private SValue stageIndex(Context cx, Ast.Index index) {
    final SValue array = stage(cx, index.exp);
    final SValue i = stage(cx, index.index);
    requireConstraint(array.constraint, IS_ARRAY, "array index");
    requireConstraint(i.constraint, IS_NUMBER, "array index");
    final @Nullable Double d = i instanceof SValue.Now
        && ((SValue.Now) i).value instanceof Value.Num
        ? Codes.num(((SValue.Now) i).value)
        : null;
    if (array instanceof SValue.Now && d != null) {
      final Value value = ((SValue.Now) array).value;
      if (!(value instanceof Value.Arr)) {
        throw new StageException("Cannot index non-array");
      }
      final List<Value> elements = ((Value.Arr) value).elements;
      if (!isInteger(d) || d < 0) {
        throw new StageException("Invalid array index: "
            + numberToString(d));
      }
      if (d >= elements.size()) {
        throw new StageException("Array index out of bounds: "
            + numberToString(d) + " >= " + elements.size());
      }
      final Value element = elements.get(d.intValue());
      final Constraint c =
          Constraints.extractElementAt(array.constraint, d.intValue());
      return SValue.now(element,
          c.equals(ANY) ? Values.constraintOf(element) : c);
    }
    final boolean validIndex = d != null && isInteger(d) && d >= 0;
    if (array instanceof SValue.LaterArray && validIndex) {
      final List<SValue> elements = ((SValue.LaterArray) array).elements;
      if (d < elements.size()) {
        return elements.get(d.intValue());
      }
    }
    final Constraint elements = Constraints.extractElements(array.constraint);
    final Constraint c = validIndex
        ? Constraints.extractElementAt(array.constraint, d.intValue())
        : elements != null ? elements : ANY;
    return SValue.later(c,
        ast.index(svalueToResidual(array), svalueToResidual(i)));
  }

  private SValue stageAssert(Context cx, Ast.Assert assert_) {
    final SValue type = stage(cx, assert_.constraint);
    if (!(type instanceof SValue.Now)) {
      throw new StageException(
          "assert requires a compile-time known type constraint");
    }
    final Value typeValue = ((SValue.Now) type).value;
    if (!(typeValue instanceof Value.TypeValue)) {
      throw new TypeException(isType(ANY), type.constraint,
          "assert constraint");
    }
    final Constraint target = ((Value.TypeValue) typeValue).constraint;
    final SValue value = stage(cx, assert_.exp);
    final Constraint unified = unify(value.constraint, target);
    if (value instanceof SValue.Now) {
      final Value v = ((SValue.Now) value).value;
      if (!Values.satisfies(v, target)) {
        throw new AssertException(
            assert_.message != null
                ? assert_.message
                : "Assertion failed: value " + v + " does not satisfy "
                    + target,
            v, target);
      }
      return SValue.now(v, unified);
    }
    return SValue.later(unified,
        ast.assertType(svalueToResidual(value), assert_.constraint,
            assert_.message));
  }

  private SValue stageAssertCond(Context cx, Ast.AssertCond assertCond) {
    final SValue condition = stage(cx, assertCond.condition);
    if (condition instanceof SValue.Now) {
      final Value value = ((SValue.Now) condition).value;
      if (value.kind != Value.Kind.BOOL) {
        throw new StageException("assert condition must be boolean");
      }
      if (!bool(value)) {
        throw new AssertException(
            assertCond.message != null
                ? assertCond.message
                : "Assertion failed: condition is false",
            value, IS_BOOL);
      }
      return SValue.now(Values.TRUE, IS_BOOL);
    }
    return SValue.later(IS_BOOL,
        ast.assertCond(svalueToResidual(condition), assertCond.message));
  }

  private SValue stageTrust(Context cx, Ast.Trust trust) {
    final SValue value = stage(cx, trust.exp);
    if (trust.constraint == null) {
      return value;
    }
    final SValue type = stage(cx, trust.constraint);
    if (!(type instanceof SValue.Now)) {
      throw new StageException(
          "trust requires a compile-time known type constraint");
    }
    final Constraint unified =
        unify(value.constraint, typeConstraint(((SValue.Now) type).value));
    if (value instanceof SValue.Now) {
      final SValue.Now now = (SValue.Now) value;
      return SValue.now(now.value, unified, now.residual);
    }
    if (value instanceof SValue.LaterArray) {
      return SValue.laterArray(((SValue.LaterArray) value).elements,
          unified);
    }
    return SValue.later(unified, ((SValue.Later) value).residual);
  }

  /** Converts a value used as a type annotation to a constraint. An array
   * of types is a tuple type; an object with a field "__arrayOf" is an
   * array type. */
  private static Constraint typeConstraint(Value value) {
    if (value instanceof Value.TypeValue) {
      return ((Value.TypeValue) value).constraint;
    }
    if (value instanceof Value.Arr) {
      return Constraints.tuple(
          transformEager(((Value.Arr) value).elements,
              Stager::typeConstraint));
    }
    if (value instanceof Value.Obj) {
      final Value elementType = ((Value.Obj) value).fields.get("__arrayOf");
      if (elementType != null) {
        return arrayOf(typeConstraint(elementType));
      }
    }
    throw new TypeException(isType(ANY), Values.constraintOf(value),
        "trust constraint");
  }

  private SValue stageImport(Context cx, Ast.Import import_) {
    final String path = import_.modulePath;
    SEnv env = cx.env;
    for (String name : import_.names) {
      final Constraint c = session.exportConstraint(loader, path, name);
      if (c == null) {
        throw new StageException("Module \"" + path
            + "\" has no export named \"" + name + "\"");
      }
      final ModuleLoader.Signature signature =
          session.exportSignature(path, name);
      final int paramCount =
          signature == null ? -1 : paramCount(signature.constraint);
      if (signature != null && signature.typeParamCount > 0
          && paramCount >= 0) {
        // "name" is a closure that forwards to the imported function;
        // each call instantiates the signature, so the result keeps the
        // types of the arguments
        final String implName = "__" + name + "_impl";
        env = env.bind(implName,
            SValue.later(signature.constraint, ast.id(name)));
        env = env.bind(name,
            SValue.now(forwardingClosure(implName, paramCount, env),
                IS_FUNCTION));
      } else {
        env = env.bind(name, SValue.later(c, ast.id(name)));
      }
    }
    final SValue body =
        stage(new Context(env, cx.refinementContext), import_.body);
    if (body.isNow()) {
      return body;
    }
    if (!anyMatch(import_.names,
        name -> FreeFinder.usesVar(import_.body, name))) {
      return body;
    }
    return SValue.later(body.constraint,
        ast.importExp(import_.names, path, svalueToResidual(body)));
  }

  /** Creates a closure whose body calls {@code implName} with its
   * parameters. */
  private Value.Closure forwardingClosure(String implName, int paramCount,
      SEnv env) {
    final List<String> params = new ArrayList<>();
    for (int i = 0; i < paramCount; i++) {
      params.add("p" + i);
    }
    final Ast.Fn fn =
        ast.fn(params,
            ast.apply(ast.id(implName), transformEager(params, ast::id)));
    return session.closures.register(fn, env);
  }

  /** Returns the number of parameters of a function type, or -1. */
  private static int paramCount(Constraint c) {
    if (c instanceof Constraint.GenericFnType) {
      return ((Constraint.GenericFnType) c).params.size();
    }
    if (c instanceof Constraint.FnType) {
      return ((Constraint.FnType) c).params.size();
    }
    return -1;
  }


  private static List<Constraint> constraints(List<SValue> svalues) {
    return transformEager(svalues, sv -> sv.constraint);
  }

  private static List<Value> values(List<SValue> svalues) {
    return transformEager(svalues, sv -> ((SValue.Now) sv).value);
  }

  private List<Ast.Exp> residuals(List<SValue> svalues) {
    return transformEager(svalues, this::svalueToResidual);
  }

  /** Converts a staged value to an expression that computes it. */
  public Ast.Exp svalueToResidual(SValue sv) {
    if (sv instanceof SValue.Later) {
      return ((SValue.Later) sv).residual;
    }
    if (sv instanceof SValue.LaterArray) {
      return ast.array(residuals(((SValue.LaterArray) sv).elements));
    }
    final SValue.Now now = (SValue.Now) sv;
    return now.residual != null ? now.residual : valueToExpr(now.value);
  }

  /** Converts a value to an expression.
   *
   * @throws UnsupportedConstructException if the value is a type */
  public Ast.Exp valueToExpr(Value value) {
    switch (value.kind) {
      case NUMBER:
      case STRING:
      case BOOL:
      case NULL:
        return ast.literal(Values.toLiteral(value));
      case OBJECT:
        final Map<String, Ast.Exp> fields = new LinkedHashMap<>();
        ((Value.Obj) value).fields.forEach((name, v) ->
            fields.put(name, valueToExpr(v)));
        return ast.record(fields);
      case ARRAY:
        return ast.array(
            transformEager(((Value.Arr) value).elements, this::valueToExpr));
      case CLOSURE:
        return session.closures.get((Value.Closure) value).fn;
      case TYPE:
        throw new UnsupportedConstructException(
            "Cannot convert type value to expression: " + value);
      case BUILTIN:
        return ast.id(((Value.Builtin) value).name);
      default:
        throw new AssertionError("unknown kind " + value.kind);
    }
  }

  /** Converts a closure to a function expression, staging its body with
   * its parameters bound to values that are not known. */
  public Ast.Fn closureToResidual(Value value) {
    if (!(value instanceof Value.Closure)) {
      throw new StageException("closureToResidual requires a closure value");
    }
    final Value.Closure closure = (Value.Closure) value;
    final Ast.Fn fn = session.closures.get(closure).fn;
    SEnv env = session.closures.get(closure).env;
    if (closure.name != null) {
      env = env.bind(closure.name, SValue.now(closure, IS_FUNCTION));
    }
    final List<SValue> params = new ArrayList<>();
    for (String param : fn.params) {
      final SValue sv = SValue.later(ANY, ast.id(param));
      params.add(sv);
      env = env.bind(param, sv);
    }
    env = env.bind(AstBuilder.ARGS, createArraySValue(params));
    final Ast.Exp body = fn.innerBody();
    for (String name : FreeFinder.freeVars(body)) {
      final SValue sv = env.getOpt(name);
      if (sv == null) {
        // Defined outside, for example by an import
        env = env.bind(name, SValue.later(ANY, ast.id(name)));
      } else if (sv instanceof SValue.Now
          && ((SValue.Now) sv).residual == null
          && Values.isCompound(((SValue.Now) sv).value)) {
        env = env.bind(name,
            SValue.now(((SValue.Now) sv).value, sv.constraint,
                ast.id(name)));
      }
    }
    final SValue result =
        stage(new Context(env, RefinementContext.empty()), body);
    final String name = closure.name != null ? closure.name : "fn";
    LOG.debug("staged closure {} for residual code", name);
    session.tracer.onClosureStaged(name);
    final Ast.Exp residual = svalueToResidual(result);
    return closure.name != null
        ? ast.residualRecFn(closure.name, fn.params, residual)
        : ast.residualFn(fn.params, residual);
  }

  /** Environment and refinements in which an expression is staged. */
  private class Context implements StagedContext {
    final SEnv env;
    final RefinementContext refinementContext;

    Context(SEnv env, RefinementContext refinementContext) {
      this.env = env;
      this.refinementContext = refinementContext;
    }

    Context bind(String name, SValue value) {
      return new Context(env.bind(name, value), refinementContext);
    }

    Context bindAll(Map<String, SValue> bindings) {
      return new Context(env.bindAll(bindings), refinementContext);
    }

    Context refine(Map<String, Constraint> refinements) {
      return new Context(env, refinementContext.refineAll(refinements));
    }

    @Override public Session session() {
      return session;
    }

    @Override public SEnv env() {
      return env;
    }

    @Override public RefinementContext refinementContext() {
      return refinementContext;
    }

    @Override public SValue invoke(SValue fn, List<SValue> args) {
      return Stager.this.invoke(this, fn, args);
    }

    @Override public Ast.Exp valueToExpr(Value value) {
      return Stager.this.valueToExpr(value);
    }

    @Override public Ast.Exp residual(SValue value) {
      return svalueToResidual(value);
    }
  }

  /** Implementation of {@link BackendContext}. */
  private class BackendContextImpl<T> implements BackendContext<T> {
    private final Backend<T> backend;
    private final SEnv env;

    BackendContextImpl(Backend<T> backend, SEnv env) {
      this.backend = backend;
      this.env = env;
    }

    @Override public SValue stage(Ast.Exp exp) {
      return Stager.this.stage(exp, env);
    }

    @Override public SValue stage(Ast.Exp exp, SEnv localEnv) {
      return Stager.this.stage(exp, localEnv);
    }

    @Override public SEnv env() {
      return env;
    }

    @Override public Ast.Exp svalueToResidual(SValue sv) {
      return Stager.this.svalueToResidual(sv);
    }

    @Override public Ast.Fn closureToResidual(Value closure) {
      return Stager.this.closureToResidual(closure);
    }

    @Override public T generate(SValue sv) {
      return backend.generate(sv, this);
    }

    @Override public T generateExpr(Ast.Exp exp) {
      return generate(stage(exp));
    }
  }
}

// End Stager.java
