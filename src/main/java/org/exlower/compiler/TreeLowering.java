/*
 * Copyright 2025 The Exlower Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */


package org.exlower.compiler;

import com.google.common.collect.ImmutableList;
import com.google.common.primitives.Ints;
import com.google.errorprone.annotations.FormatMethod;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import org.exlower.ast.AstPrinter;
import org.exlower.ast.ElixirAst;
import org.exlower.ast.ElixirAst.Clause;
import org.exlower.ast.ElixirAst.Entry;
import org.exlower.ast.Metadata;
import org.exlower.ast.Pattern;
import org.exlower.typed.EnumDecl;
import org.exlower.typed.TVar;
import org.exlower.typed.TypeRef;
import org.exlower.typed.TypedExpr;
import org.exlower.typed.TypedExpr.BinOp;
import org.exlower.typed.TypedExpr.UnOp;
import org.exlower.util.Names;
import org.jspecify.annotations.Nullable;

/**
 * Lowers a typed tree to an Elixir AST, one node at a time.
 *
 * <p>Each node is lowered in one of three positions:
 *
 * <ul>
 *   <li>EXPR: its value is used;
 *   <li>STATEMENT: its value is discarded, and it may be elided entirely (the visit method returns
 *       null);
 *   <li>TAIL: its value is the result of the enclosing function, so a {@code return} here is
 *       lowered to its value.
 * </ul>
 *
 * Constructs that have no Elixir equivalent are lowered to a {@link ElixirAst.Diagnostic} node and
 * reported to the context; lowering continues with the next node.
 */
final class TreeLowering extends VisitorBase<@Nullable ElixirAst> {

  enum Position {
    EXPR,
    STATEMENT,
    TAIL
  }

  /** A structural loop whose body is being lowered. */
  static final class LoopFrame {
    /** The outer variables that the loop threads from one iteration to the next. */
    final ImmutableList<TVar> state;

    boolean breaks;
    boolean continues;

    LoopFrame(ImmutableList<TVar> state) {
      this.state = state;
    }
  }

  private static final java.util.regex.Pattern RAW_ARG =
      java.util.regex.Pattern.compile("\\{(\\d+)\\}");

  private static final String SWITCH_VALUE = "switch_value";

  private static final long UINT32_MASK = 0xFFFFFFFFL;

  final LoweringOptions options;
  private final ClauseBindingPlanner planner;
  private final LoopIntentClassifier classifier;
  private final LoopSynthesizer synthesizer;
  private final BuiltinCalls builtins;

  private Position position = Position.TAIL;
  private Deque<LoopFrame> loopFrames = new ArrayDeque<>();

  TreeLowering(CompilationContext ctx) {
    super(ctx);
    this.options = ctx.options();
    this.planner = new ClauseBindingPlanner(options);
    this.classifier = new LoopIntentClassifier(options);
    this.synthesizer = new LoopSynthesizer(this, classifier);
    this.builtins = new BuiltinCalls(this);
  }

  /** The position of the node currently being lowered. */
  Position position() {
    return position;
  }

  /** Lowers {@code e} in position {@code p}; returns null if it was elided. */
  @Nullable ElixirAst lower(TypedExpr e, Position p) {
    Position prev = position;
    position = p;
    ElixirAst result = visit(e);
    position = prev;
    if (result != null) {
      addMetadata(e, result);
    }
    return result;
  }

  /** Lowers {@code e} in position {@code p}; a node that was elided becomes a diagnostic. */
  ElixirAst lowerRequired(TypedExpr e, Position p) {
    ElixirAst result = lower(e, p);
    return (result != null) ? result : diagnostic("%s has no value", e.kind());
  }

  ElixirAst lowerExpr(TypedExpr e) {
    return lowerRequired(e, Position.EXPR);
  }

  ImmutableList<ElixirAst> lowerExprs(List<TypedExpr> exprs) {
    return exprs.stream().map(this::lowerExpr).collect(ImmutableList.toImmutableList());
  }

  /**
   * Lowers the body of a branch, clause, or function in position {@code p}; an empty body becomes
   * {@code nil}.
   */
  ElixirAst lowerBody(TypedExpr e, Position p) {
    ElixirAst result = lower(e, p);
    return (result != null) ? result : ElixirAst.nil();
  }

  private static void addMetadata(TypedExpr e, ElixirAst result) {
    Metadata metadata = result.metadata();
    if (metadata.pos() == null) {
      metadata = metadata.withPos(e.pos);
    }
    if (metadata.type() == null) {
      metadata = metadata.withType(e.type);
    }
    TypedExpr unwrapped = e.unwrap();
    if (unwrapped instanceof TypedExpr.Const) {
      metadata = metadata.withPurity(true, true);
    } else if (unwrapped instanceof TypedExpr.Local) {
      metadata = metadata.withPurity(true, false);
    }
    result.setMetadata(metadata);
  }

  /** Returns a diagnostic placeholder for the current node, and reports it. */
  @FormatMethod
  ElixirAst diagnostic(String fmt, Object... fmtArgs) {
    String msg = String.format(fmt, fmtArgs);
    ctx.report(currentPos(), msg);
    return ElixirAst.diagnostic(msg);
  }

  // Statement sequences

  /**
   * Lowers a sequence of statements, the last of which is in position {@code p} (the others are
   * all statements). Returns the lowered statements with elided ones dropped and nested sequences
   * flattened.
   */
  List<ElixirAst> lowerStatements(List<TypedExpr> stmts, Position p) {
    List<ElixirAst> result = new ArrayList<>();
    int i = 0;
    while (i < stmts.size()) {
      TypedExpr stmt = stmts.get(i);
      LoopIntentClassifier.Classification classification = classifier.classify(stmts, i);
      if (classification != null) {
        ElixirAst synthesized = synthesizer.synthesize(classification);
        addMetadata(stmt, synthesized);
        result.add(synthesized);
        i += classification.consumed();
        continue;
      }
      boolean isLast = (i == stmts.size() - 1);
      if (p == Position.TAIL
          && !isLast
          && stmt.unwrap() instanceof TypedExpr.If ifStmt
          && ifStmt.elseExpr == null
          && TypedTrees.alwaysExits(ifStmt.thenExpr)) {
        // if (c) { ...; return x; } rest  ==>  if c do ... x else rest end
        result.add(earlyReturn(ifStmt, stmts.subList(i + 1, stmts.size())));
        break;
      }
      Position stmtPosition = isLast ? p : Position.STATEMENT;
      ElixirAst lowered = lower(stmt, stmtPosition);
      if (lowered instanceof ElixirAst.Block block && stmtPosition == Position.STATEMENT) {
        result.addAll(block.exprs);
      } else if (lowered != null) {
        result.add(lowered);
      }
      i++;
    }
    return result;
  }

  /** Combines lowered statements into a single node (or null, for none in statement position). */
  static @Nullable ElixirAst sequence(List<ElixirAst> stmts, Position p) {
    if (stmts.isEmpty()) {
      return (p == Position.STATEMENT) ? null : ElixirAst.nil();
    } else if (stmts.size() == 1) {
      return stmts.get(0);
    }
    return ElixirAst.block(stmts);
  }

  private ElixirAst earlyReturn(TypedExpr.If ifStmt, List<TypedExpr> rest) {
    ElixirAst cond = lowerExpr(ifStmt.cond);
    ElixirAst thenBranch = lowerBody(ifStmt.thenExpr, Position.TAIL);
    ElixirAst elseBranch = sequence(lowerStatements(rest, Position.TAIL), Position.TAIL);
    ElixirAst result = new ElixirAst.If(cond, thenBranch, elseBranch, false);
    addMetadata(ifStmt, result);
    return result;
  }

  @Override
  public @Nullable ElixirAst visitBlock(TypedExpr.Block node) {
    return sequence(lowerStatements(node.exprs, position), position);
  }

  // Variables and assignment

  @Override
  public ElixirAst visitConst(TypedExpr.Const node) {
    return switch (node.constKind) {
      case INT -> ElixirAst.intLit(((Number) node.value).longValue());
      case FLOAT -> ElixirAst.floatLit(((Number) node.value).doubleValue());
      case STRING -> ElixirAst.string((String) node.value);
      case BOOL -> ElixirAst.bool((Boolean) node.value);
      case NULL -> ElixirAst.nil();
    };
  }

  @Override
  public ElixirAst visitLocal(TypedExpr.Local node) {
    return reference(node.var);
  }

  /** Returns a reference to {@code v}, and records that it was used. */
  ElixirAst.Var reference(TVar v) {
    ctx.markUsed(v);
    return ElixirAst.var(ctx.nameOf(v));
  }

  @Override
  public @Nullable ElixirAst visitVarDecl(TypedExpr.VarDecl node) {
    BindingPlan plan = ctx.plan();
    if (plan != null && plan.isRedundant(node)) {
      return null;
    }
    if (ClauseBindingPlanner.extraction(node) != null
        && planner.reconcile(ctx, node) == ClauseBindingPlanner.Reconciliation.ELIDED) {
      return null;
    }
    String name = ctx.nameOf(node.var);
    if (node.init == null) {
      return rebind(name, ElixirAst.nil());
    }
    TypedExpr init = node.init.unwrap();
    if (init instanceof TypedExpr.Unop unop
        && isStep(unop.op)
        && unop.operand.unwrap() instanceof TypedExpr.Local operand) {
      // var i = g++  ==>  i = g; g = g + 1
      ElixirAst copy = rebind(name, reference(operand.var));
      ElixirAst step = step(unop);
      List<ElixirAst> stmts = new ArrayList<>();
      for (ElixirAst stmt : unop.postfix ? Arrays.asList(copy, step) : Arrays.asList(step, copy)) {
        if (stmt != null) {
          stmts.add(stmt);
        }
      }
      return sequence(stmts, position);
    }
    return rebind(name, lowerExpr(node.init));
  }

  /**
   * Returns {@code name = value}, or (if {@code value} is just {@code name}) null in statement
   * position and {@code value} elsewhere.
   */
  @Nullable ElixirAst rebind(String name, ElixirAst value) {
    if (value instanceof ElixirAst.Var v && v.name.equals(name)) {
      return (position == Position.STATEMENT) ? null : value;
    }
    return ElixirAst.match(Pattern.var(name), value);
  }

  @Override
  public @Nullable ElixirAst visitAssign(TypedExpr.Assign node) {
    TypedExpr lhs = node.lhs.unwrap();
    ElixirAst value =
        (node.op == null)
            ? lowerExpr(node.rhs)
            : binop(node.op, node.lhs, node.rhs, node.lhs.type);
    return assignTo(lhs, value);
  }

  /**
   * Returns the statement that stores {@code value} in {@code lhs}. Since Elixir values are
   * immutable, storing into a field or element rebuilds each enclosing value up to the variable
   * that holds it.
   */
  @Nullable ElixirAst assignTo(TypedExpr lhs, ElixirAst value) {
    lhs = lhs.unwrap();
    if (lhs instanceof TypedExpr.Local local) {
      return rebind(ctx.nameOf(local.var), value);
    } else if (lhs instanceof TypedExpr.Field field
        && (field.fieldKind == TypedExpr.FieldKind.INSTANCE
            || field.fieldKind == TypedExpr.FieldKind.ANON)) {
      ElixirAst updated =
          new ElixirAst.MapUpdate(
              lowerExpr(field.obj), List.of(new Entry(ElixirAst.atom(field.name), value)));
      return assignTo(field.obj, updated);
    } else if (lhs instanceof TypedExpr.ArrayAccess access) {
      ElixirAst container = lowerExpr(access.array);
      ElixirAst key = lowerExpr(access.index);
      ElixirAst updated =
          access.array.type.is(TypeRef.Kind.MAP)
              ? ElixirAst.remote("Map", "put", container, key, value)
              : ElixirAst.remote("List", "replace_at", container, key, value);
      return assignTo(access.array, updated);
    }
    return diagnostic("Cannot assign to %s", lhs.kind());
  }

  // Operators

  private static boolean isStep(UnOp op) {
    return op == UnOp.INCREMENT || op == UnOp.DECREMENT;
  }

  /** Returns {@code x = x + 1} (or {@code - 1}) for {@code x++} or {@code x--}. */
  private @Nullable ElixirAst step(TypedExpr.Unop unop) {
    String op = (unop.op == UnOp.INCREMENT) ? "+" : "-";
    ElixirAst value = ElixirAst.binary(op, lowerExpr(unop.operand), ElixirAst.intLit(1));
    return assignTo(unop.operand, value);
  }

  @Override
  public @Nullable ElixirAst visitUnop(TypedExpr.Unop node) {
    if (isStep(node.op)) {
      if (position == Position.EXPR) {
        return diagnostic("%s used as a value", node.op == UnOp.INCREMENT ? "++" : "--");
      }
      return step(node);
    }
    ElixirAst operand = lowerExpr(node.operand);
    return switch (node.op) {
      case NOT -> ElixirAst.unary("not", operand);
      case NEG -> ElixirAst.unary("-", operand);
      case BIT_NOT -> ElixirAst.remote("Bitwise", "bnot", operand);
      default -> throw new AssertionError(node.op);
    };
  }

  @Override
  public ElixirAst visitBinop(TypedExpr.Binop node) {
    return binop(node.op, node.lhs, node.rhs, node.type);
  }

  private ElixirAst binop(BinOp op, TypedExpr lhs, TypedExpr rhs, TypeRef type) {
    if (op == BinOp.ADD && type.is(TypeRef.Kind.STRING)) {
      return ElixirAst.binary("<>", stringOperand(lhs), stringOperand(rhs));
    } else if (op == BinOp.INTERVAL) {
      return range(lhs, rhs);
    }
    ElixirAst l = lowerExpr(lhs);
    ElixirAst r = lowerExpr(rhs);
    return switch (op) {
      case ADD -> ElixirAst.binary("+", l, r);
      case SUB -> ElixirAst.binary("-", l, r);
      case MULT -> ElixirAst.binary("*", l, r);
      case DIV -> ElixirAst.binary("/", l, r);
      case MOD -> ElixirAst.call("rem", l, r);
      case EQ -> ElixirAst.binary("==", l, r);
      case NOT_EQ -> ElixirAst.binary("!=", l, r);
      case LT -> ElixirAst.binary("<", l, r);
      case LTE -> ElixirAst.binary("<=", l, r);
      case GT -> ElixirAst.binary(">", l, r);
      case GTE -> ElixirAst.binary(">=", l, r);
      case BOOL_AND -> ElixirAst.binary("and", l, r);
      case BOOL_OR -> ElixirAst.binary("or", l, r);
      case AND -> ElixirAst.remote("Bitwise", "band", l, r);
      case OR -> ElixirAst.remote("Bitwise", "bor", l, r);
      case XOR -> ElixirAst.remote("Bitwise", "bxor", l, r);
      case SHL -> ElixirAst.remote("Bitwise", "bsl", l, r);
      case SHR -> ElixirAst.remote("Bitwise", "bsr", l, r);
      // The left operand is reinterpreted as an unsigned 32-bit value first.
      case USHR ->
          ElixirAst.remote(
              "Bitwise",
              "bsr",
              ElixirAst.remote("Bitwise", "band", l, ElixirAst.intLit(UINT32_MASK)),
              r);
      case INTERVAL -> throw new AssertionError();
    };
  }

  private ElixirAst stringOperand(TypedExpr e) {
    ElixirAst lowered = lowerExpr(e);
    return e.type.is(TypeRef.Kind.STRING) ? lowered : ElixirAst.call("to_string", lowered);
  }

  /**
   * Returns the range of integers from {@code start} up to but not including {@code end}. Constant
   * bounds are folded; a range that may be empty gets an explicit step so that Elixir does not
   * count down.
   */
  ElixirAst range(TypedExpr start, TypedExpr end) {
    TypedExpr s = start.unwrap();
    TypedExpr e = end.unwrap();
    if (s instanceof TypedExpr.Const sc
        && sc.constKind == TypedExpr.ConstKind.INT
        && e instanceof TypedExpr.Const ec
        && ec.constKind == TypedExpr.ConstKind.INT) {
      long first = ((Number) sc.value).longValue();
      long last = ((Number) ec.value).longValue() - 1;
      ElixirAst step = (last < first) ? ElixirAst.intLit(1) : null;
      return new ElixirAst.Range(ElixirAst.intLit(first), ElixirAst.intLit(last), step);
    }
    ElixirAst last = ElixirAst.binary("-", lowerExpr(end), ElixirAst.intLit(1));
    return new ElixirAst.Range(lowerExpr(start), last, ElixirAst.intLit(1));
  }

  // Control flow

  @Override
  public ElixirAst visitIf(TypedExpr.If node) {
    List<TypedExpr> branches = new ArrayList<>();
    branches.add(node.thenExpr);
    if (node.elseExpr != null) {
      branches.add(node.elseExpr);
    }
    ImmutableList<TVar> state = threadedState(branches, ImmutableList.of());
    ElixirAst cond;
    boolean unless = false;
    if (node.elseExpr == null
        && node.cond.unwrap() instanceof TypedExpr.Unop not
        && not.op == UnOp.NOT) {
      cond = lowerExpr(not.operand);
      unless = true;
    } else {
      cond = lowerExpr(node.cond);
    }
    if (state.isEmpty()) {
      ElixirAst thenBranch = lowerBody(node.thenExpr, position);
      ElixirAst elseBranch = (node.elseExpr == null) ? null : lowerBody(node.elseExpr, position);
      return new ElixirAst.If(cond, thenBranch, elseBranch, unless);
    }
    // x = if c do ...; x else x end
    ElixirAst thenBranch = threadedBranch(node.thenExpr, state);
    ElixirAst elseBranch =
        (node.elseExpr == null) ? stateExpr(state) : threadedBranch(node.elseExpr, state);
    return ElixirAst.match(
        statePattern(state), new ElixirAst.If(cond, thenBranch, elseBranch, unless));
  }

  /**
   * Returns the outer variables that the given branches rebind, if the branching construct is in
   * statement position (elsewhere its value is used, and any later rebinding would be lost anyway).
   * The variables that the construct binds itself, {@code bound}, are not outer.
   */
  private ImmutableList<TVar> threadedState(
      List<TypedExpr> branches, List<? extends @Nullable TVar> bound) {
    if (position != Position.STATEMENT) {
      return ImmutableList.of();
    }
    return MutationAnalyzer.outerMutations(branches, bound);
  }

  /** Lowers a branch as statements followed by the current value of {@code state}. */
  private ElixirAst threadedBranch(TypedExpr branch, ImmutableList<TVar> state) {
    List<ElixirAst> stmts = new ArrayList<>();
    ElixirAst lowered = lower(branch, Position.STATEMENT);
    if (lowered instanceof ElixirAst.Block block) {
      stmts.addAll(block.exprs);
    } else if (lowered != null) {
      stmts.add(lowered);
    }
    stmts.add(stateExpr(state));
    return sequence(stmts, Position.EXPR);
  }

  /** Returns an expression for the current values of {@code state}. */
  ElixirAst stateExpr(List<TVar> state) {
    if (state.isEmpty()) {
      return ElixirAst.nil();
    } else if (state.size() == 1) {
      return reference(state.get(0));
    }
    List<ElixirAst> values = new ArrayList<>();
    state.forEach(v -> values.add(reference(v)));
    return ElixirAst.tuple(values);
  }

  /** Returns a pattern that rebinds each of {@code state}. */
  Pattern statePattern(List<TVar> state) {
    if (state.isEmpty()) {
      return Pattern.wildcard();
    } else if (state.size() == 1) {
      return Pattern.var(ctx.nameOf(state.get(0)));
    }
    List<Pattern> vars = new ArrayList<>();
    state.forEach(v -> vars.add(Pattern.var(ctx.nameOf(v))));
    return Pattern.tuple(vars);
  }

  /**
   * Returns the pattern that binds {@code v}, or marks it as unused if it was not referenced in the
   * current scope.
   */
  Pattern binding(TVar v) {
    String name = ctx.nameOf(v);
    if (ctx.wasReferenced(v)) {
      return Pattern.var(name);
    }
    return unused(name, !v.generated);
  }

  /** Returns the pattern for an unused binding named {@code name}. */
  Pattern unused(String name, boolean userFacing) {
    if (options.unusedStyle == LoweringOptions.UnusedStyle.PREFIX && userFacing) {
      return Pattern.var(Names.unusedName(name));
    }
    return Pattern.wildcard();
  }

  @Override
  public ElixirAst visitSwitch(TypedExpr.Switch node) {
    List<TypedExpr> branches = new ArrayList<>();
    List<@Nullable TVar> patternVars = new ArrayList<>();
    for (TypedExpr.Case c : node.cases) {
      branches.add(c.body);
      patternVars.addAll(c.patternVars);
    }
    if (node.defaultExpr != null) {
      branches.add(node.defaultExpr);
    }
    ImmutableList<TVar> state = threadedState(branches, patternVars);
    Position bodyPosition = state.isEmpty() ? position : Position.STATEMENT;
    TypedExpr subject = node.subject.unwrap();
    boolean enumSwitch = subject instanceof TypedExpr.EnumIndex;
    TypedExpr matched = enumSwitch ? ((TypedExpr.EnumIndex) subject).expr : node.subject;
    ElixirAst subjectAst = lowerExpr(matched);

    List<Clause> clauses = new ArrayList<>();
    Set<Integer> covered = new HashSet<>();
    for (TypedExpr.Case c : node.cases) {
      for (TypedExpr value : c.values) {
        if (enumSwitch) {
          Clause clause = enumClause(matched, value, c, state, bodyPosition);
          if (clause != null) {
            clauses.add(clause);
            if (c.guard == null) {
              covered.add(((Number) ((TypedExpr.Const) value.unwrap()).value).intValue());
            }
          }
        } else {
          clauses.add(valueClause(value, c, state, bodyPosition));
        }
      }
    }
    boolean exhaustive =
        enumSwitch && covered.size() == matched.type.enumDecl().ctors.size();
    if (node.defaultExpr != null) {
      clauses.add(
          Clause.of(
              Pattern.wildcard(),
              null,
              clauseBody(node.defaultExpr, state, bodyPosition)));
    } else if (!exhaustive) {
      clauses.add(Clause.of(Pattern.wildcard(), null, stateExpr(state)));
    }
    ElixirAst result = new ElixirAst.Case(subjectAst, clauses);
    if (enumSwitch) {
      result.flag(Metadata.PLANNED_PATTERN);
    }
    return state.isEmpty() ? result : ElixirAst.match(statePattern(state), result);
  }

  private ElixirAst clauseBody(TypedExpr body, ImmutableList<TVar> state, Position p) {
    return state.isEmpty() ? lowerBody(body, p) : threadedBranch(body, state);
  }

  /**
   * Returns the clause matching one constructor of a switch over a tagged union, with its pattern
   * rendered from a binding plan.
   */
  private @Nullable Clause enumClause(
      TypedExpr matched,
      TypedExpr value,
      TypedExpr.Case c,
      ImmutableList<TVar> state,
      Position p) {
    if (!(value.unwrap() instanceof TypedExpr.Const index)
        || index.constKind != TypedExpr.ConstKind.INT) {
      diagnostic("Case value %s is not a constructor index", value);
      return null;
    }
    EnumDecl.Ctor ctor = matched.type.enumDecl().ctor(((Number) index.value).intValue());
    BindingPlan plan = planner.plan(matched, ctor, c);
    ctx.pushScope();
    BindingPlan prevPlan = ctx.installPlan(plan);
    planner.bindAll(ctx, plan);
    ElixirAst guard = (c.guard == null) ? null : lowerExpr(c.guard);
    ElixirAst body = clauseBody(c.body, state, p);
    // After the body, so that extractions adopted while lowering it are bound.
    Pattern pattern = planner.renderPattern(ctx, plan);
    ctx.installPlan(prevPlan);
    ctx.popScope();
    return Clause.of(pattern, guard, body);
  }

  /** Returns the clause for one value of a switch over anything other than a tagged union. */
  private Clause valueClause(
      TypedExpr value, TypedExpr.Case c, ImmutableList<TVar> state, Position p) {
    ctx.pushScope();
    Pattern pattern;
    ElixirAst test = null;
    if (value.unwrap() instanceof TypedExpr.Const
        && lowerExpr(value) instanceof ElixirAst.Literal literal) {
      pattern = Pattern.literal(literal);
    } else {
      // switch_value when switch_value == value
      String name = ctx.freshName(SWITCH_VALUE);
      pattern = Pattern.var(name);
      test = ElixirAst.binary("==", ElixirAst.var(name), lowerExpr(value));
    }
    ElixirAst guard = (c.guard == null) ? null : lowerExpr(c.guard);
    if (test != null) {
      guard = (guard == null) ? test : ElixirAst.binary("and", test, guard);
    }
    ElixirAst body = clauseBody(c.body, state, p);
    ctx.popScope();
    return Clause.of(pattern, guard, body);
  }

  @Override
  public ElixirAst visitWhile(TypedExpr.While node) {
    return synthesizer.structuralWhile(node);
  }

  @Override
  public ElixirAst visitForIn(TypedExpr.ForIn node) {
    if (TypedTrees.containsLoopExit(node.body)) {
      return synthesizer.structuralForIn(node);
    }
    return synthesizer.synthesize(classifier.forIn(node));
  }

  /** Lowers the body of a structural loop with {@code frame} active for break and continue. */
  List<ElixirAst> lowerLoopBody(TypedExpr body, LoopFrame frame) {
    loopFrames.push(frame);
    List<ElixirAst> result = lowerStatements(TypedTrees.statements(body), Position.STATEMENT);
    loopFrames.pop();
    return result;
  }

  @Override
  public ElixirAst visitLoopExit(TypedExpr.LoopExit node) {
    LoopFrame frame = loopFrames.peek();
    if (frame == null) {
      return diagnostic("%s outside a loop", node.isBreak ? "break" : "continue");
    }
    if (node.isBreak) {
      frame.breaks = true;
    } else {
      frame.continues = true;
    }
    // throw({:break, state})
    ElixirAst tag = ElixirAst.atom(node.isBreak ? "break" : "continue");
    return ElixirAst.call("throw", ElixirAst.tuple(tag, stateExpr(frame.state)));
  }

  @Override
  public ElixirAst visitReturn(TypedExpr.Return node) {
    if (position != Position.TAIL) {
      return diagnostic("return is only supported in tail position");
    }
    return (node.value == null) ? ElixirAst.nil() : lowerExpr(node.value);
  }

  @Override
  public ElixirAst visitThrow(TypedExpr.Throw node) {
    ElixirAst value = lowerExpr(node.value);
    return ElixirAst.call(node.value.type.is(TypeRef.Kind.CLASS) ? "raise" : "throw", value);
  }

  @Override
  public ElixirAst visitTry(TypedExpr.Try node) {
    ElixirAst body = lowerBody(node.body, position);
    List<Clause> rescues = new ArrayList<>();
    List<Clause> catches = new ArrayList<>();
    for (TypedExpr.Catch c : node.catches) {
      ctx.pushScope();
      ctx.declare(c.var);
      ElixirAst handler = lowerBody(c.body, position);
      Clause clause = Clause.of(binding(c.var), null, handler);
      ctx.popScope();
      // Exceptions are raised, any other value is thrown.
      if (c.var.type.is(TypeRef.Kind.CLASS)) {
        rescues.add(clause);
      } else {
        catches.add(clause);
      }
    }
    return new ElixirAst.Try(body, rescues, catches, null);
  }

  // Functions and calls

  @Override
  public ElixirAst visitFunction(TypedExpr.Function node) {
    Deque<LoopFrame> outerFrames = loopFrames;
    loopFrames = new ArrayDeque<>();
    ctx.pushScope();
    node.args.forEach(ctx::declare);
    ElixirAst body = lowerBody(node.body, Position.TAIL);
    ImmutableList<Pattern> params =
        node.args.stream().map(this::binding).collect(ImmutableList.toImmutableList());
    ctx.popScope();
    loopFrames = outerFrames;
    return ElixirAst.fn(params, body);
  }

  /** Lowers a named function to a {@code def} (or {@code defp}). */
  ElixirAst.Def lowerDef(String name, TypedExpr.Function function, boolean isPrivate) {
    ElixirAst.Fn fn = (ElixirAst.Fn) lowerRequired(function, Position.EXPR);
    Clause clause = fn.clauses.get(0);
    ElixirAst.Def def =
        new ElixirAst.Def(Names.functionName(name), clause.patterns(), clause.body(), isPrivate);
    def.setMetadata(fn.metadata());
    return def;
  }

  @Override
  public @Nullable ElixirAst visitCall(TypedExpr.Call node) {
    return builtins.lower(node);
  }

  @Override
  public ElixirAst visitNew(TypedExpr.New node) {
    return ElixirAst.remote(node.className, "new", lowerExprs(node.args));
  }

  // Fields, elements, and literals

  @Override
  public ElixirAst visitField(TypedExpr.Field node) {
    switch (node.fieldKind) {
      case ENUM:
        return enumValue(node.ctor, ImmutableList.of());
      case STATIC:
        return ElixirAst.remote(
            modulePath(node.obj), Names.functionName(node.name), ImmutableList.of());
      default:
        break;
    }
    if (node.name.equals("length")) {
      if (node.obj.type.is(TypeRef.Kind.ARRAY)) {
        return ElixirAst.call("length", lowerExpr(node.obj));
      } else if (node.obj.type.is(TypeRef.Kind.STRING)) {
        return ElixirAst.remote("String", "length", lowerExpr(node.obj));
      }
    }
    return new ElixirAst.FieldAccess(lowerExpr(node.obj), node.name);
  }

  /** Returns the module name that a TYPE_EXPR (or other static receiver) refers to. */
  String modulePath(TypedExpr obj) {
    return (obj.unwrap() instanceof TypedExpr.TypeExpr type) ? type.path : obj.toString();
  }

  /**
   * Returns a tagged-union value built by {@code ctor}. A constructor with parameters that is used
   * as a value (without arguments) becomes a function that builds the value.
   */
  ElixirAst enumValue(EnumDecl.Ctor ctor, List<ElixirAst> args) {
    List<ElixirAst> elements = new ArrayList<>();
    elements.add(ElixirAst.atom(Names.atomName(ctor.name)));
    if (!args.isEmpty() || ctor.arity() == 0) {
      elements.addAll(args);
      return ElixirAst.tuple(elements);
    }
    // fn p0, p1 -> {:ctor, p0, p1} end
    List<Pattern> params = new ArrayList<>();
    for (int i = 0; i < ctor.arity(); i++) {
      params.add(Pattern.var("p" + i));
      elements.add(ElixirAst.var("p" + i));
    }
    return ElixirAst.fn(params, ElixirAst.tuple(elements));
  }

  @Override
  public ElixirAst visitArrayAccess(TypedExpr.ArrayAccess node) {
    TVar array = node.array.unwrap().asLocalVar();
    TVar index = node.index.unwrap().asLocalVar();
    if (array != null && index != null) {
      String alias = ctx.elementAlias(array, index);
      if (alias != null) {
        ctx.markUsed(index);
        return ElixirAst.var(alias);
      }
    }
    ElixirAst container = lowerExpr(node.array);
    ElixirAst key = lowerExpr(node.index);
    if (node.array.type.is(TypeRef.Kind.MAP)) {
      return ElixirAst.remote("Map", "get", container, key);
    }
    return ElixirAst.remote("Enum", "at", container, key);
  }

  @Override
  public ElixirAst visitArrayDecl(TypedExpr.ArrayDecl node) {
    return ElixirAst.list(lowerExprs(node.elements));
  }

  @Override
  public ElixirAst visitObjectDecl(TypedExpr.ObjectDecl node) {
    List<Entry> entries = new ArrayList<>();
    for (Map.Entry<String, TypedExpr> field : node.fields.entrySet()) {
      entries.add(new Entry(ElixirAst.atom(field.getKey()), lowerExpr(field.getValue())));
    }
    return new ElixirAst.MapLit(entries);
  }

  @Override
  public ElixirAst visitEnumIndex(TypedExpr.EnumIndex node) {
    // The tag of a tagged tuple, e.g. :some for {:some, v}.
    return ElixirAst.call("elem", lowerExpr(node.expr), ElixirAst.intLit(0));
  }

  @Override
  public ElixirAst visitEnumParameter(TypedExpr.EnumParameter node) {
    BindingPlan plan = ctx.plan();
    if (plan != null && plan.matches(node)) {
      BindingPlanEntry entry = plan.entry(node.index);
      if (entry != null) {
        plan.boundVars(node.index).forEach(ctx::markUsed);
        return ElixirAst.var(entry.finalName());
      }
    }
    return ElixirAst.call("elem", lowerExpr(node.expr), ElixirAst.intLit(node.index + 1));
  }

  @Override
  public @Nullable ElixirAst visitCast(TypedExpr.Cast node) {
    return visit(node.expr);
  }

  @Override
  public ElixirAst visitTypeExpr(TypedExpr.TypeExpr node) {
    return ElixirAst.alias(node.path);
  }

  @Override
  public ElixirAst visitRaw(TypedExpr.Raw node) {
    Matcher matcher = RAW_ARG.matcher(node.code);
    StringBuilder sb = new StringBuilder();
    while (matcher.find()) {
      // Null if the index does not fit in an int.
      Integer index = Ints.tryParse(matcher.group(1));
      String replacement;
      if (index != null && index < node.args.size()) {
        replacement = AstPrinter.print(lowerExpr(node.args.get(index)));
      } else {
        ctx.report(currentPos(), String.format("Raw code has no argument %s", matcher.group(1)));
        replacement = matcher.group();
      }
      matcher.appendReplacement(sb, Matcher.quoteReplacement(replacement));
    }
    matcher.appendTail(sb);
    return ElixirAst.raw(sb.toString());
  }
}
