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
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.exlower.compiler.LoopIntent.CollectionLoop;
import org.exlower.compiler.LoopIntent.Comprehension;
import org.exlower.compiler.LoopIntent.IndexedAccess;
import org.exlower.compiler.LoopIntent.MapEntryLoop;
import org.exlower.compiler.LoopIntent.RangeLoop;
import org.exlower.compiler.LoopIntent.UnrolledListBuild;
import org.exlower.typed.TVar;
import org.exlower.typed.TypeRef;
import org.exlower.typed.TypedExpr;
import org.exlower.typed.TypedExpr.BinOp;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Recognizes the statement sequences that the front end produces when it expands a high-level
 * loop, and returns the corresponding {@link LoopIntent}. The shapes recognized, starting at a
 * given statement of a block, are:
 *
 * <ul>
 *   <li>range: {@code var c = start; [var limit = end;] while (c < limit) { var i = c++; ... }}
 *       (or {@code var i = c; ++c;} at the start of the body);
 *   <li>collection: {@code var c = 0; [var a = xs;] while (c < a.length) { var x = a[c]; ++c; ...
 *       }}, a range over {@code xs.length} whose index is only used as {@code xs[i]}, or {@code var
 *       it = xs.iterator(); while (it.hasNext()) { var x = it.next(); ... }};
 *   <li>map entry: {@code var it = m.keyValueIterator(); while (it.hasNext()) { var e = it.next();
 *       var k = e.key; var v = e.value; ... }};
 *   <li>comprehension: {@code var acc = [];} followed by a range or collection loop whose body is
 *       just {@code acc.push(x)} or {@code if (c) acc.push(x)};
 *   <li>unrolled list build: {@code var acc = [];} followed by one or more appends to {@code acc},
 *       optionally followed by {@code acc} as the last statement of the block.
 * </ul>
 *
 * A shape matches only if it matches exactly: the counter, limit, and iterator variables must not
 * be referenced anywhere else (including after the loop), and the loop body must not contain a
 * {@code break}, {@code continue}, or {@code return}. Shapes are tried in the order range,
 * collection, map entry, comprehension, unrolled list; the first that matches wins.
 */
public final class LoopIntentClassifier {

  private static final Logger log = LoggerFactory.getLogger(LoopIntentClassifier.class);

  private final LoweringOptions options;

  public LoopIntentClassifier(LoweringOptions options) {
    this.options = options;
  }

  /**
   * A recognized shape.
   *
   * @param intent what the statements do
   * @param consumed how many statements (starting at the one passed to {@link #classify}) the
   *     intent replaces
   * @param infrastructure the compiler temporaries that the replacement eliminates
   */
  public record Classification(
      LoopIntent intent, int consumed, ImmutableList<TVar> infrastructure) {}

  /**
   * Returns the intent of the statements starting at {@code stmts.get(start)}, or null if they do
   * not match any recognized shape.
   */
  public @Nullable Classification classify(List<TypedExpr> stmts, int start) {
    if (!options.loopIntents) {
      return null;
    }
    Classification result = counterLoop(stmts, start);
    if (result == null) {
      result = iteratorLoop(stmts, start);
    }
    if (result == null && options.comprehensions) {
      result = comprehension(stmts, start);
    }
    if (result == null && options.unrolledLists) {
      result = unrolledList(stmts, start);
    }
    if (result != null) {
      log.debug(
          "statement {}: {} replacing {} statement(s)",
          start,
          result.intent().label(),
          result.consumed());
    }
    return result;
  }

  /** Returns the intent of a {@code for (x in iterable)} loop that the front end kept. */
  public LoopIntent forIn(TypedExpr.ForIn forIn) {
    TypedExpr iterable = forIn.iterable.unwrap();
    ImmutableList<TypedExpr> body = TypedTrees.statements(forIn.body);
    if (iterable instanceof TypedExpr.Binop binop && binop.op == BinOp.INTERVAL) {
      return new RangeLoop(forIn.var, binop.lhs, binop.rhs, body, true);
    }
    return new CollectionLoop(forIn.var, iterable, body, null);
  }

  /** Matches the range and collection loops that use an integer counter. */
  private @Nullable Classification counterLoop(List<TypedExpr> stmts, int start) {
    if (!(stmts.get(start) instanceof TypedExpr.VarDecl counterDecl)
        || counterDecl.init == null
        || !counterDecl.var.type.is(TypeRef.Kind.INT)) {
      return null;
    }
    TVar counter = counterDecl.var;
    int next = start + 1;
    // An optional second declaration, either the limit or (for a collection) the array.
    TypedExpr.VarDecl extraDecl = null;
    if (next < stmts.size()
        && stmts.get(next) instanceof TypedExpr.VarDecl decl
        && decl.init != null) {
      extraDecl = decl;
      next++;
    }
    if (next >= stmts.size()
        || !(stmts.get(next) instanceof TypedExpr.While loop)
        || !loop.normalWhile
        || !(loop.cond.unwrap() instanceof TypedExpr.Binop cond)
        || cond.op != BinOp.LT
        || !cond.lhs.unwrap().isLocal(counter)
        || !isSimpleBody(loop.body)) {
      return null;
    }
    ImmutableList<TypedExpr> body = TypedTrees.statements(loop.body);
    List<TypedExpr> after = stmts.subList(next + 1, stmts.size());
    ImmutableList.Builder<TVar> infrastructure = ImmutableList.builder();
    infrastructure.add(counter);
    if (extraDecl != null) {
      infrastructure.add(extraDecl.var);
    }
    ImmutableList<TVar> infra = infrastructure.build();

    // The value the counter is compared against, as an expression evaluated once before the loop.
    TypedExpr bound = cond.rhs.unwrap();
    TypedExpr end;
    if (extraDecl != null && bound.isLocal(extraDecl.var)) {
      end = extraDecl.init;
    } else if (TypedTrees.isPure(bound)) {
      end = bound;
    } else {
      return null;
    }

    int consumed = next - start + 1;
    if (body.size() >= 2
        && body.get(0) instanceof TypedExpr.VarDecl elementDecl
        && elementDecl.init != null
        && elementDecl.init.unwrap() instanceof TypedExpr.ArrayAccess access
        && access.index.unwrap().isLocal(counter)
        && isIncrement(body.get(1), counter)) {
      // var x = a[c]; ++c;
      ImmutableList<TypedExpr> rest = body.subList(2, body.size());
      if (!isIntConst(counterDecl.init, 0)
          || !(end instanceof TypedExpr.Field length)
          || !length.isInstanceField("length")
          || !TypedTrees.sameValue(length.obj, access.array)
          || !unreferenced(infra, rest, after)) {
        return null;
      }
      TypedExpr collection = access.array;
      if (extraDecl != null && collection.unwrap().isLocal(extraDecl.var)) {
        collection = extraDecl.init;
      } else if (extraDecl != null && !bound.isLocal(extraDecl.var)) {
        return null;
      }
      if (mutates(rest, collection) || (extraDecl == null && mutates(rest, end))) {
        return null;
      }
      return new Classification(
          new CollectionLoop(elementDecl.var, collection, rest, null), consumed, infra);
    }

    TVar user;
    ImmutableList<TypedExpr> rest;
    if (!body.isEmpty()
        && body.get(0) instanceof TypedExpr.VarDecl userDecl
        && userDecl.init != null
        && userDecl.init.unwrap() instanceof TypedExpr.Unop inc
        && inc.postfix
        && inc.isIncrementOf(counter)) {
      // var i = c++;
      user = userDecl.var;
      rest = body.subList(1, body.size());
    } else if (body.size() >= 2
        && body.get(0) instanceof TypedExpr.VarDecl userDecl
        && userDecl.init != null
        && userDecl.init.unwrap().isLocal(counter)
        && isIncrement(body.get(1), counter)) {
      // var i = c; ++c;
      user = userDecl.var;
      rest = body.subList(2, body.size());
    } else {
      return null;
    }
    if (extraDecl != null && !bound.isLocal(extraDecl.var)) {
      return null;
    }
    if (!unreferenced(infra, rest, after)) {
      return null;
    }
    if (extraDecl == null && mutates(rest, end)) {
      return null;
    }
    // A range over xs.length whose index is only used to read xs is a collection loop.
    if (isIntConst(counterDecl.init, 0)
        && end instanceof TypedExpr.Field length
        && length.isInstanceField("length")
        && length.obj.unwrap() instanceof TypedExpr.Local array
        && array.type.is(TypeRef.Kind.ARRAY)
        && onlyIndexes(rest, array.var, user)
        && !mutates(rest, array)) {
      return new Classification(
          new CollectionLoop(null, array, rest, new IndexedAccess(array.var, user)),
          consumed,
          infra);
    }
    return new Classification(
        new RangeLoop(user, counterDecl.init, end, rest, true), consumed, infra);
  }

  /** Matches the collection and map entry loops that use an iterator. */
  private @Nullable Classification iteratorLoop(List<TypedExpr> stmts, int start) {
    if (start + 1 >= stmts.size()
        || !(stmts.get(start) instanceof TypedExpr.VarDecl iterDecl)
        || !(iterDecl.init instanceof TypedExpr.Call iterCall)
        || !iterCall.args.isEmpty()
        || !(stmts.get(start + 1) instanceof TypedExpr.While loop)
        || !loop.normalWhile
        || !(loop.cond.unwrap() instanceof TypedExpr.Call hasNext)
        || !isLocalOrNull(hasNext.receiverOf("hasNext"), iterDecl.var)
        || !isSimpleBody(loop.body)) {
      return null;
    }
    TVar iterator = iterDecl.var;
    ImmutableList<TypedExpr> body = TypedTrees.statements(loop.body);
    if (body.isEmpty()
        || !(body.get(0) instanceof TypedExpr.VarDecl nextDecl)
        || !(nextDecl.init instanceof TypedExpr.Call nextCall)
        || !isLocalOrNull(nextCall.receiverOf("next"), iterator)) {
      return null;
    }
    List<TypedExpr> after = stmts.subList(start + 2, stmts.size());
    TypedExpr collection = iterCall.receiverOf("iterator");
    if (collection != null) {
      ImmutableList<TypedExpr> rest = body.subList(1, body.size());
      ImmutableList<TVar> infra = ImmutableList.of(iterator);
      if (!unreferenced(infra, rest, after) || mutates(rest, collection)) {
        return null;
      }
      return new Classification(
          new CollectionLoop(nextDecl.var, collection, rest, null), 2, infra);
    }
    TypedExpr map = iterCall.receiverOf("keyValueIterator");
    if (map == null) {
      return null;
    }
    TVar entry = nextDecl.var;
    TVar keyVar = null;
    TVar valueVar = null;
    int index = 1;
    for (; index < body.size() && index <= 2; index++) {
      if (!(body.get(index) instanceof TypedExpr.VarDecl decl)
          || !(decl.init instanceof TypedExpr.Field field)
          || !field.obj.unwrap().isLocal(entry)) {
        break;
      }
      if (field.name.equals("key") && keyVar == null) {
        keyVar = decl.var;
      } else if (field.name.equals("value") && valueVar == null) {
        valueVar = decl.var;
      } else {
        break;
      }
    }
    ImmutableList<TypedExpr> rest = body.subList(index, body.size());
    ImmutableList<TVar> infra = ImmutableList.of(iterator, entry);
    if (!unreferenced(infra, rest, after) || mutates(rest, map)) {
      return null;
    }
    return new Classification(new MapEntryLoop(keyVar, valueVar, map, rest), 2, infra);
  }

  /** Matches an empty-list initialization followed by a loop that only appends to the list. */
  private @Nullable Classification comprehension(List<TypedExpr> stmts, int start) {
    TVar acc = emptyListInit(stmts.get(start));
    if (acc == null || start + 1 >= stmts.size()) {
      return null;
    }
    LoopIntent source;
    int consumed;
    ImmutableList<TVar> infra;
    if (stmts.get(start + 1) instanceof TypedExpr.ForIn forIn) {
      if (!isSimpleBody(forIn.body)) {
        return null;
      }
      source = forIn(forIn);
      consumed = 1;
      infra = ImmutableList.of();
    } else {
      Classification loop = counterLoop(stmts, start + 1);
      if (loop == null) {
        loop = iteratorLoop(stmts, start + 1);
      }
      if (loop == null) {
        return null;
      }
      source = loop.intent();
      consumed = loop.consumed();
      infra = loop.infrastructure();
    }
    ImmutableList<TypedExpr> body;
    if (source instanceof RangeLoop range) {
      body = range.body();
    } else if (source instanceof CollectionLoop collection) {
      body = collection.body();
    } else {
      return null;
    }
    if (body.size() != 1) {
      return null;
    }
    TypedExpr stmt = body.get(0).unwrap();
    TypedExpr filter = null;
    if (stmt instanceof TypedExpr.If ifStmt && ifStmt.elseExpr == null) {
      ImmutableList<TypedExpr> thenStmts = TypedTrees.statements(ifStmt.thenExpr);
      if (thenStmts.size() != 1) {
        return null;
      }
      filter = ifStmt.cond;
      stmt = thenStmts.get(0).unwrap();
    }
    if (!(stmt instanceof TypedExpr.Call push)
        || push.args.size() != 1
        || !isLocalOrNull(push.receiverOf("push"), acc)) {
      return null;
    }
    TypedExpr element = push.args.get(0);
    if (UsageCounter.references(element, acc)
        || (filter != null && UsageCounter.references(filter, acc))) {
      return null;
    }
    return new Classification(
        new Comprehension(acc, source, filter, element), consumed + 1, infra);
  }

  /** Matches an empty-list initialization followed by appends of known elements. */
  private @Nullable Classification unrolledList(List<TypedExpr> stmts, int start) {
    TVar acc = emptyListInit(stmts.get(start));
    if (acc == null) {
      return null;
    }
    List<TypedExpr> elements = new ArrayList<>();
    int next = start + 1;
    for (; next < stmts.size(); next++) {
      List<TypedExpr> appended = appendedElements(stmts.get(next), acc);
      if (appended == null) {
        break;
      }
      elements.addAll(appended);
    }
    if (elements.isEmpty()
        || elements.stream().anyMatch(e -> UsageCounter.references(e, acc))) {
      return null;
    }
    boolean yieldsValue = next == stmts.size() - 1 && stmts.get(next).unwrap().isLocal(acc);
    int consumed = next - start + (yieldsValue ? 1 : 0);
    return new Classification(
        new UnrolledListBuild(acc, ImmutableList.copyOf(elements), yieldsValue),
        consumed,
        ImmutableList.of());
  }

  /**
   * If {@code stmt} appends to {@code acc} ({@code acc.push(x)}, {@code acc = acc.concat([...])},
   * {@code acc = acc + [...]}, or {@code acc += [...]}), returns the appended elements.
   */
  private static @Nullable List<TypedExpr> appendedElements(TypedExpr stmt, TVar acc) {
    stmt = stmt.unwrap();
    if (stmt instanceof TypedExpr.Call call) {
      return (call.args.size() == 1 && isLocalOrNull(call.receiverOf("push"), acc))
          ? call.args
          : null;
    }
    if (!(stmt instanceof TypedExpr.Assign assign) || !assign.lhs.unwrap().isLocal(acc)) {
      return null;
    }
    TypedExpr rhs = assign.rhs.unwrap();
    if (assign.op == BinOp.ADD) {
      return (rhs instanceof TypedExpr.ArrayDecl decl) ? decl.elements : null;
    } else if (assign.op != null) {
      return null;
    }
    if (rhs instanceof TypedExpr.Call call
        && call.args.size() == 1
        && isLocalOrNull(call.receiverOf("concat"), acc)
        && call.args.get(0).unwrap() instanceof TypedExpr.ArrayDecl decl) {
      return decl.elements;
    } else if (rhs instanceof TypedExpr.Binop binop
        && binop.op == BinOp.ADD
        && binop.lhs.unwrap().isLocal(acc)
        && binop.rhs.unwrap() instanceof TypedExpr.ArrayDecl decl) {
      return decl.elements;
    }
    return null;
  }

  /** If {@code stmt} is {@code var acc = []} or {@code acc = []}, returns {@code acc}. */
  private static @Nullable TVar emptyListInit(TypedExpr stmt) {
    if (stmt instanceof TypedExpr.VarDecl decl && TypedTrees.isEmptyArray(decl.init)) {
      return decl.var;
    } else if (stmt instanceof TypedExpr.Assign assign
        && assign.op == null
        && TypedTrees.isEmptyArray(assign.rhs)) {
      return assign.lhs.unwrap().asLocalVar();
    }
    return null;
  }

  /** Returns true if a loop body has no statements that exit it early. */
  private static boolean isSimpleBody(TypedExpr body) {
    return !TypedTrees.containsLoopExit(body) && !TypedTrees.containsReturn(body);
  }

  /** Returns true if {@code stmt} is {@code ++c}, {@code c++}, or {@code c += 1}. */
  private static boolean isIncrement(TypedExpr stmt, TVar counter) {
    stmt = stmt.unwrap();
    if (stmt instanceof TypedExpr.Unop unop) {
      return unop.isIncrementOf(counter);
    }
    return stmt instanceof TypedExpr.Assign assign
        && assign.op == BinOp.ADD
        && assign.lhs.unwrap().isLocal(counter)
        && isIntConst(assign.rhs, 1);
  }

  private static boolean isIntConst(@Nullable TypedExpr e, int value) {
    return e != null && e.unwrap() instanceof TypedExpr.Const c && c.isInt(value);
  }

  private static boolean isLocalOrNull(@Nullable TypedExpr e, TVar v) {
    return e != null && e.unwrap().isLocal(v);
  }

  /** Returns true if none of {@code vars} is referenced by {@code body} or {@code after}. */
  private static boolean unreferenced(
      List<TVar> vars, List<TypedExpr> body, List<TypedExpr> after) {
    List<TypedExpr> roots = new ArrayList<>(body);
    roots.addAll(after);
    UsageCounter usage = UsageCounter.count(roots, Set.of());
    return vars.stream().noneMatch(usage::isReferenced);
  }

  /** Returns true if {@code body} rebinds any variable that {@code e} reads. */
  private static boolean mutates(List<TypedExpr> body, TypedExpr e) {
    ImmutableList<TVar> mutated = MutationAnalyzer.outerMutations(body);
    if (mutated.isEmpty()) {
      return false;
    }
    UsageCounter reads = UsageCounter.count(e);
    return mutated.stream().anyMatch(reads::isReferenced);
  }

  /**
   * Returns true if every reference to {@code index} in {@code body} is as {@code array[index]},
   * and none of those is assigned to.
   */
  private static boolean onlyIndexes(List<TypedExpr> body, TVar array, TVar index) {
    int[] counts = new int[2];
    for (TypedExpr stmt : body) {
      if (!countIndexes(stmt, array, index, counts)) {
        return false;
      }
    }
    UsageCounter usage = UsageCounter.count(body, Set.of());
    // Each a[i] also counts one reference to the array and one to the index.
    return counts[0] > 0 && usage.count(index) == counts[0];
  }

  /**
   * Adds the number of {@code array[index]} reads in {@code e} to {@code counts[0]}; returns false
   * if one of them is the target of an assignment.
   */
  private static boolean countIndexes(TypedExpr e, TVar array, TVar index, int[] counts) {
    if (e instanceof TypedExpr.Assign assign
        && assign.lhs.unwrap() instanceof TypedExpr.ArrayAccess target
        && target.array.unwrap().isLocal(array)
        && target.index.unwrap().isLocal(index)) {
      return false;
    }
    if (e instanceof TypedExpr.ArrayAccess access
        && access.array.unwrap().isLocal(array)
        && access.index.unwrap().isLocal(index)) {
      counts[0]++;
      return true;
    }
    boolean[] ok = {true};
    e.forEachChild(
        child -> {
          if (ok[0] && !countIndexes(child, array, index, counts)) {
            ok[0] = false;
          }
        });
    return ok[0];
  }
}
