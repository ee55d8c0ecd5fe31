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

import static com.google.common.truth.Truth.assertThat;
import static org.exlower.typed.TypedExprs.add;
import static org.exlower.typed.TypedExprs.arrayAccess;
import static org.exlower.typed.TypedExprs.arrayDecl;
import static org.exlower.typed.TypedExprs.assign;
import static org.exlower.typed.TypedExprs.assignOp;
import static org.exlower.typed.TypedExprs.binop;
import static org.exlower.typed.TypedExprs.block;
import static org.exlower.typed.TypedExprs.breakLoop;
import static org.exlower.typed.TypedExprs.field;
import static org.exlower.typed.TypedExprs.forIn;
import static org.exlower.typed.TypedExprs.ifThen;
import static org.exlower.typed.TypedExprs.intConst;
import static org.exlower.typed.TypedExprs.interval;
import static org.exlower.typed.TypedExprs.lessThan;
import static org.exlower.typed.TypedExprs.local;
import static org.exlower.typed.TypedExprs.method;
import static org.exlower.typed.TypedExprs.postIncrement;
import static org.exlower.typed.TypedExprs.preIncrement;
import static org.exlower.typed.TypedExprs.staticCall;
import static org.exlower.typed.TypedExprs.varDecl;
import static org.exlower.typed.TypedExprs.whileLoop;

import com.google.common.collect.ImmutableList;
import org.exlower.compiler.LoopIntent.CollectionLoop;
import org.exlower.compiler.LoopIntent.Comprehension;
import org.exlower.compiler.LoopIntent.MapEntryLoop;
import org.exlower.compiler.LoopIntent.RangeLoop;
import org.exlower.compiler.LoopIntent.UnrolledListBuild;
import org.exlower.compiler.LoopIntentClassifier.Classification;
import org.exlower.typed.TVar;
import org.exlower.typed.TypeRef;
import org.exlower.typed.TypedExpr;
import org.exlower.typed.TypedExpr.BinOp;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class LoopIntentClassifierTest {

  private static final TypeRef INTS = TypeRef.array(TypeRef.INT);

  private final TVar.Factory vars = new TVar.Factory();
  private final TVar sum = vars.user("sum", TypeRef.INT);
  private final TVar xs = vars.user("xs", INTS);
  private final TVar n = vars.user("n", TypeRef.INT);
  private final TVar counter = vars.temp("_g", TypeRef.INT);
  private final TVar limit = vars.temp("_g1", TypeRef.INT);
  private final TVar i = vars.user("i", TypeRef.INT);
  private final TVar x = vars.user("x", TypeRef.INT);

  private final LoopIntentClassifier classifier =
      new LoopIntentClassifier(LoweringOptions.DEFAULT);

  private static TypedExpr println(TypedExpr arg) {
    return staticCall(TypeRef.VOID, "Sys", "println", arg);
  }

  private TypedExpr addToSum(TypedExpr value) {
    return assign(local(sum), add(local(sum), value));
  }

  private TypedExpr xsLength() {
    return field(TypeRef.INT, local(xs), "length");
  }

  /** {@code var _g = 0; var _g1 = 5; while (_g < _g1) { var i = _g++; sum = sum + i; }} */
  private ImmutableList<TypedExpr> rangeWithLimit() {
    return ImmutableList.of(
        varDecl(sum, intConst(0)),
        varDecl(counter, intConst(0)),
        varDecl(limit, intConst(5)),
        whileLoop(
            lessThan(local(counter), local(limit)),
            block(varDecl(i, postIncrement(local(counter))), addToSum(local(i)))),
        local(sum));
  }

  @Test
  public void rangeWithLimitVariable() {
    ImmutableList<TypedExpr> stmts = rangeWithLimit();
    // The first declaration is not followed by a loop.
    assertThat(classifier.classify(stmts, 0)).isNull();

    Classification result = classifier.classify(stmts, 1);
    assertThat(result.consumed()).isEqualTo(3);
    assertThat(result.infrastructure()).containsExactly(counter, limit).inOrder();
    RangeLoop range = (RangeLoop) result.intent();
    assertThat(range.userVar()).isSameInstanceAs(i);
    assertThat(((TypedExpr.Const) range.start()).isInt(0)).isTrue();
    // The limit's initializer replaces the limit variable.
    assertThat(((TypedExpr.Const) range.end()).isInt(5)).isTrue();
    assertThat(range.exclusiveBound()).isTrue();
    assertThat(range.body()).hasSize(1);
  }

  @Test
  public void rangeWithSeparateIncrement() {
    // var _g = 0; while (_g < n) { var i = _g; ++_g; Sys.println(i); }
    ImmutableList<TypedExpr> stmts =
        ImmutableList.of(
            varDecl(counter, intConst(0)),
            whileLoop(
                lessThan(local(counter), local(n)),
                block(
                    varDecl(i, local(counter)),
                    preIncrement(local(counter)),
                    println(local(i)))));
    Classification result = classifier.classify(stmts, 0);
    assertThat(result.consumed()).isEqualTo(2);
    assertThat(result.infrastructure()).containsExactly(counter);
    RangeLoop range = (RangeLoop) result.intent();
    assertThat(range.end().unwrap().isLocal(n)).isTrue();
    assertThat(range.body()).hasSize(1);
  }

  @Test
  public void counterUsedAfterLoop() {
    ImmutableList<TypedExpr> stmts =
        ImmutableList.of(
            varDecl(counter, intConst(0)),
            whileLoop(
                lessThan(local(counter), local(n)),
                block(varDecl(i, postIncrement(local(counter))), println(local(i)))),
            println(local(counter)));
    assertThat(classifier.classify(stmts, 0)).isNull();
  }

  @Test
  public void loopWithBreak() {
    ImmutableList<TypedExpr> stmts =
        ImmutableList.of(
            varDecl(counter, intConst(0)),
            whileLoop(
                lessThan(local(counter), local(n)),
                block(
                    varDecl(i, postIncrement(local(counter))),
                    ifThen(binop(BinOp.GT, local(i), intConst(3)), breakLoop()))));
    assertThat(classifier.classify(stmts, 0)).isNull();
  }

  @Test
  public void boundMutatedByBody() {
    // while (_g < n) { var i = _g++; n = n - 1; }
    ImmutableList<TypedExpr> stmts =
        ImmutableList.of(
            varDecl(counter, intConst(0)),
            whileLoop(
                lessThan(local(counter), local(n)),
                block(
                    varDecl(i, postIncrement(local(counter))),
                    assign(local(n), binop(BinOp.SUB, local(n), intConst(1))))));
    assertThat(classifier.classify(stmts, 0)).isNull();
  }

  @Test
  public void elementLoop() {
    // var _g = 0; while (_g < xs.length) { var x = xs[_g]; ++_g; sum = sum + x; }
    ImmutableList<TypedExpr> stmts =
        ImmutableList.of(
            varDecl(counter, intConst(0)),
            whileLoop(
                lessThan(local(counter), xsLength()),
                block(
                    varDecl(x, arrayAccess(local(xs), local(counter))),
                    preIncrement(local(counter)),
                    addToSum(local(x)))));
    Classification result = classifier.classify(stmts, 0);
    assertThat(result.consumed()).isEqualTo(2);
    CollectionLoop loop = (CollectionLoop) result.intent();
    assertThat(loop.userVar()).isSameInstanceAs(x);
    assertThat(loop.collection().unwrap().isLocal(xs)).isTrue();
    assertThat(loop.indexed()).isNull();
    assertThat(loop.body()).hasSize(1);
  }

  @Test
  public void indexOnlyUsedToReadArray() {
    // var _g = 0; while (_g < xs.length) { var i = _g++; sum = sum + xs[i]; }
    ImmutableList<TypedExpr> stmts =
        ImmutableList.of(
            varDecl(counter, intConst(0)),
            whileLoop(
                lessThan(local(counter), xsLength()),
                block(
                    varDecl(i, postIncrement(local(counter))),
                    addToSum(arrayAccess(local(xs), local(i))))));
    CollectionLoop loop = (CollectionLoop) classifier.classify(stmts, 0).intent();
    assertThat(loop.userVar()).isNull();
    assertThat(loop.indexed()).isEqualTo(new LoopIntent.IndexedAccess(xs, i));
  }

  @Test
  public void indexUsedAsValueStaysRange() {
    // while (_g < xs.length) { var i = _g++; sum = sum + xs[i] * i; }
    ImmutableList<TypedExpr> stmts =
        ImmutableList.of(
            varDecl(counter, intConst(0)),
            whileLoop(
                lessThan(local(counter), xsLength()),
                block(
                    varDecl(i, postIncrement(local(counter))),
                    addToSum(
                        binop(BinOp.MULT, arrayAccess(local(xs), local(i)), local(i))))));
    assertThat(classifier.classify(stmts, 0).intent()).isInstanceOf(RangeLoop.class);
  }

  @Test
  public void iteratorLoop() {
    TVar it = vars.temp("_it", TypeRef.iterator(TypeRef.INT));
    ImmutableList<TypedExpr> stmts =
        ImmutableList.of(
            varDecl(it, method(TypeRef.iterator(TypeRef.INT), local(xs), "iterator")),
            whileLoop(
                method(TypeRef.BOOL, local(it), "hasNext"),
                block(varDecl(x, method(TypeRef.INT, local(it), "next")), println(local(x)))));
    Classification result = classifier.classify(stmts, 0);
    assertThat(result.consumed()).isEqualTo(2);
    assertThat(result.infrastructure()).containsExactly(it);
    CollectionLoop loop = (CollectionLoop) result.intent();
    assertThat(loop.userVar()).isSameInstanceAs(x);
    assertThat(loop.collection().unwrap().isLocal(xs)).isTrue();
  }

  @Test
  public void mapEntryLoop() {
    TypeRef mapType = TypeRef.map(TypeRef.STRING, TypeRef.INT);
    TVar m = vars.user("m", mapType);
    TVar it = vars.temp("_it", TypeRef.iterator(TypeRef.DYNAMIC));
    TVar entry = vars.temp("_e", TypeRef.DYNAMIC);
    TVar k = vars.user("k", TypeRef.STRING);
    TVar v = vars.user("v", TypeRef.INT);
    ImmutableList<TypedExpr> stmts =
        ImmutableList.of(
            varDecl(it, method(TypeRef.iterator(TypeRef.DYNAMIC), local(m), "keyValueIterator")),
            whileLoop(
                method(TypeRef.BOOL, local(it), "hasNext"),
                block(
                    varDecl(entry, method(TypeRef.DYNAMIC, local(it), "next")),
                    varDecl(k, field(TypeRef.STRING, local(entry), "key")),
                    varDecl(v, field(TypeRef.INT, local(entry), "value")),
                    println(local(k)),
                    addToSum(local(v)))));
    Classification result = classifier.classify(stmts, 0);
    assertThat(result.infrastructure()).containsExactly(it, entry).inOrder();
    MapEntryLoop loop = (MapEntryLoop) result.intent();
    assertThat(loop.keyVar()).isSameInstanceAs(k);
    assertThat(loop.valueVar()).isSameInstanceAs(v);
    assertThat(loop.body()).hasSize(2);
  }

  @Test
  public void comprehensionOverForIn() {
    TVar acc = vars.user("doubled", INTS);
    ImmutableList<TypedExpr> stmts =
        ImmutableList.of(
            varDecl(acc, arrayDecl(TypeRef.INT)),
            forIn(
                x,
                local(xs),
                block(
                    ifThen(
                        binop(BinOp.GT, local(x), intConst(0)),
                        method(
                            TypeRef.INT,
                            local(acc),
                            "push",
                            binop(BinOp.MULT, local(x), intConst(2)))))),
            local(acc));
    Classification result = classifier.classify(stmts, 0);
    assertThat(result.consumed()).isEqualTo(2);
    Comprehension comprehension = (Comprehension) result.intent();
    assertThat(comprehension.accumulator()).isSameInstanceAs(acc);
    assertThat(comprehension.filter()).isNotNull();
    assertThat(comprehension.source()).isInstanceOf(CollectionLoop.class);
  }

  @Test
  public void comprehensionsDisabled() {
    TVar acc = vars.user("copy", INTS);
    ImmutableList<TypedExpr> stmts =
        ImmutableList.of(
            varDecl(acc, arrayDecl(TypeRef.INT)),
            forIn(x, local(xs), block(method(TypeRef.INT, local(acc), "push", local(x)))));
    LoopIntentClassifier noComprehensions =
        new LoopIntentClassifier(
            LoweringOptions.builder().setComprehensions(false).build());
    assertThat(classifier.classify(stmts, 0).intent()).isInstanceOf(Comprehension.class);
    assertThat(noComprehensions.classify(stmts, 0)).isNull();
  }

  @Test
  public void unrolledList() {
    TVar list = vars.user("list", INTS);
    ImmutableList<TypedExpr> stmts =
        ImmutableList.of(
            varDecl(list, arrayDecl(TypeRef.INT)),
            method(TypeRef.INT, local(list), "push", intConst(1)),
            assignOp(BinOp.ADD, local(list), arrayDecl(TypeRef.INT, intConst(2), intConst(3))),
            println(local(list)));
    Classification result = classifier.classify(stmts, 0);
    assertThat(result.consumed()).isEqualTo(3);
    UnrolledListBuild build = (UnrolledListBuild) result.intent();
    assertThat(build.elements()).hasSize(3);
    assertThat(build.yieldsValue()).isFalse();
  }

  @Test
  public void unrolledListYieldingValue() {
    TVar list = vars.user("list", INTS);
    ImmutableList<TypedExpr> stmts =
        ImmutableList.of(
            varDecl(list, arrayDecl(TypeRef.INT)),
            assign(local(list), add(local(list), arrayDecl(TypeRef.INT, intConst(1)))),
            local(list));
    Classification result = classifier.classify(stmts, 0);
    assertThat(result.consumed()).isEqualTo(3);
    assertThat(((UnrolledListBuild) result.intent()).yieldsValue()).isTrue();
  }

  @Test
  public void selfReferencingAppendIsNotUnrolled() {
    TVar list = vars.user("list", INTS);
    ImmutableList<TypedExpr> stmts =
        ImmutableList.of(
            varDecl(list, arrayDecl(TypeRef.INT)),
            method(TypeRef.INT, local(list), "push", field(TypeRef.INT, local(list), "length")));
    assertThat(classifier.classify(stmts, 0)).isNull();
  }

  @Test
  public void forInIsNotReclassified() {
    ImmutableList<TypedExpr> stmts =
        ImmutableList.of(forIn(x, local(xs), block(addToSum(local(x)))));
    assertThat(classifier.classify(stmts, 0)).isNull();
  }

  @Test
  public void forInIntent() {
    TypedExpr.ForIn overRange =
        forIn(i, interval(intConst(0), local(n)), block(println(local(i))));
    RangeLoop range = (RangeLoop) classifier.forIn(overRange);
    assertThat(range.userVar()).isSameInstanceAs(i);
    assertThat(range.end().unwrap().isLocal(n)).isTrue();

    CollectionLoop loop = (CollectionLoop) classifier.forIn(forIn(x, local(xs), println(local(x))));
    assertThat(loop.userVar()).isSameInstanceAs(x);
    assertThat(loop.body()).hasSize(1);
  }

  @Test
  public void loopIntentsDisabled() {
    LoopIntentClassifier disabled =
        new LoopIntentClassifier(LoweringOptions.builder().setLoopIntents(false).build());
    assertThat(disabled.classify(rangeWithLimit(), 1)).isNull();
  }
}
