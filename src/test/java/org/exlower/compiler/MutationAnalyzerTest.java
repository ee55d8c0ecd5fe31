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
import static org.exlower.typed.TypedExprs.assign;
import static org.exlower.typed.TypedExprs.block;
import static org.exlower.typed.TypedExprs.field;
import static org.exlower.typed.TypedExprs.forIn;
import static org.exlower.typed.TypedExprs.function;
import static org.exlower.typed.TypedExprs.intConst;
import static org.exlower.typed.TypedExprs.local;
import static org.exlower.typed.TypedExprs.method;
import static org.exlower.typed.TypedExprs.postIncrement;
import static org.exlower.typed.TypedExprs.varDecl;

import com.google.testing.junit.testparameterinjector.TestParameter;
import com.google.testing.junit.testparameterinjector.TestParameterInjector;
import java.util.Arrays;
import java.util.List;
import org.exlower.typed.TVar;
import org.exlower.typed.TypeRef;
import org.exlower.typed.TypedExpr;
import org.exlower.typed.TypedExprs;
import org.junit.Test;
import org.junit.runner.RunWith;

@RunWith(TestParameterInjector.class)
public class MutationAnalyzerTest {

  private final TVar.Factory vars = new TVar.Factory();
  private final TVar x = vars.user("x", TypeRef.INT);
  private final TVar y = vars.user("y", TypeRef.INT);
  private final TVar xs = vars.user("xs", TypeRef.array(TypeRef.INT));
  private final TVar m = vars.user("m", TypeRef.map(TypeRef.STRING, TypeRef.INT));

  @Test
  public void localDeclarationsAreNotOuter() {
    TypedExpr body =
        block(varDecl(y, intConst(1)), assign(local(y), intConst(2)), assign(local(x), local(y)));
    assertThat(MutationAnalyzer.outerMutations(body)).containsExactly(x);
  }

  @Test
  public void firstRebindingOrder() {
    TypedExpr body =
        block(
            assign(local(y), intConst(1)),
            postIncrement(local(x)),
            assign(local(y), add(local(y), intConst(1))));
    assertThat(MutationAnalyzer.outerMutations(body)).containsExactly(y, x).inOrder();
  }

  @Test
  public void boundVariablesAreNotOuter() {
    TypedExpr body = block(assign(local(x), add(local(x), intConst(1))), postIncrement(local(y)));
    assertThat(MutationAnalyzer.outerMutations(List.of(body), List.of(x))).containsExactly(y);
    assertThat(MutationAnalyzer.outerMutations(List.of(body), Arrays.asList(null, y)))
        .containsExactly(x);
  }

  @Test
  public void acrossBranches() {
    assertThat(
            MutationAnalyzer.outerMutations(
                List.of(assign(local(x), intConst(1)), assign(local(y), intConst(2)))))
        .containsExactly(x, y)
        .inOrder();
  }

  @Test
  public void nestedFunctionsAreSkipped() {
    TypedExpr body = function(List.of(), assign(local(x), intConst(1)));
    assertThat(MutationAnalyzer.outerMutations(body)).isEmpty();
  }

  @Test
  public void storesRebindTheRoot() {
    TVar o = vars.user("o", TypeRef.DYNAMIC);
    TypedExpr nested = field(TypeRef.DYNAMIC, local(o), "inner");
    assertThat(
            MutationAnalyzer.outerMutations(assign(field(TypeRef.INT, nested, "n"), intConst(1))))
        .containsExactly(o);
    TypedExpr store = assign(arrayAccess(local(xs), intConst(0)), local(x));
    assertThat(MutationAnalyzer.outerMutations(store)).containsExactly(xs);
  }

  @Test
  public void loopAndCatchVariablesAreDeclared() {
    TVar e = vars.user("e", TypeRef.INT);
    TVar err = vars.user("err", TypeRef.DYNAMIC);
    TypedExpr loop = forIn(e, local(xs), assign(local(e), intConst(0)));
    TypedExpr tryExpr =
        TypedExprs.tryCatch(intConst(0), new TypedExpr.Catch(err, assign(local(err), intConst(1))));
    assertThat(MutationAnalyzer.outerMutations(List.of(loop, tryExpr))).isEmpty();
  }

  @Test
  public void mutatingArrayMethod(
      @TestParameter({"push", "unshift", "insert", "remove", "reverse", "sort"}) String name) {
    TypedExpr call = method(TypeRef.VOID, local(xs), name, local(x));
    assertThat(MutationAnalyzer.outerMutations(call)).containsExactly(xs);
  }

  @Test
  public void mutatingMapMethod(@TestParameter({"set", "remove", "clear"}) String name) {
    TypedExpr call = method(TypeRef.VOID, local(m), name);
    assertThat(MutationAnalyzer.outerMutations(call)).containsExactly(m);
  }

  @Test
  public void readingMethod(@TestParameter({"indexOf", "contains", "join", "map"}) String name) {
    TypedExpr call = method(TypeRef.INT, local(xs), name, local(x));
    assertThat(MutationAnalyzer.outerMutations(call)).isEmpty();
  }
}
