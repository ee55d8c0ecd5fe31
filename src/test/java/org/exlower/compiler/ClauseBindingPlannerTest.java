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
import static org.exlower.typed.TypedExprs.binop;
import static org.exlower.typed.TypedExprs.block;
import static org.exlower.typed.TypedExprs.enumCase;
import static org.exlower.typed.TypedExprs.enumParameter;
import static org.exlower.typed.TypedExprs.intConst;
import static org.exlower.typed.TypedExprs.local;
import static org.exlower.typed.TypedExprs.staticCall;
import static org.exlower.typed.TypedExprs.varDecl;

import java.util.Arrays;
import org.exlower.ast.AstPrinter;
import org.exlower.compiler.ClauseBindingPlanner.Reconciliation;
import org.exlower.compiler.LoweringOptions.UnusedStyle;
import org.exlower.typed.EnumDecl;
import org.exlower.typed.TVar;
import org.exlower.typed.TypeRef;
import org.exlower.typed.TypedExpr;
import org.exlower.typed.TypedExpr.BinOp;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class ClauseBindingPlannerTest {

  private static final EnumDecl PAIR =
      EnumDecl.builder("Pair").ctor("Both", "left", "right").ctor("Neither").build();
  private static final EnumDecl.Ctor BOTH = PAIR.ctor("Both");

  private final TVar.Factory vars = new TVar.Factory();
  private final TVar p = vars.user("p", TypeRef.enumType(PAIR));

  private final ClauseBindingPlanner planner = new ClauseBindingPlanner(LoweringOptions.DEFAULT);
  private final CompilationContext ctx = new CompilationContext(LoweringOptions.DEFAULT);

  private TypedExpr extract(int index) {
    return enumParameter(TypeRef.INT, local(p), BOTH, index);
  }

  private static TypedExpr println(TypedExpr arg) {
    return staticCall(TypeRef.VOID, "Sys", "println", arg);
  }

  private static TypedExpr.Case clause(TypedExpr body, TVar... patternVars) {
    return enumCase(BOTH, null, body, Arrays.asList(patternVars));
  }

  @Test
  public void aliasNamesTheBinding() {
    TVar t0 = vars.temp("_g", TypeRef.INT);
    TVar t1 = vars.temp("_g1", TypeRef.INT);
    TVar width = vars.user("width", TypeRef.INT);
    TypedExpr.VarDecl extract0 = varDecl(t0, extract(0));
    TypedExpr.VarDecl alias = varDecl(width, local(t0));
    TypedExpr.VarDecl extract1 = varDecl(t1, extract(1));
    TypedExpr.Case c = clause(block(extract0, extract1, alias, println(local(width))));

    BindingPlan plan = planner.plan(local(p), BOTH, c);

    assertThat(plan.entries())
        .containsExactly(
            new BindingPlanEntry(0, "width", true, true),
            new BindingPlanEntry(1, "right", false, false))
        .inOrder();
    assertThat(plan.boundVars(0)).containsExactly(t0, width).inOrder();
    assertThat(plan.isRedundant(extract0)).isTrue();
    assertThat(plan.isRedundant(extract1)).isTrue();
    assertThat(plan.isRedundant(alias)).isTrue();
  }

  @Test
  public void planIsDeterministic() {
    TVar t0 = vars.temp("_g", TypeRef.INT);
    TVar a = vars.user("a", TypeRef.INT);
    TypedExpr.Case c =
        clause(block(varDecl(t0, extract(0)), varDecl(a, local(t0)), println(local(a))));
    String first = planner.plan(local(p), BOTH, c).toString();
    for (int i = 0; i < 5; i++) {
      assertThat(planner.plan(local(p), BOTH, c).toString()).isEqualTo(first);
    }
  }

  @Test
  public void repeatedExtractionSharesTheName() {
    TVar t0 = vars.temp("_g", TypeRef.INT);
    TVar t1 = vars.temp("_g1", TypeRef.INT);
    TypedExpr.VarDecl second = varDecl(t1, extract(0));
    TypedExpr.Case c =
        clause(block(varDecl(t0, extract(0)), second, println(local(t0)), println(local(t1))));

    BindingPlan plan = planner.plan(local(p), BOTH, c);

    assertThat(plan.entry(0)).isEqualTo(new BindingPlanEntry(0, "left", true, false));
    assertThat(plan.boundVars(0)).containsExactly(t0, t1).inOrder();
    assertThat(plan.isRedundant(second)).isTrue();
  }

  @Test
  public void retainedPatternVariable() {
    TVar left = vars.user("left", TypeRef.INT);
    TypedExpr.Case c =
        enumCase(
            BOTH,
            binop(BinOp.GT, local(left), intConst(0)),
            println(intConst(1)),
            Arrays.asList(left, null));

    BindingPlan plan = planner.plan(local(p), BOTH, c);

    // Referenced by the guard only.
    assertThat(plan.entry(0)).isEqualTo(new BindingPlanEntry(0, "left", true, true));
    assertThat(plan.entry(1)).isNull();
  }

  @Test
  public void extractionOfAnotherValueIsIgnored() {
    TVar q = vars.user("q", TypeRef.enumType(PAIR));
    TVar t0 = vars.temp("_g", TypeRef.INT);
    TypedExpr.VarDecl other = varDecl(t0, enumParameter(TypeRef.INT, local(q), BOTH, 0));
    BindingPlan plan = planner.plan(local(p), BOTH, clause(block(other, println(local(t0)))));
    assertThat(plan.entries()).isEmpty();
    assertThat(plan.isRedundant(other)).isFalse();
  }

  @Test
  public void renderPattern() {
    TVar right = vars.user("right", TypeRef.INT);
    TypedExpr.Case c = clause(println(intConst(0)), null, right);
    BindingPlan plan = planner.plan(local(p), BOTH, c);
    ctx.pushScope();
    String prefixed = AstPrinter.print(planner.renderPattern(ctx, plan));
    ClauseBindingPlanner wildcards =
        new ClauseBindingPlanner(
            LoweringOptions.builder().setUnusedStyle(UnusedStyle.WILDCARD).build());
    String wildcard = AstPrinter.print(wildcards.renderPattern(ctx, plan));
    ctx.popScope();
    assertThat(prefixed).isEqualTo("{:both, _, _right}");
    assertThat(wildcard).isEqualTo("{:both, _, _}");
  }

  @Test
  public void renderPatternCountsReferencesMadeWhileLowering() {
    TVar right = vars.user("right", TypeRef.INT);
    TypedExpr.Case c = clause(println(intConst(0)), null, right);
    BindingPlan plan = planner.plan(local(p), BOTH, c);
    assertThat(plan.entry(1).isUsed()).isFalse();
    ctx.pushScope();
    planner.bindAll(ctx, plan);
    ctx.markUsed(right);
    assertThat(AstPrinter.print(planner.renderPattern(ctx, plan))).isEqualTo("{:both, _, right}");
    ctx.popScope();
  }

  @Test
  public void bindAllRenamesEntryHeldByOuterVariable() {
    TVar outer = vars.user("right", TypeRef.INT);
    TVar right = vars.user("right", TypeRef.INT);
    ctx.declare(outer);
    BindingPlan plan = planner.plan(local(p), BOTH, clause(println(local(right)), null, right));
    ctx.pushScope();
    planner.bindAll(ctx, plan);

    assertThat(plan.entry(1)).isEqualTo(new BindingPlanEntry(1, "right_1", true, true));
    assertThat(ctx.nameOf(right)).isEqualTo("right_1");
    assertThat(ctx.nameOf(outer)).isEqualTo("right");
    ctx.popScope();
  }

  @Test
  public void reconcileAdoptedTemporaryAvoidsOuterName() {
    TVar outer = vars.user("right", TypeRef.INT);
    TVar t0 = vars.temp("_g", TypeRef.INT);
    ctx.declare(outer);
    BindingPlan plan = planner.plan(local(p), BOTH, clause(println(intConst(0))));
    ctx.pushScope();
    ctx.installPlan(plan);

    assertThat(planner.reconcile(ctx, varDecl(t0, extract(1))))
        .isEqualTo(Reconciliation.ELIDED);

    assertThat(plan.entry(1)).isEqualTo(new BindingPlanEntry(1, "right_1", false, false));
    assertThat(ctx.nameOf(t0)).isEqualTo("right_1");
    ctx.installPlan(null);
    ctx.popScope();
  }

  @Test
  public void reconcileAdoptsNestedTemporary() {
    TVar t0 = vars.temp("_g", TypeRef.INT);
    TypedExpr.VarDecl nested = varDecl(t0, extract(1));
    BindingPlan plan = planner.plan(local(p), BOTH, clause(println(intConst(0))));
    ctx.pushScope();
    ctx.installPlan(plan);

    assertThat(planner.reconcile(ctx, nested)).isEqualTo(Reconciliation.ELIDED);

    assertThat(plan.entry(1)).isEqualTo(new BindingPlanEntry(1, "right", false, false));
    assertThat(ctx.nameOf(t0)).isEqualTo("right");
    ctx.installPlan(null);
    ctx.popScope();
  }

  @Test
  public void reconcileRenamesOntoExistingEntry() {
    TVar left = vars.user("first", TypeRef.INT);
    TVar t0 = vars.temp("_g", TypeRef.INT);
    BindingPlan plan =
        planner.plan(local(p), BOTH, clause(println(local(left)), left, null));
    ctx.pushScope();
    ctx.installPlan(plan);
    planner.bindAll(ctx, plan);

    assertThat(planner.reconcile(ctx, varDecl(t0, extract(0))))
        .isEqualTo(Reconciliation.ELIDED);

    assertThat(ctx.nameOf(t0)).isEqualTo("first");
    assertThat(plan.boundVars(0)).containsExactly(left, t0).inOrder();
    ctx.installPlan(null);
    ctx.popScope();
  }

  @Test
  public void reconcileKeepsUserVariable() {
    TVar mine = vars.user("mine", TypeRef.INT);
    BindingPlan plan = planner.plan(local(p), BOTH, clause(println(intConst(0))));
    ctx.installPlan(plan);
    assertThat(planner.reconcile(ctx, varDecl(mine, extract(0))))
        .isEqualTo(Reconciliation.KEPT);
    assertThat(plan.entry(0)).isNull();
    ctx.installPlan(null);
  }

  @Test
  public void reconcileWithoutPlan() {
    TVar t0 = vars.temp("_g", TypeRef.INT);
    assertThat(planner.reconcile(ctx, varDecl(t0, extract(0)))).isEqualTo(Reconciliation.KEPT);
  }

  @Test
  public void extractionRecognized() {
    TVar t0 = vars.temp("_g", TypeRef.INT);
    assertThat(ClauseBindingPlanner.extraction(varDecl(t0, extract(0)))).isNotNull();
    assertThat(ClauseBindingPlanner.extraction(varDecl(t0, intConst(0)))).isNull();
    assertThat(ClauseBindingPlanner.extraction(varDecl(t0))).isNull();
  }
}
