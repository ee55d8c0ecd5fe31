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
import static org.junit.Assert.assertThrows;

import java.util.List;
import org.exlower.typed.TVar;
import org.exlower.typed.TypeRef;
import org.exlower.typed.TypedExprs;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class CompilationContextTest {

  private final TVar.Factory vars = new TVar.Factory();
  private final CompilationContext ctx = new CompilationContext(LoweringOptions.DEFAULT);

  @Test
  public void scopedNames() {
    TVar temp = vars.temp("_g2", TypeRef.INT);
    assertThat(ctx.nameOf(temp)).isEqualTo("g2");
    ctx.pushScope();
    ctx.bind(temp, "value");
    assertThat(ctx.nameOf(temp)).isEqualTo("value");
    ctx.popScope();
    assertThat(ctx.nameOf(temp)).isEqualTo("g2");
    ctx.freeze();
    // The renaming table keeps every name chosen.
    assertThat(ctx.renamingTable()).containsExactly(temp.id, "value");
  }

  @Test
  public void declaredNamesAreNotReused() {
    TVar outer = vars.user("item", TypeRef.INT);
    TVar inner = vars.user("item", TypeRef.INT);
    assertThat(ctx.declare(outer)).isEqualTo("item");
    ctx.pushScope();
    assertThat(ctx.declare(inner)).isEqualTo("item_1");
    assertThat(ctx.freshName("item")).isEqualTo("item_2");
    // Declaring again keeps the name.
    assertThat(ctx.declare(outer)).isEqualTo("item");
    ctx.popScope();
    ctx.pushScope();
    // The inner scope's names are free again.
    assertThat(ctx.freshName("item_1")).isEqualTo("item_1");
    ctx.popScope();
  }

  @Test
  public void bindFreshSharesNameAmongItsVariables() {
    TVar temp = vars.temp("_g", TypeRef.INT);
    TVar alias = vars.user("value", TypeRef.INT);
    TVar param = vars.user("value", TypeRef.INT);
    ctx.declare(param);
    ctx.pushScope();
    assertThat(ctx.bindFresh(List.of(temp, alias), "value")).isEqualTo("value_1");
    assertThat(ctx.nameOf(temp)).isEqualTo("value_1");
    assertThat(ctx.nameOf(alias)).isEqualTo("value_1");
    // Binding the same variables again keeps their name.
    assertThat(ctx.bindFresh(List.of(temp, alias), "value")).isEqualTo("value_1");
    ctx.popScope();
  }

  @Test
  public void freeVariablesAreReserved() {
    TVar item = vars.user("item", TypeRef.INT);
    ctx.reserveFreeVariables(TypedExprs.local(item));
    ctx.pushScope();
    assertThat(ctx.freshName("item")).isEqualTo("item_1");
    assertThat(ctx.nameOf(item)).isEqualTo("item");
    ctx.popScope();
  }

  @Test
  public void usagePropagatesToParent() {
    TVar x = vars.user("x", TypeRef.INT);
    ctx.pushScope();
    ctx.pushScope();
    ctx.markUsed(x);
    assertThat(ctx.wasReferenced(x)).isTrue();
    ctx.popScope();
    assertThat(ctx.wasReferenced(x)).isTrue();
    ctx.popScope();
    assertThat(ctx.depth()).isEqualTo(1);
    assertThat(ctx.wasReferenced(x)).isTrue();
  }

  @Test
  public void siblingScopesAreIndependent() {
    TVar x = vars.user("x", TypeRef.INT);
    ctx.pushScope();
    ctx.pushScope();
    ctx.markUsed(x);
    ctx.popScope();
    ctx.pushScope();
    assertThat(ctx.wasReferenced(x)).isFalse();
    ctx.popScope();
    ctx.popScope();
  }

  @Test
  public void elementAliases() {
    TVar xs = vars.user("xs", TypeRef.array(TypeRef.INT));
    TVar i = vars.user("i", TypeRef.INT);
    ctx.pushScope();
    ctx.addElementAlias(xs, i, "item");
    ctx.pushScope();
    assertThat(ctx.elementAlias(xs, i)).isEqualTo("item");
    assertThat(ctx.elementAlias(i, xs)).isNull();
    ctx.popScope();
    ctx.popScope();
    assertThat(ctx.elementAlias(xs, i)).isNull();
  }

  @Test
  public void unbalancedPop() {
    assertThrows(IllegalStateException.class, ctx::popScope);
  }

  @Test
  public void frozenContext() {
    TVar temp = vars.temp("_g", TypeRef.INT);
    assertThrows(IllegalStateException.class, ctx::renamingTable);
    ctx.addInfrastructure(temp);
    ctx.freeze();
    assertThat(ctx.isFrozen()).isTrue();
    assertThat(ctx.infrastructureVars()).containsExactly(temp.id);
    assertThrows(IllegalStateException.class, () -> ctx.bind(temp, "g"));
    assertThrows(IllegalStateException.class, () -> ctx.report(null, "late"));
  }

  @Test
  public void diagnostics() {
    ctx.report(null, "first");
    ctx.report(null, "second");
    assertThat(ctx.diagnostics()).hasSize(2);
    assertThat(ctx.diagnostics().get(1).message()).isEqualTo("second");
  }
}
