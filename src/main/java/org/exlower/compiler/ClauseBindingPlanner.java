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
import java.util.Map;
import java.util.TreeMap;
import org.exlower.ast.ElixirAst;
import org.exlower.ast.Pattern;
import org.exlower.typed.EnumDecl;
import org.exlower.typed.TVar;
import org.exlower.typed.TypedExpr;
import org.exlower.util.Names;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides, for each case clause of a switch over a tagged union, which variable the clause's
 * pattern binds for each constructor parameter.
 *
 * <p>The front end may present a parameter in several ways: as a retained pattern variable on the
 * case, as a statement {@code var t = enumParameter(subject, ctor, i)} at the start of the body,
 * or both, often followed by an alias {@code var u = t} that carries the user's name. The planner
 * folds all of these into a single binding:
 *
 * <ol>
 *   <li>The first extraction of each parameter in the top-level statements of the body is made
 *       redundant (the pattern binds it); later extractions of the same parameter are renamed onto
 *       it and also made redundant.
 *   <li>If the extracted variable is referenced exactly once, by an alias {@code var u = t}, the
 *       binding takes {@code u}'s name and the alias is made redundant. If {@code u} is itself a
 *       compiler temporary the same rule is applied once more.
 *   <li>Otherwise the binding takes the name of the retained pattern variable, or of the extracted
 *       variable (using the constructor's declared parameter name if that is a compiler temporary).
 *   <li>A parameter with none of these has no entry; the pattern has {@code _} at its position.
 * </ol>
 *
 * A binding is used if the guard or body (ignoring the redundant statements) refers to any variable
 * bound to it; unused bindings are written following {@link LoweringOptions#unusedStyle}.
 */
public final class ClauseBindingPlanner {

  private static final Logger log = LoggerFactory.getLogger(ClauseBindingPlanner.class);

  private final LoweringOptions options;

  public ClauseBindingPlanner(LoweringOptions options) {
    this.options = options;
  }

  /** The possible outcomes of {@link #reconcile}. */
  public enum Reconciliation {
    /** The statement is redundant with the pattern and must be elided. */
    ELIDED,
    /** The statement is not covered by the active plan and must be lowered as written. */
    KEPT
  }

  /** Returns the binding plan for the clause of {@code c} that matches {@code ctor}. */
  public BindingPlan plan(TypedExpr subject, EnumDecl.Ctor ctor, TypedExpr.Case c) {
    BindingPlan plan = new BindingPlan(subject, ctor);
    ImmutableList<TypedExpr> stmts = TypedTrees.statements(c.body);

    // Find the extractions.
    Map<Integer, TypedExpr.VarDecl> first = new TreeMap<>();
    Map<Integer, List<TVar>> repeats = new TreeMap<>();
    for (TypedExpr stmt : stmts) {
      TypedExpr.EnumParameter param = extraction(stmt);
      if (param == null || !plan.matches(param)) {
        continue;
      }
      TypedExpr.VarDecl decl = (TypedExpr.VarDecl) stmt;
      if (first.putIfAbsent(param.index, decl) != null) {
        repeats.computeIfAbsent(param.index, k -> new ArrayList<>()).add(decl.var);
      }
      plan.addRedundant(decl);
    }

    List<TypedExpr> roots = new ArrayList<>();
    if (c.guard != null) {
      roots.add(c.guard);
    }
    roots.add(c.body);
    UsageCounter allRefs = UsageCounter.count(roots, plan.redundantStatements());

    // Resolve each parameter's name.
    List<List<TVar>> varsByIndex = new ArrayList<>();
    List<@Nullable TVar> namedBy = new ArrayList<>();
    for (int i = 0; i < ctor.arity(); i++) {
      List<TVar> vars = new ArrayList<>();
      TVar patternVar = c.patternVar(i);
      if (patternVar != null) {
        vars.add(patternVar);
      }
      TVar named = patternVar;
      TypedExpr.VarDecl decl = first.get(i);
      if (decl != null) {
        vars.add(decl.var);
        vars.addAll(repeats.getOrDefault(i, List.of()));
        TypedExpr.VarDecl alias = uniqueAlias(stmts, decl.var, allRefs);
        if (alias != null) {
          plan.addRedundant(alias);
          vars.add(alias.var);
          named = alias.var;
          if (alias.var.generated) {
            TypedExpr.VarDecl second = uniqueAlias(stmts, alias.var, allRefs);
            if (second != null) {
              plan.addRedundant(second);
              vars.add(second.var);
              named = second.var;
            }
          }
        } else if (named == null) {
          named = decl.var;
        }
      }
      varsByIndex.add(vars);
      namedBy.add(named);
    }

    // Usage is counted once all the redundant statements are known.
    UsageCounter usage = UsageCounter.count(roots, plan.redundantStatements());
    for (int i = 0; i < ctor.arity(); i++) {
      TVar named = namedBy.get(i);
      if (named == null) {
        continue;
      }
      List<TVar> vars = varsByIndex.get(i);
      boolean used = vars.stream().anyMatch(usage::isReferenced);
      plan.addEntry(
          new BindingPlanEntry(i, finalName(ctor, i, named), used, !named.generated), vars);
    }
    log.debug("plan for {}: {}", ctor.name, plan);
    return plan;
  }

  /**
   * Makes {@code plan}'s names visible to the current scope of {@code ctx}. An entry whose name is
   * held by another variable in a visible scope is renamed first.
   */
  public void bindAll(CompilationContext ctx, BindingPlan plan) {
    for (BindingPlanEntry entry : plan.entries()) {
      int index = entry.parameterIndex();
      String name = ctx.bindFresh(plan.boundVars(index), entry.finalName());
      if (!name.equals(entry.finalName())) {
        plan.rename(index, name);
      }
    }
  }

  /**
   * Called for each {@code var t = enumParameter(...)} statement that is lowered while a plan is
   * active and that was not marked redundant by the plan itself (e.g. one nested inside an {@code
   * if}). If it extracts a parameter of the matched value:
   *
   * <ul>
   *   <li>if the plan has an entry for that parameter, {@code t} is renamed to the entry's name and
   *       the statement is elided;
   *   <li>if not, and {@code t} is a compiler temporary, a new entry is added to the plan (so the
   *       pattern will bind it) and the statement is elided.
   * </ul>
   *
   * Anything else is kept.
   */
  public Reconciliation reconcile(CompilationContext ctx, TypedExpr.VarDecl decl) {
    BindingPlan plan = ctx.plan();
    TypedExpr.EnumParameter param = extraction(decl);
    if (plan == null || param == null || !plan.matches(param)) {
      return Reconciliation.KEPT;
    }
    BindingPlanEntry entry = plan.entry(param.index);
    if (entry != null) {
      plan.addBoundVar(param.index, decl.var);
      ctx.bind(decl.var, entry.finalName());
      return Reconciliation.ELIDED;
    } else if (decl.var.generated) {
      String name =
          ctx.bindFresh(ImmutableList.of(decl.var), finalName(plan.ctor, param.index, decl.var));
      entry = new BindingPlanEntry(param.index, name, false, false);
      plan.addEntry(entry, ImmutableList.of(decl.var));
      log.debug("adopted {} into plan for {}", decl.var, plan.ctor.name);
      return Reconciliation.ELIDED;
    }
    return Reconciliation.KEPT;
  }

  /**
   * Returns the pattern for the clause. This must be called after the guard and body have been
   * lowered (so that entries added by {@link #reconcile} are included) and before the clause's
   * scope is popped.
   */
  public Pattern renderPattern(CompilationContext ctx, BindingPlan plan) {
    List<Pattern> elements = new ArrayList<>();
    elements.add(Pattern.literal(ElixirAst.atom(Names.atomName(plan.ctor.name))));
    for (int i = 0; i < plan.ctor.arity(); i++) {
      BindingPlanEntry entry = plan.entry(i);
      if (entry == null) {
        elements.add(Pattern.wildcard());
        continue;
      }
      boolean used =
          entry.isUsed() || plan.boundVars(i).stream().anyMatch(ctx::wasReferenced);
      if (used) {
        elements.add(Pattern.var(entry.finalName()));
      } else if (options.unusedStyle == LoweringOptions.UnusedStyle.PREFIX
          && entry.userFacing()) {
        elements.add(Pattern.var(Names.unusedName(entry.finalName())));
      } else {
        elements.add(Pattern.wildcard());
      }
    }
    return Pattern.tuple(elements);
  }

  /** If {@code stmt} is {@code var t = enumParameter(...)}, returns the ENUM_PARAMETER. */
  static TypedExpr.@Nullable EnumParameter extraction(TypedExpr stmt) {
    if (stmt instanceof TypedExpr.VarDecl decl
        && decl.init != null
        && decl.init.unwrap() instanceof TypedExpr.EnumParameter param) {
      return param;
    }
    return null;
  }

  /**
   * If {@code t}'s only reference is as the initializer of a top-level {@code var u = t}, returns
   * that declaration.
   */
  private static TypedExpr.@Nullable VarDecl uniqueAlias(
      List<TypedExpr> stmts, TVar t, UsageCounter refs) {
    if (refs.count(t) != 1) {
      return null;
    }
    for (TypedExpr stmt : stmts) {
      if (stmt instanceof TypedExpr.VarDecl decl
          && decl.init != null
          && decl.init.unwrap().isLocal(t)) {
        return decl;
      }
    }
    return null;
  }

  private static String finalName(EnumDecl.Ctor ctor, int index, TVar named) {
    // Temporaries take the declared parameter name.
    String source = named.generated ? ctor.paramNames.get(index) : named.name;
    return Names.variableName(source);
  }
}
