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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import org.exlower.typed.EnumDecl;
import org.exlower.typed.TVar;
import org.exlower.typed.TypedExpr;
import org.jspecify.annotations.Nullable;

/**
 * The binding plan for one case clause of a switch over a tagged union: at most one {@link
 * BindingPlanEntry} per constructor parameter, plus the source variables bound to each entry and
 * the statements of the clause body that the pattern makes redundant.
 *
 * <p>Plans are built by {@link ClauseBindingPlanner}. An entry may be added after the plan is
 * installed (see {@link ClauseBindingPlanner#reconcile}). An existing entry changes only when its
 * name is taken by a variable of an enclosing scope and it is {@linkplain #rename renamed} as the
 * clause is entered.
 */
public final class BindingPlan {
  /** The value being matched (the operand of the switch's ENUM_INDEX). */
  public final TypedExpr subject;

  public final EnumDecl.Ctor ctor;

  private final Map<Integer, BindingPlanEntry> entries = new TreeMap<>();
  private final Map<Integer, List<TVar>> boundVars = new TreeMap<>();
  private final Set<TypedExpr> redundant = Collections.newSetFromMap(new IdentityHashMap<>());

  BindingPlan(TypedExpr subject, EnumDecl.Ctor ctor) {
    this.subject = subject;
    this.ctor = ctor;
  }

  public @Nullable BindingPlanEntry entry(int index) {
    return entries.get(index);
  }

  /** Returns the entries in parameter order. */
  public ImmutableList<BindingPlanEntry> entries() {
    return ImmutableList.copyOf(entries.values());
  }

  /** Returns the source variables whose references are rewritten to the given entry's name. */
  public ImmutableList<TVar> boundVars(int index) {
    List<TVar> vars = boundVars.get(index);
    return (vars == null) ? ImmutableList.of() : ImmutableList.copyOf(vars);
  }

  /** Returns true if {@code stmt} (compared by identity) must be elided. */
  public boolean isRedundant(TypedExpr stmt) {
    return redundant.contains(stmt);
  }

  /** Returns true if {@code param} extracts a parameter of the value this clause matched. */
  public boolean matches(TypedExpr.EnumParameter param) {
    return param.ctor == ctor && TypedTrees.sameValue(param.expr, subject);
  }

  Set<TypedExpr> redundantStatements() {
    return Collections.unmodifiableSet(redundant);
  }

  void addEntry(BindingPlanEntry entry, List<TVar> vars) {
    Preconditions.checkState(
        !entries.containsKey(entry.parameterIndex()),
        "duplicate entry for %s",
        entry.parameterIndex());
    entries.put(entry.parameterIndex(), entry);
    boundVars.put(entry.parameterIndex(), new ArrayList<>(vars));
  }

  void rename(int index, String finalName) {
    BindingPlanEntry entry = entries.get(index);
    Preconditions.checkState(entry != null, "no entry for %s", index);
    entries.put(
        index,
        new BindingPlanEntry(index, finalName, entry.isUsed(), entry.userFacing()));
  }

  void addBoundVar(int index, TVar v) {
    Preconditions.checkState(entries.containsKey(index));
    boundVars.get(index).add(v);
  }

  void addRedundant(TypedExpr stmt) {
    redundant.add(stmt);
  }

  @Override
  public String toString() {
    return ctor.name + entries.values();
  }
}
