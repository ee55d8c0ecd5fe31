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
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.exlower.typed.SourcePos;
import org.exlower.typed.TVar;
import org.exlower.typed.TypedExpr;
import org.exlower.util.Names;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The state shared by all the steps of lowering one unit (an expression, a function, or a module).
 * A CompilationContext is created for each unit and passed explicitly to everything that needs it;
 * there is no static state, so independent units can be lowered concurrently, each with its own
 * context.
 *
 * <p>Most of the state is scoped: {@link #pushScope} starts a new frame (for a function body, a
 * case clause, or a loop body) and {@link #popScope} discards it. A frame holds
 *
 * <ul>
 *   <li>the final names chosen for variables in that scope (which override the default name
 *       derived from the source name),
 *   <li>the names taken in that scope, each owned by one variable; a name is never given to a
 *       second variable while the scope that took it is visible, and
 *   <li>the set of variables referenced while the frame was active; on pop these are merged into
 *       the parent frame, so a frame's usage set includes that of all its descendants.
 * </ul>
 *
 * <p>Every final name chosen is also recorded in the unit-wide renaming table, which (with the set
 * of infrastructure variables) is exported once the unit has been lowered and the context frozen.
 */
public final class CompilationContext {

  private static final Logger log = LoggerFactory.getLogger(CompilationContext.class);

  private static class Frame {
    final Map<Integer, String> names = new HashMap<>();

    /** Maps each name taken in this scope to the id of the variable that holds it. */
    final Map<String, Integer> claims = new HashMap<>();

    final Set<Integer> used = new HashSet<>();

    /** Maps "arrayId:indexId" to the name of the element variable that replaces array[index]. */
    final Map<String, String> elementAliases = new HashMap<>();
  }

  private final LoweringOptions options;
  private final Deque<Frame> frames = new ArrayDeque<>();
  private final Map<Integer, String> renamingTable = new LinkedHashMap<>();
  private final Set<Integer> infrastructure = new LinkedHashSet<>();
  private final List<Diagnostic> diagnostics = new ArrayList<>();
  private @Nullable BindingPlan plan;

  /** Owners for names that belong to no source variable; counts down from -1. */
  private int nextSyntheticOwner = -1;

  private int visits;
  private final Deque<String> trace = new ArrayDeque<>();

  private boolean frozen;

  public CompilationContext(LoweringOptions options) {
    this.options = options;
    frames.push(new Frame());
  }

  public LoweringOptions options() {
    return options;
  }

  public void pushScope() {
    checkNotFrozen();
    frames.push(new Frame());
  }

  public void popScope() {
    Preconditions.checkState(frames.size() > 1, "popScope() without pushScope()");
    Frame frame = frames.pop();
    frames.peek().used.addAll(frame.used);
  }

  /** Returns the number of active scopes, including the outermost. */
  public int depth() {
    return frames.size();
  }

  /**
   * Takes the default names of the variables that {@code root} refers to without declaring them,
   * so that nothing declared inside the unit can hide them.
   */
  public void reserveFreeVariables(TypedExpr root) {
    for (TVar v : TypedTrees.freeVariables(root)) {
      declare(v);
    }
  }

  /** Sets the final name of {@code v} for the rest of the current scope. */
  public void bind(TVar v, String name) {
    checkNotFrozen();
    Frame frame = frames.peek();
    frame.names.put(v.id, name);
    frame.claims.putIfAbsent(name, v.id);
    renamingTable.put(v.id, name);
  }

  /**
   * Binds every one of {@code vars} to {@code base}, or to the first of {@code base_1}, {@code
   * base_2}, ... that no other variable holds in a visible scope. Returns the name chosen.
   */
  public String bindFresh(List<TVar> vars, String base) {
    Preconditions.checkArgument(!vars.isEmpty(), "no variables to bind");
    Set<Integer> owners = new HashSet<>();
    vars.forEach(v -> owners.add(v.id));
    String name = freeName(base, owners);
    vars.forEach(v -> bind(v, name));
    return name;
  }

  /**
   * Gives {@code v} a name in the current scope, unless it already has one in a visible scope.
   * Returns its name.
   */
  public String declare(TVar v) {
    String name = visibleName(v);
    if (name != null) {
      return name;
    }
    return bindFresh(ImmutableList.of(v), Names.variableName(v.name));
  }

  /**
   * Returns {@code base}, or a numbered variant of it, for a variable that the lowering introduces
   * itself; the name is taken for the rest of the current scope.
   */
  public String freshName(String base) {
    checkNotFrozen();
    int owner = nextSyntheticOwner--;
    String name = freeName(base, ImmutableSet.of(owner));
    frames.peek().claims.put(name, owner);
    return name;
  }

  private String freeName(String base, Set<Integer> owners) {
    String name = base;
    for (int n = 1; isTaken(name, owners); n++) {
      name = base + "_" + n;
    }
    if (!name.equals(base)) {
      log.debug("renamed {} to {} to avoid a clash", base, name);
    }
    return name;
  }

  private boolean isTaken(String name, Set<Integer> owners) {
    for (Frame frame : frames) {
      Integer owner = frame.claims.get(name);
      if (owner != null && !owners.contains(owner)) {
        return true;
      }
    }
    return false;
  }

  private @Nullable String visibleName(TVar v) {
    for (Frame frame : frames) {
      String name = frame.names.get(v.id);
      if (name != null) {
        return name;
      }
    }
    return null;
  }

  /**
   * Returns the final name of {@code v}: the innermost name set for it in a visible scope, else the
   * last name it was given anywhere in the unit. A variable that has never been named is declared
   * in the current scope.
   */
  public String nameOf(TVar v) {
    String name = visibleName(v);
    if (name == null) {
      name = renamingTable.get(v.id);
    }
    return (name != null) ? name : declare(v);
  }

  /** Records that {@code v} was referenced in the current scope. */
  public void markUsed(TVar v) {
    frames.peek().used.add(v.id);
  }

  /** Returns true if {@code v} has been referenced in the current scope or any it has popped. */
  public boolean wasReferenced(TVar v) {
    return frames.peek().used.contains(v.id);
  }

  /** Within the current scope, {@code array[index]} will be lowered to {@code elementName}. */
  public void addElementAlias(TVar array, TVar index, String elementName) {
    frames.peek().elementAliases.put(array.id + ":" + index.id, elementName);
  }

  /** Returns the element variable that replaces {@code array[index]}, or null. */
  public @Nullable String elementAlias(TVar array, TVar index) {
    String key = array.id + ":" + index.id;
    for (Frame frame : frames) {
      String name = frame.elementAliases.get(key);
      if (name != null) {
        return name;
      }
    }
    return null;
  }

  /** Records {@code v} as a compiler-introduced variable that does not appear in the output. */
  public void addInfrastructure(TVar v) {
    checkNotFrozen();
    if (infrastructure.add(v.id)) {
      log.debug("infrastructure variable {}", v);
    }
  }

  public boolean isInfrastructure(TVar v) {
    return infrastructure.contains(v.id);
  }

  /** Returns the binding plan of the case clause currently being lowered, or null. */
  public @Nullable BindingPlan plan() {
    return plan;
  }

  /**
   * Makes {@code newPlan} (which may be null) the active binding plan, and returns the previous
   * one; the caller must restore it when the clause is complete.
   */
  public @Nullable BindingPlan installPlan(@Nullable BindingPlan newPlan) {
    BindingPlan prev = plan;
    plan = newPlan;
    return prev;
  }

  /** Records a problem with the construct at {@code pos}. */
  public void report(@Nullable SourcePos pos, String message) {
    checkNotFrozen();
    Diagnostic diagnostic = new Diagnostic(pos, message);
    log.warn("{}", diagnostic);
    diagnostics.add(diagnostic);
  }

  public ImmutableList<Diagnostic> diagnostics() {
    return ImmutableList.copyOf(diagnostics);
  }

  /**
   * Called before visiting each node. Throws a {@link LoweringError} if the node-visit ceiling has
   * been reached.
   */
  void enter(TypedExpr node) {
    if (++visits > options.maxNodeVisits) {
      throw new LoweringError(
          String.format("Node-visit ceiling (%s) reached", options.maxNodeVisits),
          node.pos,
          visitTrace());
    }
    trace.push(node.kind() + (node.pos == null ? "" : "@" + node.pos));
  }

  /** Called after visiting each node that {@link #enter} was called with. */
  void exit() {
    trace.pop();
  }

  /** Returns the nodes currently being visited, outermost first. */
  ImmutableList<String> visitTrace() {
    return ImmutableList.copyOf(trace).reverse();
  }

  public int visits() {
    return visits;
  }

  /** Ends the lowering; the exported tables may be read only after this. */
  public void freeze() {
    frozen = true;
  }

  public boolean isFrozen() {
    return frozen;
  }

  /** Returns the final name chosen for each variable id that was given one. */
  public ImmutableMap<Integer, String> renamingTable() {
    Preconditions.checkState(frozen, "not frozen");
    return ImmutableMap.copyOf(renamingTable);
  }

  /** Returns the ids of the infrastructure variables. */
  public ImmutableSet<Integer> infrastructureVars() {
    Preconditions.checkState(frozen, "not frozen");
    return ImmutableSet.copyOf(infrastructure);
  }

  private void checkNotFrozen() {
    Preconditions.checkState(!frozen, "context is frozen");
  }
}
