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
import com.google.common.collect.ImmutableSet;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.exlower.typed.TVar;
import org.exlower.typed.TypeRef;
import org.exlower.typed.TypedExpr;
import org.jspecify.annotations.Nullable;

/**
 * Finds the variables that a piece of code rebinds but does not declare. Elixir variables are
 * immutable and a rebinding inside an {@code if}, {@code case}, or anonymous function is not
 * visible outside it, so the lowering must return such variables explicitly from the construct.
 *
 * <p>A variable counts as rebound if it is the root of the left-hand side of an assignment, the
 * operand of {@code ++} or {@code --}, or the root of the receiver of a mutating builtin method
 * (e.g. {@code a.push(x)}, which becomes {@code a = a ++ [x]}).
 */
final class MutationAnalyzer {

  /** Array methods that update their receiver in place. */
  static final ImmutableSet<String> MUTATING_ARRAY_METHODS =
      ImmutableSet.of("push", "unshift", "insert", "remove", "reverse", "sort");

  /** Map methods that update their receiver in place. */
  static final ImmutableSet<String> MUTATING_MAP_METHODS =
      ImmutableSet.of("set", "remove", "clear");

  private final Set<Integer> declared = new HashSet<>();
  private final Map<Integer, TVar> assigned = new LinkedHashMap<>();

  private MutationAnalyzer() {}

  /**
   * Returns the variables rebound in {@code roots} that are not declared there, in order of first
   * rebinding. Nested functions are not examined.
   */
  static ImmutableList<TVar> outerMutations(List<TypedExpr> roots) {
    return outerMutations(roots, ImmutableList.of());
  }

  /**
   * Like {@link #outerMutations(List)}, but {@code bound} are also treated as declared: they are
   * the variables that the construct enclosing {@code roots} binds itself, such as a loop variable
   * or the pattern variables of a case clause.
   */
  static ImmutableList<TVar> outerMutations(
      List<TypedExpr> roots, Collection<? extends @Nullable TVar> bound) {
    MutationAnalyzer analyzer = new MutationAnalyzer();
    for (TVar v : bound) {
      if (v != null) {
        analyzer.declared.add(v.id);
      }
    }
    roots.forEach(analyzer::scan);
    return analyzer.assigned.values().stream()
        .filter(v -> !analyzer.declared.contains(v.id))
        .collect(ImmutableList.toImmutableList());
  }

  static ImmutableList<TVar> outerMutations(TypedExpr root) {
    return outerMutations(ImmutableList.of(root));
  }

  private void scan(TypedExpr e) {
    if (e instanceof TypedExpr.Function) {
      return;
    } else if (e instanceof TypedExpr.VarDecl decl) {
      declared.add(decl.var.id);
    } else if (e instanceof TypedExpr.ForIn forIn) {
      declared.add(forIn.var.id);
    } else if (e instanceof TypedExpr.Try tryExpr) {
      tryExpr.catches.forEach(c -> declared.add(c.var.id));
    } else if (e instanceof TypedExpr.Assign assign) {
      addRoot(assign.lhs);
    } else if (e instanceof TypedExpr.Unop unop
        && (unop.op == TypedExpr.UnOp.INCREMENT || unop.op == TypedExpr.UnOp.DECREMENT)) {
      addRoot(unop.operand);
    } else if (e instanceof TypedExpr.Call call) {
      TypedExpr receiver = mutatedReceiver(call);
      if (receiver != null) {
        addRoot(receiver);
      }
    }
    e.forEachChild(this::scan);
  }

  private void addRoot(TypedExpr lvalue) {
    TVar v = root(lvalue);
    if (v != null) {
      assigned.putIfAbsent(v.id, v);
    }
  }

  /**
   * Returns the variable whose value is replaced when {@code lvalue} is updated: {@code x} for
   * {@code x}, {@code x.f.g}, or {@code x[i]}; null if there is none.
   */
  static @Nullable TVar root(TypedExpr lvalue) {
    lvalue = lvalue.unwrap();
    if (lvalue instanceof TypedExpr.Local local) {
      return local.var;
    } else if (lvalue instanceof TypedExpr.Field field
        && (field.fieldKind == TypedExpr.FieldKind.INSTANCE
            || field.fieldKind == TypedExpr.FieldKind.ANON)) {
      return root(field.obj);
    } else if (lvalue instanceof TypedExpr.ArrayAccess access) {
      return root(access.array);
    }
    return null;
  }

  /** If {@code call} is a mutating builtin method, returns its receiver; otherwise null. */
  static @Nullable TypedExpr mutatedReceiver(TypedExpr.Call call) {
    if (!(call.target instanceof TypedExpr.Field field)
        || field.fieldKind != TypedExpr.FieldKind.INSTANCE) {
      return null;
    }
    TypeRef type = field.obj.type;
    if ((type.is(TypeRef.Kind.ARRAY) && MUTATING_ARRAY_METHODS.contains(field.name))
        || (type.is(TypeRef.Kind.MAP) && MUTATING_MAP_METHODS.contains(field.name))) {
      return field.obj;
    }
    return null;
  }
}
