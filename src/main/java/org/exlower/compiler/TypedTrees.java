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
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;
import org.exlower.typed.TVar;
import org.exlower.typed.TypedExpr;
import org.jspecify.annotations.Nullable;

/** Static queries over typed trees. */
final class TypedTrees {

  // Static methods only
  private TypedTrees() {}

  /** Returns the statements of a BLOCK, or a singleton list of any other node. */
  static ImmutableList<TypedExpr> statements(TypedExpr e) {
    return (e instanceof TypedExpr.Block block) ? block.exprs : ImmutableList.of(e);
  }

  /**
   * Returns true if {@code a} and {@code b} are guaranteed to evaluate to the same value: the same
   * local, the same field of the same value, or equal constants. Any call makes this false.
   */
  static boolean sameValue(TypedExpr a, TypedExpr b) {
    a = a.unwrap();
    b = b.unwrap();
    if (a instanceof TypedExpr.Local la && b instanceof TypedExpr.Local lb) {
      return la.var == lb.var;
    } else if (a instanceof TypedExpr.Field fa && b instanceof TypedExpr.Field fb) {
      return fa.name.equals(fb.name) && fa.fieldKind == fb.fieldKind && sameValue(fa.obj, fb.obj);
    } else if (a instanceof TypedExpr.TypeExpr ta && b instanceof TypedExpr.TypeExpr tb) {
      return ta.path.equals(tb.path);
    } else if (a instanceof TypedExpr.Const ca && b instanceof TypedExpr.Const cb) {
      return ca.constKind == cb.constKind && Objects.equals(ca.value, cb.value);
    }
    return false;
  }

  /**
   * Returns true if {@code e} has no side effects: it is built only from constants, locals,
   * non-call field accesses, array accesses, and non-assigning operators.
   */
  static boolean isPure(TypedExpr e) {
    e = e.unwrap();
    switch (e.kind()) {
      case CONST:
      case LOCAL:
      case TYPE_EXPR:
        return true;
      case FIELD:
        return isPure(((TypedExpr.Field) e).obj);
      case ARRAY_ACCESS:
        TypedExpr.ArrayAccess access = (TypedExpr.ArrayAccess) e;
        return isPure(access.array) && isPure(access.index);
      case BINOP:
        TypedExpr.Binop binop = (TypedExpr.Binop) e;
        return isPure(binop.lhs) && isPure(binop.rhs);
      case UNOP:
        TypedExpr.Unop unop = (TypedExpr.Unop) e;
        return unop.op != TypedExpr.UnOp.INCREMENT
            && unop.op != TypedExpr.UnOp.DECREMENT
            && isPure(unop.operand);
      default:
        return false;
    }
  }

  /**
   * Returns true if {@code e} contains a {@code break} or {@code continue} that would exit a loop
   * enclosing {@code e} (i.e. one that is not inside a nested loop or function).
   */
  static boolean containsLoopExit(TypedExpr e) {
    return containsLoopExit(e, exit -> true);
  }

  /** Like {@link #containsLoopExit(TypedExpr)}, but only counts exits matching {@code which}. */
  static boolean containsLoopExit(TypedExpr e, Predicate<TypedExpr.LoopExit> which) {
    if (e instanceof TypedExpr.LoopExit exit) {
      return which.test(exit);
    } else if (e instanceof TypedExpr.While
        || e instanceof TypedExpr.ForIn
        || e instanceof TypedExpr.Function) {
      return false;
    }
    boolean[] found = new boolean[1];
    e.forEachChild(
        child -> {
          if (!found[0] && containsLoopExit(child, which)) {
            found[0] = true;
          }
        });
    return found[0];
  }

  /** Returns true if {@code e} contains a {@code return} that is not inside a nested function. */
  static boolean containsReturn(TypedExpr e) {
    if (e instanceof TypedExpr.Return) {
      return true;
    } else if (e instanceof TypedExpr.Function) {
      return false;
    }
    boolean[] found = new boolean[1];
    e.forEachChild(
        child -> {
          if (!found[0] && containsReturn(child)) {
            found[0] = true;
          }
        });
    return found[0];
  }

  /** Returns true if every path through {@code e} ends with a {@code return} or {@code throw}. */
  static boolean alwaysExits(TypedExpr e) {
    e = e.unwrap();
    if (e instanceof TypedExpr.Return || e instanceof TypedExpr.Throw) {
      return true;
    } else if (e instanceof TypedExpr.Block block) {
      return !block.exprs.isEmpty() && alwaysExits(block.exprs.get(block.exprs.size() - 1));
    } else if (e instanceof TypedExpr.If ifExpr) {
      return ifExpr.elseExpr != null
          && alwaysExits(ifExpr.thenExpr)
          && alwaysExits(ifExpr.elseExpr);
    }
    return false;
  }

  /** Returns true if {@code e} is an array literal with no elements. */
  static boolean isEmptyArray(@Nullable TypedExpr e) {
    return e != null && e.unwrap() instanceof TypedExpr.ArrayDecl decl && decl.elements.isEmpty();
  }

  /**
   * Returns the variables that {@code root} refers to but never declares (as a local, a function
   * parameter, a loop variable, a catch variable, or a retained pattern variable), in order of
   * first reference.
   */
  static ImmutableList<TVar> freeVariables(TypedExpr root) {
    Set<Integer> declared = new HashSet<>();
    Map<Integer, TVar> referenced = new LinkedHashMap<>();
    collectVariables(root, declared, referenced);
    return referenced.values().stream()
        .filter(v -> !declared.contains(v.id))
        .collect(ImmutableList.toImmutableList());
  }

  private static void collectVariables(
      TypedExpr e, Set<Integer> declared, Map<Integer, TVar> referenced) {
    if (e instanceof TypedExpr.Local local) {
      referenced.putIfAbsent(local.var.id, local.var);
    } else if (e instanceof TypedExpr.VarDecl decl) {
      declared.add(decl.var.id);
    } else if (e instanceof TypedExpr.ForIn forIn) {
      declared.add(forIn.var.id);
    } else if (e instanceof TypedExpr.Function function) {
      function.args.forEach(arg -> declared.add(arg.id));
    } else if (e instanceof TypedExpr.Try tryExpr) {
      tryExpr.catches.forEach(c -> declared.add(c.var.id));
    } else if (e instanceof TypedExpr.Switch switchExpr) {
      for (TypedExpr.Case c : switchExpr.cases) {
        for (TVar v : c.patternVars) {
          if (v != null) {
            declared.add(v.id);
          }
        }
      }
    }
    e.forEachChild(child -> collectVariables(child, declared, referenced));
  }
}
