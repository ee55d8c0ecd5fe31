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

import org.exlower.typed.SourcePos;
import org.exlower.typed.TypedExpr;
import org.exlower.typed.TypedVisitor;
import org.jspecify.annotations.Nullable;

/**
 * A base class for visitors of the typed tree that provides three useful functions:
 *
 * <ul>
 *   <li>Each visit is counted against the context's node-visit ceiling and recorded in its visit
 *       trace, so that runaway recursion ends in a {@link LoweringError} that says where it was.
 *   <li>Parentheses are skipped; a visitor never sees a PAREN node.
 *   <li>{@link #currentPos} gives the position of the node currently being visited (or of the
 *       nearest enclosing node that has one), for diagnostics.
 * </ul>
 */
abstract class VisitorBase<T> implements TypedVisitor<T> {

  final CompilationContext ctx;

  /** The position of the innermost node being visited that has one. */
  private @Nullable SourcePos currentPos;

  VisitorBase(CompilationContext ctx) {
    this.ctx = ctx;
  }

  /**
   * Visits {@code node}, binding {@link #currentPos} for the duration of the call.
   *
   * <p>Assumes that if the visit throws an exception, this visitor will not be used again (no
   * attempt is made to restore the correct currentPos state).
   */
  final T visit(TypedExpr node) {
    ctx.enter(node);
    SourcePos prevPos = currentPos;
    if (node.pos != null) {
      currentPos = node.pos;
    }
    T result = node.accept(this);
    currentPos = prevPos;
    ctx.exit();
    return result;
  }

  @Override
  public final T visitParen(TypedExpr.Paren node) {
    // Parentheses don't change the interpretation of the parenthesized expression.
    return visit(node.expr);
  }

  /** Returns the position of the current node, or of the nearest enclosing node with one. */
  @Nullable SourcePos currentPos() {
    return currentPos;
  }
}
