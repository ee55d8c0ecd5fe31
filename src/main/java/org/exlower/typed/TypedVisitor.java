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

package org.exlower.typed;

/** One method per {@link TypedExpr} subclass. */
public interface TypedVisitor<T> {
  T visitConst(TypedExpr.Const node);

  T visitLocal(TypedExpr.Local node);

  T visitVarDecl(TypedExpr.VarDecl node);

  T visitBinop(TypedExpr.Binop node);

  T visitAssign(TypedExpr.Assign node);

  T visitUnop(TypedExpr.Unop node);

  T visitCall(TypedExpr.Call node);

  T visitField(TypedExpr.Field node);

  T visitArrayAccess(TypedExpr.ArrayAccess node);

  T visitArrayDecl(TypedExpr.ArrayDecl node);

  T visitObjectDecl(TypedExpr.ObjectDecl node);

  T visitBlock(TypedExpr.Block node);

  T visitIf(TypedExpr.If node);

  T visitWhile(TypedExpr.While node);

  T visitForIn(TypedExpr.ForIn node);

  T visitSwitch(TypedExpr.Switch node);

  T visitEnumIndex(TypedExpr.EnumIndex node);

  T visitEnumParameter(TypedExpr.EnumParameter node);

  T visitFunction(TypedExpr.Function node);

  T visitReturn(TypedExpr.Return node);

  T visitLoopExit(TypedExpr.LoopExit node);

  T visitThrow(TypedExpr.Throw node);

  T visitTry(TypedExpr.Try node);

  T visitParen(TypedExpr.Paren node);

  T visitCast(TypedExpr.Cast node);

  T visitNew(TypedExpr.New node);

  T visitTypeExpr(TypedExpr.TypeExpr node);

  T visitRaw(TypedExpr.Raw node);
}
