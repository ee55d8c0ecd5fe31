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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.Arrays;
import java.util.List;
import org.exlower.typed.TypedExpr.BinOp;
import org.exlower.typed.TypedExpr.ConstKind;
import org.exlower.typed.TypedExpr.FieldKind;
import org.exlower.typed.TypedExpr.UnOp;
import org.jspecify.annotations.Nullable;

/**
 * Static factory methods for building typed trees. Front ends that translate their own
 * representation use these, as do the tests. No source positions are attached; use {@link #at} to
 * build a node with one.
 */
public final class TypedExprs {

  // Static methods only
  private TypedExprs() {}

  public static TypedExpr.Const intConst(long i) {
    return new TypedExpr.Const(TypeRef.INT, null, ConstKind.INT, i);
  }

  public static TypedExpr.Const floatConst(double d) {
    return new TypedExpr.Const(TypeRef.FLOAT, null, ConstKind.FLOAT, d);
  }

  public static TypedExpr.Const stringConst(String s) {
    return new TypedExpr.Const(TypeRef.STRING, null, ConstKind.STRING, s);
  }

  public static TypedExpr.Const boolConst(boolean b) {
    return new TypedExpr.Const(TypeRef.BOOL, null, ConstKind.BOOL, b);
  }

  public static TypedExpr.Const nullConst() {
    return new TypedExpr.Const(TypeRef.DYNAMIC, null, ConstKind.NULL, null);
  }

  public static TypedExpr.Local local(TVar v) {
    return new TypedExpr.Local(null, v);
  }

  /** Returns a Local for {@code v} with the given position. */
  public static TypedExpr.Local at(SourcePos pos, TVar v) {
    return new TypedExpr.Local(pos, v);
  }

  public static TypedExpr.VarDecl varDecl(TVar v, @Nullable TypedExpr init) {
    return new TypedExpr.VarDecl(null, v, init);
  }

  public static TypedExpr.VarDecl varDecl(TVar v) {
    return new TypedExpr.VarDecl(null, v, null);
  }

  /** Builds a binary operation, inferring its type from the operator and operands. */
  public static TypedExpr.Binop binop(BinOp op, TypedExpr lhs, TypedExpr rhs) {
    return new TypedExpr.Binop(binopType(op, lhs, rhs), null, op, lhs, rhs);
  }

  private static TypeRef binopType(BinOp op, TypedExpr lhs, TypedExpr rhs) {
    switch (op) {
      case EQ, NOT_EQ, LT, LTE, GT, GTE, BOOL_AND, BOOL_OR:
        return TypeRef.BOOL;
      case INTERVAL:
        return TypeRef.iterator(TypeRef.INT);
      case DIV:
        return TypeRef.FLOAT;
      case ADD:
        if (lhs.type.is(TypeRef.Kind.STRING) || rhs.type.is(TypeRef.Kind.STRING)) {
          return TypeRef.STRING;
        }
        // fall through
      default:
        if (lhs.type.is(TypeRef.Kind.FLOAT) || rhs.type.is(TypeRef.Kind.FLOAT)) {
          return TypeRef.FLOAT;
        }
        return lhs.type;
    }
  }

  public static TypedExpr.Binop add(TypedExpr lhs, TypedExpr rhs) {
    return binop(BinOp.ADD, lhs, rhs);
  }

  public static TypedExpr.Binop lessThan(TypedExpr lhs, TypedExpr rhs) {
    return binop(BinOp.LT, lhs, rhs);
  }

  public static TypedExpr.Binop interval(TypedExpr start, TypedExpr end) {
    return binop(BinOp.INTERVAL, start, end);
  }

  public static TypedExpr.Assign assign(TypedExpr lhs, TypedExpr rhs) {
    return new TypedExpr.Assign(null, null, lhs, rhs);
  }

  public static TypedExpr.Assign assignOp(BinOp op, TypedExpr lhs, TypedExpr rhs) {
    return new TypedExpr.Assign(null, op, lhs, rhs);
  }

  public static TypedExpr.Unop unop(UnOp op, boolean postfix, TypedExpr operand) {
    TypeRef type = (op == UnOp.NOT) ? TypeRef.BOOL : operand.type;
    return new TypedExpr.Unop(type, null, op, postfix, operand);
  }

  public static TypedExpr.Unop not(TypedExpr operand) {
    return unop(UnOp.NOT, false, operand);
  }

  /** {@code v++} */
  public static TypedExpr.Unop postIncrement(TypedExpr operand) {
    return unop(UnOp.INCREMENT, true, operand);
  }

  /** {@code ++v} */
  public static TypedExpr.Unop preIncrement(TypedExpr operand) {
    return unop(UnOp.INCREMENT, false, operand);
  }

  public static TypedExpr.Call call(TypeRef type, TypedExpr target, TypedExpr... args) {
    return new TypedExpr.Call(type, null, target, ImmutableList.copyOf(args));
  }

  /** {@code obj.name(args)} */
  public static TypedExpr.Call method(
      TypeRef type, TypedExpr obj, String name, TypedExpr... args) {
    return call(type, field(TypeRef.FUNCTION, obj, name), args);
  }

  /** {@code Cls.name(args)} */
  public static TypedExpr.Call staticCall(
      TypeRef type, String className, String name, TypedExpr... args) {
    TypedExpr.Field target =
        new TypedExpr.Field(
            TypeRef.FUNCTION, null, typeExpr(className), name, FieldKind.STATIC, null);
    return call(type, target, args);
  }

  /** An instance field or method reference {@code obj.name}. */
  public static TypedExpr.Field field(TypeRef type, TypedExpr obj, String name) {
    return new TypedExpr.Field(type, null, obj, name, FieldKind.INSTANCE, null);
  }

  /** A field of an anonymous structure. */
  public static TypedExpr.Field anonField(TypeRef type, TypedExpr obj, String name) {
    return new TypedExpr.Field(type, null, obj, name, FieldKind.ANON, null);
  }

  /**
   * Builds a tagged-union value: a reference to the constructor if it has no parameters, otherwise
   * a call of the constructor.
   */
  public static TypedExpr enumValue(EnumDecl decl, String ctorName, TypedExpr... args) {
    EnumDecl.Ctor ctor = decl.ctor(ctorName);
    TypeRef type = TypeRef.enumType(decl);
    TypedExpr.Field ref =
        new TypedExpr.Field(
            ctor.arity() == 0 ? type : TypeRef.FUNCTION,
            null,
            typeExpr(decl.name),
            ctor.name,
            FieldKind.ENUM,
            ctor);
    return ctor.arity() == 0 ? ref : call(type, ref, args);
  }

  public static TypedExpr.ArrayAccess arrayAccess(TypedExpr array, TypedExpr index) {
    TypeRef type = array.type.is(TypeRef.Kind.ARRAY) ? array.type.element() : TypeRef.DYNAMIC;
    return new TypedExpr.ArrayAccess(type, null, array, index);
  }

  public static TypedExpr.ArrayDecl arrayDecl(TypeRef elementType, TypedExpr... elements) {
    return new TypedExpr.ArrayDecl(
        TypeRef.array(elementType), null, ImmutableList.copyOf(elements));
  }

  public static TypedExpr.ObjectDecl objectDecl(ImmutableMap<String, TypedExpr> fields) {
    return new TypedExpr.ObjectDecl(TypeRef.DYNAMIC, null, fields);
  }

  public static TypedExpr.Block block(TypedExpr... exprs) {
    return block(Arrays.asList(exprs));
  }

  public static TypedExpr.Block block(List<TypedExpr> exprs) {
    TypeRef type = exprs.isEmpty() ? TypeRef.VOID : exprs.get(exprs.size() - 1).type;
    return new TypedExpr.Block(type, null, ImmutableList.copyOf(exprs));
  }

  public static TypedExpr.If ifThen(TypedExpr cond, TypedExpr thenExpr) {
    return new TypedExpr.If(TypeRef.VOID, null, cond, thenExpr, null);
  }

  public static TypedExpr.If ifElse(TypedExpr cond, TypedExpr thenExpr, TypedExpr elseExpr) {
    return new TypedExpr.If(thenExpr.type, null, cond, thenExpr, elseExpr);
  }

  public static TypedExpr.While whileLoop(TypedExpr cond, TypedExpr body) {
    return new TypedExpr.While(null, cond, body, true);
  }

  public static TypedExpr.While doWhile(TypedExpr cond, TypedExpr body) {
    return new TypedExpr.While(null, cond, body, false);
  }

  public static TypedExpr.ForIn forIn(TVar v, TypedExpr iterable, TypedExpr body) {
    return new TypedExpr.ForIn(null, v, iterable, body);
  }

  /** A case matching any of the given values, with no guard or retained pattern variables. */
  public static TypedExpr.Case caseOf(TypedExpr body, TypedExpr... values) {
    return new TypedExpr.Case(ImmutableList.copyOf(values), null, body, ImmutableList.of());
  }

  /** A case of a switch over a tagged union, matching the given constructor. */
  public static TypedExpr.Case enumCase(EnumDecl.Ctor ctor, TypedExpr body) {
    return caseOf(body, intConst(ctor.index));
  }

  public static TypedExpr.Case enumCase(
      EnumDecl.Ctor ctor, @Nullable TypedExpr guard, TypedExpr body, List<@Nullable TVar> vars) {
    return new TypedExpr.Case(ImmutableList.of(intConst(ctor.index)), guard, body, vars);
  }

  public static TypedExpr.Switch switchOn(
      TypeRef type,
      TypedExpr subject,
      List<TypedExpr.Case> cases,
      @Nullable TypedExpr defaultExpr) {
    return new TypedExpr.Switch(type, null, subject, ImmutableList.copyOf(cases), defaultExpr);
  }

  public static TypedExpr.EnumIndex enumIndex(TypedExpr expr) {
    return new TypedExpr.EnumIndex(null, expr);
  }

  public static TypedExpr.EnumParameter enumParameter(
      TypeRef type, TypedExpr expr, EnumDecl.Ctor ctor, int index) {
    return new TypedExpr.EnumParameter(type, null, expr, ctor, index);
  }

  public static TypedExpr.Function function(List<TVar> args, TypedExpr body) {
    return new TypedExpr.Function(null, ImmutableList.copyOf(args), body);
  }

  public static TypedExpr.Return ret(@Nullable TypedExpr value) {
    return new TypedExpr.Return(null, value);
  }

  public static TypedExpr.LoopExit breakLoop() {
    return new TypedExpr.LoopExit(null, true);
  }

  public static TypedExpr.LoopExit continueLoop() {
    return new TypedExpr.LoopExit(null, false);
  }

  public static TypedExpr.Throw throwValue(TypedExpr value) {
    return new TypedExpr.Throw(null, value);
  }

  public static TypedExpr.Try tryCatch(TypedExpr body, TypedExpr.Catch... catches) {
    return new TypedExpr.Try(body.type, null, body, ImmutableList.copyOf(catches));
  }

  public static TypedExpr.Paren paren(TypedExpr expr) {
    return new TypedExpr.Paren(null, expr);
  }

  public static TypedExpr.Cast cast(TypeRef type, TypedExpr expr) {
    return new TypedExpr.Cast(type, null, expr);
  }

  public static TypedExpr.New newInstance(String className, TypedExpr... args) {
    return new TypedExpr.New(null, className, ImmutableList.copyOf(args));
  }

  public static TypedExpr.TypeExpr typeExpr(String path) {
    return new TypedExpr.TypeExpr(null, path);
  }

  public static TypedExpr.Raw raw(TypeRef type, String code, TypedExpr... args) {
    return new TypedExpr.Raw(type, null, code, ImmutableList.copyOf(args));
  }
}
