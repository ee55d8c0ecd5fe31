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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.Collections;
import java.util.List;
import java.util.function.Consumer;
import org.jspecify.annotations.Nullable;

/**
 * A node of the fully typed expression tree produced by the front end. This is the input to the
 * lowering; it is never modified by it.
 *
 * <p>Statements and expressions are not distinguished: a {@link Block} is a sequence of
 * expressions whose value is the value of the last one. Each concrete subclass corresponds to one
 * {@link Kind} and one method of {@link TypedVisitor}.
 */
public abstract class TypedExpr {

  /** The distinct node kinds. */
  public enum Kind {
    CONST,
    LOCAL,
    VAR_DECL,
    BINOP,
    ASSIGN,
    UNOP,
    CALL,
    FIELD,
    ARRAY_ACCESS,
    ARRAY_DECL,
    OBJECT_DECL,
    BLOCK,
    IF,
    WHILE,
    FOR_IN,
    SWITCH,
    ENUM_INDEX,
    ENUM_PARAMETER,
    FUNCTION,
    RETURN,
    BREAK,
    CONTINUE,
    THROW,
    TRY,
    PAREN,
    CAST,
    NEW,
    TYPE_EXPR,
    RAW
  }

  public final TypeRef type;
  public final @Nullable SourcePos pos;

  TypedExpr(TypeRef type, @Nullable SourcePos pos) {
    this.type = type;
    this.pos = pos;
  }

  public abstract Kind kind();

  public abstract <T> T accept(TypedVisitor<T> visitor);

  /** Calls {@code consumer} with each direct child of this node, in evaluation order. */
  public abstract void forEachChild(Consumer<TypedExpr> consumer);

  /** Returns true if this is a LOCAL reference to {@code v}. */
  public final boolean isLocal(TVar v) {
    return this instanceof Local local && local.var == v;
  }

  /** Returns the variable if this is a LOCAL reference, or null. */
  public final @Nullable TVar asLocalVar() {
    return (this instanceof Local local) ? local.var : null;
  }

  /** Strips any number of PAREN and CAST wrappers. */
  public final TypedExpr unwrap() {
    TypedExpr e = this;
    while (true) {
      if (e instanceof Paren paren) {
        e = paren.expr;
      } else if (e instanceof Cast cast) {
        e = cast.expr;
      } else {
        return e;
      }
    }
  }

  /** The kinds of constant values. */
  public enum ConstKind {
    INT,
    FLOAT,
    STRING,
    BOOL,
    NULL
  }

  public static final class Const extends TypedExpr {
    public final ConstKind constKind;
    public final @Nullable Object value;

    Const(TypeRef type, @Nullable SourcePos pos, ConstKind constKind, @Nullable Object value) {
      super(type, pos);
      this.constKind = constKind;
      this.value = value;
    }

    /** Returns true if this is the integer constant {@code i}. */
    public boolean isInt(int i) {
      return constKind == ConstKind.INT && ((Number) value).longValue() == i;
    }

    @Override
    public Kind kind() {
      return Kind.CONST;
    }

    @Override
    public <T> T accept(TypedVisitor<T> visitor) {
      return visitor.visitConst(this);
    }

    @Override
    public void forEachChild(Consumer<TypedExpr> consumer) {}

    @Override
    public String toString() {
      return constKind == ConstKind.STRING ? "\"" + value + "\"" : String.valueOf(value);
    }
  }

  public static final class Local extends TypedExpr {
    public final TVar var;

    Local(@Nullable SourcePos pos, TVar var) {
      super(var.type, pos);
      this.var = var;
    }

    @Override
    public Kind kind() {
      return Kind.LOCAL;
    }

    @Override
    public <T> T accept(TypedVisitor<T> visitor) {
      return visitor.visitLocal(this);
    }

    @Override
    public void forEachChild(Consumer<TypedExpr> consumer) {}

    @Override
    public String toString() {
      return var.toString();
    }
  }

  /** Declares a variable, optionally initializing it ({@code var x = init}). */
  public static final class VarDecl extends TypedExpr {
    public final TVar var;
    public final @Nullable TypedExpr init;

    VarDecl(@Nullable SourcePos pos, TVar var, @Nullable TypedExpr init) {
      super(TypeRef.VOID, pos);
      this.var = var;
      this.init = init;
    }

    @Override
    public Kind kind() {
      return Kind.VAR_DECL;
    }

    @Override
    public <T> T accept(TypedVisitor<T> visitor) {
      return visitor.visitVarDecl(this);
    }

    @Override
    public void forEachChild(Consumer<TypedExpr> consumer) {
      if (init != null) {
        consumer.accept(init);
      }
    }

    @Override
    public String toString() {
      return "var " + var + (init == null ? "" : " = " + init);
    }
  }

  /** Binary operators other than assignment. */
  public enum BinOp {
    ADD("+"),
    SUB("-"),
    MULT("*"),
    DIV("/"),
    MOD("%"),
    EQ("=="),
    NOT_EQ("!="),
    LT("<"),
    LTE("<="),
    GT(">"),
    GTE(">="),
    BOOL_AND("&&"),
    BOOL_OR("||"),
    AND("&"),
    OR("|"),
    XOR("^"),
    SHL("<<"),
    SHR(">>"),
    USHR(">>>"),
    INTERVAL("...");

    public final String symbol;

    BinOp(String symbol) {
      this.symbol = symbol;
    }
  }

  public static final class Binop extends TypedExpr {
    public final BinOp op;
    public final TypedExpr lhs;
    public final TypedExpr rhs;

    Binop(TypeRef type, @Nullable SourcePos pos, BinOp op, TypedExpr lhs, TypedExpr rhs) {
      super(type, pos);
      this.op = op;
      this.lhs = lhs;
      this.rhs = rhs;
    }

    @Override
    public Kind kind() {
      return Kind.BINOP;
    }

    @Override
    public <T> T accept(TypedVisitor<T> visitor) {
      return visitor.visitBinop(this);
    }

    @Override
    public void forEachChild(Consumer<TypedExpr> consumer) {
      consumer.accept(lhs);
      consumer.accept(rhs);
    }

    @Override
    public String toString() {
      return "(" + lhs + " " + op.symbol + " " + rhs + ")";
    }
  }

  /**
   * An assignment {@code lhs = rhs}, or a compound assignment {@code lhs op= rhs} if {@code op} is
   * non-null. {@code lhs} is a LOCAL, FIELD, or ARRAY_ACCESS.
   */
  public static final class Assign extends TypedExpr {
    public final @Nullable BinOp op;
    public final TypedExpr lhs;
    public final TypedExpr rhs;

    Assign(@Nullable SourcePos pos, @Nullable BinOp op, TypedExpr lhs, TypedExpr rhs) {
      super(lhs.type, pos);
      this.op = op;
      this.lhs = lhs;
      this.rhs = rhs;
    }

    @Override
    public Kind kind() {
      return Kind.ASSIGN;
    }

    @Override
    public <T> T accept(TypedVisitor<T> visitor) {
      return visitor.visitAssign(this);
    }

    @Override
    public void forEachChild(Consumer<TypedExpr> consumer) {
      consumer.accept(lhs);
      consumer.accept(rhs);
    }

    @Override
    public String toString() {
      return lhs + " " + (op == null ? "" : op.symbol) + "= " + rhs;
    }
  }

  /** Unary operators. */
  public enum UnOp {
    NOT,
    NEG,
    BIT_NOT,
    INCREMENT,
    DECREMENT
  }

  public static final class Unop extends TypedExpr {
    public final UnOp op;
    public final boolean postfix;
    public final TypedExpr operand;

    Unop(TypeRef type, @Nullable SourcePos pos, UnOp op, boolean postfix, TypedExpr operand) {
      super(type, pos);
      this.op = op;
      this.postfix = postfix;
      this.operand = operand;
    }

    /** Returns true if this is {@code ++v} or {@code v++}. */
    public boolean isIncrementOf(TVar v) {
      return op == UnOp.INCREMENT && operand.isLocal(v);
    }

    @Override
    public Kind kind() {
      return Kind.UNOP;
    }

    @Override
    public <T> T accept(TypedVisitor<T> visitor) {
      return visitor.visitUnop(this);
    }

    @Override
    public void forEachChild(Consumer<TypedExpr> consumer) {
      consumer.accept(operand);
    }

    @Override
    public String toString() {
      return postfix ? operand + op.name() : op.name() + operand;
    }
  }

  public static final class Call extends TypedExpr {
    public final TypedExpr target;
    public final ImmutableList<TypedExpr> args;

    Call(TypeRef type, @Nullable SourcePos pos, TypedExpr target, ImmutableList<TypedExpr> args) {
      super(type, pos);
      this.target = target;
      this.args = args;
    }

    /**
     * If this is a method call {@code obj.name(...)} (through an INSTANCE field), returns the
     * receiver; otherwise returns null.
     */
    public @Nullable TypedExpr receiverOf(String name) {
      if (target instanceof Field field
          && field.fieldKind == FieldKind.INSTANCE
          && field.name.equals(name)) {
        return field.obj;
      }
      return null;
    }

    @Override
    public Kind kind() {
      return Kind.CALL;
    }

    @Override
    public <T> T accept(TypedVisitor<T> visitor) {
      return visitor.visitCall(this);
    }

    @Override
    public void forEachChild(Consumer<TypedExpr> consumer) {
      consumer.accept(target);
      args.forEach(consumer);
    }

    @Override
    public String toString() {
      return target + args.toString().replace('[', '(').replace(']', ')');
    }
  }

  /** How a field is accessed. */
  public enum FieldKind {
    /** A field or method of an instance. */
    INSTANCE,
    /** A static field or method; {@code obj} is a TYPE_EXPR. */
    STATIC,
    /** A field of an anonymous structure. */
    ANON,
    /** A constructor of a tagged union; {@code obj} is a TYPE_EXPR. */
    ENUM
  }

  public static final class Field extends TypedExpr {
    public final TypedExpr obj;
    public final String name;
    public final FieldKind fieldKind;

    /** Non-null iff {@code fieldKind} is ENUM. */
    public final EnumDecl.@Nullable Ctor ctor;

    Field(
        TypeRef type,
        @Nullable SourcePos pos,
        TypedExpr obj,
        String name,
        FieldKind fieldKind,
        EnumDecl.@Nullable Ctor ctor) {
      super(type, pos);
      Preconditions.checkArgument((fieldKind == FieldKind.ENUM) == (ctor != null));
      this.obj = obj;
      this.name = name;
      this.fieldKind = fieldKind;
      this.ctor = ctor;
    }

    /** Returns true if this is {@code obj.name} for a non-static field. */
    public boolean isInstanceField(String fieldName) {
      return fieldKind != FieldKind.STATIC && fieldKind != FieldKind.ENUM && name.equals(fieldName);
    }

    @Override
    public Kind kind() {
      return Kind.FIELD;
    }

    @Override
    public <T> T accept(TypedVisitor<T> visitor) {
      return visitor.visitField(this);
    }

    @Override
    public void forEachChild(Consumer<TypedExpr> consumer) {
      consumer.accept(obj);
    }

    @Override
    public String toString() {
      return obj + "." + name;
    }
  }

  public static final class ArrayAccess extends TypedExpr {
    public final TypedExpr array;
    public final TypedExpr index;

    ArrayAccess(TypeRef type, @Nullable SourcePos pos, TypedExpr array, TypedExpr index) {
      super(type, pos);
      this.array = array;
      this.index = index;
    }

    @Override
    public Kind kind() {
      return Kind.ARRAY_ACCESS;
    }

    @Override
    public <T> T accept(TypedVisitor<T> visitor) {
      return visitor.visitArrayAccess(this);
    }

    @Override
    public void forEachChild(Consumer<TypedExpr> consumer) {
      consumer.accept(array);
      consumer.accept(index);
    }

    @Override
    public String toString() {
      return array + "[" + index + "]";
    }
  }

  public static final class ArrayDecl extends TypedExpr {
    public final ImmutableList<TypedExpr> elements;

    ArrayDecl(TypeRef type, @Nullable SourcePos pos, ImmutableList<TypedExpr> elements) {
      super(type, pos);
      this.elements = elements;
    }

    @Override
    public Kind kind() {
      return Kind.ARRAY_DECL;
    }

    @Override
    public <T> T accept(TypedVisitor<T> visitor) {
      return visitor.visitArrayDecl(this);
    }

    @Override
    public void forEachChild(Consumer<TypedExpr> consumer) {
      elements.forEach(consumer);
    }

    @Override
    public String toString() {
      return elements.toString();
    }
  }

  /** An anonymous structure literal; the map preserves declaration order. */
  public static final class ObjectDecl extends TypedExpr {
    public final ImmutableMap<String, TypedExpr> fields;

    ObjectDecl(TypeRef type, @Nullable SourcePos pos, ImmutableMap<String, TypedExpr> fields) {
      super(type, pos);
      this.fields = fields;
    }

    @Override
    public Kind kind() {
      return Kind.OBJECT_DECL;
    }

    @Override
    public <T> T accept(TypedVisitor<T> visitor) {
      return visitor.visitObjectDecl(this);
    }

    @Override
    public void forEachChild(Consumer<TypedExpr> consumer) {
      fields.values().forEach(consumer);
    }

    @Override
    public String toString() {
      return fields.toString();
    }
  }

  public static final class Block extends TypedExpr {
    public final ImmutableList<TypedExpr> exprs;

    Block(TypeRef type, @Nullable SourcePos pos, ImmutableList<TypedExpr> exprs) {
      super(type, pos);
      this.exprs = exprs;
    }

    @Override
    public Kind kind() {
      return Kind.BLOCK;
    }

    @Override
    public <T> T accept(TypedVisitor<T> visitor) {
      return visitor.visitBlock(this);
    }

    @Override
    public void forEachChild(Consumer<TypedExpr> consumer) {
      exprs.forEach(consumer);
    }

    @Override
    public String toString() {
      return "{" + exprs + "}";
    }
  }

  public static final class If extends TypedExpr {
    public final TypedExpr cond;
    public final TypedExpr thenExpr;
    public final @Nullable TypedExpr elseExpr;

    If(
        TypeRef type,
        @Nullable SourcePos pos,
        TypedExpr cond,
        TypedExpr thenExpr,
        @Nullable TypedExpr elseExpr) {
      super(type, pos);
      this.cond = cond;
      this.thenExpr = thenExpr;
      this.elseExpr = elseExpr;
    }

    @Override
    public Kind kind() {
      return Kind.IF;
    }

    @Override
    public <T> T accept(TypedVisitor<T> visitor) {
      return visitor.visitIf(this);
    }

    @Override
    public void forEachChild(Consumer<TypedExpr> consumer) {
      consumer.accept(cond);
      consumer.accept(thenExpr);
      if (elseExpr != null) {
        consumer.accept(elseExpr);
      }
    }

    @Override
    public String toString() {
      return "if " + cond + " " + thenExpr + (elseExpr == null ? "" : " else " + elseExpr);
    }
  }

  /** A {@code while} loop, or a {@code do ... while} loop if {@code normalWhile} is false. */
  public static final class While extends TypedExpr {
    public final TypedExpr cond;
    public final TypedExpr body;
    public final boolean normalWhile;

    While(@Nullable SourcePos pos, TypedExpr cond, TypedExpr body, boolean normalWhile) {
      super(TypeRef.VOID, pos);
      this.cond = cond;
      this.body = body;
      this.normalWhile = normalWhile;
    }

    @Override
    public Kind kind() {
      return Kind.WHILE;
    }

    @Override
    public <T> T accept(TypedVisitor<T> visitor) {
      return visitor.visitWhile(this);
    }

    @Override
    public void forEachChild(Consumer<TypedExpr> consumer) {
      consumer.accept(cond);
      consumer.accept(body);
    }

    @Override
    public String toString() {
      return "while " + cond + " " + body;
    }
  }

  /** A {@code for (var in iterable)} loop that the front end did not expand. */
  public static final class ForIn extends TypedExpr {
    public final TVar var;
    public final TypedExpr iterable;
    public final TypedExpr body;

    ForIn(@Nullable SourcePos pos, TVar var, TypedExpr iterable, TypedExpr body) {
      super(TypeRef.VOID, pos);
      this.var = var;
      this.iterable = iterable;
      this.body = body;
    }

    @Override
    public Kind kind() {
      return Kind.FOR_IN;
    }

    @Override
    public <T> T accept(TypedVisitor<T> visitor) {
      return visitor.visitForIn(this);
    }

    @Override
    public void forEachChild(Consumer<TypedExpr> consumer) {
      consumer.accept(iterable);
      consumer.accept(body);
    }

    @Override
    public String toString() {
      return "for " + var + " in " + iterable + " " + body;
    }
  }

  /**
   * One case of a SWITCH. A case matches if the subject equals any of {@code values} and the
   * optional guard holds.
   *
   * <p>For a switch over a tagged union the values are the INT constructor indices. If the front
   * end retained the variables the user wrote in the pattern, {@code patternVars} has one entry
   * per constructor parameter (null for positions the user ignored); otherwise it is empty and the
   * body extracts the parameters with ENUM_PARAMETER.
   */
  public static final class Case {
    public final ImmutableList<TypedExpr> values;
    public final @Nullable TypedExpr guard;
    public final TypedExpr body;
    public final List<@Nullable TVar> patternVars;

    public Case(
        ImmutableList<TypedExpr> values,
        @Nullable TypedExpr guard,
        TypedExpr body,
        List<@Nullable TVar> patternVars) {
      Preconditions.checkArgument(!values.isEmpty(), "case with no values");
      this.values = values;
      this.guard = guard;
      this.body = body;
      this.patternVars = Collections.unmodifiableList(patternVars);
    }

    /** Returns the retained pattern variable for the given position, or null. */
    public @Nullable TVar patternVar(int index) {
      return index < patternVars.size() ? patternVars.get(index) : null;
    }
  }

  public static final class Switch extends TypedExpr {
    public final TypedExpr subject;
    public final ImmutableList<Case> cases;
    public final @Nullable TypedExpr defaultExpr;

    Switch(
        TypeRef type,
        @Nullable SourcePos pos,
        TypedExpr subject,
        ImmutableList<Case> cases,
        @Nullable TypedExpr defaultExpr) {
      super(type, pos);
      this.subject = subject;
      this.cases = cases;
      this.defaultExpr = defaultExpr;
    }

    @Override
    public Kind kind() {
      return Kind.SWITCH;
    }

    @Override
    public <T> T accept(TypedVisitor<T> visitor) {
      return visitor.visitSwitch(this);
    }

    @Override
    public void forEachChild(Consumer<TypedExpr> consumer) {
      consumer.accept(subject);
      for (Case c : cases) {
        c.values.forEach(consumer);
        if (c.guard != null) {
          consumer.accept(c.guard);
        }
        consumer.accept(c.body);
      }
      if (defaultExpr != null) {
        consumer.accept(defaultExpr);
      }
    }

    @Override
    public String toString() {
      return "switch " + subject;
    }
  }

  /** The constructor index of a tagged-union value. */
  public static final class EnumIndex extends TypedExpr {
    public final TypedExpr expr;

    EnumIndex(@Nullable SourcePos pos, TypedExpr expr) {
      super(TypeRef.INT, pos);
      Preconditions.checkArgument(expr.type.is(TypeRef.Kind.ENUM), "not a tagged union: %s", expr);
      this.expr = expr;
    }

    @Override
    public Kind kind() {
      return Kind.ENUM_INDEX;
    }

    @Override
    public <T> T accept(TypedVisitor<T> visitor) {
      return visitor.visitEnumIndex(this);
    }

    @Override
    public void forEachChild(Consumer<TypedExpr> consumer) {
      consumer.accept(expr);
    }

    @Override
    public String toString() {
      return "enumIndex(" + expr + ")";
    }
  }

  /** Extracts parameter {@code index} of a tagged-union value known to have been built by ctor. */
  public static final class EnumParameter extends TypedExpr {
    public final TypedExpr expr;
    public final EnumDecl.Ctor ctor;
    public final int index;

    EnumParameter(
        TypeRef type, @Nullable SourcePos pos, TypedExpr expr, EnumDecl.Ctor ctor, int index) {
      super(type, pos);
      Preconditions.checkElementIndex(index, ctor.arity(), "parameter index");
      this.expr = expr;
      this.ctor = ctor;
      this.index = index;
    }

    @Override
    public Kind kind() {
      return Kind.ENUM_PARAMETER;
    }

    @Override
    public <T> T accept(TypedVisitor<T> visitor) {
      return visitor.visitEnumParameter(this);
    }

    @Override
    public void forEachChild(Consumer<TypedExpr> consumer) {
      consumer.accept(expr);
    }

    @Override
    public String toString() {
      return "enumParameter(" + expr + ", " + ctor.name + ", " + index + ")";
    }
  }

  /** An anonymous function (or the body of a named function handed over by the front end). */
  public static final class Function extends TypedExpr {
    public final ImmutableList<TVar> args;
    public final TypedExpr body;

    Function(@Nullable SourcePos pos, ImmutableList<TVar> args, TypedExpr body) {
      super(TypeRef.FUNCTION, pos);
      this.args = args;
      this.body = body;
    }

    @Override
    public Kind kind() {
      return Kind.FUNCTION;
    }

    @Override
    public <T> T accept(TypedVisitor<T> visitor) {
      return visitor.visitFunction(this);
    }

    @Override
    public void forEachChild(Consumer<TypedExpr> consumer) {
      consumer.accept(body);
    }

    @Override
    public String toString() {
      return "function" + args + " " + body;
    }
  }

  public static final class Return extends TypedExpr {
    public final @Nullable TypedExpr value;

    Return(@Nullable SourcePos pos, @Nullable TypedExpr value) {
      super(TypeRef.VOID, pos);
      this.value = value;
    }

    @Override
    public Kind kind() {
      return Kind.RETURN;
    }

    @Override
    public <T> T accept(TypedVisitor<T> visitor) {
      return visitor.visitReturn(this);
    }

    @Override
    public void forEachChild(Consumer<TypedExpr> consumer) {
      if (value != null) {
        consumer.accept(value);
      }
    }

    @Override
    public String toString() {
      return "return " + value;
    }
  }

  /** {@code break} if {@code isBreak} is true, otherwise {@code continue}. */
  public static final class LoopExit extends TypedExpr {
    public final boolean isBreak;

    LoopExit(@Nullable SourcePos pos, boolean isBreak) {
      super(TypeRef.VOID, pos);
      this.isBreak = isBreak;
    }

    @Override
    public Kind kind() {
      return isBreak ? Kind.BREAK : Kind.CONTINUE;
    }

    @Override
    public <T> T accept(TypedVisitor<T> visitor) {
      return visitor.visitLoopExit(this);
    }

    @Override
    public void forEachChild(Consumer<TypedExpr> consumer) {}

    @Override
    public String toString() {
      return isBreak ? "break" : "continue";
    }
  }

  public static final class Throw extends TypedExpr {
    public final TypedExpr value;

    Throw(@Nullable SourcePos pos, TypedExpr value) {
      super(TypeRef.VOID, pos);
      this.value = value;
    }

    @Override
    public Kind kind() {
      return Kind.THROW;
    }

    @Override
    public <T> T accept(TypedVisitor<T> visitor) {
      return visitor.visitThrow(this);
    }

    @Override
    public void forEachChild(Consumer<TypedExpr> consumer) {
      consumer.accept(value);
    }

    @Override
    public String toString() {
      return "throw " + value;
    }
  }

  /** One {@code catch (var:Type) body} of a TRY. */
  public static final class Catch {
    public final TVar var;
    public final TypedExpr body;

    public Catch(TVar var, TypedExpr body) {
      this.var = var;
      this.body = body;
    }
  }

  public static final class Try extends TypedExpr {
    public final TypedExpr body;
    public final ImmutableList<Catch> catches;

    Try(TypeRef type, @Nullable SourcePos pos, TypedExpr body, ImmutableList<Catch> catches) {
      super(type, pos);
      this.body = body;
      this.catches = catches;
    }

    @Override
    public Kind kind() {
      return Kind.TRY;
    }

    @Override
    public <T> T accept(TypedVisitor<T> visitor) {
      return visitor.visitTry(this);
    }

    @Override
    public void forEachChild(Consumer<TypedExpr> consumer) {
      consumer.accept(body);
      catches.forEach(c -> consumer.accept(c.body));
    }

    @Override
    public String toString() {
      return "try " + body;
    }
  }

  public static final class Paren extends TypedExpr {
    public final TypedExpr expr;

    Paren(@Nullable SourcePos pos, TypedExpr expr) {
      super(expr.type, pos);
      this.expr = expr;
    }

    @Override
    public Kind kind() {
      return Kind.PAREN;
    }

    @Override
    public <T> T accept(TypedVisitor<T> visitor) {
      return visitor.visitParen(this);
    }

    @Override
    public void forEachChild(Consumer<TypedExpr> consumer) {
      consumer.accept(expr);
    }

    @Override
    public String toString() {
      return "(" + expr + ")";
    }
  }

  public static final class Cast extends TypedExpr {
    public final TypedExpr expr;

    Cast(TypeRef type, @Nullable SourcePos pos, TypedExpr expr) {
      super(type, pos);
      this.expr = expr;
    }

    @Override
    public Kind kind() {
      return Kind.CAST;
    }

    @Override
    public <T> T accept(TypedVisitor<T> visitor) {
      return visitor.visitCast(this);
    }

    @Override
    public void forEachChild(Consumer<TypedExpr> consumer) {
      consumer.accept(expr);
    }

    @Override
    public String toString() {
      return "cast(" + expr + ")";
    }
  }

  public static final class New extends TypedExpr {
    public final String className;
    public final ImmutableList<TypedExpr> args;

    New(@Nullable SourcePos pos, String className, ImmutableList<TypedExpr> args) {
      super(TypeRef.classType(className), pos);
      this.className = className;
      this.args = args;
    }

    @Override
    public Kind kind() {
      return Kind.NEW;
    }

    @Override
    public <T> T accept(TypedVisitor<T> visitor) {
      return visitor.visitNew(this);
    }

    @Override
    public void forEachChild(Consumer<TypedExpr> consumer) {
      args.forEach(consumer);
    }

    @Override
    public String toString() {
      return "new " + className + args;
    }
  }

  /** A reference to a module, class, or tagged union by its dotted path. */
  public static final class TypeExpr extends TypedExpr {
    public final String path;

    TypeExpr(@Nullable SourcePos pos, String path) {
      super(TypeRef.DYNAMIC, pos);
      this.path = path;
    }

    @Override
    public Kind kind() {
      return Kind.TYPE_EXPR;
    }

    @Override
    public <T> T accept(TypedVisitor<T> visitor) {
      return visitor.visitTypeExpr(this);
    }

    @Override
    public void forEachChild(Consumer<TypedExpr> consumer) {}

    @Override
    public String toString() {
      return path;
    }
  }

  /**
   * Target-language code embedded in the source. Each {@code {N}} in {@code code} is replaced by
   * the lowering of {@code args.get(N)}.
   */
  public static final class Raw extends TypedExpr {
    public final String code;
    public final ImmutableList<TypedExpr> args;

    Raw(TypeRef type, @Nullable SourcePos pos, String code, ImmutableList<TypedExpr> args) {
      super(type, pos);
      this.code = code;
      this.args = args;
    }

    @Override
    public Kind kind() {
      return Kind.RAW;
    }

    @Override
    public <T> T accept(TypedVisitor<T> visitor) {
      return visitor.visitRaw(this);
    }

    @Override
    public void forEachChild(Consumer<TypedExpr> consumer) {
      args.forEach(consumer);
    }

    @Override
    public String toString() {
      return "raw(" + code + ")";
    }
  }
}
