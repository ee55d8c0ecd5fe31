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

package org.exlower.ast;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import org.jspecify.annotations.Nullable;

/**
 * A node of the Elixir AST produced by the lowering. The concrete subclasses, all defined here,
 * form a closed union distinguished by {@link #kind}.
 *
 * <p>Each node has exactly one parent: a node instance must never appear at two positions in a
 * tree (see {@link AstOwnership}), so that later passes can rewrite subtrees in place. Apart from
 * their {@link Metadata}, nodes are immutable.
 */
public abstract class ElixirAst {

  /** The distinct node kinds. */
  public enum Kind {
    LITERAL,
    VAR,
    ALIAS,
    CALL,
    FN,
    MATCH,
    BINARY,
    UNARY,
    FIELD_ACCESS,
    INDEX_ACCESS,
    IF,
    CASE,
    TRY,
    BLOCK,
    LIST,
    TUPLE,
    MAP,
    MAP_UPDATE,
    STRUCT,
    KEYWORD_LIST,
    RANGE,
    FOR,
    MODULE,
    DEF,
    RAW,
    DIAGNOSTIC
  }

  private Metadata metadata = Metadata.EMPTY;

  // Subclasses are all defined in this file.
  private ElixirAst() {}

  public abstract Kind kind();

  /** Calls {@code consumer} with each direct child node (not including patterns). */
  public abstract void forEachChild(Consumer<ElixirAst> consumer);

  public final Metadata metadata() {
    return metadata;
  }

  @CanIgnoreReturnValue
  public final ElixirAst setMetadata(Metadata metadata) {
    this.metadata = Preconditions.checkNotNull(metadata);
    return this;
  }

  /** Adds a flag to this node's metadata. */
  @CanIgnoreReturnValue
  public final ElixirAst flag(String flag) {
    metadata = metadata.withFlag(flag);
    return this;
  }

  @Override
  public String toString() {
    return AstPrinter.print(this);
  }

  // Factory methods

  public static Literal nil() {
    return new Literal(Literal.Kind.NIL, null);
  }

  public static Literal bool(boolean b) {
    return new Literal(Literal.Kind.BOOL, b);
  }

  public static Literal intLit(long i) {
    return new Literal(Literal.Kind.INT, i);
  }

  public static Literal floatLit(double d) {
    return new Literal(Literal.Kind.FLOAT, d);
  }

  public static Literal string(String s) {
    return new Literal(Literal.Kind.STRING, s);
  }

  public static Literal atom(String name) {
    return new Literal(Literal.Kind.ATOM, name);
  }

  public static Var var(String name) {
    return new Var(name);
  }

  public static Alias alias(String name) {
    return new Alias(name);
  }

  /** A call of a local or imported function, e.g. {@code length(x)}. */
  public static Call call(String name, ElixirAst... args) {
    return new Call(null, name, ImmutableList.copyOf(args));
  }

  /** A call of a function in another module, e.g. {@code Enum.map(xs, f)}. */
  public static Call remote(String module, String name, ElixirAst... args) {
    return new Call(new Alias(module), name, ImmutableList.copyOf(args));
  }

  public static Call remote(String module, String name, List<ElixirAst> args) {
    return new Call(new Alias(module), name, ImmutableList.copyOf(args));
  }

  /** A call of an anonymous function value, e.g. {@code f.(x)}. */
  public static Call apply(ElixirAst fn, List<ElixirAst> args) {
    return new Call(fn, null, ImmutableList.copyOf(args));
  }

  public static Fn fn(List<Pattern> params, ElixirAst body) {
    return new Fn(ImmutableList.of(new Clause(ImmutableList.copyOf(params), null, body)));
  }

  public static Match match(Pattern pattern, ElixirAst value) {
    return new Match(pattern, value);
  }

  public static Binary binary(String op, ElixirAst lhs, ElixirAst rhs) {
    return new Binary(op, lhs, rhs);
  }

  public static Unary unary(String op, ElixirAst operand) {
    return new Unary(op, operand);
  }

  public static Block block(List<ElixirAst> exprs) {
    return new Block(ImmutableList.copyOf(exprs));
  }

  public static ListLit list(List<ElixirAst> elements) {
    return new ListLit(ImmutableList.copyOf(elements));
  }

  public static ListLit list(ElixirAst... elements) {
    return list(Arrays.asList(elements));
  }

  public static Tuple tuple(List<ElixirAst> elements) {
    return new Tuple(ImmutableList.copyOf(elements));
  }

  public static Tuple tuple(ElixirAst... elements) {
    return tuple(Arrays.asList(elements));
  }

  public static Raw raw(String code) {
    return new Raw(code);
  }

  public static Diagnostic diagnostic(String message) {
    return new Diagnostic(message);
  }

  /** One clause of a case, fn, rescue, or catch: {@code patterns when guard -> body}. */
  public record Clause(ImmutableList<Pattern> patterns, @Nullable ElixirAst guard, ElixirAst body) {
    public static Clause of(Pattern pattern, @Nullable ElixirAst guard, ElixirAst body) {
      return new Clause(ImmutableList.of(pattern), guard, body);
    }

    void forEachNode(Consumer<ElixirAst> consumer) {
      if (guard != null) {
        consumer.accept(guard);
      }
      consumer.accept(body);
    }
  }

  /** A key/value pair of a map, struct, or keyword list. */
  public record Entry(ElixirAst key, ElixirAst value) {}

  /** One {@code pattern <- source} of a comprehension. */
  public record Generator(Pattern pattern, ElixirAst source) {}

  public static final class Literal extends ElixirAst {
    /** The kinds of literal. */
    public enum Kind {
      NIL,
      BOOL,
      INT,
      FLOAT,
      STRING,
      ATOM
    }

    public final Kind literalKind;
    public final @Nullable Object value;

    Literal(Kind literalKind, @Nullable Object value) {
      this.literalKind = literalKind;
      this.value = value;
    }

    /** Returns true if this is the integer {@code i}. */
    public boolean isInt(long i) {
      return literalKind == Kind.INT && ((Long) value) == i;
    }

    @Override
    public ElixirAst.Kind kind() {
      return ElixirAst.Kind.LITERAL;
    }

    @Override
    public void forEachChild(Consumer<ElixirAst> consumer) {}

    // Literals are used as map pattern keys, so they need value equality.
    @Override
    public boolean equals(Object obj) {
      return obj instanceof Literal other
          && literalKind == other.literalKind
          && Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
      return Objects.hash(literalKind, value);
    }
  }

  public static final class Var extends ElixirAst {
    public final String name;

    Var(String name) {
      Preconditions.checkArgument(!name.isEmpty());
      this.name = name;
    }

    @Override
    public Kind kind() {
      return Kind.VAR;
    }

    @Override
    public void forEachChild(Consumer<ElixirAst> consumer) {}
  }

  /** A module name, e.g. {@code Enum} or {@code MyApp.User}. */
  public static final class Alias extends ElixirAst {
    public final String name;

    Alias(String name) {
      this.name = name;
    }

    @Override
    public Kind kind() {
      return Kind.ALIAS;
    }

    @Override
    public void forEachChild(Consumer<ElixirAst> consumer) {}
  }

  /**
   * A function call. {@code target} is null for a local call, a module for a remote call, or any
   * expression if {@code name} is null (a call of an anonymous function, {@code f.(x)}).
   */
  public static final class Call extends ElixirAst {
    public final @Nullable ElixirAst target;
    public final @Nullable String name;
    public final ImmutableList<ElixirAst> args;

    Call(@Nullable ElixirAst target, @Nullable String name, ImmutableList<ElixirAst> args) {
      Preconditions.checkArgument(name != null || target != null);
      this.target = target;
      this.name = name;
      this.args = args;
    }

    /** Returns true if this is a call of {@code module.name}. */
    public boolean isRemote(String module, String fnName) {
      return target instanceof Alias alias && alias.name.equals(module) && fnName.equals(name);
    }

    @Override
    public Kind kind() {
      return Kind.CALL;
    }

    @Override
    public void forEachChild(Consumer<ElixirAst> consumer) {
      if (target != null) {
        consumer.accept(target);
      }
      args.forEach(consumer);
    }
  }

  /** An anonymous function with one or more clauses. */
  public static final class Fn extends ElixirAst {
    public final ImmutableList<Clause> clauses;

    Fn(ImmutableList<Clause> clauses) {
      Preconditions.checkArgument(!clauses.isEmpty());
      this.clauses = clauses;
    }

    @Override
    public Kind kind() {
      return Kind.FN;
    }

    @Override
    public void forEachChild(Consumer<ElixirAst> consumer) {
      clauses.forEach(c -> c.forEachNode(consumer));
    }
  }

  /** {@code pattern = value} */
  public static final class Match extends ElixirAst {
    public final Pattern pattern;
    public final ElixirAst value;

    Match(Pattern pattern, ElixirAst value) {
      this.pattern = pattern;
      this.value = value;
    }

    @Override
    public Kind kind() {
      return Kind.MATCH;
    }

    @Override
    public void forEachChild(Consumer<ElixirAst> consumer) {
      consumer.accept(value);
    }
  }

  public static final class Binary extends ElixirAst {
    public final String op;
    public final ElixirAst lhs;
    public final ElixirAst rhs;

    Binary(String op, ElixirAst lhs, ElixirAst rhs) {
      this.op = op;
      this.lhs = lhs;
      this.rhs = rhs;
    }

    @Override
    public Kind kind() {
      return Kind.BINARY;
    }

    @Override
    public void forEachChild(Consumer<ElixirAst> consumer) {
      consumer.accept(lhs);
      consumer.accept(rhs);
    }
  }

  public static final class Unary extends ElixirAst {
    public final String op;
    public final ElixirAst operand;

    Unary(String op, ElixirAst operand) {
      this.op = op;
      this.operand = operand;
    }

    @Override
    public Kind kind() {
      return Kind.UNARY;
    }

    @Override
    public void forEachChild(Consumer<ElixirAst> consumer) {
      consumer.accept(operand);
    }
  }

  /** {@code target.field} */
  public static final class FieldAccess extends ElixirAst {
    public final ElixirAst target;
    public final String field;

    public FieldAccess(ElixirAst target, String field) {
      this.target = target;
      this.field = field;
    }

    @Override
    public Kind kind() {
      return Kind.FIELD_ACCESS;
    }

    @Override
    public void forEachChild(Consumer<ElixirAst> consumer) {
      consumer.accept(target);
    }
  }

  /** {@code target[key]} */
  public static final class IndexAccess extends ElixirAst {
    public final ElixirAst target;
    public final ElixirAst key;

    public IndexAccess(ElixirAst target, ElixirAst key) {
      this.target = target;
      this.key = key;
    }

    @Override
    public Kind kind() {
      return Kind.INDEX_ACCESS;
    }

    @Override
    public void forEachChild(Consumer<ElixirAst> consumer) {
      consumer.accept(target);
      consumer.accept(key);
    }
  }

  /** {@code if} or, if {@code unless} is true, {@code unless}. */
  public static final class If extends ElixirAst {
    public final ElixirAst cond;
    public final ElixirAst thenBranch;
    public final @Nullable ElixirAst elseBranch;
    public final boolean unless;

    public If(
        ElixirAst cond, ElixirAst thenBranch, @Nullable ElixirAst elseBranch, boolean unless) {
      this.cond = cond;
      this.thenBranch = thenBranch;
      this.elseBranch = elseBranch;
      this.unless = unless;
    }

    @Override
    public Kind kind() {
      return Kind.IF;
    }

    @Override
    public void forEachChild(Consumer<ElixirAst> consumer) {
      consumer.accept(cond);
      consumer.accept(thenBranch);
      if (elseBranch != null) {
        consumer.accept(elseBranch);
      }
    }
  }

  public static final class Case extends ElixirAst {
    public final ElixirAst subject;
    public final ImmutableList<Clause> clauses;

    public Case(ElixirAst subject, List<Clause> clauses) {
      this.subject = subject;
      this.clauses = ImmutableList.copyOf(clauses);
    }

    @Override
    public Kind kind() {
      return Kind.CASE;
    }

    @Override
    public void forEachChild(Consumer<ElixirAst> consumer) {
      consumer.accept(subject);
      clauses.forEach(c -> c.forEachNode(consumer));
    }
  }

  public static final class Try extends ElixirAst {
    public final ElixirAst body;
    public final ImmutableList<Clause> rescueClauses;
    public final ImmutableList<Clause> catchClauses;
    public final @Nullable ElixirAst after;

    public Try(
        ElixirAst body,
        List<Clause> rescueClauses,
        List<Clause> catchClauses,
        @Nullable ElixirAst after) {
      this.body = body;
      this.rescueClauses = ImmutableList.copyOf(rescueClauses);
      this.catchClauses = ImmutableList.copyOf(catchClauses);
      this.after = after;
    }

    @Override
    public Kind kind() {
      return Kind.TRY;
    }

    @Override
    public void forEachChild(Consumer<ElixirAst> consumer) {
      consumer.accept(body);
      rescueClauses.forEach(c -> c.forEachNode(consumer));
      catchClauses.forEach(c -> c.forEachNode(consumer));
      if (after != null) {
        consumer.accept(after);
      }
    }
  }

  /** A sequence of expressions; its value is the value of the last one. */
  public static final class Block extends ElixirAst {
    public final ImmutableList<ElixirAst> exprs;

    Block(ImmutableList<ElixirAst> exprs) {
      this.exprs = exprs;
    }

    @Override
    public Kind kind() {
      return Kind.BLOCK;
    }

    @Override
    public void forEachChild(Consumer<ElixirAst> consumer) {
      exprs.forEach(consumer);
    }
  }

  public static final class ListLit extends ElixirAst {
    public final ImmutableList<ElixirAst> elements;

    ListLit(ImmutableList<ElixirAst> elements) {
      this.elements = elements;
    }

    @Override
    public Kind kind() {
      return Kind.LIST;
    }

    @Override
    public void forEachChild(Consumer<ElixirAst> consumer) {
      elements.forEach(consumer);
    }
  }

  public static final class Tuple extends ElixirAst {
    public final ImmutableList<ElixirAst> elements;

    Tuple(ImmutableList<ElixirAst> elements) {
      this.elements = elements;
    }

    @Override
    public Kind kind() {
      return Kind.TUPLE;
    }

    @Override
    public void forEachChild(Consumer<ElixirAst> consumer) {
      elements.forEach(consumer);
    }
  }

  /** {@code %{key => value}}; atom keys are printed in the {@code key: value} form. */
  public static final class MapLit extends ElixirAst {
    public final ImmutableList<Entry> entries;

    public MapLit(List<Entry> entries) {
      this.entries = ImmutableList.copyOf(entries);
    }

    @Override
    public Kind kind() {
      return Kind.MAP;
    }

    @Override
    public void forEachChild(Consumer<ElixirAst> consumer) {
      entries.forEach(
          e -> {
            consumer.accept(e.key());
            consumer.accept(e.value());
          });
    }
  }

  /** {@code %{base | key: value}} */
  public static final class MapUpdate extends ElixirAst {
    public final ElixirAst base;
    public final ImmutableList<Entry> entries;

    public MapUpdate(ElixirAst base, List<Entry> entries) {
      this.base = base;
      this.entries = ImmutableList.copyOf(entries);
    }

    @Override
    public Kind kind() {
      return Kind.MAP_UPDATE;
    }

    @Override
    public void forEachChild(Consumer<ElixirAst> consumer) {
      consumer.accept(base);
      entries.forEach(
          e -> {
            consumer.accept(e.key());
            consumer.accept(e.value());
          });
    }
  }

  /** {@code %Module{field: value}}; keys are atoms. */
  public static final class StructLit extends ElixirAst {
    public final String module;
    public final ImmutableList<Entry> fields;

    public StructLit(String module, List<Entry> fields) {
      this.module = module;
      this.fields = ImmutableList.copyOf(fields);
    }

    @Override
    public Kind kind() {
      return Kind.STRUCT;
    }

    @Override
    public void forEachChild(Consumer<ElixirAst> consumer) {
      fields.forEach(
          e -> {
            consumer.accept(e.key());
            consumer.accept(e.value());
          });
    }
  }

  /** {@code [key: value, ...]}; keys are atoms. */
  public static final class KeywordList extends ElixirAst {
    public final ImmutableList<Entry> entries;

    public KeywordList(List<Entry> entries) {
      this.entries = ImmutableList.copyOf(entries);
    }

    @Override
    public Kind kind() {
      return Kind.KEYWORD_LIST;
    }

    @Override
    public void forEachChild(Consumer<ElixirAst> consumer) {
      entries.forEach(
          e -> {
            consumer.accept(e.key());
            consumer.accept(e.value());
          });
    }
  }

  /** {@code first..last}, or {@code first..last//step} if {@code step} is non-null. */
  public static final class Range extends ElixirAst {
    public final ElixirAst first;
    public final ElixirAst last;
    public final @Nullable ElixirAst step;

    public Range(ElixirAst first, ElixirAst last, @Nullable ElixirAst step) {
      this.first = first;
      this.last = last;
      this.step = step;
    }

    @Override
    public Kind kind() {
      return Kind.RANGE;
    }

    @Override
    public void forEachChild(Consumer<ElixirAst> consumer) {
      consumer.accept(first);
      consumer.accept(last);
      if (step != null) {
        consumer.accept(step);
      }
    }
  }

  /** A comprehension: {@code for gen1, gen2, filter, into: into do body end}. */
  public static final class For extends ElixirAst {
    public final ImmutableList<Generator> generators;
    public final ImmutableList<ElixirAst> filters;
    public final @Nullable ElixirAst into;
    public final ElixirAst body;

    public For(
        List<Generator> generators,
        List<ElixirAst> filters,
        @Nullable ElixirAst into,
        ElixirAst body) {
      Preconditions.checkArgument(!generators.isEmpty());
      this.generators = ImmutableList.copyOf(generators);
      this.filters = ImmutableList.copyOf(filters);
      this.into = into;
      this.body = body;
    }

    @Override
    public Kind kind() {
      return Kind.FOR;
    }

    @Override
    public void forEachChild(Consumer<ElixirAst> consumer) {
      generators.forEach(g -> consumer.accept(g.source()));
      filters.forEach(consumer);
      if (into != null) {
        consumer.accept(into);
      }
      consumer.accept(body);
    }
  }

  /** {@code defmodule name do body end} */
  public static final class ModuleDef extends ElixirAst {
    public final String name;
    public final ImmutableList<ElixirAst> body;

    public ModuleDef(String name, List<ElixirAst> body) {
      this.name = name;
      this.body = ImmutableList.copyOf(body);
    }

    @Override
    public Kind kind() {
      return Kind.MODULE;
    }

    @Override
    public void forEachChild(Consumer<ElixirAst> consumer) {
      body.forEach(consumer);
    }
  }

  /** {@code def name(params) do body end}, or {@code defp} if {@code isPrivate}. */
  public static final class Def extends ElixirAst {
    public final String name;
    public final ImmutableList<Pattern> params;
    public final ElixirAst body;
    public final boolean isPrivate;

    public Def(String name, List<Pattern> params, ElixirAst body, boolean isPrivate) {
      this.name = name;
      this.params = ImmutableList.copyOf(params);
      this.body = body;
      this.isPrivate = isPrivate;
    }

    @Override
    public Kind kind() {
      return Kind.DEF;
    }

    @Override
    public void forEachChild(Consumer<ElixirAst> consumer) {
      consumer.accept(body);
    }
  }

  /** Target code passed through verbatim. */
  public static final class Raw extends ElixirAst {
    public final String code;

    Raw(String code) {
      this.code = code;
    }

    @Override
    public Kind kind() {
      return Kind.RAW;
    }

    @Override
    public void forEachChild(Consumer<ElixirAst> consumer) {}
  }

  /**
   * Stands in for a source construct that could not be lowered. It is printed as a {@code raise}
   * so that the problem is visible in the generated code rather than silently dropped.
   */
  public static final class Diagnostic extends ElixirAst {
    public final String message;

    Diagnostic(String message) {
      this.message = message;
    }

    @Override
    public Kind kind() {
      return Kind.DIAGNOSTIC;
    }

    @Override
    public void forEachChild(Consumer<ElixirAst> consumer) {}
  }
}
