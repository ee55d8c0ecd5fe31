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
import com.google.common.collect.ImmutableMap;
import java.util.Arrays;
import java.util.List;
import java.util.function.Consumer;
import org.jspecify.annotations.Nullable;

/**
 * The left-hand side of a match: a case clause, a function parameter, a comprehension generator,
 * or the target of {@code =}. Patterns are a separate union from {@link ElixirAst} and are never
 * used as expressions.
 */
public abstract class Pattern {

  /** The distinct pattern kinds. */
  public enum Kind {
    VAR,
    WILDCARD,
    LITERAL,
    TUPLE,
    LIST,
    MAP,
    STRUCT,
    PIN,
    ALIAS
  }

  // Subclasses are all defined in this file.
  private Pattern() {}

  public abstract Kind kind();

  /** Calls {@code consumer} with each nested pattern. */
  public abstract void forEachChild(Consumer<Pattern> consumer);

  /** Calls {@code consumer} with the name of each variable this pattern binds, left to right. */
  public final void forEachBoundName(Consumer<String> consumer) {
    if (this instanceof Var v) {
      consumer.accept(v.name);
    } else if (this instanceof Alias a) {
      a.pattern.forEachBoundName(consumer);
      consumer.accept(a.name);
    } else {
      forEachChild(p -> p.forEachBoundName(consumer));
    }
  }

  @Override
  public String toString() {
    return AstPrinter.print(this);
  }

  public static Var var(String name) {
    return new Var(name);
  }

  /** A variable if {@code name} is non-null, otherwise a wildcard. */
  public static Pattern varOrWildcard(@Nullable String name) {
    return (name == null) ? new Wildcard() : new Var(name);
  }

  public static Wildcard wildcard() {
    return new Wildcard();
  }

  public static Literal literal(ElixirAst.Literal value) {
    return new Literal(value);
  }

  public static Tuple tuple(Pattern... elements) {
    return new Tuple(ImmutableList.copyOf(elements));
  }

  public static Tuple tuple(List<Pattern> elements) {
    return new Tuple(ImmutableList.copyOf(elements));
  }

  public static ListPattern list(List<Pattern> elements, @Nullable Pattern tail) {
    return new ListPattern(ImmutableList.copyOf(elements), tail);
  }

  public static ListPattern list(Pattern... elements) {
    return list(Arrays.asList(elements), null);
  }

  public static MapPattern map(ImmutableMap<ElixirAst.Literal, Pattern> entries) {
    return new MapPattern(entries);
  }

  public static StructPattern struct(String module, ImmutableMap<String, Pattern> fields) {
    return new StructPattern(module, fields);
  }

  public static Pin pin(String name) {
    return new Pin(name);
  }

  public static Alias alias(Pattern pattern, String name) {
    return new Alias(pattern, name);
  }

  /** Binds the matched value to {@code name}. Names starting with "_" mark intentionally unused. */
  public static final class Var extends Pattern {
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
    public void forEachChild(Consumer<Pattern> consumer) {}
  }

  /** {@code _} */
  public static final class Wildcard extends Pattern {
    @Override
    public Kind kind() {
      return Kind.WILDCARD;
    }

    @Override
    public void forEachChild(Consumer<Pattern> consumer) {}
  }

  public static final class Literal extends Pattern {
    public final ElixirAst.Literal value;

    Literal(ElixirAst.Literal value) {
      this.value = value;
    }

    @Override
    public Kind kind() {
      return Kind.LITERAL;
    }

    @Override
    public void forEachChild(Consumer<Pattern> consumer) {}
  }

  public static final class Tuple extends Pattern {
    public final ImmutableList<Pattern> elements;

    Tuple(ImmutableList<Pattern> elements) {
      this.elements = elements;
    }

    @Override
    public Kind kind() {
      return Kind.TUPLE;
    }

    @Override
    public void forEachChild(Consumer<Pattern> consumer) {
      elements.forEach(consumer);
    }
  }

  /** {@code [a, b]}, or {@code [a, b | tail]} if {@code tail} is non-null. */
  public static final class ListPattern extends Pattern {
    public final ImmutableList<Pattern> elements;
    public final @Nullable Pattern tail;

    ListPattern(ImmutableList<Pattern> elements, @Nullable Pattern tail) {
      Preconditions.checkArgument(tail == null || !elements.isEmpty(), "cons with no head");
      this.elements = elements;
      this.tail = tail;
    }

    @Override
    public Kind kind() {
      return Kind.LIST;
    }

    @Override
    public void forEachChild(Consumer<Pattern> consumer) {
      elements.forEach(consumer);
      if (tail != null) {
        consumer.accept(tail);
      }
    }
  }

  public static final class MapPattern extends Pattern {
    public final ImmutableMap<ElixirAst.Literal, Pattern> entries;

    MapPattern(ImmutableMap<ElixirAst.Literal, Pattern> entries) {
      this.entries = entries;
    }

    @Override
    public Kind kind() {
      return Kind.MAP;
    }

    @Override
    public void forEachChild(Consumer<Pattern> consumer) {
      entries.values().forEach(consumer);
    }
  }

  /** {@code %Module{field: pattern}} */
  public static final class StructPattern extends Pattern {
    public final String module;
    public final ImmutableMap<String, Pattern> fields;

    StructPattern(String module, ImmutableMap<String, Pattern> fields) {
      this.module = module;
      this.fields = fields;
    }

    @Override
    public Kind kind() {
      return Kind.STRUCT;
    }

    @Override
    public void forEachChild(Consumer<Pattern> consumer) {
      fields.values().forEach(consumer);
    }
  }

  /** {@code ^name}: matches the current value of an existing variable. */
  public static final class Pin extends Pattern {
    public final String name;

    Pin(String name) {
      this.name = name;
    }

    @Override
    public Kind kind() {
      return Kind.PIN;
    }

    @Override
    public void forEachChild(Consumer<Pattern> consumer) {}
  }

  /** {@code pattern = name}: matches {@code pattern} and also binds the whole value. */
  public static final class Alias extends Pattern {
    public final Pattern pattern;
    public final String name;

    Alias(Pattern pattern, String name) {
      this.pattern = pattern;
      this.name = name;
    }

    @Override
    public Kind kind() {
      return Kind.ALIAS;
    }

    @Override
    public void forEachChild(Consumer<Pattern> consumer) {
      consumer.accept(pattern);
    }
  }
}
