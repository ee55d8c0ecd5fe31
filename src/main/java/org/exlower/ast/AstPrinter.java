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

import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.function.Function;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.exlower.ast.ElixirAst.Clause;
import org.exlower.ast.ElixirAst.Entry;
import org.jspecify.annotations.Nullable;

/**
 * Renders an {@link ElixirAst} or {@link org.exlower.ast.Pattern} as Elixir source text, with
 * two-space indentation. This is a debugging aid (it backs {@code toString()}) and the form in
 * which tests state their expectations; it makes no attempt to match {@code mix format} exactly.
 *
 * <p>Each rendering is returned without leading indentation; a nested multi-line rendering is
 * indented by prefixing each of its lines.
 */
public final class AstPrinter {

  // Static methods only
  private AstPrinter() {}

  private static final Pattern SIMPLE_ATOM = Pattern.compile("[a-z_][a-zA-Z0-9_]*[?!]?");

  /**
   * Binary operator precedences; a child with lower precedence than its parent (or equal, on the
   * right-hand side) is parenthesized.
   */
  private static final ImmutableMap<String, Integer> PRECEDENCE =
      ImmutableMap.<String, Integer>builder()
          .put("or", 1)
          .put("||", 1)
          .put("and", 2)
          .put("&&", 2)
          .put("==", 3)
          .put("!=", 3)
          .put("===", 3)
          .put("!==", 3)
          .put("<", 4)
          .put(">", 4)
          .put("<=", 4)
          .put(">=", 4)
          .put("in", 4)
          .put("++", 5)
          .put("--", 5)
          .put("<>", 5)
          .put("..", 5)
          .put("+", 6)
          .put("-", 6)
          .put("*", 7)
          .put("/", 7)
          .buildOrThrow();

  public static String print(ElixirAst node) {
    if (node instanceof ElixirAst.Literal lit) {
      return literal(lit);
    } else if (node instanceof ElixirAst.Var v) {
      return v.name;
    } else if (node instanceof ElixirAst.Alias alias) {
      return alias.name;
    } else if (node instanceof ElixirAst.Call call) {
      return call(call);
    } else if (node instanceof ElixirAst.Fn fn) {
      return fn(fn);
    } else if (node instanceof ElixirAst.Match match) {
      return print(match.pattern) + " = " + print(match.value);
    } else if (node instanceof ElixirAst.Binary binary) {
      return binary(binary);
    } else if (node instanceof ElixirAst.Unary unary) {
      String operand = operand(unary.operand);
      return unary.op.equals("not") ? "not " + operand : unary.op + operand;
    } else if (node instanceof ElixirAst.FieldAccess access) {
      return operand(access.target) + "." + access.field;
    } else if (node instanceof ElixirAst.IndexAccess access) {
      return operand(access.target) + "[" + print(access.key) + "]";
    } else if (node instanceof ElixirAst.If ifNode) {
      return ifNode(ifNode);
    } else if (node instanceof ElixirAst.Case caseNode) {
      return "case " + print(caseNode.subject) + " do\n" + clauses(caseNode.clauses) + "end";
    } else if (node instanceof ElixirAst.Try tryNode) {
      return tryNode(tryNode);
    } else if (node instanceof ElixirAst.Block block) {
      return block.exprs.isEmpty()
          ? "nil"
          : "(" + block.exprs.stream().map(AstPrinter::print).collect(Collectors.joining("; "))
              + ")";
    } else if (node instanceof ElixirAst.ListLit list) {
      return "[" + join(list.elements, AstPrinter::print) + "]";
    } else if (node instanceof ElixirAst.Tuple tuple) {
      return "{" + join(tuple.elements, AstPrinter::print) + "}";
    } else if (node instanceof ElixirAst.MapLit map) {
      return "%{" + join(map.entries, AstPrinter::entry) + "}";
    } else if (node instanceof ElixirAst.MapUpdate update) {
      return "%{" + print(update.base) + " | " + join(update.entries, AstPrinter::entry) + "}";
    } else if (node instanceof ElixirAst.StructLit struct) {
      return "%" + struct.module + "{" + join(struct.fields, AstPrinter::entry) + "}";
    } else if (node instanceof ElixirAst.KeywordList kw) {
      return "[" + join(kw.entries, AstPrinter::entry) + "]";
    } else if (node instanceof ElixirAst.Range range) {
      String result = operand(range.first) + ".." + operand(range.last);
      return (range.step == null) ? result : result + "//" + operand(range.step);
    } else if (node instanceof ElixirAst.For forNode) {
      return forNode(forNode);
    } else if (node instanceof ElixirAst.ModuleDef module) {
      String body =
          module.body.stream().map(AstPrinter::print).collect(Collectors.joining("\n\n"));
      return "defmodule " + module.name + " do\n" + indent(body) + "\nend";
    } else if (node instanceof ElixirAst.Def def) {
      return (def.isPrivate ? "defp " : "def ")
          + def.name
          + "("
          + join(def.params, AstPrinter::print)
          + ") do\n"
          + indent(body(def.body))
          + "\nend";
    } else if (node instanceof ElixirAst.Raw raw) {
      return raw.code;
    } else if (node instanceof ElixirAst.Diagnostic diagnostic) {
      return "raise(" + quote("exlower: " + diagnostic.message) + ")";
    }
    throw new AssertionError(node.kind());
  }

  public static String print(org.exlower.ast.Pattern pattern) {
    if (pattern instanceof org.exlower.ast.Pattern.Var v) {
      return v.name;
    } else if (pattern instanceof org.exlower.ast.Pattern.Wildcard) {
      return "_";
    } else if (pattern instanceof org.exlower.ast.Pattern.Literal lit) {
      return literal(lit.value);
    } else if (pattern instanceof org.exlower.ast.Pattern.Tuple tuple) {
      return "{" + join(tuple.elements, AstPrinter::print) + "}";
    } else if (pattern instanceof org.exlower.ast.Pattern.ListPattern list) {
      String elements = join(list.elements, AstPrinter::print);
      return "[" + elements + (list.tail == null ? "" : " | " + print(list.tail)) + "]";
    } else if (pattern instanceof org.exlower.ast.Pattern.MapPattern map) {
      return "%{"
          + map.entries.entrySet().stream()
              .map(e -> key(e.getKey()) + print(e.getValue()))
              .collect(Collectors.joining(", "))
          + "}";
    } else if (pattern instanceof org.exlower.ast.Pattern.StructPattern struct) {
      return "%"
          + struct.module
          + "{"
          + struct.fields.entrySet().stream()
              .map(e -> e.getKey() + ": " + print(e.getValue()))
              .collect(Collectors.joining(", "))
          + "}";
    } else if (pattern instanceof org.exlower.ast.Pattern.Pin pin) {
      return "^" + pin.name;
    } else if (pattern instanceof org.exlower.ast.Pattern.Alias alias) {
      return print(alias.pattern) + " = " + alias.name;
    }
    throw new AssertionError(pattern.kind());
  }

  /**
   * Renders a node in statement position: the expressions of a block are rendered one per line
   * rather than parenthesized.
   */
  public static String body(ElixirAst node) {
    if (node instanceof ElixirAst.Block block && !block.exprs.isEmpty()) {
      return block.exprs.stream().map(AstPrinter::print).collect(Collectors.joining("\n"));
    }
    return print(node);
  }

  /** Returns {@code s} with two spaces before each non-empty line. */
  static String indent(String s) {
    return s.lines()
        .map(line -> line.isEmpty() ? line : "  " + line)
        .collect(Collectors.joining("\n"));
  }

  private static <T> String join(List<T> items, Function<T, String> fn) {
    return items.stream().map(fn).collect(Collectors.joining(", "));
  }

  private static String literal(ElixirAst.Literal lit) {
    switch (lit.literalKind) {
      case NIL:
        return "nil";
      case STRING:
        return quote((String) lit.value);
      case ATOM:
        return ":" + atomText((String) lit.value);
      case FLOAT:
        return lit.value.toString().replace('E', 'e');
      default:
        return String.valueOf(lit.value);
    }
  }

  private static String atomText(String name) {
    return SIMPLE_ATOM.matcher(name).matches() ? name : quote(name);
  }

  /** Renders a map or keyword key, using the {@code key: value} form for simple atoms. */
  private static String key(ElixirAst key) {
    if (key instanceof ElixirAst.Literal lit && lit.literalKind == ElixirAst.Literal.Kind.ATOM) {
      return atomText((String) lit.value) + ": ";
    }
    return print(key) + " => ";
  }

  private static String entry(Entry entry) {
    return key(entry.key()) + print(entry.value());
  }

  static String quote(String s) {
    StringBuilder sb = new StringBuilder("\"");
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      switch (c) {
        case '"' -> sb.append("\\\"");
        case '\\' -> sb.append("\\\\");
        case '\n' -> sb.append("\\n");
        case '\t' -> sb.append("\\t");
        case '#' -> sb.append(i + 1 < s.length() && s.charAt(i + 1) == '{' ? "\\#" : "#");
        default -> sb.append(c);
      }
    }
    return sb.append('"').toString();
  }

  private static String call(ElixirAst.Call call) {
    String args = join(call.args, AstPrinter::print);
    if (call.name == null) {
      return operand(call.target) + ".(" + args + ")";
    } else if (call.target == null) {
      return call.name + "(" + args + ")";
    }
    return operand(call.target) + "." + call.name + "(" + args + ")";
  }

  private static String fn(ElixirAst.Fn fn) {
    if (fn.clauses.size() == 1 && fn.clauses.get(0).guard() == null) {
      Clause clause = fn.clauses.get(0);
      String params = join(clause.patterns(), AstPrinter::print);
      String head = params.isEmpty() ? "fn ->" : "fn " + params + " ->";
      String body = body(clause.body());
      return body.contains("\n")
          ? head + "\n" + indent(body) + "\nend"
          : head + " " + body + " end";
    }
    return "fn\n" + clauses(fn.clauses) + "end";
  }

  /** Renders clauses one after another, each indented and followed by a newline. */
  private static String clauses(List<Clause> clauses) {
    StringBuilder sb = new StringBuilder();
    for (Clause clause : clauses) {
      String head = join(clause.patterns(), AstPrinter::print);
      if (clause.guard() != null) {
        head += " when " + print(clause.guard());
      }
      String body = body(clause.body());
      String text =
          body.contains("\n") ? head + " ->\n" + indent(body) : head + " -> " + body;
      sb.append(indent(text)).append('\n');
    }
    return sb.toString();
  }

  private static String binary(ElixirAst.Binary binary) {
    int prec = PRECEDENCE.getOrDefault(binary.op, 0);
    return side(binary.lhs, prec, false) + " " + binary.op + " " + side(binary.rhs, prec, true);
  }

  private static String side(ElixirAst child, int parentPrec, boolean isRight) {
    String text = print(child);
    if (child instanceof ElixirAst.Binary binary) {
      int prec = PRECEDENCE.getOrDefault(binary.op, 0);
      if (prec < parentPrec || (isRight && prec == parentPrec)) {
        return "(" + text + ")";
      }
    } else if (child instanceof ElixirAst.Match || child instanceof ElixirAst.Range) {
      return "(" + text + ")";
    }
    return text;
  }

  /** Renders a node used as the target of {@code .}, {@code []}, or a unary operator. */
  private static String operand(ElixirAst node) {
    String text = print(node);
    return (node instanceof ElixirAst.Binary
            || node instanceof ElixirAst.Fn
            || node instanceof ElixirAst.Match
            || node instanceof ElixirAst.Unary
            || node instanceof ElixirAst.Range)
        ? "(" + text + ")"
        : text;
  }

  private static String ifNode(ElixirAst.If ifNode) {
    StringBuilder sb = new StringBuilder();
    sb.append(ifNode.unless ? "unless " : "if ").append(print(ifNode.cond)).append(" do\n");
    sb.append(indent(body(ifNode.thenBranch))).append('\n');
    if (ifNode.elseBranch != null) {
      sb.append("else\n").append(indent(body(ifNode.elseBranch))).append('\n');
    }
    return sb.append("end").toString();
  }

  private static String tryNode(ElixirAst.Try tryNode) {
    StringBuilder sb = new StringBuilder("try do\n");
    sb.append(indent(body(tryNode.body))).append('\n');
    if (!tryNode.rescueClauses.isEmpty()) {
      sb.append("rescue\n").append(clauses(tryNode.rescueClauses));
    }
    if (!tryNode.catchClauses.isEmpty()) {
      sb.append("catch\n").append(clauses(tryNode.catchClauses));
    }
    if (tryNode.after != null) {
      sb.append("after\n").append(indent(body(tryNode.after))).append('\n');
    }
    return sb.append("end").toString();
  }

  private static String forNode(ElixirAst.For forNode) {
    StringBuilder head = new StringBuilder("for ");
    head.append(
        join(forNode.generators, g -> print(g.pattern()) + " <- " + print(g.source())));
    for (ElixirAst filter : forNode.filters) {
      head.append(", ").append(print(filter));
    }
    @Nullable ElixirAst into = forNode.into;
    if (into != null) {
      head.append(", into: ").append(print(into));
    }
    String body = body(forNode.body);
    if (body.contains("\n")) {
      return head + " do\n" + indent(body) + "\nend";
    }
    return head + ", do: " + body;
  }
}
