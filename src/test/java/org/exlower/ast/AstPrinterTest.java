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

import static com.google.common.truth.Truth.assertThat;
import static org.exlower.ast.ElixirAst.atom;
import static org.exlower.ast.ElixirAst.binary;
import static org.exlower.ast.ElixirAst.intLit;
import static org.exlower.ast.ElixirAst.string;
import static org.exlower.ast.ElixirAst.var;

import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class AstPrinterTest {

  private static String print(ElixirAst node) {
    return AstPrinter.print(node);
  }

  @Test
  public void literals() {
    assertThat(print(ElixirAst.nil())).isEqualTo("nil");
    assertThat(print(ElixirAst.bool(true))).isEqualTo("true");
    assertThat(print(intLit(-3))).isEqualTo("-3");
    assertThat(print(ElixirAst.floatLit(2.5))).isEqualTo("2.5");
    assertThat(print(atom("ok"))).isEqualTo(":ok");
    assertThat(print(atom("valid?"))).isEqualTo(":valid?");
    assertThat(print(atom("hello world"))).isEqualTo(":\"hello world\"");
  }

  @Test
  public void stringEscapes() {
    assertThat(print(string("say \"hi\""))).isEqualTo("\"say \\\"hi\\\"\"");
    assertThat(print(string("a\nb"))).isEqualTo("\"a\\nb\"");
    // Only "#{" would start an interpolation.
    assertThat(print(string("#1 #{x}"))).isEqualTo("\"#1 \\#{x}\"");
  }

  @Test
  public void binaryPrecedence() {
    assertThat(print(binary("*", binary("+", var("a"), var("b")), var("c"))))
        .isEqualTo("(a + b) * c");
    assertThat(print(binary("+", binary("*", var("a"), var("b")), var("c"))))
        .isEqualTo("a * b + c");
    assertThat(print(binary("-", var("a"), binary("-", var("b"), var("c")))))
        .isEqualTo("a - (b - c)");
    assertThat(print(binary("-", binary("-", var("a"), var("b")), var("c"))))
        .isEqualTo("a - b - c");
    assertThat(print(binary("or", binary("==", var("a"), intLit(0)), var("b"))))
        .isEqualTo("a == 0 or b");
  }

  @Test
  public void calls() {
    assertThat(print(ElixirAst.call("length", var("xs")))).isEqualTo("length(xs)");
    assertThat(print(ElixirAst.remote("Enum", "map", var("xs"), var("f"))))
        .isEqualTo("Enum.map(xs, f)");
    ElixirAst fn = ElixirAst.fn(ImmutableList.of(Pattern.var("x")), var("x"));
    assertThat(print(ElixirAst.apply(fn, ImmutableList.of(intLit(1)))))
        .isEqualTo("(fn x -> x end).(1)");
    assertThat(print(ElixirAst.apply(var("f"), ImmutableList.of())))
        .isEqualTo("f.()");
  }

  @Test
  public void collections() {
    assertThat(print(ElixirAst.list(intLit(1), intLit(2)))).isEqualTo("[1, 2]");
    assertThat(print(ElixirAst.tuple(atom("ok"), var("v")))).isEqualTo("{:ok, v}");
    ElixirAst map =
        new ElixirAst.MapLit(
            ImmutableList.of(
                new ElixirAst.Entry(atom("a"), intLit(1)),
                new ElixirAst.Entry(string("k"), intLit(2))));
    assertThat(print(map)).isEqualTo("%{a: 1, \"k\" => 2}");
    ElixirAst update =
        new ElixirAst.MapUpdate(
            var("m"), ImmutableList.of(new ElixirAst.Entry(atom("count"), intLit(0))));
    assertThat(print(update)).isEqualTo("%{m | count: 0}");
    assertThat(print(new ElixirAst.Range(intLit(1), intLit(10), intLit(2))))
        .isEqualTo("1..10//2");
  }

  @Test
  public void patterns() {
    Pattern pattern =
        Pattern.tuple(
            Pattern.literal(atom("ok")),
            Pattern.list(ImmutableList.of(Pattern.var("h")), Pattern.wildcard()),
            Pattern.pin("x"));
    assertThat(AstPrinter.print(pattern)).isEqualTo("{:ok, [h | _], ^x}");
  }

  @Test
  public void caseExpression() {
    ElixirAst node =
        new ElixirAst.Case(
            var("r"),
            ImmutableList.of(
                ElixirAst.Clause.of(
                    Pattern.tuple(Pattern.literal(atom("ok")), Pattern.var("v")),
                    binary(">", var("v"), intLit(0)),
                    var("v")),
                ElixirAst.Clause.of(Pattern.wildcard(), null, intLit(0))));
    assertThat(print(node))
        .isEqualTo(
            """
            case r do
              {:ok, v} when v > 0 -> v
              _ -> 0
            end""");
  }

  @Test
  public void ifWithBlockBranches() {
    ElixirAst node =
        new ElixirAst.If(
            var("flag"),
            ElixirAst.block(
                ImmutableList.of(
                    ElixirAst.match(Pattern.var("x"), intLit(1)), var("x"))),
            var("x"),
            false);
    assertThat(print(node))
        .isEqualTo(
            """
            if flag do
              x = 1
              x
            else
              x
            end""");
  }

  @Test
  public void blockBodyVersusExpression() {
    ElixirAst block =
        ElixirAst.block(
            ImmutableList.of(ElixirAst.match(Pattern.var("x"), intLit(1)), var("x")));
    assertThat(print(block)).isEqualTo("(x = 1; x)");
    assertThat(AstPrinter.body(block)).isEqualTo("x = 1\nx");
  }

  @Test
  public void diagnostic() {
    assertThat(print(ElixirAst.diagnostic("oops"))).isEqualTo("raise(\"exlower: oops\")");
  }
}
