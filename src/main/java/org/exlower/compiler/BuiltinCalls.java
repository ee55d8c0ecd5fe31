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
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.List;
import org.exlower.ast.ElixirAst;
import org.exlower.ast.Pattern;
import org.exlower.compiler.TreeLowering.Position;
import org.exlower.typed.TypeRef;
import org.exlower.typed.TypedExpr;
import org.exlower.util.Names;
import org.jspecify.annotations.Nullable;

/**
 * Lowers CALL nodes. Methods of the builtin array, string, and map types, and a few static
 * functions of the standard library, are mapped to the corresponding Elixir functions; a method
 * that updates its receiver in place becomes a rebinding of the variable that holds it. Other calls
 * become calls of the receiver type's module (with the receiver as the first argument), or
 * applications of a function value.
 */
final class BuiltinCalls {

  /** Static functions that map to a function of the same name in Kernel. */
  private static final ImmutableMap<String, String> KERNEL_STATICS =
      ImmutableMap.<String, String>builder()
          .put("Std.string", "to_string")
          .put("Std.int", "trunc")
          .put("Math.abs", "abs")
          .put("Math.max", "max")
          .put("Math.min", "min")
          .put("Math.floor", "floor")
          .put("Math.ceil", "ceil")
          .put("Math.round", "round")
          .buildOrThrow();

  /** Static functions that map to a function of an Erlang module. */
  private static final ImmutableMap<String, String> ERLANG_STATICS =
      ImmutableMap.of(
          "Math.sqrt", ":math.sqrt",
          "Math.pow", ":math.pow",
          "Math.sin", ":math.sin",
          "Math.cos", ":math.cos");

  private final TreeLowering lowering;

  BuiltinCalls(TreeLowering lowering) {
    this.lowering = lowering;
  }

  @Nullable ElixirAst lower(TypedExpr.Call node) {
    TypedExpr target = node.target.unwrap();
    if (!(target instanceof TypedExpr.Field field)) {
      // f(x) where f is a local or any other function-valued expression.
      return ElixirAst.apply(lowering.lowerExpr(target), lowering.lowerExprs(node.args));
    }
    switch (field.fieldKind) {
      case ENUM:
        return lowering.enumValue(field.ctor, lowering.lowerExprs(node.args));
      case STATIC:
        return staticCall(lowering.modulePath(field.obj), field.name, node.args);
      case ANON:
        return ElixirAst.apply(
            new ElixirAst.FieldAccess(lowering.lowerExpr(field.obj), field.name),
            lowering.lowerExprs(node.args));
      case INSTANCE:
        break;
    }
    TypeRef receiverType = field.obj.type;
    ElixirAst result = null;
    if (receiverType.is(TypeRef.Kind.ARRAY)) {
      result = arrayMethod(field.obj, field.name, node.args);
    } else if (receiverType.is(TypeRef.Kind.STRING)) {
      result = stringMethod(field.obj, field.name, node.args);
    } else if (receiverType.is(TypeRef.Kind.MAP)) {
      result = mapMethod(field.obj, field.name, node.args);
    }
    if (result != null) {
      return result;
    }
    String module = receiverType.moduleName();
    if (module == null) {
      return ElixirAst.apply(
          new ElixirAst.FieldAccess(lowering.lowerExpr(field.obj), field.name),
          lowering.lowerExprs(node.args));
    }
    return ElixirAst.remote(
        module, Names.functionName(field.name), withReceiver(field.obj, node.args));
  }

  private ElixirAst staticCall(String module, String name, List<TypedExpr> args) {
    String qualified = module + "." + name;
    String kernel = KERNEL_STATICS.get(qualified);
    if (kernel != null) {
      return ElixirAst.call(kernel, lowering.lowerExprs(args).toArray(new ElixirAst[0]));
    }
    String erlang = ERLANG_STATICS.get(qualified);
    if (erlang != null) {
      int dot = erlang.lastIndexOf('.');
      return ElixirAst.remote(
          erlang.substring(0, dot), erlang.substring(dot + 1), lowering.lowerExprs(args));
    }
    return ElixirAst.remote(module, Names.functionName(name), lowering.lowerExprs(args));
  }

  private List<ElixirAst> withReceiver(TypedExpr receiver, List<TypedExpr> args) {
    List<ElixirAst> result = new ArrayList<>();
    result.add(lowering.lowerExpr(receiver));
    result.addAll(lowering.lowerExprs(args));
    return result;
  }

  /** Returns the lowering of a call of an array method, or null if it is not a builtin. */
  private @Nullable ElixirAst arrayMethod(TypedExpr array, String name, List<TypedExpr> args) {
    switch (name) {
      case "push":
        if (args.size() == 1) {
          return update(array, ElixirAst.binary("++", receiver(array), elements(args)));
        }
        break;
      case "unshift":
        if (args.size() == 1) {
          return update(array, ElixirAst.binary("++", elements(args), receiver(array)));
        }
        break;
      case "insert":
        if (args.size() == 2) {
          return update(array, remote("List", "insert_at", array, args));
        }
        break;
      case "remove":
        if (args.size() == 1) {
          return update(array, remote("List", "delete", array, args));
        }
        break;
      case "reverse":
        if (args.isEmpty()) {
          return update(array, remote("Enum", "reverse", array, args));
        }
        break;
      case "sort":
        if (args.size() == 1) {
          // Enum.sort(a, fn x, y -> f.(x, y) <= 0 end)
          lowering.ctx.pushScope();
          String x = lowering.ctx.freshName("x");
          String y = lowering.ctx.freshName("y");
          ElixirAst compare =
              ElixirAst.apply(
                  lowering.lowerExpr(args.get(0)),
                  ImmutableList.of(ElixirAst.var(x), ElixirAst.var(y)));
          lowering.ctx.popScope();
          ElixirAst sorter =
              ElixirAst.fn(
                  ImmutableList.of(Pattern.var(x), Pattern.var(y)),
                  ElixirAst.binary("<=", compare, ElixirAst.intLit(0)));
          return update(array, ElixirAst.remote("Enum", "sort", receiver(array), sorter));
        }
        break;
      case "concat":
        if (args.size() == 1) {
          return ElixirAst.binary("++", receiver(array), lowering.lowerExpr(args.get(0)));
        }
        break;
      case "copy":
        if (args.isEmpty()) {
          return receiver(array);
        }
        break;
      case "map":
      case "filter":
        if (args.size() == 1) {
          return remote("Enum", name, array, args);
        }
        break;
      case "indexOf":
        if (args.size() == 1) {
          // Enum.find_index(a, fn item -> item == x end) || -1
          lowering.ctx.pushScope();
          String item = lowering.ctx.freshName("item");
          ElixirAst sought = lowering.lowerExpr(args.get(0));
          lowering.ctx.popScope();
          ElixirAst test =
              ElixirAst.fn(
                  ImmutableList.of(Pattern.var(item)),
                  ElixirAst.binary("==", ElixirAst.var(item), sought));
          return ElixirAst.binary(
              "||",
              ElixirAst.remote("Enum", "find_index", receiver(array), test),
              ElixirAst.intLit(-1));
        }
        break;
      case "join":
        if (args.size() == 1) {
          return remote("Enum", "join", array, args);
        }
        break;
      case "contains":
        if (args.size() == 1) {
          return remote("Enum", "member?", array, args);
        }
        break;
      default:
        break;
    }
    return null;
  }

  /** Returns the lowering of a call of a string method, or null if it is not a builtin. */
  private @Nullable ElixirAst stringMethod(TypedExpr string, String name, List<TypedExpr> args) {
    return switch (name) {
      case "toUpperCase" -> args.isEmpty() ? remote("String", "upcase", string, args) : null;
      case "toLowerCase" -> args.isEmpty() ? remote("String", "downcase", string, args) : null;
      // String.at(s, i) || "", since String.at is nil past the end
      case "charAt" ->
          (args.size() == 1)
              ? ElixirAst.binary("||", remote("String", "at", string, args), ElixirAst.string(""))
              : null;
      case "split" -> (args.size() == 1) ? remote("String", "split", string, args) : null;
      default -> null;
    };
  }

  /** Returns the lowering of a call of a map method, or null if it is not a builtin. */
  private @Nullable ElixirAst mapMethod(TypedExpr map, String name, List<TypedExpr> args) {
    return switch (name) {
      case "get" -> (args.size() == 1) ? remote("Map", "get", map, args) : null;
      case "exists" -> (args.size() == 1) ? remote("Map", "has_key?", map, args) : null;
      case "keys" -> args.isEmpty() ? remote("Map", "keys", map, args) : null;
      case "set" -> (args.size() == 2) ? update(map, remote("Map", "put", map, args)) : null;
      case "remove" -> (args.size() == 1) ? update(map, remote("Map", "delete", map, args)) : null;
      case "clear" -> args.isEmpty() ? update(map, new ElixirAst.MapLit(List.of())) : null;
      default -> null;
    };
  }

  private ElixirAst receiver(TypedExpr receiver) {
    return lowering.lowerExpr(receiver);
  }

  /** Returns {@code [x, ...]} for the given arguments. */
  private ElixirAst elements(List<TypedExpr> args) {
    return ElixirAst.list(lowering.lowerExprs(args));
  }

  private ElixirAst remote(String module, String name, TypedExpr receiver, List<TypedExpr> args) {
    return ElixirAst.remote(module, name, withReceiver(receiver, args));
  }

  /**
   * Returns the statement that replaces the value of {@code receiver} with {@code value}. The
   * updated value of a method that modifies its receiver cannot also be used as the method's
   * result.
   */
  private ElixirAst update(TypedExpr receiver, ElixirAst value) {
    if (lowering.position() == Position.EXPR) {
      return lowering.diagnostic("Result of a method that modifies %s is used", receiver);
    }
    ElixirAst result = lowering.assignTo(receiver, value);
    return (result != null) ? result : value;
  }
}
