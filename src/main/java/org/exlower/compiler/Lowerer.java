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
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import org.exlower.ast.ElixirAst;
import org.exlower.ast.Pattern;
import org.exlower.typed.TypedExpr;
import org.exlower.util.Names;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The entry points for lowering typed trees. Each unit (an expression or a function) is lowered
 * with a new {@link CompilationContext}; a {@link LoweringError} ends the lowering of that unit
 * only, and is returned as a diagnostic.
 */
public final class Lowerer {

  private static final Logger log = LoggerFactory.getLogger(Lowerer.class);

  // Static methods only
  private Lowerer() {}

  /** Lowers an expression, as if it were the body of a function. */
  public static LoweringResult lowerExpr(TypedExpr expr, LoweringOptions options) {
    return lowerUnit(
        options,
        "expression",
        expr,
        lowering -> lowering.lowerBody(expr, TreeLowering.Position.TAIL),
        diagnostic -> diagnostic);
  }

  /** Lowers a named function to a {@code def}, or a {@code defp} if {@code isPrivate}. */
  public static LoweringResult lowerFunction(
      String name, TypedExpr.Function function, boolean isPrivate, LoweringOptions options) {
    return lowerUnit(
        options,
        name,
        function,
        lowering -> lowering.lowerDef(name, function, isPrivate),
        // Keep the function (with the same arity) so that calls of it still resolve.
        diagnostic ->
            new ElixirAst.Def(
                Names.functionName(name),
                function.args.stream()
                    .map(arg -> (Pattern) Pattern.wildcard())
                    .collect(ImmutableList.toImmutableList()),
                diagnostic,
                isPrivate));
  }

  /**
   * Lowers a module containing the given public functions, in order. The functions are lowered
   * independently; their variable ids are expected to be distinct.
   */
  public static LoweringResult lowerModule(
      String name, ImmutableMap<String, TypedExpr.Function> functions, LoweringOptions options) {
    List<ElixirAst> defs = new ArrayList<>();
    ImmutableList.Builder<Diagnostic> diagnostics = ImmutableList.builder();
    Map<Integer, String> renamingTable = new LinkedHashMap<>();
    Set<Integer> infrastructure = new LinkedHashSet<>();
    functions.forEach(
        (fnName, function) -> {
          LoweringResult result = lowerFunction(fnName, function, false, options);
          defs.add(result.ast());
          diagnostics.addAll(result.diagnostics());
          renamingTable.putAll(result.renamingTable());
          infrastructure.addAll(result.infrastructureVars());
        });
    return new LoweringResult(
        new ElixirAst.ModuleDef(name, defs),
        diagnostics.build(),
        ImmutableMap.copyOf(renamingTable),
        ImmutableSet.copyOf(infrastructure));
  }

  private static LoweringResult lowerUnit(
      LoweringOptions options,
      String unitName,
      TypedExpr root,
      Function<TreeLowering, ElixirAst> lower,
      Function<ElixirAst.Diagnostic, ElixirAst> onError) {
    CompilationContext ctx = new CompilationContext(options);
    ElixirAst ast;
    try {
      ctx.reserveFreeVariables(root);
      ast = lower.apply(new TreeLowering(ctx));
    } catch (LoweringError e) {
      log.error("Lowering {} failed; visit trace: {}", unitName, e.trace, e);
      ctx.report(e.pos, e.getMessage());
      ast = onError.apply(ElixirAst.diagnostic(e.msg));
    }
    ctx.freeze();
    log.debug("lowered {} in {} visits", unitName, ctx.visits());
    return new LoweringResult(
        ast, ctx.diagnostics(), ctx.renamingTable(), ctx.infrastructureVars());
  }
}
