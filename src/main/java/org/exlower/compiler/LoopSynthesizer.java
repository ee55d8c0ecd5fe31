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
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.exlower.ast.ElixirAst;
import org.exlower.ast.ElixirAst.Clause;
import org.exlower.ast.Metadata;
import org.exlower.ast.Pattern;
import org.exlower.compiler.LoopIntent.CollectionLoop;
import org.exlower.compiler.LoopIntent.Comprehension;
import org.exlower.compiler.LoopIntent.IndexedAccess;
import org.exlower.compiler.LoopIntent.MapEntryLoop;
import org.exlower.compiler.LoopIntent.RangeLoop;
import org.exlower.compiler.LoopIntent.UnrolledListBuild;
import org.exlower.compiler.TreeLowering.LoopFrame;
import org.exlower.compiler.TreeLowering.Position;
import org.exlower.typed.TVar;
import org.exlower.typed.TypeRef;
import org.exlower.typed.TypedExpr;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the Elixir form of a loop: a call of an {@code Enum} function or a comprehension for a
 * recognized {@link LoopIntent}, or a structural {@code Enum.reduce_while} for any other loop.
 *
 * <p>Outer variables that the loop body rebinds are threaded through the iterations as the
 * accumulator of a reduction, and rebound to its result after the loop.
 */
final class LoopSynthesizer {

  private static final Logger log = LoggerFactory.getLogger(LoopSynthesizer.class);

  /** The element name used when the source names none. */
  private static final String DEFAULT_ELEMENT = "item";

  /** The iteration counter of a structural do-while loop. */
  private static final String ITERATION = "iteration";

  private final TreeLowering lowering;
  private final LoopIntentClassifier classifier;
  private final CompilationContext ctx;

  LoopSynthesizer(TreeLowering lowering, LoopIntentClassifier classifier) {
    this.lowering = lowering;
    this.classifier = classifier;
    this.ctx = lowering.ctx;
  }

  /** Returns the replacement for the statements of a classification. */
  ElixirAst synthesize(LoopIntentClassifier.Classification classification) {
    classification.infrastructure().forEach(ctx::addInfrastructure);
    return synthesize(classification.intent());
  }

  ElixirAst synthesize(LoopIntent intent) {
    ElixirAst result;
    if (intent instanceof RangeLoop range) {
      result =
          iterate(
              lowering.range(range.start(), range.end()), range.userVar(), null, range.body());
    } else if (intent instanceof CollectionLoop collection) {
      result =
          iterate(
              source(collection.collection()),
              collection.userVar(),
              collection.indexed(),
              collection.body());
    } else if (intent instanceof MapEntryLoop entries) {
      result = mapEntries(entries);
    } else if (intent instanceof Comprehension comprehension) {
      result = comprehension(comprehension);
    } else if (intent instanceof UnrolledListBuild unrolled) {
      ElixirAst list = ElixirAst.list(lowering.lowerExprs(unrolled.elements()));
      result =
          unrolled.yieldsValue()
              ? list
              : ElixirAst.match(Pattern.var(ctx.nameOf(unrolled.accumulator())), list);
      result.flag(Metadata.UNROLLED_LIST);
    } else {
      throw new AssertionError(intent);
    }
    log.debug("synthesized {} loop", intent.label());
    return result
        .flag(Metadata.SYNTHESIZED_LOOP)
        .flag(Metadata.LOOP_INTENT_PREFIX + intent.label());
  }

  /** Returns the enumerable for a collection: the values of a map, or the collection itself. */
  private ElixirAst source(TypedExpr collection) {
    ElixirAst lowered = lowering.lowerExpr(collection);
    return collection.type.is(TypeRef.Kind.MAP)
        ? ElixirAst.remote("Map", "values", lowered)
        : lowered;
  }

  /**
   * Returns the pattern for the per-element variable. {@code userVar} is the variable the source
   * declared, if any; otherwise the element, named {@code elementName}, replaces the {@code
   * indexed} accesses, if any.
   */
  private Pattern element(
      @Nullable TVar userVar, @Nullable IndexedAccess indexed, @Nullable String elementName) {
    if (userVar != null) {
      return lowering.binding(userVar);
    } else if (indexed != null && elementName != null && ctx.wasReferenced(indexed.index())) {
      return Pattern.var(elementName);
    }
    return lowering.unused(elementName != null ? elementName : DEFAULT_ELEMENT, true);
  }

  /**
   * Opens the scope of a loop body: declares {@code userVar}, and if there are {@code indexed}
   * accesses, picks the name of the element that replaces them. Returns that name, or null.
   */
  private @Nullable String enterLoopScope(
      @Nullable TVar userVar, @Nullable IndexedAccess indexed) {
    ctx.pushScope();
    if (userVar != null) {
      ctx.declare(userVar);
    }
    if (indexed == null) {
      return null;
    }
    String elementName = ctx.freshName(DEFAULT_ELEMENT);
    ctx.addElementAlias(indexed.array(), indexed.index(), elementName);
    return elementName;
  }

  /**
   * Returns {@code Enum.each(source, fn x -> body end)}, or the corresponding {@code Enum.reduce}
   * if the body rebinds outer variables.
   */
  private ElixirAst iterate(
      ElixirAst source,
      @Nullable TVar userVar,
      @Nullable IndexedAccess indexed,
      List<TypedExpr> body) {
    List<@Nullable TVar> binders = new ArrayList<>();
    binders.add(userVar);
    if (indexed != null) {
      binders.add(indexed.index());
    }
    ImmutableList<TVar> state = loopState(body, binders);
    ElixirAst init = lowering.stateExpr(state);
    String elementName = enterLoopScope(userVar, indexed);
    ElixirAst bodyAst = loopBody(body, state);
    Pattern element = element(userVar, indexed, elementName);
    ctx.popScope();
    return reduce(source, element, state, init, bodyAst);
  }

  private ElixirAst mapEntries(MapEntryLoop entries) {
    ElixirAst source = lowering.lowerExpr(entries.map());
    List<@Nullable TVar> binders = Arrays.asList(entries.keyVar(), entries.valueVar());
    ImmutableList<TVar> state = loopState(entries.body(), binders);
    ElixirAst init = lowering.stateExpr(state);
    ctx.pushScope();
    for (TVar v : binders) {
      if (v != null) {
        ctx.declare(v);
      }
    }
    ElixirAst bodyAst = loopBody(entries.body(), state);
    // fn {k, v} -> ... end
    Pattern element =
        Pattern.tuple(optionalBinding(entries.keyVar()), optionalBinding(entries.valueVar()));
    ctx.popScope();
    return reduce(source, element, state, init, bodyAst);
  }

  private Pattern optionalBinding(@Nullable TVar v) {
    return (v == null) ? Pattern.wildcard() : lowering.binding(v);
  }

  private ElixirAst reduce(
      ElixirAst source,
      Pattern element,
      ImmutableList<TVar> state,
      ElixirAst init,
      ElixirAst bodyAst) {
    if (state.isEmpty()) {
      return ElixirAst.remote("Enum", "each", source, ElixirAst.fn(List.of(element), bodyAst));
    }
    // x = Enum.reduce(source, x, fn e, x -> ...; x end)
    ElixirAst fn = ElixirAst.fn(List.of(element, lowering.statePattern(state)), bodyAst);
    return ElixirAst.match(
        lowering.statePattern(state), ElixirAst.remote("Enum", "reduce", source, init, fn));
  }

  /**
   * Returns the outer variables that a loop with the given body must thread. The loop's own
   * variables, {@code binders}, are never threaded.
   */
  private ImmutableList<TVar> loopState(
      List<TypedExpr> body, List<? extends @Nullable TVar> binders) {
    if (!lowering.options.threadLoopState) {
      return ImmutableList.of();
    }
    return MutationAnalyzer.outerMutations(body, binders);
  }

  /**
   * Lowers the statements of a loop body, followed by the threaded state if there is any. A final
   * {@code x = v} that updates the only state variable is replaced by {@code v}.
   */
  private ElixirAst loopBody(List<TypedExpr> body, ImmutableList<TVar> state) {
    List<ElixirAst> stmts = lowering.lowerStatements(body, Position.STATEMENT);
    if (!state.isEmpty()) {
      String only = (state.size() == 1) ? ctx.nameOf(state.get(0)) : null;
      int last = stmts.size() - 1;
      if (only != null
          && last >= 0
          && stmts.get(last) instanceof ElixirAst.Match match
          && match.pattern instanceof Pattern.Var v
          && v.name.equals(only)) {
        stmts.set(last, match.value);
      } else {
        stmts.add(lowering.stateExpr(state));
      }
    }
    return TreeLowering.sequence(stmts, Position.EXPR);
  }

  /** Returns {@code acc = for x <- source, filter, do: element}. */
  private ElixirAst comprehension(Comprehension comprehension) {
    LoopIntent source = comprehension.source();
    ElixirAst enumerable;
    TVar userVar;
    IndexedAccess indexed;
    if (source instanceof RangeLoop range) {
      enumerable = lowering.range(range.start(), range.end());
      userVar = range.userVar();
      indexed = null;
    } else {
      CollectionLoop collection = (CollectionLoop) source;
      enumerable = source(collection.collection());
      userVar = collection.userVar();
      indexed = collection.indexed();
    }
    String elementName = enterLoopScope(userVar, indexed);
    List<ElixirAst> filters = new ArrayList<>();
    if (comprehension.filter() != null) {
      filters.add(lowering.lowerExpr(comprehension.filter()));
    }
    ElixirAst element = lowering.lowerExpr(comprehension.element());
    Pattern pattern = element(userVar, indexed, elementName);
    ctx.popScope();
    ElixirAst forNode =
        new ElixirAst.For(
            List.of(new ElixirAst.Generator(pattern, enumerable)), filters, null, element);
    return ElixirAst.match(Pattern.var(ctx.nameOf(comprehension.accumulator())), forNode);
  }

  // Structural loops

  /**
   * Returns the structural form of a while or do-while loop:
   *
   * <pre>
   * state = Enum.reduce_while(Stream.iterate(0, fn n -> n + 1 end), state, fn _, state ->
   *   if cond do
   *     body
   *     {:cont, state}
   *   else
   *     {:halt, state}
   *   end
   * end)
   * </pre>
   *
   * For a do-while loop the condition is {@code iteration == 0 or cond}, so the body runs once
   * before the condition is first tested.
   */
  ElixirAst structuralWhile(TypedExpr.While node) {
    ImmutableList<TVar> state = MutationAnalyzer.outerMutations(List.of(node.cond, node.body));
    ElixirAst init = lowering.stateExpr(state);
    LoopFrame frame = new LoopFrame(state);
    ctx.pushScope();
    String iteration = node.normalWhile ? null : ctx.freshName(ITERATION);
    ElixirAst cond = lowering.lowerExpr(node.cond);
    if (iteration != null) {
      ElixirAst first = ElixirAst.binary("==", ElixirAst.var(iteration), ElixirAst.intLit(0));
      cond = ElixirAst.binary("or", first, cond);
    }
    ElixirAst body = structuralBody(node.body, frame);
    ctx.popScope();
    ElixirAst fnBody = new ElixirAst.If(cond, body, halt(state), false);
    Pattern counter = (iteration == null) ? Pattern.wildcard() : Pattern.var(iteration);
    ElixirAst fn = ElixirAst.fn(List.of(counter, lowering.statePattern(state)), fnBody);
    ElixirAst naturals = ElixirAst.remote("Stream", "iterate", ElixirAst.intLit(0), successor());
    log.debug("structural {} loop threading {}", node.normalWhile ? "while" : "do-while", state);
    return structuralResult(state, naturals, init, fn);
  }

  /**
   * Returns the structural form of a for-in loop whose body may exit early: an {@code
   * Enum.reduce_while} over the collection.
   */
  ElixirAst structuralForIn(TypedExpr.ForIn node) {
    LoopIntent intent = classifier.forIn(node);
    ElixirAst source;
    ImmutableList<TypedExpr> body;
    if (intent instanceof RangeLoop range) {
      source = lowering.range(range.start(), range.end());
      body = range.body();
    } else {
      CollectionLoop collection = (CollectionLoop) intent;
      source = source(collection.collection());
      body = collection.body();
    }
    ImmutableList<TVar> state = MutationAnalyzer.outerMutations(body, List.of(node.var));
    ElixirAst init = lowering.stateExpr(state);
    LoopFrame frame = new LoopFrame(state);
    ctx.pushScope();
    ctx.declare(node.var);
    ElixirAst bodyAst = structuralBody(node.body, frame);
    Pattern element = lowering.binding(node.var);
    ctx.popScope();
    ElixirAst fn = ElixirAst.fn(List.of(element, lowering.statePattern(state)), bodyAst);
    return structuralResult(state, source, init, fn);
  }

  private ElixirAst structuralResult(
      ImmutableList<TVar> state, ElixirAst source, ElixirAst init, ElixirAst fn) {
    ElixirAst call = ElixirAst.remote("Enum", "reduce_while", source, init, fn);
    ElixirAst result = state.isEmpty() ? call : ElixirAst.match(lowering.statePattern(state), call);
    return result.flag(Metadata.STRUCTURAL_LOOP);
  }

  /**
   * Lowers the body of a structural loop, ending with {@code {:cont, state}}. If the body contains
   * a break or continue, it is wrapped in a {@code try} that catches the value they throw.
   */
  private ElixirAst structuralBody(TypedExpr body, LoopFrame frame) {
    List<ElixirAst> stmts = new ArrayList<>(lowering.lowerLoopBody(body, frame));
    stmts.add(cont(frame.state));
    ElixirAst result = TreeLowering.sequence(stmts, Position.EXPR);
    if (!frame.breaks && !frame.continues) {
      return result;
    }
    List<Clause> catches = new ArrayList<>();
    if (frame.breaks) {
      catches.add(exitClause("break", halt(frame.state), frame.state));
    }
    if (frame.continues) {
      catches.add(exitClause("continue", cont(frame.state), frame.state));
    }
    return new ElixirAst.Try(result, List.of(), catches, null);
  }

  /** Returns {@code {:tag, state} -> result}. */
  private Clause exitClause(String tag, ElixirAst result, ImmutableList<TVar> state) {
    Pattern pattern =
        Pattern.tuple(Pattern.literal(ElixirAst.atom(tag)), lowering.statePattern(state));
    return Clause.of(pattern, null, result);
  }

  private ElixirAst cont(ImmutableList<TVar> state) {
    return ElixirAst.tuple(ElixirAst.atom("cont"), lowering.stateExpr(state));
  }

  private ElixirAst halt(ImmutableList<TVar> state) {
    return ElixirAst.tuple(ElixirAst.atom("halt"), lowering.stateExpr(state));
  }

  /** Returns {@code fn n -> n + 1 end}. */
  private static ElixirAst successor() {
    return ElixirAst.fn(
        List.of(Pattern.var("n")),
        ElixirAst.binary("+", ElixirAst.var("n"), ElixirAst.intLit(1)));
  }
}
