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

import com.google.common.collect.ImmutableSet;
import org.exlower.typed.SourcePos;
import org.exlower.typed.TypeRef;
import org.jspecify.annotations.Nullable;

/**
 * Bookkeeping attached to each {@link ElixirAst} node for the benefit of later passes. The
 * lowering only writes the fields it computes itself and never reads another node's metadata.
 *
 * @param pos where in the source the node came from
 * @param type the semantic type of the value the node computes
 * @param pure true if evaluating the node has no side effects
 * @param constant true if the node's value is known at compile time
 * @param requiresTemp true if a printer must bind the node's value to a variable before using it
 *     in a guard or as a pattern
 * @param flags free-form markers, e.g. {@link #SYNTHESIZED_LOOP}
 */
public record Metadata(
    @Nullable SourcePos pos,
    @Nullable TypeRef type,
    boolean pure,
    boolean constant,
    boolean requiresTemp,
    ImmutableSet<String> flags) {

  public static final Metadata EMPTY =
      new Metadata(null, null, false, false, false, ImmutableSet.of());

  /** Set on nodes that replace an imperative loop. */
  public static final String SYNTHESIZED_LOOP = "synthesized-loop";

  /** Set on nodes that replace a sequence of list appends. */
  public static final String UNROLLED_LIST = "unrolled-list";

  /** Set on the structural fallback for loops that matched no intent. */
  public static final String STRUCTURAL_LOOP = "structural-loop";

  /** Set on case clauses whose pattern was rendered from a binding plan. */
  public static final String PLANNED_PATTERN = "planned-pattern";

  /**
   * Prefix of the flag naming the kind of loop intent a synthesized node replaces, e.g. {@code
   * "loop-intent:RANGE"}.
   */
  public static final String LOOP_INTENT_PREFIX = "loop-intent:";

  public Metadata withPos(@Nullable SourcePos newPos) {
    return new Metadata(newPos, type, pure, constant, requiresTemp, flags);
  }

  public Metadata withType(@Nullable TypeRef newType) {
    return new Metadata(pos, newType, pure, constant, requiresTemp, flags);
  }

  public Metadata withPurity(boolean newPure, boolean newConstant) {
    return new Metadata(pos, type, newPure, newConstant, requiresTemp, flags);
  }

  public Metadata withRequiresTemp(boolean newRequiresTemp) {
    return new Metadata(pos, type, pure, constant, newRequiresTemp, flags);
  }

  public Metadata withFlag(String flag) {
    if (flags.contains(flag)) {
      return this;
    }
    ImmutableSet<String> newFlags =
        ImmutableSet.<String>builder().addAll(flags).add(flag).build();
    return new Metadata(pos, type, pure, constant, requiresTemp, newFlags);
  }

  public boolean hasFlag(String flag) {
    return flags.contains(flag);
  }
}
