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
import org.exlower.typed.TVar;
import org.exlower.typed.TypedExpr;
import org.jspecify.annotations.Nullable;

/**
 * The declarative meaning of an imperative loop, as recognized by {@link LoopIntentClassifier}.
 * Intents are consumed by {@link LoopSynthesizer} as soon as they are created.
 *
 * <p>{@code body} is always the list of loop-body statements that remain once the statements
 * implementing the iteration itself (counter increments, element extraction) have been removed.
 */
public interface LoopIntent {

  /** A short name for the kind of intent, used in metadata flags and logging. */
  String label();

  /**
   * Iterates {@code userVar} from {@code start} up to {@code end} (exclusive if {@code
   * exclusiveBound}).
   */
  record RangeLoop(
      TVar userVar,
      TypedExpr start,
      TypedExpr end,
      ImmutableList<TypedExpr> body,
      boolean exclusiveBound)
      implements LoopIntent {
    @Override
    public String label() {
      return "RANGE";
    }
  }

  /**
   * Iterates {@code userVar} over the elements of {@code collection}. If {@code userVar} is null
   * the loop was written with an index, and {@code indexed} identifies the {@code array[index]}
   * accesses in the body that refer to the current element.
   */
  record CollectionLoop(
      @Nullable TVar userVar,
      TypedExpr collection,
      ImmutableList<TypedExpr> body,
      @Nullable IndexedAccess indexed)
      implements LoopIntent {
    @Override
    public String label() {
      return "COLLECTION";
    }
  }

  /** The {@code array[index]} accesses that a collection loop replaces with its element. */
  record IndexedAccess(TVar array, TVar index) {}

  /** Iterates over the entries of {@code map}, binding each key and value (either may be null). */
  record MapEntryLoop(
      @Nullable TVar keyVar, @Nullable TVar valueVar, TypedExpr map, ImmutableList<TypedExpr> body)
      implements LoopIntent {
    @Override
    public String label() {
      return "MAP_ENTRY";
    }
  }

  /**
   * Appends {@code elements} one at a time to the empty list {@code accumulator}. If {@code
   * yieldsValue}, the accumulator is then the value of the enclosing block.
   */
  record UnrolledListBuild(
      TVar accumulator, ImmutableList<TypedExpr> elements, boolean yieldsValue)
      implements LoopIntent {
    @Override
    public String label() {
      return "UNROLLED_LIST";
    }
  }

  /**
   * Builds {@code accumulator} by appending {@code element} on each iteration of {@code source}
   * (a RangeLoop or CollectionLoop) for which {@code filter} (if non-null) holds.
   */
  record Comprehension(
      TVar accumulator, LoopIntent source, @Nullable TypedExpr filter, TypedExpr element)
      implements LoopIntent {
    @Override
    public String label() {
      return "COMPREHENSION";
    }
  }
}
