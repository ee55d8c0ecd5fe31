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

import com.google.common.base.VerifyException;
import com.google.common.collect.ImmutableList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;

/** Checks that no node instance appears at more than one position of a tree. */
public final class AstOwnership {

  // Static methods only
  private AstOwnership() {}

  /** Returns each node that is reachable from {@code root} by more than one path. */
  public static ImmutableList<ElixirAst> sharedNodes(ElixirAst root) {
    Set<ElixirAst> seen = Collections.newSetFromMap(new IdentityHashMap<>());
    Set<ElixirAst> shared = Collections.newSetFromMap(new IdentityHashMap<>());
    ImmutableList.Builder<ElixirAst> result = ImmutableList.builder();
    walk(root, seen, shared, result);
    return result.build();
  }

  /** Throws a {@link VerifyException} if any node of the tree is shared. */
  public static void verify(ElixirAst root) {
    ImmutableList<ElixirAst> shared = sharedNodes(root);
    if (!shared.isEmpty()) {
      throw new VerifyException(
          String.format("%d shared node(s), first is %s", shared.size(), shared.get(0)));
    }
  }

  private static void walk(
      ElixirAst node,
      Set<ElixirAst> seen,
      Set<ElixirAst> shared,
      ImmutableList.Builder<ElixirAst> result) {
    if (!seen.add(node)) {
      if (shared.add(node)) {
        result.add(node);
      }
      // Its children have already been visited.
      return;
    }
    node.forEachChild(child -> walk(child, seen, shared, result));
  }
}
