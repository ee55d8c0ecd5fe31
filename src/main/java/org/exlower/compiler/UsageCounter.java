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

import java.util.Collections;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.exlower.typed.TVar;
import org.exlower.typed.TypedExpr;

/**
 * Counts the references ({@link TypedExpr.Local} nodes) to each variable in a set of trees. Any
 * subtree in the {@code excluded} set (compared by identity) is skipped entirely; this is used to
 * ignore statements that are known to be elided.
 */
final class UsageCounter {
  private final Map<Integer, Integer> counts = new HashMap<>();
  private final Set<TypedExpr> excluded;

  private UsageCounter(Set<TypedExpr> excluded) {
    this.excluded = excluded;
  }

  static UsageCounter count(List<TypedExpr> roots, Set<TypedExpr> excluded) {
    UsageCounter counter = new UsageCounter(excluded);
    roots.forEach(counter::scan);
    return counter;
  }

  static UsageCounter count(TypedExpr root) {
    UsageCounter counter = new UsageCounter(Collections.newSetFromMap(new IdentityHashMap<>()));
    counter.scan(root);
    return counter;
  }

  /** Returns true if {@code root} contains a reference to {@code v}. */
  static boolean references(TypedExpr root, TVar v) {
    return count(root).isReferenced(v);
  }

  private void scan(TypedExpr e) {
    if (excluded.contains(e)) {
      return;
    }
    if (e instanceof TypedExpr.Local local) {
      counts.merge(local.var.id, 1, Integer::sum);
    }
    e.forEachChild(this::scan);
  }

  int count(TVar v) {
    return counts.getOrDefault(v.id, 0);
  }

  boolean isReferenced(TVar v) {
    return count(v) != 0;
  }
}
