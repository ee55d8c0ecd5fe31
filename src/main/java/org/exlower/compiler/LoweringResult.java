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
import org.exlower.ast.ElixirAst;

/**
 * The outcome of lowering one unit.
 *
 * @param ast the lowered tree; if lowering failed, a diagnostic node
 * @param diagnostics the problems found, in the order they were found
 * @param renamingTable the final name chosen for each variable id that was given one
 * @param infrastructureVars the ids of the compiler temporaries that do not appear in the output
 */
public record LoweringResult(
    ElixirAst ast,
    ImmutableList<Diagnostic> diagnostics,
    ImmutableMap<Integer, String> renamingTable,
    ImmutableSet<Integer> infrastructureVars) {

  public boolean hasErrors() {
    return !diagnostics.isEmpty();
  }
}
