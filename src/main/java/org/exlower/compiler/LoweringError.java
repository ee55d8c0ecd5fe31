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
import org.exlower.typed.SourcePos;
import org.jspecify.annotations.Nullable;

/**
 * Thrown when the lowering of a unit cannot continue, e.g. because the node-visit ceiling was
 * reached. Problems confined to a single construct are reported as {@link Diagnostic}s instead.
 */
public class LoweringError extends RuntimeException {
  public final String msg;
  public final @Nullable SourcePos pos;

  /** The nodes being visited when the error was detected, outermost first. */
  public final ImmutableList<String> trace;

  public LoweringError(String msg, @Nullable SourcePos pos, ImmutableList<String> trace) {
    super(msg);
    this.msg = msg;
    this.pos = pos;
    this.trace = trace;
  }

  @Override
  public String getMessage() {
    return (pos == null) ? msg : String.format("%s (%s)", msg, pos);
  }
}
