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

/**
 * The binding of one constructor parameter in one case clause.
 *
 * @param parameterIndex the position of the parameter in the constructor
 * @param finalName the variable name the pattern binds, and that every reference in the clause uses
 * @param isUsed true if the clause's guard or body refers to the value
 * @param userFacing true if {@code finalName} came from the user's source rather than from a
 *     compiler temporary; an unused user-facing binding is written {@code _finalName} rather than
 *     {@code _}
 */
public record BindingPlanEntry(
    int parameterIndex, String finalName, boolean isUsed, boolean userFacing) {}
