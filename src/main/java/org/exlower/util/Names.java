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

package org.exlower.util;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSet;

/** Conversions from source-language identifiers to Elixir ones. */
public final class Names {

  // Static methods only
  private Names() {}

  /** Words that cannot be used as Elixir variable names. */
  public static final ImmutableSet<String> RESERVED =
      ImmutableSet.of(
          "do", "end", "after", "else", "catch", "rescue", "fn", "true", "false", "nil", "when",
          "and", "or", "not", "in", "__MODULE__", "__FILE__", "__DIR__", "__ENV__", "__CALLER__");

  /**
   * Converts a camelCase or PascalCase identifier to snake_case ({@code "userId"} becomes {@code
   * "user_id"}, {@code "HTTPServer"} becomes {@code "http_server"}). Underscores and digits are
   * kept as they are.
   */
  public static String snakeCase(String name) {
    StringBuilder sb = new StringBuilder(name.length() + 4);
    for (int i = 0; i < name.length(); i++) {
      char c = name.charAt(i);
      if (Character.isUpperCase(c)) {
        boolean afterLowerOrDigit =
            i > 0
                && (Character.isLowerCase(name.charAt(i - 1))
                    || Character.isDigit(name.charAt(i - 1)));
        boolean endOfAcronym =
            i > 0
                && Character.isUpperCase(name.charAt(i - 1))
                && i + 1 < name.length()
                && Character.isLowerCase(name.charAt(i + 1));
        if ((afterLowerOrDigit || endOfAcronym) && sb.length() > 0 && !endsWith(sb, '_')) {
          sb.append('_');
        }
        sb.append(Character.toLowerCase(c));
      } else {
        sb.append(c);
      }
    }
    return sb.toString();
  }

  private static boolean endsWith(StringBuilder sb, char c) {
    return sb.charAt(sb.length() - 1) == c;
  }

  /** Appends an underscore to reserved words ({@code end} becomes {@code end_}). */
  public static String escapeReserved(String name) {
    return RESERVED.contains(name) ? name + "_" : name;
  }

  /**
   * Returns the Elixir variable name for a source variable. A referenced variable must not start
   * with an underscore (Elixir would warn on each use), so leading underscores are stripped; a name
   * that would then be empty or start with a digit gets a {@code v} prefix.
   */
  public static String variableName(String sourceName) {
    Preconditions.checkArgument(!sourceName.isEmpty());
    String name = snakeCase(sourceName);
    int start = 0;
    while (start < name.length() && name.charAt(start) == '_') {
      start++;
    }
    name = name.substring(start);
    if (name.isEmpty() || Character.isDigit(name.charAt(0))) {
      name = "v" + name;
    }
    return escapeReserved(name);
  }

  /**
   * Returns the name marking a binding as intentionally unused: {@code _name}. Names that already
   * start with an underscore are returned unchanged.
   */
  public static String unusedName(String name) {
    return name.startsWith("_") ? name : "_" + name;
  }

  /** Returns the atom name for a constructor ({@code "NotFound"} becomes {@code "not_found"}). */
  public static String atomName(String name) {
    return snakeCase(name);
  }

  /** Returns the Elixir function name for a source method name. */
  public static String functionName(String name) {
    return escapeReserved(snakeCase(name));
  }
}
