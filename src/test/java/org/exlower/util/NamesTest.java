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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import junitparams.JUnitParamsRunner;
import junitparams.Parameters;
import org.junit.Test;
import org.junit.runner.RunWith;

@RunWith(JUnitParamsRunner.class)
public class NamesTest {

  @Test
  @Parameters({
    "userId, user_id",
    "HTTPServer, http_server",
    "already_snake, already_snake",
    "x1Y, x1_y",
    "Ok, ok",
    "_g1, _g1"
  })
  public void snakeCase(String input, String expected) {
    assertThat(Names.snakeCase(input)).isEqualTo(expected);
  }

  @Test
  @Parameters({
    "sum, sum",
    "itemCount, item_count",
    "_g, g",
    "__, v",
    "_1, v1",
    "end, end_",
    "when, when_",
    "fn, fn_"
  })
  public void variableName(String input, String expected) {
    assertThat(Names.variableName(input)).isEqualTo(expected);
  }

  @Test
  public void emptyVariableName() {
    assertThrows(IllegalArgumentException.class, () -> Names.variableName(""));
  }

  @Test
  public void unusedName() {
    assertThat(Names.unusedName("value")).isEqualTo("_value");
    assertThat(Names.unusedName("_value")).isEqualTo("_value");
  }

  @Test
  public void atomAndFunctionNames() {
    assertThat(Names.atomName("NotFound")).isEqualTo("not_found");
    assertThat(Names.functionName("doThing")).isEqualTo("do_thing");
    assertThat(Names.functionName("do")).isEqualTo("do_");
  }
}
