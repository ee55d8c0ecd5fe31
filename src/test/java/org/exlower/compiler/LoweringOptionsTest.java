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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import java.util.Properties;
import junitparams.JUnitParamsRunner;
import junitparams.Parameters;
import org.exlower.compiler.LoweringOptions.UnusedStyle;
import org.junit.Test;
import org.junit.runner.RunWith;

@RunWith(JUnitParamsRunner.class)
public class LoweringOptionsTest {

  private static Properties properties(String... keysAndValues) {
    Properties properties = new Properties();
    for (int i = 0; i < keysAndValues.length; i += 2) {
      properties.setProperty(keysAndValues[i], keysAndValues[i + 1]);
    }
    return properties;
  }

  @Test
  public void defaults() {
    LoweringOptions options = LoweringOptions.DEFAULT;
    assertThat(options.loopIntents).isTrue();
    assertThat(options.comprehensions).isTrue();
    assertThat(options.unrolledLists).isTrue();
    assertThat(options.threadLoopState).isTrue();
    assertThat(options.unusedStyle).isEqualTo(UnusedStyle.PREFIX);
    assertThat(options.maxNodeVisits).isEqualTo(1_000_000);
  }

  @Test
  public void emptyPropertiesGiveDefaults() {
    assertThat(LoweringOptions.fromProperties(new Properties()).toString())
        .isEqualTo(LoweringOptions.DEFAULT.toString());
  }

  @Test
  public void fromProperties() {
    LoweringOptions options =
        LoweringOptions.fromProperties(
            properties(
                "exlower.loopIntents", " FALSE ",
                "exlower.threadLoopState", "false",
                "exlower.unusedStyle", "Wildcard",
                "exlower.maxNodeVisits", "42",
                "unrelated.key", "whatever"));
    assertThat(options.loopIntents).isFalse();
    assertThat(options.comprehensions).isTrue();
    assertThat(options.threadLoopState).isFalse();
    assertThat(options.unusedStyle).isEqualTo(UnusedStyle.WILDCARD);
    assertThat(options.maxNodeVisits).isEqualTo(42);
  }

  @Test
  public void loadResource() {
    LoweringOptions options = LoweringOptions.load("exlower-test.properties");
    assertThat(options.comprehensions).isFalse();
    assertThat(options.unrolledLists).isTrue();
    assertThat(options.unusedStyle).isEqualTo(UnusedStyle.WILDCARD);
    assertThat(options.maxNodeVisits).isEqualTo(5000);
  }

  @Test
  public void missingResource() {
    IllegalArgumentException e =
        assertThrows(
            IllegalArgumentException.class, () -> LoweringOptions.load("no-such.properties"));
    assertThat(e).hasMessageThat().contains("no-such.properties");
  }

  @Test
  @Parameters({
    "exlower.loopIntents, yes",
    "exlower.unusedStyle, underscore",
    "exlower.maxNodeVisits, lots",
    "exlower.maxNodeVisits, 0"
  })
  public void badValue(String key, String value) {
    IllegalArgumentException e =
        assertThrows(
            IllegalArgumentException.class,
            () -> LoweringOptions.fromProperties(properties(key, value)));
    assertThat(e).hasMessageThat().isNotEmpty();
  }

  @Test
  public void toBuilder() {
    LoweringOptions options =
        LoweringOptions.DEFAULT.toBuilder().setUnrolledLists(false).setMaxNodeVisits(10).build();
    assertThat(options.unrolledLists).isFalse();
    assertThat(options.maxNodeVisits).isEqualTo(10);
    assertThat(options.loopIntents).isTrue();
  }
}
