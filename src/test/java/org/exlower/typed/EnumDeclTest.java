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


package org.exlower.typed;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class EnumDeclTest {

  private static final EnumDecl SHAPE =
      EnumDecl.builder("Shape")
          .ctor("Circle", "radius")
          .ctor("Rect", "w", "h")
          .ctor("Empty")
          .build();

  @Test
  public void constructorsInIndexOrder() {
    assertThat(SHAPE.ctors).hasSize(3);
    assertThat(SHAPE.ctor(1).name).isEqualTo("Rect");
    assertThat(SHAPE.ctor("Rect").index).isEqualTo(1);
    assertThat(SHAPE.ctor("Rect").arity()).isEqualTo(2);
    assertThat(SHAPE.ctor("Empty").arity()).isEqualTo(0);
    assertThat(SHAPE.ctor(1).toString()).isEqualTo("Rect(w, h)");
    assertThat(SHAPE.ctor(2).toString()).isEqualTo("Empty");
  }

  @Test
  public void unknownConstructor() {
    IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class, () -> SHAPE.ctor("Triangle"));
    assertThat(e).hasMessageThat().isEqualTo("Shape has no constructor Triangle");
    assertThrows(IndexOutOfBoundsException.class, () -> SHAPE.ctor(3));
  }

  @Test
  public void emptyDeclaration() {
    IllegalStateException e =
        assertThrows(IllegalStateException.class, () -> EnumDecl.builder("Never").build());
    assertThat(e).hasMessageThat().isEqualTo("Never has no constructors");
  }

  @Test
  public void variablesAreDistinctByIdentity() {
    TVar.Factory vars = new TVar.Factory();
    TVar a = vars.user("a", TypeRef.INT);
    TVar b = vars.user("a", TypeRef.INT);
    assertThat(a).isNotEqualTo(b);
    assertThat(a.id).isNotEqualTo(b.id);
    assertThat(a.generated).isFalse();
    assertThat(vars.temp("_g", TypeRef.INT).generated).isTrue();
  }
}
