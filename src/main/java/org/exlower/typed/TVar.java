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

/**
 * A variable resolved by the front end. Each declaration gets a distinct {@code id}; every
 * reference to the variable ({@link TypedExpr.Local}) points at the same TVar.
 *
 * <p>{@code generated} is true for temporaries the front end introduced itself (loop counters,
 * enum parameter extractions, accumulators); these have no meaning in the user's source.
 */
public final class TVar {
  public final int id;
  public final String name;
  public final TypeRef type;
  public final boolean generated;

  public TVar(int id, String name, TypeRef type, boolean generated) {
    this.id = id;
    this.name = name;
    this.type = type;
    this.generated = generated;
  }

  @Override
  public String toString() {
    return name + "#" + id;
  }

  /** Allocates TVars with distinct ids, in the way a front end numbers the variables of a unit. */
  public static final class Factory {
    private int nextId;

    public Factory() {
      this(1);
    }

    public Factory(int firstId) {
      this.nextId = firstId;
    }

    /** Returns a new variable that appeared in the user's source. */
    public TVar user(String name, TypeRef type) {
      return new TVar(nextId++, name, type, false);
    }

    /** Returns a new compiler-generated temporary. */
    public TVar temp(String name, TypeRef type) {
      return new TVar(nextId++, name, type, true);
    }
  }
}
