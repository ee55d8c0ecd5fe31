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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.List;

/**
 * The declaration of a tagged union (an enum whose constructors may take positional parameters),
 * as resolved by the front end.
 *
 * <p>Constructors are identified by their index, which is the value the front end stores as the
 * tag of each value (see {@link TypedExpr.EnumIndex}).
 */
public final class EnumDecl {
  public final String name;
  public final ImmutableList<Ctor> ctors;

  private EnumDecl(String name, ImmutableList<Ctor> ctors) {
    this.name = name;
    this.ctors = ctors;
  }

  /** One constructor of a tagged union. */
  public static final class Ctor {
    public final String name;
    public final int index;

    /** The parameter names from the declaration; only used for documentation and diagnostics. */
    public final ImmutableList<String> paramNames;

    private Ctor(String name, int index, ImmutableList<String> paramNames) {
      this.name = name;
      this.index = index;
      this.paramNames = paramNames;
    }

    public int arity() {
      return paramNames.size();
    }

    @Override
    public String toString() {
      return paramNames.isEmpty() ? name : name + "(" + String.join(", ", paramNames) + ")";
    }
  }

  /** Returns the constructor with the given index. */
  public Ctor ctor(int index) {
    Preconditions.checkElementIndex(index, ctors.size(), "constructor index");
    return ctors.get(index);
  }

  /** Returns the constructor with the given name, or throws if there is none. */
  public Ctor ctor(String ctorName) {
    for (Ctor ctor : ctors) {
      if (ctor.name.equals(ctorName)) {
        return ctor;
      }
    }
    throw new IllegalArgumentException(String.format("%s has no constructor %s", name, ctorName));
  }

  @Override
  public String toString() {
    return name;
  }

  public static Builder builder(String name) {
    return new Builder(name);
  }

  /** Adds constructors in index order. */
  public static final class Builder {
    private final String name;
    private final List<Ctor> ctors = new ArrayList<>();

    private Builder(String name) {
      this.name = name;
    }

    @CanIgnoreReturnValue
    public Builder ctor(String ctorName, String... paramNames) {
      ctors.add(new Ctor(ctorName, ctors.size(), ImmutableList.copyOf(paramNames)));
      return this;
    }

    public EnumDecl build() {
      Preconditions.checkState(!ctors.isEmpty(), "%s has no constructors", name);
      return new EnumDecl(name, ImmutableList.copyOf(ctors));
    }
  }
}
