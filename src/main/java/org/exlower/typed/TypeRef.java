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
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * The statically resolved type of a typed node. The lowering only needs to distinguish a handful of
 * type families (e.g. to choose {@code <>} over {@code +}, or to find the constructors of a tagged
 * union), so this is a deliberately small model of whatever the front end resolved.
 */
public final class TypeRef {

  /** The families of types that the lowering distinguishes. */
  public enum Kind {
    INT,
    FLOAT,
    STRING,
    BOOL,
    VOID,
    DYNAMIC,
    ARRAY,
    MAP,
    ENUM,
    CLASS,
    FUNCTION,
    ITERATOR
  }

  public static final TypeRef INT = new TypeRef(Kind.INT, null, null, null, null);
  public static final TypeRef FLOAT = new TypeRef(Kind.FLOAT, null, null, null, null);
  public static final TypeRef STRING = new TypeRef(Kind.STRING, null, null, null, null);
  public static final TypeRef BOOL = new TypeRef(Kind.BOOL, null, null, null, null);
  public static final TypeRef VOID = new TypeRef(Kind.VOID, null, null, null, null);
  public static final TypeRef DYNAMIC = new TypeRef(Kind.DYNAMIC, null, null, null, null);
  public static final TypeRef FUNCTION = new TypeRef(Kind.FUNCTION, null, null, null, null);

  public final Kind kind;

  /** The element type of an ARRAY or ITERATOR, or the value type of a MAP. */
  private final @Nullable TypeRef element;

  /** The key type of a MAP. */
  private final @Nullable TypeRef key;

  private final @Nullable EnumDecl enumDecl;

  private final @Nullable String className;

  private TypeRef(
      Kind kind,
      @Nullable TypeRef element,
      @Nullable TypeRef key,
      @Nullable EnumDecl enumDecl,
      @Nullable String className) {
    this.kind = kind;
    this.element = element;
    this.key = key;
    this.enumDecl = enumDecl;
    this.className = className;
  }

  public static TypeRef array(TypeRef element) {
    return new TypeRef(Kind.ARRAY, element, null, null, null);
  }

  public static TypeRef iterator(TypeRef element) {
    return new TypeRef(Kind.ITERATOR, element, null, null, null);
  }

  public static TypeRef map(TypeRef key, TypeRef value) {
    return new TypeRef(Kind.MAP, value, key, null, null);
  }

  public static TypeRef enumType(EnumDecl decl) {
    return new TypeRef(Kind.ENUM, null, null, decl, null);
  }

  public static TypeRef classType(String name) {
    return new TypeRef(Kind.CLASS, null, null, null, name);
  }

  public boolean is(Kind kind) {
    return this.kind == kind;
  }

  public boolean isNumeric() {
    return kind == Kind.INT || kind == Kind.FLOAT;
  }

  /** Returns the element type of an array or iterator, or the value type of a map. */
  public TypeRef element() {
    Preconditions.checkState(element != null, "%s has no element type", this);
    return element;
  }

  public TypeRef key() {
    Preconditions.checkState(key != null, "%s has no key type", this);
    return key;
  }

  public EnumDecl enumDecl() {
    Preconditions.checkState(enumDecl != null, "%s is not a tagged union", this);
    return enumDecl;
  }

  /**
   * Returns the name of the module that instance methods of this type are dispatched to, or null
   * if the type has no natural module.
   */
  public @Nullable String moduleName() {
    return switch (kind) {
      case CLASS -> className;
      case ENUM -> enumDecl.name;
      case STRING -> "String";
      case ARRAY -> "Enum";
      case MAP -> "Map";
      default -> null;
    };
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof TypeRef other
        && kind == other.kind
        && Objects.equals(element, other.element)
        && Objects.equals(key, other.key)
        && enumDecl == other.enumDecl
        && Objects.equals(className, other.className);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, element, key, className);
  }

  @Override
  public String toString() {
    return switch (kind) {
      case ARRAY -> "Array<" + element + ">";
      case ITERATOR -> "Iterator<" + element + ">";
      case MAP -> "Map<" + key + ", " + element + ">";
      case ENUM -> enumDecl.name;
      case CLASS -> className;
      default -> kind.name();
    };
  }
}
