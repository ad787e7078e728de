/*
 * Copyright 2025 The Retrospect Authors
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

package org.wirescript.graph;

import com.google.common.base.Ascii;
import com.google.common.base.Preconditions;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * The type descriptor attached to each Port. The compiler core only relies on equality, on the
 * category (to distinguish control, wildcard, array and enum ports), and on the sub-type name used
 * by struct, enum, object and interface types.
 *
 * <p>PortTypes are immutable.
 */
public final class PortType {

  /** The broad classification of a port type. */
  public enum Category {
    /** A control-flow ("exec") port; carries no value. */
    EXEC,
    /** Not yet determined; must be resolved during expansion. */
    WILDCARD,
    BOOLEAN,
    BYTE,
    INT,
    FLOAT,
    NAME,
    STRING,
    ENUM,
    STRUCT,
    OBJECT,
    INTERFACE;

    /** Returns true if values of this category are references to object instances. */
    public boolean isReference() {
      return this == OBJECT || this == INTERFACE;
    }
  }

  /** How values of the element type are aggregated. */
  public enum Container {
    NONE,
    ARRAY,
    SET,
    MAP
  }

  public static final PortType EXEC = new PortType(Category.EXEC, null, Container.NONE);
  public static final PortType WILDCARD = new PortType(Category.WILDCARD, null, Container.NONE);
  public static final PortType BOOLEAN = new PortType(Category.BOOLEAN, null, Container.NONE);
  public static final PortType INT = new PortType(Category.INT, null, Container.NONE);
  public static final PortType FLOAT = new PortType(Category.FLOAT, null, Container.NONE);
  public static final PortType NAME = new PortType(Category.NAME, null, Container.NONE);
  public static final PortType STRING = new PortType(Category.STRING, null, Container.NONE);

  public final Category category;

  /** The struct, enum, object or interface name; null for the other categories. */
  public final @Nullable String subType;

  public final Container container;

  private PortType(Category category, @Nullable String subType, Container container) {
    Preconditions.checkArgument(
        category != Category.EXEC || container == Container.NONE, "exec ports have no container");
    this.category = category;
    this.subType = subType;
    this.container = container;
  }

  /** Returns a non-container type of the given category. */
  public static PortType of(Category category) {
    return of(category, null);
  }

  /** Returns a non-container type of the given category and sub-type. */
  public static PortType of(Category category, @Nullable String subType) {
    return new PortType(category, subType, Container.NONE);
  }

  /** Returns the type of an enum with the given name. */
  public static PortType enumType(String enumName) {
    return of(Category.ENUM, enumName);
  }

  /** Returns the type of a reference to instances of the given class. */
  public static PortType object(String className) {
    return of(Category.OBJECT, className);
  }

  /** Returns the type of a reference to an implementation of the given interface. */
  public static PortType iface(String interfaceName) {
    return of(Category.INTERFACE, interfaceName);
  }

  /** Returns an array of this type; this must not already be a container. */
  public PortType arrayOf() {
    Preconditions.checkState(container == Container.NONE && category != Category.EXEC);
    return new PortType(category, subType, Container.ARRAY);
  }

  /** Returns a copy of this type with a different container. */
  public PortType withContainer(Container container) {
    return new PortType(category, subType, container);
  }

  /** Returns the non-container type of this type's elements. */
  public PortType elementType() {
    return container == Container.NONE ? this : new PortType(category, subType, Container.NONE);
  }

  public boolean isExec() {
    return category == Category.EXEC;
  }

  public boolean isWildcard() {
    return category == Category.WILDCARD;
  }

  public boolean isArray() {
    return container == Container.ARRAY;
  }

  /**
   * Returns true if this is an enum, or a byte with an enum sub-type (enum values decay to bytes
   * once instantiated).
   */
  public boolean isEnum() {
    return container == Container.NONE
        && (category == Category.ENUM || (category == Category.BYTE && subType != null));
  }

  /**
   * Returns a copy of this type with the element category and sub-type of {@code resolved}, keeping
   * this type's container; used to concretize wildcard ports.
   */
  public PortType resolveWildcard(PortType resolved) {
    Preconditions.checkState(isWildcard());
    return new PortType(resolved.category, resolved.subType, container);
  }

  /**
   * Returns true if a value of this (output) type can be passed to an input of type {@code input}
   * without an explicit conversion node.
   */
  public boolean canConnectTo(PortType input) {
    if (equals(input) || isWildcard() || input.isWildcard()) {
      return true;
    }
    if (container != input.container) {
      return false;
    }
    // Any object or interface reference may be passed where the untyped object is expected;
    // the inverse (interface into object) requires a cast and is reported separately.
    if (category == Category.OBJECT && input.category == Category.OBJECT) {
      return input.subType == null || Objects.equals(subType, input.subType);
    }
    return category == Category.BYTE
        && input.category == Category.ENUM
        && Objects.equals(subType, input.subType);
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof PortType other
        && category == other.category
        && container == other.container
        && Objects.equals(subType, other.subType);
  }

  @Override
  public int hashCode() {
    return Objects.hash(category, subType, container);
  }

  @Override
  public String toString() {
    String base = Ascii.toLowerCase(category.name());
    if (subType != null) {
      base = base + "<" + subType + ">";
    }
    return switch (container) {
      case NONE -> base;
      case ARRAY -> base + "[]";
      case SET -> "set<" + base + ">";
      case MAP -> "map<" + base + ">";
    };
  }
}
