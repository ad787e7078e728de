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

package org.wirescript.compiler;

import com.google.common.base.Preconditions;
import org.jspecify.annotations.Nullable;
import org.wirescript.graph.Port;
import org.wirescript.graph.PortType;

/**
 * A named value slot backing a data port (or a declared variable). Terms are created when nodes
 * register them, given a storage location by the {@link FunctionAssembler}, and discarded when
 * compilation of their function completes.
 */
public final class Term {

  /** Why the term exists. */
  public enum Role {
    PARAMETER,
    RESULT,
    /** An intermediate value or a declared local variable. */
    LOCAL,
    /** A member variable of the class being compiled (or of its parent). */
    MEMBER,
    /** Storage shared between the event graph and its stubs. */
    EVENT_GRAPH_LOCAL,
    LITERAL
  }

  /** Where the backend should keep the value; assigned during assembly. */
  public enum Storage {
    UNRESOLVED,
    PARAMETER,
    LOCAL,
    /** A (possibly hidden) property of the class. */
    CLASS,
    /** A slot in the event graph's frame that persists across suspension. */
    PERSISTENT_FRAME,
    LITERAL
  }

  public final Role role;

  private String name;

  public final PortType type;

  /** The port whose value this term holds, if any. */
  public final @Nullable Port source;

  /** For LITERAL terms, the value; null means the type's default value. */
  public final @Nullable String literal;

  private Storage storage = Storage.UNRESOLVED;

  /** Position within its storage area; -1 until assigned. */
  private int slot = -1;

  Term(Role role, String name, PortType type, @Nullable Port source, @Nullable String literal) {
    Preconditions.checkArgument(role == Role.LITERAL || literal == null);
    this.role = role;
    this.name = name;
    this.type = type;
    this.source = source;
    this.literal = literal;
    if (role == Role.LITERAL) {
      storage = Storage.LITERAL;
    }
  }

  static Term literal(PortType type, @Nullable String value) {
    return new Term(Role.LITERAL, "", type, null, value);
  }

  public String name() {
    return name;
  }

  void rename(String name) {
    this.name = name;
  }

  public Storage storage() {
    return storage;
  }

  public int slot() {
    return slot;
  }

  void resolve(Storage storage, int slot) {
    this.storage = storage;
    this.slot = slot;
  }

  public boolean isLiteral() {
    return role == Role.LITERAL;
  }

  @Override
  public String toString() {
    if (!isLiteral()) {
      return name;
    } else if (literal == null) {
      return "default";
    }
    return type.category == PortType.Category.STRING ? "\"" + literal + "\"" : literal;
  }
}
