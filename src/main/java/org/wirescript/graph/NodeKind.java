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

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * A NodeKind is the tag that selects the handler for a node. NodeKinds are interned, so they may be
 * compared with {@code ==}; new kinds may be created at any time with {@link #of}, but a handler
 * for them must be registered before compilation begins.
 */
public final class NodeKind {

  private static final ConcurrentMap<String, NodeKind> KINDS = new ConcurrentHashMap<>();

  // Kinds with structural meaning to the compiler.

  /** The single entry point of a function graph; defines the parameters. */
  public static final NodeKind FUNCTION_ENTRY = of("FunctionEntry");

  /** A return point of a function graph; defines the results. */
  public static final NodeKind FUNCTION_RESULT = of("FunctionResult");

  /** An entry point of an event page. */
  public static final NodeKind EVENT = of("Event");

  /** A call to a macro graph; replaced by a copy of the macro's body. */
  public static final NodeKind MACRO_INSTANCE = of("MacroInstance");

  /** A user-collapsed region; replaced by the contents of its bound graph. */
  public static final NodeKind COMPOSITE = of("Composite");

  /** One boundary of a macro body or collapsed region. */
  public static final NodeKind TUNNEL = of("Tunnel");

  /** A reroute node with a single input and a single output. */
  public static final NodeKind KNOT = of("Knot");

  public static final NodeKind COMMENT = of("Comment");

  /** Marks where execution crosses into or out of an inlined macro body. */
  public static final NodeKind TUNNEL_BOUNDARY = of("TunnelBoundary");

  // Standard behavioral kinds.

  public static final NodeKind CALL_FUNCTION = of("CallFunction");
  public static final NodeKind BRANCH = of("Branch");
  public static final NodeKind SEQUENCE = of("Sequence");
  public static final NodeKind VARIABLE_GET = of("VariableGet");
  public static final NodeKind VARIABLE_SET = of("VariableSet");
  public static final NodeKind LITERAL = of("Literal");
  public static final NodeKind MAKE_ARRAY = of("MakeArray");
  public static final NodeKind ENUM_LITERAL = of("EnumLiteral");

  /** Copies event parameters into the event graph's shared storage. */
  public static final NodeKind ASSIGN_EVENT_PARAMS = of("AssignEventParams");

  /** Calls the consolidated event graph at a dispatch offset. */
  public static final NodeKind CALL_EVENT_GRAPH = of("CallEventGraph");

  public final String name;

  private NodeKind(String name) {
    this.name = name;
  }

  /** Returns the NodeKind with the given name, creating it if necessary. */
  public static NodeKind of(String name) {
    return KINDS.computeIfAbsent(name, NodeKind::new);
  }

  /** Returns true for the kinds that the expander eliminates. */
  public boolean isExpandable() {
    return this == MACRO_INSTANCE || this == COMPOSITE || this == TUNNEL || this == KNOT;
  }

  @Override
  public String toString() {
    return name;
  }
}
