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

package org.wirescript.nodes;

import com.google.common.base.Preconditions;
import org.jspecify.annotations.Nullable;
import org.wirescript.graph.Graph;
import org.wirescript.graph.Node;
import org.wirescript.graph.NodeKind;
import org.wirescript.graph.Port;
import org.wirescript.graph.PortType;

/**
 * Creates nodes of the standard kinds, with the ports their handlers expect. Used both by the
 * compiler (for the nodes it synthesizes) and by anything that builds graphs programmatically.
 */
public class Nodes {

  // Port names
  public static final String EXEC = "exec";
  public static final String THEN = "then";
  public static final String ELSE = "else";
  public static final String CONDITION = "Condition";
  public static final String VALUE = "value";
  public static final String ARRAY = "array";
  public static final String ENUM = "Enum";
  public static final String ENTRY_POINT = "EntryPoint";

  // Property keys
  public static final String FUNCTION = "function";
  public static final String VARIABLE = "variable";
  public static final String EVENT_NAME = "event";
  public static final String TUNNEL_SIDE = "side";

  /** Value of {@link #TUNNEL_SIDE} for the tunnel through which execution enters a body. */
  public static final String ENTRY_SIDE = "entry";

  /** Value of {@link #TUNNEL_SIDE} for the tunnel through which execution leaves a body. */
  public static final String EXIT_SIDE = "exit";

  // Static methods only
  private Nodes() {}

  private static Node withExec(Node node, boolean in, boolean out) {
    if (in) {
      node.addInput(EXEC, PortType.EXEC);
    }
    if (out) {
      node.addOutput(THEN, PortType.EXEC);
    }
    return node;
  }

  /** A function entry; add a data output for each parameter. */
  public static Node entry(Graph graph) {
    return withExec(graph.addNode(NodeKind.FUNCTION_ENTRY, graph.name), false, true);
  }

  /** A function result; add a data input for each result. */
  public static Node result(Graph graph) {
    return withExec(graph.addNode(NodeKind.FUNCTION_RESULT, "Return"), true, false);
  }

  /** An event; add a data output for each parameter. */
  public static Node event(Graph graph, String eventName) {
    Node node = graph.addNode(NodeKind.EVENT, eventName);
    node.setProperty(EVENT_NAME, eventName);
    return withExec(node, false, true);
  }

  /** A non-pure call; add a data input for each argument and a data output for each result. */
  public static Node call(Graph graph, String function) {
    Node node = graph.addNode(NodeKind.CALL_FUNCTION, function);
    node.setProperty(FUNCTION, function);
    return withExec(node, true, true);
  }

  /** A pure call, with no control pins. */
  public static Node pureCall(Graph graph, String function) {
    Node node = graph.addNode(NodeKind.CALL_FUNCTION, function);
    return node.setProperty(FUNCTION, function).setPure(true);
  }

  public static Node branch(Graph graph) {
    Node node = withExec(graph.addNode(NodeKind.BRANCH, "Branch"), true, true);
    node.addInput(CONDITION, PortType.BOOLEAN);
    node.addOutput(ELSE, PortType.EXEC);
    return node;
  }

  /** A node that runs each of its {@code count} outputs in turn. */
  public static Node sequence(Graph graph, int count) {
    Preconditions.checkArgument(count > 0);
    Node node = withExec(graph.addNode(NodeKind.SEQUENCE, "Sequence"), true, false);
    for (int i = 0; i < count; i++) {
      node.addOutput(sequenceOutput(i), PortType.EXEC);
    }
    return node;
  }

  public static String sequenceOutput(int i) {
    return THEN + "_" + i;
  }

  public static Node variableGet(Graph graph, String variable, PortType type) {
    Node node = graph.addNode(NodeKind.VARIABLE_GET, variable);
    node.setProperty(VARIABLE, variable).setPure(true);
    node.addOutput(VALUE, type);
    return node;
  }

  public static Node variableSet(Graph graph, String variable, PortType type) {
    Node node = withExec(graph.addNode(NodeKind.VARIABLE_SET, "Set " + variable), true, true);
    node.setProperty(VARIABLE, variable);
    node.addInput(VALUE, type);
    return node;
  }

  /** A pure node producing a constant. */
  public static Node literal(Graph graph, PortType type, String value) {
    Node node = graph.addNode(NodeKind.LITERAL, value).setPure(true);
    node.setProperty(VALUE, value);
    node.addOutput(VALUE, type);
    return node;
  }

  /** A pure node producing an array of its {@code size} inputs. */
  public static Node makeArray(Graph graph, PortType elementType, int size) {
    Node node = graph.addNode(NodeKind.MAKE_ARRAY, "Make Array").setPure(true);
    for (int i = 0; i < size; i++) {
      node.addInput("[" + i + "]", elementType);
    }
    node.addOutput(ARRAY, elementType.arrayOf());
    return node;
  }

  /** A pure node producing an enum value, given as the default of its input. */
  public static Node enumLiteral(Graph graph, PortType enumType, @Nullable String value) {
    Node node = graph.addNode(NodeKind.ENUM_LITERAL, "Literal " + enumType.subType).setPure(true);
    node.addInput(ENUM, enumType).setDefaultValue(value);
    node.addOutput(VALUE, enumType);
    return node;
  }

  public static Node comment(Graph graph, String text) {
    return graph.addNode(NodeKind.COMMENT, text).setPure(true);
  }

  /** A reroute node passing through a value (or execution, if {@code type} is EXEC). */
  public static Node knot(Graph graph, PortType type) {
    Node node = graph.addNode(NodeKind.KNOT, "Reroute");
    node.addInput("in", type);
    node.addOutput("out", type);
    return node.setPure(!type.isExec());
  }

  /** The tunnel through which a macro or composite body is entered; add outputs. */
  public static Node entryTunnel(Graph body) {
    return body.addNode(NodeKind.TUNNEL, "Inputs").setProperty(TUNNEL_SIDE, ENTRY_SIDE);
  }

  /** The tunnel through which a macro or composite body is left; add inputs. */
  public static Node exitTunnel(Graph body) {
    return body.addNode(NodeKind.TUNNEL, "Outputs").setProperty(TUNNEL_SIDE, EXIT_SIDE);
  }

  /** Returns the tunnel of the given side in {@code body}, or null if there is none. */
  public static @Nullable Node findTunnel(Graph body, String side) {
    for (Node node : body.nodesOfKind(NodeKind.TUNNEL)) {
      if (side.equals(node.property(TUNNEL_SIDE))) {
        return node;
      }
    }
    return null;
  }

  /**
   * An instance of the given macro, with an input for each output of the macro's entry tunnel and
   * an output for each input of its exit tunnel. The instance is pure if the macro has no control
   * pins.
   */
  public static Node macroInstance(Graph graph, Graph macro) {
    return instance(graph.addNode(NodeKind.MACRO_INSTANCE, macro.name), macro);
  }

  /** A collapsed region whose contents are {@code body}; ports are created as for macros. */
  public static Node composite(Graph graph, Graph body) {
    return instance(graph.addNode(NodeKind.COMPOSITE, body.name), body);
  }

  private static Node instance(Node node, Graph body) {
    node.setSubgraph(body);
    Node entry = findTunnel(body, ENTRY_SIDE);
    Node exit = findTunnel(body, EXIT_SIDE);
    boolean hasControl = false;
    if (entry != null) {
      for (Port p : entry.ports()) {
        node.addInput(p.name, p.type());
        hasControl |= p.isControl();
      }
    }
    if (exit != null) {
      for (Port p : exit.ports()) {
        node.addOutput(p.name, p.type());
        hasControl |= p.isControl();
      }
    }
    return node.setPure(!hasControl);
  }

  public static Node tunnelBoundary(Graph graph, String title) {
    return withExec(graph.addNode(NodeKind.TUNNEL_BOUNDARY, title), true, true);
  }

  /** Copies event parameters into shared storage; add an input per parameter. */
  public static Node assignEventParams(Graph graph) {
    return withExec(graph.addNode(NodeKind.ASSIGN_EVENT_PARAMS, "Assign Parameters"), true, true);
  }

  /** Calls the event graph; the dispatch offset is supplied once the event graph is compiled. */
  public static Node callEventGraph(Graph graph, String eventGraph) {
    Node node = withExec(graph.addNode(NodeKind.CALL_EVENT_GRAPH, eventGraph), true, false);
    return node.setProperty(FUNCTION, eventGraph);
  }
}
