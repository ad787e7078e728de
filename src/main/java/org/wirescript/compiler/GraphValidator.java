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

import org.wirescript.graph.Graph;
import org.wirescript.graph.Node;
import org.wirescript.graph.Port;
import org.wirescript.graph.PortType;

/** Checks the structural and type rules for pins and links, reporting violations to a log. */
final class GraphValidator {

  // Static methods only
  private GraphValidator() {}

  /**
   * Reports links that leave the graph, or that connect ports which can never be connected (same
   * direction, or control to data). Run on authored graphs before they are cloned.
   */
  static void checkLinks(Graph graph, MessageLog log) {
    for (Node node : graph.nodes()) {
      for (Port port : node.ports()) {
        for (Port other : port.links()) {
          if (!graph.contains(other.node)) {
            log.errorAt(
                Diagnostic.Kind.STRUCTURAL,
                port,
                "%s is connected to %s, which is not part of %s",
                port.name,
                other,
                graph);
          } else if (port.isOutput() && !other.isInput()) {
            log.errorAt(
                Diagnostic.Kind.STRUCTURAL,
                port,
                "%s is connected to %s, which is also an output",
                port.name,
                other);
          } else if (port.isOutput() && port.isControl() != other.isControl()) {
            log.errorAt(
                Diagnostic.Kind.STRUCTURAL,
                port,
                "%s connects a control pin to a data pin (%s)",
                port.name,
                other);
          } else if (port.isInput() && !other.isOutput()) {
            log.errorAt(
                Diagnostic.Kind.STRUCTURAL,
                port,
                "%s is connected to %s, which is also an input",
                port.name,
                other);
          }
        }
      }
    }
  }

  /**
   * Checks each node of a pruned, expanded graph: fan-out of control outputs, fan-in of data
   * inputs, the types on each link, and that no wildcard remains.
   */
  static void checkPins(Graph graph, MessageLog log) {
    for (Node node : graph.nodes()) {
      if (node.isDeprecated()) {
        log.warning(node, "%s is deprecated", node.title());
      }
      for (Port port : node.ports()) {
        checkPin(port, log);
      }
    }
  }

  private static void checkPin(Port port, MessageLog log) {
    int links = port.links().size();
    if (port.isControl()) {
      if (port.isOutput() && links > 1) {
        log.errorAt(
            Diagnostic.Kind.STRUCTURAL,
            port,
            "Exec output pin %s cannot have more than one connection",
            port.name);
      }
      return;
    }
    if (port.isInput() && links > 1) {
      log.errorAt(
          Diagnostic.Kind.STRUCTURAL,
          port,
          "Input pin %s cannot have more than one connection",
          port.name);
    }
    if (port.type().isWildcard()) {
      log.errorAt(Diagnostic.Kind.TYPE, port, "The type of %s is undetermined", port.name);
      return;
    }
    if (port.isOutput()) {
      for (Port input : port.links()) {
        checkLinkTypes(port, input, log);
      }
    }
  }

  private static void checkLinkTypes(Port output, Port input, MessageLog log) {
    PortType from = output.type();
    PortType to = input.type();
    if (from.category == PortType.Category.INTERFACE
        && to.category == PortType.Category.OBJECT
        && from.container == to.container) {
      log.errorAt(
          Diagnostic.Kind.TYPE,
          input,
          "%s is an interface and cannot be connected to the object pin %s; use an explicit cast"
              + " node",
          output,
          input.name);
    } else if (!from.canConnectTo(to)) {
      log.errorAt(
          Diagnostic.Kind.TYPE,
          input,
          "Cannot connect %s (%s) to %s (%s)",
          output,
          from,
          input.name,
          to);
    }
  }
}
