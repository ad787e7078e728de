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

import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import org.jspecify.annotations.Nullable;
import org.wirescript.graph.Graph;
import org.wirescript.graph.Node;
import org.wirescript.graph.NodeKind;
import org.wirescript.graph.Port;
import org.wirescript.graph.PortType;
import org.wirescript.graph.Provenance;
import org.wirescript.nodes.Nodes;

/**
 * Replaces macro instances, composites, tunnels and knots with the nodes they stand for.
 *
 * <p>Expansion proceeds in rounds: each round expands every expandable node currently in the graph,
 * and may introduce new ones (a macro whose body contains another macro instance). Rounds are
 * repeated until none remain, or until {@link CompileOptions#maxExpansionIterations} rounds have
 * run or the graph has grown past {@link CompileOptions#maxNodeCount} nodes, which is reported as
 * a recursive expansion.
 *
 * <p>Every node added to the graph is attributed (in the {@link Provenance}) to the instance whose
 * expansion produced it.
 */
public final class Expander {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final CompileOptions options;
  private final MessageLog log;
  private final Provenance provenance;

  public Expander(CompileOptions options, MessageLog log) {
    this.options = options;
    this.log = log;
    this.provenance = log.provenance();
  }

  /**
   * Expands {@code graph} in place. Returns true if it now contains no expandable nodes; returns
   * false (after logging an error) if expansion failed.
   */
  public boolean expand(Graph graph) {
    int errorsBefore = log.numErrors();
    for (int round = 1; ; round++) {
      ImmutableList<Node> pending =
          graph.nodes().stream()
              .filter(n -> n.kind.isExpandable())
              .collect(ImmutableList.toImmutableList());
      if (pending.isEmpty()) {
        return true;
      } else if (round > options.maxExpansionIterations || graph.size() > options.maxNodeCount) {
        Node culprit =
            pending.stream()
                .filter(n -> n.kind == NodeKind.MACRO_INSTANCE || n.kind == NodeKind.COMPOSITE)
                .findFirst()
                .orElse(pending.get(0));
        log.error(
            Diagnostic.Kind.STRUCTURAL,
            culprit,
            "Recursive expansion of %s: still expanding after %d rounds (%d nodes)",
            culprit.title(),
            round - 1,
            graph.size());
        return false;
      }
      logger.atFine().log(
          "Expansion round %d of %s: %d nodes to expand", round, graph, pending.size());
      for (Node node : pending) {
        // Nodes that were part of an expanded instance's boundary may already be gone
        if (!graph.contains(node)) {
          continue;
        }
        if (node.kind == NodeKind.KNOT) {
          collapseKnot(graph, node);
        } else if (node.kind == NodeKind.TUNNEL) {
          log.error(
              Diagnostic.Kind.STRUCTURAL,
              node,
              "Failed to collapse tunnel %s: it is not the boundary of an instance",
              node.title());
          graph.removeNode(node);
        } else {
          expandInstance(graph, node);
        }
      }
      if (log.numErrors() != errorsBefore) {
        return false;
      }
    }
  }

  /** Connects each source of a knot directly to each of its consumers, and removes it. */
  private void collapseKnot(Graph graph, Node knot) {
    Port in = knot.ports().stream().filter(Port::isInput).findFirst().orElse(null);
    Port out = knot.ports().stream().filter(Port::isOutput).findFirst().orElse(null);
    if (in == null || out == null) {
      log.error(Diagnostic.Kind.STRUCTURAL, knot, "Failed to collapse tunnel %s", knot.title());
      graph.removeNode(knot);
      return;
    }
    passThrough(graph, in, out);
    graph.removeNode(knot);
  }

  /**
   * Connects everything linked to {@code in} to everything linked to {@code out}, where {@code in}
   * and {@code out} are two sides of the same pass-through. If {@code in} is an unconnected data
   * port its default value is passed on instead.
   */
  private static void passThrough(Graph graph, Port in, Port out) {
    ImmutableList<Port> upstream = ImmutableList.copyOf(in.links());
    ImmutableList<Port> downstream = ImmutableList.copyOf(out.links());
    graph.disconnect(in);
    graph.disconnect(out);
    for (Port consumer : downstream) {
      if (upstream.isEmpty()) {
        if (consumer.isData() && in.defaultValue() != null && consumer.isInput()) {
          consumer.setDefaultValue(in.defaultValue());
        }
      } else {
        upstream.forEach(producer -> graph.connect(producer, consumer));
      }
    }
  }

  /** Replaces a macro instance or composite with a copy of its body. */
  private void expandInstance(Graph graph, Node instance) {
    Graph body = instance.subgraph();
    if (body == null) {
      log.error(
          Diagnostic.Kind.STRUCTURAL,
          instance,
          "Macro node %s is pointing at an invalid macro graph",
          instance.title());
      graph.removeNode(instance);
      return;
    }
    Node bodyEntry = Nodes.findTunnel(body, Nodes.ENTRY_SIDE);
    Node bodyExit = Nodes.findTunnel(body, Nodes.EXIT_SIDE);
    Graph.Copy copy = graph.copyNodesFrom(body);
    provenance.recordCopy(copy);
    for (Node clone : copy.clones()) {
      provenance.recordCallSite(clone, instance);
    }
    Node entry = (bodyEntry == null) ? null : copy.cloneOf(bodyEntry);
    Node exit = (bodyExit == null) ? null : copy.cloneOf(bodyExit);
    // Any other tunnels in the copy are left for the next round, which reports them.
    boolean isMacro = instance.kind == NodeKind.MACRO_INSTANCE;
    if (isMacro) {
      resolveWildcards(instance, copy.clones());
    }
    if (options.instrumentation) {
      insertBoundaries(graph, instance, entry, exit);
    }
    collapseBoundary(graph, instance, entry, exit);
    if (isMacro) {
      for (Node clone : copy.clones()) {
        if (graph.contains(clone)) {
          synthesizeLiterals(graph, clone, instance);
        }
      }
    }
    logger.atFine().log("Expanded %s into %d nodes", instance, copy.clones().size());
  }

  /**
   * Returns the type that the wildcard ports of {@code instance} take from the ports they are
   * connected to, or null if none of them is connected to a concrete type.
   */
  private static @Nullable PortType resolvedWildcardType(Node instance) {
    for (Port p : instance.ports()) {
      if (p.type().isWildcard()) {
        for (Port other : p.links()) {
          if (!other.type().isWildcard()) {
            return other.type().elementType();
          }
        }
      }
    }
    return null;
  }

  /** Gives the wildcard ports of the instance and of its copied body the resolved type. */
  private static void resolveWildcards(Node instance, ImmutableList<Node> clones) {
    PortType resolved = resolvedWildcardType(instance);
    if (resolved == null) {
      return;
    }
    for (Port p : instance.ports()) {
      if (p.type().isWildcard()) {
        p.setType(p.type().resolveWildcard(resolved));
      }
    }
    for (Node clone : clones) {
      for (Port p : clone.ports()) {
        if (p.type().isWildcard()) {
          p.setType(p.type().resolveWildcard(resolved));
        }
      }
    }
  }

  /**
   * Inserts TunnelBoundary nodes on the control paths into the instance, out of the body's entry
   * tunnel, and into the body's exit tunnel.
   */
  private void insertBoundaries(
      Graph graph, Node instance, @Nullable Node entry, @Nullable Node exit) {
    for (Port p : instance.controlInputs()) {
      Node boundary = addBoundary(graph, instance, "Enter " + instance.title());
      graph.moveLinks(p, boundary.input(Nodes.EXEC));
      graph.connect(boundary.output(Nodes.THEN), p);
    }
    if (entry != null) {
      for (Port p : entry.controlOutputs()) {
        Node boundary = addBoundary(graph, instance, "Begin " + instance.title());
        graph.moveLinks(p, boundary.output(Nodes.THEN));
        graph.connect(p, boundary.input(Nodes.EXEC));
      }
    }
    if (exit != null) {
      for (Port p : exit.controlInputs()) {
        Node boundary = addBoundary(graph, instance, "Leave " + instance.title());
        graph.moveLinks(p, boundary.input(Nodes.EXEC));
        graph.connect(boundary.output(Nodes.THEN), p);
      }
    }
  }

  private Node addBoundary(Graph graph, Node instance, String title) {
    Node boundary = Nodes.tunnelBoundary(graph, title);
    provenance.recordSource(boundary, instance);
    provenance.recordCallSite(boundary, instance);
    return boundary;
  }

  /**
   * Connects the instance's inputs through the body's entry tunnel and the exit tunnel's inputs
   * through the instance's outputs, then removes the instance and both tunnels.
   */
  private void collapseBoundary(
      Graph graph, Node instance, @Nullable Node entry, @Nullable Node exit) {
    for (Port p : instance.ports()) {
      Node tunnel = p.isInput() ? entry : exit;
      Port inner = (tunnel == null) ? null : tunnel.port(p.name, p.direction.opposite());
      if (inner == null) {
        if (p.isLinked()) {
          log.errorAt(
              Diagnostic.Kind.STRUCTURAL,
              p,
              "Failed to collapse tunnel %s: the body has no pin %s",
              instance.title(),
              p.name);
        }
        continue;
      }
      if (p.isInput()) {
        passThrough(graph, p, inner);
      } else {
        passThrough(graph, inner, p);
      }
    }
    graph.removeNode(instance);
    if (entry != null) {
      graph.removeNode(entry);
    }
    if (exit != null) {
      graph.removeNode(exit);
    }
  }

  /**
   * Gives each unconnected array input of {@code node} an empty MakeArray node, and each
   * unconnected enum input with a default an EnumLiteral node.
   */
  private void synthesizeLiterals(Graph graph, Node node, Node instance) {
    if (node.kind == NodeKind.MAKE_ARRAY || node.kind == NodeKind.ENUM_LITERAL) {
      return;
    }
    for (Port input : node.dataInputs()) {
      if (input.isLinked()) {
        continue;
      }
      Node literal;
      Port output;
      if (input.type().isArray()) {
        literal = Nodes.makeArray(graph, input.type().elementType(), 0);
        output = literal.output(Nodes.ARRAY);
      } else if (input.type().isEnum() && input.defaultValue() != null) {
        literal = Nodes.enumLiteral(graph, input.type(), input.defaultValue());
        output = literal.output(Nodes.VALUE);
      } else {
        continue;
      }
      provenance.recordSource(literal, node);
      provenance.recordCallSite(literal, instance);
      graph.connect(output, input);
    }
  }
}
