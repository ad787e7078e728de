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
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.wirescript.graph.Graph;
import org.wirescript.graph.Node;
import org.wirescript.graph.NodeKind;
import org.wirescript.graph.Port;
import org.wirescript.util.IndexSet;

/**
 * Removes the nodes of a graph that can never execute, in two passes:
 *
 * <ol>
 *   <li>Control reachability: a depth-first walk along control outputs from the root set. Every
 *       non-pure node that is not visited is removed, unless its handler asks to keep it.
 *   <li>Data reachability: a backwards walk along data inputs from the visited non-pure nodes,
 *       through pure nodes only. Every pure node that was neither visited by the first pass nor
 *       reached by this one is removed, even if it is connected to something, since its value is
 *       never consumed by anything that runs.
 * </ol>
 *
 * <p>A removed non-pure node whose outputs were read by a surviving node is reported with a warning
 * (the surviving node will read the default value instead), as is a removed function result.
 */
public final class Pruner {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final HandlerRegistry handlers;
  private final CompileOptions options;
  private final MessageLog log;

  public Pruner(HandlerRegistry handlers, CompileOptions options, MessageLog log) {
    this.handlers = handlers;
    this.options = options;
    this.log = log;
  }

  private boolean isPure(Node node) {
    return handlers.isPure(node);
  }

  private boolean forceKeep(Node node) {
    NodeHandler handler = handlers.find(node.kind);
    return handler != null && handler.forceKeep(node, options);
  }

  /**
   * Returns the nodes of {@code graph} that are reachable by definition: those whose handler
   * declares them a root and, if {@code includePotentialRoots} is true, non-pure nodes with no
   * control input (which could not otherwise be reached).
   */
  public ImmutableList<Node> gatherRootSet(Graph graph, boolean includePotentialRoots) {
    ImmutableList.Builder<Node> roots = ImmutableList.builder();
    for (Node node : graph.nodes()) {
      NodeHandler handler = handlers.find(node.kind);
      if (handler != null && handler.isRoot(node)) {
        roots.add(node);
      } else if (includePotentialRoots && !isPure(node) && node.controlInputs().isEmpty()) {
        roots.add(node);
      }
    }
    return roots.build();
  }

  /**
   * Removes every node of {@code graph} not reachable from {@code roots}; returns the removed
   * nodes in graph order.
   */
  public ImmutableList<Node> prune(Graph graph, Collection<Node> roots) {
    IndexSet visited = visitControlFlow(graph, roots);
    List<Node> toRemove = new ArrayList<>();
    // Inputs of other nodes that read from a removed non-pure node, and the node they read from.
    Map<Port, Node> readAsDefault = new LinkedHashMap<>();
    for (Node node : graph.nodes()) {
      if (visited.contains(node.id) || isPure(node) || forceKeep(node)) {
        continue;
      }
      if (!node.hasControlPorts()) {
        log.warning(
            node,
            "%s is not pure but has no control pins, so it can never run; it will be removed",
            node.title());
      } else if (node.kind == NodeKind.FUNCTION_RESULT) {
        boolean connected = node.controlInputs().stream().anyMatch(Port::isLinked);
        log.warning(
            node,
            "%s will never be executed: %s",
            node.title(),
            connected ? "it is unreachable" : "its exec pin is not connected");
      }
      toRemove.add(node);
      for (Port output : node.dataOutputs()) {
        for (Port consumer : output.links()) {
          readAsDefault.putIfAbsent(consumer, node);
        }
      }
    }
    IndexSet live = visitDataFlow(graph, visited);
    for (Node node : graph.nodes()) {
      if (isPure(node)
          && !visited.contains(node.id)
          && !live.contains(node.id)
          && !forceKeep(node)) {
        toRemove.add(node);
      }
    }
    graph.removeAll(toRemove);
    readAsDefault.forEach(
        (consumer, removed) -> {
          if (graph.contains(consumer.node)) {
            log.warningAt(
                consumer,
                "%s was pruned because it is unreachable; %s will read the default value instead",
                removed.title(),
                consumer.name);
          }
        });
    if (!toRemove.isEmpty()) {
      logger.atFine().log(
          "Pruned %d of %d nodes from %s", toRemove.size(), graph.size() + toRemove.size(), graph);
    }
    return toRemove.stream()
        .sorted((a, b) -> Integer.compare(a.id, b.id))
        .collect(ImmutableList.toImmutableList());
  }

  /** Gathers the root set (including potential roots) and prunes the graph. */
  public ImmutableList<Node> prune(Graph graph) {
    return prune(graph, gatherRootSet(graph, true));
  }

  /** Returns the ids of the nodes reachable from {@code roots} along control outputs. */
  private static IndexSet visitControlFlow(Graph graph, Collection<Node> roots) {
    IndexSet.Builder visited = new IndexSet.Builder();
    Deque<Node> pending = new ArrayDeque<>(roots);
    while (!pending.isEmpty()) {
      Node node = pending.pop();
      if (!visited.add(node.id)) {
        continue;
      }
      for (Port output : node.controlOutputs()) {
        for (Port target : output.links()) {
          if (graph.contains(target.node)) {
            pending.push(target.node);
          }
        }
      }
    }
    return visited.build();
  }

  /**
   * Returns the ids of the pure nodes that feed (directly or through other pure nodes) a data input
   * of a visited non-pure node.
   */
  private IndexSet visitDataFlow(Graph graph, IndexSet visited) {
    IndexSet.Builder live = new IndexSet.Builder();
    Deque<Node> pending = new ArrayDeque<>();
    for (Node node : graph.nodes()) {
      if (visited.contains(node.id) && !isPure(node)) {
        pending.push(node);
      }
    }
    while (!pending.isEmpty()) {
      Node node = pending.pop();
      for (Port input : node.dataInputs()) {
        for (Port source : input.links()) {
          Node producer = source.node;
          if (graph.contains(producer) && isPure(producer) && live.add(producer.id)) {
            pending.push(producer);
          }
        }
      }
    }
    return live.build();
  }
}
