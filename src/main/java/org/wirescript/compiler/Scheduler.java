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
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;
import org.jspecify.annotations.Nullable;
import org.wirescript.graph.Graph;
import org.wirescript.graph.Node;
import org.wirescript.graph.Port;

/**
 * Orders the nodes of a pruned, expanded graph for execution, and then (once each node's
 * statements have been generated) moves the statements of pure nodes to just before each of the
 * non-pure nodes that consume them.
 *
 * <p>The order is a topological sort over both control and data edges. When more than one node is
 * ready, the entry node is chosen first and then the node with the lowest id (i.e. the earliest
 * authored), so the order is stable for a given graph.
 */
final class Scheduler {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  // Static methods only
  private Scheduler() {}

  /**
   * Returns every node of {@code graph} in an order consistent with its control and data edges. If
   * the graph has a cycle, logs an error and returns only the nodes that could be ordered.
   */
  static ImmutableList<Node> schedule(Graph graph, @Nullable Node entry, MessageLog log) {
    Map<Node, Integer> unscheduledPredecessors = new HashMap<>();
    for (Node node : graph.nodes()) {
      unscheduledPredecessors.put(node, 0);
    }
    for (Node node : graph.nodes()) {
      for (Node successor : successors(graph, node)) {
        unscheduledPredecessors.merge(successor, 1, Integer::sum);
      }
    }
    Comparator<Node> order =
        Comparator.comparing((Node n) -> n != entry).thenComparingInt(n -> n.id);
    PriorityQueue<Node> ready = new PriorityQueue<>(order);
    unscheduledPredecessors.forEach(
        (node, count) -> {
          if (count == 0) {
            ready.add(node);
          }
        });
    List<Node> result = new ArrayList<>(graph.size());
    while (!ready.isEmpty()) {
      Node node = ready.poll();
      result.add(node);
      for (Node successor : successors(graph, node)) {
        if (unscheduledPredecessors.merge(successor, -1, Integer::sum) == 0) {
          ready.add(successor);
        }
      }
    }
    if (result.size() != graph.size()) {
      Node first =
          graph.nodes().stream()
              .filter(n -> !result.contains(n))
              .findFirst()
              .orElseThrow();
      log.error(
          Diagnostic.Kind.STRUCTURAL,
          first,
          "Cycle detected: %d nodes, including %s, depend on their own results",
          graph.size() - result.size(),
          first.title());
    }
    logger.atFine().log("Scheduled %d nodes of %s", result.size(), graph);
    return ImmutableList.copyOf(result);
  }

  /**
   * Returns the nodes that must be scheduled after {@code node}: the targets of its control
   * outputs and the consumers of its data outputs. A node linked more than once is returned once
   * per link, matching how predecessors are counted.
   */
  private static List<Node> successors(Graph graph, Node node) {
    List<Node> result = new ArrayList<>();
    for (Port output : node.ports()) {
      if (output.isOutput()) {
        for (Port target : output.links()) {
          if (graph.contains(target.node) && target.node != node) {
            result.add(target.node);
          }
        }
      }
    }
    return result;
  }

  /**
   * Given a context whose scheduled nodes have all generated their statements, removes the pure
   * nodes from the schedule and prepends a copy of each pure node's statements to every non-pure
   * node that needs its value (directly or through other pure nodes). Sets the context's linear
   * execution list.
   */
  static void inlinePureNodes(FunctionContext context) {
    Map<Node, Integer> position = new HashMap<>();
    for (int i = 0; i < context.schedule.size(); i++) {
      position.put(context.schedule.get(i), i);
    }
    // For each consumer, the pure nodes whose statements must precede it
    Map<Node, Set<Node>> needed = new HashMap<>();
    ImmutableList.Builder<Node> linear = ImmutableList.builder();
    for (Node node : context.schedule) {
      if (!context.handlers.isPure(node)) {
        linear.add(node);
        continue;
      }
      Set<Node> antecedents = needed.remove(node);
      for (Port output : node.dataOutputs()) {
        for (Port consumer : output.links()) {
          if (!position.containsKey(consumer.node)) {
            continue;
          }
          Set<Node> consumerNeeds =
              needed.computeIfAbsent(consumer.node, k -> new LinkedHashSet<>());
          consumerNeeds.add(node);
          if (antecedents != null) {
            consumerNeeds.addAll(antecedents);
          }
        }
      }
    }
    context.linearExecutionList = linear.build();
    int copied = 0;
    for (Node consumer : context.linearExecutionList) {
      Set<Node> antecedents = needed.get(consumer);
      if (antecedents == null) {
        continue;
      }
      List<Statement> prefix = new ArrayList<>();
      antecedents.stream()
          .sorted(Comparator.comparing(position::get))
          .forEach(pure -> prefix.addAll(context.statementsFor(pure)));
      List<Statement> own =
          context.statementsPerNode.computeIfAbsent(consumer, k -> new ArrayList<>());
      own.addAll(0, prefix);
      copied += prefix.size();
    }
    for (Node node : context.schedule) {
      if (context.handlers.isPure(node)) {
        context.statementsPerNode.remove(node);
      }
    }
    logger.atFine().log(
        "%s: %d nodes in the linear execution list, %d pure statements inlined",
        context.name,
        context.linearExecutionList.size(),
        copied);
  }
}
