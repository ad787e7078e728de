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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;
import org.jspecify.annotations.Nullable;

/**
 * A Graph owns an ordered sequence of Nodes; each Node owns its Ports, and Ports hold the edges
 * between them.
 *
 * <p>Graphs supplied by the authoring layer are treated as read-only by the compiler, which only
 * mutates private clones (see {@link #cloneGraph}).
 */
public final class Graph {

  public final String name;

  private final List<Node> nodes = new ArrayList<>();

  /** The id that will be assigned to the next node added. */
  private int nextId;

  public Graph(String name) {
    this.name = name;
  }

  /** The nodes of this graph, in the order they were added. */
  public List<Node> nodes() {
    return Collections.unmodifiableList(nodes);
  }

  public int size() {
    return nodes.size();
  }

  /** Returns an upper bound (exclusive) on the ids of this graph's nodes. */
  public int idLimit() {
    return nextId;
  }

  public boolean contains(Node node) {
    return node.graph() == this;
  }

  /** Returns the nodes of the given kind, in order. */
  public ImmutableList<Node> nodesOfKind(NodeKind kind) {
    return nodes.stream().filter(n -> n.kind == kind).collect(ImmutableList.toImmutableList());
  }

  public @Nullable Node findById(int id) {
    for (Node n : nodes) {
      if (n.id == id) {
        return n;
      }
    }
    return null;
  }

  /** Creates a new node with no ports. */
  public Node addNode(NodeKind kind, String title) {
    Node node = new Node(this, kind, nextId++, title);
    nodes.add(node);
    return node;
  }

  /** Connects two ports; each must be on a node of this graph. Does nothing if already linked. */
  public void connect(Port a, Port b) {
    Preconditions.checkArgument(
        contains(a.node) && contains(b.node), "%s, %s not in %s", a, b, this);
    Preconditions.checkArgument(a != b);
    if (!a.links.contains(b)) {
      a.links.add(b);
      b.links.add(a);
    }
  }

  /** Removes the link between two ports, if there is one. */
  public void disconnect(Port a, Port b) {
    a.links.remove(b);
    b.links.remove(a);
  }

  /** Removes all links to and from the given port. */
  public void disconnect(Port port) {
    for (Port other : port.links) {
      other.links.remove(port);
    }
    port.links.clear();
  }

  /** Moves every link of {@code from} to {@code to}. */
  public void moveLinks(Port from, Port to) {
    for (Port other : ImmutableList.copyOf(from.links)) {
      disconnect(from, other);
      connect(to, other);
    }
  }

  /** Removes all links to and from the given node's ports. */
  public void breakAllLinks(Node node) {
    node.ports().forEach(this::disconnect);
  }

  /** Disconnects and removes the given node. */
  public void removeNode(Node node) {
    Preconditions.checkArgument(contains(node));
    breakAllLinks(node);
    nodes.remove(node);
    node.detach();
  }

  /** Disconnects and removes each node matching the predicate; returns them in graph order. */
  @CanIgnoreReturnValue
  public ImmutableList<Node> removeNodes(Predicate<Node> toRemove) {
    ImmutableList<Node> removed =
        nodes.stream().filter(toRemove).collect(ImmutableList.toImmutableList());
    removed.forEach(this::breakAllLinks);
    nodes.removeAll(Set.copyOf(removed));
    removed.forEach(Node::detach);
    return removed;
  }

  /** Disconnects and removes the given nodes. */
  public void removeAll(Collection<Node> toRemove) {
    Set<Node> set = Set.copyOf(toRemove);
    removeNodes(set::contains);
  }

  /** The result of copying nodes from one graph to another. */
  public record Copy(Graph graph, ImmutableMap<Node, Node> cloneToOriginal) {
    /** Returns the copy of {@code original}; throws if it was not copied. */
    public Node cloneOf(Node original) {
      for (Map.Entry<Node, Node> entry : cloneToOriginal.entrySet()) {
        if (entry.getValue() == original) {
          return entry.getKey();
        }
      }
      throw new IllegalArgumentException(original + " was not copied");
    }

    /** Returns the clones, in the order of their originals. */
    public ImmutableList<Node> clones() {
      return cloneToOriginal.keySet().asList();
    }
  }

  /**
   * Returns a deep copy of this graph. Nodes in the copy keep the ids of their originals, and no
   * Node or Port is shared between the two graphs. Links to ports of nodes outside this graph are
   * not copied.
   */
  public Copy cloneGraph(String newName) {
    Graph result = new Graph(newName);
    Map<Node, Node> originalToClone = new HashMap<>();
    Map<Node, Node> cloneToOriginal = new LinkedHashMap<>();
    for (Node n : nodes) {
      Node clone = new Node(result, n.kind, n.id, n.title());
      clone.copyAttributesFrom(n);
      result.nodes.add(clone);
      originalToClone.put(n, clone);
      cloneToOriginal.put(clone, n);
    }
    result.nextId = nextId;
    copyLinks(originalToClone);
    return new Copy(result, ImmutableMap.copyOf(cloneToOriginal));
  }

  /**
   * Adds a copy of each node of {@code source} to this graph, with newly-assigned ids, and copies
   * the links between them. Returns the map from each new node to the node it was copied from.
   */
  public Copy copyNodesFrom(Graph source) {
    Preconditions.checkArgument(source != this);
    Map<Node, Node> originalToClone = new HashMap<>();
    Map<Node, Node> cloneToOriginal = new LinkedHashMap<>();
    for (Node n : source.nodes) {
      Node clone = addNode(n.kind, n.title());
      clone.copyAttributesFrom(n);
      originalToClone.put(n, clone);
      cloneToOriginal.put(clone, n);
    }
    copyLinks(originalToClone);
    return new Copy(this, ImmutableMap.copyOf(cloneToOriginal));
  }

  /**
   * Given a map from original nodes to their (already-populated) clones, links each cloned port to
   * the clones of the ports its original was linked to. Ports are matched by position, since
   * clones are created with their originals' ports in the same order.
   */
  private static void copyLinks(Map<Node, Node> originalToClone) {
    for (Map.Entry<Node, Node> entry : originalToClone.entrySet()) {
      List<Port> originalPorts = entry.getKey().ports();
      List<Port> clonePorts = entry.getValue().ports();
      for (int i = 0; i < originalPorts.size(); i++) {
        Port clonePort = clonePorts.get(i);
        for (Port target : originalPorts.get(i).links) {
          Node targetClone = originalToClone.get(target.node);
          if (targetClone != null) {
            // Each side of a link adds only its own half; the other half is added when we get to it
            clonePort.links.add(targetClone.ports().get(target.node.ports().indexOf(target)));
          }
        }
      }
    }
  }

  @Override
  public String toString() {
    return name;
  }
}
