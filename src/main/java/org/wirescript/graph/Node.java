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
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * A unit of behavior in a graph. A Node is created by (and belongs to) a single Graph; its
 * behavior is determined by the handler registered for its {@link #kind}, configured by its
 * properties and ports.
 */
public final class Node {

  public final NodeKind kind;

  /**
   * Assigned by the owning graph; unique within it and never reused. Ids increase in the order
   * nodes were added, which is the order used to break ties when scheduling.
   */
  public final int id;

  private @Nullable Graph graph;

  private String title;

  /** True if this node has no side effects and may be duplicated or reordered. */
  private boolean pure;

  private boolean deprecated;

  /** Kind-specific configuration, e.g. the name of the function a CallFunction node calls. */
  private final Map<String, String> properties = new LinkedHashMap<>();

  /** The graph referenced by a MacroInstance or Composite node. */
  private @Nullable Graph subgraph;

  private final List<Port> ports = new ArrayList<>();

  /** Authoring position; only used when reporting. */
  public int x;

  public int y;

  Node(Graph graph, NodeKind kind, int id, String title) {
    this.graph = graph;
    this.kind = kind;
    this.id = id;
    this.title = title;
  }

  /** Returns the graph containing this node, or null if it has been removed. */
  public @Nullable Graph graph() {
    return graph;
  }

  void detach() {
    graph = null;
  }

  public String title() {
    return title;
  }

  public void setTitle(String title) {
    this.title = title;
  }

  public boolean isPure() {
    return pure;
  }

  @CanIgnoreReturnValue
  public Node setPure(boolean pure) {
    this.pure = pure;
    return this;
  }

  public boolean isDeprecated() {
    return deprecated;
  }

  public void setDeprecated(boolean deprecated) {
    this.deprecated = deprecated;
  }

  public @Nullable String property(String key) {
    return properties.get(key);
  }

  public String property(String key, String defaultValue) {
    return properties.getOrDefault(key, defaultValue);
  }

  @CanIgnoreReturnValue
  public Node setProperty(String key, String value) {
    properties.put(key, value);
    return this;
  }

  public Map<String, String> properties() {
    return Collections.unmodifiableMap(properties);
  }

  public @Nullable Graph subgraph() {
    return subgraph;
  }

  @CanIgnoreReturnValue
  public Node setSubgraph(@Nullable Graph subgraph) {
    this.subgraph = subgraph;
    return this;
  }

  /** Adds a new port to this node; its name must not be used by another port in that direction. */
  @CanIgnoreReturnValue
  public Port addPort(String name, Port.Direction direction, PortType type) {
    Preconditions.checkArgument(port(name, direction) == null, "duplicate port %s", name);
    Port port = new Port(this, name, direction, type);
    ports.add(port);
    return port;
  }

  @CanIgnoreReturnValue
  public Port addInput(String name, PortType type) {
    return addPort(name, Port.Direction.IN, type);
  }

  @CanIgnoreReturnValue
  public Port addOutput(String name, PortType type) {
    return addPort(name, Port.Direction.OUT, type);
  }

  /** All ports of this node, in the order they were added. */
  public List<Port> ports() {
    return Collections.unmodifiableList(ports);
  }

  public @Nullable Port port(String name, Port.Direction direction) {
    for (Port p : ports) {
      if (p.direction == direction && p.name.equals(name)) {
        return p;
      }
    }
    return null;
  }

  /** Returns the named input port; throws if there is none. */
  public Port input(String name) {
    Port result = port(name, Port.Direction.IN);
    Preconditions.checkArgument(result != null, "%s has no input %s", this, name);
    return result;
  }

  /** Returns the named output port; throws if there is none. */
  public Port output(String name) {
    Port result = port(name, Port.Direction.OUT);
    Preconditions.checkArgument(result != null, "%s has no output %s", this, name);
    return result;
  }

  /** The ports with the given direction and role, in order. */
  public ImmutableList<Port> ports(Port.Direction direction, Port.Role role) {
    return ports.stream()
        .filter(p -> p.direction == direction && p.role() == role)
        .collect(ImmutableList.toImmutableList());
  }

  public ImmutableList<Port> controlInputs() {
    return ports(Port.Direction.IN, Port.Role.CONTROL);
  }

  public ImmutableList<Port> controlOutputs() {
    return ports(Port.Direction.OUT, Port.Role.CONTROL);
  }

  public ImmutableList<Port> dataInputs() {
    return ports(Port.Direction.IN, Port.Role.DATA);
  }

  public ImmutableList<Port> dataOutputs() {
    return ports(Port.Direction.OUT, Port.Role.DATA);
  }

  /** Returns true if any of this node's ports is a control port. */
  public boolean hasControlPorts() {
    return ports.stream().anyMatch(Port::isControl);
  }

  /** Copies the title, flags, properties, subgraph and position of another node. */
  void copyAttributesFrom(Node other) {
    title = other.title;
    pure = other.pure;
    deprecated = other.deprecated;
    properties.putAll(other.properties);
    subgraph = other.subgraph;
    x = other.x;
    y = other.y;
    for (Port p : other.ports) {
      addPort(p.name, p.direction, p.type()).setDefaultValue(p.defaultValue());
    }
  }

  @Override
  public String toString() {
    return title + "#" + id;
  }
}
