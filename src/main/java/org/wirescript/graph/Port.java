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
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * A typed connection point on a Node. Edges are represented by each Port holding the list of ports
 * it is connected to; the relation is kept symmetric by {@link Graph#connect} and {@link
 * Graph#disconnect}.
 */
public final class Port {

  public enum Direction {
    IN,
    OUT;

    public Direction opposite() {
      return this == IN ? OUT : IN;
    }
  }

  public enum Role {
    CONTROL,
    DATA
  }

  /** The node that owns this port. */
  public final Node node;

  /** Unique among the ports of {@link #node} with the same direction. */
  public final String name;

  public final Direction direction;

  /** Only changed when the expander resolves a wildcard. */
  private PortType type;

  /** The literal used for an unconnected data input; null if none was authored. */
  private @Nullable String defaultValue;

  final List<Port> links = new ArrayList<>();

  Port(Node node, String name, Direction direction, PortType type) {
    this.node = node;
    this.name = name;
    this.direction = direction;
    this.type = type;
  }

  public PortType type() {
    return type;
  }

  /** Replaces this port's type; only data ports may be retyped. */
  public void setType(PortType type) {
    Preconditions.checkArgument(!type.isExec() && !this.type.isExec());
    this.type = type;
  }

  public Role role() {
    return type.isExec() ? Role.CONTROL : Role.DATA;
  }

  public boolean isControl() {
    return type.isExec();
  }

  public boolean isData() {
    return !type.isExec();
  }

  public boolean isInput() {
    return direction == Direction.IN;
  }

  public boolean isOutput() {
    return direction == Direction.OUT;
  }

  public @Nullable String defaultValue() {
    return defaultValue;
  }

  public void setDefaultValue(@Nullable String defaultValue) {
    this.defaultValue = defaultValue;
  }

  /** The ports this port is connected to, in connection order. */
  public List<Port> links() {
    return Collections.unmodifiableList(links);
  }

  public boolean isLinked() {
    return !links.isEmpty();
  }

  /**
   * Returns the single port this input is connected to, or null if it is unconnected. Must not be
   * called on a port with more than one link.
   */
  public @Nullable Port source() {
    Preconditions.checkState(links.size() <= 1, "%s has multiple links", this);
    return links.isEmpty() ? null : links.get(0);
  }

  @Override
  public String toString() {
    return node + "." + name;
  }
}
