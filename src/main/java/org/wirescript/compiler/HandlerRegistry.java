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
import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.LinkedHashMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.wirescript.graph.Node;
import org.wirescript.graph.NodeKind;

/**
 * An immutable map from node kinds to their handlers. A HandlerRegistry is built once (with {@link
 * #builder}) before compilation begins and is then shared, read-only, by every compilation.
 */
public final class HandlerRegistry {

  private final ImmutableMap<NodeKind, NodeHandler> handlers;

  private HandlerRegistry(ImmutableMap<NodeKind, NodeHandler> handlers) {
    this.handlers = handlers;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Returns a Builder initialized with all of this registry's handlers. */
  public Builder toBuilder() {
    Builder builder = new Builder();
    builder.handlers.putAll(handlers);
    return builder;
  }

  public @Nullable NodeHandler find(NodeKind kind) {
    return handlers.get(kind);
  }

  /** Returns the handler for the given node; throws a CompileError if there is none. */
  public NodeHandler handler(Node node) {
    NodeHandler result = handlers.get(node.kind);
    if (result == null) {
      throw CompileError.structural(node, "Unexpected node type %s", node.kind);
    }
    return result;
  }

  /** Returns true if the node's kind is registered and its handler considers it pure. */
  public boolean isPure(Node node) {
    NodeHandler handler = handlers.get(node.kind);
    return handler != null ? handler.isPure(node) : node.isPure();
  }

  public ImmutableMap<NodeKind, NodeHandler> handlers() {
    return handlers;
  }

  /** Collects handlers for a HandlerRegistry. */
  public static final class Builder {
    private final Map<NodeKind, NodeHandler> handlers = new LinkedHashMap<>();

    private Builder() {}

    /** Adds a handler; each kind may only be registered once. */
    @CanIgnoreReturnValue
    public Builder register(NodeKind kind, NodeHandler handler) {
      NodeHandler prev = handlers.putIfAbsent(kind, handler);
      Preconditions.checkArgument(prev == null, "%s is already registered", kind);
      return this;
    }

    /** Adds a handler, replacing any previously registered for that kind. */
    @CanIgnoreReturnValue
    public Builder replace(NodeKind kind, NodeHandler handler) {
      handlers.put(kind, handler);
      return this;
    }

    public HandlerRegistry build() {
      return new HandlerRegistry(ImmutableMap.copyOf(handlers));
    }
  }
}
