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

import org.wirescript.graph.Node;

/**
 * Compiles the nodes of one kind. Handlers are registered in a {@link HandlerRegistry} before any
 * compilation begins and may be used by concurrent compilations, so they must be stateless.
 */
public interface NodeHandler {

  /**
   * Declares the terms this node needs, usually one for each data output. Called once per node,
   * after scheduling; for nodes where {@link #requiresTermsBeforeScheduling} is true it is instead
   * called before anything else, including in skeleton-only compiles.
   */
  void registerTerms(FunctionContext context, Node node);

  /** Appends the statements that implement this node. */
  void emitStatements(FunctionContext context, Node node);

  /** Returns true if the node has no side effects and no control ports. */
  default boolean isPure(Node node) {
    return node.isPure();
  }

  /**
   * Returns true for nodes that define the function's external signature (entry and result
   * nodes); their terms are registered ahead of everything else.
   */
  default boolean requiresTermsBeforeScheduling(Node node) {
    return false;
  }

  /** Returns true if the node must survive pruning even though it is unreachable. */
  default boolean forceKeep(Node node, CompileOptions options) {
    return false;
  }

  /** Returns true if the node is reachable by definition (an entry point or event). */
  default boolean isRoot(Node node) {
    return false;
  }
}
