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

import org.wirescript.compiler.CompileError;
import org.wirescript.compiler.FunctionContext;
import org.wirescript.compiler.NodeHandler;
import org.wirescript.graph.Node;
import org.wirescript.graph.Port;

/**
 * An event in the event graph. Its parameters are read from storage shared with the event's stub,
 * which copies them there before dispatching to this node.
 */
class EventHandler implements NodeHandler {

  @Override
  public void registerTerms(FunctionContext context, Node node) {
    if (!context.isEventGraph()) {
      throw CompileError.structural(
          node, "Event %s is only allowed in an event graph", node.title());
    }
    for (Port output : node.dataOutputs()) {
      context.bindNet(
          output, context.eventGraphLocal(context.eventParameterName(output), output.type()));
    }
  }

  @Override
  public void emitStatements(FunctionContext context, Node node) {
    context.continueWith(node, node.output(Nodes.THEN));
  }

  @Override
  public boolean isPure(Node node) {
    return false;
  }

  @Override
  public boolean isRoot(Node node) {
    return true;
  }
}
