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

import com.google.common.collect.ImmutableList;
import org.wirescript.compiler.FunctionContext;
import org.wirescript.compiler.NodeHandler;
import org.wirescript.compiler.Statement;
import org.wirescript.graph.Node;

/**
 * Runs each connected output in turn. The later outputs are pushed as execution flows (in reverse,
 * so the second output is resumed first) before jumping to the first.
 */
class SequenceHandler implements NodeHandler {

  @Override
  public void registerTerms(FunctionContext context, Node node) {}

  @Override
  public void emitStatements(FunctionContext context, Node node) {
    ImmutableList<Node> targets =
        node.controlOutputs().stream()
            .map(context::target)
            .filter(t -> t != null)
            .collect(ImmutableList.toImmutableList());
    if (targets.isEmpty()) {
      context.append(node, Statement.popExecutionFlow());
      return;
    }
    for (int i = targets.size() - 1; i > 0; i--) {
      context.append(node, Statement.pushExecutionFlow(targets.get(i)));
    }
    context.append(node, Statement.gotoNode(targets.get(0)));
  }

  @Override
  public boolean isPure(Node node) {
    return false;
  }
}
