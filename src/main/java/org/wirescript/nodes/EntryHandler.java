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

import org.wirescript.compiler.FunctionContext;
import org.wirescript.compiler.NodeHandler;
import org.wirescript.compiler.Statement;
import org.wirescript.graph.Node;
import org.wirescript.graph.Port;

/**
 * The entry of a function. Each data output is a parameter. The event graph's entry has a single
 * EntryPoint parameter and dispatches on it with a computed jump.
 */
class EntryHandler implements NodeHandler {

  @Override
  public void registerTerms(FunctionContext context, Node node) {
    for (Port output : node.dataOutputs()) {
      context.addParameter(output);
    }
  }

  @Override
  public void emitStatements(FunctionContext context, Node node) {
    if (context.isEventGraph()) {
      context.append(node, Statement.computedGoto(context.netFor(node.output(Nodes.ENTRY_POINT))));
    } else {
      context.continueWith(node, node.output(Nodes.THEN));
    }
  }

  @Override
  public boolean isPure(Node node) {
    return false;
  }

  @Override
  public boolean requiresTermsBeforeScheduling(Node node) {
    return true;
  }

  @Override
  public boolean isRoot(Node node) {
    return true;
  }
}
