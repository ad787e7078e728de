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

/** A return point. Each data input is an output parameter, shared by all result nodes. */
class ResultHandler implements NodeHandler {

  @Override
  public void registerTerms(FunctionContext context, Node node) {
    for (Port input : node.dataInputs()) {
      context.addResult(input);
    }
  }

  @Override
  public void emitStatements(FunctionContext context, Node node) {
    for (Port input : node.dataInputs()) {
      context.append(node, Statement.assign(context.netFor(input), context.valueOf(input)));
    }
    context.append(node, Statement.ret());
  }

  @Override
  public boolean isPure(Node node) {
    return false;
  }

  @Override
  public boolean requiresTermsBeforeScheduling(Node node) {
    return true;
  }
}
