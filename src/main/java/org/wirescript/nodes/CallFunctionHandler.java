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
import org.wirescript.compiler.CompileError;
import org.wirescript.compiler.FunctionContext;
import org.wirescript.compiler.NodeHandler;
import org.wirescript.compiler.Statement;
import org.wirescript.compiler.Term;
import org.wirescript.graph.Node;
import org.wirescript.graph.Port;

/**
 * A call to a named function. The arguments are the data inputs in order; a single data output
 * receives the return value, while with several outputs each is passed as an out argument after
 * the inputs.
 */
class CallFunctionHandler implements NodeHandler {

  @Override
  public void registerTerms(FunctionContext context, Node node) {
    if (node.property(Nodes.FUNCTION) == null) {
      throw CompileError.structural(node, "%s does not name the function to call", node.title());
    }
    for (Port output : node.dataOutputs()) {
      context.addLocal(output);
    }
  }

  @Override
  public void emitStatements(FunctionContext context, Node node) {
    ImmutableList<Port> outputs = node.dataOutputs();
    ImmutableList.Builder<Term> args = ImmutableList.builder();
    for (Port input : node.dataInputs()) {
      args.add(context.valueOf(input));
    }
    Term lhs = null;
    if (outputs.size() == 1) {
      lhs = context.netFor(outputs.get(0));
    } else {
      outputs.forEach(output -> args.add(context.netFor(output)));
    }
    context.append(node, Statement.call(node.property(Nodes.FUNCTION, ""), lhs, args.build()));
    Port then = node.port(Nodes.THEN, Port.Direction.OUT);
    if (then != null) {
      context.continueWith(node, then);
    }
  }
}
