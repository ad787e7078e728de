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
import org.wirescript.compiler.CompileOptions;
import org.wirescript.compiler.FunctionContext;
import org.wirescript.compiler.HandlerRegistry;
import org.wirescript.compiler.NodeHandler;
import org.wirescript.compiler.Statement;
import org.wirescript.compiler.Term;
import org.wirescript.graph.Node;
import org.wirescript.graph.NodeKind;
import org.wirescript.graph.Port;

/**
 * Registers handlers for the standard node kinds, including every kind the compiler synthesizes
 * itself.
 */
public class StandardHandlers {

  /** The registry containing only the standard handlers; built once, on first use. */
  private static final class Holder {
    static final HandlerRegistry REGISTRY = addTo(HandlerRegistry.builder()).build();
  }

  // Static methods only
  private StandardHandlers() {}

  /** Returns a registry containing the standard handlers. */
  public static HandlerRegistry registry() {
    return Holder.REGISTRY;
  }

  /** Registers the standard handlers with the given builder, which is returned. */
  public static HandlerRegistry.Builder addTo(HandlerRegistry.Builder builder) {
    NodeHandler expandable = new ExpandableHandler();
    return builder
        .register(NodeKind.FUNCTION_ENTRY, new EntryHandler())
        .register(NodeKind.FUNCTION_RESULT, new ResultHandler())
        .register(NodeKind.EVENT, new EventHandler())
        .register(NodeKind.CALL_FUNCTION, new CallFunctionHandler())
        .register(NodeKind.BRANCH, new BranchHandler())
        .register(NodeKind.SEQUENCE, new SequenceHandler())
        .register(NodeKind.VARIABLE_GET, new VariableGetHandler())
        .register(NodeKind.VARIABLE_SET, new VariableSetHandler())
        .register(NodeKind.LITERAL, new LiteralHandler())
        .register(NodeKind.MAKE_ARRAY, new MakeArrayHandler())
        .register(NodeKind.ENUM_LITERAL, new EnumLiteralHandler())
        .register(NodeKind.COMMENT, new CommentHandler())
        .register(NodeKind.TUNNEL_BOUNDARY, new TunnelBoundaryHandler())
        .register(NodeKind.ASSIGN_EVENT_PARAMS, new AssignEventParamsHandler())
        .register(NodeKind.CALL_EVENT_GRAPH, new CallEventGraphHandler())
        .register(NodeKind.MACRO_INSTANCE, expandable)
        .register(NodeKind.COMPOSITE, expandable)
        .register(NodeKind.TUNNEL, expandable)
        .register(NodeKind.KNOT, expandable);
  }

  /** Reads a member variable (or declared local); emits nothing, its value is the variable. */
  static class VariableGetHandler implements NodeHandler {
    @Override
    public void registerTerms(FunctionContext context, Node node) {
      String name = node.property(Nodes.VARIABLE, node.title());
      Term variable = context.variable(name);
      if (variable == null) {
        throw CompileError.structural(node, "Unknown variable %s", name);
      }
      context.bindNet(node.output(Nodes.VALUE), variable);
    }

    @Override
    public void emitStatements(FunctionContext context, Node node) {}

    @Override
    public boolean isPure(Node node) {
      return true;
    }
  }

  /** Assigns its input to a member variable (or declared local). */
  static class VariableSetHandler implements NodeHandler {
    @Override
    public void registerTerms(FunctionContext context, Node node) {}

    @Override
    public void emitStatements(FunctionContext context, Node node) {
      String name = node.property(Nodes.VARIABLE, node.title());
      Term variable = context.variable(name);
      if (variable == null) {
        throw CompileError.structural(node, "Unknown variable %s", name);
      }
      context.append(node, Statement.assign(variable, context.valueOf(node.input(Nodes.VALUE))));
      context.continueWith(node, node.output(Nodes.THEN));
    }

    @Override
    public boolean isPure(Node node) {
      return false;
    }
  }

  /** A constant; its value is a literal term. */
  static class LiteralHandler implements NodeHandler {
    @Override
    public void registerTerms(FunctionContext context, Node node) {
      Port output = node.output(Nodes.VALUE);
      context.bindNet(output, context.literal(output.type(), node.property(Nodes.VALUE)));
    }

    @Override
    public void emitStatements(FunctionContext context, Node node) {}

    @Override
    public boolean isPure(Node node) {
      return true;
    }
  }

  static class MakeArrayHandler implements NodeHandler {
    @Override
    public void registerTerms(FunctionContext context, Node node) {
      context.addLocal(node.output(Nodes.ARRAY));
    }

    @Override
    public void emitStatements(FunctionContext context, Node node) {
      context.append(
          node,
          Statement.createArray(
              context.netFor(node.output(Nodes.ARRAY)),
              node.dataInputs().stream().map(context::valueOf).toList()));
    }

    @Override
    public boolean isPure(Node node) {
      return true;
    }
  }

  /** Widens an enum default back into an enum value. */
  static class EnumLiteralHandler implements NodeHandler {
    @Override
    public void registerTerms(FunctionContext context, Node node) {
      context.addLocal(node.output(Nodes.VALUE));
    }

    @Override
    public void emitStatements(FunctionContext context, Node node) {
      context.append(
          node,
          Statement.assign(
              context.netFor(node.output(Nodes.VALUE)), context.valueOf(node.input(Nodes.ENUM))));
    }

    @Override
    public boolean isPure(Node node) {
      return true;
    }
  }

  /** Comments generate nothing, but are kept when intermediate products are being saved. */
  static class CommentHandler implements NodeHandler {
    @Override
    public void registerTerms(FunctionContext context, Node node) {}

    @Override
    public void emitStatements(FunctionContext context, Node node) {}

    @Override
    public boolean isPure(Node node) {
      return true;
    }

    @Override
    public boolean forceKeep(Node node, CompileOptions options) {
      return options.saveIntermediateProducts;
    }
  }

  static class TunnelBoundaryHandler implements NodeHandler {
    @Override
    public void registerTerms(FunctionContext context, Node node) {}

    @Override
    public void emitStatements(FunctionContext context, Node node) {
      Node callSite = context.provenance().callSite(node);
      String label =
          callSite == null ? node.title() : context.provenance().original(callSite).toString();
      context.append(node, Statement.instrumentationBoundary(label));
      context.continueWith(node, node.output(Nodes.THEN));
    }

    @Override
    public boolean isPure(Node node) {
      return false;
    }
  }

  /** Copies each input into the event graph storage named by the input. */
  static class AssignEventParamsHandler implements NodeHandler {
    @Override
    public void registerTerms(FunctionContext context, Node node) {}

    @Override
    public void emitStatements(FunctionContext context, Node node) {
      for (Port input : node.dataInputs()) {
        context.append(
            node,
            Statement.assign(
                context.eventGraphLocal(input.name, input.type()), context.valueOf(input)));
      }
      context.continueWith(node, node.output(Nodes.THEN));
    }

    @Override
    public boolean isPure(Node node) {
      return false;
    }
  }

  /** Calls the event graph; the dispatch offset is patched in once the event graph is compiled. */
  static class CallEventGraphHandler implements NodeHandler {
    @Override
    public void registerTerms(FunctionContext context, Node node) {}

    @Override
    public void emitStatements(FunctionContext context, Node node) {
      String eventGraph = node.property(Nodes.FUNCTION, context.eventGraphName());
      context.append(node, Statement.callEventGraph(eventGraph));
      context.append(node, Statement.ret());
    }

    @Override
    public boolean isPure(Node node) {
      return false;
    }
  }

  /** Kinds that the expander removes; reaching code generation with one is an error. */
  static class ExpandableHandler implements NodeHandler {
    @Override
    public void registerTerms(FunctionContext context, Node node) {
      throw CompileError.structural(node, "%s was not expanded", node.title());
    }

    @Override
    public void emitStatements(FunctionContext context, Node node) {
      throw CompileError.structural(node, "%s was not expanded", node.title());
    }
  }
}
