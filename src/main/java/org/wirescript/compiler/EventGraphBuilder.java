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

import com.google.common.collect.ImmutableList;
import java.util.HashSet;
import java.util.Set;
import org.wirescript.graph.Graph;
import org.wirescript.graph.Node;
import org.wirescript.graph.NodeKind;
import org.wirescript.graph.Port;
import org.wirescript.graph.PortType;
import org.wirescript.graph.Provenance;
import org.wirescript.nodes.Nodes;

/**
 * Consolidates a class's event pages into a single event graph, and creates the stub function
 * through which each event is called.
 *
 * <p>The event graph's entry takes a single EntryPoint parameter and jumps to it. Each stub copies
 * its parameters into storage shared with the event graph and then calls the event graph with the
 * offset of its event's first statement (which is filled in once the event graph is compiled).
 */
final class EventGraphBuilder {

  private final ScriptClass source;
  private final ClassScope classScope;
  private final HandlerRegistry handlers;
  private final Provenance provenance;

  EventGraphBuilder(
      ScriptClass source, ClassScope classScope, HandlerRegistry handlers, Provenance provenance) {
    this.source = source;
    this.classScope = classScope;
    this.handlers = handlers;
    this.provenance = provenance;
  }

  /** Returns true if the class needs an event graph. */
  boolean isNeeded() {
    return !source.eventPages.isEmpty() || !unhandledInterfaceEvents().isEmpty();
  }

  /**
   * Returns a context for the consolidated event graph: a copy of every page's nodes plus an entry
   * node and an event for each interface event the class does not otherwise implement.
   */
  FunctionContext buildEventGraph() {
    Graph consolidated = new Graph(source.eventGraphName());
    Node entry = Nodes.entry(consolidated);
    entry.addOutput(Nodes.ENTRY_POINT, PortType.INT);
    FunctionContext context =
        new FunctionContext(
            consolidated.name,
            FunctionContext.Kind.EVENT_GRAPH,
            null,
            consolidated,
            classScope,
            handlers,
            provenance);
    for (Graph page : source.eventPages) {
      GraphValidator.checkLinks(page, context.log);
      provenance.recordCopy(consolidated.copyNodesFrom(page));
    }
    for (FunctionSignature event : unhandledInterfaceEvents()) {
      Node node = Nodes.event(consolidated, event.name);
      for (FunctionSignature.Param param : event.inputs()) {
        node.addOutput(param.name(), param.type());
      }
    }
    context.access = FunctionSignature.Access.PRIVATE;
    context.flags.add(FunctionSignature.Flag.EVENT_GRAPH);
    return context;
  }

  /** The event functions of implemented interfaces that the class does not implement. */
  private ImmutableList<FunctionSignature> unhandledInterfaceEvents() {
    Set<String> implemented = new HashSet<>();
    source.functions.forEach(f -> implemented.add(f.name()));
    for (Graph page : source.eventPages) {
      for (Node node : page.nodesOfKind(NodeKind.EVENT)) {
        implemented.add(eventName(node));
      }
    }
    ImmutableList.Builder<FunctionSignature> result = ImmutableList.builder();
    for (ClassSignature iface : source.interfaces) {
      for (FunctionSignature f : iface.functions) {
        if (f.outputs().isEmpty() && implemented.add(f.name)) {
          result.add(f);
        }
      }
    }
    return result.build();
  }

  static String eventName(Node event) {
    return event.property(Nodes.EVENT_NAME, event.title());
  }

  /**
   * Returns a stub for each event of the (expanded) event graph: entry, then an assignment of the
   * event's parameters to shared storage (if it has any), then the call into the event graph.
   */
  ImmutableList<FunctionContext> buildStubs(FunctionContext eventGraph) {
    ImmutableList.Builder<FunctionContext> stubs = ImmutableList.builder();
    for (Node event : eventGraph.graph().nodesOfKind(NodeKind.EVENT)) {
      Graph stubGraph = new Graph(eventName(event));
      Node entry = Nodes.entry(stubGraph);
      provenance.recordSource(entry, event);
      Port then = entry.output(Nodes.THEN);
      ImmutableList<Port> params = event.dataOutputs();
      if (!params.isEmpty()) {
        Node assign = Nodes.assignEventParams(stubGraph);
        provenance.recordSource(assign, event);
        for (Port param : params) {
          Port in = assign.addInput(eventGraph.eventParameterName(param), param.type());
          stubGraph.connect(entry.addOutput(param.name, param.type()), in);
        }
        stubGraph.connect(then, assign.input(Nodes.EXEC));
        then = assign.output(Nodes.THEN);
      }
      Node call = Nodes.callEventGraph(stubGraph, eventGraph.name);
      provenance.recordSource(call, event);
      stubGraph.connect(then, call.input(Nodes.EXEC));
      FunctionContext stub =
          new FunctionContext(
              stubGraph.name,
              FunctionContext.Kind.EVENT_STUB,
              null,
              stubGraph,
              classScope,
              handlers,
              provenance);
      stub.stubEvent = event;
      stub.simpleStub = params.isEmpty();
      stub.flags.add(FunctionSignature.Flag.EVENT);
      stubs.add(stub);
    }
    return stubs.build();
  }
}
