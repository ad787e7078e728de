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
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.jspecify.annotations.Nullable;
import org.wirescript.graph.Graph;
import org.wirescript.graph.Node;
import org.wirescript.graph.Port;
import org.wirescript.graph.PortType;
import org.wirescript.graph.Provenance;

/**
 * The state of compiling one function (or the event graph, or an event stub). A FunctionContext
 * owns a private clone of the function's graph, its terms, its schedule and statements, and its own
 * diagnostics; nothing in it is shared with other functions except the {@link ClassScope}.
 *
 * <p>Node handlers use the public methods to declare terms and append statements.
 */
public final class FunctionContext {

  public enum Kind {
    FUNCTION,
    /** The consolidated graph of all event pages. */
    EVENT_GRAPH,
    /** A synthesized function that forwards one event into the event graph. */
    EVENT_STUB,
    /** A signature with no body. */
    DELEGATE_SIGNATURE
  }

  public final String name;
  public final Kind kind;

  /** The authored declaration; null for synthesized functions. */
  final @Nullable FunctionDecl decl;

  final ClassScope classScope;
  final CompileOptions options;
  final HandlerRegistry handlers;
  final Provenance provenance;
  final MessageLog log;

  /** The private clone being compiled; null once the context has been released. */
  private @Nullable Graph graph;

  @Nullable Node entry;

  /** The inherited function this one overrides, if any. */
  @Nullable FunctionSignature parentSignature;

  FunctionSignature.Access access = FunctionSignature.Access.PUBLIC;
  final EnumSet<FunctionSignature.Flag> flags = EnumSet.noneOf(FunctionSignature.Flag.class);

  /** Inputs followed by outputs, in declaration order until the assembler reorders them. */
  final List<Term> parameters = new ArrayList<>();

  final List<Term> locals = new ArrayList<>();

  /** Maps data outputs, and the inputs of result nodes, to the terms holding their values. */
  private final Map<Port, Term> nets = new HashMap<>();

  /** Literal terms created for unconnected inputs. */
  private final Map<Port, Term> literals = new HashMap<>();

  /** Nodes whose terms have been registered. */
  final Set<Node> registered = new HashSet<>();

  /** Names in use by parameters and locals. */
  private final Set<String> localNames = new HashSet<>();

  /** Defaults of declared locals, by term name; applied when the function is finalized. */
  final Map<String, String> localDefaults = new LinkedHashMap<>();

  /** All retained nodes (pure and non-pure) in the order their statements are generated. */
  ImmutableList<Node> schedule = ImmutableList.of();

  /** The non-pure nodes, in execution order; set when pure nodes are inlined. */
  ImmutableList<Node> linearExecutionList = ImmutableList.of();

  final Map<Node, List<Statement>> statementsPerNode = new HashMap<>();

  /** The final statements; set when statements are resolved. */
  ImmutableList<Statement> statements = ImmutableList.of();

  /** For the event graph, the offset of each (authored) event node's first statement. */
  final Map<Node, Integer> entryPoints = new LinkedHashMap<>();

  /** For an event stub, the event node (in the event graph) that it dispatches to. */
  @Nullable Node stubEvent;

  /** True for an event stub whose event has no parameters to copy. */
  boolean simpleStub;

  /** True once a stub body has been substituted because of errors or a skeleton-only compile. */
  boolean stubBody;

  FunctionContext(
      String name,
      Kind kind,
      @Nullable FunctionDecl decl,
      Graph graph,
      ClassScope classScope,
      HandlerRegistry handlers,
      Provenance provenance) {
    this.name = name;
    this.kind = kind;
    this.decl = decl;
    this.graph = graph;
    this.classScope = classScope;
    this.options = classScope.options;
    this.handlers = handlers;
    this.provenance = provenance;
    this.log = new MessageLog(provenance);
  }

  /** The graph being compiled. */
  public Graph graph() {
    Preconditions.checkState(graph != null, "%s has been released", name);
    return graph;
  }

  public CompileOptions options() {
    return options;
  }

  public MessageLog log() {
    return log;
  }

  public Provenance provenance() {
    return provenance;
  }

  public boolean isEventGraph() {
    return kind == Kind.EVENT_GRAPH;
  }

  /** The name of the event graph of the class being compiled. */
  public String eventGraphName() {
    return classScope.source.eventGraphName();
  }

  public boolean hasErrors() {
    return log.hasErrors();
  }

  public @Nullable Node entry() {
    return entry;
  }

  // Term declaration

  private String uniqueLocalName(String base) {
    if (isEventGraph()) {
      return classScope.uniqueName(base);
    }
    String name = ClassScope.sanitize(base);
    for (int i = 1; !localNames.add(name); i++) {
      name = ClassScope.sanitize(base) + "_" + i;
    }
    return name;
  }

  /** Declares an input parameter backing the given output port of the entry node. */
  public Term addParameter(Port port) {
    Preconditions.checkArgument(port.isData() && port.isOutput());
    Term term = new Term(Term.Role.PARAMETER, uniqueLocalName(port.name), port.type(), port, null);
    parameters.add(term);
    nets.put(port, term);
    return term;
  }

  /**
   * Declares an output parameter backing the given input port of a result node. Result nodes with
   * a port of the same name share a term.
   */
  public Term addResult(Port port) {
    Preconditions.checkArgument(port.isData() && port.isInput());
    for (Term t : parameters) {
      if (t.role == Term.Role.RESULT && t.source != null && t.source.name.equals(port.name)) {
        nets.put(port, t);
        return t;
      }
    }
    Term term = new Term(Term.Role.RESULT, uniqueLocalName(port.name), port.type(), port, null);
    parameters.add(term);
    nets.put(port, term);
    return term;
  }

  /** Declares a local holding the value of the given output port. */
  public Term addLocal(Port port) {
    Preconditions.checkArgument(port.isData() && port.isOutput());
    String localName = uniqueLocalName(port.node.title() + "_" + port.name);
    Term term = new Term(Term.Role.LOCAL, localName, port.type(), port, null);
    locals.add(term);
    nets.put(port, term);
    return term;
  }

  /** Declares a local variable authored on the function; a clashing name is replaced. */
  Term addDeclaredLocal(VariableDecl variable) {
    String name = uniqueLocalName(variable.name());
    if (!name.equals(variable.name())) {
      log.warning(
          entry,
          "Local variable %s conflicts with another name in %s and was renamed %s",
          variable.name(),
          this.name,
          name);
    }
    Term term = new Term(Term.Role.LOCAL, name, variable.type(), null, null);
    locals.add(term);
    if (variable.defaultValue() != null) {
      localDefaults.put(name, variable.defaultValue());
    }
    return term;
  }

  /** Makes the given output port's value available in {@code term} (e.g. a member variable). */
  public void bindNet(Port port, Term term) {
    Preconditions.checkArgument(port.isData());
    nets.put(port, term);
  }

  /** Returns the term for a member variable or a declared local, or null if there is none. */
  public @Nullable Term variable(String name) {
    for (Term t : locals) {
      if (t.source == null && t.name().equals(name)) {
        return t;
      }
    }
    return classScope.member(name);
  }

  /** Returns the storage shared between the event graph and its stubs. */
  public Term eventGraphLocal(String name, PortType type) {
    return classScope.eventGraphLocal(name, type);
  }

  /**
   * Returns the name of the shared storage for the given event parameter (a data output of an
   * event node, in any clone of it).
   */
  public String eventParameterName(Port eventPort) {
    return classScope.eventParameterName(provenance.original(eventPort));
  }

  /** Returns the term registered for a data port; throws a CompileError if there is none. */
  public Term netFor(Port port) {
    Term result = nets.get(port);
    if (result == null) {
      throw CompileError.structural(port.node, "No value was registered for %s", port.name);
    }
    return result;
  }

  public @Nullable Term findNet(Port port) {
    return nets.get(port);
  }

  /**
   * Returns the term providing the value of a data input: the term of the output it is connected
   * to, or a literal holding its default value if it is unconnected.
   */
  public Term valueOf(Port input) {
    Preconditions.checkArgument(input.isData() && input.isInput());
    Port source = input.source();
    if (source != null) {
      return netFor(source);
    }
    return literals.computeIfAbsent(input, p -> Term.literal(p.type(), p.defaultValue()));
  }

  /** Returns a literal term. */
  public Term literal(PortType type, @Nullable String value) {
    return Term.literal(type, value);
  }

  // Statements

  /** Appends a statement to those generated for {@code node}. */
  public void append(Node node, Statement statement) {
    statementsPerNode.computeIfAbsent(node, n -> new ArrayList<>()).add(statement);
  }

  /** Returns the statements generated so far for {@code node}. */
  public List<Statement> statementsFor(Node node) {
    return statementsPerNode.getOrDefault(node, List.of());
  }

  /** Returns the node a control output is connected to, or null. */
  public @Nullable Node target(Port controlOutput) {
    Preconditions.checkArgument(controlOutput.isControl() && controlOutput.isOutput());
    return controlOutput.links().isEmpty() ? null : controlOutput.links().get(0).node;
  }

  /**
   * Appends the statement that continues execution through the given control output: a jump to
   * the connected node, or the end of the thread if it is unconnected.
   */
  public void continueWith(Node node, Port controlOutput) {
    Node next = target(controlOutput);
    append(node, next == null ? Statement.endOfThread() : Statement.gotoNode(next));
  }

  // Results

  /** The non-pure nodes in execution order. */
  public ImmutableList<Node> linearExecutionList() {
    return linearExecutionList;
  }

  /** The resolved statements of this function. */
  public ImmutableList<Statement> statements() {
    return statements;
  }

  public ImmutableList<Term> parameters() {
    return ImmutableList.copyOf(parameters);
  }

  public ImmutableList<Term> locals() {
    return ImmutableList.copyOf(locals);
  }

  /** For the event graph, the dispatch offset of each authored event node. */
  public ImmutableMap<Node, Integer> entryPoints() {
    return ImmutableMap.copyOf(entryPoints);
  }

  /** Discards the private graph clone and per-port tables. */
  void release() {
    graph = null;
    nets.clear();
    literals.clear();
    statementsPerNode.clear();
  }

  @Override
  public String toString() {
    return name;
  }
}
