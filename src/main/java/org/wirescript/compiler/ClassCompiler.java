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

import static com.google.common.flogger.LazyArgs.lazy;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.flogger.FluentLogger;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.function.Consumer;
import org.jspecify.annotations.Nullable;
import org.wirescript.backend.Backend;
import org.wirescript.graph.Graph;
import org.wirescript.graph.Node;
import org.wirescript.graph.NodeKind;
import org.wirescript.graph.Provenance;

/**
 * Compiles one {@link ScriptClass}. A ClassCompiler steps through the {@link CompilerState}s in
 * order; {@link #advance} performs a single step and {@link #compile} runs all of them.
 *
 * <p>Each function is compiled in its own {@link FunctionContext}. An error in one function is
 * recorded in that function's log and the function gets a stub body; its siblings continue to
 * compile. A class with errors still gets a layout, but its result is not a success.
 *
 * <p>A ClassCompiler is used for a single compilation and is not thread-safe.
 */
public final class ClassCompiler {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final ScriptClass source;
  private final HandlerRegistry handlers;
  private final CompileOptions options;
  private final Provenance provenance = new Provenance();

  /** Diagnostics that don't belong to a single function. */
  private final MessageLog classLog;

  private final DefaultValues defaults = new DefaultValues();

  private CompilerState state = CompilerState.IDLE;

  private @Nullable ClassScope classScope;

  /** Delegate signatures first, then authored functions, the event graph, and the event stubs. */
  private final List<FunctionContext> contexts = new ArrayList<>();

  private @Nullable FunctionContext eventGraph;

  private final List<CompiledFunction> compiledFunctions = new ArrayList<>();

  private @Nullable CompiledClass compiledClass;

  private @Nullable Backend<?> backend;

  private @Nullable Object output;

  public ClassCompiler(ScriptClass source, HandlerRegistry handlers, CompileOptions options) {
    this.source = source;
    this.handlers = handlers;
    this.options = options;
    this.classLog = new MessageLog(provenance);
  }

  public CompilerState state() {
    return state;
  }

  public ScriptClass source() {
    return source;
  }

  /** Compiles the class without running a backend. */
  public CompilationResult<Void> compile() {
    return compile(null);
  }

  /**
   * Runs every remaining step and then, if {@code backend} is non-null, the backend. The backend is
   * asked for stubs only if this is a skeleton compile or there were errors.
   *
   * @throws CancellationException if the options' cancellation check returns true before a step
   */
  @SuppressWarnings("unchecked")
  public <T> CompilationResult<T> compile(@Nullable Backend<T> backend) {
    Preconditions.checkState(
        state != CompilerState.CLASS_FINALIZED, "%s was already compiled", source);
    this.backend = backend;
    while (state != CompilerState.CLASS_FINALIZED) {
      advance();
    }
    return (CompilationResult<T>) result();
  }

  /**
   * Performs the next step of the compilation and returns the new state.
   *
   * @throws CancellationException if the options' cancellation check returns true
   */
  public CompilerState advance() {
    Preconditions.checkState(
        state != CompilerState.CLASS_FINALIZED, "%s was already compiled", source);
    if (options.cancelled.getAsBoolean()) {
      throw new CancellationException("Compilation of " + source.name + " was cancelled");
    }
    CompilerState next = state.next();
    logger.atFine().log("%s: %s -> %s", source.name, state, next);
    switch (next) {
      case SCHEMA_READY -> buildSchema();
      case CLASS_LAYOUT_BUILT -> buildClassLayout();
      case FUNCTIONS_PRECOMPILED -> precompileFunctions();
      case FUNCTIONS_COMPILED -> compileFunctions();
      case CLASS_FINALIZED -> finalizeClass();
      default -> throw new AssertionError(next);
    }
    state = next;
    return state;
  }

  private ClassScope classScope() {
    assert classScope != null;
    return classScope;
  }

  /** Runs {@code step}, recording any CompileError it throws in the context's log. */
  private static void guarded(FunctionContext context, Consumer<FunctionContext> step) {
    try {
      step.accept(context);
    } catch (CompileError e) {
      context.log.record(e);
    }
  }

  // SCHEMA_READY

  private void buildSchema() {
    ClassScope scope = new ClassScope(source, options);
    classScope = scope;
    if (source.parent != null && source.parent.isInterface) {
      classLog.error(
          Diagnostic.Kind.STRUCTURAL,
          null,
          "%s cannot extend %s, which is an interface",
          source.name,
          source.parent.name);
    }
    for (ClassSignature iface : source.interfaces) {
      if (!iface.isInterface) {
        classLog.error(Diagnostic.Kind.STRUCTURAL, null, "%s is not an interface", iface.name);
      }
    }
    for (VariableDecl variable : source.variables) {
      String name = scope.uniqueName(variable.name());
      if (!name.equals(variable.name())) {
        classLog.warning(
            null,
            "Variable %s conflicts with an inherited name and was renamed %s",
            variable.name(),
            name);
      }
      scope.addMember(variable.withName(name));
      if (variable.defaultValue() != null) {
        defaults.set(name, variable.type(), variable.defaultValue());
      }
    }
  }

  // CLASS_LAYOUT_BUILT

  private void buildClassLayout() {
    for (FunctionDecl decl : source.functions) {
      if (decl.isDelegateSignature()) {
        contexts.add(newFunctionContext(decl));
      }
    }
    for (FunctionDecl decl : source.functions) {
      if (!decl.isDelegateSignature()) {
        contexts.add(newFunctionContext(decl));
      }
    }
    if (options.isFullCompile()) {
      contexts.forEach(c -> guarded(c, this::expand));
    }
    EventGraphBuilder builder = new EventGraphBuilder(source, classScope(), handlers, provenance);
    if (builder.isNeeded()) {
      FunctionContext events = builder.buildEventGraph();
      if (options.isFullCompile()) {
        guarded(events, this::expand);
      }
      eventGraph = events;
      contexts.add(events);
      contexts.addAll(builder.buildStubs(events));
    }
    validateFunctionList();
    contexts.forEach(c -> guarded(c, this::precompileSignature));
  }

  private FunctionContext newFunctionContext(FunctionDecl decl) {
    Graph.Copy copy = decl.graph.cloneGraph(decl.name());
    provenance.recordCopy(copy);
    FunctionContext context =
        new FunctionContext(
            decl.name(),
            decl.isDelegateSignature()
                ? FunctionContext.Kind.DELEGATE_SIGNATURE
                : FunctionContext.Kind.FUNCTION,
            decl,
            copy.graph(),
            classScope(),
            handlers,
            provenance);
    context.access = decl.access;
    context.flags.addAll(decl.flags);
    GraphValidator.checkLinks(copy.graph(), context.log);
    return context;
  }

  /**
   * Removes nodes that can't be reached even counting every node without a control input as a
   * root, and then expands macro instances, composites and knots.
   */
  private void expand(FunctionContext context) {
    Graph graph = context.graph();
    Pruner pruner = new Pruner(handlers, options, context.log);
    pruner.prune(graph, pruner.gatherRootSet(graph, true));
    new Expander(options, context.log).expand(graph);
  }

  /** Returns a node to attach class-level problems with a function to. */
  private static @Nullable Node anchor(FunctionContext context) {
    if (context.entry != null) {
      return context.entry;
    }
    ImmutableList<Node> entries = context.graph().nodesOfKind(NodeKind.FUNCTION_ENTRY);
    return entries.isEmpty() ? null : entries.get(0);
  }

  private @Nullable FunctionSignature findInherited(String name) {
    FunctionSignature result = (source.parent == null) ? null : source.parent.findFunction(name);
    for (int i = 0; result == null && i < source.interfaces.size(); i++) {
      result = source.interfaces.get(i).findFunction(name);
    }
    return result;
  }

  private void validateFunctionList() {
    Map<String, FunctionContext> byName = new HashMap<>();
    for (FunctionContext context : contexts) {
      FunctionContext previous = byName.putIfAbsent(context.name, context);
      if (previous != null) {
        context.log.error(
            Diagnostic.Kind.STRUCTURAL,
            anchor(context),
            context.kind == FunctionContext.Kind.EVENT_STUB
                ? "The stub for event %s has the same name as another function"
                : "Duplicate function name %s",
            context.name);
        continue;
      }
      if (classScope().member(context.name) != null) {
        context.log.error(
            Diagnostic.Kind.STRUCTURAL,
            anchor(context),
            "Function %s has the same name as a variable",
            context.name);
      }
      FunctionSignature inherited =
          (source.parent == null) ? null : source.parent.findFunction(context.name);
      if (inherited == null) {
        continue;
      }
      if (!inherited.isOverridable()) {
        context.log.error(
            Diagnostic.Kind.SIGNATURE_MISMATCH,
            anchor(context),
            "Cannot override %s: it is not overridable in %s",
            context.name,
            source.parent.name);
      } else if (context.kind == FunctionContext.Kind.EVENT_STUB && !inherited.isEvent()) {
        context.log.error(
            Diagnostic.Kind.SIGNATURE_MISMATCH,
            anchor(context),
            "Event %s overrides %s, which is not an event",
            context.name,
            inherited);
      }
    }
  }

  /**
   * Finds the entry node, resolves the overridden signature and flags, and registers the terms
   * that make up the function's signature.
   */
  private void precompileSignature(FunctionContext context) {
    if (context.hasErrors()) {
      return;
    }
    ImmutableList<Node> entries = context.graph().nodesOfKind(NodeKind.FUNCTION_ENTRY);
    if (entries.isEmpty()) {
      throw CompileError.structural(null, "Could not find a root node for %s", context.name);
    } else if (entries.size() > 1) {
      throw CompileError.structural(
          entries.get(1),
          "%s has %d entry nodes; only one is allowed",
          context.name,
          entries.size());
    }
    context.entry = entries.get(0);
    if (!context.isEventGraph()) {
      context.parentSignature = findInherited(context.name);
    }
    inheritFlags(context);
    for (Node node : context.graph().nodes()) {
      NodeHandler handler = handlers.find(node.kind);
      if (handler != null && handler.requiresTermsBeforeScheduling(node)) {
        handler.registerTerms(context, node);
        context.registered.add(node);
      }
    }
    if (context.decl != null) {
      context.decl.locals.forEach(context::addDeclaredLocal);
    }
    FunctionAssembler.orderParameters(context);
  }

  private void inheritFlags(FunctionContext context) {
    FunctionSignature parent = context.parentSignature;
    if (parent == null) {
      if (context.access != FunctionSignature.Access.PRIVATE && !context.isEventGraph()) {
        context.flags.add(FunctionSignature.Flag.OVERRIDABLE);
      }
      return;
    }
    Set<FunctionSignature.Flag> own = new HashSet<>(context.flags);
    own.retainAll(FunctionSignature.Flag.NET_FLAGS);
    Set<FunctionSignature.Flag> inherited = parent.netFlags();
    if (!own.isEmpty() && !own.equals(inherited)) {
      context.log.error(
          Diagnostic.Kind.SIGNATURE_MISMATCH,
          context.entry,
          "Replication flags %s of %s differ from %s in the overridden function; using the latter",
          own,
          context.name,
          inherited);
    }
    context.flags.removeAll(FunctionSignature.Flag.NET_FLAGS);
    context.flags.addAll(inherited);
    if (context.access != parent.access) {
      context.log.warning(
          context.entry,
          "%s is %s but overrides a %s function; using %s",
          context.name,
          context.access,
          parent.access,
          parent.access);
      context.access = parent.access;
    }
    if (parent.isOverridable()) {
      context.flags.add(FunctionSignature.Flag.OVERRIDABLE);
    }
  }

  // FUNCTIONS_PRECOMPILED

  private void precompileFunctions() {
    if (options.isFullCompile()) {
      for (FunctionContext context : contexts) {
        if (!context.hasErrors() && context.kind != FunctionContext.Kind.DELEGATE_SIGNATURE) {
          guarded(context, this::precompileBody);
        }
      }
    }
    contexts.forEach(c -> guarded(c, FunctionAssembler::assignStorage));
  }

  /** Prunes what is unreachable from the entry and events, validates, schedules and registers. */
  private void precompileBody(FunctionContext context) {
    Graph graph = context.graph();
    Pruner pruner = new Pruner(handlers, options, context.log);
    pruner.prune(graph, pruner.gatherRootSet(graph, false));
    GraphValidator.checkPins(graph, context.log);
    if (context.hasErrors()) {
      return;
    }
    context.schedule = Scheduler.schedule(graph, context.entry, context.log);
    if (context.hasErrors()) {
      return;
    }
    logger.atFine().log("%s schedule: %s", context, lazy(() -> context.schedule));
    for (Node node : context.schedule) {
      if (context.registered.add(node)) {
        handlers.handler(node).registerTerms(context, node);
      }
    }
  }

  // FUNCTIONS_COMPILED

  private void compileFunctions() {
    if (options.isFullCompile()) {
      for (FunctionContext context : contexts) {
        if (!context.hasErrors() && context.kind != FunctionContext.Kind.DELEGATE_SIGNATURE) {
          guarded(context, this::emitStatements);
        }
      }
      for (FunctionContext context : contexts) {
        if (context.kind == FunctionContext.Kind.EVENT_STUB && !context.hasErrors()) {
          guarded(context, this::patchEntryPoint);
        }
      }
    }
    for (FunctionContext context : contexts) {
      boolean stub =
          !options.isFullCompile()
              || context.hasErrors()
              || context.stubBody
              || context.kind == FunctionContext.Kind.DELEGATE_SIGNATURE;
      context.stubBody = stub;
      CompiledFunction function = FunctionAssembler.finish(context, stub);
      if (function.listing != null) {
        logger.atFine().log("%s:%n%s", function.name, function.listing);
      }
      compiledFunctions.add(function);
    }
  }

  private void emitStatements(FunctionContext context) {
    for (Node node : context.schedule) {
      boolean pure = handlers.isPure(node);
      if (!pure) {
        if (options.emitNodeComments) {
          context.append(node, Statement.comment(provenance.original(node).toString()));
        }
        if (options.instrumentation && !(context.isEventGraph() && node == context.entry)) {
          context.append(node, Statement.wireTraceSite(provenance.original(node).toString()));
        }
      }
      handlers.handler(node).emitStatements(context, node);
    }
    Scheduler.inlinePureNodes(context);
    FunctionAssembler.resolveStatements(context);
  }

  /** Fills in the offset of the stub's event in the compiled event graph. */
  private void patchEntryPoint(FunctionContext stub) {
    assert stub.stubEvent != null;
    Integer offset = null;
    if (eventGraph != null && !eventGraph.hasErrors()) {
      offset = eventGraph.entryPoints.get(provenance.original(stub.stubEvent));
      if (offset == null) {
        throw CompileError.structural(
            stub.stubEvent, "Event %s was not compiled into the event graph", stub.name);
      }
    }
    if (offset == null) {
      // The event graph failed to compile, and has already reported why
      stub.stubBody = true;
      return;
    }
    int entryPoint = offset;
    stub.statements =
        stub.statements.stream()
            .map(s -> s.type == Statement.Type.CALL_EVENT_GRAPH ? s.withEntryPoint(entryPoint) : s)
            .collect(ImmutableList.toImmutableList());
  }

  // CLASS_FINALIZED

  private void finalizeClass() {
    ImmutableList.Builder<CompiledClass.Property> properties = ImmutableList.builder();
    Set<String> names = new HashSet<>();
    for (Term member : classScope().ownMembers()) {
      properties.add(new CompiledClass.Property(member.name(), member.type, false));
      names.add(member.name());
    }
    for (Term local : classScope().eventGraphLocals()) {
      if (local.storage() == Term.Storage.CLASS) {
        properties.add(new CompiledClass.Property(local.name(), local.type, true));
        names.add(local.name());
      }
    }
    compiledClass =
        new CompiledClass(
            source.name,
            source.parent,
            properties.build(),
            ImmutableList.copyOf(compiledFunctions),
            defaults.apply(names::contains, classLog));
    contexts.forEach(FunctionContext::release);
    if (backend != null) {
      output = backend.generate(compiledClass, !options.isFullCompile() || hasErrors());
    }
  }

  private boolean hasErrors() {
    return classLog.hasErrors() || contexts.stream().anyMatch(FunctionContext::hasErrors);
  }

  private CompilationResult<?> result() {
    assert compiledClass != null;
    ImmutableList.Builder<Diagnostic> all = ImmutableList.builder();
    all.addAll(classLog.diagnostics());
    ImmutableListMultimap.Builder<String, Diagnostic> byFunction = ImmutableListMultimap.builder();
    for (FunctionContext context : contexts) {
      ImmutableList<Diagnostic> diagnostics = context.log.diagnostics();
      all.addAll(diagnostics);
      byFunction.putAll(context.name, diagnostics);
    }
    return new CompilationResult<>(compiledClass, all.build(), byFunction.build(), output);
  }
}
