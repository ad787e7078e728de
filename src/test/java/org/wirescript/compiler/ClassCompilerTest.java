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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;
import static org.wirescript.compiler.TestGraphs.RESULT;
import static org.wirescript.compiler.TestGraphs.call;
import static org.wirescript.compiler.TestGraphs.compileFunction;
import static org.wirescript.compiler.TestGraphs.entry;
import static org.wirescript.compiler.TestGraphs.pure;
import static org.wirescript.compiler.TestGraphs.statements;
import static org.wirescript.compiler.TestGraphs.then;
import static org.wirescript.compiler.TestGraphs.wire;

import com.google.common.collect.ImmutableList;
import java.util.EnumSet;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.wirescript.backend.ListingBackend;
import org.wirescript.graph.Graph;
import org.wirescript.graph.Node;
import org.wirescript.graph.PortType;
import org.wirescript.nodes.Nodes;
import org.wirescript.nodes.StandardHandlers;

@RunWith(JUnit4.class)
public class ClassCompilerTest {

  private static final HandlerRegistry HANDLERS = StandardHandlers.registry();

  private static CompilationResult<Void> compile(ScriptClass source) {
    return new ClassCompiler(source, HANDLERS, CompileOptions.DEFAULT).compile();
  }

  private static Graph simpleFunction(String name) {
    Graph graph = TestGraphs.function(name);
    then(entry(graph), call(graph, "A"));
    return graph;
  }

  /** A class with two events: BeginPlay calls Print, and OnHit passes its Damage to Apply. */
  private static ScriptClass actor() {
    Graph page = new Graph("EventGraph");
    then(Nodes.event(page, "BeginPlay"), call(page, "Print"));
    Node onHit = Nodes.event(page, "OnHit");
    onHit.addOutput("Damage", PortType.INT);
    Node apply = then(onHit, call(page, "Apply", "x"));
    wire(onHit, "Damage", apply, "x");
    return ScriptClass.builder("Actor").addEventPage(page).build();
  }

  @Test
  public void advanceStepsThroughEachState() {
    ScriptClass source = ScriptClass.builder("C").addFunction(simpleFunction("F")).build();
    ClassCompiler compiler = new ClassCompiler(source, HANDLERS, CompileOptions.DEFAULT);
    assertThat(compiler.state()).isEqualTo(CompilerState.IDLE);

    ImmutableList.Builder<CompilerState> states = ImmutableList.builder();
    while (compiler.state() != CompilerState.CLASS_FINALIZED) {
      states.add(compiler.advance());
    }

    assertThat(states.build())
        .containsExactly(
            CompilerState.SCHEMA_READY,
            CompilerState.CLASS_LAYOUT_BUILT,
            CompilerState.FUNCTIONS_PRECOMPILED,
            CompilerState.FUNCTIONS_COMPILED,
            CompilerState.CLASS_FINALIZED)
        .inOrder();
    assertThrows(IllegalStateException.class, compiler::advance);
    assertThrows(IllegalStateException.class, compiler::compile);
  }

  @Test
  public void skeletonCompileProducesStubs() {
    CompileOptions options =
        CompileOptions.builder().compileType(CompileOptions.CompileType.SKELETON_ONLY).build();
    Graph graph = simpleFunction("F");
    entry(graph).addOutput("a", PortType.INT);
    ScriptClass source = ScriptClass.builder("C").addFunction(graph).build();

    CompilationResult<String> result =
        new ClassCompiler(source, HANDLERS, options).compile(new ListingBackend());

    CompiledFunction f = result.compiledClass.function("F");
    assertThat(f.isStub).isTrue();
    assertThat(statements(result, "F")).containsExactly("return");
    assertThat(f.signature.params).containsExactly(FunctionSignature.Param.in("a", PortType.INT));
    assertThat(result.output).startsWith("class C (stubs only)\n");
    assertThat(result.isSuccess()).isTrue();
  }

  @Test
  public void eventsShareOneEventGraph() {
    CompilationResult<Void> result = compile(actor());

    assertThat(result.errors()).isEmpty();
    assertThat(result.compiledClass.functions.stream().map(f -> f.name).toList())
        .containsExactly("ExecuteEventGraph_Actor", "BeginPlay", "OnHit")
        .inOrder();
    assertThat(statements(result, "ExecuteEventGraph_Actor"))
        .containsExactly("goto *EntryPoint", "Print()", "end", "Apply(OnHit_Damage)", "end")
        .inOrder();
    CompiledFunction eventGraph = result.compiledClass.function("ExecuteEventGraph_Actor");
    assertThat(eventGraph.hasFlag(FunctionSignature.Flag.EVENT_GRAPH)).isTrue();
  }

  @Test
  public void eventStubsDispatchIntoEventGraph() {
    CompilationResult<Void> result = compile(actor());

    CompiledFunction beginPlay = result.compiledClass.function("BeginPlay");
    assertThat(beginPlay.isSimpleStub).isTrue();
    assertThat(beginPlay.hasFlag(FunctionSignature.Flag.EVENT)).isTrue();
    assertThat(statements(result, "BeginPlay"))
        .containsExactly("ExecuteEventGraph_Actor(1)", "return")
        .inOrder();

    CompiledFunction onHit = result.compiledClass.function("OnHit");
    assertThat(onHit.isSimpleStub).isFalse();
    assertThat(onHit.signature.params)
        .containsExactly(FunctionSignature.Param.in("Damage", PortType.INT));
    assertThat(statements(result, "OnHit"))
        .containsExactly("OnHit_Damage = Damage", "ExecuteEventGraph_Actor(3)", "return")
        .inOrder();
  }

  @Test
  public void eventParametersBecomeHiddenProperties() {
    CompilationResult<Void> result = compile(actor());

    assertThat(result.compiledClass.properties)
        .containsExactly(new CompiledClass.Property("OnHit_Damage", PortType.INT, true));
  }

  @Test
  public void persistentEventFrameKeepsEventParametersOutOfTheClass() {
    CompileOptions options = CompileOptions.builder().persistentEventFrame(true).build();

    CompilationResult<Void> result = new ClassCompiler(actor(), HANDLERS, options).compile();

    assertThat(result.compiledClass.properties).isEmpty();
    assertThat(statements(result, "OnHit")).contains("OnHit_Damage = Damage");
  }

  @Test
  public void unimplementedInterfaceEventGetsStub() {
    FunctionSignature takeDamage =
        FunctionSignature.of("TakeDamage", FunctionSignature.Param.in("Amount", PortType.FLOAT));
    ClassSignature damageable = ClassSignature.iface("Damageable", takeDamage);
    ScriptClass source = ScriptClass.builder("X").addInterface(damageable).build();

    CompilationResult<Void> result = compile(source);

    assertThat(result.errors()).isEmpty();
    CompiledFunction stub = result.compiledClass.function("TakeDamage");
    assertThat(stub.overrides).isEqualTo(takeDamage);
    assertThat(statements(result, "TakeDamage"))
        .containsExactly("TakeDamage_Amount = Amount", "ExecuteEventGraph_X(1)", "return")
        .inOrder();
  }

  @Test
  public void errorInOneFunctionLeavesSiblingsCompiled() {
    Graph good = simpleFunction("F");
    Graph bad = TestGraphs.function("G");
    Node p = pure(bad, "P", PortType.WILDCARD);
    Node c = then(entry(bad), call(bad, "C", "x"));
    wire(p, RESULT, c, "x");
    ScriptClass source = ScriptClass.builder("C").addFunction(good).addFunction(bad).build();

    CompilationResult<Void> result = compile(source);

    assertThat(result.isSuccess()).isFalse();
    assertThat(statements(result, "F")).containsExactly("A()", "end").inOrder();
    assertThat(result.compiledClass.function("G").isStub).isTrue();
    assertThat(statements(result, "G")).containsExactly("return");
    assertThat(result.functionDiagnostics.get("F")).isEmpty();
    Diagnostic error = result.functionDiagnostics.get("G").get(0);
    assertThat(error.kind()).isEqualTo(Diagnostic.Kind.TYPE);
    // Reported against the authored node, not the compiler's copy
    assertThat(error.node()).isSameInstanceAs(p);
  }

  @Test
  public void defaultValuesAreParsed() {
    ScriptClass source =
        ScriptClass.builder("C")
            .addVariable(new VariableDecl("Health", PortType.INT, "100"))
            .addVariable(new VariableDecl("Title", PortType.STRING, "Bob"))
            .addVariable(new VariableDecl("Alive", PortType.BOOLEAN, "True"))
            .addVariable(new VariableDecl("Speed", PortType.FLOAT, "fast"))
            .build();

    CompilationResult<String> result =
        new ClassCompiler(source, HANDLERS, CompileOptions.DEFAULT).compile(new ListingBackend());

    assertThat(result.compiledClass.defaultObject)
        .containsExactly("Health", 100L, "Title", "Bob", "Alive", true);
    assertThat(result.warnings()).hasSize(1);
    assertThat(result.warnings().get(0).message())
        .isEqualTo("Can't parse default value 'fast' for Speed (float)");
    assertThat(result.output).contains("  int Health = 100\n");
    assertThat(result.output).contains("  string Title = \"Bob\"\n");
  }

  @Test
  public void variableConflictingWithParentIsRenamed() {
    ClassSignature base =
        new ClassSignature(
            "Base",
            null,
            false,
            ImmutableList.of(),
            ImmutableList.of(VariableDecl.of("Health", PortType.INT)));
    ScriptClass source =
        ScriptClass.builder("C")
            .parent(base)
            .addVariable(VariableDecl.of("Health", PortType.INT))
            .build();

    CompilationResult<Void> result = compile(source);

    assertThat(result.compiledClass.properties)
        .containsExactly(new CompiledClass.Property("Health_1", PortType.INT, false));
    assertThat(result.warnings().get(0).message())
        .isEqualTo("Variable Health conflicts with an inherited name and was renamed Health_1");
  }

  @Test
  public void duplicateFunctionNameIsAnError() {
    ScriptClass source =
        ScriptClass.builder("C")
            .addFunction(simpleFunction("F"))
            .addFunction(simpleFunction("F"))
            .build();

    CompilationResult<Void> result = compile(source);

    assertThat(result.errors()).hasSize(1);
    assertThat(result.errors().get(0).message()).isEqualTo("Duplicate function name F");
    assertThat(result.compiledClass.functions.get(0).isStub).isFalse();
    assertThat(result.compiledClass.functions.get(1).isStub).isTrue();
  }

  @Test
  public void functionNamedLikeVariableIsAnError() {
    ScriptClass source =
        ScriptClass.builder("C")
            .addVariable(VariableDecl.of("F", PortType.INT))
            .addFunction(simpleFunction("F"))
            .build();

    CompilationResult<Void> result = compile(source);

    assertThat(result.errors().get(0).message())
        .isEqualTo("Function F has the same name as a variable");
    assertThat(result.compiledClass.function("F").isStub).isTrue();
  }

  @Test
  public void functionWithoutEntryIsAnError() {
    ScriptClass source = ScriptClass.builder("C").addFunction(new Graph("F")).build();

    CompilationResult<Void> result = compile(source);

    assertThat(result.errors()).hasSize(1);
    assertThat(result.errors().get(0).kind()).isEqualTo(Diagnostic.Kind.STRUCTURAL);
    assertThat(result.errors().get(0).message()).isEqualTo("Could not find a root node for F");
  }

  @Test
  public void extendingAnInterfaceIsAnError() {
    ScriptClass source =
        ScriptClass.builder("C").parent(ClassSignature.iface("Damageable")).build();

    CompilationResult<Void> result = compile(source);

    assertThat(result.errors().get(0).message())
        .isEqualTo("C cannot extend Damageable, which is an interface");
  }

  @Test
  public void delegateSignaturesComeFirstAndHaveNoBody() {
    Graph delegate = TestGraphs.function("OnDone");
    entry(delegate).addOutput("code", PortType.INT);
    FunctionDecl decl =
        new FunctionDecl(
            delegate,
            FunctionSignature.Access.PUBLIC,
            EnumSet.of(FunctionSignature.Flag.DELEGATE),
            ImmutableList.of());
    ScriptClass source =
        ScriptClass.builder("C").addFunction(simpleFunction("F")).addFunction(decl).build();

    CompilationResult<Void> result = compile(source);

    assertThat(result.errors()).isEmpty();
    CompiledFunction first = result.compiledClass.functions.get(0);
    assertThat(first.name).isEqualTo("OnDone");
    assertThat(first.isStub).isTrue();
    assertThat(first.signature.params)
        .containsExactly(FunctionSignature.Param.in("code", PortType.INT));
    assertThat(statements(result, "F")).containsExactly("A()", "end").inOrder();
  }

  @Test
  public void privateFunctionsAreNotOverridable() {
    FunctionDecl hidden =
        new FunctionDecl(
            simpleFunction("Hidden"),
            FunctionSignature.Access.PRIVATE,
            EnumSet.noneOf(FunctionSignature.Flag.class),
            ImmutableList.of());
    ScriptClass source =
        ScriptClass.builder("C").addFunction(simpleFunction("Open")).addFunction(hidden).build();

    CompilationResult<Void> result = compile(source);

    assertThat(result.compiledClass.function("Open").signature.isOverridable()).isTrue();
    assertThat(result.compiledClass.function("Hidden").signature.isOverridable()).isFalse();
  }

  @Test
  public void instrumentationTracesEachNode() {
    CompileOptions options = CompileOptions.builder().instrumentation(true).build();

    CompilationResult<Void> result = compileFunction(simpleFunction("F"), options);

    assertThat(statements(result, "F"))
        .containsExactly("trace F#0", "trace A#1", "A()", "end")
        .inOrder();
  }

  @Test
  public void nodeCommentsNameEachNode() {
    CompileOptions options = CompileOptions.builder().emitNodeComments(true).build();

    CompilationResult<Void> result = compileFunction(simpleFunction("F"), options);

    assertThat(statements(result, "F"))
        .containsExactly("// F#0", "// A#1", "A()", "end")
        .inOrder();
  }

  @Test
  public void unconnectedResultWarns() {
    Graph graph = simpleFunction("F");
    Node result = Nodes.result(graph);

    CompilationResult<Void> compiled = compileFunction(graph, CompileOptions.DEFAULT);

    assertThat(compiled.errors()).isEmpty();
    assertThat(compiled.warnings()).hasSize(1);
    Diagnostic warning = compiled.warnings().get(0);
    assertThat(warning.node()).isSameInstanceAs(result);
    assertThat(warning.message())
        .isEqualTo("Return will never be executed: its exec pin is not connected");
    assertThat(statements(compiled, "F")).containsExactly("A()", "end").inOrder();
  }

  @Test
  public void verboseKeepsListing() {
    CompileOptions options = CompileOptions.builder().verbose(true).build();

    CompilationResult<Void> result = compileFunction(simpleFunction("F"), options);

    assertThat(result.compiledClass.function("F").listing)
        .isEqualTo(String.format("  0: A()%n  1: end%n"));
    CompilationResult<Void> quiet = compileFunction(simpleFunction("F"), CompileOptions.DEFAULT);
    assertThat(quiet.compiledClass.function("F").listing).isNull();
  }

  @Test
  public void cancellationStopsBetweenSteps() {
    AtomicInteger polls = new AtomicInteger();
    CompileOptions options =
        CompileOptions.builder().cancelled(() -> polls.incrementAndGet() > 2).build();
    ScriptClass source = ScriptClass.builder("C").addFunction(simpleFunction("F")).build();
    ClassCompiler compiler = new ClassCompiler(source, HANDLERS, options);

    assertThrows(CancellationException.class, compiler::compile);
    assertThat(compiler.state()).isEqualTo(CompilerState.CLASS_LAYOUT_BUILT);
  }
}
