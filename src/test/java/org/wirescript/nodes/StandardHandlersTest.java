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

import static com.google.common.truth.Truth.assertThat;
import static org.wirescript.compiler.TestGraphs.call;
import static org.wirescript.compiler.TestGraphs.entry;
import static org.wirescript.compiler.TestGraphs.statements;
import static org.wirescript.compiler.TestGraphs.then;
import static org.wirescript.compiler.TestGraphs.wire;

import com.google.common.collect.ImmutableList;
import java.util.EnumSet;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.wirescript.compiler.ClassCompiler;
import org.wirescript.compiler.CompilationResult;
import org.wirescript.compiler.CompileOptions;
import org.wirescript.compiler.Diagnostic;
import org.wirescript.compiler.FunctionDecl;
import org.wirescript.compiler.FunctionSignature;
import org.wirescript.compiler.HandlerRegistry;
import org.wirescript.compiler.ScriptClass;
import org.wirescript.compiler.TestGraphs;
import org.wirescript.compiler.VariableDecl;
import org.wirescript.graph.Graph;
import org.wirescript.graph.Node;
import org.wirescript.graph.NodeKind;
import org.wirescript.graph.PortType;

@RunWith(JUnit4.class)
public class StandardHandlersTest {

  private static CompilationResult<Void> compile(ScriptClass source) {
    return new ClassCompiler(source, StandardHandlers.registry(), CompileOptions.DEFAULT)
        .compile();
  }

  private static ScriptClass withHealth(FunctionDecl function) {
    return ScriptClass.builder("C")
        .addVariable(VariableDecl.of("Health", PortType.INT))
        .addFunction(function)
        .build();
  }

  @Test
  public void everyKindHasAHandler() {
    HandlerRegistry registry = StandardHandlers.registry();

    assertThat(registry.handlers().keySet())
        .containsExactly(
            NodeKind.FUNCTION_ENTRY,
            NodeKind.FUNCTION_RESULT,
            NodeKind.EVENT,
            NodeKind.MACRO_INSTANCE,
            NodeKind.COMPOSITE,
            NodeKind.TUNNEL,
            NodeKind.KNOT,
            NodeKind.COMMENT,
            NodeKind.TUNNEL_BOUNDARY,
            NodeKind.CALL_FUNCTION,
            NodeKind.BRANCH,
            NodeKind.SEQUENCE,
            NodeKind.VARIABLE_GET,
            NodeKind.VARIABLE_SET,
            NodeKind.LITERAL,
            NodeKind.MAKE_ARRAY,
            NodeKind.ENUM_LITERAL,
            NodeKind.ASSIGN_EVENT_PARAMS,
            NodeKind.CALL_EVENT_GRAPH);
    assertThat(registry.find(NodeKind.of("Timeline"))).isNull();
  }

  @Test
  public void setAndGetMemberVariable() {
    Graph graph = TestGraphs.function("F");
    Node set = then(entry(graph), Nodes.variableSet(graph, "Health", PortType.INT));
    wire(Nodes.literal(graph, PortType.INT, "5"), Nodes.VALUE, set, Nodes.VALUE);
    Node use = then(set, call(graph, "Use", "x"));
    wire(Nodes.variableGet(graph, "Health", PortType.INT), Nodes.VALUE, use, "x");

    CompilationResult<Void> result = compile(withHealth(FunctionDecl.of(graph)));

    assertThat(result.errors()).isEmpty();
    assertThat(statements(result, "F"))
        .containsExactly("Health = 5", "Use(Health)", "end")
        .inOrder();
    assertThat(result.compiledClass.function("F").locals).isEmpty();
  }

  @Test
  public void declaredLocalKeepsDefault() {
    Graph graph = TestGraphs.function("F");
    Node set = then(entry(graph), Nodes.variableSet(graph, "count", PortType.INT));
    set.input(Nodes.VALUE).setDefaultValue("2");
    FunctionDecl decl =
        new FunctionDecl(
            graph,
            FunctionSignature.Access.PUBLIC,
            EnumSet.noneOf(FunctionSignature.Flag.class),
            ImmutableList.of(new VariableDecl("count", PortType.INT, "0")));

    CompilationResult<Void> result = compile(withHealth(decl));

    assertThat(statements(result, "F")).containsExactly("count = 2", "end").inOrder();
    assertThat(result.compiledClass.function("F").localDefaults).containsExactly("count", "0");
  }

  @Test
  public void unknownVariableIsAnError() {
    Graph graph = TestGraphs.function("F");
    Node use = then(entry(graph), call(graph, "Use", "x"));
    wire(Nodes.variableGet(graph, "Missing", PortType.INT), Nodes.VALUE, use, "x");

    CompilationResult<Void> result = compile(withHealth(FunctionDecl.of(graph)));

    assertThat(result.errors()).hasSize(1);
    assertThat(result.errors().get(0).kind()).isEqualTo(Diagnostic.Kind.STRUCTURAL);
    assertThat(result.errors().get(0).message()).isEqualTo("Unknown variable Missing");
  }

  @Test
  public void makeArrayCollectsInputs() {
    Graph graph = TestGraphs.function("F");
    Node array = Nodes.makeArray(graph, PortType.INT, 2);
    wire(Nodes.literal(graph, PortType.INT, "1"), Nodes.VALUE, array, "[0]");
    array.input("[1]").setDefaultValue("7");
    Node use = then(entry(graph), call(graph, "Use"));
    use.addInput("values", PortType.INT.arrayOf());
    wire(array, Nodes.ARRAY, use, "values");

    CompilationResult<Void> result = compile(withHealth(FunctionDecl.of(graph)));

    assertThat(statements(result, "F"))
        .containsExactly("Make_Array_array = [1, 7]", "Use(Make_Array_array)", "end")
        .inOrder();
  }

  @Test
  public void callWithSeveralOutputsPassesThemAsArguments() {
    Graph graph = TestGraphs.function("F");
    Node split = then(entry(graph), call(graph, "Split", "value"));
    split.addOutput("low", PortType.INT);
    split.addOutput("high", PortType.INT);
    split.input("value").setDefaultValue("300");

    CompilationResult<Void> result = compile(withHealth(FunctionDecl.of(graph)));

    assertThat(statements(result, "F"))
        .containsExactly("Split(300, Split_low, Split_high)", "end")
        .inOrder();
  }

  @Test
  public void unconnectedInputWithoutDefault() {
    Graph graph = TestGraphs.function("F");
    then(entry(graph), call(graph, "Use", "x"));

    CompilationResult<Void> result = compile(withHealth(FunctionDecl.of(graph)));

    assertThat(statements(result, "F")).containsExactly("Use(default)", "end").inOrder();
  }

  @Test
  public void eventOutsideEventGraphIsAnError() {
    Graph graph = TestGraphs.function("F");
    then(Nodes.event(graph, "Tick"), call(graph, "Use"));

    CompilationResult<Void> result = compile(withHealth(FunctionDecl.of(graph)));

    assertThat(result.functionDiagnostics.get("F").get(0).message())
        .isEqualTo("Event Tick is only allowed in an event graph");
  }
}
