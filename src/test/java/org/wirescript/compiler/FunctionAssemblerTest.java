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
import static org.wirescript.compiler.TestGraphs.RESULT;
import static org.wirescript.compiler.TestGraphs.call;
import static org.wirescript.compiler.TestGraphs.entry;
import static org.wirescript.compiler.TestGraphs.pure;
import static org.wirescript.compiler.TestGraphs.statements;
import static org.wirescript.compiler.TestGraphs.then;
import static org.wirescript.compiler.TestGraphs.wire;

import com.google.common.collect.ImmutableList;
import java.util.EnumSet;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.wirescript.compiler.FunctionSignature.Param;
import org.wirescript.graph.Graph;
import org.wirescript.graph.Node;
import org.wirescript.graph.PortType;
import org.wirescript.nodes.StandardHandlers;

@RunWith(JUnit4.class)
public class FunctionAssemblerTest {

  private static final FunctionSignature PARENT_F =
      FunctionSignature.of("F", Param.in("a", PortType.INT), Param.in("b", PortType.INT))
          .withFlags(FunctionSignature.Flag.OVERRIDABLE);

  private static final ClassSignature BASE = ClassSignature.of("Base", null, PARENT_F);

  /** Returns a function that passes its parameters, declared in the given order, to Use. */
  private static Graph function(String name, PortType type, String... params) {
    Graph graph = TestGraphs.function(name);
    Node use = then(entry(graph), call(graph, "Use", params));
    for (String param : params) {
      entry(graph).addOutput(param, type);
      use.input(param).setType(type);
      wire(entry(graph), param, use, param);
    }
    return graph;
  }

  private static CompilationResult<Void> compile(ClassSignature parent, FunctionDecl... functions) {
    ScriptClass.Builder builder = ScriptClass.builder("Child").parent(parent);
    for (FunctionDecl f : functions) {
      builder.addFunction(f);
    }
    return new ClassCompiler(builder.build(), StandardHandlers.registry(), CompileOptions.DEFAULT)
        .compile();
  }

  private static ImmutableList<String> paramNames(CompiledFunction function) {
    return function.parameters.stream().map(Term::name).collect(ImmutableList.toImmutableList());
  }

  @Test
  public void overrideTakesParentParameterOrder() {
    CompilationResult<Void> result =
        compile(BASE, FunctionDecl.of(function("F", PortType.INT, "b", "a")));

    assertThat(result.errors()).isEmpty();
    CompiledFunction f = result.compiledClass.function("F");
    assertThat(paramNames(f)).containsExactly("a", "b").inOrder();
    assertThat(f.parameters.get(0).storage()).isEqualTo(Term.Storage.PARAMETER);
    assertThat(f.parameters.get(0).slot()).isEqualTo(0);
    assertThat(f.parameters.get(1).slot()).isEqualTo(1);
    assertThat(f.overrides).isSameInstanceAs(PARENT_F);
    assertThat(f.signature.isOverridable()).isTrue();
    // Statements still refer to the parameters by name
    assertThat(statements(result, "F")).containsExactly("Use(b, a)", "end").inOrder();
  }

  @Test
  public void missingParentParameterFailsOnlyThatFunction() {
    CompilationResult<Void> result =
        compile(
            BASE,
            FunctionDecl.of(function("F", PortType.INT, "a", "c")),
            FunctionDecl.of(function("G", PortType.INT, "x")));

    assertThat(result.errors()).hasSize(1);
    Diagnostic error = result.functionDiagnostics.get("F").get(0);
    assertThat(error.kind()).isEqualTo(Diagnostic.Kind.SIGNATURE_MISMATCH);
    assertThat(error.message()).contains("the parent's parameter b is missing");
    assertThat(result.compiledClass.function("F").isStub).isTrue();
    assertThat(statements(result, "G")).containsExactly("Use(x)", "end").inOrder();
  }

  @Test
  public void extraParameterIsRejected() {
    CompilationResult<Void> result =
        compile(BASE, FunctionDecl.of(function("F", PortType.INT, "a", "b", "c")));

    assertThat(result.errors()).hasSize(1);
    assertThat(result.errors().get(0).message()).contains("[c] not in the parent");
  }

  @Test
  public void parameterTypeMustMatchParent() {
    CompilationResult<Void> result =
        compile(BASE, FunctionDecl.of(function("F", PortType.FLOAT, "a", "b")));

    assertThat(result.errors().get(0).message())
        .isEqualTo(
            "Cannot override F: parameter a is int in the parent's signature but float here");
  }

  @Test
  public void cannotOverrideFinalFunction() {
    ClassSignature base =
        ClassSignature.of(
            "Base",
            null,
            FunctionSignature.of("F", Param.in("a", PortType.INT))
                .withFlags(FunctionSignature.Flag.OVERRIDABLE, FunctionSignature.Flag.FINAL));

    CompilationResult<Void> result =
        compile(base, FunctionDecl.of(function("F", PortType.INT, "a")));

    assertThat(result.errors().get(0).kind()).isEqualTo(Diagnostic.Kind.SIGNATURE_MISMATCH);
    assertThat(result.errors().get(0).message())
        .isEqualTo("Cannot override F: it is not overridable in Base");
  }

  @Test
  public void overrideTakesParentAccess() {
    FunctionDecl decl =
        new FunctionDecl(
            function("F", PortType.INT, "a", "b"),
            FunctionSignature.Access.PRIVATE,
            EnumSet.noneOf(FunctionSignature.Flag.class),
            ImmutableList.of());

    CompilationResult<Void> result = compile(BASE, decl);

    assertThat(result.errors()).isEmpty();
    assertThat(result.warnings()).hasSize(1);
    assertThat(result.compiledClass.function("F").signature.access)
        .isEqualTo(FunctionSignature.Access.PUBLIC);
  }

  @Test
  public void replicationFlagsComeFromParent() {
    ClassSignature base =
        ClassSignature.of(
            "Base",
            null,
            PARENT_F.withFlags(FunctionSignature.Flag.NET, FunctionSignature.Flag.NET_SERVER));
    FunctionDecl matching =
        new FunctionDecl(
            function("F", PortType.INT, "a", "b"),
            FunctionSignature.Access.PUBLIC,
            EnumSet.noneOf(FunctionSignature.Flag.class),
            ImmutableList.of());
    FunctionDecl conflicting =
        new FunctionDecl(
            function("F", PortType.INT, "a", "b"),
            FunctionSignature.Access.PUBLIC,
            EnumSet.of(FunctionSignature.Flag.NET, FunctionSignature.Flag.NET_CLIENT),
            ImmutableList.of());

    CompiledFunction inherited = compile(base, matching).compiledClass.function("F");
    CompilationResult<Void> result = compile(base, conflicting);

    assertThat(inherited.signature.flags)
        .containsAtLeast(FunctionSignature.Flag.NET, FunctionSignature.Flag.NET_SERVER);
    assertThat(result.errors().get(0).kind()).isEqualTo(Diagnostic.Kind.SIGNATURE_MISMATCH);
    assertThat(result.compiledClass.function("F").signature.flags)
        .doesNotContain(FunctionSignature.Flag.NET_CLIENT);
  }

  @Test
  public void localsGetLocalStorage() {
    Graph graph = TestGraphs.function("F");
    Node p = pure(graph, "P", PortType.INT);
    Node c = then(entry(graph), call(graph, "C", "x"));
    wire(p, RESULT, c, "x");

    CompilationResult<Void> result = TestGraphs.compileFunction(graph, CompileOptions.DEFAULT);

    CompiledFunction f = result.compiledClass.function("F");
    assertThat(f.locals).hasSize(1);
    assertThat(f.locals.get(0).name()).isEqualTo("P_ReturnValue");
    assertThat(f.locals.get(0).storage()).isEqualTo(Term.Storage.LOCAL);
    assertThat(f.locals.get(0).slot()).isEqualTo(0);
  }
}
