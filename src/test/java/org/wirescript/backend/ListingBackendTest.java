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

package org.wirescript.backend;

import static com.google.common.truth.Truth.assertThat;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.wirescript.compiler.ClassCompiler;
import org.wirescript.compiler.ClassSignature;
import org.wirescript.compiler.CompilationResult;
import org.wirescript.compiler.CompileOptions;
import org.wirescript.compiler.ScriptClass;
import org.wirescript.compiler.TestGraphs;
import org.wirescript.compiler.VariableDecl;
import org.wirescript.graph.Graph;
import org.wirescript.graph.Node;
import org.wirescript.graph.PortType;
import org.wirescript.nodes.Nodes;
import org.wirescript.nodes.StandardHandlers;

@RunWith(JUnit4.class)
public class ListingBackendTest {

  private static String listing(ScriptClass source) {
    CompilationResult<String> result =
        new ClassCompiler(source, StandardHandlers.registry(), CompileOptions.DEFAULT)
            .compile(new ListingBackend());
    return result.output;
  }

  /** F(c): if c then Yes() else No(). */
  private static Graph branching() {
    Graph graph = TestGraphs.function("F");
    Node entry = TestGraphs.entry(graph);
    entry.addOutput("c", PortType.BOOLEAN);
    Node branch = TestGraphs.then(entry, Nodes.branch(graph));
    TestGraphs.wire(entry, "c", branch, Nodes.CONDITION);
    TestGraphs.then(branch, TestGraphs.call(graph, "Yes"));
    TestGraphs.then(branch, Nodes.ELSE, TestGraphs.call(graph, "No"));
    return graph;
  }

  @Test
  public void listsClassAndProperties() {
    ScriptClass source =
        ScriptClass.builder("Door")
            .parent(ClassSignature.of("Actor", null))
            .addVariable(new VariableDecl("Open", PortType.BOOLEAN, "false"))
            .addVariable(VariableDecl.of("Key", PortType.NAME))
            .build();

    assertThat(listing(source))
        .isEqualTo("class Door extends Actor\n  boolean Open = false\n  name Key\n");
  }

  @Test
  public void marksForwardJumpTargets() {
    String listing = listing(ScriptClass.builder("C").addFunction(branching()).build());

    assertThat(listing).contains("  params: c@PARAMETER:0\n");
    assertThat(listing)
        .contains("  0: if not c goto 3\n  1: Yes()\n  2: end\n -3: No()\n  4: end\n");
  }
}
