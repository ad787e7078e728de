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
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import org.jspecify.annotations.Nullable;
import org.wirescript.graph.Graph;

/**
 * A compilation unit as supplied by the authoring layer: a class with member variables, function
 * graphs, and event pages. The compiler never modifies a ScriptClass or any of its graphs.
 */
public final class ScriptClass {

  public final String name;
  public final @Nullable ClassSignature parent;
  public final ImmutableList<ClassSignature> interfaces;
  public final ImmutableList<VariableDecl> variables;
  public final ImmutableList<FunctionDecl> functions;

  /** Event pages; their nodes are consolidated into a single event graph. */
  public final ImmutableList<Graph> eventPages;

  private ScriptClass(Builder builder) {
    this.name = builder.name;
    this.parent = builder.parent;
    this.interfaces = builder.interfaces.build();
    this.variables = builder.variables.build();
    this.functions = builder.functions.build();
    this.eventPages = builder.eventPages.build();
  }

  public static Builder builder(String name) {
    return new Builder(name);
  }

  /** The name of the consolidated event graph of this class. */
  public String eventGraphName() {
    return "ExecuteEventGraph_" + name;
  }

  @Override
  public String toString() {
    return name;
  }

  /** Builds a ScriptClass. */
  public static final class Builder {
    private final String name;
    private @Nullable ClassSignature parent;
    private final ImmutableList.Builder<ClassSignature> interfaces = ImmutableList.builder();
    private final ImmutableList.Builder<VariableDecl> variables = ImmutableList.builder();
    private final ImmutableList.Builder<FunctionDecl> functions = ImmutableList.builder();
    private final ImmutableList.Builder<Graph> eventPages = ImmutableList.builder();

    private Builder(String name) {
      this.name = name;
    }

    @CanIgnoreReturnValue
    public Builder parent(ClassSignature parent) {
      this.parent = parent;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder addInterface(ClassSignature iface) {
      interfaces.add(iface);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder addVariable(VariableDecl variable) {
      variables.add(variable);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder addFunction(FunctionDecl function) {
      functions.add(function);
      return this;
    }

    /** Adds a public function with no flags or locals. */
    @CanIgnoreReturnValue
    public Builder addFunction(Graph graph) {
      return addFunction(FunctionDecl.of(graph));
    }

    @CanIgnoreReturnValue
    public Builder addEventPage(Graph page) {
      eventPages.add(page);
      return this;
    }

    public ScriptClass build() {
      return new ScriptClass(this);
    }
  }
}
