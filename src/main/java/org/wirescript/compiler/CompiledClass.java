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
import com.google.common.collect.ImmutableMap;
import org.jspecify.annotations.Nullable;
import org.wirescript.graph.PortType;

/**
 * The layout of a compiled class: its properties (declared variables plus the hidden storage of
 * the event graph), its compiled functions, and the values of its default instance.
 */
public final class CompiledClass {

  /** A property of the class; hidden properties were created by the compiler. */
  public record Property(String name, PortType type, boolean hidden) {}

  /** A default value that refers to another property of the default instance (or to None). */
  public record ObjectReference(@Nullable String target) {
    @Override
    public String toString() {
      return target == null ? "None" : "@" + target;
    }
  }

  public final String name;
  public final @Nullable ClassSignature parent;
  public final ImmutableList<Property> properties;
  public final ImmutableList<CompiledFunction> functions;

  /**
   * The parsed default values of the default instance, by property name. Values are Boolean,
   * Long, Double, String or {@link ObjectReference}.
   */
  public final ImmutableMap<String, Object> defaultObject;

  CompiledClass(
      String name,
      @Nullable ClassSignature parent,
      ImmutableList<Property> properties,
      ImmutableList<CompiledFunction> functions,
      ImmutableMap<String, Object> defaultObject) {
    this.name = name;
    this.parent = parent;
    this.properties = properties;
    this.functions = functions;
    this.defaultObject = defaultObject;
  }

  public @Nullable CompiledFunction function(String functionName) {
    for (CompiledFunction f : functions) {
      if (f.name.equals(functionName)) {
        return f;
      }
    }
    return null;
  }

  /**
   * Returns the externally visible signature of this class, which other units can compile
   * against; the event graph and event stubs' internal details are not included.
   */
  public ClassSignature toSignature() {
    return new ClassSignature(
        name,
        parent,
        false,
        functions.stream()
            .filter(f -> f.kind != FunctionContext.Kind.EVENT_GRAPH)
            .map(f -> f.signature)
            .collect(ImmutableList.toImmutableList()),
        properties.stream()
            .filter(p -> !p.hidden())
            .map(p -> VariableDecl.of(p.name(), p.type()))
            .collect(ImmutableList.toImmutableList()));
  }

  @Override
  public String toString() {
    return name;
  }
}
