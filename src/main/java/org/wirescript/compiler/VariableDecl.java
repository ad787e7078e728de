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

import org.jspecify.annotations.Nullable;
import org.wirescript.graph.PortType;

/** A declared member or local variable, with an optional default value in literal form. */
public record VariableDecl(String name, PortType type, @Nullable String defaultValue) {

  public static VariableDecl of(String name, PortType type) {
    return new VariableDecl(name, type, null);
  }

  public VariableDecl withName(String newName) {
    return new VariableDecl(newName, type, defaultValue);
  }
}
