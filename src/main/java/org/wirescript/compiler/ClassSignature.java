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
import org.jspecify.annotations.Nullable;

/**
 * The externally visible layout of a class (or interface) that has already been compiled: its
 * functions and member variables, plus those it inherits.
 */
public final class ClassSignature {

  public final String name;
  public final @Nullable ClassSignature parent;
  public final boolean isInterface;
  public final ImmutableList<FunctionSignature> functions;
  public final ImmutableList<VariableDecl> variables;

  public ClassSignature(
      String name,
      @Nullable ClassSignature parent,
      boolean isInterface,
      ImmutableList<FunctionSignature> functions,
      ImmutableList<VariableDecl> variables) {
    this.name = name;
    this.parent = parent;
    this.isInterface = isInterface;
    this.functions = functions;
    this.variables = variables;
  }

  /** Returns a class with the given functions and no member variables. */
  public static ClassSignature of(
      String name, @Nullable ClassSignature parent, FunctionSignature... functions) {
    return new ClassSignature(
        name, parent, false, ImmutableList.copyOf(functions), ImmutableList.of());
  }

  /** Returns an interface with the given functions. */
  public static ClassSignature iface(String name, FunctionSignature... functions) {
    return new ClassSignature(
        name, null, true, ImmutableList.copyOf(functions), ImmutableList.of());
  }

  /** Returns the named function declared by this class or inherited by it, or null. */
  public @Nullable FunctionSignature findFunction(String functionName) {
    for (ClassSignature c = this; c != null; c = c.parent) {
      for (FunctionSignature f : c.functions) {
        if (f.name.equals(functionName)) {
          return f;
        }
      }
    }
    return null;
  }

  /** Returns the named member variable declared by this class or inherited by it, or null. */
  public @Nullable VariableDecl findVariable(String variableName) {
    for (ClassSignature c = this; c != null; c = c.parent) {
      for (VariableDecl v : c.variables) {
        if (v.name().equals(variableName)) {
          return v;
        }
      }
    }
    return null;
  }

  @Override
  public String toString() {
    return name;
  }
}
