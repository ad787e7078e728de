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
import com.google.common.collect.Sets;
import java.util.Collection;
import java.util.EnumSet;
import java.util.Set;
import org.wirescript.graph.Graph;

/**
 * An authored function: its graph (whose name is the function's name) plus the declarations that
 * are not expressed as nodes.
 */
public final class FunctionDecl {

  public final Graph graph;
  public final FunctionSignature.Access access;
  public final Set<FunctionSignature.Flag> flags;

  /** Local variables declared by the author, in declaration order. */
  public final ImmutableList<VariableDecl> locals;

  public FunctionDecl(
      Graph graph,
      FunctionSignature.Access access,
      Collection<FunctionSignature.Flag> flags,
      Collection<VariableDecl> locals) {
    this.graph = graph;
    this.access = access;
    this.flags = Sets.immutableEnumSet(flags);
    this.locals = ImmutableList.copyOf(locals);
  }

  /** Returns a public function with no flags and no declared locals. */
  public static FunctionDecl of(Graph graph) {
    return new FunctionDecl(
        graph,
        FunctionSignature.Access.PUBLIC,
        EnumSet.noneOf(FunctionSignature.Flag.class),
        ImmutableList.of());
  }

  public String name() {
    return graph.name;
  }

  /** Returns true if this declares only the signature of a delegate. */
  public boolean isDelegateSignature() {
    return flags.contains(FunctionSignature.Flag.DELEGATE);
  }
}
